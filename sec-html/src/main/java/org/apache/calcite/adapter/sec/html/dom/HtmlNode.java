/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.sec.html.dom;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Read-only view of a node in an HTML parse tree.
 *
 * <p>The structural inference code only ever talks to this interface, so any
 * parse-tree library can be plugged in by providing an implementation. A node is
 * either an element (with a tag name, attributes and children) or a text node
 * (with text and no children). Comments and script data are not exposed.
 *
 * <p>Implementations must define {@link #equals(Object)} and {@link #hashCode()}
 * by identity of the underlying node, because analysis results are keyed by node.
 *
 * @see JsoupHtmlNode
 */
public interface HtmlNode {

  /** Tag name reported for text nodes. */
  String TEXT_TAG = "#text";

  /** Returns whether this node is an element, as opposed to a text node. */
  boolean isElement();

  /**
   * Returns the lower-cased tag name including any namespace prefix, such as
   * {@code p} or {@code ix:nonnumeric}; {@link #TEXT_TAG} for text nodes.
   */
  String tagName();

  /**
   * Returns an attribute value, matching the name case-insensitively.
   *
   * @return the value, or null if the attribute is absent
   */
  @Nullable String attr(String name);

  /** Returns the element and text children in document order. */
  List<HtmlNode> children();

  /** Returns the parent element, or null for the root. */
  @Nullable HtmlNode parent();

  /**
   * Returns the raw text: the node's own text for a text node, or the
   * concatenated text of all descendant text nodes for an element. Whitespace is
   * not normalized.
   */
  String text();
}
