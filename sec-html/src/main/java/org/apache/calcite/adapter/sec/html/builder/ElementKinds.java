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
package org.apache.calcite.adapter.sec.html.builder;

import org.apache.calcite.adapter.sec.html.dom.HtmlNode;
import org.apache.calcite.adapter.sec.html.style.StyleInfo;
import org.apache.calcite.adapter.sec.html.style.StyleResolver;

import com.google.common.collect.ImmutableSet;

import java.util.Set;

/**
 * Classifies elements by how the tree walk treats them.
 */
final class ElementKinds {

  /** Elements whose content is never part of the document text. */
  static final Set<String> SKIPPED = ImmutableSet.of(
      "head", "title", "script", "style", "noscript", "meta", "link", "template",
      "ix:header");

  /** Elements that start a new block of content. */
  static final Set<String> BLOCK = ImmutableSet.of(
      "address", "article", "aside", "blockquote", "body", "center", "dd", "div", "dl",
      "dt", "fieldset", "figure", "footer", "form", "h1", "h2", "h3", "h4", "h5", "h6",
      "header", "hr", "li", "main", "nav", "ol", "p", "pre", "section", "table", "ul");

  private ElementKinds() {
  }

  /** Returns whether the element and its subtree produce no content. */
  static boolean isSkipped(HtmlNode node) {
    return node.isElement() && SKIPPED.contains(node.tagName());
  }

  static boolean isLineBreak(HtmlNode node) {
    return node.isElement() && "br".equals(node.tagName());
  }

  static boolean isTable(HtmlNode node) {
    return node.isElement() && "table".equals(node.tagName());
  }

  /**
   * Returns whether an element is laid out as a block. An explicit
   * {@code display} wins over the tag's default.
   */
  static boolean isBlock(HtmlNode node) {
    if (!node.isElement()) {
      return false;
    }
    String display = StyleResolver.ownStyle(node).getDisplay();
    if (display != null && !"none".equals(display)) {
      return !display.startsWith("inline");
    }
    return BLOCK.contains(node.tagName());
  }

  /** Returns whether an element declares itself hidden. */
  static boolean isHidden(HtmlNode node) {
    if (!node.isElement()) {
      return false;
    }
    StyleInfo own = StyleResolver.ownStyle(node);
    return own.isHidden();
  }
}
