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
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link HtmlNode} backed by a jsoup node.
 *
 * <p>Wrappers are cheap and created on demand; two wrappers are equal when they
 * wrap the same jsoup node.
 */
public final class JsoupHtmlNode implements HtmlNode {

  private final Node node;

  private JsoupHtmlNode(Node node) {
    this.node = Objects.requireNonNull(node, "node");
  }

  /**
   * Wraps a jsoup element or text node.
   *
   * @throws IllegalArgumentException if the node is neither
   */
  public static JsoupHtmlNode of(Node node) {
    if (!(node instanceof Element) && !(node instanceof TextNode)) {
      throw new IllegalArgumentException("Unsupported jsoup node: " + node.nodeName());
    }
    return new JsoupHtmlNode(node);
  }

  /**
   * Parses HTML with jsoup's lenient HTML parser and wraps the resulting document
   * root element.
   */
  public static JsoupHtmlNode parse(String html) {
    Document doc = Jsoup.parse(html);
    return new JsoupHtmlNode(doc.child(0));
  }

  @Override public boolean isElement() {
    return node instanceof Element;
  }

  @Override public String tagName() {
    if (node instanceof Element) {
      return ((Element) node).tagName().toLowerCase(Locale.ROOT);
    }
    return TEXT_TAG;
  }

  @Override public @Nullable String attr(String name) {
    if (!(node instanceof Element) || !node.hasAttr(name)) {
      return null;
    }
    return node.attr(name);
  }

  @Override public List<HtmlNode> children() {
    if (!(node instanceof Element) || node.childNodeSize() == 0) {
      return Collections.emptyList();
    }
    List<HtmlNode> children = new ArrayList<>(node.childNodeSize());
    for (Node child : node.childNodes()) {
      if (child instanceof Element || child instanceof TextNode) {
        children.add(new JsoupHtmlNode(child));
      }
    }
    return children;
  }

  @Override public @Nullable HtmlNode parent() {
    Node parent = node.parentNode();
    if (parent instanceof Element && !(parent instanceof Document)) {
      return new JsoupHtmlNode(parent);
    }
    return null;
  }

  @Override public String text() {
    if (node instanceof TextNode) {
      return ((TextNode) node).getWholeText();
    }
    return ((Element) node).wholeText();
  }

  @Override public boolean equals(Object o) {
    return o instanceof JsoupHtmlNode && ((JsoupHtmlNode) o).node == node;
  }

  @Override public int hashCode() {
    return System.identityHashCode(node);
  }

  @Override public String toString() {
    return isElement() ? "<" + tagName() + ">" : "#text";
  }
}
