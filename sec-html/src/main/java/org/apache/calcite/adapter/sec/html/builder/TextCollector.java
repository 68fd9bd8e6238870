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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Collects the visible text of a subtree without recursion, so arbitrarily
 * deep trees are safe.
 *
 * <p>{@code <br>} and block boundaries become line breaks. Skipped and hidden
 * elements contribute nothing; tables can optionally be left out, keeping
 * only their block boundary.
 */
final class TextCollector {

  // Sentinel pushed after a block's children to close it with a newline
  private static final Object BLOCK_END = new Object();

  private TextCollector() {
  }

  static String collect(HtmlNode root, boolean includeTables) {
    String text = collect(root, includeTables, Integer.MAX_VALUE);
    return text == null ? "" : text;
  }

  /**
   * Collects the text of a subtree, tables excluded, giving up once more than
   * {@code maxVisible} non-whitespace characters have been seen.
   *
   * @return the text, or null if the subtree holds more visible text
   */
  static @Nullable String collectAtMost(HtmlNode root, int maxVisible) {
    return collect(root, false, maxVisible);
  }

  private static @Nullable String collect(HtmlNode root, boolean includeTables,
      int maxVisible) {
    StringBuilder sb = new StringBuilder();
    int visible = 0;
    Deque<Object> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      Object item = stack.pop();
      if (item == BLOCK_END) {
        newline(sb);
        continue;
      }
      HtmlNode node = (HtmlNode) item;
      if (!node.isElement()) {
        String text = node.text();
        visible += visibleLength(text);
        if (visible > maxVisible) {
          return null;
        }
        sb.append(text);
        continue;
      }
      if (ElementKinds.isSkipped(node) || ElementKinds.isHidden(node)) {
        continue;
      }
      if (!includeTables && ElementKinds.isTable(node) && node != root) {
        newline(sb);
        continue;
      }
      if (ElementKinds.isLineBreak(node)) {
        sb.append('\n');
        continue;
      }
      boolean block = node != root && ElementKinds.isBlock(node);
      if (block) {
        newline(sb);
        stack.push(BLOCK_END);
      }
      List<HtmlNode> children = node.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
    return sb.toString();
  }

  private static int visibleLength(String text) {
    int count = 0;
    for (int i = 0; i < text.length(); i++) {
      if (!Character.isWhitespace(text.charAt(i))) {
        count++;
      }
    }
    return count;
  }

  private static void newline(StringBuilder sb) {
    if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '\n') {
      sb.append('\n');
    }
  }
}
