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

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * The cascade of effective styles along the path from the root to the element
 * being visited. Every {@link #push} must be paired with a {@link #pop} in a
 * {@code finally} block.
 */
final class StyleStack {
  private final Deque<StyleInfo> stack = new ArrayDeque<>();

  /** Returns the effective style at the current position. */
  StyleInfo current() {
    StyleInfo top = stack.peek();
    return top == null ? StyleInfo.EMPTY : top;
  }

  /** Resolves an element's style over the current one and makes it current. */
  StyleInfo push(HtmlNode element) {
    StyleInfo style = StyleResolver.resolve(element, stack.peek());
    stack.push(style);
    return style;
  }

  void pop() {
    stack.pop();
  }

  int depth() {
    return stack.size();
  }
}
