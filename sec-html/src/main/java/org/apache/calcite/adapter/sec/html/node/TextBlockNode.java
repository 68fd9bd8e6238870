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
package org.apache.calcite.adapter.sec.html.node;

import org.apache.calcite.adapter.sec.html.style.StyleInfo;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;
import java.util.Objects;

/**
 * A block of prose. The text is cleaned and may contain line breaks.
 */
public final class TextBlockNode extends Node {
  private static final NodeVisitor<@Nullable TextBlockNode> AS_TEXT_BLOCK =
      new NodeVisitor<@Nullable TextBlockNode>() {
        @Override public @Nullable TextBlockNode visitHeading(HeadingNode heading) {
          return null;
        }

        @Override public @Nullable TextBlockNode visitTextBlock(TextBlockNode textBlock) {
          return textBlock;
        }

        @Override public @Nullable TextBlockNode visitTable(TableNode table) {
          return null;
        }

        @Override public @Nullable TextBlockNode visitPageBreak(PageBreakNode pageBreak) {
          return null;
        }
      };

  private final String text;
  private final StyleInfo style;

  public TextBlockNode(String text, StyleInfo style, Map<String, String> annotations) {
    super(annotations);
    this.text = Objects.requireNonNull(text, "text");
    this.style = Objects.requireNonNull(style, "style");
  }

  @Override public NodeType getType() {
    return NodeType.TEXT_BLOCK;
  }

  @Override public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitTextBlock(this);
  }

  /** Returns the node as a text block, or null if it is another kind. */
  public static @Nullable TextBlockNode from(Node node) {
    return node.accept(AS_TEXT_BLOCK);
  }

  public String getText() {
    return text;
  }

  public StyleInfo getStyle() {
    return style;
  }

  @Override public String toString() {
    return "TextBlock(" + text + ")";
  }
}
