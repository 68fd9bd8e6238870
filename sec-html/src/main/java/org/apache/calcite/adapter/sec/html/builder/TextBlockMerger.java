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

import org.apache.calcite.adapter.sec.html.node.Node;
import org.apache.calcite.adapter.sec.html.node.TextBlockNode;
import org.apache.calcite.adapter.sec.html.style.StyleInfo;
import org.apache.calcite.adapter.sec.html.style.StyleUnit;
import org.apache.calcite.adapter.sec.html.style.UnitType;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Merges runs of adjacent compatible text blocks into one block.
 *
 * <p>Two blocks are compatible when neither carries annotations and both have
 * the same text alignment. The merged text separates the parts with a blank
 * line. Margins come from the outer edges, font size and weight from the
 * later block when it declares them, and the wider of the two widths wins.
 */
public final class TextBlockMerger {

  private TextBlockMerger() {
  }

  /** Returns the nodes with adjacent compatible text blocks merged. */
  public static List<Node> merge(List<Node> nodes) {
    List<Node> merged = new ArrayList<>(nodes.size());
    for (Node node : nodes) {
      TextBlockNode last = merged.isEmpty()
          ? null : TextBlockNode.from(merged.get(merged.size() - 1));
      TextBlockNode block = TextBlockNode.from(node);
      if (last != null && block != null && canMerge(last, block)) {
        merged.set(merged.size() - 1, merge(last, block));
      } else {
        merged.add(node);
      }
    }
    return merged;
  }

  static boolean canMerge(TextBlockNode first, TextBlockNode second) {
    return !first.hasAnnotations() && !second.hasAnnotations()
        && Objects.equals(first.getStyle().getTextAlign(), second.getStyle().getTextAlign());
  }

  static TextBlockNode merge(TextBlockNode first, TextBlockNode second) {
    return new TextBlockNode(first.getText() + "\n\n" + second.getText(),
        mergeStyles(first.getStyle(), second.getStyle()), ImmutableMap.of());
  }

  static StyleInfo mergeStyles(StyleInfo first, StyleInfo second) {
    return first.toBuilder()
        .marginBottom(second.getMarginBottom())
        .fontSize(second.getFontSize() != null ? second.getFontSize() : first.getFontSize())
        .fontWeight(second.getFontWeight() != null
            ? second.getFontWeight() : first.getFontWeight())
        .width(reconcileWidths(first.getWidth(), second.getWidth()))
        .build();
  }

  /**
   * Picks the width of a merged block: the larger one. Percentages are only
   * compared with percentages; against an absolute width the first is kept.
   */
  static @Nullable StyleUnit reconcileWidths(@Nullable StyleUnit first,
      @Nullable StyleUnit second) {
    if (first == null) {
      return second;
    }
    if (second == null) {
      return first;
    }
    if (first.getUnit() == UnitType.PERCENT || second.getUnit() == UnitType.PERCENT) {
      if (first.getUnit() == second.getUnit()) {
        return first.getValue() >= second.getValue() ? first : second;
      }
      return first;
    }
    return first.toInches() >= second.toInches() ? first : second;
  }
}
