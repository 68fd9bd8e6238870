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

import org.apache.calcite.adapter.sec.html.node.HeadingNode;
import org.apache.calcite.adapter.sec.html.node.Node;
import org.apache.calcite.adapter.sec.html.node.TextBlockNode;
import org.apache.calcite.adapter.sec.html.style.StyleInfo;
import org.apache.calcite.adapter.sec.html.style.StyleParser;
import org.apache.calcite.adapter.sec.html.style.StyleUnit;
import org.apache.calcite.adapter.sec.html.style.UnitType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link TextBlockMerger}.
 */
@Tag("unit")
class TextBlockMergerTest {

  private static final ImmutableMap<String, String> NONE = ImmutableMap.of();

  private static TextBlockNode block(String text, String style) {
    return new TextBlockNode(text, StyleParser.parse(style), NONE);
  }

  @Test
  void testAdjacentBlocksMergeWithBlankLine() {
    List<Node> merged = TextBlockMerger.merge(ImmutableList.<Node>of(
        block("First.", "margin-top:6pt"), block("Second.", "margin-bottom:3pt"),
        block("Third.", "")));
    assertEquals(1, merged.size());
    TextBlockNode block = (TextBlockNode) merged.get(0);
    assertEquals("First.\n\nSecond.\n\nThird.", block.getText());
    assertEquals(StyleUnit.points(6), block.getStyle().getMarginTop());
    assertNull(block.getStyle().getMarginBottom());
  }

  @Test
  void testMergeIsAssociative() {
    TextBlockNode a = block("a", "");
    TextBlockNode b = block("b", "");
    TextBlockNode c = block("c", "");
    TextBlockNode left = TextBlockMerger.merge(TextBlockMerger.merge(a, b), c);
    TextBlockNode right = TextBlockMerger.merge(a, TextBlockMerger.merge(b, c));
    assertEquals(left.getText(), right.getText());
    assertEquals(left.getStyle(), right.getStyle());
  }

  @Test
  void testAnnotationsBlockMerging() {
    TextBlockNode tagged = new TextBlockNode("10-K", StyleInfo.EMPTY,
        ImmutableMap.of("annotation_name", "dei:DocumentType"));
    List<Node> nodes = ImmutableList.<Node>of(block("Before.", ""), tagged,
        block("After.", ""));
    List<Node> merged = TextBlockMerger.merge(nodes);
    assertEquals(3, merged.size());
    assertSame(tagged, merged.get(1));
  }

  @Test
  void testDifferentAlignmentPreventsMerging() {
    List<Node> merged = TextBlockMerger.merge(ImmutableList.<Node>of(
        block("Centered", "text-align:center"), block("Left", "text-align:left")));
    assertEquals(2, merged.size());
  }

  @Test
  void testHeadingsSeparateBlocks() {
    List<Node> merged = TextBlockMerger.merge(ImmutableList.<Node>of(
        block("a", ""), new HeadingNode("Overview", StyleInfo.EMPTY, 4, NONE),
        block("b", "")));
    assertEquals(3, merged.size());
  }

  @Test
  void testLaterFontOverridesEarlier() {
    StyleInfo merged = TextBlockMerger.mergeStyles(
        StyleParser.parse("font-size:10pt;font-weight:bold"),
        StyleParser.parse("font-size:8pt"));
    assertEquals(StyleUnit.points(8), merged.getFontSize());
    assertTrue(merged.isBold());
  }

  @Test
  void testWiderWidthWins() {
    StyleUnit narrow = new StyleUnit(1, UnitType.INCH);
    StyleUnit wide = new StyleUnit(6.5, UnitType.INCH);
    assertSame(wide, TextBlockMerger.reconcileWidths(narrow, wide));
    assertSame(wide, TextBlockMerger.reconcileWidths(wide, narrow));
    assertSame(narrow, TextBlockMerger.reconcileWidths(narrow, null));
    StyleUnit percent = new StyleUnit(100, UnitType.PERCENT);
    assertSame(narrow, TextBlockMerger.reconcileWidths(narrow, percent));
    assertSame(percent,
        TextBlockMerger.reconcileWidths(new StyleUnit(50, UnitType.PERCENT), percent));
  }
}
