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
import org.apache.calcite.adapter.sec.html.node.PageBreakNode;
import org.apache.calcite.adapter.sec.html.node.PageBreakSource;
import org.apache.calcite.adapter.sec.html.node.TextBlockNode;
import org.apache.calcite.adapter.sec.html.style.StyleInfo;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link PageNumbering}.
 */
@Tag("unit")
class PageNumberingTest {

  private static TextBlockNode text(String text) {
    return new TextBlockNode(text, StyleInfo.EMPTY, ImmutableMap.<String, String>of());
  }

  private static PageBreakNode pageBreak(PageBreakSource source) {
    return new PageBreakNode(0, source);
  }

  private static String describe(List<Node> nodes) {
    StringBuilder sb = new StringBuilder();
    for (Node node : nodes) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append(node instanceof TextBlockNode ? ((TextBlockNode) node).getText()
          : node.toString());
    }
    return sb.toString();
  }

  @Test
  void testDocumentStartIsInsertedBeforeLeadingContent() {
    TextBlockNode intro = text("intro");
    TextBlockNode page2 = text("page2");
    List<Node> numbered = PageNumbering.number(ImmutableList.<Node>of(
        intro, pageBreak(PageBreakSource.HORIZONTAL_RULE), page2));
    assertEquals(
        "PageBreak(0, DOCUMENT_START), intro, PageBreak(1, HORIZONTAL_RULE), page2",
        describe(numbered));
    assertSame(intro, numbered.get(1));
  }

  @Test
  void testLeadingBreakBecomesPageZero() {
    List<Node> numbered = PageNumbering.number(ImmutableList.<Node>of(
        pageBreak(PageBreakSource.PAGE_DIV), text("a"),
        pageBreak(PageBreakSource.PAGE_DIV), text("b")));
    assertEquals("PageBreak(0, PAGE_DIV), a, PageBreak(1, PAGE_DIV), b",
        describe(numbered));
  }

  @Test
  void testAdjacentBreaksCollapse() {
    List<Node> numbered = PageNumbering.number(ImmutableList.<Node>of(
        text("a"), pageBreak(PageBreakSource.EXPLICIT_STYLE),
        pageBreak(PageBreakSource.HORIZONTAL_RULE), text("b")));
    assertEquals(
        "PageBreak(0, DOCUMENT_START), a, PageBreak(1, EXPLICIT_STYLE), b",
        describe(numbered));
  }

  @Test
  void testTrailingBreakIsDropped() {
    List<Node> numbered = PageNumbering.number(ImmutableList.<Node>of(
        text("a"), pageBreak(PageBreakSource.CLASS_NAME)));
    assertEquals("PageBreak(0, DOCUMENT_START), a", describe(numbered));
  }

  @Test
  void testContentWithoutBreaksIsOnePage() {
    List<Node> numbered = PageNumbering.number(ImmutableList.<Node>of(text("only")));
    assertEquals("PageBreak(0, DOCUMENT_START), only", describe(numbered));
  }

  @Test
  void testEmptyInputStaysEmpty() {
    assertTrue(PageNumbering.number(ImmutableList.<Node>of()).isEmpty());
    assertTrue(PageNumbering.number(
        ImmutableList.<Node>of(pageBreak(PageBreakSource.CLASS_NAME))).isEmpty());
  }
}
