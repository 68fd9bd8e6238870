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

import org.apache.calcite.adapter.sec.html.ParserConfig;
import org.apache.calcite.adapter.sec.html.dom.JsoupHtmlNode;
import org.apache.calcite.adapter.sec.html.node.Document;
import org.apache.calcite.adapter.sec.html.node.HeadingNode;
import org.apache.calcite.adapter.sec.html.node.Node;
import org.apache.calcite.adapter.sec.html.node.NodeType;
import org.apache.calcite.adapter.sec.html.node.PageBreakNode;
import org.apache.calcite.adapter.sec.html.node.PageBreakSource;
import org.apache.calcite.adapter.sec.html.node.TableNode;
import org.apache.calcite.adapter.sec.html.node.TextBlockNode;

import org.jsoup.Jsoup;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DocumentBuilder}.
 */
@Tag("unit")
class DocumentBuilderTest {

  private static Document build(ParserConfig config, String bodyHtml) {
    return new DocumentBuilder(config)
        .build(JsoupHtmlNode.of(Jsoup.parse("<html><body>" + bodyHtml + "</body></html>").body()));
  }

  private static Document build(String bodyHtml) {
    return build(ParserConfig.defaults(), bodyHtml);
  }

  private static ParserConfig withPageBreaks() {
    return ParserConfig.builder().includePageBreaks(true).build();
  }

  private static String text(Node node) {
    if (node instanceof HeadingNode) {
      return ((HeadingNode) node).getText();
    }
    return ((TextBlockNode) node).getText();
  }

  @Test
  void testFilingOutline() {
    Document document = build(
        "<div style=\"text-align:center\">"
            + "<span style=\"font-weight:bold;font-size:14pt\">PART I</span></div>\n"
            + "<div><span style=\"font-weight:bold\">ITEM 1.</span>"
            + "<span style=\"font-weight:bold\">Business</span></div>\n"
            + "<p style=\"margin-top:6pt\">We design and sell widgets.</p>\n"
            + "<p>Our customers are located worldwide.</p>\n"
            + "<p><b>Competition</b></p>\n"
            + "<p>The market is competitive.</p>\n"
            + "<table><tr><td>Revenue</td><td>$</td><td>1,000</td></tr></table>");

    List<Node> nodes = document.nodes();
    assertEquals(6, nodes.size(), nodes.toString());

    List<HeadingNode> headings = document.headings();
    assertEquals(3, headings.size());
    assertEquals("PART I", headings.get(0).getText());
    assertEquals(1, headings.get(0).getLevel());
    assertEquals("ITEM 1. Business", headings.get(1).getText());
    assertEquals(2, headings.get(1).getLevel());
    assertEquals("Competition", headings.get(2).getText());
    assertEquals(4, headings.get(2).getLevel());

    assertEquals("We design and sell widgets.\n\nOur customers are located worldwide.",
        text(nodes.get(2)));
    assertEquals("The market is competitive.", text(nodes.get(4)));

    TableNode table = document.tables().get(0);
    assertEquals(1, table.getRows().size());
    assertEquals(3, table.getRows().get(0).width());
    assertTrue(document.nodesOfType(NodeType.PAGE_BREAK).isEmpty());
  }

  @Test
  void testExplicitHeadingTags() {
    Document document = build("<h2>Risk  Factors</h2><h5>Minor</h5><h1> </h1>");
    assertEquals(2, document.size());
    assertEquals(2, document.headings().get(0).getLevel());
    assertEquals("Risk Factors", document.headings().get(0).getText());
    assertEquals(4, document.headings().get(1).getLevel());
  }

  @Test
  void testInlineHeadingAtLineStart() {
    Document document = build(
        "<p><b>Seasonality</b><br>Sales peak in the fourth quarter.</p>");
    assertEquals(2, document.size());
    HeadingNode heading = assertInstanceOf(HeadingNode.class, document.nodes().get(0));
    assertEquals("Seasonality", heading.getText());
    assertEquals(4, heading.getLevel());
    assertEquals("Sales peak in the fourth quarter.", text(document.nodes().get(1)));
  }

  @Test
  void testHeadingSplitAcrossParagraphs() {
    Document document = build("<div style=\"font-weight:bold;text-align:center\">"
        + "<p>ITEM 7.</p><p>MANAGEMENT'S DISCUSSION AND ANALYSIS</p></div>"
        + "<p>Revenue grew.</p>");
    assertEquals(2, document.size(), document.nodes().toString());
    assertEquals(1, document.headings().size());
    HeadingNode heading = document.headings().get(0);
    assertEquals("ITEM 7. MANAGEMENT'S DISCUSSION AND ANALYSIS", heading.getText());
    assertEquals(2, heading.getLevel());
    assertEquals("Revenue grew.", text(document.nodes().get(1)));
  }

  @Test
  void testBlockWithTableIsNotOneHeading() {
    Document document = build("<div style=\"font-weight:bold\">"
        + "<p>ITEM 8.</p><table><tr><td>Cash</td><td>10</td></tr></table></div>");
    assertEquals(1, document.tables().size());
    assertEquals(1, document.headings().size());
    assertEquals("ITEM 8.", document.headings().get(0).getText());
  }

  @Test
  void testLongBlockIsClassifiedPerParagraph() {
    Document document = build("<div style=\"font-weight:bold\">"
        + "<p>ITEM 1A. RISK FACTORS</p>"
        + "<p>Our business is subject to numerous risks and uncertainties, including"
        + " those described below, any of which could harm our results.</p></div>");
    assertEquals("ITEM 1A. RISK FACTORS", document.headings().get(0).getText());
    assertEquals(2, document.headings().get(0).getLevel());
  }

  @Test
  void testBoldWordInsideSentenceStaysText() {
    Document document = build("<p>Sales of <b>widgets</b> grew.</p>");
    assertEquals(1, document.size());
    assertEquals("Sales of widgets grew.", text(document.nodes().get(0)));
  }

  @Test
  void testHiddenAndSkippedContent() {
    Document document = build("<div style=\"display:none\">secret</div>"
        + "<ix:header><ix:hidden>hidden fact</ix:hidden></ix:header>"
        + "<script>var a = 1;</script>"
        + "<p>Visible <span style=\"display:none\">not this</span>text</p>");
    assertEquals(1, document.size());
    assertEquals("Visible text", text(document.nodes().get(0)));
  }

  @Test
  void testAnnotationsAreAttachedAndBlockMerging() {
    Document document = build("<p><ix:nonNumeric name=\"dei:DocumentType\""
        + " contextRef=\"c1\" id=\"f1\">10-K</ix:nonNumeric></p>"
        + "<p>Plain text.</p>");
    assertEquals(2, document.size());
    Node tagged = document.nodes().get(0);
    assertEquals("10-K", text(tagged));
    assertEquals("dei:DocumentType", tagged.getAnnotations().get("annotation_name"));
    assertEquals("c1", tagged.getAnnotations().get("annotation_context_ref"));
    assertFalse(document.nodes().get(1).hasAnnotations());
  }

  @Test
  void testContinuationCarriesOriginAnnotations() {
    Document document = build("<div>"
        + "<ix:nonNumeric name=\"us-gaap:PolicyTextBlock\" id=\"n1\" continuedAt=\"c1\">"
        + "<p>First part.</p></ix:nonNumeric>"
        + "<p>Untagged.</p>"
        + "<ix:continuation id=\"c1\"><p>Second part.</p></ix:continuation>"
        + "</div>");
    List<Node> nodes = document.nodes();
    assertEquals(3, nodes.size(), nodes.toString());
    assertEquals("us-gaap:PolicyTextBlock", nodes.get(0).getAnnotations().get("annotation_name"));
    assertFalse(nodes.get(1).hasAnnotations());
    assertEquals("Second part.", text(nodes.get(2)));
    assertEquals("us-gaap:PolicyTextBlock", nodes.get(2).getAnnotations().get("annotation_name"));
    assertEquals("n1", nodes.get(2).getAnnotations().get("annotation_id"));
  }

  @Test
  void testTableInsideAnnotation() {
    Document document = build("<ix:nonNumeric name=\"us-gaap:ScheduleTextBlock\" id=\"t1\">"
        + "<table><tr><td>Cash</td><td>10</td></tr></table></ix:nonNumeric>");
    assertEquals(1, document.tables().size());
    assertEquals("us-gaap:ScheduleTextBlock",
        document.tables().get(0).getAnnotations().get("annotation_name"));
  }

  @Test
  void testPageBreaksAreNumbered() {
    Document document = build(withPageBreaks(), "<p>Cover page.</p>"
        + "<hr style=\"height:3px\">"
        + "<p>Page two text.</p>"
        + "<div style=\"page-break-before:always\"><p>Page three text.</p></div>");
    List<Node> nodes = document.nodes();
    assertEquals(6, nodes.size(), nodes.toString());
    PageBreakNode start = assertInstanceOf(PageBreakNode.class, nodes.get(0));
    assertEquals(PageBreakSource.DOCUMENT_START, start.getSource());
    PageBreakNode second = assertInstanceOf(PageBreakNode.class, nodes.get(2));
    assertEquals(1, second.getPageNumber());
    assertEquals(PageBreakSource.HORIZONTAL_RULE, second.getSource());
    PageBreakNode third = assertInstanceOf(PageBreakNode.class, nodes.get(4));
    assertEquals(2, third.getPageNumber());
    assertEquals(PageBreakSource.EXPLICIT_STYLE, third.getSource());
    assertEquals(3, document.pages().size());
    assertEquals("Page three text.", text(document.pages().get(2).getNodes().get(0)));
  }

  @Test
  void testBreakAfterElement() {
    Document document = build(withPageBreaks(),
        "<p style=\"page-break-after:always\">End of page one.</p><p>Page two.</p>");
    List<Node> nodes = document.nodes();
    assertEquals(4, nodes.size(), nodes.toString());
    assertEquals("End of page one.", text(nodes.get(1)));
    assertInstanceOf(PageBreakNode.class, nodes.get(2));
    assertEquals("Page two.", text(nodes.get(3)));
  }

  @Test
  void testPageBreaksDisabled() {
    Document document = build("<p>Cover page.</p><hr style=\"height:3px\">"
        + "<p class=\"pagebreak\">Page two text.</p>");
    assertTrue(document.nodesOfType(NodeType.PAGE_BREAK).isEmpty());
    assertEquals(1, document.size());
    assertEquals("Cover page.\n\nPage two text.", text(document.nodes().get(0)));
  }

  @Test
  void testDeepNestingIsFlattened() {
    ParserConfig config = ParserConfig.builder().maxNestingDepth(3).build();
    Document document = build(config,
        "<div><div><div><div><p>Deep <b>text</b></p><p>more</p></div></div></div></div>");
    assertEquals(1, document.size());
    assertEquals("Deep text\nmore", text(document.nodes().get(0)));
  }

  @Test
  void testEmptyBody() {
    assertTrue(build("").isEmpty());
    assertTrue(build(withPageBreaks(), "<div> </div>").isEmpty());
  }
}
