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
package org.apache.calcite.adapter.sec.html;

import org.apache.calcite.adapter.sec.html.dom.JsoupHtmlNode;
import org.apache.calcite.adapter.sec.html.node.Alignment;
import org.apache.calcite.adapter.sec.html.node.Document;
import org.apache.calcite.adapter.sec.html.node.PageBreakSource;
import org.apache.calcite.adapter.sec.html.node.TableNode;
import org.apache.calcite.adapter.sec.html.table.ProcessedTable;

import com.google.common.collect.ImmutableList;

import org.jsoup.Jsoup;
import org.jsoup.parser.Parser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link SecHtmlParser}.
 */
@Tag("unit")
class SecHtmlParserTest {

  private static final String FILING = "<html><head><title>Form 10-Q</title>"
      + "<style>p { margin: 0 }</style></head><body>"
      + "<div style=\"display:none\"><ix:header><ix:references/></ix:header></div>"
      + "<p style=\"text-align:center;font-weight:bold;font-size:14pt\">PART I</p>"
      + "<p style=\"font-weight:bold\">ITEM 1. FINANCIAL STATEMENTS</p>"
      + "<p>The following table presents revenue by period.</p>"
      + "<table>"
      + "<tr><td></td><td colspan=\"3\">Three Months Ended March 31,</td><td></td></tr>"
      + "<tr><td></td><td></td><td>2024</td><td></td><td>2023</td></tr>"
      + "<tr><td>Revenue</td><td>$</td><td>1,200</td><td>$</td><td>1,100</td></tr>"
      + "<tr><td>Cost of revenue</td><td></td><td>(700)</td><td></td><td>(650)</td></tr>"
      + "</table>"
      + "<div style=\"page-break-after:always\"></div>"
      + "<p style=\"font-weight:bold\">ITEM 2. MANAGEMENT'S DISCUSSION AND ANALYSIS</p>"
      + "<p>Revenue grew nine percent.</p>"
      + "</body></html>";

  @Test
  void testParseFiling() {
    SecHtmlParser parser = new SecHtmlParser(
        ParserConfig.builder().includePageBreaks(true).build());
    Document document = parser.parse(FILING);
    assertNotNull(document);

    assertEquals(3, document.headings().size());
    assertEquals(1, document.headings().get(0).getLevel());
    assertEquals(2, document.headings().get(1).getLevel());
    assertEquals("ITEM 2. MANAGEMENT'S DISCUSSION AND ANALYSIS",
        document.headings().get(2).getText());
    assertEquals(1, document.tables().size());

    assertEquals(2, document.pages().size());
    assertEquals(PageBreakSource.DOCUMENT_START,
        document.pages().get(0).getPageBreak().getSource());
    assertEquals(PageBreakSource.EXPLICIT_STYLE,
        document.pages().get(1).getPageBreak().getSource());
  }

  @Test
  void testProcessAndLayoutTable() {
    SecHtmlParser parser = SecHtmlParser.defaults();
    Document document = parser.parse(FILING);
    assertNotNull(document);
    TableNode table = document.tables().get(0);

    ProcessedTable processed = parser.processTable(table);
    assertNotNull(processed);
    assertTrue(processed.hasHeader());
    assertEquals(2, processed.getDataRows().size());
    assertEquals("Revenue", processed.getDataRows().get(0).get(0));
    assertTrue(processed.getDataRows().get(1).contains("-700"));
    assertEquals(Alignment.LEFT, processed.getAlignments().get(0));
    assertTrue(processed.getAlignments().contains(Alignment.RIGHT));

    ProcessedTable laidOut = parser.layoutTable(processed);
    assertEquals(processed.getColumnCount(), laidOut.getColumnCount());
    assertEquals(processed.getDataRows().size(), laidOut.getDataRows().size());
  }

  @Test
  void testHugeColspansDoNotBreakProcessing() {
    SecHtmlParser parser = SecHtmlParser.defaults();
    Document document = parser.parse("<body><table><tr>"
        + "<td colspan=\"2000000000\">A</td><td colspan=\"2000000000\">B</td>"
        + "</tr></table></body>");
    assertNotNull(document);
    TableNode table = document.tables().get(0);
    assertEquals(2000, table.getRows().get(0).width());
    assertNull(parser.processTable(table));

    Document single = parser.parse(
        "<body><table><tr><td colspan=\"300000000\">A</td></tr></table></body>");
    assertNotNull(single);
    ProcessedTable processed = parser.processTable(single.tables().get(0));
    assertNotNull(processed);
    assertEquals(1, processed.getColumnCount());
  }

  @Test
  void testNoBodyYieldsNoDocument() {
    org.jsoup.nodes.Document xml = Jsoup.parse(
        "<filing><section>Text without a body</section></filing>", "", Parser.xmlParser());
    assertNull(SecHtmlParser.defaults().parse(JsoupHtmlNode.of(xml.child(0))));
  }

  @Test
  void testParseFromBodyOrAncestor() {
    org.jsoup.nodes.Document html = Jsoup.parse("<p>Only paragraph.</p>");
    SecHtmlParser parser = SecHtmlParser.defaults();
    Document fromRoot = parser.parse(JsoupHtmlNode.of(html.child(0)));
    Document fromBody = parser.parse(JsoupHtmlNode.of(html.body()));
    assertNotNull(fromRoot);
    assertNotNull(fromBody);
    assertEquals(1, fromRoot.size());
    assertEquals(fromRoot.size(), fromBody.size());
  }

  @Test
  void testBlankHtmlYieldsEmptyDocument() {
    Document document = SecHtmlParser.defaults().parse("");
    assertNotNull(document);
    assertTrue(document.isEmpty());
    assertEquals(ImmutableList.of(), document.headings());
  }
}
