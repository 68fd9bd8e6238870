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
import org.apache.calcite.adapter.sec.html.dom.JsoupHtmlNode;
import org.apache.calcite.adapter.sec.html.node.Alignment;
import org.apache.calcite.adapter.sec.html.node.TableCell;
import org.apache.calcite.adapter.sec.html.node.TableNode;
import org.apache.calcite.adapter.sec.html.table.TableConfig;

import com.google.common.collect.ImmutableMap;

import org.jsoup.Jsoup;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for {@link TableRowExtractor}.
 */
@Tag("unit")
class TableRowExtractorTest {

  private static HtmlNode table(String html) {
    return JsoupHtmlNode.of(Jsoup.parse(html).body().child(0));
  }

  private static TableNode extract(String html) {
    return TableRowExtractor.extract(table(html), ImmutableMap.<String, String>of(),
        TableConfig.defaults().getMaxColspan());
  }

  @Test
  void testRowsFromSections() {
    TableNode table = extract("<table>"
        + "<thead><tr><th colspan=\"2\">Year</th></tr></thead>"
        + "<tbody><tr><td>Revenue</td><td style=\"text-align:right\">1,000</td></tr></tbody>"
        + "<tfoot><tr><td>Total</td><td>1,000</td></tr></tfoot>"
        + "</table>");
    assertNotNull(table);
    assertEquals(3, table.getRows().size());
    TableCell header = table.getRows().get(0).getCells().get(0);
    assertEquals("Year", header.getText());
    assertEquals(2, header.getColspan());
    assertEquals(Alignment.RIGHT, table.getRows().get(1).getCells().get(1).getAlignment());
    assertNull(table.getRows().get(1).getCells().get(0).getAlignment());
  }

  @Test
  void testInvalidColspanFallsBackToOne() {
    TableNode table = extract("<table><tr><td colspan=\"abc\">a</td>"
        + "<td colspan=\"0\">b</td></tr></table>");
    List<TableCell> cells = table.getRows().get(0).getCells();
    assertEquals(1, cells.get(0).getColspan());
    assertEquals(1, cells.get(1).getColspan());
  }

  @Test
  void testOversizedColspanIsClamped() {
    TableNode table = extract("<table><tr><td colspan=\"2000000000\">A</td>"
        + "<td colspan=\"99999999999\">B</td><td colspan=\"7\">C</td></tr></table>");
    List<TableCell> cells = table.getRows().get(0).getCells();
    assertEquals(1000, cells.get(0).getColspan());
    assertEquals(1000, cells.get(1).getColspan());
    assertEquals(7, cells.get(2).getColspan());

    TableNode narrow = TableRowExtractor.extract(
        table("<table><tr><td colspan=\"50\">A</td></tr></table>"),
        ImmutableMap.<String, String>of(), 10);
    assertEquals(10, narrow.getRows().get(0).getCells().get(0).getColspan());
  }

  @Test
  void testCellBlocksBecomeLines() {
    TableNode table = extract("<table><tr><td><div>Net income</div>"
        + "<div>attributable to&nbsp;Company</div></td>"
        + "<td>Line one<br>Line two</td></tr></table>");
    List<TableCell> cells = table.getRows().get(0).getCells();
    assertEquals("Net income\nattributable to Company", cells.get(0).getText());
    assertEquals("Line one\nLine two", cells.get(1).getText());
  }

  @Test
  void testNestedTable() {
    TableNode table = extract("<table><tr><td>Outer"
        + "<table><tr><td>A</td><td>1</td></tr><tr><td>B</td><td>2</td></tr></table>"
        + "</td></tr></table>");
    TableCell cell = table.getRows().get(0).getCells().get(0);
    assertNotNull(cell.getNestedTable());
    assertEquals(2, cell.getNestedTable().getRows().size());
    assertEquals("Outer\nA | 1\nB | 2", cell.getText());
  }

  @Test
  void testHiddenRowsAndEmptyTables() {
    TableNode table = extract("<table><tr style=\"display:none\"><td>x</td></tr>"
        + "<tr><td>y</td></tr></table>");
    assertEquals(1, table.getRows().size());
    assertNull(extract("<table></table>"));
  }
}
