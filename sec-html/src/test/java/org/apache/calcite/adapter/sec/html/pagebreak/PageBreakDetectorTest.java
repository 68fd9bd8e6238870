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
package org.apache.calcite.adapter.sec.html.pagebreak;

import org.apache.calcite.adapter.sec.html.dom.HtmlNode;
import org.apache.calcite.adapter.sec.html.dom.JsoupHtmlNode;
import org.apache.calcite.adapter.sec.html.node.PageBreakSource;

import com.google.common.collect.ImmutableList;

import org.jsoup.Jsoup;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link PageBreakDetector}.
 */
@Tag("unit")
class PageBreakDetectorTest {

  private final PageBreakDetector detector = new PageBreakDetector();

  private static HtmlNode element(String html) {
    return JsoupHtmlNode.of(Jsoup.parse(html).body().child(0));
  }

  private static HtmlNode body(String html) {
    return JsoupHtmlNode.of(Jsoup.parse(html).body());
  }

  @Test
  void testExplicitBreakBefore() {
    PageBreakMark mark =
        detector.mark(element("<div style=\"page-break-before: always\"></div>"));
    assertEquals(
        new PageBreakMark(PageBreakSource.EXPLICIT_STYLE, PageBreakMark.Placement.BEFORE),
        mark);
    assertEquals(PageBreakMark.Placement.BEFORE,
        detector.mark(element("<p style=\"break-before:page\">x</p>")).getPlacement());
  }

  @Test
  void testExplicitBreakAfter() {
    PageBreakMark mark =
        detector.mark(element("<p style=\"PAGE-BREAK-AFTER:Always\">end of page</p>"));
    assertEquals(PageBreakSource.EXPLICIT_STYLE, mark.getSource());
    assertEquals(PageBreakMark.Placement.AFTER, mark.getPlacement());
  }

  @Test
  void testExplicitBreakIgnoredOnNonBlockTag() {
    assertNull(detector.mark(element("<a style=\"page-break-before:always\">x</a>")));
  }

  @Test
  void testClassName() {
    assertEquals(PageBreakSource.CLASS_NAME,
        detector.mark(element("<div class=\"foo BRPFPageBreak\"></div>")).getSource());
    assertEquals(PageBreakSource.CLASS_NAME,
        detector.mark(element("<span class=\"page-break\"></span>")).getSource());
    assertNull(detector.mark(element("<div class=\"pagebreaker\"></div>")));
  }

  @Test
  void testThinRule() {
    assertEquals(PageBreakSource.HORIZONTAL_RULE,
        detector.mark(element("<hr style=\"height:3px;color:#999\">")).getSource());
    assertNull(detector.mark(element("<hr style=\"height:1px\">")));
    assertNull(detector.mark(element("<hr>")));
  }

  @Test
  void testPageSizedDiv() {
    PageBreakMark letter = detector.mark(element(
        "<div style=\"height:11in;width:8.5in;position:relative\">page</div>"));
    assertEquals(PageBreakSource.PAGE_DIV, letter.getSource());
    PageBreakMark a4 = detector.mark(element(
        "<div style=\"height:842.4pt;width:597.6pt;overflow:hidden\">page</div>"));
    assertEquals(PageBreakSource.PAGE_DIV, a4.getSource());
  }

  @Test
  void testPageSizedDivNeedsPositionOrClipping() {
    assertNull(detector.mark(element("<div style=\"height:792pt;width:612pt\">x</div>")));
    assertNull(detector.mark(
        element("<div style=\"height:792pt;position:absolute\">x</div>")));
    assertNull(detector.mark(
        element("<div style=\"height:500pt;width:612pt;position:absolute\">x</div>")));
  }

  @Test
  void testStyleTakesPrecedenceOverClass() {
    PageBreakMark mark = detector.mark(
        element("<div class=\"pagebreak\" style=\"page-break-after:always\"></div>"));
    assertEquals(PageBreakSource.EXPLICIT_STYLE, mark.getSource());
    assertEquals(PageBreakMark.Placement.AFTER, mark.getPlacement());
  }

  @Test
  void testDetectScansWholeTree() {
    HtmlNode body = body("<p>one</p><hr style=\"height:3px\">"
        + "<div><p style=\"page-break-before:always\">two</p></div>"
        + "<p>three</p>");
    PageBreakMarks marks = detector.detect(body);
    assertEquals(2, marks.size());
    assertFalse(marks.isMarked(body));
    assertTrue(PageBreakMarks.none().isEmpty());
  }

  @Test
  void testConfiguredClassNames() {
    PageBreakDetector custom = new PageBreakDetector(
        PageBreakConfig.builder().classNames(ImmutableList.of("newPage")).build());
    assertEquals(PageBreakSource.CLASS_NAME,
        custom.mark(element("<div class=\"NEWPAGE\"></div>")).getSource());
    assertNull(custom.mark(element("<div class=\"BRPFPageBreak\"></div>")));
  }
}
