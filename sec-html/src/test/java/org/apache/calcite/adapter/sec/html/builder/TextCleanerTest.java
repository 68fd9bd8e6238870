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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for {@link TextCleaner}.
 */
@Tag("unit")
class TextCleanerTest {

  @Test
  void testTypographicSpacesAndDashes() {
    assertEquals("2023 - 2024", TextCleaner.clean("2023\u00A0\u2013\u20092024"));
    assertEquals("Long-term", TextCleaner.clean("Long\u2011term"));
    assertEquals("zero width", TextCleaner.clean("zero\u200B width\uFEFF"));
  }

  @Test
  void testLiteralEntities() {
    assertEquals("AT&T <Inc> - \"x\" 'y'",
        TextCleaner.clean("AT&amp;T&nbsp;&lt;Inc&gt; &mdash; &quot;x&quot; &#39;y&apos;"));
  }

  @Test
  void testWhitespaceCollapsesWithinLines() {
    assertEquals("a b\nc", TextCleaner.clean("  a \t  b \n   c  "));
  }

  @Test
  void testBlankLinesCollapse() {
    assertEquals("first\n\nsecond", TextCleaner.clean("first\n\n\n\n  \nsecond\n\n"));
  }

  @Test
  void testOnlyWhitespaceBecomesEmpty() {
    assertEquals("", TextCleaner.clean(" \u00A0\n\t"));
    assertEquals("", TextCleaner.clean(""));
  }

  @Test
  void testCleanSingleLine() {
    assertEquals("ITEM 1. Business", TextCleaner.cleanSingleLine("ITEM 1.\n\n  Business "));
  }
}
