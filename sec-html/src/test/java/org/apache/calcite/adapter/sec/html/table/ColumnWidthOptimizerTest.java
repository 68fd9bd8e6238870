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
package org.apache.calcite.adapter.sec.html.table;

import org.apache.calcite.adapter.sec.html.node.Alignment;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ColumnWidthOptimizer}.
 */
@Tag("unit")
class ColumnWidthOptimizerTest {

  private final ColumnWidthOptimizer optimizer = new ColumnWidthOptimizer();

  private static ProcessedTable table(List<String> header, List<String>... rows) {
    List<Alignment> alignments = new ArrayList<>();
    alignments.add(Alignment.LEFT);
    alignments.addAll(Collections.nCopies(rows[0].size() - 1, Alignment.RIGHT));
    return new ProcessedTable(header, ImmutableList.copyOf(rows), alignments);
  }

  @Test
  void testNarrowTableKeepsNaturalLabel() {
    ProcessedTable table = table(null, ImmutableList.of("Revenue", "1,000"));
    assertEquals(ImmutableList.of(7, 15), optimizer.computeWidths(table));
  }

  @Test
  void testLongLabelIsClampedToMaximumShare() {
    ProcessedTable table =
        table(null, ImmutableList.of(Strings.repeat("x", 60), "1,000", "2,000"));
    assertEquals(ImmutableList.of(50, 15, 15), optimizer.computeWidths(table));
  }

  @Test
  void testOverflowIsTakenFromDataColumns() {
    List<String> row = new ArrayList<>();
    row.add("Label");
    row.addAll(Collections.nCopies(6, Strings.repeat("9", 20)));
    List<Integer> widths = optimizer.computeWidths(table(null, row));
    assertEquals(ImmutableList.of(5, 15, 15, 15, 15, 15, 15), widths);
  }

  @Test
  void testDataColumnsNeverShrinkBelowMinimum() {
    List<String> row = new ArrayList<>();
    row.add("Label");
    row.addAll(Collections.nCopies(8, Strings.repeat("9", 16)));
    List<Integer> widths = optimizer.computeWidths(table(null, row));
    for (int col = 1; col < widths.size(); col++) {
      assertEquals(15, widths.get(col).intValue());
    }
  }

  @Test
  void testOptimizeWrapsLabelsAndHeaders() {
    ProcessedTable table = table(
        ImmutableList.of("", "Year Ended December 31, 2023"),
        ImmutableList.of(Strings.repeat("Total revenues and other income ", 3).trim(), "1"));
    ColumnWidthOptimizer narrow = new ColumnWidthOptimizer(
        ColumnWidthConfig.builder().totalWidth(60).build());
    ProcessedTable optimized = narrow.optimize(table);
    List<Integer> widths = narrow.computeWidths(table);
    for (String line : optimized.getDataRows().get(0).get(0).split("\n")) {
      assertTrue(line.length() <= widths.get(0), line);
    }
    for (String line : optimized.getHeader().get(1).split("\n")) {
      assertTrue(line.length() <= widths.get(1), line);
    }
    assertEquals("1", optimized.getDataRows().get(0).get(1));
  }

  @Test
  void testWrap() {
    assertEquals("Total\nrevenues\nand other\nincome",
        ColumnWidthOptimizer.wrap("Total revenues and other income", 10));
    assertEquals("Extra-\nordin-\narily", ColumnWidthOptimizer.wrap("Extraordinarily", 6));
    assertEquals("short", ColumnWidthOptimizer.wrap("short", 10));
  }

  @Test
  void testExistingLineBreaksArePreserved() {
    String text = "Net income attributable\nto common stockholders";
    assertEquals(text, ColumnWidthOptimizer.wrap(text, 8));
  }

  @Test
  void testInvalidConfigIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> ColumnWidthConfig.builder().labelTargetRatio(0.8).labelMaxRatio(0.5).build());
  }
}
