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

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fits a {@link ProcessedTable} into a fixed character width.
 *
 * <p>Data columns get their natural width, at least
 * {@link ColumnWidthConfig#getMinDataWidth()}. The label column (column 0)
 * keeps its natural width while that fits its target share of the budget;
 * otherwise it takes the space left over, clamped between the target and
 * maximum shares. Remaining overflow is taken evenly from the data columns.
 * Label cells and header cells are then word-wrapped to their widths.
 */
public class ColumnWidthOptimizer {
  private static final Logger LOGGER = LoggerFactory.getLogger(ColumnWidthOptimizer.class);

  private final ColumnWidthConfig config;

  public ColumnWidthOptimizer(ColumnWidthConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  public ColumnWidthOptimizer() {
    this(ColumnWidthConfig.defaults());
  }

  /**
   * Computes the width of every column, label column first.
   */
  public ImmutableList<Integer> computeWidths(ProcessedTable table) {
    int columns = table.getColumnCount();
    if (columns == 0) {
      return ImmutableList.of();
    }
    int budget = config.getTotalWidth();
    int minData = config.getMinDataWidth();
    int[] widths = new int[columns];
    int dataTotal = 0;
    for (int col = 1; col < columns; col++) {
      widths[col] = Math.max(minData, naturalWidth(table, col));
      dataTotal += widths[col];
    }

    int labelNatural = Math.max(1, naturalWidth(table, 0));
    int labelTarget = (int) (budget * config.getLabelTargetRatio());
    int labelMax = (int) (budget * config.getLabelMaxRatio());
    if (labelNatural <= labelTarget) {
      widths[0] = labelNatural;
    } else {
      int remaining = budget - dataTotal;
      widths[0] = Math.max(labelTarget, Math.min(Math.min(labelMax, remaining), labelNatural));
    }

    int overflow = widths[0] + dataTotal - budget;
    if (overflow > 0 && columns > 1) {
      int share = (overflow + columns - 2) / (columns - 1);
      for (int col = 1; col < columns; col++) {
        widths[col] = Math.max(minData, widths[col] - share);
      }
    }
    ImmutableList.Builder<Integer> result = ImmutableList.builder();
    for (int width : widths) {
      result.add(width);
    }
    ImmutableList<Integer> list = result.build();
    LOGGER.debug("Column widths {} for budget {}", list, budget);
    return list;
  }

  /**
   * Returns a copy of the table whose label cells, and header cells when
   * there is a header, are wrapped to the computed column widths.
   */
  public ProcessedTable optimize(ProcessedTable table) {
    List<Integer> widths = computeWidths(table);
    if (widths.isEmpty()) {
      return table;
    }
    int labelWidth = widths.get(0);
    List<String> header = null;
    if (table.getHeader() != null) {
      header = new ArrayList<>();
      List<String> original = table.getHeader();
      for (int col = 0; col < original.size(); col++) {
        header.add(wrap(original.get(col), widths.get(col)));
      }
    }
    List<List<String>> rows = new ArrayList<>();
    for (List<String> row : table.getDataRows()) {
      List<String> wrapped = new ArrayList<>(row);
      wrapped.set(0, wrap(row.get(0), labelWidth));
      rows.add(wrapped);
    }
    return new ProcessedTable(header, rows, table.getAlignments());
  }

  /**
   * Word-wraps text to a width. Text that already contains line breaks is
   * returned unchanged; words longer than the width are broken with a hyphen.
   */
  static String wrap(String text, int width) {
    if (text.indexOf('\n') >= 0 || text.length() <= width || width < 2) {
      return text;
    }
    List<String> lines = new ArrayList<>();
    StringBuilder line = new StringBuilder();
    for (String word : text.trim().split("\\s+")) {
      while (word.length() > width) {
        if (line.length() > 0) {
          lines.add(line.toString());
          line.setLength(0);
        }
        lines.add(word.substring(0, width - 1) + "-");
        word = word.substring(width - 1);
      }
      if (line.length() == 0) {
        line.append(word);
      } else if (line.length() + 1 + word.length() <= width) {
        line.append(' ').append(word);
      } else {
        lines.add(line.toString());
        line.setLength(0);
        line.append(word);
      }
    }
    if (line.length() > 0) {
      lines.add(line.toString());
    }
    return String.join("\n", lines);
  }

  private static int naturalWidth(ProcessedTable table, int col) {
    int width = 0;
    List<String> header = table.getHeader();
    if (header != null) {
      width = longestLine(header.get(col));
    }
    for (List<String> row : table.getDataRows()) {
      width = Math.max(width, longestLine(row.get(col)));
    }
    return width;
  }

  private static int longestLine(String text) {
    int longest = 0;
    for (String line : text.split("\n", -1)) {
      longest = Math.max(longest, line.length());
    }
    return longest;
  }
}
