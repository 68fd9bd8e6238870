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
import org.apache.calcite.adapter.sec.html.node.TableCell;
import org.apache.calcite.adapter.sec.html.node.TableNode;
import org.apache.calcite.adapter.sec.html.node.TableRow;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns the ragged rows of a filing table into a {@link ProcessedTable}.
 *
 * <p>Filing agents lay out financial statements with spacer columns, column
 * spans and dollar signs in cells of their own. Processing runs in stages:
 * <ol>
 *   <li>expand column spans into a rectangular grid, putting spanned content
 *       in the last covered column; tables wider than
 *       {@link TableConfig#getMaxColumns()} are rejected;</li>
 *   <li>prune structurally empty columns and drop blank rows;</li>
 *   <li>split header rows from data rows;</li>
 *   <li>repair headers shifted one column left of their data;</li>
 *   <li>merge header rows, infer column alignment, format negatives.</li>
 * </ol>
 */
public class TableProcessor {
  private static final Logger LOGGER = LoggerFactory.getLogger(TableProcessor.class);

  private static final String PERIODS =
      "(?:three|six|nine|twelve|[1-4]|first|second|third|fourth)";
  private static final String TIMEFRAMES = "(?:months?|quarters?|years?|weeks?)";
  private static final String ENDED = "(?:ended|ending|end|period)";
  private static final String MONTHS = "(?:january|february|march|april|may|june|july"
      + "|august|september|october|november|december"
      + "|jan|feb|mar|apr|jun|jul|aug|sep|sept|oct|nov|dec)\\.?";
  private static final String DATE = MONTHS + "\\s+\\d{1,2}";
  private static final String YEARS = "(?:19|20)\\d{2}";

  private static final Pattern PERIOD_HEADER = Pattern.compile(
      "(?:" + PERIODS + "\\s+" + TIMEFRAMES + "\\s+" + ENDED + "(?:\\s+" + DATE + ")?)"
          + "|(?:(?:fiscal\\s+)?" + TIMEFRAMES + "\\s+" + ENDED + ")"
          + "|(?:" + TIMEFRAMES + "\\s+" + ENDED + "(?:\\s+" + DATE + ")?"
          + "(?:\\s*,?\\s*" + YEARS + ")?)"
          + "|(?:as\\s+of\\s+" + DATE + ")"
          + "|(?:" + DATE + ",?\\s*" + YEARS + ".*" + DATE + ",?\\s*" + YEARS + ")",
      Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

  private static final Pattern YEAR_OR_QUARTER =
      Pattern.compile("\\b(?:" + YEARS + "|q[1-4])\\b", Pattern.CASE_INSENSITIVE);

  private final TableConfig config;

  public TableProcessor(TableConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  public TableProcessor() {
    this(TableConfig.defaults());
  }

  /**
   * Processes a table node.
   *
   * @return the processed table, or null if the table has no content or is
   *     too wide
   */
  public @Nullable ProcessedTable process(TableNode table) {
    return process(table.getRows());
  }

  /**
   * Processes raw rows.
   *
   * @return the processed table, or null if no row has any content or the
   *     rows span more than {@link TableConfig#getMaxColumns()} columns
   */
  public @Nullable ProcessedTable process(List<TableRow> rows) {
    if (rows.isEmpty()) {
      return null;
    }
    int maxCols = maxWidth(rows);
    if (maxCols > config.getMaxColumns()) {
      LOGGER.warn("Table spans {} columns, more than the limit of {}; skipping",
          maxCols, config.getMaxColumns());
      return null;
    }
    List<List<String>> grid = pruneColumns(virtualize(rows));
    List<List<String>> nonBlank = new ArrayList<>();
    for (List<String> row : grid) {
      if (!isBlank(row)) {
        nonBlank.add(row);
      }
    }
    if (nonBlank.isEmpty() || nonBlank.get(0).isEmpty()) {
      LOGGER.debug("Table has no content after pruning");
      return null;
    }
    int dataStart = findDataStart(nonBlank);
    List<List<String>> headerRows = new ArrayList<>(nonBlank.subList(0, dataStart));
    List<List<String>> dataRows = nonBlank.subList(dataStart, nonBlank.size());
    if (config.isRepairMisalignment() && !headerRows.isEmpty()) {
      int last = headerRows.size() - 1;
      List<String> repaired = repairMisalignment(headerRows.get(last), dataRows);
      if (repaired != null) {
        headerRows.set(last, repaired);
      }
    }
    List<String> header = headerRows.isEmpty() ? null : mergeHeaderRows(headerRows);
    int width = nonBlank.get(0).size();
    return new ProcessedTable(header, formatDataRows(dataRows),
        inferAlignments(dataRows, width));
  }

  /**
   * Expands column spans into a rectangular grid of trimmed cell text. A cell
   * spanning several columns occupies the last of them; the others stay
   * blank.
   */
  static List<List<String>> virtualize(List<TableRow> rows) {
    int maxCols = maxWidth(rows);
    List<List<String>> grid = new ArrayList<>(rows.size());
    for (TableRow row : rows) {
      List<String> virtual = new ArrayList<>(Collections.nCopies(maxCols, ""));
      int col = 0;
      for (TableCell cell : row.getCells()) {
        col += cell.getColspan();
        virtual.set(col - 1, cleanCell(cell.getText()));
      }
      grid.add(virtual);
    }
    return grid;
  }

  private static int maxWidth(List<TableRow> rows) {
    int maxCols = 0;
    for (TableRow row : rows) {
      maxCols = Math.max(maxCols, row.width());
    }
    return maxCols;
  }

  /**
   * Removes structurally empty columns: all leading and trailing ones, a
   * single empty column between content, and all but one column of a longer
   * interior run.
   */
  static List<List<String>> pruneColumns(List<List<String>> grid) {
    if (grid.isEmpty()) {
      return grid;
    }
    int width = grid.get(0).size();
    boolean[] empty = new boolean[width];
    for (int col = 0; col < width; col++) {
      empty[col] = true;
      for (List<String> row : grid) {
        if (!row.get(col).trim().isEmpty()) {
          empty[col] = false;
          break;
        }
      }
    }
    Set<Integer> remove = new HashSet<>();
    int first = 0;
    while (first < width && empty[first]) {
      remove.add(first++);
    }
    int last = width - 1;
    while (last >= first && empty[last]) {
      remove.add(last--);
    }
    int col = first;
    while (col <= last) {
      if (!empty[col]) {
        col++;
        continue;
      }
      int runEnd = col;
      while (runEnd + 1 <= last && empty[runEnd + 1]) {
        runEnd++;
      }
      int keep = runEnd > col ? col : -1;
      for (int i = col; i <= runEnd; i++) {
        if (i != keep) {
          remove.add(i);
        }
      }
      col = runEnd + 1;
    }
    if (remove.isEmpty()) {
      return grid;
    }
    List<List<String>> pruned = new ArrayList<>(grid.size());
    for (List<String> row : grid) {
      List<String> kept = new ArrayList<>(width - remove.size());
      for (int i = 0; i < width; i++) {
        if (!remove.contains(i)) {
          kept.add(row.get(i));
        }
      }
      pruned.add(kept);
    }
    return pruned;
  }

  /**
   * Returns the index of the first data row; the rows before it are headers.
   */
  int findDataStart(List<List<String>> rows) {
    int periodRows = Math.min(config.getPeriodHeaderScanRows(), rows.size());
    for (int i = 0; i < periodRows; i++) {
      List<String> row = rows.get(i);
      if (PERIOD_HEADER.matcher(String.join(" ", row)).find() && !hasDataValues(row)) {
        if (i + 1 < rows.size()
            && YEAR_OR_QUARTER.matcher(String.join(" ", rows.get(i + 1))).find()) {
          LOGGER.debug("Period header in rows 0..{}", i + 1);
          return i + 2;
        }
        LOGGER.debug("Period header in rows 0..{}", i);
        return i + 1;
      }
    }
    int dollarRows = Math.min(config.getDollarHeaderScanRows(), rows.size());
    for (int i = 0; i < dollarRows; i++) {
      if (countLoneDollars(rows.get(i)) > 0) {
        LOGGER.debug("Dollar column starts data at row {}", i);
        return i;
      }
    }
    for (int i = 0; i + 1 < rows.size(); i++) {
      List<String> next = rows.get(i + 1);
      if (countFinancial(rows.get(i)) == 0 && countFinancial(next) > 0
          && countLoneDollars(next) > 0) {
        LOGGER.debug("Text to numbers transition starts data at row {}", i + 1);
        return i + 1;
      }
    }
    return 0;
  }

  /**
   * Shifts a header row one column right when every date column in it sits
   * directly left of a numeric column in the first data rows.
   *
   * @return the shifted row, or null if no repair applies
   */
  @Nullable List<String> repairMisalignment(List<String> header,
      List<List<String>> dataRows) {
    int width = header.size();
    if (width < 2 || !header.get(width - 1).trim().isEmpty() || dataRows.isEmpty()) {
      return null;
    }
    List<Integer> dateCols = new ArrayList<>();
    for (int col = 0; col < width; col++) {
      if (FinancialValues.isDateLike(header.get(col))) {
        dateCols.add(col);
      }
    }
    if (dateCols.isEmpty()) {
      return null;
    }
    Set<Integer> numericCols = new HashSet<>();
    int sample = Math.min(config.getMisalignmentDataRows(), dataRows.size());
    for (int r = 0; r < sample; r++) {
      List<String> row = dataRows.get(r);
      for (int col = 1; col < row.size(); col++) {
        if (FinancialValues.isNumeric(row.get(col))) {
          numericCols.add(col);
        }
      }
    }
    for (int col : dateCols) {
      if (!numericCols.contains(col + 1)) {
        return null;
      }
    }
    List<String> shifted = new ArrayList<>(width);
    shifted.add("");
    shifted.addAll(header.subList(0, width - 1));
    LOGGER.debug("Shifted misaligned header {} to {}", header, shifted);
    return shifted;
  }

  /**
   * Merges header rows per column, top to bottom, joining non-blank cells
   * other than a lone {@code $} with line breaks.
   */
  static List<String> mergeHeaderRows(List<List<String>> headerRows) {
    int width = headerRows.get(0).size();
    List<String> merged = new ArrayList<>(width);
    for (int col = 0; col < width; col++) {
      List<String> parts = new ArrayList<>();
      for (List<String> row : headerRows) {
        String text = row.get(col).trim();
        if (!text.isEmpty() && !FinancialValues.isLoneDollar(text)) {
          parts.add(text);
        }
      }
      merged.add(String.join("\n", parts));
    }
    return merged;
  }

  /**
   * Column 0 is left aligned; any other column is right aligned when one of
   * its data cells is a financial value.
   */
  static List<Alignment> inferAlignments(List<List<String>> dataRows, int width) {
    List<Alignment> alignments = new ArrayList<>(width);
    for (int col = 0; col < width; col++) {
      Alignment alignment = Alignment.LEFT;
      if (col > 0) {
        for (List<String> row : dataRows) {
          if (FinancialValues.isFinancial(row, col)) {
            alignment = Alignment.RIGHT;
            break;
          }
        }
      }
      alignments.add(alignment);
    }
    return alignments;
  }

  private List<List<String>> formatDataRows(List<List<String>> rows) {
    ImmutableList.Builder<List<String>> formatted = ImmutableList.builder();
    for (List<String> row : rows) {
      List<String> cells = new ArrayList<>(row.size());
      for (int col = 0; col < row.size(); col++) {
        String text = row.get(col).trim();
        cells.add(col > 0 && config.isFormatNegatives()
            ? FinancialValues.formatNegative(text) : text);
      }
      formatted.add(cells);
    }
    return formatted.build();
  }

  private static boolean hasDataValues(List<String> row) {
    for (int col = 0; col < row.size(); col++) {
      if (FinancialValues.isFinancial(row, col)
          && !FinancialValues.isDateLike(row.get(col))) {
        return true;
      }
    }
    return false;
  }

  private static int countFinancial(List<String> row) {
    int count = 0;
    for (int col = 0; col < row.size(); col++) {
      if (FinancialValues.isFinancial(row, col)) {
        count++;
      }
    }
    return count;
  }

  private static int countLoneDollars(List<String> row) {
    int count = 0;
    for (String cell : row) {
      if (FinancialValues.isLoneDollar(cell)) {
        count++;
      }
    }
    return count;
  }

  private static boolean isBlank(List<String> row) {
    for (String cell : row) {
      if (!cell.trim().isEmpty()) {
        return false;
      }
    }
    return true;
  }

  /** Trims every line of a cell and drops blank lines. */
  private static String cleanCell(String text) {
    if (text.indexOf('\n') < 0) {
      return text.trim();
    }
    List<String> lines = new ArrayList<>();
    for (String line : text.split("\n")) {
      String trimmed = line.trim();
      if (!trimmed.isEmpty()) {
        lines.add(trimmed);
      }
    }
    return String.join("\n", lines);
  }
}
