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

import java.util.List;
import java.util.regex.Pattern;

/**
 * Recognises the kinds of cell text found in financial tables.
 */
public final class FinancialValues {

  private static final Pattern NUMBER = Pattern.compile("^[+-]?(?:\\d+\\.?\\d*|\\.\\d+)$");
  private static final Pattern CURRENCY_AND_SEPARATORS = Pattern.compile("[$\\u20AC\\u00A3,\\s()]");

  private static final Pattern YEAR = Pattern.compile("^(?:19|20)\\d{2}$");
  private static final Pattern QUARTER = Pattern.compile(
      "\\b(?:q[1-4]|(?:first|second|third|fourth)\\s+quarter)\\b",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern MONTH = Pattern.compile(
      "\\b(?:january|february|march|april|may|june|july|august|september|october"
          + "|november|december|jan|feb|mar|apr|jun|jul|aug|sep|sept|oct|nov|dec)\\b\\.?",
      Pattern.CASE_INSENSITIVE);

  private FinancialValues() {
  }

  /**
   * Returns whether the text is a number once currency symbols, thousands
   * separators, spaces, parentheses and a trailing percent sign are removed.
   * {@code "$1,234.00"}, {@code "(500)"} and {@code "12.5%"} all qualify.
   */
  public static boolean isNumeric(String text) {
    String value = text.trim();
    if (value.endsWith("%")) {
      value = value.substring(0, value.length() - 1);
    }
    value = CURRENCY_AND_SEPARATORS.matcher(value).replaceAll("");
    return !value.isEmpty() && NUMBER.matcher(value).matches();
  }

  /** Returns whether a cell holds nothing but a dollar sign. */
  public static boolean isLoneDollar(String text) {
    return "$".equals(text.trim());
  }

  /**
   * Returns whether the cell at {@code col} holds a financial value: a number,
   * or any non-blank text with a {@code $} to its left separated only by blank
   * cells.
   */
  public static boolean isFinancial(List<String> row, int col) {
    String text = row.get(col).trim();
    if (text.isEmpty() || isLoneDollar(text)) {
      return false;
    }
    if (isNumeric(text)) {
      return true;
    }
    for (int left = col - 1; left >= 0; left--) {
      String cell = row.get(left).trim();
      if (isLoneDollar(cell)) {
        return true;
      }
      if (!cell.isEmpty()) {
        return false;
      }
    }
    return false;
  }

  /** Returns whether the text is a bare year, a quarter label or names a month. */
  public static boolean isDateLike(String text) {
    String value = text.trim();
    if (value.isEmpty()) {
      return false;
    }
    return YEAR.matcher(value).matches()
        || QUARTER.matcher(value).find()
        || MONTH.matcher(value).find();
  }

  /**
   * Rewrites a parenthesised negative, {@code (600)}, as {@code -600}. Other
   * text is returned trimmed.
   */
  public static String formatNegative(String text) {
    String value = text.trim();
    if (value.length() > 2 && value.startsWith("(") && value.endsWith(")")) {
      return "-" + value.substring(1, value.length() - 1).trim();
    }
    return value;
  }
}
