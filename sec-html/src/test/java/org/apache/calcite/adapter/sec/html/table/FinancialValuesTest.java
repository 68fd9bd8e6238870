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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link FinancialValues}.
 */
@Tag("unit")
class FinancialValuesTest {

  @Test
  void testNumericValues() {
    assertTrue(FinancialValues.isNumeric("$1,234.00"));
    assertTrue(FinancialValues.isNumeric("(500)"));
    assertTrue(FinancialValues.isNumeric("12.5%"));
    assertTrue(FinancialValues.isNumeric(" 1,000 "));
    assertTrue(FinancialValues.isNumeric("-3.2"));
  }

  @Test
  void testNonNumericValues() {
    assertFalse(FinancialValues.isNumeric(""));
    assertFalse(FinancialValues.isNumeric("$"));
    assertFalse(FinancialValues.isNumeric("N/A"));
    assertFalse(FinancialValues.isNumeric("-"));
    assertFalse(FinancialValues.isNumeric("Revenue"));
  }

  @Test
  void testFinancialByDollarToTheLeft() {
    List<String> row = ImmutableList.of("Fees", "$", "", "n/m", "Other");
    assertTrue(FinancialValues.isFinancial(row, 3));
    assertFalse(FinancialValues.isFinancial(row, 1));
    assertFalse(FinancialValues.isFinancial(row, 2));
    assertFalse(FinancialValues.isFinancial(row, 4));
    assertFalse(FinancialValues.isFinancial(row, 0));
  }

  @Test
  void testDateLikeText() {
    assertTrue(FinancialValues.isDateLike("2023"));
    assertTrue(FinancialValues.isDateLike("Q3"));
    assertTrue(FinancialValues.isDateLike("Third Quarter"));
    assertTrue(FinancialValues.isDateLike("December 31,"));
    assertFalse(FinancialValues.isDateLike("Revenue"));
    assertFalse(FinancialValues.isDateLike("Mayor"));
    assertFalse(FinancialValues.isDateLike(""));
    assertFalse(FinancialValues.isDateLike("1,000"));
  }

  @Test
  void testFormatNegative() {
    assertEquals("-600", FinancialValues.formatNegative("(600)"));
    assertEquals("-1,234", FinancialValues.formatNegative(" ( 1,234 ) "));
    assertEquals("()", FinancialValues.formatNegative("()"));
    assertEquals("600", FinancialValues.formatNegative("600"));
  }
}
