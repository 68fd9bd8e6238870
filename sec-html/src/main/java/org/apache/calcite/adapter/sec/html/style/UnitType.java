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
package org.apache.calcite.adapter.sec.html.style;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * CSS length units understood by the style parser.
 *
 * <p>Each unit knows how many inches one unit represents, which is the common
 * currency for comparisons between differently expressed lengths. Percentages
 * have no absolute size; they are only meaningful relative to a container.
 */
public enum UnitType {
  POINT("pt", 1.0 / 72),
  PIXEL("px", 1.0 / 96),
  INCH("in", 1.0),
  CM("cm", 0.393701),
  MM("mm", 0.0393701),
  PERCENT("%", 1.0),
  EM("em", 1.0 / 6),
  REM("rem", 1.0 / 6);

  private final String symbol;
  private final double inches;

  UnitType(String symbol, double inches) {
    this.symbol = symbol;
    this.inches = inches;
  }

  /** Returns the CSS suffix for this unit, e.g. {@code pt}. */
  public String symbol() {
    return symbol;
  }

  /** Returns the size of one unit in inches. */
  public double inches() {
    return inches;
  }

  /**
   * Looks up a unit by its CSS suffix.
   *
   * @param symbol suffix such as {@code pt} or {@code %}, already lower-cased
   * @return the unit, or null if the suffix is not supported
   */
  public static @Nullable UnitType fromSymbol(String symbol) {
    for (UnitType unit : values()) {
      if (unit.symbol.equals(symbol)) {
        return unit;
      }
    }
    return null;
  }
}
