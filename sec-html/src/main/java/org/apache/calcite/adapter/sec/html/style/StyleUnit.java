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

import java.util.Locale;
import java.util.Objects;

/**
 * A CSS measurement: the value exactly as declared plus its unit.
 *
 * <p>Comparisons convert both sides to inches, so {@code 12pt} and {@code 16px}
 * compare as equal lengths. Bare numbers used as thresholds are interpreted as
 * points.
 */
public final class StyleUnit {

  // Terminal conversion, calibrated at an 80 column console
  private static final int BASE_CONSOLE_WIDTH = 80;
  private static final double CHARS_PER_INCH = 12.3;

  private final double value;
  private final UnitType unit;

  public StyleUnit(double value, UnitType unit) {
    this.value = value;
    this.unit = Objects.requireNonNull(unit, "unit");
  }

  /** Creates a length expressed in points. */
  public static StyleUnit points(double value) {
    return new StyleUnit(value, UnitType.POINT);
  }

  public double getValue() {
    return value;
  }

  public UnitType getUnit() {
    return unit;
  }

  /** Returns this length in inches. Percentages return their raw value. */
  public double toInches() {
    return value * unit.inches();
  }

  /** Returns this length in points. */
  public double toPoints() {
    return toInches() * 72.0;
  }

  /**
   * Converts this length to a number of terminal characters.
   *
   * @param consoleWidth width of the target console in characters
   * @return width in characters; percentages are taken of {@code consoleWidth}
   */
  public int toChars(int consoleWidth) {
    if (unit == UnitType.PERCENT) {
      return (int) Math.round(consoleWidth * (value / 100.0));
    }
    double scale = consoleWidth / (double) BASE_CONSOLE_WIDTH;
    return (int) Math.round(toInches() * CHARS_PER_INCH * scale);
  }

  /** Returns whether this length is at least {@code points} points. */
  public boolean isAtLeastPoints(double points) {
    return unit != UnitType.PERCENT && toPoints() >= points;
  }

  /** Returns whether this length is strictly greater than {@code points} points. */
  public boolean isGreaterThanPoints(double points) {
    return unit != UnitType.PERCENT && toPoints() > points;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StyleUnit)) {
      return false;
    }
    StyleUnit other = (StyleUnit) o;
    if (unit == other.unit) {
      return Double.compare(value, other.value) == 0;
    }
    if (unit == UnitType.PERCENT || other.unit == UnitType.PERCENT) {
      return false;
    }
    return Math.abs(toInches() - other.toInches()) < 1e-9;
  }

  @Override public int hashCode() {
    // Lengths equal across units must hash alike, so hash the inch value
    if (unit == UnitType.PERCENT) {
      return Objects.hash(value, unit);
    }
    return Long.hashCode(Math.round(toInches() * 1e6));
  }

  @Override public String toString() {
    if (value == Math.rint(value)) {
      return String.format(Locale.ROOT, "%d%s", (long) value, unit.symbol());
    }
    return value + unit.symbol();
  }
}
