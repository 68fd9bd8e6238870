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

import org.apache.calcite.adapter.sec.html.ConfigValues;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Signals recognised by {@link PageBreakDetector}.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * pageBreak:
 *   classNames: [BRPFPageBreak, pagebreak, page-break, page-break-area]
 *   ruleHeightPixels: 3
 *   pageHeightsPoints: [842.4, 792, 1008]
 *   pageWidthsPoints: [597.6, 612]
 *   dimensionTolerancePoints: 1.0
 * }</pre>
 */
public class PageBreakConfig {

  private final ImmutableList<String> classNames;
  private final double ruleHeightPixels;
  private final double ruleHeightTolerancePixels;
  private final ImmutableList<Double> pageHeightsPoints;
  private final ImmutableList<Double> pageWidthsPoints;
  private final double dimensionTolerancePoints;

  private PageBreakConfig(Builder builder) {
    this.classNames = ImmutableList.copyOf(builder.classNames);
    this.ruleHeightPixels = builder.ruleHeightPixels;
    this.ruleHeightTolerancePixels = builder.ruleHeightTolerancePixels;
    this.pageHeightsPoints = ImmutableList.copyOf(builder.pageHeightsPoints);
    this.pageWidthsPoints = ImmutableList.copyOf(builder.pageWidthsPoints);
    this.dimensionTolerancePoints = builder.dimensionTolerancePoints;
  }

  /** Class names marking a page break, compared case-insensitively. */
  public ImmutableList<String> getClassNames() {
    return classNames;
  }

  /** Height of a horizontal rule used as a page separator. */
  public double getRuleHeightPixels() {
    return ruleHeightPixels;
  }

  public double getRuleHeightTolerancePixels() {
    return ruleHeightTolerancePixels;
  }

  /** Heights of physical pages (A4, Letter, Legal). */
  public ImmutableList<Double> getPageHeightsPoints() {
    return pageHeightsPoints;
  }

  /** Widths of physical pages (A4, Letter and Legal). */
  public ImmutableList<Double> getPageWidthsPoints() {
    return pageWidthsPoints;
  }

  public double getDimensionTolerancePoints() {
    return dimensionTolerancePoints;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static PageBreakConfig defaults() {
    return new Builder().build();
  }

  /**
   * Creates a PageBreakConfig from a YAML/JSON map.
   *
   * @param map configuration map, may be null
   * @return the configuration; defaults for absent keys
   */
  public static PageBreakConfig fromMap(@Nullable Map<String, Object> map) {
    if (map == null) {
      return defaults();
    }
    Builder d = new Builder();
    return builder()
        .classNames(ConfigValues.stringList(map, "classNames", d.classNames))
        .ruleHeightPixels(
            ConfigValues.doubleValue(map, "ruleHeightPixels", d.ruleHeightPixels))
        .ruleHeightTolerancePixels(
            ConfigValues.doubleValue(map, "ruleHeightTolerancePixels",
                d.ruleHeightTolerancePixels))
        .pageHeightsPoints(doubles(map, "pageHeightsPoints", d.pageHeightsPoints))
        .pageWidthsPoints(doubles(map, "pageWidthsPoints", d.pageWidthsPoints))
        .dimensionTolerancePoints(
            ConfigValues.doubleValue(map, "dimensionTolerancePoints",
                d.dimensionTolerancePoints))
        .build();
  }

  private static List<Double> doubles(Map<String, Object> map, String key,
      List<Double> defaultValue) {
    Object value = map.get(key);
    if (!(value instanceof List)) {
      return defaultValue;
    }
    List<Double> result = new ArrayList<>();
    for (Object item : (List<?>) value) {
      if (item instanceof Number) {
        result.add(((Number) item).doubleValue());
      } else if (item instanceof String) {
        try {
          result.add(Double.parseDouble(((String) item).trim()));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("Invalid number in " + key + ": " + item, e);
        }
      }
    }
    return result;
  }

  @Override public String toString() {
    return "PageBreakConfig{classNames=" + classNames
        + ", ruleHeightPixels=" + ruleHeightPixels
        + ", pageHeightsPoints=" + pageHeightsPoints
        + ", pageWidthsPoints=" + pageWidthsPoints
        + "}";
  }

  /**
   * Builder for {@link PageBreakConfig}.
   */
  public static class Builder {
    private List<String> classNames =
        ImmutableList.of("BRPFPageBreak", "pagebreak", "page-break", "page-break-area");
    private double ruleHeightPixels = 3.0;
    private double ruleHeightTolerancePixels = 0.5;
    private List<Double> pageHeightsPoints = ImmutableList.of(842.4, 792.0, 1008.0);
    private List<Double> pageWidthsPoints = ImmutableList.of(597.6, 612.0);
    private double dimensionTolerancePoints = 1.0;

    public Builder classNames(List<String> classNames) {
      this.classNames = classNames;
      return this;
    }

    public Builder ruleHeightPixels(double ruleHeightPixels) {
      this.ruleHeightPixels = ruleHeightPixels;
      return this;
    }

    public Builder ruleHeightTolerancePixels(double ruleHeightTolerancePixels) {
      this.ruleHeightTolerancePixels = ruleHeightTolerancePixels;
      return this;
    }

    public Builder pageHeightsPoints(List<Double> pageHeightsPoints) {
      this.pageHeightsPoints = pageHeightsPoints;
      return this;
    }

    public Builder pageWidthsPoints(List<Double> pageWidthsPoints) {
      this.pageWidthsPoints = pageWidthsPoints;
      return this;
    }

    public Builder dimensionTolerancePoints(double dimensionTolerancePoints) {
      this.dimensionTolerancePoints = dimensionTolerancePoints;
      return this;
    }

    public PageBreakConfig build() {
      return new PageBreakConfig(this);
    }
  }
}
