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
package org.apache.calcite.adapter.sec.html.heading;

import org.apache.calcite.adapter.sec.html.ConfigValues;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Thresholds used by {@link HeadingClassifier}.
 *
 * <p>The defaults were tuned against observed 10-K and 10-Q filings. All of
 * them are heuristics, so each can be overridden.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * heading:
 *   baseFontPoints: 10
 *   maxLength: 100
 *   largeFontRatio: 1.1
 *   prominentFontRatio: 1.2
 *   sectionKeywords: [overview, business, liquidity]
 * }</pre>
 */
public class HeadingConfig {

  public static final List<String> DEFAULT_SECTION_KEYWORDS = ImmutableList.of(
      "overview", "background", "business", "operations", "risk factors",
      "management", "financial", "discussion", "analysis", "results",
      "liquidity", "capital resources", "critical accounting", "controls",
      "procedures");

  private final double baseFontPoints;
  private final int maxLength;
  private final double largeFontRatio;
  private final double prominentFontRatio;
  private final double gateMarginTopPoints;
  private final double prominentMarginTopPoints;
  private final int minCapsLength;
  private final int sectionMinLength;
  private final int sectionMaxLength;
  private final int minorHeadingMaxLength;
  private final ImmutableList<String> sectionKeywords;

  private HeadingConfig(Builder builder) {
    this.baseFontPoints = builder.baseFontPoints;
    this.maxLength = builder.maxLength;
    this.largeFontRatio = builder.largeFontRatio;
    this.prominentFontRatio = builder.prominentFontRatio;
    this.gateMarginTopPoints = builder.gateMarginTopPoints;
    this.prominentMarginTopPoints = builder.prominentMarginTopPoints;
    this.minCapsLength = builder.minCapsLength;
    this.sectionMinLength = builder.sectionMinLength;
    this.sectionMaxLength = builder.sectionMaxLength;
    this.minorHeadingMaxLength = builder.minorHeadingMaxLength;
    this.sectionKeywords = ImmutableList.copyOf(builder.sectionKeywords);
  }

  /** Font size, in points, that font-size ratios are measured against. */
  public double getBaseFontPoints() {
    return baseFontPoints;
  }

  /** Text longer than this is never a heading. */
  public int getMaxLength() {
    return maxLength;
  }

  /** Font-size ratio from which text counts as large. */
  public double getLargeFontRatio() {
    return largeFontRatio;
  }

  /** Font-size ratio above which text counts as prominent. */
  public double getProminentFontRatio() {
    return prominentFontRatio;
  }

  public double getGateMarginTopPoints() {
    return gateMarginTopPoints;
  }

  public double getProminentMarginTopPoints() {
    return prominentMarginTopPoints;
  }

  /** Centered all-caps text must be longer than this to pass the trait gate. */
  public int getMinCapsLength() {
    return minCapsLength;
  }

  public int getSectionMinLength() {
    return sectionMinLength;
  }

  public int getSectionMaxLength() {
    return sectionMaxLength;
  }

  /** Level 4 headings must be shorter than this. */
  public int getMinorHeadingMaxLength() {
    return minorHeadingMaxLength;
  }

  public ImmutableList<String> getSectionKeywords() {
    return sectionKeywords;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static HeadingConfig defaults() {
    return new Builder().build();
  }

  /**
   * Creates a HeadingConfig from a YAML/JSON map.
   *
   * @param map configuration map, may be null
   * @return the configuration; defaults for absent keys
   */
  public static HeadingConfig fromMap(@Nullable Map<String, Object> map) {
    if (map == null) {
      return defaults();
    }
    Builder d = new Builder();
    return builder()
        .baseFontPoints(ConfigValues.doubleValue(map, "baseFontPoints", d.baseFontPoints))
        .maxLength(ConfigValues.intValue(map, "maxLength", d.maxLength))
        .largeFontRatio(ConfigValues.doubleValue(map, "largeFontRatio", d.largeFontRatio))
        .prominentFontRatio(
            ConfigValues.doubleValue(map, "prominentFontRatio", d.prominentFontRatio))
        .gateMarginTopPoints(
            ConfigValues.doubleValue(map, "gateMarginTopPoints", d.gateMarginTopPoints))
        .prominentMarginTopPoints(
            ConfigValues.doubleValue(map, "prominentMarginTopPoints",
                d.prominentMarginTopPoints))
        .minCapsLength(ConfigValues.intValue(map, "minCapsLength", d.minCapsLength))
        .sectionMinLength(ConfigValues.intValue(map, "sectionMinLength", d.sectionMinLength))
        .sectionMaxLength(ConfigValues.intValue(map, "sectionMaxLength", d.sectionMaxLength))
        .minorHeadingMaxLength(
            ConfigValues.intValue(map, "minorHeadingMaxLength", d.minorHeadingMaxLength))
        .sectionKeywords(
            ConfigValues.stringList(map, "sectionKeywords", d.sectionKeywords))
        .build();
  }

  @Override public String toString() {
    return "HeadingConfig{baseFontPoints=" + baseFontPoints
        + ", maxLength=" + maxLength
        + ", largeFontRatio=" + largeFontRatio
        + ", prominentFontRatio=" + prominentFontRatio
        + ", sectionKeywords=" + sectionKeywords.size()
        + "}";
  }

  /**
   * Builder for {@link HeadingConfig}.
   */
  public static class Builder {
    private double baseFontPoints = 10.0;
    private int maxLength = 100;
    private double largeFontRatio = 1.1;
    private double prominentFontRatio = 1.2;
    private double gateMarginTopPoints = 12.0;
    private double prominentMarginTopPoints = 18.0;
    private int minCapsLength = 4;
    private int sectionMinLength = 8;
    private int sectionMaxLength = 60;
    private int minorHeadingMaxLength = 50;
    private List<String> sectionKeywords = DEFAULT_SECTION_KEYWORDS;

    public Builder baseFontPoints(double baseFontPoints) {
      this.baseFontPoints = baseFontPoints;
      return this;
    }

    public Builder maxLength(int maxLength) {
      this.maxLength = maxLength;
      return this;
    }

    public Builder largeFontRatio(double largeFontRatio) {
      this.largeFontRatio = largeFontRatio;
      return this;
    }

    public Builder prominentFontRatio(double prominentFontRatio) {
      this.prominentFontRatio = prominentFontRatio;
      return this;
    }

    public Builder gateMarginTopPoints(double gateMarginTopPoints) {
      this.gateMarginTopPoints = gateMarginTopPoints;
      return this;
    }

    public Builder prominentMarginTopPoints(double prominentMarginTopPoints) {
      this.prominentMarginTopPoints = prominentMarginTopPoints;
      return this;
    }

    public Builder minCapsLength(int minCapsLength) {
      this.minCapsLength = minCapsLength;
      return this;
    }

    public Builder sectionMinLength(int sectionMinLength) {
      this.sectionMinLength = sectionMinLength;
      return this;
    }

    public Builder sectionMaxLength(int sectionMaxLength) {
      this.sectionMaxLength = sectionMaxLength;
      return this;
    }

    public Builder minorHeadingMaxLength(int minorHeadingMaxLength) {
      this.minorHeadingMaxLength = minorHeadingMaxLength;
      return this;
    }

    public Builder sectionKeywords(List<String> sectionKeywords) {
      this.sectionKeywords = sectionKeywords;
      return this;
    }

    public HeadingConfig build() {
      return new HeadingConfig(this);
    }
  }
}
