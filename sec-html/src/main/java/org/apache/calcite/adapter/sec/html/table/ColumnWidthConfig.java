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

import org.apache.calcite.adapter.sec.html.ConfigValues;

import com.google.common.base.Preconditions;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/**
 * Width budget for {@link ColumnWidthOptimizer}, in terminal characters.
 */
public class ColumnWidthConfig {

  private final int totalWidth;
  private final int minDataWidth;
  private final double labelTargetRatio;
  private final double labelMaxRatio;

  private ColumnWidthConfig(Builder builder) {
    Preconditions.checkArgument(builder.totalWidth > 0, "totalWidth must be positive");
    Preconditions.checkArgument(builder.minDataWidth > 0, "minDataWidth must be positive");
    Preconditions.checkArgument(builder.labelTargetRatio > 0
            && builder.labelTargetRatio <= builder.labelMaxRatio
            && builder.labelMaxRatio <= 1.0,
        "label ratios must satisfy 0 < target <= max <= 1: %s, %s",
        builder.labelTargetRatio, builder.labelMaxRatio);
    this.totalWidth = builder.totalWidth;
    this.minDataWidth = builder.minDataWidth;
    this.labelTargetRatio = builder.labelTargetRatio;
    this.labelMaxRatio = builder.labelMaxRatio;
  }

  public int getTotalWidth() {
    return totalWidth;
  }

  public int getMinDataWidth() {
    return minDataWidth;
  }

  /** Share of the budget the label column may take without competing. */
  public double getLabelTargetRatio() {
    return labelTargetRatio;
  }

  /** Hard upper bound on the label column's share of the budget. */
  public double getLabelMaxRatio() {
    return labelMaxRatio;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static ColumnWidthConfig defaults() {
    return new Builder().build();
  }

  public static ColumnWidthConfig fromMap(@Nullable Map<String, Object> map) {
    if (map == null) {
      return defaults();
    }
    Builder d = new Builder();
    return builder()
        .totalWidth(ConfigValues.intValue(map, "totalWidth", d.totalWidth))
        .minDataWidth(ConfigValues.intValue(map, "minDataWidth", d.minDataWidth))
        .labelTargetRatio(
            ConfigValues.doubleValue(map, "labelTargetRatio", d.labelTargetRatio))
        .labelMaxRatio(ConfigValues.doubleValue(map, "labelMaxRatio", d.labelMaxRatio))
        .build();
  }

  @Override public String toString() {
    return "ColumnWidthConfig{totalWidth=" + totalWidth
        + ", minDataWidth=" + minDataWidth
        + ", labelTargetRatio=" + labelTargetRatio
        + ", labelMaxRatio=" + labelMaxRatio
        + "}";
  }

  /**
   * Builder for {@link ColumnWidthConfig}.
   */
  public static class Builder {
    private int totalWidth = 100;
    private int minDataWidth = 15;
    private double labelTargetRatio = 0.4;
    private double labelMaxRatio = 0.5;

    public Builder totalWidth(int totalWidth) {
      this.totalWidth = totalWidth;
      return this;
    }

    public Builder minDataWidth(int minDataWidth) {
      this.minDataWidth = minDataWidth;
      return this;
    }

    public Builder labelTargetRatio(double labelTargetRatio) {
      this.labelTargetRatio = labelTargetRatio;
      return this;
    }

    public Builder labelMaxRatio(double labelMaxRatio) {
      this.labelMaxRatio = labelMaxRatio;
      return this;
    }

    public ColumnWidthConfig build() {
      return new ColumnWidthConfig(this);
    }
  }
}
