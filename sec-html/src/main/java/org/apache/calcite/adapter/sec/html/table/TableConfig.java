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
 * Settings for {@link TableProcessor}.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * table:
 *   periodHeaderScanRows: 3
 *   dollarHeaderScanRows: 4
 *   misalignmentDataRows: 3
 *   repairMisalignment: true
 *   formatNegatives: true
 *   maxColspan: 1000
 *   maxColumns: 1000
 * }</pre>
 */
public class TableConfig {

  private final int periodHeaderScanRows;
  private final int dollarHeaderScanRows;
  private final int misalignmentDataRows;
  private final boolean repairMisalignment;
  private final boolean formatNegatives;
  private final int maxColspan;
  private final int maxColumns;

  private TableConfig(Builder builder) {
    this.periodHeaderScanRows = builder.periodHeaderScanRows;
    this.dollarHeaderScanRows = builder.dollarHeaderScanRows;
    this.misalignmentDataRows = builder.misalignmentDataRows;
    this.repairMisalignment = builder.repairMisalignment;
    this.formatNegatives = builder.formatNegatives;
    this.maxColspan = builder.maxColspan;
    this.maxColumns = builder.maxColumns;
  }

  /** Number of leading rows searched for a financial period header. */
  public int getPeriodHeaderScanRows() {
    return periodHeaderScanRows;
  }

  /** Number of leading rows searched for a lone {@code $} cell. */
  public int getDollarHeaderScanRows() {
    return dollarHeaderScanRows;
  }

  /** Number of data rows inspected when checking header misalignment. */
  public int getMisalignmentDataRows() {
    return misalignmentDataRows;
  }

  public boolean isRepairMisalignment() {
    return repairMisalignment;
  }

  /** Whether {@code (600)} is rewritten as {@code -600} outside the label column. */
  public boolean isFormatNegatives() {
    return formatNegatives;
  }

  /** Largest {@code colspan} honoured on a cell; larger values are clamped. */
  public int getMaxColspan() {
    return maxColspan;
  }

  /** Widest virtual grid a table may expand to; wider tables are not processed. */
  public int getMaxColumns() {
    return maxColumns;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static TableConfig defaults() {
    return new Builder().build();
  }

  /**
   * Creates a TableConfig from a YAML/JSON map.
   *
   * @param map configuration map, may be null
   * @return the configuration; defaults for absent keys
   */
  public static TableConfig fromMap(@Nullable Map<String, Object> map) {
    if (map == null) {
      return defaults();
    }
    Builder d = new Builder();
    return builder()
        .periodHeaderScanRows(
            ConfigValues.intValue(map, "periodHeaderScanRows", d.periodHeaderScanRows))
        .dollarHeaderScanRows(
            ConfigValues.intValue(map, "dollarHeaderScanRows", d.dollarHeaderScanRows))
        .misalignmentDataRows(
            ConfigValues.intValue(map, "misalignmentDataRows", d.misalignmentDataRows))
        .repairMisalignment(
            ConfigValues.booleanValue(map, "repairMisalignment", d.repairMisalignment))
        .formatNegatives(
            ConfigValues.booleanValue(map, "formatNegatives", d.formatNegatives))
        .maxColspan(ConfigValues.intValue(map, "maxColspan", d.maxColspan))
        .maxColumns(ConfigValues.intValue(map, "maxColumns", d.maxColumns))
        .build();
  }

  @Override public String toString() {
    return "TableConfig{periodHeaderScanRows=" + periodHeaderScanRows
        + ", dollarHeaderScanRows=" + dollarHeaderScanRows
        + ", misalignmentDataRows=" + misalignmentDataRows
        + ", repairMisalignment=" + repairMisalignment
        + ", formatNegatives=" + formatNegatives
        + ", maxColspan=" + maxColspan
        + ", maxColumns=" + maxColumns
        + "}";
  }

  /**
   * Builder for {@link TableConfig}.
   */
  public static class Builder {
    private int periodHeaderScanRows = 3;
    private int dollarHeaderScanRows = 4;
    private int misalignmentDataRows = 3;
    private boolean repairMisalignment = true;
    private boolean formatNegatives = true;
    private int maxColspan = 1000;
    private int maxColumns = 1000;

    public Builder periodHeaderScanRows(int periodHeaderScanRows) {
      this.periodHeaderScanRows = periodHeaderScanRows;
      return this;
    }

    public Builder dollarHeaderScanRows(int dollarHeaderScanRows) {
      this.dollarHeaderScanRows = dollarHeaderScanRows;
      return this;
    }

    public Builder misalignmentDataRows(int misalignmentDataRows) {
      this.misalignmentDataRows = misalignmentDataRows;
      return this;
    }

    public Builder repairMisalignment(boolean repairMisalignment) {
      this.repairMisalignment = repairMisalignment;
      return this;
    }

    public Builder formatNegatives(boolean formatNegatives) {
      this.formatNegatives = formatNegatives;
      return this;
    }

    public Builder maxColspan(int maxColspan) {
      this.maxColspan = maxColspan;
      return this;
    }

    public Builder maxColumns(int maxColumns) {
      this.maxColumns = maxColumns;
      return this;
    }

    public TableConfig build() {
      Preconditions.checkArgument(maxColspan > 0, "maxColspan must be positive: %s", maxColspan);
      Preconditions.checkArgument(maxColumns > 0, "maxColumns must be positive: %s", maxColumns);
      return new TableConfig(this);
    }
  }
}
