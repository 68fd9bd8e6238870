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
package org.apache.calcite.adapter.sec.html;

import org.apache.calcite.adapter.sec.html.heading.HeadingConfig;
import org.apache.calcite.adapter.sec.html.pagebreak.PageBreakConfig;
import org.apache.calcite.adapter.sec.html.table.ColumnWidthConfig;
import org.apache.calcite.adapter.sec.html.table.TableConfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.base.Preconditions;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for {@link SecHtmlParser}.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * includePageBreaks: true
 * maxNestingDepth: 512
 * heading:
 *   maxLength: 100
 * pageBreak:
 *   classNames: [BRPFPageBreak, pagebreak]
 * table:
 *   repairMisalignment: true
 * columnWidth:
 *   totalWidth: 120
 * }</pre>
 */
public class ParserConfig {

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  private final boolean includePageBreaks;
  private final int maxNestingDepth;
  private final HeadingConfig headingConfig;
  private final PageBreakConfig pageBreakConfig;
  private final TableConfig tableConfig;
  private final ColumnWidthConfig columnWidthConfig;

  private ParserConfig(Builder builder) {
    Preconditions.checkArgument(builder.maxNestingDepth > 0,
        "maxNestingDepth must be positive: %s", builder.maxNestingDepth);
    this.includePageBreaks = builder.includePageBreaks;
    this.maxNestingDepth = builder.maxNestingDepth;
    this.headingConfig = builder.headingConfig;
    this.pageBreakConfig = builder.pageBreakConfig;
    this.tableConfig = builder.tableConfig;
    this.columnWidthConfig = builder.columnWidthConfig;
  }

  /** Whether page breaks are detected and emitted as nodes. */
  public boolean isIncludePageBreaks() {
    return includePageBreaks;
  }

  /** Elements nested deeper than this are flattened to plain text. */
  public int getMaxNestingDepth() {
    return maxNestingDepth;
  }

  public HeadingConfig getHeadingConfig() {
    return headingConfig;
  }

  public PageBreakConfig getPageBreakConfig() {
    return pageBreakConfig;
  }

  public TableConfig getTableConfig() {
    return tableConfig;
  }

  public ColumnWidthConfig getColumnWidthConfig() {
    return columnWidthConfig;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static ParserConfig defaults() {
    return new Builder().build();
  }

  /**
   * Creates a ParserConfig from a YAML/JSON map.
   *
   * @param map configuration map, may be null
   * @return the configuration; defaults for absent keys
   */
  public static ParserConfig fromMap(@Nullable Map<String, Object> map) {
    if (map == null) {
      return defaults();
    }
    Builder d = new Builder();
    return builder()
        .includePageBreaks(
            ConfigValues.booleanValue(map, "includePageBreaks", d.includePageBreaks))
        .maxNestingDepth(ConfigValues.intValue(map, "maxNestingDepth", d.maxNestingDepth))
        .headingConfig(HeadingConfig.fromMap(ConfigValues.section(map, "heading")))
        .pageBreakConfig(PageBreakConfig.fromMap(ConfigValues.section(map, "pageBreak")))
        .tableConfig(TableConfig.fromMap(ConfigValues.section(map, "table")))
        .columnWidthConfig(
            ColumnWidthConfig.fromMap(ConfigValues.section(map, "columnWidth")))
        .build();
  }

  /**
   * Reads a ParserConfig from a YAML document.
   *
   * @param in YAML input; not closed
   * @throws IOException if the YAML cannot be read
   */
  @SuppressWarnings("unchecked")
  public static ParserConfig fromYaml(InputStream in) throws IOException {
    Map<String, Object> map = YAML_MAPPER.readValue(in, Map.class);
    return fromMap(map);
  }

  @Override public String toString() {
    return "ParserConfig{includePageBreaks=" + includePageBreaks
        + ", maxNestingDepth=" + maxNestingDepth
        + ", heading=" + headingConfig
        + ", pageBreak=" + pageBreakConfig
        + ", table=" + tableConfig
        + ", columnWidth=" + columnWidthConfig
        + "}";
  }

  /**
   * Builder for {@link ParserConfig}.
   */
  public static class Builder {
    private boolean includePageBreaks = false;
    private int maxNestingDepth = 512;
    private HeadingConfig headingConfig = HeadingConfig.defaults();
    private PageBreakConfig pageBreakConfig = PageBreakConfig.defaults();
    private TableConfig tableConfig = TableConfig.defaults();
    private ColumnWidthConfig columnWidthConfig = ColumnWidthConfig.defaults();

    public Builder includePageBreaks(boolean includePageBreaks) {
      this.includePageBreaks = includePageBreaks;
      return this;
    }

    public Builder maxNestingDepth(int maxNestingDepth) {
      this.maxNestingDepth = maxNestingDepth;
      return this;
    }

    public Builder headingConfig(HeadingConfig headingConfig) {
      this.headingConfig = Objects.requireNonNull(headingConfig, "headingConfig");
      return this;
    }

    public Builder pageBreakConfig(PageBreakConfig pageBreakConfig) {
      this.pageBreakConfig = Objects.requireNonNull(pageBreakConfig, "pageBreakConfig");
      return this;
    }

    public Builder tableConfig(TableConfig tableConfig) {
      this.tableConfig = Objects.requireNonNull(tableConfig, "tableConfig");
      return this;
    }

    public Builder columnWidthConfig(ColumnWidthConfig columnWidthConfig) {
      this.columnWidthConfig = Objects.requireNonNull(columnWidthConfig, "columnWidthConfig");
      return this;
    }

    public ParserConfig build() {
      return new ParserConfig(this);
    }
  }
}
