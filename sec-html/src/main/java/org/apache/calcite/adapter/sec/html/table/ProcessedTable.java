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
import org.apache.calcite.adapter.sec.html.node.DocumentStructureException;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * A table reduced to a rectangular grid: an optional header, data rows and
 * one alignment per column.
 *
 * <p>Every row, the header included, has {@link #getColumnCount()} cells.
 */
public final class ProcessedTable {
  private final @Nullable ImmutableList<String> header;
  private final ImmutableList<ImmutableList<String>> dataRows;
  private final ImmutableList<Alignment> alignments;

  /**
   * Creates a processed table.
   *
   * @throws DocumentStructureException if the rows, header and alignments do
   *     not all have the same width
   */
  public ProcessedTable(@Nullable List<String> header, List<? extends List<String>> dataRows,
      List<Alignment> alignments) {
    this.header = header == null ? null : ImmutableList.copyOf(header);
    ImmutableList.Builder<ImmutableList<String>> rows = ImmutableList.builder();
    for (List<String> row : dataRows) {
      rows.add(ImmutableList.copyOf(row));
    }
    this.dataRows = rows.build();
    this.alignments = ImmutableList.copyOf(alignments);
    checkRectangular();
  }

  private void checkRectangular() {
    int width = alignments.size();
    if (header != null && header.size() != width) {
      throw new DocumentStructureException("Header has " + header.size()
          + " cells but table has " + width + " columns");
    }
    for (int i = 0; i < dataRows.size(); i++) {
      if (dataRows.get(i).size() != width) {
        throw new DocumentStructureException("Row " + i + " has " + dataRows.get(i).size()
            + " cells but table has " + width + " columns");
      }
    }
  }

  /** Returns the merged header, or null if the table has none. */
  public @Nullable ImmutableList<String> getHeader() {
    return header;
  }

  public boolean hasHeader() {
    return header != null;
  }

  public ImmutableList<ImmutableList<String>> getDataRows() {
    return dataRows;
  }

  public ImmutableList<Alignment> getAlignments() {
    return alignments;
  }

  public int getColumnCount() {
    return alignments.size();
  }

  @Override public String toString() {
    return "ProcessedTable{header=" + header + ", rows=" + dataRows.size()
        + ", alignments=" + alignments + "}";
  }
}
