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
package org.apache.calcite.adapter.sec.html.node;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A row of a raw table.
 */
public final class TableRow {
  private final ImmutableList<TableCell> cells;

  public TableRow(List<TableCell> cells) {
    this.cells = ImmutableList.copyOf(cells);
  }

  public ImmutableList<TableCell> getCells() {
    return cells;
  }

  /**
   * Returns the number of virtual columns this row spans, saturating at
   * {@link Integer#MAX_VALUE}.
   */
  public int width() {
    long width = 0;
    for (TableCell cell : cells) {
      width += cell.getColspan();
    }
    return (int) Math.min(width, Integer.MAX_VALUE);
  }

  @Override public String toString() {
    return cells.toString();
  }
}
