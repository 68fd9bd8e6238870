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
import java.util.Map;

/**
 * A table exactly as found in the markup: ragged rows of cells with column
 * spans. Pass it to the table processor for a rectangular view.
 */
public final class TableNode extends Node {
  private final ImmutableList<TableRow> rows;

  public TableNode(List<TableRow> rows, Map<String, String> annotations) {
    super(annotations);
    this.rows = ImmutableList.copyOf(rows);
  }

  @Override public NodeType getType() {
    return NodeType.TABLE;
  }

  @Override public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitTable(this);
  }

  public ImmutableList<TableRow> getRows() {
    return rows;
  }

  /**
   * Renders the table as plain text, one line per row with cells separated by
   * {@code " | "}. Used as the content of a cell that holds this table.
   */
  public String toFlatText() {
    StringBuilder sb = new StringBuilder();
    for (TableRow row : rows) {
      StringBuilder line = new StringBuilder();
      for (TableCell cell : row.getCells()) {
        String text = cell.getText().replace('\n', ' ').trim();
        if (text.isEmpty()) {
          continue;
        }
        if (line.length() > 0) {
          line.append(" | ");
        }
        line.append(text);
      }
      if (line.length() == 0) {
        continue;
      }
      if (sb.length() > 0) {
        sb.append('\n');
      }
      sb.append(line);
    }
    return sb.toString();
  }

  @Override public String toString() {
    return "Table(" + rows.size() + " rows)";
  }
}
