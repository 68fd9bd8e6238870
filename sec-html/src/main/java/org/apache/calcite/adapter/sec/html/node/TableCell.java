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

import com.google.common.base.Preconditions;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * A cell of a raw table as it appears in the markup.
 *
 * <p>When the cell holds a nested table, {@link #getNestedTable()} returns it
 * and {@link #getText()} holds its flat rendering.
 */
public final class TableCell {
  private final String text;
  private final int colspan;
  private final @Nullable Alignment alignment;
  private final @Nullable TableNode nestedTable;

  public TableCell(String text, int colspan, @Nullable Alignment alignment,
      @Nullable TableNode nestedTable) {
    Preconditions.checkArgument(colspan >= 1, "colspan must be positive: %s", colspan);
    this.text = Objects.requireNonNull(text, "text");
    this.colspan = colspan;
    this.alignment = alignment;
    this.nestedTable = nestedTable;
  }

  /** Creates a plain text cell with no alignment hint. */
  public static TableCell of(String text, int colspan) {
    return new TableCell(text, colspan, null, null);
  }

  public String getText() {
    return text;
  }

  public int getColspan() {
    return colspan;
  }

  /** Returns the alignment declared on the cell, or null if none. */
  public @Nullable Alignment getAlignment() {
    return alignment;
  }

  public @Nullable TableNode getNestedTable() {
    return nestedTable;
  }

  @Override public String toString() {
    return colspan == 1 ? text : text + "(colspan=" + colspan + ")";
  }
}
