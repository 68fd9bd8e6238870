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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;

/**
 * Horizontal alignment of a table cell or column.
 */
public enum Alignment {
  LEFT,
  CENTER,
  RIGHT;

  /**
   * Maps a CSS {@code text-align} value to an alignment.
   *
   * @return the alignment, or null for absent or unsupported values
   */
  public static @Nullable Alignment fromTextAlign(@Nullable String textAlign) {
    if (textAlign == null) {
      return null;
    }
    switch (textAlign.trim().toLowerCase(Locale.ROOT)) {
      case "left":
      case "start":
      case "justify":
        return LEFT;
      case "center":
        return CENTER;
      case "right":
      case "end":
        return RIGHT;
      default:
        return null;
    }
  }
}
