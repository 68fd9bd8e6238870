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

import java.util.Locale;

/**
 * The closed set of node kinds a {@link Document} is made of.
 */
public enum NodeType {
  HEADING("heading"),
  TEXT_BLOCK("text_block"),
  TABLE("table"),
  PAGE_BREAK("page_break");

  private final String kind;

  NodeType(String kind) {
    this.kind = kind;
  }

  /** Returns the lower-case name of this kind, e.g. {@code text_block}. */
  public String kind() {
    return kind;
  }

  /**
   * Looks up a node kind by name. Hyphens and case are ignored, so
   * {@code "text-block"} and {@code "TEXT_BLOCK"} both resolve.
   *
   * @throws DocumentStructureException if the name is not a known kind
   */
  public static NodeType of(String name) {
    String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    for (NodeType type : values()) {
      if (type.kind.equals(normalized)) {
        return type;
      }
    }
    throw new DocumentStructureException("Unknown node kind: " + name);
  }
}
