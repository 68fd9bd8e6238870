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

import org.apache.calcite.adapter.sec.html.style.StyleInfo;

import com.google.common.base.Preconditions;

import java.util.Map;
import java.util.Objects;

/**
 * A heading with a level from 1 (a Part) to 4 (a minor bold caption).
 */
public final class HeadingNode extends Node {
  private final String text;
  private final StyleInfo style;
  private final int level;

  public HeadingNode(String text, StyleInfo style, int level,
      Map<String, String> annotations) {
    super(annotations);
    Preconditions.checkArgument(level >= 1 && level <= 4,
        "heading level must be between 1 and 4: %s", level);
    this.text = Objects.requireNonNull(text, "text");
    this.style = Objects.requireNonNull(style, "style");
    this.level = level;
  }

  @Override public NodeType getType() {
    return NodeType.HEADING;
  }

  @Override public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitHeading(this);
  }

  public String getText() {
    return text;
  }

  public StyleInfo getStyle() {
    return style;
  }

  public int getLevel() {
    return level;
  }

  @Override public String toString() {
    return "Heading(" + level + ", " + text + ")";
  }
}
