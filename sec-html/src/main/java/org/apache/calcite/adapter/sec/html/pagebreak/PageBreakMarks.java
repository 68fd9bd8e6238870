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
package org.apache.calcite.adapter.sec.html.pagebreak;

import org.apache.calcite.adapter.sec.html.dom.HtmlNode;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/**
 * The elements of one parse tree that mark page boundaries.
 *
 * <p>Marks are kept beside the tree rather than in it, so detection never
 * changes the tree that is later walked.
 */
public final class PageBreakMarks {
  private static final PageBreakMarks NONE = new PageBreakMarks(ImmutableMap.of());

  private final ImmutableMap<HtmlNode, PageBreakMark> marks;

  PageBreakMarks(Map<HtmlNode, PageBreakMark> marks) {
    this.marks = ImmutableMap.copyOf(marks);
  }

  /** Returns an empty set of marks, used when page tracking is off. */
  public static PageBreakMarks none() {
    return NONE;
  }

  public @Nullable PageBreakMark get(HtmlNode element) {
    return marks.get(element);
  }

  public boolean isMarked(HtmlNode element) {
    return marks.containsKey(element);
  }

  public int size() {
    return marks.size();
  }

  public boolean isEmpty() {
    return marks.isEmpty();
  }
}
