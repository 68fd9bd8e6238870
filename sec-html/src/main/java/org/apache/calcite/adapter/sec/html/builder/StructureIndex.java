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
package org.apache.calcite.adapter.sec.html.builder;

import org.apache.calcite.adapter.sec.html.dom.HtmlNode;
import org.apache.calcite.adapter.sec.html.pagebreak.PageBreakMarks;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Remembers which elements must be walked structurally rather than flattened
 * into inline text: block elements, tables, page-break marks, and any element
 * with one of those in its subtree. Also remembers which elements hold a
 * table or a page-break mark anywhere in their subtree.
 *
 * <p>Computed once per document in a single post-order pass without
 * recursion.
 */
final class StructureIndex {
  private final Set<HtmlNode> structural = new HashSet<>();
  private final Set<HtmlNode> tableOrBreak = new HashSet<>();

  private StructureIndex() {
  }

  static StructureIndex build(HtmlNode root, PageBreakMarks marks) {
    StructureIndex index = new StructureIndex();
    // Pairs of (node, expanded) emulate post-order recursion
    Deque<HtmlNode> nodes = new ArrayDeque<>();
    Deque<Boolean> expanded = new ArrayDeque<>();
    nodes.push(root);
    expanded.push(Boolean.FALSE);
    while (!nodes.isEmpty()) {
      HtmlNode node = nodes.pop();
      boolean done = expanded.pop();
      if (!node.isElement() || ElementKinds.isSkipped(node)) {
        continue;
      }
      List<HtmlNode> children = node.children();
      if (!done) {
        nodes.push(node);
        expanded.push(Boolean.TRUE);
        for (HtmlNode child : children) {
          nodes.push(child);
          expanded.push(Boolean.FALSE);
        }
        continue;
      }
      boolean result = ElementKinds.isBlock(node) || marks.isMarked(node);
      boolean opaque = ElementKinds.isTable(node) || marks.isMarked(node);
      for (HtmlNode child : children) {
        result |= index.structural.contains(child);
        opaque |= index.tableOrBreak.contains(child);
      }
      if (result) {
        index.structural.add(node);
      }
      if (opaque) {
        index.tableOrBreak.add(node);
      }
    }
    return index;
  }

  /** Returns whether an element must be walked rather than flattened. */
  boolean isStructural(HtmlNode node) {
    return structural.contains(node);
  }

  /** Returns whether an element is, or contains, a table or a page-break mark. */
  boolean containsTableOrBreak(HtmlNode node) {
    return tableOrBreak.contains(node);
  }

  /** Returns whether any child of an element is structural. */
  boolean hasStructuralChild(HtmlNode node) {
    for (HtmlNode child : node.children()) {
      if (structural.contains(child)) {
        return true;
      }
    }
    return false;
  }
}
