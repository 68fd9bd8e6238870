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

import java.util.ArrayList;
import java.util.List;

/**
 * The structure inferred from one filing document: an ordered, immutable
 * sequence of nodes.
 *
 * <p>Consumers read it through {@link #nodes()}, {@link #headings()} and
 * {@link #tables()}, or group it with {@link #pages()} when page breaks were
 * detected.
 */
public final class Document {
  private final ImmutableList<Node> nodes;

  public Document(List<Node> nodes) {
    this.nodes = ImmutableList.copyOf(nodes);
  }

  /** Returns every node in document order. */
  public ImmutableList<Node> nodes() {
    return nodes;
  }

  /** Returns the headings in document order. */
  public ImmutableList<HeadingNode> headings() {
    return ofClass(HeadingNode.class);
  }

  /** Returns the tables in document order. */
  public ImmutableList<TableNode> tables() {
    return ofClass(TableNode.class);
  }

  /** Returns the nodes of one kind in document order. */
  public ImmutableList<Node> nodesOfType(NodeType type) {
    ImmutableList.Builder<Node> builder = ImmutableList.builder();
    for (Node node : nodes) {
      if (node.getType() == type) {
        builder.add(node);
      }
    }
    return builder.build();
  }

  /**
   * Groups the nodes into pages. Nodes are assigned to the most recent page
   * break; nodes before the first break (only possible when page tracking was
   * off) belong to no page and are not returned.
   *
   * @return the pages in order, empty when the document has no page breaks
   */
  public ImmutableList<Page> pages() {
    ImmutableList.Builder<Page> pages = ImmutableList.builder();
    PageBreakNode current = null;
    List<Node> content = new ArrayList<>();
    for (Node node : nodes) {
      PageBreakNode pageBreak = PageBreakNode.from(node);
      if (pageBreak != null) {
        if (current != null) {
          pages.add(new Page(current, content));
        }
        current = pageBreak;
        content = new ArrayList<>();
      } else if (current != null) {
        content.add(node);
      }
    }
    if (current != null) {
      pages.add(new Page(current, content));
    }
    return pages.build();
  }

  public int size() {
    return nodes.size();
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  private <T extends Node> ImmutableList<T> ofClass(Class<T> clazz) {
    ImmutableList.Builder<T> builder = ImmutableList.builder();
    for (Node node : nodes) {
      if (clazz.isInstance(node)) {
        builder.add(clazz.cast(node));
      }
    }
    return builder.build();
  }

  @Override public String toString() {
    return "Document" + nodes;
  }
}
