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
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * A page boundary. The page number is that of the page this break opens.
 */
public final class PageBreakNode extends Node {
  private static final NodeVisitor<@Nullable PageBreakNode> AS_PAGE_BREAK =
      new NodeVisitor<@Nullable PageBreakNode>() {
        @Override public @Nullable PageBreakNode visitHeading(HeadingNode heading) {
          return null;
        }

        @Override public @Nullable PageBreakNode visitTextBlock(TextBlockNode textBlock) {
          return null;
        }

        @Override public @Nullable PageBreakNode visitTable(TableNode table) {
          return null;
        }

        @Override public @Nullable PageBreakNode visitPageBreak(PageBreakNode pageBreak) {
          return pageBreak;
        }
      };

  private final int pageNumber;
  private final PageBreakSource source;

  public PageBreakNode(int pageNumber, PageBreakSource source) {
    super(ImmutableMap.of());
    Preconditions.checkArgument(pageNumber >= 0, "negative page number: %s", pageNumber);
    this.pageNumber = pageNumber;
    this.source = Objects.requireNonNull(source, "source");
  }

  @Override public NodeType getType() {
    return NodeType.PAGE_BREAK;
  }

  @Override public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitPageBreak(this);
  }

  /** Returns the node as a page break, or null if it is another kind. */
  public static @Nullable PageBreakNode from(Node node) {
    return node.accept(AS_PAGE_BREAK);
  }

  public int getPageNumber() {
    return pageNumber;
  }

  public PageBreakSource getSource() {
    return source;
  }

  @Override public String toString() {
    return "PageBreak(" + pageNumber + ", " + source + ")";
  }
}
