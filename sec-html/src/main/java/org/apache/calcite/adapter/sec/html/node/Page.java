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
 * The nodes between one page break and the next.
 */
public final class Page {
  private final int pageNumber;
  private final PageBreakNode pageBreak;
  private final ImmutableList<Node> nodes;

  Page(PageBreakNode pageBreak, List<Node> nodes) {
    this.pageNumber = pageBreak.getPageNumber();
    this.pageBreak = pageBreak;
    this.nodes = ImmutableList.copyOf(nodes);
  }

  public int getPageNumber() {
    return pageNumber;
  }

  /** Returns the break that opens this page. */
  public PageBreakNode getPageBreak() {
    return pageBreak;
  }

  /** Returns the content nodes on this page, excluding the break itself. */
  public ImmutableList<Node> getNodes() {
    return nodes;
  }
}
