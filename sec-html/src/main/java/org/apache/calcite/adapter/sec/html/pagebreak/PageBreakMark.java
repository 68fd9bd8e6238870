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

import org.apache.calcite.adapter.sec.html.node.PageBreakSource;

import java.util.Objects;

/**
 * Marks an element as a page boundary.
 */
public final class PageBreakMark {

  /** Where the boundary lies relative to the element's content. */
  public enum Placement {
    BEFORE,
    AFTER
  }

  private final PageBreakSource source;
  private final Placement placement;

  public PageBreakMark(PageBreakSource source, Placement placement) {
    this.source = Objects.requireNonNull(source, "source");
    this.placement = Objects.requireNonNull(placement, "placement");
  }

  public PageBreakSource getSource() {
    return source;
  }

  public Placement getPlacement() {
    return placement;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PageBreakMark)) {
      return false;
    }
    PageBreakMark that = (PageBreakMark) o;
    return source == that.source && placement == that.placement;
  }

  @Override public int hashCode() {
    return Objects.hash(source, placement);
  }

  @Override public String toString() {
    return source + "/" + placement;
  }
}
