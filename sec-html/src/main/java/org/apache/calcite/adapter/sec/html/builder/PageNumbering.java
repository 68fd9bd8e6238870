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

import org.apache.calcite.adapter.sec.html.node.Node;
import org.apache.calcite.adapter.sec.html.node.PageBreakNode;
import org.apache.calcite.adapter.sec.html.node.PageBreakSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Assigns page numbers to the page breaks of a finished node sequence.
 *
 * <p>Breaks with no content between them collapse into the first, a break
 * with no content after it is dropped, and a synthetic
 * {@link PageBreakSource#DOCUMENT_START} break is inserted when content
 * precedes the first break. Pages are then numbered from 0.
 */
final class PageNumbering {

  private PageNumbering() {
  }

  static List<Node> number(List<Node> nodes) {
    List<Node> cleaned = new ArrayList<>(nodes.size() + 1);
    boolean contentSinceBreak = false;
    boolean seenBreak = false;
    for (Node node : nodes) {
      if (PageBreakNode.from(node) != null) {
        if (seenBreak && !contentSinceBreak) {
          continue;
        }
        if (!seenBreak && !cleaned.isEmpty()) {
          cleaned.add(0, new PageBreakNode(0, PageBreakSource.DOCUMENT_START));
        }
        seenBreak = true;
        contentSinceBreak = false;
        cleaned.add(node);
      } else {
        contentSinceBreak = true;
        cleaned.add(node);
      }
    }
    if (seenBreak && !contentSinceBreak) {
      cleaned.remove(cleaned.size() - 1);
    }
    if (!seenBreak && !cleaned.isEmpty()) {
      cleaned.add(0, new PageBreakNode(0, PageBreakSource.DOCUMENT_START));
    }

    List<Node> numbered = new ArrayList<>(cleaned.size());
    int page = 0;
    for (Node node : cleaned) {
      PageBreakNode pageBreak = PageBreakNode.from(node);
      if (pageBreak != null) {
        numbered.add(new PageBreakNode(page++, pageBreak.getSource()));
      } else {
        numbered.add(node);
      }
    }
    return numbered;
  }
}
