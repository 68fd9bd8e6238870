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
import org.apache.calcite.adapter.sec.html.node.Alignment;
import org.apache.calcite.adapter.sec.html.node.TableCell;
import org.apache.calcite.adapter.sec.html.node.TableNode;
import org.apache.calcite.adapter.sec.html.node.TableRow;
import org.apache.calcite.adapter.sec.html.style.StyleResolver;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads the rows and cells of a {@code <table>} element.
 *
 * <p>Rows are the {@code <tr>} children of the table and of its
 * {@code <thead>}, {@code <tbody>} and {@code <tfoot>} sections; cells are
 * their {@code <td>} and {@code <th>} children. A table nested in a cell is
 * extracted as well and its flat text becomes part of the cell text.
 */
final class TableRowExtractor {
  private static final Logger LOGGER = LoggerFactory.getLogger(TableRowExtractor.class);

  private static final Pattern DIGITS = Pattern.compile("\\+?\\d+");

  private TableRowExtractor() {
  }

  /**
   * Extracts a table.
   *
   * @param table the {@code <table>} element
   * @param annotations annotation context of the table
   * @param maxColspan largest column span kept; larger spans are clamped
   * @return the table, or null if it has no cells
   */
  static @Nullable TableNode extract(HtmlNode table, Map<String, String> annotations,
      int maxColspan) {
    List<TableRow> rows = new ArrayList<>();
    for (HtmlNode row : rowElements(table)) {
      List<TableCell> cells = new ArrayList<>();
      for (HtmlNode cell : row.children()) {
        if (cell.isElement() && ("td".equals(cell.tagName()) || "th".equals(cell.tagName()))
            && !ElementKinds.isHidden(cell)) {
          cells.add(extractCell(cell, maxColspan));
        }
      }
      if (!cells.isEmpty()) {
        rows.add(new TableRow(cells));
      }
    }
    if (rows.isEmpty()) {
      return null;
    }
    return new TableNode(rows, annotations);
  }

  private static List<HtmlNode> rowElements(HtmlNode table) {
    List<HtmlNode> rows = new ArrayList<>();
    for (HtmlNode child : table.children()) {
      if (!child.isElement() || ElementKinds.isHidden(child)) {
        continue;
      }
      switch (child.tagName()) {
        case "tr":
          rows.add(child);
          break;
        case "thead":
        case "tbody":
        case "tfoot":
          for (HtmlNode row : child.children()) {
            if (row.isElement() && "tr".equals(row.tagName()) && !ElementKinds.isHidden(row)) {
              rows.add(row);
            }
          }
          break;
        default:
          break;
      }
    }
    return rows;
  }

  private static TableCell extractCell(HtmlNode cell, int maxColspan) {
    int colspan = colspan(cell, maxColspan);
    Alignment alignment = Alignment.fromTextAlign(StyleResolver.ownStyle(cell).getTextAlign());
    HtmlNode nested = firstNestedTable(cell);
    String text = TextCleaner.clean(TextCollector.collect(cell, false));
    TableNode nestedTable = null;
    if (nested != null) {
      nestedTable = extract(nested, ImmutableMap.of(), maxColspan);
      if (nestedTable != null) {
        String flat = nestedTable.toFlatText();
        text = text.isEmpty() ? flat : text + "\n" + flat;
      }
    }
    return new TableCell(text, colspan, alignment, nestedTable);
  }

  private static int colspan(HtmlNode cell, int maxColspan) {
    String value = cell.attr("colspan");
    if (value == null || value.trim().isEmpty()) {
      return 1;
    }
    try {
      int colspan = Integer.parseInt(value.trim());
      if (colspan > maxColspan) {
        LOGGER.warn("Colspan {} exceeds {}, clamping", colspan, maxColspan);
        return maxColspan;
      }
      return colspan >= 1 ? colspan : 1;
    } catch (NumberFormatException e) {
      if (DIGITS.matcher(value.trim()).matches()) {
        LOGGER.warn("Colspan {} exceeds {}, clamping", value.trim(), maxColspan);
        return maxColspan;
      }
      LOGGER.warn("Unparseable colspan '{}', using 1", value);
      return 1;
    }
  }

  private static @Nullable HtmlNode firstNestedTable(HtmlNode cell) {
    Deque<HtmlNode> stack = new ArrayDeque<>(cell.children());
    while (!stack.isEmpty()) {
      HtmlNode node = stack.pollFirst();
      if (!node.isElement()) {
        continue;
      }
      if (ElementKinds.isTable(node)) {
        return node;
      }
      List<HtmlNode> children = node.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.addFirst(children.get(i));
      }
    }
    return null;
  }
}
