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
package org.apache.calcite.adapter.sec.html;

import org.apache.calcite.adapter.sec.html.builder.DocumentBuilder;
import org.apache.calcite.adapter.sec.html.dom.HtmlNode;
import org.apache.calcite.adapter.sec.html.dom.JsoupHtmlNode;
import org.apache.calcite.adapter.sec.html.node.Document;
import org.apache.calcite.adapter.sec.html.node.TableNode;
import org.apache.calcite.adapter.sec.html.table.ColumnWidthOptimizer;
import org.apache.calcite.adapter.sec.html.table.ProcessedTable;
import org.apache.calcite.adapter.sec.html.table.TableProcessor;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for structural inference over SEC filing HTML.
 *
 * <p>Turns the {@code <body>} of a 10-K, 10-Q or 8-K document into a
 * {@link Document}: an ordered sequence of headings, text blocks, tables
 * and, optionally, page breaks.
 *
 * <pre>{@code
 * SecHtmlParser parser = new SecHtmlParser(
 *     ParserConfig.builder().includePageBreaks(true).build());
 * Document doc = parser.parse(html);
 * if (doc != null) {
 *   for (TableNode table : doc.tables()) {
 *     ProcessedTable processed = parser.processTable(table);
 *   }
 * }
 * }</pre>
 *
 * <p>Tables stay raw in the document; {@link #processTable(TableNode)} and
 * {@link #layoutTable(ProcessedTable)} are separate steps the caller runs
 * for the tables it needs. A parser holds no per-document state and may be
 * used from several threads.
 */
public class SecHtmlParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(SecHtmlParser.class);

  private final ParserConfig config;
  private final DocumentBuilder builder;
  private final TableProcessor tableProcessor;
  private final ColumnWidthOptimizer widthOptimizer;

  public SecHtmlParser(ParserConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    this.builder = new DocumentBuilder(config);
    this.tableProcessor = new TableProcessor(config.getTableConfig());
    this.widthOptimizer = new ColumnWidthOptimizer(config.getColumnWidthConfig());
  }

  /** Creates a parser with default configuration. */
  public static SecHtmlParser defaults() {
    return new SecHtmlParser(ParserConfig.defaults());
  }

  public ParserConfig getConfig() {
    return config;
  }

  /**
   * Parses raw HTML with jsoup and builds its document.
   *
   * @return the document, or null if the HTML has no body
   */
  public @Nullable Document parse(String html) {
    return parse(JsoupHtmlNode.parse(html));
  }

  /**
   * Builds the document for an already parsed tree. The tree may be the body
   * itself or any ancestor of it.
   *
   * @return the document, or null if there is no {@code <body>} element
   */
  public @Nullable Document parse(HtmlNode root) {
    HtmlNode body = findBody(root);
    if (body == null) {
      LOGGER.warn("No <body> element found under <{}>; skipping document", root.tagName());
      return null;
    }
    return builder.build(body);
  }

  /**
   * Runs the structural processing of one table.
   *
   * @return the processed table, or null if no rows survive
   */
  public @Nullable ProcessedTable processTable(TableNode table) {
    return tableProcessor.process(table);
  }

  /** Fits a processed table into the configured character width. */
  public ProcessedTable layoutTable(ProcessedTable table) {
    return widthOptimizer.optimize(table);
  }

  static @Nullable HtmlNode findBody(HtmlNode root) {
    Deque<HtmlNode> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      HtmlNode node = stack.pop();
      if (!node.isElement()) {
        continue;
      }
      if ("body".equals(node.tagName())) {
        return node;
      }
      List<HtmlNode> children = node.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
    return null;
  }
}
