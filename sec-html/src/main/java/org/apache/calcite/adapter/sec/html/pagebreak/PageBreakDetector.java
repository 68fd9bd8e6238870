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
import org.apache.calcite.adapter.sec.html.node.PageBreakSource;
import org.apache.calcite.adapter.sec.html.style.StyleParser;
import org.apache.calcite.adapter.sec.html.style.StyleUnit;
import org.apache.calcite.adapter.sec.html.style.UnitType;

import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Finds the elements of a parse tree that represent page boundaries.
 *
 * <p>Four independent signals are recognised, strongest first:
 * <ol>
 *   <li>{@code page-break-before:always} or {@code page-break-after:always}
 *       (or the newer {@code break-before:page}) on a block element;</li>
 *   <li>a known page-break class name;</li>
 *   <li>a thin styled {@code <hr>}, as emitted by several filing agents
 *       between pages;</li>
 *   <li>a {@code <div>} sized like a physical page and positioned or clipped
 *       as one.</li>
 * </ol>
 *
 * <p>Detection only reads the tree. The result is a {@link PageBreakMarks}
 * lookup; running it twice on the same tree gives the same marks.
 */
public class PageBreakDetector {
  private static final Logger LOGGER = LoggerFactory.getLogger(PageBreakDetector.class);

  private static final Set<String> BLOCK_TAGS = ImmutableSet.of(
      "p", "div", "hr", "br", "span", "section", "article", "center", "table",
      "h1", "h2", "h3", "h4", "h5", "h6", "li", "ul", "ol", "font");

  private static final Set<String> SKIPPED_TAGS =
      ImmutableSet.of("head", "script", "style", "title");

  private final PageBreakConfig config;
  private final Set<String> classNames;

  public PageBreakDetector(PageBreakConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    for (String name : config.getClassNames()) {
      names.add(name.toLowerCase(Locale.ROOT));
    }
    this.classNames = names.build();
  }

  public PageBreakDetector() {
    this(PageBreakConfig.defaults());
  }

  /**
   * Scans the subtree rooted at {@code root}.
   *
   * @return the marked elements
   */
  public PageBreakMarks detect(HtmlNode root) {
    Map<HtmlNode, PageBreakMark> marks = new LinkedHashMap<>();
    Deque<HtmlNode> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      HtmlNode node = stack.pop();
      if (!node.isElement() || SKIPPED_TAGS.contains(node.tagName())) {
        continue;
      }
      PageBreakMark mark = mark(node);
      if (mark != null) {
        marks.put(node, mark);
      }
      List<HtmlNode> children = node.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
    LOGGER.debug("Detected {} page breaks", marks.size());
    return new PageBreakMarks(marks);
  }

  /**
   * Returns the page-break mark for a single element.
   *
   * @return the mark, or null if the element is not a page boundary
   */
  public @Nullable PageBreakMark mark(HtmlNode element) {
    if (!element.isElement()) {
      return null;
    }
    String tag = element.tagName();
    Map<String, String> style = StyleParser.declarations(element.attr("style"));
    if (BLOCK_TAGS.contains(tag)) {
      PageBreakMark explicit = explicitBreak(style);
      if (explicit != null) {
        return explicit;
      }
    }
    if (hasBreakClass(element)) {
      return new PageBreakMark(PageBreakSource.CLASS_NAME, PageBreakMark.Placement.BEFORE);
    }
    if ("hr".equals(tag) && isRuleMarker(style)) {
      return new PageBreakMark(PageBreakSource.HORIZONTAL_RULE,
          PageBreakMark.Placement.BEFORE);
    }
    if ("div".equals(tag) && isPageDiv(style)) {
      return new PageBreakMark(PageBreakSource.PAGE_DIV, PageBreakMark.Placement.BEFORE);
    }
    return null;
  }

  private static @Nullable PageBreakMark explicitBreak(Map<String, String> style) {
    if ("always".equals(style.get("page-break-before"))
        || "page".equals(style.get("break-before"))) {
      return new PageBreakMark(PageBreakSource.EXPLICIT_STYLE,
          PageBreakMark.Placement.BEFORE);
    }
    if ("always".equals(style.get("page-break-after"))
        || "page".equals(style.get("break-after"))) {
      return new PageBreakMark(PageBreakSource.EXPLICIT_STYLE,
          PageBreakMark.Placement.AFTER);
    }
    return null;
  }

  private boolean hasBreakClass(HtmlNode element) {
    String classes = element.attr("class");
    if (classes == null || classes.trim().isEmpty()) {
      return false;
    }
    for (String name : classes.trim().split("\\s+")) {
      if (classNames.contains(name.toLowerCase(Locale.ROOT))) {
        return true;
      }
    }
    return false;
  }

  private boolean isRuleMarker(Map<String, String> style) {
    String height = style.get("height");
    if (height == null) {
      return false;
    }
    StyleUnit unit = StyleParser.parseLength(height);
    if (unit == null || unit.getUnit() == UnitType.PERCENT) {
      return false;
    }
    double pixels = unit.toInches() * 96.0;
    return Math.abs(pixels - config.getRuleHeightPixels())
        <= config.getRuleHeightTolerancePixels();
  }

  private boolean isPageDiv(Map<String, String> style) {
    String height = style.get("height");
    String width = style.get("width");
    if (height == null || width == null) {
      return false;
    }
    String position = style.get("position");
    boolean positioned = "relative".equals(position) || "absolute".equals(position);
    if (!positioned && !"hidden".equals(style.get("overflow"))) {
      return false;
    }
    return matches(StyleParser.parseLength(height), config.getPageHeightsPoints())
        && matches(StyleParser.parseLength(width), config.getPageWidthsPoints());
  }

  private boolean matches(@Nullable StyleUnit length, List<Double> candidates) {
    if (length == null || length.getUnit() == UnitType.PERCENT) {
      return false;
    }
    double points = length.toPoints();
    for (Double candidate : candidates) {
      if (Math.abs(points - candidate) <= config.getDimensionTolerancePoints()) {
        return true;
      }
    }
    return false;
  }
}
