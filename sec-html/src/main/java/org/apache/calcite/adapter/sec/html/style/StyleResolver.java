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
package org.apache.calcite.adapter.sec.html.style;

import org.apache.calcite.adapter.sec.html.dom.HtmlNode;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;

/**
 * Resolves the effective style of an element.
 *
 * <p>An element's own style combines the visual meaning of its tag
 * ({@code <b>}, {@code <u>}, {@code <center>}, {@code <font size>}, the legacy
 * {@code align} attribute) with its inline {@code style} attribute, which wins
 * on conflict. The own style is then cascaded over the inherited style.
 */
public final class StyleResolver {

  // HTML font size attribute 1..7 in points
  private static final ImmutableMap<String, Double> FONT_SIZE_POINTS =
      ImmutableMap.<String, Double>builder()
          .put("1", 7.5)
          .put("2", 10.0)
          .put("3", 12.0)
          .put("4", 13.5)
          .put("5", 18.0)
          .put("6", 24.0)
          .put("7", 36.0)
          .build();

  private StyleResolver() {
  }

  /**
   * Returns the style an element declares itself, ignoring inheritance.
   */
  public static StyleInfo ownStyle(HtmlNode element) {
    if (!element.isElement()) {
      return StyleInfo.EMPTY;
    }
    StyleInfo declared = StyleParser.parse(element.attr("style"));
    StyleInfo implied = impliedStyle(element);
    if (implied == StyleInfo.EMPTY) {
      return declared;
    }
    return declared.merge(implied);
  }

  /**
   * Returns the effective style of an element: its own style cascaded over
   * the parent's effective style.
   *
   * @param element the element
   * @param inherited the parent's effective style, may be null at the root
   */
  public static StyleInfo resolve(HtmlNode element, @Nullable StyleInfo inherited) {
    return ownStyle(element).merge(inherited);
  }

  private static StyleInfo impliedStyle(HtmlNode element) {
    String tag = element.tagName();
    StyleInfo.Builder builder = null;
    switch (tag) {
      case "b":
      case "strong":
      case "h1":
      case "h2":
      case "h3":
      case "h4":
      case "h5":
      case "h6":
      case "th":
        builder = StyleInfo.builder().fontWeight("bold");
        break;
      case "u":
        builder = StyleInfo.builder().textDecoration("underline");
        break;
      case "center":
        builder = StyleInfo.builder().textAlign("center");
        break;
      case "font":
        String size = element.attr("size");
        Double points = size == null ? null : FONT_SIZE_POINTS.get(size.trim());
        if (points != null) {
          builder = StyleInfo.builder().fontSize(StyleUnit.points(points));
        }
        break;
      default:
        break;
    }
    String align = element.attr("align");
    if (align != null && !align.trim().isEmpty() && !"table".equals(tag)) {
      if (builder == null) {
        builder = StyleInfo.builder();
      }
      builder.textAlign(align.trim().toLowerCase(Locale.ROOT));
    }
    return builder == null ? StyleInfo.EMPTY : builder.build();
  }
}
