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

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses inline {@code style} attribute values into {@link StyleInfo} records.
 *
 * <p>Filer tooling regularly emits broken declarations (scientific notation,
 * unknown units, stray separators). A declaration that cannot be parsed is
 * skipped on its own; the rest of the string is still honoured.
 */
public final class StyleParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(StyleParser.class);

  // Plain decimal followed by an optional unit; exponents never match
  private static final Pattern LENGTH =
      Pattern.compile("^([+-]?(?:\\d+\\.?\\d*|\\.\\d+))\\s*([a-z%]*)$");
  private static final Pattern IMPORTANT = Pattern.compile("\\s*!\\s*important\\s*$");

  private StyleParser() {
  }

  /**
   * Parses a declaration list such as {@code "font-weight:bold; margin-top:12pt"}.
   *
   * @param declarations the raw attribute value, may be null
   * @return the parsed style; {@link StyleInfo#EMPTY} when nothing is usable
   */
  public static StyleInfo parse(@Nullable String declarations) {
    Map<String, String> properties = declarations(declarations);
    if (properties.isEmpty()) {
      return StyleInfo.EMPTY;
    }
    StyleInfo.Builder builder = StyleInfo.builder();
    boolean any = false;
    for (Map.Entry<String, String> property : properties.entrySet()) {
      any |= apply(builder, property.getKey(), property.getValue());
    }
    return any ? builder.build() : StyleInfo.EMPTY;
  }

  /**
   * Splits a declaration list into lower-cased property/value pairs without
   * interpreting the values. A property declared twice keeps its last value;
   * {@code !important} markers are dropped.
   */
  public static ImmutableMap<String, String> declarations(@Nullable String declarations) {
    if (declarations == null || declarations.trim().isEmpty()) {
      return ImmutableMap.of();
    }
    Map<String, String> properties = new LinkedHashMap<>();
    for (String declaration : declarations.split(";")) {
      int colon = declaration.indexOf(':');
      if (colon < 0) {
        continue;
      }
      String property = declaration.substring(0, colon).trim().toLowerCase(Locale.ROOT);
      String value = declaration.substring(colon + 1).trim().toLowerCase(Locale.ROOT);
      value = IMPORTANT.matcher(value).replaceFirst("");
      if (property.isEmpty() || value.isEmpty()) {
        continue;
      }
      properties.put(property, value);
    }
    return ImmutableMap.copyOf(properties);
  }

  private static boolean apply(StyleInfo.Builder builder, String property, String value) {
    switch (property) {
      case "display":
        builder.display(value);
        return true;
      case "font-weight":
        builder.fontWeight(value);
        return true;
      case "text-align":
        builder.textAlign(value);
        return true;
      case "text-decoration":
      case "text-decoration-line":
        builder.textDecoration(value);
        return true;
      case "margin-top":
        return set(property, value, builder::marginTop);
      case "margin-bottom":
        return set(property, value, builder::marginBottom);
      case "font-size":
        return set(property, value, builder::fontSize);
      case "line-height":
        return set(property, value, builder::lineHeight);
      case "width":
        return set(property, value, builder::width);
      case "margin":
        return applyMarginShorthand(builder, value);
      default:
        return false;
    }
  }

  /** Shorthand {@code margin}: 1 to 4 values, top first, bottom third (or first). */
  private static boolean applyMarginShorthand(StyleInfo.Builder builder, String value) {
    String[] parts = value.trim().split("\\s+");
    if (parts.length > 4) {
      return false;
    }
    StyleUnit top = parseLength(parts[0]);
    StyleUnit bottom = parseLength(parts.length >= 3 ? parts[2] : parts[0]);
    if (top != null) {
      builder.marginTop(top);
    }
    if (bottom != null) {
      builder.marginBottom(bottom);
    }
    return top != null || bottom != null;
  }

  private static boolean set(String property, String value, LengthSetter setter) {
    StyleUnit unit = parseLength(value);
    if (unit == null) {
      LOGGER.debug("Ignoring malformed declaration {}: {}", property, value);
      return false;
    }
    setter.set(unit);
    return true;
  }

  /**
   * Parses a single CSS length.
   *
   * @param value lower-cased value such as {@code 12pt}, {@code 50%} or {@code 3}
   * @return the length (pixels when no unit is given), or null if malformed
   */
  public static @Nullable StyleUnit parseLength(String value) {
    Matcher matcher = LENGTH.matcher(value.trim());
    if (!matcher.matches()) {
      return null;
    }
    UnitType unit;
    if (matcher.group(2).isEmpty()) {
      unit = UnitType.PIXEL;
    } else {
      unit = UnitType.fromSymbol(matcher.group(2));
      if (unit == null) {
        return null;
      }
    }
    try {
      return new StyleUnit(Double.parseDouble(matcher.group(1)), unit);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /** Receives a parsed length. */
  @FunctionalInterface
  private interface LengthSetter {
    void set(StyleUnit unit);
  }
}
