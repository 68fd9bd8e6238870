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

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Normalizes text taken from filing markup.
 *
 * <p>Typographic spaces and dashes become their ASCII equivalents, entities
 * that survived double escaping are decoded, runs of whitespace within a line
 * collapse to one space, and more than one blank line collapses to one.
 * Single line breaks are kept.
 */
public final class TextCleaner {

  private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f\\r]+");
  private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");

  // Literal entities left behind by double-escaping producers
  private static final Map<String, String> ENTITIES = ImmutableMap.<String, String>builder()
      .put("&nbsp;", " ")
      .put("&#160;", " ")
      .put("&#8201;", " ")
      .put("&#8202;", " ")
      .put("&#8203;", "")
      .put("&#8211;", "-")
      .put("&#8212;", "-")
      .put("&ndash;", "-")
      .put("&mdash;", "-")
      .put("&lt;", "<")
      .put("&gt;", ">")
      .put("&quot;", "\"")
      .put("&apos;", "'")
      .put("&#39;", "'")
      .put("&amp;", "&")
      .build();

  private TextCleaner() {
  }

  /**
   * Cleans a piece of text.
   *
   * @param text raw text, possibly containing line breaks
   * @return the cleaned text, trimmed; empty if nothing visible remains
   */
  public static String clean(String text) {
    if (text.isEmpty()) {
      return text;
    }
    String decoded = text.indexOf('&') >= 0 ? decodeEntities(text) : text;
    StringBuilder sb = new StringBuilder(decoded.length());
    for (int i = 0; i < decoded.length(); i++) {
      char c = decoded.charAt(i);
      switch (c) {
        case '\u00A0':
        case '\u2002':
        case '\u2003':
        case '\u2007':
        case '\u2009':
        case '\u200A':
        case '\u202F':
          sb.append(' ');
          break;
        case '\u200B':
        case '\u200C':
        case '\u200D':
        case '\uFEFF':
          break;
        case '\u2010':
        case '\u2011':
        case '\u2013':
        case '\u2014':
        case '\u2212':
          sb.append('-');
          break;
        default:
          sb.append(c);
          break;
      }
    }
    String[] lines = sb.toString().split("\n", -1);
    StringBuilder out = new StringBuilder(sb.length());
    for (int i = 0; i < lines.length; i++) {
      if (i > 0) {
        out.append('\n');
      }
      out.append(HORIZONTAL_WHITESPACE.matcher(lines[i]).replaceAll(" ").trim());
    }
    return EXCESS_NEWLINES.matcher(out).replaceAll("\n\n").trim();
  }

  /** Cleans text and joins its lines with single spaces. */
  public static String cleanSingleLine(String text) {
    return clean(text).replaceAll("\\s*\\n+\\s*", " ");
  }

  private static String decodeEntities(String text) {
    String result = text;
    for (Map.Entry<String, String> entity : ENTITIES.entrySet()) {
      result = result.replace(entity.getKey(), entity.getValue());
    }
    return result;
  }
}
