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
package org.apache.calcite.adapter.sec.html.heading;

import org.apache.calcite.adapter.sec.html.style.StyleInfo;
import org.apache.calcite.adapter.sec.html.style.StyleUnit;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Decides whether a run of styled text is a heading and at which level.
 *
 * <p>Filings rarely use heading tags, so the level is inferred from the text
 * shape and the resolved style:
 * <ol>
 *   <li>Level 1: "PART I", "PART II", ...</li>
 *   <li>Level 2: "ITEM 1A.", "ARTICLE IV", "SECTION 2.1"</li>
 *   <li>Level 3: prominent text naming a well-known filing section, or a short
 *       phrase built around a section keyword</li>
 *   <li>Level 4: any other short bold caption</li>
 * </ol>
 *
 * <p>Text must first pass a trait gate: bold, a larger font, or extra space
 * above a bold or centered all-caps line. Thresholds come from
 * {@link HeadingConfig}.
 */
public class HeadingClassifier {
  private static final Logger LOGGER = LoggerFactory.getLogger(HeadingClassifier.class);

  private static final Pattern PART = Pattern.compile(
      "^part\\s+[ivx0-9]+(?:\\s.*)?$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

  private static final List<Pattern> ITEM_PATTERNS = ImmutableList.of(
      Pattern.compile("^item\\s+\\d+[a-z]?\\.?(?:\\s.*)?$",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
      Pattern.compile("^article\\s+[ivx0-9]+(?:[\\s.].*)?$",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
      Pattern.compile("^section\\s+\\d+(?:\\.\\d+)*(?:\\s.*)?$",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL));

  // All-caps phrase is matched case-sensitively; the rest ignore case
  private static final List<Pattern> SECTION_PATTERNS = ImmutableList.of(
      Pattern.compile("^[A-Z][A-Z\\s\\-&]{5,}$"),
      Pattern.compile("^(?:consolidated|combined)\\s+[a-z\\s]+$", Pattern.CASE_INSENSITIVE),
      Pattern.compile("^management[a-z'\\u2019\\s]+(?:discussion|analysis)$",
          Pattern.CASE_INSENSITIVE),
      Pattern.compile("^notes?\\s+to\\s+[a-z\\s]+$", Pattern.CASE_INSENSITIVE),
      Pattern.compile("^selected\\s+financial\\s+data$", Pattern.CASE_INSENSITIVE),
      Pattern.compile("^supplementary\\s+information$", Pattern.CASE_INSENSITIVE),
      Pattern.compile("^signatures?$", Pattern.CASE_INSENSITIVE),
      Pattern.compile("^exhibits?\\s+and\\s+financial\\s+statement\\s+schedules$",
          Pattern.CASE_INSENSITIVE));

  private static final List<String> MINOR_HEADING_PREFIXES =
      ImmutableList.of("note:", "*", "(", "$");

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final HeadingConfig config;
  private final Pattern keywordPattern;

  public HeadingClassifier(HeadingConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    this.keywordPattern = keywordPattern(config.getSectionKeywords());
  }

  public HeadingClassifier() {
    this(HeadingConfig.defaults());
  }

  /**
   * Classifies text with its resolved style.
   *
   * @param style effective style of the text
   * @param text the text, whitespace is normalized before matching
   * @return the heading level 1 to 4, or null if the text is not a heading
   */
  public @Nullable Integer classify(StyleInfo style, @Nullable String text) {
    if (text == null) {
      return null;
    }
    String normalized = WHITESPACE.matcher(text).replaceAll(" ").trim();
    if (normalized.isEmpty() || normalized.length() > config.getMaxLength()) {
      return null;
    }
    if (!passesTraitGate(style, normalized)) {
      return null;
    }
    if (PART.matcher(normalized).matches()) {
      return log(normalized, 1);
    }
    for (Pattern pattern : ITEM_PATTERNS) {
      if (pattern.matcher(normalized).matches()) {
        return log(normalized, 2);
      }
    }
    if (isProminent(style) && isSectionTitle(normalized)) {
      return log(normalized, 3);
    }
    if (isMinorHeading(style, normalized)) {
      return log(normalized, 4);
    }
    return null;
  }

  /**
   * Returns the level for an explicit heading tag: {@code h1}..{@code h3} map
   * to their own number, deeper tags to 4.
   *
   * @return the level, or null if the tag is not a heading tag
   */
  public static @Nullable Integer levelForTag(String tagName) {
    if (tagName.length() != 2 || tagName.charAt(0) != 'h') {
      return null;
    }
    char digit = tagName.charAt(1);
    if (digit < '1' || digit > '6') {
      return null;
    }
    return Math.min(digit - '0', 4);
  }

  /**
   * Combines the styles of the inline pieces of a heading split across
   * several elements. The result is bold when any piece is bold; the other
   * fields come from the first piece.
   */
  public static StyleInfo combineStyles(List<StyleInfo> pieces) {
    if (pieces.isEmpty()) {
      return StyleInfo.EMPTY;
    }
    StyleInfo first = pieces.get(0);
    for (StyleInfo piece : pieces) {
      if (piece.isBold()) {
        return first.isBold() ? first : first.toBuilder().fontWeight("bold").build();
      }
    }
    return first;
  }

  boolean passesTraitGate(StyleInfo style, String text) {
    boolean bold = style.isBold();
    if (bold) {
      return true;
    }
    if (style.fontSizeRatio(config.getBaseFontPoints()) >= config.getLargeFontRatio()) {
      return true;
    }
    StyleUnit marginTop = style.getMarginTop();
    if (marginTop != null && marginTop.isAtLeastPoints(config.getGateMarginTopPoints())) {
      return style.isCentered() && isAllCaps(text)
          && text.length() > config.getMinCapsLength();
    }
    return false;
  }

  boolean isProminent(StyleInfo style) {
    if (style.fontSizeRatio(config.getBaseFontPoints()) > config.getProminentFontRatio()) {
      return true;
    }
    StyleUnit marginTop = style.getMarginTop();
    if (marginTop != null
        && marginTop.isAtLeastPoints(config.getProminentMarginTopPoints())) {
      return true;
    }
    if (style.isCentered()) {
      return true;
    }
    return style.isBold() && marginTop != null;
  }

  boolean isSectionTitle(String text) {
    for (Pattern pattern : SECTION_PATTERNS) {
      if (pattern.matcher(text).matches()) {
        return true;
      }
    }
    return text.length() >= config.getSectionMinLength()
        && text.length() <= config.getSectionMaxLength()
        && keywordPattern.matcher(text).find();
  }

  private boolean isMinorHeading(StyleInfo style, String text) {
    if (!style.isBold() || text.length() >= config.getMinorHeadingMaxLength()) {
      return false;
    }
    String lower = text.toLowerCase(Locale.ROOT);
    for (String prefix : MINOR_HEADING_PREFIXES) {
      if (lower.startsWith(prefix)) {
        return false;
      }
    }
    return !text.endsWith(":");
  }

  private static boolean isAllCaps(String text) {
    boolean letter = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (Character.isLetter(c)) {
        if (Character.isLowerCase(c)) {
          return false;
        }
        letter = true;
      }
    }
    return letter;
  }

  private static Pattern keywordPattern(List<String> keywords) {
    StringBuilder sb = new StringBuilder("\\b(?:");
    for (int i = 0; i < keywords.size(); i++) {
      if (i > 0) {
        sb.append('|');
      }
      sb.append(Pattern.quote(keywords.get(i).toLowerCase(Locale.ROOT)));
    }
    // An empty keyword list must match nothing
    sb.append(keywords.isEmpty() ? "(?!))" : ")\\b");
    return Pattern.compile(sb.toString(), Pattern.CASE_INSENSITIVE);
  }

  private static Integer log(String text, int level) {
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Heading level {}: {}", level, text);
    }
    return level;
  }
}
