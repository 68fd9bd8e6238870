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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * The subset of CSS that matters for structural inference.
 *
 * <p>Every field is optional. Instances are immutable; {@link #merge(StyleInfo)}
 * implements the cascade by returning a new record in which each field is the
 * child's value when the child declares it and the parent's value otherwise.
 */
public final class StyleInfo {

  /** A style that declares nothing. */
  public static final StyleInfo EMPTY = builder().build();

  private final @Nullable String display;
  private final @Nullable StyleUnit marginTop;
  private final @Nullable StyleUnit marginBottom;
  private final @Nullable StyleUnit fontSize;
  private final @Nullable String fontWeight;
  private final @Nullable String textAlign;
  private final @Nullable StyleUnit lineHeight;
  private final @Nullable StyleUnit width;
  private final @Nullable String textDecoration;

  private StyleInfo(Builder builder) {
    this.display = builder.display;
    this.marginTop = builder.marginTop;
    this.marginBottom = builder.marginBottom;
    this.fontSize = builder.fontSize;
    this.fontWeight = builder.fontWeight;
    this.textAlign = builder.textAlign;
    this.lineHeight = builder.lineHeight;
    this.width = builder.width;
    this.textDecoration = builder.textDecoration;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a builder initialised with this record's fields. */
  public Builder toBuilder() {
    return new Builder()
        .display(display)
        .marginTop(marginTop)
        .marginBottom(marginBottom)
        .fontSize(fontSize)
        .fontWeight(fontWeight)
        .textAlign(textAlign)
        .lineHeight(lineHeight)
        .width(width)
        .textDecoration(textDecoration);
  }

  /**
   * Cascades this (child) style over a parent style.
   *
   * @param parent the inherited style, may be null
   * @return a record holding the child's value where declared, else the parent's
   */
  public StyleInfo merge(@Nullable StyleInfo parent) {
    if (parent == null) {
      return this;
    }
    return new Builder()
        .display(display != null ? display : parent.display)
        .marginTop(marginTop != null ? marginTop : parent.marginTop)
        .marginBottom(marginBottom != null ? marginBottom : parent.marginBottom)
        .fontSize(fontSize != null ? fontSize : parent.fontSize)
        .fontWeight(fontWeight != null ? fontWeight : parent.fontWeight)
        .textAlign(textAlign != null ? textAlign : parent.textAlign)
        .lineHeight(lineHeight != null ? lineHeight : parent.lineHeight)
        .width(width != null ? width : parent.width)
        .textDecoration(textDecoration != null ? textDecoration : parent.textDecoration)
        .build();
  }

  /** Returns whether the font weight is {@code bold}, 700, 800 or 900. */
  public boolean isBold() {
    if (fontWeight == null) {
      return false;
    }
    switch (fontWeight) {
      case "bold":
      case "700":
      case "800":
      case "900":
        return true;
      default:
        return false;
    }
  }

  /** Returns whether text-align is {@code center}. */
  public boolean isCentered() {
    return "center".equals(textAlign);
  }

  /** Returns whether the element is hidden with {@code display:none}. */
  public boolean isHidden() {
    return "none".equals(display);
  }

  /**
   * Returns the ratio of the font size to a baseline size in points.
   *
   * @return the ratio, or 0 when no absolute font size is declared
   */
  public double fontSizeRatio(double basePoints) {
    if (fontSize == null || fontSize.getUnit() == UnitType.PERCENT || basePoints <= 0) {
      return 0;
    }
    return fontSize.toPoints() / basePoints;
  }

  public @Nullable String getDisplay() {
    return display;
  }

  public @Nullable StyleUnit getMarginTop() {
    return marginTop;
  }

  public @Nullable StyleUnit getMarginBottom() {
    return marginBottom;
  }

  public @Nullable StyleUnit getFontSize() {
    return fontSize;
  }

  public @Nullable String getFontWeight() {
    return fontWeight;
  }

  public @Nullable String getTextAlign() {
    return textAlign;
  }

  public @Nullable StyleUnit getLineHeight() {
    return lineHeight;
  }

  public @Nullable StyleUnit getWidth() {
    return width;
  }

  public @Nullable String getTextDecoration() {
    return textDecoration;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StyleInfo)) {
      return false;
    }
    StyleInfo that = (StyleInfo) o;
    return Objects.equals(display, that.display)
        && Objects.equals(marginTop, that.marginTop)
        && Objects.equals(marginBottom, that.marginBottom)
        && Objects.equals(fontSize, that.fontSize)
        && Objects.equals(fontWeight, that.fontWeight)
        && Objects.equals(textAlign, that.textAlign)
        && Objects.equals(lineHeight, that.lineHeight)
        && Objects.equals(width, that.width)
        && Objects.equals(textDecoration, that.textDecoration);
  }

  @Override public int hashCode() {
    return Objects.hash(display, marginTop, marginBottom, fontSize, fontWeight,
        textAlign, lineHeight, width, textDecoration);
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder("StyleInfo{");
    append(sb, "display", display);
    append(sb, "margin-top", marginTop);
    append(sb, "margin-bottom", marginBottom);
    append(sb, "font-size", fontSize);
    append(sb, "font-weight", fontWeight);
    append(sb, "text-align", textAlign);
    append(sb, "line-height", lineHeight);
    append(sb, "width", width);
    append(sb, "text-decoration", textDecoration);
    return sb.append('}').toString();
  }

  private static void append(StringBuilder sb, String key, @Nullable Object value) {
    if (value == null) {
      return;
    }
    if (sb.charAt(sb.length() - 1) != '{') {
      sb.append("; ");
    }
    sb.append(key).append(':').append(value);
  }

  /**
   * Builder for {@link StyleInfo}.
   */
  public static class Builder {
    private @Nullable String display;
    private @Nullable StyleUnit marginTop;
    private @Nullable StyleUnit marginBottom;
    private @Nullable StyleUnit fontSize;
    private @Nullable String fontWeight;
    private @Nullable String textAlign;
    private @Nullable StyleUnit lineHeight;
    private @Nullable StyleUnit width;
    private @Nullable String textDecoration;

    public Builder display(@Nullable String display) {
      this.display = display;
      return this;
    }

    public Builder marginTop(@Nullable StyleUnit marginTop) {
      this.marginTop = marginTop;
      return this;
    }

    public Builder marginBottom(@Nullable StyleUnit marginBottom) {
      this.marginBottom = marginBottom;
      return this;
    }

    public Builder fontSize(@Nullable StyleUnit fontSize) {
      this.fontSize = fontSize;
      return this;
    }

    public Builder fontWeight(@Nullable String fontWeight) {
      this.fontWeight = fontWeight;
      return this;
    }

    public Builder textAlign(@Nullable String textAlign) {
      this.textAlign = textAlign;
      return this;
    }

    public Builder lineHeight(@Nullable StyleUnit lineHeight) {
      this.lineHeight = lineHeight;
      return this;
    }

    public Builder width(@Nullable StyleUnit width) {
      this.width = width;
      return this;
    }

    public Builder textDecoration(@Nullable String textDecoration) {
      this.textDecoration = textDecoration;
      return this;
    }

    public StyleInfo build() {
      return new StyleInfo(this);
    }
  }
}
