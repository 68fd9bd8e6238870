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

import org.apache.calcite.adapter.sec.html.ParserConfig;
import org.apache.calcite.adapter.sec.html.annotation.TagContextTracker;
import org.apache.calcite.adapter.sec.html.dom.HtmlNode;
import org.apache.calcite.adapter.sec.html.heading.HeadingClassifier;
import org.apache.calcite.adapter.sec.html.node.Document;
import org.apache.calcite.adapter.sec.html.node.HeadingNode;
import org.apache.calcite.adapter.sec.html.node.Node;
import org.apache.calcite.adapter.sec.html.node.PageBreakNode;
import org.apache.calcite.adapter.sec.html.node.TableNode;
import org.apache.calcite.adapter.sec.html.node.TextBlockNode;
import org.apache.calcite.adapter.sec.html.pagebreak.PageBreakDetector;
import org.apache.calcite.adapter.sec.html.pagebreak.PageBreakMark;
import org.apache.calcite.adapter.sec.html.pagebreak.PageBreakMarks;
import org.apache.calcite.adapter.sec.html.style.StyleInfo;
import org.apache.calcite.adapter.sec.html.style.StyleUnit;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds a {@link Document} from the {@code <body>} of a filing.
 *
 * <p>The body is walked depth first once. Along the way a {@link StyleStack}
 * carries the style cascade and a {@link TagContextTracker} the enclosing
 * inline-XBRL tags. Elements are handled as follows:
 * <ul>
 *   <li>tables become {@link TableNode}s;</li>
 *   <li>{@code <h1>}..{@code <h6>} become headings;</li>
 *   <li>other elements with blocks, tables or page breaks below them are
 *       walked child by child, and each run of inline content between
 *       those children is flushed as one heading or text block;</li>
 *   <li>a run is a heading when its pieces, joined, classify as one; an
 *       inline element opening a line may also be split out as a heading.</li>
 * </ul>
 *
 * <p>Adjacent compatible text blocks are merged afterwards, and page numbers
 * are assigned last. Instances are immutable and may be shared; all walk
 * state lives in a per-call object.
 */
public class DocumentBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger(DocumentBuilder.class);

  private final ParserConfig config;
  private final HeadingClassifier classifier;
  private final PageBreakDetector detector;

  public DocumentBuilder(ParserConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    this.classifier = new HeadingClassifier(config.getHeadingConfig());
    this.detector = new PageBreakDetector(config.getPageBreakConfig());
  }

  /**
   * Builds the document for a body element.
   *
   * @param body the {@code <body>} element
   * @return the document; empty if the body has no visible content
   */
  public Document build(HtmlNode body) {
    PageBreakMarks marks = config.isIncludePageBreaks()
        ? detector.detect(body)
        : PageBreakMarks.none();
    Walk walk = new Walk(marks, StructureIndex.build(body, marks));
    List<Node> nodes = new ArrayList<>();
    walk.walk(body, 0, nodes);
    List<Node> result = TextBlockMerger.merge(nodes);
    if (config.isIncludePageBreaks()) {
      result = PageNumbering.number(result);
    }
    LOGGER.debug("Built document with {} nodes ({} before merging)", result.size(),
        nodes.size());
    return new Document(result);
  }

  /** State of one walk over one document. */
  private class Walk {
    private final PageBreakMarks marks;
    private final StructureIndex index;
    private final StyleStack styles = new StyleStack();
    private final TagContextTracker tracker = new TagContextTracker();
    private boolean depthWarned;

    Walk(PageBreakMarks marks, StructureIndex index) {
      this.marks = marks;
      this.index = index;
    }

    void walk(HtmlNode element, int depth, List<Node> out) {
      if (!element.isElement() || ElementKinds.isSkipped(element)) {
        return;
      }
      if (depth > config.getMaxNestingDepth()) {
        flattenDeep(element, out);
        return;
      }
      StyleInfo style = styles.push(element);
      tracker.enter(element);
      try {
        if (style.isHidden()) {
          return;
        }
        PageBreakMark mark = marks.get(element);
        if (mark != null && mark.getPlacement() == PageBreakMark.Placement.BEFORE) {
          out.add(new PageBreakNode(0, mark.getSource()));
        }
        visitContent(element, style, depth, out);
        if (mark != null && mark.getPlacement() == PageBreakMark.Placement.AFTER) {
          out.add(new PageBreakNode(0, mark.getSource()));
        }
      } finally {
        tracker.exit(element);
        styles.pop();
      }
    }

    private void visitContent(HtmlNode element, StyleInfo style, int depth, List<Node> out) {
      if (ElementKinds.isTable(element)) {
        TableNode table = TableRowExtractor.extract(element, tracker.currentContext(),
            config.getTableConfig().getMaxColspan());
        if (table != null) {
          out.add(table);
        }
        return;
      }
      Integer level = HeadingClassifier.levelForTag(element.tagName());
      if (level != null && !index.hasStructuralChild(element)) {
        String text = TextCleaner.cleanSingleLine(TextCollector.collect(element, false));
        if (!text.isEmpty()) {
          out.add(new HeadingNode(text, style, level, tracker.currentContext()));
        }
        return;
      }
      if (depth > 0 && index.hasStructuralChild(element)
          && !index.containsTableOrBreak(element) && emitBlockHeading(element, style, out)) {
        return;
      }
      List<Segment> run = new ArrayList<>();
      for (HtmlNode child : element.children()) {
        if (child.isElement() && index.isStructural(child)) {
          flushRun(run, style, out);
          run = new ArrayList<>();
          walk(child, depth + 1, out);
        } else {
          Segment segment = collectSegment(child, depth + 1);
          if (segment != null) {
            run.add(segment);
          }
        }
      }
      flushRun(run, style, out);
    }

    /**
     * Classifies the full text of a block whose children are blocks, so that
     * a heading split over several paragraphs becomes one heading.
     */
    private boolean emitBlockHeading(HtmlNode element, StyleInfo style, List<Node> out) {
      String raw = TextCollector.collectAtMost(element,
          config.getHeadingConfig().getMaxLength());
      if (raw == null) {
        return false;
      }
      String text = TextCleaner.cleanSingleLine(raw);
      if (text.isEmpty()) {
        return false;
      }
      Integer level = classifier.classify(style, text);
      if (level == null) {
        return false;
      }
      out.add(new HeadingNode(text, style, level, tracker.currentContext()));
      return true;
    }

    private @Nullable Segment collectSegment(HtmlNode node, int depth) {
      if (!node.isElement()) {
        List<Piece> pieces = new ArrayList<>(1);
        pieces.add(new Piece(node.text(), styles.current(), tracker.currentContext()));
        return new Segment(false, false, pieces, styles.current());
      }
      if (ElementKinds.isSkipped(node)) {
        return null;
      }
      if (ElementKinds.isLineBreak(node)) {
        List<Piece> pieces = new ArrayList<>(1);
        pieces.add(new Piece("\n", styles.current(), ImmutableMap.of()));
        return new Segment(false, true, pieces, styles.current());
      }
      List<Piece> pieces = new ArrayList<>();
      StyleInfo style = collectInline(node, depth, pieces);
      return new Segment(true, false, pieces, style);
    }

    /** Appends the text pieces of an inline subtree and returns its style. */
    private StyleInfo collectInline(HtmlNode node, int depth, List<Piece> pieces) {
      if (!node.isElement()) {
        pieces.add(new Piece(node.text(), styles.current(), tracker.currentContext()));
        return styles.current();
      }
      if (ElementKinds.isSkipped(node)) {
        return styles.current();
      }
      if (ElementKinds.isLineBreak(node)) {
        pieces.add(new Piece("\n", styles.current(), ImmutableMap.of()));
        return styles.current();
      }
      if (depth > config.getMaxNestingDepth()) {
        warnDepth();
        pieces.add(new Piece(TextCollector.collect(node, true), styles.current(),
            tracker.currentContext()));
        return styles.current();
      }
      StyleInfo style = styles.push(node);
      tracker.enter(node);
      try {
        if (!style.isHidden()) {
          for (HtmlNode child : node.children()) {
            collectInline(child, depth + 1, pieces);
          }
        }
        return style;
      } finally {
        tracker.exit(node);
        styles.pop();
      }
    }

    private void flushRun(List<Segment> run, StyleInfo containerStyle, List<Node> out) {
      if (run.isEmpty() || !hasText(run)) {
        return;
      }
      HeadingNode split = splitHeading(run);
      if (split != null) {
        out.add(split);
        return;
      }
      List<Piece> pieces = pieces(run);
      String text = TextCleaner.clean(assemble(pieces));
      StyleInfo runStyle = runStyle(containerStyle, pieces);
      Integer level = classifier.classify(runStyle, text);
      if (level != null) {
        out.add(new HeadingNode(TextCleaner.cleanSingleLine(text), runStyle, level,
            annotations(pieces)));
        return;
      }
      List<Segment> pending = new ArrayList<>();
      boolean lineStart = true;
      for (Segment segment : run) {
        if (segment.lineBreak) {
          pending.add(segment);
          lineStart = true;
          continue;
        }
        boolean visible = hasText(segment.pieces);
        if (segment.element && lineStart && visible) {
          String segmentText = TextCleaner.clean(assemble(segment.pieces));
          StyleInfo segmentStyle = runStyle(segment.style, segment.pieces);
          Integer segmentLevel = classifier.classify(segmentStyle, segmentText);
          if (segmentLevel != null) {
            emitText(pending, containerStyle, out);
            pending = new ArrayList<>();
            out.add(
                new HeadingNode(TextCleaner.cleanSingleLine(segmentText), segmentStyle,
                    segmentLevel, annotations(segment.pieces)));
            lineStart = false;
            continue;
          }
        }
        pending.add(segment);
        if (visible) {
          lineStart = false;
        }
      }
      emitText(pending, containerStyle, out);
    }

    /**
     * Classifies a heading split across several styled inline elements, such
     * as "ITEM", "1." and "Business" in three spans, by joining their texts
     * with spaces.
     */
    private @Nullable HeadingNode splitHeading(List<Segment> run) {
      List<String> texts = new ArrayList<>();
      List<StyleInfo> pieceStyles = new ArrayList<>();
      List<Piece> pieces = new ArrayList<>();
      for (Segment segment : run) {
        if (!hasText(segment.pieces)) {
          continue;
        }
        if (!segment.element) {
          return null;
        }
        texts.add(TextCleaner.cleanSingleLine(assemble(segment.pieces)));
        pieceStyles.add(runStyle(segment.style, segment.pieces));
        pieces.addAll(segment.pieces);
      }
      if (texts.size() < 2) {
        return null;
      }
      String combined = String.join(" ", texts);
      StyleInfo style = HeadingClassifier.combineStyles(pieceStyles);
      Integer level = classifier.classify(style, combined);
      if (level == null) {
        return null;
      }
      return new HeadingNode(combined, style, level, annotations(pieces));
    }

    private void emitText(List<Segment> segments, StyleInfo containerStyle, List<Node> out) {
      List<Piece> pieces = pieces(segments);
      String text = TextCleaner.clean(assemble(pieces));
      if (text.isEmpty()) {
        return;
      }
      out.add(new TextBlockNode(text, runStyle(containerStyle, pieces), annotations(pieces)));
    }

    private void flattenDeep(HtmlNode element, List<Node> out) {
      warnDepth();
      String text = TextCleaner.clean(TextCollector.collect(element, true));
      if (!text.isEmpty()) {
        out.add(new TextBlockNode(text, styles.current(), tracker.currentContext()));
      }
    }

    private void warnDepth() {
      if (!depthWarned) {
        depthWarned = true;
        LOGGER.warn("Nesting deeper than {} levels; flattening deeper content to text",
            config.getMaxNestingDepth());
      }
    }
  }

  /**
   * Refines a container style with what all visible pieces agree on: bold
   * when every piece is bold, and a font size every piece shares.
   */
  static StyleInfo runStyle(StyleInfo base, List<Piece> pieces) {
    boolean any = false;
    boolean allBold = true;
    StyleUnit fontSize = null;
    boolean sameSize = true;
    for (Piece piece : pieces) {
      if (piece.isBlank()) {
        continue;
      }
      StyleUnit size = piece.style.getFontSize();
      if (!any) {
        fontSize = size;
      } else if (!Objects.equals(fontSize, size)) {
        sameSize = false;
      }
      any = true;
      allBold &= piece.style.isBold();
    }
    if (!any) {
      return base;
    }
    boolean bold = allBold && !base.isBold();
    boolean size = sameSize && fontSize != null && !fontSize.equals(base.getFontSize());
    if (!bold && !size) {
      return base;
    }
    StyleInfo.Builder builder = base.toBuilder();
    if (bold) {
      builder.fontWeight("bold");
    }
    if (size) {
      builder.fontSize(fontSize);
    }
    return builder.build();
  }

  private static boolean hasText(List<?> items) {
    for (Object item : items) {
      if (item instanceof Segment) {
        if (hasText(((Segment) item).pieces)) {
          return true;
        }
      } else if (!((Piece) item).isBlank()) {
        return true;
      }
    }
    return false;
  }

  private static List<Piece> pieces(List<Segment> segments) {
    List<Piece> pieces = new ArrayList<>();
    for (Segment segment : segments) {
      pieces.addAll(segment.pieces);
    }
    return pieces;
  }

  private static String assemble(List<Piece> pieces) {
    StringBuilder sb = new StringBuilder();
    for (Piece piece : pieces) {
      sb.append(piece.text);
    }
    return sb.toString();
  }

  /** Returns the first non-empty annotation map among the pieces. */
  private static ImmutableMap<String, String> annotations(List<Piece> pieces) {
    for (Piece piece : pieces) {
      if (!piece.isBlank() && !piece.annotations.isEmpty()) {
        return piece.annotations;
      }
    }
    return ImmutableMap.of();
  }

  /** A run of text with the style and annotations in effect where it occurs. */
  static final class Piece {
    final String text;
    final StyleInfo style;
    final ImmutableMap<String, String> annotations;

    Piece(String text, StyleInfo style, ImmutableMap<String, String> annotations) {
      this.text = text;
      this.style = style;
      this.annotations = annotations;
    }

    boolean isBlank() {
      return TextCleaner.clean(text).isEmpty();
    }
  }

  /** The inline content contributed by one child of a container. */
  private static final class Segment {
    final boolean element;
    final boolean lineBreak;
    final List<Piece> pieces;
    final StyleInfo style;

    Segment(boolean element, boolean lineBreak, List<Piece> pieces, StyleInfo style) {
      this.element = element;
      this.lineBreak = lineBreak;
      this.pieces = pieces;
      this.style = style;
    }
  }
}
