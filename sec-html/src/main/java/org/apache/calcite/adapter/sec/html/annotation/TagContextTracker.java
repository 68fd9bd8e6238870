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
package org.apache.calcite.adapter.sec.html.annotation;

import org.apache.calcite.adapter.sec.html.dom.HtmlNode;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tracks the inline-XBRL tags enclosing the current position of a tree walk.
 *
 * <p>Regular tags ({@code ix:nonFraction}, {@code ix:nonNumeric},
 * {@code ix:fraction}, {@code ix:footnote}) push a frame on {@link #enter} and
 * pop it on {@link #exit}. A tag whose text continues elsewhere names the
 * continuation with {@code continuedAt}; the {@code ix:continuation} carrying
 * that id resolves back to the originating frame and does not push a frame of
 * its own. Continuations may chain, each one naming the next.
 *
 * <p>One tracker serves one document walk and is not thread-safe.
 */
public class TagContextTracker {
  private static final Logger LOGGER = LoggerFactory.getLogger(TagContextTracker.class);

  public static final String CONTINUATION = "ix:continuation";

  private static final ImmutableSet<String> REGULAR_TAGS = ImmutableSet.of(
      "ix:nonfraction", "ix:nonnumeric", "ix:fraction", "ix:footnote");

  // Attribute name -> field name
  private static final ImmutableMap<String, String> ATTRIBUTES =
      ImmutableMap.<String, String>builder()
          .put("name", "name")
          .put("contextref", "context_ref")
          .put("unitref", "unit_ref")
          .put("id", "id")
          .put("decimals", "decimals")
          .put("scale", "scale")
          .put("format", "format")
          .put("sign", "sign")
          .put("continuedat", "continued_at")
          .put("footnoterole", "footnote_role")
          .build();

  private final Deque<TagFrame> frames = new ArrayDeque<>();
  // Effective frame per open annotation element, continuations included
  private final Deque<Scope> scopes = new ArrayDeque<>();
  private final Map<String, TagFrame> byId = new HashMap<>();
  private final Map<String, TagFrame> byContinuationId = new HashMap<>();

  /** Returns whether the element is an inline-XBRL tag this tracker follows. */
  public static boolean isAnnotation(HtmlNode node) {
    return node.isElement()
        && (REGULAR_TAGS.contains(node.tagName()) || CONTINUATION.equals(node.tagName()));
  }

  public static boolean isContinuation(HtmlNode node) {
    return node.isElement() && CONTINUATION.equals(node.tagName());
  }

  /**
   * Enters an element. Elements that are not inline-XBRL tags are ignored.
   *
   * @return the element's effective frame, or null if it is not a tag
   */
  public @Nullable TagFrame enter(HtmlNode element) {
    if (!isAnnotation(element)) {
      return null;
    }
    TagFrame frame;
    if (isContinuation(element)) {
      frame = resolveContinuation(element);
    } else {
      frame = buildFrame(element);
      frames.push(frame);
      String id = frame.getId();
      if (id != null) {
        byId.put(id, frame);
      }
    }
    String continuedAt = attrValue(element, "continuedat");
    if (continuedAt != null) {
      byContinuationId.put(continuedAt, frame);
    }
    scopes.push(new Scope(element, frame));
    return frame;
  }

  /**
   * Leaves an element previously passed to {@link #enter}. Regular tags pop
   * their frame; continuations leave the frame stack untouched.
   */
  public void exit(HtmlNode element) {
    if (!isAnnotation(element)) {
      return;
    }
    Scope top = scopes.peek();
    if (top == null || !top.element.equals(element)) {
      LOGGER.warn("Unbalanced exit from {}", element);
      return;
    }
    scopes.pop();
    if (!isContinuation(element) && !frames.isEmpty()) {
      frames.pop();
    }
  }

  /**
   * Returns the annotation map for the innermost open tag, keys prefixed with
   * {@code annotation_}; empty when no tag is open.
   */
  public ImmutableMap<String, String> currentContext() {
    Scope top = scopes.peek();
    return top == null ? ImmutableMap.of() : top.frame.toAnnotations();
  }

  /**
   * Returns the annotation map that applies to an element: the resolved
   * originating frame for a continuation that is open, otherwise the top of
   * the frame stack.
   */
  public ImmutableMap<String, String> currentContext(HtmlNode element) {
    if (isContinuation(element)) {
      for (Scope scope : scopes) {
        if (scope.element.equals(element)) {
          return scope.frame.toAnnotations();
        }
      }
    }
    TagFrame top = frames.peek();
    return top == null ? ImmutableMap.of() : top.toAnnotations();
  }

  /** Returns the number of regular frames currently open. */
  int depth() {
    return frames.size();
  }

  /** Returns the frame registered under an id, or null. */
  @Nullable TagFrame frameById(String id) {
    return byId.get(id);
  }

  private TagFrame resolveContinuation(HtmlNode element) {
    String id = attrValue(element, "id");
    if (id != null) {
      TagFrame origin = byContinuationId.get(id);
      if (origin == null) {
        origin = byId.get(id);
      }
      if (origin != null) {
        return origin;
      }
    }
    LOGGER.debug("Unresolved continuation {}", id);
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("type", CONTINUATION);
    if (id != null) {
      fields.put("id", id);
    }
    return new TagFrame(CONTINUATION, fields);
  }

  private static TagFrame buildFrame(HtmlNode element) {
    String type = element.tagName();
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("type", type);
    for (Map.Entry<String, String> attribute : ATTRIBUTES.entrySet()) {
      String value = attrValue(element, attribute.getKey());
      if (value != null) {
        fields.put(attribute.getValue(), value);
      }
    }
    if ("ix:footnote".equals(type) && fields.containsKey("id")) {
      fields.put("footnote_id", fields.get("id"));
    }
    return new TagFrame(type, fields);
  }

  private static @Nullable String attrValue(HtmlNode element, String name) {
    String value = element.attr(name);
    if (value == null) {
      return null;
    }
    value = value.trim();
    return value.isEmpty() ? null : value;
  }

  /** An open annotation element and the frame in effect inside it. */
  private static class Scope {
    final HtmlNode element;
    final TagFrame frame;

    Scope(HtmlNode element, TagFrame frame) {
      this.element = element;
      this.frame = frame;
    }
  }
}
