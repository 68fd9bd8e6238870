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

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/**
 * The context of one inline-XBRL tag: its type plus the attributes that
 * identify the tagged fact.
 *
 * <p>Field names are plain ({@code name}, {@code context_ref}, ...);
 * {@link #toAnnotations()} returns them with the {@code annotation_} prefix
 * used on document nodes.
 */
public final class TagFrame {
  public static final String PREFIX = "annotation_";

  private final String type;
  private final ImmutableMap<String, String> fields;

  TagFrame(String type, Map<String, String> fields) {
    this.type = type;
    this.fields = ImmutableMap.copyOf(fields);
  }

  /** Returns the tag type, e.g. {@code ix:nonfraction}. */
  public String getType() {
    return type;
  }

  /** Returns the tag's fields, including {@code type}, unprefixed. */
  public ImmutableMap<String, String> getFields() {
    return fields;
  }

  public @Nullable String get(String field) {
    return fields.get(field);
  }

  public @Nullable String getId() {
    return fields.get("id");
  }

  @Nullable String getContinuedAt() {
    return fields.get("continued_at");
  }

  /** Returns the fields with every key prefixed by {@link #PREFIX}. */
  public ImmutableMap<String, String> toAnnotations() {
    ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
    for (Map.Entry<String, String> entry : fields.entrySet()) {
      builder.put(PREFIX + entry.getKey(), entry.getValue());
    }
    return builder.build();
  }

  @Override public String toString() {
    return "TagFrame" + fields;
  }
}
