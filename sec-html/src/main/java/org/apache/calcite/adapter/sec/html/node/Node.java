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
package org.apache.calcite.adapter.sec.html.node;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * A structural element of a filing document: a heading, a block of text, a
 * table or a page boundary.
 *
 * <p>The set of subclasses is closed; consumers dispatch with
 * {@link #accept(NodeVisitor)}. Every node carries an annotation map, which
 * holds the inline-XBRL context (keys prefixed {@code annotation_}) the node's
 * content was tagged with, and is empty otherwise.
 */
public abstract class Node {

  private final ImmutableMap<String, String> annotations;

  Node(Map<String, String> annotations) {
    this.annotations = ImmutableMap.copyOf(annotations);
  }

  public abstract NodeType getType();

  public abstract <R> R accept(NodeVisitor<R> visitor);

  public ImmutableMap<String, String> getAnnotations() {
    return annotations;
  }

  public boolean hasAnnotations() {
    return !annotations.isEmpty();
  }
}
