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

/**
 * Visitor over the node kinds of a {@link Document}.
 *
 * <p>Adding a node kind adds a method here, so every consumer is forced to
 * handle it.
 *
 * @param <R> result type
 */
public interface NodeVisitor<R> {
  R visitHeading(HeadingNode heading);

  R visitTextBlock(TextBlockNode textBlock);

  R visitTable(TableNode table);

  R visitPageBreak(PageBreakNode pageBreak);
}
