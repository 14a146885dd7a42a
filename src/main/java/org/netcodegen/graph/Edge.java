/*
 * Copyright 2025 The Netcodegen Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.netcodegen.graph;

import com.google.common.base.Preconditions;

/**
 * A named, directed relation from a {@link Node} to one of its children. The {@code kind} is a
 * caller-chosen label describing the role the child plays (an operand, an array index, ...); it is
 * used by structural queries such as {@link Node#getNodesByKind} but never by rendering.
 */
public record Edge(String name, String kind, Node target) {

  /** The kind used by {@link Node#addEdge(String, Node)} when the caller doesn't choose one. */
  public static final String CONTENT = "content";

  /** Binds a child to one of an expression's placeholders. */
  public static final String OPERAND = "operand";

  /** Links an indexed variable to the variable it indexes. */
  public static final String VAR = "var";

  /** One subscript of an indexed variable. */
  public static final String INDEX = "index";

  public Edge {
    Preconditions.checkNotNull(name);
    Preconditions.checkNotNull(kind);
    Preconditions.checkNotNull(target);
  }

  @Override
  public String toString() {
    return String.format("%s:%s -> %s", name, kind, target.describe());
  }
}
