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

package org.netcodegen.traverse;

import org.netcodegen.graph.Edge;
import org.netcodegen.graph.Node;

/**
 * A TraverseAction is the pair of hooks that a {@link Traversal} calls for each edge it visits.
 * Everything that inspects or transforms a code graph (searching, rewriting, collecting
 * declarations, emitting code) is a TraverseAction; they keep whatever state they need
 * themselves.
 *
 * <p>For each edge, {@link #preVisit} is called first. If it returns {@link VisitDecision#DESCEND}
 * the target's edges are visited next, and then {@link #postVisit} is called with the same edge.
 * An action can therefore rely on everything below a node having been seen by the time {@link
 * #postVisit} is called for an edge leading to it.
 */
public abstract class TraverseAction {

  /** Called before the target of {@code edge} is visited. */
  protected abstract VisitDecision preVisit(Edge edge);

  /**
   * Called after the target of {@code edge} (and, unless it was pruned, everything below it) has
   * been visited. The default implementation does nothing.
   */
  protected void postVisit(Edge edge) {}

  /** Walks the graph below {@code root}, calling this action's hooks. */
  public void traverse(Node root) {
    Traversal.walk(root, this);
  }
}
