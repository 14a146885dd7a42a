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

import com.google.common.base.Preconditions;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.List;
import org.netcodegen.graph.Edge;
import org.netcodegen.graph.Node;

/**
 * An action that redirects every edge leading to one node so that it leads to another instead.
 * Each redirected edge keeps its name, kind, and position among its origin's edges.
 *
 * <p>The walk does not enter the node being replaced. Edges are redirected after the walk
 * completes, so the walk itself always sees the original graph.
 */
public class ReplaceNode extends TraverseAction {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Node original;
  private final Node replacement;

  /** The origin of each edge on the current path; the root is at index 0. */
  private final List<Node> origins = new ArrayList<>();

  /** Pairs of (origin, edge) to be redirected once the walk is done. */
  private final List<Node> pendingOrigins = new ArrayList<>();

  private final List<Edge> pendingEdges = new ArrayList<>();

  public ReplaceNode(Node original, Node replacement) {
    Preconditions.checkArgument(original != replacement, "Can't replace a node with itself");
    this.original = Preconditions.checkNotNull(original);
    this.replacement = Preconditions.checkNotNull(replacement);
  }

  /**
   * Redirects every edge below {@code root} that leads to the original node, and returns the
   * number of edges changed.
   */
  public int replaceIn(Node root) {
    origins.clear();
    pendingOrigins.clear();
    pendingEdges.clear();
    origins.add(root);
    traverse(root);
    for (int i = 0; i < pendingEdges.size(); i++) {
      Edge edge = pendingEdges.get(i);
      pendingOrigins.get(i).addEdge(edge.name(), replacement, edge.kind());
    }
    int count = pendingEdges.size();
    logger.atFine().log(
        "Replaced %s with %s on %s edge(s)", original.describe(), replacement.describe(), count);
    return count;
  }

  @Override
  protected VisitDecision preVisit(Edge edge) {
    Node origin = origins.get(origins.size() - 1);
    if (edge.target() == original) {
      pendingOrigins.add(origin);
      pendingEdges.add(edge);
    }
    origins.add(edge.target());
    return (edge.target() == original) ? VisitDecision.PRUNE : VisitDecision.DESCEND;
  }

  @Override
  protected void postVisit(Edge edge) {
    origins.remove(origins.size() - 1);
  }
}
