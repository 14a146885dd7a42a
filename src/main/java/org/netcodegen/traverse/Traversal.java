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

import com.google.common.collect.Sets;
import java.util.Set;
import org.netcodegen.graph.Edge;
import org.netcodegen.graph.IrException;
import org.netcodegen.graph.Node;

/**
 * The depth-first walk used by every {@link TraverseAction}.
 *
 * <p>Starting from a root node (which is not itself visited), each of its edges is visited in
 * attachment order; visiting an edge calls the action's hooks and, if the action chooses to
 * descend, recursively visits the target's edges.
 *
 * <p>A node with several parents has its edges expanded only the first time the walk descends into
 * it; later edges leading to it still get their own {@link TraverseAction#preVisit} and {@link
 * TraverseAction#postVisit} calls, but the walk does not re-enter the node. Every reachable edge is
 * therefore visited exactly once. A node that was pruned has not been expanded, so a later edge may
 * still descend into it.
 *
 * <p>The order of a walk depends only on the order in which edges were attached; the identity sets
 * below are only used to test membership, never iterated.
 */
public final class Traversal {

  private final TraverseAction action;

  /** Nodes whose edges have been (or are being) visited. */
  private final Set<Node> expanded = Sets.newIdentityHashSet();

  /** Nodes on the current path from the root; an edge back to one of these closes a cycle. */
  private final Set<Node> active = Sets.newIdentityHashSet();

  private Traversal(TraverseAction action) {
    this.action = action;
  }

  /** Walks the graph below {@code root}, calling the hooks of {@code action} for each edge. */
  public static void walk(Node root, TraverseAction action) {
    new Traversal(action).expand(root);
  }

  private void expand(Node node) {
    expanded.add(node);
    active.add(node);
    // edges() is a snapshot, so an action may attach edges to this node while we're walking it;
    // they won't be visited.
    for (Edge edge : node.edges()) {
      visit(node, edge);
    }
    active.remove(node);
  }

  private void visit(Node origin, Edge edge) {
    Node target = edge.target();
    if (active.contains(target)) {
      throw new IrException.CyclicGraph(origin, "walk", edge.name());
    }
    if (action.preVisit(edge) == VisitDecision.DESCEND && !expanded.contains(target)) {
      expand(target);
    }
    action.postVisit(edge);
  }
}
