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
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A Node is one vertex of the code graph; it renders to a single fragment of C source (see {@link
 * #render}). Nodes are connected to their children by named {@link Edge}s.
 *
 * <p>The graph is not a tree: any number of nodes may hold edges to the same child, and those
 * edges must continue to refer to that one instance (the child is never copied). The graph
 * reachable from any root must be acyclic.
 *
 * <p>Edges are kept in the order they were first attached. Attaching a second edge with an
 * existing name replaces the earlier edge but keeps its position. Edges are never removed.
 */
public abstract class Node {

  /** The outgoing edges, by name, in attachment order. */
  private final Map<String, Edge> edges = new LinkedHashMap<>();

  /** The index of this node in its {@code CodeGraph}; negative if it hasn't been added to one. */
  private int index = -1;

  /**
   * Attaches an edge named {@code name} with the given kind to {@code target}, replacing any
   * existing edge with that name. Returns the new edge.
   */
  @CanIgnoreReturnValue
  public Edge addEdge(String name, Node target, String kind) {
    Edge edge = new Edge(name, kind, target);
    edges.put(name, edge);
    return edge;
  }

  /** Equivalent to {@code addEdge(name, target, Edge.CONTENT)}. */
  @CanIgnoreReturnValue
  public Edge addEdge(String name, Node target) {
    return addEdge(name, target, Edge.CONTENT);
  }

  /** Returns the target of the edge with the given name; throws if there is no such edge. */
  public Node getNode(String name) {
    Edge edge = edges.get(name);
    if (edge == null) {
      throw new IrException.MissingEdge(this, "getNode(" + name + ")", name);
    }
    return edge.target();
  }

  /** Returns the edge with the given name, or null if there is none. */
  public Edge edge(String name) {
    return edges.get(name);
  }

  /** Returns the targets of all edges with the given kind, in attachment order. */
  public ImmutableList<Node> getNodesByKind(String kind) {
    return edges.values().stream()
        .filter(e -> e.kind().equals(kind))
        .map(Edge::target)
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns all outgoing edges, in attachment order. */
  public ImmutableList<Edge> edges() {
    return ImmutableList.copyOf(edges.values());
  }

  /** Returns the number of outgoing edges. */
  public int numEdges() {
    return edges.size();
  }

  /**
   * The index of this node in its {@code CodeGraph}; negative if it has not been added to one.
   */
  public final int index() {
    return index;
  }

  /** Enables CodeGraph to set {@link #index}; not for general use. */
  public final void setIndex(int index) {
    Preconditions.checkState(this.index < 0, "%s already has an index", describe());
    Preconditions.checkArgument(index >= 0);
    this.index = index;
  }

  /**
   * Returns the C source fragment for this node. The result must depend only on the graph and the
   * given context, so that rendering an unchanged graph twice produces identical text.
   */
  public abstract String render(RenderContext context);

  /**
   * Returns a short description of this node for error messages and debugging listings. Unlike
   * {@link #render} this never fails and never depends on children.
   */
  public String describe() {
    String kind = getClass().getSimpleName();
    return index < 0 ? kind : kind + "#" + index;
  }

  @Override
  public String toString() {
    return render(RenderContext.DEFAULT);
  }
}
