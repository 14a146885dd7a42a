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
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.netcodegen.graph.Edge;
import org.netcodegen.graph.Node;

/**
 * An action that finds nodes matching a predicate. Each match is reported as a path: the nodes
 * passed through from the root (excluded) down to the match (included).
 *
 * <p>Matches are found once per edge, so a node that is the target of two edges is reported twice,
 * with two different paths; callers that want each node once must remove duplicates themselves.
 * Results are in the order the walk finishes with them, i.e. a match below another match comes
 * first.
 */
public class SearchNode extends TraverseAction {

  private final Predicate<Node> matches;

  /** Used by {@link #toString}. */
  private final String description;

  /** The nodes from the root (excluded) to the current edge's target (included). */
  private final List<Node> pathStack = new ArrayList<>();

  private final List<ImmutableList<Node>> result = new ArrayList<>();

  public SearchNode(String description, Predicate<Node> matches) {
    this.description = description;
    this.matches = matches;
  }

  /** Returns a SearchNode that matches {@code node} itself (not nodes equal to it). */
  public static SearchNode forInstance(Node node) {
    Preconditions.checkNotNull(node);
    return new SearchNode("instance " + node.describe(), n -> n == node);
  }

  /** Returns a SearchNode that matches nodes whose class is exactly {@code kind}. */
  public static SearchNode forKind(Class<? extends Node> kind) {
    Preconditions.checkNotNull(kind);
    return new SearchNode("kind " + kind.getSimpleName(), n -> n.getClass() == kind);
  }

  /** Returns a SearchNode that matches nodes that render (by default) as {@code name}. */
  public static SearchNode forName(String name) {
    Preconditions.checkNotNull(name);
    return new SearchNode("name " + name, n -> n.toString().equals(name));
  }

  /**
   * Searches the graph below {@code root} and returns the matching paths. Any results from a
   * previous search with this action are discarded.
   */
  public ImmutableList<ImmutableList<Node>> search(Node root) {
    result.clear();
    pathStack.clear();
    traverse(root);
    assert pathStack.isEmpty();
    return result();
  }

  /** Returns the paths found so far. */
  public ImmutableList<ImmutableList<Node>> result() {
    return ImmutableList.copyOf(result);
  }

  /** Returns the last node of each path found so far. */
  public ImmutableList<Node> matchedNodes() {
    return result.stream()
        .map(path -> path.get(path.size() - 1))
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  protected VisitDecision preVisit(Edge edge) {
    pathStack.add(edge.target());
    return VisitDecision.DESCEND;
  }

  @Override
  protected void postVisit(Edge edge) {
    if (matches.test(edge.target())) {
      result.add(ImmutableList.copyOf(pathStack));
    }
    pathStack.remove(pathStack.size() - 1);
  }

  @Override
  public String toString() {
    return "SearchNode(" + description + ")";
  }
}
