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

package org.netcodegen.code;

import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.netcodegen.graph.Edge;
import org.netcodegen.graph.Node;
import org.netcodegen.util.StringUtil;

/**
 * A CodeGraph owns all the nodes created while compiling one inference step. The lifecycle of a
 * CodeGraph is <nl>
 * <li>Lowering code creates {@link Variable}s for the step's storage and {@link Expression}s,
 *     {@link Constant}s, and {@link IndexedVariable}s for its arithmetic, using the factory methods
 *     here so that each node gets an index and each variable a unique identifier.
 * <li>Passes (searches, rewrites) walk the graph with {@link
 *     org.netcodegen.traverse.TraverseAction}s.
 * <li>Emission renders the nodes and variable declarations to text. </nl>
 *
 * <p>The whole graph is discarded once emission is complete; nodes are never removed individually.
 */
public class CodeGraph {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** All nodes in the graph ({@code nodes.get(i).index() == i}). */
  private final List<Node> nodes = new ArrayList<>();

  /** The unique index that will be given to the next Variable; never reused. */
  private int nextVariableIndex = 0;

  /** If true, {@link #logNodes} logs a listing of the whole graph. */
  public boolean verbose;

  /** Adds a node to this graph and returns it. A node can only be added to one graph, once. */
  @CanIgnoreReturnValue
  public <T extends Node> T add(T node) {
    node.setIndex(nodes.size());
    nodes.add(node);
    return node;
  }

  /** Returns the number of nodes in this graph. */
  public int numNodes() {
    return nodes.size();
  }

  /** Returns the node with the given index. */
  public Node node(int index) {
    return nodes.get(index);
  }

  /** Returns all nodes, in order of creation. */
  public ImmutableList<Node> nodes() {
    return ImmutableList.copyOf(nodes);
  }

  /** Returns the number of variables created by {@link #newVariable}. */
  public int numVariables() {
    return nextVariableIndex;
  }

  /** Creates a Constant. */
  public Constant newConstant(Object value) {
    return add(new Constant(value));
  }

  /**
   * Creates an Expression. Bindings that are not Nodes are added to this graph as {@link
   * Constant}s.
   */
  public Expression newExpression(String snippet, Map<String, ?> operands) {
    Snippet parsed = Snippet.parse(snippet);
    // Constants are created in template order; any unused operands follow, and are rejected by
    // the Expression constructor.
    ImmutableMap.Builder<String, Node> nodeOperands = ImmutableMap.builder();
    for (String name : parsed.names()) {
      if (operands.containsKey(name)) {
        nodeOperands.put(name, asGraphNode(operands.get(name)));
      }
    }
    operands.forEach(
        (name, value) -> {
          if (!parsed.names().contains(name)) {
            nodeOperands.put(name, asGraphNode(value));
          }
        });
    return add(new Expression(parsed, nodeOperands.buildOrThrow()));
  }

  private Node asGraphNode(Object value) {
    return (value instanceof Node node) ? node : newConstant(value);
  }

  /** Creates a scalar Variable with no alignment requirement and no initial value. */
  public Variable newScalar(String type, String name) {
    return newVariable(type, name, null, 0, null);
  }

  /**
   * Creates a Variable with the next unique index; see {@link Variable#Variable} for the meaning
   * of the arguments.
   */
  public Variable newVariable(
      String type,
      String name,
      int @Nullable [] dims,
      int alignment,
      double @Nullable [] initData) {
    Variable var = add(new Variable(type, name, dims, alignment, nextVariableIndex, initData));
    nextVariableIndex++;
    logger.atFine().log(
        "New variable %s %s%s", type, var.identifier(), lazy(() -> dimsToString(dims)));
    return var;
  }

  private static String dimsToString(int @Nullable [] dims) {
    return (dims == null) ? "" : Arrays.toString(dims);
  }

  /**
   * Creates an IndexedVariable that offsets each index by its axis's leading padding, with the
   * given indices (values that are not Nodes are added to this graph as {@link Constant}s).
   */
  public IndexedVariable newIndexedVariable(Variable var, Object... indices) {
    return newIndexedVariable(var, true, Arrays.asList(indices));
  }

  /** Creates an IndexedVariable with the given indices. */
  public IndexedVariable newIndexedVariable(
      Variable var, boolean paddingToOffset, List<?> indices) {
    List<Node> nodeIndices = new ArrayList<>();
    for (Object index : indices) {
      nodeIndices.add((index instanceof Node node) ? node : newConstant(index));
    }
    return add(new IndexedVariable(var, paddingToOffset).setIndices(nodeIndices));
  }

  /**
   * Returns a listing of every node, one per line, with its index, its kind, its rendering, and its
   * edges.
   */
  public String printNodes() {
    StringBuilder sb = new StringBuilder();
    String fmt = "%" + StringUtil.numDigits(Math.max(0, nodes.size() - 1)) + "d";
    for (Node node : nodes) {
      sb.append(String.format(fmt, node.index()))
          .append(": ")
          .append(node.getClass().getSimpleName())
          .append(" ")
          .append(StringUtil.safeToString(node));
      for (Edge edge : node.edges()) {
        sb.append("\n    ").append(edge.name()).append(" -> ").append(edge.target().describe());
      }
      sb.append("\n");
    }
    return sb.toString();
  }

  /** If {@link #verbose} is set, logs {@link #printNodes} with the given label. */
  public void logNodes(String where) {
    if (verbose) {
      logger.atInfo().log("%s (%s nodes):\n%s", where, nodes.size(), lazy(this::printNodes));
    } else {
      logger.atFine().log("%s: %s nodes, %s variables", where, nodes.size(), nextVariableIndex);
    }
  }
}
