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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import org.netcodegen.graph.Edge;
import org.netcodegen.graph.Node;
import org.netcodegen.graph.RenderContext;

/**
 * An element (or sub-array) of a {@link Variable}: renders as the variable followed by one
 * subscript per index, e.g. {@code w_0[i_1][j_2]}.
 *
 * <p>If {@link #paddingToOffset} is true each subscript also adds the leading padding of its axis
 * ({@code w_0[i_1 + 1][j_2 + 0]}), so that index 0 refers to the first element after the padding.
 * This lets a layer that doesn't know about padding address an array that was padded for the
 * benefit of some other layer.
 */
public class IndexedVariable extends Node {

  /** The name of the edge to the indexed variable. */
  public static final String VAR_EDGE = "var";

  /** If true, each subscript is offset by the leading padding of its axis. */
  public final boolean paddingToOffset;

  public IndexedVariable(Variable var, boolean paddingToOffset) {
    addEdge(VAR_EDGE, var, Edge.VAR);
    this.paddingToOffset = paddingToOffset;
  }

  /** Equivalent to {@code new IndexedVariable(var, true)}. */
  public IndexedVariable(Variable var) {
    this(var, true);
  }

  /** Returns the indexed variable. */
  public Variable variable() {
    Node node = getNode(VAR_EDGE);
    Preconditions.checkState(node instanceof Variable, "%s is not a Variable", node.describe());
    return (Variable) node;
  }

  /**
   * Sets the index for each of the first {@code indices.size()} axes; values that are not Nodes
   * are wrapped in {@link Constant}s. The i-th index is attached as an {@link Edge#INDEX} edge
   * named {@code "i"}, replacing any index previously set for that axis.
   *
   * <p>More indices than the variable has axes are rejected whether or not {@link
   * #paddingToOffset} is set.
   */
  @CanIgnoreReturnValue
  public IndexedVariable setIndices(List<?> indices) {
    Preconditions.checkArgument(
        indices.size() <= variable().numDims(),
        "%s indices for %s, which has %s dimensions",
        indices.size(),
        variable().describe(),
        variable().numDims());
    for (int i = 0; i < indices.size(); i++) {
      addEdge(String.valueOf(i), Expression.asNode(indices.get(i)), Edge.INDEX);
    }
    return this;
  }

  /** Returns the indices, in axis order. */
  public ImmutableList<Node> indices() {
    return getNodesByKind(Edge.INDEX);
  }

  @Override
  public String render(RenderContext context) {
    Variable var = variable();
    ImmutableList<Node> indices = indices();
    Preconditions.checkState(
        indices.size() <= var.numDims(), "Too many indices for %s", var.describe());
    StringBuilder sb = new StringBuilder(var.render(context));
    for (int axis = 0; axis < indices.size(); axis++) {
      sb.append('[').append(indices.get(axis).render(context));
      if (paddingToOffset) {
        sb.append(" + ").append(var.leadingPad(axis));
      }
      sb.append(']');
    }
    return sb.toString();
  }
}
