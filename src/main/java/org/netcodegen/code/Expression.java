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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.Map;
import org.netcodegen.graph.Edge;
import org.netcodegen.graph.IrException;
import org.netcodegen.graph.Node;
import org.netcodegen.graph.RenderContext;

/**
 * A node that renders a {@link Snippet} with each placeholder replaced by the rendering of the
 * child bound to it. For example, {@code "{a} + {b}"} with {@code a} and {@code b} bound to
 * constants 1 and 2 renders as {@code "1 + 2"}.
 *
 * <p>Each placeholder name is bound by an {@link Edge#OPERAND} edge with the same name; the
 * constructor attaches them in order of each name's first appearance in the template. It checks
 * that the placeholders and the bindings correspond exactly; since edges can be attached later,
 * {@link #render} checks again.
 */
public class Expression extends Node {

  public final Snippet snippet;

  /**
   * Creates an Expression from a template and its bindings. A binding whose value is not a {@link
   * Node} is wrapped in a {@link Constant}.
   */
  public Expression(String snippet, Map<String, ?> operands) {
    this(Snippet.parse(snippet), operands);
  }

  public Expression(Snippet snippet, Map<String, ?> operands) {
    this.snippet = snippet;
    ImmutableSet<String> names = snippet.names();
    if (!names.equals(operands.keySet())) {
      throw new IrException.TemplateMismatch(
          describe(),
          "new Expression",
          String.format(
              "unbound placeholders %s, unused operands %s",
              Sets.difference(names, operands.keySet()),
              Sets.difference(operands.keySet(), names)));
    }
    // Template order, so that the edge order doesn't depend on how the caller's map iterates.
    for (String name : names) {
      addEdge(name, asNode(operands.get(name)), Edge.OPERAND);
    }
  }

  /** Returns {@code value} if it is a Node, or a new {@link Constant} wrapping it. */
  static Node asNode(Object value) {
    return (value instanceof Node node) ? node : new Constant(value);
  }

  /** Returns the child bound to the given placeholder. */
  public Node operand(String name) {
    return getNode(name);
  }

  @Override
  public String render(RenderContext context) {
    ImmutableSet<String> names = snippet.names();
    for (Edge edge : edges()) {
      if (edge.kind().equals(Edge.OPERAND) && !names.contains(edge.name())) {
        throw new IrException.TemplateMismatch(
            describe(), "render", "operand '" + edge.name() + "' has no placeholder");
      }
    }
    return snippet.format(
        name -> {
          Edge edge = edge(name);
          if (edge == null) {
            throw new IrException.MissingEdge(this, "render", name);
          }
          return edge.target().render(context);
        });
  }

  @Override
  public String describe() {
    return super.describe() + " \"" + snippet.text + "\"";
  }
}
