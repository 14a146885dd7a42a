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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.netcodegen.code.Variable.Pad;
import org.netcodegen.graph.IrException;
import org.netcodegen.graph.Node;
import org.netcodegen.graph.RenderContext;
import org.netcodegen.traverse.SearchNode;

@RunWith(JUnit4.class)
public class CodeGraphTest {

  private CodeGraph graph;

  @Before
  public void setup() {
    graph = new CodeGraph();
    graph.verbose = true;
  }

  /**
   * Builds a small 1-D convolution step ({@code out[x] = in[x]*k[0] + in[x+1]*k[1] + in[x+2]*k[2]})
   * with the kernel loop unrolled, and returns its emitted text.
   */
  private static String emitConvolution(CodeGraph graph) {
    Variable in = graph.newVariable("float", "in", new int[] {8}, 16, null);
    in.setPadding(List.of(new Pad(1, 3)));
    Variable kernel =
        graph.newVariable("float", "k", new int[] {3}, 0, new double[] {0.25, 0.5, 0.25});
    Variable out = graph.newVariable("float", "out", new int[] {6}, 0, null);
    Variable x = graph.newScalar("int", "x");
    Variable t = graph.newScalar("int", "t");
    Expression position = graph.newExpression("{x} + {t}", ImmutableMap.of("x", x, "t", t));
    Node tap =
        graph.newExpression(
            "{in} * {k}",
            ImmutableMap.of(
                "in", graph.newIndexedVariable(in, true, List.of(position)),
                "k", graph.newIndexedVariable(kernel, false, List.of(t))));
    StringBuilder sum = new StringBuilder();
    for (int i = 0; i < 3; i++) {
      RenderContext unrolled = RenderContext.withOverride(RenderContext.DEFAULT, t, i);
      sum.append(i == 0 ? "" : " + ").append(tap.render(unrolled));
    }
    Expression statement =
        graph.newExpression(
            "for (int {x} = 0; {x} < {n}; {x}++) {{ {dst} = {sum}; }}",
            ImmutableMap.of(
                "x", x,
                "n", 6,
                "dst", graph.newIndexedVariable(out, x),
                "sum", new Constant(sum.toString())));
    Declarations decls = Declarations.collect(statement);
    decls.addAll(tap);
    graph.logNodes("convolution");
    return decls.render(true) + statement + "\n";
  }

  @Test
  public void indicesAndUniqueNames() {
    Variable a = graph.newScalar("float", "w");
    Variable b = graph.newScalar("float", "w");
    Constant c = graph.newConstant(1);
    assertThat(a.identifier()).isEqualTo("w_0");
    assertThat(b.identifier()).isEqualTo("w_1");
    assertThat(graph.numVariables()).isEqualTo(2);
    assertThat(graph.numNodes()).isEqualTo(3);
    assertThat(c.index()).isEqualTo(2);
    assertThat(graph.node(1)).isSameInstanceAs(b);
    assertThat(graph.nodes()).containsExactly(a, b, c).inOrder();
  }

  @Test
  public void nodeCanOnlyBeAddedOnce() {
    Constant c = graph.newConstant(1);
    assertThrows(IllegalStateException.class, () -> new CodeGraph().add(c));
  }

  @Test
  public void expressionConstantsJoinTheGraph() {
    Variable x = graph.newScalar("float", "x");
    Expression e = graph.newExpression("{a} + {b}", ImmutableMap.of("a", x, "b", 1));
    assertThat(graph.numNodes()).isEqualTo(3);
    assertThat(e.operand("b").index()).isEqualTo(1);
    assertThat(graph.printNodes())
        .isEqualTo(
            "0: Variable x_0\n"
                + "1: Constant 1\n"
                + "2: Expression x_0 + 1\n"
                + "    a -> x_0\n"
                + "    b -> Constant#1 1\n");
  }

  @Test
  public void indexedVariableFactory() {
    Variable w = graph.newVariable("float", "w", new int[] {3, 3}, 0, null);
    IndexedVariable element = graph.newIndexedVariable(w, 1, 2);
    assertThat(element.toString()).isEqualTo("w_0[1 + 0][2 + 0]");
    assertThat(graph.numNodes()).isEqualTo(4);
  }

  @Test
  public void emissionIsByteIdentical() {
    String first = emitConvolution(new CodeGraph());
    String second = emitConvolution(new CodeGraph());
    assertThat(second).isEqualTo(first);
    assertThat(first)
        .isEqualTo(
            "static int x_3 = { 0 };\n"
                + "static float out_2 [6] = { 0 };\n"
                + "static float in_0 alignas(128) [12] = { 0 };\n"
                + "static int t_4 = { 0 };\n"
                + "static float k_1 [3] = { 2.50000000000000e-01,5.00000000000000e-01,"
                + "2.50000000000000e-01 };\n"
                + "for (int x_3 = 0; x_3 < 6; x_3++) { out_2[x_3 + 0] = "
                + "in_0[x_3 + 0 + 1] * k_1[0] + in_0[x_3 + 1 + 1] * k_1[1]"
                + " + in_0[x_3 + 2 + 1] * k_1[2]; }\n");
  }

  @Test
  public void searchesAreRepeatable() {
    emitConvolution(graph);
    Node root = graph.node(graph.numNodes() - 1);
    ImmutableList<ImmutableList<Node>> first = SearchNode.forKind(Variable.class).search(root);
    ImmutableList<ImmutableList<Node>> second = SearchNode.forKind(Variable.class).search(root);
    assertThat(second).isEqualTo(first);
    assertThat(first).hasSize(3);
  }

  @Test
  public void quietLogging() {
    graph.verbose = false;
    graph.newScalar("int", "n");
    graph.logNodes("quiet");
    assertThat(graph.printNodes()).isEqualTo("0: Variable n_0\n");
  }
  @Test
  public void expressionConstantsAreCreatedInTemplateOrder() {
    Map<String, Object> operands = new LinkedHashMap<>();
    operands.put("b", 2);
    operands.put("a", 1);
    Expression e = graph.newExpression("{a} - {b}", operands);
    assertThat(e.operand("a").index()).isEqualTo(0);
    assertThat(e.operand("b").index()).isEqualTo(1);
    assertThat(e.index()).isEqualTo(2);
    assertThat(e.toString()).isEqualTo("1 - 2");
  }

  @Test
  public void unusedOperandIsStillRejected() {
    assertThrows(
        IrException.TemplateMismatch.class,
        () -> graph.newExpression("{a}", ImmutableMap.of("z", 2, "a", 1)));
  }
}
