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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.netcodegen.code.Variable.Pad;
import org.netcodegen.graph.Edge;
import org.netcodegen.graph.IrException;
import org.netcodegen.graph.Node;
import org.netcodegen.traverse.TraverseAction;
import org.netcodegen.traverse.VisitDecision;

/**
 * Collects the variables that a piece of generated code refers to, so that their declarations can
 * be written ahead of it.
 *
 * <p>Variables are collected in post-order (a variable is recorded once everything below the edge
 * that leads to it has been visited), and each variable is recorded once no matter how many edges
 * lead to it.
 *
 * <p>Two distinct Variables may end up with the same identifier (the lowering code may choose
 * unique indices itself). If their storage matches (type, dimensions, padding and alignment) only
 * the first is declared; if not, {@link IrException.IdentityConflict} is thrown, since the single
 * declaration couldn't be right for both.
 */
public class Declarations extends TraverseAction {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final List<Variable> variables = new ArrayList<>();

  private final Set<Variable> seen = Sets.newIdentityHashSet();

  /** The first variable recorded with each identifier. */
  private final Map<String, Variable> byIdentifier = new HashMap<>();

  /** Returns a Declarations containing every variable reachable from {@code root}. */
  public static Declarations collect(Node root) {
    Declarations result = new Declarations();
    result.addAll(root);
    return result;
  }

  /** Adds every variable reachable from {@code root} (including root, if it is a Variable). */
  public void addAll(Node root) {
    int before = variables.size();
    traverse(root);
    if (root instanceof Variable var) {
      add(var);
    }
    logger.atFine().log(
        "Collected %s variable(s) below %s", variables.size() - before, root.describe());
  }

  /**
   * Adds a single variable. Does nothing if it (or a matching variable with the same identifier)
   * has already been added.
   */
  public void add(Variable var) {
    if (!seen.add(var)) {
      return;
    }
    Variable previous = byIdentifier.putIfAbsent(var.identifier(), var);
    if (previous == null) {
      variables.add(var);
    } else {
      String previousSignature = signature(previous);
      String signature = signature(var);
      if (!previousSignature.equals(signature)) {
        throw new IrException.IdentityConflict(var, "declare", previousSignature, signature);
      }
    }
  }

  /**
   * Describes everything about a variable's storage that its declaration or its subscripts depend
   * on, e.g. {@code float[4]}, or {@code float[2+4+2] alignas(128)} if padded and aligned.
   */
  private static String signature(Variable var) {
    StringBuilder sb = new StringBuilder(var.type);
    boolean padded = var.padding().stream().anyMatch(pad -> !pad.equals(Pad.NONE));
    for (int i = 0; i < var.numDims(); i++) {
      sb.append('[');
      if (padded) {
        Pad pad = var.padding().get(i);
        sb.append(pad.leading()).append('+').append(var.dim(i)).append('+').append(pad.trailing());
      } else {
        sb.append(var.dim(i));
      }
      sb.append(']');
    }
    if (var.alignment() > 0) {
      sb.append(' ').append(var.alignmentDirective());
    }
    return sb.toString();
  }

  /** Returns the collected variables, in the order they were recorded. */
  public ImmutableList<Variable> variables() {
    return ImmutableList.copyOf(variables);
  }

  /**
   * Returns the concatenated definitions of all collected variables (see {@link
   * Variable#declaration}). Variables that have already been declared contribute nothing.
   */
  public String render(boolean embedData) {
    StringBuilder sb = new StringBuilder();
    for (Variable var : variables) {
      sb.append(var.declaration(embedData));
    }
    return sb.toString();
  }

  /** Returns the concatenated pointer declarations of all collected variables. */
  public String renderPointers() {
    StringBuilder sb = new StringBuilder();
    for (Variable var : variables) {
      sb.append(var.pointerDeclaration());
    }
    return sb.toString();
  }

  @Override
  protected VisitDecision preVisit(Edge edge) {
    return VisitDecision.DESCEND;
  }

  @Override
  protected void postVisit(Edge edge) {
    if (edge.target() instanceof Variable var) {
      add(var);
    }
  }
}
