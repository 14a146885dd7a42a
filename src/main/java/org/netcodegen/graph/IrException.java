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

/**
 * Thrown when a graph violates one of the structural rules that code generation depends on. These
 * are never recoverable; the compile that encountered one should be abandoned without writing any
 * output.
 *
 * <p>Each IrException records a description of the node at fault (see {@link Node#describe}) and
 * the operation that was being attempted.
 */
public abstract class IrException extends RuntimeException {

  /** A description of the offending node, as returned by {@link Node#describe}. */
  public final String node;

  /** The operation that failed, e.g. {@code "getNode(var)"} or {@code "render"}. */
  public final String operation;

  IrException(String node, String operation, String detail) {
    super(String.format("%s: %s (in %s)", operation, detail, node));
    this.node = node;
    this.operation = operation;
  }

  /** A required edge (by name, or for a template placeholder) is not present. */
  public static class MissingEdge extends IrException {
    /** The name of the edge that was requested. */
    public final String edgeName;

    public MissingEdge(Node node, String operation, String edgeName) {
      super(node.describe(), operation, "no edge named '" + edgeName + "'");
      this.edgeName = edgeName;
    }
  }

  /** An expression's template and the edges bound to it don't correspond. */
  public static class TemplateMismatch extends IrException {
    public TemplateMismatch(String node, String operation, String detail) {
      super(node, operation, detail);
    }
  }

  /** A padding specification doesn't have one (leading, trailing) pair per dimension. */
  public static class PaddingArity extends IrException {
    public PaddingArity(Node node, String operation, int expected, int actual) {
      super(
          node.describe(),
          operation,
          String.format("expected %s padding pairs, got %s", expected, actual));
    }
  }

  /** The same identifier was declared twice with different types or shapes. */
  public static class IdentityConflict extends IrException {
    public IdentityConflict(Node node, String operation, String previous, String current) {
      super(
          node.describe(),
          operation,
          String.format("already declared as %s, now %s", previous, current));
    }
  }

  /** A walk found an edge leading back to a node that is still being visited. */
  public static class CyclicGraph extends IrException {
    public CyclicGraph(Node node, String operation, String edgeName) {
      super(node.describe(), operation, "edge '" + edgeName + "' closes a cycle");
    }
  }
}
