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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A RenderContext is passed to {@link Node#render} and lets the caller substitute text for
 * particular nodes without changing them. The main use is loop unrolling: a loop counter variable
 * is rendered as a concrete index (e.g. {@code 3}) while the graph itself, and the variable's
 * identity and declaration state, are unchanged.
 *
 * <p>{@link #DEFAULT} substitutes nothing.
 */
@FunctionalInterface
public interface RenderContext {

  /**
   * Returns the text to use in place of {@code node}'s usual rendering, or null if it should be
   * rendered normally. Only nodes that support overriding (variables) consult this.
   */
  @Nullable String override(Node node);

  /**
   * Returns a RenderContext that renders {@code node} as {@code String.valueOf(value)} and
   * delegates every other node to {@code parent}.
   */
  static RenderContext withOverride(RenderContext parent, Node node, Object value) {
    String text = String.valueOf(value);
    return n -> (n == node) ? text : parent.override(n);
  }

  /**
   * Returns a RenderContext with an override for each key of {@code overrides}, and no others.
   * Nodes do not override {@code equals}, so lookups are by identity.
   */
  static RenderContext withOverrides(Map<? extends Node, ?> overrides) {
    ImmutableMap.Builder<Node, String> builder = ImmutableMap.builder();
    overrides.forEach((n, v) -> builder.put(n, String.valueOf(v)));
    ImmutableMap<Node, String> map = builder.buildOrThrow();
    return map::get;
  }

  RenderContext DEFAULT = n -> null;
}
