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
import org.netcodegen.graph.Node;
import org.netcodegen.graph.RenderContext;

/**
 * A leaf node that renders a fixed value, e.g. a stride, a loop bound, or a scalar weight.
 *
 * <p>The value is rendered with {@link String#valueOf}, which for the boxed numeric types produces
 * text that parses back to exactly the same value.
 */
public class Constant extends Node {

  public final Object value;

  public Constant(Object value) {
    this.value = Preconditions.checkNotNull(value);
  }

  @Override
  public String render(RenderContext context) {
    return String.valueOf(value);
  }

  @Override
  public String describe() {
    return super.describe() + " " + value;
  }
}
