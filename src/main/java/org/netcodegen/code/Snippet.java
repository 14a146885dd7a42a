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
import com.google.common.collect.ImmutableSet;
import java.util.function.Function;

/**
 * A parsed C code template with named placeholders, e.g. {@code "{var} / {stride0}"}.
 *
 * <p>A placeholder is a name made of letters, digits, and underscores between braces. Doubled
 * braces ({@code "{{"} and {@code "}}"}) stand for single literal braces, so a template can contain
 * C blocks: {@code "if ({cond}) {{ {body} }}"}. A name may appear more than once.
 */
public final class Snippet {

  /** The template as given. */
  public final String text;

  /**
   * The literal text around the placeholders; {@code literals.get(i)} precedes {@code
   * placeholders.get(i)}, and the last element follows the last placeholder.
   */
  private final ImmutableList<String> literals;

  /** The placeholder names, in order of appearance (with repeats). */
  private final ImmutableList<String> placeholders;

  private Snippet(String text, ImmutableList<String> literals, ImmutableList<String> placeholders) {
    assert literals.size() == placeholders.size() + 1;
    this.text = text;
    this.literals = literals;
    this.placeholders = placeholders;
  }

  /** Parses a template; throws {@link IllegalArgumentException} if it is malformed. */
  public static Snippet parse(String text) {
    Preconditions.checkNotNull(text);
    ImmutableList.Builder<String> literals = ImmutableList.builder();
    ImmutableList.Builder<String> placeholders = ImmutableList.builder();
    StringBuilder literal = new StringBuilder();
    int n = text.length();
    int i = 0;
    while (i < n) {
      char c = text.charAt(i);
      if (c == '}') {
        Preconditions.checkArgument(
            i + 1 < n && text.charAt(i + 1) == '}', "Unmatched '}' at %s in \"%s\"", i, text);
        literal.append('}');
        i += 2;
      } else if (c != '{') {
        literal.append(c);
        i++;
      } else if (i + 1 < n && text.charAt(i + 1) == '{') {
        literal.append('{');
        i += 2;
      } else {
        int close = text.indexOf('}', i + 1);
        Preconditions.checkArgument(close > 0, "Unterminated placeholder at %s in \"%s\"", i, text);
        String name = text.substring(i + 1, close);
        Preconditions.checkArgument(
            isPlaceholderName(name), "Bad placeholder \"{%s}\" in \"%s\"", name, text);
        literals.add(literal.toString());
        literal.setLength(0);
        placeholders.add(name);
        i = close + 1;
      }
    }
    literals.add(literal.toString());
    return new Snippet(text, literals.build(), placeholders.build());
  }

  private static boolean isPlaceholderName(String name) {
    if (name.isEmpty()) {
      return false;
    }
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (!(Character.isLetterOrDigit(c) || c == '_')) {
        return false;
      }
    }
    return true;
  }

  /** Returns the distinct placeholder names, in order of first appearance. */
  public ImmutableSet<String> names() {
    return ImmutableSet.copyOf(placeholders);
  }

  /** Returns the number of placeholder occurrences (counting repeats). */
  public int numPlaceholders() {
    return placeholders.size();
  }

  /**
   * Returns the template with each placeholder replaced by {@code values.apply(name)}. Literal
   * braces are un-doubled.
   */
  public String format(Function<String, String> values) {
    StringBuilder sb = new StringBuilder(literals.get(0));
    for (int i = 0; i < placeholders.size(); i++) {
      sb.append(values.apply(placeholders.get(i))).append(literals.get(i + 1));
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return text;
  }
}
