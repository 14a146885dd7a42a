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

package org.netcodegen.util;

import java.util.Locale;
import java.util.function.IntFunction;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/** Static-only class with methods for building the text of generated C code. */
public class StringUtil {

  private StringUtil() {}

  /**
   * The number of significant digits written for floating-point initializer data; enough for any
   * float (and all but the last bit of a double) to survive a trip through C source text.
   */
  public static final int LITERAL_DIGITS = 15;

  private static final String LITERAL_FORMAT = "%." + (LITERAL_DIGITS - 1) + "e";

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  /**
   * Constructs a string by calling the given IntFunction for each int from 0 to size-1, calling
   * {@code String.valueOf()} on each element, separating them with {@code separator}, and adding
   * the given prefix and suffix.
   */
  public static String joinElements(
      String prefix, String separator, String suffix, int size, IntFunction<Object> elements) {
    assert size >= 0;
    return IntStream.range(0, size)
        .mapToObj(i -> String.valueOf(elements.apply(i)))
        .collect(Collectors.joining(separator, prefix, suffix));
  }

  /**
   * Formats {@code d} as a C floating-point literal in scientific notation with {@link
   * #LITERAL_DIGITS} significant digits, e.g. {@code 1.00000000000000e+00}.
   *
   * <p>NaN and infinities have no literal form in C and are rejected.
   */
  public static String scientific(double d) {
    if (Double.isNaN(d) || Double.isInfinite(d)) {
      throw new IllegalArgumentException("No C literal for " + d);
    }
    // Locale.ROOT so that the decimal separator is always '.'
    return String.format(Locale.ROOT, LITERAL_FORMAT, d);
  }

  /** Returns true if {@code s} is usable as a C identifier (ignoring reserved words). */
  public static boolean isIdentifier(String s) {
    return s != null && IDENTIFIER.matcher(s).matches();
  }

  /**
   * Returns the number of digits in the decimal representation of the given int. Not intended for
   * use with negative numbers (the current implementation will always return 1).
   */
  public static int numDigits(int n) {
    int result = 1;
    for (long powerOfTen = 10; n >= powerOfTen; powerOfTen *= 10) {
      ++result;
    }
    return result;
  }

  /**
   * Call {@link String#valueOf} but swallow any errors; intended for formatting errors when the
   * graph is already known to be in a bad state.
   */
  public static String safeToString(Object x) {
    try {
      return String.valueOf(x);
    } catch (RuntimeException | AssertionError nested) {
      return "(can't print)";
    }
  }
}
