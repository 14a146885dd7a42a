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
import com.google.common.math.IntMath;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.netcodegen.graph.IrException;
import org.netcodegen.graph.Node;
import org.netcodegen.graph.RenderContext;
import org.netcodegen.util.StringUtil;

/**
 * A named storage location in the generated code: either a scalar or an n-dimensional array. We'll
 * use an array declared as {@code float w_0[3][3]} as the running example.
 *
 * <p>A Variable renders as its identifier, which is its base name followed by its unique index
 * ({@code w_0}); two variables created with the same base name never collide. It renders without
 * subscripts; see {@link IndexedVariable} for element access.
 *
 * <p>An array may be given padding: extra elements before and after the logical range on each
 * axis, so that rows can meet the alignment that vectorized kernels require. Padding increases the
 * size in the declaration ({@code float w_0[5][5]} if each axis is padded by one on each side) but
 * doesn't change how indices are interpreted elsewhere; an {@link IndexedVariable} can add the
 * leading padding to each index so that logical index 0 is the first element past the padding.
 */
public class Variable extends Node {

  /** The amount of padding before and after the logical elements on one axis. */
  public record Pad(int leading, int trailing) {
    public static final Pad NONE = new Pad(0, 0);

    public Pad {
      Preconditions.checkArgument(
          leading >= 0 && trailing >= 0, "Negative padding (%s, %s)", leading, trailing);
    }
  }

  /** The C element type, e.g. {@code "float"} or {@code "int"}. */
  public final String type;

  /** The base name; {@link #identifier} appends {@link #uniqueIndex}. */
  public final String name;

  /** Distinguishes this variable from others with the same base name. */
  public final int uniqueIndex;

  /** The logical size of each axis, or null for a scalar. */
  private final int @Nullable [] dims;

  /** The flattened initial contents, or null if there are none. */
  private final double @Nullable [] initData;

  /** Required alignment in bytes; zero means no requirement. */
  private int alignment;

  /** One entry per axis ({@code pads.size() == numDims()}). */
  private ImmutableList<Pad> pads;

  /** Set once {@link #declaration} has returned this variable's declaration. */
  private boolean declared;

  /**
   * Creates a Variable.
   *
   * @param type the C element type
   * @param name the base name; must be a valid C identifier
   * @param dims the size of each axis, or null for a scalar
   * @param alignment the required alignment in bytes, or zero for none; can be changed later
   * @param uniqueIndex appended to {@code name} to make the identifier unique
   * @param initData the flattened initial contents (one value per logical element), or null
   */
  public Variable(
      String type,
      String name,
      int @Nullable [] dims,
      int alignment,
      int uniqueIndex,
      double @Nullable [] initData) {
    Preconditions.checkArgument(StringUtil.isIdentifier(name), "Bad variable name \"%s\"", name);
    Preconditions.checkArgument(uniqueIndex >= 0);
    this.type = Preconditions.checkNotNull(type);
    this.name = name;
    this.uniqueIndex = uniqueIndex;
    if (dims != null) {
      Preconditions.checkArgument(dims.length > 0, "Use null dims for a scalar");
      for (int d : dims) {
        Preconditions.checkArgument(d > 0, "Bad dimensions %s", Arrays.toString(dims));
      }
      dims = dims.clone();
    }
    this.dims = dims;
    if (initData != null) {
      Preconditions.checkArgument(
          initData.length == numElements(),
          "%s has %s elements but %s initial values",
          identifier(),
          numElements(),
          initData.length);
      initData = initData.clone();
    }
    this.initData = initData;
    setAlignment(alignment);
    this.pads = ImmutableList.copyOf(Collections.nCopies(numDims(), Pad.NONE));
  }

  /** Returns the name used for this variable in generated code, e.g. {@code w_0}. */
  public String identifier() {
    return name + "_" + uniqueIndex;
  }

  /** Returns the number of axes; zero for a scalar. */
  public int numDims() {
    return (dims == null) ? 0 : dims.length;
  }

  /** True if this variable is an array. */
  public boolean isArray() {
    return dims != null;
  }

  /** Returns a copy of the logical dimensions, or null for a scalar. */
  public int @Nullable [] dims() {
    return (dims == null) ? null : dims.clone();
  }

  /** Returns the logical size of the given axis. */
  public int dim(int axis) {
    Preconditions.checkElementIndex(axis, numDims());
    return dims[axis];
  }

  /**
   * Returns the number of logical elements (1 for a scalar). Throws {@link ArithmeticException} if
   * that doesn't fit in an int.
   */
  public int numElements() {
    int result = 1;
    for (int i = 0; i < numDims(); i++) {
      result = IntMath.checkedMultiply(result, dims[i]);
    }
    return result;
  }

  /** True if this variable has initial contents. */
  public boolean hasInitData() {
    return initData != null;
  }

  /** Returns the required alignment in bytes (zero for none). */
  public int alignment() {
    return alignment;
  }

  /** Sets the required alignment in bytes; zero for none. */
  public void setAlignment(int bytes) {
    Preconditions.checkArgument(bytes >= 0, "Bad alignment %s", bytes);
    this.alignment = bytes;
  }

  /**
   * Returns the alignment directive for the declaration, or the empty string if no alignment is
   * required. The argument is eight times the alignment in bytes.
   */
  public String alignmentDirective() {
    return (alignment > 0) ? "alignas(" + (8 * alignment) + ")" : "";
  }

  /** Returns the padding on each axis. */
  public ImmutableList<Pad> padding() {
    return pads;
  }

  /** Returns the padding before the logical elements on the given axis. */
  public int leadingPad(int axis) {
    return pads.get(axis).leading();
  }

  /** Replaces the padding; there must be exactly one {@link Pad} per axis. */
  public void setPadding(List<Pad> pads) {
    if (pads.size() != numDims()) {
      throw new IrException.PaddingArity(this, "setPadding", numDims(), pads.size());
    }
    this.pads = ImmutableList.copyOf(pads);
  }

  /**
   * Returns the declared (padded) size of the given axis. Throws {@link ArithmeticException} on
   * overflow.
   */
  public int paddedDim(int axis) {
    Pad pad = pads.get(axis);
    return IntMath.checkedAdd(IntMath.checkedAdd(dim(axis), pad.leading()), pad.trailing());
  }

  /** Returns the array part of the declaration, e.g. {@code "[5][5]"}; empty for a scalar. */
  String dimensionText() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < numDims(); i++) {
      sb.append('[').append(paddedDim(i)).append(']');
    }
    return sb.toString();
  }

  /** True if {@link #declaration} has already been called. */
  public boolean isDeclared() {
    return declared;
  }

  /**
   * Returns a complete definition of this variable, e.g.
   *
   * <pre>
   * static float w_0 alignas(128) [5][5] = { 1.00000000000000e+00,... };
   * </pre>
   *
   * <p>If {@code embedData} is true and this variable has initial contents, each value is written
   * with 15 significant digits; otherwise the initializer is a single zero. Any elements without an
   * initial value (including all padding) are zero-initialized by C.
   *
   * <p>Only the first call returns the definition; later calls return the empty string.
   */
  public String declaration(boolean embedData) {
    if (declared) {
      return "";
    }
    String data;
    if (embedData && initData != null) {
      double[] values = initData;
      data =
          StringUtil.joinElements(
              "", ",", "", values.length, i -> StringUtil.scientific(values[i]));
    } else {
      data = "0";
    }
    StringBuilder sb = new StringBuilder("static ").append(type).append(' ').append(identifier());
    appendIfPresent(sb, alignmentDirective());
    appendIfPresent(sb, dimensionText());
    sb.append(" = { ").append(data).append(" };\n");
    declared = true;
    return sb.toString();
  }

  /**
   * Returns a declaration of this variable as a pointer, for storage that will be supplied at
   * runtime rather than embedded in the code, e.g. {@code float *w_0 alignas(128);}.
   */
  public String pointerDeclaration() {
    StringBuilder sb = new StringBuilder(type).append(" *").append(identifier());
    appendIfPresent(sb, alignmentDirective());
    return sb.append(";\n").toString();
  }

  /** Returns a cast to a pointer to this variable's element type, e.g. {@code (float*)}. */
  public String cast() {
    return "(" + type + "*)";
  }

  private static void appendIfPresent(StringBuilder sb, String s) {
    if (!s.isEmpty()) {
      sb.append(' ').append(s);
    }
  }

  /** Returns the identifier, unless the context overrides this variable. */
  @Override
  public String render(RenderContext context) {
    String override = context.override(this);
    return (override != null) ? override : identifier();
  }

  @Override
  public String describe() {
    return identifier();
  }
}
