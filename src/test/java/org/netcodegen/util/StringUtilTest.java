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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class StringUtilTest {

  @Test
  public void joinElements() {
    List<String> parts = List.of("a", "b", "c");
    assertThat(StringUtil.joinElements("[", "][", "]", 3, parts::get)).isEqualTo("[a][b][c]");
    assertThat(StringUtil.joinElements("(", ", ", ")", 0, parts::get)).isEqualTo("()");
  }

  @Test
  public void scientific() {
    assertThat(StringUtil.scientific(1)).isEqualTo("1.00000000000000e+00");
    assertThat(StringUtil.scientific(0)).isEqualTo("0.00000000000000e+00");
    assertThat(StringUtil.scientific(-0.001)).isEqualTo("-1.00000000000000e-03");
    assertThat(StringUtil.scientific(123456.789)).isEqualTo("1.23456789000000e+05");
    assertThat(StringUtil.scientific(1.0 / 3)).isEqualTo("3.33333333333333e-01");
    assertThat(StringUtil.scientific(6.02214076e23)).isEqualTo("6.02214076000000e+23");
  }

  @Test
  public void scientificKeepsFloatPrecision() {
    float[] values = {0.1f, (float) Math.PI, 1.17549435e-38f, 3.4028235e38f, -7.6293945e-6f};
    for (float f : values) {
      assertThat(Float.parseFloat(StringUtil.scientific(f))).isEqualTo(f);
    }
  }

  @Test
  public void scientificRejectsNonFinite() {
    assertThrows(IllegalArgumentException.class, () -> StringUtil.scientific(Double.NaN));
    assertThrows(
        IllegalArgumentException.class, () -> StringUtil.scientific(Double.NEGATIVE_INFINITY));
  }

  @Test
  public void identifiers() {
    assertThat(StringUtil.isIdentifier("conv2d_weights")).isTrue();
    assertThat(StringUtil.isIdentifier("_x")).isTrue();
    assertThat(StringUtil.isIdentifier("2x")).isFalse();
    assertThat(StringUtil.isIdentifier("a-b")).isFalse();
    assertThat(StringUtil.isIdentifier("")).isFalse();
    assertThat(StringUtil.isIdentifier(null)).isFalse();
  }

  @Test
  public void numDigits() {
    assertThat(StringUtil.numDigits(0)).isEqualTo(1);
    assertThat(StringUtil.numDigits(9)).isEqualTo(1);
    assertThat(StringUtil.numDigits(10)).isEqualTo(2);
    assertThat(StringUtil.numDigits(999)).isEqualTo(3);
    assertThat(StringUtil.numDigits(Integer.MAX_VALUE)).isEqualTo(10);
  }

  @Test
  public void safeToString() {
    Object broken =
        new Object() {
          @Override
          public String toString() {
            throw new IllegalStateException();
          }
        };
    assertThat(StringUtil.safeToString(broken)).isEqualTo("(can't print)");
    assertThat(StringUtil.safeToString(null)).isEqualTo("null");
  }
}
