// Copyright 2010-2025 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.fzn2sat.mapper;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.ortools.Loader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests which variables a translated model prints. */
public final class OutputSpecTest {
  @BeforeEach
  public void setUp() {
    Loader.loadNativeLibraries();
  }

  private static OutputSpec output(String source) {
    return new FlatZincTranslator().translate(source).getOutput();
  }

  @Test
  public void testBuild_annotatedOnly() throws Exception {
    final OutputSpec spec =
        output(
            "var 1..3: x :: output_var;\n"
                + "var 1..3: hidden;\n"
                + "array [1..4] of var bool: m :: output_array([1..2, 0..1]);\n");
    assertThat(spec.getEntries()).hasSize(2);
    final OutputSpec.Entry x = spec.getEntries().get(0);
    assertThat(x.getName()).isEqualTo("x");
    assertThat(x.isArray()).isFalse();
    final OutputSpec.Entry m = spec.getEntries().get(1);
    assertThat(m.getName()).isEqualTo("m");
    assertThat(m.getKind()).isEqualTo(VarKind.BOOL);
    assertThat(m.getVars()).hasSize(4);
    assertThat(m.getDimensions()).hasSize(2);
    assertThat(m.getDimensions().get(1)).asList().containsExactly(0L, 1L).inOrder();
  }

  @Test
  public void testBuild_parameterArrayOutput() throws Exception {
    final OutputSpec spec =
        output("array [1..2] of int: p :: output_array([1..2]) = [4, 5];\nvar 0..1: y;");
    assertThat(spec.getEntries()).hasSize(1);
    assertThat(MappingContext.fixedValue(spec.getEntries().get(0).getVars().get(1)))
        .isEqualTo(5L);
  }

  @Test
  public void testBuild_everythingWithoutAnnotations() throws Exception {
    final OutputSpec spec = output("var 1..3: x; array [1..2] of var 0..1: a; int: k = 3;");
    assertThat(spec.getEntries()).hasSize(2);
    assertThat(spec.getEntries().get(0).getName()).isEqualTo("x");
    assertThat(spec.getEntries().get(1).getName()).isEqualTo("a");
    assertThat(spec.getEntries().get(1).getDimensions().get(0))
        .asList()
        .containsExactly(1L, 2L)
        .inOrder();
  }

  @Test
  public void testBuild_shapeMismatch() throws Exception {
    assertThrows(
        MapException.class,
        () -> output("array [1..3] of var 0..1: a :: output_array([1..2, 1..2]);"));
  }

  @Test
  public void testBuild_nonRangeDimension() throws Exception {
    assertThrows(
        MapException.UnsupportedExpression.class,
        () -> output("array [1..2] of var 0..1: a :: output_array([2]);"));
  }
}
