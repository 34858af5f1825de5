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

import com.google.ortools.Loader;
import java.util.Arrays;
import org.fzn2sat.solver.Solution;
import org.fzn2sat.solver.SolveOutcome;
import org.fzn2sat.solver.SolveStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests the element lowerings. */
public final class ElementLoweringTest {
  @BeforeEach
  public void setUp() {
    Loader.loadNativeLibraries();
  }

  @Test
  public void testLower_constantArrayIsOneBased() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll(
            "var int: i; var 0..100: v; constraint array_int_element(i, [10, 20, 30], v);");
    assertThat(SolveHelper.assignments(outcome, "i", "v"))
        .containsExactly(
            Arrays.asList(1L, 10L), Arrays.asList(2L, 20L), Arrays.asList(3L, 30L));
  }

  @Test
  public void testLower_variableArray() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll(
            "array [1..2] of var 0..1: a; var 1..2: i; var 0..1: v;\n"
                + "constraint array_var_int_element(i, a, v);\n");
    assertThat(outcome.getSolutions()).hasSize(8);
    for (Solution s : outcome.getSolutions()) {
      final long[] a = s.getIntArray("a");
      assertThat(s.getInt("v")).isEqualTo(a[(int) s.getInt("i") - 1]);
    }
  }

  @Test
  public void testLower_explicitOffset() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll(
            "array [1..3] of var 5..7: a = [5, 6, 7]; var -5..5: i; var 0..10: v;\n"
                + "constraint array_var_int_element(i, 0, a, v);\n");
    assertThat(SolveHelper.assignments(outcome, "i", "v"))
        .containsExactly(Arrays.asList(0L, 5L), Arrays.asList(1L, 6L), Arrays.asList(2L, 7L));
  }

  @Test
  public void testLower_boolArray() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll(
            "var 1..3: i; var bool: b; constraint array_bool_element(i, [true, false, true], b);");
    assertThat(SolveHelper.assignments(outcome, "i", "b"))
        .containsExactly(Arrays.asList(1L, 1L), Arrays.asList(2L, 0L), Arrays.asList(3L, 1L));
  }

  @Test
  public void testLower_floatArray() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll(
            "var 1..2: i; var 0.0..5.0: f; constraint array_float_element(i, [1.5, 2.25], f);");
    assertThat(outcome.getSolutions()).hasSize(2);
    for (Solution s : outcome.getSolutions()) {
      assertThat(s.getFloat("f")).isEqualTo(s.getInt("i") == 1 ? 1.5 : 2.25);
    }
  }

  @Test
  public void testLower_emptyArrayIsInfeasible() throws Exception {
    assertThat(
            SolveHelper.solve("var 1..3: i; var 0..1: v; constraint array_int_element(i, [], v);")
                .getStatus())
        .isEqualTo(SolveStatus.UNSATISFIABLE);
  }
}
