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

/** Tests the boolean lowerings against their truth tables. */
public final class BooleanLoweringTest {
  @BeforeEach
  public void setUp() {
    Loader.loadNativeLibraries();
  }

  private static final String ABR = "var bool: a; var bool: b; var bool: r;\n";

  @Test
  public void testLower_boolAnd() throws Exception {
    final SolveOutcome outcome = SolveHelper.solveAll(ABR + "constraint bool_and(a, b, r);");
    assertThat(outcome.getSolutions()).hasSize(4);
    for (Solution s : outcome.getSolutions()) {
      assertThat(s.getBool("r")).isEqualTo(s.getBool("a") && s.getBool("b"));
    }
  }

  @Test
  public void testLower_boolOr() throws Exception {
    final SolveOutcome outcome = SolveHelper.solveAll(ABR + "constraint bool_or(a, b, r);");
    assertThat(outcome.getSolutions()).hasSize(4);
    for (Solution s : outcome.getSolutions()) {
      assertThat(s.getBool("r")).isEqualTo(s.getBool("a") || s.getBool("b"));
    }
  }

  @Test
  public void testLower_boolXorReified() throws Exception {
    final SolveOutcome outcome = SolveHelper.solveAll(ABR + "constraint bool_xor(a, b, r);");
    assertThat(outcome.getSolutions()).hasSize(4);
    for (Solution s : outcome.getSolutions()) {
      assertThat(s.getBool("r")).isEqualTo(s.getBool("a") ^ s.getBool("b"));
    }
  }

  @Test
  public void testLower_boolXorPlain() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll("var bool: a; var bool: b; constraint bool_xor(a, b);");
    assertThat(SolveHelper.assignments(outcome, "a", "b"))
        .containsExactly(Arrays.asList(0L, 1L), Arrays.asList(1L, 0L));
  }

  @Test
  public void testLower_comparisons() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll(
            ABR + "var bool: ne; var bool: le;\n"
                + "constraint bool_lt_reif(a, b, r);\n"
                + "constraint bool_ne_reif(a, b, ne);\n"
                + "constraint bool_le_reif(a, b, le);\n");
    assertThat(outcome.getSolutions()).hasSize(4);
    for (Solution s : outcome.getSolutions()) {
      final boolean a = s.getBool("a");
      final boolean b = s.getBool("b");
      assertThat(s.getBool("r")).isEqualTo(!a && b);
      assertThat(s.getBool("ne")).isEqualTo(a != b);
      assertThat(s.getBool("le")).isEqualTo(!a || b);
    }
  }

  @Test
  public void testLower_notAndBool2Int() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll(
            "var bool: a; var bool: na; var 0..1: i;\n"
                + "constraint bool_not(a, na);\n"
                + "constraint bool2int(a, i);\n");
    assertThat(SolveHelper.assignments(outcome, "a", "na", "i"))
        .containsExactly(Arrays.asList(0L, 1L, 0L), Arrays.asList(1L, 0L, 1L));
  }

  @Test
  public void testLower_arrayBoolAndOr() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll(
            "array [1..3] of var bool: xs; var bool: all; var bool: any;\n"
                + "constraint array_bool_and(xs, all);\n"
                + "constraint array_bool_or(xs, any);\n");
    assertThat(outcome.getSolutions()).hasSize(8);
    for (Solution s : outcome.getSolutions()) {
      final long[] xs = s.getIntArray("xs");
      final long sum = xs[0] + xs[1] + xs[2];
      assertThat(s.getBool("all")).isEqualTo(sum == 3);
      assertThat(s.getBool("any")).isEqualTo(sum > 0);
    }
  }

  @Test
  public void testLower_arrayBoolXorIsOddParity() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll(
            "array [1..3] of var bool: xs; constraint array_bool_xor(xs);");
    assertThat(outcome.getSolutions()).hasSize(4);
    for (Solution s : outcome.getSolutions()) {
      final long[] xs = s.getIntArray("xs");
      assertThat((xs[0] + xs[1] + xs[2]) % 2).isEqualTo(1);
    }
  }

  @Test
  public void testLower_emptyArrayBoolXorIsInfeasible() throws Exception {
    assertThat(SolveHelper.solve("constraint array_bool_xor([]);").getStatus())
        .isEqualTo(SolveStatus.UNSATISFIABLE);
  }

  @Test
  public void testLower_boolClause() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll("var bool: a; var bool: b; constraint bool_clause([a], [b]);");
    assertThat(SolveHelper.assignments(outcome, "a", "b"))
        .containsExactly(
            Arrays.asList(0L, 0L), Arrays.asList(1L, 0L), Arrays.asList(1L, 1L));
  }

  @Test
  public void testLower_boolClauseReified() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll(ABR + "constraint bool_clause_reif([a], [b], r);");
    assertThat(outcome.getSolutions()).hasSize(4);
    for (Solution s : outcome.getSolutions()) {
      assertThat(s.getBool("r")).isEqualTo(s.getBool("a") || !s.getBool("b"));
    }
  }

  @Test
  public void testLower_emptyClauseIsInfeasible() throws Exception {
    assertThat(SolveHelper.solve("constraint bool_clause([], []);").getStatus())
        .isEqualTo(SolveStatus.UNSATISFIABLE);
  }

  @Test
  public void testLower_boolEqImplied() throws Exception {
    final SolveOutcome outcome = SolveHelper.solveAll(ABR + "constraint bool_eq_imp(a, b, r);");
    assertThat(outcome.getSolutions()).hasSize(6);
    for (Solution s : outcome.getSolutions()) {
      if (s.getBool("r")) {
        assertThat(s.getBool("a")).isEqualTo(s.getBool("b"));
      }
    }
  }
}
