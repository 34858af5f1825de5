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
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.fzn2sat.solver.Solution;
import org.fzn2sat.solver.SolveOutcome;
import org.fzn2sat.solver.SolveStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests the global constraint decompositions. */
public final class GlobalLoweringTest {
  @BeforeEach
  public void setUp() {
    Loader.loadNativeLibraries();
  }

  private static long lexCompare(long[] x, long[] y) {
    for (int i = 0; i < x.length; i++) {
      if (x[i] != y[i]) {
        return Long.compare(x[i], y[i]);
      }
    }
    return 0;
  }

  @Test
  public void testLower_allDifferent() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll("array [1..3] of var 1..3: x; constraint all_different_int(x);");
    assertThat(outcome.getSolutions()).hasSize(6);
  }

  @Test
  public void testLower_sortDistinctValues() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll("array [1..3] of var 0..5: y; constraint sort([3, 1, 2], y);");
    assertThat(SolveHelper.assignments(outcome, "y")).containsExactly(Arrays.asList(1L, 2L, 3L));
  }

  @Test
  public void testLower_sortWithDuplicates() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solve("array [1..3] of var 0..5: y; constraint sort([2, 1, 2], y);");
    assertThat(outcome.getBestSolution().getIntArray("y")).asList().containsExactly(1L, 2L, 2L);
  }

  @Test
  public void testLower_sortTiesYToX() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll(
            "array [1..2] of var 1..3: x; array [1..2] of var 1..3: y;\n"
                + "constraint int_eq(x[1], 3); constraint sort(x, y);\n");
    assertThat(SolveHelper.assignments(outcome, "x", "y"))
        .containsExactly(
            Arrays.asList(3L, 1L, 1L, 3L),
            Arrays.asList(3L, 2L, 2L, 3L),
            Arrays.asList(3L, 3L, 3L, 3L));
  }

  @Test
  public void testLower_sortLengthMismatch() throws Exception {
    assertThrows(
        MapException.MismatchedArrayLengths.class,
        () ->
            new FlatZincTranslator()
                .translate("array [1..2] of var 0..5: y; constraint sort([3, 1, 2], y);"));
  }

  @Test
  public void testLower_largeSortOnlyOrders() throws Exception {
    final Translation translation =
        new FlatZincTranslator()
            .translate(
                "array [1..11] of var 0..20: x; array [1..11] of var 0..20: y;\n"
                    + "constraint sort(x, y);\n");
    assertThat(translation.getDiagnostics()).hasSize(1);
    assertThat(translation.getDiagnostics().get(0).getKind())
        .isEqualTo(Diagnostic.Kind.DECOMPOSITION_INCOMPLETE);
  }

  @Test
  public void testLower_tableIsExact() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll(
            "array [1..2] of var 1..4: x; constraint table_int(x, [1, 2, 3, 4]);");
    assertThat(outcome.getSolutions()).hasSize(2);
    assertThat(SolveHelper.assignments(outcome, "x"))
        .containsExactly(Arrays.asList(1L, 2L), Arrays.asList(3L, 4L));
  }

  @Test
  public void testLower_tableRowOutsideDomain() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll(
            "array [1..2] of var 1..4: x; constraint table_int(x, [1, 2, 9, 9]);");
    assertThat(SolveHelper.assignments(outcome, "x")).containsExactly(Arrays.asList(1L, 2L));
  }

  @Test
  public void testLower_tableBool() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll(
            "array [1..2] of var bool: b;\n"
                + "constraint table_bool(b, [true, false, false, true]);\n");
    assertThat(SolveHelper.assignments(outcome, "b"))
        .containsExactly(Arrays.asList(1L, 0L), Arrays.asList(0L, 1L));
  }

  @Test
  public void testLower_emptyTableIsInfeasible() throws Exception {
    assertThat(
            SolveHelper.solve("array [1..2] of var 1..4: x; constraint table_int(x, []);")
                .getStatus())
        .isEqualTo(SolveStatus.UNSATISFIABLE);
  }

  @Test
  public void testLower_tableWithPartialRow() throws Exception {
    assertThrows(
        MapException.class,
        () ->
            new FlatZincTranslator()
                .translate("array [1..2] of var 1..4: x; constraint table_int(x, [1, 2, 3]);"));
  }

  @Test
  public void testLower_lexLess() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll(
            "array [1..2] of var 0..1: x; array [1..2] of var 0..1: y;\n"
                + "constraint lex_less_int(x, y);\n");
    assertThat(outcome.getSolutions()).hasSize(6);
    for (Solution s : outcome.getSolutions()) {
      assertThat(lexCompare(s.getIntArray("x"), s.getIntArray("y"))).isLessThan(0L);
    }
  }

  @Test
  public void testLower_lexLessEq() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll(
            "array [1..2] of var 0..1: x; array [1..2] of var 0..1: y;\n"
                + "constraint lex_lesseq_int(x, y);\n");
    assertThat(outcome.getSolutions()).hasSize(10);
    for (Solution s : outcome.getSolutions()) {
      assertThat(lexCompare(s.getIntArray("x"), s.getIntArray("y"))).isAtMost(0L);
    }
  }

  @Test
  public void testLower_lexOverEmptyArrays() throws Exception {
    assertThat(SolveHelper.solve("constraint lex_less_int([], []);").getStatus())
        .isEqualTo(SolveStatus.UNSATISFIABLE);
    assertThat(SolveHelper.solve("constraint lex_lesseq_int([], []);").getStatus())
        .isEqualTo(SolveStatus.SATISFIED);
  }

  @Test
  public void testLower_nvalue() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll(
            "array [1..3] of var 1..3: x; var 0..3: n; constraint nvalue(n, x);");
    assertThat(outcome.getSolutions()).hasSize(27);
    for (Solution s : outcome.getSolutions()) {
      final Set<Long> distinct = new HashSet<>();
      for (long v : s.getIntArray("x")) {
        distinct.add(v);
      }
      assertThat(s.getInt("n")).isEqualTo(distinct.size());
    }
  }

  @Test
  public void testLower_nvalueOverWideDomain() throws Exception {
    assertThrows(
        UnsupportedFeatureException.class,
        () ->
            new FlatZincTranslator()
                .translate(
                    "array [1..2] of var 0..5000: x; var 0..2: n; constraint nvalue(n, x);"));
  }

  private static final String TWO_TASKS =
      "array [1..2] of var 0..3: s;\n"
          + "constraint cumulative(s, [2, 2], [1, 1], 1);\n";

  private static void checkNoOverlap(SolveOutcome outcome) {
    assertThat(outcome.getSolutions()).hasSize(6);
    for (Solution sol : outcome.getSolutions()) {
      final long[] s = sol.getIntArray("s");
      assertThat(Math.abs(s[0] - s[1])).isAtLeast(2L);
    }
  }

  @Test
  public void testLower_cumulativeDecomposition() throws Exception {
    checkNoOverlap(SolveHelper.solveAll(TWO_TASKS));
  }

  @Test
  public void testLower_cumulativeNative() throws Exception {
    checkNoOverlap(
        SolveHelper.solveAll(
            TWO_TASKS, TranslatorOptions.newBuilder().setNativeCumulative(true).build()));
  }

  @Test
  public void testLower_cumulativeSharesCapacity() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll(
            "array [1..3] of var 0..1: s;\n"
                + "constraint cumulative(s, [1, 1, 1], [1, 1, 0], 1);\n");
    // The third task needs no resource and is free.
    assertThat(outcome.getSolutions()).hasSize(4);
    for (Solution sol : outcome.getSolutions()) {
      final long[] s = sol.getIntArray("s");
      assertThat(s[0]).isNotEqualTo(s[1]);
    }
  }

  private static final String VARIABLE_CAPACITY =
      "array [1..2] of var 0..3: s;\n"
          + "var 0..2: c;\n"
          + "constraint cumulative(s, [2, 2], [1, 1], c);\n";

  private static void checkVariableCapacity(SolveOutcome outcome) {
    // c = 0 admits nothing, c = 1 the 6 disjoint placements, c = 2 all 16.
    assertThat(outcome.getSolutions()).hasSize(22);
    for (Solution sol : outcome.getSolutions()) {
      final long[] s = sol.getIntArray("s");
      final long c = sol.getInt("c");
      assertThat(c).isAtLeast(1L);
      if (c == 1) {
        assertThat(Math.abs(s[0] - s[1])).isAtLeast(2L);
      }
    }
  }

  @Test
  public void testLower_cumulativeVariableCapacity() throws Exception {
    checkVariableCapacity(SolveHelper.solveAll(VARIABLE_CAPACITY));
  }

  @Test
  public void testLower_cumulativeNativeVariableCapacity() throws Exception {
    checkVariableCapacity(
        SolveHelper.solveAll(
            VARIABLE_CAPACITY, TranslatorOptions.newBuilder().setNativeCumulative(true).build()));
  }

  @Test
  public void testLower_cumulativeWithoutTasksKeepsCapacityNonNegative() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll(
            "var -2..2: c;\n"
                + "array [1..2] of var 0..3: s;\n"
                + "constraint cumulative(s, [0, 3], [4, 0], c);\n");
    assertThat(SolveHelper.assignments(outcome, "c"))
        .containsExactly(Arrays.asList(0L), Arrays.asList(1L), Arrays.asList(2L));
  }

  @Test
  public void testLower_cumulativeSampledHorizon() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll(
            "array [1..2] of var 0..999: s;\n"
                + "constraint cumulative(s, [1, 1], [1, 1], 1);\n"
                + "constraint int_eq(s[1], s[2]);\n");
    assertThat(outcome.getDiagnostics()).hasSize(1);
    assertThat(outcome.getDiagnostics().get(0).getKind())
        .isEqualTo(Diagnostic.Kind.DECOMPOSITION_INCOMPLETE);
    // Both tasks at the same time overload the capacity, which is only caught at sampled points.
    final Set<Long> sampled = new HashSet<>(GlobalLowering.timePoints(0, 999));
    assertThat(outcome.getSolutions()).hasSize(1000 - sampled.size());
    for (Solution sol : outcome.getSolutions()) {
      assertThat(sampled).doesNotContain(sol.getIntArray("s")[0]);
    }
  }

  @Test
  public void testTimePoints() throws Exception {
    assertThat(GlobalLowering.timePoints(3, 6)).containsExactly(3L, 4L, 5L, 6L).inOrder();
    final List<Long> sampled = GlobalLowering.timePoints(0, 999);
    assertThat(sampled).hasSize(200);
    assertThat(sampled.get(0)).isEqualTo(0L);
    assertThat(sampled.get(199)).isEqualTo(999L);
    assertThat(sampled).isInStrictOrder();
  }
}
