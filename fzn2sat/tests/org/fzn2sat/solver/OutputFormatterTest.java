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

package org.fzn2sat.solver;

import static com.google.common.truth.Truth.assertThat;

import com.google.ortools.Loader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for {@link OutputFormatter}. */
public final class OutputFormatterTest {
  @BeforeEach
  public void setUp() {
    Loader.loadNativeLibraries();
  }

  private static Solution solveOnce(String source) {
    final SolveOutcome outcome = new FlatZincSolver().solve(source);
    assertThat(outcome.getSolutions()).hasSize(1);
    return outcome.getBestSolution();
  }

  @Test
  public void testFormatSolution_scalarsAndArrays() throws Exception {
    final Solution solution =
        solveOnce(
            "var 3..3: x :: output_var;\n"
                + "array [1..2] of var 1..2: a :: output_array([1..2]);\n"
                + "var 1..2: hidden;\n"
                + "constraint int_lt(a[1], a[2]);\n"
                + "solve satisfy;\n");
    assertThat(OutputFormatter.formatSolution(solution))
        .isEqualTo("x = 3;\na = array1d(1..2, [1, 2]);\n----------\n");
  }

  @Test
  public void testFormatSolution_twoDimensions() throws Exception {
    final Solution solution =
        solveOnce(
            "array [1..4] of var 0..0: m :: output_array([1..2, 0..1]);\nsolve satisfy;\n");
    assertThat(OutputFormatter.formatSolution(solution))
        .isEqualTo("m = array2d(1..2, 0..1, [0, 0, 0, 0]);\n----------\n");
  }

  @Test
  public void testFormatSolution_boolsAndFloats() throws Exception {
    final Solution solution =
        solveOnce(
            "var bool: b :: output_var;\n"
                + "var 0.125..0.125: f :: output_var;\n"
                + "var 2.0..2.0: g :: output_var;\n"
                + "constraint bool_eq(b, true);\n"
                + "solve satisfy;\n");
    assertThat(OutputFormatter.formatSolution(solution))
        .isEqualTo("b = true;\nf = 0.125;\ng = 2.0;\n----------\n");
    assertThat(solution.getBool("b")).isTrue();
    assertThat(solution.getFloat("f")).isEqualTo(0.125);
  }

  @Test
  public void testFormatSolution_negativeFloat() throws Exception {
    final Solution solution =
        solveOnce("var -1.5..-1.5: f :: output_var;\nsolve satisfy;\n");
    assertThat(OutputFormatter.formatSolution(solution)).isEqualTo("f = -1.5;\n----------\n");
  }

  @Test
  public void testFormatStatus() throws Exception {
    assertThat(OutputFormatter.formatStatus(SolveStatus.OPTIMAL)).isEqualTo("==========\n");
    assertThat(OutputFormatter.formatStatus(SolveStatus.ALL_SOLUTIONS))
        .isEqualTo("==========\n");
    assertThat(OutputFormatter.formatStatus(SolveStatus.UNSATISFIABLE))
        .isEqualTo("=====UNSATISFIABLE=====\n");
    assertThat(OutputFormatter.formatStatus(SolveStatus.UNKNOWN))
        .isEqualTo("=====UNKNOWN=====\n");
    assertThat(OutputFormatter.formatStatus(SolveStatus.SATISFIED)).isEmpty();
  }

  @Test
  public void testFormatStatistics() throws Exception {
    final SolveStatistics statistics = new SolveStatistics(2, 10, 3, 0.5, 4, 5, 7.0, 6.5);
    assertThat(OutputFormatter.formatStatistics(statistics))
        .isEqualTo(
            "%%%mzn-stat: solutions=2\n"
                + "%%%mzn-stat: nodes=10\n"
                + "%%%mzn-stat: failures=3\n"
                + "%%%mzn-stat: variables=4\n"
                + "%%%mzn-stat: propagators=5\n"
                + "%%%mzn-stat: solveTime=0.500\n"
                + "%%%mzn-stat: objective=7\n"
                + "%%%mzn-stat: objectiveBound=6.5\n"
                + "%%%mzn-stat-end\n");
  }

  @Test
  public void testFormatStatistics_withoutObjective() throws Exception {
    final SolveStatistics statistics = new SolveStatistics(0, 0, 0, 0.0, 1, 0, null, null);
    assertThat(OutputFormatter.formatStatistics(statistics)).doesNotContain("objective");
  }
}
