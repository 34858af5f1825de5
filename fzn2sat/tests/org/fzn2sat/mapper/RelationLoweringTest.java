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
import org.fzn2sat.solver.SolveOutcome;
import org.fzn2sat.solver.SolveStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests integer comparisons, including comparisons between two constants. */
public final class RelationLoweringTest {
  @BeforeEach
  public void setUp() {
    Loader.loadNativeLibraries();
  }

  @Test
  public void testLower_variables() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll("var 0..3: x; var 0..3: y; constraint int_lt(x, y);");
    assertThat(outcome.getSolutions()).hasSize(6);
  }

  @Test
  public void testLower_constantsThatHold() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll("var 0..2: x; constraint int_lt(1, 2); constraint int_eq(3, 3);");
    assertThat(outcome.getSolutions()).hasSize(3);
  }

  @Test
  public void testLower_constantsThatFail() throws Exception {
    assertThat(SolveHelper.solve("var 0..2: x; constraint int_ne(4, 4);").getStatus())
        .isEqualTo(SolveStatus.UNSATISFIABLE);
  }

  @Test
  public void testLower_reifiedConstants() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll(
            "int: k = 5;\n"
                + "var bool: a; var bool: b;\n"
                + "constraint int_eq_reif(4, 4, a);\n"
                + "constraint int_le_reif(k, 3, b);\n");
    assertThat(outcome.getSolutions()).hasSize(1);
    assertThat(outcome.getBestSolution().getBool("a")).isTrue();
    assertThat(outcome.getBestSolution().getBool("b")).isFalse();
  }

  @Test
  public void testLower_impliedConstants() throws Exception {
    final SolveOutcome failing =
        SolveHelper.solveAll("var bool: r; constraint int_ge_imp(1, 2, r);");
    assertThat(failing.getSolutions()).hasSize(1);
    assertThat(failing.getBestSolution().getBool("r")).isFalse();

    final SolveOutcome holding =
        SolveHelper.solveAll("var bool: r; constraint int_ge_imp(3, 2, r);");
    assertThat(holding.getSolutions()).hasSize(2);
  }

  @Test
  public void testRelation_holdsAgreesWithNegate() throws Exception {
    for (Relation relation : Relation.values()) {
      for (long left = -1; left <= 1; left++) {
        for (long right = -1; right <= 1; right++) {
          assertThat(relation.negate().holds(left, right))
              .isEqualTo(!relation.holds(left, right));
        }
      }
    }
    assertThat(Relation.LT.holds(1, 2)).isTrue();
    assertThat(Relation.GE.holds(1, 2)).isFalse();
  }
}
