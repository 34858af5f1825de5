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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.fzn2sat.solver.FlatZincSolver;
import org.fzn2sat.solver.Solution;
import org.fzn2sat.solver.SolveOutcome;
import org.fzn2sat.solver.SolverOptions;

/** Solves small FlatZinc models for the lowering tests. */
final class SolveHelper {
  private SolveHelper() {}

  /** Finds one solution, or proves there is none. */
  static SolveOutcome solve(String source) {
    return new FlatZincSolver().solve(source);
  }

  /** Enumerates every solution of a satisfaction model. */
  static SolveOutcome solveAll(String source) {
    return solveAll(source, TranslatorOptions.defaults());
  }

  static SolveOutcome solveAll(String source, TranslatorOptions options) {
    final SolverOptions solverOptions = SolverOptions.newBuilder().setAllSolutions(true).build();
    return new FlatZincSolver(options, solverOptions).solve(source);
  }

  /**
   * Returns the distinct assignments of the named outputs over all solutions. Arrays contribute
   * all their elements in order.
   */
  static Set<List<Long>> assignments(SolveOutcome outcome, String... names) {
    final Set<List<Long>> result = new HashSet<>();
    for (Solution solution : outcome.getSolutions()) {
      final List<Long> row = new ArrayList<>();
      for (String name : names) {
        for (long value : solution.getIntArray(name)) {
          row.add(value);
        }
      }
      result.add(row);
    }
    return result;
  }
}
