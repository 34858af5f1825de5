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

import com.google.common.collect.ImmutableList;
import org.fzn2sat.mapper.Diagnostic;

/** The result of a solve: final status, every reported solution and the statistics. */
public final class SolveOutcome {
  SolveOutcome(SolveStatus status, ImmutableList<Solution> solutions,
      SolveStatistics statistics, ImmutableList<Diagnostic> diagnostics) {
    this.status = status;
    this.solutions = solutions;
    this.statistics = statistics;
    this.diagnostics = diagnostics;
  }

  public SolveStatus getStatus() {
    return status;
  }

  public ImmutableList<Solution> getSolutions() {
    return solutions;
  }

  /** Returns the last reported solution, which is the best one when optimizing, or null. */
  public Solution getBestSolution() {
    return solutions.isEmpty() ? null : solutions.get(solutions.size() - 1);
  }

  public SolveStatistics getStatistics() {
    return statistics;
  }

  /** Translation diagnostics of the solved model. */
  public ImmutableList<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  private final SolveStatus status;
  private final ImmutableList<Solution> solutions;
  private final SolveStatistics statistics;
  private final ImmutableList<Diagnostic> diagnostics;
}
