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

/** Search statistics of one solve, reported as {@code %%%mzn-stat} lines. */
public final class SolveStatistics {
  SolveStatistics(int solutions, long branches, long conflicts, double wallTime,
      int variables, int constraints, Double objective, Double objectiveBound) {
    this.solutions = solutions;
    this.branches = branches;
    this.conflicts = conflicts;
    this.wallTime = wallTime;
    this.variables = variables;
    this.constraints = constraints;
    this.objective = objective;
    this.objectiveBound = objectiveBound;
  }

  public int getSolutions() {
    return solutions;
  }

  public long getBranches() {
    return branches;
  }

  public long getConflicts() {
    return conflicts;
  }

  /** Wall time of the search in seconds. */
  public double getWallTime() {
    return wallTime;
  }

  public int getVariables() {
    return variables;
  }

  public int getConstraints() {
    return constraints;
  }

  /** Best objective value, or null when there is none. */
  public Double getObjective() {
    return objective;
  }

  public Double getObjectiveBound() {
    return objectiveBound;
  }

  private final int solutions;
  private final long branches;
  private final long conflicts;
  private final double wallTime;
  private final int variables;
  private final int constraints;
  private final Double objective;
  private final Double objectiveBound;
}
