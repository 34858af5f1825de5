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

/** Final state of a solve. */
public enum SolveStatus {
  /** An optimal solution was found and proven. */
  OPTIMAL,
  /** Every solution of a satisfaction problem was enumerated. */
  ALL_SOLUTIONS,
  /** At least one solution was found but the search did not complete. */
  SATISFIED,
  /** The model has no solution. */
  UNSATISFIABLE,
  /** The search stopped before finding a solution or proving there is none. */
  UNKNOWN;

  /** True when the search space was exhausted. */
  public boolean isComplete() {
    return this == OPTIMAL || this == ALL_SOLUTIONS || this == UNSATISFIABLE;
  }
}
