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

import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.Literal;
import java.util.ArrayList;
import java.util.List;

/**
 * Occurrence counting, which the solver has no native constraint for. A count is the sum of one
 * reified equality per array element.
 */
final class CardinalityPrimitives {
  CardinalityPrimitives(Reification reification) {
    this.reification = reification;
  }

  /** Returns an expression equal to the number of {@code vars} taking {@code value}. */
  LinearExpr count(List<IntVar> vars, long value) {
    List<Literal> hits = new ArrayList<>();
    for (IntVar var : vars) {
      if (var.getDomain().contains(value)) {
        hits.add(reification.reified(Relation.EQ, var, value));
      }
    }
    return sum(hits);
  }

  /** Returns an expression equal to the number of {@code vars} equal to {@code value}. */
  LinearExpr count(List<IntVar> vars, IntVar value) {
    Long fixed = MappingContext.fixedValue(value);
    if (fixed != null) {
      return count(vars, fixed);
    }
    List<Literal> hits = new ArrayList<>();
    for (IntVar var : vars) {
      hits.add(reification.reified(Relation.EQ, var, value));
    }
    return sum(hits);
  }

  private static LinearExpr sum(List<Literal> literals) {
    if (literals.isEmpty()) {
      return LinearExpr.constant(0);
    }
    return LinearExpr.sum(Lowering.toArray(literals));
  }

  private final Reification reification;
}
