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
import com.google.ortools.sat.Literal;
import org.fzn2sat.flatzinc.ConstraintItem;

/** Lowers {@code int_eq}, {@code int_lt} and the other integer comparisons, plain or reified. */
final class RelationLowering extends Lowering {
  RelationLowering(MappingContext context, ExpressionEvaluator evaluator,
      Reification reification) {
    super(context, evaluator, reification);
  }

  @Override
  void lower(Predicate.Call call, ConstraintItem item) {
    IntVar left = evaluator.resolveInt(item.getArg(0));
    IntVar right = evaluator.resolveInt(item.getArg(1));
    Relation relation = relationOf(call.getPredicate());
    Long leftValue = MappingContext.fixedValue(left);
    Long rightValue = MappingContext.fixedValue(right);
    if (leftValue != null && rightValue != null) {
      fold(call.getMode(), relation.holds(leftValue, rightValue),
          reificationLiteral(call, item));
      return;
    }
    reification.enforce(call.getMode(), relation, left, right, reificationLiteral(call, item));
  }

  /** Posts the outcome of a comparison between two constants. */
  private void fold(Predicate.Mode mode, boolean holds, Literal literal) {
    switch (mode) {
      case PLAIN:
        if (!holds) {
          postFalse();
        }
        break;
      case REIF:
        model.addBoolAnd(new Literal[] {holds ? literal : literal.not()});
        break;
      case IMP:
        if (!holds) {
          model.addBoolAnd(new Literal[] {literal.not()});
        }
        break;
    }
  }
}
