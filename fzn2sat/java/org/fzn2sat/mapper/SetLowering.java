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
import com.google.ortools.util.Domain;
import org.fzn2sat.flatzinc.ConstraintItem;

/** Lowers {@code set_in} against a constant set of integers, plain or reified. */
final class SetLowering extends Lowering {
  SetLowering(MappingContext context, ExpressionEvaluator evaluator, Reification reification) {
    super(context, evaluator, reification);
  }

  @Override
  void lower(Predicate.Call call, ConstraintItem item) {
    IntVar var = evaluator.resolveInt(item.getArg(0));
    Domain set = evaluator.extractSet(item.getArg(1));
    if (call.getMode() == Predicate.Mode.PLAIN) {
      if (set.isEmpty()) {
        postFalse();
      } else {
        model.addLinearExpressionInDomain(var, set);
      }
      return;
    }
    Literal literal = reificationLiteral(call, item);
    Domain varDomain = var.getDomain();
    Domain inside = varDomain.intersectionWith(set);
    if (inside.isEmpty()) {
      model.addBoolAnd(new Literal[] {literal.not()});
      return;
    }
    model.addLinearExpressionInDomain(var, inside).onlyEnforceIf(literal);
    if (call.getMode() == Predicate.Mode.IMP) {
      return;
    }
    Domain outside = varDomain.intersectionWith(set.complement());
    if (outside.isEmpty()) {
      model.addBoolAnd(new Literal[] {literal});
    } else {
      model.addLinearExpressionInDomain(var, outside).onlyEnforceIf(literal.not());
    }
  }
}
