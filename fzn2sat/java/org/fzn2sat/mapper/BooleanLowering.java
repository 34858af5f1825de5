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

import com.google.ortools.sat.LinearArgument;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.Literal;
import java.util.ArrayList;
import java.util.List;
import org.fzn2sat.flatzinc.ConstraintItem;

/** Lowers boolean connectives, clauses and boolean comparisons. */
final class BooleanLowering extends Lowering {
  BooleanLowering(MappingContext context, ExpressionEvaluator evaluator,
      Reification reification) {
    super(context, evaluator, reification);
  }

  @Override
  void lower(Predicate.Call call, ConstraintItem item) {
    switch (call.getPredicate()) {
      case BOOL_EQ:
      case BOOL_NE:
      case BOOL_LT:
      case BOOL_LE:
        reification.enforce(call.getMode(), relationOf(call.getPredicate()),
            evaluator.resolveInt(item.getArg(0)), evaluator.resolveInt(item.getArg(1)),
            reificationLiteral(call, item));
        break;
      case BOOL_NOT:
        model.addEquality(
            LinearExpr.sum(new LinearArgument[] {
                evaluator.resolveInt(item.getArg(0)), evaluator.resolveInt(item.getArg(1))}),
            1);
        break;
      case BOOL2INT:
        model.addEquality(evaluator.resolveInt(item.getArg(0)),
            evaluator.resolveInt(item.getArg(1)));
        break;
      case BOOL_AND:
        reification.reifyAnd(pair(item), evaluator.resolveBool(item.getArg(2)));
        break;
      case BOOL_OR:
        reification.reifyOr(pair(item), evaluator.resolveBool(item.getArg(2)));
        break;
      case BOOL_XOR:
        lowerXor(item);
        break;
      case ARRAY_BOOL_AND:
        reification.reifyAnd(evaluator.resolveBoolArray(item.getArg(0)),
            evaluator.resolveBool(item.getArg(1)));
        break;
      case ARRAY_BOOL_OR:
        reification.reifyOr(evaluator.resolveBoolArray(item.getArg(0)),
            evaluator.resolveBool(item.getArg(1)));
        break;
      case ARRAY_BOOL_XOR:
        {
          List<Literal> literals = evaluator.resolveBoolArray(item.getArg(0));
          if (literals.isEmpty()) {
            postFalse();
          } else {
            model.addBoolXor(literals);
          }
          break;
        }
      case BOOL_CLAUSE:
        lowerClause(call, item);
        break;
      default:
        throw new IllegalArgumentException(call.getName() + " is not a boolean predicate");
    }
  }

  private List<Literal> pair(ConstraintItem item) {
    List<Literal> literals = new ArrayList<>();
    literals.add(evaluator.resolveBool(item.getArg(0)));
    literals.add(evaluator.resolveBool(item.getArg(1)));
    return literals;
  }

  private void lowerXor(ConstraintItem item) {
    List<Literal> literals = pair(item);
    if (item.arity() == 3) {
      // a xor b xor not(r) holds exactly when r == (a xor b).
      literals.add(evaluator.resolveBool(item.getArg(2)).not());
    }
    model.addBoolXor(literals);
  }

  /** Some literal of {@code pos} is true or some literal of {@code neg} is false. */
  private void lowerClause(Predicate.Call call, ConstraintItem item) {
    List<Literal> clause = new ArrayList<>(evaluator.resolveBoolArray(item.getArg(0)));
    for (Literal negative : evaluator.resolveBoolArray(item.getArg(1))) {
      clause.add(negative.not());
    }
    switch (call.getMode()) {
      case PLAIN:
        if (clause.isEmpty()) {
          postFalse();
        } else {
          model.addBoolOr(clause);
        }
        break;
      case REIF:
        reification.reifyOr(clause, reificationLiteral(call, item));
        break;
      case IMP:
        reification.implyOr(clause, reificationLiteral(call, item));
        break;
    }
  }
}
