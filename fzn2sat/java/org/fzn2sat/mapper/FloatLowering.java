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
import com.google.ortools.sat.LinearArgument;
import com.google.ortools.sat.LinearExpr;
import java.util.List;
import org.fzn2sat.flatzinc.ConstraintItem;

/**
 * Lowers float predicates over fixed-point encoded variables.
 *
 * <p>With {@code X = round(x * S)}, sums, comparisons, min, max and abs are exact on the encoded
 * values. Products are rounded to the nearest grid point and quotients are truncated.
 */
final class FloatLowering extends Lowering {
  FloatLowering(MappingContext context, ExpressionEvaluator evaluator, Reification reification) {
    super(context, evaluator, reification);
    this.scale = context.getFloats().getScale();
  }

  @Override
  void lower(Predicate.Call call, ConstraintItem item) {
    switch (call.getPredicate()) {
      case FLOAT_EQ:
      case FLOAT_NE:
      case FLOAT_LT:
      case FLOAT_LE:
      case FLOAT_GT:
      case FLOAT_GE:
        reification.enforce(call.getMode(), relationOf(call.getPredicate()), arg(item, 0),
            arg(item, 1), reificationLiteral(call, item));
        break;
      case FLOAT_PLUS:
        model.addEquality(LinearExpr.sum(new LinearArgument[] {arg(item, 0), arg(item, 1)}),
            arg(item, 2));
        break;
      case FLOAT_MINUS:
        model.addEquality(
            LinearExpr.weightedSum(new LinearArgument[] {arg(item, 0), arg(item, 1)},
                new long[] {1, -1}),
            arg(item, 2));
        break;
      case FLOAT_ABS:
        model.addAbsEquality(arg(item, 1), arg(item, 0));
        break;
      case FLOAT_MAX:
        model.addMaxEquality(arg(item, 2), new LinearArgument[] {arg(item, 0), arg(item, 1)});
        break;
      case FLOAT_MIN:
        model.addMinEquality(arg(item, 2), new LinearArgument[] {arg(item, 0), arg(item, 1)});
        break;
      case ARRAY_FLOAT_MINIMUM:
        model.addMinEquality(arg(item, 0), nonEmpty(call, item));
        break;
      case ARRAY_FLOAT_MAXIMUM:
        model.addMaxEquality(arg(item, 0), nonEmpty(call, item));
        break;
      case FLOAT_TIMES:
        lowerTimes(call, item);
        break;
      case FLOAT_DIV:
        lowerDiv(call, item);
        break;
      case INT2FLOAT:
        model.addEquality(arg(item, 1), LinearExpr.term(evaluator.resolveInt(item.getArg(0)),
            scale));
        break;
      case FLOAT2INT:
        // i * S - S/2 <= F < i * S + S/2: i is F rounded to the nearest integer.
        postRounded(arg(item, 0), evaluator.resolveInt(item.getArg(1)));
        break;
      default:
        throw new IllegalArgumentException(call.getName() + " is not a float predicate");
    }
  }

  private IntVar arg(ConstraintItem item, int index) {
    return evaluator.resolveFloat(item.getArg(index));
  }

  private LinearArgument[] nonEmpty(Predicate.Call call, ConstraintItem item) {
    List<IntVar> vars = evaluator.resolveFloatArray(item.getArg(1));
    if (vars.isEmpty()) {
      throw new MapException(call.getName() + " over an empty array", item.getLocation());
    }
    return toArray(vars);
  }

  /** {@code C = round(A * B / S)}, through an exact product variable. */
  private void lowerTimes(Predicate.Call call, ConstraintItem item) {
    IntVar a = arg(item, 0);
    IntVar b = arg(item, 1);
    IntVar c = arg(item, 2);
    long[] bounds = productBounds(a, b);
    IntVar product = model.newIntVar(bounds[0], bounds[1], "");
    model.addMultiplicationEquality(product, a, b);
    postRounded(product, c);
    if (scale > 1) {
      context.diagnose(Diagnostic.Kind.FLOAT_APPROXIMATION,
          call.getName() + " rounded to " + context.getFloats().getPrecision()
              + " decimal digits",
          item.getLocation());
    }
  }

  /** {@code C = trunc(A * S / B)}. */
  private void lowerDiv(Predicate.Call call, ConstraintItem item) {
    IntVar a = arg(item, 0);
    IntVar b = nonZero(arg(item, 1));
    IntVar c = arg(item, 2);
    model.addDivisionEquality(c, LinearExpr.term(a, scale), b);
    context.diagnose(Diagnostic.Kind.FLOAT_APPROXIMATION,
        call.getName() + " truncated to " + context.getFloats().getPrecision()
            + " decimal digits",
        item.getLocation());
  }

  /** Posts {@code -(S/2) <= value - rounded * S <= S - 1 - S/2}. */
  private void postRounded(LinearArgument value, IntVar rounded) {
    long half = scale / 2;
    model.addLinearConstraint(
        LinearExpr.weightedSum(new LinearArgument[] {value, rounded}, new long[] {1, -scale}),
        -half, scale - 1 - half);
  }

  private final long scale;
}
