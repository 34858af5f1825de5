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

/** Lowers integer arithmetic: sums, products, division, modulo, powers, min and max. */
final class ArithmeticLowering extends Lowering {
  /** Largest exponent domain enumerated for {@code int_pow} with a variable exponent. */
  static final int MAX_POW_EXPONENTS = 64;

  ArithmeticLowering(MappingContext context, ExpressionEvaluator evaluator,
      Reification reification) {
    super(context, evaluator, reification);
  }

  @Override
  void lower(Predicate.Call call, ConstraintItem item) {
    switch (call.getPredicate()) {
      case INT_ABS:
        model.addAbsEquality(arg(item, 1), arg(item, 0));
        break;
      case INT_PLUS:
        model.addEquality(LinearExpr.sum(new LinearArgument[] {arg(item, 0), arg(item, 1)}),
            arg(item, 2));
        break;
      case INT_MINUS:
        model.addEquality(
            LinearExpr.weightedSum(new LinearArgument[] {arg(item, 0), arg(item, 1)},
                new long[] {1, -1}),
            arg(item, 2));
        break;
      case INT_TIMES:
        model.addMultiplicationEquality(arg(item, 2), arg(item, 0), arg(item, 1));
        break;
      case INT_DIV:
        model.addDivisionEquality(arg(item, 2), arg(item, 0), nonZero(arg(item, 1)));
        break;
      case INT_MOD:
        lowerMod(item);
        break;
      case INT_MAX:
        model.addMaxEquality(arg(item, 2), new LinearArgument[] {arg(item, 0), arg(item, 1)});
        break;
      case INT_MIN:
        model.addMinEquality(arg(item, 2), new LinearArgument[] {arg(item, 0), arg(item, 1)});
        break;
      case INT_POW:
        lowerPow(call, item);
        break;
      case ARRAY_INT_MINIMUM:
        model.addMinEquality(arg(item, 0), nonEmpty(call, item, 1));
        break;
      case ARRAY_INT_MAXIMUM:
        model.addMaxEquality(arg(item, 0), nonEmpty(call, item, 1));
        break;
      default:
        throw new IllegalArgumentException(call.getName() + " is not integer arithmetic");
    }
  }

  private IntVar arg(ConstraintItem item, int index) {
    return evaluator.resolveInt(item.getArg(index));
  }

  private LinearArgument[] nonEmpty(Predicate.Call call, ConstraintItem item, int index) {
    List<IntVar> vars = evaluator.resolveIntArray(item.getArg(index));
    if (vars.isEmpty()) {
      throw new MapException(call.getName() + " over an empty array", item.getLocation());
    }
    return toArray(vars);
  }

  private void lowerMod(ConstraintItem item) {
    IntVar dividend = arg(item, 0);
    IntVar divisor = nonZero(arg(item, 1));
    IntVar remainder = arg(item, 2);
    // Truncated remainder only depends on |divisor|, and the solver wants a positive modulus.
    Long fixed = MappingContext.fixedValue(divisor);
    if (fixed != null) {
      model.addModuloEquality(remainder, dividend, Math.abs(fixed));
      return;
    }
    long magnitude = Math.max(Math.abs(MappingContext.lowerBound(divisor)),
        Math.abs(MappingContext.upperBound(divisor)));
    IntVar modulus = model.newIntVar(1, magnitude, "");
    model.addAbsEquality(modulus, divisor);
    model.addModuloEquality(remainder, dividend, modulus);
  }

  private void lowerPow(Predicate.Call call, ConstraintItem item) {
    IntVar base = arg(item, 0);
    IntVar exponent = arg(item, 1);
    IntVar result = arg(item, 2);
    Long fixedExponent = MappingContext.fixedValue(exponent);
    if (fixedExponent != null) {
      model.addEquality(result, power(base, fixedExponent, call, item));
      return;
    }
    long lo = Math.max(0, MappingContext.lowerBound(exponent));
    long hi = MappingContext.upperBound(exponent);
    if (hi - lo + 1 > MAX_POW_EXPONENTS) {
      throw new UnsupportedFeatureException(
          call.getName() + " with an exponent domain wider than " + MAX_POW_EXPONENTS,
          item.getLocation());
    }
    if (MappingContext.lowerBound(exponent) < 0) {
      model.addGreaterOrEqual(exponent, 0);
    }
    for (long e = lo; e <= hi; e++) {
      IntVar value = power(base, e, call, item);
      reification.imply(Relation.EQ, result, value,
          reification.reified(Relation.EQ, exponent, e));
    }
  }

  /** Returns a variable equal to {@code base^exponent}, built by repeated multiplication. */
  private IntVar power(IntVar base, long exponent, Predicate.Call call, ConstraintItem item) {
    if (exponent < 0) {
      throw new UnsupportedFeatureException(call.getName() + " with a negative exponent",
          item.getLocation());
    }
    if (exponent == 0) {
      return model.newConstant(1);
    }
    IntVar acc = base;
    for (long i = 1; i < exponent; i++) {
      long[] bounds = productBounds(acc, base);
      IntVar next = model.newIntVar(bounds[0], bounds[1], "");
      model.addMultiplicationEquality(next, acc, base);
      acc = next;
    }
    return acc;
  }
}
