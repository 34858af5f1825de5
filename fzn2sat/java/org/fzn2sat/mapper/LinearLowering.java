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
 * Lowers the {@code *_lin_*} predicates to one weighted-sum relation.
 *
 * <p>Coefficient and variable arrays must have the same length; this is checked before any
 * variable is resolved. Float sums are scaled by the smallest power of ten that makes every
 * coefficient integral.
 */
final class LinearLowering extends Lowering {
  LinearLowering(MappingContext context, ExpressionEvaluator evaluator,
      Reification reification) {
    super(context, evaluator, reification);
  }

  @Override
  void lower(Predicate.Call call, ConstraintItem item) {
    switch (call.getPredicate()) {
      case INT_LIN_EQ:
      case INT_LIN_NE:
      case INT_LIN_LE:
      case INT_LIN_LT:
      case INT_LIN_GE:
      case INT_LIN_GT:
        lowerInt(call, item);
        break;
      case BOOL_LIN_EQ:
      case BOOL_LIN_LE:
        lowerBool(call, item);
        break;
      case FLOAT_LIN_EQ:
      case FLOAT_LIN_NE:
      case FLOAT_LIN_LE:
      case FLOAT_LIN_LT:
        lowerFloat(call, item);
        break;
      default:
        throw new IllegalArgumentException(call.getName() + " is not linear");
    }
  }

  private void lowerInt(Predicate.Call call, ConstraintItem item) {
    long[] coeffs = evaluator.extractIntArray(item.getArg(0));
    checkSameLength(call, item, "coefficients", coeffs.length, "variables",
        evaluator.arrayLength(item.getArg(1)));
    List<IntVar> vars = evaluator.resolveIntArray(item.getArg(1));
    long rhs = evaluator.extractInt(item.getArg(2));
    LinearExpr sum = LinearExpr.weightedSum(toArray(vars), coeffs);
    reification.enforce(call.getMode(), relationOf(call.getPredicate()), sum,
        LinearExpr.constant(rhs), reificationLiteral(call, item));
  }

  private void lowerBool(Predicate.Call call, ConstraintItem item) {
    long[] coeffs = evaluator.extractIntArray(item.getArg(0));
    checkSameLength(call, item, "coefficients", coeffs.length, "variables",
        evaluator.arrayLength(item.getArg(1)));
    List<IntVar> vars = evaluator.resolveIntArray(item.getArg(1));
    // The right-hand side of bool_lin_* may be a variable.
    IntVar rhs = evaluator.resolveInt(item.getArg(2));
    LinearExpr sum = LinearExpr.weightedSum(toArray(vars), coeffs);
    reification.enforce(call.getMode(), relationOf(call.getPredicate()), sum, rhs,
        reificationLiteral(call, item));
  }

  private void lowerFloat(Predicate.Call call, ConstraintItem item) {
    double[] coeffs = evaluator.extractFloatArray(item.getArg(0));
    checkSameLength(call, item, "coefficients", coeffs.length, "variables",
        evaluator.arrayLength(item.getArg(1)));
    List<IntVar> vars = evaluator.resolveFloatArray(item.getArg(1));
    double rhs = evaluator.extractFloat(item.getArg(2));

    // sum(a[i] * x[i]) op c  becomes  sum(a[i]*m * X[i]) op c*m*scale  with X[i] = x[i]*scale.
    long scale = context.getFloats().getScale();
    long multiplier = integralMultiplier(coeffs, rhs * scale);
    long[] scaled = new long[coeffs.length];
    boolean exact = true;
    for (int i = 0; i < coeffs.length; i++) {
      double value = coeffs[i] * multiplier;
      scaled[i] = Math.round(value);
      exact &= isIntegral(value);
    }
    double scaledRhs = rhs * scale * multiplier;
    exact &= isIntegral(scaledRhs);
    if (!exact) {
      context.diagnose(Diagnostic.Kind.FLOAT_APPROXIMATION,
          call.getName() + " coefficients rounded to " + MAX_DIGITS + " decimal digits",
          item.getLocation());
    }
    LinearExpr sum = LinearExpr.weightedSum(toArray(vars), scaled);
    LinearArgument bound = LinearExpr.constant(Math.round(scaledRhs));
    reification.enforce(call.getMode(), relationOf(call.getPredicate()), sum, bound,
        reificationLiteral(call, item));
  }

  /** Smallest power of ten, up to 10^MAX_DIGITS, making every value integral. */
  static long integralMultiplier(double[] coeffs, double rhs) {
    long multiplier = 1;
    for (int digits = 0; digits < MAX_DIGITS; digits++) {
      if (allIntegral(coeffs, rhs, multiplier)) {
        return multiplier;
      }
      multiplier *= 10;
    }
    return multiplier;
  }

  private static boolean allIntegral(double[] coeffs, double rhs, long multiplier) {
    for (double c : coeffs) {
      if (!isIntegral(c * multiplier)) {
        return false;
      }
    }
    return isIntegral(rhs * multiplier);
  }

  private static boolean isIntegral(double value) {
    return Math.abs(value - Math.rint(value)) < 1e-9 * Math.max(1.0, Math.abs(value));
  }

  private static final int MAX_DIGITS = 6;
}
