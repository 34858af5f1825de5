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

import com.google.common.math.LongMath;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.LinearArgument;
import com.google.ortools.sat.Literal;
import com.google.ortools.util.Domain;
import java.util.List;
import org.fzn2sat.flatzinc.ConstraintItem;

/** Base class of the per-family constraint lowering strategies. */
abstract class Lowering {
  Lowering(MappingContext context, ExpressionEvaluator evaluator, Reification reification) {
    this.context = context;
    this.evaluator = evaluator;
    this.reification = reification;
    this.model = context.getModel();
  }

  /** Lowers one constraint whose arity has already been checked. */
  abstract void lower(Predicate.Call call, ConstraintItem item);

  /** Resolves the trailing boolean of a reified call, or returns null for plain calls. */
  Literal reificationLiteral(Predicate.Call call, ConstraintItem item) {
    if (!call.isReified()) {
      return null;
    }
    return evaluator.resolveBool(item.getArg(item.arity() - 1));
  }

  /** Makes the model infeasible. */
  void postFalse() {
    model.addBoolOr(new Literal[] {model.falseLiteral()});
  }

  /**
   * Returns {@code var}, or a copy of it whose domain excludes 0 when {@code var} can be 0. The
   * solver rejects divisors whose domain contains 0.
   */
  IntVar nonZero(IntVar var) {
    Domain domain = var.getDomain();
    if (!domain.contains(0)) {
      return var;
    }
    Domain withoutZero = domain.intersectionWith(new Domain(0).complement());
    if (withoutZero.isEmpty()) {
      postFalse();
      return model.newConstant(1);
    }
    IntVar copy = model.newIntVarFromDomain(withoutZero, "");
    model.addEquality(copy, var);
    return copy;
  }

  /** Bounds of {@code a * b}, clamped to the range the solver accepts for variables. */
  static long[] productBounds(IntVar a, IntVar b) {
    long[] as = {MappingContext.lowerBound(a), MappingContext.upperBound(a)};
    long[] bs = {MappingContext.lowerBound(b), MappingContext.upperBound(b)};
    long lo = Long.MAX_VALUE;
    long hi = Long.MIN_VALUE;
    for (long x : as) {
      for (long y : bs) {
        long p = LongMath.saturatedMultiply(x, y);
        lo = Math.min(lo, p);
        hi = Math.max(hi, p);
      }
    }
    return new long[] {Math.max(lo, -MAX_MAGNITUDE), Math.min(hi, MAX_MAGNITUDE)};
  }

  static void checkSameLength(Predicate.Call call, ConstraintItem item, String first,
      int firstLength, String second, int secondLength) {
    if (firstLength != secondLength) {
      throw new MapException.MismatchedArrayLengths(call.getName(), first, firstLength, second,
          secondLength, item.getLocation());
    }
  }

  static LinearArgument[] toArray(List<? extends LinearArgument> vars) {
    return vars.toArray(new LinearArgument[0]);
  }

  static IntVar[] toIntVars(List<IntVar> vars) {
    return vars.toArray(new IntVar[0]);
  }

  /** The relation named by a comparison or linear predicate. */
  static Relation relationOf(Predicate predicate) {
    switch (predicate) {
      case INT_EQ:
      case BOOL_EQ:
      case FLOAT_EQ:
      case INT_LIN_EQ:
      case BOOL_LIN_EQ:
      case FLOAT_LIN_EQ:
        return Relation.EQ;
      case INT_NE:
      case BOOL_NE:
      case FLOAT_NE:
      case INT_LIN_NE:
      case FLOAT_LIN_NE:
        return Relation.NE;
      case INT_LT:
      case BOOL_LT:
      case FLOAT_LT:
      case INT_LIN_LT:
      case FLOAT_LIN_LT:
        return Relation.LT;
      case INT_LE:
      case BOOL_LE:
      case FLOAT_LE:
      case INT_LIN_LE:
      case BOOL_LIN_LE:
      case FLOAT_LIN_LE:
        return Relation.LE;
      case INT_GT:
      case FLOAT_GT:
      case INT_LIN_GT:
        return Relation.GT;
      case INT_GE:
      case FLOAT_GE:
      case INT_LIN_GE:
        return Relation.GE;
      default:
        throw new IllegalArgumentException(predicate + " is not a comparison");
    }
  }

  /** Variable bounds used for auxiliary products stay within this magnitude. */
  static final long MAX_MAGNITUDE = Long.MAX_VALUE / 4;

  final MappingContext context;
  final ExpressionEvaluator evaluator;
  final Reification reification;
  final CpModel model;
}
