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
import com.google.ortools.util.Domain;
import java.util.List;
import org.fzn2sat.flatzinc.ConstraintItem;

/** Lowers global cardinality and the {@code count}, {@code at_least} family. */
final class CountingLowering extends Lowering {
  CountingLowering(MappingContext context, ExpressionEvaluator evaluator,
      Reification reification) {
    super(context, evaluator, reification);
    this.cardinality = new CardinalityPrimitives(reification);
  }

  @Override
  void lower(Predicate.Call call, ConstraintItem item) {
    switch (call.getPredicate()) {
      case GLOBAL_CARDINALITY:
      case GLOBAL_CARDINALITY_CLOSED:
        lowerCardinality(call, item);
        break;
      case GLOBAL_CARDINALITY_LOW_UP:
      case GLOBAL_CARDINALITY_LOW_UP_CLOSED:
        lowerCardinalityLowUp(call, item);
        break;
      case COUNT_EQ:
        {
          List<IntVar> x = evaluator.resolveIntArray(item.getArg(0));
          IntVar value = evaluator.resolveInt(item.getArg(1));
          IntVar count = evaluator.resolveInt(item.getArg(2));
          reification.enforce(call.getMode(), Relation.EQ, cardinality.count(x, value), count,
              reificationLiteral(call, item));
          break;
        }
      case AT_LEAST_INT:
        lowerBound(item, Relation.GE);
        break;
      case AT_MOST_INT:
        lowerBound(item, Relation.LE);
        break;
      case EXACTLY_INT:
        lowerBound(item, Relation.EQ);
        break;
      default:
        throw new IllegalArgumentException(call.getName() + " is not a counting constraint");
    }
  }

  // global_cardinality(x, cover, counts): counts[j] is the number of x equal to cover[j].
  private void lowerCardinality(Predicate.Call call, ConstraintItem item) {
    long[] cover = evaluator.extractIntArray(item.getArg(1));
    checkSameLength(call, item, "cover", cover.length, "counts",
        evaluator.arrayLength(item.getArg(2)));
    List<IntVar> x = evaluator.resolveIntArray(item.getArg(0));
    List<IntVar> counts = evaluator.resolveIntArray(item.getArg(2));
    for (int j = 0; j < cover.length; j++) {
      model.addEquality(cardinality.count(x, cover[j]), counts.get(j));
    }
    if (call.getPredicate() == Predicate.GLOBAL_CARDINALITY_CLOSED) {
      close(x, cover);
    }
  }

  // global_cardinality_low_up(x, cover, lbound, ubound).
  private void lowerCardinalityLowUp(Predicate.Call call, ConstraintItem item) {
    long[] cover = evaluator.extractIntArray(item.getArg(1));
    long[] lower = evaluator.extractIntArray(item.getArg(2));
    long[] upper = evaluator.extractIntArray(item.getArg(3));
    checkSameLength(call, item, "cover", cover.length, "lbound", lower.length);
    checkSameLength(call, item, "cover", cover.length, "ubound", upper.length);
    List<IntVar> x = evaluator.resolveIntArray(item.getArg(0));
    for (int j = 0; j < cover.length; j++) {
      model.addLinearConstraint(cardinality.count(x, cover[j]), lower[j], upper[j]);
    }
    if (call.getPredicate() == Predicate.GLOBAL_CARDINALITY_LOW_UP_CLOSED) {
      close(x, cover);
    }
  }

  /** Restricts every variable of {@code x} to the values of {@code cover}. */
  private void close(List<IntVar> x, long[] cover) {
    if (x.isEmpty()) {
      return;
    }
    if (cover.length == 0) {
      postFalse();
      return;
    }
    Domain allowed = Domain.fromValues(cover);
    for (IntVar var : x) {
      model.addLinearExpressionInDomain(var, allowed);
    }
  }

  // at_least_int(n, x, v), at_most_int(n, x, v), exactly_int(n, x, v).
  private void lowerBound(ConstraintItem item, Relation relation) {
    long n = evaluator.extractInt(item.getArg(0));
    List<IntVar> x = evaluator.resolveIntArray(item.getArg(1));
    long value = evaluator.extractInt(item.getArg(2));
    LinearExpr count = cardinality.count(x, value);
    reification.post(relation, count, n);
  }

  private final CardinalityPrimitives cardinality;
}
