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
import java.util.List;
import org.fzn2sat.flatzinc.ConstraintItem;
import org.fzn2sat.flatzinc.Expr;

/**
 * Lowers the {@code array_*_element} family onto the native element constraint.
 *
 * <p>The three-argument form is {@code (idx, array, value)} with a 1-based {@code idx}. The
 * four-argument form is {@code (idx, offset, array, value)} where {@code idx - offset} is the
 * 0-based position. In both forms {@code idx} is restricted to the array's index range.
 */
final class ElementLowering extends Lowering {
  ElementLowering(MappingContext context, ExpressionEvaluator evaluator,
      Reification reification) {
    super(context, evaluator, reification);
  }

  @Override
  void lower(Predicate.Call call, ConstraintItem item) {
    boolean withOffset = item.arity() == 4;
    long offset = withOffset ? evaluator.extractInt(item.getArg(1)) : 1;
    Expr arrayExpr = item.getArg(withOffset ? 2 : 1);
    Expr targetExpr = item.getArg(withOffset ? 3 : 2);

    IntVar index = evaluator.resolveInt(item.getArg(0));
    boolean floats = isFloat(call.getPredicate());
    List<IntVar> elements = floats
        ? evaluator.resolveFloatArray(arrayExpr)
        : evaluator.resolveIntArray(arrayExpr);
    IntVar target = floats ? evaluator.resolveFloat(targetExpr) : evaluator.resolveInt(targetExpr);

    if (elements.isEmpty()) {
      postFalse();
      return;
    }
    model.addLinearConstraint(index, offset, offset + elements.size() - 1);
    LinearExpr position = LinearExpr.affine(index, 1, -offset);
    long[] values = fixedValues(elements);
    if (values != null) {
      model.addElement(position, values, target);
    } else {
      model.addElement(position, toArray(elements), target);
    }
  }

  private static boolean isFloat(Predicate predicate) {
    return predicate == Predicate.ARRAY_FLOAT_ELEMENT
        || predicate == Predicate.ARRAY_VAR_FLOAT_ELEMENT;
  }

  /** Returns the values of {@code vars} when every one is fixed, otherwise null. */
  static long[] fixedValues(List<IntVar> vars) {
    long[] values = new long[vars.size()];
    for (int i = 0; i < values.length; i++) {
      Long value = MappingContext.fixedValue(vars.get(i));
      if (value == null) {
        return null;
      }
      values[i] = value;
    }
    return values;
  }
}
