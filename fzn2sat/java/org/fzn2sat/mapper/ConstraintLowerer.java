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

import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.fzn2sat.flatzinc.ConstraintItem;

/**
 * Lowers constraint items onto the model. The predicate name is decoded and the argument count
 * checked before any argument is resolved, so a malformed call allocates nothing.
 */
public final class ConstraintLowerer {
  public ConstraintLowerer(MappingContext context, ExpressionEvaluator evaluator) {
    Reification reification = new Reification(context.getModel());
    strategies.put(Predicate.Family.RELATION,
        new RelationLowering(context, evaluator, reification));
    strategies.put(Predicate.Family.LINEAR, new LinearLowering(context, evaluator, reification));
    strategies.put(Predicate.Family.ARITHMETIC,
        new ArithmeticLowering(context, evaluator, reification));
    strategies.put(Predicate.Family.BOOLEAN,
        new BooleanLowering(context, evaluator, reification));
    strategies.put(Predicate.Family.ELEMENT,
        new ElementLowering(context, evaluator, reification));
    strategies.put(Predicate.Family.SET, new SetLowering(context, evaluator, reification));
    strategies.put(Predicate.Family.FLOAT, new FloatLowering(context, evaluator, reification));
    strategies.put(Predicate.Family.GLOBAL, new GlobalLowering(context, evaluator, reification));
    strategies.put(Predicate.Family.COUNTING,
        new CountingLowering(context, evaluator, reification));
  }

  /** Lowers one constraint item. Items must be lowered in source order. */
  public void lower(ConstraintItem item) {
    Predicate.Call call = Predicate.decode(item.getPredicate(), item.getLocation());
    call.checkArity(item);
    if (logger.isLoggable(Level.FINEST)) {
      logger.finest("lowering " + call.getName() + " at " + item.getLocation());
    }
    strategies.get(call.getPredicate().getFamily()).lower(call, item);
  }

  private static final Logger logger = Logger.getLogger(ConstraintLowerer.class.getName());

  private final Map<Predicate.Family, Lowering> strategies =
      new EnumMap<>(Predicate.Family.class);
}
