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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.ortools.sat.DecisionStrategyProto;
import com.google.ortools.sat.IntVar;
import java.util.List;
import org.fzn2sat.flatzinc.Annotation;
import org.fzn2sat.flatzinc.Expr;
import org.fzn2sat.flatzinc.Location;

/**
 * Applies solve annotations: {@code int_search} and {@code bool_search} become decision
 * strategies, {@code seq_search} applies its members in order and {@code warm_start} becomes
 * solution hints. Anything else is reported and ignored.
 */
public final class SearchAnnotations {
  public SearchAnnotations(MappingContext context, ExpressionEvaluator evaluator) {
    this.context = context;
    this.evaluator = evaluator;
  }

  public void apply(List<Annotation> annotations) {
    for (Annotation annotation : annotations) {
      apply(annotation.getName(), annotation.getArgs(), annotation.getLocation());
    }
  }

  private void apply(String name, List<Expr> args, Location location) {
    switch (name) {
      case "int_search":
      case "bool_search":
        if (args.size() < 3) {
          ignore(name, "expects at least 3 arguments", location);
          return;
        }
        addStrategy(name, args, location);
        break;
      case "seq_search":
      case "warm_start_array":
        if (args.size() != 1 || args.get(0).getKind() != Expr.Kind.ARRAY_LIT) {
          ignore(name, "expects an array of annotations", location);
          return;
        }
        for (Expr nested : ((Expr.ArrayLit) args.get(0)).getElements()) {
          applyNested(nested);
        }
        break;
      case "warm_start":
        if (args.size() != 2) {
          ignore(name, "expects 2 arguments", location);
          return;
        }
        addHints(args, location);
        break;
      default:
        ignore(name, "is not supported", location);
        break;
    }
  }

  private void applyNested(Expr nested) {
    if (nested.getKind() == Expr.Kind.CALL) {
      Expr.Call call = (Expr.Call) nested;
      apply(call.getName(), call.getArgs(), call.getLocation());
    } else if (nested.getKind() == Expr.Kind.IDENT) {
      apply(((Expr.Ident) nested).getName(), ImmutableList.<Expr>of(), nested.getLocation());
    } else {
      ignore(nested.toString(), "is not a search annotation", nested.getLocation());
    }
  }

  private void addStrategy(String name, List<Expr> args, Location location) {
    DecisionStrategyProto.VariableSelectionStrategy variables =
        VARIABLE_SELECTION.get(identName(args.get(1)));
    DecisionStrategyProto.DomainReductionStrategy values =
        DOMAIN_REDUCTION.get(identName(args.get(2)));
    if (variables == null || values == null) {
      ignore(name, "uses an unknown strategy " + args.get(1) + ", " + args.get(2), location);
      return;
    }
    List<IntVar> vars = evaluator.resolveIntArray(args.get(0));
    if (vars.isEmpty()) {
      return;
    }
    context.getModel().addDecisionStrategy(vars, variables, values);
  }

  private void addHints(List<Expr> args, Location location) {
    List<IntVar> vars = evaluator.resolveIntArray(args.get(0));
    long[] values;
    if (evaluator.isConstantIntArray(args.get(1))) {
      values = evaluator.extractIntArray(args.get(1));
    } else {
      boolean[] bools = evaluator.extractBoolArray(args.get(1));
      values = new long[bools.length];
      for (int i = 0; i < bools.length; i++) {
        values[i] = bools[i] ? 1 : 0;
      }
    }
    if (vars.size() != values.length) {
      ignore("warm_start", "has " + vars.size() + " variables but " + values.length + " values",
          location);
      return;
    }
    for (int i = 0; i < values.length; i++) {
      context.getModel().addHint(vars.get(i), values[i]);
    }
  }

  private static String identName(Expr expr) {
    return expr.getKind() == Expr.Kind.IDENT ? ((Expr.Ident) expr).getName() : expr.toString();
  }

  private void ignore(String name, String reason, Location location) {
    context.diagnose(Diagnostic.Kind.ANNOTATION_IGNORED,
        "annotation '" + name + "' " + reason + "; ignored", location);
  }

  private static final ImmutableMap<String, DecisionStrategyProto.VariableSelectionStrategy>
      VARIABLE_SELECTION =
          ImmutableMap.<String, DecisionStrategyProto.VariableSelectionStrategy>builder()
              .put("input_order", DecisionStrategyProto.VariableSelectionStrategy.CHOOSE_FIRST)
              .put("first_fail",
                  DecisionStrategyProto.VariableSelectionStrategy.CHOOSE_MIN_DOMAIN_SIZE)
              .put("anti_first_fail",
                  DecisionStrategyProto.VariableSelectionStrategy.CHOOSE_MAX_DOMAIN_SIZE)
              .put("smallest", DecisionStrategyProto.VariableSelectionStrategy.CHOOSE_LOWEST_MIN)
              .put("largest", DecisionStrategyProto.VariableSelectionStrategy.CHOOSE_HIGHEST_MAX)
              .build();

  private static final ImmutableMap<String, DecisionStrategyProto.DomainReductionStrategy>
      DOMAIN_REDUCTION =
          ImmutableMap.<String, DecisionStrategyProto.DomainReductionStrategy>builder()
              .put("indomain_min", DecisionStrategyProto.DomainReductionStrategy.SELECT_MIN_VALUE)
              .put("indomain_max", DecisionStrategyProto.DomainReductionStrategy.SELECT_MAX_VALUE)
              .put("indomain_split",
                  DecisionStrategyProto.DomainReductionStrategy.SELECT_LOWER_HALF)
              .put("indomain_reverse_split",
                  DecisionStrategyProto.DomainReductionStrategy.SELECT_UPPER_HALF)
              .put("indomain_median",
                  DecisionStrategyProto.DomainReductionStrategy.SELECT_MEDIAN_VALUE)
              .build();

  private final MappingContext context;
  private final ExpressionEvaluator evaluator;
}
