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

import com.google.common.base.Preconditions;
import com.google.ortools.sat.CpModel;
import java.util.logging.Logger;
import org.fzn2sat.flatzinc.ConstraintItem;
import org.fzn2sat.flatzinc.FlatZincModel;
import org.fzn2sat.flatzinc.SolveItem;
import org.fzn2sat.flatzinc.VarDecl;

/**
 * Translates a parsed FlatZinc model into a CP-SAT model in one forward pass: bound inference,
 * declarations in source order, constraints in source order, then the solve item.
 *
 * <p>A translator holds no per-model state and may be reused. Any error aborts the translation;
 * the partially built model is discarded.
 */
public final class FlatZincTranslator {
  public FlatZincTranslator() {
    this(TranslatorOptions.defaults());
  }

  public FlatZincTranslator(TranslatorOptions options) {
    this.options = Preconditions.checkNotNull(options);
  }

  /** Parses and translates FlatZinc source text. */
  public Translation translate(String source) {
    return translate(FlatZincModel.parse(source));
  }

  public Translation translate(FlatZincModel fzn) {
    InferredBounds bounds = BoundInference.infer(fzn, options.getMaxDomainSize());
    CpModel model = new CpModel();
    MappingContext context = new MappingContext(model, options, bounds);
    ExpressionEvaluator evaluator = new ExpressionEvaluator(context);

    DeclarationMapper declarations = new DeclarationMapper(context, evaluator);
    for (VarDecl decl : fzn.getDeclarations()) {
      try {
        declarations.map(decl);
      } catch (ArithmeticException e) {
        throw new MapException("'" + decl.getName() + "': " + e.getMessage(),
            decl.getLocation(), e);
      }
    }
    ConstraintLowerer lowerer = new ConstraintLowerer(context, evaluator);
    for (ConstraintItem item : fzn.getConstraints()) {
      try {
        lowerer.lower(item);
      } catch (ArithmeticException e) {
        throw new MapException(item.getPredicate() + ": " + e.getMessage(), item.getLocation(),
            e);
      }
    }

    SolveItem solve = fzn.getSolve();
    MappingContext.Scalar objective = null;
    if (solve.isOptimization()) {
      objective = evaluator.resolveScalar(solve.getObjective());
      if (solve.getGoal() == SolveItem.Goal.MINIMIZE) {
        model.minimize(objective.getVar());
      } else {
        model.maximize(objective.getVar());
      }
    }
    if (options.isUseSearchAnnotations()) {
      new SearchAnnotations(context, evaluator).apply(solve.getAnnotations());
    }
    OutputSpec output = OutputSpec.build(fzn.getDeclarations(), context, evaluator);

    logger.fine("translated " + fzn.getDeclarations().size() + " declarations and "
        + fzn.getConstraints().size() + " constraints into a model with "
        + model.getBuilder().getVariablesCount() + " variables and "
        + model.getBuilder().getConstraintsCount() + " constraints");
    return new Translation(model, context, solve.getGoal(), objective, output);
  }

  public TranslatorOptions getOptions() {
    return options;
  }

  private static final Logger logger = Logger.getLogger(FlatZincTranslator.class.getName());

  private final TranslatorOptions options;
}
