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
import java.util.logging.Logger;
import org.fzn2sat.flatzinc.ConstraintItem;
import org.fzn2sat.flatzinc.Expr;
import org.fzn2sat.flatzinc.FlatZincModel;
import org.fzn2sat.flatzinc.Type;
import org.fzn2sat.flatzinc.VarDecl;

/**
 * Computes the {@link InferredBounds} of a model in one pass over its declarations, constraints and
 * objective, before any variable is allocated.
 *
 * <p>Every finite integer domain and every integer constant in the model is observed. The observed
 * hull {@code [min, max]} is widened by {@code max(max - min, 100)} on each side and clamped to
 * {@code +/- maxDomainSize / 2}. A model without any integer data gets that full range.
 */
public final class BoundInference {
  /** Minimum widening applied on each side of the observed hull. */
  public static final long MIN_EXPANSION = 100;

  public BoundInference(long maxDomainSize) {
    this.maxDomainSize = maxDomainSize;
  }

  public static InferredBounds infer(FlatZincModel model, long maxDomainSize) {
    BoundInference inference = new BoundInference(maxDomainSize);
    for (VarDecl decl : model.getDeclarations()) {
      inference.observeDeclaration(decl);
    }
    for (ConstraintItem constraint : model.getConstraints()) {
      for (Expr arg : constraint.getArgs()) {
        inference.observeExpr(arg);
      }
    }
    if (model.getSolve().getObjective() != null) {
      inference.observeExpr(model.getSolve().getObjective());
    }
    InferredBounds bounds = inference.result();
    logger.fine("inferred integer bounds " + bounds);
    return bounds;
  }

  void observeDeclaration(VarDecl decl) {
    Type.DomainSpec domain = decl.getType().getDomain();
    if (domain != null && domain.isInt() && !domain.isEmpty()
        && decl.getType().getBase() == Type.Base.INT) {
      long size = domainSize(domain.getIntLo(), domain.getIntHi());
      // Oversized domains are the ones the inferred range replaces.
      if (size <= maxDomainSize) {
        observe(domain.getIntLo());
        observe(domain.getIntHi());
      }
    }
    if (decl.getInit() != null) {
      observeExpr(decl.getInit());
    }
  }

  void observeExpr(Expr expr) {
    switch (expr.getKind()) {
      case INT_LIT:
        observe(((Expr.IntLit) expr).getValue());
        break;
      case RANGE:
        observe(((Expr.Range) expr).getLo());
        observe(((Expr.Range) expr).getHi());
        break;
      case ARRAY_LIT:
        for (Expr element : ((Expr.ArrayLit) expr).getElements()) {
          observeExpr(element);
        }
        break;
      case SET_LIT:
        for (Expr element : ((Expr.SetLit) expr).getElements()) {
          observeExpr(element);
        }
        break;
      default:
        // Identifiers were observed at their declaration; array indices are positions.
        break;
    }
  }

  private void observe(long value) {
    if (!found) {
      min = value;
      max = value;
      found = true;
    } else {
      min = Math.min(min, value);
      max = Math.max(max, value);
    }
  }

  InferredBounds result() {
    long limit = maxDomainSize / 2;
    if (!found) {
      return new InferredBounds(-limit, limit, false);
    }
    long expansion = Math.max(LongMath.saturatedSubtract(max, min), MIN_EXPANSION);
    long lo = Math.max(LongMath.saturatedSubtract(min, expansion), -limit);
    long hi = Math.min(LongMath.saturatedAdd(max, expansion), limit);
    if (lo > hi) {
      // Every observed value lies outside the ceiling on the same side.
      return min > 0 ? new InferredBounds(limit, limit, true)
                     : new InferredBounds(-limit, -limit, true);
    }
    return new InferredBounds(lo, hi, true);
  }

  static long domainSize(long lo, long hi) {
    long diff = LongMath.saturatedSubtract(hi, lo);
    return diff == Long.MAX_VALUE ? Long.MAX_VALUE : diff + 1;
  }

  private static final Logger logger = Logger.getLogger(BoundInference.class.getName());

  private final long maxDomainSize;
  private long min;
  private long max;
  private boolean found = false;
}
