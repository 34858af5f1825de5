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

import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.Constraint;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.LinearArgument;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.Literal;
import java.util.ArrayList;
import java.util.List;

/**
 * Posts relations in plain, reified or implied form, and builds reified boolean aggregates.
 *
 * <p>A reified relation {@code b <-> (l op r)} is posted as {@code (l op r)} enforced by {@code b}
 * and the negated relation enforced by {@code not(b)}.
 */
public final class Reification {
  public Reification(CpModel model) {
    this.model = model;
  }

  /** Posts {@code left op right}. */
  public Constraint post(Relation relation, LinearArgument left, LinearArgument right) {
    switch (relation) {
      case EQ:
        return model.addEquality(left, right);
      case NE:
        return model.addDifferent(left, right);
      case LT:
        return model.addLessThan(left, right);
      case LE:
        return model.addLessOrEqual(left, right);
      case GT:
        return model.addGreaterThan(left, right);
      default:
        return model.addGreaterOrEqual(left, right);
    }
  }

  /** Posts {@code expr op value}. */
  public Constraint post(Relation relation, LinearArgument expr, long value) {
    return post(relation, expr, LinearExpr.constant(value));
  }

  /** Posts {@code literal <-> (left op right)}. */
  public void reify(Relation relation, LinearArgument left, LinearArgument right,
      Literal literal) {
    post(relation, left, right).onlyEnforceIf(literal);
    post(relation.negate(), left, right).onlyEnforceIf(literal.not());
  }

  /** Posts {@code literal -> (left op right)}. */
  public void imply(Relation relation, LinearArgument left, LinearArgument right,
      Literal literal) {
    post(relation, left, right).onlyEnforceIf(literal);
  }

  /**
   * Posts {@code left op right} in the given mode. {@code literal} is ignored for
   * {@link Predicate.Mode#PLAIN}.
   */
  public void enforce(Predicate.Mode mode, Relation relation, LinearArgument left,
      LinearArgument right, Literal literal) {
    switch (mode) {
      case PLAIN:
        post(relation, left, right);
        break;
      case REIF:
        reify(relation, left, right, literal);
        break;
      case IMP:
        imply(relation, left, right, literal);
        break;
    }
  }

  /** Returns a fresh boolean equivalent to {@code left op right}. */
  public BoolVar reified(Relation relation, LinearArgument left, LinearArgument right) {
    BoolVar b = model.newBoolVar("");
    reify(relation, left, right, b);
    return b;
  }

  public BoolVar reified(Relation relation, LinearArgument expr, long value) {
    return reified(relation, expr, LinearExpr.constant(value));
  }

  /** Posts {@code literal <-> and(literals)}. An empty conjunction is true. */
  public void reifyAnd(List<Literal> literals, Literal literal) {
    List<Literal> clause = new ArrayList<>();
    for (Literal l : literals) {
      model.addImplication(literal, l);
      clause.add(l.not());
    }
    clause.add(literal);
    model.addBoolOr(clause);
  }

  /** Posts {@code literal <-> or(literals)}. An empty disjunction is false. */
  public void reifyOr(List<Literal> literals, Literal literal) {
    List<Literal> clause = new ArrayList<>(literals);
    for (Literal l : literals) {
      model.addImplication(l, literal);
    }
    clause.add(literal.not());
    model.addBoolOr(clause);
  }

  /** Posts {@code literal -> and(literals)}. */
  public void implyAnd(List<Literal> literals, Literal literal) {
    for (Literal l : literals) {
      model.addImplication(literal, l);
    }
  }

  /** Posts {@code literal -> or(literals)}. */
  public void implyOr(List<Literal> literals, Literal literal) {
    List<Literal> clause = new ArrayList<>(literals);
    clause.add(literal.not());
    model.addBoolOr(clause);
  }

  /** Returns a fresh boolean equivalent to the conjunction of {@code literals}. */
  public BoolVar and(List<Literal> literals) {
    BoolVar b = model.newBoolVar("");
    reifyAnd(literals, b);
    return b;
  }

  /** Returns a fresh boolean equivalent to the disjunction of {@code literals}. */
  public BoolVar or(List<Literal> literals) {
    BoolVar b = model.newBoolVar("");
    reifyOr(literals, b);
    return b;
  }

  public CpModel getModel() {
    return model;
  }

  private final CpModel model;
}
