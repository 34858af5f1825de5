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

package org.fzn2sat.flatzinc;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** A parsed FlatZinc model. Items keep their source order. */
public final class FlatZincModel {
  public FlatZincModel(List<PredicateDecl> predicates, List<VarDecl> declarations,
      List<ConstraintItem> constraints, SolveItem solve) {
    this.predicates = ImmutableList.copyOf(predicates);
    this.declarations = ImmutableList.copyOf(declarations);
    this.constraints = ImmutableList.copyOf(constraints);
    this.solve = solve;
  }

  /** Parses FlatZinc source text. */
  public static FlatZincModel parse(String text) {
    return new Parser(Tokenizer.tokenize(text)).parseModel();
  }

  public ImmutableList<PredicateDecl> getPredicates() {
    return predicates;
  }

  public ImmutableList<VarDecl> getDeclarations() {
    return declarations;
  }

  public ImmutableList<ConstraintItem> getConstraints() {
    return constraints;
  }

  public SolveItem getSolve() {
    return solve;
  }

  private final ImmutableList<PredicateDecl> predicates;
  private final ImmutableList<VarDecl> declarations;
  private final ImmutableList<ConstraintItem> constraints;
  private final SolveItem solve;
}
