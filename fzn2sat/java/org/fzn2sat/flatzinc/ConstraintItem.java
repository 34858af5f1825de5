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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** A {@code constraint predicate(args) :: annotations;} item. */
public final class ConstraintItem {
  public ConstraintItem(String predicate, List<Expr> args, List<Annotation> annotations,
      Location location) {
    this.predicate = predicate;
    this.args = ImmutableList.copyOf(args);
    this.annotations = ImmutableList.copyOf(annotations);
    this.location = location;
  }

  public String getPredicate() {
    return predicate;
  }

  public ImmutableList<Expr> getArgs() {
    return args;
  }

  public Expr getArg(int index) {
    return args.get(index);
  }

  public int arity() {
    return args.size();
  }

  public ImmutableList<Annotation> getAnnotations() {
    return annotations;
  }

  public Location getLocation() {
    return location;
  }

  @Override
  public String toString() {
    return predicate + "(" + Joiner.on(", ").join(args) + ")";
  }

  private final String predicate;
  private final ImmutableList<Expr> args;
  private final ImmutableList<Annotation> annotations;
  private final Location location;
}
