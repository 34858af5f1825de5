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

/** The {@code solve} item: the goal, its objective when optimizing, and search annotations. */
public final class SolveItem {
  /** Solve goals. */
  public enum Goal {
    SATISFY,
    MINIMIZE,
    MAXIMIZE
  }

  public static SolveItem satisfy() {
    return new SolveItem(Goal.SATISFY, null, ImmutableList.<Annotation>of(), null);
  }

  public SolveItem(Goal goal, Expr objective, List<Annotation> annotations, Location location) {
    this.goal = goal;
    this.objective = objective;
    this.annotations = ImmutableList.copyOf(annotations);
    this.location = location;
  }

  public Goal getGoal() {
    return goal;
  }

  /** Returns the objective expression, or null for satisfaction problems. */
  public Expr getObjective() {
    return objective;
  }

  public ImmutableList<Annotation> getAnnotations() {
    return annotations;
  }

  public Location getLocation() {
    return location;
  }

  public boolean isOptimization() {
    return goal != Goal.SATISFY;
  }

  @Override
  public String toString() {
    return "solve " + goal.name().toLowerCase() + (objective == null ? "" : " " + objective);
  }

  private final Goal goal;
  private final Expr objective;
  private final ImmutableList<Annotation> annotations;
  private final Location location;
}
