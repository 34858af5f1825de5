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

/** An annotation {@code :: name} or {@code :: name(args)} attached to an item. */
public final class Annotation {
  public Annotation(String name, List<Expr> args, Location location) {
    this.name = name;
    this.args = ImmutableList.copyOf(args);
    this.location = location;
  }

  public String getName() {
    return name;
  }

  public ImmutableList<Expr> getArgs() {
    return args;
  }

  public Location getLocation() {
    return location;
  }

  /** Finds the first annotation named {@code name} in {@code annotations}, or null. */
  public static Annotation find(List<Annotation> annotations, String name) {
    for (Annotation annotation : annotations) {
      if (annotation.name.equals(name)) {
        return annotation;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return args.isEmpty() ? name : name + "(" + Joiner.on(", ").join(args) + ")";
  }

  private final String name;
  private final ImmutableList<Expr> args;
  private final Location location;
}
