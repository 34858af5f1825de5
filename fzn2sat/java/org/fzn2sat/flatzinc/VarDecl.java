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

/** A variable or parameter declaration, scalar or array. */
public final class VarDecl {
  public VarDecl(Type type, String name, List<Annotation> annotations, Expr init,
      Location location) {
    this.type = type;
    this.name = name;
    this.annotations = ImmutableList.copyOf(annotations);
    this.init = init;
    this.location = location;
  }

  public Type getType() {
    return type;
  }

  public String getName() {
    return name;
  }

  public ImmutableList<Annotation> getAnnotations() {
    return annotations;
  }

  /** Returns the initializer, or null when the declaration has none. */
  public Expr getInit() {
    return init;
  }

  public Location getLocation() {
    return location;
  }

  public boolean hasAnnotation(String annotationName) {
    return Annotation.find(annotations, annotationName) != null;
  }

  @Override
  public String toString() {
    return type + ": " + name + (init == null ? "" : " = " + init);
  }

  private final Type type;
  private final String name;
  private final ImmutableList<Annotation> annotations;
  private final Expr init;
  private final Location location;
}
