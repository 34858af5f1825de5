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

/** A {@code predicate name(params);} item. Only the name is kept. */
public final class PredicateDecl {
  public PredicateDecl(String name, int paramCount, Location location) {
    this.name = name;
    this.paramCount = paramCount;
    this.location = location;
  }

  public String getName() {
    return name;
  }

  public int getParamCount() {
    return paramCount;
  }

  public Location getLocation() {
    return location;
  }

  private final String name;
  private final int paramCount;
  private final Location location;
}
