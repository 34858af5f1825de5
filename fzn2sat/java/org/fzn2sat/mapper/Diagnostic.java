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

import org.fzn2sat.flatzinc.Location;

/** A non-fatal note produced during translation. */
public final class Diagnostic {
  /** Diagnostic categories. */
  public enum Kind {
    /** An unbounded or oversized integer domain was replaced by the inferred range. */
    DOMAIN_SUBSTITUTED,
    /** An explicit integer set domain was widened to its interval hull. */
    DOMAIN_HULL,
    /** A decomposition hit its size cap and only enforces part of the constraint. */
    DECOMPOSITION_INCOMPLETE,
    /** A float operation was rounded to the fixed-point grid. */
    FLOAT_APPROXIMATION,
    /** An annotation was recognized but ignored. */
    ANNOTATION_IGNORED
  }

  public Diagnostic(Kind kind, String message, Location location) {
    this.kind = kind;
    this.message = message;
    this.location = location;
  }

  public Kind getKind() {
    return kind;
  }

  public String getMessage() {
    return message;
  }

  /** Returns the source position, or null. */
  public Location getLocation() {
    return location;
  }

  @Override
  public String toString() {
    return (location == null ? "" : location + ": ") + kind + ": " + message;
  }

  private final Kind kind;
  private final String message;
  private final Location location;
}
