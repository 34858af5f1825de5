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

/** A binary comparison operator. */
public enum Relation {
  EQ,
  NE,
  LT,
  LE,
  GT,
  GE;

  /** Returns the relation that holds exactly when this one does not. */
  public Relation negate() {
    switch (this) {
      case EQ:
        return NE;
      case NE:
        return EQ;
      case LT:
        return GE;
      case LE:
        return GT;
      case GT:
        return LE;
      default:
        return LT;
    }
  }

  /** Evaluates the relation on two constants. */
  public boolean holds(long left, long right) {
    switch (this) {
      case EQ:
        return left == right;
      case NE:
        return left != right;
      case LT:
        return left < right;
      case LE:
        return left <= right;
      case GT:
        return left > right;
      default:
        return left >= right;
    }
  }
}
