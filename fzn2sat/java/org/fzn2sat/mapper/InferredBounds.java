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

/** The integer interval substituted for unbounded or oversized integer declarations. */
public final class InferredBounds {
  public InferredBounds(long lo, long hi, boolean observed) {
    this.lo = lo;
    this.hi = hi;
    this.observed = observed;
  }

  public long getLo() {
    return lo;
  }

  public long getHi() {
    return hi;
  }

  /** False when the model had no finite integer data and the default range was used. */
  public boolean isObserved() {
    return observed;
  }

  public boolean contains(long value) {
    return lo <= value && value <= hi;
  }

  @Override
  public String toString() {
    return "[" + lo + ", " + hi + "]";
  }

  private final long lo;
  private final long hi;
  private final boolean observed;
}
