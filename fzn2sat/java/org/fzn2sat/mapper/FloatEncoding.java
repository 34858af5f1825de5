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

import com.google.common.math.LongMath;

/**
 * Fixed-point representation of float values as integers: {@code f} is stored as
 * {@code round(f * scale)} with {@code scale = 10^precision}.
 */
public final class FloatEncoding {
  public FloatEncoding(int precision, double defaultBound) {
    this.precision = precision;
    this.scale = LongMath.pow(10, precision);
    this.defaultBound = defaultBound;
  }

  public int getPrecision() {
    return precision;
  }

  public long getScale() {
    return scale;
  }

  /** Encodes {@code value}, rounding to the nearest grid point. */
  public long encode(double value) {
    double scaled = value * scale;
    if (Double.isNaN(scaled) || Math.abs(scaled) > MAX_ENCODED) {
      throw new ArithmeticException("float value " + value + " cannot be encoded");
    }
    return Math.round(scaled);
  }

  /** Encodes a lower bound, rounding up so no admissible value is cut off incorrectly. */
  public long encodeLowerBound(double value) {
    return (long) Math.ceil(clamp(value * scale - EPSILON));
  }

  /** Encodes an upper bound, rounding down. */
  public long encodeUpperBound(double value) {
    return (long) Math.floor(clamp(value * scale + EPSILON));
  }

  public double decode(long encoded) {
    return (double) encoded / scale;
  }

  /** Lower bound used for float variables without a declared domain. */
  public long unboundedLo() {
    return encode(-defaultBound);
  }

  /** Upper bound used for float variables without a declared domain. */
  public long unboundedHi() {
    return encode(defaultBound);
  }

  /** True when {@code value} lies exactly on the encoding grid. */
  public boolean isExact(double value) {
    double scaled = value * scale;
    return Math.abs(scaled - Math.rint(scaled)) < EPSILON;
  }

  private static double clamp(double value) {
    return Math.max(-MAX_ENCODED, Math.min(MAX_ENCODED, value));
  }

  // Encoded magnitudes above this lose integer precision as doubles.
  private static final double MAX_ENCODED = 1e15;
  private static final double EPSILON = 1e-6;

  private final int precision;
  private final long scale;
  private final double defaultBound;
}
