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

import com.google.common.base.Preconditions;

/** Immutable translation settings. Use {@link #newBuilder()}. */
public final class TranslatorOptions {
  /** Largest integer domain, in number of values, allocated as declared. */
  public static final long DEFAULT_MAX_DOMAIN_SIZE = 10_000_000L;
  /** Decimal digits kept by the fixed-point float encoding. */
  public static final int DEFAULT_FLOAT_PRECISION = 3;
  /** Magnitude used for float variables declared without bounds. */
  public static final double DEFAULT_FLOAT_BOUND = 1_000_000.0;

  public static TranslatorOptions defaults() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .setMaxDomainSize(maxDomainSize)
        .setFloatPrecision(floatPrecision)
        .setFloatBound(floatBound)
        .setNativeCumulative(nativeCumulative)
        .setUseSearchAnnotations(useSearchAnnotations);
  }

  public long getMaxDomainSize() {
    return maxDomainSize;
  }

  public int getFloatPrecision() {
    return floatPrecision;
  }

  public double getFloatBound() {
    return floatBound;
  }

  /** Whether cumulative uses the solver's exact native constraint instead of time sampling. */
  public boolean isNativeCumulative() {
    return nativeCumulative;
  }

  public boolean isUseSearchAnnotations() {
    return useSearchAnnotations;
  }

  /** Builder for {@link TranslatorOptions}. */
  public static final class Builder {
    private Builder() {}

    public Builder setMaxDomainSize(long maxDomainSize) {
      Preconditions.checkArgument(maxDomainSize >= 2, "maxDomainSize must be at least 2");
      this.maxDomainSize = maxDomainSize;
      return this;
    }

    public Builder setFloatPrecision(int floatPrecision) {
      Preconditions.checkArgument(floatPrecision >= 0 && floatPrecision <= 9,
          "floatPrecision must be in 0..9, got %s", floatPrecision);
      this.floatPrecision = floatPrecision;
      return this;
    }

    public Builder setFloatBound(double floatBound) {
      Preconditions.checkArgument(floatBound > 0, "floatBound must be positive");
      this.floatBound = floatBound;
      return this;
    }

    public Builder setNativeCumulative(boolean nativeCumulative) {
      this.nativeCumulative = nativeCumulative;
      return this;
    }

    public Builder setUseSearchAnnotations(boolean useSearchAnnotations) {
      this.useSearchAnnotations = useSearchAnnotations;
      return this;
    }

    public TranslatorOptions build() {
      return new TranslatorOptions(this);
    }

    private long maxDomainSize = DEFAULT_MAX_DOMAIN_SIZE;
    private int floatPrecision = DEFAULT_FLOAT_PRECISION;
    private double floatBound = DEFAULT_FLOAT_BOUND;
    private boolean nativeCumulative = false;
    private boolean useSearchAnnotations = true;
  }

  private TranslatorOptions(Builder builder) {
    this.maxDomainSize = builder.maxDomainSize;
    this.floatPrecision = builder.floatPrecision;
    this.floatBound = builder.floatBound;
    this.nativeCumulative = builder.nativeCumulative;
    this.useSearchAnnotations = builder.useSearchAnnotations;
  }

  private final long maxDomainSize;
  private final int floatPrecision;
  private final double floatBound;
  private final boolean nativeCumulative;
  private final boolean useSearchAnnotations;
}
