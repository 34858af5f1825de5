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

package org.fzn2sat.solver;

import com.google.common.base.Preconditions;
import com.google.ortools.sat.SatParameters;

/**
 * Immutable options of a {@link FlatZincSolver} run. Built through {@link #newBuilder()}, in the
 * manner of {@code SatParameters}.
 */
public final class SolverOptions {
  public static SolverOptions defaults() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.allSolutions = allSolutions;
    builder.solutionLimit = solutionLimit;
    builder.intermediateSolutions = intermediateSolutions;
    builder.timeLimitSeconds = timeLimitSeconds;
    builder.numWorkers = numWorkers;
    builder.randomSeed = randomSeed;
    builder.statistics = statistics;
    builder.logSearch = logSearch;
    builder.satParameters = satParameters;
    return builder;
  }

  /** Satisfaction: enumerate every solution. Optimization: report every improving solution. */
  public boolean isAllSolutions() {
    return allSolutions;
  }

  /** Maximum number of solutions to report for satisfaction problems; 0 means the default. */
  public int getSolutionLimit() {
    return solutionLimit;
  }

  public boolean isIntermediateSolutions() {
    return intermediateSolutions;
  }

  /** Wall-clock limit in seconds; 0 means none. */
  public double getTimeLimitSeconds() {
    return timeLimitSeconds;
  }

  /** Number of search workers; 0 lets the solver choose. */
  public int getNumWorkers() {
    return numWorkers;
  }

  /** Random seed, or null to keep the solver's default. */
  public Integer getRandomSeed() {
    return randomSeed;
  }

  public boolean isStatistics() {
    return statistics;
  }

  public boolean isLogSearch() {
    return logSearch;
  }

  /** Raw solver parameters merged in before the options above are applied. */
  public SatParameters getSatParameters() {
    return satParameters;
  }

  /** Builder of {@link SolverOptions}. */
  public static final class Builder {
    private Builder() {}

    public Builder setAllSolutions(boolean allSolutions) {
      this.allSolutions = allSolutions;
      return this;
    }

    public Builder setSolutionLimit(int solutionLimit) {
      Preconditions.checkArgument(solutionLimit >= 0, "negative solution limit %s", solutionLimit);
      this.solutionLimit = solutionLimit;
      return this;
    }

    public Builder setIntermediateSolutions(boolean intermediateSolutions) {
      this.intermediateSolutions = intermediateSolutions;
      return this;
    }

    public Builder setTimeLimitSeconds(double timeLimitSeconds) {
      Preconditions.checkArgument(timeLimitSeconds >= 0, "negative time limit %s",
          timeLimitSeconds);
      this.timeLimitSeconds = timeLimitSeconds;
      return this;
    }

    public Builder setNumWorkers(int numWorkers) {
      Preconditions.checkArgument(numWorkers >= 0, "negative worker count %s", numWorkers);
      this.numWorkers = numWorkers;
      return this;
    }

    public Builder setRandomSeed(Integer randomSeed) {
      this.randomSeed = randomSeed;
      return this;
    }

    public Builder setStatistics(boolean statistics) {
      this.statistics = statistics;
      return this;
    }

    public Builder setLogSearch(boolean logSearch) {
      this.logSearch = logSearch;
      return this;
    }

    public Builder setSatParameters(SatParameters satParameters) {
      this.satParameters = Preconditions.checkNotNull(satParameters);
      return this;
    }

    public SolverOptions build() {
      return new SolverOptions(this);
    }

    private boolean allSolutions;
    private int solutionLimit;
    private boolean intermediateSolutions;
    private double timeLimitSeconds;
    private int numWorkers;
    private Integer randomSeed;
    private boolean statistics;
    private boolean logSearch;
    private SatParameters satParameters = SatParameters.getDefaultInstance();
  }

  private SolverOptions(Builder builder) {
    this.allSolutions = builder.allSolutions;
    this.solutionLimit = builder.solutionLimit;
    this.intermediateSolutions = builder.intermediateSolutions;
    this.timeLimitSeconds = builder.timeLimitSeconds;
    this.numWorkers = builder.numWorkers;
    this.randomSeed = builder.randomSeed;
    this.statistics = builder.statistics;
    this.logSearch = builder.logSearch;
    this.satParameters = builder.satParameters;
  }

  private final boolean allSolutions;
  private final int solutionLimit;
  private final boolean intermediateSolutions;
  private final double timeLimitSeconds;
  private final int numWorkers;
  private final Integer randomSeed;
  private final boolean statistics;
  private final boolean logSearch;
  private final SatParameters satParameters;
}
