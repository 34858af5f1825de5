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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import org.fzn2sat.mapper.OutputSpec;
import org.fzn2sat.mapper.VarKind;

/** The values of the output variables in one solution, in output order. */
public final class Solution {
  /** The value of one output scalar or array, as raw solver integers. */
  public static final class Value {
    Value(OutputSpec.Entry entry, long[] raw) {
      this.entry = entry;
      this.raw = raw;
    }

    public String getName() {
      return entry.getName();
    }

    public VarKind getKind() {
      return entry.getKind();
    }

    public boolean isArray() {
      return entry.isArray();
    }

    public ImmutableList<long[]> getDimensions() {
      return entry.getDimensions();
    }

    public int size() {
      return raw.length;
    }

    /** The solver value of element {@code i}; floats are still encoded. */
    public long getRaw(int i) {
      return raw[i];
    }

    private final OutputSpec.Entry entry;
    private final long[] raw;
  }

  Solution(ImmutableList<Value> values, int floatPrecision, Double objective) {
    this.values = values;
    this.floatPrecision = floatPrecision;
    this.objective = objective;
    ImmutableMap.Builder<String, Value> byName = ImmutableMap.builder();
    for (Value value : values) {
      byName.put(value.getName(), value);
    }
    this.byName = byName.build();
  }

  public ImmutableList<Value> getValues() {
    return values;
  }

  /** Returns the value named {@code name}, or null when it is not an output. */
  public Value get(String name) {
    return byName.get(name);
  }

  /** Objective value of this solution, or null for satisfaction problems. */
  public Double getObjective() {
    return objective;
  }

  public long getInt(String name) {
    return require(name).getRaw(0);
  }

  public boolean getBool(String name) {
    return require(name).getRaw(0) != 0;
  }

  public double getFloat(String name) {
    return decode(require(name).getRaw(0)).doubleValue();
  }

  public long[] getIntArray(String name) {
    Value value = require(name);
    long[] result = new long[value.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = value.getRaw(i);
    }
    return result;
  }

  /** Returns the exact decimal value of an encoded float. */
  public BigDecimal decode(long encoded) {
    return BigDecimal.valueOf(encoded, floatPrecision);
  }

  /** Formats element {@code i} of {@code value} as a FlatZinc literal. */
  public String format(Value value, int i) {
    long raw = value.getRaw(i);
    switch (value.getKind()) {
      case BOOL:
        return raw != 0 ? "true" : "false";
      case FLOAT:
        {
          String text = decode(raw).stripTrailingZeros().toPlainString();
          return text.indexOf('.') < 0 ? text + ".0" : text;
        }
      default:
        return Long.toString(raw);
    }
  }

  private Value require(String name) {
    Value value = byName.get(name);
    if (value == null) {
      throw new IllegalArgumentException("'" + name + "' is not an output variable");
    }
    return value;
  }

  private final ImmutableList<Value> values;
  private final ImmutableMap<String, Value> byName;
  private final int floatPrecision;
  private final Double objective;
}
