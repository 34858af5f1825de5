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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.IntVar;
import java.util.HashMap;
import java.util.Map;
import org.fzn2sat.flatzinc.SolveItem;

/**
 * The result of translating a model: the populated {@link CpModel} plus the lookup bundle that
 * maps source names to variables and back.
 */
public final class Translation {
  Translation(CpModel model, MappingContext context, SolveItem.Goal goal,
      MappingContext.Scalar objective, OutputSpec output) {
    this.model = model;
    this.scalars = ImmutableMap.copyOf(context.getScalars());
    this.arrays = ImmutableMap.copyOf(context.getArrays());
    this.goal = goal;
    this.objective = objective;
    this.output = output;
    this.diagnostics = ImmutableList.copyOf(context.getDiagnostics());
    this.floats = context.getFloats();
    this.bounds = context.getBounds();
    Map<Integer, String> names = new HashMap<>();
    for (Map.Entry<String, MappingContext.Scalar> entry : scalars.entrySet()) {
      names.putIfAbsent(entry.getValue().getVar().getIndex(), entry.getKey());
    }
    this.namesByIndex = ImmutableMap.copyOf(names);
  }

  public CpModel getModel() {
    return model;
  }

  public SolveItem.Goal getGoal() {
    return goal;
  }

  /** Returns the objective variable, or null for satisfaction problems. */
  public MappingContext.Scalar getObjective() {
    return objective;
  }

  public OutputSpec getOutput() {
    return output;
  }

  /** Returns the variable declared as {@code name}, or null. */
  public MappingContext.Scalar getVariable(String name) {
    return scalars.get(name);
  }

  /** Returns the variable array declared as {@code name}, or null. */
  public MappingContext.Array getArray(String name) {
    return arrays.get(name);
  }

  public ImmutableMap<String, MappingContext.Scalar> getVariables() {
    return scalars;
  }

  public ImmutableMap<String, MappingContext.Array> getArrays() {
    return arrays;
  }

  /** Returns the source name of {@code var}, or null for auxiliary and constant variables. */
  public String nameOf(IntVar var) {
    return namesByIndex.get(var.getIndex());
  }

  public ImmutableList<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  public FloatEncoding getFloats() {
    return floats;
  }

  public InferredBounds getBounds() {
    return bounds;
  }

  /** Converts a solver value of a variable of {@code kind} back to its source value. */
  public Object decode(VarKind kind, long value) {
    switch (kind) {
      case BOOL:
        return value != 0;
      case FLOAT:
        return floats.decode(value);
      default:
        return value;
    }
  }

  private final CpModel model;
  private final ImmutableMap<String, MappingContext.Scalar> scalars;
  private final ImmutableMap<String, MappingContext.Array> arrays;
  private final ImmutableMap<Integer, String> namesByIndex;
  private final SolveItem.Goal goal;
  private final MappingContext.Scalar objective;
  private final OutputSpec output;
  private final ImmutableList<Diagnostic> diagnostics;
  private final FloatEncoding floats;
  private final InferredBounds bounds;
}
