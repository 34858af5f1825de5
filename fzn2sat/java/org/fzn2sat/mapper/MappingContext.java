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
import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.Literal;
import com.google.ortools.util.Domain;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.fzn2sat.flatzinc.Location;

/**
 * Symbol tables and shared state for one translation. Owns the model under construction, the
 * inferred bounds, the float encoding and the diagnostics.
 *
 * <p>Every name lives in exactly one table: scalar variables, variable arrays, parameter arrays or
 * scalar parameters. Tables only grow, in declaration order.
 */
public final class MappingContext {
  /** A declared scalar variable. */
  public static final class Scalar {
    Scalar(IntVar var, VarKind kind) {
      this.var = var;
      this.kind = kind;
    }

    public IntVar getVar() {
      return var;
    }

    public VarKind getKind() {
      return kind;
    }

    private final IntVar var;
    private final VarKind kind;
  }

  /** A declared array of variables. */
  public static final class Array {
    Array(ImmutableList<IntVar> vars, VarKind kind) {
      this.vars = vars;
      this.kind = kind;
    }

    public ImmutableList<IntVar> getVars() {
      return vars;
    }

    public VarKind getKind() {
      return kind;
    }

    private final ImmutableList<IntVar> vars;
    private final VarKind kind;
  }

  public MappingContext(CpModel model, TranslatorOptions options, InferredBounds bounds) {
    this.model = model;
    this.options = options;
    this.bounds = bounds;
    this.floats = new FloatEncoding(options.getFloatPrecision(), options.getFloatBound());
  }

  public CpModel getModel() {
    return model;
  }

  public TranslatorOptions getOptions() {
    return options;
  }

  public InferredBounds getBounds() {
    return bounds;
  }

  public FloatEncoding getFloats() {
    return floats;
  }

  // Definitions.

  public void defineScalar(String name, VarKind kind, IntVar var, Location location) {
    claim(name, location);
    scalars.put(name, new Scalar(var, kind));
  }

  public void defineArray(String name, VarKind kind, List<IntVar> vars, Location location) {
    claim(name, location);
    arrays.put(name, new Array(ImmutableList.copyOf(vars), kind));
  }

  public void defineIntParamArray(String name, long[] values, Location location) {
    claim(name, location);
    intParamArrays.put(name, values.clone());
  }

  public void defineBoolParamArray(String name, boolean[] values, Location location) {
    claim(name, location);
    boolParamArrays.put(name, values.clone());
  }

  public void defineFloatParamArray(String name, double[] values, Location location) {
    claim(name, location);
    floatParamArrays.put(name, values.clone());
  }

  public void defineIntParam(String name, long value, Location location) {
    claim(name, location);
    intParams.put(name, value);
  }

  public void defineBoolParam(String name, boolean value, Location location) {
    claim(name, location);
    boolParams.put(name, value);
  }

  public void defineFloatParam(String name, double value, Location location) {
    claim(name, location);
    floatParams.put(name, value);
  }

  public void defineSetParam(String name, Domain value, Location location) {
    claim(name, location);
    setParams.put(name, value);
  }

  private void claim(String name, Location location) {
    if (!names.add(name)) {
      throw new MapException.DuplicateSymbol(name, location);
    }
  }

  // Lookups. Each returns null when the name is not in that table.

  public boolean isDeclared(String name) {
    return names.contains(name);
  }

  public Scalar getScalar(String name) {
    return scalars.get(name);
  }

  public Array getArray(String name) {
    return arrays.get(name);
  }

  public long[] getIntParamArray(String name) {
    return intParamArrays.get(name);
  }

  public boolean[] getBoolParamArray(String name) {
    return boolParamArrays.get(name);
  }

  public double[] getFloatParamArray(String name) {
    return floatParamArrays.get(name);
  }

  public Long getIntParam(String name) {
    return intParams.get(name);
  }

  public Boolean getBoolParam(String name) {
    return boolParams.get(name);
  }

  public Double getFloatParam(String name) {
    return floatParams.get(name);
  }

  public Domain getSetParam(String name) {
    return setParams.get(name);
  }

  /** Scalar variables in declaration order. */
  public Map<String, Scalar> getScalars() {
    return Collections.unmodifiableMap(scalars);
  }

  /** Variable arrays in declaration order. */
  public Map<String, Array> getArrays() {
    return Collections.unmodifiableMap(arrays);
  }

  // Model helpers.

  /**
   * Returns {@code var} as a literal. Boolean variables are returned unchanged, 0/1 integer
   * variables are reinterpreted, and any other variable is channeled to a fresh boolean.
   */
  public Literal asLiteral(IntVar var) {
    if (var instanceof BoolVar) {
      return (BoolVar) var;
    }
    Literal cached = literals.get(var.getIndex());
    if (cached != null) {
      return cached;
    }
    long lo = lowerBound(var);
    long hi = upperBound(var);
    Literal literal;
    if (lo >= 0 && hi <= 1) {
      literal = model.getBoolVarFromProtoIndex(var.getIndex());
    } else {
      BoolVar b = model.newBoolVar("");
      model.addEquality(var, b);
      literal = b;
    }
    literals.put(var.getIndex(), literal);
    return literal;
  }

  /** Returns a fixed 0/1 integer variable for a boolean constant. */
  public IntVar boolConstant(boolean value) {
    return model.newConstant(value ? 1 : 0);
  }

  public static long lowerBound(IntVar var) {
    return var.getDomain().min();
  }

  public static long upperBound(IntVar var) {
    return var.getDomain().max();
  }

  /** Returns the constant value of {@code var}, or null when its domain has several values. */
  public static Long fixedValue(IntVar var) {
    long lo = lowerBound(var);
    return lo == upperBound(var) ? Long.valueOf(lo) : null;
  }

  // Diagnostics.

  /** Records a non-fatal diagnostic and logs it as a warning. */
  public void diagnose(Diagnostic.Kind kind, String message, Location location) {
    Diagnostic diagnostic = new Diagnostic(kind, message, location);
    diagnostics.add(diagnostic);
    logger.warning(diagnostic.toString());
  }

  public List<Diagnostic> getDiagnostics() {
    return Collections.unmodifiableList(diagnostics);
  }

  private static final Logger logger = Logger.getLogger(MappingContext.class.getName());

  private final CpModel model;
  private final TranslatorOptions options;
  private final InferredBounds bounds;
  private final FloatEncoding floats;

  private final Set<String> names = new HashSet<>();
  private final Map<String, Scalar> scalars = new LinkedHashMap<>();
  private final Map<String, Array> arrays = new LinkedHashMap<>();
  private final Map<String, long[]> intParamArrays = new HashMap<>();
  private final Map<String, boolean[]> boolParamArrays = new HashMap<>();
  private final Map<String, double[]> floatParamArrays = new HashMap<>();
  private final Map<String, Long> intParams = new HashMap<>();
  private final Map<String, Boolean> boolParams = new HashMap<>();
  private final Map<String, Double> floatParams = new HashMap<>();
  private final Map<String, Domain> setParams = new HashMap<>();
  private final Map<Integer, Literal> literals = new HashMap<>();
  private final List<Diagnostic> diagnostics = new ArrayList<>();
}
