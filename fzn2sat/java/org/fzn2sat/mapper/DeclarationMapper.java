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

import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.IntVar;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.fzn2sat.flatzinc.Expr;
import org.fzn2sat.flatzinc.Type;
import org.fzn2sat.flatzinc.VarDecl;

/**
 * Turns declarations into model variables or parameter table entries.
 *
 * <p>Integer domains that are missing or larger than the configured ceiling are replaced by the
 * inferred bounds with a diagnostic. Explicit integer sets are allocated as their interval hull.
 */
public final class DeclarationMapper {
  public DeclarationMapper(MappingContext context, ExpressionEvaluator evaluator) {
    this.context = context;
    this.evaluator = evaluator;
    this.model = context.getModel();
  }

  /** Maps one declaration. Declarations must be mapped in source order. */
  public void map(VarDecl decl) {
    Type type = decl.getType();
    if (type.getBase() == Type.Base.SET_OF_INT) {
      mapSet(decl);
    } else if (type.isArray()) {
      mapArray(decl);
    } else if (type.isVar()) {
      mapScalarVar(decl);
    } else {
      mapScalarParam(decl);
    }
  }

  private void mapSet(VarDecl decl) {
    if (decl.getType().isVar()) {
      throw new UnsupportedFeatureException("set variables ('" + decl.getName() + "')",
          decl.getLocation());
    }
    if (decl.getType().isArray()) {
      throw new UnsupportedFeatureException("arrays of sets ('" + decl.getName() + "')",
          decl.getLocation());
    }
    context.defineSetParam(decl.getName(), evaluator.extractSet(requireInit(decl)),
        decl.getLocation());
  }

  private void mapScalarParam(VarDecl decl) {
    Expr init = requireInit(decl);
    switch (decl.getType().getBase()) {
      case INT:
        context.defineIntParam(decl.getName(), evaluator.extractInt(init), decl.getLocation());
        break;
      case BOOL:
        context.defineBoolParam(decl.getName(), evaluator.extractBool(init), decl.getLocation());
        break;
      case FLOAT:
        context.defineFloatParam(decl.getName(), evaluator.extractFloat(init),
            decl.getLocation());
        break;
      default:
        throw new IllegalStateException("unexpected base type " + decl.getType().getBase());
    }
  }

  private void mapScalarVar(VarDecl decl) {
    VarKind kind = kindOf(decl.getType());
    IntVar var = allocate(decl, decl.getName());
    if (decl.getInit() != null) {
      // A defined variable gets its own handle, tied to its definition by an equality.
      IntVar value = resolve(decl.getInit(), kind);
      model.addEquality(var, value);
    }
    context.defineScalar(decl.getName(), kind, var, decl.getLocation());
  }

  private void mapArray(VarDecl decl) {
    Type type = decl.getType();
    if (type.getIndexSets().size() > 1) {
      throw new UnsupportedFeatureException(
          "multi-dimensional arrays ('" + decl.getName() + "')", decl.getLocation());
    }
    Type.IndexSet indexSet = type.getIndexSets().get(0);
    if (!type.isVar()) {
      mapParamArray(decl, indexSet);
      return;
    }
    VarKind kind = kindOf(type);
    List<IntVar> vars = new ArrayList<>();
    if (decl.getInit() == null) {
      if (!indexSet.isBounded()) {
        throw new UnsupportedFeatureException(
            "variable arrays over an unbounded index set ('" + decl.getName() + "')",
            decl.getLocation());
      }
      for (long i = 0; i < indexSet.size(); i++) {
        vars.add(allocate(decl, decl.getName() + "[" + (i + 1) + "]"));
      }
    } else {
      for (MappingContext.Scalar element : evaluator.resolveElements(decl.getInit(), kind)) {
        checkElementKind(decl, kind, element.getKind());
        vars.add(element.getVar());
      }
      checkLength(decl, indexSet, vars.size());
      restrictElements(decl, vars);
    }
    context.defineArray(decl.getName(), kind, vars, decl.getLocation());
  }

  private void mapParamArray(VarDecl decl, Type.IndexSet indexSet) {
    Expr init = requireInit(decl);
    switch (decl.getType().getBase()) {
      case INT:
        {
          long[] values = evaluator.extractIntArray(init);
          checkLength(decl, indexSet, values.length);
          context.defineIntParamArray(decl.getName(), values, decl.getLocation());
          break;
        }
      case BOOL:
        {
          boolean[] values = evaluator.extractBoolArray(init);
          checkLength(decl, indexSet, values.length);
          context.defineBoolParamArray(decl.getName(), values, decl.getLocation());
          break;
        }
      case FLOAT:
        {
          double[] values = evaluator.extractFloatArray(init);
          checkLength(decl, indexSet, values.length);
          context.defineFloatParamArray(decl.getName(), values, decl.getLocation());
          break;
        }
      default:
        throw new IllegalStateException("unexpected base type " + decl.getType().getBase());
    }
  }

  /** Allocates one variable for the element type of {@code decl}. */
  private IntVar allocate(VarDecl decl, String name) {
    Type type = decl.getType();
    Type.DomainSpec domain = type.getDomain();
    switch (type.getBase()) {
      case BOOL:
        return model.newBoolVar(name);
      case FLOAT:
        return allocateFloat(decl, domain, name);
      case INT:
        return allocateInt(decl, domain, name);
      default:
        throw new IllegalStateException("unexpected base type " + type.getBase());
    }
  }

  private IntVar allocateInt(VarDecl decl, Type.DomainSpec domain, String name) {
    if (domain == null) {
      return allocateInferred(decl, name, "unbounded");
    }
    if (!domain.isInt()) {
      throw new MapException.TypeMismatch("domain of '" + decl.getName() + "'", "int",
          "float range", decl.getLocation());
    }
    if (domain.isEmpty()) {
      throw MapException.emptyDomain(decl.getName(), decl.getLocation());
    }
    long lo = domain.getIntLo();
    long hi = domain.getIntHi();
    long size = BoundInference.domainSize(lo, hi);
    if (size > context.getOptions().getMaxDomainSize()) {
      return allocateInferred(decl, name, "domain " + domain + " has " + size + " values");
    }
    if (domain.getKind() == Type.DomainSpec.Kind.INT_SET
        && domain.getValues().size() != size && hullReported.add(decl.getName())) {
      context.diagnose(Diagnostic.Kind.DOMAIN_HULL,
          "'" + decl.getName() + "' uses the hull " + lo + ".." + hi + " of " + domain,
          decl.getLocation());
    }
    return model.newIntVar(lo, hi, name);
  }

  private IntVar allocateInferred(VarDecl decl, String name, String reason) {
    InferredBounds bounds = context.getBounds();
    // Arrays report once for all their elements.
    if (substitutionReported.add(decl.getName())) {
      context.diagnose(Diagnostic.Kind.DOMAIN_SUBSTITUTED,
          "'" + decl.getName() + "' is " + reason + "; using inferred bounds " + bounds,
          decl.getLocation());
    }
    return model.newIntVar(bounds.getLo(), bounds.getHi(), name);
  }

  private IntVar allocateFloat(VarDecl decl, Type.DomainSpec domain, String name) {
    FloatEncoding floats = context.getFloats();
    if (domain == null) {
      return model.newIntVar(floats.unboundedLo(), floats.unboundedHi(), name);
    }
    double lo = domain.isInt() ? domain.getIntLo() : domain.getFloatLo();
    double hi = domain.isInt() ? domain.getIntHi() : domain.getFloatHi();
    long encodedLo = floats.encodeLowerBound(lo);
    long encodedHi = floats.encodeUpperBound(hi);
    if (lo > hi || encodedLo > encodedHi) {
      throw MapException.emptyDomain(decl.getName(), decl.getLocation());
    }
    return model.newIntVar(encodedLo, encodedHi, name);
  }

  private IntVar resolve(Expr expr, VarKind kind) {
    switch (kind) {
      case FLOAT:
        return evaluator.resolveFloat(expr);
      default:
        return evaluator.resolveInt(expr);
    }
  }

  /** Posts the declared element domain on gathered variables that are wider than it. */
  private void restrictElements(VarDecl decl, List<IntVar> vars) {
    Type.DomainSpec domain = decl.getType().getDomain();
    if (domain == null || decl.getType().getBase() != Type.Base.INT || !domain.isInt()) {
      return;
    }
    if (domain.isEmpty()) {
      throw MapException.emptyDomain(decl.getName(), decl.getLocation());
    }
    for (IntVar var : vars) {
      if (MappingContext.lowerBound(var) < domain.getIntLo()
          || MappingContext.upperBound(var) > domain.getIntHi()) {
        model.addLinearConstraint(var, domain.getIntLo(), domain.getIntHi());
      }
    }
  }

  private static void checkElementKind(VarDecl decl, VarKind declared, VarKind actual) {
    boolean compatible = declared == actual
        || (declared == VarKind.INT && actual == VarKind.BOOL)
        || (declared == VarKind.BOOL && actual == VarKind.INT);
    if (!compatible) {
      throw new MapException.TypeMismatch("element of '" + decl.getName() + "'",
          declared.name().toLowerCase(), actual.name().toLowerCase(), decl.getLocation());
    }
  }

  private static void checkLength(VarDecl decl, Type.IndexSet indexSet, int length) {
    if (indexSet.isBounded() && indexSet.size() != length) {
      throw new MapException.MismatchedArrayLengths(decl.getName(), "the index set",
          (int) indexSet.size(), "the initializer", length, decl.getLocation());
    }
  }

  private static Expr requireInit(VarDecl decl) {
    if (decl.getInit() == null) {
      throw new MapException.InvalidDomain(decl.getName(), "parameter has no value",
          decl.getLocation());
    }
    return decl.getInit();
  }

  static VarKind kindOf(Type type) {
    switch (type.getBase()) {
      case BOOL:
        return VarKind.BOOL;
      case FLOAT:
        return VarKind.FLOAT;
      default:
        return VarKind.INT;
    }
  }

  private final MappingContext context;
  private final ExpressionEvaluator evaluator;
  private final CpModel model;
  private final Set<String> substitutionReported = new HashSet<>();
  private final Set<String> hullReported = new HashSet<>();
}
