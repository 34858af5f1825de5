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
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.Literal;
import com.google.ortools.util.Domain;
import java.util.ArrayList;
import java.util.List;
import org.fzn2sat.flatzinc.Expr;

/**
 * Resolves expressions to model variables, arrays of variables, or compile-time constants.
 *
 * <p>Identifiers are looked up in the {@link MappingContext}. Literals and parameters become fixed
 * variables. Array accesses are 1-based in the source and bounds-checked before conversion to the
 * 0-based position in the resolved array.
 */
public final class ExpressionEvaluator {
  public ExpressionEvaluator(MappingContext context) {
    this.context = context;
    this.model = context.getModel();
  }

  // Scalars.

  /** Resolves an integer (or 0/1 boolean) expression. */
  public IntVar resolveInt(Expr expr) {
    MappingContext.Scalar scalar = resolve(expr, VarKind.INT);
    if (scalar.getKind() == VarKind.FLOAT) {
      throw MapException.typeMismatch(expr, "int", scalar.getKind());
    }
    return scalar.getVar();
  }

  /** Resolves a boolean expression to a literal. */
  public Literal resolveBool(Expr expr) {
    MappingContext.Scalar scalar = resolve(expr, VarKind.BOOL);
    if (scalar.getKind() == VarKind.FLOAT) {
      throw MapException.typeMismatch(expr, "bool", scalar.getKind());
    }
    return context.asLiteral(scalar.getVar());
  }

  /** Resolves a float expression to its fixed-point encoded variable. */
  public IntVar resolveFloat(Expr expr) {
    MappingContext.Scalar scalar = resolve(expr, VarKind.FLOAT);
    if (scalar.getKind() != VarKind.FLOAT) {
      throw MapException.typeMismatch(expr, "float", scalar.getKind());
    }
    return scalar.getVar();
  }

  /**
   * Resolves a scalar expression of any kind. Literals take the kind they are written in; an
   * integer literal is an int.
   */
  public MappingContext.Scalar resolveScalar(Expr expr) {
    return resolve(expr, expr.getKind() == Expr.Kind.FLOAT_LIT ? VarKind.FLOAT : VarKind.INT);
  }

  private MappingContext.Scalar resolve(Expr expr, VarKind wanted) {
    switch (expr.getKind()) {
      case INT_LIT:
        return constant(((Expr.IntLit) expr).getValue(), wanted);
      case BOOL_LIT:
        return new MappingContext.Scalar(
            context.boolConstant(((Expr.BoolLit) expr).getValue()), VarKind.BOOL);
      case FLOAT_LIT:
        if (wanted != VarKind.FLOAT) {
          throw MapException.typeMismatch(expr, wanted.name().toLowerCase(), VarKind.FLOAT);
        }
        return floatConstant(((Expr.FloatLit) expr).getValue());
      case IDENT:
        return resolveIdent((Expr.Ident) expr, wanted);
      case ARRAY_ACCESS:
        return resolveAccess((Expr.ArrayAccess) expr, wanted);
      default:
        throw MapException.unsupportedExpression(expr, "a scalar expression");
    }
  }

  private MappingContext.Scalar resolveIdent(Expr.Ident ident, VarKind wanted) {
    String name = ident.getName();
    MappingContext.Scalar scalar = context.getScalar(name);
    if (scalar != null) {
      return scalar;
    }
    Long intValue = context.getIntParam(name);
    if (intValue != null) {
      return constant(intValue, wanted);
    }
    Boolean boolValue = context.getBoolParam(name);
    if (boolValue != null) {
      return new MappingContext.Scalar(context.boolConstant(boolValue), VarKind.BOOL);
    }
    Double floatValue = context.getFloatParam(name);
    if (floatValue != null) {
      return floatConstant(floatValue);
    }
    if (context.isDeclared(name)) {
      throw MapException.unsupportedExpression(ident,
          "a scalar, found array or set '" + name + "'");
    }
    throw MapException.unknownSymbol(name, ident.getLocation());
  }

  private MappingContext.Scalar resolveAccess(Expr.ArrayAccess access, VarKind wanted) {
    String name = access.getArray();
    long index = extractIndex(access);
    long[] ints = context.getIntParamArray(name);
    if (ints != null) {
      return constant(ints[toPosition(access, index, ints.length)], wanted);
    }
    boolean[] bools = context.getBoolParamArray(name);
    if (bools != null) {
      return new MappingContext.Scalar(
          context.boolConstant(bools[toPosition(access, index, bools.length)]), VarKind.BOOL);
    }
    double[] floats = context.getFloatParamArray(name);
    if (floats != null) {
      return floatConstant(floats[toPosition(access, index, floats.length)]);
    }
    MappingContext.Array array = context.getArray(name);
    if (array != null) {
      IntVar var = array.getVars().get(toPosition(access, index, array.getVars().size()));
      return new MappingContext.Scalar(var, array.getKind());
    }
    throw MapException.unknownSymbol(name, access.getLocation());
  }

  private long extractIndex(Expr.ArrayAccess access) {
    Expr index = access.getIndex();
    if (index.getKind() == Expr.Kind.INT_LIT) {
      return ((Expr.IntLit) index).getValue();
    }
    if (index.getKind() == Expr.Kind.IDENT) {
      Long value = context.getIntParam(((Expr.Ident) index).getName());
      if (value != null) {
        return value;
      }
    }
    throw new MapException.NonLiteralIndex(access.getArray(), index, access.getLocation());
  }

  /** Converts a 1-based source index into a 0-based position, checking it against {@code size}. */
  static int toPosition(Expr.ArrayAccess access, long index, int size) {
    if (index < 1 || index > size) {
      throw new MapException.IndexOutOfRange(access.getArray(), index, size,
          access.getLocation());
    }
    return (int) (index - 1);
  }

  private MappingContext.Scalar constant(long value, VarKind wanted) {
    if (wanted == VarKind.FLOAT) {
      return floatConstant(value);
    }
    return new MappingContext.Scalar(model.newConstant(value), VarKind.INT);
  }

  private MappingContext.Scalar floatConstant(double value) {
    return new MappingContext.Scalar(
        model.newConstant(context.getFloats().encode(value)), VarKind.FLOAT);
  }

  // Arrays.

  /** Resolves an integer array; boolean elements become 0/1 variables. */
  public List<IntVar> resolveIntArray(Expr expr) {
    List<IntVar> vars = new ArrayList<>();
    for (MappingContext.Scalar scalar : resolveElements(expr, VarKind.INT)) {
      if (scalar.getKind() == VarKind.FLOAT) {
        throw MapException.typeMismatch(expr, "array of int", VarKind.FLOAT);
      }
      vars.add(scalar.getVar());
    }
    return vars;
  }

  public List<Literal> resolveBoolArray(Expr expr) {
    List<Literal> literals = new ArrayList<>();
    for (MappingContext.Scalar scalar : resolveElements(expr, VarKind.BOOL)) {
      if (scalar.getKind() == VarKind.FLOAT) {
        throw MapException.typeMismatch(expr, "array of bool", VarKind.FLOAT);
      }
      literals.add(context.asLiteral(scalar.getVar()));
    }
    return literals;
  }

  /** Resolves a float array to encoded variables. Integer literals are encoded too. */
  public List<IntVar> resolveFloatArray(Expr expr) {
    List<IntVar> vars = new ArrayList<>();
    for (MappingContext.Scalar scalar : resolveElements(expr, VarKind.FLOAT)) {
      if (scalar.getKind() != VarKind.FLOAT) {
        throw MapException.typeMismatch(expr, "array of float", scalar.getKind());
      }
      vars.add(scalar.getVar());
    }
    return vars;
  }

  /**
   * Resolves an array expression element by element, keeping source order. Parameter arrays are
   * consulted first, then variable arrays; a lone scalar becomes a one-element array.
   */
  public List<MappingContext.Scalar> resolveElements(Expr expr, VarKind wanted) {
    List<MappingContext.Scalar> result = new ArrayList<>();
    if (expr.getKind() == Expr.Kind.IDENT) {
      String name = ((Expr.Ident) expr).getName();
      long[] ints = context.getIntParamArray(name);
      if (ints != null) {
        for (long value : ints) {
          result.add(constant(value, wanted));
        }
        return result;
      }
      boolean[] bools = context.getBoolParamArray(name);
      if (bools != null) {
        for (boolean value : bools) {
          result.add(new MappingContext.Scalar(context.boolConstant(value), VarKind.BOOL));
        }
        return result;
      }
      double[] floats = context.getFloatParamArray(name);
      if (floats != null) {
        for (double value : floats) {
          result.add(floatConstant(value));
        }
        return result;
      }
      MappingContext.Array array = context.getArray(name);
      if (array != null) {
        for (IntVar var : array.getVars()) {
          result.add(new MappingContext.Scalar(var, array.getKind()));
        }
        return result;
      }
      result.add(resolve(expr, wanted));
      return result;
    }
    if (expr.getKind() != Expr.Kind.ARRAY_LIT) {
      throw MapException.unsupportedExpression(expr, "an array");
    }
    for (Expr element : ((Expr.ArrayLit) expr).getElements()) {
      switch (element.getKind()) {
        case RANGE:
          {
            Expr.Range range = (Expr.Range) element;
            for (long v = range.getLo(); v <= range.getHi(); v++) {
              result.add(constant(v, wanted));
            }
            break;
          }
        case SET_LIT:
          throw new UnsupportedFeatureException("set-valued array elements",
              element.getLocation());
        case IDENT:
        case INT_LIT:
        case BOOL_LIT:
        case FLOAT_LIT:
        case ARRAY_ACCESS:
          result.add(resolve(element, wanted));
          break;
        default:
          throw MapException.unsupportedExpression(element, "an array element");
      }
    }
    return result;
  }

  // Compile-time constants.

  public long extractInt(Expr expr) {
    switch (expr.getKind()) {
      case INT_LIT:
        return ((Expr.IntLit) expr).getValue();
      case IDENT:
        {
          Long value = context.getIntParam(((Expr.Ident) expr).getName());
          if (value != null) {
            return value;
          }
          break;
        }
      case ARRAY_ACCESS:
        {
          Expr.ArrayAccess access = (Expr.ArrayAccess) expr;
          long[] values = context.getIntParamArray(access.getArray());
          if (values != null) {
            return values[toPosition(access, extractIndex(access), values.length)];
          }
          break;
        }
      default:
        break;
    }
    throw MapException.unsupportedExpression(expr, "a constant integer");
  }

  public boolean extractBool(Expr expr) {
    switch (expr.getKind()) {
      case BOOL_LIT:
        return ((Expr.BoolLit) expr).getValue();
      case IDENT:
        {
          Boolean value = context.getBoolParam(((Expr.Ident) expr).getName());
          if (value != null) {
            return value;
          }
          break;
        }
      case ARRAY_ACCESS:
        {
          Expr.ArrayAccess access = (Expr.ArrayAccess) expr;
          boolean[] values = context.getBoolParamArray(access.getArray());
          if (values != null) {
            return values[toPosition(access, extractIndex(access), values.length)];
          }
          break;
        }
      default:
        break;
    }
    throw MapException.unsupportedExpression(expr, "a constant boolean");
  }

  /** Extracts a float constant. Integer constants are accepted. */
  public double extractFloat(Expr expr) {
    switch (expr.getKind()) {
      case FLOAT_LIT:
        return ((Expr.FloatLit) expr).getValue();
      case IDENT:
        {
          Double value = context.getFloatParam(((Expr.Ident) expr).getName());
          if (value != null) {
            return value;
          }
          break;
        }
      case ARRAY_ACCESS:
        {
          Expr.ArrayAccess access = (Expr.ArrayAccess) expr;
          double[] values = context.getFloatParamArray(access.getArray());
          if (values != null) {
            return values[toPosition(access, extractIndex(access), values.length)];
          }
          break;
        }
      default:
        break;
    }
    return extractInt(expr);
  }

  public long[] extractIntArray(Expr expr) {
    if (expr.getKind() == Expr.Kind.IDENT) {
      long[] values = context.getIntParamArray(((Expr.Ident) expr).getName());
      if (values != null) {
        return values.clone();
      }
      throw MapException.unsupportedExpression(expr, "a constant integer array");
    }
    if (expr.getKind() != Expr.Kind.ARRAY_LIT) {
      throw MapException.unsupportedExpression(expr, "a constant integer array");
    }
    List<Long> values = new ArrayList<>();
    for (Expr element : ((Expr.ArrayLit) expr).getElements()) {
      if (element.getKind() == Expr.Kind.RANGE) {
        Expr.Range range = (Expr.Range) element;
        for (long v = range.getLo(); v <= range.getHi(); v++) {
          values.add(v);
        }
      } else {
        values.add(extractInt(element));
      }
    }
    long[] result = new long[values.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = values.get(i);
    }
    return result;
  }

  public boolean[] extractBoolArray(Expr expr) {
    if (expr.getKind() == Expr.Kind.IDENT) {
      boolean[] values = context.getBoolParamArray(((Expr.Ident) expr).getName());
      if (values != null) {
        return values.clone();
      }
    } else if (expr.getKind() == Expr.Kind.ARRAY_LIT) {
      ImmutableList<Expr> elements = ((Expr.ArrayLit) expr).getElements();
      boolean[] result = new boolean[elements.size()];
      for (int i = 0; i < result.length; i++) {
        result[i] = extractBool(elements.get(i));
      }
      return result;
    }
    throw MapException.unsupportedExpression(expr, "a constant boolean array");
  }

  public double[] extractFloatArray(Expr expr) {
    if (expr.getKind() == Expr.Kind.IDENT) {
      String name = ((Expr.Ident) expr).getName();
      double[] values = context.getFloatParamArray(name);
      if (values != null) {
        return values.clone();
      }
      long[] ints = context.getIntParamArray(name);
      if (ints != null) {
        double[] result = new double[ints.length];
        for (int i = 0; i < ints.length; i++) {
          result[i] = ints[i];
        }
        return result;
      }
    } else if (expr.getKind() == Expr.Kind.ARRAY_LIT) {
      ImmutableList<Expr> elements = ((Expr.ArrayLit) expr).getElements();
      double[] result = new double[elements.size()];
      for (int i = 0; i < result.length; i++) {
        result[i] = extractFloat(elements.get(i));
      }
      return result;
    }
    throw MapException.unsupportedExpression(expr, "a constant float array");
  }

  /**
   * Extracts a constant integer set from a range, a set literal or a set parameter. Ranges stay
   * intervals; values are never enumerated.
   */
  public Domain extractSet(Expr expr) {
    switch (expr.getKind()) {
      case RANGE:
        {
          Expr.Range range = (Expr.Range) expr;
          return range.getLo() > range.getHi()
              ? Domain.fromValues(new long[0])
              : new Domain(range.getLo(), range.getHi());
        }
      case SET_LIT:
        {
          Domain values = Domain.fromValues(new long[0]);
          for (Expr element : ((Expr.SetLit) expr).getElements()) {
            if (element.getKind() == Expr.Kind.RANGE) {
              values = values.unionWith(extractSet(element));
            } else {
              values = values.unionWith(Domain.fromValues(new long[] {extractInt(element)}));
            }
          }
          return values;
        }
      case IDENT:
        {
          Domain value = context.getSetParam(((Expr.Ident) expr).getName());
          if (value != null) {
            return value;
          }
          break;
        }
      default:
        break;
    }
    throw MapException.unsupportedExpression(expr, "a constant set of int");
  }

  /** True when {@link #extractInt} succeeds on {@code expr}. */
  public boolean isConstantInt(Expr expr) {
    switch (expr.getKind()) {
      case INT_LIT:
        return true;
      case IDENT:
        return context.getIntParam(((Expr.Ident) expr).getName()) != null;
      case ARRAY_ACCESS:
        return context.getIntParamArray(((Expr.ArrayAccess) expr).getArray()) != null;
      default:
        return false;
    }
  }

  /** True when {@link #extractIntArray} succeeds on {@code expr}. */
  public boolean isConstantIntArray(Expr expr) {
    if (expr.getKind() == Expr.Kind.IDENT) {
      return context.getIntParamArray(((Expr.Ident) expr).getName()) != null;
    }
    if (expr.getKind() != Expr.Kind.ARRAY_LIT) {
      return false;
    }
    for (Expr element : ((Expr.ArrayLit) expr).getElements()) {
      if (element.getKind() != Expr.Kind.RANGE && !isConstantInt(element)) {
        return false;
      }
    }
    return true;
  }

  /** Returns the number of elements {@code expr} resolves to, without allocating anything. */
  public int arrayLength(Expr expr) {
    if (expr.getKind() == Expr.Kind.ARRAY_LIT) {
      int length = 0;
      for (Expr element : ((Expr.ArrayLit) expr).getElements()) {
        if (element.getKind() == Expr.Kind.RANGE) {
          Expr.Range range = (Expr.Range) element;
          length += (int) Math.max(0, range.getHi() - range.getLo() + 1);
        } else {
          length++;
        }
      }
      return length;
    }
    if (expr.getKind() == Expr.Kind.IDENT) {
      String name = ((Expr.Ident) expr).getName();
      if (context.getIntParamArray(name) != null) {
        return context.getIntParamArray(name).length;
      }
      if (context.getBoolParamArray(name) != null) {
        return context.getBoolParamArray(name).length;
      }
      if (context.getFloatParamArray(name) != null) {
        return context.getFloatParamArray(name).length;
      }
      if (context.getArray(name) != null) {
        return context.getArray(name).getVars().size();
      }
      if (context.getScalar(name) != null) {
        return 1;
      }
      throw MapException.unknownSymbol(name, expr.getLocation());
    }
    throw MapException.unsupportedExpression(expr, "an array");
  }

  public MappingContext getContext() {
    return context;
  }

  public CpModel getModel() {
    return model;
  }

  private final MappingContext context;
  private final CpModel model;
}
