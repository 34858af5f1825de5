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

package org.fzn2sat.flatzinc;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A FlatZinc expression: an identifier, a literal, an array or set literal, an integer range, a
 * 1-based array access, or an annotation call.
 */
public abstract class Expr {
  /** Expression kinds, one per concrete subclass. */
  public enum Kind {
    IDENT,
    BOOL_LIT,
    INT_LIT,
    FLOAT_LIT,
    STRING_LIT,
    RANGE,
    SET_LIT,
    ARRAY_LIT,
    ARRAY_ACCESS,
    CALL
  }

  Expr(Location location) {
    this.location = location;
  }

  public abstract Kind getKind();

  /** Returns the source position, or null for synthesized expressions. */
  public Location getLocation() {
    return location;
  }

  /** True for scalar bool, int, float and string literals. */
  public boolean isScalarLiteral() {
    switch (getKind()) {
      case BOOL_LIT:
      case INT_LIT:
      case FLOAT_LIT:
      case STRING_LIT:
        return true;
      default:
        return false;
    }
  }

  private final Location location;

  /** A reference to a declared variable, parameter or array. */
  public static final class Ident extends Expr {
    public Ident(String name, Location location) {
      super(location);
      this.name = name;
    }

    @Override
    public Kind getKind() {
      return Kind.IDENT;
    }

    public String getName() {
      return name;
    }

    @Override
    public String toString() {
      return name;
    }

    private final String name;
  }

  /** {@code true} or {@code false}. */
  public static final class BoolLit extends Expr {
    public BoolLit(boolean value, Location location) {
      super(location);
      this.value = value;
    }

    @Override
    public Kind getKind() {
      return Kind.BOOL_LIT;
    }

    public boolean getValue() {
      return value;
    }

    @Override
    public String toString() {
      return Boolean.toString(value);
    }

    private final boolean value;
  }

  /** An integer literal. */
  public static final class IntLit extends Expr {
    public IntLit(long value, Location location) {
      super(location);
      this.value = value;
    }

    @Override
    public Kind getKind() {
      return Kind.INT_LIT;
    }

    public long getValue() {
      return value;
    }

    @Override
    public String toString() {
      return Long.toString(value);
    }

    private final long value;
  }

  /** A float literal. */
  public static final class FloatLit extends Expr {
    public FloatLit(double value, Location location) {
      super(location);
      this.value = value;
    }

    @Override
    public Kind getKind() {
      return Kind.FLOAT_LIT;
    }

    public double getValue() {
      return value;
    }

    @Override
    public String toString() {
      return Double.toString(value);
    }

    private final double value;
  }

  /** A string literal, only meaningful inside annotations. */
  public static final class StringLit extends Expr {
    public StringLit(String value, Location location) {
      super(location);
      this.value = value;
    }

    @Override
    public Kind getKind() {
      return Kind.STRING_LIT;
    }

    public String getValue() {
      return value;
    }

    @Override
    public String toString() {
      return "\"" + value + "\"";
    }

    private final String value;
  }

  /** An integer range {@code lo..hi}, used both as a set literal and inside array literals. */
  public static final class Range extends Expr {
    public Range(long lo, long hi, Location location) {
      super(location);
      this.lo = lo;
      this.hi = hi;
    }

    @Override
    public Kind getKind() {
      return Kind.RANGE;
    }

    public long getLo() {
      return lo;
    }

    public long getHi() {
      return hi;
    }

    @Override
    public String toString() {
      return lo + ".." + hi;
    }

    private final long lo;
    private final long hi;
  }

  /** An explicit set literal {@code {e1, ..., en}}. */
  public static final class SetLit extends Expr {
    public SetLit(List<Expr> elements, Location location) {
      super(location);
      this.elements = ImmutableList.copyOf(elements);
    }

    @Override
    public Kind getKind() {
      return Kind.SET_LIT;
    }

    public ImmutableList<Expr> getElements() {
      return elements;
    }

    @Override
    public String toString() {
      return "{" + Joiner.on(", ").join(elements) + "}";
    }

    private final ImmutableList<Expr> elements;
  }

  /** An array literal {@code [e1, ..., en]}. */
  public static final class ArrayLit extends Expr {
    public ArrayLit(List<Expr> elements, Location location) {
      super(location);
      this.elements = ImmutableList.copyOf(elements);
    }

    @Override
    public Kind getKind() {
      return Kind.ARRAY_LIT;
    }

    public ImmutableList<Expr> getElements() {
      return elements;
    }

    @Override
    public String toString() {
      return "[" + Joiner.on(", ").join(elements) + "]";
    }

    private final ImmutableList<Expr> elements;
  }

  /** A single-index access {@code array[index]}; the index is 1-based. */
  public static final class ArrayAccess extends Expr {
    public ArrayAccess(String array, Expr index, Location location) {
      super(location);
      this.array = array;
      this.index = index;
    }

    @Override
    public Kind getKind() {
      return Kind.ARRAY_ACCESS;
    }

    public String getArray() {
      return array;
    }

    public Expr getIndex() {
      return index;
    }

    @Override
    public String toString() {
      return array + "[" + index + "]";
    }

    private final String array;
    private final Expr index;
  }

  /** A call {@code name(args)}; only appears inside annotations, e.g. {@code int_search(...)}. */
  public static final class Call extends Expr {
    public Call(String name, List<Expr> args, Location location) {
      super(location);
      this.name = name;
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public Kind getKind() {
      return Kind.CALL;
    }

    public String getName() {
      return name;
    }

    public ImmutableList<Expr> getArgs() {
      return args;
    }

    @Override
    public String toString() {
      return name + "(" + Joiner.on(", ").join(args) + ")";
    }

    private final String name;
    private final ImmutableList<Expr> args;
  }
}
