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

import java.util.Arrays;
import org.fzn2sat.flatzinc.Expr;
import org.fzn2sat.flatzinc.FlatZincException;
import org.fzn2sat.flatzinc.Location;

/**
 * A semantic error found while translating one model. Each failure kind is a nested subclass that
 * exposes the offending names and numbers as fields.
 */
public class MapException extends FlatZincException {
  public MapException(String message, Location location) {
    super(message, location);
  }

  public MapException(String message, Location location, Throwable cause) {
    super(message, location, cause);
  }

  /** An identifier that is declared nowhere. */
  public static class UnknownSymbol extends MapException {
    public UnknownSymbol(String name, Location location) {
      super("unknown identifier '" + name + "'", location);
      this.name = name;
    }

    public String getName() {
      return name;
    }

    private final String name;
  }

  /** A 1-based index outside {@code 1..size}. */
  public static class IndexOutOfRange extends MapException {
    public IndexOutOfRange(String array, long index, int size, Location location) {
      super("index " + index + " out of range 1.." + size + " for array '" + array + "'",
          location);
      this.array = array;
      this.index = index;
      this.size = size;
    }

    public String getArray() {
      return array;
    }

    public long getIndex() {
      return index;
    }

    public int getSize() {
      return size;
    }

    private final String array;
    private final long index;
    private final int size;
  }

  /** An array access whose index is not a compile-time integer. */
  public static class NonLiteralIndex extends MapException {
    public NonLiteralIndex(String array, Expr index, Location location) {
      super("index '" + index + "' into array '" + array + "' is not a constant integer",
          location);
      this.array = array;
    }

    public String getArray() {
      return array;
    }

    private final String array;
  }

  /** An expression of a shape the evaluator does not accept at that position. */
  public static class UnsupportedExpression extends MapException {
    public UnsupportedExpression(Expr expr, String expected) {
      super("expected " + expected + ", found '" + expr + "'", expr.getLocation());
      this.expr = expr;
      this.expected = expected;
    }

    public Expr getExpr() {
      return expr;
    }

    public String getExpected() {
      return expected;
    }

    private final Expr expr;
    private final String expected;
  }

  /** A predicate called with the wrong number of arguments. */
  public static class WrongArity extends MapException {
    public WrongArity(String predicate, int[] expected, int actual, Location location) {
      super(predicate + " expects " + describe(expected) + " arguments, got " + actual, location);
      this.predicate = predicate;
      this.expected = expected.clone();
      this.actual = actual;
    }

    public String getPredicate() {
      return predicate;
    }

    public int[] getExpected() {
      return expected.clone();
    }

    public int getActual() {
      return actual;
    }

    private static String describe(int[] expected) {
      if (expected.length == 1) {
        return Integer.toString(expected[0]);
      }
      String joined = Arrays.toString(expected);
      return "one of " + joined.substring(1, joined.length() - 1);
    }

    private final String predicate;
    private final int[] expected;
    private final int actual;
  }

  /** Two arrays that must have the same length do not. */
  public static class MismatchedArrayLengths extends MapException {
    public MismatchedArrayLengths(String predicate, String first, int firstLength,
        String second, int secondLength, Location location) {
      super(predicate + ": " + first + " has " + firstLength + " elements but " + second
          + " has " + secondLength, location);
      this.predicate = predicate;
      this.firstLength = firstLength;
      this.secondLength = secondLength;
    }

    public String getPredicate() {
      return predicate;
    }

    public int getFirstLength() {
      return firstLength;
    }

    public int getSecondLength() {
      return secondLength;
    }

    private final String predicate;
    private final int firstLength;
    private final int secondLength;
  }

  /** A value of the wrong kind, such as a float where an int is required. */
  public static class TypeMismatch extends MapException {
    public TypeMismatch(String what, String expected, String actual, Location location) {
      super(what + ": expected " + expected + ", found " + actual, location);
      this.expected = expected;
      this.actual = actual;
    }

    public String getExpected() {
      return expected;
    }

    public String getActual() {
      return actual;
    }

    private final String expected;
    private final String actual;
  }

  /** An empty or malformed domain, or a parameter without a value. */
  public static class InvalidDomain extends MapException {
    public InvalidDomain(String name, String reason, Location location) {
      super("invalid declaration of '" + name + "': " + reason, location);
      this.name = name;
    }

    public String getName() {
      return name;
    }

    private final String name;
  }

  /** A name declared twice. */
  public static class DuplicateSymbol extends MapException {
    public DuplicateSymbol(String name, Location location) {
      super("'" + name + "' is already declared", location);
      this.name = name;
    }

    public String getName() {
      return name;
    }

    private final String name;
  }

  public static MapException unknownSymbol(String name, Location location) {
    return new UnknownSymbol(name, location);
  }

  public static MapException unsupportedExpression(Expr expr, String expected) {
    return new UnsupportedExpression(expr, expected);
  }

  public static MapException typeMismatch(Expr expr, String expected, VarKind actual) {
    return new TypeMismatch("'" + expr + "'", expected, actual.name().toLowerCase(),
        expr.getLocation());
  }

  public static MapException emptyDomain(String name, Location location) {
    return new InvalidDomain(name, "empty domain", location);
  }
}
