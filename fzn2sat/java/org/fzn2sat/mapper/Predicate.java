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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.fzn2sat.flatzinc.ConstraintItem;
import org.fzn2sat.flatzinc.Location;

/**
 * The closed set of constraint predicates the translator lowers. Names are decoded once into a
 * constant and a {@link Mode}; unknown names fail before any argument is looked at.
 */
public enum Predicate {
  // Integer comparisons.
  INT_EQ(Family.RELATION, true, arity(2), "int_eq"),
  INT_NE(Family.RELATION, true, arity(2), "int_ne"),
  INT_LT(Family.RELATION, true, arity(2), "int_lt"),
  INT_LE(Family.RELATION, true, arity(2), "int_le"),
  INT_GT(Family.RELATION, true, arity(2), "int_gt"),
  INT_GE(Family.RELATION, true, arity(2), "int_ge"),

  // Linear relations over weighted sums.
  INT_LIN_EQ(Family.LINEAR, true, arity(3), "int_lin_eq"),
  INT_LIN_NE(Family.LINEAR, true, arity(3), "int_lin_ne"),
  INT_LIN_LE(Family.LINEAR, true, arity(3), "int_lin_le"),
  INT_LIN_LT(Family.LINEAR, true, arity(3), "int_lin_lt"),
  INT_LIN_GE(Family.LINEAR, true, arity(3), "int_lin_ge"),
  INT_LIN_GT(Family.LINEAR, true, arity(3), "int_lin_gt"),
  BOOL_LIN_EQ(Family.LINEAR, true, arity(3), "bool_lin_eq"),
  BOOL_LIN_LE(Family.LINEAR, true, arity(3), "bool_lin_le"),
  FLOAT_LIN_EQ(Family.LINEAR, true, arity(3), "float_lin_eq"),
  FLOAT_LIN_NE(Family.LINEAR, true, arity(3), "float_lin_ne"),
  FLOAT_LIN_LE(Family.LINEAR, true, arity(3), "float_lin_le"),
  FLOAT_LIN_LT(Family.LINEAR, true, arity(3), "float_lin_lt"),

  // Integer arithmetic.
  INT_ABS(Family.ARITHMETIC, false, arity(2), "int_abs"),
  INT_PLUS(Family.ARITHMETIC, false, arity(3), "int_plus"),
  INT_MINUS(Family.ARITHMETIC, false, arity(3), "int_minus"),
  INT_TIMES(Family.ARITHMETIC, false, arity(3), "int_times"),
  INT_DIV(Family.ARITHMETIC, false, arity(3), "int_div"),
  INT_MOD(Family.ARITHMETIC, false, arity(3), "int_mod"),
  INT_MAX(Family.ARITHMETIC, false, arity(3), "int_max"),
  INT_MIN(Family.ARITHMETIC, false, arity(3), "int_min"),
  INT_POW(Family.ARITHMETIC, false, arity(3), "int_pow"),
  ARRAY_INT_MINIMUM(Family.ARITHMETIC, false, arity(2), "array_int_minimum", "minimum_int"),
  ARRAY_INT_MAXIMUM(Family.ARITHMETIC, false, arity(2), "array_int_maximum", "maximum_int"),

  // Booleans.
  BOOL_EQ(Family.BOOLEAN, true, arity(2), "bool_eq"),
  BOOL_NE(Family.BOOLEAN, true, arity(2), "bool_ne"),
  BOOL_LT(Family.BOOLEAN, true, arity(2), "bool_lt"),
  BOOL_LE(Family.BOOLEAN, true, arity(2), "bool_le"),
  BOOL_NOT(Family.BOOLEAN, false, arity(2), "bool_not"),
  BOOL_AND(Family.BOOLEAN, false, arity(3), "bool_and"),
  BOOL_OR(Family.BOOLEAN, false, arity(3), "bool_or"),
  BOOL_XOR(Family.BOOLEAN, false, arity(2, 3), "bool_xor"),
  BOOL_CLAUSE(Family.BOOLEAN, true, arity(2), "bool_clause"),
  ARRAY_BOOL_AND(Family.BOOLEAN, false, arity(2), "array_bool_and"),
  ARRAY_BOOL_OR(Family.BOOLEAN, false, arity(2), "array_bool_or"),
  ARRAY_BOOL_XOR(Family.BOOLEAN, false, arity(1), "array_bool_xor"),
  BOOL2INT(Family.BOOLEAN, false, arity(2), "bool2int"),

  // Element constraints. The variable forms accept (index, offset, array, value).
  ARRAY_INT_ELEMENT(Family.ELEMENT, false, arity(3), "array_int_element"),
  ARRAY_VAR_INT_ELEMENT(Family.ELEMENT, false, arity(3, 4), "array_var_int_element"),
  ARRAY_BOOL_ELEMENT(Family.ELEMENT, false, arity(3), "array_bool_element"),
  ARRAY_VAR_BOOL_ELEMENT(Family.ELEMENT, false, arity(3, 4), "array_var_bool_element"),
  ARRAY_FLOAT_ELEMENT(Family.ELEMENT, false, arity(3), "array_float_element"),
  ARRAY_VAR_FLOAT_ELEMENT(Family.ELEMENT, false, arity(3, 4), "array_var_float_element"),

  // Membership in a constant set.
  SET_IN(Family.SET, true, arity(2), "set_in"),

  // Floats.
  FLOAT_EQ(Family.FLOAT, true, arity(2), "float_eq"),
  FLOAT_NE(Family.FLOAT, true, arity(2), "float_ne"),
  FLOAT_LT(Family.FLOAT, true, arity(2), "float_lt"),
  FLOAT_LE(Family.FLOAT, true, arity(2), "float_le"),
  FLOAT_GT(Family.FLOAT, true, arity(2), "float_gt"),
  FLOAT_GE(Family.FLOAT, true, arity(2), "float_ge"),
  FLOAT_PLUS(Family.FLOAT, false, arity(3), "float_plus"),
  FLOAT_MINUS(Family.FLOAT, false, arity(3), "float_minus"),
  FLOAT_TIMES(Family.FLOAT, false, arity(3), "float_times"),
  FLOAT_DIV(Family.FLOAT, false, arity(3), "float_div"),
  FLOAT_ABS(Family.FLOAT, false, arity(2), "float_abs"),
  FLOAT_MAX(Family.FLOAT, false, arity(3), "float_max"),
  FLOAT_MIN(Family.FLOAT, false, arity(3), "float_min"),
  ARRAY_FLOAT_MINIMUM(Family.FLOAT, false, arity(2), "array_float_minimum", "minimum_float"),
  ARRAY_FLOAT_MAXIMUM(Family.FLOAT, false, arity(2), "array_float_maximum", "maximum_float"),
  INT2FLOAT(Family.FLOAT, false, arity(2), "int2float"),
  FLOAT2INT(Family.FLOAT, false, arity(2), "float2int"),

  // Global constraints.
  ALL_DIFFERENT(Family.GLOBAL, false, arity(1),
      "all_different", "all_different_int", "fzn_all_different_int", "alldifferent"),
  SORT(Family.GLOBAL, false, arity(2), "sort", "fzn_sort"),
  TABLE_INT(Family.GLOBAL, false, arity(2), "table_int", "fzn_table_int"),
  TABLE_BOOL(Family.GLOBAL, false, arity(2), "table_bool", "fzn_table_bool"),
  LEX_LESS(Family.GLOBAL, false, arity(2),
      "lex_less", "lex_less_int", "lex_less_bool", "fzn_lex_less_int", "fzn_lex_less_bool"),
  LEX_LESSEQ(Family.GLOBAL, false, arity(2),
      "lex_lesseq", "lex_lesseq_int", "lex_lesseq_bool", "fzn_lex_lesseq_int",
      "fzn_lex_lesseq_bool"),
  NVALUE(Family.GLOBAL, false, arity(2), "nvalue", "fzn_nvalue"),
  CUMULATIVE(Family.GLOBAL, false, arity(4),
      "cumulative", "fzn_cumulative", "fixed_fzn_cumulative", "var_fzn_cumulative"),

  // Counting.
  GLOBAL_CARDINALITY(Family.COUNTING, false, arity(3),
      "global_cardinality", "fzn_global_cardinality"),
  GLOBAL_CARDINALITY_CLOSED(Family.COUNTING, false, arity(3),
      "global_cardinality_closed", "fzn_global_cardinality_closed"),
  GLOBAL_CARDINALITY_LOW_UP(Family.COUNTING, false, arity(4),
      "global_cardinality_low_up", "fzn_global_cardinality_low_up"),
  GLOBAL_CARDINALITY_LOW_UP_CLOSED(Family.COUNTING, false, arity(4),
      "global_cardinality_low_up_closed", "fzn_global_cardinality_low_up_closed"),
  COUNT_EQ(Family.COUNTING, true, arity(3), "count_eq", "count", "fzn_count_eq"),
  AT_LEAST_INT(Family.COUNTING, false, arity(3), "at_least_int", "fzn_at_least_int"),
  AT_MOST_INT(Family.COUNTING, false, arity(3), "at_most_int", "fzn_at_most_int"),
  EXACTLY_INT(Family.COUNTING, false, arity(3), "exactly_int", "fzn_exactly_int");

  /** Which lowering strategy handles a predicate. */
  public enum Family {
    RELATION,
    LINEAR,
    ARITHMETIC,
    BOOLEAN,
    ELEMENT,
    SET,
    FLOAT,
    GLOBAL,
    COUNTING
  }

  /** How a reifiable predicate is bound to its extra boolean argument. */
  public enum Mode {
    /** The constraint must hold. */
    PLAIN,
    /** {@code _reif}: the last argument is equivalent to the constraint. */
    REIF,
    /** {@code _imp}: the last argument implies the constraint. */
    IMP
  }

  /** A decoded predicate name: the constant, its mode and the name as written. */
  public static final class Call {
    Call(Predicate predicate, Mode mode, String name) {
      this.predicate = predicate;
      this.mode = mode;
      this.name = name;
    }

    public Predicate getPredicate() {
      return predicate;
    }

    public Mode getMode() {
      return mode;
    }

    public String getName() {
      return name;
    }

    public boolean isReified() {
      return mode != Mode.PLAIN;
    }

    /** Accepted argument counts, including the trailing literal of reified forms. */
    public int[] arities() {
      int[] accepted = predicate.arities.clone();
      if (mode != Mode.PLAIN) {
        for (int i = 0; i < accepted.length; i++) {
          accepted[i]++;
        }
      }
      return accepted;
    }

    /** Throws {@link MapException.WrongArity} unless {@code item} has an accepted arity. */
    public void checkArity(ConstraintItem item) {
      int[] accepted = arities();
      for (int arity : accepted) {
        if (arity == item.arity()) {
          return;
        }
      }
      throw new MapException.WrongArity(name, accepted, item.arity(), item.getLocation());
    }

    private final Predicate predicate;
    private final Mode mode;
    private final String name;
  }

  Predicate(Family family, boolean reifiable, int[] arities, String... names) {
    this.family = family;
    this.reifiable = reifiable;
    this.arities = arities;
    this.names = names;
  }

  public Family getFamily() {
    return family;
  }

  public boolean isReifiable() {
    return reifiable;
  }

  /** Decodes a predicate name, throwing {@link UnsupportedFeatureException} if it is unknown. */
  public static Call decode(String name, Location location) {
    Predicate predicate = BY_NAME.get(name);
    if (predicate != null) {
      return new Call(predicate, Mode.PLAIN, name);
    }
    for (Mode mode : new Mode[] {Mode.REIF, Mode.IMP}) {
      String suffix = mode == Mode.REIF ? "_reif" : "_imp";
      if (name.endsWith(suffix)) {
        Predicate base = BY_NAME.get(name.substring(0, name.length() - suffix.length()));
        if (base != null && base.reifiable) {
          return new Call(base, mode, name);
        }
      }
    }
    throw new UnsupportedFeatureException("constraint '" + name + "'", location);
  }

  private static int[] arity(int... accepted) {
    return accepted;
  }

  private static final Map<String, Predicate> BY_NAME;

  static {
    ImmutableMap.Builder<String, Predicate> builder = ImmutableMap.builder();
    for (Predicate predicate : values()) {
      for (String name : predicate.names) {
        builder.put(name, predicate);
      }
    }
    BY_NAME = builder.build();
  }

  private final Family family;
  private final boolean reifiable;
  private final int[] arities;
  private final String[] names;
}
