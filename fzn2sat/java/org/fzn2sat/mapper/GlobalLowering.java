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

import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CumulativeConstraint;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.IntervalVar;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.Literal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.fzn2sat.flatzinc.ConstraintItem;

/**
 * Lowers the global constraints. {@code all_different} maps onto the native constraint; the
 * others are decomposed into reified primitives, with explicit caps on the ones whose size
 * grows faster than linearly.
 */
final class GlobalLowering extends Lowering {
  /** Largest {@code sort} for which the permutation channeling is emitted. */
  static final int MAX_SORT_CHANNELING = 10;
  /** Largest value span {@code nvalue} enumerates. */
  static final long MAX_NVALUE_SPAN = 1000;
  /** Number of time points the sampled {@code cumulative} checks. */
  static final int MAX_TIME_POINTS = 200;

  GlobalLowering(MappingContext context, ExpressionEvaluator evaluator,
      Reification reification) {
    super(context, evaluator, reification);
  }

  @Override
  void lower(Predicate.Call call, ConstraintItem item) {
    switch (call.getPredicate()) {
      case ALL_DIFFERENT:
        model.addAllDifferent(evaluator.resolveIntArray(item.getArg(0)));
        break;
      case SORT:
        lowerSort(call, item);
        break;
      case TABLE_INT:
      case TABLE_BOOL:
        lowerTable(call, item);
        break;
      case LEX_LESS:
      case LEX_LESSEQ:
        lowerLex(call, item);
        break;
      case NVALUE:
        lowerNvalue(call, item);
        break;
      case CUMULATIVE:
        lowerCumulative(call, item);
        break;
      default:
        throw new IllegalArgumentException(call.getName() + " is not a global constraint");
    }
  }

  // sort(x, y): y is x in non-decreasing order.
  private void lowerSort(Predicate.Call call, ConstraintItem item) {
    checkSameLength(call, item, "x", evaluator.arrayLength(item.getArg(0)), "y",
        evaluator.arrayLength(item.getArg(1)));
    List<IntVar> x = evaluator.resolveIntArray(item.getArg(0));
    List<IntVar> y = evaluator.resolveIntArray(item.getArg(1));
    int n = y.size();
    for (int i = 0; i + 1 < n; i++) {
      model.addLessOrEqual(y.get(i), y.get(i + 1));
    }
    if (n > MAX_SORT_CHANNELING) {
      context.diagnose(Diagnostic.Kind.DECOMPOSITION_INCOMPLETE,
          call.getName() + " over " + n + " elements only orders y; y is not tied to x",
          item.getLocation());
      return;
    }
    // p[i][j] -> y[i] == x[j], with exactly one true entry per row and per column.
    BoolVar[][] p = new BoolVar[n][n];
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < n; j++) {
        p[i][j] = model.newBoolVar("");
        reification.imply(Relation.EQ, y.get(i), x.get(j), p[i][j]);
      }
    }
    for (int i = 0; i < n; i++) {
      List<Literal> row = new ArrayList<>();
      List<Literal> column = new ArrayList<>();
      for (int j = 0; j < n; j++) {
        row.add(p[i][j]);
        column.add(p[j][i]);
      }
      model.addExactlyOne(row);
      model.addExactlyOne(column);
    }
  }

  // table(x, t): x equals one row of the row-major matrix t.
  private void lowerTable(Predicate.Call call, ConstraintItem item) {
    long[] table = constantTable(call, item);
    List<IntVar> x = evaluator.resolveIntArray(item.getArg(0));
    int arity = x.size();
    if (table.length == 0) {
      postFalse();
      return;
    }
    if (arity == 0 || table.length % arity != 0) {
      throw new MapException(call.getName() + ": table of " + table.length
          + " values is not a whole number of rows of " + arity, item.getLocation());
    }
    List<Map<Long, Literal>> equalities = new ArrayList<>();
    for (int j = 0; j < arity; j++) {
      equalities.add(new HashMap<Long, Literal>());
    }
    List<Literal> rows = new ArrayList<>();
    for (int start = 0; start < table.length; start += arity) {
      List<Literal> cells = new ArrayList<>();
      for (int j = 0; j < arity; j++) {
        cells.add(equality(equalities.get(j), x.get(j), table[start + j]));
      }
      rows.add(reification.and(cells));
    }
    model.addBoolOr(rows);
  }

  private long[] constantTable(Predicate.Call call, ConstraintItem item) {
    if (call.getPredicate() == Predicate.TABLE_INT) {
      return evaluator.extractIntArray(item.getArg(1));
    }
    boolean[] values = evaluator.extractBoolArray(item.getArg(1));
    long[] table = new long[values.length];
    for (int i = 0; i < values.length; i++) {
      table[i] = values[i] ? 1 : 0;
    }
    return table;
  }

  /** Returns a literal for {@code var == value}, shared between rows of the same column. */
  private Literal equality(Map<Long, Literal> cache, IntVar var, long value) {
    Literal literal = cache.get(value);
    if (literal == null) {
      if (var.getDomain().contains(value)) {
        literal = reification.reified(Relation.EQ, var, value);
      } else {
        literal = model.falseLiteral();
      }
      cache.put(value, literal);
    }
    return literal;
  }

  // lex_less(x, y) / lex_lesseq(x, y).
  private void lowerLex(Predicate.Call call, ConstraintItem item) {
    checkSameLength(call, item, "x", evaluator.arrayLength(item.getArg(0)), "y",
        evaluator.arrayLength(item.getArg(1)));
    List<IntVar> x = evaluator.resolveIntArray(item.getArg(0));
    List<IntVar> y = evaluator.resolveIntArray(item.getArg(1));
    boolean strict = call.getPredicate() == Predicate.LEX_LESS;
    int n = x.size();
    if (n == 0) {
      if (strict) {
        postFalse();
      }
      return;
    }
    // prefix holds when x[0..i) == y[0..i).
    List<Literal> cases = new ArrayList<>();
    List<Literal> prefix = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      Literal less = reification.reified(Relation.LT, x.get(i), y.get(i));
      if (prefix.isEmpty()) {
        cases.add(less);
      } else {
        List<Literal> conjunction = new ArrayList<>(prefix);
        conjunction.add(less);
        cases.add(reification.and(conjunction));
      }
      prefix.add(reification.reified(Relation.EQ, x.get(i), y.get(i)));
    }
    if (!strict) {
      cases.add(reification.and(prefix));
    }
    model.addBoolOr(cases);
  }

  // nvalue(n, x): n is the number of distinct values in x.
  private void lowerNvalue(Predicate.Call call, ConstraintItem item) {
    IntVar count = evaluator.resolveInt(item.getArg(0));
    List<IntVar> x = evaluator.resolveIntArray(item.getArg(1));
    if (x.isEmpty()) {
      model.addEquality(count, 0);
      return;
    }
    long lo = Long.MAX_VALUE;
    long hi = Long.MIN_VALUE;
    for (IntVar var : x) {
      lo = Math.min(lo, MappingContext.lowerBound(var));
      hi = Math.max(hi, MappingContext.upperBound(var));
    }
    if (hi - lo + 1 > MAX_NVALUE_SPAN) {
      throw new UnsupportedFeatureException(call.getName() + " over a value span of "
          + (hi - lo + 1) + " (at most " + MAX_NVALUE_SPAN + ")", item.getLocation());
    }
    List<Literal> present = new ArrayList<>();
    for (long v = lo; v <= hi; v++) {
      List<Literal> holders = new ArrayList<>();
      for (IntVar var : x) {
        if (var.getDomain().contains(v)) {
          holders.add(reification.reified(Relation.EQ, var, v));
        }
      }
      if (!holders.isEmpty()) {
        present.add(reification.or(holders));
      }
    }
    model.addEquality(count, LinearExpr.sum(toArray(present)));
  }

  // cumulative(s, d, r, b): at every time point the running tasks use at most b.
  private void lowerCumulative(Predicate.Call call, ConstraintItem item) {
    int n = evaluator.arrayLength(item.getArg(0));
    long[] durations = evaluator.extractIntArray(item.getArg(1));
    long[] resources = evaluator.extractIntArray(item.getArg(2));
    checkSameLength(call, item, "s", n, "d", durations.length);
    checkSameLength(call, item, "s", n, "r", resources.length);
    List<IntVar> starts = evaluator.resolveIntArray(item.getArg(0));
    IntVar capacity = evaluator.resolveInt(item.getArg(3));

    model.addGreaterOrEqual(capacity, 0);
    List<Integer> tasks = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      if (durations[i] > 0 && resources[i] > 0) {
        tasks.add(i);
      }
    }
    if (tasks.isEmpty()) {
      return;
    }
    if (context.getOptions().isNativeCumulative()) {
      CumulativeConstraint cumulative = model.addCumulative(capacity);
      for (int i : tasks) {
        IntervalVar interval = model.newFixedSizeIntervalVar(starts.get(i), durations[i], "");
        cumulative.addDemand(interval, resources[i]);
      }
      return;
    }

    long horizonLo = Long.MAX_VALUE;
    long horizonHi = Long.MIN_VALUE;
    for (int i : tasks) {
      horizonLo = Math.min(horizonLo, MappingContext.lowerBound(starts.get(i)));
      horizonHi = Math.max(horizonHi,
          MappingContext.upperBound(starts.get(i)) + durations[i] - 1);
    }
    long span = horizonHi - horizonLo + 1;
    if (span > MAX_TIME_POINTS) {
      context.diagnose(Diagnostic.Kind.DECOMPOSITION_INCOMPLETE,
          call.getName() + " horizon of " + span + " time points checked at "
              + MAX_TIME_POINTS + " samples",
          item.getLocation());
    }
    for (long t : timePoints(horizonLo, horizonHi)) {
      List<Literal> active = new ArrayList<>();
      List<Long> demand = new ArrayList<>();
      for (int i : tasks) {
        IntVar start = starts.get(i);
        // Task i runs at t when t - d[i] < s[i] <= t.
        long earliest = t - durations[i] + 1;
        if (MappingContext.upperBound(start) < earliest
            || MappingContext.lowerBound(start) > t) {
          continue;
        }
        List<Literal> bounds = new ArrayList<>();
        bounds.add(reification.reified(Relation.LE, start, t));
        bounds.add(reification.reified(Relation.GE, start, earliest));
        active.add(reification.and(bounds));
        demand.add(resources[i]);
      }
      if (active.isEmpty()) {
        continue;
      }
      long[] coeffs = new long[demand.size()];
      for (int k = 0; k < coeffs.length; k++) {
        coeffs[k] = demand.get(k);
      }
      model.addLessOrEqual(LinearExpr.weightedSum(toArray(active), coeffs), capacity);
    }
  }

  /**
   * Returns every integer of {@code [lo, hi]} when there are at most {@link #MAX_TIME_POINTS},
   * otherwise that many points evenly spread over the range, both ends included.
   */
  static List<Long> timePoints(long lo, long hi) {
    List<Long> points = new ArrayList<>();
    long span = hi - lo + 1;
    if (span <= MAX_TIME_POINTS) {
      for (long t = lo; t <= hi; t++) {
        points.add(t);
      }
      return points;
    }
    for (int k = 0; k < MAX_TIME_POINTS; k++) {
      points.add(lo + (long) ((double) (span - 1) * k / (MAX_TIME_POINTS - 1)));
    }
    return points;
  }
}
