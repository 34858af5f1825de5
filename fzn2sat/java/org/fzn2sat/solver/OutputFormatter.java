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

import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders solutions, final status markers and statistics in the FlatZinc output format.
 *
 * <p>Every returned string is a sequence of complete lines, each ending with a newline.
 */
public final class OutputFormatter {
  public static final String SOLUTION_SEPARATOR = "----------";
  public static final String SEARCH_COMPLETE = "==========";
  public static final String UNSATISFIABLE = "=====UNSATISFIABLE=====";
  public static final String UNKNOWN = "=====UNKNOWN=====";

  /** Formats one solution: {@code name = value;} per output, then the separator. */
  public static String formatSolution(Solution solution) {
    StringBuilder out = new StringBuilder();
    for (Solution.Value value : solution.getValues()) {
      out.append(value.getName()).append(" = ");
      if (value.isArray()) {
        appendArray(out, solution, value);
      } else {
        out.append(solution.format(value, 0));
      }
      out.append(";\n");
    }
    out.append(SOLUTION_SEPARATOR).append('\n');
    return out.toString();
  }

  private static void appendArray(StringBuilder out, Solution solution, Solution.Value value) {
    List<String> ranges = new ArrayList<>();
    for (long[] dimension : value.getDimensions()) {
      ranges.add(dimension[0] + ".." + dimension[1]);
    }
    List<String> elements = new ArrayList<>();
    for (int i = 0; i < value.size(); i++) {
      elements.add(solution.format(value, i));
    }
    out.append("array").append(ranges.size()).append("d(");
    COMMA.appendTo(out, ranges);
    out.append(", [");
    COMMA.appendTo(out, elements);
    out.append("])");
  }

  /** Formats the marker closing the output of a solve, or "" when none applies. */
  public static String formatStatus(SolveStatus status) {
    switch (status) {
      case OPTIMAL:
      case ALL_SOLUTIONS:
        return SEARCH_COMPLETE + "\n";
      case UNSATISFIABLE:
        return UNSATISFIABLE + "\n";
      case UNKNOWN:
        return UNKNOWN + "\n";
      default:
        return "";
    }
  }

  /** Formats statistics as {@code %%%mzn-stat: key=value} lines. */
  public static String formatStatistics(SolveStatistics statistics) {
    StringBuilder out = new StringBuilder();
    stat(out, "solutions", Integer.toString(statistics.getSolutions()));
    stat(out, "nodes", Long.toString(statistics.getBranches()));
    stat(out, "failures", Long.toString(statistics.getConflicts()));
    stat(out, "variables", Integer.toString(statistics.getVariables()));
    stat(out, "propagators", Integer.toString(statistics.getConstraints()));
    stat(out, "solveTime", String.format(Locale.ROOT, "%.3f", statistics.getWallTime()));
    if (statistics.getObjective() != null) {
      stat(out, "objective", formatNumber(statistics.getObjective()));
      stat(out, "objectiveBound", formatNumber(statistics.getObjectiveBound()));
    }
    out.append("%%%mzn-stat-end\n");
    return out.toString();
  }

  private static void stat(StringBuilder out, String key, String value) {
    out.append("%%%mzn-stat: ").append(key).append('=').append(value).append('\n');
  }

  private static String formatNumber(double value) {
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }

  private static final Joiner COMMA = Joiner.on(", ");

  private OutputFormatter() {}
}
