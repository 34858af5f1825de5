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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.ortools.Loader;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverSolutionCallback;
import com.google.ortools.sat.CpSolverStatus;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.SatParameters;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.fzn2sat.mapper.FlatZincTranslator;
import org.fzn2sat.mapper.MappingContext;
import org.fzn2sat.mapper.OutputSpec;
import org.fzn2sat.mapper.Translation;
import org.fzn2sat.mapper.TranslatorOptions;
import org.fzn2sat.mapper.VarKind;

/**
 * Translates FlatZinc models and solves them with CP-SAT.
 *
 * <p>Satisfaction problems report one solution, the first {@code n}, or all of them.
 * Optimization problems report the best solution, or every improving one.
 */
public final class FlatZincSolver {
  public FlatZincSolver() {
    this(TranslatorOptions.defaults(), SolverOptions.defaults());
  }

  public FlatZincSolver(TranslatorOptions translatorOptions, SolverOptions solverOptions) {
    Loader.loadNativeLibraries();
    this.translator = new FlatZincTranslator(Preconditions.checkNotNull(translatorOptions));
    this.options = Preconditions.checkNotNull(solverOptions);
  }

  /** Reads, translates and solves the FlatZinc file at {@code path}. */
  public SolveOutcome solveFile(Path path, SolutionListener listener) throws IOException {
    String source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    return solve(source, listener);
  }

  /** Translates and solves FlatZinc source text. */
  public SolveOutcome solve(String source, SolutionListener listener) {
    return solve(translator.translate(source), listener);
  }

  public SolveOutcome solve(String source) {
    return solve(source, null);
  }

  /** Solves an already translated model. {@code listener} may be null. */
  public SolveOutcome solve(Translation translation, SolutionListener listener) {
    CpModel model = translation.getModel();
    boolean optimization = translation.getObjective() != null;
    boolean enumerate =
        !optimization && (options.isAllSolutions() || options.getSolutionLimit() > 1);
    boolean reportEach = !optimization
        || options.isAllSolutions() || options.isIntermediateSolutions();
    int limit = 0;
    if (!optimization) {
      limit = options.getSolutionLimit() > 0 ? options.getSolutionLimit()
          : options.isAllSolutions() ? 0 : 1;
    }

    CpSolver solver = new CpSolver();
    configure(solver.getParameters(), enumerate);
    if (options.isLogSearch()) {
      solver.getParameters().setLogSearchProgress(true).setLogToStdout(false);
      solver.setLogCallback(logger::info);
    }

    SolutionCollector collector =
        new SolutionCollector(translation, reportEach ? listener : null, limit);
    CpSolverStatus status = solver.solve(model, collector);
    logger.fine("solver status " + status + " after " + solver.wallTime() + "s");
    if (status == CpSolverStatus.MODEL_INVALID) {
      String reason = model.validate();
      throw new SolverException("invalid model: "
          + (reason.isEmpty() ? solver.response().getSolutionInfo() : reason));
    }

    List<Solution> solutions = collector.getSolutions();
    if (solutions.isEmpty()
        && (status == CpSolverStatus.OPTIMAL || status == CpSolverStatus.FEASIBLE)) {
      solutions.add(fromResponse(solver, translation));
      if (listener != null) {
        listener.onSolution(solutions.get(0));
      }
    } else if (!reportEach && listener != null && !solutions.isEmpty()) {
      listener.onSolution(solutions.get(solutions.size() - 1));
    }

    SolveStatus result = toStatus(status, optimization, enumerate, !solutions.isEmpty());
    Double objective = null;
    Double bound = null;
    if (optimization && !solutions.isEmpty()) {
      objective = solutions.get(solutions.size() - 1).getObjective();
      bound = objectiveValue(translation, solver.bestObjectiveBound());
    }
    SolveStatistics statistics = new SolveStatistics(solutions.size(), solver.numBranches(),
        solver.numConflicts(), solver.wallTime(), model.getBuilder().getVariablesCount(),
        model.getBuilder().getConstraintsCount(), objective, bound);
    return new SolveOutcome(result, ImmutableList.copyOf(solutions), statistics,
        translation.getDiagnostics());
  }

  private void configure(SatParameters.Builder parameters, boolean enumerate) {
    parameters.mergeFrom(options.getSatParameters());
    if (options.getTimeLimitSeconds() > 0) {
      parameters.setMaxTimeInSeconds(options.getTimeLimitSeconds());
    }
    if (options.getNumWorkers() > 0) {
      parameters.setNumWorkers(options.getNumWorkers());
    } else if (enumerate) {
      // Enumeration runs on a single search worker.
      parameters.setNumWorkers(1);
    }
    if (options.getRandomSeed() != null) {
      parameters.setRandomSeed(options.getRandomSeed());
    }
    if (enumerate) {
      parameters.setEnumerateAllSolutions(true);
    }
  }

  static SolveStatus toStatus(CpSolverStatus status, boolean optimization, boolean enumerate,
      boolean found) {
    switch (status) {
      case OPTIMAL:
        if (optimization) {
          return SolveStatus.OPTIMAL;
        }
        return enumerate ? SolveStatus.ALL_SOLUTIONS : SolveStatus.SATISFIED;
      case FEASIBLE:
        return SolveStatus.SATISFIED;
      case INFEASIBLE:
        return found ? SolveStatus.ALL_SOLUTIONS : SolveStatus.UNSATISFIABLE;
      default:
        return found ? SolveStatus.SATISFIED : SolveStatus.UNKNOWN;
    }
  }

  /** Scales a solver objective back to source units. */
  private static Double objectiveValue(Translation translation, double raw) {
    if (translation.getObjective().getKind() == VarKind.FLOAT) {
      return raw / translation.getFloats().getScale();
    }
    return raw;
  }

  private Solution fromResponse(CpSolver solver, Translation translation) {
    ImmutableList.Builder<Solution.Value> values = ImmutableList.builder();
    for (OutputSpec.Entry entry : translation.getOutput().getEntries()) {
      long[] raw = new long[entry.getVars().size()];
      for (int i = 0; i < raw.length; i++) {
        raw[i] = solver.value(entry.getVars().get(i));
      }
      values.add(new Solution.Value(entry, raw));
    }
    Double objective = null;
    MappingContext.Scalar scalar = translation.getObjective();
    if (scalar != null) {
      objective = objectiveValue(translation, solver.value(scalar.getVar()));
    }
    return new Solution(values.build(), translation.getFloats().getPrecision(), objective);
  }

  /** Records every solution and stops the search once {@code limit} are found. */
  private static final class SolutionCollector extends CpSolverSolutionCallback {
    SolutionCollector(Translation translation, SolutionListener listener, int limit) {
      this.translation = translation;
      this.listener = listener;
      this.limit = limit;
    }

    @Override
    public void onSolutionCallback() {
      ImmutableList.Builder<Solution.Value> values = ImmutableList.builder();
      for (OutputSpec.Entry entry : translation.getOutput().getEntries()) {
        long[] raw = new long[entry.getVars().size()];
        for (int i = 0; i < raw.length; i++) {
          raw[i] = valueOf(entry.getVars().get(i));
        }
        values.add(new Solution.Value(entry, raw));
      }
      Double objective = null;
      MappingContext.Scalar scalar = translation.getObjective();
      if (scalar != null) {
        objective = FlatZincSolver.objectiveValue(translation, valueOf(scalar.getVar()));
      }
      Solution solution =
          new Solution(values.build(), translation.getFloats().getPrecision(), objective);
      solutions.add(solution);
      if (listener != null) {
        listener.onSolution(solution);
      }
      if (limit > 0 && solutions.size() >= limit) {
        stopSearch();
      }
    }

    private long valueOf(IntVar var) {
      return value(var.build());
    }

    List<Solution> getSolutions() {
      return solutions;
    }

    private final Translation translation;
    private final SolutionListener listener;
    private final int limit;
    private final List<Solution> solutions = new ArrayList<>();
  }

  private static final Logger logger = Logger.getLogger(FlatZincSolver.class.getName());

  private final FlatZincTranslator translator;
  private final SolverOptions options;
}
