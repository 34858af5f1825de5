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

package org.fzn2sat.cli;

import com.google.ortools.sat.SatParameters;
import com.google.protobuf.TextFormat;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.fzn2sat.flatzinc.FlatZincException;
import org.fzn2sat.mapper.TranslatorOptions;
import org.fzn2sat.solver.FlatZincSolver;
import org.fzn2sat.solver.OutputFormatter;
import org.fzn2sat.solver.SolveOutcome;
import org.fzn2sat.solver.SolverOptions;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/** Command line entry point: solves a FlatZinc file and prints solutions in FlatZinc format. */
@Command(
    name = "fzn2sat",
    mixinStandardHelpOptions = true,
    version = "fzn2sat 1.0",
    description = "Solves a FlatZinc model with the OR-Tools CP-SAT solver.")
public final class Main implements Callable<Integer> {
  @Parameters(index = "0", paramLabel = "MODEL", description = "FlatZinc file to solve.")
  private Path model;

  @Option(names = {"-a", "--all-solutions"},
      description = "Print all solutions, or every improving solution when optimizing.")
  private boolean allSolutions;

  @Option(names = {"-n", "--num-solutions"}, paramLabel = "N",
      description = "Stop after N solutions of a satisfaction problem.")
  private int numSolutions;

  @Option(names = {"-i", "--intermediate"},
      description = "Print intermediate solutions when optimizing.")
  private boolean intermediate;

  @Option(names = {"-f", "--free-search"}, description = "Ignore search annotations.")
  private boolean freeSearch;

  @Option(names = {"-s", "--statistics"}, description = "Print search statistics.")
  private boolean statistics;

  @Option(names = {"-v", "--verbose"}, description = "Log translation and search progress.")
  private boolean verbose;

  @Option(names = {"-p", "--parallel"}, paramLabel = "WORKERS",
      description = "Number of search workers.")
  private int workers;

  @Option(names = {"-r", "--random-seed"}, paramLabel = "SEED", description = "Random seed.")
  private Integer seed;

  @Option(names = {"-t", "--time-limit"}, paramLabel = "MS",
      description = "Time limit in milliseconds.")
  private long timeLimitMillis;

  @Option(names = "--precision", paramLabel = "DIGITS",
      description = "Decimal digits kept for float variables (default: ${DEFAULT-VALUE}).")
  private int precision = TranslatorOptions.DEFAULT_FLOAT_PRECISION;

  @Option(names = "--max-domain-size", paramLabel = "SIZE",
      description = "Largest integer domain allocated as declared (default: ${DEFAULT-VALUE}).")
  private long maxDomainSize = TranslatorOptions.DEFAULT_MAX_DOMAIN_SIZE;

  @Option(names = "--native-cumulative",
      description = "Use the solver's cumulative constraint instead of time sampling.")
  private boolean nativeCumulative;

  @Option(names = "--sat-params", paramLabel = "TEXT",
      description = "CP-SAT parameters in protobuf text format.")
  private String satParams;

  public Main() {
    this(System.out, System.err);
  }

  public Main(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }

  @Override
  public Integer call() throws IOException {
    configureLogging(verbose);
    TranslatorOptions translatorOptions;
    SolverOptions solverOptions;
    try {
      translatorOptions = translatorOptions();
      solverOptions = solverOptions();
    } catch (TextFormat.ParseException e) {
      err.println("invalid --sat-params: " + e.getMessage());
      return 2;
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      return 2;
    }
    try {
      FlatZincSolver solver = new FlatZincSolver(translatorOptions, solverOptions);
      SolveOutcome outcome = solver.solveFile(model,
          solution -> out.print(OutputFormatter.formatSolution(solution)));
      out.print(OutputFormatter.formatStatus(outcome.getStatus()));
      if (statistics) {
        out.print(OutputFormatter.formatStatistics(outcome.getStatistics()));
      }
      out.flush();
      return 0;
    } catch (FlatZincException e) {
      logger.log(Level.FINE, "solve failed", e);
      err.println(model + ":" + e.render());
      return 1;
    } catch (IOException e) {
      err.println("cannot read " + model + ": " + e.getMessage());
      return 1;
    }
  }

  TranslatorOptions translatorOptions() {
    return TranslatorOptions.newBuilder()
        .setFloatPrecision(precision)
        .setMaxDomainSize(maxDomainSize)
        .setNativeCumulative(nativeCumulative)
        .setUseSearchAnnotations(!freeSearch)
        .build();
  }

  SolverOptions solverOptions() throws TextFormat.ParseException {
    SolverOptions.Builder builder = SolverOptions.newBuilder()
        .setAllSolutions(allSolutions)
        .setSolutionLimit(numSolutions)
        .setIntermediateSolutions(intermediate)
        .setTimeLimitSeconds(timeLimitMillis / 1000.0)
        .setNumWorkers(workers)
        .setRandomSeed(seed)
        .setStatistics(statistics)
        .setLogSearch(verbose);
    if (satParams != null) {
      SatParameters.Builder parameters = SatParameters.newBuilder();
      TextFormat.merge(satParams, parameters);
      builder.setSatParameters(parameters.build());
    }
    return builder.build();
  }

  /** Loads the bundled logging setup; verbose mode lowers every level to FINE. */
  static void configureLogging(boolean verbose) throws IOException {
    try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
      if (in != null) {
        LogManager.getLogManager().readConfiguration(in);
      }
    }
    if (verbose) {
      Logger root = Logger.getLogger("");
      root.setLevel(Level.FINE);
      for (Handler handler : root.getHandlers()) {
        handler.setLevel(Level.FINE);
      }
    }
  }

  public static void main(String[] args) {
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  private static final Logger logger = Logger.getLogger(Main.class.getName());

  private final PrintStream out;
  private final PrintStream err;
}
