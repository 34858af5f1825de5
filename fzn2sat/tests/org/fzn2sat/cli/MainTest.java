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

import static com.google.common.truth.Truth.assertThat;

import com.google.ortools.Loader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

/** Tests the fzn2sat command line. */
public final class MainTest {
  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();

  @BeforeEach
  public void setUp() {
    Loader.loadNativeLibraries();
  }

  private int run(String... args) {
    final Main main =
        new Main(
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    return new CommandLine(main).execute(args);
  }

  private static String model(String name) throws Exception {
    final Path path = Paths.get(MainTest.class.getResource("/models/" + name).toURI());
    return path.toString();
  }

  private String stdout() {
    return new String(out.toByteArray(), StandardCharsets.UTF_8);
  }

  private String stderr() {
    return new String(err.toByteArray(), StandardCharsets.UTF_8);
  }

  private static int count(String text, String needle) {
    int count = 0;
    for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + needle.length())) {
      count++;
    }
    return count;
  }

  @Test
  public void testMain_firstSolution() throws Exception {
    assertThat(run(model("queens4.fzn"))).isEqualTo(0);
    final String output = stdout();
    assertThat(count(output, "----------\n")).isEqualTo(1);
    assertThat(output).doesNotContain("==========");
    assertThat(
            output.equals("q = array1d(1..4, [2, 4, 1, 3]);\n----------\n")
                || output.equals("q = array1d(1..4, [3, 1, 4, 2]);\n----------\n"))
        .isTrue();
  }

  @Test
  public void testMain_allSolutions() throws Exception {
    assertThat(run("-a", model("queens4.fzn"))).isEqualTo(0);
    final String output = stdout();
    assertThat(output).contains("q = array1d(1..4, [2, 4, 1, 3]);\n----------\n");
    assertThat(output).contains("q = array1d(1..4, [3, 1, 4, 2]);\n----------\n");
    assertThat(count(output, "----------\n")).isEqualTo(2);
    assertThat(output).endsWith("==========\n");
  }

  @Test
  public void testMain_solutionLimit() throws Exception {
    assertThat(run("-n", "1", model("queens4.fzn"))).isEqualTo(0);
    assertThat(count(stdout(), "----------\n")).isEqualTo(1);
  }

  @Test
  public void testMain_optimization() throws Exception {
    assertThat(run("-s", model("knapsack.fzn"))).isEqualTo(0);
    final String output = stdout();
    assertThat(output).startsWith("a = 0;\nb = 3;\nvalue = 21;\n----------\n==========\n");
    assertThat(output).contains("%%%mzn-stat: objective=21\n");
    assertThat(output).endsWith("%%%mzn-stat-end\n");
  }

  @Test
  public void testMain_unsatisfiable() throws Exception {
    assertThat(run(model("unsat.fzn"))).isEqualTo(0);
    assertThat(stdout()).isEqualTo("=====UNSATISFIABLE=====\n");
  }

  @Test
  public void testMain_syntaxError() throws Exception {
    final String path = model("syntax_error.fzn");
    assertThat(run(path)).isEqualTo(1);
    assertThat(stderr()).startsWith(path + ":2:1: ");
    assertThat(stdout()).isEmpty();
  }

  @Test
  public void testMain_unsupportedFeature() throws Exception {
    assertThat(run(model("unsupported.fzn"))).isEqualTo(1);
    assertThat(stderr()).contains("unsupported feature");
  }

  @Test
  public void testMain_missingFile() throws Exception {
    assertThat(run("/nonexistent/model.fzn")).isEqualTo(1);
    assertThat(stderr()).contains("cannot read /nonexistent/model.fzn");
  }

  @Test
  public void testMain_invalidSatParams() throws Exception {
    assertThat(run("--sat-params", "no_such_field: 1", model("unsat.fzn"))).isEqualTo(2);
    assertThat(stderr()).startsWith("invalid --sat-params");
  }

  @Test
  public void testMain_invalidOption() throws Exception {
    assertThat(run("-n", "-3", model("unsat.fzn"))).isEqualTo(2);
  }

  @Test
  public void testMain_usageError() throws Exception {
    assertThat(run()).isEqualTo(2);
  }
}
