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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.ortools.Loader;
import com.google.ortools.sat.IntVar;
import java.util.Arrays;
import org.fzn2sat.solver.SolveOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests how declarations become solver variables. */
public final class DeclarationMapperTest {
  @BeforeEach
  public void setUp() {
    Loader.loadNativeLibraries();
  }

  private static Translation translate(String source) {
    return new FlatZincTranslator().translate(source);
  }

  @Test
  public void testMap_intRange() throws Exception {
    final Translation translation = translate("var 1..5: x;");
    final IntVar x = translation.getVariable("x").getVar();
    assertThat(MappingContext.lowerBound(x)).isEqualTo(1);
    assertThat(MappingContext.upperBound(x)).isEqualTo(5);
    assertThat(translation.getVariable("x").getKind()).isEqualTo(VarKind.INT);
    assertThat(translation.nameOf(x)).isEqualTo("x");
    assertThat(translation.getDiagnostics()).isEmpty();
  }

  @Test
  public void testMap_setDomainUsesHull() throws Exception {
    final Translation translation = translate("var {1, 3, 5}: y;");
    final IntVar y = translation.getVariable("y").getVar();
    assertThat(MappingContext.lowerBound(y)).isEqualTo(1);
    assertThat(MappingContext.upperBound(y)).isEqualTo(5);
    assertThat(translation.getDiagnostics()).hasSize(1);
    assertThat(translation.getDiagnostics().get(0).getKind())
        .isEqualTo(Diagnostic.Kind.DOMAIN_HULL);
  }

  @Test
  public void testMap_unboundedUsesInferredBounds() throws Exception {
    final Translation translation = translate("var int: z; constraint int_le(z, 10);");
    final IntVar z = translation.getVariable("z").getVar();
    assertThat(MappingContext.lowerBound(z)).isEqualTo(-90);
    assertThat(MappingContext.upperBound(z)).isEqualTo(110);
    assertThat(translation.getDiagnostics().get(0).getKind())
        .isEqualTo(Diagnostic.Kind.DOMAIN_SUBSTITUTED);
  }

  @Test
  public void testMap_arrayReportsSubstitutionOnce() throws Exception {
    final Translation translation = translate("array [1..3] of var int: xs;");
    assertThat(translation.getArray("xs").getVars()).hasSize(3);
    assertThat(translation.getDiagnostics()).hasSize(1);
  }

  @Test
  public void testMap_bool() throws Exception {
    final Translation translation = translate("var bool: b;");
    assertThat(translation.getVariable("b").getKind()).isEqualTo(VarKind.BOOL);
    assertThat(MappingContext.upperBound(translation.getVariable("b").getVar())).isEqualTo(1);
  }

  @Test
  public void testMap_floatDomainIsScaled() throws Exception {
    final Translation translation = translate("var 0.5..2.25: f;");
    final IntVar f = translation.getVariable("f").getVar();
    assertThat(MappingContext.lowerBound(f)).isEqualTo(500);
    assertThat(MappingContext.upperBound(f)).isEqualTo(2250);
    assertThat(translation.decode(VarKind.FLOAT, 1250)).isEqualTo(1.25);
  }

  @Test
  public void testMap_definedVariable() throws Exception {
    final SolveOutcome outcome = SolveHelper.solveAll("var 1..3: x; var 0..10: y = x;");
    assertThat(SolveHelper.assignments(outcome, "x", "y"))
        .containsExactly(Arrays.asList(1L, 1L), Arrays.asList(2L, 2L), Arrays.asList(3L, 3L));
  }

  @Test
  public void testMap_arrayInitializerRestrictsElements() throws Exception {
    final SolveOutcome outcome =
        SolveHelper.solveAll("var 0..100: a; array [1..1] of var 1..3: arr = [a];");
    assertThat(outcome.getSolutions()).hasSize(3);
    assertThat(SolveHelper.assignments(outcome, "a"))
        .containsExactly(Arrays.asList(1L), Arrays.asList(2L), Arrays.asList(3L));
  }

  @Test
  public void testMap_parameterLengthMismatch() throws Exception {
    assertThrows(
        MapException.MismatchedArrayLengths.class,
        () -> translate("array [1..3] of int: a = [1, 2];"));
  }

  @Test
  public void testMap_duplicateName() throws Exception {
    final MapException.DuplicateSymbol e =
        assertThrows(
            MapException.DuplicateSymbol.class, () -> translate("var bool: b;\nvar bool: b;"));
    assertThat(e.getName()).isEqualTo("b");
    assertThat(e.getLocation().getLine()).isEqualTo(2);
  }

  @Test
  public void testMap_parameterWithoutValue() throws Exception {
    assertThrows(MapException.InvalidDomain.class, () -> translate("int: n;"));
  }

  @Test
  public void testMap_emptyDomain() throws Exception {
    assertThrows(MapException.InvalidDomain.class, () -> translate("var 5..1: x;"));
  }

  @Test
  public void testMap_setVariablesAreUnsupported() throws Exception {
    assertThrows(UnsupportedFeatureException.class, () -> translate("var set of 1..3: s;"));
  }

  @Test
  public void testMap_multiDimensionalArraysAreUnsupported() throws Exception {
    assertThrows(
        UnsupportedFeatureException.class,
        () -> translate("array [1..2, 1..2] of var 0..1: m;"));
  }
}
