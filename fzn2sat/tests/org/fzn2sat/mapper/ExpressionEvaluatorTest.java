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

import com.google.common.collect.ImmutableList;
import com.google.ortools.Loader;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.IntVar;
import com.google.ortools.util.Domain;
import java.util.List;
import org.fzn2sat.flatzinc.Expr;
import org.fzn2sat.flatzinc.Location;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests expression resolution against a hand-built mapping context. */
public final class ExpressionEvaluatorTest {
  private static final Location LOCATION = new Location(1, 1);

  private CpModel model;
  private MappingContext context;
  private ExpressionEvaluator evaluator;

  @BeforeEach
  public void setUp() {
    Loader.loadNativeLibraries();
    model = new CpModel();
    context = new MappingContext(
        model, TranslatorOptions.defaults(), new InferredBounds(-100, 100, true));
    evaluator = new ExpressionEvaluator(context);
    context.defineIntParamArray("a", new long[] {10, 20, 30}, LOCATION);
    context.defineIntParam("k", 2, LOCATION);
    context.defineScalar("x", VarKind.INT, model.newIntVar(0, 5, "x"), LOCATION);
  }

  private static Expr.ArrayAccess access(String array, Expr index) {
    return new Expr.ArrayAccess(array, index, LOCATION);
  }

  private static Expr.IntLit lit(long value) {
    return new Expr.IntLit(value, LOCATION);
  }

  private static Expr.Ident ident(String name) {
    return new Expr.Ident(name, LOCATION);
  }

  @Test
  public void testResolveInt_oneBasedAccess() throws Exception {
    assertThat(MappingContext.fixedValue(evaluator.resolveInt(access("a", lit(1)))))
        .isEqualTo(10L);
    assertThat(MappingContext.fixedValue(evaluator.resolveInt(access("a", lit(3)))))
        .isEqualTo(30L);
    assertThat(evaluator.extractInt(access("a", ident("k")))).isEqualTo(20);
  }

  @Test
  public void testResolveInt_indexOutOfRange() throws Exception {
    final MapException.IndexOutOfRange low =
        assertThrows(
            MapException.IndexOutOfRange.class, () -> evaluator.resolveInt(access("a", lit(0))));
    assertThat(low.getIndex()).isEqualTo(0);
    assertThat(low.getSize()).isEqualTo(3);
    final MapException.IndexOutOfRange high =
        assertThrows(
            MapException.IndexOutOfRange.class, () -> evaluator.resolveInt(access("a", lit(4))));
    assertThat(high.getMessage()).isEqualTo("index 4 out of range 1..3 for array 'a'");
  }

  @Test
  public void testResolveInt_nonLiteralIndex() throws Exception {
    final MapException.NonLiteralIndex e =
        assertThrows(
            MapException.NonLiteralIndex.class,
            () -> evaluator.resolveInt(access("a", ident("x"))));
    assertThat(e.getArray()).isEqualTo("a");
  }

  @Test
  public void testResolveInt_unknownSymbol() throws Exception {
    final MapException.UnknownSymbol e =
        assertThrows(MapException.UnknownSymbol.class, () -> evaluator.resolveInt(ident("nope")));
    assertThat(e.getName()).isEqualTo("nope");
  }

  @Test
  public void testResolveInt_arrayUsedAsScalar() throws Exception {
    assertThrows(MapException.UnsupportedExpression.class, () -> evaluator.resolveInt(ident("a")));
  }

  @Test
  public void testResolveInt_floatLiteralIsATypeMismatch() throws Exception {
    assertThrows(
        MapException.TypeMismatch.class,
        () -> evaluator.resolveInt(new Expr.FloatLit(1.5, LOCATION)));
  }

  @Test
  public void testResolveInt_variableIsShared() throws Exception {
    assertThat(evaluator.resolveInt(ident("x"))).isSameInstanceAs(context.getScalar("x").getVar());
  }

  @Test
  public void testResolveFloat_encodesIntegerLiteral() throws Exception {
    final IntVar encoded = evaluator.resolveFloat(lit(2));
    assertThat(MappingContext.fixedValue(encoded)).isEqualTo(2000L);
    final IntVar quarter = evaluator.resolveFloat(new Expr.FloatLit(0.25, LOCATION));
    assertThat(MappingContext.fixedValue(quarter)).isEqualTo(250L);
  }

  @Test
  public void testResolveIntArray_rangesAndParameters() throws Exception {
    final Expr array =
        new Expr.ArrayLit(
            ImmutableList.<Expr>of(new Expr.Range(1, 3, LOCATION), ident("k"), ident("x")),
            LOCATION);
    final List<IntVar> vars = evaluator.resolveIntArray(array);
    assertThat(vars).hasSize(5);
    assertThat(MappingContext.fixedValue(vars.get(2))).isEqualTo(3L);
    assertThat(MappingContext.fixedValue(vars.get(3))).isEqualTo(2L);
    assertThat(vars.get(4)).isSameInstanceAs(context.getScalar("x").getVar());
    assertThat(evaluator.arrayLength(array)).isEqualTo(5);
  }

  @Test
  public void testResolveIntArray_setElementsAreUnsupported() throws Exception {
    final Expr array =
        new Expr.ArrayLit(
            ImmutableList.<Expr>of(new Expr.SetLit(ImmutableList.<Expr>of(lit(1)), LOCATION)),
            LOCATION);
    assertThrows(UnsupportedFeatureException.class, () -> evaluator.resolveIntArray(array));
  }

  @Test
  public void testExtractIntArray_parameterArray() throws Exception {
    assertThat(evaluator.extractIntArray(ident("a"))).asList().containsExactly(10L, 20L, 30L);
    assertThat(evaluator.isConstantIntArray(ident("a"))).isTrue();
    assertThat(evaluator.isConstantIntArray(
            new Expr.ArrayLit(ImmutableList.<Expr>of(ident("x")), LOCATION)))
        .isFalse();
  }

  @Test
  public void testExtractSet() throws Exception {
    assertThat(evaluator.extractSet(new Expr.Range(2, 4, LOCATION)).flattenedIntervals())
        .asList()
        .containsExactly(2L, 4L)
        .inOrder();
    final Expr set =
        new Expr.SetLit(
            ImmutableList.<Expr>of(lit(9), new Expr.Range(1, 2, LOCATION), ident("k")),
            LOCATION);
    assertThat(evaluator.extractSet(set).flattenedIntervals())
        .asList()
        .containsExactly(1L, 2L, 9L, 9L)
        .inOrder();
    assertThat(evaluator.extractSet(new Expr.Range(3, 1, LOCATION)).isEmpty()).isTrue();
  }

  @Test
  public void testExtractSet_wideRangeStaysAnInterval() throws Exception {
    final long hi = 1L << 40;
    final Domain set = evaluator.extractSet(new Expr.Range(1, hi, LOCATION));
    assertThat(set.size()).isEqualTo(hi);
    assertThat(set.flattenedIntervals()).asList().containsExactly(1L, hi).inOrder();
  }

  @Test
  public void testExtractInt_variableIsNotConstant() throws Exception {
    assertThat(evaluator.isConstantInt(ident("x"))).isFalse();
    assertThrows(MapException.class, () -> evaluator.extractInt(ident("x")));
  }
}
