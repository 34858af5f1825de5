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

import org.fzn2sat.flatzinc.FlatZincModel;
import org.junit.jupiter.api.Test;

/** Tests the integer bound inference pass. */
public final class BoundInferenceTest {
  private static InferredBounds infer(String source, long maxDomainSize) {
    return BoundInference.infer(FlatZincModel.parse(source), maxDomainSize);
  }

  @Test
  public void testInfer_widensObservedHull() throws Exception {
    final InferredBounds bounds =
        infer("var 1..10: x; constraint int_le(x, 50);", TranslatorOptions.DEFAULT_MAX_DOMAIN_SIZE);
    assertThat(bounds.isObserved()).isTrue();
    assertThat(bounds.getLo()).isEqualTo(1 - 100);
    assertThat(bounds.getHi()).isEqualTo(50 + 100);
  }

  @Test
  public void testInfer_expansionFollowsSpan() throws Exception {
    final InferredBounds bounds =
        infer("var -200..300: x;", TranslatorOptions.DEFAULT_MAX_DOMAIN_SIZE);
    assertThat(bounds.getLo()).isEqualTo(-700);
    assertThat(bounds.getHi()).isEqualTo(800);
    assertThat(bounds.contains(0)).isTrue();
    assertThat(bounds.contains(801)).isFalse();
  }

  @Test
  public void testInfer_clampedToMaxDomainSize() throws Exception {
    final InferredBounds bounds = infer("var 0..10: x; constraint int_le(x, 400);", 1000);
    assertThat(bounds.getLo()).isEqualTo(-400);
    assertThat(bounds.getHi()).isEqualTo(500);
  }

  @Test
  public void testInfer_noIntegerData() throws Exception {
    final InferredBounds bounds = infer("var int: x; solve satisfy;", 1000);
    assertThat(bounds.isObserved()).isFalse();
    assertThat(bounds.getLo()).isEqualTo(-500);
    assertThat(bounds.getHi()).isEqualTo(500);
  }

  @Test
  public void testInfer_oversizedDomainIsIgnored() throws Exception {
    final InferredBounds bounds = infer("var 0..100000: x;", 1000);
    assertThat(bounds.isObserved()).isFalse();
  }

  @Test
  public void testInfer_literalsInArraysAndObjective() throws Exception {
    final InferredBounds bounds =
        infer(
            "array [1..2] of int: c = [-3, 7];\nvar int: x;\nsolve minimize x;",
            TranslatorOptions.DEFAULT_MAX_DOMAIN_SIZE);
    assertThat(bounds.getLo()).isEqualTo(-103);
    assertThat(bounds.getHi()).isEqualTo(107);
  }

  @Test
  public void testDomainSize_saturates() throws Exception {
    assertThat(BoundInference.domainSize(1, 10)).isEqualTo(10);
    assertThat(BoundInference.domainSize(Long.MIN_VALUE, Long.MAX_VALUE))
        .isEqualTo(Long.MAX_VALUE);
  }
}
