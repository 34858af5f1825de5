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

package org.fzn2sat.flatzinc;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.List;

/**
 * The declared type of a FlatZinc variable or parameter: base type, optional domain, whether it is
 * a decision variable, and the index sets when it is an array.
 */
public final class Type {
  /** Base scalar types. */
  public enum Base {
    BOOL,
    INT,
    FLOAT,
    SET_OF_INT
  }

  /** A domain restriction written in the type: {@code 1..10}, {@code {1,3}} or {@code 0.0..1.0}. */
  public static final class DomainSpec {
    /** Domain shapes. */
    public enum Kind {
      INT_RANGE,
      INT_SET,
      FLOAT_RANGE
    }

    public static DomainSpec intRange(long lo, long hi) {
      return new DomainSpec(Kind.INT_RANGE, lo, hi, 0, 0, ImmutableSortedSet.<Long>of());
    }

    public static DomainSpec intSet(List<Long> values) {
      ImmutableSortedSet<Long> sorted = ImmutableSortedSet.copyOf(values);
      long lo = sorted.isEmpty() ? 1 : sorted.first();
      long hi = sorted.isEmpty() ? 0 : sorted.last();
      return new DomainSpec(Kind.INT_SET, lo, hi, 0, 0, sorted);
    }

    public static DomainSpec floatRange(double lo, double hi) {
      return new DomainSpec(Kind.FLOAT_RANGE, 0, 0, lo, hi, ImmutableSortedSet.<Long>of());
    }

    private DomainSpec(Kind kind, long intLo, long intHi, double floatLo, double floatHi,
        ImmutableSortedSet<Long> values) {
      this.kind = kind;
      this.intLo = intLo;
      this.intHi = intHi;
      this.floatLo = floatLo;
      this.floatHi = floatHi;
      this.values = values;
    }

    public Kind getKind() {
      return kind;
    }

    /** Lower bound of an integer range, or the smallest member of an integer set. */
    public long getIntLo() {
      return intLo;
    }

    /** Upper bound of an integer range, or the largest member of an integer set. */
    public long getIntHi() {
      return intHi;
    }

    public double getFloatLo() {
      return floatLo;
    }

    public double getFloatHi() {
      return floatHi;
    }

    /** Members of an integer set domain, sorted. Empty for ranges. */
    public ImmutableSortedSet<Long> getValues() {
      return values;
    }

    public boolean isInt() {
      return kind != Kind.FLOAT_RANGE;
    }

    /** True when the domain admits no value at all. */
    public boolean isEmpty() {
      switch (kind) {
        case INT_RANGE:
          return intLo > intHi;
        case INT_SET:
          return values.isEmpty();
        default:
          return floatLo > floatHi;
      }
    }

    @Override
    public String toString() {
      switch (kind) {
        case INT_RANGE:
          return intLo + ".." + intHi;
        case INT_SET:
          return "{" + Joiner.on(',').join(values) + "}";
        default:
          return floatLo + ".." + floatHi;
      }
    }

    private final Kind kind;
    private final long intLo;
    private final long intHi;
    private final double floatLo;
    private final double floatHi;
    private final ImmutableSortedSet<Long> values;
  }

  /** One array dimension: either {@code lo..hi} or the unbounded {@code int}. */
  public static final class IndexSet {
    public static IndexSet range(long lo, long hi) {
      return new IndexSet(lo, hi, true);
    }

    public static IndexSet unbounded() {
      return new IndexSet(1, 0, false);
    }

    private IndexSet(long lo, long hi, boolean bounded) {
      this.lo = lo;
      this.hi = hi;
      this.bounded = bounded;
    }

    public long getLo() {
      return lo;
    }

    public long getHi() {
      return hi;
    }

    public boolean isBounded() {
      return bounded;
    }

    public long size() {
      return bounded ? Math.max(0, hi - lo + 1) : -1;
    }

    @Override
    public String toString() {
      return bounded ? lo + ".." + hi : "int";
    }

    private final long lo;
    private final long hi;
    private final boolean bounded;
  }

  public static Type scalar(Base base, boolean isVar, DomainSpec domain) {
    return new Type(base, isVar, domain, ImmutableList.<IndexSet>of());
  }

  public static Type array(List<IndexSet> indexSets, Type element) {
    return new Type(element.base, element.isVar, element.domain, ImmutableList.copyOf(indexSets));
  }

  private Type(Base base, boolean isVar, DomainSpec domain, ImmutableList<IndexSet> indexSets) {
    this.base = base;
    this.isVar = isVar;
    this.domain = domain;
    this.indexSets = indexSets;
  }

  public Base getBase() {
    return base;
  }

  /** True for decision variables, false for parameters. */
  public boolean isVar() {
    return isVar;
  }

  /** Returns the domain restriction, or null when the type is unrestricted. */
  public DomainSpec getDomain() {
    return domain;
  }

  public boolean isArray() {
    return !indexSets.isEmpty();
  }

  public ImmutableList<IndexSet> getIndexSets() {
    return indexSets;
  }

  /** Returns the same type with the array dimensions removed. */
  public Type elementType() {
    return isArray() ? scalar(base, isVar, domain) : this;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (isArray()) {
      sb.append("array [").append(Joiner.on(", ").join(indexSets)).append("] of ");
    }
    if (isVar) {
      sb.append("var ");
    }
    if (base == Base.SET_OF_INT) {
      sb.append("set of ");
    }
    if (domain != null) {
      sb.append(domain);
    } else {
      sb.append(base == Base.SET_OF_INT ? "int" : base.name().toLowerCase());
    }
    return sb.toString();
  }

  private final Base base;
  private final boolean isVar;
  private final DomainSpec domain;
  private final ImmutableList<IndexSet> indexSets;
}
