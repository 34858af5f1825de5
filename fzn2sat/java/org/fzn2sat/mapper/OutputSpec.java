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

import com.google.common.collect.ImmutableList;
import com.google.ortools.sat.IntVar;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.fzn2sat.flatzinc.Annotation;
import org.fzn2sat.flatzinc.Expr;
import org.fzn2sat.flatzinc.VarDecl;

/**
 * The variables a solution prints, in declaration order. Built from the {@code output_var} and
 * {@code output_array} annotations, or from every variable when the model has none.
 */
public final class OutputSpec {
  /** One printed scalar or array. */
  public static final class Entry {
    Entry(String name, VarKind kind, List<IntVar> vars, List<long[]> dimensions) {
      this.name = name;
      this.kind = kind;
      this.vars = ImmutableList.copyOf(vars);
      this.dimensions = dimensions == null ? null : ImmutableList.copyOf(dimensions);
    }

    public String getName() {
      return name;
    }

    public VarKind getKind() {
      return kind;
    }

    public ImmutableList<IntVar> getVars() {
      return vars;
    }

    public boolean isArray() {
      return dimensions != null;
    }

    /** Index ranges as {@code {lo, hi}} pairs, one per dimension; null for scalars. */
    public ImmutableList<long[]> getDimensions() {
      return dimensions;
    }

    private final String name;
    private final VarKind kind;
    private final ImmutableList<IntVar> vars;
    private final ImmutableList<long[]> dimensions;
  }

  OutputSpec(List<Entry> entries) {
    this.entries = ImmutableList.copyOf(entries);
  }

  public ImmutableList<Entry> getEntries() {
    return entries;
  }

  /** Collects the output entries of {@code declarations}, which must already be mapped. */
  static OutputSpec build(List<VarDecl> declarations, MappingContext context,
      ExpressionEvaluator evaluator) {
    List<Entry> entries = new ArrayList<>();
    boolean annotated = false;
    for (VarDecl decl : declarations) {
      if (decl.hasAnnotation("output_var")) {
        annotated = true;
        MappingContext.Scalar scalar = evaluator.resolveScalar(new Expr.Ident(decl.getName(),
            decl.getLocation()));
        entries.add(new Entry(decl.getName(), DeclarationMapper.kindOf(decl.getType()),
            ImmutableList.of(scalar.getVar()), null));
      }
      Annotation outputArray = Annotation.find(decl.getAnnotations(), "output_array");
      if (outputArray != null) {
        annotated = true;
        List<long[]> dimensions = dimensions(outputArray);
        List<MappingContext.Scalar> elements = evaluator.resolveElements(
            new Expr.Ident(decl.getName(), decl.getLocation()),
            DeclarationMapper.kindOf(decl.getType()));
        List<IntVar> vars = new ArrayList<>();
        for (MappingContext.Scalar element : elements) {
          vars.add(element.getVar());
        }
        long size = 1;
        for (long[] dimension : dimensions) {
          size *= Math.max(0, dimension[1] - dimension[0] + 1);
        }
        if (size != vars.size()) {
          throw new MapException("output_array of '" + decl.getName() + "' describes " + size
              + " elements but the array has " + vars.size(), outputArray.getLocation());
        }
        entries.add(new Entry(decl.getName(), DeclarationMapper.kindOf(decl.getType()), vars,
            dimensions));
      }
    }
    if (annotated) {
      return new OutputSpec(entries);
    }
    return everything(declarations, context);
  }

  private static OutputSpec everything(List<VarDecl> declarations, MappingContext context) {
    List<Entry> entries = new ArrayList<>();
    Map<String, MappingContext.Scalar> scalars = context.getScalars();
    Map<String, MappingContext.Array> arrays = context.getArrays();
    for (VarDecl decl : declarations) {
      MappingContext.Scalar scalar = scalars.get(decl.getName());
      if (scalar != null) {
        entries.add(new Entry(decl.getName(), scalar.getKind(),
            ImmutableList.of(scalar.getVar()), null));
        continue;
      }
      MappingContext.Array array = arrays.get(decl.getName());
      if (array != null) {
        List<long[]> dimensions = new ArrayList<>();
        dimensions.add(new long[] {1, array.getVars().size()});
        entries.add(new Entry(decl.getName(), array.getKind(), array.getVars(), dimensions));
      }
    }
    return new OutputSpec(entries);
  }

  private static List<long[]> dimensions(Annotation annotation) {
    List<long[]> dimensions = new ArrayList<>();
    if (annotation.getArgs().size() != 1
        || annotation.getArgs().get(0).getKind() != Expr.Kind.ARRAY_LIT) {
      throw new MapException("output_array expects a list of index ranges",
          annotation.getLocation());
    }
    for (Expr range : ((Expr.ArrayLit) annotation.getArgs().get(0)).getElements()) {
      if (range.getKind() != Expr.Kind.RANGE) {
        throw MapException.unsupportedExpression(range, "an index range");
      }
      dimensions.add(new long[] {((Expr.Range) range).getLo(), ((Expr.Range) range).getHi()});
    }
    return dimensions;
  }

  private final ImmutableList<Entry> entries;
}
