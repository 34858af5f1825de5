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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/** Recursive-descent parser producing a {@link FlatZincModel} from a token list. */
public final class Parser {
  public Parser(List<Token> tokens) {
    if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getKind() != Token.Kind.EOF) {
      throw new IllegalArgumentException("token list must end with EOF");
    }
    this.tokens = ImmutableList.copyOf(tokens);
  }

  /** Parses the whole token list. */
  public FlatZincModel parseModel() {
    List<PredicateDecl> predicates = new ArrayList<>();
    List<VarDecl> declarations = new ArrayList<>();
    List<ConstraintItem> constraints = new ArrayList<>();
    SolveItem solve = null;
    while (peek() != Token.Kind.EOF) {
      switch (peek()) {
        case PREDICATE:
          predicates.add(parsePredicate());
          break;
        case CONSTRAINT:
          constraints.add(parseConstraint());
          break;
        case SOLVE:
          if (solve != null) {
            throw new ParseException("duplicate solve item", current().getLocation());
          }
          solve = parseSolve();
          break;
        case VAR:
        case ARRAY:
        case BOOL:
        case INT:
        case FLOAT:
        case SET:
        case INT_LITERAL:
        case FLOAT_LITERAL:
        case LEFT_BRACE:
          declarations.add(parseVarDecl());
          break;
        default:
          throw ParseException.expected("a model item", current());
      }
    }
    return new FlatZincModel(predicates, declarations, constraints,
        solve == null ? SolveItem.satisfy() : solve);
  }

  private PredicateDecl parsePredicate() {
    Location location = expect(Token.Kind.PREDICATE).getLocation();
    String name = expect(Token.Kind.IDENTIFIER).getText();
    expect(Token.Kind.LEFT_PAREN);
    int paramCount = 0;
    if (peek() != Token.Kind.RIGHT_PAREN) {
      do {
        parseType();
        expect(Token.Kind.COLON);
        expect(Token.Kind.IDENTIFIER);
        paramCount++;
      } while (accept(Token.Kind.COMMA));
    }
    expect(Token.Kind.RIGHT_PAREN);
    expect(Token.Kind.SEMICOLON);
    return new PredicateDecl(name, paramCount, location);
  }

  private VarDecl parseVarDecl() {
    Location location = current().getLocation();
    Type type = parseType();
    expect(Token.Kind.COLON);
    String name = expect(Token.Kind.IDENTIFIER).getText();
    List<Annotation> annotations = parseAnnotations();
    Expr init = null;
    if (accept(Token.Kind.EQUALS)) {
      init = parseExpr();
    }
    expect(Token.Kind.SEMICOLON);
    return new VarDecl(type, name, annotations, init, location);
  }

  Type parseType() {
    if (accept(Token.Kind.ARRAY)) {
      expect(Token.Kind.LEFT_BRACKET);
      List<Type.IndexSet> indexSets = new ArrayList<>();
      do {
        indexSets.add(parseIndexSet());
      } while (accept(Token.Kind.COMMA));
      expect(Token.Kind.RIGHT_BRACKET);
      expect(Token.Kind.OF);
      return Type.array(indexSets, parseScalarType());
    }
    return parseScalarType();
  }

  private Type.IndexSet parseIndexSet() {
    if (accept(Token.Kind.INT)) {
      return Type.IndexSet.unbounded();
    }
    long first = expect(Token.Kind.INT_LITERAL).intValue();
    if (accept(Token.Kind.DOUBLE_DOT)) {
      return Type.IndexSet.range(first, expect(Token.Kind.INT_LITERAL).intValue());
    }
    return Type.IndexSet.range(1, first);
  }

  private Type parseScalarType() {
    boolean isVar = accept(Token.Kind.VAR);
    Token token = current();
    switch (token.getKind()) {
      case BOOL:
        advance();
        return Type.scalar(Type.Base.BOOL, isVar, null);
      case INT:
        advance();
        return Type.scalar(Type.Base.INT, isVar, null);
      case FLOAT:
        advance();
        return Type.scalar(Type.Base.FLOAT, isVar, null);
      case INT_LITERAL:
      case LEFT_BRACE:
        return Type.scalar(Type.Base.INT, isVar, parseIntDomain());
      case FLOAT_LITERAL:
        {
          double lo = advance().floatValue();
          expect(Token.Kind.DOUBLE_DOT);
          double hi = expectNumber().floatValue();
          return Type.scalar(Type.Base.FLOAT, isVar, Type.DomainSpec.floatRange(lo, hi));
        }
      case SET:
        {
          advance();
          expect(Token.Kind.OF);
          Type.DomainSpec universe = accept(Token.Kind.INT) ? null : parseIntDomain();
          return Type.scalar(Type.Base.SET_OF_INT, isVar, universe);
        }
      default:
        throw ParseException.expected("a type", token);
    }
  }

  private Type.DomainSpec parseIntDomain() {
    if (accept(Token.Kind.LEFT_BRACE)) {
      List<Long> values = new ArrayList<>();
      if (peek() != Token.Kind.RIGHT_BRACE) {
        do {
          values.add(expect(Token.Kind.INT_LITERAL).intValue());
        } while (accept(Token.Kind.COMMA));
      }
      expect(Token.Kind.RIGHT_BRACE);
      return Type.DomainSpec.intSet(values);
    }
    Token lo = expect(Token.Kind.INT_LITERAL);
    expect(Token.Kind.DOUBLE_DOT);
    if (peek() == Token.Kind.FLOAT_LITERAL) {
      // "0..1.5" is a float range written with an integer lower bound.
      return Type.DomainSpec.floatRange(lo.intValue(), advance().floatValue());
    }
    return Type.DomainSpec.intRange(lo.intValue(), expect(Token.Kind.INT_LITERAL).intValue());
  }

  private ConstraintItem parseConstraint() {
    Location location = expect(Token.Kind.CONSTRAINT).getLocation();
    String predicate = expect(Token.Kind.IDENTIFIER).getText();
    expect(Token.Kind.LEFT_PAREN);
    List<Expr> args = parseExprList(Token.Kind.RIGHT_PAREN);
    expect(Token.Kind.RIGHT_PAREN);
    List<Annotation> annotations = parseAnnotations();
    expect(Token.Kind.SEMICOLON);
    return new ConstraintItem(predicate, args, annotations, location);
  }

  private SolveItem parseSolve() {
    Location location = expect(Token.Kind.SOLVE).getLocation();
    List<Annotation> annotations = parseAnnotations();
    SolveItem.Goal goal;
    Expr objective = null;
    if (accept(Token.Kind.SATISFY)) {
      goal = SolveItem.Goal.SATISFY;
    } else if (accept(Token.Kind.MINIMIZE)) {
      goal = SolveItem.Goal.MINIMIZE;
      objective = parseExpr();
    } else if (accept(Token.Kind.MAXIMIZE)) {
      goal = SolveItem.Goal.MAXIMIZE;
      objective = parseExpr();
    } else {
      throw ParseException.expected("satisfy, minimize or maximize", current());
    }
    expect(Token.Kind.SEMICOLON);
    return new SolveItem(goal, objective, annotations, location);
  }

  private List<Annotation> parseAnnotations() {
    List<Annotation> annotations = new ArrayList<>();
    while (accept(Token.Kind.DOUBLE_COLON)) {
      Token name = expect(Token.Kind.IDENTIFIER);
      List<Expr> args = ImmutableList.of();
      if (accept(Token.Kind.LEFT_PAREN)) {
        args = parseExprList(Token.Kind.RIGHT_PAREN);
        expect(Token.Kind.RIGHT_PAREN);
      }
      annotations.add(new Annotation(name.getText(), args, name.getLocation()));
    }
    return annotations;
  }

  private List<Expr> parseExprList(Token.Kind closing) {
    List<Expr> exprs = new ArrayList<>();
    if (peek() == closing) {
      return exprs;
    }
    do {
      // Trailing commas are accepted.
      if (peek() == closing) {
        break;
      }
      exprs.add(parseExpr());
    } while (accept(Token.Kind.COMMA));
    return exprs;
  }

  Expr parseExpr() {
    Token token = current();
    Location location = token.getLocation();
    switch (token.getKind()) {
      case TRUE:
        advance();
        return new Expr.BoolLit(true, location);
      case FALSE:
        advance();
        return new Expr.BoolLit(false, location);
      case INT_LITERAL:
        {
          long value = advance().intValue();
          if (accept(Token.Kind.DOUBLE_DOT)) {
            return new Expr.Range(value, expect(Token.Kind.INT_LITERAL).intValue(), location);
          }
          return new Expr.IntLit(value, location);
        }
      case FLOAT_LITERAL:
        {
          double value = advance().floatValue();
          if (peek() == Token.Kind.DOUBLE_DOT) {
            throw new ParseException("float ranges are not supported in expressions", location);
          }
          return new Expr.FloatLit(value, location);
        }
      case STRING_LITERAL:
        advance();
        return new Expr.StringLit(token.getText(), location);
      case LEFT_BRACKET:
        {
          advance();
          List<Expr> elements = parseExprList(Token.Kind.RIGHT_BRACKET);
          expect(Token.Kind.RIGHT_BRACKET);
          return new Expr.ArrayLit(elements, location);
        }
      case LEFT_BRACE:
        {
          advance();
          List<Expr> elements = parseExprList(Token.Kind.RIGHT_BRACE);
          expect(Token.Kind.RIGHT_BRACE);
          return new Expr.SetLit(elements, location);
        }
      case IDENTIFIER:
        {
          String name = advance().getText();
          if (accept(Token.Kind.LEFT_BRACKET)) {
            Expr index = parseExpr();
            expect(Token.Kind.RIGHT_BRACKET);
            return new Expr.ArrayAccess(name, index, location);
          }
          if (accept(Token.Kind.LEFT_PAREN)) {
            List<Expr> args = parseExprList(Token.Kind.RIGHT_PAREN);
            expect(Token.Kind.RIGHT_PAREN);
            return new Expr.Call(name, args, location);
          }
          return new Expr.Ident(name, location);
        }
      default:
        throw ParseException.expected("an expression", token);
    }
  }

  private Token current() {
    return tokens.get(position);
  }

  private Token.Kind peek() {
    return current().getKind();
  }

  private Token advance() {
    Token token = current();
    if (token.getKind() != Token.Kind.EOF) {
      position++;
    }
    return token;
  }

  private boolean accept(Token.Kind kind) {
    if (peek() == kind) {
      advance();
      return true;
    }
    return false;
  }

  private Token expect(Token.Kind kind) {
    if (peek() != kind) {
      throw ParseException.expected(kind.display(), current());
    }
    return advance();
  }

  private Token expectNumber() {
    if (peek() != Token.Kind.FLOAT_LITERAL && peek() != Token.Kind.INT_LITERAL) {
      throw ParseException.expected("a number", current());
    }
    return advance();
  }

  private final ImmutableList<Token> tokens;
  private int position = 0;
}
