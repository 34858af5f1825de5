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

/** One lexical token of a FlatZinc source. */
public final class Token {
  /** Token categories. Keywords are recognized by the tokenizer, not by the parser. */
  public enum Kind {
    PREDICATE("predicate"),
    VAR("var"),
    ARRAY("array"),
    OF("of"),
    CONSTRAINT("constraint"),
    SOLVE("solve"),
    SATISFY("satisfy"),
    MINIMIZE("minimize"),
    MAXIMIZE("maximize"),
    INT("int"),
    BOOL("bool"),
    FLOAT("float"),
    SET("set"),
    TRUE("true"),
    FALSE("false"),
    IDENTIFIER("identifier"),
    INT_LITERAL("integer literal"),
    FLOAT_LITERAL("float literal"),
    STRING_LITERAL("string literal"),
    DOUBLE_COLON("'::'"),
    COLON("':'"),
    SEMICOLON("';'"),
    COMMA("','"),
    DOUBLE_DOT("'..'"),
    LEFT_PAREN("'('"),
    RIGHT_PAREN("')'"),
    LEFT_BRACKET("'['"),
    RIGHT_BRACKET("']'"),
    LEFT_BRACE("'{'"),
    RIGHT_BRACE("'}'"),
    EQUALS("'='"),
    EOF("end of input");

    Kind(String display) {
      this.display = display;
    }

    public String display() {
      return display;
    }

    private final String display;
  }

  Token(Kind kind, String text, Location location) {
    this.kind = kind;
    this.text = text;
    this.location = location;
  }

  public Kind getKind() {
    return kind;
  }

  /** Source text for identifiers and literals; the decoded value for strings. */
  public String getText() {
    return text;
  }

  public Location getLocation() {
    return location;
  }

  public long intValue() {
    return Long.parseLong(text);
  }

  public double floatValue() {
    return Double.parseDouble(text);
  }

  String describe() {
    switch (kind) {
      case IDENTIFIER:
      case INT_LITERAL:
      case FLOAT_LITERAL:
        return kind.display() + " '" + text + "'";
      default:
        return kind.display();
    }
  }

  @Override
  public String toString() {
    return kind + "(" + text + ")@" + location;
  }

  private final Kind kind;
  private final String text;
  private final Location location;
}
