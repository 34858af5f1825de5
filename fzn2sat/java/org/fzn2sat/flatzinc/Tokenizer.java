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
import com.google.common.collect.ImmutableMap;
import java.util.Map;

/** Splits FlatZinc source text into {@link Token}s. */
public final class Tokenizer {
  public Tokenizer(String input) {
    this.input = input;
  }

  /** Tokenizes the whole input. The returned list always ends with an EOF token. */
  public static ImmutableList<Token> tokenize(String input) {
    Tokenizer tokenizer = new Tokenizer(input);
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    while (true) {
      Token token = tokenizer.next();
      tokens.add(token);
      if (token.getKind() == Token.Kind.EOF) {
        return tokens.build();
      }
    }
  }

  /** Returns the next token, or an EOF token once the input is exhausted. */
  public Token next() {
    skipWhitespaceAndComments();
    Location location = here();
    if (position >= input.length()) {
      return new Token(Token.Kind.EOF, "", location);
    }
    char c = peek(0);
    if (Character.isLetter(c) || c == '_') {
      String word = readIdentifier();
      Token.Kind keyword = KEYWORDS.get(word);
      return new Token(keyword != null ? keyword : Token.Kind.IDENTIFIER, word, location);
    }
    if (Character.isDigit(c) || (c == '-' && Character.isDigit(peek(1)))) {
      return readNumber(location);
    }
    if (c == '"') {
      return new Token(Token.Kind.STRING_LITERAL, readString(location), location);
    }
    advance();
    switch (c) {
      case ':':
        if (peek(0) == ':') {
          advance();
          return new Token(Token.Kind.DOUBLE_COLON, "::", location);
        }
        return new Token(Token.Kind.COLON, ":", location);
      case '.':
        if (peek(0) == '.') {
          advance();
          return new Token(Token.Kind.DOUBLE_DOT, "..", location);
        }
        throw new LexException("unexpected '.'", location);
      case ';':
        return new Token(Token.Kind.SEMICOLON, ";", location);
      case ',':
        return new Token(Token.Kind.COMMA, ",", location);
      case '(':
        return new Token(Token.Kind.LEFT_PAREN, "(", location);
      case ')':
        return new Token(Token.Kind.RIGHT_PAREN, ")", location);
      case '[':
        return new Token(Token.Kind.LEFT_BRACKET, "[", location);
      case ']':
        return new Token(Token.Kind.RIGHT_BRACKET, "]", location);
      case '{':
        return new Token(Token.Kind.LEFT_BRACE, "{", location);
      case '}':
        return new Token(Token.Kind.RIGHT_BRACE, "}", location);
      case '=':
        return new Token(Token.Kind.EQUALS, "=", location);
      default:
        throw new LexException("unexpected character '" + c + "'", location);
    }
  }

  private void skipWhitespaceAndComments() {
    while (position < input.length()) {
      char c = peek(0);
      if (Character.isWhitespace(c)) {
        advance();
      } else if (c == '%') {
        while (position < input.length() && peek(0) != '\n') {
          advance();
        }
      } else if (c == '/' && peek(1) == '*') {
        Location start = here();
        advance();
        advance();
        while (!(peek(0) == '*' && peek(1) == '/')) {
          if (position >= input.length()) {
            throw new LexException("unterminated block comment", start);
          }
          advance();
        }
        advance();
        advance();
      } else {
        return;
      }
    }
  }

  private String readIdentifier() {
    int start = position;
    while (position < input.length()
        && (Character.isLetterOrDigit(peek(0)) || peek(0) == '_')) {
      advance();
    }
    return input.substring(start, position);
  }

  private Token readNumber(Location location) {
    int start = position;
    boolean isFloat = false;
    if (peek(0) == '-') {
      advance();
    }
    if (peek(0) == '0' && peek(1) == 'x') {
      advance();
      advance();
      while (Character.digit(peek(0), 16) >= 0) {
        advance();
      }
      return parseInteger(input.substring(start, position), location);
    }
    while (Character.isDigit(peek(0))) {
      advance();
    }
    // A '.' only belongs to the number when a digit follows, so "1..5" stays a range.
    if (peek(0) == '.' && Character.isDigit(peek(1))) {
      isFloat = true;
      advance();
      while (Character.isDigit(peek(0))) {
        advance();
      }
    }
    if (peek(0) == 'e' || peek(0) == 'E') {
      isFloat = true;
      advance();
      if (peek(0) == '+' || peek(0) == '-') {
        advance();
      }
      if (!Character.isDigit(peek(0))) {
        throw new LexException("malformed exponent in '" + input.substring(start, position)
            + "'", location);
      }
      while (Character.isDigit(peek(0))) {
        advance();
      }
    }
    String text = input.substring(start, position);
    if (isFloat) {
      return new Token(Token.Kind.FLOAT_LITERAL, text, location);
    }
    return parseInteger(text, location);
  }

  private static Token parseInteger(String text, Location location) {
    boolean negative = text.startsWith("-");
    String digits = negative ? text.substring(1) : text;
    long value;
    try {
      value = digits.startsWith("0x") ? Long.parseLong(digits.substring(2), 16)
                                      : Long.parseLong(digits);
    } catch (NumberFormatException e) {
      throw new LexException("integer literal out of range: " + text, location);
    }
    return new Token(Token.Kind.INT_LITERAL, Long.toString(negative ? -value : value), location);
  }

  private String readString(Location location) {
    advance();
    StringBuilder sb = new StringBuilder();
    while (true) {
      if (position >= input.length() || peek(0) == '\n') {
        throw new LexException("unterminated string literal", location);
      }
      char c = advance();
      if (c == '"') {
        return sb.toString();
      }
      if (c != '\\') {
        sb.append(c);
        continue;
      }
      char escaped = position < input.length() ? advance() : '\0';
      switch (escaped) {
        case 'n':
          sb.append('\n');
          break;
        case 't':
          sb.append('\t');
          break;
        case '\\':
        case '"':
          sb.append(escaped);
          break;
        default:
          throw new LexException("invalid escape sequence '\\" + escaped + "'", here());
      }
    }
  }

  private char peek(int offset) {
    int index = position + offset;
    return index < input.length() ? input.charAt(index) : '\0';
  }

  private char advance() {
    char c = input.charAt(position++);
    if (c == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    return c;
  }

  private Location here() {
    return new Location(line, column);
  }

  private static final Map<String, Token.Kind> KEYWORDS =
      ImmutableMap.<String, Token.Kind>builder()
          .put("predicate", Token.Kind.PREDICATE)
          .put("var", Token.Kind.VAR)
          .put("array", Token.Kind.ARRAY)
          .put("of", Token.Kind.OF)
          .put("constraint", Token.Kind.CONSTRAINT)
          .put("solve", Token.Kind.SOLVE)
          .put("satisfy", Token.Kind.SATISFY)
          .put("minimize", Token.Kind.MINIMIZE)
          .put("maximize", Token.Kind.MAXIMIZE)
          .put("int", Token.Kind.INT)
          .put("bool", Token.Kind.BOOL)
          .put("float", Token.Kind.FLOAT)
          .put("set", Token.Kind.SET)
          .put("true", Token.Kind.TRUE)
          .put("false", Token.Kind.FALSE)
          .build();

  private final String input;
  private int position = 0;
  private int line = 1;
  private int column = 1;
}
