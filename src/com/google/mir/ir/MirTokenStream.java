/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.mir.ir;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Splits textual MIR into tokens.
 *
 * <p>Identifiers include locals ({@code _3}) and block labels ({@code bb2}). Numbers are runs of
 * digits with an optional type suffix ({@code 5_i32}); the fractional part of a float literal
 * comes out as a separate number after a {@code .} token, which keeps {@code _1.0.1} a chain of
 * field steps.
 */
final class MirTokenStream {

  enum TokenType {
    IDENT,
    NUMBER,
    PUNCT,
    EOF
  }

  /** A token with the position of its first character. Lines and columns are 1-based. */
  static final class Token {
    final TokenType type;
    final String text;
    final int line;
    final int column;

    Token(TokenType type, String text, int line, int column) {
      this.type = type;
      this.text = text;
      this.line = line;
      this.column = column;
    }

    boolean is(String s) {
      return type != TokenType.EOF && text.equals(s);
    }

    @Override
    public String toString() {
      return type == TokenType.EOF ? "end of input" : "'" + text + "'";
    }
  }

  private static final String[] TWO_CHAR_PUNCT = {"->", "=>", "<-", "::"};
  private static final String ONE_CHAR_PUNCT = "{}()[],;:.=&*!-<>";

  private final String sourceName;
  private final String input;
  private int pos = 0;
  private int line = 1;
  private int column = 1;

  MirTokenStream(String sourceName, String input) {
    this.sourceName = checkNotNull(sourceName);
    this.input = checkNotNull(input);
  }

  String getSourceName() {
    return sourceName;
  }

  Token next() {
    skipWhitespaceAndComments();
    int startLine = line;
    int startColumn = column;
    if (pos >= input.length()) {
      return new Token(TokenType.EOF, "", startLine, startColumn);
    }
    char c = input.charAt(pos);
    if (isIdentifierStart(c)) {
      int start = pos;
      while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
        advance();
      }
      return new Token(TokenType.IDENT, input.substring(start, pos), startLine, startColumn);
    }
    if (isDigit(c)) {
      int start = pos;
      while (pos < input.length() && isDigit(input.charAt(pos))) {
        advance();
      }
      if (pos + 1 < input.length()
          && input.charAt(pos) == '_'
          && Character.isLetter(input.charAt(pos + 1))) {
        advance();
        while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
          advance();
        }
      }
      return new Token(TokenType.NUMBER, input.substring(start, pos), startLine, startColumn);
    }
    for (String punct : TWO_CHAR_PUNCT) {
      if (input.startsWith(punct, pos)) {
        advance();
        advance();
        return new Token(TokenType.PUNCT, punct, startLine, startColumn);
      }
    }
    if (ONE_CHAR_PUNCT.indexOf(c) >= 0) {
      advance();
      return new Token(TokenType.PUNCT, String.valueOf(c), startLine, startColumn);
    }
    throw new MirSyntaxException(
        "unexpected character '" + c + "'", sourceName, startLine, startColumn);
  }

  private void skipWhitespaceAndComments() {
    while (pos < input.length()) {
      char c = input.charAt(pos);
      if (Character.isWhitespace(c)) {
        advance();
      } else if (input.startsWith("//", pos)) {
        while (pos < input.length() && input.charAt(pos) != '\n') {
          advance();
        }
      } else {
        return;
      }
    }
  }

  private void advance() {
    if (input.charAt(pos) == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    pos++;
  }

  private static boolean isIdentifierStart(char c) {
    return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  private static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || isDigit(c);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
