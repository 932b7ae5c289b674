/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.calx.parse;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.calx.ast.Pos;

/** Splits expression text into tokens. */
class Tokenizer {
  /** Operators, longest first, so that "<=" is preferred to "<". */
  private static final List<String> OPERATORS =
      ImmutableList.of("??", "||", "&&", "==", "!=", "<=", ">=", "<<", ">>",
          "~/", "<", ">", "+", "-", "*", "/", "%", "^", "!", "~", "|", "&");

  private static final String PUNCTUATION = "()[]{},:?.";

  private final String text;
  private int i = 0;

  Tokenizer(String text) {
    this.text = requireNonNull(text);
  }

  /** Converts the text to a list of tokens. The last token has kind
   * {@link Kind#EOF}.
   *
   * @throws CalxParseException if the text contains an invalid character or
   *   an unterminated string */
  List<Token> tokenize() {
    final List<Token> tokens = new ArrayList<>();
    for (;;) {
      skipWhitespace();
      if (i >= text.length()) {
        tokens.add(new Token(Kind.EOF, "", i, i));
        return tokens;
      }
      tokens.add(next());
    }
  }

  private void skipWhitespace() {
    while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
      ++i;
    }
  }

  private Token next() {
    final int start = i;
    final char c = text.charAt(i);
    if (isDigit(c) || c == '.' && isDigit(charAt(i + 1))) {
      return number(start);
    }
    if (c == '"' || c == '\'') {
      return string(start, c);
    }
    if (isIdentifierStart(c)) {
      ++i;
      while (i < text.length() && isIdentifierPart(text.charAt(i))) {
        ++i;
      }
      return new Token(Kind.IDENTIFIER, text.substring(start, i), start, i);
    }
    for (String op : OPERATORS) {
      if (text.startsWith(op, i)) {
        i += op.length();
        return new Token(Kind.OPERATOR, op, start, i);
      }
    }
    if (PUNCTUATION.indexOf(c) >= 0) {
      ++i;
      return new Token(Kind.PUNCTUATION, String.valueOf(c), start, i);
    }
    throw new CalxParseException("Unexpected character '" + c + "'",
        Pos.of(text, start, start + 1));
  }

  private Token number(int start) {
    if (charAt(i) == '0' && "xXbBoO".indexOf(charAt(i + 1)) >= 0
        && Character.isLetterOrDigit(charAt(i + 2))) {
      i += 2;
      while (Character.isLetterOrDigit(charAt(i))) {
        ++i;
      }
      return new Token(Kind.NUMBER, text.substring(start, i), start, i);
    }
    while (isDigit(charAt(i))) {
      ++i;
    }
    if (charAt(i) == '.' && isDigit(charAt(i + 1))) {
      ++i;
      while (isDigit(charAt(i))) {
        ++i;
      }
    }
    // An exponent only if digits follow; "2e" is "2" times "e"
    final char e = charAt(i);
    if (e == 'e' || e == 'E') {
      int j = i + 1;
      if (charAt(j) == '+' || charAt(j) == '-') {
        ++j;
      }
      if (isDigit(charAt(j))) {
        i = j;
        while (isDigit(charAt(i))) {
          ++i;
        }
      }
    }
    return new Token(Kind.NUMBER, text.substring(start, i), start, i);
  }

  private Token string(int start, char quote) {
    ++i;
    while (i < text.length()) {
      final char c = text.charAt(i++);
      if (c == '\\') {
        ++i;
      } else if (c == quote) {
        return new Token(Kind.STRING, text.substring(start, i), start, i);
      }
    }
    throw new CalxParseException("Unterminated string",
        Pos.of(text, start, text.length()));
  }

  /** Returns the character at a given offset, or 0 if past the end. */
  private char charAt(int offset) {
    return offset < text.length() ? text.charAt(offset) : 0;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentifierStart(char c) {
    return Character.isLetter(c) || c == '_' || c == '$';
  }

  private static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '$';
  }

  /** Kind of token. */
  enum Kind {
    NUMBER,
    STRING,
    IDENTIFIER,
    OPERATOR,
    PUNCTUATION,
    EOF
  }

  /** Token. */
  static class Token {
    final Kind kind;
    final String text;
    /** Offset of the first character. */
    final int start;
    /** Offset just past the last character. */
    final int end;

    Token(Kind kind, String text, int start, int end) {
      this.kind = requireNonNull(kind);
      this.text = requireNonNull(text);
      this.start = start;
      this.end = end;
    }

    /** Whether this token has a given kind and text. */
    boolean is(Kind kind, String text) {
      return this.kind == kind && this.text.equals(text);
    }

    @Override public String toString() {
      return kind == Kind.EOF ? "end of input" : "'" + text + "'";
    }
  }
}

// End Tokenizer.java
