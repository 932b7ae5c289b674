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

import static com.google.common.base.Preconditions.checkArgument;

/** Utilities for parsing. */
public final class Parsers {
  private Parsers() {}

  /**
   * Given quoted string {@code "abc"} or {@code 'abc'} returns {@code abc};
   * {@code "\t"} returns the tab character.
   *
   * @throws IllegalArgumentException if an escape sequence is invalid
   */
  public static String unquoteString(String s) {
    checkArgument(s.length() >= 2);
    final char quote = s.charAt(0);
    checkArgument(quote == '"' || quote == '\'');
    checkArgument(s.charAt(s.length() - 1) == quote);
    s = s.substring(1, s.length() - 1);
    if (!s.contains("\\")) {
      // There are no escaped characters. Take the quick route.
      return s;
    }
    final StringBuilder b = new StringBuilder();
    int i = 0;
    while (i < s.length()) {
      final char c = s.charAt(i++);
      if (c != '\\') {
        b.append(c);
        continue;
      }
      if (i >= s.length()) {
        throw new IllegalArgumentException(
            "illegal escape; no character after \\");
      }
      final char c2 = s.charAt(i++);
      switch (c2) {
        case '"':
        case '\'':
        case '\\':
          b.append(c2);
          break;
        case 'b':
          b.append('\b');
          break;
        case 't':
          b.append('\t');
          break;
        case 'n':
          b.append('\n');
          break;
        case 'v':
          b.append('\u000B');
          break;
        case 'f':
          b.append('\f');
          break;
        case 'r':
          b.append('\r');
          break;
        default:
          throw new IllegalArgumentException("illegal escape '\\" + c2 + "'");
      }
    }
    return b.toString();
  }

  /** Converts a string to a double-quoted literal, escaping special
   * characters. Inverse of {@link #unquoteString}. */
  public static String quoteString(String s) {
    final StringBuilder b = new StringBuilder("\"");
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
        case '\b':
          b.append("\\b");
          break;
        case '\t':
          b.append("\\t");
          break;
        case '\n':
          b.append("\\n");
          break;
        case '\u000B':
          b.append("\\v");
          break;
        case '\f':
          b.append("\\f");
          break;
        case '\r':
          b.append("\\r");
          break;
        case '"':
          b.append("\\\"");
          break;
        case '\\':
          b.append("\\\\");
          break;
        default:
          b.append(c);
      }
    }
    return b.append('"').toString();
  }
}

// End Parsers.java
