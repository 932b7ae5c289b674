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
package net.hydromatic.calx.ast;

import java.util.Objects;

/** Position of a parse-tree node. */
public class Pos {
  public static final Pos ZERO = new Pos(0, 0, 0, 0);

  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  /** Creates a Pos. */
  public Pos(int startLine, int startColumn, int endLine, int endColumn) {
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  /** Creates a Pos from two offsets into a source string. */
  public static Pos of(String text, int startOffset, int endOffset) {
    final int[] start = lineCol(text, startOffset);
    final int[] end = lineCol(text, endOffset);
    return new Pos(start[0], start[1], end[0], end[1]);
  }

  /** Converts an offset into a 1-based line and column. An offset past
   * the end of the text continues the last line. */
  private static int[] lineCol(String text, int offset) {
    int line = 1;
    int column = 1;
    for (int i = 0; i < offset; i++) {
      if (i < text.length() && text.charAt(i) == '\n') {
        ++line;
        column = 1;
      } else {
        ++column;
      }
    }
    return new int[] {line, column};
  }

  @Override public int hashCode() {
    return Objects.hash(startLine, startColumn, endLine, endColumn);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
        && this.startLine == ((Pos) o).startLine
        && this.startColumn == ((Pos) o).startColumn
        && this.endLine == ((Pos) o).endLine
        && this.endColumn == ((Pos) o).endColumn;
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(startLine)
        .append('.')
        .append(startColumn);
    if (endColumn != startColumn + 1 || endLine != startLine) {
      buf.append('-')
          .append(endLine)
          .append('.')
          .append(endColumn);
    }
    return buf;
  }

  /** Returns a position that spans from the start of this position to the
   * end of another. If either is {@link #ZERO}, returns the other. */
  public Pos plus(Pos pos) {
    if (this.equals(ZERO)) {
      return pos;
    }
    if (pos.equals(ZERO)) {
      return this;
    }
    int startLine = this.startLine;
    int startColumn = this.startColumn;
    if (pos.startLine < startLine
        || pos.startLine == startLine && pos.startColumn < startColumn) {
      startLine = pos.startLine;
      startColumn = pos.startColumn;
    }
    int endLine = this.endLine;
    int endColumn = this.endColumn;
    if (pos.endLine > endLine
        || pos.endLine == endLine && pos.endColumn > endColumn) {
      endLine = pos.endLine;
      endColumn = pos.endColumn;
    }
    return new Pos(startLine, startColumn, endLine, endColumn);
  }
}

// End Pos.java
