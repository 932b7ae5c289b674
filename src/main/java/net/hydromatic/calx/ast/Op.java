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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import java.util.EnumSet;
import java.util.Set;

/** Sub-types of {@link AstNode}.
 *
 * <p>Each operator knows how it is written ({@link #padded}) and its
 * precedence on the left and on the right, which {@link AstWriter} uses to
 * decide where parentheses are needed. */
public enum Op {
  // identifiers
  ID(true),

  // literals
  NUMBER(true),
  STRING(true),
  BOOL(true),
  NULL(true),

  // value constructors
  LIST(true),
  MAP(true),
  /** Polynomial in one variable; written out as a sum of terms. */
  POLYNOMIAL(" + ", 9),

  GROUP(true),
  APPLY(true),
  MEMBER(".", 15),
  INDEX("[", 15),

  IF(" ? ", 0, false),

  COALESCE(" ?? ", 1),
  OR(" || ", 2),
  AND(" && ", 3),
  BIT_OR(" | ", 4),
  BIT_AND(" & ", 5),
  EQ(" == ", 6),
  NE(" != ", 6),
  LT(" < ", 7),
  LE(" <= ", 7),
  GT(" > ", 7),
  GE(" >= ", 7),
  SHL(" << ", 8),
  SHR(" >> ", 8),
  PLUS(" + ", 9),
  MINUS(" - ", 9),
  TIMES(" * ", 10),
  DIVIDE(" / ", 10),
  MOD(" % ", 10),
  INT_DIVIDE(" ~/ ", 10),
  /** Permutations, "n P r". */
  PERMUTE(" P ", 11),
  /** Combinations, "n C r". */
  CHOOSE(" C ", 12),

  // prefix operators
  NEGATE("-", 13, false),
  POSITIVE("+", 13, false),
  NOT("!", 13, false),
  BIT_NOT("~", 13, false),

  POWER("^", 14, false),

  // postfix operators
  FACTORIAL("!", 15),
  PERCENT("%", 15);

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;
  /** Operator name, e.g. "+"; null for atoms. */
  public final String opName;

  /** Operators that combine two operands and that the parser can reduce,
   * keyed by the symbol that denotes them. Includes the aliases "or" and
   * "and". */
  public static final ImmutableMap<String, Op> BINARY_BY_NAME;

  private static final Set<Op> PREFIX =
      EnumSet.of(NEGATE, POSITIVE, NOT, BIT_NOT);

  private static final Set<Op> POSTFIX = EnumSet.of(FACTORIAL, PERCENT);

  private static final Set<Op> ARITHMETIC =
      EnumSet.of(PLUS, MINUS, TIMES, DIVIDE, MOD, POWER);

  private static final Set<Op> RELATIONAL =
      Sets.immutableEnumSet(COALESCE, OR, AND, BIT_OR, BIT_AND, EQ, NE, LT,
          LE, GT, GE, SHL, SHR, INT_DIVIDE, PERMUTE, CHOOSE);

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      if (op.isBinary()) {
        b.put(op.opName, op);
      }
    }
    b.put("or", OR);
    b.put("and", AND);
    BINARY_BY_NAME = b.build();
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded, int precedence) {
    this(padded, precedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
    this.opName = padded.equals("") ? null : padded.trim();
  }

  /** Returns the precedence used by the parser when reducing a binary
   * operator; higher binds tighter. */
  public int precedence() {
    return left / 2;
  }

  /** Whether this is a prefix unary operator, such as "-x". */
  public boolean isPrefix() {
    return PREFIX.contains(this);
  }

  /** Whether this is a postfix unary operator, such as "x!". */
  public boolean isPostfix() {
    return POSTFIX.contains(this);
  }

  /** Whether this is one of the arithmetic binary operators that the
   * simplifier and calculus rules understand. */
  public boolean isArithmetic() {
    return ARITHMETIC.contains(this);
  }

  /** Whether this is a comparison, logical, bitwise or combinatorial binary
   * operator. */
  public boolean isRelational() {
    return RELATIONAL.contains(this);
  }

  /** Whether this operator combines two operands. */
  public boolean isBinary() {
    return isArithmetic() || isRelational();
  }
}

// End Op.java
