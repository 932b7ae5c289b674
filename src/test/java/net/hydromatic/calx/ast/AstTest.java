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

import static net.hydromatic.calx.Matchers.isAst;
import static net.hydromatic.calx.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

/** Tests for {@link Ast}, {@link AstBuilder} and {@link AstWriter}. */
public class AstTest {
  private static final Ast.Id A = ast.id("a");
  private static final Ast.Id B = ast.id("b");
  private static final Ast.Id C = ast.id("c");

  /** Parentheses are added only where precedence and associativity
   * require them. */
  @Test void testUnparse() {
    assertThat(ast.minus(ast.minus(A, B), C), isAst("a - b - c"));
    assertThat(ast.minus(A, ast.minus(B, C)), isAst("a - (b - c)"));
    assertThat(ast.power(A, ast.power(B, C)), isAst("a^b^c"));
    assertThat(ast.power(ast.power(A, B), C), isAst("(a^b)^c"));
    assertThat(ast.times(ast.plus(A, B), C), isAst("(a + b) * c"));
    assertThat(ast.plus(A, ast.times(B, C)), isAst("a + b * c"));
    assertThat(ast.negate(ast.power(A, ast.number(2))), isAst("-a^2"));
    assertThat(ast.power(ast.negate(A), ast.number(2)), isAst("(-a)^2"));
    assertThat(ast.apply("sin", ast.plus(A, B)), isAst("sin(a + b)"));
  }

  @Test void testFold() {
    assertThat(ast.sum(ImmutableList.of()), isAst("0"));
    assertThat(ast.product(ImmutableList.of()), isAst("1"));
    assertThat(ast.sum(ImmutableList.of(A, B, C)), isAst("a + b + c"));
    assertThat(ast.product(ImmutableList.of(A, B, C)), isAst("a * b * c"));
  }

  @Test void testLift() {
    assertThat(ast.lift(2.5d), isAst("2.5"));
    assertThat(ast.lift(7), isAst("7"));
    assertThat(ast.lift(true), isAst("true"));
    assertThat(ast.lift("s"), isAst("\"s\""));
    assertThat(ast.lift(A), is(A));
    assertThrows(IllegalArgumentException.class,
        () -> ast.lift(new Object()));
  }

  /** Equality is structural, and ignores position. */
  @Test void testEquals() {
    final Pos pos = Pos.of("a + b", 0, 5);
    assertThat(ast.infixCall(pos, Op.PLUS, A, B).equals(ast.plus(A, B)),
        is(true));
    assertThat(ast.plus(A, B).equals(ast.plus(B, A)), is(false));
    assertThat(ast.plus(A, B).hashCode(), is(ast.plus(A, B).hashCode()));
  }
}

// End AstTest.java
