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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.calx.num.Num;
import net.hydromatic.calx.poly.Polynomial;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /** The singleton instance of the AST builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates a numeric literal. */
  public Ast.Literal number(Pos pos, Num value) {
    return new Ast.Literal(pos, Op.NUMBER, value);
  }

  public Ast.Literal number(Num value) {
    return number(Pos.ZERO, value);
  }

  public Ast.Literal number(long value) {
    return number(Num.of(value));
  }

  public Ast.Literal number(double value) {
    return number(Num.of(value));
  }

  /** Creates a string literal. */
  public Ast.Literal string(Pos pos, String value) {
    return new Ast.Literal(pos, Op.STRING, value);
  }

  public Ast.Literal string(String value) {
    return string(Pos.ZERO, value);
  }

  /** Creates a boolean literal. */
  public Ast.Literal bool(Pos pos, boolean value) {
    return new Ast.Literal(pos, Op.BOOL, value);
  }

  public Ast.Literal bool(boolean value) {
    return bool(Pos.ZERO, value);
  }

  /** Creates the null literal. */
  public Ast.Literal nullLiteral(Pos pos) {
    return new Ast.Literal(pos, Op.NULL, null);
  }

  /** Creates an identifier. */
  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, name);
  }

  public Ast.Id id(String name) {
    return id(Pos.ZERO, name);
  }

  /**
   * Converts a value into an expression.
   *
   * <p>Numbers become numeric literals; an expression is returned as is.
   * This is how the evaluator lifts a value back into the tree when the
   * other operand of an operator is still symbolic, so that the tree never
   * contains a raw number outside a {@link Ast.Literal}.
   */
  public Ast.Exp lift(@Nullable Object o) {
    if (o instanceof Ast.Exp) {
      return (Ast.Exp) o;
    }
    if (o instanceof Num) {
      return number((Num) o);
    }
    if (o instanceof Number) {
      return number(Num.of((Number) o));
    }
    if (o instanceof Boolean) {
      return bool((Boolean) o);
    }
    if (o instanceof String) {
      return string((String) o);
    }
    if (o == null) {
      return nullLiteral(Pos.ZERO);
    }
    if (o instanceof Polynomial) {
      return polynomial((Polynomial) o);
    }
    throw new IllegalArgumentException("cannot convert " + o.getClass()
        + " to expression");
  }

  public Ast.InfixCall infixCall(Pos pos, Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.InfixCall(pos, op, a0, a1);
  }

  public Ast.InfixCall infixCall(Op op, Ast.Exp a0, Ast.Exp a1) {
    return infixCall(a0.pos.plus(a1.pos), op, a0, a1);
  }

  public Ast.InfixCall plus(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(Op.PLUS, a0, a1);
  }

  public Ast.InfixCall minus(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(Op.MINUS, a0, a1);
  }

  public Ast.InfixCall times(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(Op.TIMES, a0, a1);
  }

  public Ast.InfixCall divide(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(Op.DIVIDE, a0, a1);
  }

  public Ast.InfixCall mod(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(Op.MOD, a0, a1);
  }

  public Ast.InfixCall power(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(Op.POWER, a0, a1);
  }

  public Ast.InfixCall equal(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(Op.EQ, a0, a1);
  }

  /** Creates a call to a prefix or postfix operator. */
  public Ast.Unary unary(Pos pos, Op op, Ast.Exp a) {
    return new Ast.Unary(pos, op, a);
  }

  public Ast.Unary negate(Ast.Exp a) {
    return unary(a.pos, Op.NEGATE, a);
  }

  /** Creates a call to a named function. */
  public Ast.Apply apply(Pos pos, String name, List<Ast.Exp> args) {
    return new Ast.Apply(pos, name, ImmutableList.copyOf(args));
  }

  public Ast.Apply apply(String name, Ast.Exp... args) {
    return apply(Pos.ZERO, name, ImmutableList.copyOf(args));
  }

  public Ast.Group group(Pos pos, Ast.Exp exp) {
    return new Ast.Group(pos, exp);
  }

  public Ast.If ifThenElse(Pos pos, Ast.Exp condition, Ast.Exp ifTrue,
      Ast.Exp ifFalse) {
    return new Ast.If(pos, condition, ifTrue, ifFalse);
  }

  public Ast.Member member(Pos pos, Ast.Exp exp, String field) {
    return new Ast.Member(pos, exp, field);
  }

  public Ast.Index index(Pos pos, Ast.Exp exp, Ast.Exp key) {
    return new Ast.Index(pos, exp, key);
  }

  public Ast.ListExp list(Pos pos, List<Ast.Exp> args) {
    return new Ast.ListExp(pos, ImmutableList.copyOf(args));
  }

  public Ast.MapExp map(Pos pos, List<Ast.Exp> keys, List<Ast.Exp> values) {
    return new Ast.MapExp(pos, ImmutableList.copyOf(keys),
        ImmutableList.copyOf(values));
  }

  public Ast.PolynomialExp polynomial(Polynomial polynomial) {
    return new Ast.PolynomialExp(Pos.ZERO, polynomial);
  }

  /** Combines a list of expressions into a left-deep sum; an empty list
   * becomes zero. */
  public Ast.Exp sum(List<? extends Ast.Exp> exps) {
    return fold(exps, Op.PLUS, 0);
  }

  /** Combines a list of expressions into a left-deep product; an empty
   * list becomes one. */
  public Ast.Exp product(List<? extends Ast.Exp> exps) {
    return fold(exps, Op.TIMES, 1);
  }

  private Ast.Exp fold(List<? extends Ast.Exp> exps, Op op, long empty) {
    if (exps.isEmpty()) {
      return number(empty);
    }
    Ast.Exp e = exps.get(0);
    for (int i = 1; i < exps.size(); i++) {
      e = infixCall(op, e, exps.get(i));
    }
    return e;
  }
}

// End AstBuilder.java
