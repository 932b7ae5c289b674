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
import static java.util.Objects.requireNonNull;
import static net.hydromatic.calx.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.ast.Op;
import net.hydromatic.calx.ast.Pos;
import net.hydromatic.calx.eval.Functions;
import net.hydromatic.calx.eval.Prop;
import net.hydromatic.calx.eval.Session;
import net.hydromatic.calx.num.Num;
import net.hydromatic.calx.parse.Tokenizer.Kind;
import net.hydromatic.calx.parse.Tokenizer.Token;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parser for expressions.
 *
 * <p>A parser is stateless and may be shared; each call to {@link #parse}
 * works on its own token list.
 *
 * <p>Binary operators are parsed into a flat list of operands and operators,
 * which is then reduced: first every {@code ^}, right to left; then,
 * repeatedly, the leftmost operator of highest precedence. Implicit
 * multiplication ({@code 2x}, {@code 2(x + 1)}) is an operator with the
 * precedence of {@code *}, except that a function name followed by an
 * operand ({@code sin x}) is a call, and binds tighter than any operator
 * other than {@code ^}.
 */
public class CalxParser {
  /** Words that are operators when they occur where an operator may. */
  private static final Set<String> OPERATOR_WORDS =
      ImmutableSet.of("or", "and", "P", "C");

  /** Operators that may follow a postfix {@code %}. */
  private static final Set<String> PERCENT_FOLLOWERS =
      ImmutableSet.of(")", "]", "}", ",", ":", "?");

  /** Parser precedence of a function applied without parentheses. */
  private static final int APPLY_PRECEDENCE = Op.NEGATE.precedence();

  private final boolean implicitMultiplication;
  private final int maxDepth;
  private final MathContext mathContext;

  /** Creates a CalxParser. */
  public CalxParser(Session session) {
    this.implicitMultiplication =
        Prop.IMPLICIT_MULTIPLICATION.booleanValue(session.map);
    this.maxDepth = Prop.MAX_DEPTH.intValue(session.map);
    this.mathContext = session.mathContext();
  }

  /** Parses an expression.
   *
   * @throws CalxParseException if the text is not a valid expression, or is
   *   nested more deeply than {@link Prop#MAX_DEPTH} */
  public Ast.Exp parse(String text) {
    final Tokenizer tokenizer = new Tokenizer(text);
    final Parse parse = new Parse(text, tokenizer.tokenize());
    final Ast.Exp exp = parse.expression();
    parse.expect(Kind.EOF, "");
    return exp;
  }

  /** Operator in the flat list built by {@link Parse#binary()}. */
  private static class OpRef {
    final Op op;
    /** Whether the operator is implied by two adjacent operands. */
    final boolean implicit;

    OpRef(Op op, boolean implicit) {
      this.op = requireNonNull(op);
      this.implicit = implicit;
    }
  }

  /** State of parsing one piece of text. */
  private class Parse {
    final String text;
    final List<Token> tokens;
    int i = 0;
    int depth = 0;

    Parse(String text, List<Token> tokens) {
      this.text = text;
      this.tokens = tokens;
    }

    Token peek() {
      return tokens.get(i);
    }

    Token peek(int offset) {
      return tokens.get(Math.min(i + offset, tokens.size() - 1));
    }

    Token next() {
      final Token token = tokens.get(i);
      if (token.kind != Kind.EOF) {
        ++i;
      }
      return token;
    }

    /** Returns the position from the start of a token to the end of the most
     * recently consumed token. */
    Pos posFrom(Token start) {
      final int end = i > 0 ? tokens.get(i - 1).end : start.end;
      return Pos.of(text, start.start, Math.max(end, start.end));
    }

    Pos pos(Token token) {
      return Pos.of(text, token.start, Math.max(token.end, token.start + 1));
    }

    CalxParseException error(String message, Token token) {
      return new CalxParseException(message, pos(token));
    }

    Token expect(Kind kind, String expected) {
      final Token token = peek();
      if (token.kind != kind
          || kind != Kind.EOF && !token.text.equals(expected)) {
        throw error(kind == Kind.EOF
            ? "Unexpected " + token
            : "Expected '" + expected + "' but found " + token, token);
      }
      return next();
    }

    boolean isPunctuation(String s) {
      return peek().is(Kind.PUNCTUATION, s);
    }

    void enter() {
      if (++depth > maxDepth) {
        throw error("Expression nested too deeply (maximum depth "
            + maxDepth + ")", peek());
      }
    }

    void leave() {
      --depth;
    }

    <E extends Ast.Exp> E checkDepth(E exp, Token token) {
      if (exp.depth > maxDepth) {
        throw error("Expression nested too deeply (maximum depth "
            + maxDepth + ")", token);
      }
      return exp;
    }

    /** Parses an expression, including a trailing conditional. */
    Ast.Exp expression() {
      final Token start = peek();
      enter();
      try {
        final Ast.Exp condition = binary();
        if (!isPunctuation("?")) {
          return condition;
        }
        next();
        final Ast.Exp ifTrue = expression();
        expect(Kind.PUNCTUATION, ":");
        final Ast.Exp ifFalse = expression();
        return checkDepth(
            ast.ifThenElse(posFrom(start), condition, ifTrue, ifFalse),
            start);
      } finally {
        leave();
      }
    }

    /** Returns the binary operator denoted by the current token, or null. */
    @Nullable Op binaryOp() {
      final Token token = peek();
      switch (token.kind) {
        case OPERATOR:
          return Op.BINARY_BY_NAME.get(token.text);
        case IDENTIFIER:
          if (OPERATOR_WORDS.contains(token.text)) {
            switch (token.text) {
              case "P":
                return Op.PERMUTE;
              case "C":
                return Op.CHOOSE;
              default:
                return Op.BINARY_BY_NAME.get(token.text);
            }
          }
          return null;
        default:
          return null;
      }
    }

    /** Whether the current token can start an operand. */
    boolean canStartOperand() {
      return canStartOperand(peek());
    }

    boolean canStartOperand(Token token) {
      switch (token.kind) {
        case NUMBER:
        case IDENTIFIER:
          return true;
        case PUNCTUATION:
          return token.text.equals("(")
              || token.text.equals("[")
              || token.text.equals("{");
        default:
          return false;
      }
    }

    /** Parses a sequence of operands separated by binary operators. */
    Ast.Exp binary() {
      final Token start = peek();
      final List<Ast.Exp> operands = new ArrayList<>();
      final List<OpRef> ops = new ArrayList<>();
      operands.add(unaryOperand());
      for (;;) {
        final Op op = binaryOp();
        if (op != null) {
          next();
          ops.add(new OpRef(op, false));
        } else if (implicitMultiplication && canStartOperand()) {
          ops.add(new OpRef(Op.TIMES, true));
        } else {
          break;
        }
        operands.add(unaryOperand());
      }
      return reduce(operands, ops, start);
    }

    /** Reduces a flat list of operands and operators to a tree. */
    Ast.Exp reduce(List<Ast.Exp> operands, List<OpRef> ops, Token start) {
      // Power first, right to left
      for (int k = ops.size() - 1; k >= 0; k--) {
        if (ops.get(k).op == Op.POWER) {
          operands.set(k, power(operands.get(k), operands.get(k + 1)));
          operands.remove(k + 1);
          ops.remove(k);
        }
      }
      while (!ops.isEmpty()) {
        int best = 0;
        int bestPrecedence = -1;
        for (int k = 0; k < ops.size(); k++) {
          final int precedence = precedence(ops.get(k), operands.get(k));
          if (precedence > bestPrecedence) {
            best = k;
            bestPrecedence = precedence;
          }
        }
        final OpRef opRef = ops.get(best);
        final Ast.Exp a0 = operands.get(best);
        final Ast.Exp a1 = operands.get(best + 1);
        Ast.Exp e = opRef.implicit ? applyFunction(a0, a1) : null;
        if (e == null) {
          e = ast.infixCall(a0.pos.plus(a1.pos), opRef.op, a0, a1);
        }
        operands.set(best, checkDepth(e, start));
        operands.remove(best + 1);
        ops.remove(best);
      }
      return operands.get(0);
    }

    int precedence(OpRef opRef, Ast.Exp left) {
      if (opRef.implicit && functionName(left) != null) {
        return APPLY_PRECEDENCE;
      }
      return opRef.op.precedence();
    }

    /** Creates {@code a ^ b}. If {@code a} has a prefix operator, the
     * operator applies to the power: {@code -a^b} is {@code -(a^b)}. */
    Ast.Exp power(Ast.Exp a, Ast.Exp b) {
      if (a instanceof Ast.Unary && ((Ast.Unary) a).prefix()) {
        final Ast.Unary unary = (Ast.Unary) a;
        return ast.unary(a.pos.plus(b.pos), unary.op, power(unary.a, b));
      }
      return ast.infixCall(a.pos.plus(b.pos), Op.POWER, a, b);
    }

    /** If an expression is a function name, possibly under prefix operators,
     * returns the name; otherwise null. */
    @Nullable String functionName(Ast.Exp e) {
      if (e instanceof Ast.Unary && ((Ast.Unary) e).prefix()) {
        return functionName(((Ast.Unary) e).a);
      }
      if (e.op == Op.ID && Functions.isFunction(((Ast.Id) e).name)) {
        return ((Ast.Id) e).name;
      }
      return null;
    }

    /** Converts "sin x" into "sin(x)" and "-sin x" into "-sin(x)"; returns
     * null if {@code f} is not a function name. */
    Ast.@Nullable Exp applyFunction(Ast.Exp f, Ast.Exp arg) {
      if (functionName(f) == null) {
        return null;
      }
      if (f instanceof Ast.Unary) {
        final Ast.Unary unary = (Ast.Unary) f;
        return ast.unary(f.pos.plus(arg.pos), unary.op,
            requireNonNull(applyFunction(unary.a, arg)));
      }
      return ast.apply(f.pos.plus(arg.pos), ((Ast.Id) f).name,
          ImmutableList.of(arg));
    }

    /** Parses an operand with its prefix and postfix operators. */
    Ast.Exp unaryOperand() {
      final Token start = peek();
      if (start.kind == Kind.OPERATOR) {
        final Op op;
        switch (start.text) {
          case "-":
            op = Op.NEGATE;
            break;
          case "+":
            op = Op.POSITIVE;
            break;
          case "!":
            op = Op.NOT;
            break;
          case "~":
            op = Op.BIT_NOT;
            break;
          default:
            throw error("Unexpected " + start, start);
        }
        next();
        enter();
        try {
          final Ast.Exp a = unaryOperand();
          return checkDepth(ast.unary(posFrom(start), op, a), start);
        } finally {
          leave();
        }
      }
      return postfix(primary(), start);
    }

    /** Parses member access, indexing, calls, factorial and percent after
     * an operand. */
    Ast.Exp postfix(Ast.Exp e, Token start) {
      for (;;) {
        final Token token = peek();
        if (token.is(Kind.PUNCTUATION, ".")
            && peek(1).kind == Kind.IDENTIFIER) {
          next();
          final String field = next().text;
          e = ast.member(posFrom(start), e, field);
        } else if (token.is(Kind.PUNCTUATION, "[")) {
          next();
          final Ast.Exp key = expression();
          expect(Kind.PUNCTUATION, "]");
          e = ast.index(posFrom(start), e, key);
        } else if (token.is(Kind.PUNCTUATION, "(") && isCallTarget(e)) {
          next();
          final List<Ast.Exp> args = expressionList(")");
          final String name = e.op == Op.ID ? ((Ast.Id) e).name : e.toString();
          e = ast.apply(posFrom(start), name, args);
        } else if (token.is(Kind.OPERATOR, "!")) {
          next();
          e = ast.unary(posFrom(start), Op.FACTORIAL, e);
        } else if (token.is(Kind.OPERATOR, "%") && isPercent()) {
          next();
          e = ast.unary(posFrom(start), Op.PERCENT, e);
        } else {
          return checkDepth(e, start);
        }
        checkDepth(e, start);
      }
    }

    boolean isCallTarget(Ast.Exp e) {
      switch (e.op) {
        case MEMBER:
          return true;
        case ID:
          return !implicitMultiplication
              || Functions.isFunction(((Ast.Id) e).name);
        default:
          return false;
      }
    }

    /** Whether the current token, "%", is postfix percent rather than
     * modulo; it is if the token after it cannot start an operand.
     *
     * <p>A "+" or "-" after "%" is a sign, and "%" is modulo, if it is
     * separated from the "%" by white space and attached to the operand
     * that follows it. So {@code 5 % -3} is modulo, but {@code 50% - 3}
     * and {@code 50%-3} are percent. */
    boolean isPercent() {
      final Token percent = peek();
      final Token after = peek(1);
      switch (after.kind) {
        case EOF:
          return true;
        case PUNCTUATION:
          return PERCENT_FOLLOWERS.contains(after.text);
        case OPERATOR:
          if (!Op.BINARY_BY_NAME.containsKey(after.text)) {
            return false;
          }
          return !isSign(after, percent, peek(2));
        default:
          return false;
      }
    }

    private boolean isSign(Token op, Token before, Token operand) {
      return (op.text.equals("-") || op.text.equals("+"))
          && before.end < op.start
          && op.end == operand.start
          && canStartOperand(operand);
    }

    /** Parses a comma-separated list of expressions up to a closing
     * token, and consumes the closer. */
    List<Ast.Exp> expressionList(String closer) {
      final List<Ast.Exp> list = new ArrayList<>();
      if (isPunctuation(closer)) {
        next();
        return list;
      }
      for (;;) {
        list.add(expression());
        if (isPunctuation(",")) {
          next();
          continue;
        }
        expect(Kind.PUNCTUATION, closer);
        return list;
      }
    }

    Ast.Exp primary() {
      final Token token = next();
      switch (token.kind) {
        case NUMBER:
          try {
            return ast.number(pos(token), Num.parse(token.text, mathContext));
          } catch (NumberFormatException e) {
            throw new CalxParseException("Invalid number '" + token.text
                + "'", pos(token));
          }
        case STRING:
          try {
            return ast.string(pos(token), Parsers.unquoteString(token.text));
          } catch (IllegalArgumentException e) {
            throw new CalxParseException(e, pos(token));
          }
        case IDENTIFIER:
          switch (token.text) {
            case "true":
              return ast.bool(pos(token), true);
            case "false":
              return ast.bool(pos(token), false);
            case "null":
              return ast.nullLiteral(pos(token));
            default:
              return ast.id(pos(token), token.text);
          }
        case PUNCTUATION:
          switch (token.text) {
            case "(":
              final Ast.Exp e = expression();
              expect(Kind.PUNCTUATION, ")");
              return checkDepth(ast.group(posFrom(token), e), token);
            case "[":
              final List<Ast.Exp> args = expressionList("]");
              return checkDepth(ast.list(posFrom(token), args), token);
            case "{":
              return checkDepth(map(token), token);
            default:
              break;
          }
          break;
        default:
          break;
      }
      throw error("Unexpected " + token, token);
    }

    /** Parses the rest of a map literal, "{k0: v0, k1: v1}". */
    Ast.Exp map(Token start) {
      final List<Ast.Exp> keys = new ArrayList<>();
      final List<Ast.Exp> values = new ArrayList<>();
      if (isPunctuation("}")) {
        next();
      } else {
        for (;;) {
          keys.add(binary());
          expect(Kind.PUNCTUATION, ":");
          values.add(expression());
          if (isPunctuation(",")) {
            next();
            continue;
          }
          expect(Kind.PUNCTUATION, "}");
          break;
        }
      }
      checkArgument(keys.size() == values.size());
      return ast.map(posFrom(start), keys, values);
    }
  }
}

// End CalxParser.java
