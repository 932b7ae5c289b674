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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.calx.num.Num;
import net.hydromatic.calx.parse.Parsers;
import net.hydromatic.calx.poly.Polynomial;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes.
 *
 * <p>The set of node classes is closed. Each class handles a fixed set of
 * {@link Op} values, and code that processes expressions switches on
 * {@link AstNode#op}. */
public class Ast {
  private Ast() {}

  private static int depth(List<? extends Exp> exps) {
    int depth = 0;
    for (Exp exp : exps) {
      depth = Math.max(depth, exp.depth);
    }
    return depth + 1;
  }

  /** Base class for an expression. */
  public abstract static class Exp extends AstNode {
    /** Number of nodes on the longest path from this node to a leaf; 1 for a
     * leaf. The parser uses it to reject trees that are too deep to
     * process recursively. */
    public final int depth;

    Exp(Pos pos, Op op, int depth) {
      super(pos, op);
      this.depth = depth;
    }

    @Override public abstract Exp accept(Shuttle shuttle);

    /** Returns the child expressions, in order. */
    public abstract List<Exp> args();

    /** Creates a copy of this expression with given children, or
     * {@code this} if the children are the same. The list must have the
     * same size as {@link #args()}. */
    public abstract Exp copy(List<Exp> args);

    /** Whether this is a numeric literal. */
    public boolean isNumber() {
      return op == Op.NUMBER;
    }

    /** Whether this is a numeric literal with a given value. */
    public boolean isNumber(long value) {
      return op == Op.NUMBER
          && ((Literal) this).num().numericallyEquals(Num.of(value));
    }

    /** Whether this is a literal of any type. */
    public boolean isLiteral() {
      switch (op) {
        case NUMBER:
        case STRING:
        case BOOL:
        case NULL:
          return true;
        default:
          return false;
      }
    }
  }

  /** Literal: a number, string, boolean or null. */
  public static class Literal extends Exp {
    public final @Nullable Object value;

    /** Creates a Literal. */
    Literal(Pos pos, Op op, @Nullable Object value) {
      super(pos, op, 1);
      this.value = value;
      switch (op) {
        case NUMBER:
          checkArgument(value instanceof Num);
          break;
        case STRING:
          checkArgument(value instanceof String);
          break;
        case BOOL:
          checkArgument(value instanceof Boolean);
          break;
        case NULL:
          checkArgument(value == null);
          break;
        default:
          throw new IllegalArgumentException("not a literal: " + op);
      }
    }

    /** Returns the value of a numeric literal. */
    public Num num() {
      checkArgument(op == Op.NUMBER);
      return (Num) requireNonNull(value);
    }

    @Override public int hashCode() {
      return Objects.hash(op, value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && this.op == ((Literal) o).op
          && Objects.equals(this.value, ((Literal) o).value);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of();
    }

    @Override public Exp copy(List<Exp> args) {
      checkArgument(args.isEmpty());
      return this;
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      switch (op) {
        case STRING:
          return w.append(Parsers.quoteString((String) value));
        case BOOL:
        case NULL:
          return w.append(String.valueOf(value));
        default:
          final Num num = num();
          if (num.kind == Num.Kind.COMPLEX) {
            // "1.0 + 2.0i" needs parentheses where a sum would
            return left > Op.PLUS.left || Op.PLUS.right < right
                ? w.append("(").append(num.toString()).append(")")
                : w.append(num.toString());
          }
          if (num.isNegative()) {
            return left > Op.NEGATE.left || Op.NEGATE.right < right
                ? w.append("(").append(num.toString()).append(")")
                : w.append(num.toString());
          }
          return w.append(num.toString());
      }
    }
  }

  /** Named variable or constant. */
  public static class Id extends Exp {
    public final String name;

    /** Creates an Id. */
    Id(Pos pos, String name) {
      super(pos, Op.ID, 1);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Id
          && this.name.equals(((Id) o).name);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of();
    }

    @Override public Exp copy(List<Exp> args) {
      checkArgument(args.isEmpty());
      return this;
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /** Call to an infix operator: arithmetic ({@code + - * / % ^}),
   * comparison, logical, bitwise or combinatorial. */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp a1;

    InfixCall(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op, Math.max(a0.depth, a1.depth) + 1);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      checkArgument(op.isBinary(), "not binary: %s", op);
    }

    @Override public int hashCode() {
      return Objects.hash(op, a0, a1);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof InfixCall
          && this.op == ((InfixCall) o).op
          && this.a0.equals(((InfixCall) o).a0)
          && this.a1.equals(((InfixCall) o).a1);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of(a0, a1);
    }

    @Override public Exp copy(List<Exp> args) {
      checkArgument(args.size() == 2);
      return copy(args.get(0), args.get(1));
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }

    /** Creates a copy of this {@code InfixCall} with given contents,
     * or {@code this} if the contents are the same. */
    public InfixCall copy(Exp a0, Exp a1) {
      return this.a0.equals(a0)
          && this.a1.equals(a1)
          ? this
          : new InfixCall(pos, op, a0, a1);
    }
  }

  /** Call to a prefix operator ({@code - + ! ~}) or a postfix operator
   * (factorial {@code !}, percent {@code %}). */
  public static class Unary extends Exp {
    public final Exp a;

    Unary(Pos pos, Op op, Exp a) {
      super(pos, op, a.depth + 1);
      this.a = requireNonNull(a);
      checkArgument(op.isPrefix() || op.isPostfix(), "not unary: %s", op);
    }

    /** Whether the operator is written before its operand. */
    public boolean prefix() {
      return op.isPrefix();
    }

    @Override public int hashCode() {
      return Objects.hash(op, a);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Unary
          && this.op == ((Unary) o).op
          && this.a.equals(((Unary) o).a);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of(a);
    }

    @Override public Exp copy(List<Exp> args) {
      checkArgument(args.size() == 1);
      return copy(args.get(0));
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return prefix()
          ? w.prefix(left, op, a, right)
          : w.postfix(left, a, op, op.opName, right);
    }

    /** Creates a copy of this {@code Unary} with given contents,
     * or {@code this} if the contents are the same. */
    public Unary copy(Exp a) {
      return this.a.equals(a) ? this : new Unary(pos, op, a);
    }
  }

  /** Call to a named function, such as "sin(x)" or "log(2, x)". */
  public static class Apply extends Exp {
    public final String name;
    public final ImmutableList<Exp> args;

    Apply(Pos pos, String name, ImmutableList<Exp> args) {
      super(pos, Op.APPLY, depth(args));
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    /** Returns the sole argument of a one-argument call. */
    public Exp arg() {
      checkArgument(args.size() == 1, "expected one argument: %s", this);
      return args.get(0);
    }

    @Override public int hashCode() {
      return Objects.hash(name, args);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Apply
          && this.name.equals(((Apply) o).name)
          && this.args.equals(((Apply) o).args);
    }

    @Override public List<Exp> args() {
      return args;
    }

    @Override public Exp copy(List<Exp> args) {
      return this.args.equals(args)
          ? this
          : new Apply(pos, name, ImmutableList.copyOf(args));
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name).appendAll("(", args, ")");
    }
  }

  /** Parenthesized expression. */
  public static class Group extends Exp {
    public final Exp exp;

    Group(Pos pos, Exp exp) {
      super(pos, Op.GROUP, exp.depth + 1);
      this.exp = requireNonNull(exp);
    }

    @Override public int hashCode() {
      return Objects.hash(op, exp);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Group
          && this.exp.equals(((Group) o).exp);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of(exp);
    }

    @Override public Exp copy(List<Exp> args) {
      checkArgument(args.size() == 1);
      return exp.equals(args.get(0)) ? this : new Group(pos, args.get(0));
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(").append(exp, 0, 0).append(")");
    }
  }

  /** Conditional expression, "condition ? ifTrue : ifFalse". */
  public static class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Pos pos, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(pos, Op.IF, depth(ImmutableList.of(condition, ifTrue, ifFalse)));
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override public int hashCode() {
      return Objects.hash(condition, ifTrue, ifFalse);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof If
          && this.condition.equals(((If) o).condition)
          && this.ifTrue.equals(((If) o).ifTrue)
          && this.ifFalse.equals(((If) o).ifFalse);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of(condition, ifTrue, ifFalse);
    }

    @Override public Exp copy(List<Exp> args) {
      checkArgument(args.size() == 3);
      return copy(args.get(0), args.get(1), args.get(2));
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(condition, 0, Op.COALESCE.left)
          .append(" ? ").append(ifTrue, 0, 0)
          .append(" : ").append(ifFalse, 0, 0);
    }

    /** Creates a copy of this {@code If} with given contents,
     * or {@code this} if the contents are the same. */
    public If copy(Exp condition, Exp ifTrue, Exp ifFalse) {
      return this.condition.equals(condition)
          && this.ifTrue.equals(ifTrue)
          && this.ifFalse.equals(ifFalse)
          ? this
          : new If(pos, condition, ifTrue, ifFalse);
    }
  }

  /** Member access, "exp.field". */
  public static class Member extends Exp {
    public final Exp exp;
    public final String field;

    Member(Pos pos, Exp exp, String field) {
      super(pos, Op.MEMBER, exp.depth + 1);
      this.exp = requireNonNull(exp);
      this.field = requireNonNull(field);
    }

    @Override public int hashCode() {
      return Objects.hash(exp, field);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Member
          && this.exp.equals(((Member) o).exp)
          && this.field.equals(((Member) o).field);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of(exp);
    }

    @Override public Exp copy(List<Exp> args) {
      checkArgument(args.size() == 1);
      return exp.equals(args.get(0))
          ? this
          : new Member(pos, args.get(0), field);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.postfix(left, exp, op, "." + field, right);
    }
  }

  /** Index access, "exp[key]". */
  public static class Index extends Exp {
    public final Exp exp;
    public final Exp key;

    Index(Pos pos, Exp exp, Exp key) {
      super(pos, Op.INDEX, Math.max(exp.depth, key.depth) + 1);
      this.exp = requireNonNull(exp);
      this.key = requireNonNull(key);
    }

    @Override public int hashCode() {
      return Objects.hash(op, exp, key);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Index
          && this.exp.equals(((Index) o).exp)
          && this.key.equals(((Index) o).key);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of(exp, key);
    }

    @Override public Exp copy(List<Exp> args) {
      checkArgument(args.size() == 2);
      return exp.equals(args.get(0)) && key.equals(args.get(1))
          ? this
          : new Index(pos, args.get(0), args.get(1));
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.postfix(left, exp, op, "[" + key + "]", right);
    }
  }

  /** List literal, "[a, b, c]". */
  public static class ListExp extends Exp {
    public final ImmutableList<Exp> args;

    ListExp(Pos pos, ImmutableList<Exp> args) {
      super(pos, Op.LIST, depth(args));
      this.args = requireNonNull(args);
    }

    @Override public int hashCode() {
      return Objects.hash(op, args);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ListExp
          && this.args.equals(((ListExp) o).args);
    }

    @Override public List<Exp> args() {
      return args;
    }

    @Override public Exp copy(List<Exp> args) {
      return this.args.equals(args)
          ? this
          : new ListExp(pos, ImmutableList.copyOf(args));
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll("[", args, "]");
    }
  }

  /** Map literal, "{k0: v0, k1: v1}".
   *
   * <p>{@link #args()} holds keys and values interleaved. */
  public static class MapExp extends Exp {
    public final ImmutableList<Exp> keys;
    public final ImmutableList<Exp> values;

    MapExp(Pos pos, ImmutableList<Exp> keys, ImmutableList<Exp> values) {
      super(pos, Op.MAP,
          depth(ImmutableList.<Exp>builder().addAll(keys).addAll(values)
              .build()));
      this.keys = requireNonNull(keys);
      this.values = requireNonNull(values);
      checkArgument(keys.size() == values.size());
    }

    @Override public int hashCode() {
      return Objects.hash(keys, values);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof MapExp
          && this.keys.equals(((MapExp) o).keys)
          && this.values.equals(((MapExp) o).values);
    }

    @Override public List<Exp> args() {
      final ImmutableList.Builder<Exp> b = ImmutableList.builder();
      for (int i = 0; i < keys.size(); i++) {
        b.add(keys.get(i), values.get(i));
      }
      return b.build();
    }

    @Override public Exp copy(List<Exp> args) {
      checkArgument(args.size() == keys.size() * 2);
      final ImmutableList.Builder<Exp> keys = ImmutableList.builder();
      final ImmutableList.Builder<Exp> values = ImmutableList.builder();
      for (int i = 0; i < args.size(); i += 2) {
        keys.add(args.get(i));
        values.add(args.get(i + 1));
      }
      final MapExp mapExp = new MapExp(pos, keys.build(), values.build());
      return mapExp.equals(this) ? this : mapExp;
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("{");
      for (int i = 0; i < keys.size(); i++) {
        if (i > 0) {
          w.append(", ");
        }
        w.append(keys.get(i), 0, 0).append(": ").append(values.get(i), 0, 0);
      }
      return w.append("}");
    }
  }

  /** Polynomial in one variable, held as a coefficient vector. */
  public static class PolynomialExp extends Exp {
    public final Polynomial polynomial;

    PolynomialExp(Pos pos, Polynomial polynomial) {
      super(pos, Op.POLYNOMIAL, 1);
      this.polynomial = requireNonNull(polynomial);
    }

    @Override public int hashCode() {
      return polynomial.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof PolynomialExp
          && this.polynomial.equals(((PolynomialExp) o).polynomial);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of();
    }

    @Override public Exp copy(List<Exp> args) {
      checkArgument(args.isEmpty());
      return this;
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return polynomial.toExp().unparse(w, left, right);
    }
  }
}

// End Ast.java
