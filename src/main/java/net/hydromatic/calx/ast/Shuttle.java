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

/** Visits and transforms syntax trees.
 *
 * <p>Each method returns a copy of its node with transformed children, or
 * the node itself if no child changed. Sub-classes override the methods for
 * the nodes they replace. */
public class Shuttle {
  /** Creates a Shuttle. */
  public Shuttle() {
  }

  protected List<Ast.Exp> visitList(List<Ast.Exp> exps) {
    final ImmutableList.Builder<Ast.Exp> list = ImmutableList.builder();
    for (Ast.Exp exp : exps) {
      list.add(exp.accept(this));
    }
    return list.build();
  }

  public Ast.Exp visit(Ast.Literal literal) {
    return literal;
  }

  public Ast.Exp visit(Ast.Id id) {
    return id;
  }

  public Ast.Exp visit(Ast.InfixCall infixCall) {
    return infixCall.copy(infixCall.a0.accept(this),
        infixCall.a1.accept(this));
  }

  public Ast.Exp visit(Ast.Unary unary) {
    return unary.copy(unary.a.accept(this));
  }

  public Ast.Exp visit(Ast.Apply apply) {
    return apply.copy(visitList(apply.args));
  }

  public Ast.Exp visit(Ast.Group group) {
    return group.copy(ImmutableList.of(group.exp.accept(this)));
  }

  public Ast.Exp visit(Ast.If anIf) {
    return anIf.copy(anIf.condition.accept(this), anIf.ifTrue.accept(this),
        anIf.ifFalse.accept(this));
  }

  public Ast.Exp visit(Ast.Member member) {
    return member.copy(ImmutableList.of(member.exp.accept(this)));
  }

  public Ast.Exp visit(Ast.Index index) {
    return index.copy(
        ImmutableList.of(index.exp.accept(this), index.key.accept(this)));
  }

  public Ast.Exp visit(Ast.ListExp list) {
    return list.copy(visitList(list.args));
  }

  public Ast.Exp visit(Ast.MapExp map) {
    return map.copy(visitList(map.args()));
  }

  public Ast.Exp visit(Ast.PolynomialExp polynomialExp) {
    return polynomialExp;
  }
}

// End Shuttle.java
