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

/** Visits syntax trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  protected void visit(Ast.Literal literal) {}

  protected void visit(Ast.Id id) {}

  protected void visit(Ast.InfixCall infixCall) {
    infixCall.a0.accept(this);
    infixCall.a1.accept(this);
  }

  protected void visit(Ast.Unary unary) {
    unary.a.accept(this);
  }

  protected void visit(Ast.Apply apply) {
    apply.args.forEach(this::accept);
  }

  protected void visit(Ast.Group group) {
    group.exp.accept(this);
  }

  protected void visit(Ast.If anIf) {
    anIf.condition.accept(this);
    anIf.ifTrue.accept(this);
    anIf.ifFalse.accept(this);
  }

  protected void visit(Ast.Member member) {
    member.exp.accept(this);
  }

  protected void visit(Ast.Index index) {
    index.exp.accept(this);
    index.key.accept(this);
  }

  protected void visit(Ast.ListExp list) {
    list.args.forEach(this::accept);
  }

  protected void visit(Ast.MapExp map) {
    map.keys.forEach(this::accept);
    map.values.forEach(this::accept);
  }

  protected void visit(Ast.PolynomialExp polynomialExp) {}
}

// End Visitor.java
