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
package net.hydromatic.ipl.ast;

import net.hydromatic.ipl.type.Type;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  public Ast.Var var(Pos pos, String name) {
    return new Ast.Var(pos, name);
  }

  public Ast.Var var(String name) {
    return var(Pos.ZERO, name);
  }

  public Ast.Pair pair(Pos pos, Ast.Term e0, Ast.Term e1) {
    return new Ast.Pair(pos, e0, e1);
  }

  public Ast.Pair pair(Ast.Term e0, Ast.Term e1) {
    return pair(Pos.ZERO, e0, e1);
  }

  public Ast.InL inl(Pos pos, Ast.Term exp) {
    return new Ast.InL(pos, exp);
  }

  public Ast.InL inl(Ast.Term exp) {
    return inl(Pos.ZERO, exp);
  }

  public Ast.InR inr(Pos pos, Ast.Term exp) {
    return new Ast.InR(pos, exp);
  }

  public Ast.InR inr(Ast.Term exp) {
    return inr(Pos.ZERO, exp);
  }

  public Ast.Case caseOf(
      Pos pos, Ast.Term exp, Ast.Term left, Ast.Term right) {
    return new Ast.Case(pos, exp, left, right);
  }

  public Ast.Case caseOf(Ast.Term exp, Ast.Term left, Ast.Term right) {
    return caseOf(Pos.ZERO, exp, left, right);
  }

  public Ast.Fst fst(Pos pos, Ast.Term exp) {
    return new Ast.Fst(pos, exp);
  }

  public Ast.Fst fst(Ast.Term exp) {
    return fst(Pos.ZERO, exp);
  }

  public Ast.Snd snd(Pos pos, Ast.Term exp) {
    return new Ast.Snd(pos, exp);
  }

  public Ast.Snd snd(Ast.Term exp) {
    return snd(Pos.ZERO, exp);
  }

  public Ast.Lambda lambda(Pos pos, String name, Type type, Ast.Term body) {
    return new Ast.Lambda(pos, name, type, body);
  }

  public Ast.Lambda lambda(String name, Type type, Ast.Term body) {
    return lambda(Pos.ZERO, name, type, body);
  }

  public Ast.Abort abort(Pos pos, Ast.Term exp) {
    return new Ast.Abort(pos, exp);
  }

  public Ast.Abort abort(Ast.Term exp) {
    return abort(Pos.ZERO, exp);
  }
}

// End AstBuilder.java
