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
package net.hydromatic.ipl.check;

import static net.hydromatic.ipl.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableMap;
import net.hydromatic.ipl.ast.Ast;
import net.hydromatic.ipl.ast.Op;
import net.hydromatic.ipl.type.Type;
import net.hydromatic.ipl.type.TypeSystem;
import net.hydromatic.ipl.type.TypeVisitor;
import org.junit.jupiter.api.Test;

/** Tests for {@link Grammar}. */
public class GrammarTest {
  private final TypeSystem ts = new TypeSystem();
  private final Type p = ts.atom("P");

  @Test
  void testName() {
    assertThat(Grammar.isName("x"), is(true));
    assertThat(Grammar.isName("x1'"), is(true));
    assertThat(Grammar.isName("_tmp"), is(true));
    assertThat(Grammar.isName("α"), is(true));
    assertThat(Grammar.isName(""), is(false));
    assertThat(Grammar.isName("1x"), is(false));
    assertThat(Grammar.isName("a b"), is(false));
    assertThat(Grammar.isName("->"), is(false));
    assertThat(Grammar.isName(null), is(false));
    for (String word : Grammar.RESERVED) {
      assertThat(word, Grammar.isName(word), is(false));
    }
  }

  @Test
  void testType() {
    assertThat(Grammar.isType(p), is(true));
    assertThat(Grammar.isType(ts.bottom()), is(true));
    assertThat(
        Grammar.isType(ts.fnType(ts.sumType(p, ts.bottom()),
            ts.productType(p, p))),
        is(true));
    assertThat(Grammar.isType(null), is(false));
    assertThat(Grammar.isType("P"), is(false));
    assertThat(Grammar.isType(ast.var("x")), is(false));
    assertThat(Grammar.invalidType(ts.atom("cons")),
        is("invalid base type name 'cons'"));
    assertThat(Grammar.invalidType(ts.productType(p, ts.atom("1"))),
        is("invalid base type name '1'"));
  }

  /** A type implementation from outside this library is not well-formed. */
  @Test
  void testForeignType() {
    final Type foreign =
        new Type() {
          @Override
          public Op op() {
            return Op.ATOM_TYPE;
          }

          @Override
          public StringBuilder describe(StringBuilder buf) {
            return buf.append("P");
          }

          @Override
          public <R> R accept(TypeVisitor<R> typeVisitor) {
            return null;
          }
        };
    assertThat(Grammar.isType(foreign), is(false));
    assertThat(Grammar.isType(ts.fnType(p, foreign)), is(false));
  }

  @Test
  void testTerm() {
    final Ast.Term ok =
        ast.caseOf(ast.var("s"),
            ast.lambda("a", p, ast.inl(ast.var("a"))),
            ast.lambda("b", p, ast.inr(ast.var("b"))));
    assertThat(Grammar.invalidTerm(ok), nullValue());
    assertThat(Grammar.isTerm(ast.abort(ast.fst(ast.var("x")))), is(true));
    assertThat(Grammar.isTerm(null), is(false));
    assertThat(Grammar.isTerm(p), is(false));
    assertThat(Grammar.invalidTerm(ast.pair(ast.var("x"), ast.var("inl"))),
        is("invalid variable name 'inl'"));
    assertThat(Grammar.invalidTerm(ast.lambda("λ", p, ast.var("x"))),
        is("invalid parameter name 'λ'"));
    assertThat(
        Grammar.invalidTerm(ast.lambda("x", ts.atom("bot"), ast.var("x"))),
        is("invalid base type name 'bot'"));
  }

  /** Every part of a {@code case} is checked, including the last branch. */
  @Test
  void testCaseBranches() {
    final Ast.Var good = ast.var("f");
    final Ast.Var bad = ast.var("9");
    assertThat(Grammar.isTerm(ast.caseOf(bad, good, good)), is(false));
    assertThat(Grammar.isTerm(ast.caseOf(good, bad, good)), is(false));
    assertThat(Grammar.isTerm(ast.caseOf(good, good, bad)), is(false));
    assertThat(Grammar.isTerm(ast.caseOf(good, good, good)), is(true));
  }

  @Test
  void testEnvironment() {
    assertThat(Grammar.isEnvironment(Environments.empty()), is(true));
    assertThat(
        Grammar.isEnvironment(Environments.of(ImmutableMap.of("x", p))),
        is(true));
    assertThat(Grammar.isEnvironment(ImmutableMap.of("x", p)), is(false));
    assertThat(
        Grammar.invalidEnvironment(Environments.of(ImmutableMap.of("cdr", p))),
        is("invalid variable name 'cdr'"));
    assertThat(
        Grammar.invalidEnvironment(
            Environments.of(ImmutableMap.of("x", ts.atom("x y")))),
        is("invalid base type name 'x y'"));
  }

  /** Very deep terms and types are validated without recursion, and a
   * validator with a maximum depth rejects those deeper than it. */
  @Test
  void testDeep() {
    Ast.Term term = ast.var("f");
    Type type = p;
    for (int i = 0; i < 200_000; i++) {
      term = ast.abort(term);
      type = ts.fnType(p, type);
    }
    assertThat(Grammar.isTerm(term), is(true));
    assertThat(Grammar.isType(type), is(true));

    final Grammar.Validator validator = new Grammar.Validator(1_000, true);
    assertThat(validator.term(term), is("term is deeper than 1000"));
    assertThat(new Grammar.Validator(1_000, true).type(type),
        is("type is deeper than 1000"));
    assertThat(new Grammar.Validator(1_000, false).type(type),
        is("type is deeper than 1000"));
    assertThat(new Grammar.Validator(2, true).term(ast.abort(ast.var("f"))),
        nullValue());
    assertThat(
        new Grammar.Validator(2, true)
            .term(ast.lambda("x", ts.fnType(p, p, p, p), ast.var("x"))),
        is("type is deeper than 2"));
  }

  /** A sub-term or sub-type that occurs many times is validated once. */
  @Test
  void testShared() {
    Ast.Term term = ast.var("x");
    Type type = p;
    for (int i = 0; i < 64; i++) {
      term = ast.pair(term, term);
      type = ts.productType(type, type);
    }
    assertThat(Grammar.isTerm(term), is(true));
    assertThat(Grammar.isType(type), is(true));
    assertThat(
        Grammar.isEnvironment(Environments.of(ImmutableMap.of("x", type))),
        is(true));

    // The same sub-term is checked again if it occurs deeper.
    final Ast.Term leaf = ast.abort(ast.var("f"));
    final Ast.Term shallow = ast.pair(leaf, ast.inl(leaf));
    assertThat(new Grammar.Validator(2, true).term(shallow),
        is("term is deeper than 2"));
  }

  /** A validator that is not strict checks only depth. */
  @Test
  void testLenient() {
    final Grammar.Validator validator = new Grammar.Validator(10, false);
    assertThat(validator.term(ast.var("case")), nullValue());
    assertThat(validator.type(ts.atom("not a name!")), nullValue());
    assertThat(validator.term(null), is("not a term: null"));
  }
}

// End GrammarTest.java
