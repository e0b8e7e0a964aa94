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
package net.hydromatic.ipl.parse;

import static net.hydromatic.ipl.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import net.hydromatic.ipl.ast.Ast;
import net.hydromatic.ipl.check.Derivation;
import net.hydromatic.ipl.check.Environment;
import net.hydromatic.ipl.check.Rule;
import net.hydromatic.ipl.check.Sequent;
import net.hydromatic.ipl.type.Type;
import net.hydromatic.ipl.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests for {@link IplParser} and {@link Lexer}. */
public class IplParserTest {
  private final TypeSystem ts = new TypeSystem();

  private IplParser parser(String text) {
    return IplParser.create(ts, text);
  }

  /** Parses a type and checks its string form. */
  private void checkType(String text, String expected) {
    final Type type = parser(text).parseType();
    assertThat(type.toString(), is(expected));
    assertThat(parser(expected).parseType(), is(type));
  }

  /** Parses a term and checks its string form. */
  private void checkTerm(String text, String expected) {
    final Ast.Term term = parser(text).parseTerm();
    assertThat(term.toString(), is(expected));
    assertThat(parser(expected).parseTerm(), is(term));
  }

  /** Parses text, expecting an error with a given description. */
  private void checkError(String file, String text, String expected) {
    final IplParseException e =
        assertThrows(IplParseException.class,
            () -> new IplParser(ts, file, text).parseCommands());
    assertThat(e.describeTo(new StringBuilder()).toString(), is(expected));
  }

  @Test
  void testLexer() {
    final List<Lexer.Token> tokens =
        new Lexer("", "(x ⊢\n  ->) ; comment\nabc").scan();
    assertThat(tokens.toString(), is("[(, x, ⊢, ->, ), abc]"));
    assertThat(tokens.get(0).kind, is(Lexer.Kind.LEFT));
    assertThat(tokens.get(3).kind, is(Lexer.Kind.SYMBOL));
    assertThat(tokens.get(4).kind, is(Lexer.Kind.RIGHT));
    assertThat(tokens.get(2).pos.toString(), is("1.4"));
    assertThat(tokens.get(3).pos.toString(), is("2.3-2.5"));
    assertThat(tokens.get(5).pos.toString(), is("3.1-3.4"));
  }

  @Test
  void testType() {
    checkType("⊥", "⊥");
    checkType("bot", "⊥");
    checkType("P", "P");
    checkType("(P -> Q)", "(P -> Q)");
    checkType("(P → Q)", "(P -> Q)");
    checkType("(P * Q)", "(P × Q)");
    checkType("(P × (Q + bot))", "(P × (Q + ⊥))");
    checkType("((A + B) -> ⊥)", "((A + B) -> ⊥)");
  }

  @Test
  void testTerm() {
    checkTerm("x", "x");
    checkTerm("(cons a (inl b))", "(cons a (inl b))");
    checkTerm("(inr b)", "(inr b)");
    checkTerm("(case s f g)", "(case s f g)");
    checkTerm("(fst p)", "(car p)");
    checkTerm("(snd p)", "(cdr p)");
    checkTerm("(abort (car p))", "(abort (car p))");
    checkTerm("(lambda (x : (P -> Q)) x)", "(λ (x : (P -> Q)) x)");
    assertThat(parser("(λ (x : P) (inl x))").parseTerm(),
        is(ast.lambda("x", ts.atom("P"), ast.inl(ast.var("x")))));
  }

  @Test
  void testEnvironment() {
    final Environment env =
        parser("((y : Q) (x : (P + Q)))").parseEnvironment();
    assertThat(env.toString(), is("((x : (P + Q)) (y : Q))"));
    assertThat(env.getTypeOpt("y"), is(ts.atom("Q")));
    assertThat(parser("()").parseEnvironment().isEmpty(), is(true));
  }

  @Test
  void testSequent() {
    final Sequent s = parser("(((x : P)) ⊢ x : P)").parseSequent();
    assertThat(s.toString(), is("((x : P)) ⊢ x : P"));
    assertThat(parser("(((x : P)) |- x : P)").parseSequent(), is(s));
    assertThat(parser("(" + s + ")").parseSequent(), is(s));
  }

  @Test
  void testDerivation() {
    final String text =
        "(LambdaIntro (() ⊢ (λ (x : P) x) : (P -> P))\n"
            + "  (Assm (((x : P)) ⊢ x : P)))";
    final Derivation derivation = parser(text).parseDerivation();
    assertThat(derivation.rule(), is(Rule.LAMBDA_INTRO));
    assertThat(derivation.premises().size(), is(1));
    assertThat(derivation.toString(),
        is("(LambdaIntro (() ⊢ (λ (x : P) x) : (P -> P)) "
            + "(Assm (((x : P)) ⊢ x : P)))"));
    assertThat(parser(derivation.toString()).parseDerivation(),
        is(derivation));
  }

  @Test
  void testCommands() {
    final String text =
        "; identity\n"
            + "(check (() ⊢ (λ (x : P) x) : (P -> P))\n"
            + "  (LambdaIntro (() ⊢ (λ (x : P) x) : (P -> P))\n"
            + "    (Assm (((x : P)) ⊢ x : P))))\n"
            + "\n"
            + "(check (((x : P)) ⊢ x : P) (Assm (((x : P)) ⊢ x : P)))\n";
    final IplParser parser = parser(text);
    final List<Command> commands = parser.parseCommands();
    assertThat(parser.atEnd(), is(true));
    assertThat(commands.size(), is(2));
    assertThat(commands.get(1).toString(),
        is("(check (((x : P)) ⊢ x : P) (Assm (((x : P)) ⊢ x : P)))"));
    assertThat(commands.get(0).pos.toString(), is("2.1-4.33"));
    final Command reparsed = parser(commands.get(0).toString()).parseCommand();
    assertThat(reparsed.target, is(commands.get(0).target));
    assertThat(reparsed.derivation, is(commands.get(0).derivation));
  }

  /** The parser does not check premise counts; the checker does. */
  @Test
  void testPremiseCountNotChecked() {
    final Derivation derivation =
        parser("(Assm (((x : P)) ⊢ x : P) (Assm (((x : P)) ⊢ x : P)))")
            .parseDerivation();
    assertThat(derivation.premises().size(), is(1));
  }

  @Test
  void testErrors() {
    checkError("", ")", "1.1 Error: unexpected ')'");
    checkError("", "(check", "1.1 Error: missing ')'");
    checkError("f.ipl", "\n  (cons a)",
        "f.ipl:2.3-2.11 Error: expected a command (check sequent derivation)");
    checkError("", "(check (() ⊢ x : P) (Foo (() ⊢ x : P)))",
        "1.22-1.25 Error: unknown rule 'Foo'");
    checkError("", "(check (() ⊢ x : (P -> case)) (Assm (() ⊢ x : P)))",
        "1.24-1.28 Error: invalid type 'case'");
    checkError("", "(check (((x : P) (x : Q)) ⊢ x : P) (Assm (() ⊢ x : P)))",
        "1.18-1.25 Error: duplicate variable 'x'");
    checkError("", "(check (() ⊢ (cons a) : P) (Assm (() ⊢ x : P)))",
        "1.14-1.22 Error: expected (cons term term)");
    checkError("", "(check (() ⊢ (frob a) : P) (Assm (() ⊢ x : P)))",
        "1.14-1.22 Error: unknown term constructor 'frob'");
    checkError("", "(check (() x : P) (Assm (() ⊢ x : P)))",
        "1.8-1.18 Error: expected a sequent (env ⊢ term : type)");
    checkError("", "(check (() ⊢ (λ x x) : P) (Assm (() ⊢ x : P)))",
        "1.17 Error: expected (name : type)");
  }

  @Test
  void testEndOfInput() {
    final IplParseException e =
        assertThrows(IplParseException.class,
            () -> parser("(P -> Q)").parseTerm());
    assertThat(e.getMessage(), is("unknown term constructor 'P'"));
    final IplParseException e2 =
        assertThrows(IplParseException.class, () -> parser("").parseType());
    assertThat(e2.getMessage(), is("unexpected end of input"));
    assertThat(e2.pos().startLine, is(1));
  }
}

// End IplParserTest.java
