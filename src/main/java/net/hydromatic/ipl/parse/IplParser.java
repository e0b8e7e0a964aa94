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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.ipl.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.ipl.ast.Ast;
import net.hydromatic.ipl.ast.Pos;
import net.hydromatic.ipl.check.Derivation;
import net.hydromatic.ipl.check.Derivations;
import net.hydromatic.ipl.check.Environment;
import net.hydromatic.ipl.check.Environments;
import net.hydromatic.ipl.check.Grammar;
import net.hydromatic.ipl.check.Rule;
import net.hydromatic.ipl.check.Sequent;
import net.hydromatic.ipl.type.Type;
import net.hydromatic.ipl.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parser for proof scripts.
 *
 * <p>Everything is written as an s-expression:
 *
 * <pre>
 * type     ::= ⊥ | bot | NAME
 *            | ( type -&gt; type ) | ( type × type ) | ( type + type )
 * term     ::= NAME | ( cons term term ) | ( inl term ) | ( inr term )
 *            | ( case term term term ) | ( car term ) | ( cdr term )
 *            | ( λ ( NAME : type ) term ) | ( abort term )
 * env      ::= ( ( NAME : type ) * )
 * sequent  ::= ( env ⊢ term : type )
 * proof    ::= ( RULE sequent proof * )
 * command  ::= ( check sequent proof )
 * </pre>
 *
 * <p>Alternative spellings: "{@code →}" for "{@code ->}", "{@code *}" for
 * "{@code ×}", "{@code |-}" for "{@code ⊢}", "{@code lambda}" for "{@code λ}",
 * "{@code fst}" and "{@code snd}" for "{@code car}" and "{@code cdr}".
 *
 * <p>The parser checks syntax only. It does not check that a proof has the
 * right number of premises for its rule, or anything else that {@link
 * net.hydromatic.ipl.check.DerivationChecker} checks.
 */
public class IplParser {
  private final TypeSystem typeSystem;
  private final String file;
  private final List<Lexer.Token> tokens;
  private int index;

  /** Creates a parser. */
  public IplParser(TypeSystem typeSystem, String file, String text) {
    this.typeSystem = requireNonNull(typeSystem);
    this.file = requireNonNull(file);
    this.tokens = new Lexer(file, text).scan();
  }

  /** Creates a parser for a string that does not come from a file. */
  public static IplParser create(TypeSystem typeSystem, String text) {
    return new IplParser(typeSystem, "", text);
  }

  /** Returns whether all input has been consumed. */
  public boolean atEnd() {
    return index >= tokens.size();
  }

  /** Reads a type. */
  public Type parseType() {
    return toType(read());
  }

  /** Reads a term. */
  public Ast.Term parseTerm() {
    return toTerm(read());
  }

  /** Reads an environment. */
  public Environment parseEnvironment() {
    return toEnvironment(read());
  }

  /** Reads a sequent. */
  public Sequent parseSequent() {
    return toSequent(read());
  }

  /** Reads a derivation. */
  public Derivation parseDerivation() {
    return toDerivation(read());
  }

  /** Reads a command. */
  public Command parseCommand() {
    return toCommand(read());
  }

  /** Reads commands until the end of input. */
  public List<Command> parseCommands() {
    final ImmutableList.Builder<Command> commands = ImmutableList.builder();
    while (!atEnd()) {
      commands.add(parseCommand());
    }
    return commands.build();
  }

  private IplParseException error(String message, Pos pos) {
    return new IplParseException(message, pos);
  }

  /** Reads an s-expression. */
  private Sexp read() {
    if (atEnd()) {
      final Pos pos =
          tokens.isEmpty()
              ? new Pos(file, 1, 1, 1, 1)
              : tokens.get(tokens.size() - 1).pos;
      throw error("unexpected end of input", pos);
    }
    final Lexer.Token token = tokens.get(index++);
    switch (token.kind) {
    case SYMBOL:
      return new Sexp(token.pos, token.text, ImmutableList.of());
    case RIGHT:
      throw error("unexpected ')'", token.pos);
    default:
      final List<Sexp> list = new ArrayList<>();
      for (;;) {
        if (atEnd()) {
          throw error("missing ')'", token.pos);
        }
        final Lexer.Token next = tokens.get(index);
        if (next.kind == Lexer.Kind.RIGHT) {
          ++index;
          return new Sexp(token.pos.plus(next.pos), null, list);
        }
        list.add(read());
      }
    }
  }

  private Type toType(Sexp x) {
    if (x.symbol != null) {
      switch (x.symbol) {
      case "⊥":
      case "bot":
        return typeSystem.bottom();
      default:
        if (!Grammar.isName(x.symbol)) {
          throw error("invalid type '" + x.symbol + "'", x.pos);
        }
        return typeSystem.atom(x.symbol);
      }
    }
    if (x.list.size() == 3 && x.list.get(1).symbol != null) {
      final Sexp left = x.list.get(0);
      final Sexp right = x.list.get(2);
      switch (x.list.get(1).symbol) {
      case "->":
      case "→":
        return typeSystem.fnType(toType(left), toType(right));
      case "×":
      case "*":
        return typeSystem.productType(toType(left), toType(right));
      case "+":
        return typeSystem.sumType(toType(left), toType(right));
      default:
        break;
      }
    }
    throw error(
        "expected a type such as (A -> B), (A × B) or (A + B)", x.pos);
  }

  private Ast.Term toTerm(Sexp x) {
    if (x.symbol != null) {
      if (!Grammar.isName(x.symbol)) {
        throw error("invalid variable name '" + x.symbol + "'", x.pos);
      }
      return ast.var(x.pos, x.symbol);
    }
    final String keyword = x.head();
    if (keyword == null) {
      throw error("expected a term", x.pos);
    }
    switch (keyword) {
    case "cons":
      x.checkSize(3, "(cons term term)");
      return ast.pair(x.pos, toTerm(x.list.get(1)), toTerm(x.list.get(2)));
    case "inl":
      x.checkSize(2, "(inl term)");
      return ast.inl(x.pos, toTerm(x.list.get(1)));
    case "inr":
      x.checkSize(2, "(inr term)");
      return ast.inr(x.pos, toTerm(x.list.get(1)));
    case "case":
      x.checkSize(4, "(case term term term)");
      return ast.caseOf(x.pos, toTerm(x.list.get(1)), toTerm(x.list.get(2)),
          toTerm(x.list.get(3)));
    case "car":
    case "fst":
      x.checkSize(2, "(car term)");
      return ast.fst(x.pos, toTerm(x.list.get(1)));
    case "cdr":
    case "snd":
      x.checkSize(2, "(cdr term)");
      return ast.snd(x.pos, toTerm(x.list.get(1)));
    case "abort":
      x.checkSize(2, "(abort term)");
      return ast.abort(x.pos, toTerm(x.list.get(1)));
    case "λ":
    case "lambda":
      x.checkSize(3, "(λ (name : type) term)");
      final Sexp param = x.list.get(1);
      final String name = toBindingName(param);
      return ast.lambda(x.pos, name, toType(param.list.get(2)),
          toTerm(x.list.get(2)));
    default:
      throw error("unknown term constructor '" + keyword + "'", x.pos);
    }
  }

  /**
   * Checks that an s-expression has the form "{@code (name : type)}" and
   * returns the name.
   */
  private String toBindingName(Sexp x) {
    if (x.list.size() != 3 || !":".equals(x.list.get(1).symbol)) {
      throw error("expected (name : type)", x.pos);
    }
    final Sexp name = x.list.get(0);
    if (!Grammar.isName(name.symbol)) {
      throw error("invalid variable name '" + name + "'", name.pos);
    }
    return requireNonNull(name.symbol);
  }

  private Environment toEnvironment(Sexp x) {
    if (x.symbol != null) {
      throw error("expected an environment", x.pos);
    }
    final Map<String, Type> map = new LinkedHashMap<>();
    for (Sexp binding : x.list) {
      final String name = toBindingName(binding);
      if (map.put(name, toType(binding.list.get(2))) != null) {
        throw error("duplicate variable '" + name + "'", binding.pos);
      }
    }
    return Environments.of(map);
  }

  private Sequent toSequent(Sexp x) {
    if (x.list.size() != 5
        || !isTurnstile(x.list.get(1).symbol)
        || !":".equals(x.list.get(3).symbol)) {
      throw error("expected a sequent (env ⊢ term : type)", x.pos);
    }
    return Sequent.of(
        toEnvironment(x.list.get(0)),
        toTerm(x.list.get(2)),
        toType(x.list.get(4)));
  }

  private static boolean isTurnstile(@Nullable String symbol) {
    return "⊢".equals(symbol) || "|-".equals(symbol);
  }

  private Derivation toDerivation(Sexp x) {
    final String tag = x.head();
    if (tag == null || x.list.size() < 2) {
      throw error("expected a derivation (rule sequent derivation...)", x.pos);
    }
    final Rule rule = Rule.lookup(tag);
    if (rule == null) {
      throw error("unknown rule '" + tag + "'", x.list.get(0).pos);
    }
    final Sequent conclusion = toSequent(x.list.get(1));
    final List<Derivation> premises = new ArrayList<>();
    for (Sexp premise : x.list.subList(2, x.list.size())) {
      premises.add(toDerivation(premise));
    }
    return Derivations.of(rule, conclusion, premises);
  }

  private Command toCommand(Sexp x) {
    if (!"check".equals(x.head()) || x.list.size() != 3) {
      throw error("expected a command (check sequent derivation)", x.pos);
    }
    return new Command(
        x.pos, toSequent(x.list.get(1)), toDerivation(x.list.get(2)));
  }

  /** S-expression: either a symbol or a parenthesized list. */
  private class Sexp {
    final Pos pos;
    final @Nullable String symbol;
    final List<Sexp> list;

    Sexp(Pos pos, @Nullable String symbol, List<Sexp> list) {
      this.pos = pos;
      this.symbol = symbol;
      this.list = list;
    }

    /** Returns the symbol at the start of this list, or null. */
    @Nullable String head() {
      return list.isEmpty() ? null : list.get(0).symbol;
    }

    void checkSize(int size, String form) {
      if (list.size() != size) {
        throw error("expected " + form, pos);
      }
    }

    @Override
    public String toString() {
      return symbol != null ? symbol : list.toString();
    }
  }
}

// End IplParser.java
