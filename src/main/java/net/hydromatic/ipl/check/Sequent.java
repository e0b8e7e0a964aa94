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

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.ipl.ast.Ast;
import net.hydromatic.ipl.type.Type;

/**
 * Judgment "Γ ⊢ term : type": in environment Γ, {@code term} has type {@code
 * type}.
 *
 * <p>Two sequents are equal if their environments map the same names to the
 * same types, and their terms and types are syntactically identical.
 */
public class Sequent {
  public final Environment env;
  public final Ast.Term term;
  public final Type type;

  private Sequent(Environment env, Ast.Term term, Type type) {
    this.env = requireNonNull(env);
    this.term = requireNonNull(term);
    this.type = requireNonNull(type);
  }

  /** Creates a sequent. */
  public static Sequent of(Environment env, Ast.Term term, Type type) {
    return new Sequent(env, term, type);
  }

  /** Returns a sequent with the same environment and term but another type. */
  Sequent withType(Type type) {
    return type.equals(this.type) ? this : of(env, term, type);
  }

  /** Returns a sequent with the same environment and type but another term. */
  Sequent withTerm(Ast.Term term) {
    return term.equals(this.term) ? this : of(env, term, type);
  }

  /** Returns a sequent with the same term and type but another environment. */
  Sequent withEnv(Environment env) {
    return env.equals(this.env) ? this : of(env, term, type);
  }

  @Override
  public int hashCode() {
    return Objects.hash(env, term, type);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Sequent
            && term.equals(((Sequent) o).term)
            && type.equals(((Sequent) o).type)
            && env.equals(((Sequent) o).env);
  }

  /** Converts this sequent to a string, e.g. "{@code ((x : P)) ⊢ x : P}". */
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    buf.append(env).append(" ⊢ ").append(term).append(" : ");
    return type.describe(buf).toString();
  }
}

// End Sequent.java
