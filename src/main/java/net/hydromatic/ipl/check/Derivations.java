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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Utilities for {@link Derivation}. */
public abstract class Derivations {
  private Derivations() {}

  /** Creates a derivation. */
  public static Derivation of(
      Rule rule, Sequent conclusion, Derivation... premises) {
    return new TreeDerivation(
        rule, conclusion, ImmutableList.copyOf(premises));
  }

  /** Creates a derivation. */
  public static Derivation of(
      Rule rule, Sequent conclusion, Iterable<? extends Derivation> premises) {
    return new TreeDerivation(
        rule, conclusion, ImmutableList.copyOf(premises));
  }

  /**
   * Returns a copy of a derivation with a different conclusion and the same
   * rule and premises.
   */
  public static Derivation withConclusion(
      Derivation derivation, Sequent conclusion) {
    return of(derivation.rule(), conclusion, derivation.premises());
  }

  /**
   * Returns a copy of a derivation with its {@code i}th premise replaced.
   *
   * @throws IndexOutOfBoundsException if there is no such premise
   */
  public static Derivation withPremise(
      Derivation derivation, int i, Derivation premise) {
    final List<Derivation> premises =
        new ArrayList<>(derivation.premises());
    premises.set(i, premise);
    return of(derivation.rule(), derivation.conclusion(), premises);
  }

  /** Derivation whose premises are held in an immutable list. */
  private static class TreeDerivation extends Derivation {
    private final Rule rule;
    private final Sequent conclusion;
    private final ImmutableList<Derivation> premises;

    TreeDerivation(
        Rule rule, Sequent conclusion, ImmutableList<Derivation> premises) {
      this.rule = requireNonNull(rule);
      this.conclusion = requireNonNull(conclusion);
      this.premises = requireNonNull(premises);
    }

    @Override
    public Rule rule() {
      return rule;
    }

    @Override
    public Sequent conclusion() {
      return conclusion;
    }

    @Override
    public List<Derivation> premises() {
      return premises;
    }

    @Override
    public int hashCode() {
      return Objects.hash(rule, conclusion, premises);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof TreeDerivation
              && rule == ((TreeDerivation) o).rule
              && conclusion.equals(((TreeDerivation) o).conclusion)
              && premises.equals(((TreeDerivation) o).premises);
    }
  }
}

// End Derivations.java
