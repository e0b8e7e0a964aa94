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

import java.util.List;

/**
 * Derivation (proof tree): an application of an inference rule to premises,
 * recording the sequent that it claims to conclude.
 *
 * <p>A derivation is untrusted input. It is typically built by a prover
 * outside this library, which may supply its own implementation of this class;
 * {@link DerivationChecker} copes with implementations that return null
 * components, the wrong number of premises, or that contain cycles.
 *
 * <p>To create a derivation, call {@link Derivations#of}.
 */
public abstract class Derivation {
  /** Returns the rule applied at the root of this derivation. */
  public abstract Rule rule();

  /** Returns the sequent that this derivation claims to conclude. */
  public abstract Sequent conclusion();

  /** Returns the sub-derivations that establish the rule's premises. */
  public abstract List<? extends Derivation> premises();

  /**
   * Converts this derivation to a string, e.g. "{@code (Assm (((x : P)) ⊢ x :
   * P))}".
   */
  @Override
  public String toString() {
    return describe(new StringBuilder()).toString();
  }

  /** Writes this derivation to a string builder. */
  public StringBuilder describe(StringBuilder buf) {
    buf.append('(').append(rule())
        .append(" (").append(conclusion()).append(')');
    for (Derivation premise : premises()) {
      premise.describe(buf.append(' '));
    }
    return buf.append(')');
  }
}

// End Derivation.java
