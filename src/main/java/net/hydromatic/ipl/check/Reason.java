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

import com.google.common.base.CaseFormat;

/** Reason that {@link DerivationChecker} rejected a derivation. */
public enum Reason {
  /** The input term, type, environment or derivation is not well-formed. */
  MALFORMED_INPUT,

  /**
   * The derivation is not a finite tree of the expected shape: it contains a
   * cycle, lacks a rule or a conclusion, or has the wrong number of premises
   * for its rule.
   */
  MALFORMED_PROOF_STRUCTURE,

  /** The derivation's conclusion differs from the sequent it must prove. */
  CONCLUSION_TARGET_MISMATCH,

  /** The conclusion's term is not built by the rule's term constructor. */
  RULE_TERM_MISMATCH,

  /** The conclusion's type does not have the shape the rule requires. */
  RULE_TYPE_MISMATCH,

  /**
   * A premise concludes a sequent other than the one the rule requires of
   * it.
   */
  PREMISE_CONCLUSION_MISMATCH,

  /**
   * A premise is not itself a valid derivation. Reported by {@link
   * CheckResult.Reject#reasonAtRoot()} when the first mismatch is below the
   * root.
   */
  PREMISE_INVALID,

  /** An assumption refers to a variable that the environment does not bind. */
  UNBOUND_VARIABLE;

  /** Name of this reason in messages, e.g. "{@code rule-term-mismatch}". */
  public final String label =
      CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_HYPHEN, name());

  @Override
  public String toString() {
    return label;
  }
}

// End Reason.java
