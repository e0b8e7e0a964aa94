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

import com.google.common.collect.ImmutableMap;
import net.hydromatic.ipl.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Inference rule of natural deduction for intuitionistic propositional logic.
 *
 * <p>Each rule concludes a sequent whose term has a particular constructor,
 * and has a fixed number of premises.
 */
public enum Rule {
  /** Assumption: "Γ ⊢ x : T" if Γ binds x to T. */
  ASSM("Assm", Op.ID, 0),

  /** "Γ ⊢ (cons e0 e1) : (A × B)" from "Γ ⊢ e0 : A" and "Γ ⊢ e1 : B". */
  PAIR_INTRO("PairIntro", Op.PAIR, 2),

  /** "Γ ⊢ (inl e) : (A + B)" from "Γ ⊢ e : A". */
  IN_L_INTRO("InLIntro", Op.INL, 1),

  /** "Γ ⊢ (inr e) : (A + B)" from "Γ ⊢ e : B". */
  IN_R_INTRO("InRIntro", Op.INR, 1),

  /**
   * "Γ ⊢ (case e e1 e2) : T" from "Γ ⊢ e : (A + B)", "Γ ⊢ e1 : (A -> T)" and
   * "Γ ⊢ e2 : (B -> T)".
   */
  CASE_ELIM("CaseElim", Op.CASE, 3),

  /** "Γ ⊢ (car e) : A" from "Γ ⊢ e : (A × B)". */
  FST_ELIM("FstElim", Op.FST, 1),

  /** "Γ ⊢ (cdr e) : B" from "Γ ⊢ e : (A × B)". */
  SND_ELIM("SndElim", Op.SND, 1),

  /** "Γ ⊢ (λ (x : A) e) : (A -> B)" from "Γ, x : A ⊢ e : B". */
  LAMBDA_INTRO("LambdaIntro", Op.LAMBDA, 1),

  /** "Γ ⊢ (abort e) : T", for any T, from "Γ ⊢ e : ⊥". */
  BOTTOM_ELIM("BottomElim", Op.ABORT, 1);

  /** Name of the rule in proof scripts, e.g. "{@code PairIntro}". */
  public final String tag;

  /** Operator of the term in the rule's conclusion. */
  public final Op termOp;

  /** Number of premises. */
  public final int premiseCount;

  private static final ImmutableMap<String, Rule> BY_TAG;

  static {
    final ImmutableMap.Builder<String, Rule> b = ImmutableMap.builder();
    for (Rule rule : values()) {
      b.put(rule.tag, rule);
    }
    BY_TAG = b.build();
  }

  Rule(String tag, Op termOp, int premiseCount) {
    this.tag = tag;
    this.termOp = termOp;
    this.premiseCount = premiseCount;
  }

  /** Looks up a rule by its tag; returns null if not found. */
  public static @Nullable Rule lookup(String tag) {
    return BY_TAG.get(tag);
  }

  @Override
  public String toString() {
    return tag;
  }
}

// End Rule.java
