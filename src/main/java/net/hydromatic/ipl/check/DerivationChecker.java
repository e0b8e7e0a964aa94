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
import static net.hydromatic.ipl.check.CheckResult.reject;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.ipl.ast.Ast;
import net.hydromatic.ipl.type.FnType;
import net.hydromatic.ipl.type.ProductType;
import net.hydromatic.ipl.type.SumType;
import net.hydromatic.ipl.type.Type;
import net.hydromatic.ipl.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Decides whether a derivation is a valid proof of a sequent.
 *
 * <p>The checker examines each node of the derivation, from the root down. At
 * each node it confirms that:
 *
 * <ol>
 *   <li>the node's recorded conclusion, and the conclusion recorded by each of
 *       its premises, is well-formed and no deeper than {@link
 *       Prop#MAX_DEPTH};
 *   <li>the node's recorded conclusion is the sequent that the node must
 *       prove (the caller's target at the root, the rule's requirement below
 *       it);
 *   <li>the node has as many premises as its rule requires;
 *   <li>the conclusion's term is built by the rule's term constructor;
 *   <li>the conclusion's type has the shape the rule requires;
 *   <li>each premise records exactly the conclusion that the rule requires of
 *       it;
 *   <li>each premise is itself a valid derivation of its recorded conclusion.
 * </ol>
 *
 * <p>The first failure rejects the whole derivation. Equality of types, terms
 * and environments is syntactic; terms that differ only in the names of bound
 * variables are different.
 *
 * <p>A sub-derivation that occurs more than once, compared by identity, is
 * not checked again if it has just been accepted as proving the same
 * sequent.
 *
 * <p>A checker has no mutable state; {@link #check} is a pure function of its
 * arguments and the checker's properties, and may be called from several
 * threads at once.
 */
public class DerivationChecker {
  private final TypeSystem typeSystem;
  private final ImmutableMap<Prop, Object> propMap;
  private final Tracer tracer;

  /** Creates a checker with default properties and no tracing. */
  public DerivationChecker() {
    this(ImmutableMap.of(), Tracers.empty());
  }

  /** Creates a checker. */
  public DerivationChecker(Map<Prop, Object> propMap, Tracer tracer) {
    this.typeSystem = new TypeSystem();
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = requireNonNull(tracer);
  }

  /**
   * Checks whether {@code derivation} is a valid derivation of "{@code env ⊢
   * term : type}".
   */
  public CheckResult check(
      @Nullable Derivation derivation,
      @Nullable Environment env,
      Ast.@Nullable Term term,
      @Nullable Type type) {
    if (env == null || term == null || type == null) {
      return done(
          reject(
              Reason.MALFORMED_INPUT,
              Location.ROOT,
              "environment, term and type are required"));
    }
    return check(derivation, Sequent.of(env, term, type));
  }

  /** Checks whether {@code derivation} is a valid derivation of a sequent. */
  public CheckResult check(
      @Nullable Derivation derivation, @Nullable Sequent target) {
    if (derivation == null || target == null) {
      return done(
          reject(
              Reason.MALFORMED_INPUT,
              Location.ROOT,
              "derivation and target sequent are required"));
    }
    final Grammar.Validator validator =
        new Grammar.Validator(Prop.MAX_DEPTH.intValue(propMap),
            Prop.CHECK_INPUT.booleanValue(propMap));
    final String problem = validator.sequent(target);
    if (problem != null) {
      return done(reject(Reason.MALFORMED_INPUT, Location.ROOT, problem));
    }
    final Set<Derivation> ancestors =
        Collections.newSetFromMap(new IdentityHashMap<>());
    final Map<Derivation, Sequent> verified = new IdentityHashMap<>();
    return done(
        check(derivation, target, Location.ROOT,
            new Context(validator, ancestors, verified)));
  }

  private CheckResult done(CheckResult result) {
    tracer.onResult(result);
    return result;
  }

  /**
   * Checks a sub-derivation.
   *
   * @param derivation Sub-derivation
   * @param target Sequent that the sub-derivation must prove; already
   *     validated
   * @param location Location of the sub-derivation within the whole
   * @param cx State shared by all nodes of one call to {@link #check}
   */
  private CheckResult check(
      Derivation derivation,
      Sequent target,
      Location location,
      Context cx) {
    if (!cx.ancestors.add(derivation)) {
      return reject(
          Reason.MALFORMED_PROOF_STRUCTURE,
          location,
          "derivation contains a cycle");
    }
    try {
      if (target.equals(cx.verified.get(derivation))) {
        return CheckResult.accept();
      }
      final Rule rule = derivation.rule();
      final Sequent conclusion = derivation.conclusion();
      final List<? extends Derivation> premises = derivation.premises();
      if (rule == null || conclusion == null || premises == null) {
        return reject(
            Reason.MALFORMED_PROOF_STRUCTURE,
            location,
            "derivation must have a rule, a conclusion and premises");
      }
      final String problem = cx.validator.sequent(conclusion);
      if (problem != null) {
        return reject(Reason.MALFORMED_INPUT, location, problem);
      }
      tracer.onStep(location, derivation);
      if (!conclusion.equals(target)) {
        return reject(
            Reason.CONCLUSION_TARGET_MISMATCH,
            location,
            "derivation concludes " + conclusion + ", but must prove "
                + target);
      }

      // Read each premise's conclusion once; the recursive check below
      // requires the premise to prove exactly what was read here.
      final ImmutableList.Builder<Derivation> premiseBuilder =
          ImmutableList.builder();
      final ImmutableList.Builder<Sequent> conclusionBuilder =
          ImmutableList.builder();
      for (int i = 0; i < premises.size(); i++) {
        final Derivation premise = premises.get(i);
        final Sequent premiseConclusion =
            premise == null ? null : premise.conclusion();
        if (premiseConclusion == null) {
          return reject(
              Reason.MALFORMED_PROOF_STRUCTURE,
              location.premise(i),
              "premise must have a conclusion");
        }
        final String premiseProblem =
            cx.validator.sequent(premiseConclusion);
        if (premiseProblem != null) {
          return reject(
              Reason.MALFORMED_INPUT, location.premise(i), premiseProblem);
        }
        premiseBuilder.add(premise);
        conclusionBuilder.add(premiseConclusion);
      }
      final List<Derivation> premiseList = premiseBuilder.build();
      final List<Sequent> conclusions = conclusionBuilder.build();
      if (premiseList.size() != rule.premiseCount) {
        return reject(
            Reason.MALFORMED_PROOF_STRUCTURE,
            location,
            "rule " + rule + " requires " + rule.premiseCount
                + " premise(s), but derivation has " + premiseList.size());
      }
      if (conclusion.term.op != rule.termOp) {
        return reject(
            Reason.RULE_TERM_MISMATCH,
            location,
            "rule " + rule + " cannot conclude term " + conclusion.term);
      }

      final CheckResult.Reject reject =
          checkRule(rule, conclusion, conclusions, location);
      if (reject != null) {
        return reject;
      }

      for (int i = 0; i < premiseList.size(); i++) {
        final CheckResult result =
            check(
                premiseList.get(i),
                conclusions.get(i),
                location.premise(i),
                cx);
        if (!result.isAccept()) {
          return result;
        }
      }
      cx.verified.put(derivation, target);
      return CheckResult.accept();
    } finally {
      cx.ancestors.remove(derivation);
    }
  }

  /**
   * Checks that a conclusion and the conclusions of its premises are an
   * instance of a rule. Returns null if they are, otherwise a rejection.
   *
   * <p>The caller has already checked that the conclusion's term has the
   * right operator and that there are the right number of premises.
   */
  private CheckResult.@Nullable Reject checkRule(
      Rule rule, Sequent s, List<Sequent> premises, Location location) {
    CheckResult.Reject reject;
    switch (rule) {
    case ASSM:
      final Ast.Var variable = (Ast.Var) s.term;
      final Type varType = s.env.getTypeOpt(variable.name);
      if (varType == null) {
        return reject(
            Reason.UNBOUND_VARIABLE,
            location,
            "variable '" + variable.name + "' is not bound in " + s.env);
      }
      if (!varType.equals(s.type)) {
        return reject(
            Reason.RULE_TYPE_MISMATCH,
            location,
            "environment gives '" + variable.name + "' type " + varType
                + ", not " + s.type);
      }
      return null;

    case PAIR_INTRO:
      if (!(s.type instanceof ProductType)) {
        return typeMismatch(rule, s, "a product type", location);
      }
      final Ast.Pair pair = (Ast.Pair) s.term;
      final ProductType pairType = (ProductType) s.type;
      reject =
          expect(premises, 0, Sequent.of(s.env, pair.e0, pairType.left),
              location);
      if (reject != null) {
        return reject;
      }
      return expect(premises, 1, Sequent.of(s.env, pair.e1, pairType.right),
          location);

    case IN_L_INTRO:
    case IN_R_INTRO:
      if (!(s.type instanceof SumType)) {
        return typeMismatch(rule, s, "a sum type", location);
      }
      final Ast.Unary injection = (Ast.Unary) s.term;
      final SumType sumType = (SumType) s.type;
      // The other side of the sum is taken from the conclusion; the premise
      // does not constrain it.
      final Type injectedType =
          rule == Rule.IN_L_INTRO ? sumType.left : sumType.right;
      return expect(premises, 0,
          Sequent.of(s.env, injection.exp, injectedType), location);

    case CASE_ELIM:
      final Ast.Case caseTerm = (Ast.Case) s.term;
      final Type scrutineeType = premises.get(0).type;
      if (!(scrutineeType instanceof SumType)) {
        return reject(
            Reason.PREMISE_CONCLUSION_MISMATCH,
            location,
            "premise 0 of rule " + rule + " must have a sum type, but has "
                + scrutineeType);
      }
      final SumType caseType = (SumType) scrutineeType;
      reject =
          expect(premises, 0, Sequent.of(s.env, caseTerm.exp, caseType),
              location);
      if (reject != null) {
        return reject;
      }
      final FnType leftType = typeSystem.fnType(caseType.left, s.type);
      reject =
          expect(premises, 1, Sequent.of(s.env, caseTerm.left, leftType),
              location);
      if (reject != null) {
        return reject;
      }
      final FnType rightType = typeSystem.fnType(caseType.right, s.type);
      return expect(premises, 2,
          Sequent.of(s.env, caseTerm.right, rightType), location);

    case FST_ELIM:
    case SND_ELIM:
      final Type pairedType = premises.get(0).type;
      if (!(pairedType instanceof ProductType)) {
        return reject(
            Reason.PREMISE_CONCLUSION_MISMATCH,
            location,
            "premise 0 of rule " + rule + " must have a product type, but has "
                + pairedType);
      }
      final Ast.Unary projection = (Ast.Unary) s.term;
      final ProductType productType = (ProductType) pairedType;
      // The projected component must be the conclusion's type; the other
      // component is whatever the premise says.
      final ProductType requiredType =
          rule == Rule.FST_ELIM
              ? typeSystem.productType(s.type, productType.right)
              : typeSystem.productType(productType.left, s.type);
      return expect(premises, 0,
          Sequent.of(s.env, projection.exp, requiredType), location);

    case LAMBDA_INTRO:
      if (!(s.type instanceof FnType)) {
        return typeMismatch(rule, s, "a function type", location);
      }
      final Ast.Lambda lambda = (Ast.Lambda) s.term;
      final FnType fnType = (FnType) s.type;
      if (!lambda.type.equals(fnType.paramType)) {
        return reject(
            Reason.RULE_TYPE_MISMATCH,
            location,
            "parameter '" + lambda.name + "' has type " + lambda.type
                + ", but conclusion has parameter type " + fnType.paramType);
      }
      // The body is checked in a new environment; the conclusion's
      // environment is not changed.
      final Environment bodyEnv = s.env.bind(lambda.name, lambda.type);
      return expect(premises, 0,
          Sequent.of(bodyEnv, lambda.body, fnType.resultType), location);

    case BOTTOM_ELIM:
      final Ast.Abort abort = (Ast.Abort) s.term;
      return expect(premises, 0,
          Sequent.of(s.env, abort.exp, typeSystem.bottom()), location);

    default:
      throw new AssertionError("unknown rule " + rule);
    }
  }

  /**
   * Returns null if the {@code i}th premise concludes the required sequent,
   * otherwise a rejection.
   */
  private static CheckResult.@Nullable Reject expect(
      List<Sequent> premises, int i, Sequent required, Location location) {
    final Sequent actual = premises.get(i);
    if (actual.equals(required)) {
      return null;
    }
    return reject(
        Reason.PREMISE_CONCLUSION_MISMATCH,
        location,
        "premise " + i + " must conclude " + required + ", but concludes "
            + actual);
  }

  private static CheckResult.Reject typeMismatch(
      Rule rule, Sequent s, String expected, Location location) {
    return reject(
        Reason.RULE_TYPE_MISMATCH,
        location,
        "rule " + rule + " requires " + expected + ", but conclusion has type "
            + s.type);
  }

  /** State of one call to {@link #check(Derivation, Sequent)}. */
  private static class Context {
    final Grammar.Validator validator;
    /** Sub-derivations on the path from the root, compared by identity. */
    final Set<Derivation> ancestors;
    /** Sub-derivations already accepted, compared by identity, with the
     * sequent each was accepted as proving. */
    final Map<Derivation, Sequent> verified;

    Context(Grammar.Validator validator, Set<Derivation> ancestors,
        Map<Derivation, Sequent> verified) {
      this.validator = validator;
      this.ancestors = ancestors;
      this.verified = verified;
    }
  }
}

// End DerivationChecker.java
