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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;
import java.util.function.ObjIntConsumer;
import net.hydromatic.ipl.type.Type;

/**
 * Various sub-classes of AST nodes.
 *
 * <p>Terms are compared by structure, and variable names are compared
 * literally. There is no alpha-equivalence: "{@code (λ (x : P) x)}" and
 * "{@code (λ (y : P) y)}" are different terms.
 */
public class Ast {
  private Ast() {}

  /** Base class for a term. */
  public abstract static class Term extends AstNode {
    Term(Pos pos, Op op) {
      super(pos, op);
      checkArgument(!op.isType(), "not a term operator: %s", op);
    }

    /** Calls an action for each immediate sub-term. */
    public void forEachArg(ObjIntConsumer<Term> action) {
      // no args
    }
  }

  /** Variable, e.g. "{@code x}". */
  public static class Var extends Term {
    public final String name;

    Var(Pos pos, String name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Var && name.equals(((Var) o).name);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(name);
    }
  }

  /** Pair construction, e.g. "{@code (cons a b)}". */
  public static class Pair extends Term {
    public final Term e0;
    public final Term e1;

    Pair(Pos pos, Term e0, Term e1) {
      super(pos, Op.PAIR);
      this.e0 = requireNonNull(e0);
      this.e1 = requireNonNull(e1);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, e0, e1);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Pair
              && e0.equals(((Pair) o).e0)
              && e1.equals(((Pair) o).e1);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Term> action) {
      action.accept(e0, 0);
      action.accept(e1, 1);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.call(op, e0, e1);
    }
  }

  /**
   * Term with one sub-term: an injection ({@link InL}, {@link InR}), a
   * projection ({@link Fst}, {@link Snd}), or {@link Abort}.
   */
  public abstract static class Unary extends Term {
    public final Term exp;

    Unary(Pos pos, Op op, Term exp) {
      super(pos, op);
      this.exp = requireNonNull(exp);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Unary
              && op == ((Unary) o).op
              && exp.equals(((Unary) o).exp);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Term> action) {
      action.accept(exp, 0);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.call(op, exp);
    }
  }

  /** Left injection into a sum, e.g. "{@code (inl e)}". */
  public static class InL extends Unary {
    InL(Pos pos, Term exp) {
      super(pos, Op.INL, exp);
    }
  }

  /** Right injection into a sum, e.g. "{@code (inr e)}". */
  public static class InR extends Unary {
    InR(Pos pos, Term exp) {
      super(pos, Op.INR, exp);
    }
  }

  /** First projection of a pair, e.g. "{@code (car p)}". */
  public static class Fst extends Unary {
    Fst(Pos pos, Term exp) {
      super(pos, Op.FST, exp);
    }
  }

  /** Second projection of a pair, e.g. "{@code (cdr p)}". */
  public static class Snd extends Unary {
    Snd(Pos pos, Term exp) {
      super(pos, Op.SND, exp);
    }
  }

  /**
   * Elimination of the uninhabited type, e.g. "{@code (abort e)}".
   *
   * <p>Also known as ex falso.
   */
  public static class Abort extends Unary {
    Abort(Pos pos, Term exp) {
      super(pos, Op.ABORT, exp);
    }
  }

  /**
   * Case analysis of a sum, e.g. "{@code (case s f g)}".
   *
   * <p>Each branch is a function: {@code left} is applied to the value of a
   * left injection, {@code right} to the value of a right injection.
   */
  public static class Case extends Term {
    public final Term exp;
    public final Term left;
    public final Term right;

    Case(Pos pos, Term exp, Term left, Term right) {
      super(pos, Op.CASE);
      this.exp = requireNonNull(exp);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, exp, left, right);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Case
              && exp.equals(((Case) o).exp)
              && left.equals(((Case) o).left)
              && right.equals(((Case) o).right);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Term> action) {
      action.accept(exp, 0);
      action.accept(left, 1);
      action.accept(right, 2);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.call(op, exp, left, right);
    }
  }

  /**
   * Lambda abstraction with an explicitly typed parameter, e.g. "{@code (λ (x
   * : P) x)}".
   */
  public static class Lambda extends Term {
    public final String name;
    public final Type type;
    public final Term body;

    Lambda(Pos pos, String name, Type type, Term body) {
      super(pos, Op.LAMBDA);
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
      this.body = requireNonNull(body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, name, type, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Lambda
              && name.equals(((Lambda) o).name)
              && type.equals(((Lambda) o).type)
              && body.equals(((Lambda) o).body);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Term> action) {
      action.accept(body, 0);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("(")
          .append(op.symbol)
          .append(" (")
          .append(name)
          .append(" : ")
          .append(type)
          .append(") ")
          .append(body)
          .append(")");
    }
  }
}

// End Ast.java
