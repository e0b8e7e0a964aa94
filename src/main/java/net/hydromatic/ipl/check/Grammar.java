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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import net.hydromatic.ipl.ast.Ast;
import net.hydromatic.ipl.type.AtomType;
import net.hydromatic.ipl.type.BottomType;
import net.hydromatic.ipl.type.FnType;
import net.hydromatic.ipl.type.ProductType;
import net.hydromatic.ipl.type.SumType;
import net.hydromatic.ipl.type.Type;
import net.hydromatic.ipl.type.TypeVisitor;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Well-formedness predicates for types, terms and environments.
 *
 * <p>Each {@code invalidXxx} method returns null if its argument is
 * well-formed, otherwise a description of the first malformed part. The
 * corresponding {@code isXxx} method returns whether the argument is
 * well-formed.
 *
 * <p>The walks use an explicit stack, so arbitrarily deep values do not
 * overflow the Java stack, and visit a sub-term or sub-type that occurs more
 * than once only once.
 */
public abstract class Grammar {
  private Grammar() {}

  /** Pattern for variable names and base type names. */
  private static final Pattern NAME =
      Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_']*");

  /** Words that cannot be used as names. */
  public static final ImmutableSet<String> RESERVED =
      ImmutableSet.of(
          "abort", "bot", "car", "case", "cdr", "check", "cons", "fst", "inl",
          "inr", "lambda", "snd", "λ");

  /** Returns whether a string is a valid variable or base type name. */
  public static boolean isName(@Nullable String name) {
    return name != null
        && NAME.matcher(name).matches()
        && !RESERVED.contains(name);
  }

  /** Returns whether a value is one of the built-in kinds of type. */
  private static boolean isKnownType(@Nullable Object o) {
    return o instanceof BottomType
        || o instanceof AtomType
        || o instanceof FnType
        || o instanceof ProductType
        || o instanceof SumType;
  }

  /** Returns whether a value is a well-formed type. */
  public static boolean isType(@Nullable Object o) {
    return invalidType(o) == null;
  }

  /**
   * Returns null if a value is a well-formed type, otherwise a description of
   * the problem.
   *
   * <p>A well-formed type is {@code ⊥}, a base type whose name is a valid
   * name, or an arrow, product or sum of two well-formed types.
   */
  public static @Nullable String invalidType(@Nullable Object o) {
    return new Validator(Integer.MAX_VALUE, true).type(o);
  }

  /** Returns whether a value is a well-formed term. */
  public static boolean isTerm(@Nullable Object o) {
    return invalidTerm(o) == null;
  }

  /**
   * Returns null if a value is a well-formed term, otherwise a description of
   * the problem.
   *
   * <p>Every sub-term must be well-formed, including both branches of a
   * {@code case}; a variable or lambda parameter must have a valid name; a
   * lambda's parameter type must be a well-formed type.
   */
  public static @Nullable String invalidTerm(@Nullable Object o) {
    return new Validator(Integer.MAX_VALUE, true).term(o);
  }

  /** Returns whether a value is a well-formed environment. */
  public static boolean isEnvironment(@Nullable Object o) {
    return invalidEnvironment(o) == null;
  }

  /**
   * Returns null if a value is a well-formed environment, otherwise a
   * description of the problem.
   *
   * <p>Each visible binding must have a valid name and a well-formed type.
   */
  public static @Nullable String invalidEnvironment(@Nullable Object o) {
    return new Validator(Integer.MAX_VALUE, true).environment(o);
  }

  /** A node waiting to be visited, and its distance from the root. */
  private static class Frame {
    final Object node;
    final int depth;

    Frame(Object node, int depth) {
      this.node = node;
      this.depth = depth;
    }
  }

  /**
   * Validates values, remembering what it has already seen.
   *
   * <p>A validator bounds the depth of each term and type it is given. If it
   * is strict it also checks names and rejects types it does not know; if
   * not, it checks only depth, and treats an unknown type as a leaf.
   *
   * <p>Once a validator has returned a problem, it must not be used again.
   */
  static class Validator {
    private final int maxDepth;
    private final boolean strict;

    /** Values already visited, and the greatest depth at which each was
     * visited. Compared by identity. */
    private final Map<Object, Integer> seen = new IdentityHashMap<>();

    private final Deque<Frame> typeStack = new ArrayDeque<>();
    private int typeDepth;

    /** Checks the name of a base type and pushes the components of a compound
     * type. */
    private final TypeVisitor<@Nullable String> typeExpander =
        new TypeVisitor<@Nullable String>() {
          @Override
          public @Nullable String visit(AtomType atomType) {
            return !strict || isName(atomType.name)
                ? null
                : "invalid base type name '" + atomType.name + "'";
          }

          @Override
          public @Nullable String visit(FnType fnType) {
            return pushTypes(fnType.paramType, fnType.resultType);
          }

          @Override
          public @Nullable String visit(ProductType productType) {
            return pushTypes(productType.left, productType.right);
          }

          @Override
          public @Nullable String visit(SumType sumType) {
            return pushTypes(sumType.left, sumType.right);
          }
        };

    Validator(int maxDepth, boolean strict) {
      this.maxDepth = maxDepth;
      this.strict = strict;
    }

    /** Returns whether a node needs to be visited at a given depth, and if so
     * records that it has been. */
    private boolean visit(Object node, int depth) {
      final Integer previous = seen.get(node);
      if (previous != null && depth <= previous) {
        return false;
      }
      seen.put(node, depth);
      return true;
    }

    private @Nullable String pushTypes(Type left, Type right) {
      // Push right first, so that left is visited first.
      for (Type type : new Type[] {right, left}) {
        if (strict && !isKnownType(type)) {
          return "not a type: " + type;
        }
        typeStack.push(new Frame(type, typeDepth + 1));
      }
      return null;
    }

    /** Returns null if every part of a sequent is valid, otherwise a
     * description of the first problem. */
    @Nullable String sequent(Sequent sequent) {
      String problem = environment(sequent.env);
      if (problem == null) {
        problem = term(sequent.term);
      }
      if (problem == null) {
        problem = type(sequent.type);
      }
      return problem;
    }

    @Nullable String type(@Nullable Object o) {
      if (o == null || (strict && !isKnownType(o))) {
        return "not a type: " + o;
      }
      typeStack.clear();
      typeStack.push(new Frame(o, 0));
      while (!typeStack.isEmpty()) {
        final Frame frame = typeStack.pop();
        if (frame.depth > maxDepth) {
          return "type is deeper than " + maxDepth;
        }
        if (!visit(frame.node, frame.depth)
            || !isKnownType(frame.node)) {
          continue;
        }
        typeDepth = frame.depth;
        final String problem = ((Type) frame.node).accept(typeExpander);
        if (problem != null) {
          return problem;
        }
      }
      return null;
    }

    @Nullable String term(@Nullable Object o) {
      if (!(o instanceof Ast.Term)) {
        return "not a term: " + o;
      }
      final Deque<Frame> stack = new ArrayDeque<>();
      stack.push(new Frame(o, 0));
      while (!stack.isEmpty()) {
        final Frame frame = stack.pop();
        if (frame.depth > maxDepth) {
          return "term is deeper than " + maxDepth;
        }
        if (!visit(frame.node, frame.depth)) {
          continue;
        }
        final Ast.Term term = (Ast.Term) frame.node;
        switch (term.op) {
        case ID:
          final Ast.Var variable = (Ast.Var) term;
          if (strict && !isName(variable.name)) {
            return "invalid variable name '" + variable.name + "'";
          }
          break;

        case LAMBDA:
          final Ast.Lambda lambda = (Ast.Lambda) term;
          if (strict && !isName(lambda.name)) {
            return "invalid parameter name '" + lambda.name + "'";
          }
          final String problem = type(lambda.type);
          if (problem != null) {
            return problem;
          }
          break;

        default:
          break;
        }
        final List<Ast.Term> args = new ArrayList<>();
        term.forEachArg((arg, i) -> args.add(arg));
        for (Ast.Term arg : Lists.reverse(args)) {
          stack.push(new Frame(arg, frame.depth + 1));
        }
      }
      return null;
    }

    @Nullable String environment(@Nullable Object o) {
      if (!(o instanceof Environment)) {
        return "not an environment: " + o;
      }
      if (!visit(o, 0)) {
        return null;
      }
      for (Map.Entry<String, Type> entry
          : ((Environment) o).getTypeMap().entrySet()) {
        if (strict && !isName(entry.getKey())) {
          return "invalid variable name '" + entry.getKey() + "'";
        }
        final String problem = type(entry.getValue());
        if (problem != null) {
          return problem;
        }
      }
      return null;
    }
  }
}

// End Grammar.java
