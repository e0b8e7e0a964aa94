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

import com.google.common.collect.ImmutableSortedMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.ipl.type.Binding;
import net.hydromatic.ipl.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Typing environment, "Γ", a mapping from variable names to types.
 *
 * <p>Every environment is immutable; when you call {@link #bind}, a new
 * environment is created that inherits from the previous environment. The new
 * environment may obscure bindings in the old environment, but neither the new
 * nor the old will ever change. This allows the two branches of a derivation
 * to extend the same environment without seeing each other's bindings.
 *
 * <p>Two environments are equal if they map the same names to the same types,
 * regardless of the order in which the bindings were made and of any obscured
 * bindings.
 *
 * <p>To create an empty environment, call {@link Environments#empty()}.
 */
public abstract class Environment {
  /**
   * Visits every variable binding in this environment.
   *
   * <p>Bindings that are obscured by more recent bindings of the same name are
   * visited, but after the more obscuring bindings.
   */
  abstract void visit(Consumer<Binding> consumer);

  /** Returns the binding of {@code name} if bound, null if not. */
  public abstract @Nullable Binding getOpt(String name);

  /** Returns the type of {@code name} if bound, null if not. */
  public @Nullable Type getTypeOpt(String name) {
    final Binding binding = getOpt(name);
    return binding == null ? null : binding.type;
  }

  /**
   * Creates an environment that is the same as this environment, plus one more
   * variable.
   */
  public Environment bind(String name, Type type) {
    return bind(Binding.of(name, type));
  }

  protected Environment bind(Binding binding) {
    return new Environments.SubEnvironment(this, binding);
  }

  /**
   * Creates an environment that is the same as this, plus the given bindings.
   */
  public final Environment bindAll(Iterable<Binding> bindings) {
    return Environments.bind(this, bindings);
  }

  /**
   * Returns a map of the visible bindings, sorted by name. Obscured bindings
   * are not included.
   */
  public final ImmutableSortedMap<String, Type> getTypeMap() {
    final Map<String, Type> typeMap = new LinkedHashMap<>();
    visit(binding -> typeMap.putIfAbsent(binding.name, binding.type));
    return ImmutableSortedMap.copyOf(typeMap);
  }

  /** Returns whether this environment has no bindings. */
  public boolean isEmpty() {
    return getTypeMap().isEmpty();
  }

  /**
   * If this environment only defines bindings in the given set, returns its
   * parent. Never returns null. The empty environment returns itself.
   */
  abstract Environment nearestAncestorNotObscuredBy(Set<String> names);

  @Override
  public int hashCode() {
    return getTypeMap().hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Environment
            && getTypeMap().equals(((Environment) o).getTypeMap());
  }

  /** Converts this environment to a string, e.g. "{@code ((p : P))}". */
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder("(");
    getTypeMap()
        .forEach(
            (name, type) -> {
              if (buf.length() > 1) {
                buf.append(' ');
              }
              Binding.of(name, type).describe(buf);
            });
    return buf.append(')').toString();
  }
}

// End Environment.java
