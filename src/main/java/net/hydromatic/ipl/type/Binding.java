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
package net.hydromatic.ipl.type;

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * Binding of a name to a type.
 *
 * <p>Used in {@link net.hydromatic.ipl.check.Environment}.
 */
public class Binding {
  public final String name;
  public final Type type;

  private Binding(String name, Type type) {
    this.name = requireNonNull(name);
    this.type = requireNonNull(type);
  }

  /** Creates a binding. */
  public static Binding of(String name, Type type) {
    return new Binding(name, type);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Binding
            && name.equals(((Binding) o).name)
            && type.equals(((Binding) o).type);
  }

  @Override
  public String toString() {
    return describe(new StringBuilder()).toString();
  }

  /** Writes this binding as "{@code (name : type)}". */
  public StringBuilder describe(StringBuilder buf) {
    buf.append('(').append(name).append(" : ");
    return type.describe(buf).append(')');
  }
}

// End Binding.java
