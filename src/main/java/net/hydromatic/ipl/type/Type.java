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

import net.hydromatic.ipl.ast.Op;

/**
 * Type.
 *
 * <p>Types are values: two types are equal if and only if they have the same
 * structure. There is no subtyping and no unification.
 */
public interface Type {
  /** Type operator. */
  Op op();

  /**
   * Writes a description of this type to a string builder, e.g. "{@code P}",
   * "{@code (P × Q)}", "{@code ((A + B) -> ⊥)}".
   *
   * <p>Compound types are always parenthesized, so the description can be
   * read back by the parser.
   */
  StringBuilder describe(StringBuilder buf);

  <R> R accept(TypeVisitor<R> typeVisitor);
}

// End Type.java
