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

import java.util.HashMap;
import java.util.Map;

/**
 * Creates types.
 *
 * <p>Base types are cached by name, so that a proof that mentions "{@code P}"
 * many times holds one instance. Compound types are not cached; types are
 * compared by structure, so a type created by one type system equals the same
 * type created by another.
 */
public class TypeSystem {
  private final Map<String, AtomType> atomByName = new HashMap<>();

  /** Returns the uninhabited type, "{@code ⊥}". */
  public Type bottom() {
    return BottomType.BOTTOM;
  }

  /** Returns the base type with a given name. */
  public AtomType atom(String name) {
    return atomByName.computeIfAbsent(name, AtomType::new);
  }

  /** Creates a function type, "{@code (paramType -> resultType)}". */
  public FnType fnType(Type paramType, Type resultType) {
    return new FnType(paramType, resultType);
  }

  /**
   * Creates a function type with several parameters, curried. For example,
   * {@code fnType(P, Q, R)} returns "{@code (P -> (Q -> R))}".
   */
  public FnType fnType(Type paramType, Type type1, Type... moreTypes) {
    Type type = moreTypes.length == 0 ? type1 : moreTypes[moreTypes.length - 1];
    for (int i = moreTypes.length - 2; i >= -1; i--) {
      type = new FnType(i < 0 ? type1 : moreTypes[i], type);
    }
    return new FnType(paramType, type);
  }

  /** Creates a product type, "{@code (left × right)}". */
  public ProductType productType(Type left, Type right) {
    return new ProductType(left, right);
  }

  /** Creates a sum type, "{@code (left + right)}". */
  public SumType sumType(Type left, Type right) {
    return new SumType(left, right);
  }
}

// End TypeSystem.java
