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

/** Sub-types of {@link AstNode} and {@link net.hydromatic.ipl.type.Type}. */
public enum Op {
  // terms
  ID(""),
  PAIR("cons"),
  INL("inl"),
  INR("inr"),
  CASE("case"),
  FST("car"),
  SND("cdr"),
  LAMBDA("λ"),
  ABORT("abort"),

  // types
  BOTTOM_TYPE("⊥"),
  ATOM_TYPE(""),
  FUNCTION_TYPE(" -> "),
  PRODUCT_TYPE(" × "),
  SUM_TYPE(" + ");

  /**
   * How the operator is written: the head keyword of a term, for example
   * "{@code cons}", or the padded infix symbol of a compound type, for example
   * "{@code  -> }".
   */
  public final String symbol;

  Op(String symbol) {
    this.symbol = symbol;
  }

  /** Whether this operator creates a type. */
  public boolean isType() {
    return ordinal() >= BOTTOM_TYPE.ordinal();
  }
}

// End Op.java
