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

import net.hydromatic.ipl.type.Type;

/** Context for writing an AST out as a string. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node to the output. */
  public AstWriter append(AstNode node) {
    return node.unparse(this);
  }

  /** Appends a type to the output. */
  public AstWriter append(Type type) {
    type.describe(b);
    return this;
  }

  /**
   * Appends an application of a keyword to arguments, e.g. "{@code (cons a
   * b)}".
   */
  public AstWriter call(Op op, AstNode... args) {
    append("(").append(op.symbol);
    for (AstNode arg : args) {
      append(" ").append(arg);
    }
    return append(")");
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
