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
 * The uninhabited type, "{@code ⊥}".
 *
 * <p>Under the Curry-Howard correspondence it is falsehood; a term of this
 * type can be eliminated by {@code abort} to produce any type.
 */
public enum BottomType implements Type {
  BOTTOM;

  @Override
  public String toString() {
    return Op.BOTTOM_TYPE.symbol;
  }

  @Override
  public Op op() {
    return Op.BOTTOM_TYPE;
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return buf.append(Op.BOTTOM_TYPE.symbol);
  }

  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }
}

// End BottomType.java
