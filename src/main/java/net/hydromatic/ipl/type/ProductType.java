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
import net.hydromatic.ipl.ast.Op;

/** The type of a pair; under Curry-Howard, conjunction. */
public class ProductType extends BaseType {
  public final Type left;
  public final Type right;

  ProductType(Type left, Type right) {
    super(Op.PRODUCT_TYPE);
    this.left = requireNonNull(left);
    this.right = requireNonNull(right);
  }

  @Override
  public int hashCode() {
    return Objects.hash(op, left, right);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ProductType
            && left.equals(((ProductType) o).left)
            && right.equals(((ProductType) o).right);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    buf.append('(');
    left.describe(buf).append(op.symbol);
    return right.describe(buf).append(')');
  }

  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }
}

// End ProductType.java
