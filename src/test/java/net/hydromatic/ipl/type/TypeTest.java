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

import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.ipl.ast.Op;
import org.junit.jupiter.api.Test;

/** Tests for {@link Type} and {@link TypeSystem}. */
public class TypeTest {
  private final TypeSystem ts = new TypeSystem();

  @Test
  void testDescribe() {
    final AtomType p = ts.atom("P");
    final AtomType q = ts.atom("Q");
    assertThat(p.toString(), is("P"));
    assertThat(ts.bottom().toString(), is("⊥"));
    assertThat(ts.fnType(p, q).toString(), is("(P -> Q)"));
    assertThat(ts.productType(p, q).toString(), is("(P × Q)"));
    assertThat(ts.sumType(p, q).toString(), is("(P + Q)"));
    assertThat(
        ts.fnType(ts.sumType(p, q), ts.bottom()).toString(),
        is("((P + Q) -> ⊥)"));
  }

  @Test
  void testOp() {
    final AtomType p = ts.atom("P");
    assertThat(p.op(), is(Op.ATOM_TYPE));
    assertThat(ts.bottom().op(), is(Op.BOTTOM_TYPE));
    assertThat(ts.fnType(p, p).op(), is(Op.FUNCTION_TYPE));
    assertThat(ts.productType(p, p).op(), is(Op.PRODUCT_TYPE));
    assertThat(ts.sumType(p, p).op(), is(Op.SUM_TYPE));
    assertThat(Op.SUM_TYPE.isType(), is(true));
    assertThat(Op.CASE.isType(), is(false));
  }

  /** Types are equal if and only if they have the same structure. */
  @Test
  void testEquality() {
    final TypeSystem ts2 = new TypeSystem();
    final Type t1 = ts.fnType(ts.atom("P"), ts.productType(ts.atom("Q"),
        ts.bottom()));
    final Type t2 = ts2.fnType(ts2.atom("P"), ts2.productType(ts2.atom("Q"),
        ts2.bottom()));
    assertThat(t1, is(t2));
    assertThat(t1.hashCode(), is(t2.hashCode()));

    // Product and sum of the same components are different.
    final AtomType p = ts.atom("P");
    final AtomType q = ts.atom("Q");
    assertThat(ts.productType(p, q), not(is((Type) ts.sumType(p, q))));
    assertThat(ts.productType(p, q), not(is((Type) ts.productType(q, p))));
    assertThat(ts.fnType(p, q), not(is((Type) ts.fnType(q, p))));
    assertThat(p, not(is((Type) q)));
    assertThat(ts.atom("P"), sameInstance(p));
  }

  @Test
  void testCurriedFnType() {
    final AtomType p = ts.atom("P");
    final AtomType q = ts.atom("Q");
    final AtomType r = ts.atom("R");
    assertThat(ts.fnType(p, q, r).toString(), is("(P -> (Q -> R))"));
    assertThat(ts.fnType(p, q, r, p).toString(), is("(P -> (Q -> (R -> P)))"));
    assertThat(ts.fnType(p, q, r),
        is(ts.fnType(p, ts.fnType(q, r))));
  }

  @Test
  void testBinding() {
    final Binding b = Binding.of("x", ts.sumType(ts.atom("P"), ts.bottom()));
    assertThat(b.toString(), is("(x : (P + ⊥))"));
    assertThat(b, is(Binding.of("x", ts.sumType(ts.atom("P"), ts.bottom()))));
    assertThat(b, not(is(Binding.of("y", b.type))));
  }

  /** Tests that the default visitor reaches every base type. */
  @Test
  void testVisitor() {
    final Type t =
        ts.fnType(ts.sumType(ts.atom("A"), ts.atom("B")),
            ts.productType(ts.bottom(), ts.atom("C")));
    final List<String> names = new ArrayList<>();
    t.accept(
        new TypeVisitor<Void>() {
          @Override
          public Void visit(AtomType atomType) {
            names.add(atomType.name);
            return null;
          }

          @Override
          public Void visit(BottomType bottomType) {
            names.add("⊥");
            return null;
          }
        });
    assertThat(names.toString(), is("[A, B, ⊥, C]"));
  }
}

// End TypeTest.java
