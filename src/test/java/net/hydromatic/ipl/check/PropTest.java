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

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test
  void testDefaults() {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    assertThat(Prop.MAX_DEPTH.intValue(map), is(1_000));
    assertThat(Prop.CHECK_INPUT.booleanValue(map), is(true));
  }

  @Test
  void testLookup() {
    assertThat(Prop.lookup("maxDepth"), is(Prop.MAX_DEPTH));
    assertThat(Prop.lookup("MAX_DEPTH"), is(Prop.MAX_DEPTH));
    assertThat(Prop.lookup("checkInput"), is(Prop.CHECK_INPUT));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.lookup("nonExistent"));
    assertThat(e.getMessage(), is("property nonExistent not found"));
    assertThat(Prop.BY_CAMEL_NAME.toString(), is("[CHECK_INPUT, MAX_DEPTH]"));
  }

  @Test
  void testSet() {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    Prop.MAX_DEPTH.set(map, 5);
    assertThat(Prop.MAX_DEPTH.intValue(map), is(5));
    Prop.MAX_DEPTH.set(map, null);
    assertThat(Prop.MAX_DEPTH.intValue(map), is(1_000));

    assertThrows(IllegalArgumentException.class,
        () -> Prop.MAX_DEPTH.set(map, "5"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.MAX_DEPTH.booleanValue(map));
  }

  @Test
  void testSetLenient() {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    Prop.MAX_DEPTH.setLenient(map, " 12 ");
    assertThat(Prop.MAX_DEPTH.intValue(map), is(12));
    Prop.CHECK_INPUT.setLenient(map, "FALSE");
    assertThat(Prop.CHECK_INPUT.booleanValue(map), is(false));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.MAX_DEPTH.setLenient(map, "lots"));
    assertThat(e.getMessage(), containsString("must be an integer"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.CHECK_INPUT.setLenient(map, "yes"));
  }
}

// End PropTest.java
