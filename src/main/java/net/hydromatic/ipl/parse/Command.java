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
package net.hydromatic.ipl.parse;

import static java.util.Objects.requireNonNull;

import net.hydromatic.ipl.ast.Pos;
import net.hydromatic.ipl.check.Derivation;
import net.hydromatic.ipl.check.Sequent;

/**
 * Command in a proof script, "{@code (check sequent derivation)}": check that
 * a derivation proves a sequent.
 */
public class Command {
  public final Pos pos;
  public final Sequent target;
  public final Derivation derivation;

  Command(Pos pos, Sequent target, Derivation derivation) {
    this.pos = requireNonNull(pos);
    this.target = requireNonNull(target);
    this.derivation = requireNonNull(derivation);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder("(check (");
    buf.append(target).append(") ");
    return derivation.describe(buf).append(')').toString();
  }
}

// End Command.java
