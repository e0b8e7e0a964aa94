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

/** Called on various events while checking a derivation. */
public interface Tracer {
  /**
   * Called when the checker starts to examine a sub-derivation, before any of
   * its premises. Not called for a sub-derivation whose conclusion is
   * malformed, nor for one that has already been accepted.
   */
  void onStep(Location location, Derivation derivation);

  /** Called with the result of checking a whole derivation. */
  void onResult(CheckResult result);
}

// End Tracer.java
