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

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * Result of checking a derivation: {@link #accept()} or a {@link Reject}.
 *
 * <p>A result is a value; checking the same input twice yields equal results.
 */
public abstract class CheckResult {
  private static final CheckResult ACCEPT = new Accept();

  CheckResult() {}

  /** Returns the result that accepts a derivation. */
  public static CheckResult accept() {
    return ACCEPT;
  }

  /** Creates a rejection. */
  public static Reject reject(Reason reason, Location location,
      String message) {
    return new Reject(reason, location, message);
  }

  /** Whether the derivation was accepted. */
  public abstract boolean isAccept();

  /** Result that accepts a derivation. */
  private static class Accept extends CheckResult {
    @Override
    public boolean isAccept() {
      return true;
    }

    @Override
    public String toString() {
      return "accept";
    }
  }

  /**
   * Result that rejects a derivation, saying why and where.
   *
   * <p>The reason and location are those of the first mismatch found; the
   * checker never reports partial acceptance.
   */
  public static class Reject extends CheckResult {
    public final Reason reason;
    public final Location location;
    public final String message;

    Reject(Reason reason, Location location, String message) {
      this.reason = requireNonNull(reason);
      this.location = requireNonNull(location);
      this.message = requireNonNull(message);
    }

    @Override
    public boolean isAccept() {
      return false;
    }

    /**
     * Returns the reason as seen from the root of the derivation: {@link
     * #reason} if the mismatch is at the root, otherwise {@link
     * Reason#PREMISE_INVALID}.
     */
    public Reason reasonAtRoot() {
      return location.isRoot() ? reason : Reason.PREMISE_INVALID;
    }

    @Override
    public int hashCode() {
      return Objects.hash(reason, location, message);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Reject
              && reason == ((Reject) o).reason
              && location.equals(((Reject) o).location)
              && message.equals(((Reject) o).message);
    }

    /**
     * Converts this rejection to a string, e.g. "{@code reject:
     * rule-type-mismatch at root: ...}" or "{@code reject: premise-invalid:
     * unbound-variable at 0.1: ...}".
     */
    @Override
    public String toString() {
      final StringBuilder buf = new StringBuilder("reject: ");
      if (reasonAtRoot() != reason) {
        buf.append(reasonAtRoot()).append(": ");
      }
      return buf.append(reason)
          .append(" at ")
          .append(location)
          .append(": ")
          .append(message)
          .toString();
    }
  }
}

// End CheckResult.java
