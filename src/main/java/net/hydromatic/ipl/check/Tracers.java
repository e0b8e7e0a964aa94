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

import java.util.function.BiConsumer;
import java.util.function.Consumer;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on each step, then calls
   * the underlying tracer.
   */
  public static Tracer withOnStep(
      Tracer tracer, BiConsumer<Location, Derivation> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onStep(Location location, Derivation derivation) {
        consumer.accept(location, derivation);
        super.onStep(location, derivation);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the result of a check,
   * then calls the underlying tracer.
   */
  public static Tracer withOnResult(
      Tracer tracer, Consumer<CheckResult> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onResult(CheckResult result) {
        consumer.accept(result);
        super.onResult(result);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onStep(Location location, Derivation derivation) {}

    @Override
    public void onResult(CheckResult result) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    private final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onStep(Location location, Derivation derivation) {
      tracer.onStep(location, derivation);
    }

    @Override
    public void onResult(CheckResult result) {
      tracer.onResult(result);
    }
  }
}

// End Tracers.java
