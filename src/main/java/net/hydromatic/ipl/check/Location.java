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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Location of a sub-derivation within a derivation: the list of premise
 * indexes that leads to it from the root.
 *
 * <p>For example, "{@code 1.0}" is the first premise of the second premise of
 * the root.
 */
public class Location {
  public static final Location ROOT = new Location(ImmutableList.of());

  public final ImmutableList<Integer> path;

  private Location(ImmutableList<Integer> path) {
    this.path = requireNonNull(path);
  }

  /** Creates a location from a list of premise indexes. */
  public static Location of(Integer... path) {
    return path.length == 0 ? ROOT : new Location(ImmutableList.copyOf(path));
  }

  /** Returns the location of the {@code i}th premise of this location. */
  public Location premise(int i) {
    return new Location(
        ImmutableList.<Integer>builder().addAll(path).add(i).build());
  }

  /** Returns the number of steps from the root; 0 for the root. */
  public int depth() {
    return path.size();
  }

  public boolean isRoot() {
    return path.isEmpty();
  }

  /**
   * Returns the sub-derivation of {@code root} at this location.
   *
   * @throws IndexOutOfBoundsException if {@code root} does not have a
   *     sub-derivation at this location
   */
  public Derivation resolve(Derivation root) {
    Derivation derivation = root;
    for (int i : path) {
      derivation = derivation.premises().get(i);
    }
    return derivation;
  }

  @Override
  public int hashCode() {
    return path.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Location && path.equals(((Location) o).path);
  }

  /** Returns "{@code root}" or a dotted path such as "{@code 1.0}". */
  @Override
  public String toString() {
    return path.isEmpty() ? "root" : Joiner.on('.').join(path);
  }
}

// End Location.java
