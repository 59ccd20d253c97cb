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
package net.hydromatic.sloth.eval;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Suspended computation that yields a {@link Value} when forced.
 *
 * <p>A Thunk on its own makes no promise about memoization; the
 * {@link Backend#delay} operation wraps a computation in a {@link Promise},
 * which runs it at most once.
 */
@FunctionalInterface
public interface Thunk {
  /** Runs the computation, or returns its cached result. */
  Value force();

  /** Returns a thunk whose value is already known. */
  static Thunk of(Value value) {
    return new Ready(value);
  }

  /** Returns the value of a thunk if it has already been computed, or null.
   * Never forces the thunk. */
  static @Nullable Value peek(Thunk thunk) {
    if (thunk instanceof Ready) {
      return ((Ready) thunk).value;
    }
    if (thunk instanceof Promise) {
      return ((Promise) thunk).peek();
    }
    return null;
  }

  /** Thunk that holds an already-computed value. */
  final class Ready implements Thunk {
    private final Value value;

    private Ready(Value value) {
      this.value = value;
    }

    @Override
    public Value force() {
      return value;
    }

    @Override
    public String toString() {
      return "ready(" + value + ")";
    }
  }
}

// End Thunk.java
