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

import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Memoized suspension; the standard implementation of
 * {@link Backend#delay}.
 *
 * <p>A promise moves from {@link State#PENDING} to
 * {@link State#IN_PROGRESS} when first forced, then to {@link State#FORCED}
 * or {@link State#FAILED}. Forcing a promise that is in progress means that
 * its value depends on itself; that is reported as an
 * {@link EvalException.Kind#LOOP} error.
 *
 * <p>Not thread-safe; evaluation is single-threaded.
 */
public final class Promise implements Thunk {
  private final @Nullable String label;
  private @Nullable Thunk computation;
  private State state = State.PENDING;
  private @Nullable Value value;
  private @Nullable RuntimeException failure;

  /** Creates a Promise.
   *
   * @param label Name of what is being computed, used in the loop
   *   error; or null
   * @param computation Computation to run when first forced
   */
  public Promise(@Nullable String label, Thunk computation) {
    this.label = label;
    this.computation = requireNonNull(computation);
  }

  public State state() {
    return state;
  }

  /** Returns the value if this promise has been forced successfully, or
   * null. */
  public @Nullable Value peek() {
    return state == State.FORCED ? value : null;
  }

  @Override
  public Value force() {
    switch (state) {
      case FORCED:
        return requireNonNull(value);
      case FAILED:
        throw requireNonNull(failure);
      case IN_PROGRESS:
        throw new EvalException(EvalException.Kind.LOOP,
            label == null
                ? "<<loop>>"
                : "<<loop>> while evaluating " + label);
      default:
        break;
    }
    final Thunk computation = requireNonNull(this.computation);
    state = State.IN_PROGRESS;
    try {
      final Value v = computation.force();
      value = requireNonNull(v, "computation returned null");
      state = State.FORCED;
      return v;
    } catch (RuntimeException e) {
      failure = e;
      state = State.FAILED;
      throw e;
    } finally {
      if (state == State.IN_PROGRESS) {
        // An Error such as StackOverflowError escaped; allow a retry.
        state = State.PENDING;
      } else {
        this.computation = null;
      }
    }
  }

  @Override
  public String toString() {
    return "promise(" + (label == null ? "" : label + ", ") + state + ")";
  }

  /** States of a promise. */
  public enum State {
    PENDING, IN_PROGRESS, FORCED, FAILED
  }
}

// End Promise.java
