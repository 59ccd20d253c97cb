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
 * Write-once placeholder for a recursively bound name.
 *
 * <p>While a recursive declaration group is being set up, each declared
 * name is bound to the {@link #read() read handle} of a hole; after every
 * body has been suspended, each hole is {@link #fill filled} with its
 * body's suspension.
 *
 * <p>Forcing the read handle before the hole is filled means that a body
 * needed its own value while it was being constructed; that is a
 * {@link EvalException.Kind#LOOP} error. Forcing it after the owning group
 * has been {@link #abandon() abandoned} without filling is a panic.
 */
public class Hole {
  private final String label;
  private final Thunk read = this::forceFilled;
  private @Nullable Thunk filled;
  private boolean abandoned;

  /** Creates a Hole.
   *
   * @param label Name of the declaration, used in diagnostics
   */
  public Hole(String label) {
    this.label = requireNonNull(label);
  }

  public String label() {
    return label;
  }

  /** Returns the read handle. It may be forced any number of times. */
  public Thunk read() {
    return read;
  }

  public boolean isFilled() {
    return filled != null;
  }

  /** Fills this hole. May be called at most once. */
  public void fill(Thunk thunk) {
    requireNonNull(thunk);
    if (filled != null) {
      throw new EvalPanic("Hole.fill", "hole filled twice", label);
    }
    if (abandoned) {
      throw new EvalPanic("Hole.fill", "hole already abandoned", label);
    }
    filled = thunk;
  }

  /** Marks this hole as never to be filled, because the declaration group
   * that owns it failed to complete. Has no effect if already filled. */
  void abandon() {
    if (filled == null) {
      abandoned = true;
    }
  }

  private Value forceFilled() {
    final Thunk thunk = filled;
    if (thunk != null) {
      return thunk.force();
    }
    if (abandoned) {
      throw new EvalPanic("Hole.read", "recursive definition not completed",
          label);
    }
    throw new EvalException(EvalException.Kind.LOOP,
        "<<loop>> while evaluating " + label);
  }

  @Override
  public String toString() {
    return "hole(" + label + ")";
  }
}

// End Hole.java
