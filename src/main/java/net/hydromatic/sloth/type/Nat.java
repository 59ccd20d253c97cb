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
package net.hydromatic.sloth.type;

import net.hydromatic.sloth.eval.EvalPanic;

/** Natural number extended with infinity; the value of a numeric type, and
 * the length of a sequence.
 *
 * <p>{@code Finite(n)} is created by {@link #of(long)}; the single infinite
 * value is {@link #INF}. */
public final class Nat implements TypeArg, Comparable<Nat> {
  public static final Nat INF = new Nat(-1);

  private static final Nat[] SMALL = new Nat[64];

  static {
    for (int i = 0; i < SMALL.length; i++) {
      SMALL[i] = new Nat(i);
    }
  }

  /** The value, or -1 if infinite. */
  private final long n;

  private Nat(long n) {
    this.n = n;
  }

  /** Returns a finite number. */
  public static Nat of(long n) {
    if (n < 0) {
      throw new EvalPanic("Nat.of", "negative length " + n);
    }
    return n < SMALL.length ? SMALL[(int) n] : new Nat(n);
  }

  public boolean isFinite() {
    return n >= 0;
  }

  /** Returns the value of a finite number; panics if infinite. */
  public long value() {
    if (n < 0) {
      throw new EvalPanic("Nat.value", "expected a finite number");
    }
    return n;
  }

  @Override
  public Kind kind() {
    return Kind.NUM;
  }

  public Nat plus(Nat o) {
    return isFinite() && o.isFinite() ? of(n + o.n) : INF;
  }

  /** Subtraction. {@code inf - n} is {@code inf}; subtracting infinity, or a
   * larger number, is not defined. */
  public Nat minus(Nat o) {
    if (!o.isFinite()) {
      throw new EvalPanic("Nat.minus", "cannot subtract inf from " + this);
    }
    if (!isFinite()) {
      return INF;
    }
    if (o.n > n) {
      throw new EvalPanic("Nat.minus", this + " - " + o + " is negative");
    }
    return of(n - o.n);
  }

  /** Multiplication. {@code 0 * inf} is 0. */
  public Nat times(Nat o) {
    if (n == 0 || o.n == 0) {
      return of(0);
    }
    return isFinite() && o.isFinite() ? of(n * o.n) : INF;
  }

  public Nat min(Nat o) {
    return compareTo(o) <= 0 ? this : o;
  }

  public Nat max(Nat o) {
    return compareTo(o) >= 0 ? this : o;
  }

  @Override
  public int compareTo(Nat o) {
    if (!isFinite()) {
      return o.isFinite() ? 1 : 0;
    }
    return o.isFinite() ? Long.compare(n, o.n) : -1;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(n);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this || obj instanceof Nat && n == ((Nat) obj).n;
  }

  @Override
  public String toString() {
    return isFinite() ? Long.toString(n) : "inf";
  }
}

// End Nat.java
