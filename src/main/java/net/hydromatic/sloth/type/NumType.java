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

import static java.util.Objects.requireNonNull;

import net.hydromatic.sloth.ast.Op;

/** Numeric type literal, such as {@code 8} or {@code inf}. */
public class NumType implements Type {
  public static final NumType INF = new NumType(Nat.INF);

  public final Nat nat;

  private NumType(Nat nat) {
    this.nat = requireNonNull(nat);
  }

  /** Creates a finite numeric type. */
  public static NumType of(long n) {
    return new NumType(Nat.of(n));
  }

  /** Creates a numeric type. */
  public static NumType of(Nat nat) {
    return nat.isFinite() ? new NumType(nat) : INF;
  }

  @Override
  public int hashCode() {
    return nat.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof NumType && nat.equals(((NumType) obj).nat);
  }

  @Override
  public String toString() {
    return nat.toString();
  }

  @Override
  public Op op() {
    return Op.NUM_TYPE;
  }
}

// End NumType.java
