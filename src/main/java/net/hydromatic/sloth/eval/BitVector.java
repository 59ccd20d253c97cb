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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.math.BigInteger;
import java.util.Objects;

/** Fixed-width unsigned bit vector; the concrete representation of a
 * word.
 *
 * <p>Bit 0 is the most significant bit, so that the bits of a word read in
 * the same order as the elements of the sequence it packs. */
public final class BitVector {
  public final long width;
  public final BigInteger value;

  private BitVector(long width, BigInteger value) {
    this.width = width;
    this.value = requireNonNull(value);
  }

  /** Creates a bit vector, reducing the value modulo 2<sup>width</sup>. */
  public static BitVector of(long width, BigInteger value) {
    checkArgument(width >= 0 && width <= Integer.MAX_VALUE,
        "invalid width %s", width);
    final BigInteger modulus = BigInteger.ONE.shiftLeft((int) width);
    return new BitVector(width, value.mod(modulus));
  }

  /** Returns bit {@code i}, counting from the most significant. */
  public boolean bit(long i) {
    checkArgument(i >= 0 && i < width, "bit %s out of range", i);
    return value.testBit((int) (width - 1 - i));
  }

  @Override
  public int hashCode() {
    return Objects.hash(width, value);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof BitVector
            && width == ((BitVector) obj).width
            && value.equals(((BitVector) obj).value);
  }

  @Override
  public String toString() {
    return "0x" + value.toString(16) + ":[" + width + "]";
  }
}

// End BitVector.java
