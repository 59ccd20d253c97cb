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

import com.google.common.math.LongMath;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.List;
import net.hydromatic.sloth.type.TValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Backend that computes with actual values.
 *
 * <p>A bit is a {@link Boolean}, an integer is a {@link BigInteger}, and a
 * word is a {@link BitVector}. */
public class ConcreteBackend implements Backend {
  /** Shared instance. Subclasses may override {@link #delay} and similar
   * methods to observe evaluation. */
  public static final ConcreteBackend INSTANCE = new ConcreteBackend();

  protected ConcreteBackend() {}

  @Override
  public @Nullable Object packBits(List<? extends Thunk> bits) {
    BigInteger value = BigInteger.ZERO;
    for (Thunk bit : bits) {
      final Value v = Thunk.peek(bit);
      if (v == null || v.tag != Value.Tag.BIT) {
        return null;
      }
      value = value.shiftLeft(1);
      if (asBoolean(((Value.Bit) v).bit)) {
        value = value.setBit(0);
      }
    }
    return BitVector.of(bits.size(), value);
  }

  @Override
  public long wordLen(Object word) {
    return ((BitVector) word).width;
  }

  @Override
  public Object wordBit(Object word, long i) {
    return ((BitVector) word).bit(i);
  }

  @Override
  public Object wordLit(long width, BigInteger value) {
    return BitVector.of(width, value);
  }

  @Override
  public Object bitLit(boolean b) {
    return b;
  }

  @Override
  public @Nullable Boolean bitAsLit(Object bit) {
    return (Boolean) bit;
  }

  @Override
  public Object bitNot(Object bit) {
    return !asBoolean(bit);
  }

  @Override
  public Object bitAnd(Object bit0, Object bit1) {
    return asBoolean(bit0) && asBoolean(bit1);
  }

  @Override
  public Object bitOr(Object bit0, Object bit1) {
    return asBoolean(bit0) || asBoolean(bit1);
  }

  @Override
  public Object bitXor(Object bit0, Object bit1) {
    return asBoolean(bit0) ^ asBoolean(bit1);
  }

  @Override
  public Object bitEq(Object bit0, Object bit1) {
    return asBoolean(bit0) == asBoolean(bit1);
  }

  @Override
  public Object integerLit(BigInteger value) {
    return value;
  }

  @Override
  public @Nullable BigInteger integerAsLit(Object value) {
    return (BigInteger) value;
  }

  @Override
  public Object intPlus(Object value0, Object value1) {
    return asInteger(value0).add(asInteger(value1));
  }

  @Override
  public Object intMinus(Object value0, Object value1) {
    return asInteger(value0).subtract(asInteger(value1));
  }

  @Override
  public Object intMult(Object value0, Object value1) {
    return asInteger(value0).multiply(asInteger(value1));
  }

  @Override
  public Object intDiv(Object value0, Object value1) {
    final BigInteger dividend = asInteger(value0);
    final BigInteger divisor = asInteger(value1);
    if (divisor.signum() == 0) {
      throw new EvalException(EvalException.Kind.DIVIDE_BY_ZERO,
          dividend + " / 0");
    }
    if (dividend.bitLength() < 63 && divisor.bitLength() < 63) {
      return BigInteger.valueOf(
          LongMath.divide(dividend.longValue(), divisor.longValue(),
              RoundingMode.FLOOR));
    }
    final BigInteger[] qr = dividend.divideAndRemainder(divisor);
    return qr[1].signum() != 0 && qr[1].signum() != divisor.signum()
        ? qr[0].subtract(BigInteger.ONE)
        : qr[0];
  }

  @Override
  public Object intEq(Object value0, Object value1) {
    return asInteger(value0).equals(asInteger(value1));
  }

  @Override
  public Value iteValue(TValue type, Object bit, Thunk ifTrue,
      Thunk ifFalse) {
    return asBoolean(bit) ? ifTrue.force() : ifFalse.force();
  }

  @Override
  public String describeBit(Object bit) {
    return asBoolean(bit) ? "True" : "False";
  }

  @Override
  public String describeInteger(Object value) {
    return asInteger(value).toString();
  }

  @Override
  public String describeWord(Object word) {
    return ((BitVector) word).value.toString();
  }

  private static boolean asBoolean(Object bit) {
    return (Boolean) bit;
  }

  private static BigInteger asInteger(Object value) {
    return (BigInteger) value;
  }
}

// End ConcreteBackend.java
