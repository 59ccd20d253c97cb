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

import java.math.BigInteger;
import java.util.List;
import java.util.function.LongFunction;
import java.util.function.Supplier;
import net.hydromatic.sloth.type.TValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Capabilities that the evaluator requires of its value domain.
 *
 * <p>The evaluator is written once against this interface. A
 * {@link ConcreteBackend} computes with actual bits and integers; a
 * symbolic backend builds terms, and merges the two branches of a
 * conditional whose condition is not known.
 *
 * <p>Bits, integers and words are represented by objects that only the
 * backend interprets.
 */
public interface Backend {
  // suspension

  /** Suspends a computation, which will be run at most once.
   *
   * @param label Description used if the computation depends on itself,
   *   or null
   */
  default Thunk delay(@Nullable String label, Thunk computation) {
    return new Promise(label, computation);
  }

  /** Creates a placeholder for a recursively bound name. */
  default Hole declareHole(String label) {
    return new Hole(label);
  }

  // sequence maps

  /** Creates a sequence map from a function of the index. */
  default SeqMap generateSeqMap(LongFunction<Thunk> f) {
    return SeqMaps.generate(f);
  }

  /** Creates a sequence map from a list of suspended elements. */
  default SeqMap finiteSeqMap(List<? extends Thunk> elements) {
    return SeqMaps.finite(elements);
  }

  /** Wraps a sequence map so that each element is computed at most
   * once. */
  default SeqMap memoSeqMap(SeqMap seqMap) {
    return SeqMaps.memo(this, seqMap);
  }

  /** Returns the suspended element of a sequence map at an index. */
  default Thunk lookupSeqMap(SeqMap seqMap, long i) {
    return seqMap.lookup(i);
  }

  /** Returns a sequence map with one element replaced. */
  default SeqMap updateSeqMap(SeqMap seqMap, long i, Thunk value) {
    return SeqMaps.update(seqMap, i, value);
  }

  /** Creates a sequence map whose contents are computed on first use. */
  default SeqMap delaySeqMap(Supplier<SeqMap> supplier) {
    return SeqMaps.delay(supplier);
  }

  /** Flattens a sequence of sequences of equal length. */
  default SeqMap joinSeqMap(long innerLength, SeqMap nested) {
    return SeqMaps.join(this, innerLength, nested);
  }

  // words

  /** Packs a list of bits into a word, or returns null if any bit has not
   * yet been evaluated or this backend cannot represent the bits as a
   * word. Never forces the bits.
   *
   * @see Thunk#peek(Thunk) */
  @Nullable Object packBits(List<? extends Thunk> bits);

  /** Returns the number of bits in a word. */
  long wordLen(Object word);

  /** Returns bit {@code i} of a word, counting from the most
   * significant. */
  Object wordBit(Object word, long i);

  /** Creates a word of a given width holding a value. */
  Object wordLit(long width, BigInteger value);

  /** Returns a sequence map of the bits of a word. */
  default SeqMap unpackWord(Object word) {
    return SeqMaps.word(this, word);
  }

  // bits

  Object bitLit(boolean b);

  /** Returns the literal value of a bit, or null if it is not known. */
  @Nullable Boolean bitAsLit(Object bit);

  Object bitNot(Object bit);

  Object bitAnd(Object bit0, Object bit1);

  Object bitOr(Object bit0, Object bit1);

  Object bitXor(Object bit0, Object bit1);

  Object bitEq(Object bit0, Object bit1);

  // integers

  Object integerLit(BigInteger value);

  /** Returns the literal value of an integer, or null if it is not
   * known. */
  @Nullable BigInteger integerAsLit(Object value);

  Object intPlus(Object value0, Object value1);

  Object intMinus(Object value0, Object value1);

  Object intMult(Object value0, Object value1);

  /** Divides, rounding towards negative infinity. Division by zero is an
   * {@link EvalException.Kind#DIVIDE_BY_ZERO} error. */
  Object intDiv(Object value0, Object value1);

  /** Compares two integers, returning a bit. */
  Object intEq(Object value0, Object value1);

  // conditionals

  /** Chooses between two values of a given type according to a bit.
   * A backend may evaluate one branch or both. */
  Value iteValue(TValue type, Object bit, Thunk ifTrue, Thunk ifFalse);

  // printing

  String describeBit(Object bit);

  String describeInteger(Object value);

  String describeWord(Object word);
}

// End Backend.java
