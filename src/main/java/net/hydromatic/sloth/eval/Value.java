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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import net.hydromatic.sloth.type.Nat;
import net.hydromatic.sloth.type.TValue;

/**
 * Result of evaluating an expression, in weak head normal form.
 *
 * <p>The outermost shape of a value is known; its components (tuple and
 * record fields, sequence elements) are {@link Thunk}s that have not
 * necessarily been forced.
 *
 * <p>Bits, integers and words are opaque objects owned by the
 * {@link Backend}: a concrete backend uses {@link Boolean},
 * {@link java.math.BigInteger} and {@link BitVector}; a symbolic backend
 * uses terms.
 */
public abstract class Value {
  public final Tag tag;

  Value(Tag tag) {
    this.tag = requireNonNull(tag);
  }

  public static Bit bit(Object bit) {
    return new Bit(bit);
  }

  public static Int integer(Object value) {
    return new Int(value);
  }

  public static Word word(Object word) {
    return new Word(word);
  }

  public static Seq seq(Nat length, TValue elementType, SeqMap seqMap) {
    return new Seq(length, elementType, seqMap);
  }

  public static Tuple tuple(List<? extends Thunk> args) {
    return new Tuple(ImmutableList.copyOf(args));
  }

  public static Record record(Map<String, ? extends Thunk> fields) {
    return new Record(ImmutableSortedMap.copyOf(fields));
  }

  public static Fun fun(Function<Thunk, Value> f) {
    return new Fun(f);
  }

  public static Poly poly(Function<TValue, Value> f) {
    return new Poly(f);
  }

  public static NumPoly numPoly(Function<Nat, Value> f) {
    return new NumPoly(f);
  }

  public static Error error(EvalException e) {
    return new Error(e);
  }

  @Override
  public String toString() {
    return tag.toString().toLowerCase(Locale.ROOT);
  }

  /** Kinds of value. */
  public enum Tag {
    BIT, INTEGER, WORD, SEQ, TUPLE, RECORD, FUN, POLY, NUM_POLY, ERROR
  }

  /** Bit value. */
  public static final class Bit extends Value {
    public final Object bit;

    Bit(Object bit) {
      super(Tag.BIT);
      this.bit = requireNonNull(bit);
    }

    @Override
    public String toString() {
      return bit.toString();
    }
  }

  /** Integer value. */
  public static final class Int extends Value {
    public final Object value;

    Int(Object value) {
      super(Tag.INTEGER);
      this.value = requireNonNull(value);
    }

    @Override
    public String toString() {
      return value.toString();
    }
  }

  /** Finite sequence of bits, packed into a word. */
  public static final class Word extends Value {
    public final Object word;

    Word(Object word) {
      super(Tag.WORD);
      this.word = requireNonNull(word);
    }

    @Override
    public String toString() {
      return word.toString();
    }
  }

  /** Sequence, finite or infinite. */
  public static final class Seq extends Value {
    public final Nat length;
    public final TValue elementType;
    public final SeqMap seqMap;

    Seq(Nat length, TValue elementType, SeqMap seqMap) {
      super(Tag.SEQ);
      this.length = requireNonNull(length);
      this.elementType = requireNonNull(elementType);
      this.seqMap = requireNonNull(seqMap);
    }

    @Override
    public String toString() {
      return "seq([" + length + "]" + elementType + ")";
    }
  }

  /** Tuple. */
  public static final class Tuple extends Value {
    public final ImmutableList<Thunk> args;

    Tuple(ImmutableList<Thunk> args) {
      super(Tag.TUPLE);
      this.args = args;
    }
  }

  /** Record. Fields are sorted by name. */
  public static final class Record extends Value {
    public final ImmutableSortedMap<String, Thunk> fields;

    Record(ImmutableSortedMap<String, Thunk> fields) {
      super(Tag.RECORD);
      this.fields = fields;
    }
  }

  /** Function. The argument is passed unevaluated. */
  public static final class Fun extends Value {
    private final Function<Thunk, Value> f;

    Fun(Function<Thunk, Value> f) {
      super(Tag.FUN);
      this.f = requireNonNull(f);
    }

    public Value apply(Thunk arg) {
      return f.apply(arg);
    }
  }

  /** Function from a value type to a value. */
  public static final class Poly extends Value {
    private final Function<TValue, Value> f;

    Poly(Function<TValue, Value> f) {
      super(Tag.POLY);
      this.f = requireNonNull(f);
    }

    public Value apply(TValue type) {
      return f.apply(type);
    }
  }

  /** Function from a number to a value. */
  public static final class NumPoly extends Value {
    private final Function<Nat, Value> f;

    NumPoly(Function<Nat, Value> f) {
      super(Tag.NUM_POLY);
      this.f = requireNonNull(f);
    }

    public Value apply(Nat n) {
      return f.apply(n);
    }
  }

  /** Placeholder for a value whose computation failed.
   *
   * <p>An error value may be stored, passed and merged like any other value;
   * the error is raised when something inspects its shape, by calling
   * {@link #raise()}. */
  public static final class Error extends Value {
    public final EvalException exception;

    Error(EvalException exception) {
      super(Tag.ERROR);
      this.exception = requireNonNull(exception);
    }

    /** Throws the underlying exception. */
    public RuntimeException raise() {
      throw exception;
    }

    @Override
    public String toString() {
      return "error(" + exception + ")";
    }
  }
}

// End Value.java
