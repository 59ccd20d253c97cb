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
package net.hydromatic.sloth.sym;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.math.BigInteger;
import java.util.List;
import net.hydromatic.sloth.eval.Backend;
import net.hydromatic.sloth.eval.EvalException;
import net.hydromatic.sloth.eval.EvalPanic;
import net.hydromatic.sloth.eval.SeqMap;
import net.hydromatic.sloth.eval.Thunk;
import net.hydromatic.sloth.eval.Value;
import net.hydromatic.sloth.eval.Values;
import net.hydromatic.sloth.type.Nat;
import net.hydromatic.sloth.type.TValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Backend whose bits and integers are symbolic {@link Term}s.
 *
 * <p>A word is an {@link ImmutableList} of bit terms, most significant
 * first.
 *
 * <p>If the condition of a conditional is a literal, only the chosen
 * branch is evaluated. Otherwise both branches are evaluated and merged:
 * bits and integers via an if-then-else term, and structured values
 * component by component, lazily. If either branch is an error
 * placeholder, the merged value is that placeholder.
 */
public class SymbolicBackend implements Backend {
  public static final SymbolicBackend INSTANCE = new SymbolicBackend();

  protected SymbolicBackend() {}

  /** Creates a fresh bit variable. */
  public Value freshBit(String name) {
    return Value.bit(Term.var(name, Term.Sort.BIT));
  }

  /** Creates a fresh integer variable. */
  public Value freshInteger(String name) {
    return Value.integer(Term.var(name, Term.Sort.INTEGER));
  }

  @Override
  public @Nullable Object packBits(List<? extends Thunk> bits) {
    final ImmutableList.Builder<Term> b = ImmutableList.builder();
    for (Thunk bit : bits) {
      final Value v = Thunk.peek(bit);
      if (v == null || v.tag != Value.Tag.BIT) {
        return null;
      }
      b.add(term(((Value.Bit) v).bit));
    }
    return b.build();
  }

  @Override
  public long wordLen(Object word) {
    return bits(word).size();
  }

  @Override
  public Object wordBit(Object word, long i) {
    return bits(word).get((int) i);
  }

  @Override
  public Object wordLit(long width, BigInteger value) {
    final ImmutableList.Builder<Term> b = ImmutableList.builder();
    for (long i = width - 1; i >= 0; i--) {
      b.add(Term.bit(value.testBit((int) i)));
    }
    return b.build();
  }

  @Override
  public Object bitLit(boolean b) {
    return Term.bit(b);
  }

  @Override
  public @Nullable Boolean bitAsLit(Object bit) {
    return term(bit).asBoolean();
  }

  @Override
  public Object bitNot(Object bit) {
    return Term.not(term(bit));
  }

  @Override
  public Object bitAnd(Object bit0, Object bit1) {
    return Term.and(term(bit0), term(bit1));
  }

  @Override
  public Object bitOr(Object bit0, Object bit1) {
    return Term.or(term(bit0), term(bit1));
  }

  @Override
  public Object bitXor(Object bit0, Object bit1) {
    return Term.xor(term(bit0), term(bit1));
  }

  @Override
  public Object bitEq(Object bit0, Object bit1) {
    return Term.eq(term(bit0), term(bit1));
  }

  @Override
  public Object integerLit(BigInteger value) {
    return Term.integer(value);
  }

  @Override
  public @Nullable BigInteger integerAsLit(Object value) {
    return term(value).asInteger();
  }

  @Override
  public Object intPlus(Object value0, Object value1) {
    return Term.plus(term(value0), term(value1));
  }

  @Override
  public Object intMinus(Object value0, Object value1) {
    return Term.minus(term(value0), term(value1));
  }

  @Override
  public Object intMult(Object value0, Object value1) {
    return Term.mult(term(value0), term(value1));
  }

  @Override
  public Object intDiv(Object value0, Object value1) {
    final Term divisor = term(value1);
    if (BigInteger.ZERO.equals(divisor.asInteger())) {
      throw new EvalException(EvalException.Kind.DIVIDE_BY_ZERO,
          value0 + " / 0");
    }
    return Term.div(term(value0), divisor);
  }

  @Override
  public Object intEq(Object value0, Object value1) {
    return Term.eq(term(value0), term(value1));
  }

  @Override
  public Value iteValue(TValue type, Object bit, Thunk ifTrue,
      Thunk ifFalse) {
    final Term c = term(bit);
    final Boolean b = c.asBoolean();
    if (b != null) {
      return b ? ifTrue.force() : ifFalse.force();
    }
    return merge(c, type, ifTrue.force(), ifFalse.force());
  }

  /** Merges two values of the same type under a condition. */
  Value merge(Term c, TValue type, Value t, Value f) {
    if (t.tag == Value.Tag.ERROR) {
      return t;
    }
    if (f.tag == Value.Tag.ERROR) {
      return f;
    }
    switch (type.tag) {
      case BIT:
        return Value.bit(
            Term.ite(c, term(Values.fromVBit(t)), term(Values.fromVBit(f))));

      case INTEGER:
        return Value.integer(
            Term.ite(c, term(Values.fromVInteger(t)),
                term(Values.fromVInteger(f))));

      case SEQ:
      case STREAM:
        final TValue elementType = type.tag == TValue.Tag.SEQ
            ? ((TValue.Seq) type).elementType
            : ((TValue.Stream) type).elementType;
        if (t.tag == Value.Tag.WORD && f.tag == Value.Tag.WORD) {
          final List<Term> tBits = bits(((Value.Word) t).word);
          final List<Term> fBits = bits(((Value.Word) f).word);
          final ImmutableList.Builder<Term> b = ImmutableList.builder();
          for (int i = 0; i < tBits.size(); i++) {
            b.add(Term.ite(c, tBits.get(i), fBits.get(i)));
          }
          return Value.word(b.build());
        }
        final Nat length = type.tag == TValue.Tag.SEQ
            ? Nat.of(((TValue.Seq) type).length)
            : Nat.INF;
        final SeqMap ts = Values.fromVSeq(this, t);
        final SeqMap fs = Values.fromVSeq(this, f);
        return Value.seq(length, elementType,
            memoSeqMap(
                generateSeqMap(i -> () ->
                    merge(c, elementType, lookupSeqMap(ts, i).force(),
                        lookupSeqMap(fs, i).force()))));

      case TUPLE:
        final List<TValue> argTypes = ((TValue.Tuple) type).argTypes;
        final Value.Tuple tTuple = Values.fromVTuple(t);
        final Value.Tuple fTuple = Values.fromVTuple(f);
        final ImmutableList.Builder<Thunk> args = ImmutableList.builder();
        for (int i = 0; i < argTypes.size(); i++) {
          final int j = i;
          args.add(
              delay(null, () ->
                  merge(c, argTypes.get(j), tTuple.args.get(j).force(),
                      fTuple.args.get(j).force())));
        }
        return Value.tuple(args.build());

      case RECORD:
        final ImmutableSortedMap.Builder<String, Thunk> fields =
            ImmutableSortedMap.naturalOrder();
        ((TValue.Record) type).argNameTypes.forEach((name, fieldType) ->
            fields.put(name,
                delay(null, () ->
                    merge(c, fieldType,
                        Values.lookupRecord(name, t).force(),
                        Values.lookupRecord(name, f).force()))));
        return Value.record(fields.build());

      case FUN:
        final TValue resultType = ((TValue.Fun) type).resultType;
        final Value.Fun tFun = Values.fromVFun(t);
        final Value.Fun fFun = Values.fromVFun(f);
        return Value.fun(x ->
            merge(c, resultType, tFun.apply(x), fFun.apply(x)));

      default:
        throw new EvalPanic("SymbolicBackend.merge",
            "cannot merge values of type " + type);
    }
  }

  @Override
  public String describeBit(Object bit) {
    return term(bit).toString();
  }

  @Override
  public String describeInteger(Object value) {
    return term(value).toString();
  }

  @Override
  public String describeWord(Object word) {
    return bits(word).toString();
  }

  private static Term term(Object o) {
    return (Term) o;
  }

  @SuppressWarnings("unchecked")
  private static List<Term> bits(Object word) {
    return (List<Term>) word;
  }
}

// End SymbolicBackend.java
