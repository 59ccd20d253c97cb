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

import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;
import net.hydromatic.sloth.ast.PrimIdent;
import net.hydromatic.sloth.type.Nat;
import net.hydromatic.sloth.type.TValue;

/**
 * Implementations of the prelude primitives, for any backend.
 *
 * <p>The table is deliberately small: enough for literals, logic,
 * integer arithmetic, equality, lazy append and infinite enumeration.
 */
public abstract class Primitives {
  private Primitives() {}

  /** Returns the table of primitives, implemented using a given backend. */
  public static ImmutableMap<PrimIdent, Value> table(Backend backend) {
    final ImmutableMap.Builder<PrimIdent, Value> b = ImmutableMap.builder();

    // True : Bit
    // False : Bit
    b.put(PrimIdent.prelude("True"), Value.bit(backend.bitLit(true)));
    b.put(PrimIdent.prelude("False"), Value.bit(backend.bitLit(false)));

    // number : {val, a} a
    b.put(PrimIdent.prelude("number"),
        Values.nlam(val -> Values.tlam(type -> literal(backend, val, type))));

    // (&&), (||), (^) : Bit -> Bit -> Bit
    b.put(PrimIdent.prelude("&&"), bitBinary(backend::bitAnd));
    b.put(PrimIdent.prelude("||"), bitBinary(backend::bitOr));
    b.put(PrimIdent.prelude("^"), bitBinary(backend::bitXor));

    // complement : Bit -> Bit
    b.put(PrimIdent.prelude("complement"),
        Value.fun(x ->
            Value.bit(backend.bitNot(Values.fromVBit(x.force())))));

    // (==) : {a} a -> a -> Bit
    b.put(PrimIdent.prelude("=="),
        Values.tlam(type ->
            Values.lam2((x, y) ->
                Value.bit(equal(backend, type, x.force(), y.force())))));

    // (+), (-), (*), (/) : Integer -> Integer -> Integer
    b.put(PrimIdent.prelude("+"), intBinary(backend::intPlus));
    b.put(PrimIdent.prelude("-"), intBinary(backend::intMinus));
    b.put(PrimIdent.prelude("*"), intBinary(backend::intMult));
    b.put(PrimIdent.prelude("/"), intBinary(backend::intDiv));

    // negate : Integer -> Integer
    b.put(PrimIdent.prelude("negate"),
        intUnary(x ->
            backend.intMinus(backend.integerLit(BigInteger.ZERO), x)));

    // (#) : {front, back, a} [front]a -> [back]a -> [front + back]a
    b.put(PrimIdent.prelude("#"),
        Values.nlam(front ->
            Values.nlam(back ->
                Values.tlam(type ->
                    Values.lam2((xs, ys) ->
                        append(backend, front, back, type, xs, ys))))));

    // infFrom : Integer -> [inf]Integer
    b.put(PrimIdent.prelude("infFrom"),
        Value.fun(x ->
            Value.seq(Nat.INF, TValue.INTEGER,
                backend.generateSeqMap(i ->
                    backend.delay(null, () ->
                        Value.integer(
                            backend.intPlus(Values.fromVInteger(x.force()),
                                backend.integerLit(
                                    BigInteger.valueOf(i)))))))));

    // undefined : {a} a
    b.put(PrimIdent.prelude("undefined"),
        Values.tlam(type ->
            Value.error(
                new EvalException(EvalException.Kind.USER_ERROR,
                    "undefined"))));

    return b.build();
  }

  private static Value literal(Backend backend, Nat val, TValue type) {
    final BigInteger value = BigInteger.valueOf(val.value());
    switch (type.tag) {
      case INTEGER:
        return Value.integer(backend.integerLit(value));
      case SEQ:
        final TValue.Seq seq = (TValue.Seq) type;
        if (seq.elementType.isBit()) {
          return Value.word(backend.wordLit(seq.length, value));
        }
        break;
      default:
        break;
    }
    throw new EvalException(EvalException.Kind.UNSUPPORTED,
        "literal " + val + " of type " + type);
  }

  private static Value bitBinary(BinaryOperator<Object> op) {
    return Values.lam2((x, y) ->
        Value.bit(
            op.apply(Values.fromVBit(x.force()), Values.fromVBit(y.force()))));
  }

  private static Value intBinary(BinaryOperator<Object> op) {
    return Values.lam2((x, y) ->
        Value.integer(
            op.apply(Values.fromVInteger(x.force()),
                Values.fromVInteger(y.force()))));
  }

  private static Value intUnary(UnaryOperator<Object> op) {
    return Value.fun(x ->
        Value.integer(op.apply(Values.fromVInteger(x.force()))));
  }

  /** Compares two values of the same type, returning a bit. */
  static Object equal(Backend backend, TValue type, Value x, Value y) {
    switch (type.tag) {
      case BIT:
        return backend.bitEq(Values.fromVBit(x), Values.fromVBit(y));
      case INTEGER:
        return backend.intEq(Values.fromVInteger(x), Values.fromVInteger(y));
      case SEQ:
        final TValue.Seq seq = (TValue.Seq) type;
        final SeqMap xs = Values.fromVSeq(backend, x);
        final SeqMap ys = Values.fromVSeq(backend, y);
        Object result = backend.bitLit(true);
        for (long i = 0; i < seq.length; i++) {
          result = backend.bitAnd(result,
              equal(backend, seq.elementType,
                  backend.lookupSeqMap(xs, i).force(),
                  backend.lookupSeqMap(ys, i).force()));
        }
        return result;
      case TUPLE:
        final TValue.Tuple tuple = (TValue.Tuple) type;
        Object tupleResult = backend.bitLit(true);
        for (int i = 0; i < tuple.argTypes.size(); i++) {
          tupleResult = backend.bitAnd(tupleResult,
              equal(backend, tuple.argTypes.get(i),
                  Values.fromVTuple(x).args.get(i).force(),
                  Values.fromVTuple(y).args.get(i).force()));
        }
        return tupleResult;
      case RECORD:
        Object recordResult = backend.bitLit(true);
        for (String name : ((TValue.Record) type).argNameTypes.keySet()) {
          recordResult = backend.bitAnd(recordResult,
              equal(backend, ((TValue.Record) type).argNameTypes.get(name),
                  Values.lookupRecord(name, x).force(),
                  Values.lookupRecord(name, y).force()));
        }
        return recordResult;
      default:
        throw new EvalException(EvalException.Kind.UNSUPPORTED,
            "equality on type " + type);
    }
  }

  /** Appends two sequences. Neither argument is forced until an element is
   * forced; an element of the front is found without forcing the back. */
  private static Value append(Backend backend, Nat front, Nat back,
      TValue type, Thunk xs, Thunk ys) {
    final SeqMap elements =
        backend.generateSeqMap(i -> () -> {
          if (!front.isFinite() || i < front.value()) {
            return backend.lookupSeqMap(Values.fromVSeq(backend, xs.force()),
                i).force();
          }
          return backend.lookupSeqMap(Values.fromVSeq(backend, ys.force()),
              i - front.value()).force();
        });
    return Value.seq(front.plus(back), type, elements);
  }
}

// End Primitives.java
