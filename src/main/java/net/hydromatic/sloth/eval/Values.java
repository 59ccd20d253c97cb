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

import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;
import net.hydromatic.sloth.type.Nat;
import net.hydromatic.sloth.type.TValue;

/** Utilities for {@link Value}.
 *
 * <p>The {@code fromVXxx} methods extract the contents of a value of an
 * expected shape. If the value is an {@link Value.Error error placeholder},
 * they raise its error; if it has some other shape, they panic. */
public abstract class Values {
  private Values() {}

  /** Returns the bit inside a bit value. */
  public static Object fromVBit(Value value) {
    switch (value.tag) {
      case BIT:
        return ((Value.Bit) value).bit;
      case ERROR:
        throw ((Value.Error) value).raise();
      default:
        throw mismatch("fromVBit", "bit", value);
    }
  }

  /** Returns the integer inside an integer value. */
  public static Object fromVInteger(Value value) {
    switch (value.tag) {
      case INTEGER:
        return ((Value.Int) value).value;
      case ERROR:
        throw ((Value.Error) value).raise();
      default:
        throw mismatch("fromVInteger", "integer", value);
    }
  }

  /** Returns the elements of a sequence value. A word is unpacked into its
   * bits. */
  public static SeqMap fromVSeq(Backend backend, Value value) {
    switch (value.tag) {
      case SEQ:
        return ((Value.Seq) value).seqMap;
      case WORD:
        return backend.unpackWord(((Value.Word) value).word);
      case ERROR:
        throw ((Value.Error) value).raise();
      default:
        throw mismatch("fromVSeq", "sequence", value);
    }
  }

  /** Returns the length of a sequence value. */
  public static Nat seqLength(Backend backend, Value value) {
    switch (value.tag) {
      case SEQ:
        return ((Value.Seq) value).length;
      case WORD:
        return Nat.of(backend.wordLen(((Value.Word) value).word));
      case ERROR:
        throw ((Value.Error) value).raise();
      default:
        throw mismatch("seqLength", "sequence", value);
    }
  }

  /** Returns the components of a tuple value. */
  public static Value.Tuple fromVTuple(Value value) {
    switch (value.tag) {
      case TUPLE:
        return (Value.Tuple) value;
      case ERROR:
        throw ((Value.Error) value).raise();
      default:
        throw mismatch("fromVTuple", "tuple", value);
    }
  }

  /** Returns the fields of a record value. */
  public static Value.Record fromVRecord(Value value) {
    switch (value.tag) {
      case RECORD:
        return (Value.Record) value;
      case ERROR:
        throw ((Value.Error) value).raise();
      default:
        throw mismatch("fromVRecord", "record", value);
    }
  }

  /** Returns a function value. */
  public static Value.Fun fromVFun(Value value) {
    switch (value.tag) {
      case FUN:
        return (Value.Fun) value;
      case ERROR:
        throw ((Value.Error) value).raise();
      default:
        throw mismatch("fromVFun", "function", value);
    }
  }

  /** Returns the suspended value of a field of a record. Panics if the
   * record has no such field. */
  public static Thunk lookupRecord(String name, Value value) {
    final Thunk thunk = fromVRecord(value).fields.get(name);
    if (thunk == null) {
      throw new EvalPanic("Values.lookupRecord", "missing field!",
          "field: " + name,
          "fields: " + ((Value.Record) value).fields.keySet());
    }
    return thunk;
  }

  /** Creates a type abstraction. */
  public static Value tlam(Function<TValue, Value> f) {
    return Value.poly(f);
  }

  /** Creates a numeric type abstraction. */
  public static Value nlam(Function<Nat, Value> f) {
    return Value.numPoly(f);
  }

  /** Creates a curried function of two arguments. */
  public static Value lam2(BiFunction<Thunk, Thunk, Value> f) {
    return Value.fun(x -> Value.fun(y -> f.apply(x, y)));
  }

  /** Forces a value and all of its components, recursively. Raises the
   * first error found. Infinite sequences and functions are returned
   * without forcing their contents. */
  public static Value forceValue(Backend backend, Value value) {
    switch (value.tag) {
      case SEQ:
        final Value.Seq seq = (Value.Seq) value;
        if (!seq.length.isFinite()) {
          return value;
        }
        final long n = seq.length.value();
        for (long i = 0; i < n; i++) {
          forceValue(backend, backend.lookupSeqMap(seq.seqMap, i).force());
        }
        return value;
      case TUPLE:
        ((Value.Tuple) value).args.forEach(t -> forceValue(backend, t.force()));
        return value;
      case RECORD:
        ((Value.Record) value).fields.values()
            .forEach(t -> forceValue(backend, t.force()));
        return value;
      case ERROR:
        throw ((Value.Error) value).raise();
      default:
        return value;
    }
  }

  /** Converts a value to a string, forcing as much of it as is needed.
   * Sequences longer than {@link Prop#PRINT_LENGTH} and structures deeper
   * than {@link Prop#PRINT_DEPTH} are abbreviated. */
  public static String describe(Backend backend, Value value,
      Map<Prop, Object> propMap) {
    final int printLength = Prop.PRINT_LENGTH.intValue(propMap);
    final int printDepth = Prop.PRINT_DEPTH.intValue(propMap);
    final StringBuilder b = new StringBuilder();
    describe(backend, value, printLength, printDepth, b);
    return b.toString();
  }

  private static void describe(Backend backend, Value value, int printLength,
      int depth, StringBuilder b) {
    switch (value.tag) {
      case BIT:
        b.append(backend.describeBit(((Value.Bit) value).bit));
        return;
      case INTEGER:
        b.append(backend.describeInteger(((Value.Int) value).value));
        return;
      case WORD:
        b.append(backend.describeWord(((Value.Word) value).word));
        return;
      case ERROR:
        throw ((Value.Error) value).raise();
      case FUN:
      case POLY:
      case NUM_POLY:
        b.append("<fun>");
        return;
      default:
        break;
    }
    if (depth <= 0) {
      b.append("...");
      return;
    }
    switch (value.tag) {
      case SEQ:
        final Value.Seq seq = (Value.Seq) value;
        b.append('[');
        final boolean more = !seq.length.isFinite()
            || seq.length.value() > printLength;
        final long n = more ? printLength : seq.length.value();
        for (long i = 0; i < n; i++) {
          if (i > 0) {
            b.append(", ");
          }
          describe(backend, backend.lookupSeqMap(seq.seqMap, i).force(),
              printLength, depth - 1, b);
        }
        if (more) {
          b.append(n > 0 ? ", ..." : "...");
        }
        b.append(']');
        return;
      case TUPLE:
        b.append('(');
        final Value.Tuple tuple = (Value.Tuple) value;
        for (int i = 0; i < tuple.args.size(); i++) {
          if (i > 0) {
            b.append(", ");
          }
          describe(backend, tuple.args.get(i).force(), printLength,
              depth - 1, b);
        }
        b.append(')');
        return;
      case RECORD:
        b.append('{');
        final int start = b.length();
        ((Value.Record) value).fields.forEach((name, thunk) -> {
          if (b.length() > start) {
            b.append(", ");
          }
          b.append(name).append(" = ");
          describe(backend, thunk.force(), printLength, depth - 1, b);
        });
        b.append('}');
        return;
      default:
        throw new EvalPanic("Values.describe", "unknown value " + value);
    }
  }

  private static EvalPanic mismatch(String location, String expected,
      Value value) {
    return new EvalPanic("Values." + location, "expected a " + expected,
        "actual: " + value.tag);
  }
}

// End Values.java
