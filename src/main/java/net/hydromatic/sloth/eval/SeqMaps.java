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

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongFunction;
import java.util.function.Supplier;

/** Implementations of {@link SeqMap}. */
public abstract class SeqMaps {
  private SeqMaps() {}

  /** Creates a sequence map that calls a function for each lookup.
   * Nothing is cached. */
  public static SeqMap generate(LongFunction<Thunk> f) {
    requireNonNull(f);
    return f::apply;
  }

  /** Creates a sequence map over a list of suspended elements. Looking up
   * an index beyond the end of the list is an
   * {@link EvalException.Kind#INVALID_INDEX} error. */
  public static SeqMap finite(List<? extends Thunk> elements) {
    final ImmutableList<Thunk> list = ImmutableList.copyOf(elements);
    return i -> {
      if (i < 0 || i >= list.size()) {
        throw new EvalException(EvalException.Kind.INVALID_INDEX,
            "index " + i + " out of range [0, " + list.size() + ")");
      }
      return list.get((int) i);
    };
  }

  /** Creates a sequence map that evaluates each element of another map at
   * most once. The element at each index is wrapped in a suspension made by
   * {@link Backend#delay}, and the suspension is cached. */
  public static SeqMap memo(Backend backend, SeqMap seqMap) {
    if (seqMap instanceof MemoSeqMap) {
      return seqMap;
    }
    return new MemoSeqMap(backend, seqMap);
  }

  /** Creates a sequence map that is the same as another except at one
   * index. */
  public static SeqMap update(SeqMap seqMap, long index, Thunk value) {
    requireNonNull(seqMap);
    requireNonNull(value);
    return i -> i == index ? value : seqMap.lookup(i);
  }

  /** Creates a sequence map whose contents come from a computation that is
   * not run until the first lookup, and is run only once. */
  public static SeqMap delay(Supplier<SeqMap> supplier) {
    final Supplier<SeqMap> memo = Suppliers.memoize(supplier::get);
    return i -> memo.get().lookup(i);
  }

  /** Flattens a sequence of sequences, each of length {@code innerLength},
   * into one sequence. Element {@code i} of the result is element
   * {@code i mod innerLength} of element {@code i / innerLength} of
   * {@code nested}. */
  public static SeqMap join(Backend backend, long innerLength,
      SeqMap nested) {
    return i -> {
      final long outer = i / innerLength;
      final long inner = i % innerLength;
      return () -> {
        final Value v = nested.lookup(outer).force();
        return backend.lookupSeqMap(Values.fromVSeq(backend, v), inner)
            .force();
      };
    };
  }

  /** Creates a sequence map of the bits of a packed word. Bit 0 is the most
   * significant. */
  public static SeqMap word(Backend backend, Object word) {
    requireNonNull(word);
    final long width = backend.wordLen(word);
    return i -> {
      if (i < 0 || i >= width) {
        throw new EvalException(EvalException.Kind.INVALID_INDEX,
            "bit " + i + " out of range [0, " + width + ")");
      }
      return Thunk.of(Value.bit(backend.wordBit(word, i)));
    };
  }

  /** Sequence map that caches a suspension for each index it has been
   * asked for. */
  private static class MemoSeqMap implements SeqMap {
    private final Backend backend;
    private final SeqMap seqMap;
    private final Map<Long, Thunk> cache = new HashMap<>();

    MemoSeqMap(Backend backend, SeqMap seqMap) {
      this.backend = requireNonNull(backend);
      this.seqMap = requireNonNull(seqMap);
    }

    @Override
    public Thunk lookup(long i) {
      final Thunk cached = cache.get(i);
      if (cached != null) {
        return cached;
      }
      final Thunk element = seqMap.lookup(i);
      final Thunk thunk = backend.delay(null, element::force);
      cache.put(i, thunk);
      return thunk;
    }
  }
}

// End SeqMaps.java
