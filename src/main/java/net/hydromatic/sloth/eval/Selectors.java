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
import net.hydromatic.sloth.ast.Core;
import net.hydromatic.sloth.type.Nat;
import net.hydromatic.sloth.type.TValue;

/** Selection and functional update of components of tuples, records and
 * sequences.
 *
 * <p>Selection returns the component's suspension without forcing it.
 * Update returns a new container in which every component that is not
 * replaced is re-derived, on demand, from the original container. */
public class Selectors {
  private final Backend backend;

  Selectors(Backend backend) {
    this.backend = requireNonNull(backend);
  }

  /** Selects a component of a value. */
  public Thunk evalSel(Value value, Core.Selector selector) {
    if (value.tag == Value.Tag.ERROR) {
      throw ((Value.Error) value).raise();
    }
    switch (selector.op) {
      case TUPLE_SEL:
        if (value.tag != Value.Tag.TUPLE) {
          break;
        }
        final ImmutableList<Thunk> args = ((Value.Tuple) value).args;
        if (selector.index >= args.size()) {
          throw new EvalPanic("Selectors.evalSel", "tuple index out of range",
              "index: " + selector.index, "size: " + args.size());
        }
        return args.get(selector.index);

      case RECORD_SEL:
        if (value.tag != Value.Tag.RECORD) {
          break;
        }
        return Values.lookupRecord(requireNonNull(selector.field), value);

      case LIST_SEL:
        if (value.tag != Value.Tag.SEQ && value.tag != Value.Tag.WORD) {
          break;
        }
        final Nat length = Values.seqLength(backend, value);
        if (length.isFinite() && selector.index >= length.value()) {
          throw new EvalPanic("Selectors.evalSel", "list index out of range",
              "index: " + selector.index, "length: " + length);
        }
        return backend.lookupSeqMap(Values.fromVSeq(backend, value),
            selector.index);

      default:
        break;
    }
    throw new EvalPanic("Selectors.evalSel",
        "selector does not match value",
        "selector: " + selector, "value: " + value.tag);
  }

  /** Replaces a component of a value.
   *
   * @param type Type of the container
   * @param container Suspended container
   * @param selector Which component to replace
   * @param replacement Suspended new component
   */
  public Value evalSetSel(TValue type, Thunk container, Core.Selector selector,
      Thunk replacement) {
    switch (selector.op) {
      case TUPLE_SEL:
        if (type.tag != TValue.Tag.TUPLE) {
          break;
        }
        final List<TValue> argTypes = ((TValue.Tuple) type).argTypes;
        final ImmutableList.Builder<Thunk> args = ImmutableList.builder();
        for (int i = 0; i < argTypes.size(); i++) {
          final int j = i;
          args.add(i == selector.index
              ? replacement
              : () -> Values.fromVTuple(container.force()).args.get(j)
                  .force());
        }
        return Value.tuple(args.build());

      case RECORD_SEL:
        if (type.tag != TValue.Tag.RECORD) {
          break;
        }
        final String field = requireNonNull(selector.field);
        final ImmutableSortedMap<String, TValue> fieldTypes =
            ((TValue.Record) type).argNameTypes;
        if (!fieldTypes.containsKey(field)) {
          throw new EvalPanic("Selectors.evalSetSel", "missing field!",
              "field: " + field, "fields: " + fieldTypes.keySet());
        }
        final ImmutableSortedMap.Builder<String, Thunk> fields =
            ImmutableSortedMap.naturalOrder();
        fieldTypes.keySet().forEach(name ->
            fields.put(name,
                name.equals(field)
                    ? replacement
                    : () -> Values.lookupRecord(name, container.force())
                        .force()));
        return Value.record(fields.build());

      case LIST_SEL:
        final Nat length;
        final TValue elementType;
        if (type.tag == TValue.Tag.SEQ) {
          length = Nat.of(((TValue.Seq) type).length);
          elementType = ((TValue.Seq) type).elementType;
        } else if (type.tag == TValue.Tag.STREAM) {
          length = Nat.INF;
          elementType = ((TValue.Stream) type).elementType;
        } else {
          break;
        }
        if (length.isFinite() && selector.index >= length.value()) {
          throw new EvalPanic("Selectors.evalSetSel",
              "list index out of range",
              "index: " + selector.index, "length: " + length);
        }
        final SeqMap elements =
            backend.delaySeqMap(() ->
                Values.fromVSeq(backend, container.force()));
        return Value.seq(length, elementType,
            backend.updateSeqMap(elements, selector.index, replacement));

      default:
        break;
    }
    throw new EvalPanic("Selectors.evalSetSel",
        "selector does not match type",
        "selector: " + selector, "type: " + type);
  }
}

// End Selectors.java
