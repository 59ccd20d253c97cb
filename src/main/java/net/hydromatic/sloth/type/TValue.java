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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Evaluated value type.
 *
 * <p>Whereas a {@link Type} may contain variables and type-level arithmetic,
 * a TValue is closed: every length is known. The evaluator uses TValues to
 * decide how to represent values (for example, sequences of bits may be
 * packed into words) and to guide functional update. */
public abstract class TValue implements TypeArg {
  public static final TValue BIT = new Prim(Tag.BIT);
  public static final TValue INTEGER = new Prim(Tag.INTEGER);

  public final Tag tag;

  TValue(Tag tag) {
    this.tag = requireNonNull(tag);
  }

  @Override
  public Kind kind() {
    return Kind.TYPE;
  }

  /** Returns whether this is the type {@code Bit}. */
  public boolean isBit() {
    return tag == Tag.BIT;
  }

  /** Creates a sequence type; a {@link Stream} if the length is infinite,
   * otherwise a {@link Seq}. */
  public static TValue seq(Nat length, TValue elementType) {
    return length.isFinite()
        ? new Seq(length.value(), elementType)
        : new Stream(elementType);
  }

  public static Tuple tuple(List<? extends TValue> types) {
    return new Tuple(ImmutableList.copyOf(types));
  }

  public static Record record(Map<String, ? extends TValue> fields) {
    return new Record(ImmutableSortedMap.copyOf(fields));
  }

  public static Fun fun(TValue paramType, TValue resultType) {
    return new Fun(paramType, resultType);
  }

  /** Kinds of value type. */
  public enum Tag {
    BIT, INTEGER, SEQ, STREAM, TUPLE, RECORD, FUN
  }

  /** {@code Bit} or {@code Integer}. */
  static class Prim extends TValue {
    Prim(Tag tag) {
      super(tag);
    }

    @Override
    public String toString() {
      return tag == Tag.BIT ? "Bit" : "Integer";
    }
  }

  /** Finite sequence type. */
  public static class Seq extends TValue {
    public final long length;
    public final TValue elementType;

    Seq(long length, TValue elementType) {
      super(Tag.SEQ);
      this.length = length;
      this.elementType = requireNonNull(elementType);
    }

    @Override
    public int hashCode() {
      return Objects.hash(length, elementType);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Seq
              && length == ((Seq) obj).length
              && elementType.equals(((Seq) obj).elementType);
    }

    @Override
    public String toString() {
      return "[" + length + "]" + elementType;
    }
  }

  /** Infinite sequence type. */
  public static class Stream extends TValue {
    public final TValue elementType;

    Stream(TValue elementType) {
      super(Tag.STREAM);
      this.elementType = requireNonNull(elementType);
    }

    @Override
    public int hashCode() {
      return elementType.hashCode() * 31 + 7;
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Stream
              && elementType.equals(((Stream) obj).elementType);
    }

    @Override
    public String toString() {
      return "[inf]" + elementType;
    }
  }

  /** Tuple type. */
  public static class Tuple extends TValue {
    public final ImmutableList<TValue> argTypes;

    Tuple(ImmutableList<TValue> argTypes) {
      super(Tag.TUPLE);
      this.argTypes = argTypes;
    }

    @Override
    public int hashCode() {
      return argTypes.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Tuple && argTypes.equals(((Tuple) obj).argTypes);
    }

    @Override
    public String toString() {
      return argTypes.toString().replace('[', '(').replace(']', ')');
    }
  }

  /** Record type. */
  public static class Record extends TValue {
    public final ImmutableSortedMap<String, TValue> argNameTypes;

    Record(ImmutableSortedMap<String, TValue> argNameTypes) {
      super(Tag.RECORD);
      this.argNameTypes = argNameTypes;
    }

    @Override
    public int hashCode() {
      return argNameTypes.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Record
              && argNameTypes.equals(((Record) obj).argNameTypes);
    }

    @Override
    public String toString() {
      return argNameTypes.toString();
    }
  }

  /** Function type. */
  public static class Fun extends TValue {
    public final TValue paramType;
    public final TValue resultType;

    Fun(TValue paramType, TValue resultType) {
      super(Tag.FUN);
      this.paramType = requireNonNull(paramType);
      this.resultType = requireNonNull(resultType);
    }

    @Override
    public int hashCode() {
      return Objects.hash(paramType, resultType);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Fun
              && paramType.equals(((Fun) obj).paramType)
              && resultType.equals(((Fun) obj).resultType);
    }

    @Override
    public String toString() {
      return "(" + paramType + " -> " + resultType + ")";
    }
  }
}

// End TValue.java
