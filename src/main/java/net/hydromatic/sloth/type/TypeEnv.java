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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import net.hydromatic.sloth.eval.EvalPanic;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Bindings of type variables to evaluated types.
 *
 * <p>A variable of kind {@link Kind#NUM} is bound to a {@link Nat}; a
 * variable of kind {@link Kind#TYPE} is bound to a {@link TValue}.
 *
 * <p>Every environment is immutable; {@link #bind} and {@link #union} create
 * new environments.
 */
public class TypeEnv {
  private static final TypeEnv EMPTY = new TypeEnv(ImmutableMap.of());

  private final ImmutableMap<TypeVar, TypeArg> map;

  private TypeEnv(ImmutableMap<TypeVar, TypeArg> map) {
    this.map = map;
  }

  /** Returns the empty type environment. */
  public static TypeEnv empty() {
    return EMPTY;
  }

  /** Returns the binding of a variable, or null. */
  public @Nullable TypeArg getOpt(TypeVar typeVar) {
    return map.get(typeVar);
  }

  /** Returns the bindings as a map. */
  public Map<TypeVar, TypeArg> asMap() {
    return map;
  }

  /** Creates an environment that is this plus one binding. A binding for a
   * variable of the same name replaces the existing binding. */
  public TypeEnv bind(TypeVar typeVar, TypeArg arg) {
    if (typeVar.kind != arg.kind()) {
      throw new EvalPanic("TypeEnv.bind",
          "kind mismatch binding " + typeVar,
          "expected: " + typeVar.kind.symbol,
          "actual: " + arg.kind().symbol);
    }
    return new TypeEnv(
        ImmutableMap.<TypeVar, TypeArg>builder()
            .putAll(map)
            .put(typeVar, arg)
            .buildKeepingLast());
  }

  /** Returns the union of this and another environment. Where both bind a
   * variable, this environment's binding wins. */
  public TypeEnv union(TypeEnv env) {
    if (env.map.isEmpty() || env == this) {
      return this;
    }
    if (map.isEmpty()) {
      return env;
    }
    return new TypeEnv(
        ImmutableMap.<TypeVar, TypeArg>builder()
            .putAll(env.map)
            .putAll(map)
            .buildKeepingLast());
  }

  /** Evaluates a type of kind {@link Kind#TYPE}. */
  public TValue evalValType(Type type) {
    switch (type.op()) {
      case TY_VAR:
        final TypeArg arg = map.get((TypeVar) type);
        if (arg instanceof TValue) {
          return (TValue) arg;
        }
        throw new EvalPanic("TypeEnv.evalValType",
            "type variable " + type + " is not bound to a value type",
            "binding: " + arg);

      case PRIM_TYPE:
        return type == PrimitiveType.BIT ? TValue.BIT : TValue.INTEGER;

      case SEQ_TYPE:
        final SeqType seqType = (SeqType) type;
        return TValue.seq(evalNumType(seqType.length),
            evalValType(seqType.elementType));

      case TUPLE_TYPE:
        final ImmutableList.Builder<TValue> types = ImmutableList.builder();
        ((TupleType) type).argTypes.forEach(t -> types.add(evalValType(t)));
        return TValue.tuple(types.build());

      case RECORD_TYPE:
        final ImmutableSortedMap.Builder<String, TValue> fields =
            ImmutableSortedMap.naturalOrder();
        ((RecordType) type).argNameTypes.forEach((name, t) ->
            fields.put(name, evalValType(t)));
        return TValue.record(fields.build());

      case FUNCTION_TYPE:
        final FnType fnType = (FnType) type;
        return TValue.fun(evalValType(fnType.paramType),
            evalValType(fnType.resultType));

      default:
        throw new EvalPanic("TypeEnv.evalValType",
            "expected a value type", "type: " + type);
    }
  }

  /** Evaluates a type of kind {@link Kind#NUM}. */
  public Nat evalNumType(Type type) {
    switch (type.op()) {
      case TY_VAR:
        final TypeArg arg = map.get((TypeVar) type);
        if (arg instanceof Nat) {
          return (Nat) arg;
        }
        throw new EvalPanic("TypeEnv.evalNumType",
            "type variable " + type + " is not bound to a number",
            "binding: " + arg);

      case NUM_TYPE:
        return ((NumType) type).nat;

      case TYPE_FUN:
        final TypeFun typeFun = (TypeFun) type;
        return typeFun.fun.apply(evalNumType(typeFun.args.get(0)),
            evalNumType(typeFun.args.get(1)));

      default:
        throw new EvalPanic("TypeEnv.evalNumType",
            "expected a numeric type", "type: " + type);
    }
  }

  @Override
  public String toString() {
    return map.toString();
  }
}

// End TypeEnv.java
