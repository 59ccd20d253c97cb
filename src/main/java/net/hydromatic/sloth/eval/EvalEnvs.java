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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.function.BiConsumer;
import net.hydromatic.sloth.type.TypeEnv;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link EvalEnv}. */
public class EvalEnvs {
  private static final EvalEnv EMPTY = new EmptyEvalEnv();

  private EvalEnvs() {}

  /** Returns the empty evaluation environment. */
  public static EvalEnv empty() {
    return EMPTY;
  }

  /** Creates an evaluation environment with the given (name, value) map. */
  public static EvalEnv copyOf(Map<String, ? extends Thunk> valueMap) {
    return EMPTY.bindAll(valueMap);
  }

  /** Environment that binds nothing. */
  private static class EmptyEvalEnv implements EvalEnv {
    @Override
    public @Nullable Thunk getOpt(String name) {
      return null;
    }

    @Override
    public TypeEnv types() {
      return TypeEnv.empty();
    }

    @Override
    public void visit(BiConsumer<String, Thunk> consumer) {}

    @Override
    public String toString() {
      return "{}";
    }
  }

  /** Evaluation environment that inherits from a parent environment and
   * adds one binding. */
  static class SubEvalEnv implements EvalEnv {
    protected final EvalEnv parentEnv;
    protected final String name;
    protected final Thunk value;

    SubEvalEnv(EvalEnv parentEnv, String name, Thunk value) {
      this.parentEnv = requireNonNull(parentEnv);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
    }

    @Override
    public void visit(BiConsumer<String, Thunk> consumer) {
      consumer.accept(name, value);
      parentEnv.visit(consumer);
    }

    @Override
    public @Nullable Thunk getOpt(String name) {
      for (SubEvalEnv e = this;;) {
        if (name.equals(e.name)) {
          return e.value;
        }
        if (e.parentEnv instanceof SubEvalEnv) {
          e = (SubEvalEnv) e.parentEnv;
        } else {
          return e.parentEnv.getOpt(name);
        }
      }
    }

    @Override
    public TypeEnv types() {
      return parentEnv.types();
    }

    @Override
    public String toString() {
      return valueMap().keySet().toString();
    }
  }

  /** Evaluation environment that inherits from a parent environment and
   * adds several bindings. */
  static class MapEvalEnv implements EvalEnv {
    protected final EvalEnv parentEnv;
    protected final ImmutableMap<String, Thunk> valueMap;

    MapEvalEnv(EvalEnv parentEnv, Map<String, ? extends Thunk> valueMap) {
      this.parentEnv = requireNonNull(parentEnv);
      this.valueMap = ImmutableMap.copyOf(valueMap);
    }

    @Override
    public void visit(BiConsumer<String, Thunk> consumer) {
      valueMap.forEach(consumer);
      parentEnv.visit(consumer);
    }

    @Override
    public @Nullable Thunk getOpt(String name) {
      final Thunk value = valueMap.get(name);
      return value != null ? value : parentEnv.getOpt(name);
    }

    @Override
    public TypeEnv types() {
      return parentEnv.types();
    }

    @Override
    public String toString() {
      return valueMap().keySet().toString();
    }
  }

  /** Evaluation environment that has the same values as its parent
   * environment, and different type bindings. */
  static class TypedEvalEnv implements EvalEnv {
    protected final EvalEnv parentEnv;
    protected final TypeEnv typeEnv;

    TypedEvalEnv(EvalEnv parentEnv, TypeEnv typeEnv) {
      this.parentEnv = requireNonNull(parentEnv);
      this.typeEnv = requireNonNull(typeEnv);
    }

    @Override
    public void visit(BiConsumer<String, Thunk> consumer) {
      parentEnv.visit(consumer);
    }

    @Override
    public @Nullable Thunk getOpt(String name) {
      return parentEnv.getOpt(name);
    }

    @Override
    public TypeEnv types() {
      return typeEnv;
    }

    @Override
    public String toString() {
      return valueMap().keySet() + " " + typeEnv;
    }
  }
}

// End EvalEnvs.java
