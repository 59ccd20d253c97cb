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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import net.hydromatic.sloth.type.TypeArg;
import net.hydromatic.sloth.type.TypeEnv;
import net.hydromatic.sloth.type.TypeVar;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluation environment.
 *
 * <p>Binds variable names to suspended values, and type variables to
 * evaluated types. Environments are immutable; every {@code bind} method
 * returns a new environment that shares structure with this one.
 */
public interface EvalEnv {
  /** Returns the binding of {@code name} if bound, null if not. */
  @Nullable Thunk getOpt(String name);

  /** Returns the binding of type variables. */
  TypeEnv types();

  /**
   * Creates an environment that has the same content as this one, plus the
   * binding (name, value).
   */
  default EvalEnv bind(String name, Thunk value) {
    return new EvalEnvs.SubEvalEnv(this, name, value);
  }

  /**
   * Creates an environment that has the same content as this one, plus
   * several bindings. Where a name is already bound, the new binding
   * wins.
   */
  default EvalEnv bindAll(Map<String, ? extends Thunk> values) {
    if (values.isEmpty()) {
      return this;
    }
    return new EvalEnvs.MapEvalEnv(this, values);
  }

  /**
   * Creates an environment that has the same content as this one, plus the
   * binding of a type variable.
   */
  default EvalEnv bindType(TypeVar typeVar, TypeArg arg) {
    return new EvalEnvs.TypedEvalEnv(this, types().bind(typeVar, arg));
  }

  /**
   * Visits every variable binding in this environment.
   *
   * <p>Bindings that are obscured by more recent bindings of the same name
   * are visited, but after the more obscuring bindings.
   */
  void visit(BiConsumer<String, Thunk> consumer);

  /**
   * Returns a map of the values and bindings.
   *
   * <p>Used for diagnostics; forces nothing.
   */
  default Map<String, Thunk> valueMap() {
    final Map<String, Thunk> map = new LinkedHashMap<>();
    visit(map::putIfAbsent);
    return map;
  }
}

// End EvalEnv.java
