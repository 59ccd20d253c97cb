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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.LongFunction;
import net.hydromatic.sloth.type.TypeEnv;

/**
 * Environment for evaluating the branches of a comprehension.
 *
 * <p>Some variables are <em>varying</em>: their value depends on the index
 * of the element being computed, so each is a function from index to
 * suspended value. Other variables are <em>static</em>, the same for every
 * index. Static variables sit on top of a base environment, which holds
 * everything in scope where the comprehension was written.
 *
 * <p>Immutable.
 */
public class ListEnv {
  private final EvalEnv base;
  private final ImmutableMap<String, Thunk> statics;
  private final ImmutableMap<String, LongFunction<Thunk>> varying;

  private ListEnv(EvalEnv base, ImmutableMap<String, Thunk> statics,
      ImmutableMap<String, LongFunction<Thunk>> varying) {
    this.base = requireNonNull(base);
    this.statics = requireNonNull(statics);
    this.varying = requireNonNull(varying);
  }

  /** Creates a list environment in which everything in {@code env} is
   * static and nothing varies. */
  public static ListEnv of(EvalEnv env) {
    return new ListEnv(env, ImmutableMap.of(), ImmutableMap.of());
  }

  /** Returns the type bindings; they are the same at every index. */
  public TypeEnv types() {
    return base.types();
  }

  /** Returns the names of the varying variables. */
  public Set<String> varyingNames() {
    return varying.keySet();
  }

  /** Returns an environment with a varying variable added. */
  public ListEnv bindVarying(String name, LongFunction<Thunk> f) {
    return new ListEnv(base, statics,
        ImmutableMap.<String, LongFunction<Thunk>>builder()
            .putAll(varying)
            .put(name, f)
            .buildKeepingLast());
  }

  /** Returns an environment in which each varying variable advances once
   * every {@code n} indexes; the value at index {@code i} is the old value
   * at index {@code i / n}. */
  public ListEnv stutter(long n) {
    final ImmutableMap.Builder<String, LongFunction<Thunk>> b =
        ImmutableMap.builder();
    varying.forEach((name, f) -> b.put(name, i -> f.apply(i / n)));
    return new ListEnv(base, statics, b.build());
  }

  /** Returns an environment in which each varying variable is fixed at its
   * value at index 0, and so becomes static. */
  public ListEnv collapse() {
    if (varying.isEmpty()) {
      return this;
    }
    final Map<String, Thunk> map = new LinkedHashMap<>(statics);
    varying.forEach((name, f) -> map.put(name, f.apply(0)));
    return new ListEnv(base, ImmutableMap.copyOf(map), ImmutableMap.of());
  }

  /** Returns the union of this and another environment over the same base.
   * Where both bind a variable, this environment's binding wins. */
  public ListEnv union(ListEnv other) {
    if (other.base != base) {
      throw new EvalPanic("ListEnv.union",
          "branches have different base environments");
    }
    final Map<String, Thunk> statics = new LinkedHashMap<>(other.statics);
    statics.putAll(this.statics);
    final Map<String, LongFunction<Thunk>> varying =
        new LinkedHashMap<>(other.varying);
    varying.putAll(this.varying);
    return new ListEnv(base, ImmutableMap.copyOf(statics),
        ImmutableMap.copyOf(varying));
  }

  /** Returns the ordinary environment for computing the element at index
   * {@code i}. A varying binding shadows a static binding of the same
   * name. */
  public EvalEnv evalAt(long i) {
    if (varying.isEmpty()) {
      return base.bindAll(statics);
    }
    final Map<String, Thunk> map = new LinkedHashMap<>(statics);
    varying.forEach((name, f) -> map.put(name, f.apply(i)));
    return base.bindAll(map);
  }

  @Override
  public String toString() {
    return "static " + statics.keySet() + " varying " + varying.keySet();
  }
}

// End ListEnv.java
