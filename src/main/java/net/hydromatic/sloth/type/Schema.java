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
import java.util.List;

/** Type schema of a declaration: quantified variables, constraints, and the
 * body type; e.g. {@code {a} (Zero a) => a -> a}. */
public class Schema {
  public final ImmutableList<TypeVar> params;
  public final ImmutableList<Type> props;
  public final Type type;

  public Schema(List<TypeVar> params, List<? extends Type> props, Type type) {
    this.params = ImmutableList.copyOf(params);
    this.props = ImmutableList.copyOf(props);
    this.type = requireNonNull(type);
  }

  /** Creates a monomorphic schema. */
  public static Schema mono(Type type) {
    return new Schema(ImmutableList.of(), ImmutableList.of(), type);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    if (!params.isEmpty()) {
      b.append("{");
      for (int i = 0; i < params.size(); i++) {
        b.append(i > 0 ? ", " : "").append(params.get(i));
      }
      b.append("} ");
    }
    if (!props.isEmpty()) {
      b.append(props).append(" => ");
    }
    return b.append(type).toString();
  }
}

// End Schema.java
