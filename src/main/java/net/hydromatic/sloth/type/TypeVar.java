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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.sloth.ast.Op;

/** Type variable (e.g. {@code a} in {@code {a} a -> a}).
 *
 * <p>Names are unique within a program; the type checker guarantees it. */
public class TypeVar implements Type {
  public final String name;
  public final Kind kind;

  /** Creates a type variable. */
  public TypeVar(String name, Kind kind) {
    this.name = requireNonNull(name);
    this.kind = requireNonNull(kind);
    checkArgument(!name.isEmpty(), "empty name");
  }

  /** Creates a type variable of kind {@link Kind#TYPE}. */
  public static TypeVar type(String name) {
    return new TypeVar(name, Kind.TYPE);
  }

  /** Creates a type variable of kind {@link Kind#NUM}. */
  public static TypeVar num(String name) {
    return new TypeVar(name, Kind.NUM);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, kind);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof TypeVar
            && name.equals(((TypeVar) obj).name)
            && kind == ((TypeVar) obj).kind;
  }

  @Override
  public String toString() {
    return name;
  }

  @Override
  public Op op() {
    return Op.TY_VAR;
  }
}

// End TypeVar.java
