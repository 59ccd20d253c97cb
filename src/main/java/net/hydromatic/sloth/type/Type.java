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

import net.hydromatic.sloth.ast.Op;

/** Type term, as written in a type-checked program.
 *
 * <p>Type terms may mention type variables and type-level arithmetic; they
 * are turned into {@link TValue}s and {@link Nat}s by
 * {@link TypeEnv#evalValType} and {@link TypeEnv#evalNumType}. */
public interface Type {
  /** Returns the kind of type term. */
  Op op();

  /** Returns whether this term denotes the type {@code Bit}. */
  default boolean isBit() {
    return this == PrimitiveType.BIT;
  }
}

// End Type.java
