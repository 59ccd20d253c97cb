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
package net.hydromatic.sloth.ast;

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/** Identifier of a primitive: the module that declares it, and its name.
 *
 * <p>A declaration whose definition is a primitive carries a PrimIdent;
 * the evaluator looks up the implementation in its primitive table. */
public class PrimIdent {
  /** Module of the primitives in the standard prelude. */
  public static final String PRELUDE = "Prelude";

  public final String module;
  public final String name;

  public PrimIdent(String module, String name) {
    this.module = requireNonNull(module);
    this.name = requireNonNull(name);
  }

  /** Creates an identifier for a primitive in the prelude. */
  public static PrimIdent prelude(String name) {
    return new PrimIdent(PRELUDE, name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(module, name);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof PrimIdent
            && module.equals(((PrimIdent) obj).module)
            && name.equals(((PrimIdent) obj).name);
  }

  @Override
  public String toString() {
    return module + "::" + name;
  }
}

// End PrimIdent.java
