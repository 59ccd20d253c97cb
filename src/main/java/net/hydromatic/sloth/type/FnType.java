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

import java.util.Objects;
import net.hydromatic.sloth.ast.Op;

/** The type of a function value. */
public class FnType implements Type {
  public final Type paramType;
  public final Type resultType;

  public FnType(Type paramType, Type resultType) {
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
        || obj instanceof FnType
            && paramType.equals(((FnType) obj).paramType)
            && resultType.equals(((FnType) obj).resultType);
  }

  @Override
  public String toString() {
    return "(" + paramType + Op.FUNCTION_TYPE.padded + resultType + ")";
  }

  @Override
  public Op op() {
    return Op.FUNCTION_TYPE;
  }
}

// End FnType.java
