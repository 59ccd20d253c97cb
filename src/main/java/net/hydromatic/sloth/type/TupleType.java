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
import java.util.List;
import net.hydromatic.sloth.ast.Op;

/** Tuple type, such as {@code (Bit, [8])}. */
public class TupleType implements Type {
  public final ImmutableList<Type> argTypes;

  public TupleType(List<? extends Type> argTypes) {
    this.argTypes = ImmutableList.copyOf(argTypes);
  }

  @Override
  public int hashCode() {
    return argTypes.hashCode() + 17;
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof TupleType
            && argTypes.equals(((TupleType) obj).argTypes);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("(");
    for (int i = 0; i < argTypes.size(); i++) {
      b.append(i > 0 ? Op.TUPLE_TYPE.padded : "").append(argTypes.get(i));
    }
    return b.append(")").toString();
  }

  @Override
  public Op op() {
    return Op.TUPLE_TYPE;
  }
}

// End TupleType.java
