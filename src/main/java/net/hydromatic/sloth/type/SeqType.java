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

/** Sequence type, {@code [n]a}. If the length is {@code inf}, the type is a
 * stream. */
public class SeqType implements Type {
  public final Type length;
  public final Type elementType;

  public SeqType(Type length, Type elementType) {
    this.length = requireNonNull(length);
    this.elementType = requireNonNull(elementType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(length, elementType);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof SeqType
            && length.equals(((SeqType) obj).length)
            && elementType.equals(((SeqType) obj).elementType);
  }

  @Override
  public String toString() {
    return "[" + length + "]" + elementType;
  }

  @Override
  public Op op() {
    return Op.SEQ_TYPE;
  }
}

// End SeqType.java
