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

import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import net.hydromatic.sloth.ast.Op;

/** Record type, such as {@code {x : Bit, y : Integer}}.
 *
 * <p>Fields are kept in name order, so that two records with the same
 * fields have the same canonical form. */
public class RecordType implements Type {
  public final ImmutableSortedMap<String, Type> argNameTypes;

  public RecordType(Map<String, ? extends Type> argNameTypes) {
    this.argNameTypes = ImmutableSortedMap.copyOf(argNameTypes);
  }

  @Override
  public int hashCode() {
    return argNameTypes.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof RecordType
            && argNameTypes.equals(((RecordType) obj).argNameTypes);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("{");
    argNameTypes.forEach((name, type) ->
        b.append(b.length() > 1 ? Op.RECORD_TYPE.padded : "")
            .append(name).append(" : ").append(type));
    return b.append("}").toString();
  }

  @Override
  public Op op() {
    return Op.RECORD_TYPE;
  }
}

// End RecordType.java
