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

/**
 * Mapping from index to suspended element; the representation of a
 * sequence.
 *
 * <p>A sequence map does not know its own length; the length is carried
 * by the {@link Value.Seq} (or the type) that owns it. Looking up an index
 * never forces the element.
 *
 * @see SeqMaps
 */
@FunctionalInterface
public interface SeqMap {
  /** Returns the suspended element at a given index. */
  Thunk lookup(long i);
}

// End SeqMap.java
