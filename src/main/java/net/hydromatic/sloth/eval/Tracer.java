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

import net.hydromatic.sloth.ast.Core;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events during evaluation.
 *
 * @see Tracers */
public interface Tracer {
  /** Called when a declaration group has been bound into an
   * environment. */
  void onDeclGroup(Core.DeclGroup group);

  /** Called when the hole for a recursive declaration has been filled. */
  void onHoleFilled(Core.Decl decl);

  /** Called on the result of a top-level evaluation. */
  void onResult(Value value);

  /**
   * Called with the exception thrown during evaluation, or null if no
   * exception was thrown. Returns whether a handler was found.
   */
  boolean onException(@Nullable Throwable e);
}

// End Tracer.java
