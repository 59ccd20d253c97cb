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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.sloth.util.SlothException;

/**
 * Internal-consistency failure of the evaluator.
 *
 * <p>A panic means that an invariant the type checker should have
 * established does not hold: an unresolved variable, a selector that does
 * not match the shape of its value, applying something that is not a
 * function. Panics abort evaluation; they are never reported as errors in
 * the user's program.
 *
 * @see EvalException
 */
public class EvalPanic extends RuntimeException implements SlothException {
  /** Where the panic was raised, e.g. "Evaluator.evalExpr". */
  public final String location;
  /** Diagnostic lines; the first is the summary. */
  public final ImmutableList<String> details;

  /** Creates an EvalPanic. */
  public EvalPanic(String location, String... details) {
    this(location, ImmutableList.copyOf(details));
  }

  /** Creates an EvalPanic. */
  public EvalPanic(String location, List<String> details) {
    super(message(location, details));
    this.location = requireNonNull(location);
    this.details = ImmutableList.copyOf(details);
  }

  private static String message(String location, List<String> details) {
    final StringBuilder b = new StringBuilder("[").append(location).append("]");
    details.forEach(detail -> b.append("\n  ").append(detail));
    return b.toString();
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("internal error: ").append(getMessage());
  }
}

// End EvalPanic.java
