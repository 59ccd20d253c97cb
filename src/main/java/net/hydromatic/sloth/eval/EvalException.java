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

import net.hydromatic.sloth.util.SlothException;

/**
 * Error in the program being evaluated, discovered at evaluation time.
 *
 * <p>Examples are division by zero, a call to {@code undefined}, a
 * primitive that has no implementation, and a value that depends on itself
 * without an intervening constructor ({@code x = x}).
 *
 * <p>An EvalException travels through the suspension mechanism: a
 * {@link Promise} whose computation throws one rethrows the same instance
 * every time it is forced.
 *
 * @see EvalPanic
 */
public class EvalException extends RuntimeException
    implements SlothException {
  public final Kind kind;

  /** Creates an EvalException. */
  public EvalException(Kind kind, String detail) {
    super(detail);
    this.kind = requireNonNull(kind);
  }

  @Override
  public String toString() {
    return kind.description + ": " + getMessage();
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Run-time error: ")
        .append(kind.description)
        .append(" (")
        .append(getMessage())
        .append(")");
  }

  /** Kinds of evaluation error. */
  public enum Kind {
    LOOP("<<loop>>"),
    DIVIDE_BY_ZERO("division by 0"),
    NO_PRIM("unimplemented primitive"),
    USER_ERROR("error"),
    INVALID_INDEX("invalid sequence index"),
    UNSUPPORTED("unsupported operation");

    public final String description;

    Kind(String description) {
      this.description = description;
    }
  }
}

// End EvalException.java
