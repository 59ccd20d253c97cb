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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.function.BinaryOperator;
import net.hydromatic.sloth.ast.Op;

/** Application of a type-level numeric function, such as
 * {@code front + back}. */
public class TypeFun implements Type {
  public final Fun fun;
  public final ImmutableList<Type> args;

  public TypeFun(Fun fun, List<? extends Type> args) {
    this.fun = requireNonNull(fun);
    this.args = ImmutableList.copyOf(args);
    checkArgument(this.args.size() == 2, "binary function %s", fun);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fun, args);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof TypeFun
            && fun == ((TypeFun) obj).fun
            && args.equals(((TypeFun) obj).args);
  }

  @Override
  public String toString() {
    return fun.infix
        ? "(" + args.get(0) + " " + fun.symbol + " " + args.get(1) + ")"
        : fun.symbol + " " + args.get(0) + " " + args.get(1);
  }

  @Override
  public Op op() {
    return Op.TYPE_FUN;
  }

  /** Built-in numeric type functions. */
  public enum Fun {
    ADD("+", true, Nat::plus),
    SUB("-", true, Nat::minus),
    MUL("*", true, Nat::times),
    MIN("min", false, Nat::min),
    MAX("max", false, Nat::max);

    public final String symbol;
    final boolean infix;
    private final BinaryOperator<Nat> operator;

    Fun(String symbol, boolean infix, BinaryOperator<Nat> operator) {
      this.symbol = symbol;
      this.infix = infix;
      this.operator = operator;
    }

    /** Applies this function to two evaluated arguments. */
    public Nat apply(Nat n0, Nat n1) {
      return operator.apply(n0, n1);
    }
  }
}

// End TypeFun.java
