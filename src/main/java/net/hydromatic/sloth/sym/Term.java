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
package net.hydromatic.sloth.sym;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Symbolic term; the representation of bits and integers in a
 * {@link SymbolicBackend}.
 *
 * <p>The factory methods simplify as they build: operations on literals are
 * folded, and a conditional whose condition is a literal, or whose branches
 * are equal, collapses to one branch. Terms are immutable and compared
 * structurally.
 */
public final class Term {
  public static final Term TRUE = new Term(Op.LITERAL, Sort.BIT, true,
      ImmutableList.of());
  public static final Term FALSE = new Term(Op.LITERAL, Sort.BIT, false,
      ImmutableList.of());

  public final Op op;
  public final Sort sort;
  /** For a literal, its {@link Boolean} or {@link BigInteger} value; for a
   * variable, its name; otherwise null. */
  public final @Nullable Object value;
  public final ImmutableList<Term> args;

  private Term(Op op, Sort sort, @Nullable Object value,
      ImmutableList<Term> args) {
    this.op = requireNonNull(op);
    this.sort = requireNonNull(sort);
    this.value = value;
    this.args = requireNonNull(args);
  }

  private static Term call(Op op, Sort sort, Term... args) {
    return new Term(op, sort, null, ImmutableList.copyOf(args));
  }

  /** Creates a bit literal. */
  public static Term bit(boolean b) {
    return b ? TRUE : FALSE;
  }

  /** Creates an integer literal. */
  public static Term integer(BigInteger value) {
    return new Term(Op.LITERAL, Sort.INTEGER, requireNonNull(value),
        ImmutableList.of());
  }

  /** Creates a free variable. */
  public static Term var(String name, Sort sort) {
    return new Term(Op.VAR, sort, requireNonNull(name), ImmutableList.of());
  }

  /** Returns the value of a bit literal, or null. */
  public @Nullable Boolean asBoolean() {
    return op == Op.LITERAL && sort == Sort.BIT ? (Boolean) value : null;
  }

  /** Returns the value of an integer literal, or null. */
  public @Nullable BigInteger asInteger() {
    return op == Op.LITERAL && sort == Sort.INTEGER
        ? (BigInteger) value : null;
  }

  public static Term not(Term t) {
    checkBit(t);
    final Boolean b = t.asBoolean();
    if (b != null) {
      return bit(!b);
    }
    if (t.op == Op.NOT) {
      return t.args.get(0);
    }
    return call(Op.NOT, Sort.BIT, t);
  }

  public static Term and(Term t0, Term t1) {
    checkBit(t0);
    checkBit(t1);
    if (t0 == FALSE || t1 == FALSE) {
      return FALSE;
    }
    if (t0 == TRUE) {
      return t1;
    }
    if (t1 == TRUE || t0.equals(t1)) {
      return t0;
    }
    return call(Op.AND, Sort.BIT, t0, t1);
  }

  public static Term or(Term t0, Term t1) {
    checkBit(t0);
    checkBit(t1);
    if (t0 == TRUE || t1 == TRUE) {
      return TRUE;
    }
    if (t0 == FALSE) {
      return t1;
    }
    if (t1 == FALSE || t0.equals(t1)) {
      return t0;
    }
    return call(Op.OR, Sort.BIT, t0, t1);
  }

  public static Term xor(Term t0, Term t1) {
    checkBit(t0);
    checkBit(t1);
    if (t0 == FALSE) {
      return t1;
    }
    if (t1 == FALSE) {
      return t0;
    }
    if (t0 == TRUE) {
      return not(t1);
    }
    if (t1 == TRUE) {
      return not(t0);
    }
    return call(Op.XOR, Sort.BIT, t0, t1);
  }

  /** Equality of two bits or two integers. */
  public static Term eq(Term t0, Term t1) {
    checkArgument(t0.sort == t1.sort, "sort mismatch: %s, %s", t0, t1);
    if (t0.equals(t1)) {
      return TRUE;
    }
    if (t0.op == Op.LITERAL && t1.op == Op.LITERAL) {
      return FALSE;
    }
    return call(Op.EQ, Sort.BIT, t0, t1);
  }

  /** If-then-else. */
  public static Term ite(Term c, Term t, Term f) {
    checkBit(c);
    checkArgument(t.sort == f.sort, "sort mismatch: %s, %s", t, f);
    final Boolean b = c.asBoolean();
    if (b != null) {
      return b ? t : f;
    }
    if (t.equals(f)) {
      return t;
    }
    if (t.sort == Sort.BIT && t == TRUE && f == FALSE) {
      return c;
    }
    return call(Op.ITE, t.sort, c, t, f);
  }

  public static Term plus(Term t0, Term t1) {
    final BigInteger i0 = t0.asInteger();
    final BigInteger i1 = t1.asInteger();
    if (i0 != null && i1 != null) {
      return integer(i0.add(i1));
    }
    if (BigInteger.ZERO.equals(i0)) {
      return t1;
    }
    if (BigInteger.ZERO.equals(i1)) {
      return t0;
    }
    return call(Op.PLUS, Sort.INTEGER, checkInteger(t0), checkInteger(t1));
  }

  public static Term minus(Term t0, Term t1) {
    final BigInteger i0 = t0.asInteger();
    final BigInteger i1 = t1.asInteger();
    if (i0 != null && i1 != null) {
      return integer(i0.subtract(i1));
    }
    if (BigInteger.ZERO.equals(i1)) {
      return t0;
    }
    return call(Op.MINUS, Sort.INTEGER, checkInteger(t0), checkInteger(t1));
  }

  public static Term mult(Term t0, Term t1) {
    final BigInteger i0 = t0.asInteger();
    final BigInteger i1 = t1.asInteger();
    if (i0 != null && i1 != null) {
      return integer(i0.multiply(i1));
    }
    if (BigInteger.ONE.equals(i0)) {
      return t1;
    }
    if (BigInteger.ONE.equals(i1)) {
      return t0;
    }
    return call(Op.MULT, Sort.INTEGER, checkInteger(t0), checkInteger(t1));
  }

  /** Division. The caller must ensure the divisor is not the literal
   * zero. Two literals are divided rounding towards negative infinity. */
  public static Term div(Term t0, Term t1) {
    final BigInteger i0 = t0.asInteger();
    final BigInteger i1 = t1.asInteger();
    checkArgument(!BigInteger.ZERO.equals(i1), "division by zero");
    if (i0 != null && i1 != null) {
      final BigInteger[] qr = i0.divideAndRemainder(i1);
      return integer(qr[1].signum() != 0 && qr[1].signum() != i1.signum()
          ? qr[0].subtract(BigInteger.ONE)
          : qr[0]);
    }
    if (BigInteger.ONE.equals(i1)) {
      return t0;
    }
    return call(Op.DIV, Sort.INTEGER, checkInteger(t0), checkInteger(t1));
  }

  private static void checkBit(Term t) {
    checkArgument(t.sort == Sort.BIT, "expected bit: %s", t);
  }

  private static Term checkInteger(Term t) {
    checkArgument(t.sort == Sort.INTEGER, "expected integer: %s", t);
    return t;
  }

  @Override
  public int hashCode() {
    return Objects.hash(op, sort, value, args);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Term
            && op == ((Term) obj).op
            && sort == ((Term) obj).sort
            && Objects.equals(value, ((Term) obj).value)
            && args.equals(((Term) obj).args);
  }

  @Override
  public String toString() {
    switch (op) {
      case LITERAL:
      case VAR:
        return String.valueOf(value);
      default:
        final StringBuilder b = new StringBuilder("(")
            .append(op.name().toLowerCase(Locale.ROOT));
        args.forEach(arg -> b.append(' ').append(arg));
        return b.append(')').toString();
    }
  }

  /** Sort of a term. */
  public enum Sort {
    BIT, INTEGER
  }

  /** Operator of a term. */
  public enum Op {
    LITERAL, VAR, NOT, AND, OR, XOR, EQ, ITE, PLUS, MINUS, MULT, DIV
  }
}

// End Term.java
