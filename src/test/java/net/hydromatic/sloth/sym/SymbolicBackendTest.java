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

import static net.hydromatic.sloth.Fixture.at;
import static net.hydromatic.sloth.Fixture.bit;
import static net.hydromatic.sloth.Fixture.divide;
import static net.hydromatic.sloth.Fixture.eq;
import static net.hydromatic.sloth.Fixture.field;
import static net.hydromatic.sloth.Fixture.ints;
import static net.hydromatic.sloth.Fixture.num;
import static net.hydromatic.sloth.Fixture.plus;
import static net.hydromatic.sloth.Fixture.times;
import static net.hydromatic.sloth.Fixture.undefined;
import static net.hydromatic.sloth.Fixture.v;
import static net.hydromatic.sloth.Fixture.word;
import static net.hydromatic.sloth.ast.CoreBuilder.core;
import static net.hydromatic.sloth.type.PrimitiveType.BIT;
import static net.hydromatic.sloth.type.PrimitiveType.INTEGER;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;

import java.math.BigInteger;
import net.hydromatic.sloth.Fixture;
import net.hydromatic.sloth.eval.EvalException;
import org.junit.jupiter.api.Test;

/** Tests for {@link SymbolicBackend} and {@link Term}. */
public class SymbolicBackendTest {
  private static final SymbolicBackend BACKEND = SymbolicBackend.INSTANCE;

  /** Returns a fixture with a free bit "b" and a free integer "x". */
  private static Fixture fixture() {
    return Fixture.symbolic()
        .withBinding("b", BACKEND.freshBit("b"))
        .withBinding("x", BACKEND.freshInteger("x"));
  }

  @Test void testIfOnFreeBitMerges() {
    fixture()
        .assertEval(core.ifThenElse(INTEGER, v("b"), num(1), num(2)),
            "(ite b 1 2)")
        .assertEval(core.ifThenElse(BIT, v("b"), bit(true), bit(false)), "b")
        .assertEval(core.ifThenElse(INTEGER, v("b"), num(3), num(3)), "3");
  }

  /** A condition that is a literal selects a branch, and the other branch
   * is never evaluated. */
  @Test void testIfOnLiteralCommits() {
    fixture()
        .assertEval(
            core.ifThenElse(INTEGER, bit(true), num(1), undefined(INTEGER)),
            "1")
        .assertEval(
            core.ifThenElse(INTEGER, eq(INTEGER, num(2), num(3)),
                undefined(INTEGER), num(4)),
            "4");
  }

  /** If either branch is an error, the merge is that error. */
  @Test void testMergeWithError() {
    fixture()
        .assertEvalError(
            core.ifThenElse(INTEGER, v("b"), num(1), undefined(INTEGER)),
            EvalException.Kind.USER_ERROR);
  }

  @Test void testMergeTuple() {
    final Fixture f = fixture();
    f.assertEval(
        core.ifThenElse(core.tupleType(INTEGER, BIT), v("b"),
            core.tuple(num(1), bit(true)),
            core.tuple(num(2), bit(true))),
        "((ite b 1 2), true)");
    f.assertEval(
        field(
            core.ifThenElse(core.tupleType(INTEGER, INTEGER), v("b"),
                core.tuple(num(1), num(5)),
                core.tuple(num(2), num(5))),
            1, 2),
        "5");
  }

  @Test void testMergeSeq() {
    fixture()
        .assertEval(
            core.ifThenElse(core.seqType(2, INTEGER), v("b"),
                ints(1, 2), ints(1, 3)),
            "[1, (ite b 2 3)]")
        .assertEval(
            at(
                core.ifThenElse(core.seqType(2, INTEGER), v("b"),
                    ints(1, 2), ints(1, 3)),
                0),
            "1");
  }

  @Test void testMergeWord() {
    fixture()
        .assertEval(word(5, 3), "[true, false, true]")
        .assertEval(
            core.ifThenElse(core.seqType(3, BIT), v("b"), word(5, 3),
                word(4, 3)),
            "[true, false, b]");
  }

  @Test void testMergeFunction() {
    fixture()
        .assertEval(
            core.apply(
                core.ifThenElse(core.fnType(INTEGER, INTEGER), v("b"),
                    core.fn("y", INTEGER, plus(v("y"), num(1))),
                    core.fn("y", INTEGER, v("y"))),
                num(5)),
            "(ite b 6 5)");
  }

  @Test void testArithmetic() {
    fixture()
        .assertEval(plus(v("x"), num(0)), "x")
        .assertEval(times(v("x"), num(2)), "(mult x 2)")
        .assertEval(times(num(3), num(4)), "12")
        .assertEval(divide(v("x"), num(1)), "x")
        .assertEval(eq(INTEGER, v("x"), v("x")), "true")
        .assertEval(eq(INTEGER, v("x"), num(1)), "(eq x 1)")
        .assertEvalError(divide(v("x"), num(0)),
            EvalException.Kind.DIVIDE_BY_ZERO);
  }

  @Test void testTermFolding() {
    final Term b = Term.var("b", Term.Sort.BIT);
    final Term c = Term.var("c", Term.Sort.BIT);
    assertThat(Term.and(Term.TRUE, b), sameInstance(b));
    assertThat(Term.and(b, Term.FALSE), sameInstance(Term.FALSE));
    assertThat(Term.or(b, b), sameInstance(b));
    assertThat(Term.not(Term.not(b)), sameInstance(b));
    assertThat(Term.xor(Term.TRUE, b).toString(), is("(not b)"));
    assertThat(Term.ite(b, Term.TRUE, Term.FALSE), sameInstance(b));
    assertThat(Term.ite(Term.FALSE, b, c), sameInstance(c));
    assertThat(Term.and(b, c).toString(), is("(and b c)"));
    assertThat(Term.eq(Term.TRUE, Term.FALSE), sameInstance(Term.FALSE));

    final Term seven = Term.integer(BigInteger.valueOf(-7));
    final Term two = Term.integer(BigInteger.valueOf(2));
    assertThat(Term.div(seven, two).asInteger(), is(BigInteger.valueOf(-4)));
    assertThat(Term.minus(seven, two).asInteger(),
        is(BigInteger.valueOf(-9)));
    assertThat(b.asBoolean() == null, is(true));
  }
}

// End SymbolicBackendTest.java
