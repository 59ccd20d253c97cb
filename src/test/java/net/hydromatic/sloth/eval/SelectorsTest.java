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

import static net.hydromatic.sloth.Fixture.at;
import static net.hydromatic.sloth.Fixture.bits;
import static net.hydromatic.sloth.Fixture.concrete;
import static net.hydromatic.sloth.Fixture.field;
import static net.hydromatic.sloth.Fixture.ints;
import static net.hydromatic.sloth.Fixture.num;
import static net.hydromatic.sloth.Fixture.undefined;
import static net.hydromatic.sloth.Matchers.isPanic;
import static net.hydromatic.sloth.ast.CoreBuilder.core;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import net.hydromatic.sloth.Fixture;
import net.hydromatic.sloth.ast.Core;
import net.hydromatic.sloth.type.PrimitiveType;
import net.hydromatic.sloth.type.TValue;
import net.hydromatic.sloth.type.Type;
import org.junit.jupiter.api.Test;

/** Tests for {@link Selectors}. */
public class SelectorsTest {
  private static final Type INTEGER = PrimitiveType.INTEGER;
  private static final Type BIT = PrimitiveType.BIT;
  private static final Type XY =
      core.recordType(ImmutableMap.of("x", INTEGER, "y", INTEGER));

  private static Core.Exp xy(Core.Exp x, Core.Exp y) {
    return core.record(ImmutableMap.of("x", x, "y", y));
  }

  @Test void testSelectReturnsSuspensionUnchanged() {
    final Thunk a = Thunk.of(Value.integer(BigInteger.ONE));
    final Thunk b = () -> {
      throw new AssertionError("must not be forced");
    };
    final Selectors selectors = concrete().evaluator().selectors();
    assertThat(
        selectors.evalSel(Value.tuple(ImmutableList.of(a, b)),
            core.tupleSel(0, 2)),
        sameInstance(a));
    assertThat(
        selectors.evalSel(Value.record(ImmutableMap.of("p", a, "q", b)),
            core.recordSel("p")),
        sameInstance(a));
  }

  @Test void testUpdateTuple() {
    final Core.Exp exp =
        core.set(core.tupleType(INTEGER, INTEGER), core.tuple(num(1), num(2)),
            core.tupleSel(1, 2), num(5));
    concrete().assertEval(exp, "(1, 5)");
  }

  @Test void testUpdateRecord() {
    final Core.Exp exp =
        core.set(XY, xy(num(1), num(2)), core.recordSel("x"), num(7));
    concrete()
        .assertEval(exp, "{x = 7, y = 2}")
        .assertEval(field(exp, "x"), "7")
        .assertEval(field(exp, "y"), "2");
  }

  /** Selecting the updated component does not force the container. */
  @Test void testUpdateDoesNotForceContainer() {
    final Core.Exp exp =
        core.set(XY, undefined(XY), core.recordSel("x"), num(7));
    concrete()
        .assertEval(field(exp, "x"), "7")
        .assertEvalError(field(exp, "y"), EvalException.Kind.USER_ERROR);
    final Type seqType = core.seqType(3, INTEGER);
    final Core.Exp exp2 =
        core.set(seqType, undefined(seqType), core.listSel(0, 3), num(4));
    concrete()
        .assertEval(at(exp2, 0), "4")
        .assertEvalError(at(exp2, 1), EvalException.Kind.USER_ERROR);
  }

  @Test void testUpdateList() {
    final Core.Exp exp =
        core.set(core.seqType(3, INTEGER), ints(1, 2, 3), core.listSel(1, 3),
            num(9));
    concrete().assertEval(exp, "[1, 9, 3]");
  }

  /** Updating a packed word gives the same bits as updating a sequence. */
  @Test void testUpdateWord() {
    final Core.Exp exp =
        core.set(core.seqType(3, BIT), bits(true, false, true),
            core.listSel(0, 3), Fixture.bit(false));
    concrete().assertEval(exp, "[False, False, True]");
    concrete().withProp(Prop.PACK_BIT_LITERALS, false)
        .assertEval(exp, "[False, False, True]");
  }

  /** Selecting a component after updating it gives the new value; the
   * other components are unchanged. */
  @Test void testSelectAfterUpdate() {
    final Core.Exp list = ints(4, 5, 6, 7);
    final Fixture f = concrete();
    for (int i = 0; i < 4; i++) {
      final Core.Exp updated =
          core.set(core.seqType(4, INTEGER), list, core.listSel(i, 4),
              num(100));
      for (int j = 0; j < 4; j++) {
        f.assertEval(at(updated, j), j == i ? "100" : Integer.toString(4 + j));
      }
    }
  }

  @Test void testUpdateMissingFieldPanics() {
    final Core.Exp exp =
        core.set(XY, xy(num(1), num(2)), core.recordSel("z"), num(7));
    final EvalPanic e =
        assertThrows(EvalPanic.class, () -> concrete().eval(exp));
    assertThat(e.details.get(0), is("missing field!"));
  }

  @Test void testSelectMissingFieldPanics() {
    final EvalPanic e =
        assertThrows(EvalPanic.class,
            () -> concrete().eval(field(xy(num(1), num(2)), "z")));
    assertThat(e, isPanic("missing field!"));
  }

  @Test void testListIndexOutOfRangePanics() {
    final EvalPanic e =
        assertThrows(EvalPanic.class,
            () -> concrete().eval(at(ints(1, 2), 2)));
    assertThat(e.details.get(0), is("list index out of range"));
  }

  @Test void testSelectorTypeMismatchPanics() {
    final Selectors selectors = concrete().evaluator().selectors();
    final EvalPanic e =
        assertThrows(EvalPanic.class,
            () -> selectors.evalSetSel(TValue.INTEGER,
                Thunk.of(Value.integer(BigInteger.ONE)), core.tupleSel(0, 2),
                Thunk.of(Value.integer(BigInteger.ONE))));
    assertThat(e.details.get(0), is("selector does not match type"));
  }
}

// End SelectorsTest.java
