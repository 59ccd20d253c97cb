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
import static net.hydromatic.sloth.Fixture.bit;
import static net.hydromatic.sloth.Fixture.bits;
import static net.hydromatic.sloth.Fixture.concrete;
import static net.hydromatic.sloth.Fixture.divide;
import static net.hydromatic.sloth.Fixture.eq;
import static net.hydromatic.sloth.Fixture.field;
import static net.hydromatic.sloth.Fixture.infFrom;
import static net.hydromatic.sloth.Fixture.ints;
import static net.hydromatic.sloth.Fixture.minus;
import static net.hydromatic.sloth.Fixture.num;
import static net.hydromatic.sloth.Fixture.plus;
import static net.hydromatic.sloth.Fixture.times;
import static net.hydromatic.sloth.Fixture.undefined;
import static net.hydromatic.sloth.Fixture.v;
import static net.hydromatic.sloth.Fixture.word;
import static net.hydromatic.sloth.Matchers.hasTag;
import static net.hydromatic.sloth.Matchers.isEvalError;
import static net.hydromatic.sloth.Matchers.isPanic;
import static net.hydromatic.sloth.ast.CoreBuilder.core;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.sloth.Fixture;
import net.hydromatic.sloth.ast.Core;
import net.hydromatic.sloth.ast.PrimIdent;
import net.hydromatic.sloth.type.Kind;
import net.hydromatic.sloth.type.NumType;
import net.hydromatic.sloth.type.PrimitiveType;
import net.hydromatic.sloth.type.Schema;
import net.hydromatic.sloth.type.Type;
import net.hydromatic.sloth.type.TypeVar;
import org.junit.jupiter.api.Test;

/** Tests for {@link Evaluator}. */
public class EvaluatorTest {
  private static final Type INTEGER = PrimitiveType.INTEGER;
  private static final Type BIT = PrimitiveType.BIT;

  /** {@code fact = \n -> if n == 0 then 1 else n * fact (n - 1)}. */
  private static final Core.Recursive FACT =
      core.rec(
          core.decl("fact", core.fnType(INTEGER, INTEGER),
              core.fn("n", INTEGER,
                  core.ifThenElse(INTEGER, eq(INTEGER, v("n"), num(0)),
                      num(1),
                      times(v("n"),
                          core.apply(v("fact"), minus(v("n"), num(1))))))));

  @Test void testLiterals() {
    concrete()
        .assertEval(num(42), "42")
        .assertEval(bit(true), "True")
        .assertEval(ints(1, 2, 3), "[1, 2, 3]")
        .assertEval(core.tuple(num(1), bit(false)), "(1, False)")
        .assertEval(
            core.record(ImmutableMap.of("y", num(2), "x", num(1))),
            "{x = 1, y = 2}")
        .assertEval(word(5, 4), "5");
  }

  @Test void testArithmetic() {
    concrete()
        .assertEval(plus(num(2), times(num(3), num(4))), "14")
        .assertEval(divide(num(7), num(2)), "3")
        .assertEval(divide(core.apply(v("negate"), num(7)), num(2)), "-4")
        .assertEval(core.apply(v("negate"), num(5)), "-5")
        .assertEval(eq(INTEGER, num(3), plus(num(1), num(2))), "True")
        .assertEval(eq(core.seqType(2, INTEGER), ints(1, 2), ints(1, 3)),
            "False");
  }

  /** Packing a list of bits into a word does not change which bits you
   * see. */
  @Test void testBitLiteralPacking() {
    final Fixture packed = concrete();
    final Fixture unpacked = concrete().withProp(Prop.PACK_BIT_LITERALS, false);
    final Core.Exp exp = bits(true, false, true);
    assertThat(packed.eval(exp), hasTag(Value.Tag.WORD));
    assertThat(unpacked.eval(exp), hasTag(Value.Tag.SEQ));
    packed.assertEval(exp, "5");
    unpacked.assertEval(exp, "[True, False, True]");
    for (int i = 0; i < 3; i++) {
      final String expected = i == 1 ? "False" : "True";
      packed.assertEval(at(exp, i), expected);
      unpacked.assertEval(at(exp, i), expected);
    }
  }

  /** A bit list with an element that has not been evaluated is not packed,
   * so its other elements can be used. */
  @Test void testBitLiteralWithUnevaluatedElement() {
    final Core.Exp exp = core.list(BIT, bit(true), undefined(BIT));
    final Fixture packed = concrete();
    assertThat(packed.eval(exp), hasTag(Value.Tag.SEQ));
    packed.assertEval(at(exp, 0), "True")
        .assertEvalError(at(exp, 1), EvalException.Kind.USER_ERROR);
    concrete().withProp(Prop.PACK_BIT_LITERALS, false)
        .assertEval(at(exp, 0), "True");
    Fixture.symbolic()
        .assertEval(at(exp, 0), "true")
        .assertEvalError(at(exp, 1), EvalException.Kind.USER_ERROR);
  }

  /** {@code bs = [True, bs@0]}; the recursive use is guarded by the
   * list. */
  @Test void testRecursiveBitList() {
    final Core.Recursive bs =
        core.rec(
            core.decl("bs", core.seqType(2, BIT),
                core.list(BIT, bit(true), at(v("bs"), 0))));
    concrete().withDecl(bs)
        .assertEval(at(v("bs"), 1), "True")
        .assertEval(v("bs"), "[True, True]");
    Fixture.symbolic().withDecl(bs)
        .assertEval(at(v("bs"), 1), "true");
  }

  /** Deep forcing raises an error buried in a component, and leaves
   * streams alone. */
  @Test void testForceValue() {
    final Fixture f = concrete();
    final Backend backend = f.backend();
    final Value stream = f.eval(infFrom(num(1)));
    assertThat(Values.forceValue(backend, stream), sameInstance(stream));

    final Value list = f.eval(ints(1, 2, 3));
    assertThat(Values.forceValue(backend, list), sameInstance(list));

    final Value pair =
        f.eval(core.tuple(num(1), core.tuple(bit(true), undefined(INTEGER))));
    final EvalException e =
        assertThrows(EvalException.class,
            () -> Values.forceValue(backend, pair));
    assertThat(e.kind, is(EvalException.Kind.USER_ERROR));

    final Value record =
        f.eval(
            core.record(
                ImmutableMap.of("a", num(1), "b", divide(num(1), num(0)))));
    final EvalException e2 =
        assertThrows(EvalException.class,
            () -> Values.forceValue(backend, record));
    assertThat(e2.kind, is(EvalException.Kind.DIVIDE_BY_ZERO));
  }

  @Test void testIfIsLazyInItsBranches() {
    concrete()
        .assertEval(core.ifThenElse(INTEGER, bit(true), num(1),
            undefined(INTEGER)), "1")
        .assertEval(core.ifThenElse(INTEGER, bit(false),
            divide(num(1), num(0)), num(2)), "2")
        .assertEvalError(core.ifThenElse(INTEGER, undefined(BIT), num(1),
            num(2)), EvalException.Kind.USER_ERROR);
  }

  @Test void testComponentsAreNotForced() {
    final Core.Exp pair = core.tuple(num(1), divide(num(1), num(0)));
    concrete()
        .assertEval(field(pair, 0, 2), "1")
        .assertEvalError(field(pair, 1, 2), EvalException.Kind.DIVIDE_BY_ZERO)
        .assertEval(
            at(core.list(INTEGER, undefined(INTEGER), num(7)), 1), "7");
  }

  @Test void testFunctions() {
    final Core.Exp inc = core.fn("x", INTEGER, plus(v("x"), num(1)));
    final Core.Exp k = core.fn("x", INTEGER, num(7));
    concrete()
        .assertEval(core.apply(inc, num(41)), "42")
        // argument is passed unevaluated, and never needed
        .assertEval(core.apply(k, divide(num(1), num(0))), "7")
        .assertEval(core.fn("x", INTEGER, v("x")), "<fun>");
  }

  @Test void testTypeAbstraction() {
    final TypeVar a = TypeVar.type("a");
    final TypeVar n = TypeVar.num("n");
    final Core.Exp id = core.tAbs(a, core.fn("x", a, v("x")));
    final Core.Exp lit =
        core.tAbs(n, core.tApp(v("number"), n, INTEGER));
    concrete()
        .assertEval(core.apply(core.tApp(id, INTEGER), num(5)), "5")
        .assertEval(core.tApp(lit, NumType.of(0)), "0")
        .assertEval(core.tApp(lit, NumType.of(7)), "7");
  }

  @Test void testTypeAbstractionOverConstraintPanics() {
    final Core.Exp exp =
        core.tAbs(new TypeVar("p", Kind.PROP), num(1));
    final EvalPanic e =
        assertThrows(EvalPanic.class, () -> concrete().eval(exp));
    assertThat(e, isPanic("kind: PROP"));
  }

  @Test void testProofAbstractionIsErased() {
    concrete()
        .assertEval(
            core.proofApp(core.proofAbs(TypeVar.type("c"), num(3))), "3");
  }

  @Test void testWhere() {
    final Core.Exp exp =
        core.where(plus(v("x"), v("y")),
            core.nonRec(core.decl("x", INTEGER, num(1))),
            core.nonRec(core.decl("y", INTEGER, plus(v("x"), num(1)))));
    concrete().assertEval(exp, "3");
  }

  @Test void testRecursion() {
    concrete().withDecl(FACT)
        .assertEval(core.apply(v("fact"), num(5)), "120")
        .assertEval(core.apply(v("fact"), num(0)), "1");
  }

  /** A recursive name behaves the same as its definition. */
  @Test void testRecursionEtaEquivalence() {
    final Core.Recursive g =
        core.rec(
            core.decl("g", core.fnType(INTEGER, INTEGER),
                core.fn("m", INTEGER, core.apply(v("fact"), v("m")))));
    final Fixture f = concrete().withDecl(FACT, g);
    for (int i = 0; i < 6; i++) {
      assertThat(f.describe(f.eval(core.apply(v("g"), num(i)))),
          is(f.describe(f.eval(core.apply(v("fact"), num(i))))));
    }
  }

  @Test void testMutualRecursion() {
    // even = \n -> if n == 0 then True else odd (n - 1)
    // odd = \n -> if n == 0 then False else even (n - 1)
    final Core.Recursive group =
        core.rec(
            core.decl("even", core.fnType(INTEGER, BIT),
                core.fn("n", INTEGER,
                    core.ifThenElse(BIT, eq(INTEGER, v("n"), num(0)),
                        bit(true),
                        core.apply(v("odd"), minus(v("n"), num(1)))))),
            core.decl("odd", core.fnType(INTEGER, BIT),
                core.fn("n", INTEGER,
                    core.ifThenElse(BIT, eq(INTEGER, v("n"), num(0)),
                        bit(false),
                        core.apply(v("even"), minus(v("n"), num(1)))))));
    final List<String> filled = new ArrayList<>();
    concrete()
        .withTracer(
            Tracers.withOnHoleFilled(Tracers.empty(),
                decl -> filled.add(decl.name)))
        .withDecl(group)
        .assertEval(core.apply(v("even"), num(10)), "True")
        .assertEval(core.apply(v("odd"), num(7)), "True");
    assertThat(filled.subList(0, 2), is(ImmutableList.of("even", "odd")));
  }

  /** {@code ones = [1] # ones} is a well-defined stream. */
  @Test void testRecursiveStream() {
    final Core.Recursive ones =
        core.rec(
            core.decl("ones", core.streamType(INTEGER),
                Fixture.append(NumType.of(1), NumType.INF, INTEGER,
                    ints(1), v("ones"))));
    concrete().withProp(Prop.PRINT_LENGTH, 4).withDecl(ones)
        .assertEval(v("ones"), "[1, 1, 1, 1, ...]")
        .assertEval(at(v("ones"), 100), "1");
  }

  /** {@code x = x} is a loop; the same error is raised every time. */
  @Test void testLoop() {
    final Fixture f =
        concrete().withDecl(core.rec(core.decl("x", INTEGER, v("x"))));
    final Evaluator evaluator = f.evaluator();
    final EvalEnv env = f.env();
    final EvalException e =
        assertThrows(EvalException.class,
            () -> evaluator.evalExpr(env, v("x")));
    assertThat(e, isEvalError(EvalException.Kind.LOOP, "x"));
    final EvalException e2 =
        assertThrows(EvalException.class,
            () -> evaluator.evalExpr(env, v("x")));
    assertThat(e2, sameInstance(e));
  }

  @Test void testLoopThroughArithmetic() {
    concrete()
        .withDecl(
            core.rec(core.decl("y", INTEGER, plus(v("y"), num(1)))))
        .assertEvalError(v("y"), EvalException.Kind.LOOP);
  }

  @Test void testDivideByZeroIsCached() {
    final Fixture f =
        concrete().withDecl(
            core.nonRec(core.decl("d", INTEGER, divide(num(1), num(0)))));
    final Evaluator evaluator = f.evaluator();
    final EvalEnv env = f.env();
    final EvalException e =
        assertThrows(EvalException.class,
            () -> evaluator.evalExpr(env, v("d")));
    assertThat(e.kind, is(EvalException.Kind.DIVIDE_BY_ZERO));
    final EvalException e2 =
        assertThrows(EvalException.class,
            () -> evaluator.evalExpr(env, plus(v("d"), num(1))));
    assertThat(e2, sameInstance(e));
  }

  @Test void testUndefinedIsPlaceholder() {
    final Fixture f = concrete();
    assertThat(f.eval(undefined(INTEGER)), hasTag(Value.Tag.ERROR));
    f.assertEvalError(plus(undefined(INTEGER), num(1)),
        EvalException.Kind.USER_ERROR);
    f.assertEval(field(core.tuple(undefined(INTEGER), num(2)), 1, 2), "2");
  }

  @Test void testMissingPrimitive() {
    final Core.NonRecursive foo =
        core.nonRec(
            core.primDecl("foo", Schema.mono(INTEGER),
                PrimIdent.prelude("foo")));
    // Declaring an unknown primitive is fine; using it is not.
    concrete().withDecl(foo)
        .assertEval(num(1), "1")
        .assertEvalError(v("foo"), EvalException.Kind.NO_PRIM);
  }

  @Test void testUnboundVariablePanics() {
    final EvalPanic e =
        assertThrows(EvalPanic.class, () -> concrete().eval(v("zz")));
    assertThat(e.details.get(0), is("var `zz` is not defined"));
    assertThat(e, isPanic("True"));
  }

  @Test void testApplyNonFunctionPanics() {
    final EvalPanic e =
        assertThrows(EvalPanic.class,
            () -> concrete().eval(core.apply(num(1), num(2))));
    assertThat(e.details.get(0), is("expected a function"));
  }

  @Test void testPrimitiveInRecursiveGroupPanics() {
    final Core.Recursive group =
        core.rec(
            core.primDecl("p", Schema.mono(INTEGER), PrimIdent.prelude("+")));
    final EvalPanic e =
        assertThrows(EvalPanic.class,
            () -> concrete().withDecl(group).env());
    assertThat(e.details.get(0),
        is("Unexpected primitive declaration in recursive group"));
  }

  @Test void testNewtype() {
    final TypeVar a = TypeVar.type("a");
    final Core.Newtype pair =
        core.newtype("Pair", ImmutableList.of(a),
            core.recordType(ImmutableMap.of("fst", a, "snd", a)));
    final Core.Exp mk =
        core.apply(core.tApp(v("Pair"), INTEGER),
            core.record(ImmutableMap.of("fst", num(1), "snd", num(2))));
    final Core.Module module =
        core.module("M", ImmutableList.of(pair),
            ImmutableList.of(core.nonRec(core.decl("p", INTEGER, mk))));
    final Fixture f = concrete();
    final Evaluator evaluator = f.evaluator();
    final EvalEnv env = evaluator.moduleEnv(module, f.env());
    final Value value = evaluator.evalExpr(env, field(v("p"), "snd"));
    assertThat(f.describe(value), is("2"));
  }

  @Test void testTracer() {
    final List<String> groups = new ArrayList<>();
    final List<Value> results = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnResult(
            Tracers.withOnDeclGroup(Tracers.empty(),
                g -> groups.add(g.decls().get(0).name)),
            results::add);
    final Fixture f =
        concrete().withTracer(tracer)
            .withDecl(core.nonRec(core.decl("x", INTEGER, num(1))));
    f.assertEval(v("x"), "1");
    assertThat(groups.get(groups.size() - 1), is("x"));
    assertThat(results, hasSize(1));
  }

  /** If the tracer handles an error, evaluation returns a placeholder. */
  @Test void testTracerHandlesException() {
    final List<Throwable> errors = new ArrayList<>();
    final Fixture f =
        concrete().withTracer(
            Tracers.withOnException(Tracers.empty(), errors::add));
    final Value value = f.eval(divide(num(1), num(0)));
    assertThat(value, hasTag(Value.Tag.ERROR));
    assertThat(errors, hasSize(1));
  }
}

// End EvaluatorTest.java
