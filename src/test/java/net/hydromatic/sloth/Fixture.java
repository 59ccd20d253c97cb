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
package net.hydromatic.sloth;

import static net.hydromatic.sloth.ast.CoreBuilder.core;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.sloth.ast.Core;
import net.hydromatic.sloth.ast.PrimIdent;
import net.hydromatic.sloth.eval.Backend;
import net.hydromatic.sloth.eval.ConcreteBackend;
import net.hydromatic.sloth.eval.EvalEnv;
import net.hydromatic.sloth.eval.EvalEnvs;
import net.hydromatic.sloth.eval.EvalException;
import net.hydromatic.sloth.eval.Evaluator;
import net.hydromatic.sloth.eval.Primitives;
import net.hydromatic.sloth.eval.Prop;
import net.hydromatic.sloth.eval.Thunk;
import net.hydromatic.sloth.eval.Tracer;
import net.hydromatic.sloth.eval.Tracers;
import net.hydromatic.sloth.eval.Value;
import net.hydromatic.sloth.eval.Values;
import net.hydromatic.sloth.sym.SymbolicBackend;
import net.hydromatic.sloth.type.NumType;
import net.hydromatic.sloth.type.PrimitiveType;
import net.hydromatic.sloth.type.Schema;
import net.hydromatic.sloth.type.Type;
import net.hydromatic.sloth.type.TypeVar;
import org.hamcrest.Matcher;

/**
 * Fluent test fixture: an evaluator configuration, a prelude of
 * primitives, and declarations, against which expressions are evaluated.
 *
 * <p>Each {@code with} method returns a new fixture.
 */
public class Fixture {
  private static final TypeVar A = TypeVar.type("a");
  private static final Type INTEGER = PrimitiveType.INTEGER;
  private static final Type BIT = PrimitiveType.BIT;

  private final Backend backend;
  private final ImmutableMap<Prop, Object> propMap;
  private final ImmutableMap<String, Value> extraPrimitives;
  private final ImmutableMap<String, Value> bindings;
  private final ImmutableList<Core.DeclGroup> declGroups;
  private final Tracer tracer;

  private Fixture(Backend backend, ImmutableMap<Prop, Object> propMap,
      ImmutableMap<String, Value> extraPrimitives,
      ImmutableMap<String, Value> bindings,
      ImmutableList<Core.DeclGroup> declGroups, Tracer tracer) {
    this.backend = backend;
    this.propMap = propMap;
    this.extraPrimitives = extraPrimitives;
    this.bindings = bindings;
    this.declGroups = declGroups;
    this.tracer = tracer;
  }

  /** Creates a fixture that uses the concrete backend. */
  public static Fixture concrete() {
    return new Fixture(ConcreteBackend.INSTANCE, ImmutableMap.of(),
        ImmutableMap.of(), ImmutableMap.of(), ImmutableList.of(),
        Tracers.empty());
  }

  /** Creates a fixture that uses the symbolic backend. */
  public static Fixture symbolic() {
    return concrete().withBackend(SymbolicBackend.INSTANCE);
  }

  public Backend backend() {
    return backend;
  }

  public Fixture withBackend(Backend backend) {
    return new Fixture(backend, propMap, extraPrimitives, bindings,
        declGroups, tracer);
  }

  public Fixture withProp(Prop prop, Object value) {
    final Map<Prop, Object> map = new HashMap<>(propMap);
    prop.set(map, value);
    return new Fixture(backend, ImmutableMap.copyOf(map), extraPrimitives,
        bindings, declGroups, tracer);
  }

  /** Adds a primitive to the prelude, under its own name. */
  public Fixture withPrimitive(String name, Value value) {
    final Map<String, Value> map = new LinkedHashMap<>(extraPrimitives);
    map.put(name, value);
    return new Fixture(backend, propMap, ImmutableMap.copyOf(map), bindings,
        declGroups, tracer);
  }

  /** Binds a name to a value, beneath the prelude. */
  public Fixture withBinding(String name, Value value) {
    final Map<String, Value> map = new LinkedHashMap<>(bindings);
    map.put(name, value);
    return new Fixture(backend, propMap, extraPrimitives,
        ImmutableMap.copyOf(map), declGroups, tracer);
  }

  /** Adds declaration groups, after the prelude. */
  public Fixture withDecl(Core.DeclGroup... groups) {
    return new Fixture(backend, propMap, extraPrimitives, bindings,
        ImmutableList.<Core.DeclGroup>builder().addAll(declGroups)
            .add(groups).build(),
        tracer);
  }

  public Fixture withTracer(Tracer tracer) {
    return new Fixture(backend, propMap, extraPrimitives, bindings,
        declGroups, tracer);
  }

  /** Creates an evaluator. */
  public Evaluator evaluator() {
    final Map<PrimIdent, Value> primitives =
        new HashMap<>(Primitives.table(backend));
    extraPrimitives.forEach((name, value) ->
        primitives.put(PrimIdent.prelude(name), value));
    final Evaluator.Builder builder =
        Evaluator.builder(backend)
            .withPrimitives(primitives)
            .withTracer(tracer);
    propMap.forEach(builder::withProp);
    return builder.build();
  }

  /** Returns the prelude: a declaration for each primitive. */
  public ImmutableList<Core.DeclGroup> prelude() {
    final ImmutableList.Builder<Core.DeclGroup> b = ImmutableList.builder();
    Primitives.table(backend).keySet().forEach(prim ->
        b.add(core.nonRec(core.primDecl(prim.name, schema(prim.name), prim))));
    extraPrimitives.keySet().forEach(name ->
        b.add(
            core.nonRec(
                core.primDecl(name, Schema.mono(INTEGER),
                    PrimIdent.prelude(name)))));
    return b.build();
  }

  private static Schema schema(String name) {
    final Type intOp = core.fnType(INTEGER, core.fnType(INTEGER, INTEGER));
    final Type bitOp = core.fnType(BIT, core.fnType(BIT, BIT));
    switch (name) {
      case "True":
      case "False":
        return Schema.mono(BIT);
      case "&&":
      case "||":
      case "^":
        return Schema.mono(bitOp);
      case "complement":
        return Schema.mono(core.fnType(BIT, BIT));
      case "+":
      case "-":
      case "*":
      case "/":
        return Schema.mono(intOp);
      case "negate":
        return Schema.mono(core.fnType(INTEGER, INTEGER));
      case "infFrom":
        return Schema.mono(core.fnType(INTEGER, core.streamType(INTEGER)));
      case "==":
        return new Schema(ImmutableList.of(A), ImmutableList.of(),
            core.fnType(A, core.fnType(A, BIT)));
      default:
        return new Schema(ImmutableList.of(A), ImmutableList.of(), A);
    }
  }

  /** Returns the environment: bindings, prelude, then declarations. */
  public EvalEnv env() {
    final Evaluator evaluator = evaluator();
    final Map<String, Thunk> map = new LinkedHashMap<>();
    bindings.forEach((name, value) -> map.put(name, Thunk.of(value)));
    final EvalEnv env = EvalEnvs.copyOf(map);
    return evaluator.evalDecls(declGroups,
        evaluator.evalDecls(prelude(), env));
  }

  /** Evaluates an expression to weak head normal form. */
  public Value eval(Core.Exp exp) {
    return evaluator().eval(env(), exp);
  }

  /** Converts a value to a string, forcing it as far as the print
   * properties allow. */
  public String describe(Value value) {
    return Values.describe(backend, value, propMap);
  }

  /** Evaluates an expression and checks its description. */
  @CanIgnoreReturnValue
  public Fixture assertEval(Core.Exp exp, Matcher<String> matcher) {
    assertThat(describe(eval(exp)), matcher);
    return this;
  }

  /** Evaluates an expression and checks its description. */
  @CanIgnoreReturnValue
  public Fixture assertEval(Core.Exp exp, String expected) {
    return assertEval(exp, is(expected));
  }

  /** Evaluates and describes an expression, and checks that it throws an
   * evaluation error of a given kind. */
  @CanIgnoreReturnValue
  public Fixture assertEvalError(Core.Exp exp, EvalException.Kind kind) {
    final EvalException e =
        assertThrows(EvalException.class, () -> describe(eval(exp)));
    assertThat(e.kind, is(kind));
    return this;
  }

  // Expression helpers

  /** Reference to a variable. */
  public static Core.Exp v(String name) {
    return core.var(name);
  }

  /** Integer literal. */
  public static Core.Exp num(long n) {
    return core.tApp(v("number"), NumType.of(n), INTEGER);
  }

  /** Word literal, {@code n : [width]}. */
  public static Core.Exp word(long n, long width) {
    return core.tApp(v("number"), NumType.of(n), core.seqType(width, BIT));
  }

  public static Core.Exp bit(boolean b) {
    return v(b ? "True" : "False");
  }

  /** List of integer literals. */
  public static Core.Exp ints(long... values) {
    final ImmutableList.Builder<Core.Exp> b = ImmutableList.builder();
    for (long value : values) {
      b.add(num(value));
    }
    return core.list(INTEGER, b.build());
  }

  /** List of bit literals. */
  public static Core.Exp bits(boolean... values) {
    final ImmutableList.Builder<Core.Exp> b = ImmutableList.builder();
    for (boolean value : values) {
      b.add(bit(value));
    }
    return core.list(BIT, b.build());
  }

  public static Core.Exp plus(Core.Exp e0, Core.Exp e1) {
    return core.apply(v("+"), e0, e1);
  }

  public static Core.Exp minus(Core.Exp e0, Core.Exp e1) {
    return core.apply(v("-"), e0, e1);
  }

  public static Core.Exp times(Core.Exp e0, Core.Exp e1) {
    return core.apply(v("*"), e0, e1);
  }

  public static Core.Exp divide(Core.Exp e0, Core.Exp e1) {
    return core.apply(v("/"), e0, e1);
  }

  public static Core.Exp eq(Type type, Core.Exp e0, Core.Exp e1) {
    return core.apply(core.tApp(v("=="), type), e0, e1);
  }

  /** Append, {@code front # back}. */
  public static Core.Exp append(Type front, Type back, Type type,
      Core.Exp e0, Core.Exp e1) {
    return core.apply(core.tApp(v("#"), front, back, type), e0, e1);
  }

  public static Core.Exp infFrom(Core.Exp e) {
    return core.apply(v("infFrom"), e);
  }

  public static Core.Exp undefined(Type type) {
    return core.tApp(v("undefined"), type);
  }

  /** Element {@code i} of a sequence. */
  public static Core.Exp at(Core.Exp e, int i) {
    return core.sel(e, core.listSel(i, -1));
  }

  /** Component {@code i} of a tuple of {@code size} components. */
  public static Core.Exp field(Core.Exp e, int i, int size) {
    return core.sel(e, core.tupleSel(i, size));
  }

  /** Field of a record. */
  public static Core.Exp field(Core.Exp e, String name) {
    return core.sel(e, core.recordSel(name));
  }
}

// End Fixture.java
