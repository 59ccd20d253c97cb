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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Lists;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import net.hydromatic.sloth.ast.Core;
import net.hydromatic.sloth.ast.Op;
import net.hydromatic.sloth.ast.PrimIdent;
import net.hydromatic.sloth.type.Nat;
import net.hydromatic.sloth.type.TValue;
import net.hydromatic.sloth.type.TypeEnv;
import net.hydromatic.sloth.type.TypeVar;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Non-strict evaluator of core expressions.
 *
 * <p>Every sub-expression that is not needed to determine the outermost
 * shape of a value is suspended via {@link Backend#delay}, and is
 * evaluated at most once, if ever.
 *
 * <p>An evaluator is created via {@link #builder(Backend)}, and holds no
 * state between calls other than its configuration.
 */
public class Evaluator {
  final Backend backend;
  private final Function<PrimIdent, @Nullable Value> primitives;
  private final ImmutableMap<Prop, Object> propMap;
  private final Tracer tracer;
  private final boolean packBitLiterals;
  private final Selectors selectors;
  private final Comprehensions comprehensions;

  private Evaluator(Backend backend,
      Function<PrimIdent, @Nullable Value> primitives,
      Map<Prop, Object> propMap, Tracer tracer) {
    this.backend = requireNonNull(backend);
    this.primitives = requireNonNull(primitives);
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = requireNonNull(tracer);
    this.packBitLiterals = Prop.PACK_BIT_LITERALS.booleanValue(this.propMap);
    this.selectors = new Selectors(backend);
    this.comprehensions = new Comprehensions(this, backend);
  }

  /** Creates a builder. */
  public static Builder builder(Backend backend) {
    return new Builder(backend);
  }

  public Backend backend() {
    return backend;
  }

  public Map<Prop, Object> propMap() {
    return propMap;
  }

  public Selectors selectors() {
    return selectors;
  }

  public Comprehensions comprehensions() {
    return comprehensions;
  }

  // declarations

  /** Extends an environment with the newtypes and declaration groups of a
   * module. */
  public EvalEnv moduleEnv(Core.Module module, EvalEnv env) {
    return evalDecls(module.declGroups,
        extendWithNewtypes(module.newtypes, env));
  }

  /** Binds the constructor of each newtype. */
  public EvalEnv extendWithNewtypes(List<Core.Newtype> newtypes,
      EvalEnv env) {
    EvalEnv env2 = env;
    for (Core.Newtype newtype : newtypes) {
      env2 = env2.bind(newtype.name, Thunk.of(evalNewtype(newtype)));
    }
    return env2;
  }

  /** Returns the constructor of a newtype: the identity function, wrapped
   * in one type abstraction for each value or numeric parameter. */
  Value evalNewtype(Core.Newtype newtype) {
    Value value = Value.fun(Thunk::force);
    for (TypeVar param : Lists.reverse(newtype.params)) {
      final Value body = value;
      switch (param.kind) {
        case TYPE:
          value = Values.tlam(type -> body);
          break;
        case NUM:
          value = Values.nlam(n -> body);
          break;
        default:
          // constraints are erased
          break;
      }
    }
    return value;
  }

  /** Extends an environment with several declaration groups, in order. */
  public EvalEnv evalDecls(List<? extends Core.DeclGroup> declGroups,
      EvalEnv env) {
    EvalEnv env2 = env;
    for (Core.DeclGroup declGroup : declGroups) {
      env2 = extendWithDeclGroup(env2, declGroup);
    }
    return env2;
  }

  /** Extends an environment with one declaration group.
   *
   * <p>For a recursive group, every name is first bound to a hole; then
   * every body is suspended in the environment that contains the holes;
   * then each hole is filled with its body. */
  public EvalEnv extendWithDeclGroup(EvalEnv env, Core.DeclGroup group) {
    final EvalEnv env2;
    switch (group.op) {
      case NON_REC_GROUP:
        final Core.Decl decl = ((Core.NonRecursive) group).decl;
        env2 = env.bind(decl.name, evalDecl(env, decl));
        break;

      case REC_GROUP:
        env2 = extendWithRecursiveGroup(env, (Core.Recursive) group);
        break;

      default:
        throw new EvalPanic("Evaluator.extendWithDeclGroup",
            "unknown group " + group.op);
    }
    tracer.onDeclGroup(group);
    return env2;
  }

  private EvalEnv extendWithRecursiveGroup(EvalEnv env,
      Core.Recursive group) {
    final List<Hole> holes = new ArrayList<>();
    final Map<String, Thunk> holeMap = new HashMap<>();
    for (Core.Decl decl : group.decls) {
      if (decl.isPrim()) {
        throw new EvalPanic("Evaluator.extendWithRecursiveGroup",
            "Unexpected primitive declaration in recursive group",
            "name: " + decl.name);
      }
      final Hole hole =
          backend.declareHole(decl.name);
      holes.add(hole);
      holeMap.put(decl.name, hole.read());
    }
    final EvalEnv env2 = env.bindAll(holeMap);
    try {
      final List<Thunk> bodies = new ArrayList<>();
      for (Core.Decl decl : group.decls) {
        bodies.add(evalDecl(env2, decl));
      }
      for (int i = 0; i < holes.size(); i++) {
        holes.get(i).fill(bodies.get(i));
        tracer.onHoleFilled(group.decls.get(i));
      }
    } finally {
      holes.forEach(Hole::abandon);
    }
    return env2;
  }

  /** Returns the suspended value of a declaration. The body is evaluated
   * in {@code env}, which for a recursive group contains the group's
   * holes. */
  Thunk evalDecl(EvalEnv env, Core.Decl decl) {
    if (decl.prim != null) {
      final PrimIdent prim = decl.prim;
      final Value value = primitives.apply(prim);
      if (value != null) {
        return Thunk.of(value);
      }
      return () -> {
        throw new EvalException(EvalException.Kind.NO_PRIM,
            "no implementation for primitive " + prim
                + " (declared as " + decl.name + ")");
      };
    }
    final Core.Exp exp = requireNonNull(decl.exp);
    return backend.delay(decl.name, () -> evalExpr(env, exp));
  }

  // expressions

  /** Evaluates an expression at the top level. The tracer sees the result,
   * or the error; if the tracer handles an error, the result is an error
   * placeholder. */
  public Value eval(EvalEnv env, Core.Exp exp) {
    try {
      final Value value = evalExpr(env, exp);
      tracer.onResult(value);
      return value;
    } catch (EvalException e) {
      if (!tracer.onException(e)) {
        throw e;
      }
      return Value.error(e);
    }
  }

  /** Suspends the evaluation of an expression. */
  public Thunk delay(EvalEnv env, Core.Exp exp) {
    return backend.delay(null, () -> evalExpr(env, exp));
  }

  /** Suspends an element of a list literal. A variable shares its existing
   * binding, so an element that is already evaluated can be packed into a
   * word without forcing anything. */
  private Thunk delayElement(EvalEnv env, Core.Exp exp) {
    if (exp.op == Op.VAR) {
      final Thunk thunk = env.getOpt(((Core.Var) exp).name);
      if (thunk != null) {
        return thunk;
      }
    }
    return delay(env, exp);
  }

  /** Evaluates an expression to weak head normal form. */
  public Value evalExpr(EvalEnv env, Core.Exp exp) {
    final TypeEnv types = env.types();
    switch (exp.op) {
      case LIST:
        final Core.ListExp list = (Core.ListExp) exp;
        final TValue elementType = types.evalValType(list.elementType);
        final List<Thunk> elements = new ArrayList<>();
        list.args.forEach(arg -> elements.add(delayElement(env, arg)));
        if (elementType.isBit() && packBitLiterals) {
          final Object word = backend.packBits(elements);
          if (word != null) {
            return Value.word(word);
          }
        }
        return Value.seq(Nat.of(elements.size()), elementType,
            backend.finiteSeqMap(elements));

      case TUPLE:
        final ImmutableList.Builder<Thunk> args = ImmutableList.builder();
        ((Core.Tuple) exp).args.forEach(arg -> args.add(delay(env, arg)));
        return Value.tuple(args.build());

      case RECORD:
        final ImmutableSortedMap.Builder<String, Thunk> fields =
            ImmutableSortedMap.naturalOrder();
        ((Core.Record) exp).args.forEach((name, arg) ->
            fields.put(name, delay(env, arg)));
        return Value.record(fields.build());

      case SEL:
        final Core.Sel sel = (Core.Sel) exp;
        return selectors.evalSel(evalExpr(env, sel.exp), sel.selector)
            .force();

      case SET:
        final Core.Set set = (Core.Set) exp;
        return selectors.evalSetSel(types.evalValType(set.type),
            delay(env, set.exp), set.selector, delay(env, set.value));

      case IF:
        final Core.If if_ = (Core.If) exp;
        final Object bit = Values.fromVBit(evalExpr(env, if_.condition));
        return backend.iteValue(types.evalValType(if_.type), bit,
            () -> evalExpr(env, if_.ifTrue),
            () -> evalExpr(env, if_.ifFalse));

      case COMP:
        final Core.Comp comp = (Core.Comp) exp;
        return comprehensions.evalComp(env, types.evalNumType(comp.length),
            types.evalValType(comp.elementType), comp.head, comp.branches);

      case VAR:
        return lookup(env, ((Core.Var) exp).name).force();

      case TY_ABS:
        final Core.TAbs tAbs = (Core.TAbs) exp;
        final TypeVar typeVar = tAbs.typeVar;
        switch (typeVar.kind) {
          case TYPE:
            return Values.tlam(type ->
                evalExpr(env.bindType(typeVar, type), tAbs.exp));
          case NUM:
            return Values.nlam(n ->
                evalExpr(env.bindType(typeVar, n), tAbs.exp));
          default:
            throw new EvalPanic("Evaluator.evalExpr",
                "invalid kind on type abstraction",
                "kind: " + typeVar.kind, "expression: " + exp);
        }

      case TY_APP:
        final Core.TApp tApp = (Core.TApp) exp;
        final Value poly = evalExpr(env, tApp.exp);
        switch (poly.tag) {
          case POLY:
            return ((Value.Poly) poly).apply(types.evalValType(tApp.type));
          case NUM_POLY:
            return ((Value.NumPoly) poly).apply(types.evalNumType(tApp.type));
          case ERROR:
            throw ((Value.Error) poly).raise();
          default:
            throw new EvalPanic("Evaluator.evalExpr",
                "expected a polymorphic value",
                "actual: " + poly.tag, "expression: " + exp);
        }

      case APPLY:
        final Core.Apply apply = (Core.Apply) exp;
        final Value fn = evalExpr(env, apply.fn);
        switch (fn.tag) {
          case FUN:
            return ((Value.Fun) fn).apply(delay(env, apply.arg));
          case ERROR:
            throw ((Value.Error) fn).raise();
          default:
            throw new EvalPanic("Evaluator.evalExpr",
                "expected a function",
                "actual: " + fn.tag, "expression: " + exp);
        }

      case FN:
        final Core.Fn fn2 = (Core.Fn) exp;
        return Value.fun(arg -> evalExpr(env.bind(fn2.name, arg), fn2.exp));

      case PROOF_ABS:
        return evalExpr(env, ((Core.ProofAbs) exp).exp);

      case PROOF_APP:
        return evalExpr(env, ((Core.ProofApp) exp).exp);

      case WHERE:
        final Core.Where where = (Core.Where) exp;
        return evalExpr(evalDecls(where.declGroups, env), where.exp);

      default:
        throw new EvalPanic("Evaluator.evalExpr",
            "unknown expression " + exp.op);
    }
  }

  private static Thunk lookup(EvalEnv env, String name) {
    final Thunk thunk = env.getOpt(name);
    if (thunk == null) {
      throw new EvalPanic("Evaluator.evalExpr", "var `" + name
          + "` is not defined", "environment: " + env.valueMap().keySet());
    }
    return thunk;
  }

  /** Builder for {@link Evaluator}. */
  public static class Builder {
    private final Backend backend;
    private final Map<Prop, Object> propMap = new HashMap<>();
    private Function<PrimIdent, @Nullable Value> primitives = prim -> null;
    private Tracer tracer = Tracers.empty();

    Builder(Backend backend) {
      this.backend = requireNonNull(backend);
    }

    /** Sets a property. */
    @CanIgnoreReturnValue
    public Builder withProp(Prop prop, @Nullable Object value) {
      prop.set(propMap, value);
      return this;
    }

    /** Sets the table that maps primitive identifiers to their
     * implementations. A primitive that the table does not know evaluates
     * to an error when used. */
    @CanIgnoreReturnValue
    public Builder withPrimitives(
        Function<PrimIdent, @Nullable Value> primitives) {
      this.primitives = requireNonNull(primitives);
      return this;
    }

    /** Sets the table of primitives. */
    @CanIgnoreReturnValue
    public Builder withPrimitives(Map<PrimIdent, Value> primitives) {
      final ImmutableMap<PrimIdent, Value> map =
          ImmutableMap.copyOf(primitives);
      return withPrimitives(map::get);
    }

    /** Sets the tracer. */
    @CanIgnoreReturnValue
    public Builder withTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
      return this;
    }

    public Evaluator build() {
      return new Evaluator(backend, primitives, propMap, tracer);
    }
  }
}

// End Evaluator.java
