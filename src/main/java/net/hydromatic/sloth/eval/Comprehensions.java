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

import java.util.List;
import net.hydromatic.sloth.ast.Core;
import net.hydromatic.sloth.type.Nat;
import net.hydromatic.sloth.type.TValue;

/**
 * Evaluates sequence comprehensions.
 *
 * <p>Each branch of a comprehension is a list of matches. A generator
 * {@code x <- e} with a finite source of length {@code n} multiplies the
 * length of the branch by {@code n}: element {@code i} uses element
 * {@code i mod n} of the source, and every variable bound earlier in the
 * branch advances once every {@code n} elements. A generator with an
 * infinite source instead fixes the variables bound earlier in the branch
 * at their first value. Parallel branches are zipped.
 */
public class Comprehensions {
  private final Evaluator evaluator;
  private final Backend backend;

  Comprehensions(Evaluator evaluator, Backend backend) {
    this.evaluator = requireNonNull(evaluator);
    this.backend = requireNonNull(backend);
  }

  /** Evaluates a comprehension. Nothing is forced until an element of the
   * result is demanded. */
  public Value evalComp(EvalEnv env, Nat length, TValue elementType,
      Core.Exp head, List<? extends List<Core.Match>> branches) {
    ListEnv listEnv = null;
    for (List<Core.Match> branch : branches) {
      final ListEnv branchEnv = branchEnvs(ListEnv.of(env), branch);
      listEnv = listEnv == null ? branchEnv : listEnv.union(branchEnv);
    }
    if (listEnv == null) {
      throw new EvalPanic("Comprehensions.evalComp",
          "comprehension has no branches");
    }
    final ListEnv lenv = listEnv;
    final SeqMap elements =
        backend.memoSeqMap(
            backend.generateSeqMap(i ->
                () -> evaluator.evalExpr(lenv.evalAt(i), head)));
    return Value.seq(length, elementType, elements);
  }

  /** Extends an environment with the matches of one branch. */
  public ListEnv branchEnvs(ListEnv listEnv, List<Core.Match> matches) {
    ListEnv env = listEnv;
    for (Core.Match match : matches) {
      env = evalMatch(env, match);
    }
    return env;
  }

  /** Extends an environment with one match. */
  public ListEnv evalMatch(ListEnv listEnv, Core.Match match) {
    switch (match.op) {
      case FROM:
        final Core.From from = (Core.From) match;
        final Nat length = listEnv.types().evalNumType(from.length);
        if (length.isFinite()) {
          final long n = length.value();
          // The source may mention varying variables, so it is evaluated
          // once per index of the enclosing branch.
          final SeqMap sources =
              backend.memoSeqMap(
                  backend.generateSeqMap(i ->
                      () -> evaluator.evalExpr(listEnv.evalAt(i), from.exp)));
          final SeqMap elements = backend.joinSeqMap(n, sources);
          return listEnv.stutter(n)
              .bindVarying(from.name, i ->
                  backend.lookupSeqMap(elements, i));
        } else {
          final ListEnv collapsed = listEnv.collapse();
          final Value source =
              evaluator.evalExpr(collapsed.evalAt(0), from.exp);
          final SeqMap elements =
              backend.memoSeqMap(Values.fromVSeq(backend, source));
          return collapsed.bindVarying(from.name, i ->
              backend.lookupSeqMap(elements, i));
        }

      case LET_MATCH:
        final Core.Decl decl = ((Core.LetMatch) match).decl;
        if (decl.isPrim()) {
          throw new EvalPanic("Comprehensions.evalMatch",
              "unexpected local primitive declaration in match",
              "name: " + decl.name);
        }
        final Core.Exp exp = requireNonNull(decl.exp);
        return listEnv.bindVarying(decl.name, i ->
            backend.delay(decl.name, () ->
                evaluator.evalExpr(listEnv.evalAt(i), exp)));

      default:
        throw new EvalPanic("Comprehensions.evalMatch",
            "unknown match " + match.op);
    }
  }
}

// End Comprehensions.java
