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
package net.hydromatic.sloth.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import net.hydromatic.sloth.type.FnType;
import net.hydromatic.sloth.type.NumType;
import net.hydromatic.sloth.type.RecordType;
import net.hydromatic.sloth.type.Schema;
import net.hydromatic.sloth.type.SeqType;
import net.hydromatic.sloth.type.TupleType;
import net.hydromatic.sloth.type.Type;
import net.hydromatic.sloth.type.TypeFun;
import net.hydromatic.sloth.type.TypeVar;

/** Builds core expressions, declarations and types. */
public enum CoreBuilder {
  /** The singleton instance of the CORE builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  core;

  // expressions

  /** Creates a list literal. */
  public Core.ListExp list(Type elementType, Core.Exp... args) {
    return list(elementType, Arrays.asList(args));
  }

  /** Creates a list literal. */
  public Core.ListExp list(Type elementType, List<? extends Core.Exp> args) {
    return new Core.ListExp(Pos.ZERO, elementType, ImmutableList.copyOf(args));
  }

  /** Creates a tuple. */
  public Core.Tuple tuple(Core.Exp... args) {
    return new Core.Tuple(Pos.ZERO, ImmutableList.copyOf(args));
  }

  /** Creates a record. */
  public Core.Record record(Map<String, ? extends Core.Exp> args) {
    return new Core.Record(Pos.ZERO, ImmutableSortedMap.copyOf(args));
  }

  /** Creates a selection. */
  public Core.Sel sel(Core.Exp exp, Core.Selector selector) {
    return new Core.Sel(Pos.ZERO, exp, selector);
  }

  /** Creates a functional update. */
  public Core.Set set(Type type, Core.Exp exp, Core.Selector selector,
      Core.Exp value) {
    return new Core.Set(Pos.ZERO, type, exp, selector, value);
  }

  /** Creates a conditional. */
  public Core.If ifThenElse(Type type, Core.Exp condition, Core.Exp ifTrue,
      Core.Exp ifFalse) {
    return new Core.If(Pos.ZERO, type, condition, ifTrue, ifFalse);
  }

  /** Creates a comprehension with one branch. */
  public Core.Comp comp(Type length, Type elementType, Core.Exp head,
      Core.Match... matches) {
    return comp(length, elementType, head,
        ImmutableList.of(ImmutableList.copyOf(matches)));
  }

  /** Creates a comprehension with any number of parallel branches. */
  public Core.Comp comp(Type length, Type elementType, Core.Exp head,
      List<? extends List<? extends Core.Match>> branches) {
    final ImmutableList.Builder<ImmutableList<Core.Match>> b =
        ImmutableList.builder();
    branches.forEach(branch -> b.add(ImmutableList.copyOf(branch)));
    return new Core.Comp(Pos.ZERO, length, elementType, head, b.build());
  }

  /** Creates a reference to a variable. */
  public Core.Var var(String name) {
    return new Core.Var(Pos.ZERO, name);
  }

  /** Creates a type abstraction. */
  public Core.TAbs tAbs(TypeVar typeVar, Core.Exp exp) {
    return new Core.TAbs(Pos.ZERO, typeVar, exp);
  }

  /** Creates a type application. */
  public Core.TApp tApp(Core.Exp exp, Type type) {
    return new Core.TApp(Pos.ZERO, exp, type);
  }

  /** Creates a chain of type applications, {@code e `{t0} `{t1}}. */
  public Core.Exp tApp(Core.Exp exp, Type type0, Type... types) {
    Core.Exp e = tApp(exp, type0);
    for (Type type : types) {
      e = tApp(e, type);
    }
    return e;
  }

  /** Creates a function application. */
  public Core.Apply apply(Core.Exp fn, Core.Exp arg) {
    return new Core.Apply(Pos.ZERO, fn, arg);
  }

  /** Creates a curried application of a function to several arguments. */
  public Core.Exp apply(Core.Exp fn, Core.Exp arg0, Core.Exp... args) {
    Core.Exp e = apply(fn, arg0);
    for (Core.Exp arg : args) {
      e = apply(e, arg);
    }
    return e;
  }

  /** Creates a lambda. */
  public Core.Fn fn(String name, Type paramType, Core.Exp exp) {
    return new Core.Fn(Pos.ZERO, name, paramType, exp);
  }

  /** Creates an abstraction over a constraint. */
  public Core.ProofAbs proofAbs(Type prop, Core.Exp exp) {
    return new Core.ProofAbs(Pos.ZERO, prop, exp);
  }

  /** Creates an application to a constraint. */
  public Core.ProofApp proofApp(Core.Exp exp) {
    return new Core.ProofApp(Pos.ZERO, exp);
  }

  /** Creates an expression with local declarations. */
  public Core.Where where(Core.Exp exp, Core.DeclGroup... declGroups) {
    return where(exp, Arrays.asList(declGroups));
  }

  /** Creates an expression with local declarations. */
  public Core.Where where(Core.Exp exp,
      List<? extends Core.DeclGroup> declGroups) {
    return new Core.Where(Pos.ZERO, exp, ImmutableList.copyOf(declGroups));
  }

  // selectors

  /** Creates a selector of component {@code index} of a tuple of
   * {@code size} components. */
  public Core.Selector tupleSel(int index, int size) {
    return new Core.Selector(Op.TUPLE_SEL, index, null, size);
  }

  /** Creates a selector of a record field. */
  public Core.Selector recordSel(String field) {
    return new Core.Selector(Op.RECORD_SEL, -1, field, -1);
  }

  /** Creates a selector of element {@code index} of a list of
   * {@code size} elements. */
  public Core.Selector listSel(int index, long size) {
    return new Core.Selector(Op.LIST_SEL, index, null, size);
  }

  // matches

  /** Creates a generator match, {@code name <- exp}. */
  public Core.From from(String name, Type length, Type elementType,
      Core.Exp exp) {
    return new Core.From(Pos.ZERO, name, length, elementType, exp);
  }

  /** Creates a local definition in a comprehension branch. */
  public Core.LetMatch let(Core.Decl decl) {
    return new Core.LetMatch(Pos.ZERO, decl);
  }

  // declarations

  /** Creates a declaration defined by an expression. */
  public Core.Decl decl(String name, Schema schema, Core.Exp exp) {
    return new Core.Decl(Pos.ZERO, name, schema, null, exp);
  }

  /** Creates a monomorphic declaration defined by an expression. */
  public Core.Decl decl(String name, Type type, Core.Exp exp) {
    return decl(name, Schema.mono(type), exp);
  }

  /** Creates a declaration defined by a primitive. */
  public Core.Decl primDecl(String name, Schema schema, PrimIdent prim) {
    return new Core.Decl(Pos.ZERO, name, schema, prim, null);
  }

  /** Creates a non-recursive declaration group. */
  public Core.NonRecursive nonRec(Core.Decl decl) {
    return new Core.NonRecursive(Pos.ZERO, decl);
  }

  /** Creates a recursive declaration group. */
  public Core.Recursive rec(Core.Decl... decls) {
    return rec(Arrays.asList(decls));
  }

  /** Creates a recursive declaration group. */
  public Core.Recursive rec(List<Core.Decl> decls) {
    return new Core.Recursive(Pos.ZERO, ImmutableList.copyOf(decls));
  }

  /** Creates a newtype declaration. */
  public Core.Newtype newtype(String name, List<TypeVar> params,
      RecordType fields) {
    return new Core.Newtype(Pos.ZERO, name, ImmutableList.copyOf(params),
        fields);
  }

  /** Creates a module. */
  public Core.Module module(String name, List<Core.Newtype> newtypes,
      List<? extends Core.DeclGroup> declGroups) {
    return new Core.Module(Pos.ZERO, name, ImmutableList.copyOf(newtypes),
        ImmutableList.copyOf(declGroups));
  }

  // types

  /** Creates a sequence type {@code [length]elementType}. */
  public SeqType seqType(long length, Type elementType) {
    return new SeqType(NumType.of(length), elementType);
  }

  /** Creates a sequence type whose length is a type. */
  public SeqType seqType(Type length, Type elementType) {
    return new SeqType(length, elementType);
  }

  /** Creates a stream type {@code [inf]elementType}. */
  public SeqType streamType(Type elementType) {
    return new SeqType(NumType.INF, elementType);
  }

  /** Creates a tuple type. */
  public TupleType tupleType(Type... argTypes) {
    return new TupleType(Arrays.asList(argTypes));
  }

  /** Creates a record type. */
  public RecordType recordType(Map<String, ? extends Type> argNameTypes) {
    return new RecordType(argNameTypes);
  }

  /** Creates a function type. */
  public FnType fnType(Type paramType, Type resultType) {
    return new FnType(paramType, resultType);
  }

  /** Creates an application of a numeric type function. */
  public TypeFun typeFun(TypeFun.Fun fun, Type arg0, Type arg1) {
    return new TypeFun(fun, ImmutableList.of(arg0, arg1));
  }
}

// End CoreBuilder.java
