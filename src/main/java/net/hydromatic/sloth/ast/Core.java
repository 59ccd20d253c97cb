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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.List;
import net.hydromatic.sloth.type.RecordType;
import net.hydromatic.sloth.type.Schema;
import net.hydromatic.sloth.type.Type;
import net.hydromatic.sloth.type.TypeVar;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Core expressions and declarations; the type-checked program that the
 * evaluator consumes.
 *
 * <p>This class functions as a namespace, so that we can keep the class
 * names short. Nodes are created via {@link CoreBuilder#core}.
 *
 * <p>Names are unique within a program, so a binder never shadows another
 * binder of the same name that is still in scope.
 */
public class Core {
  private Core() {}

  /** Base class of core expressions. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** List literal, {@code [e0, e1, ...]}. The element type decides whether
   * a list of bits may be packed into a word. */
  public static class ListExp extends Exp {
    public final Type elementType;
    public final ImmutableList<Exp> args;

    ListExp(Pos pos, Type elementType, ImmutableList<Exp> args) {
      super(pos, Op.LIST);
      this.elementType = requireNonNull(elementType);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("[").appendAll(args, ", ").append("]");
    }

    @Override
    boolean isAtomic() {
      return true;
    }
  }

  /** Tuple, {@code (e0, e1, ...)}. */
  public static class Tuple extends Exp {
    public final ImmutableList<Exp> args;

    Tuple(Pos pos, ImmutableList<Exp> args) {
      super(pos, Op.TUPLE);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("(").appendAll(args, ", ").append(")");
    }

    @Override
    boolean isAtomic() {
      return true;
    }
  }

  /** Record, {@code {x = e0, y = e1}}. Fields are sorted by name. */
  public static class Record extends Exp {
    public final ImmutableSortedMap<String, Exp> args;

    Record(Pos pos, ImmutableSortedMap<String, Exp> args) {
      super(pos, Op.RECORD);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      w.append("{");
      final boolean[] first = {true};
      args.forEach((name, exp) -> {
        w.append(first[0] ? "" : ", ").append(name).append(" = ").append(exp);
        first[0] = false;
      });
      return w.append("}");
    }

    @Override
    boolean isAtomic() {
      return true;
    }
  }

  /** Selection of a component, {@code e.1}, {@code e.x} or {@code e @ 2}. */
  public static class Sel extends Exp {
    public final Exp exp;
    public final Selector selector;

    Sel(Pos pos, Exp exp, Selector selector) {
      super(pos, Op.SEL);
      this.exp = requireNonNull(exp);
      this.selector = requireNonNull(selector);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.appendParen(exp).append(selector.op.padded)
          .append(selector.label());
    }

    @Override
    boolean isAtomic() {
      return true;
    }
  }

  /** Functional update of a component, {@code {e | sel = v}}. The type is
   * that of {@code e}. */
  public static class Set extends Exp {
    public final Type type;
    public final Exp exp;
    public final Selector selector;
    public final Exp value;

    Set(Pos pos, Type type, Exp exp, Selector selector, Exp value) {
      super(pos, Op.SET);
      this.type = requireNonNull(type);
      this.exp = requireNonNull(exp);
      this.selector = requireNonNull(selector);
      this.value = requireNonNull(value);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("{").append(exp).append(" | ")
          .append(selector.label()).append(" = ").append(value).append("}");
    }

    @Override
    boolean isAtomic() {
      return true;
    }
  }

  /** Conditional, {@code if c then t else f}, whose branches have a given
   * type. */
  public static class If extends Exp {
    public final Type type;
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Pos pos, Type type, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(pos, Op.IF);
      this.type = requireNonNull(type);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("if ").append(condition)
          .append(" then ").append(ifTrue)
          .append(" else ").append(ifFalse);
    }
  }

  /** Sequence comprehension with one or more parallel branches,
   * {@code [head | m0, m1 | m2]}. */
  public static class Comp extends Exp {
    public final Type length;
    public final Type elementType;
    public final Exp head;
    public final ImmutableList<ImmutableList<Match>> branches;

    Comp(Pos pos, Type length, Type elementType, Exp head,
        ImmutableList<ImmutableList<Match>> branches) {
      super(pos, Op.COMP);
      this.length = requireNonNull(length);
      this.elementType = requireNonNull(elementType);
      this.head = requireNonNull(head);
      this.branches = requireNonNull(branches);
      checkArgument(!branches.isEmpty(), "comprehension has no branches");
    }

    @Override
    AstWriter unparse(AstWriter w) {
      w.append("[").append(head);
      for (List<Match> branch : branches) {
        w.append(" | ").appendAll(branch, ", ");
      }
      return w.append("]");
    }

    @Override
    boolean isAtomic() {
      return true;
    }
  }

  /** Reference to a variable. */
  public static class Var extends Exp {
    public final String name;

    Var(Pos pos, String name) {
      super(pos, Op.VAR);
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(name);
    }

    @Override
    boolean isAtomic() {
      return true;
    }
  }

  /** Type abstraction, {@code /\ a -> e}. */
  public static class TAbs extends Exp {
    public final TypeVar typeVar;
    public final Exp exp;

    TAbs(Pos pos, TypeVar typeVar, Exp exp) {
      super(pos, Op.TY_ABS);
      this.typeVar = requireNonNull(typeVar);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("/\\").append(typeVar.name).append(" -> ").append(exp);
    }
  }

  /** Type application, {@code e `{t}}. */
  public static class TApp extends Exp {
    public final Exp exp;
    public final Type type;

    TApp(Pos pos, Exp exp, Type type) {
      super(pos, Op.TY_APP);
      this.exp = requireNonNull(exp);
      this.type = requireNonNull(type);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.appendParen(exp).append(" `{").append(type.toString())
          .append("}");
    }
  }

  /** Function application, {@code f x}. */
  public static class Apply extends Exp {
    public final Exp fn;
    public final Exp arg;

    Apply(Pos pos, Exp fn, Exp arg) {
      super(pos, Op.APPLY);
      this.fn = requireNonNull(fn);
      this.arg = requireNonNull(arg);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(fn).append(" ").appendParen(arg);
    }
  }

  /** Lambda, {@code \(x : t) -> e}. */
  public static class Fn extends Exp {
    public final String name;
    public final Type paramType;
    public final Exp exp;

    Fn(Pos pos, String name, Type paramType, Exp exp) {
      super(pos, Op.FN);
      this.name = requireNonNull(name);
      this.paramType = requireNonNull(paramType);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("\\(").append(name).append(" : ")
          .append(paramType.toString()).append(") -> ").append(exp);
    }
  }

  /** Abstraction over a constraint; erased at run time. */
  public static class ProofAbs extends Exp {
    public final Type prop;
    public final Exp exp;

    ProofAbs(Pos pos, Type prop, Exp exp) {
      super(pos, Op.PROOF_ABS);
      this.prop = requireNonNull(prop);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("/\\(").append(prop.toString()).append(") -> ")
          .append(exp);
    }
  }

  /** Application to a constraint; erased at run time. */
  public static class ProofApp extends Exp {
    public final Exp exp;

    ProofApp(Pos pos, Exp exp) {
      super(pos, Op.PROOF_APP);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.appendParen(exp).append(" <>");
    }
  }

  /** Local declarations, {@code e where decls}. */
  public static class Where extends Exp {
    public final Exp exp;
    public final ImmutableList<DeclGroup> declGroups;

    Where(Pos pos, Exp exp, ImmutableList<DeclGroup> declGroups) {
      super(pos, Op.WHERE);
      this.exp = requireNonNull(exp);
      this.declGroups = requireNonNull(declGroups);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(exp).append(" where ").appendAll(declGroups, "; ");
    }
  }

  /** Component selector: a tuple index, a record field name, or a list
   * index. */
  public static class Selector {
    public final Op op;
    public final int index;
    public final @Nullable String field;
    /** For a tuple selector, the number of components; for a list selector,
     * the length of the list; otherwise -1. */
    public final long size;

    Selector(Op op, int index, @Nullable String field, long size) {
      checkArgument(op == Op.TUPLE_SEL || op == Op.RECORD_SEL
          || op == Op.LIST_SEL, "not a selector: %s", op);
      checkArgument(op == Op.RECORD_SEL ? field != null : index >= 0,
          "invalid selector");
      this.op = op;
      this.index = index;
      this.field = field;
      this.size = size;
    }

    /** Returns the text that follows the dot (or {@code @}) in a
     * selection. */
    public String label() {
      return op == Op.RECORD_SEL ? requireNonNull(field)
          : Integer.toString(index);
    }

    @Override
    public String toString() {
      return op.padded + label();
    }
  }

  /** Match in a branch of a comprehension. */
  public abstract static class Match extends AstNode {
    Match(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Generator match, {@code x <- e}, where {@code e} has type
   * {@code [length]elementType}. */
  public static class From extends Match {
    public final String name;
    public final Type length;
    public final Type elementType;
    public final Exp exp;

    From(Pos pos, String name, Type length, Type elementType, Exp exp) {
      super(pos, Op.FROM);
      this.name = requireNonNull(name);
      this.length = requireNonNull(length);
      this.elementType = requireNonNull(elementType);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(name).append(op.padded).append(exp);
    }
  }

  /** Local definition in a comprehension branch, {@code let x = e}. */
  public static class LetMatch extends Match {
    public final Decl decl;

    LetMatch(Pos pos, Decl decl) {
      super(pos, Op.LET_MATCH);
      this.decl = requireNonNull(decl);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("let ").append(decl);
    }
  }

  /** Declaration of a name. Its definition is either an expression or a
   * primitive. */
  public static class Decl extends AstNode {
    public final String name;
    public final Schema schema;
    public final @Nullable PrimIdent prim;
    public final @Nullable Exp exp;

    Decl(Pos pos, String name, Schema schema, @Nullable PrimIdent prim,
        @Nullable Exp exp) {
      super(pos, Op.DECL);
      this.name = requireNonNull(name);
      this.schema = requireNonNull(schema);
      this.prim = prim;
      this.exp = exp;
      checkArgument((prim == null) != (exp == null),
          "exactly one of prim and exp must be set");
    }

    /** Returns whether this is a primitive declaration. */
    public boolean isPrim() {
      return prim != null;
    }

    @Override
    AstWriter unparse(AstWriter w) {
      w.append(name).append(op.padded);
      return prim != null ? w.append("primitive ").append(prim.toString())
          : w.append(requireNonNull(exp));
    }
  }

  /** Group of declarations, recursive or not. */
  public abstract static class DeclGroup extends AstNode {
    DeclGroup(Pos pos, Op op) {
      super(pos, op);
    }

    /** Returns the declarations in this group. */
    public abstract List<Decl> decls();
  }

  /** Group of one declaration whose body may not mention itself. */
  public static class NonRecursive extends DeclGroup {
    public final Decl decl;

    NonRecursive(Pos pos, Decl decl) {
      super(pos, Op.NON_REC_GROUP);
      this.decl = requireNonNull(decl);
    }

    @Override
    public List<Decl> decls() {
      return ImmutableList.of(decl);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(decl);
    }
  }

  /** Group of mutually recursive declarations. */
  public static class Recursive extends DeclGroup {
    public final ImmutableList<Decl> decls;

    Recursive(Pos pos, ImmutableList<Decl> decls) {
      super(pos, Op.REC_GROUP);
      this.decls = requireNonNull(decls);
    }

    @Override
    public List<Decl> decls() {
      return decls;
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("rec ").appendAll(decls, " and ");
    }
  }

  /** Newtype declaration; a named record type with type parameters. Its
   * constructor is the identity on records. */
  public static class Newtype extends AstNode {
    public final String name;
    public final ImmutableList<TypeVar> params;
    public final RecordType fields;

    Newtype(Pos pos, String name, ImmutableList<TypeVar> params,
        RecordType fields) {
      super(pos, Op.NEWTYPE);
      this.name = requireNonNull(name);
      this.params = requireNonNull(params);
      this.fields = requireNonNull(fields);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      w.append("newtype ").append(name);
      params.forEach(p -> w.append(" ").append(p.name));
      return w.append(" = ").append(fields.toString());
    }
  }

  /** Module: newtypes followed by declaration groups in dependency
   * order. */
  public static class Module extends AstNode {
    public final String name;
    public final ImmutableList<Newtype> newtypes;
    public final ImmutableList<DeclGroup> declGroups;

    Module(Pos pos, String name, ImmutableList<Newtype> newtypes,
        ImmutableList<DeclGroup> declGroups) {
      super(pos, Op.MODULE);
      this.name = requireNonNull(name);
      this.newtypes = requireNonNull(newtypes);
      this.declGroups = requireNonNull(declGroups);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      w.append("module ").append(name);
      newtypes.forEach(n -> w.append("\n").append(n));
      declGroups.forEach(g -> w.append("\n").append(g));
      return w;
    }
  }
}

// End Core.java
