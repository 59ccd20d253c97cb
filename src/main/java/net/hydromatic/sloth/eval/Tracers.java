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

import java.util.function.Consumer;
import net.hydromatic.sloth.ast.Core;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Implementations of {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that calls an action on each declaration group, and
   * otherwise behaves like {@code tracer}. */
  public static Tracer withOnDeclGroup(Tracer tracer,
      Consumer<Core.DeclGroup> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onDeclGroup(Core.DeclGroup group) {
        consumer.accept(group);
      }
    };
  }

  /** Returns a tracer that calls an action each time a hole is filled. */
  public static Tracer withOnHoleFilled(Tracer tracer,
      Consumer<Core.Decl> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onHoleFilled(Core.Decl decl) {
        consumer.accept(decl);
      }
    };
  }

  /** Returns a tracer that calls an action on the result of evaluation. */
  public static Tracer withOnResult(Tracer tracer, Consumer<Value> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onResult(Value value) {
        consumer.accept(value);
      }
    };
  }

  /** Returns a tracer that handles exceptions by calling an action. */
  public static Tracer withOnException(Tracer tracer,
      Consumer<Throwable> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean onException(@Nullable Throwable e) {
        if (e != null) {
          consumer.accept(e);
        }
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onDeclGroup(Core.DeclGroup group) {}

    @Override
    public void onHoleFilled(Core.Decl decl) {}

    @Override
    public void onResult(Value value) {}

    @Override
    public boolean onException(@Nullable Throwable e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    private final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override
    public void onDeclGroup(Core.DeclGroup group) {
      tracer.onDeclGroup(group);
    }

    @Override
    public void onHoleFilled(Core.Decl decl) {
      tracer.onHoleFilled(decl);
    }

    @Override
    public void onResult(Value value) {
      tracer.onResult(value);
    }

    @Override
    public boolean onException(@Nullable Throwable e) {
      return tracer.onException(e);
    }
  }
}

// End Tracers.java
