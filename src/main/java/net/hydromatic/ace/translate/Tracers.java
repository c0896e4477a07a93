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
package net.hydromatic.ace.translate;

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.ace.ast.LogicAst.Sentence;
import net.hydromatic.ace.ast.Statement;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on each classified
   * statement, then calls the underlying tracer.
   */
  public static Tracer withOnStatement(Tracer tracer,
      Consumer<Statement> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onStatement(int line, Statement statement) {
        consumer.accept(statement);
        super.onStatement(line, statement);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each translated
   * statement, then calls the underlying tracer.
   */
  public static Tracer withOnResult(Tracer tracer,
      BiConsumer<Statement, Sentence> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onResult(Statement statement, Sentence sentence) {
        consumer.accept(statement, sentence);
        super.onResult(statement, sentence);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each failure, then
   * calls the underlying tracer.
   */
  public static Tracer withOnFailure(Tracer tracer,
      Consumer<TranslationException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean onFailure(Statement statement, TranslationException e) {
        consumer.accept(e);
        super.onFailure(statement, e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onStatement(int line, Statement statement) {}

    @Override
    public void onResult(Statement statement, Sentence sentence) {}

    @Override
    public boolean onFailure(Statement statement, TranslationException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onStatement(int line, Statement statement) {
      tracer.onStatement(line, statement);
    }

    @Override
    public void onResult(Statement statement, Sentence sentence) {
      tracer.onResult(statement, sentence);
    }

    @Override
    public boolean onFailure(Statement statement, TranslationException e) {
      return tracer.onFailure(statement, e);
    }
  }
}

// End Tracers.java
