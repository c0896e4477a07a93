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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.ace.ast.LogicAst.Sentence;
import net.hydromatic.ace.ast.Statement;

/**
 * Outcome of translating a text: for each statement, in input order, its
 * translation or the reason it failed.
 */
public class TranslationReport {
  public final List<Entry> entries;

  TranslationReport(List<Entry> entries) {
    this.entries = ImmutableList.copyOf(entries);
  }

  /** Returns the entries whose translation succeeded. */
  public List<Entry> successes() {
    return entries.stream()
        .filter(e -> e.translation.isSuccess())
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns the entries whose translation failed. */
  public List<Entry> failures() {
    return entries.stream()
        .filter(e -> !e.translation.isSuccess())
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns the statements, in input order. */
  public List<Statement> statements() {
    return entries.stream()
        .map(e -> e.statement)
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    for (Entry entry : entries) {
      entry.describeTo(b).append('\n');
    }
    return b.toString();
  }

  /** Translation of one statement. */
  public static class Entry {
    /** Line number in the input, starting at 1. */
    public final int line;
    public final Statement statement;
    public final Translation<? extends Sentence> translation;

    public Entry(int line, Statement statement,
        Translation<? extends Sentence> translation) {
      this.line = line;
      this.statement = requireNonNull(statement);
      this.translation = requireNonNull(translation);
    }

    @Override
    public String toString() {
      return describeTo(new StringBuilder()).toString();
    }

    /** Writes "line: text => output" or "line: text => KIND: reason". */
    public StringBuilder describeTo(StringBuilder buf) {
      buf.append(line).append(": ").append(statement.text).append(" => ");
      if (translation.isSuccess()) {
        return buf.append(translation.value());
      }
      return translation.failure().describeTo(buf);
    }
  }
}

// End TranslationReport.java
