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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.ace.ast.LogicAst.Sentence;
import net.hydromatic.ace.ast.Statement;
import net.hydromatic.ace.eval.Prop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates a text, one statement per line.
 *
 * <p>Blank lines, and lines that start with "#", are skipped. Each other
 * line is classified and handed to the translator for its kind. A statement
 * that fails to translate does not stop the others; the {@link
 * TranslationReport} pairs every statement with its translation or its
 * failure.
 *
 * <p>A Driver holds no mutable state, and may be used from several threads.
 */
public class Driver {
  private static final Logger LOGGER = LoggerFactory.getLogger(Driver.class);

  private static final Splitter LINE_SPLITTER = Splitter.onPattern("\r?\n");

  private final RuleTranslator ruleTranslator;
  private final Tracer tracer;

  /** Creates a Driver with default properties and no tracer. */
  public Driver() {
    this(ImmutableMap.of(), Tracers.empty());
  }

  /** Creates a Driver. */
  public Driver(Map<Prop, Object> propMap, Tracer tracer) {
    this.ruleTranslator = new RuleTranslator(propMap);
    this.tracer = requireNonNull(tracer);
  }

  /** Splits a text into classified statements, without translating them. */
  public static List<Statement> parseText(String text) {
    final ImmutableList.Builder<Statement> statements =
        ImmutableList.builder();
    for (String line : LINE_SPLITTER.split(text)) {
      if (!skip(line)) {
        statements.add(StatementClassifier.classify(line));
      }
    }
    return statements.build();
  }

  private static boolean skip(String line) {
    final String trimmed = line.trim();
    return trimmed.isEmpty() || trimmed.startsWith("#");
  }

  /** Classifies and translates every statement in a text. */
  public TranslationReport translateText(String text) {
    final List<TranslationReport.Entry> entries = new ArrayList<>();
    int lineNumber = 0;
    for (String line : LINE_SPLITTER.split(text)) {
      ++lineNumber;
      if (skip(line)) {
        continue;
      }
      final Statement statement = StatementClassifier.classify(line);
      LOGGER.debug("line {}: {} {}", lineNumber, statement.kind, statement);
      tracer.onStatement(lineNumber, statement);
      final Translation<? extends Sentence> translation = translate(statement);
      if (translation.isSuccess()) {
        tracer.onResult(statement, translation.value());
      } else {
        if (!tracer.onFailure(statement, translation.failure())) {
          LOGGER.debug("line {}: {}", lineNumber, translation.failure());
        }
      }
      entries.add(
          new TranslationReport.Entry(lineNumber, statement, translation));
    }
    return new TranslationReport(entries);
  }

  /** Translates a classified statement. */
  public Translation<? extends Sentence> translate(Statement statement) {
    switch (statement.kind) {
    case FACT:
      return FactTranslator.translate(statement.text);
    case RULE:
      return ruleTranslator.translate(statement.text);
    case QUERY:
      return QueryTranslator.translate(statement.text);
    default:
      throw new AssertionError("unknown kind " + statement.kind);
    }
  }
}

// End Driver.java
