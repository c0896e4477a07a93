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
package net.hydromatic.ace.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.ace.ast.LogicAst.Clause;
import net.hydromatic.ace.ast.LogicAst.Fact;
import net.hydromatic.ace.ast.LogicAst.Predication;
import net.hydromatic.ace.ast.LogicAst.Query;
import net.hydromatic.ace.ast.LogicAst.Sentence;
import net.hydromatic.ace.ast.LogicAst.Variable;
import net.hydromatic.ace.ast.QueryType;
import net.hydromatic.ace.ast.Statement;
import net.hydromatic.ace.translate.Driver;
import net.hydromatic.ace.translate.Predicates;
import net.hydromatic.ace.translate.Tracers;
import net.hydromatic.ace.translate.TranslationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Knowledge base backed by an {@link InferenceEngine}.
 *
 * <p>A session translates programs, asserts their facts and rules, and
 * answers their questions in plain words. It remembers which predicates it
 * has asserted, so that {@link #clear()} can remove them.
 *
 * <p>A session is not thread-safe: mutating operations against the engine
 * must happen one at a time.
 */
public class Session {
  private static final Logger LOGGER = LoggerFactory.getLogger(Session.class);

  /** Answer when the engine rejects a question. */
  public static final String ERROR_ANSWER = "Error in query";

  private final InferenceEngine engine;
  private final Map<Prop, Object> propMap;
  private final Driver driver;
  private final Set<String> assertedPatterns = new LinkedHashSet<>();

  /** Creates a Session. */
  public Session(InferenceEngine engine, Map<Prop, Object> propMap) {
    this.engine = requireNonNull(engine);
    this.propMap = ImmutableMap.copyOf(propMap);
    this.driver = new Driver(this.propMap, Tracers.empty());
  }

  /**
   * Removes the predicates that this session has asserted, and the
   * predicates that translation typically produces.
   */
  public void clear() {
    final Set<String> patterns =
        new LinkedHashSet<>(Predicates.DEFAULT_PATTERNS);
    patterns.addAll(assertedPatterns);
    for (String pattern : patterns) {
      try {
        engine.retract(pattern);
        LOGGER.debug("Retracted {}", pattern);
      } catch (InferenceException e) {
        LOGGER.warn("Error retracting {}: {}", pattern, e.getMessage());
      }
    }
    assertedPatterns.clear();
  }

  /**
   * Asserts a fact or a rule. Returns whether the engine accepted it.
   *
   * @throws IllegalArgumentException if the sentence is a query
   */
  public boolean add(Sentence sentence) {
    final Predication head;
    final String kind;
    if (sentence instanceof Fact) {
      head = ((Fact) sentence).predication;
      kind = "fact";
    } else if (sentence instanceof Clause) {
      head = ((Clause) sentence).head;
      kind = "rule";
    } else {
      throw new IllegalArgumentException("cannot assert " + sentence);
    }
    try {
      engine.assertz(sentence.toString());
    } catch (InferenceException e) {
      LOGGER.warn("Error adding {} {}: {}", kind, sentence, e.getMessage());
      return false;
    }
    assertedPatterns.add(head.pattern());
    LOGGER.debug("Added {}: {}", kind, sentence);
    return true;
  }

  /** Asks a question and describes the answer in words. */
  public String answer(Query query) {
    final List<Map<String, String>> solutions;
    try {
      solutions = engine.query(query.goal.toString());
    } catch (InferenceException e) {
      LOGGER.warn("Error in query {}: {}", query, e.getMessage());
      return ERROR_ANSWER;
    }
    LOGGER.debug("Query {} returned {} solutions", query, solutions.size());
    if (query.type.isYesNo()) {
      return solutions.isEmpty() ? "No" : "Yes";
    }
    final boolean titleCase = Prop.TITLE_CASE_ANSWERS.booleanValue(propMap);
    final Set<String> values = new LinkedHashSet<>();
    for (Map<String, String> solution : solutions) {
      final String value = solution.get(Variable.ANSWER.name);
      if (value != null) {
        values.add(titleCase ? titleCase(value) : value);
      }
    }
    if (values.isEmpty()) {
      return noAnswer(query.type);
    }
    return String.join(", ", values);
  }

  private static String noAnswer(QueryType type) {
    switch (type) {
    case WHO_IS_X:
    case WHICH_ELIGIBLE:
      return "No one";
    case WHAT_DOES_X_LIKE:
      return "Nothing found";
    case WHAT_BENEFITS:
      return "None";
    case HOW_MUCH:
      return "Unknown";
    default:
      return "No";
    }
  }

  /**
   * Upper-cases the first letter of each run of letters, lower-cases the
   * others: "john_smith" becomes "John_Smith".
   */
  static String titleCase(String s) {
    final StringBuilder b = new StringBuilder(s.length());
    boolean previousIsLetter = false;
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      final boolean isLetter = Character.isLetter(c);
      b.append(!isLetter ? c
          : previousIsLetter ? Character.toLowerCase(c)
          : Character.toUpperCase(c));
      previousIsLetter = isLetter;
    }
    return b.toString();
  }

  /**
   * Translates a program, asserts its facts and rules in input order, then
   * answers its questions.
   *
   * <p>If {@link Prop#CLEAR_BEFORE_RUN} is set, first removes what earlier
   * runs asserted. Statements that fail to translate are reported in the
   * result, and do not stop the others.
   */
  public Result run(String text) {
    final TranslationReport report = driver.translateText(text);
    if (Prop.CLEAR_BEFORE_RUN.booleanValue(propMap)) {
      clear();
    }
    final List<String> asserted = new ArrayList<>();
    final List<TranslationReport.Entry> questions = new ArrayList<>();
    for (TranslationReport.Entry entry : report.successes()) {
      final Sentence sentence = entry.translation.value();
      if (sentence instanceof Query) {
        questions.add(entry);
      } else if (add(sentence)) {
        asserted.add(sentence.toString());
      }
    }
    final List<Answer> answers = new ArrayList<>();
    for (TranslationReport.Entry entry : questions) {
      final Query query = (Query) entry.translation.value();
      answers.add(new Answer(entry.statement, query, answer(query)));
    }
    return new Result(report, asserted, answers);
  }

  /** Outcome of {@link #run}. */
  public static class Result {
    public final TranslationReport report;
    /** Facts and rules that the engine accepted, in input order. */
    public final List<String> asserted;
    public final List<Answer> answers;

    Result(TranslationReport report, List<String> asserted,
        List<Answer> answers) {
      this.report = requireNonNull(report);
      this.asserted = ImmutableList.copyOf(asserted);
      this.answers = ImmutableList.copyOf(answers);
    }

    @Override
    public String toString() {
      final StringBuilder b = new StringBuilder();
      b.append("Asserted ").append(asserted.size()).append(" clauses\n");
      for (Answer answer : answers) {
        b.append(answer).append('\n');
      }
      for (TranslationReport.Entry entry : report.failures()) {
        entry.describeTo(b).append('\n');
      }
      return b.toString();
    }
  }

  /** Answer to a question. */
  public static class Answer {
    public final Statement statement;
    public final Query query;
    public final String text;

    Answer(Statement statement, Query query, String text) {
      this.statement = requireNonNull(statement);
      this.query = requireNonNull(query);
      this.text = requireNonNull(text);
    }

    @Override
    public String toString() {
      return "Q: " + statement.text + "\nA: " + text;
    }
  }
}

// End Session.java
