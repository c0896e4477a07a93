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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.ace.ast.LogicAst.Query;
import net.hydromatic.ace.translate.Predicates;
import net.hydromatic.ace.translate.QueryTranslator;
import org.junit.jupiter.api.Test;

/** Tests {@link Session}. */
public class SessionTest {
  private static final String PROGRAM = "John is a person.\n"
      + "Mary likes chocolate.\n"
      + "X is happy if X likes chocolate.\n"
      + "Who is happy?\n"
      + "Is John happy?\n"
      + "What does Mary like?\n"
      + "Where is John?\n";

  private static Query query(String text) {
    return QueryTranslator.translate(text).value();
  }

  @Test void testRun() {
    final RecordingEngine engine =
        new RecordingEngine()
            .answer("happy(X)", "mary")
            .answer("likes(mary, X)", "chocolate", "chocolate");
    final Session session = new Session(engine, ImmutableMap.of());
    final Session.Result result = session.run(PROGRAM);
    final List<String> expectedClauses =
        ImmutableList.of("person(john)", "likes(mary, chocolate)",
            "happy(X) :- likes(X, chocolate)");
    assertThat(result.asserted, is(expectedClauses));
    assertThat(engine.clauses, is(expectedClauses));
    assertThat(engine.queries,
        is(ImmutableList.of("happy(X)", "happy(john)", "likes(mary, X)")));
    final String expected = "Asserted 3 clauses\n"
        + "Q: Who is happy?\n"
        + "A: Mary\n"
        + "Q: Is John happy?\n"
        + "A: No\n"
        + "Q: What does Mary like?\n"
        + "A: Chocolate\n"
        + "7: Where is John? => UNSUPPORTED_QUERY_TYPE:"
        + " unsupported question 'Where is John'\n";
    assertThat(result, hasToString(expected));
  }

  /** Each run starts from a clean knowledge base, including predicates
   * that are not in the default list. */
  @Test void testClearBeforeRun() {
    final RecordingEngine engine = new RecordingEngine();
    final Session session = new Session(engine, ImmutableMap.of());
    session.run("Mary is rich.\nJohn likes Mary.");
    assertThat(engine.retracted, is(Predicates.DEFAULT_PATTERNS));

    engine.retracted.clear();
    session.run("Mary is happy.");
    assertThat(engine.retracted,
        hasSize(Predicates.DEFAULT_PATTERNS.size() + 1));
    assertThat(engine.retracted.get(engine.retracted.size() - 1),
        is("rich(_)"));

    // "rich" was not asserted by the second run, so is forgotten
    engine.retracted.clear();
    session.clear();
    assertThat(engine.retracted, is(Predicates.DEFAULT_PATTERNS));
  }

  @Test void testNoClearBeforeRun() {
    final RecordingEngine engine = new RecordingEngine();
    final Map<Prop, Object> propMap = new HashMap<>();
    Prop.CLEAR_BEFORE_RUN.set(propMap, false);
    final Session session = new Session(engine, propMap);
    session.run("John is a person.");
    session.run("Mary is a person.");
    assertThat(engine.retracted, hasSize(0));
    assertThat(engine.clauses,
        is(ImmutableList.of("person(john)", "person(mary)")));
  }

  /** A pattern that cannot be retracted does not stop the others. */
  @Test void testClearError() {
    final RecordingEngine engine =
        new RecordingEngine().reject("likes(_, _)");
    final Session session = new Session(engine, ImmutableMap.of());
    session.clear();
    assertThat(engine.retracted,
        hasSize(Predicates.DEFAULT_PATTERNS.size() - 1));
  }

  @Test void testAddError() {
    final RecordingEngine engine =
        new RecordingEngine().reject("likes(mary, chocolate)");
    final Session session = new Session(engine, ImmutableMap.of());
    final Session.Result result =
        session.run("Mary likes chocolate.\nJohn likes cake.");
    assertThat(result.asserted, is(ImmutableList.of("likes(john, cake)")));
  }

  @Test void testAddQuery() {
    final Session session =
        new Session(new RecordingEngine(), ImmutableMap.of());
    assertThrows(IllegalArgumentException.class,
        () -> session.add(query("Who is happy?")));
  }

  @Test void testAnswers() {
    final RecordingEngine engine =
        new RecordingEngine()
            .succeed("eligible(hans, kindergeld)")
            .answer("eligible(hans, X)", "kindergeld", "wohngeld")
            .answer("eligible(X, kindergeld)", "hans", "anna_maria")
            .answer("income(hans, X, _)", "2500.50")
            .reject("likes(bob, X)");
    final Session session = new Session(engine, ImmutableMap.of());
    assertThat(session.answer(query("Is Hans eligible for Kindergeld?")),
        is("Yes"));
    assertThat(session.answer(query("Is Anna eligible for Kindergeld?")),
        is("No"));
    assertThat(session.answer(query("What benefits does Hans qualify for?")),
        is("Kindergeld, Wohngeld"));
    assertThat(
        session.answer(query("Which parents are eligible for Kindergeld?")),
        is("Hans, Anna_Maria"));
    assertThat(session.answer(query("How much income does Hans earn?")),
        is("2500.50"));
    assertThat(session.answer(query("What does Bob like?")),
        is(Session.ERROR_ANSWER));
  }

  @Test void testNoAnswers() {
    final Session session =
        new Session(new RecordingEngine(), ImmutableMap.of());
    assertThat(session.answer(query("Who is happy?")), is("No one"));
    assertThat(
        session.answer(query("Which parents are eligible for Kindergeld?")),
        is("No one"));
    assertThat(session.answer(query("What does Mary like?")),
        is("Nothing found"));
    assertThat(session.answer(query("What benefits does Hans qualify for?")),
        is("None"));
    assertThat(session.answer(query("How much Kindergeld does Hans receive?")),
        is("Unknown"));
  }

  @Test void testTitleCaseAnswers() {
    final RecordingEngine engine =
        new RecordingEngine().answer("happy(X)", "john_smith");
    final Map<Prop, Object> propMap = new HashMap<>();
    assertThat(new Session(engine, propMap).answer(query("Who is happy?")),
        is("John_Smith"));
    Prop.TITLE_CASE_ANSWERS.set(propMap, false);
    assertThat(new Session(engine, propMap).answer(query("Who is happy?")),
        is("john_smith"));
  }

  @Test void testTitleCase() {
    assertThat(Session.titleCase("john_smith"), is("John_Smith"));
    assertThat(Session.titleCase("NEW_YORK"), is("New_York"));
    assertThat(Session.titleCase("o'brien"), is("O'Brien"));
    assertThat(Session.titleCase("2500.50"), is("2500.50"));
    assertThat(Session.titleCase(""), is(""));
  }
}

// End SessionTest.java
