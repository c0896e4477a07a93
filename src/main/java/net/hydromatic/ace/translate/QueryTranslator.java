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

import static net.hydromatic.ace.translate.EntityNormalizer.atom;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;
import net.hydromatic.ace.ast.LogicAst.Query;
import net.hydromatic.ace.ast.LogicAst.Variable;
import net.hydromatic.ace.ast.QueryType;

/**
 * Translates a question, such as "Who is happy?", into a query goal, such as
 * {@code happy(X)}.
 *
 * <p>The goal's only free variable is {@code X}, which carries the answer;
 * yes/no questions have no free variable. Where templates share a leading
 * phrase, the more specific template comes first: "Is Hans eligible for
 * Kindergeld?" never reaches the generic "Is ... ..." template.
 */
public class QueryTranslator {
  private static final Variable X = Variable.ANSWER;

  /**
   * Lookahead that rejects a question ending with a word that needs a
   * complement, such as "Is Hans eligible for?" or "Who is a?".
   */
  private static final String NO_DANGLING_WORD =
      "(?!(?:an?|for|eligible for)$)";

  /**
   * Query templates, in order of precedence. Each template's name is the
   * phrase that the question starts with.
   */
  static final List<Template<Query>> TEMPLATES =
      ImmutableList.of(
          Template.of("is eligible for", "is (.+?) eligible for (.+)",
              m ->
                  new Query(QueryType.IS_ELIGIBLE_FOR,
                      Predicates.eligible(atom(m.group(1)),
                          atom(m.group(2))))),
          Template.of("is a", "is (.+?) an? (.+)",
              m ->
                  new Query(QueryType.IS_X_Y,
                      Predicates.property(m.group(2), atom(m.group(1))))),
          Template.of("is", "is (.+) " + NO_DANGLING_WORD + "(\\S+)",
              m ->
                  new Query(QueryType.IS_X_Y,
                      Predicates.status(atom(m.group(1)), m.group(2)))),
          Template.of("who is eligible for", "who is eligible for (.+)",
              m ->
                  new Query(QueryType.WHO_IS_X,
                      Predicates.eligible(X, atom(m.group(1))))),
          Template.of("who is a", "who is an? (.+)",
              m ->
                  new Query(QueryType.WHO_IS_X,
                      Predicates.property(m.group(1), X))),
          Template.of("who is", "who is " + NO_DANGLING_WORD + "(.+)",
              m ->
                  new Query(QueryType.WHO_IS_X,
                      Predicates.status(X, m.group(1)))),
          Template.of("what does", "what does (.+?) like",
              m ->
                  new Query(QueryType.WHAT_DOES_X_LIKE,
                      Predicates.likes(atom(m.group(1)), X))),
          Template.of("what benefits does",
              "what benefits does (.+?) qualify for",
              m ->
                  new Query(QueryType.WHAT_BENEFITS,
                      Predicates.eligible(atom(m.group(1)), X))),
          Template.of("which", "which (.+?) (?:are|is) eligible for (.+)",
              m ->
                  new Query(QueryType.WHICH_ELIGIBLE,
                      Predicates.eligible(X, atom(m.group(2))))),
          Template.of("how much", "how much (.+?) does (.+?) (receive|earn)",
              m ->
                  new Query(QueryType.HOW_MUCH,
                      m.group(3).toLowerCase(Locale.ROOT).equals("earn")
                          ? Predicates.income(atom(m.group(2)), X,
                              Variable.ANONYMOUS)
                          : Predicates.benefitAmount(atom(m.group(2)),
                              atom(m.group(1)), X))));

  private static final CharMatcher QUESTION_MARK = CharMatcher.is('?');

  private QueryTranslator() {}

  /**
   * Translates a question.
   *
   * @param text Question, e.g. "What does Mary like?"; the question mark is
   *     optional
   * @return Translation, e.g. {@code likes(mary, X)} with type {@link
   *     QueryType#WHAT_DOES_X_LIKE}, or failure
   */
  public static Translation<Query> translate(String text) {
    final String body = QUESTION_MARK.trimTrailingFrom(text.trim()).trim();
    try {
      final Query query = Template.apply(TEMPLATES, body);
      if (query == null) {
        return Translation.failure(FailureKind.UNSUPPORTED_QUERY_TYPE,
            "unsupported question '" + body + "'");
      }
      return Translation.success(query);
    } catch (TranslationException e) {
      return Translation.failure(e);
    }
  }
}

// End QueryTranslator.java
