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
import static net.hydromatic.ace.translate.EntityNormalizer.term;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import net.hydromatic.ace.ast.LogicAst.Compound;
import net.hydromatic.ace.ast.LogicAst.Fact;
import net.hydromatic.ace.ast.LogicAst.Numeral;
import net.hydromatic.ace.ast.LogicAst.Predication;
import net.hydromatic.ace.ast.LogicAst.Term;

/**
 * Translates a fact, such as "John is a person.", into a predicate
 * application, such as {@code person(john)}.
 *
 * <p>Names pass through {@link EntityNormalizer}; numbers pass through
 * unchanged.
 */
public class FactTranslator {
  /** Fact templates, in order of precedence. */
  static final List<Template<Predication>> TEMPLATES =
      ImmutableList.of(
          Template.of("category", "(.+?) is an? (.+)",
              m -> Predicates.property(m.group(2), atom(m.group(1)))),
          Template.of("employment status",
              "(.+?) is (" + Predicates.EMPLOYMENT_REGEX + ")",
              m -> Predicates.status(atom(m.group(1)), m.group(2))),
          Template.of("marital status",
              "(.+?) is (" + Predicates.MARITAL_REGEX + ")",
              m -> Predicates.status(atom(m.group(1)), m.group(2))),
          Template.of("eligibility", "(.+?) is eligible for (.+)",
              m -> Predicates.eligible(atom(m.group(1)), atom(m.group(2)))),
          Template.of("property", "(.+?) is (.+)",
              m -> Predicates.property(m.group(2), atom(m.group(1)))),
          Template.of("likes", "(.+?) likes (.+)",
              m -> Predicates.likes(atom(m.group(1)), atom(m.group(2)))),
          Template.of("income",
              "(.+?) earns (\\d+(?:\\.\\d+)?) [a-z]+ per (month|year)",
              m ->
                  Predicates.income(atom(m.group(1)),
                      new Numeral(m.group(2)),
                      atom(m.group(3)))),
          Template.of("birth date",
              "(.+?) was born on (\\d{4}-\\d{2}-\\d{2})",
              m -> Predicates.birthDate(atom(m.group(1)), date(m.group(2)))),
          Template.of("residence", "(.+?) lives in (.+)",
              m -> Predicates.residence(atom(m.group(1)), atom(m.group(2)))),
          Template.of("children", "(.+?) has (\\d+) (?:child|children)",
              m ->
                  Predicates.childrenCount(atom(m.group(1)),
                      new Numeral(m.group(2)))),
          Template.of("citizenship", "(.+?) has ([a-z][\\w-]*) citizenship",
              m ->
                  Predicates.citizenship(atom(m.group(1)),
                      atom(m.group(2)))),
          Template.of("has property", "(.+?) has (\\S+) (\\S+)",
              m ->
                  Predicates.hasProperty(atom(m.group(1)), term(m.group(2)),
                      term(m.group(3)))));

  private static final CharMatcher PERIOD = CharMatcher.is('.');

  private FactTranslator() {}

  /**
   * Translates a fact.
   *
   * @param text Fact, e.g. "Bob has age 25."
   * @return Translation, e.g. {@code has_property(bob, age, 25)}, or failure
   */
  public static Translation<Fact> translate(String text) {
    final String body = PERIOD.trimTrailingFrom(text.trim()).trim();
    try {
      final Predication predication = Template.apply(TEMPLATES, body);
      if (predication == null) {
        return Translation.failure(FailureKind.UNRECOGNIZED_FACT_PATTERN,
            "no fact template matches '" + body + "'");
      }
      return Translation.success(new Fact(predication));
    } catch (TranslationException e) {
      return Translation.failure(e);
    }
  }

  /** Converts "1985-06-15" to {@code date(1985, 6, 15)}. */
  private static Term date(String iso) {
    final LocalDate date;
    try {
      date = LocalDate.parse(iso);
    } catch (DateTimeParseException e) {
      throw new TranslationException(FailureKind.UNRECOGNIZED_FACT_PATTERN,
          String.format(Locale.ROOT, "'%s' is not a valid date", iso));
    }
    return new Compound("date",
        ImmutableList.of(numeral(date.getYear()),
            numeral(date.getMonthValue()),
            numeral(date.getDayOfMonth())));
  }

  private static Numeral numeral(int i) {
    return new Numeral(Integer.toString(i));
  }
}

// End FactTranslator.java
