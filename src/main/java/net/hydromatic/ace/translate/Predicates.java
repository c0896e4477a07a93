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
import static net.hydromatic.ace.translate.EntityNormalizer.normalize;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import net.hydromatic.ace.ast.LogicAst.Predication;
import net.hydromatic.ace.ast.LogicAst.Term;

/**
 * Builders for the predicates that translation produces, shared by facts,
 * rule conditions and queries so that all three encode a sentence the same
 * way.
 */
public class Predicates {
  private Predicates() {}

  /** Regular expression that matches an employment status as written. */
  public static final String EMPLOYMENT_REGEX =
      "employed|unemployed|self[- ]employed|retired";

  /** Regular expression that matches a marital status as written. */
  public static final String MARITAL_REGEX =
      "married|single|divorced|widowed";

  /** Regular expression that matches any status in the lexicon. */
  public static final String STATUS_REGEX =
      EMPLOYMENT_REGEX + "|" + MARITAL_REGEX;

  static final ImmutableSet<String> EMPLOYMENT_STATUSES =
      ImmutableSet.of("employed", "unemployed", "self_employed", "retired");

  static final ImmutableSet<String> MARITAL_STATUSES =
      ImmutableSet.of("married", "single", "divorced", "widowed");

  /**
   * Patterns of the predicates that a knowledge base built by translation
   * typically contains.
   */
  public static final List<String> DEFAULT_PATTERNS =
      ImmutableList.of(
          Predication.pattern("person", 1),
          Predication.pattern("likes", 2),
          Predication.pattern("happy", 1),
          Predication.pattern("has_property", 3),
          Predication.pattern("residence", 2),
          Predication.pattern("employment_status", 2),
          Predication.pattern("marital_status", 2),
          Predication.pattern("children_count", 2),
          Predication.pattern("birth_date", 2),
          Predication.pattern("income", 3),
          Predication.pattern("citizenship", 2),
          Predication.pattern("eligible", 2),
          Predication.pattern("benefit_amount", 3));

  /**
   * "Hans is married" &rarr; {@code marital_status(hans, married)};
   * "Hans is self-employed" &rarr; {@code employment_status(hans,
   * self_employed)}; other words become unary properties, as in
   * {@link #property}.
   */
  public static Predication status(Term subject, String word) {
    final String s = normalize(word);
    if (EMPLOYMENT_STATUSES.contains(s)) {
      return Predication.of("employment_status", subject, atom(s));
    }
    if (MARITAL_STATUSES.contains(s)) {
      return Predication.of("marital_status", subject, atom(s));
    }
    return property(word, subject);
  }

  /** "John is happy" &rarr; {@code happy(john)}. */
  public static Predication property(String property, Term subject) {
    return Predication.of(normalize(property), subject);
  }

  /** "John likes chocolate" &rarr; {@code likes(john, chocolate)}. */
  public static Predication likes(Term subject, Term object) {
    return Predication.of("likes", subject, object);
  }

  /** "Hans lives in Germany" &rarr; {@code residence(hans, germany)}. */
  public static Predication residence(Term subject, Term place) {
    return Predication.of("residence", subject, place);
  }

  /** "Hans has German citizenship" &rarr; {@code citizenship(hans,
   * german)}. */
  public static Predication citizenship(Term subject, Term citizenshipClass) {
    return Predication.of("citizenship", subject, citizenshipClass);
  }

  public static Predication eligible(Term subject, Term benefit) {
    return Predication.of("eligible", subject, benefit);
  }

  public static Predication childrenCount(Term subject, Term count) {
    return Predication.of("children_count", subject, count);
  }

  public static Predication income(Term subject, Term amount, Term period) {
    return Predication.of("income", subject, amount, period);
  }

  public static Predication birthDate(Term subject, Term date) {
    return Predication.of("birth_date", subject, date);
  }

  public static Predication hasProperty(Term subject, Term property,
      Term value) {
    return Predication.of("has_property", subject, property, value);
  }

  public static Predication benefitAmount(Term subject, Term kind,
      Term amount) {
    return Predication.of("benefit_amount", subject, kind, amount);
  }
}

// End Predicates.java
