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
import static net.hydromatic.ace.translate.EntityNormalizer.atom;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.hydromatic.ace.ast.LogicAst.Clause;
import net.hydromatic.ace.ast.LogicAst.CompOp;
import net.hydromatic.ace.ast.LogicAst.Comparison;
import net.hydromatic.ace.ast.LogicAst.Connective;
import net.hydromatic.ace.ast.LogicAst.Goal;
import net.hydromatic.ace.ast.LogicAst.Junction;
import net.hydromatic.ace.ast.LogicAst.Numeral;
import net.hydromatic.ace.ast.LogicAst.Predication;
import net.hydromatic.ace.ast.LogicAst.Term;
import net.hydromatic.ace.ast.LogicAst.Variable;
import net.hydromatic.ace.eval.Prop;

/**
 * Translates a rule, such as "X is happy if X likes chocolate.", into a
 * clause, such as {@code happy(X) :- likes(X, chocolate)}.
 *
 * <p>A rule is written either "conclusion if condition" or "If condition
 * then conclusion". The subject of the conclusion, upper-cased, becomes the
 * clause's variable; "Someone" becomes {@code SOMEONE}.
 *
 * <p>The condition is one atomic condition, or several joined all by "and"
 * (rendered with {@code ,}) or all by "or" (rendered with {@code ;}). A
 * condition that mixes "and" and "or" is rejected.
 */
public class RuleTranslator {
  private static final Pattern IF_WORD =
      Pattern.compile("\\bif\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern THEN_WORD =
      Pattern.compile("\\bthen\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern CONCLUSION_FIRST =
      Pattern.compile("(.*?)\\s+if\\b(.*)",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern CONDITION_FIRST_HINT =
      Pattern.compile("^if\\s.*\\bthen\\b",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern CONDITION_FIRST =
      Pattern.compile("if\\s+(.*?)\\s+then\\b(.*)",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern AND =
      Pattern.compile("\\s+and(?:\\s+|$)", Pattern.CASE_INSENSITIVE);
  private static final Pattern OR =
      Pattern.compile("\\s+or(?:\\s+|$)", Pattern.CASE_INSENSITIVE);
  private static final CharMatcher PERIOD = CharMatcher.is('.');

  private static final Map<String, CompOp> COMPARISONS =
      ImmutableMap.of("more than", CompOp.GT,
          "fewer than", CompOp.LT,
          "at least", CompOp.GE,
          "exactly", CompOp.EQ);

  /** Conclusion templates, in order of precedence. */
  static final List<Template<Head>> HEADS =
      ImmutableList.of(
          Template.of("eligibility", "(.+?) is eligible for (.+)",
              m ->
                  new Head(m.group(1),
                      v -> Predicates.eligible(v, atom(m.group(2))))),
          Template.of("category", "(.+?) is an? (.+)",
              m ->
                  new Head(m.group(1),
                      v -> Predicates.property(m.group(2), v))),
          Template.of("property", "(.+?) is (.+)",
              m ->
                  new Head(m.group(1),
                      v -> Predicates.property(m.group(2), v))));

  /** Atomic condition templates, in order of precedence. */
  static final List<Template<Condition>> CONDITIONS =
      ImmutableList.of(
          Template.of("children comparison",
              "(.+?) has (more than|fewer than|at least|exactly) (\\d+)"
                  + " (?:child|children)",
              m ->
                  new Condition(m.group(1),
                      (s, table) -> {
                        final Variable count = table.helper("Count");
                        final CompOp op =
                            COMPARISONS.get(
                                m.group(2).toLowerCase(Locale.ROOT));
                        return Junction.and(
                            Predicates.childrenCount(s, count),
                            new Comparison(count, op,
                                new Numeral(m.group(3))));
                      })),
          Template.of("children", "(.+?) has (\\d+) (?:child|children)",
              m ->
                  new Condition(m.group(1),
                      (s, table) ->
                          Predicates.childrenCount(s,
                              new Numeral(m.group(2))))),
          Template.of("citizenship", "(.+?) has ([a-z][\\w-]*) citizenship",
              m ->
                  new Condition(m.group(1),
                      (s, table) ->
                          Predicates.citizenship(s, atom(m.group(2))))),
          Template.of("residence", "(.+?) lives in (.+)",
              m ->
                  new Condition(m.group(1),
                      (s, table) ->
                          Predicates.residence(s, atom(m.group(2))))),
          Template.of("eligibility", "(.+?) is eligible for (.+)",
              m ->
                  new Condition(m.group(1),
                      (s, table) ->
                          Predicates.eligible(s, atom(m.group(2))))),
          Template.of("status",
              "(.+?) is (" + Predicates.STATUS_REGEX + ")",
              m ->
                  new Condition(m.group(1),
                      (s, table) -> Predicates.status(s, m.group(2)))),
          Template.of("likes", "(.+?) likes (.+)",
              m ->
                  new Condition(m.group(1),
                      (s, table) -> Predicates.likes(s, atom(m.group(2))))),
          Template.of("category", "(.+?) is an? (.+)",
              m ->
                  new Condition(m.group(1),
                      (s, table) -> Predicates.property(m.group(2), s))),
          Template.of("property", "(.+?) is (.+)",
              m ->
                  new Condition(m.group(1),
                      (s, table) -> Predicates.property(m.group(2), s))));

  private final boolean requireBoundHead;

  /** Creates a RuleTranslator. */
  public RuleTranslator(Map<Prop, Object> propMap) {
    this.requireBoundHead = Prop.REQUIRE_BOUND_HEAD.booleanValue(propMap);
  }

  /**
   * Translates a rule.
   *
   * @param text Rule, e.g. "X is happy if X likes chocolate."
   * @return Translation, e.g. {@code happy(X) :- likes(X, chocolate)}, or
   *     failure
   */
  public Translation<Clause> translate(String text) {
    try {
      return Translation.success(toClause(text));
    } catch (TranslationException e) {
      return Translation.failure(e);
    }
  }

  private Clause toClause(String text) {
    final String body = PERIOD.trimTrailingFrom(text.trim()).trim();

    // Separate the conclusion from the condition.
    final Matcher conclusionFirst = CONCLUSION_FIRST.matcher(body);
    final boolean hasInfixIf = conclusionFirst.matches();
    final boolean hasIfThen = CONDITION_FIRST_HINT.matcher(body).find();
    final String conclusion;
    final String condition;
    if (hasInfixIf && hasIfThen) {
      throw new TranslationException(FailureKind.AMBIGUOUS_SEPARATOR,
          "rule uses both 'if ... then' and '... if ...'");
    } else if (hasInfixIf) {
      conclusion = conclusionFirst.group(1).trim();
      condition = conclusionFirst.group(2).trim();
    } else if (hasIfThen) {
      final Matcher conditionFirst = CONDITION_FIRST.matcher(body);
      if (!conditionFirst.matches()) {
        throw malformed("incomplete 'if ... then' in '" + body + "'");
      }
      condition = conditionFirst.group(1).trim();
      conclusion = conditionFirst.group(2).trim();
      if (count(THEN_WORD, body) > 1) {
        throw malformed("more than one 'then' in '" + body + "'");
      }
    } else {
      throw malformed("no 'if' in '" + body + "'");
    }
    if (count(IF_WORD, body) > 1) {
      throw malformed("more than one 'if' in '" + body + "'");
    }
    if (conclusion.isEmpty()) {
      throw malformed("rule has no conclusion");
    }
    if (condition.isEmpty()) {
      throw malformed("rule has no condition");
    }

    final Head head = Template.apply(HEADS, conclusion);
    if (head == null) {
      throw malformed("unrecognized conclusion '" + conclusion + "'");
    }

    // Split the condition into atomic conditions.
    final boolean hasAnd = AND.matcher(condition).find();
    final boolean hasOr = OR.matcher(condition).find();
    if (hasAnd && hasOr) {
      throw malformed("condition mixes 'and' with 'or'");
    }
    final Connective connective = hasOr ? Connective.OR : Connective.AND;
    final List<String> parts =
        hasAnd
            ? ImmutableList.copyOf(AND.split(condition, -1))
            : hasOr
                ? ImmutableList.copyOf(OR.split(condition, -1))
                : ImmutableList.of(condition);
    final List<Condition> conditions = new ArrayList<>();
    final List<String> subjects = new ArrayList<>();
    for (String part : parts) {
      if (part.trim().isEmpty()) {
        throw malformed("empty condition in '" + condition + "'");
      }
      final Condition c = Template.apply(CONDITIONS, part.trim());
      if (c == null) {
        throw malformed("unrecognized condition '" + part.trim() + "'");
      }
      conditions.add(c);
      subjects.add(c.subject);
    }

    // Resolve every subject, then generate goals.
    final SymbolTable table = SymbolTable.create(head.subject, subjects);
    final List<Goal> goals = new ArrayList<>();
    for (Condition c : conditions) {
      goals.add(c.builder.apply(table.term(c.subject), table));
    }
    final Goal goal =
        goals.size() == 1 ? goals.get(0) : new Junction(connective, goals);
    if (requireBoundHead) {
      // Each branch of a disjunction must bind the variable on its own
      final List<Goal> branches =
          connective == Connective.OR ? goals : ImmutableList.of(goal);
      for (Goal branch : branches) {
        if (!branch.mentions(table.variable)) {
          throw new TranslationException(FailureKind.UNBOUND_HEAD_VARIABLE,
              "variable " + table.variable + " does not occur in '"
                  + branch + "'");
        }
      }
    }
    return new Clause(head.builder.apply(table.variable), goal);
  }

  private static TranslationException malformed(String message) {
    return new TranslationException(FailureKind.MALFORMED_RULE, message);
  }

  private static int count(Pattern pattern, String s) {
    final Matcher matcher = pattern.matcher(s);
    int n = 0;
    while (matcher.find()) {
      ++n;
    }
    return n;
  }

  /** Conclusion of a rule, before its subject is resolved. */
  static class Head {
    final String subject;
    final Function<Variable, Predication> builder;

    Head(String subject, Function<Variable, Predication> builder) {
      this.subject = subject.trim();
      this.builder = requireNonNull(builder);
    }
  }

  /** Atomic condition, before its subject is resolved. */
  static class Condition {
    final String subject;
    final BiFunction<Term, SymbolTable, Goal> builder;

    Condition(String subject, BiFunction<Term, SymbolTable, Goal> builder) {
      this.subject = subject.trim();
      this.builder = requireNonNull(builder);
    }
  }
}

// End RuleTranslator.java
