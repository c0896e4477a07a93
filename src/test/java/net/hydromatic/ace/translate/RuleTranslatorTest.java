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

import static net.hydromatic.ace.translate.Ace.ace;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.ace.ast.LogicAst.Clause;
import net.hydromatic.ace.ast.LogicAst.Variable;
import net.hydromatic.ace.eval.Prop;
import org.junit.jupiter.api.Test;

/** Tests {@link RuleTranslator} and {@link SymbolTable}. */
public class RuleTranslatorTest {
  @Test void testRule() {
    ace("X is happy if X likes chocolate.")
        .assertRule("happy(X) :- likes(X, chocolate)");
    ace("X is happy IF X likes chocolate")
        .assertRule("happy(X) :- likes(X, chocolate)");
  }

  @Test void testMultiLetterVariable() {
    ace("Someone is happy if Someone likes chocolate.")
        .assertRule("happy(SOMEONE) :- likes(SOMEONE, chocolate)");
    // Spelling decides, not case
    ace("Someone is happy if someone likes chocolate.")
        .assertRule("happy(SOMEONE) :- likes(SOMEONE, chocolate)");
    ace("Some Person is happy if Some Person likes chocolate.")
        .assertRule("happy(SOME_PERSON) :- likes(SOME_PERSON, chocolate)");
  }

  @Test void testConditionFirst() {
    ace("If X is rich then X is happy.")
        .assertRule("happy(X) :- rich(X)");
    ace("if X likes cake then X is a gourmet")
        .assertRule("gourmet(X) :- likes(X, cake)");
  }

  @Test void testConjunction() {
    ace("X is eligible for Kindergeld if X has German citizenship"
        + " and X lives in Germany and X has at least 1 child.")
        .assertRule("eligible(X, kindergeld) :- citizenship(X, german),"
            + " residence(X, germany), children_count(X, Count), Count >= 1");
  }

  @Test void testDisjunction() {
    ace("X is happy if X likes chocolate or X likes cake.")
        .assertRule("happy(X) :- likes(X, chocolate); likes(X, cake)");
    ace("X is busy if X has more than 3 children or X is employed.")
        .assertRule("busy(X) :- children_count(X, Count), Count > 3;"
            + " employment_status(X, employed)");
  }

  @Test void testComparisons() {
    ace("X is a parent if X has at least 1 child.")
        .assertRule("parent(X) :- children_count(X, Count), Count >= 1");
    ace("X is childless if X has fewer than 1 child.")
        .assertRule("childless(X) :- children_count(X, Count), Count < 1");
    ace("X is a twin parent if X has exactly 2 children.")
        .assertRule("twin_parent(X) :- children_count(X, Count),"
            + " Count =:= 2");
    ace("X is a parent if X has 2 children.")
        .assertRule("parent(X) :- children_count(X, 2)");
  }

  /** Each comparison gets its own count variable. */
  @Test void testHelperVariables() {
    ace("X is busy if X has more than 2 children"
        + " and X has fewer than 5 children.")
        .assertRule("busy(X) :- children_count(X, Count), Count > 2,"
            + " children_count(X, Count2), Count2 < 5");
  }

  @Test void testConditions() {
    ace("X is eligible for Arbeitslosengeld if X is unemployed.")
        .assertRule("eligible(X, arbeitslosengeld) :-"
            + " employment_status(X, unemployed)");
    ace("X is eligible for Ehegattensplitting if X is married.")
        .assertRule("eligible(X, ehegattensplitting) :-"
            + " marital_status(X, married)");
    ace("X is happy if X is eligible for Kindergeld.")
        .assertRule("happy(X) :- eligible(X, kindergeld)");
    ace("X is happy if X is a parent.")
        .assertRule("happy(X) :- parent(X)");
    ace("X is a resident if X lives in New York.")
        .assertRule("resident(X) :- residence(X, new_york)");
  }

  /** A subject that is not the head's variable is a ground entity. */
  @Test void testGroundSubject() {
    ace("X is happy if X likes Mary and Mary is rich.")
        .assertRule("happy(X) :- likes(X, mary), rich(mary)");
  }

  @Test void testUnboundHeadVariable() {
    ace("X is happy if John likes chocolate.")
        .assertRuleFails(FailureKind.UNBOUND_HEAD_VARIABLE)
        .withProp(Prop.REQUIRE_BOUND_HEAD, false)
        .assertRule("happy(X) :- likes(john, chocolate)");
  }

  /** Each branch of a disjunction must bind the head variable. */
  @Test void testUnboundHeadVariableInDisjunct() {
    ace("X is happy if X likes cake or John is rich.")
        .assertRuleFails(FailureKind.UNBOUND_HEAD_VARIABLE)
        .withProp(Prop.REQUIRE_BOUND_HEAD, false)
        .assertRule("happy(X) :- likes(X, cake); rich(john)");
    ace("X is happy if X likes cake or X is rich.")
        .assertRule("happy(X) :- likes(X, cake); rich(X)");
  }

  @Test void testMalformed() {
    ace("X is happy if.").assertRuleFails(FailureKind.MALFORMED_RULE);
    ace("If X is rich then.").assertRuleFails(FailureKind.MALFORMED_RULE);
    ace("X is happy.").assertRuleFails(FailureKind.MALFORMED_RULE);
    ace("X is happy if X is rich if X is nice.")
        .assertRuleFails(FailureKind.MALFORMED_RULE);
    ace("X sings if X is happy.")
        .assertRuleFails(FailureKind.MALFORMED_RULE);
    ace("X is happy if X sings.")
        .assertRuleFails(FailureKind.MALFORMED_RULE);
    ace("X is happy if X likes chocolate and.")
        .assertRuleFails(FailureKind.MALFORMED_RULE);
    // Head subject cannot be a variable
    ace("3 is happy if 3 likes chocolate.")
        .assertRuleFails(FailureKind.MALFORMED_RULE);
  }

  @Test void testMixedConnectives() {
    ace("X is happy if X likes chocolate and X likes cake or X is rich.")
        .assertRuleFails(FailureKind.MALFORMED_RULE);
  }

  @Test void testAmbiguousSeparator() {
    ace("If X is rich then X is happy if X is nice.")
        .assertRuleFails(FailureKind.AMBIGUOUS_SEPARATOR);
  }

  @Test void testClause() {
    final Clause clause =
        new RuleTranslator(ImmutableMap.of())
            .translate("X is happy if X likes chocolate.").value();
    assertThat(clause.head, hasToString("happy(X)"));
    assertThat(clause.head.pattern(), is("happy(_)"));
    assertThat(clause.body.mentions(new Variable("X")), is(true));
    assertThat(clause.body.mentions(new Variable("Y")), is(false));
  }

  @Test void testSymbolTable() {
    final SymbolTable table =
        SymbolTable.create("Someone",
            ImmutableList.of("someone", "John", "Someone"));
    assertThat(table.variable, hasToString("SOMEONE"));
    assertThat(table.term("someone"), is(table.variable));
    assertThat(table.term("John"), hasToString("john"));
    assertThat(table.helper("Count"), hasToString("Count"));
    assertThat(table.helper("Count"), hasToString("Count2"));
    assertThat(table.helper("Sum"), hasToString("Sum"));
    assertThat(SymbolTable.spell(" new-york "), is("NEW_YORK"));
  }
}

// End RuleTranslatorTest.java
