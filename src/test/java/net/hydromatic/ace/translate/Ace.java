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
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.ace.ast.LogicAst.Query;
import net.hydromatic.ace.ast.QueryType;
import net.hydromatic.ace.ast.Statement.Kind;
import net.hydromatic.ace.eval.Prop;

/** Fluent test helper. */
class Ace {
  private final String text;
  private final Map<Prop, Object> propMap;

  private Ace(String text, Map<Prop, Object> propMap) {
    this.text = requireNonNull(text);
    this.propMap = ImmutableMap.copyOf(propMap);
  }

  /** Creates an {@code Ace}. */
  static Ace ace(String text) {
    return new Ace(text, ImmutableMap.of());
  }

  /** Returns a copy of this {@code Ace} with a property set. */
  Ace withProp(Prop prop, Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(propMap);
    prop.set(map, value);
    return new Ace(text, map);
  }

  Ace assertKind(Kind kind) {
    assertThat(StatementClassifier.kind(text), is(kind));
    return this;
  }

  Ace assertFact(String expected) {
    assertThat(FactTranslator.translate(text), hasToString(expected));
    assertThat(FactTranslator.translate(text).isSuccess(), is(true));
    return this;
  }

  Ace assertFactFails(FailureKind kind) {
    assertThat(FactTranslator.translate(text).failureKind(), is(kind));
    return this;
  }

  Ace assertRule(String expected) {
    final Translation<?> translation =
        new RuleTranslator(propMap).translate(text);
    assertThat(translation.isSuccess(), is(true));
    assertThat(translation, hasToString(expected));
    return this;
  }

  Ace assertRuleFails(FailureKind kind) {
    assertThat(new RuleTranslator(propMap).translate(text).failureKind(),
        is(kind));
    return this;
  }

  Ace assertQuery(QueryType type, String expected) {
    final Translation<Query> translation = QueryTranslator.translate(text);
    assertThat(translation.isSuccess(), is(true));
    assertThat(translation.value().type, is(type));
    assertThat(translation.value(), hasToString(expected));
    return this;
  }

  Ace assertQueryFails(FailureKind kind) {
    assertThat(QueryTranslator.translate(text).failureKind(), is(kind));
    return this;
  }
}

// End Ace.java
