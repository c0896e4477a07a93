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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests {@link Translation} and {@link TranslationException}. */
public class TranslationTest {
  @Test void testSuccess() {
    final Translation<String> t = Translation.success("person(john)");
    assertThat(t.isSuccess(), is(true));
    assertThat(t.value(), is("person(john)"));
    assertThat(t.failureKind(), nullValue());
    assertThrows(IllegalStateException.class, t::failure);
  }

  @Test void testFailure() {
    final Translation<String> t =
        Translation.failure(FailureKind.MALFORMED_RULE, "rule has no body");
    assertThat(t.isSuccess(), is(false));
    assertThat(t.failureKind(), is(FailureKind.MALFORMED_RULE));
    assertThat(t, hasToString("MALFORMED_RULE: rule has no body"));
    assertThat(t.failure().getMessage(), is("rule has no body"));
    final IllegalStateException e =
        assertThrows(IllegalStateException.class, t::value);
    assertThat(e.getMessage(),
        is("translation failed: MALFORMED_RULE: rule has no body"));
  }
}

// End TranslationTest.java
