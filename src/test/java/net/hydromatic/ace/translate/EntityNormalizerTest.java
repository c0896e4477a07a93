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

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.ace.ast.LogicAst.Atom;
import net.hydromatic.ace.ast.LogicAst.Numeral;
import org.junit.jupiter.api.Test;

/** Tests {@link EntityNormalizer}. */
public class EntityNormalizerTest {
  private static final List<String> SAMPLES =
      ImmutableList.of("John", "John-Smith", "  New  York ", "Müller",
          "O'Brien", "3com", "self employed", "-x-", "Kindergeld",
          "ÉCOLE normale", "a__b", "n3com");

  @Test void testNormalize() {
    assertThat(EntityNormalizer.normalize("John"), is("john"));
    assertThat(EntityNormalizer.normalize("John-Smith"), is("john_smith"));
    assertThat(EntityNormalizer.normalize("  New  York "), is("new_york"));
    assertThat(EntityNormalizer.normalize("self employed"),
        is("self_employed"));
    assertThat(EntityNormalizer.normalize("O'Brien"), is("obrien"));
    assertThat(EntityNormalizer.normalize("-x-"), is("x"));
  }

  @Test void testNormalizeAccents() {
    assertThat(EntityNormalizer.normalize("Müller"), is("muller"));
    assertThat(EntityNormalizer.normalize("ÉCOLE normale"),
        is("ecole_normale"));
  }

  /** A name that starts with a digit is not a valid atom, so gets a
   * prefix. */
  @Test void testNormalizeLeadingDigit() {
    assertThat(EntityNormalizer.normalize("3com"), is("n3com"));
    assertThat(EntityNormalizer.normalize("42"), is("n42"));
  }

  @Test void testNormalizeIsIdempotent() {
    for (String sample : SAMPLES) {
      final String once = EntityNormalizer.normalize(sample);
      assertThat(sample, EntityNormalizer.normalize(once), is(once));
    }
  }

  @Test void testNormalizeIsRepeatable() {
    for (String sample : SAMPLES) {
      assertThat(EntityNormalizer.normalize(sample),
          is(EntityNormalizer.normalize(sample)));
    }
  }

  @Test void testNormalizeEmpty() {
    for (String s : ImmutableList.of("", "   ", "!!!", "---", "_")) {
      final TranslationException e =
          assertThrows(TranslationException.class,
              () -> EntityNormalizer.normalize(s));
      assertThat(e.kind, is(FailureKind.EMPTY_NORMALIZATION_RESULT));
    }
  }

  @Test void testTerm() {
    assertThat(EntityNormalizer.term("25"), instanceOf(Numeral.class));
    assertThat(EntityNormalizer.term(" 2500.50 "), hasToString("2500.50"));
    assertThat(EntityNormalizer.term("-3"), hasToString("-3"));
    assertThat(EntityNormalizer.term("Blue"), instanceOf(Atom.class));
    assertThat(EntityNormalizer.term("Blue"), hasToString("blue"));
    assertThat(EntityNormalizer.term("3rd"), hasToString("n3rd"));
  }
}

// End EntityNormalizerTest.java
