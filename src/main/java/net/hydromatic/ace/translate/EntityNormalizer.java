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

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;
import net.hydromatic.ace.ast.LogicAst.Atom;
import net.hydromatic.ace.ast.LogicAst.Numeral;
import net.hydromatic.ace.ast.LogicAst.Term;

/**
 * Converts free-form names into atoms.
 *
 * <p>Normalization is a pure function of its argument, and is idempotent:
 * {@code normalize(normalize(s)).equals(normalize(s))}. An atom consists of
 * lower-case ASCII letters, digits and underscores, and starts with a letter.
 */
public class EntityNormalizer {
  private static final Pattern MARKS = Pattern.compile("\\p{M}+");
  private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-]+");
  private static final Pattern INVALID = Pattern.compile("[^a-z0-9_]");
  private static final Pattern OUTER_UNDERSCORES = Pattern.compile("^_+|_+$");
  private static final Pattern NUMERAL = Pattern.compile("-?\\d+(\\.\\d+)?");

  private EntityNormalizer() {}

  /**
   * Normalizes a name.
   *
   * <p>Trims, lower-cases, and strips accents; replaces each run of
   * whitespace and hyphens with an underscore; removes other characters that
   * cannot occur in an atom. If the result starts with a digit, prefixes
   * "n".
   *
   * @param token Name, e.g. "John-Smith"
   * @return Atom name, e.g. "john_smith"
   * @throws TranslationException if nothing remains after normalization
   */
  public static String normalize(String token) {
    requireNonNull(token, "token");
    String s = token.trim().toLowerCase(Locale.ROOT);
    s = MARKS.matcher(Normalizer.normalize(s, Normalizer.Form.NFD))
        .replaceAll("");
    s = SEPARATORS.matcher(s).replaceAll("_");
    s = INVALID.matcher(s).replaceAll("");
    s = OUTER_UNDERSCORES.matcher(s).replaceAll("");
    if (s.isEmpty()) {
      throw new TranslationException(FailureKind.EMPTY_NORMALIZATION_RESULT,
          "'" + token + "' does not contain a name");
    }
    if (!Character.isLetter(s.charAt(0))) {
      s = "n" + s;
    }
    return s;
  }

  /** Normalizes a name and returns it as an atom. */
  public static Atom atom(String token) {
    return new Atom(normalize(token));
  }

  /**
   * Converts a token to a term: a numeral if it is a number, otherwise an
   * atom. Numbers pass through unchanged; other tokens are normalized, so
   * one that starts with a digit gets the "n" prefix ("3rd" becomes
   * {@code n3rd}).
   */
  public static Term term(String token) {
    final String trimmed = token.trim();
    if (NUMERAL.matcher(trimmed).matches()) {
      return new Numeral(trimmed);
    }
    return atom(trimmed);
  }
}

// End EntityNormalizer.java
