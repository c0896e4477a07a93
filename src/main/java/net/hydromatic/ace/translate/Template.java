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

import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A pattern paired with an extractor that builds a result from a match.
 *
 * <p>Translators hold their templates in lists that are consulted top-down,
 * so precedence is the order of the list. A template matches only if its
 * pattern matches the whole text, ignoring case. Once a template has matched,
 * later templates are not tried, even if the extractor throws.
 *
 * @param <R> Type of result
 */
public class Template<R> {
  public final String name;
  public final Pattern pattern;
  private final Function<Matcher, R> extractor;

  private Template(String name, Pattern pattern,
      Function<Matcher, R> extractor) {
    this.name = requireNonNull(name);
    this.pattern = requireNonNull(pattern);
    this.extractor = requireNonNull(extractor);
  }

  /** Creates a template with a case-insensitive regular expression. */
  public static <R> Template<R> of(String name, String regex,
      Function<Matcher, R> extractor) {
    return new Template<>(name,
        Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
        extractor);
  }

  /** Returns whether this template's pattern matches the whole text. */
  public boolean matches(String text) {
    return pattern.matcher(text).matches();
  }

  /**
   * Returns the first template in a list that matches some text, or null.
   */
  public static <R> @Nullable Template<R> find(
      List<Template<R>> templates, String text) {
    for (Template<R> template : templates) {
      if (template.matches(text)) {
        return template;
      }
    }
    return null;
  }

  /**
   * Applies the first template in a list that matches some text; returns
   * null if none matches.
   */
  public static <R> @Nullable R apply(List<Template<R>> templates,
      String text) {
    for (Template<R> template : templates) {
      final Matcher matcher = template.pattern.matcher(text);
      if (matcher.matches()) {
        return template.extractor.apply(matcher);
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return name;
  }
}

// End Template.java
