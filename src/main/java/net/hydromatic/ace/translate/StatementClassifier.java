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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import net.hydromatic.ace.ast.Statement;
import net.hydromatic.ace.ast.Statement.Kind;

/**
 * Labels a line of input as a fact, a rule or a query.
 *
 * <p>Shapes are tried in a fixed order: query, rule, fact. Classification
 * never fails; a line that matches no shape is a fact, and gets a trailing
 * period if it lacks one.
 *
 * <p>A line that contains several sentences ("John is happy. Mary is sad.")
 * is a single statement, of whichever kind matches first.
 */
public class StatementClassifier {
  private static final Pattern QUESTION_WORD =
      Pattern.compile(
          "^(is|are|does|do|who|what|which|when|where|why|how)\\b",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern INFIX_IF =
      Pattern.compile("\\sif\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern IF_THEN =
      Pattern.compile("^if\\s.*\\bthen\\b",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern SUBJECT_VERB_OBJECT =
      Pattern.compile("^[A-Z][\\w-]* .+ [\\w-]+\\.$", Pattern.DOTALL);

  /** Shapes, in order of precedence. */
  static final List<Shape> SHAPES =
      ImmutableList.of(
          new Shape(Kind.QUERY, "question mark", s -> s.endsWith("?")),
          new Shape(Kind.QUERY, "question word",
              s -> QUESTION_WORD.matcher(s).find()),
          new Shape(Kind.RULE, "if", s -> INFIX_IF.matcher(s).find()),
          new Shape(Kind.RULE, "if-then", s -> IF_THEN.matcher(s).find()),
          new Shape(Kind.FACT, "subject-verb-object",
              s -> SUBJECT_VERB_OBJECT.matcher(s).matches()),
          new Shape(Kind.FACT, "period", s -> s.endsWith(".")));

  private StatementClassifier() {}

  /** Classifies a line. */
  public static Statement classify(String line) {
    final String text = requireNonNull(line, "line").trim();
    for (Shape shape : SHAPES) {
      if (shape.predicate.test(text)) {
        return new Statement(text, shape.kind);
      }
    }
    // No shape matched, so the text does not end with "."
    return new Statement(text + ".", Kind.FACT);
  }

  /** Returns the kind of a line. */
  public static Kind kind(String line) {
    return classify(line).kind;
  }

  /** A shape of statement that implies its kind. */
  static class Shape {
    final Kind kind;
    final String name;
    final Predicate<String> predicate;

    Shape(Kind kind, String name, Predicate<String> predicate) {
      this.kind = requireNonNull(kind);
      this.name = requireNonNull(name);
      this.predicate = requireNonNull(predicate);
    }

    @Override
    public String toString() {
      return kind + ":" + name;
    }
  }
}

// End StatementClassifier.java
