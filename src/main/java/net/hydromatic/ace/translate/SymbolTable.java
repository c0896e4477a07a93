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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Multiset;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import net.hydromatic.ace.ast.LogicAst.Term;
import net.hydromatic.ace.ast.LogicAst.Variable;

/**
 * Symbols of one rule.
 *
 * <p>Maps each subject that the rule mentions to a term: the rule's variable
 * if the subject spells the variable (ignoring case), otherwise a ground
 * atom. The table is complete before any goal is generated, so every
 * condition resolves a subject the same way.
 *
 * <p>Also allocates helper variables, such as {@code Count}, that are local
 * to one condition.
 */
class SymbolTable {
  private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-]+");
  private static final Pattern VARIABLE_NAME =
      Pattern.compile("[A-Z][A-Z0-9_]*");

  final Variable variable;
  private final ImmutableMap<String, Term> terms;
  private final Multiset<String> helperNames = HashMultiset.create();

  private SymbolTable(Variable variable, ImmutableMap<String, Term> terms) {
    this.variable = requireNonNull(variable);
    this.terms = requireNonNull(terms);
  }

  /**
   * Creates a symbol table.
   *
   * @param headSubject Subject of the rule's conclusion, which names the
   *     variable
   * @param subjects Subjects of the rule's conditions
   * @throws TranslationException if the head subject cannot be a variable,
   *     or a ground subject does not normalize to an atom
   */
  static SymbolTable create(String headSubject, Iterable<String> subjects) {
    final String name = spell(headSubject);
    if (!VARIABLE_NAME.matcher(name).matches()) {
      throw new TranslationException(FailureKind.MALFORMED_RULE,
          "'" + headSubject.trim() + "' cannot be a variable");
    }
    final Variable variable = new Variable(name);
    final Map<String, Term> terms = new LinkedHashMap<>();
    terms.put(headSubject, variable);
    for (String subject : subjects) {
      if (!terms.containsKey(subject)) {
        terms.put(subject,
            spell(subject).equals(name)
                ? variable
                : EntityNormalizer.atom(subject));
      }
    }
    return new SymbolTable(variable, ImmutableMap.copyOf(terms));
  }

  /** Spells a subject as a variable: "Someone" becomes "SOMEONE". */
  static String spell(String subject) {
    return SEPARATORS.matcher(subject.trim().toUpperCase(Locale.ROOT))
        .replaceAll("_");
  }

  /** Returns the term that a subject resolves to. */
  Term term(String subject) {
    final Term term = terms.get(subject);
    checkArgument(term != null, "unknown subject '%s'", subject);
    return term;
  }

  /**
   * Allocates a fresh helper variable; the first is called {@code base}, the
   * next {@code base2}, and so on.
   */
  Variable helper(String base) {
    final int n = helperNames.add(base, 1) + 1;
    return new Variable(n == 1 ? base : base + n);
  }
}

// End SymbolTable.java
