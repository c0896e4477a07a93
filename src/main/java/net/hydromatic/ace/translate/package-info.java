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

/**
 * Translation of controlled English into logic programs.
 *
 * <p>The {@link net.hydromatic.ace.translate.Driver} reads one statement per
 * line. {@link net.hydromatic.ace.translate.StatementClassifier} labels each
 * line as a fact, a rule or a query, and the matching translator converts it:
 *
 * <table>
 * <caption>Examples</caption>
 * <tr><th>Statement</th><th>Translation</th></tr>
 * <tr><td>John is a person.</td><td>{@code person(john)}</td></tr>
 * <tr><td>Bob has age 25.</td><td>{@code has_property(bob, age, 25)}</td></tr>
 * <tr><td>Hans was born on 1985-06-15.</td>
 *     <td>{@code birth_date(hans, date(1985, 6, 15))}</td></tr>
 * <tr><td>X is happy if X likes chocolate.</td>
 *     <td>{@code happy(X) :- likes(X, chocolate)}</td></tr>
 * <tr><td>X is eligible for Kindergeld if X has more than 0 children and X
 *     lives in Germany.</td>
 *     <td>{@code eligible(X, kindergeld) :- children_count(X, Count),
 *     Count > 0, residence(X, germany)}</td></tr>
 * <tr><td>Who is happy?</td><td>{@code happy(X)}</td></tr>
 * </table>
 *
 * <p>Each translator consults an ordered list of
 * {@link net.hydromatic.ace.translate.Template templates}; the first whose
 * pattern matches the whole statement produces the result. Translation is
 * pure: the same statement always gives the same result, whatever was
 * translated before.
 *
 * <p>A statement that cannot be translated yields a
 * {@link net.hydromatic.ace.translate.Translation} that holds a
 * {@link net.hydromatic.ace.translate.FailureKind} and a reason.
 */
package net.hydromatic.ace.translate;

// End package-info.java
