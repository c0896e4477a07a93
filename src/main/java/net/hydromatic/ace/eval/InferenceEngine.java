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
package net.hydromatic.ace.eval;

import java.util.List;
import java.util.Map;

/**
 * Logic-programming runtime that stores clauses and answers goals.
 *
 * <p>Translation never performs inference; it only produces the text that an
 * engine accepts. Implementations bridge to a real engine, such as
 * SWI-Prolog. The caller serializes mutating operations ({@link #assertz}
 * and {@link #retract}) against one engine.
 *
 * <p>Methods throw {@link InferenceException} if the engine rejects a
 * request.
 */
public interface InferenceEngine {
  /**
   * Adds a fact, such as {@code person(john)}, or a rule, such as {@code
   * happy(X) :- likes(X, chocolate)}, after the existing clauses.
   */
  void assertz(String clause);

  /**
   * Removes every clause that matches a pattern, such as {@code likes(_,
   * _)}. Does nothing if no clause matches.
   */
  void retract(String pattern);

  /**
   * Evaluates a goal, such as {@code likes(mary, X)}, and returns one map of
   * variable bindings per solution; for example {@code [{X=music},
   * {X=books}]}. A goal without variables returns one empty map if it
   * succeeds, and an empty list if it fails.
   */
  List<Map<String, String>> query(String goal);
}

// End InferenceEngine.java
