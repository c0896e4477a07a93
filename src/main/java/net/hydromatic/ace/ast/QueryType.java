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
package net.hydromatic.ace.ast;

/**
 * Shape of a question.
 *
 * <p>Each shape pairs with exactly one rule for building the goal. Every goal
 * has at most one free variable, {@code X}, that carries the answer.
 */
public enum QueryType {
  /** "Is John happy?" &rarr; {@code happy(john)}. */
  IS_X_Y,
  /** "Who is happy?" &rarr; {@code happy(X)}. */
  WHO_IS_X,
  /** "What does Mary like?" &rarr; {@code likes(mary, X)}. */
  WHAT_DOES_X_LIKE,
  /** "Is Hans eligible for Kindergeld?" &rarr; {@code eligible(hans,
   * kindergeld)}. */
  IS_ELIGIBLE_FOR,
  /** "What benefits does Hans qualify for?" &rarr; {@code eligible(hans,
   * X)}. */
  WHAT_BENEFITS,
  /** "Which parents are eligible for Kindergeld?" &rarr; {@code eligible(X,
   * kindergeld)}. */
  WHICH_ELIGIBLE,
  /** "How much income does Hans earn?" &rarr; {@code income(hans, X, _)}. */
  HOW_MUCH;

  /** Whether the answer is yes or no, rather than a list of values. */
  public boolean isYesNo() {
    return this == IS_X_Y || this == IS_ELIGIBLE_FOR;
  }
}

// End QueryType.java
