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

/** Reason why a statement could not be translated. */
public enum FailureKind {
  /** A fact matched none of the fact templates. */
  UNRECOGNIZED_FACT_PATTERN,
  /**
   * A rule is missing its conclusion or its condition, has an incomplete
   * separator, mixes "and" with "or", or has a conclusion or condition that
   * matches no template.
   */
  MALFORMED_RULE,
  /** A rule uses both "... if ..." and "If ... then ...". */
  AMBIGUOUS_SEPARATOR,
  /** A question has a shape that no query template handles. */
  UNSUPPORTED_QUERY_TYPE,
  /** A name normalized to the empty string. */
  EMPTY_NORMALIZATION_RESULT,
  /** A rule's head variable does not occur in its body. */
  UNBOUND_HEAD_VARIABLE
}

// End FailureKind.java
