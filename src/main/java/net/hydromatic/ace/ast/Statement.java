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

import static java.util.Objects.requireNonNull;

/** One line of input, labeled with its kind. */
public class Statement {
  public final String text;
  public final Kind kind;

  public Statement(String text, Kind kind) {
    this.text = requireNonNull(text);
    this.kind = requireNonNull(kind);
  }

  @Override
  public String toString() {
    return text;
  }

  /** Kind of statement. */
  public enum Kind {
    /** A ground fact, such as "John is a person." */
    FACT,
    /** A rule, such as "X is happy if X likes chocolate." */
    RULE,
    /** A question, such as "Who is happy?" */
    QUERY
  }
}

// End Statement.java
