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

import net.hydromatic.ace.ast.LogicAst.Sentence;
import net.hydromatic.ace.ast.Statement;

/** Called on various events during translation. */
public interface Tracer {
  /** Called when a line has been classified. */
  void onStatement(int line, Statement statement);

  /** Called when a statement has been translated. */
  void onResult(Statement statement, Sentence sentence);

  /**
   * Called when a statement could not be translated. Returns whether a
   * handler was found; if not, the driver logs the failure.
   */
  boolean onFailure(Statement statement, TranslationException e);
}

// End Tracer.java
