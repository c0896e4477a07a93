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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Result of translating a statement: either a value or the reason the
 * translation failed.
 *
 * @param <T> Type of value
 */
public final class Translation<T> {
  private final @Nullable T value;
  private final @Nullable TranslationException failure;

  private Translation(@Nullable T value,
      @Nullable TranslationException failure) {
    checkArgument((value == null) != (failure == null));
    this.value = value;
    this.failure = failure;
  }

  /** Creates a successful translation. */
  public static <T> Translation<T> success(T value) {
    return new Translation<>(requireNonNull(value), null);
  }

  /** Creates a failed translation. */
  public static <T> Translation<T> failure(TranslationException failure) {
    return new Translation<>(null, requireNonNull(failure));
  }

  /** Creates a failed translation. */
  public static <T> Translation<T> failure(FailureKind kind, String reason) {
    return failure(new TranslationException(kind, reason));
  }

  public boolean isSuccess() {
    return value != null;
  }

  /** Returns the value; throws if the translation failed. */
  public T value() {
    if (value == null) {
      throw new IllegalStateException("translation failed: " + failure);
    }
    return value;
  }

  /** Returns the failure; throws if the translation succeeded. */
  public TranslationException failure() {
    if (failure == null) {
      throw new IllegalStateException("translation succeeded: " + value);
    }
    return failure;
  }

  /** Returns the kind of failure, or null if the translation succeeded. */
  public @Nullable FailureKind failureKind() {
    return failure == null ? null : failure.kind;
  }

  @Override
  public String toString() {
    return value != null ? value.toString() : String.valueOf(failure);
  }
}

// End Translation.java
