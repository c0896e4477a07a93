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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property.
 *
 * @see Session
 */
public enum Prop {
  /**
   * Boolean property "clearBeforeRun" controls whether {@link Session#run}
   * retracts the predicates of the knowledge base before it asserts a new
   * program. Default is true.
   */
  CLEAR_BEFORE_RUN("clearBeforeRun", Boolean.class, true, true),

  /**
   * Boolean property "requireBoundHead" controls whether a rule whose head
   * variable does not occur in its condition, such as "X is happy if John
   * likes chocolate", is rejected. Default is true.
   */
  REQUIRE_BOUND_HEAD("requireBoundHead", Boolean.class, true, true),

  /**
   * Boolean property "titleCaseAnswers" controls whether answers print atoms
   * in title case, "john_smith" as "John_Smith". Default is true.
   */
  TITLE_CASE_ANSWERS("titleCaseAnswers", Boolean.class, true, true);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final @Nullable Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required,
      @Nullable Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    if (defaultValue == null) {
      checkArgument(
          !required, "required property %s must have default value", camelName);
    } else {
      checkArgument(type.isInstance(defaultValue));
    }
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public @Nullable Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkArgument(
        type == Boolean.class,
        "invalid type %s for property %s",
        Boolean.class,
        camelName);
    Object o = get(map);
    if (o == null) {
      throw new IllegalStateException(
          "no value for property " + camelName + " and no default value");
    }
    return (Boolean) o;
  }

  /**
   * Sets the value of a property from a string, such as "false", converting
   * it to the property's type.
   */
  public void setString(Map<Prop, Object> map, String value) {
    if (type == Boolean.class) {
      checkArgument(value.equals("true") || value.equals("false"),
          "invalid value '%s' for boolean property %s", value, camelName);
      set(map, Boolean.valueOf(value));
    } else {
      set(map, value);
    }
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException("property is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException(
            "value for property must have type " + type);
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
