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
package net.hydromatic.cnf.eval;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Configuration setting.
 *
 * <p>Settings are held in a {@code Map<Setting, Object>}; a setting that is
 * absent from the map has its default value.
 *
 * @see net.hydromatic.cnf.kb.KnowledgeBase#empty(Map)
 */
public enum Setting {
  /**
   * Boolean setting "checkPostconditions" controls whether the CNF pipeline
   * checks, after each pass, that the formula has the shape that the next
   * pass requires. A failed check throws {@link AssertionError}. Default is
   * false.
   */
  CHECK_POSTCONDITIONS("checkPostconditions", Boolean.class, false),

  /**
   * Enum setting "output" controls how the command line prints clauses.
   * Default is "infix".
   */
  OUTPUT("output", Output.class, Output.INFIX),

  /**
   * String setting "printIndent" is the string written once per level of
   * depth when a formula is printed as a tree. Default is a tab.
   */
  PRINT_INDENT("printIndent", String.class, "\t"),

  /**
   * Boolean setting "splitOnTell" controls whether
   * {@link net.hydromatic.cnf.kb.KnowledgeBase#tell} splits every stored
   * sentence into clauses after adding new clauses. This matters only if
   * sentences have been added without normalization. Default is false.
   */
  SPLIT_ON_TELL("splitOnTell", Boolean.class, false);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /**
   * Map of all settings, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Setting> BY_NAME;

  /** List of all settings sorted by {@link #camelName}. */
  public static final List<Setting> BY_CAMEL_NAME;

  static {
    final List<Setting> list = Arrays.asList(values());
    final Ordering<Setting> ordering =
        Ordering.from(Comparator.comparing((Setting o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Setting> map = new LinkedHashMap<>();
    for (Setting value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Setting(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a setting by name. Throws if not found; never returns null. */
  public static Setting lookup(String name) {
    Setting setting = BY_NAME.get(name);
    if (setting == null) {
      throw new IllegalArgumentException("setting " + name + " not found");
    }
    return setting;
  }

  /** Throws if the requested type does not match this setting's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for setting %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean setting. */
  public boolean booleanValue(Map<Setting, Object> map) {
    checkType(Boolean.class);
    return this.<Boolean>typeValue(map.get(this));
  }

  /** Returns the value of a string setting. */
  public String stringValue(Map<Setting, Object> map) {
    checkType(String.class);
    return this.typeValue(map.get(this));
  }

  /** Returns the value of an enum setting. */
  public <E extends Enum<E>> E enumValue(Map<Setting, Object> map,
      Class<E> type) {
    checkType(type);
    return this.typeValue(map.get(this));
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    return (T) (o == null ? defaultValue : o);
  }

  /**
   * Sets the value of a setting, allowing strings for boolean and enum
   * types. Used to apply settings given on the command line.
   */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Setting, Object> map, @Nullable Object value) {
    if (type == Boolean.class && value instanceof String) {
      final String s = ((String) value).toLowerCase(Locale.ROOT);
      if (!s.equals("true") && !s.equals("false")) {
        throw new IllegalArgumentException(
            "value for setting " + camelName + " must be 'true' or 'false'");
      }
      set(map, Boolean.valueOf(s));
      return;
    }
    if (type.isEnum() && value instanceof String) {
      Optional<Enum> optional =
          Enums.getIfPresent(
              (Class<Enum>) type, ((String) value).toUpperCase(Locale.ROOT));
      if (!optional.isPresent()) {
        String values =
            Arrays.stream((Enum[]) type.getEnumConstants())
                .map(e -> e.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining("', '", "'", "'"));
        throw new IllegalArgumentException("value must be one of: " + values);
      }
      set(map, optional.get());
      return;
    }
    set(map, value);
  }

  /** Sets the value of a setting. Checks that its type is valid. A null
   * value removes the setting, so that it has its default value. */
  public void set(Map<Setting, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException(
            "value for setting " + camelName + " must have type " + type);
      }
      map.put(this, value);
    }
  }

  /** Allowed values for {@link #OUTPUT} setting. */
  public enum Output {
    /** Each clause on one line, in infix notation. The default. */
    INFIX,
    /** Each clause as an indented tree, one node per line. */
    TREE
  }
}

// End Setting.java
