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
package net.hydromatic.zen.check;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import net.hydromatic.zen.util.ZenException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property of a model checker.
 *
 * @see ModelCheckers#create(Map)
 */
public enum Prop {
  /**
   * Enum property "backend" is the solver that decides satisfiability.
   * Default is {@link Backend#SMT}.
   */
  BACKEND("backend", Backend.class, true, Backend.SMT),

  /**
   * Boolean property "interleave" controls whether the decision diagram
   * backend runs {@link InterleavingHeuristic} and allocates interleaved
   * variables. If false, each arbitrary gets its own block of variables.
   * Default is true.
   */
  INTERLEAVE("interleave", Boolean.class, true, true),

  /**
   * Integer property "listSize" is the maximum length of the lists in a
   * symbolic input. Default is 5.
   */
  LIST_SIZE("listSize", Integer.class, true, 5),

  /**
   * Integer property "smtTimeout" is the number of milliseconds after which
   * the SMT backend gives up. Default is null, meaning no timeout.
   */
  SMT_TIMEOUT("smtTimeout", Integer.class, false, null);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final @Nullable Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  static {
    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : values()) {
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
      throw new ZenException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of a property, or its default value. */
  public @Nullable Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return this.<Boolean>typeValue(map.get(this));
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return this.<Integer>typeValue(map.get(this));
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map,
      Class<E> type) {
    checkType(type);
    return this.typeValue(map.get(this));
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    if (o == null) {
      if (defaultValue == null) {
        throw new ZenException(
            "no value for property " + camelName + " and no default value");
      }
      return (T) defaultValue;
    }
    return (T) o;
  }

  /** Sets the value of a property, allowing strings for enum types. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (type.isEnum() && value instanceof String) {
      Optional<Enum> optional =
          Enums.getIfPresent(
              (Class<Enum>) type, ((String) value).toUpperCase(Locale.ROOT));
      if (!optional.isPresent()) {
        String values =
            Arrays.stream((Enum[]) type.getEnumConstants())
                .map(Enum::name)
                .collect(Collectors.joining("', '", "'", "'"));
        throw new ZenException("value must be one of: " + values);
      }
      set(map, optional.get());
      return;
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new ZenException("property " + camelName + " is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new ZenException("value for property " + camelName
            + " must have type " + type);
      }
      map.put(this, value);
    }
  }

  /** Allowed values for {@link #BACKEND} property. */
  public enum Backend {
    /** Satisfiability modulo theories solver. The default. Supports every
     * type, and optimization. */
    SMT,
    /** Binary decision diagrams. Supports booleans, fixed-width integers,
     * and records and bounded lists of them. */
    DECISION_DIAGRAMS
  }
}

// End Prop.java
