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
package net.hydromatic.cas.eval;

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
 * Property.
 *
 * @see Session#map
 */
public enum Prop {
  /** Integer property "precision" is the number of digits after the decimal
   * point in approximate results. In scientific notation, it is the number
   * of digits after the point in the mantissa. Default is 10. */
  PRECISION("precision", Integer.class, 10),

  /** Enum property "numberFormat" controls how numbers are written; see
   * {@link NumberFormat}. Default is {@link NumberFormat#AUTOMATIC}. */
  NUMBER_FORMAT("numberFormat", NumberFormat.class,
      NumberFormat.AUTOMATIC),

  /** Maximum nesting of nodes and parentheses in an expression. Deeper
   * input gives an error result. Default is 200. */
  MAX_DEPTH("maxDepth", Integer.class, 200),

  /** Maximum number of iterations of a summation or product. A larger range
   * gives an error result. Default is 10,000. */
  LOOP_LIMIT("loopLimit", Integer.class, 10_000);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  public static final ImmutableMap<String, Prop> BY_NAME;

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

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL.to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by its name or camel-case name. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Returns the value of this property, or its default value. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType,
        "invalid type %s for property %s", type, camelName);
  }

  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return this.<Integer>typeValue(map.get(this));
  }

  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map,
      Class<E> type) {
    checkType(type);
    return this.typeValue(map.get(this));
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    return (T) (o == null ? defaultValue : o);
  }

  /** Sets the value of this property, converting from a string if
   * necessary; for example, "scientific" to
   * {@link NumberFormat#SCIENTIFIC}, or "4" to 4. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (type.isEnum() && value instanceof String) {
      Optional<Enum> optional =
          Enums.getIfPresent((Class<Enum>) type,
              ((String) value).toUpperCase(Locale.ROOT));
      if (!optional.isPresent()) {
        String values =
            Arrays.stream((Enum[]) type.getEnumConstants())
                .map(Enum::name)
                .collect(Collectors.joining("', '", "'", "'"));
        throw new IllegalArgumentException("value must be one of: " + values);
      }
      set(map, optional.get());
      return;
    }
    if (type == Integer.class && value instanceof String) {
      try {
        set(map, Integer.valueOf((String) value));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("value must be an integer", e);
      }
      return;
    }
    set(map, value);
  }

  /** Sets the value of this property; null resets it to the default. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
      return;
    }
    if (!type.isInstance(value)) {
      throw new IllegalArgumentException("value for property " + camelName
          + " must have type " + type.getSimpleName());
    }
    if (value instanceof Integer && (Integer) value < 0) {
      throw new IllegalArgumentException("value for property " + camelName
          + " must not be negative");
    }
    if (this == MAX_DEPTH && (Integer) value == 0) {
      throw new IllegalArgumentException("value for property " + camelName
          + " must be positive");
    }
    map.put(this, value);
  }
}

// End Prop.java
