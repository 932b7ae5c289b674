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
package net.hydromatic.calx.eval;

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
  /**
   * Integer property "precision" is the number of significant decimal digits
   * kept by arbitrary-precision values. Default is 50.
   */
  PRECISION("precision", Integer.class, true, 50),

  /**
   * Double property "tolerance" is the convergence tolerance of numerical
   * root finding, and the threshold below which a solver result is treated
   * as real or integral. Default is 1e-10.
   */
  TOLERANCE("tolerance", Double.class, true, 1e-10),

  /** Maximum number of iterations of numerical root finding. */
  MAX_ITERATIONS("maxIterations", Integer.class, true, 1000),

  /**
   * Integer property "maxDepth" is the deepest expression tree that the
   * parser accepts. Transforms recurse once per level, so this bounds their
   * use of the call stack. Default is 500.
   */
  MAX_DEPTH("maxDepth", Integer.class, true, 500),

  /** Maximum number of rewrites of a single node during simplification. */
  SIMPLIFY_PASS_LIMIT("simplifyPassLimit", Integer.class, true, 64),

  /**
   * Boolean property "implicitMultiplication" controls whether adjacent
   * operands, as in "2x" or "2(x + 1)", are multiplied, and whether a known
   * function name followed by an operand, as in "sin x", is a call.
   * Default is true.
   */
  IMPLICIT_MULTIPLICATION("implicitMultiplication", Boolean.class, true,
      true),

  /**
   * Boolean property "complex" controls whether evaluation may produce
   * complex values, for example "sqrt(-4)". If false, such operations throw
   * {@link EvaluationException}. Default is true.
   */
  COMPLEX("complex", Boolean.class, true, true),

  /**
   * Property "angleUnit" is the unit of the arguments of trigonometric
   * functions and the results of their inverses. Default is radians.
   */
  ANGLE_UNIT("angleUnit", AngleUnit.class, true, AngleUnit.RADIANS),

  /** Maximum nesting of integration by parts. */
  INTEGRATION_DEPTH("integrationDepth", Integer.class, true, 4),

  /**
   * String property "defaultVariable" is the variable of differentiation,
   * integration and solving if none is given and the expression does not
   * have exactly one free variable. Default is "x".
   */
  DEFAULT_VARIABLE("defaultVariable", String.class, true, "x");

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

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

  Prop(String camelName, Class<?> type, boolean required, Object defaultValue) {
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
      checkArgument(validValue(type, defaultValue));
    }
  }

  private static boolean validValue(Class<?> type, Object value) {
    if (type == Boolean.class
        || type == Double.class
        || type == Integer.class
        || type == String.class
        || type.isEnum()) {
      return type.isInstance(value);
    }
    return false;
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
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
    Object o = map.get(this);
    return this.<Boolean>typeValue(o);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    Object o = map.get(this);
    return this.<Integer>typeValue(o);
  }

  /** Returns the value of a double property. */
  public double doubleValue(Map<Prop, Object> map) {
    checkType(Double.class);
    Object o = map.get(this);
    return this.<Double>typeValue(o);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    Object o = map.get(this);
    return this.typeValue(o);
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map, Class<E> type) {
    checkType(type);
    Object o = map.get(this);
    return this.typeValue(o);
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(Object o) {
    if (o == null) {
      if (defaultValue == null) {
        throw new IllegalStateException(
            "no value for property " + camelName + " and no default value");
      }
      return (T) defaultValue;
    }
    return (T) o;
  }

  /** Sets the value of a property, allowing strings for enum, boolean and
   * numeric types. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String && type != String.class) {
      final String s = (String) value;
      if (type.isEnum()) {
        Optional<Enum> optional =
            Enums.getIfPresent(
                (Class<Enum>) type, s.toUpperCase(Locale.ROOT));
        if (!optional.isPresent()) {
          String values =
              Arrays.stream((Enum[]) type.getEnumConstants())
                  .map(Enum::name)
                  .collect(Collectors.joining("', '", "'", "'"));
          throw new IllegalArgumentException("value must be one of: "
              + values);
        }
        set(map, optional.get());
        return;
      }
      try {
        if (type == Boolean.class) {
          set(map, Boolean.valueOf(s));
        } else if (type == Integer.class) {
          set(map, Integer.valueOf(s));
        } else if (type == Double.class) {
          set(map, Double.valueOf(s));
        } else {
          set(map, value);
        }
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("invalid value for property "
            + camelName + ": " + s, e);
      }
      return;
    }
    set(map, value);
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
        throw new IllegalArgumentException("value for property must have type "
            + type);
      }
      map.put(this, value);
    }
  }

  /**
   * Removes the value of this property from a map, returning the previous value
   * or null.
   */
  public Object remove(Map<Prop, Object> map) {
    return map.remove(this);
  }

  /** Allowed values for {@link #ANGLE_UNIT} property. */
  public enum AngleUnit {
    /** Angles are in radians. The default. */
    RADIANS,
    /** Angles are in degrees. */
    DEGREES
  }
}

// End Prop.java
