/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.anomalysentinel.common.config;

import com.linkedin.anomalysentinel.common.utils.Utils;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;


/**
 * The set of keys a configuration accepts. Each key has a name, a {@link Type}, a default value (possibly
 * {@code null}), an optional {@link Validator}, an {@link Importance} and a documentation string.
 * <pre>
 * ConfigDef def = new ConfigDef()
 *     .define(&quot;windowSize&quot;, Type.INT, 5, Range.atLeast(1), Importance.HIGH, &quot;Trailing window size.&quot;);
 * Map&lt;String, Object&gt; parsed = def.parse(Map.of(&quot;windowSize&quot;, &quot;10&quot;));
 * </pre>
 * Values may arrive as strings (properties files) or already typed, including the shapes a JSON decoder produces:
 * every JSON number as a {@link Double}, every JSON array as a {@link List}. Keys that are not defined are ignored by
 * {@link #parse(Map)}.
 */
public class ConfigDef {
  private final Map<String, ConfigKey> _configKeys;

  public ConfigDef() {
    _configKeys = new LinkedHashMap<>();
  }

  /**
   * Define a new configuration key.
   *
   * @param name          Name of the key.
   * @param type          Type the value is parsed into.
   * @param defaultValue  Value used when the key is absent, {@code null} for none.
   * @param validator     Validator applied to the parsed value and to the default, or {@code null}.
   * @param importance    How likely the key needs to be changed.
   * @param documentation Documentation of the key.
   * @return This ConfigDef so calls can be chained.
   */
  public ConfigDef define(String name, Type type, Object defaultValue, Validator validator, Importance importance,
                          String documentation) {
    if (_configKeys.containsKey(name)) {
      throw new ConfigException("Configuration " + name + " is defined twice.");
    }
    _configKeys.put(name, new ConfigKey(name, type, defaultValue, validator, importance, documentation));
    return this;
  }

  /**
   * Parse and validate the given values against the defined keys.
   *
   * @param props Values keyed by configuration name.
   * @return The parsed value of every defined key, defaults filled in.
   */
  public Map<String, Object> parse(Map<?, ?> props) {
    Map<String, Object> values = new HashMap<>();
    for (ConfigKey key : _configKeys.values()) {
      Object parsedValue = props.containsKey(key._name) ? parseType(key._name, props.get(key._name), key._type)
                                                        : key._defaultValue;
      if (key._validator != null) {
        key._validator.ensureValid(key._name, parsedValue);
      }
      values.put(key._name, parsedValue);
    }
    return values;
  }

  /**
   * Parse a value according to its expected type.
   * @param name  The config name
   * @param value The config value
   * @param type  The expected type
   * @return The parsed object, {@code null} for a {@code null} value.
   */
  public static Object parseType(String name, Object value, Type type) {
    if (value == null) {
      return null;
    }
    String trimmed = value instanceof String ? ((String) value).trim() : null;
    try {
      switch (type) {
        case INT:
          if (value instanceof Integer) {
            return value;
          } else if (value instanceof Number) {
            return toInt(name, (Number) value);
          } else if (trimmed != null) {
            return Integer.parseInt(trimmed);
          }
          throw new ConfigException(name, value, "Expected value to be a 32-bit integer, but it was a "
                                                 + value.getClass().getName());
        case DOUBLE:
          if (value instanceof Number) {
            return ((Number) value).doubleValue();
          } else if (trimmed != null) {
            return Double.parseDouble(trimmed);
          }
          throw new ConfigException(name, value, "Expected value to be a double, but it was a "
                                                 + value.getClass().getName());
        case LIST:
          if (value instanceof List) {
            return toStringList(name, (List<?>) value);
          } else if (trimmed != null) {
            return trimmed.isEmpty() ? Collections.emptyList() : Arrays.asList(trimmed.split("\\s*,\\s*", -1));
          }
          throw new ConfigException(name, value, "Expected a list of strings or a comma separated list.");
        default:
          throw new IllegalStateException("Unknown type " + type);
      }
    } catch (NumberFormatException e) {
      throw new ConfigException(name, value, "Not a number of type " + type);
    }
  }

  /**
   * Accepts any number without a fractional part that fits in an int, e.g. the {@code 3.0} a JSON decoder yields for
   * {@code 3}.
   */
  private static Integer toInt(String name, Number number) {
    double asDouble = number.doubleValue();
    if (asDouble != Math.rint(asDouble) || asDouble < Integer.MIN_VALUE || asDouble > Integer.MAX_VALUE) {
      throw new ConfigException(name, number, "Expected value to be a 32-bit integer");
    }
    return number.intValue();
  }

  private static List<String> toStringList(String name, List<?> values) {
    List<String> strings = new ArrayList<>(values.size());
    for (Object element : values) {
      if (!(element instanceof String)) {
        throw new ConfigException(name, values, "Expected every list element to be a string, but found "
                                                + (element == null ? "null" : element.getClass().getName()));
      }
      strings.add(((String) element).trim());
    }
    return strings;
  }

  /**
   * The config types
   */
  public enum Type {
    INT, DOUBLE, LIST
  }

  /**
   * The importance level for a configuration
   */
  public enum Importance {
    HIGH, MEDIUM, LOW
  }

  /**
   * Validation of a single parsed value.
   */
  public interface Validator {
    /**
     * @param name The name of the configuration
     * @param value The parsed value of the configuration
     * @throws ConfigException if the value is invalid.
     */
    void ensureValid(String name, Object value);
  }

  /**
   * Inclusive numeric bounds, either of which may be open.
   */
  public static final class Range implements Validator {
    private final Number _min;
    private final Number _max;

    private Range(Number min, Number max) {
      _min = min;
      _max = max;
    }

    public static Range atLeast(Number min) {
      return new Range(min, null);
    }

    public static Range between(Number min, Number max) {
      return new Range(min, max);
    }

    @Override
    public void ensureValid(String name, Object o) {
      if (o == null) {
        throw new ConfigException(name, null, "Value must be non-null");
      }
      double value = ((Number) o).doubleValue();
      if (Double.isNaN(value)) {
        throw new ConfigException(name, o, "Value must be a number");
      }
      if (_min != null && value < _min.doubleValue()) {
        throw new ConfigException(name, o, "Value must be at least " + _min);
      }
      if (_max != null && value > _max.doubleValue()) {
        throw new ConfigException(name, o, "Value must be no more than " + _max);
      }
    }

    @Override
    public String toString() {
      return "[" + (_min == null ? "..." : _min) + "," + (_max == null ? "..." : _max) + "]";
    }
  }

  /**
   * Accepts {@code null}, otherwise delegates to the wrapped validator. Used for optional configs whose default
   * depends on the component reading them.
   */
  public static final class NullOr implements Validator {
    private final Validator _validator;

    private NullOr(Validator validator) {
      _validator = validator;
    }

    public static NullOr of(Validator validator) {
      return new NullOr(validator);
    }

    @Override
    public void ensureValid(String name, Object value) {
      if (value != null) {
        _validator.ensureValid(name, value);
      }
    }

    @Override
    public String toString() {
      return "null or " + _validator;
    }
  }

  /**
   * A non-null list whose every element, compared case-insensitively, is one of the given strings.
   */
  public static final class ValidList implements Validator {
    private final List<String> _validStrings;

    private ValidList(List<String> validStrings) {
      _validStrings = validStrings;
    }

    public static ValidList in(String... validStrings) {
      return new ValidList(Arrays.asList(validStrings));
    }

    @Override
    public void ensureValid(String name, Object value) {
      if (value == null) {
        throw new ConfigException(name, null, "Value must be non-null");
      }
      for (Object element : (List<?>) value) {
        if (element == null || !_validStrings.contains(element.toString().toLowerCase(Locale.ROOT))) {
          throw new ConfigException(name, element, "String must be one of: " + Utils.join(_validStrings, ", "));
        }
      }
    }

    @Override
    public String toString() {
      return "[" + Utils.join(_validStrings, ", ") + "]";
    }
  }

  private static final class ConfigKey {
    private final String _name;
    private final Type _type;
    private final Object _defaultValue;
    private final Validator _validator;
    private final Importance _importance;
    private final String _documentation;

    ConfigKey(String name, Type type, Object defaultValue, Validator validator, Importance importance,
              String documentation) {
      _name = name;
      _type = type;
      _defaultValue = parseType(name, defaultValue, type);
      _validator = validator;
      _importance = importance;
      _documentation = documentation;
      if (_validator != null) {
        _validator.ensureValid(name, _defaultValue);
      }
    }

    @Override
    public String toString() {
      return _name + " (" + _type + ", " + _importance + "): " + _documentation;
    }
  }
}
