/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.metricalerts.common.config;

import com.linkedin.metricalerts.common.utils.Utils;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;


/**
 * This class is used for specifying the set of expected configurations. For each configuration, you can specify
 * the name, the type, the default value, the validator, the importance and the documentation.
 *
 * To use the class:
 * <pre>
 * ConfigDef defs = new ConfigDef();
 *
 * defs.define(&quot;mad.threshold&quot;, Type.DOUBLE, 3.2, Range.between(0.0, 100.0), Importance.HIGH, &quot;Sensitivity.&quot;);
 * defs.define(&quot;metric.set&quot;, Type.LIST, &quot;spend,leads,sessions&quot;, Importance.HIGH, &quot;Metrics to evaluate.&quot;);
 *
 * Map&lt;String, String&gt; props = new HashMap&lt;&gt;();
 * props.put(&quot;mad.threshold&quot;, &quot;3.5&quot;);
 *
 * Map&lt;String, Object&gt; configs = defs.parse(props);
 * // will return 3.5
 * double k = (Double) configs.get(&quot;mad.threshold&quot;);
 * </pre>
 * This class can be used standalone or in combination with {@link AbstractConfig} which provides some additional
 * functionality for accessing configs.
 */
public class ConfigDef {
  /**
   * A unique Java object which represents the lack of a default value.
   */
  public static final Object NO_DEFAULT_VALUE = new Object();

  private final Map<String, ConfigKey> _configKeys;

  public ConfigDef() {
    _configKeys = new LinkedHashMap<>();
  }

  public ConfigDef(ConfigDef base) {
    _configKeys = new LinkedHashMap<>(base._configKeys);
  }

  /**
   * Returns unmodifiable set of properties names defined in this {@linkplain ConfigDef}
   *
   * @return New unmodifiable {@link Set} instance containing the keys
   */
  public Set<String> names() {
    return Collections.unmodifiableSet(_configKeys.keySet());
  }

  /**
   * Define the given config key and return this config definition.
   *
   * @param key Config key
   * @return This config definition.
   */
  public ConfigDef define(ConfigKey key) {
    if (_configKeys.containsKey(key._name)) {
      throw new ConfigException("Configuration " + key._name + " is defined twice.");
    }
    _configKeys.put(key._name, key);
    return this;
  }

  /**
   * Define a new configuration
   * @param name          the name of the config parameter
   * @param type          the type of the config
   * @param defaultValue  the default value to use if this config isn't present
   * @param validator     the validator to use in checking the correctness of the config
   * @param importance    the importance of this config
   * @param documentation the documentation string for the config
   * @return This ConfigDef so you can chain calls
   */
  public ConfigDef define(String name, Type type, Object defaultValue, Validator validator, Importance importance,
                          String documentation) {
    Object parsedDefault = NO_DEFAULT_VALUE.equals(defaultValue) ? NO_DEFAULT_VALUE : parseType(name, defaultValue, type);
    return define(new ConfigKey(name, type, parsedDefault, validator, importance, documentation));
  }

  /**
   * Define a new configuration with no special validation logic
   * @param name          The name of the config parameter
   * @param type          The type of the config
   * @param defaultValue  The default value to use if this config isn't present
   * @param importance    The importance of this config: is this something you will likely need to change.
   * @param documentation The documentation string for the config
   * @return This ConfigDef so you can chain calls
   */
  public ConfigDef define(String name, Type type, Object defaultValue, Importance importance, String documentation) {
    return define(name, type, defaultValue, null, importance, documentation);
  }

  /**
   * Define a new configuration with no default value and no special validation logic
   * @param name          The name of the config parameter
   * @param type          The type of the config
   * @param importance    The importance of this config: is this something you will likely need to change.
   * @param documentation The documentation string for the config
   * @return This ConfigDef so you can chain calls
   */
  public ConfigDef define(String name, Type type, Importance importance, String documentation) {
    return define(name, type, NO_DEFAULT_VALUE, null, importance, documentation);
  }

  /**
   * Get the configuration keys
   * @return A map containing all configuration keys
   */
  public Map<String, ConfigKey> configKeys() {
    return Collections.unmodifiableMap(_configKeys);
  }

  /**
   * Parse and validate configs against this configuration definition. The input is a map of configs. It is expected
   * that the keys of the map are strings, but the values can either be strings or they may already be of the
   * appropriate type (int, string, etc).
   *
   * @param props The configs to parse and validate.
   * @return Parsed and validated configs. The key will be the config name and the value will be the value parsed into
   * the appropriate type (int, string, etc).
   */
  public Map<String, Object> parse(Map<?, ?> props) {
    Map<String, Object> values = new HashMap<>();
    for (ConfigKey key : _configKeys.values()) {
      values.put(key._name, parseValue(key, props.get(key._name), props.containsKey(key._name)));
    }
    return values;
  }

  Object parseValue(ConfigKey key, Object value, boolean isSet) {
    Object parsedValue;
    if (isSet) {
      parsedValue = parseType(key._name, value, key._type);
      // props map doesn't contain setting, the key is required because no default value specified - its an error
    } else if (NO_DEFAULT_VALUE.equals(key._defaultValue)) {
      throw new ConfigException("Missing required configuration \"" + key._name + "\" which has no default value.");
    } else {
      // otherwise assign setting its default value
      parsedValue = key._defaultValue;
    }
    if (key._validator != null) {
      key._validator.ensureValid(key._name, parsedValue);
    }
    return parsedValue;
  }

  /**
   * Parse a value according to its expected type.
   * @param name  The config name
   * @param value The config value
   * @param type  The expected type
   * @return The parsed object
   */
  public static Object parseType(String name, Object value, Type type) {
    try {
      if (value == null) {
        return null;
      }

      String trimmed = null;
      if (value instanceof String) {
        trimmed = ((String) value).trim();
      }

      switch (type) {
        case STRING:
          if (value instanceof String) {
            return trimmed;
          } else {
            throw new ConfigException(name, value, "Expected value to be a string, but it was a " + value.getClass().getName());
          }
        case INT:
          if (value instanceof Integer) {
            return value;
          } else if (value instanceof String) {
            return Integer.parseInt(trimmed);
          } else {
            throw new ConfigException(name, value,
                                      "Expected value to be a 32-bit integer, but it was a " + value.getClass().getName());
          }
        case LONG:
          if (value instanceof Integer) {
            return ((Integer) value).longValue();
          }
          if (value instanceof Long) {
            return value;
          } else if (value instanceof String) {
            return Long.parseLong(trimmed);
          } else {
            throw new ConfigException(name, value, "Expected value to be a 64-bit integer (long), but it was a " + value.getClass().getName());
          }
        case DOUBLE:
          if (value instanceof Number) {
            return ((Number) value).doubleValue();
          } else if (value instanceof String) {
            return Double.parseDouble(trimmed);
          } else {
            throw new ConfigException(name, value, "Expected value to be a double, but it was a " + value.getClass().getName());
          }
        case LIST:
          if (value instanceof List) {
            return value;
          } else if (value instanceof String) {
            if (trimmed.isEmpty()) {
              return Collections.emptyList();
            } else {
              return Arrays.asList(trimmed.split("\\s*,\\s*", -1));
            }
          } else {
            throw new ConfigException(name, value, "Expected a comma separated list.");
          }
        case CLASS:
          if (value instanceof Class) {
            return value;
          } else if (value instanceof String) {
            return Class.forName(trimmed, true, Utils.getContextOrMetricAlertsClassLoader());
          } else {
            throw new ConfigException(name, value, "Expected a Class instance or class name.");
          }
        default:
          throw new IllegalStateException("Unknown type.");
      }
    } catch (NumberFormatException e) {
      throw new ConfigException(name, value, "Not a number of type " + type);
    } catch (ClassNotFoundException e) {
      throw new ConfigException(name, value, "Class " + value + " could not be found.");
    }
  }

  /**
   * The config types
   */
  public enum Type {
    STRING, INT, LONG, DOUBLE, LIST, CLASS
  }

  /**
   * The importance level for a configuration
   */
  public enum Importance {
    HIGH, MEDIUM, LOW
  }

  /**
   * Validation logic the user may provide to perform single configuration validation.
   */
  public interface Validator {
    /**
     * Perform single configuration validation.
     * @param name The name of the configuration
     * @param value The value of the configuration
     * @throws ConfigException if the value is invalid.
     */
    void ensureValid(String name, Object value);
  }

  /**
   * Validation logic for numeric ranges
   */
  public static final class Range implements Validator {
    private final Number _min;
    private final Number _max;
    private final boolean _minExclusive;

    private Range(Number min, Number max, boolean minExclusive) {
      _min = min;
      _max = max;
      _minExclusive = minExclusive;
    }

    /**
     * A numeric range that checks only the lower bound
     *
     * @param min The minimum acceptable value
     * @return A numeric range that checks only the lower bound.
     */
    public static Range atLeast(Number min) {
      return new Range(min, null, false);
    }

    /**
     * @param min Minimum bound.
     * @param max Maximum bound.
     * @return A numeric range that checks both the upper and lower bound
     */
    public static Range between(Number min, Number max) {
      return new Range(min, max, false);
    }

    /**
     * @param min Exclusive minimum bound.
     * @param max Inclusive maximum bound.
     * @return A numeric range (min, max].
     */
    public static Range aboveAndAtMost(Number min, Number max) {
      return new Range(min, max, true);
    }

    /**
     * Object to ensure validity for the given config name.
     *
     * @param name The name of the configuration
     * @param o Object to ensure validity.
     */
    public void ensureValid(String name, Object o) {
      if (o == null) {
        throw new ConfigException(name, null, "Value must be non-null");
      }
      Number n = (Number) o;
      if (_min != null) {
        if (_minExclusive && n.doubleValue() <= _min.doubleValue()) {
          throw new ConfigException(name, o, "Value must be greater than " + _min);
        }
        if (n.doubleValue() < _min.doubleValue()) {
          throw new ConfigException(name, o, "Value must be at least " + _min);
        }
      }
      if (_max != null && n.doubleValue() > _max.doubleValue()) {
        throw new ConfigException(name, o, "Value must be no more than " + _max);
      }
    }

    /**
     * @return String representation of the numeric range.
     */
    public String toString() {
      String lower = _minExclusive ? "(" : "[";
      if (_min == null) {
        return "[...," + _max + "]";
      } else if (_max == null) {
        return lower + _min + ",...]";
      } else {
        return lower + _min + ",...," + _max + "]";
      }
    }
  }

  public static class NonEmptyList implements Validator {

    @Override
    public void ensureValid(String name, Object o) {
      List<?> values = (List<?>) o;
      if (values == null || values.isEmpty()) {
        throw new ConfigException(name, o, "List must be non-empty");
      }
      for (Object value : values) {
        if (value == null || value.toString().isEmpty()) {
          throw new ConfigException(name, o, "List must not contain empty entries");
        }
      }
    }

    @Override
    public String toString() {
      return "non-empty list";
    }
  }

  /**
   * Accepts a region-based zone id such as {@code Europe/Madrid} or an offset such as {@code UTC}.
   */
  public static class ValidZoneId implements Validator {

    @Override
    public void ensureValid(String name, Object o) {
      try {
        ZoneId.of((String) o);
      } catch (RuntimeException e) {
        throw new ConfigException(name, o, "Not a valid time zone id");
      }
    }

    @Override
    public String toString() {
      return "time zone id";
    }
  }

  /**
   * Accepts an empty string or an ISO-8601 local date.
   */
  public static class OptionalIsoDate implements Validator {

    @Override
    public void ensureValid(String name, Object o) {
      String s = (String) o;
      if (s == null || s.isEmpty()) {
        return;
      }
      try {
        LocalDate.parse(s);
      } catch (DateTimeParseException e) {
        throw new ConfigException(name, o, "Expected an ISO-8601 date (yyyy-MM-dd)");
      }
    }

    @Override
    public String toString() {
      return "empty or yyyy-MM-dd";
    }
  }

  public static class ConfigKey {
    protected final String _name;
    protected final Type _type;
    protected final String _documentation;
    protected final Object _defaultValue;
    protected final Validator _validator;
    protected final Importance _importance;

    public ConfigKey(String name, Type type, Object defaultValue, Validator validator, Importance importance,
                     String documentation) {
      _name = name;
      _type = type;
      _defaultValue = defaultValue;
      _validator = validator;
      _importance = importance;
      if (_validator != null && hasDefault()) {
        _validator.ensureValid(name, defaultValue);
      }
      _documentation = documentation;
    }

    public boolean hasDefault() {
      return !NO_DEFAULT_VALUE.equals(_defaultValue);
    }

    public String name() {
      return _name;
    }

    public Type type() {
      return _type;
    }

    public String documentation() {
      return _documentation;
    }

    public Object defaultValue() {
      return _defaultValue;
    }

    public Validator validator() {
      return _validator;
    }

    public Importance importance() {
      return _importance;
    }
  }
}
