/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.metricalerts.common.config;

import com.linkedin.metricalerts.common.MetricAlertsConfigurable;
import com.linkedin.metricalerts.common.utils.Utils;
import com.linkedin.metricalerts.exception.MetricAlertsException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * A convenient base class for configurations to extend.
 * <p>
 * This class holds both the original configuration that was provided as well as the parsed
 */
public class AbstractConfig {

  public static final String NL = System.lineSeparator();

  private final Logger _log = LoggerFactory.getLogger(getClass());

  /* configs for which values have been requested, used to detect unused configs */
  private final Set<String> _used;

  /* the original values passed in by the user */
  private final Map<String, ?> _originals;

  /* the parsed values */
  private final Map<String, Object> _values;

  private final ConfigDef _definition;

  @SuppressWarnings("unchecked")
  public AbstractConfig(ConfigDef definition, Map<?, ?> originals, boolean doLog) {
    /* check that all the keys are really strings */
    for (Map.Entry<?, ?> entry : originals.entrySet()) {
      if (!(entry.getKey() instanceof String)) {
        throw new ConfigException(entry.getKey().toString(), entry.getValue(), "Key must be a string.");
      }
    }
    _originals = (Map<String, ?>) originals;
    _values = definition.parse(_originals);
    _used = Collections.synchronizedSet(new HashSet<>());
    _definition = definition;
    if (doLog) {
      logAll();
    }
  }

  public AbstractConfig(ConfigDef definition, Map<?, ?> originals) {
    this(definition, originals, true);
  }

  protected Object get(String key) {
    if (!_values.containsKey(key)) {
      throw new ConfigException(String.format("Unknown configuration '%s'", key));
    }
    _used.add(key);
    return _values.get(key);
  }

  public Integer getInt(String key) {
    return (Integer) get(key);
  }

  public Long getLong(String key) {
    return (Long) get(key);
  }

  public Double getDouble(String key) {
    return (Double) get(key);
  }

  @SuppressWarnings("unchecked")
  public List<String> getList(String key) {
    return (List<String>) get(key);
  }

  public String getString(String key) {
    return (String) get(key);
  }

  public Class<?> getClass(String key) {
    return (Class<?>) get(key);
  }

  /**
   * Get the type of the given key.
   *
   * @param key A config key to retrieve the type.
   * @return The type of the given key.
   */
  public ConfigDef.Type typeOf(String key) {
    ConfigDef.ConfigKey configKey = _definition.configKeys().get(key);
    if (configKey == null) {
      return null;
    }
    return configKey.type();
  }

  /**
   * @return Unused configs.
   */
  public Set<String> unused() {
    Set<String> keys = new HashSet<>(_originals.keySet());
    keys.removeAll(_used);
    return keys;
  }

  /**
   * @return Original configs.
   */
  public Map<String, Object> originals() {
    Map<String, Object> copy = new RecordingMap<>();
    copy.putAll(_originals);
    return copy;
  }

  /**
   * Original configs with every defined key overwritten by its parsed, non-null value, so that configured
   * instances observe defaults as well.
   *
   * @return Merged config values.
   */
  public Map<String, Object> mergedConfigValues() {
    Map<String, Object> conf = originals();
    _values.forEach((k, v) -> {
      if (v != null) {
        conf.put(k, v);
      }
    });
    return conf;
  }

  public Map<String, ?> values() {
    return new RecordingMap<>(_values);
  }

  private void logAll() {
    StringBuilder b = new StringBuilder();
    b.append(getClass().getSimpleName());
    b.append(" values: ");
    b.append(NL);

    for (Map.Entry<String, Object> entry : new TreeMap<>(_values).entrySet()) {
      b.append('\t');
      b.append(entry.getKey());
      b.append(" = ");
      b.append(entry.getValue());
      b.append(NL);
    }
    _log.info(b.toString());
  }

  /**
   * Log warnings for any unused configurations
   */
  public void logUnused() {
    for (String key : unused()) {
      _log.warn("The configuration '{}' was supplied but isn't a known config.", key);
    }
  }

  /**
   * Get a configured instance of the give class specified by the given configuration key. If the object implements
   * {@link MetricAlertsConfigurable} configure it using the merged configuration.
   *
   * @param key The configuration key for the class
   * @param t The interface the class should implement
   * @param <T> The type of the configured instance to be returned.
   * @return A configured instance of the class
   */
  public <T> T getConfiguredInstance(String key, Class<T> t) throws MetricAlertsException {
    Class<?> c = getClass(key);
    if (c == null) {
      return null;
    }
    Object o = Utils.newInstance(c);
    if (!t.isInstance(o)) {
      throw new MetricAlertsException(c.getName() + " is not an instance of " + t.getName());
    }
    if (o instanceof MetricAlertsConfigurable) {
      ((MetricAlertsConfigurable) o).configure(mergedConfigValues());
    }
    return t.cast(o);
  }

  /**
   * Get a list of configured instances of the given class specified by the given configuration key. The configuration
   * may specify either null or an empty string to indicate no configured instances. In both cases, this method
   * returns an empty list to indicate no configured instances.
   *
   * @param key The configuration key for the list of class names.
   * @param t The interface the class should implement.
   * @param <T> The type of the configured instances to be returned.
   * @return The list of configured instances.
   */
  public <T> List<T> getConfiguredInstances(String key, Class<T> t) throws MetricAlertsException {
    List<String> classNames = getList(key);
    List<T> objects = new ArrayList<>();
    if (classNames == null) {
      return objects;
    }
    Map<String, Object> configPairs = mergedConfigValues();
    for (String klass : classNames) {
      Object o;
      try {
        o = Utils.newInstance(Class.forName(klass, true, Utils.getContextOrMetricAlertsClassLoader()));
      } catch (ClassNotFoundException e) {
        throw new MetricAlertsException(klass + " cannot be found.", e);
      }
      if (!t.isInstance(o)) {
        throw new MetricAlertsException(klass + " is not an instance of " + t.getName());
      }
      if (o instanceof MetricAlertsConfigurable) {
        ((MetricAlertsConfigurable) o).configure(configPairs);
      }
      objects.add(t.cast(o));
    }
    return objects;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    AbstractConfig that = (AbstractConfig) o;

    return _originals.equals(that._originals);
  }

  @Override
  public int hashCode() {
    return _originals.hashCode();
  }

  /**
   * Marks keys retrieved via `get` as used, so that configured instances reading their settings from the map
   * handed to {@link MetricAlertsConfigurable#configure(Map)} do not show up as unused.
   */
  private class RecordingMap<V> extends HashMap<String, V> {

    RecordingMap() {
      super();
    }

    RecordingMap(Map<String, ? extends V> m) {
      super(m);
    }

    @Override
    public V get(Object key) {
      if (key instanceof String) {
        _used.add((String) key);
      }
      return super.get(key);
    }
  }
}
