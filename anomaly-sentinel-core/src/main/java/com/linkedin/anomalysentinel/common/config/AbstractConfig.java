/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.anomalysentinel.common.config;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * A base class for configurations: parses the given values against a {@link ConfigDef} once, at construction, and
 * exposes typed getters over the result.
 */
public class AbstractConfig {

  public static final String NL = System.lineSeparator();

  private final Logger _log = LoggerFactory.getLogger(getClass());

  /* the parsed values of every defined key */
  private final Map<String, Object> _values;

  public AbstractConfig(ConfigDef definition, Map<?, ?> originals, boolean doLog) {
    for (Object key : originals.keySet()) {
      if (!(key instanceof String)) {
        throw new ConfigException(String.valueOf(key), originals.get(key), "Key must be a string.");
      }
    }
    _values = Collections.unmodifiableMap(definition.parse(originals));
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
    return _values.get(key);
  }

  public Integer getInt(String key) {
    return (Integer) get(key);
  }

  public Double getDouble(String key) {
    return (Double) get(key);
  }

  @SuppressWarnings("unchecked")
  public List<String> getList(String key) {
    return (List<String>) get(key);
  }

  private void logAll() {
    StringBuilder b = new StringBuilder();
    b.append(getClass().getSimpleName()).append(" values: ").append(NL);
    for (Map.Entry<String, Object> entry : new TreeMap<>(_values).entrySet()) {
      b.append('\t').append(entry.getKey()).append(" = ").append(entry.getValue()).append(NL);
    }
    _log.info(b.toString());
  }
}
