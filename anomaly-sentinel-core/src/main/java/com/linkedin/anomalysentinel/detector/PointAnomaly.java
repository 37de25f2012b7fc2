/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector;

import java.util.HashMap;
import java.util.Map;

import static com.linkedin.anomalysentinel.common.utils.Utils.validateNotNull;


/**
 * A single point of a series flagged by one detection method. Subclasses carry the fields specific to their
 * {@link #method()}.
 */
public abstract class PointAnomaly {
  protected static final String INDEX = "index";
  protected static final String VALUE = "value";
  protected static final String SEVERITY = "severity";
  protected static final String DIRECTION = "direction";
  protected static final String METHOD = "method";
  private final int _index;
  private final double _value;
  private final Severity _severity;
  private final Direction _direction;

  protected PointAnomaly(int index, double value, Severity severity, Direction direction) {
    if (index < 0) {
      throw new IllegalArgumentException("Anomaly index cannot be negative: " + index);
    }
    _index = index;
    _value = value;
    _severity = validateNotNull(severity, "Anomaly severity cannot be null.");
    _direction = direction;
  }

  /**
   * @return The detection method that flagged this point.
   */
  public abstract DetectionMethod method();

  /**
   * @return Position of the point in the series.
   */
  public int index() {
    return _index;
  }

  /**
   * @return Value of the point.
   */
  public double value() {
    return _value;
  }

  public Severity severity() {
    return _severity;
  }

  /**
   * @return Direction of the deviation, or {@code null} if the method does not report one.
   */
  public Direction direction() {
    return _direction;
  }

  /**
   * @return The range of values the method considered normal for this point, or {@code null} if it reports none.
   */
  public ExpectedRange expectedRange() {
    return null;
  }

  /**
   * Add the method-specific fields to the given JSON structure.
   *
   * @param jsonStructure JSON structure to populate.
   */
  protected abstract void addMethodFields(Map<String, Object> jsonStructure);

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> anomaly = new HashMap<>();
    anomaly.put(INDEX, _index);
    anomaly.put(VALUE, _value);
    anomaly.put(SEVERITY, _severity.label());
    anomaly.put(METHOD, method().methodId());
    if (_direction != null) {
      anomaly.put(DIRECTION, _direction.label());
    }
    addMethodFields(anomaly);
    return anomaly;
  }

  @Override
  public String toString() {
    return String.format("%s{index=%d, value=%f, severity=%s, direction=%s}", getClass().getSimpleName(), _index, _value,
                         _severity, _direction);
  }
}
