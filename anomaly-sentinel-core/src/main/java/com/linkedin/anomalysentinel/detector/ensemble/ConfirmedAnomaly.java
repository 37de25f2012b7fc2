/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector.ensemble;

import com.linkedin.anomalysentinel.detector.DetectionMethod;
import com.linkedin.anomalysentinel.detector.Severity;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;


/**
 * A point flagged by at least {@value EnsembleCoordinator#MIN_VOTES} distinct detection methods. It is critical if any
 * of the methods flagged it critical.
 */
public class ConfirmedAnomaly {
  private static final String INDEX = "index";
  private static final String VALUE = "value";
  private static final String METHODS = "methods";
  private static final String SEVERITY = "severity";
  private final int _index;
  private final double _value;
  private final Set<DetectionMethod> _methods;
  private final Severity _severity;

  ConfirmedAnomaly(int index, double value, Set<DetectionMethod> methods, Severity severity) {
    if (methods.size() < EnsembleCoordinator.MIN_VOTES) {
      throw new IllegalArgumentException(String.format("Index %d is flagged by %s, at least %d methods are required.",
                                                       index, methods, EnsembleCoordinator.MIN_VOTES));
    }
    _index = index;
    _value = value;
    _methods = Collections.unmodifiableSet(EnumSet.copyOf(methods));
    _severity = severity;
  }

  public int index() {
    return _index;
  }

  public double value() {
    return _value;
  }

  /**
   * @return Methods that flagged this point, in {@link DetectionMethod} order.
   */
  public Set<DetectionMethod> methods() {
    return _methods;
  }

  public Severity severity() {
    return _severity;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> anomaly = new HashMap<>();
    anomaly.put(INDEX, _index);
    anomaly.put(VALUE, _value);
    anomaly.put(METHODS, _methods.stream().map(DetectionMethod::methodId).collect(Collectors.toList()));
    anomaly.put(SEVERITY, _severity.label());
    return anomaly;
  }

  @Override
  public String toString() {
    return String.format("ConfirmedAnomaly{index=%d, value=%f, methods=%s, severity=%s}", _index, _value, _methods,
                         _severity);
  }
}
