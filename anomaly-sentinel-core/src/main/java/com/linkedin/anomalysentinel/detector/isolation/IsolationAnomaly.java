/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector.isolation;

import com.linkedin.anomalysentinel.detector.DetectionMethod;
import com.linkedin.anomalysentinel.detector.PointAnomaly;
import com.linkedin.anomalysentinel.detector.Severity;
import java.util.Map;


public class IsolationAnomaly extends PointAnomaly {
  private static final String ISOLATION_SCORE = "isolationScore";
  private final double _isolationScore;

  public IsolationAnomaly(int index, double value, double isolationScore, Severity severity) {
    super(index, value, severity, null);
    _isolationScore = isolationScore;
  }

  @Override
  public DetectionMethod method() {
    return DetectionMethod.ISOLATION;
  }

  /**
   * @return Mean absolute distance between the value and every other value of the series.
   */
  public double isolationScore() {
    return _isolationScore;
  }

  @Override
  protected void addMethodFields(Map<String, Object> jsonStructure) {
    jsonStructure.put(ISOLATION_SCORE, _isolationScore);
  }
}
