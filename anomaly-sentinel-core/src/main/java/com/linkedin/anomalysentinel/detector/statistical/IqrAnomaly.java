/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector.statistical;

import com.linkedin.anomalysentinel.detector.DetectionMethod;
import com.linkedin.anomalysentinel.detector.Direction;
import com.linkedin.anomalysentinel.detector.PointAnomaly;
import com.linkedin.anomalysentinel.detector.Severity;
import java.util.Map;


public class IqrAnomaly extends PointAnomaly {
  private static final String DEVIATION = "deviation";
  private final double _deviation;

  public IqrAnomaly(int index, double value, double deviation, Severity severity, Direction direction) {
    super(index, value, severity, direction);
    _deviation = deviation;
  }

  @Override
  public DetectionMethod method() {
    return DetectionMethod.IQR;
  }

  /**
   * @return Distance to the crossed bound in units of IQR, 0 if the IQR is 0.
   */
  public double deviation() {
    return _deviation;
  }

  @Override
  protected void addMethodFields(Map<String, Object> jsonStructure) {
    jsonStructure.put(DEVIATION, _deviation);
  }
}
