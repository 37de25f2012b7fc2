/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector.statistical;

import com.linkedin.anomalysentinel.detector.DetectionMethod;
import com.linkedin.anomalysentinel.detector.Direction;
import com.linkedin.anomalysentinel.detector.PointAnomaly;
import com.linkedin.anomalysentinel.detector.Severity;
import java.util.Map;


public class ZScoreAnomaly extends PointAnomaly {
  private static final String Z_SCORE = "zScore";
  private final double _zScore;

  public ZScoreAnomaly(int index, double value, double zScore, Severity severity) {
    super(index, value, severity, zScore > 0 ? Direction.HIGH : Direction.LOW);
    _zScore = zScore;
  }

  @Override
  public DetectionMethod method() {
    return DetectionMethod.Z_SCORE;
  }

  /**
   * @return Signed number of standard deviations between the value and the series mean.
   */
  public double zScore() {
    return _zScore;
  }

  @Override
  protected void addMethodFields(Map<String, Object> jsonStructure) {
    jsonStructure.put(Z_SCORE, _zScore);
  }
}
