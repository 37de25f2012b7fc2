/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector.pattern;

import com.linkedin.anomalysentinel.detector.DetectionMethod;
import com.linkedin.anomalysentinel.detector.DetectionResult;
import java.util.List;
import java.util.Map;


public class TrendBreakResult extends DetectionResult<TrendBreakAnomaly> {
  private static final String WINDOW_SIZE = "windowSize";
  private static final String SENSITIVITY = "sensitivityThreshold";
  private final int _windowSize;
  private final double _sensitivity;

  TrendBreakResult(List<TrendBreakAnomaly> anomalies, String note, int windowSize, double sensitivity) {
    super(DetectionMethod.TREND_BREAK, anomalies, note);
    _windowSize = windowSize;
    _sensitivity = sensitivity;
  }

  public int windowSize() {
    return _windowSize;
  }

  public double sensitivity() {
    return _sensitivity;
  }

  @Override
  protected void addSummary(Map<String, Object> jsonStructure) {
    jsonStructure.put(WINDOW_SIZE, _windowSize);
    jsonStructure.put(SENSITIVITY, _sensitivity);
  }
}
