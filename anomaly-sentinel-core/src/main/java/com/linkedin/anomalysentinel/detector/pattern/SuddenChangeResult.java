/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector.pattern;

import com.linkedin.anomalysentinel.detector.DetectionMethod;
import com.linkedin.anomalysentinel.detector.DetectionResult;
import java.util.List;
import java.util.Map;


public class SuddenChangeResult extends DetectionResult<SuddenChangeAnomaly> {
  private static final String WINDOW_SIZE = "windowSize";
  private static final String THRESHOLD = "threshold";
  private final int _windowSize;
  private final double _threshold;

  SuddenChangeResult(List<SuddenChangeAnomaly> anomalies, String note, int windowSize, double threshold) {
    super(DetectionMethod.SUDDEN_CHANGE, anomalies, note);
    _windowSize = windowSize;
    _threshold = threshold;
  }

  public int windowSize() {
    return _windowSize;
  }

  public double threshold() {
    return _threshold;
  }

  @Override
  protected void addSummary(Map<String, Object> jsonStructure) {
    jsonStructure.put(WINDOW_SIZE, _windowSize);
    jsonStructure.put(THRESHOLD, _threshold);
  }
}
