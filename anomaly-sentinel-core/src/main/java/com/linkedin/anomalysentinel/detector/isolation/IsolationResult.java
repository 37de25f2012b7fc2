/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector.isolation;

import com.linkedin.anomalysentinel.detector.DetectionMethod;
import com.linkedin.anomalysentinel.detector.DetectionResult;
import java.util.List;
import java.util.Map;


public class IsolationResult extends DetectionResult<IsolationAnomaly> {
  private static final String CONTAMINATION = "contamination";
  private static final String THRESHOLD = "threshold";
  private final double _contamination;
  private final double _cutoffScore;

  IsolationResult(List<IsolationAnomaly> anomalies, String note, double contamination, double cutoffScore) {
    super(DetectionMethod.ISOLATION, anomalies, note);
    _contamination = contamination;
    _cutoffScore = cutoffScore;
  }

  public double contamination() {
    return _contamination;
  }

  /**
   * @return Isolation score of the least isolated flagged point, NaN if the series was too short.
   */
  public double cutoffScore() {
    return _cutoffScore;
  }

  @Override
  protected void addSummary(Map<String, Object> jsonStructure) {
    jsonStructure.put(CONTAMINATION, _contamination);
    if (!Double.isNaN(_cutoffScore)) {
      jsonStructure.put(THRESHOLD, _cutoffScore);
    }
  }
}
