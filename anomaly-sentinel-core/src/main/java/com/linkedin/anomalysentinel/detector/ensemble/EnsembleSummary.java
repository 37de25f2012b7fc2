/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector.ensemble;

import com.linkedin.anomalysentinel.detector.DetectionMethod;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;


public class EnsembleSummary {
  private static final String DATA_POINTS = "dataPoints";
  private static final String METHODS_USED = "methodsUsed";
  private static final String TOTAL_ANOMALIES_FOUND = "totalAnomaliesFound";
  private static final String CONFIRMED_ANOMALIES = "confirmedAnomalies";
  private static final String CRITICAL_ANOMALIES = "criticalAnomalies";
  private final int _dataPoints;
  private final List<DetectionMethod> _methodsUsed;
  private final int _totalAnomaliesFound;
  private final int _confirmedAnomalies;
  private final int _criticalAnomalies;

  EnsembleSummary(int dataPoints,
                  List<DetectionMethod> methodsUsed,
                  int totalAnomaliesFound,
                  int confirmedAnomalies,
                  int criticalAnomalies) {
    _dataPoints = dataPoints;
    _methodsUsed = Collections.unmodifiableList(new ArrayList<>(methodsUsed));
    _totalAnomaliesFound = totalAnomaliesFound;
    _confirmedAnomalies = confirmedAnomalies;
    _criticalAnomalies = criticalAnomalies;
  }

  public int dataPoints() {
    return _dataPoints;
  }

  public List<DetectionMethod> methodsUsed() {
    return _methodsUsed;
  }

  /**
   * @return Number of distinct indices flagged by at least one method.
   */
  public int totalAnomaliesFound() {
    return _totalAnomaliesFound;
  }

  public int confirmedAnomalies() {
    return _confirmedAnomalies;
  }

  /**
   * @return Number of confirmed anomalies with critical severity.
   */
  public int criticalAnomalies() {
    return _criticalAnomalies;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> summary = new HashMap<>();
    summary.put(DATA_POINTS, _dataPoints);
    summary.put(METHODS_USED, _methodsUsed.stream().map(DetectionMethod::optionName).collect(Collectors.toList()));
    summary.put(TOTAL_ANOMALIES_FOUND, _totalAnomaliesFound);
    summary.put(CONFIRMED_ANOMALIES, _confirmedAnomalies);
    summary.put(CRITICAL_ANOMALIES, _criticalAnomalies);
    return summary;
  }

  @Override
  public String toString() {
    return String.format("{dataPoints=%d, methodsUsed=%s, totalAnomaliesFound=%d, confirmedAnomalies=%d, "
                         + "criticalAnomalies=%d}", _dataPoints, _methodsUsed, _totalAnomaliesFound,
                         _confirmedAnomalies, _criticalAnomalies);
  }
}
