/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector.multidimensional;

import com.linkedin.anomalysentinel.detector.Severity;
import com.linkedin.anomalysentinel.detector.statistical.ZScoreAnomaly;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;


/**
 * An index of a set of correlated series at which at least two of the series are anomalous simultaneously.
 */
public class MultiSeriesAnomaly {
  private static final String INDEX = "index";
  private static final String METRICS_AFFECTED = "metricsAffected";
  private static final String TOTAL_METRICS = "totalMetrics";
  private static final String SEVERITY = "severity";
  private static final String DETAILS = "details";
  private final int _index;
  private final int _totalMetrics;
  private final Severity _severity;
  private final Map<String, ZScoreAnomaly> _anomalyByMetric;

  MultiSeriesAnomaly(int index, int totalMetrics, Map<String, ZScoreAnomaly> anomalyByMetric) {
    if (anomalyByMetric.size() < MultiDimensionalAnalyzer.MIN_METRICS_AFFECTED) {
      throw new IllegalArgumentException(String.format("Index %d is anomalous in %d metrics, at least %d are required.",
                                                       index, anomalyByMetric.size(),
                                                       MultiDimensionalAnalyzer.MIN_METRICS_AFFECTED));
    }
    _index = index;
    _totalMetrics = totalMetrics;
    _anomalyByMetric = Collections.unmodifiableMap(new LinkedHashMap<>(anomalyByMetric));
    _severity = anomalyByMetric.size() >= totalMetrics / 2.0 ? Severity.CRITICAL : Severity.WARNING;
  }

  public int index() {
    return _index;
  }

  /**
   * @return Number of metrics anomalous at this index.
   */
  public int metricsAffected() {
    return _anomalyByMetric.size();
  }

  /**
   * @return Number of metrics analyzed.
   */
  public int totalMetrics() {
    return _totalMetrics;
  }

  /**
   * @return {@link Severity#CRITICAL} if at least half of the metrics are anomalous at this index.
   */
  public Severity severity() {
    return _severity;
  }

  /**
   * @return The z-score anomaly of each affected metric, in metric order.
   */
  public Map<String, ZScoreAnomaly> details() {
    return _anomalyByMetric;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> anomaly = new HashMap<>();
    anomaly.put(INDEX, _index);
    anomaly.put(METRICS_AFFECTED, metricsAffected());
    anomaly.put(TOTAL_METRICS, _totalMetrics);
    anomaly.put(SEVERITY, _severity.label());
    Map<String, Object> details = new LinkedHashMap<>();
    _anomalyByMetric.forEach((metric, detail) -> details.put(metric, detail.getJsonStructure()));
    anomaly.put(DETAILS, details);
    return anomaly;
  }

  @Override
  public String toString() {
    return String.format("MultiSeriesAnomaly{index=%d, metricsAffected=%d/%d, severity=%s, metrics=%s}", _index,
                         metricsAffected(), _totalMetrics, _severity, _anomalyByMetric.keySet());
  }
}
