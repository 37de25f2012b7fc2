/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector.multidimensional;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.linkedin.anomalysentinel.detector.statistical.ZScoreResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;


public class MultiDimensionalResult {
  private static final String METHOD = "method";
  private static final String METHOD_ID = "multi-dimensional";
  private static final String ANOMALIES = "anomalies";
  private static final String PER_METRIC_RESULTS = "perMetricResults";
  private static final String METRICS_ANALYZED = "metricsAnalyzed";
  private static final String POINTS_ANALYZED = "pointsAnalyzed";
  private static final String THRESHOLD = "threshold";
  private static final String NOTE = "note";
  private final List<MultiSeriesAnomaly> _anomalies;
  private final Map<String, ZScoreResult> _resultByMetric;
  private final List<String> _metricsAnalyzed;
  private final int _pointsAnalyzed;
  private final double _threshold;
  private final String _note;

  MultiDimensionalResult(List<MultiSeriesAnomaly> anomalies,
                         Map<String, ZScoreResult> resultByMetric,
                         List<String> metricsAnalyzed,
                         int pointsAnalyzed,
                         double threshold,
                         String note) {
    _anomalies = Collections.unmodifiableList(new ArrayList<>(anomalies));
    _resultByMetric = Collections.unmodifiableMap(new LinkedHashMap<>(resultByMetric));
    _metricsAnalyzed = Collections.unmodifiableList(new ArrayList<>(metricsAnalyzed));
    _pointsAnalyzed = pointsAnalyzed;
    _threshold = threshold;
    _note = note;
  }

  /**
   * @return Indices anomalous in at least two metrics, in ascending index order.
   */
  public List<MultiSeriesAnomaly> anomalies() {
    return _anomalies;
  }

  /**
   * @return The z-score result of each metric, in metric order. Empty if the series were too short.
   */
  public Map<String, ZScoreResult> perMetricResults() {
    return _resultByMetric;
  }

  public List<String> metricsAnalyzed() {
    return _metricsAnalyzed;
  }

  /**
   * @return Number of leading points of each series that were analyzed.
   */
  public int pointsAnalyzed() {
    return _pointsAnalyzed;
  }

  public double threshold() {
    return _threshold;
  }

  /**
   * @return Explanation of insufficient data or truncated series, {@code null} otherwise.
   */
  public String note() {
    return _note;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> result = new HashMap<>();
    result.put(METHOD, METHOD_ID);
    result.put(ANOMALIES, _anomalies.stream().map(MultiSeriesAnomaly::getJsonStructure).collect(Collectors.toList()));
    Map<String, Object> perMetric = new LinkedHashMap<>();
    _resultByMetric.forEach((metric, zScoreResult) -> perMetric.put(metric, zScoreResult.getJsonStructure()));
    result.put(PER_METRIC_RESULTS, perMetric);
    result.put(METRICS_ANALYZED, _metricsAnalyzed);
    result.put(POINTS_ANALYZED, _pointsAnalyzed);
    result.put(THRESHOLD, _threshold);
    if (_note != null) {
      result.put(NOTE, _note);
    }
    return result;
  }

  /**
   * @return JSON representation of this result.
   */
  public String getJsonString() {
    Gson gson = new GsonBuilder().serializeNulls().serializeSpecialFloatingPointValues().create();
    return gson.toJson(getJsonStructure());
  }
}
