/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector.multidimensional;

import com.linkedin.anomalysentinel.common.utils.Utils;
import com.linkedin.anomalysentinel.detector.SeriesStatistics;
import com.linkedin.anomalysentinel.detector.statistical.StatisticalDetectors;
import com.linkedin.anomalysentinel.detector.statistical.ZScoreAnomaly;
import com.linkedin.anomalysentinel.detector.statistical.ZScoreResult;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.anomalysentinel.AnomalySentinelUtils.ensureValidSeries;
import static com.linkedin.anomalysentinel.AnomalySentinelUtils.ensureValidString;
import static com.linkedin.anomalysentinel.common.utils.Utils.validateNotNull;


/**
 * Runs z-score detection over several named metrics in lock-step and reports the indices that are anomalous in at
 * least {@value #MIN_METRICS_AFFECTED} metrics simultaneously.
 *
 * Series of different lengths are truncated to the shortest one, and the result carries a note saying so. Metrics are
 * reported in the iteration order of the given map; pass a {@link LinkedHashMap} to control it.
 */
public class MultiDimensionalAnalyzer {
  private static final Logger LOG = LoggerFactory.getLogger(MultiDimensionalAnalyzer.class);
  public static final double DEFAULT_THRESHOLD = 2.0;
  public static final int MIN_POINTS = 5;
  public static final int MIN_METRICS_AFFECTED = 2;
  public static final String INSUFFICIENT_DATA_NOTE = "Insufficient data";
  private final ExecutorService _executor;

  /**
   * Create an analyzer that runs the per-metric detection in the calling thread.
   */
  public MultiDimensionalAnalyzer() {
    this(null);
  }

  /**
   * @param executor Executor to run the per-metric detection on, one task per metric, or {@code null} to run it in the
   *                 calling thread. The analyzer does not shut it down.
   */
  public MultiDimensionalAnalyzer(ExecutorService executor) {
    _executor = executor;
  }

  /**
   * @param metrics Series by metric name.
   * @return Multi-series anomalies with the default threshold of {@value #DEFAULT_THRESHOLD}.
   * @see #detectMultiDimensional(Map, double)
   */
  public MultiDimensionalResult detectMultiDimensional(Map<String, double[]> metrics) {
    return detectMultiDimensional(metrics, DEFAULT_THRESHOLD);
  }

  /**
   * Detect the indices anomalous in at least two metrics. A multi-series anomaly is critical if at least half of the
   * metrics are anomalous at its index.
   *
   * @param metrics Series by metric name, at least {@value #MIN_POINTS} points each for an opinion.
   * @param threshold Non-negative z-score threshold applied to every metric.
   * @return Multi-series anomalies in ascending index order, with the per-metric z-score results.
   */
  public MultiDimensionalResult detectMultiDimensional(Map<String, double[]> metrics, double threshold) {
    SeriesStatistics.ensureNonNegative("threshold", threshold);
    validateNotNull(metrics, "Metrics cannot be null.");
    List<String> metricNames = new ArrayList<>(metrics.keySet());
    int length = Integer.MAX_VALUE;
    boolean lengthsDiffer = false;
    for (String metricName : metricNames) {
      ensureValidString("Metric name", metricName);
      double[] series = ensureValidSeries(metrics.get(metricName));
      if (length != Integer.MAX_VALUE && series.length != length) {
        lengthsDiffer = true;
      }
      length = Math.min(length, series.length);
    }
    if (metricNames.isEmpty() || length < MIN_POINTS) {
      LOG.trace("Skip multi-dimensional detection over {} metrics.", metricNames.size());
      return new MultiDimensionalResult(List.of(), Map.of(), metricNames, metricNames.isEmpty() ? 0 : length, threshold,
                                        INSUFFICIENT_DATA_NOTE);
    }
    String note = null;
    if (lengthsDiffer) {
      note = String.format("Series lengths differ; truncated to %d points", length);
      LOG.debug("Metrics {} have different lengths, truncated to {} points.", metricNames, length);
    }

    int numPoints = length;
    List<Callable<ZScoreResult>> tasks = new ArrayList<>(metricNames.size());
    for (String metricName : metricNames) {
      double[] series = metrics.get(metricName);
      double[] truncated = series.length == numPoints ? series : Arrays.copyOf(series, numPoints);
      tasks.add(() -> StatisticalDetectors.detectZScore(truncated, threshold));
    }
    List<ZScoreResult> results = Utils.runAll(tasks, _executor);

    Map<String, ZScoreResult> resultByMetric = new LinkedHashMap<>();
    List<Map<String, ZScoreAnomaly>> anomalyByMetricByIndex = new ArrayList<>(numPoints);
    for (int i = 0; i < numPoints; i++) {
      anomalyByMetricByIndex.add(new LinkedHashMap<>());
    }
    for (int m = 0; m < metricNames.size(); m++) {
      String metricName = metricNames.get(m);
      ZScoreResult result = results.get(m);
      resultByMetric.put(metricName, result);
      for (ZScoreAnomaly anomaly : result.anomalies()) {
        anomalyByMetricByIndex.get(anomaly.index()).put(metricName, anomaly);
      }
    }

    List<MultiSeriesAnomaly> anomalies = new ArrayList<>();
    for (int i = 0; i < numPoints; i++) {
      Map<String, ZScoreAnomaly> anomalyByMetric = anomalyByMetricByIndex.get(i);
      if (anomalyByMetric.size() >= MIN_METRICS_AFFECTED) {
        anomalies.add(new MultiSeriesAnomaly(i, metricNames.size(), anomalyByMetric));
      }
    }
    LOG.debug("Multi-dimensional detection over {} metrics and {} points found {} anomalies.", metricNames.size(), numPoints,
              anomalies.size());
    return new MultiDimensionalResult(anomalies, resultByMetric, metricNames, numPoints, threshold, note);
  }
}
