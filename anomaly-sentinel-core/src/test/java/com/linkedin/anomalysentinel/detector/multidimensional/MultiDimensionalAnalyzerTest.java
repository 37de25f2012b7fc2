/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector.multidimensional;

import com.linkedin.anomalysentinel.common.config.ConfigException;
import com.linkedin.anomalysentinel.common.utils.AnomalySentinelThreadFactory;
import com.linkedin.anomalysentinel.detector.Direction;
import com.linkedin.anomalysentinel.detector.Severity;
import com.linkedin.anomalysentinel.detector.statistical.StatisticalDetectors;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class MultiDimensionalAnalyzerTest {
  private static final String CPU = "cpu";
  private static final String LATENCY = "latency";
  private static final int NUM_POINTS = 12;

  /**
   * @param value Value of every point.
   * @param outlierIndex Index of the single outlier.
   * @param outlierValue Value of the outlier.
   * @return A series with a single outlier, whose |z| is sqrt(11) for 12 points.
   */
  private static double[] withOutlier(double value, int outlierIndex, double outlierValue) {
    double[] series = new double[NUM_POINTS];
    Arrays.fill(series, value);
    series[outlierIndex] = outlierValue;
    return series;
  }

  @Test
  public void testSharedOutlier() {
    Map<String, double[]> metrics = new LinkedHashMap<>();
    metrics.put(CPU, withOutlier(1, 11, 20));
    metrics.put(LATENCY, withOutlier(3, 11, -30));

    MultiDimensionalResult result = new MultiDimensionalAnalyzer().detectMultiDimensional(metrics);

    assertNull(result.note());
    assertEquals(Arrays.asList(CPU, LATENCY), result.metricsAnalyzed());
    assertEquals(NUM_POINTS, result.pointsAnalyzed());
    assertEquals(MultiDimensionalAnalyzer.DEFAULT_THRESHOLD, result.threshold(), 0.0);
    assertEquals(1, result.anomalies().size());
    MultiSeriesAnomaly anomaly = result.anomalies().get(0);
    assertEquals(11, anomaly.index());
    assertEquals(2, anomaly.metricsAffected());
    assertEquals(2, anomaly.totalMetrics());
    assertEquals(Severity.CRITICAL, anomaly.severity());
    assertEquals(Arrays.asList(CPU, LATENCY), List.copyOf(anomaly.details().keySet()));
    assertEquals(Direction.HIGH, anomaly.details().get(CPU).direction());
    assertEquals(Direction.LOW, anomaly.details().get(LATENCY).direction());
    assertEquals(1, result.perMetricResults().get(CPU).anomalies().size());
  }

  @Test
  public void testOutliersAtDifferentIndices() {
    Map<String, double[]> metrics = new LinkedHashMap<>();
    metrics.put(CPU, withOutlier(1, 2, 20));
    metrics.put(LATENCY, withOutlier(1, 7, 20));

    MultiDimensionalResult result = new MultiDimensionalAnalyzer().detectMultiDimensional(metrics);
    assertTrue(result.anomalies().isEmpty());
    assertEquals(2, result.perMetricResults().size());
  }

  @Test
  public void testWarningWhenLessThanHalfOfMetricsAffected() {
    Map<String, double[]> metrics = new LinkedHashMap<>();
    metrics.put("a", withOutlier(1, 5, 20));
    metrics.put("b", withOutlier(1, 5, 20));
    metrics.put("c", withOutlier(1, 9, 20));
    metrics.put("d", withOutlier(1, 0, 1));
    metrics.put("e", withOutlier(2, 0, 2));

    MultiDimensionalResult result = new MultiDimensionalAnalyzer().detectMultiDimensional(metrics);

    assertEquals(1, result.anomalies().size());
    MultiSeriesAnomaly anomaly = result.anomalies().get(0);
    assertEquals(5, anomaly.index());
    assertEquals(2, anomaly.metricsAffected());
    assertEquals(5, anomaly.totalMetrics());
    assertEquals(Severity.WARNING, anomaly.severity());
    assertEquals(StatisticalDetectors.NO_VARIANCE_NOTE, result.perMetricResults().get("d").note());
  }

  @Test
  public void testSeriesOfDifferentLengthsAreTruncated() {
    Map<String, double[]> metrics = new LinkedHashMap<>();
    metrics.put(CPU, withOutlier(1, 11, 20));
    double[] longer = Arrays.copyOf(withOutlier(3, 11, -30), NUM_POINTS + 3);
    metrics.put(LATENCY, longer);

    MultiDimensionalResult result = new MultiDimensionalAnalyzer().detectMultiDimensional(metrics);

    assertEquals("Series lengths differ; truncated to 12 points", result.note());
    assertEquals(NUM_POINTS, result.pointsAnalyzed());
    assertEquals(NUM_POINTS, result.perMetricResults().get(LATENCY).count());
    assertEquals(1, result.anomalies().size());
    assertEquals(NUM_POINTS + 3, longer.length);
  }

  @Test
  public void testInsufficientData() {
    Map<String, double[]> metrics = new LinkedHashMap<>();
    metrics.put(CPU, new double[]{1, 2, 3, 100});
    metrics.put(LATENCY, new double[]{1, 2, 3, 100});
    MultiDimensionalResult result = new MultiDimensionalAnalyzer().detectMultiDimensional(metrics);
    assertEquals(MultiDimensionalAnalyzer.INSUFFICIENT_DATA_NOTE, result.note());
    assertTrue(result.anomalies().isEmpty());
    assertTrue(result.perMetricResults().isEmpty());

    result = new MultiDimensionalAnalyzer().detectMultiDimensional(Collections.emptyMap());
    assertEquals(MultiDimensionalAnalyzer.INSUFFICIENT_DATA_NOTE, result.note());
    assertEquals(0, result.pointsAnalyzed());
  }

  @Test
  public void testSameResultOnExecutor() {
    Map<String, double[]> metrics = new LinkedHashMap<>();
    metrics.put("a", withOutlier(1, 5, 20));
    metrics.put("b", withOutlier(1, 5, 20));
    metrics.put("c", withOutlier(1, 9, 20));
    metrics.put("d", withOutlier(4, 9, -20));

    ExecutorService executor = Executors.newFixedThreadPool(3, new AnomalySentinelThreadFactory("MultiDimensionalAnalyzerTest"));
    try {
      MultiDimensionalResult sequential = new MultiDimensionalAnalyzer().detectMultiDimensional(metrics);
      MultiDimensionalResult parallel = new MultiDimensionalAnalyzer(executor).detectMultiDimensional(metrics);
      assertEquals(sequential.getJsonStructure(), parallel.getJsonStructure());
      assertEquals(2, parallel.anomalies().size());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  public void testInvalidInput() {
    MultiDimensionalAnalyzer analyzer = new MultiDimensionalAnalyzer();
    Map<String, double[]> metrics = new LinkedHashMap<>();
    metrics.put(CPU, withOutlier(1, 11, 20));
    assertThrows(ConfigException.class, () -> analyzer.detectMultiDimensional(metrics, -1.0));
    metrics.put(LATENCY, null);
    assertThrows(IllegalArgumentException.class, () -> analyzer.detectMultiDimensional(metrics));
    assertThrows(IllegalArgumentException.class, () -> analyzer.detectMultiDimensional(null));
  }

  @Test
  public void testJsonString() {
    Map<String, double[]> metrics = new LinkedHashMap<>();
    metrics.put(CPU, withOutlier(1, 11, 20));
    metrics.put(LATENCY, withOutlier(3, 11, -30));
    String json = new MultiDimensionalAnalyzer().detectMultiDimensional(metrics).getJsonString();
    assertTrue(json.contains("\"metricsAffected\":2"));
    assertTrue(json.contains("\"method\":\"multi-dimensional\""));
  }
}
