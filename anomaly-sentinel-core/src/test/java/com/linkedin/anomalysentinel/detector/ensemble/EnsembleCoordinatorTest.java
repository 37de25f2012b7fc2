/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector.ensemble;

import com.linkedin.anomalysentinel.common.config.ConfigException;
import com.linkedin.anomalysentinel.common.utils.AnomalySentinelThreadFactory;
import com.linkedin.anomalysentinel.detector.DetectionMethod;
import com.linkedin.anomalysentinel.detector.DetectionOptions;
import com.linkedin.anomalysentinel.detector.Severity;
import com.linkedin.anomalysentinel.detector.pattern.SuddenChangeResult;
import com.linkedin.anomalysentinel.detector.pattern.TrendBreakResult;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.Test;

import static com.linkedin.anomalysentinel.detector.DetectionMethod.IQR;
import static com.linkedin.anomalysentinel.detector.DetectionMethod.ISOLATION;
import static com.linkedin.anomalysentinel.detector.DetectionMethod.SUDDEN_CHANGE;
import static com.linkedin.anomalysentinel.detector.DetectionMethod.TREND_BREAK;
import static com.linkedin.anomalysentinel.detector.DetectionMethod.Z_SCORE;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class EnsembleCoordinatorTest {
  private static final double DELTA = 1E-6;
  private static final double[] RAMP_WITH_OUTLIER = {1, 2, 3, 4, 5, 6, 7, 8, 9, 50};

  /**
   * @return 20 points alternating between 10 and 11, with a moderate spike at 7 and a large one at 15.
   */
  private static double[] twoSpikes() {
    double[] data = new double[20];
    for (int i = 0; i < data.length; i++) {
      data[i] = i % 2 == 0 ? 10 : 11;
    }
    data[7] = 25;
    data[15] = 40;
    return data;
  }

  @Test
  public void testDefaultMethods() {
    EnsembleResult result = new EnsembleCoordinator().detectAll(RAMP_WITH_OUTLIER);

    assertEquals(Arrays.asList(Z_SCORE, IQR, SUDDEN_CHANGE), List.copyOf(result.methodResults().keySet()));
    assertNull(result.methodResult(TREND_BREAK));
    // Every point of the ramp after the first window is 2.12 window stdDevs above the window mean.
    assertEquals(5, result.methodResult(SUDDEN_CHANGE).anomalies().size());

    assertEquals(1, result.confirmedAnomalies().size());
    ConfirmedAnomaly anomaly = result.confirmedAnomalies().get(0);
    assertEquals(9, anomaly.index());
    assertEquals(50.0, anomaly.value(), DELTA);
    assertEquals(EnumSet.of(Z_SCORE, IQR, SUDDEN_CHANGE), anomaly.methods());
    assertEquals(Severity.CRITICAL, anomaly.severity());

    EnsembleSummary summary = result.summary();
    assertEquals(10, summary.dataPoints());
    assertEquals(Arrays.asList(Z_SCORE, IQR, SUDDEN_CHANGE), summary.methodsUsed());
    assertEquals(5, summary.totalAnomaliesFound());
    assertEquals(1, summary.confirmedAnomalies());
    assertEquals(1, summary.criticalAnomalies());
  }

  @Test
  public void testSingleVoteIsNotConfirmed() {
    // Only sudden change flags points of a plain ramp.
    double[] ramp = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10};
    EnsembleResult result = new EnsembleCoordinator().detectAll(ramp);

    assertTrue(result.methodResult(Z_SCORE).isEmpty());
    assertTrue(result.methodResult(IQR).isEmpty());
    assertEquals(5, result.summary().totalAnomaliesFound());
    assertTrue(result.confirmedAnomalies().isEmpty());
    assertEquals(0, result.summary().criticalAnomalies());
  }

  @Test
  public void testTwoVotesAreConfirmedWithPromotedSeverity() {
    EnsembleResult result = new EnsembleCoordinator().detectAll(RAMP_WITH_OUTLIER, Map.of(DetectionOptions.METHODS_CONFIG,
                                                                                          "zscore,iqr"));

    assertEquals(1, result.confirmedAnomalies().size());
    ConfirmedAnomaly anomaly = result.confirmedAnomalies().get(0);
    assertEquals(EnumSet.of(Z_SCORE, IQR), anomaly.methods());
    // Z-score alone flags the point as a warning.
    assertEquals(Severity.WARNING, result.methodResult(Z_SCORE).anomalies().get(0).severity());
    assertEquals(Severity.CRITICAL, anomaly.severity());
  }

  @Test
  public void testMostVotedFirst() {
    EnsembleResult result = new EnsembleCoordinator().detectAll(twoSpikes());

    List<ConfirmedAnomaly> confirmed = result.confirmedAnomalies();
    assertEquals(2, confirmed.size());
    assertEquals(15, confirmed.get(0).index());
    assertEquals(EnumSet.of(Z_SCORE, IQR, SUDDEN_CHANGE), confirmed.get(0).methods());
    assertEquals(7, confirmed.get(1).index());
    assertEquals(EnumSet.of(IQR, SUDDEN_CHANGE), confirmed.get(1).methods());
    assertEquals(2, result.summary().totalAnomaliesFound());
    assertEquals(2, result.summary().criticalAnomalies());
  }

  @Test
  public void testAddingMethodsNeverRemovesConfirmedAnomalies() {
    double[] data = twoSpikes();
    EnsembleResult fewer = new EnsembleCoordinator().detectAll(data, Map.of(DetectionOptions.METHODS_CONFIG, "iqr,zscore"));
    EnsembleResult more = new EnsembleCoordinator().detectAll(data, Map.of(DetectionOptions.METHODS_CONFIG,
                                                                          "iqr,zscore,sudden-change,isolation"));
    assertEquals(1, fewer.confirmedAnomalies().size());
    for (ConfirmedAnomaly anomaly : fewer.confirmedAnomalies()) {
      assertTrue(more.confirmedAnomalies().stream().anyMatch(a -> a.index() == anomaly.index()
                                                                  && a.methods().containsAll(anomaly.methods())));
    }
    assertNotNull(more.methodResult(ISOLATION));
  }

  @Test
  public void testDuplicatedMethodsCountOnce() {
    EnsembleResult result = new EnsembleCoordinator().detectAll(RAMP_WITH_OUTLIER,
                                                                Map.of(DetectionOptions.METHODS_CONFIG, "IQR, zscore, iqr"));
    assertEquals(Arrays.asList(IQR, Z_SCORE), result.summary().methodsUsed());
    assertEquals(Arrays.asList(Z_SCORE, IQR), List.copyOf(result.methodResults().keySet()));
    assertEquals(2, result.confirmedAnomalies().get(0).methods().size());
  }

  @Test
  public void testOptionsReachDetectors() {
    double[] data = new double[30];
    for (int i = 0; i < data.length; i++) {
      data[i] = i < 15 ? 0 : 3 * (i - 15);
    }
    EnsembleResult result = new EnsembleCoordinator().detectAll(data, Map.of(DetectionOptions.METHODS_CONFIG,
                                                                            "trend-break,sudden-change",
                                                                            DetectionOptions.WINDOW_SIZE_CONFIG, 3,
                                                                            DetectionOptions.THRESHOLD_CONFIG, "1.0",
                                                                            "unknown.option", true));
    assertEquals(3, ((TrendBreakResult) result.methodResult(TREND_BREAK)).windowSize());
    assertEquals(1.0, ((SuddenChangeResult) result.methodResult(SUDDEN_CHANGE)).threshold(), DELTA);
    assertTrue(result.methodResult(TREND_BREAK).anomalies().stream().anyMatch(a -> a.index() == 15));
  }

  @Test
  public void testSameResultOnExecutor() {
    ExecutorService executor = Executors.newFixedThreadPool(3, new AnomalySentinelThreadFactory("EnsembleCoordinatorTest"));
    try {
      DetectionOptions options = new DetectionOptions(Map.of(DetectionOptions.METHODS_CONFIG,
                                                             String.join(",", DetectionMethod.optionNames())));
      for (double[] data : List.of(RAMP_WITH_OUTLIER, twoSpikes())) {
        EnsembleResult sequential = new EnsembleCoordinator().detectAll(data, options);
        EnsembleResult parallel = new EnsembleCoordinator(executor).detectAll(data, options);
        assertEquals(sequential.getJsonStructure(), parallel.getJsonStructure());
        assertEquals(sequential.getJsonString(), parallel.getJsonString());
      }
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  public void testInvalidOptions() {
    EnsembleCoordinator coordinator = new EnsembleCoordinator();
    assertThrows(ConfigException.class,
                 () -> coordinator.detectAll(RAMP_WITH_OUTLIER, Map.of(DetectionOptions.METHODS_CONFIG, "zscore,lstm")));
    assertThrows(ConfigException.class,
                 () -> coordinator.detectAll(RAMP_WITH_OUTLIER, Map.of(DetectionOptions.THRESHOLD_CONFIG, -1.0)));
    assertThrows(ConfigException.class,
                 () -> coordinator.detectAll(RAMP_WITH_OUTLIER, Map.of(DetectionOptions.CONTAMINATION_CONFIG, 0.0)));
    assertThrows(IllegalArgumentException.class, () -> coordinator.detectAll(null));
  }

  @Test
  public void testJsonStructure() {
    Map<String, Object> json = new EnsembleCoordinator().detectAll(RAMP_WITH_OUTLIER).getJsonStructure();
    @SuppressWarnings("unchecked")
    Map<String, Object> summary = (Map<String, Object>) json.get("summary");
    assertEquals(Arrays.asList("zscore", "iqr", "sudden-change"), summary.get("methodsUsed"));
    assertEquals(1, summary.get("confirmedAnomalies"));
    @SuppressWarnings("unchecked")
    Map<String, Object> methodResults = (Map<String, Object>) json.get("methodResults");
    assertEquals(3, methodResults.size());
  }
}
