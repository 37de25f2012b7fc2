/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector.isolation;

import com.linkedin.anomalysentinel.common.config.ConfigException;
import com.linkedin.anomalysentinel.detector.Severity;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.anomalysentinel.AnomalySentinelUtils.ensureValidSeries;


/**
 * Scores how isolated each point is by its mean absolute distance to every other point, and flags the most isolated
 * share of the series.
 *
 * This is a global average-distance heuristic in the spirit of an isolation forest, without random sub-sampling or
 * partition trees. It costs O(n^2) and is meant for batch diagnostics rather than hot paths.
 */
public final class IsolationDetector {
  private static final Logger LOG = LoggerFactory.getLogger(IsolationDetector.class);
  public static final double DEFAULT_CONTAMINATION = 0.1;
  public static final int MIN_ISOLATION_POINTS = 10;
  public static final String MIN_POINTS_NOTE = "Need at least " + MIN_ISOLATION_POINTS + " points";
  static final double CRITICAL_SCORE_FACTOR = 1.5;

  private IsolationDetector() {

  }

  /**
   * @param series Series to analyze.
   * @return The most isolated {@value #DEFAULT_CONTAMINATION} share of the series.
   * @see #detectIsolation(double[], double)
   */
  public static IsolationResult detectIsolation(double[] series) {
    return detectIsolation(series, DEFAULT_CONTAMINATION);
  }

  /**
   * Flag the {@code max(1, floor(n * contamination))} points with the highest isolation scores. Points with equal
   * scores keep their series order. A flagged point is critical if its score exceeds 1.5 times the score of the least
   * isolated flagged point.
   *
   * @param series Series to analyze, at least {@value #MIN_ISOLATION_POINTS} points for an opinion.
   * @param contamination Expected share of anomalous points, in (0, 1].
   * @return Isolation anomalies ordered by descending isolation score.
   */
  public static IsolationResult detectIsolation(double[] series, double contamination) {
    if (Double.isNaN(contamination) || contamination <= 0.0 || contamination > 1.0) {
      throw new ConfigException("contamination", contamination, "Value must be in (0.0, 1.0]");
    }
    ensureValidSeries(series);
    int n = series.length;
    if (n < MIN_ISOLATION_POINTS) {
      LOG.trace("Skip isolation detection over {} points.", n);
      return new IsolationResult(List.of(), MIN_POINTS_NOTE, contamination, Double.NaN);
    }

    double[] scores = isolationScores(series);
    List<Integer> byScore = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      byScore.add(i);
    }
    // List.sort is stable, so ties keep series order.
    byScore.sort(Comparator.comparingDouble((Integer i) -> scores[i]).reversed());

    int numAnomalies = Math.max(1, (int) Math.floor(n * contamination));
    double cutoffScore = scores[byScore.get(numAnomalies - 1)];
    List<IsolationAnomaly> anomalies = new ArrayList<>(numAnomalies);
    for (int rank = 0; rank < numAnomalies; rank++) {
      int index = byScore.get(rank);
      Severity severity = scores[index] > cutoffScore * CRITICAL_SCORE_FACTOR ? Severity.CRITICAL : Severity.WARNING;
      anomalies.add(new IsolationAnomaly(index, series[index], scores[index], severity));
    }
    LOG.debug("Isolation detection flagged {} of {} points (cutoff score: {}).", numAnomalies, n, cutoffScore);
    return new IsolationResult(anomalies, null, contamination, cutoffScore);
  }

  /**
   * Package private for unit test.
   * @param series Series with at least two points.
   * @return Mean absolute distance of each point to every other point.
   */
  static double[] isolationScores(double[] series) {
    int n = series.length;
    double[] scores = new double[n];
    for (int i = 0; i < n; i++) {
      double totalDistance = 0.0;
      for (int j = 0; j < n; j++) {
        if (j != i) {
          totalDistance += Math.abs(series[i] - series[j]);
        }
      }
      scores[i] = totalDistance / (n - 1);
    }
    return scores;
  }
}
