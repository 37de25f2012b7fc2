/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector.pattern;

import com.linkedin.anomalysentinel.detector.DetectionResult;
import com.linkedin.anomalysentinel.detector.Direction;
import com.linkedin.anomalysentinel.detector.ExpectedRange;
import com.linkedin.anomalysentinel.detector.SeriesStatistics;
import com.linkedin.anomalysentinel.detector.Severity;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.anomalysentinel.AnomalySentinelUtils.ensureValidSeries;


/**
 * Detectors that compare each point against the windows of the series around it.
 */
public final class PatternDetectors {
  private static final Logger LOG = LoggerFactory.getLogger(PatternDetectors.class);
  public static final int DEFAULT_SUDDEN_CHANGE_WINDOW_SIZE = 5;
  public static final double DEFAULT_SUDDEN_CHANGE_THRESHOLD = 2.0;
  public static final int DEFAULT_TREND_BREAK_WINDOW_SIZE = 10;
  public static final double DEFAULT_TREND_BREAK_SENSITIVITY = 0.5;
  static final double CRITICAL_SUDDEN_CHANGE_FACTOR = 1.5;
  static final double CRITICAL_TREND_BREAK_FACTOR = 2.0;

  private PatternDetectors() {

  }

  /**
   * @param series Series to analyze.
   * @return Sudden changes with a window of {@value #DEFAULT_SUDDEN_CHANGE_WINDOW_SIZE} points and a threshold of
   * {@value #DEFAULT_SUDDEN_CHANGE_THRESHOLD}.
   * @see #detectSuddenChanges(double[], int, double)
   */
  public static SuddenChangeResult detectSuddenChanges(double[] series) {
    return detectSuddenChanges(series, DEFAULT_SUDDEN_CHANGE_WINDOW_SIZE, DEFAULT_SUDDEN_CHANGE_THRESHOLD);
  }

  /**
   * Compare every point from index {@code windowSize} on against the mean and population standard deviation of the
   * {@code windowSize} points right before it. Only past points are used, so a point's verdict never changes as the
   * series grows.
   *
   * A point is flagged if it lies more than {@code threshold} window standard deviations from the window mean, and is
   * critical beyond 1.5 times the threshold. A flat window has a deviation of 0, which is never flagged.
   *
   * @param series Series to analyze, at least {@code 2 * windowSize} points for an opinion.
   * @param windowSize Number of trailing points forming the baseline, at least 1.
   * @param threshold Non-negative deviation threshold.
   * @return Sudden changes in ascending index order.
   */
  public static SuddenChangeResult detectSuddenChanges(double[] series, int windowSize, double threshold) {
    SeriesStatistics.ensurePositive("windowSize", windowSize);
    SeriesStatistics.ensureNonNegative("threshold", threshold);
    ensureValidSeries(series);
    int n = series.length;
    if (n < 2L * windowSize) {
      LOG.trace("Skip sudden change detection over {} points with window size {}.", n, windowSize);
      return new SuddenChangeResult(List.of(), DetectionResult.INSUFFICIENT_DATA_NOTE, windowSize, threshold);
    }

    List<SuddenChangeAnomaly> anomalies = new ArrayList<>();
    for (int i = windowSize; i < n; i++) {
      double windowMean = SeriesStatistics.mean(series, i - windowSize, windowSize);
      double windowStdDev = SeriesStatistics.populationStdDev(series, i - windowSize, windowSize);
      double current = series[i];
      double deviation = windowStdDev > 0.0 ? Math.abs(current - windowMean) / windowStdDev : 0.0;
      if (deviation > threshold) {
        Severity severity = deviation > threshold * CRITICAL_SUDDEN_CHANGE_FACTOR ? Severity.CRITICAL : Severity.WARNING;
        ExpectedRange expectedRange = new ExpectedRange(windowMean - windowStdDev, windowMean + windowStdDev);
        anomalies.add(new SuddenChangeAnomaly(i, current, deviation, expectedRange, severity,
                                              current > windowMean ? Direction.SPIKE : Direction.DROP));
      }
    }
    LOG.debug("Sudden change detection flagged {} of {} points.", anomalies.size(), n);
    return new SuddenChangeResult(anomalies, null, windowSize, threshold);
  }

  /**
   * @param series Series to analyze.
   * @return Trend breaks with a window of {@value #DEFAULT_TREND_BREAK_WINDOW_SIZE} points and a sensitivity of
   * {@value #DEFAULT_TREND_BREAK_SENSITIVITY}.
   * @see #detectTrendBreaks(double[], int, double)
   */
  public static TrendBreakResult detectTrendBreaks(double[] series) {
    return detectTrendBreaks(series, DEFAULT_TREND_BREAK_WINDOW_SIZE, DEFAULT_TREND_BREAK_SENSITIVITY);
  }

  /**
   * For every interior index {@code i} with {@code windowSize <= i < n - windowSize}, compare the least-squares slope
   * of the {@code windowSize} points before {@code i} with the slope of the {@code windowSize} points starting at
   * {@code i}. A point is flagged if the absolute slope change exceeds the sensitivity, and is critical beyond twice
   * the sensitivity.
   *
   * @param series Series to analyze, at least {@code 3 * windowSize} points for an opinion.
   * @param windowSize Number of points on each side of a candidate break, at least 1.
   * @param sensitivity Non-negative minimum slope change.
   * @return Trend breaks in ascending index order.
   */
  public static TrendBreakResult detectTrendBreaks(double[] series, int windowSize, double sensitivity) {
    SeriesStatistics.ensurePositive("windowSize", windowSize);
    SeriesStatistics.ensureNonNegative("sensitivity", sensitivity);
    ensureValidSeries(series);
    int n = series.length;
    if (n < 3L * windowSize) {
      LOG.trace("Skip trend break detection over {} points with window size {}.", n, windowSize);
      return new TrendBreakResult(List.of(), DetectionResult.INSUFFICIENT_DATA_NOTE, windowSize, sensitivity);
    }

    List<TrendBreakAnomaly> anomalies = new ArrayList<>();
    for (int i = windowSize; i < n - windowSize; i++) {
      double slopeBefore = SeriesStatistics.slope(series, i - windowSize, windowSize);
      double slopeAfter = SeriesStatistics.slope(series, i, windowSize);
      double slopeChange = Math.abs(slopeAfter - slopeBefore);
      if (slopeChange > sensitivity) {
        Severity severity = slopeChange > sensitivity * CRITICAL_TREND_BREAK_FACTOR ? Severity.CRITICAL : Severity.WARNING;
        anomalies.add(new TrendBreakAnomaly(i, series[i], slopeBefore, slopeAfter, severity));
      }
    }
    LOG.debug("Trend break detection flagged {} of {} points.", anomalies.size(), n);
    return new TrendBreakResult(anomalies, null, windowSize, sensitivity);
  }
}
