/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector.statistical;

import com.linkedin.anomalysentinel.detector.Direction;
import com.linkedin.anomalysentinel.detector.SeriesStatistics;
import com.linkedin.anomalysentinel.detector.Severity;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.anomalysentinel.AnomalySentinelUtils.ensureValidSeries;


/**
 * Outlier detectors over the distribution of a whole series, ignoring the order of its points.
 */
public final class StatisticalDetectors {
  private static final Logger LOG = LoggerFactory.getLogger(StatisticalDetectors.class);
  public static final double DEFAULT_Z_SCORE_THRESHOLD = 2.5;
  public static final double DEFAULT_IQR_MULTIPLIER = 1.5;
  public static final int MIN_Z_SCORE_POINTS = 3;
  public static final int MIN_IQR_POINTS = 4;
  public static final String NO_VARIANCE_NOTE = "No variance in data";
  public static final String ZERO_IQR_NOTE = "Zero interquartile range";
  static final double CRITICAL_Z_SCORE_FACTOR = 1.5;
  static final double CRITICAL_IQR_DEVIATION = 2.0;

  private StatisticalDetectors() {

  }

  /**
   * @param series Series to analyze.
   * @return Z-score anomalies with the default threshold of {@value #DEFAULT_Z_SCORE_THRESHOLD}.
   * @see #detectZScore(double[], double)
   */
  public static ZScoreResult detectZScore(double[] series) {
    return detectZScore(series, DEFAULT_Z_SCORE_THRESHOLD);
  }

  /**
   * Flag the points whose distance to the population mean exceeds the given number of population standard deviations.
   * A point is critical if its |z| exceeds 1.5 times the threshold.
   *
   * @param series Series to analyze, at least {@value #MIN_Z_SCORE_POINTS} points for an opinion.
   * @param threshold Non-negative z-score threshold.
   * @return Z-score anomalies in ascending index order.
   */
  public static ZScoreResult detectZScore(double[] series, double threshold) {
    SeriesStatistics.ensureNonNegative("threshold", threshold);
    ensureValidSeries(series);
    int n = series.length;
    if (n < MIN_Z_SCORE_POINTS) {
      LOG.trace("Skip z-score detection over {} points.", n);
      return ZScoreResult.insufficientData(threshold, n);
    }

    double mean = SeriesStatistics.mean(series, 0, n);
    double stdDev = SeriesStatistics.populationStdDev(series, 0, n);
    if (stdDev == 0.0) {
      return new ZScoreResult(List.of(), NO_VARIANCE_NOTE, threshold, mean, stdDev, n);
    }

    List<ZScoreAnomaly> anomalies = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      double zScore = (series[i] - mean) / stdDev;
      double absZScore = Math.abs(zScore);
      if (absZScore > threshold) {
        Severity severity = absZScore > threshold * CRITICAL_Z_SCORE_FACTOR ? Severity.CRITICAL : Severity.WARNING;
        anomalies.add(new ZScoreAnomaly(i, series[i], zScore, severity));
      }
    }
    LOG.debug("Z-score detection flagged {} of {} points (mean: {}, stdDev: {}).", anomalies.size(), n, mean, stdDev);
    return new ZScoreResult(anomalies, null, threshold, mean, stdDev, n);
  }

  /**
   * @param series Series to analyze.
   * @return IQR anomalies with the default multiplier of {@value #DEFAULT_IQR_MULTIPLIER}.
   * @see #detectIqr(double[], double)
   */
  public static IqrResult detectIqr(double[] series) {
    return detectIqr(series, DEFAULT_IQR_MULTIPLIER);
  }

  /**
   * Flag the points outside {@code [Q1 - multiplier * IQR, Q3 + multiplier * IQR]}. Quartiles use the nearest rank of a
   * sorted copy: Q1 is the value at {@code floor(0.25 * n)} and Q3 the value at {@code floor(0.75 * n)}.
   *
   * A point is critical if its distance to the crossed bound exceeds 2 IQRs. If the IQR is 0, every point outside the
   * collapsed bounds is critical and reported with a deviation of 0.
   *
   * @param series Series to analyze, at least {@value #MIN_IQR_POINTS} points for an opinion.
   * @param multiplier Non-negative IQR multiplier.
   * @return IQR anomalies in ascending index order.
   */
  public static IqrResult detectIqr(double[] series, double multiplier) {
    SeriesStatistics.ensureNonNegative("multiplier", multiplier);
    ensureValidSeries(series);
    int n = series.length;
    if (n < MIN_IQR_POINTS) {
      LOG.trace("Skip IQR detection over {} points.", n);
      return IqrResult.insufficientData(multiplier);
    }

    double[] sorted = Arrays.copyOf(series, n);
    Arrays.sort(sorted);
    double q1 = sorted[(int) Math.floor(n * 0.25)];
    double q3 = sorted[(int) Math.floor(n * 0.75)];
    double iqr = q3 - q1;
    double lowerBound = q1 - multiplier * iqr;
    double upperBound = q3 + multiplier * iqr;

    List<IqrAnomaly> anomalies = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      double value = series[i];
      if (value < lowerBound || value > upperBound) {
        boolean low = value < lowerBound;
        double deviation;
        Severity severity;
        if (iqr == 0.0) {
          deviation = 0.0;
          severity = Severity.CRITICAL;
        } else {
          deviation = (low ? lowerBound - value : value - upperBound) / iqr;
          severity = deviation > CRITICAL_IQR_DEVIATION ? Severity.CRITICAL : Severity.WARNING;
        }
        anomalies.add(new IqrAnomaly(i, value, deviation, severity, low ? Direction.LOW : Direction.HIGH));
      }
    }
    LOG.debug("IQR detection flagged {} of {} points (bounds: [{}, {}]).", anomalies.size(), n, lowerBound, upperBound);
    return new IqrResult(anomalies, iqr == 0.0 ? ZERO_IQR_NOTE : null, multiplier, q1, q3, lowerBound, upperBound);
  }
}
