/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector.statistical;

import com.linkedin.anomalysentinel.detector.DetectionMethod;
import com.linkedin.anomalysentinel.detector.DetectionResult;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;


public class ZScoreResult extends DetectionResult<ZScoreAnomaly> {
  private static final String THRESHOLD = "threshold";
  private static final String STATISTICS = "statistics";
  private static final String MEAN = "mean";
  private static final String STD_DEV = "stdDev";
  private static final String COUNT = "count";
  private final double _threshold;
  private final double _mean;
  private final double _stdDev;
  private final int _count;

  ZScoreResult(List<ZScoreAnomaly> anomalies, String note, double threshold, double mean, double stdDev, int count) {
    super(DetectionMethod.Z_SCORE, anomalies, note);
    _threshold = threshold;
    _mean = mean;
    _stdDev = stdDev;
    _count = count;
  }

  static ZScoreResult insufficientData(double threshold, int count) {
    return new ZScoreResult(Collections.emptyList(), INSUFFICIENT_DATA_NOTE, threshold, Double.NaN, Double.NaN, count);
  }

  public double threshold() {
    return _threshold;
  }

  /**
   * @return Population mean of the series, NaN if the series was too short.
   */
  public double mean() {
    return _mean;
  }

  /**
   * @return Population standard deviation of the series, NaN if the series was too short.
   */
  public double stdDev() {
    return _stdDev;
  }

  public int count() {
    return _count;
  }

  @Override
  protected void addSummary(Map<String, Object> jsonStructure) {
    jsonStructure.put(THRESHOLD, _threshold);
    if (!Double.isNaN(_mean)) {
      Map<String, Object> statistics = new HashMap<>(3);
      statistics.put(MEAN, _mean);
      statistics.put(STD_DEV, _stdDev);
      statistics.put(COUNT, _count);
      jsonStructure.put(STATISTICS, statistics);
    }
  }
}
