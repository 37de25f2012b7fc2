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


public class IqrResult extends DetectionResult<IqrAnomaly> {
  private static final String MULTIPLIER = "multiplier";
  private static final String BOUNDS = "bounds";
  private static final String LOWER = "lower";
  private static final String UPPER = "upper";
  private static final String QUARTILES = "quartiles";
  private static final String Q1 = "q1";
  private static final String Q3 = "q3";
  private static final String IQR = "iqr";
  private final double _multiplier;
  private final double _q1;
  private final double _q3;
  private final double _lowerBound;
  private final double _upperBound;

  IqrResult(List<IqrAnomaly> anomalies, String note, double multiplier, double q1, double q3, double lowerBound,
            double upperBound) {
    super(DetectionMethod.IQR, anomalies, note);
    _multiplier = multiplier;
    _q1 = q1;
    _q3 = q3;
    _lowerBound = lowerBound;
    _upperBound = upperBound;
  }

  static IqrResult insufficientData(double multiplier) {
    return new IqrResult(Collections.emptyList(), INSUFFICIENT_DATA_NOTE, multiplier, Double.NaN, Double.NaN, Double.NaN,
                         Double.NaN);
  }

  public double multiplier() {
    return _multiplier;
  }

  public double q1() {
    return _q1;
  }

  public double q3() {
    return _q3;
  }

  public double iqr() {
    return _q3 - _q1;
  }

  public double lowerBound() {
    return _lowerBound;
  }

  public double upperBound() {
    return _upperBound;
  }

  @Override
  protected void addSummary(Map<String, Object> jsonStructure) {
    jsonStructure.put(MULTIPLIER, _multiplier);
    if (!Double.isNaN(_q1)) {
      Map<String, Object> bounds = new HashMap<>(2);
      bounds.put(LOWER, _lowerBound);
      bounds.put(UPPER, _upperBound);
      jsonStructure.put(BOUNDS, bounds);
      Map<String, Object> quartiles = new HashMap<>(3);
      quartiles.put(Q1, _q1);
      quartiles.put(Q3, _q3);
      quartiles.put(IQR, iqr());
      jsonStructure.put(QUARTILES, quartiles);
    }
  }
}
