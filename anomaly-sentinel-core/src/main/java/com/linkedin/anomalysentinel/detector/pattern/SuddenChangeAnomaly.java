/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector.pattern;

import com.linkedin.anomalysentinel.detector.DetectionMethod;
import com.linkedin.anomalysentinel.detector.Direction;
import com.linkedin.anomalysentinel.detector.ExpectedRange;
import com.linkedin.anomalysentinel.detector.PointAnomaly;
import com.linkedin.anomalysentinel.detector.Severity;
import java.util.Map;


public class SuddenChangeAnomaly extends PointAnomaly {
  private static final String DEVIATION = "deviation";
  private static final String EXPECTED_RANGE = "expectedRange";
  private final double _deviation;
  private final ExpectedRange _expectedRange;

  public SuddenChangeAnomaly(int index, double value, double deviation, ExpectedRange expectedRange, Severity severity,
                             Direction direction) {
    super(index, value, severity, direction);
    _deviation = deviation;
    _expectedRange = expectedRange;
  }

  @Override
  public DetectionMethod method() {
    return DetectionMethod.SUDDEN_CHANGE;
  }

  /**
   * @return Distance to the trailing window mean in units of the trailing window standard deviation.
   */
  public double deviation() {
    return _deviation;
  }

  /**
   * @return One standard deviation around the trailing window mean.
   */
  @Override
  public ExpectedRange expectedRange() {
    return _expectedRange;
  }

  @Override
  protected void addMethodFields(Map<String, Object> jsonStructure) {
    jsonStructure.put(DEVIATION, _deviation);
    jsonStructure.put(EXPECTED_RANGE, _expectedRange.getJsonStructure());
  }
}
