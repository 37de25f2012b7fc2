/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector.pattern;

import com.linkedin.anomalysentinel.detector.DetectionMethod;
import com.linkedin.anomalysentinel.detector.Direction;
import com.linkedin.anomalysentinel.detector.PointAnomaly;
import com.linkedin.anomalysentinel.detector.Severity;
import java.util.Map;


public class TrendBreakAnomaly extends PointAnomaly {
  private static final String SLOPE_BEFORE = "slopeBefore";
  private static final String SLOPE_AFTER = "slopeAfter";
  private static final String SLOPE_CHANGE = "slopeChange";
  private static final String TYPE = "type";
  private final double _slopeBefore;
  private final double _slopeAfter;

  public TrendBreakAnomaly(int index, double value, double slopeBefore, double slopeAfter, Severity severity) {
    super(index, value, severity, slopeAfter > slopeBefore ? Direction.ACCELERATION : Direction.DECELERATION);
    _slopeBefore = slopeBefore;
    _slopeAfter = slopeAfter;
  }

  @Override
  public DetectionMethod method() {
    return DetectionMethod.TREND_BREAK;
  }

  public double slopeBefore() {
    return _slopeBefore;
  }

  public double slopeAfter() {
    return _slopeAfter;
  }

  public double slopeChange() {
    return Math.abs(_slopeAfter - _slopeBefore);
  }

  /**
   * @return {@link Direction#ACCELERATION} if the slope increased, {@link Direction#DECELERATION} otherwise.
   */
  public Direction type() {
    return direction();
  }

  @Override
  protected void addMethodFields(Map<String, Object> jsonStructure) {
    jsonStructure.put(SLOPE_BEFORE, _slopeBefore);
    jsonStructure.put(SLOPE_AFTER, _slopeAfter);
    jsonStructure.put(SLOPE_CHANGE, slopeChange());
    jsonStructure.put(TYPE, type().label());
  }
}
