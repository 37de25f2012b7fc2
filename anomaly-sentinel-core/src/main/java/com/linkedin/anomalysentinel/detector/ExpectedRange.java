/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;


/**
 * The range of values a detector considered normal for a point.
 */
public final class ExpectedRange {
  private static final String LOW = "low";
  private static final String HIGH = "high";
  private final double _low;
  private final double _high;

  public ExpectedRange(double low, double high) {
    _low = low;
    _high = high;
  }

  public double low() {
    return _low;
  }

  public double high() {
    return _high;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> range = new HashMap<>(2);
    range.put(LOW, _low);
    range.put(HIGH, _high);
    return range;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ExpectedRange that = (ExpectedRange) o;
    return Double.compare(that._low, _low) == 0 && Double.compare(that._high, _high) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(_low, _high);
  }

  @Override
  public String toString() {
    return String.format("[%.3f, %.3f]", _low, _high);
  }
}
