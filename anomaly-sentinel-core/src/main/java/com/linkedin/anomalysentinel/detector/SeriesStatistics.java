/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector;

import com.linkedin.anomalysentinel.common.config.ConfigException;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.regression.SimpleRegression;


/**
 * Population statistics over a range of a series. None of the methods modify the given array.
 */
public final class SeriesStatistics {

  private SeriesStatistics() {

  }

  /**
   * @param values Values.
   * @param begin Index of the first value.
   * @param length Number of values.
   * @return Arithmetic mean of the values in the range.
   */
  public static double mean(double[] values, int begin, int length) {
    return new Mean().evaluate(values, begin, length);
  }

  /**
   * @param values Values.
   * @param begin Index of the first value.
   * @param length Number of values.
   * @return Population (biased) standard deviation of the values in the range, 0 for a single value.
   */
  public static double populationStdDev(double[] values, int begin, int length) {
    return new StandardDeviation(false).evaluate(values, begin, length);
  }

  /**
   * Least-squares slope of the values in the range against their positions 0..length-1 within the range.
   *
   * @param values Values.
   * @param begin Index of the first value.
   * @param length Number of values.
   * @return The slope, 0 if the range has fewer than two values.
   */
  public static double slope(double[] values, int begin, int length) {
    SimpleRegression regression = new SimpleRegression();
    for (int i = 0; i < length; i++) {
      regression.addData(i, values[begin + i]);
    }
    double slope = regression.getSlope();
    return Double.isNaN(slope) ? 0.0 : slope;
  }

  /**
   * Fail fast on a negative or non-numeric detection parameter.
   *
   * @param name Name of the parameter.
   * @param value Value of the parameter.
   */
  public static void ensureNonNegative(String name, double value) {
    if (Double.isNaN(value) || value < 0.0) {
      throw new ConfigException(name, value, "Value must be at least 0.0");
    }
  }

  /**
   * Fail fast on a non-positive window size.
   *
   * @param name Name of the parameter.
   * @param value Value of the parameter.
   */
  public static void ensurePositive(String name, int value) {
    if (value < 1) {
      throw new ConfigException(name, value, "Value must be at least 1");
    }
  }
}
