/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoUnit;

import static com.linkedin.anomalysentinel.common.utils.Utils.validateNotNull;

/**
 * Utils class for Anomaly Sentinel
 */
public final class AnomalySentinelUtils {
  private static final DateTimeFormatter UTC_SECONDS_FORMATTER = new DateTimeFormatterBuilder().appendInstant(0).toFormatter();

  private AnomalySentinelUtils() {

  }

  /**
   * Ensure that the given String value of the given String key is not {@code null} or empty.
   *
   * @param key The key corresponding to the given String value.
   * @param value String value to be checked for being non-empty.
   */
  public static void ensureValidString(String key, String value) {
    validateNotNull(value, () -> key + " cannot be null");
    if (value.trim().isEmpty()) {
      throw new IllegalArgumentException(key + " cannot be empty");
    }
  }

  /**
   * Ensure that the given series is not {@code null} and contains only finite values.
   *
   * @param series The series to check.
   * @return The given series.
   */
  public static double[] ensureValidSeries(double[] series) {
    validateNotNull(series, "Series cannot be null.");
    for (int i = 0; i < series.length; i++) {
      if (!Double.isFinite(series[i])) {
        throw new IllegalArgumentException(String.format("Series value %f at index %d is not finite.", series[i], i));
      }
    }
    return series;
  }

  /**
   * @param timeMs Time in milliseconds.
   * @return The date for the given time in ISO 8601 format with date, hour, minute, and seconds.
   */
  public static String utcDateFor(long timeMs) {
    return UTC_SECONDS_FORMATTER.format(Instant.ofEpochMilli(timeMs).truncatedTo(ChronoUnit.SECONDS));
  }
}
