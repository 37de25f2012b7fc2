/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.alert;

import com.linkedin.anomalysentinel.detector.Severity;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import static com.linkedin.anomalysentinel.AnomalySentinelUtils.utcDateFor;


/**
 * The number of alerts of one metric and severity over a time window, with the first and last detection time.
 */
public final class AlertStatistics {
  private static final String METRIC_NAME = "metricName";
  private static final String SEVERITY = "severity";
  private static final String COUNT = "count";
  private static final String FIRST_SEEN = "firstSeen";
  private static final String LAST_SEEN = "lastSeen";
  private final String _metricName;
  private final Severity _severity;
  private final long _count;
  private final long _firstSeenMs;
  private final long _lastSeenMs;

  public AlertStatistics(String metricName, Severity severity, long count, long firstSeenMs, long lastSeenMs) {
    if (count <= 0) {
      throw new IllegalArgumentException("Alert count must be positive: " + count);
    }
    if (firstSeenMs > lastSeenMs) {
      throw new IllegalArgumentException(String.format("First seen time %d is after last seen time %d.", firstSeenMs,
                                                       lastSeenMs));
    }
    _metricName = metricName;
    _severity = severity;
    _count = count;
    _firstSeenMs = firstSeenMs;
    _lastSeenMs = lastSeenMs;
  }

  public String metricName() {
    return _metricName;
  }

  public Severity severity() {
    return _severity;
  }

  public long count() {
    return _count;
  }

  public long firstSeenMs() {
    return _firstSeenMs;
  }

  public long lastSeenMs() {
    return _lastSeenMs;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> statistics = new HashMap<>();
    statistics.put(METRIC_NAME, _metricName);
    statistics.put(SEVERITY, _severity.label());
    statistics.put(COUNT, _count);
    statistics.put(FIRST_SEEN, utcDateFor(_firstSeenMs));
    statistics.put(LAST_SEEN, utcDateFor(_lastSeenMs));
    return statistics;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    AlertStatistics that = (AlertStatistics) o;
    return _count == that._count
           && _firstSeenMs == that._firstSeenMs
           && _lastSeenMs == that._lastSeenMs
           && _metricName.equals(that._metricName)
           && _severity == that._severity;
  }

  @Override
  public int hashCode() {
    return Objects.hash(_metricName, _severity, _count, _firstSeenMs, _lastSeenMs);
  }

  @Override
  public String toString() {
    return String.format("{metric=%s, severity=%s, count=%d, firstSeen=%s, lastSeen=%s}", _metricName, _severity, _count,
                         utcDateFor(_firstSeenMs), utcDateFor(_lastSeenMs));
  }
}
