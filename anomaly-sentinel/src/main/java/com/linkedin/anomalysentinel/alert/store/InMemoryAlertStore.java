/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.alert.store;

import com.linkedin.anomalysentinel.alert.Alert;
import com.linkedin.anomalysentinel.alert.AlertStatistics;
import com.linkedin.anomalysentinel.detector.Severity;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.linkedin.anomalysentinel.common.utils.Utils.validateNotNull;


/**
 * An {@link AlertStore} backed by process memory, for tests and for embedders without a database. Ids are assigned
 * sequentially from 1.
 */
public class InMemoryAlertStore implements AlertStore {
  private static final Comparator<Alert> MOST_RECENT_FIRST =
      Comparator.comparingLong(Alert::detectedAtMs).thenComparingLong(Alert::id).reversed();
  private static final Comparator<AlertStatistics> LARGEST_COUNT_FIRST =
      Comparator.comparingLong(AlertStatistics::count).reversed()
                .thenComparing(AlertStatistics::metricName)
                .thenComparing(AlertStatistics::severity);
  // Alert by id, in insertion order.
  private final Map<Long, Alert> _alertById;
  private long _nextId;

  public InMemoryAlertStore() {
    _alertById = new LinkedHashMap<>();
    _nextId = 1L;
  }

  @Override
  public synchronized Alert insert(Alert alert) {
    validateNotNull(alert, "Alert cannot be null.");
    if (alert.id() != Alert.UNASSIGNED_ID) {
      throw new IllegalArgumentException("Alert is already stored with id " + alert.id());
    }
    Alert stored = alert.withId(_nextId++);
    _alertById.put(stored.id(), stored);
    return stored;
  }

  @Override
  public synchronized List<Alert> findUnacknowledged(Severity severity, int limit) {
    if (limit < 0) {
      throw new IllegalArgumentException("Limit cannot be negative: " + limit);
    }
    return _alertById.values().stream()
                     .filter(alert -> !alert.isAcknowledged())
                     .filter(alert -> severity == null || alert.severity() == severity)
                     .sorted(MOST_RECENT_FIRST)
                     .limit(limit)
                     .collect(Collectors.toList());
  }

  @Override
  public synchronized Alert findById(long id) {
    return _alertById.get(id);
  }

  @Override
  public synchronized Alert acknowledge(long id, long acknowledgedAtMs, String notes) {
    Alert alert = _alertById.get(id);
    if (alert == null) {
      return null;
    }
    Alert acknowledged = alert.acknowledge(acknowledgedAtMs, notes);
    _alertById.put(id, acknowledged);
    return acknowledged;
  }

  @Override
  public synchronized List<AlertStatistics> aggregate(long sinceMs) {
    // Group by metric name, then by severity.
    Map<String, Map<Severity, List<Alert>>> alertsByMetric = new LinkedHashMap<>();
    for (Alert alert : _alertById.values()) {
      if (alert.detectedAtMs() > sinceMs) {
        alertsByMetric.computeIfAbsent(alert.metricName(), k -> new LinkedHashMap<>())
                      .computeIfAbsent(alert.severity(), k -> new ArrayList<>())
                      .add(alert);
      }
    }
    List<AlertStatistics> statistics = new ArrayList<>();
    alertsByMetric.forEach((metricName, alertsBySeverity) -> alertsBySeverity.forEach((severity, alerts) -> {
      long firstSeenMs = Long.MAX_VALUE;
      long lastSeenMs = Long.MIN_VALUE;
      for (Alert alert : alerts) {
        firstSeenMs = Math.min(firstSeenMs, alert.detectedAtMs());
        lastSeenMs = Math.max(lastSeenMs, alert.detectedAtMs());
      }
      statistics.add(new AlertStatistics(metricName, severity, alerts.size(), firstSeenMs, lastSeenMs));
    }));
    statistics.sort(LARGEST_COUNT_FIRST);
    return statistics;
  }

  /**
   * @return Number of stored alerts.
   */
  public synchronized int size() {
    return _alertById.size();
  }
}
