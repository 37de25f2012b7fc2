/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.alert.store;

import com.linkedin.anomalysentinel.alert.Alert;
import com.linkedin.anomalysentinel.alert.AlertStatistics;
import com.linkedin.anomalysentinel.detector.Severity;
import com.linkedin.anomalysentinel.exception.PersistenceException;
import java.util.List;


/**
 * The durable store of alerts. A relational implementation maps to a table equivalent to
 * <pre>
 * anomaly_alerts(id PK, metric_name, anomaly_type, severity, value, expected_range JSON, detected_at timestamp,
 *                acknowledged bool default false, acknowledged_at timestamp, notes text)
 * </pre>
 * indexed on {@code (severity, acknowledged)}. Implementations must be safe for concurrent use and fail with
 * {@link PersistenceException} when the store is unreachable. Retries are up to the implementation.
 */
public interface AlertStore {

  /**
   * Store a new alert and assign it an id.
   *
   * @param alert An alert with {@link Alert#UNASSIGNED_ID}.
   * @return The stored alert, with its id.
   */
  Alert insert(Alert alert) throws PersistenceException;

  /**
   * @param severity Severity to filter on, or {@code null} for all severities.
   * @param limit Maximum number of alerts to return.
   * @return Open alerts, most recently detected first, ties by descending id.
   */
  List<Alert> findUnacknowledged(Severity severity, int limit) throws PersistenceException;

  /**
   * Look up a single alert, acknowledged or not. {@link com.linkedin.anomalysentinel.alert.AlertManager} does not
   * call this; it is an inspection hook for operators and tests.
   *
   * @param id Alert id.
   * @return The alert with the given id, or {@code null} if there is none.
   */
  Alert findById(long id) throws PersistenceException;

  /**
   * Acknowledge the alert with the given id if it is open, as a single conditional update. An alert that is already
   * acknowledged keeps its acknowledgement time and notes.
   *
   * @param id Alert id.
   * @param acknowledgedAtMs Acknowledgement time in milliseconds.
   * @param notes Notes of the acknowledgement, or {@code null}.
   * @return The alert after the update, or {@code null} if there is no alert with the given id.
   */
  Alert acknowledge(long id, long acknowledgedAtMs, String notes) throws PersistenceException;

  /**
   * @param sinceMs Exclusive lower bound of the detection time in milliseconds.
   * @return Alert counts per metric and severity, largest count first, ties by metric name then severity.
   */
  List<AlertStatistics> aggregate(long sinceMs) throws PersistenceException;
}
