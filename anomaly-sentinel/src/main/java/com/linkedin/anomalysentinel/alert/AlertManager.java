/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.alert;

import com.linkedin.anomalysentinel.alert.store.AlertStore;
import com.linkedin.anomalysentinel.common.config.ConfigException;
import com.linkedin.anomalysentinel.config.AlertManagerConfig;
import com.linkedin.anomalysentinel.detector.ExpectedRange;
import com.linkedin.anomalysentinel.detector.PointAnomaly;
import com.linkedin.anomalysentinel.detector.Severity;
import com.linkedin.anomalysentinel.detector.ensemble.ConfirmedAnomaly;
import com.linkedin.anomalysentinel.detector.multidimensional.MultiSeriesAnomaly;
import com.linkedin.anomalysentinel.exception.AlertNotFoundException;
import com.linkedin.anomalysentinel.exception.PersistenceException;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.anomalysentinel.AnomalySentinelUtils.utcDateFor;
import static com.linkedin.anomalysentinel.common.utils.Utils.validateNotNull;


/**
 * Manages the lifecycle of alerts over an {@link AlertStore}: create an open alert from a detected anomaly, list the
 * open alerts, acknowledge them and aggregate recent alerts per metric and severity.
 *
 * The manager holds no state besides the store handle, so a single instance can be shared across threads as long as
 * the store is thread-safe. It does not retry: a {@link PersistenceException} from the store is logged and rethrown.
 */
public class AlertManager {
  private static final Logger LOG = LoggerFactory.getLogger(AlertManager.class);
  private final AlertStore _store;
  private final Clock _clock;
  private final int _activeMaxResults;
  private final int _statsDefaultWindowHours;

  /**
   * Create a manager with the default configuration and the system clock.
   *
   * @param store Alert store.
   */
  public AlertManager(AlertStore store) {
    this(store, AlertManagerConfig.defaults(), Clock.systemUTC());
  }

  /**
   * @param store Alert store.
   * @param config Alert manager configuration.
   * @param clock Clock stamping detection and acknowledgement times.
   */
  public AlertManager(AlertStore store, AlertManagerConfig config, Clock clock) {
    _store = validateNotNull(store, "Alert store cannot be null.");
    validateNotNull(config, "Alert manager config cannot be null.");
    _clock = validateNotNull(clock, "Clock cannot be null.");
    _activeMaxResults = config.getInt(AlertManagerConfig.ALERT_ACTIVE_MAX_RESULTS_CONFIG);
    _statsDefaultWindowHours = config.getInt(AlertManagerConfig.ALERT_STATS_DEFAULT_WINDOW_HOURS_CONFIG);
  }

  /**
   * Create an open alert from an anomaly confirmed by the ensemble.
   *
   * @param metricName Name of the metric the anomaly was detected on.
   * @param anomaly Confirmed anomaly.
   * @param anomalyType Type of the anomaly, e.g. {@code ensemble}.
   * @return The stored alert, with its id.
   */
  public Alert createAlert(String metricName, ConfirmedAnomaly anomaly, String anomalyType) throws PersistenceException {
    validateNotNull(anomaly, "Anomaly cannot be null.");
    return create(metricName, anomalyType, anomaly.severity(), anomaly.value(), null);
  }

  /**
   * Create an open alert from an index anomalous in several metrics. Such an alert has no value.
   *
   * @param metricName Name of the group of metrics the anomaly was detected on.
   * @param anomaly Multi-series anomaly.
   * @param anomalyType Type of the anomaly, e.g. {@code multi-dimensional}.
   * @return The stored alert, with its id.
   */
  public Alert createAlert(String metricName, MultiSeriesAnomaly anomaly, String anomalyType) throws PersistenceException {
    validateNotNull(anomaly, "Anomaly cannot be null.");
    return create(metricName, anomalyType, anomaly.severity(), null, null);
  }

  /**
   * Create an open alert from a point flagged by a single detection method, keeping its expected range if it has one.
   *
   * @param metricName Name of the metric the anomaly was detected on.
   * @param anomaly Point anomaly.
   * @param anomalyType Type of the anomaly, e.g. the method id.
   * @return The stored alert, with its id.
   */
  public Alert createAlert(String metricName, PointAnomaly anomaly, String anomalyType) throws PersistenceException {
    validateNotNull(anomaly, "Anomaly cannot be null.");
    return create(metricName, anomalyType, anomaly.severity(), anomaly.value(), anomaly.expectedRange());
  }

  private Alert create(String metricName, String anomalyType, Severity severity, Double value, ExpectedRange expectedRange)
      throws PersistenceException {
    Alert alert = Alert.open(metricName, anomalyType, severity, value, expectedRange, _clock.millis());
    try {
      Alert stored = _store.insert(alert);
      LOG.info("Created {} alert {} for metric {} ({}).", severity.label(), stored.id(), metricName, anomalyType);
      return stored;
    } catch (PersistenceException pe) {
      LOG.warn("Failed to store {} alert for metric {}.", severity.label(), metricName, pe);
      throw pe;
    }
  }

  /**
   * @return Open alerts of any severity, most recent first.
   */
  public List<Alert> getActiveAlerts() throws PersistenceException {
    return getActiveAlerts(null);
  }

  /**
   * @param severity Severity to filter on, or {@code null} for all severities.
   * @return Open alerts, most recent first, at most {@link AlertManagerConfig#ALERT_ACTIVE_MAX_RESULTS_CONFIG}.
   */
  public List<Alert> getActiveAlerts(Severity severity) throws PersistenceException {
    try {
      return _store.findUnacknowledged(severity, _activeMaxResults);
    } catch (PersistenceException pe) {
      LOG.warn("Failed to retrieve active alerts with severity {}.", severity, pe);
      throw pe;
    }
  }

  /**
   * @param alertId Alert id.
   * @return The acknowledged alert.
   * @see #acknowledgeAlert(long, String)
   */
  public Alert acknowledgeAlert(long alertId) throws AlertNotFoundException, PersistenceException {
    return acknowledgeAlert(alertId, null);
  }

  /**
   * Acknowledge an alert. Acknowledging an alert that is already acknowledged succeeds without changing it.
   *
   * @param alertId Alert id.
   * @param notes Notes of the acknowledgement, or {@code null}.
   * @return The acknowledged alert.
   * @throws AlertNotFoundException If there is no alert with the given id.
   */
  public Alert acknowledgeAlert(long alertId, String notes) throws AlertNotFoundException, PersistenceException {
    long nowMs = _clock.millis();
    Alert alert;
    try {
      alert = _store.acknowledge(alertId, nowMs, notes);
    } catch (PersistenceException pe) {
      LOG.warn("Failed to acknowledge alert {}.", alertId, pe);
      throw pe;
    }
    if (alert == null) {
      throw new AlertNotFoundException(alertId);
    }
    LOG.info("Alert {} is acknowledged since {}.", alertId, utcDateFor(alert.acknowledgedAtMs()));
    return alert;
  }

  /**
   * @return Alert statistics over the default window of
   * {@link AlertManagerConfig#ALERT_STATS_DEFAULT_WINDOW_HOURS_CONFIG} hours.
   */
  public List<AlertStatistics> getAnomalyStats() throws PersistenceException {
    return getAnomalyStats(_statsDefaultWindowHours);
  }

  /**
   * @param hours Positive length of the trailing window in hours.
   * @return Alert counts per metric and severity detected within the window, largest count first.
   */
  public List<AlertStatistics> getAnomalyStats(int hours) throws PersistenceException {
    if (hours <= 0) {
      throw new ConfigException("hours", hours, "Statistics window must be positive.");
    }
    long sinceMs = _clock.millis() - TimeUnit.HOURS.toMillis(hours);
    try {
      return _store.aggregate(sinceMs);
    } catch (PersistenceException pe) {
      LOG.warn("Failed to aggregate alerts since {}.", utcDateFor(sinceMs), pe);
      throw pe;
    }
  }
}
