/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.alert;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.linkedin.anomalysentinel.detector.ExpectedRange;
import com.linkedin.anomalysentinel.detector.Severity;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import static com.linkedin.anomalysentinel.AnomalySentinelUtils.ensureValidString;
import static com.linkedin.anomalysentinel.AnomalySentinelUtils.utcDateFor;
import static com.linkedin.anomalysentinel.common.utils.Utils.validateNotNull;


/**
 * A persisted record of an anomaly. An alert is created open and moves to acknowledged exactly once; there is no
 * other transition. Instances are immutable, state changes produce a new instance.
 */
public final class Alert {
  /**
   * The id of an alert that has not been stored yet.
   */
  public static final long UNASSIGNED_ID = -1L;
  static final String DETAILS_NOTE = "See detection details";
  private static final String ID = "id";
  private static final String METRIC_NAME = "metricName";
  private static final String ANOMALY_TYPE = "anomalyType";
  private static final String SEVERITY = "severity";
  private static final String VALUE = "value";
  private static final String EXPECTED_RANGE = "expectedRange";
  private static final String NOTE = "note";
  private static final String DETECTED_AT = "detectedAt";
  private static final String ACKNOWLEDGED = "acknowledged";
  private static final String ACKNOWLEDGED_AT = "acknowledgedAt";
  private static final String NOTES = "notes";
  private final long _id;
  private final String _metricName;
  private final String _anomalyType;
  private final Severity _severity;
  private final Double _value;
  private final ExpectedRange _expectedRange;
  private final long _detectedAtMs;
  private final boolean _acknowledged;
  private final Long _acknowledgedAtMs;
  private final String _notes;

  private Alert(long id,
                String metricName,
                String anomalyType,
                Severity severity,
                Double value,
                ExpectedRange expectedRange,
                long detectedAtMs,
                boolean acknowledged,
                Long acknowledgedAtMs,
                String notes) {
    _id = id;
    _metricName = metricName;
    _anomalyType = anomalyType;
    _severity = severity;
    _value = value;
    _expectedRange = expectedRange;
    _detectedAtMs = detectedAtMs;
    _acknowledged = acknowledged;
    _acknowledgedAtMs = acknowledgedAtMs;
    _notes = notes;
  }

  /**
   * Create an open alert that has not been stored yet.
   *
   * @param metricName Name of the metric the anomaly was detected on.
   * @param anomalyType Free-form type of the anomaly, e.g. the detection method.
   * @param severity Severity of the anomaly.
   * @param value Value of the anomalous point, or {@code null} if the anomaly has no single value.
   * @param expectedRange Range of normal values, or {@code null} if unknown.
   * @param detectedAtMs Detection time in milliseconds.
   * @return A new open alert with {@link #UNASSIGNED_ID}.
   */
  public static Alert open(String metricName,
                           String anomalyType,
                           Severity severity,
                           Double value,
                           ExpectedRange expectedRange,
                           long detectedAtMs) {
    ensureValidString("Metric name", metricName);
    ensureValidString("Anomaly type", anomalyType);
    validateNotNull(severity, "Alert severity cannot be null.");
    return new Alert(UNASSIGNED_ID, metricName, anomalyType, severity, value, expectedRange, detectedAtMs, false, null,
                     null);
  }

  /**
   * @param id Id assigned by the store.
   * @return A copy of this alert with the given id.
   */
  public Alert withId(long id) {
    if (id < 0) {
      throw new IllegalArgumentException("Alert id cannot be negative: " + id);
    }
    return new Alert(id, _metricName, _anomalyType, _severity, _value, _expectedRange, _detectedAtMs, _acknowledged,
                     _acknowledgedAtMs, _notes);
  }

  /**
   * @param acknowledgedAtMs Acknowledgement time in milliseconds.
   * @param notes Notes of the acknowledgement, or {@code null}.
   * @return An acknowledged copy of this alert, or this alert if it is already acknowledged.
   */
  public Alert acknowledge(long acknowledgedAtMs, String notes) {
    if (_acknowledged) {
      return this;
    }
    return new Alert(_id, _metricName, _anomalyType, _severity, _value, _expectedRange, _detectedAtMs, true,
                     acknowledgedAtMs, notes);
  }

  public long id() {
    return _id;
  }

  public String metricName() {
    return _metricName;
  }

  public String anomalyType() {
    return _anomalyType;
  }

  public Severity severity() {
    return _severity;
  }

  /**
   * @return Value of the anomalous point, or {@code null} for anomalies spanning several metrics.
   */
  public Double value() {
    return _value;
  }

  /**
   * @return Range of normal values, or {@code null} if the detection did not report one.
   */
  public ExpectedRange expectedRange() {
    return _expectedRange;
  }

  public long detectedAtMs() {
    return _detectedAtMs;
  }

  public boolean isAcknowledged() {
    return _acknowledged;
  }

  /**
   * @return Acknowledgement time in milliseconds, or {@code null} while the alert is open.
   */
  public Long acknowledgedAtMs() {
    return _acknowledgedAtMs;
  }

  public String notes() {
    return _notes;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> alert = new HashMap<>();
    alert.put(ID, _id);
    alert.put(METRIC_NAME, _metricName);
    alert.put(ANOMALY_TYPE, _anomalyType);
    alert.put(SEVERITY, _severity.label());
    alert.put(VALUE, _value);
    alert.put(EXPECTED_RANGE, _expectedRange != null ? _expectedRange.getJsonStructure() : Map.of(NOTE, DETAILS_NOTE));
    alert.put(DETECTED_AT, utcDateFor(_detectedAtMs));
    alert.put(ACKNOWLEDGED, _acknowledged);
    alert.put(ACKNOWLEDGED_AT, _acknowledgedAtMs == null ? null : utcDateFor(_acknowledgedAtMs));
    alert.put(NOTES, _notes);
    return alert;
  }

  /**
   * @return JSON representation of this alert.
   */
  public String getJsonString() {
    Gson gson = new GsonBuilder().serializeNulls().serializeSpecialFloatingPointValues().create();
    return gson.toJson(getJsonStructure());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Alert alert = (Alert) o;
    return _id == alert._id
           && _detectedAtMs == alert._detectedAtMs
           && _acknowledged == alert._acknowledged
           && _metricName.equals(alert._metricName)
           && _anomalyType.equals(alert._anomalyType)
           && _severity == alert._severity
           && Objects.equals(_value, alert._value)
           && Objects.equals(_expectedRange, alert._expectedRange)
           && Objects.equals(_acknowledgedAtMs, alert._acknowledgedAtMs)
           && Objects.equals(_notes, alert._notes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_id, _metricName, _anomalyType, _severity, _value, _expectedRange, _detectedAtMs, _acknowledged,
                        _acknowledgedAtMs, _notes);
  }

  @Override
  public String toString() {
    return String.format("Alert{id=%d, metric=%s, type=%s, severity=%s, value=%s, detectedAt=%s, acknowledged=%s}", _id,
                         _metricName, _anomalyType, _severity, _value, utcDateFor(_detectedAtMs), _acknowledged);
  }
}
