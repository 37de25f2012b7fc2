/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.linkedin.anomalysentinel.common.utils.Utils.validateNotNull;


/**
 * The output of one detection method over one series: the flagged points plus method-specific summary statistics.
 *
 * A result without anomalies may carry a {@link #note()} explaining why the method has no opinion, e.g. the series is
 * shorter than the method's minimum or it has no variance. Such a result is not an error.
 *
 * @param <A> The type of the point anomalies reported by the method.
 */
public abstract class DetectionResult<A extends PointAnomaly> {
  public static final String INSUFFICIENT_DATA_NOTE = "Insufficient data";
  protected static final String METHOD = "method";
  protected static final String ANOMALIES = "anomalies";
  protected static final String NOTE = "note";
  private final DetectionMethod _method;
  private final List<A> _anomalies;
  private final String _note;

  protected DetectionResult(DetectionMethod method, List<A> anomalies, String note) {
    _method = validateNotNull(method, "Detection method cannot be null.");
    _anomalies = Collections.unmodifiableList(new ArrayList<>(validateNotNull(anomalies, "Anomalies cannot be null.")));
    _note = note;
  }

  public DetectionMethod method() {
    return _method;
  }

  /**
   * @return Flagged points in ascending index order, except where the method defines another order.
   */
  public List<A> anomalies() {
    return _anomalies;
  }

  /**
   * @return Explanation of an empty or degenerate result, {@code null} otherwise.
   */
  public String note() {
    return _note;
  }

  /**
   * @return {@code true} if the method flagged no point.
   */
  public boolean isEmpty() {
    return _anomalies.isEmpty();
  }

  /**
   * Add the method-specific summary to the given JSON structure.
   *
   * @param jsonStructure JSON structure to populate.
   */
  protected abstract void addSummary(Map<String, Object> jsonStructure);

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> result = new HashMap<>();
    result.put(METHOD, _method.methodId());
    result.put(ANOMALIES, _anomalies.stream().map(PointAnomaly::getJsonStructure).collect(Collectors.toList()));
    if (_note != null) {
      result.put(NOTE, _note);
    }
    addSummary(result);
    return result;
  }

  @Override
  public String toString() {
    return String.format("%s{anomalies=%d%s}", _method.methodId(), _anomalies.size(), _note == null ? "" : ", note=" + _note);
  }
}
