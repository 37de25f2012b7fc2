/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector.ensemble;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.linkedin.anomalysentinel.detector.DetectionMethod;
import com.linkedin.anomalysentinel.detector.DetectionResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;


/**
 * The output of {@link EnsembleCoordinator#detectAll(double[], com.linkedin.anomalysentinel.detector.DetectionOptions)}:
 * the raw result of each method for auditability, the confirmed anomalies and a summary.
 */
public class EnsembleResult {
  private static final String METHOD_RESULTS = "methodResults";
  private static final String CONFIRMED_ANOMALIES = "confirmedAnomalies";
  private static final String SUMMARY = "summary";
  private final Map<DetectionMethod, DetectionResult<?>> _resultByMethod;
  private final List<ConfirmedAnomaly> _confirmedAnomalies;
  private final EnsembleSummary _summary;

  EnsembleResult(Map<DetectionMethod, DetectionResult<?>> resultByMethod,
                 List<ConfirmedAnomaly> confirmedAnomalies,
                 EnsembleSummary summary) {
    _resultByMethod = Collections.unmodifiableMap(new LinkedHashMap<>(resultByMethod));
    _confirmedAnomalies = Collections.unmodifiableList(new ArrayList<>(confirmedAnomalies));
    _summary = summary;
  }

  /**
   * @return The result of each method that ran, in {@link DetectionMethod} order.
   */
  public Map<DetectionMethod, DetectionResult<?>> methodResults() {
    return _resultByMethod;
  }

  /**
   * @param method A detection method.
   * @return The result of the given method, or {@code null} if it did not run.
   */
  public DetectionResult<?> methodResult(DetectionMethod method) {
    return _resultByMethod.get(method);
  }

  /**
   * @return Confirmed anomalies, most voted first, ties by ascending index.
   */
  public List<ConfirmedAnomaly> confirmedAnomalies() {
    return _confirmedAnomalies;
  }

  public EnsembleSummary summary() {
    return _summary;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> result = new HashMap<>();
    Map<String, Object> methodResults = new LinkedHashMap<>();
    _resultByMethod.forEach((method, methodResult) -> methodResults.put(method.optionName(), methodResult.getJsonStructure()));
    result.put(METHOD_RESULTS, methodResults);
    result.put(CONFIRMED_ANOMALIES, _confirmedAnomalies.stream().map(ConfirmedAnomaly::getJsonStructure)
                                                       .collect(Collectors.toList()));
    result.put(SUMMARY, _summary.getJsonStructure());
    return result;
  }

  /**
   * @return JSON representation of this result.
   */
  public String getJsonString() {
    Gson gson = new GsonBuilder().serializeNulls().serializeSpecialFloatingPointValues().create();
    return gson.toJson(getJsonStructure());
  }

  @Override
  public String toString() {
    return String.format("EnsembleResult{confirmed=%s, summary=%s}", _confirmedAnomalies, _summary);
  }
}
