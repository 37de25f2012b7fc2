/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector.ensemble;

import com.linkedin.anomalysentinel.common.utils.Utils;
import com.linkedin.anomalysentinel.detector.DetectionMethod;
import com.linkedin.anomalysentinel.detector.DetectionOptions;
import com.linkedin.anomalysentinel.detector.DetectionResult;
import com.linkedin.anomalysentinel.detector.PointAnomaly;
import com.linkedin.anomalysentinel.detector.Severity;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.anomalysentinel.AnomalySentinelUtils.ensureValidSeries;
import static com.linkedin.anomalysentinel.common.utils.Utils.validateNotNull;


/**
 * Runs several detection methods over the same series and confirms the points flagged by at least
 * {@value #MIN_VOTES} of them.
 *
 * <ul>
 *   <li>The methods come from {@link DetectionOptions#METHODS_CONFIG}, by default z-score, IQR and sudden change.</li>
 *   <li>Each method runs independently with the given options. A confirmed anomaly is critical if any method flagged
 *   its point critical.</li>
 *   <li>Method results are merged in {@link DetectionMethod} order, so the output does not depend on whether the
 *   methods ran on an executor.</li>
 * </ul>
 */
public class EnsembleCoordinator {
  private static final Logger LOG = LoggerFactory.getLogger(EnsembleCoordinator.class);
  public static final int MIN_VOTES = 2;
  private static final Comparator<ConfirmedAnomaly> MOST_VOTED_FIRST =
      Comparator.comparingInt((ConfirmedAnomaly anomaly) -> anomaly.methods().size()).reversed()
                .thenComparingInt(ConfirmedAnomaly::index);
  private final ExecutorService _executor;

  /**
   * Create a coordinator that runs the methods in the calling thread.
   */
  public EnsembleCoordinator() {
    this(null);
  }

  /**
   * @param executor Executor to run the methods on, one task per method, or {@code null} to run them in the calling
   *                 thread. The coordinator does not shut it down.
   */
  public EnsembleCoordinator(ExecutorService executor) {
    _executor = executor;
  }

  /**
   * @param series Series to analyze.
   * @return The ensemble result of the default methods with their default parameters.
   */
  public EnsembleResult detectAll(double[] series) {
    return detectAll(series, DetectionOptions.defaults());
  }

  /**
   * @param series Series to analyze.
   * @param options Raw detection options, see {@link DetectionOptions}.
   * @return The ensemble result.
   */
  public EnsembleResult detectAll(double[] series, Map<String, ?> options) {
    return detectAll(series, new DetectionOptions(validateNotNull(options, "Detection options cannot be null.")));
  }

  /**
   * Run the requested methods over the series and merge their votes per index.
   *
   * @param series Series to analyze, left unmodified.
   * @param options Detection options.
   * @return The result of each method, the confirmed anomalies and a summary.
   */
  public EnsembleResult detectAll(double[] series, DetectionOptions options) {
    ensureValidSeries(series);
    validateNotNull(options, "Detection options cannot be null.");
    List<DetectionMethod> requested = options.methods();
    // Run in declaration order so that the merge is deterministic.
    Set<DetectionMethod> methodSet = EnumSet.noneOf(DetectionMethod.class);
    methodSet.addAll(requested);
    List<DetectionMethod> methods = new ArrayList<>(methodSet);

    List<Callable<DetectionResult<?>>> tasks = new ArrayList<>(methods.size());
    for (DetectionMethod method : methods) {
      tasks.add(() -> method.detect(series, options));
    }
    List<DetectionResult<?>> results = Utils.runAll(tasks, _executor);

    Map<DetectionMethod, DetectionResult<?>> resultByMethod = new TreeMap<>();
    SortedMap<Integer, Set<DetectionMethod>> methodsByIndex = new TreeMap<>();
    SortedMap<Integer, Severity> severityByIndex = new TreeMap<>();
    for (int i = 0; i < methods.size(); i++) {
      DetectionMethod method = methods.get(i);
      DetectionResult<?> result = results.get(i);
      resultByMethod.put(method, result);
      for (PointAnomaly anomaly : result.anomalies()) {
        methodsByIndex.computeIfAbsent(anomaly.index(), k -> EnumSet.noneOf(DetectionMethod.class)).add(method);
        severityByIndex.merge(anomaly.index(), anomaly.severity(), Severity::max);
      }
    }

    List<ConfirmedAnomaly> confirmed = new ArrayList<>();
    int numCritical = 0;
    for (Map.Entry<Integer, Set<DetectionMethod>> entry : methodsByIndex.entrySet()) {
      if (entry.getValue().size() >= MIN_VOTES) {
        int index = entry.getKey();
        Severity severity = severityByIndex.get(index);
        confirmed.add(new ConfirmedAnomaly(index, series[index], entry.getValue(), severity));
        if (severity == Severity.CRITICAL) {
          numCritical++;
        }
      }
    }
    confirmed.sort(MOST_VOTED_FIRST);

    EnsembleSummary summary = new EnsembleSummary(series.length, requested, methodsByIndex.size(), confirmed.size(),
                                                  numCritical);
    LOG.debug("Ensemble detection over {} points: {}", series.length, summary);
    return new EnsembleResult(resultByMethod, confirmed, summary);
  }
}
