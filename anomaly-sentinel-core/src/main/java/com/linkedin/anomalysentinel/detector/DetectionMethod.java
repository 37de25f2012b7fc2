/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector;

import com.linkedin.anomalysentinel.detector.isolation.IsolationDetector;
import com.linkedin.anomalysentinel.detector.pattern.PatternDetectors;
import com.linkedin.anomalysentinel.detector.statistical.StatisticalDetectors;
import java.util.List;


/**
 * The single-series detection methods the ensemble can vote with.
 *
 * Each method has an option name, used in the {@code methods} detection option, and a method id, used to label its
 * results. Detection dispatches to the corresponding detector, reading the parameters it recognizes from the given
 * {@link DetectionOptions} and falling back to the detector's own defaults.
 */
public enum DetectionMethod {
  Z_SCORE("zscore", "z-score") {
    @Override
    public DetectionResult<?> detect(double[] series, DetectionOptions options) {
      return StatisticalDetectors.detectZScore(series, options.threshold(StatisticalDetectors.DEFAULT_Z_SCORE_THRESHOLD));
    }
  },
  IQR("iqr", "iqr") {
    @Override
    public DetectionResult<?> detect(double[] series, DetectionOptions options) {
      return StatisticalDetectors.detectIqr(series, options.multiplier(StatisticalDetectors.DEFAULT_IQR_MULTIPLIER));
    }
  },
  SUDDEN_CHANGE("sudden-change", "sudden-change") {
    @Override
    public DetectionResult<?> detect(double[] series, DetectionOptions options) {
      return PatternDetectors.detectSuddenChanges(series,
                                                  options.windowSize(PatternDetectors.DEFAULT_SUDDEN_CHANGE_WINDOW_SIZE),
                                                  options.threshold(PatternDetectors.DEFAULT_SUDDEN_CHANGE_THRESHOLD));
    }
  },
  TREND_BREAK("trend-break", "trend-break") {
    @Override
    public DetectionResult<?> detect(double[] series, DetectionOptions options) {
      return PatternDetectors.detectTrendBreaks(series,
                                                options.windowSize(PatternDetectors.DEFAULT_TREND_BREAK_WINDOW_SIZE),
                                                options.sensitivity(PatternDetectors.DEFAULT_TREND_BREAK_SENSITIVITY));
    }
  },
  ISOLATION("isolation", "isolation") {
    @Override
    public DetectionResult<?> detect(double[] series, DetectionOptions options) {
      return IsolationDetector.detectIsolation(series, options.contamination(IsolationDetector.DEFAULT_CONTAMINATION));
    }
  };

  private static final List<DetectionMethod> CACHED_VALUES = List.of(values());
  private final String _optionName;
  private final String _methodId;

  DetectionMethod(String optionName, String methodId) {
    _optionName = optionName;
    _methodId = methodId;
  }

  /**
   * Run this method over the given series.
   *
   * @param series Series to analyze, left unmodified.
   * @param options Detection options.
   * @return The result of this method.
   */
  public abstract DetectionResult<?> detect(double[] series, DetectionOptions options);

  /**
   * @return Name of this method in the {@code methods} detection option.
   */
  public String optionName() {
    return _optionName;
  }

  /**
   * @return Identifier of this method in detection results.
   */
  public String methodId() {
    return _methodId;
  }

  /**
   * @param optionName Case-insensitive option name, e.g. {@code sudden-change}.
   * @return The method with the given option name.
   */
  public static DetectionMethod forOptionName(String optionName) {
    for (DetectionMethod method : CACHED_VALUES) {
      if (method._optionName.equalsIgnoreCase(optionName)) {
        return method;
      }
    }
    throw new IllegalArgumentException("Unknown detection method " + optionName);
  }

  /**
   * @return Option names of all methods, in declaration order.
   */
  public static String[] optionNames() {
    return CACHED_VALUES.stream().map(DetectionMethod::optionName).toArray(String[]::new);
  }
}
