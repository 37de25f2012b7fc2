/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector;

import com.linkedin.anomalysentinel.common.config.AbstractConfig;
import com.linkedin.anomalysentinel.common.config.ConfigDef;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.linkedin.anomalysentinel.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.anomalysentinel.common.config.ConfigDef.Range.between;


/**
 * The options of a single detection call. Unknown keys are ignored. A missing numeric option resolves to the default
 * of the detector reading it, e.g. {@link #THRESHOLD_CONFIG} defaults to 2.5 for z-score and to 2 for sudden change.
 * Invalid values fail with {@link com.linkedin.anomalysentinel.common.config.ConfigException} at construction, before
 * any computation.
 */
public class DetectionOptions extends AbstractConfig {
  private static final ConfigDef CONFIG;

  /**
   * <code>threshold</code>
   */
  public static final String THRESHOLD_CONFIG = "threshold";
  private static final String THRESHOLD_DOC = "The deviation threshold of the z-score, sudden change and multi-dimensional "
      + "detectors, in standard deviations.";

  /**
   * <code>multiplier</code>
   */
  public static final String MULTIPLIER_CONFIG = "multiplier";
  private static final String MULTIPLIER_DOC = "The IQR multiplier that sets how far outside the quartiles a value must "
      + "fall to be flagged.";

  /**
   * <code>windowSize</code>
   */
  public static final String WINDOW_SIZE_CONFIG = "windowSize";
  private static final String WINDOW_SIZE_DOC = "The window size of the sudden change and trend break detectors.";

  /**
   * <code>sensitivity</code>
   */
  public static final String SENSITIVITY_CONFIG = "sensitivity";
  private static final String SENSITIVITY_DOC = "The minimum change of slope for the trend break detector to flag a point.";

  /**
   * <code>contamination</code>
   */
  public static final String CONTAMINATION_CONFIG = "contamination";
  private static final String CONTAMINATION_DOC = "The expected share of anomalous points, in (0, 1], used by the "
      + "isolation detector.";

  /**
   * <code>methods</code>
   */
  public static final String METHODS_CONFIG = "methods";
  public static final String DEFAULT_METHODS = "zscore,iqr,sudden-change";
  private static final String METHODS_DOC = "The detection methods the ensemble runs, as a comma separated list of zscore, "
      + "iqr, sudden-change, trend-break and isolation.";

  static {
    CONFIG = new ConfigDef()
        .define(THRESHOLD_CONFIG,
                ConfigDef.Type.DOUBLE,
                null,
                ConfigDef.NullOr.of(atLeast(0.0)),
                ConfigDef.Importance.HIGH,
                THRESHOLD_DOC)
        .define(MULTIPLIER_CONFIG,
                ConfigDef.Type.DOUBLE,
                null,
                ConfigDef.NullOr.of(atLeast(0.0)),
                ConfigDef.Importance.MEDIUM,
                MULTIPLIER_DOC)
        .define(WINDOW_SIZE_CONFIG,
                ConfigDef.Type.INT,
                null,
                ConfigDef.NullOr.of(atLeast(1)),
                ConfigDef.Importance.MEDIUM,
                WINDOW_SIZE_DOC)
        .define(SENSITIVITY_CONFIG,
                ConfigDef.Type.DOUBLE,
                null,
                ConfigDef.NullOr.of(atLeast(0.0)),
                ConfigDef.Importance.MEDIUM,
                SENSITIVITY_DOC)
        .define(CONTAMINATION_CONFIG,
                ConfigDef.Type.DOUBLE,
                null,
                ConfigDef.NullOr.of(between(Double.MIN_VALUE, 1.0)),
                ConfigDef.Importance.LOW,
                CONTAMINATION_DOC)
        .define(METHODS_CONFIG,
                ConfigDef.Type.LIST,
                DEFAULT_METHODS,
                ConfigDef.ValidList.in(DetectionMethod.optionNames()),
                ConfigDef.Importance.HIGH,
                METHODS_DOC);
  }

  public DetectionOptions(Map<?, ?> originals) {
    super(CONFIG, originals, false);
  }

  /**
   * @return Options with every detector's defaults.
   */
  public static DetectionOptions defaults() {
    return new DetectionOptions(Collections.emptyMap());
  }

  public double threshold(double defaultValue) {
    return orDefault(getDouble(THRESHOLD_CONFIG), defaultValue);
  }

  public double multiplier(double defaultValue) {
    return orDefault(getDouble(MULTIPLIER_CONFIG), defaultValue);
  }

  public int windowSize(int defaultValue) {
    Integer windowSize = getInt(WINDOW_SIZE_CONFIG);
    return windowSize == null ? defaultValue : windowSize;
  }

  public double sensitivity(double defaultValue) {
    return orDefault(getDouble(SENSITIVITY_CONFIG), defaultValue);
  }

  public double contamination(double defaultValue) {
    return orDefault(getDouble(CONTAMINATION_CONFIG), defaultValue);
  }

  /**
   * @return The requested detection methods in request order, each at most once.
   */
  public List<DetectionMethod> methods() {
    List<DetectionMethod> methods = new ArrayList<>();
    for (String optionName : getList(METHODS_CONFIG)) {
      DetectionMethod method = DetectionMethod.forOptionName(optionName);
      if (!methods.contains(method)) {
        methods.add(method);
      }
    }
    return methods;
  }

  private static double orDefault(Double value, double defaultValue) {
    return value == null ? defaultValue : value;
  }
}
