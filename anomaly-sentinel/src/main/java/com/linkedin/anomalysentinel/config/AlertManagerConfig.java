/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.config;

import com.linkedin.anomalysentinel.common.config.AbstractConfig;
import com.linkedin.anomalysentinel.common.config.ConfigDef;
import java.util.Collections;
import java.util.Map;

import static com.linkedin.anomalysentinel.common.config.ConfigDef.Range.atLeast;


/**
 * The configuration of {@link com.linkedin.anomalysentinel.alert.AlertManager}.
 */
public class AlertManagerConfig extends AbstractConfig {
  private static final ConfigDef CONFIG;

  /**
   * <code>alert.active.max.results</code>
   */
  public static final String ALERT_ACTIVE_MAX_RESULTS_CONFIG = "alert.active.max.results";
  public static final int DEFAULT_ALERT_ACTIVE_MAX_RESULTS = 50;
  private static final String ALERT_ACTIVE_MAX_RESULTS_DOC = "The maximum number of open alerts returned by a single "
      + "active alert query.";

  /**
   * <code>alert.stats.default.window.hours</code>
   */
  public static final String ALERT_STATS_DEFAULT_WINDOW_HOURS_CONFIG = "alert.stats.default.window.hours";
  public static final int DEFAULT_ALERT_STATS_DEFAULT_WINDOW_HOURS = 24;
  private static final String ALERT_STATS_DEFAULT_WINDOW_HOURS_DOC = "The trailing window in hours of alert statistics "
      + "when the caller does not give one.";

  static {
    CONFIG = new ConfigDef()
        .define(ALERT_ACTIVE_MAX_RESULTS_CONFIG,
                ConfigDef.Type.INT,
                DEFAULT_ALERT_ACTIVE_MAX_RESULTS,
                atLeast(1),
                ConfigDef.Importance.MEDIUM,
                ALERT_ACTIVE_MAX_RESULTS_DOC)
        .define(ALERT_STATS_DEFAULT_WINDOW_HOURS_CONFIG,
                ConfigDef.Type.INT,
                DEFAULT_ALERT_STATS_DEFAULT_WINDOW_HOURS,
                atLeast(1),
                ConfigDef.Importance.LOW,
                ALERT_STATS_DEFAULT_WINDOW_HOURS_DOC);
  }

  public AlertManagerConfig(Map<?, ?> originals) {
    this(originals, true);
  }

  public AlertManagerConfig(Map<?, ?> originals, boolean doLog) {
    super(CONFIG, originals, doLog);
  }

  /**
   * @return The configuration with every default.
   */
  public static AlertManagerConfig defaults() {
    return new AlertManagerConfig(Collections.emptyMap(), false);
  }
}
