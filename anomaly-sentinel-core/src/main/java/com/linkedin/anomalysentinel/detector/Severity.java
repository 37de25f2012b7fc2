/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector;

import java.util.List;
import java.util.Locale;


/**
 * Coarse-grained impact label of an anomaly, derived from how far a deviation exceeds its detector's threshold.
 */
public enum Severity {
  WARNING, CRITICAL;

  private static final List<Severity> CACHED_VALUES = List.of(values());

  /**
   * @param first The first severity.
   * @param second The second severity.
   * @return The more severe of the two.
   */
  public static Severity max(Severity first, Severity second) {
    return first == CRITICAL || second == CRITICAL ? CRITICAL : WARNING;
  }

  /**
   * @param name Case-insensitive severity name, e.g. {@code critical}.
   * @return The severity with the given name.
   */
  public static Severity forName(String name) {
    for (Severity severity : CACHED_VALUES) {
      if (severity.name().equalsIgnoreCase(name)) {
        return severity;
      }
    }
    throw new IllegalArgumentException("Unknown severity " + name);
  }

  /**
   * @return The lower-case name used in JSON responses and in the alert store.
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
