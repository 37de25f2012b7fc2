/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.detector;

import java.util.Locale;


/**
 * Which way an anomalous point deviates.
 * <ul>
 *   <li>{@link #HIGH} / {@link #LOW}: statistical detectors.</li>
 *   <li>{@link #SPIKE} / {@link #DROP}: sudden change detector.</li>
 *   <li>{@link #ACCELERATION} / {@link #DECELERATION}: trend break detector.</li>
 * </ul>
 */
public enum Direction {
  HIGH, LOW, SPIKE, DROP, ACCELERATION, DECELERATION;

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
