/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.exception;

/**
 * Thrown when an alert id is not known to the alert store.
 */
public class AlertNotFoundException extends AnomalySentinelException {
  public AlertNotFoundException(long alertId) {
    super(String.format("Alert %d does not exist.", alertId));
  }
}
