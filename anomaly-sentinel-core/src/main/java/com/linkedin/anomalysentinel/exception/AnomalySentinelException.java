/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.exception;

public class AnomalySentinelException extends Exception {

  public AnomalySentinelException(String message, Throwable cause) {
    super(message, cause);
  }

  public AnomalySentinelException(String message) {
    super(message);
  }

  public AnomalySentinelException(Throwable cause) {
    super(cause);
  }
}
