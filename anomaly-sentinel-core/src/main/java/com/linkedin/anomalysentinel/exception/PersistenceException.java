/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.exception;

/**
 * Thrown if the durable alert store is unreachable or rejects a read or write. Never retried by the engine.
 */
public class PersistenceException extends AnomalySentinelException {
  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }

  public PersistenceException(String message) {
    super(message);
  }

  public PersistenceException(Throwable cause) {
    super(cause);
  }
}
