/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.alert;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.TimeUnit;


/**
 * A clock that only moves when told to.
 */
public class MockClock extends Clock {
  private long _timeMs;

  public MockClock(long timeMs) {
    _timeMs = timeMs;
  }

  public void sleep(long durationMs) {
    _timeMs += durationMs;
  }

  public void sleepHours(long hours) {
    sleep(TimeUnit.HOURS.toMillis(hours));
  }

  @Override
  public ZoneId getZone() {
    return ZoneOffset.UTC;
  }

  @Override
  public Clock withZone(ZoneId zone) {
    throw new UnsupportedOperationException("MockClock is always UTC.");
  }

  @Override
  public Instant instant() {
    return Instant.ofEpochMilli(_timeMs);
  }

  @Override
  public long millis() {
    return _timeMs;
  }
}
