package com.dev.dcaservice.model;

import java.time.Duration;

/**
 * Execution cadence classes offered to order owners.
 * A month is a fixed nominal 30 days.
 */
public enum Frequency {
  HOURLY(3_600L),
  DAILY(86_400L),
  WEEKLY(604_800L),
  MONTHLY(2_592_000L);

  private final long seconds;

  Frequency(long seconds) {
    this.seconds = seconds;
  }

  public long getSeconds() {
    return seconds;
  }

  public Duration toDuration() {
    return Duration.ofSeconds(seconds);
  }
}
