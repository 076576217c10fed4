package com.dev.dcaservice.model;

import java.time.Instant;

/**
 * A single price observation from the oracle.
 */
public class PriceReading {

  private final long value;
  private final Instant asOf;

  public PriceReading(long value, Instant asOf) {
    this.value = value;
    this.asOf = asOf;
  }

  public long getValue() {
    return value;
  }

  public Instant getAsOf() {
    return asOf;
  }

  @Override
  public String toString() {
    return "PriceReading{value=" + value + ", asOf=" + asOf + '}';
  }
}
