package com.dev.dcaservice.gateway;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.dev.dcaservice.model.PriceReading;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ManualPriceOracle.
 */
class ManualPriceOracleTest {

  private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");
  private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

  @Test
  void testLatestPrice_InitialValue() {
    ManualPriceOracle oracle = new ManualPriceOracle(clock, 1000);

    PriceReading reading = oracle.latestPrice();

    assertEquals(1000, reading.getValue());
    assertEquals(NOW, reading.getAsOf());
  }

  @Test
  void testUpdate_ReplacesReading() {
    ManualPriceOracle oracle = new ManualPriceOracle(clock, 1000);

    oracle.update(1200);

    assertEquals(1200, oracle.latestPrice().getValue());
  }

  @Test
  void testUpdate_NonPositive_Rejected() {
    ManualPriceOracle oracle = new ManualPriceOracle(clock, 1000);

    assertThrows(IllegalArgumentException.class, () -> oracle.update(0));
    assertEquals(1000, oracle.latestPrice().getValue());
  }
}
