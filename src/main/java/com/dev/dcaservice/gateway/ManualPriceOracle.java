package com.dev.dcaservice.gateway;

import com.dev.dcaservice.model.PriceReading;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Price oracle fed by operators through the admin API.
 * Starts from {@code dca.oracle.initial-price}.
 */
@Service
public class ManualPriceOracle implements PriceOracle {

  private static final Logger log = LoggerFactory.getLogger(ManualPriceOracle.class);

  private final Clock clock;
  private final AtomicReference<PriceReading> latest;

  /**
   * Creates the oracle with its configured starting price.
   *
   * @param clock time source for reading timestamps
   * @param initialPrice starting price
   */
  @Autowired
  public ManualPriceOracle(Clock clock,
                           @Value("${dca.oracle.initial-price:0}") long initialPrice) {
    this.clock = clock;
    this.latest = new AtomicReference<>(new PriceReading(initialPrice, clock.instant()));
  }

  @Override
  public PriceReading latestPrice() {
    return latest.get();
  }

  /**
   * Publishes a new price reading.
   *
   * @param value new price, positive
   * @return the stored reading
   */
  public PriceReading update(long value) {
    if (value <= 0) {
      throw new IllegalArgumentException("Price must be positive");
    }
    PriceReading reading = new PriceReading(value, clock.instant());
    latest.set(reading);
    log.info("Oracle price set to {}", value);
    return reading;
  }
}
