package com.dev.dcaservice.gateway;

import com.dev.dcaservice.model.PriceReading;

/**
 * Source of the current target-asset price. Staleness checks are the caller's concern.
 */
public interface PriceOracle {

  PriceReading latestPrice();
}
