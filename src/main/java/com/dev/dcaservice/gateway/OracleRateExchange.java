package com.dev.dcaservice.gateway;

import com.dev.dcaservice.exception.ExchangeRejectedException;
import java.math.BigInteger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Exchange that fills every conversion at the current oracle price.
 *
 * <p>Output is {@code inputAmount * price / priceScale}, truncated. A conversion that
 * would yield nothing is rejected.</p>
 */
@Service
public class OracleRateExchange implements ExchangeExecutor {

  private final PriceOracle priceOracle;
  private final long priceScale;

  public OracleRateExchange(PriceOracle priceOracle,
                            @Value("${dca.exchange.price-scale:1}") long priceScale) {
    if (priceScale <= 0) {
      throw new IllegalArgumentException("dca.exchange.price-scale must be positive");
    }
    this.priceOracle = priceOracle;
    this.priceScale = priceScale;
  }

  @Override
  public long execute(long inputAmount) {
    if (inputAmount <= 0) {
      throw new ExchangeRejectedException("Input amount must be positive: " + inputAmount);
    }
    long price = priceOracle.latestPrice().getValue();
    if (price <= 0) {
      throw new ExchangeRejectedException("No usable price available");
    }
    BigInteger out = BigInteger.valueOf(inputAmount)
        .multiply(BigInteger.valueOf(price))
        .divide(BigInteger.valueOf(priceScale));
    if (out.signum() == 0) {
      throw new ExchangeRejectedException("Conversion of " + inputAmount + " yields nothing");
    }
    if (out.bitLength() > 63) {
      throw new ExchangeRejectedException("Conversion output overflows: " + out);
    }
    return out.longValue();
  }
}
