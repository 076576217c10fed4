package com.dev.dcaservice.gateway;

import com.dev.dcaservice.exception.ExchangeRejectedException;

/**
 * Converts funding-asset units into the target asset. Not retried by the engine.
 */
public interface ExchangeExecutor {

  /**
   * Executes one conversion.
   *
   * @param inputAmount funding units to convert
   * @return target units received
   * @throws ExchangeRejectedException if the conversion did not happen
   */
  long execute(long inputAmount);
}
