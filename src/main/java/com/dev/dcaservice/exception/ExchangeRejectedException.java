package com.dev.dcaservice.exception;

/**
 * Thrown when the exchange refuses or fails to convert an execution amount.
 */
public class ExchangeRejectedException extends DcaException {

  public ExchangeRejectedException(String message) {
    super(ErrorCode.EXCHANGE_REJECTED, message);
  }

  public ExchangeRejectedException(String message, Throwable cause) {
    super(ErrorCode.EXCHANGE_REJECTED, message, cause);
  }
}
