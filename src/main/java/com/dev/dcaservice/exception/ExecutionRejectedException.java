package com.dev.dcaservice.exception;

/**
 * Thrown when a timing, balance or price gate blocks an execution.
 */
public class ExecutionRejectedException extends DcaException {

  /**
   * Constructs the exception for one of the execution gates.
   *
   * @param reason TOO_EARLY, PERIOD_ENDED, INSUFFICIENT_BALANCE, PRICE_BELOW_MINIMUM
   *               or PRICE_ABOVE_MAXIMUM
   * @param message the detail message
   */
  public ExecutionRejectedException(ErrorCode reason, String message) {
    super(reason, message);
  }
}
