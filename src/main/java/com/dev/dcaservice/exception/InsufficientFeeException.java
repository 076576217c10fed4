package com.dev.dcaservice.exception;

/**
 * Thrown when the fee supplied at creation is below the configured execution fee.
 */
public class InsufficientFeeException extends DcaException {

  /**
   * Constructs a InsufficientFeeException with the specified detail message.
   *
   * @param message the detail message
   */
  public InsufficientFeeException(String message) {
    super(ErrorCode.INSUFFICIENT_FEE, message);
  }
}
