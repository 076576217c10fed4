package com.dev.dcaservice.exception;

/**
 * Thrown when a caller other than the trusted agent triggers an execution.
 */
public class UnauthorizedException extends DcaException {

  /**
   * Constructs a UnauthorizedException with the specified detail message.
   *
   * @param message the detail message
   */
  public UnauthorizedException(String message) {
    super(ErrorCode.UNAUTHORIZED, message);
  }
}
