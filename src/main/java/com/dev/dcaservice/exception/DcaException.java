package com.dev.dcaservice.exception;

/**
 * Base class for every rejection raised by the order engine.
 * An operation that throws has made no state change.
 */
public abstract class DcaException extends RuntimeException {

  private final ErrorCode errorCode;

  /**
   * Constructs the exception with its reason code.
   *
   * @param errorCode the failure reason
   * @param message the detail message
   */
  protected DcaException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  /**
   * Constructs the exception with its reason code and the underlying cause.
   *
   * @param errorCode the failure reason
   * @param message the detail message
   * @param cause the underlying cause
   */
  protected DcaException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }
}
