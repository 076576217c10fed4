package com.dev.dcaservice.exception;

/**
 * Thrown on a second attempt to initialize the engine.
 */
public class AlreadyInitializedException extends DcaException {

  /**
   * Constructs a AlreadyInitializedException with the specified detail message.
   *
   * @param message the detail message
   */
  public AlreadyInitializedException(String message) {
    super(ErrorCode.ALREADY_INITIALIZED, message);
  }
}
