package com.dev.dcaservice.exception;

/**
 * Thrown when engine settings or identifiers are missing or inconsistent.
 */
public class InvalidConfigurationException extends DcaException {

  /**
   * Constructs a InvalidConfigurationException with the specified detail message.
   *
   * @param message the detail message
   */
  public InvalidConfigurationException(String message) {
    super(ErrorCode.INVALID_CONFIGURATION, message);
  }
}
