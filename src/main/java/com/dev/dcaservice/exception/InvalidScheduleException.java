package com.dev.dcaservice.exception;

/**
 * Thrown when creation parameters do not yield a usable schedule.
 */
public class InvalidScheduleException extends DcaException {

  /**
   * Constructs a InvalidScheduleException with the specified detail message.
   *
   * @param message the detail message
   */
  public InvalidScheduleException(String message) {
    super(ErrorCode.INVALID_SCHEDULE, message);
  }
}
