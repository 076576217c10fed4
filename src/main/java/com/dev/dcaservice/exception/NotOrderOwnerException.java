package com.dev.dcaservice.exception;

/**
 * Thrown when someone other than the owner tries to cancel an order.
 */
public class NotOrderOwnerException extends DcaException {

  /**
   * Constructs a NotOrderOwnerException with the specified detail message.
   *
   * @param message the detail message
   */
  public NotOrderOwnerException(String message) {
    super(ErrorCode.NOT_ORDER_OWNER, message);
  }
}
