package com.dev.dcaservice.exception;

import java.util.UUID;

/**
 * Thrown when an identifier does not refer to an active order.
 */
public class OrderNotFoundException extends DcaException {

  private final UUID orderId;

  /**
   * Constructs an OrderNotFoundException for the given identifier.
   *
   * @param orderId the identifier that was looked up
   */
  public OrderNotFoundException(UUID orderId) {
    super(ErrorCode.ORDER_NOT_FOUND, "Order not found: " + orderId);
    this.orderId = orderId;
  }

  public UUID getOrderId() {
    return orderId;
  }
}
