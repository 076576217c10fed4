package com.dev.dcaservice.event;

/**
 * Lifecycle transitions announced for an order.
 */
public enum OrderEventType {
  CREATED,
  EXECUTED,
  COMPLETED,
  CANCELLED
}
