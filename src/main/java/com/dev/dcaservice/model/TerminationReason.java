package com.dev.dcaservice.model;

/**
 * Why an order left the active set.
 */
public enum TerminationReason {
  COMPLETED,
  CANCELLED
}
