package com.dev.dcaservice.dto;

import java.util.UUID;

/**
 * Result of the pre-trade check run before routing an execution to the exchange.
 * Nothing is debited by the check itself.
 */
public class PreAuthorizationResult {

  private UUID orderId;
  private long amountIn;
  private long executionFee;
  private long price;

  public PreAuthorizationResult() {
    // Default constructor for framework use
  }

  /**
   * Constructs a PreAuthorizationResult with all fields.
   *
   * @param orderId checked order
   * @param amountIn units the next execution will debit
   * @param executionFee fee counted in the balance check
   * @param price price that passed the gate
   */
  public PreAuthorizationResult(UUID orderId, long amountIn, long executionFee, long price) {
    this.orderId = orderId;
    this.amountIn = amountIn;
    this.executionFee = executionFee;
    this.price = price;
  }

  public UUID getOrderId() {
    return orderId;
  }

  public void setOrderId(UUID orderId) {
    this.orderId = orderId;
  }

  public long getAmountIn() {
    return amountIn;
  }

  public void setAmountIn(long amountIn) {
    this.amountIn = amountIn;
  }

  public long getExecutionFee() {
    return executionFee;
  }

  public void setExecutionFee(long executionFee) {
    this.executionFee = executionFee;
  }

  public long getPrice() {
    return price;
  }

  public void setPrice(long price) {
    this.price = price;
  }
}
