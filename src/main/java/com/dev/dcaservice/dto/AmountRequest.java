package com.dev.dcaservice.dto;

/**
 * Single-amount payload, used for deposits and oracle price updates.
 */
public class AmountRequest {

  private long amount;

  public AmountRequest() {
    // Default constructor for framework use
  }

  public AmountRequest(long amount) {
    this.amount = amount;
  }

  public long getAmount() {
    return amount;
  }

  public void setAmount(long amount) {
    this.amount = amount;
  }
}
