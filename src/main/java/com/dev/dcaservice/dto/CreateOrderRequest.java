package com.dev.dcaservice.dto;

import com.dev.dcaservice.model.Frequency;

/**
 * Represents the JSON body for creating a new DCA order.
 * The owner is the calling account, not part of the body.
 */
public class CreateOrderRequest {

  private long totalAmount;
  private Frequency frequency;
  private long durationDays;
  private long minPrice;         // 0 = no lower bound
  private long maxPrice;         // 0 = no upper bound
  private long feePayment;

  /**
   * Default constructor.
   */
  public CreateOrderRequest() {
    // Default constructor for framework use
  }

  /**
   * Constructs a CreateOrderRequest with all fields.
   *
   * @param totalAmount total budget in funding-asset units
   * @param frequency execution cadence
   * @param durationDays how long the order runs
   * @param minPrice inclusive lower price bound, 0 for none
   * @param maxPrice inclusive upper price bound, 0 for none
   * @param feePayment fee offered, at least the configured execution fee
   */
  public CreateOrderRequest(long totalAmount, Frequency frequency, long durationDays,
                            long minPrice, long maxPrice, long feePayment) {
    this.totalAmount = totalAmount;
    this.frequency = frequency;
    this.durationDays = durationDays;
    this.minPrice = minPrice;
    this.maxPrice = maxPrice;
    this.feePayment = feePayment;
  }

  public long getTotalAmount() {
    return totalAmount;
  }

  public void setTotalAmount(long totalAmount) {
    this.totalAmount = totalAmount;
  }

  public Frequency getFrequency() {
    return frequency;
  }

  public void setFrequency(Frequency frequency) {
    this.frequency = frequency;
  }

  public long getDurationDays() {
    return durationDays;
  }

  public void setDurationDays(long durationDays) {
    this.durationDays = durationDays;
  }

  public long getMinPrice() {
    return minPrice;
  }

  public void setMinPrice(long minPrice) {
    this.minPrice = minPrice;
  }

  public long getMaxPrice() {
    return maxPrice;
  }

  public void setMaxPrice(long maxPrice) {
    this.maxPrice = maxPrice;
  }

  public long getFeePayment() {
    return feePayment;
  }

  public void setFeePayment(long feePayment) {
    this.feePayment = feePayment;
  }
}
