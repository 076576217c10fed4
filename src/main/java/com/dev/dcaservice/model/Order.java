package com.dev.dcaservice.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A standing dollar-cost-averaging order.
 *
 * <p>The schedule fields ({@code totalAmount}, {@code amountPerSwap}, {@code frequency},
 * {@code endTime}, price bounds, {@code totalSwaps}) are fixed when the order is created.
 * Only the execution engine moves {@code swapsExecuted}, {@code lastExecutionTime} and
 * {@code remainingBalance}.</p>
 *
 * <p>Amounts are integers in the smallest unit of the funding asset. A price bound of
 * {@code 0} means the bound is not set.</p>
 */
public class Order {

  private UUID id;
  private String owner;
  private long totalAmount;
  private long amountPerSwap;
  private Frequency frequency;
  private Instant createdAt;
  private Instant lastExecutionTime;
  private Instant endTime;
  private long minPrice;
  private long maxPrice;
  private int swapsExecuted;
  private int totalSwaps;
  private long remainingBalance;
  private long feePaid;

  /**
   * Default constructor.
   */
  public Order() {
  }

  /**
   * Returns a field-by-field copy, used to restore an order after a rolled-back operation.
   *
   * @return detached copy of this order
   */
  public Order copy() {
    Order copy = new Order();
    copy.id = id;
    copy.owner = owner;
    copy.totalAmount = totalAmount;
    copy.amountPerSwap = amountPerSwap;
    copy.frequency = frequency;
    copy.createdAt = createdAt;
    copy.lastExecutionTime = lastExecutionTime;
    copy.endTime = endTime;
    copy.minPrice = minPrice;
    copy.maxPrice = maxPrice;
    copy.swapsExecuted = swapsExecuted;
    copy.totalSwaps = totalSwaps;
    copy.remainingBalance = remainingBalance;
    copy.feePaid = feePaid;
    return copy;
  }

  /**
   * Earliest instant at which the next execution is allowed.
   *
   * @return {@code lastExecutionTime + frequency}
   */
  public Instant nextEligibleTime() {
    return lastExecutionTime.plus(frequency.toDuration());
  }

  /**
   * Gets the order identifier.
   *
   * @return order ID
   */
  public UUID getId() {
    return id;
  }

  /**
   * Sets the order identifier.
   *
   * @param id order ID
   */
  public void setId(UUID id) {
    this.id = id;
  }

  /**
   * Gets the account that created and funds the order.
   *
   * @return owner account ID
   */
  public String getOwner() {
    return owner;
  }

  /**
   * Sets the owning account.
   *
   * @param owner owner account ID
   */
  public void setOwner(String owner) {
    this.owner = owner;
  }

  /**
   * Gets the total funding committed at creation.
   *
   * @return total amount
   */
  public long getTotalAmount() {
    return totalAmount;
  }

  public void setTotalAmount(long totalAmount) {
    this.totalAmount = totalAmount;
  }

  /**
   * Gets the funding amount debited per execution.
   *
   * @return amount per swap
   */
  public long getAmountPerSwap() {
    return amountPerSwap;
  }

  public void setAmountPerSwap(long amountPerSwap) {
    this.amountPerSwap = amountPerSwap;
  }

  /**
   * Gets the execution cadence.
   *
   * @return frequency class
   */
  public Frequency getFrequency() {
    return frequency;
  }

  public void setFrequency(Frequency frequency) {
    this.frequency = frequency;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }

  /**
   * Gets the time of the most recent execution, or the creation time if none yet.
   *
   * @return last execution time
   */
  public Instant getLastExecutionTime() {
    return lastExecutionTime;
  }

  public void setLastExecutionTime(Instant lastExecutionTime) {
    this.lastExecutionTime = lastExecutionTime;
  }

  /**
   * Gets the deadline after which no further executions occur.
   *
   * @return end time
   */
  public Instant getEndTime() {
    return endTime;
  }

  public void setEndTime(Instant endTime) {
    this.endTime = endTime;
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

  /**
   * Gets the number of executions so far.
   *
   * @return swaps executed
   */
  public int getSwapsExecuted() {
    return swapsExecuted;
  }

  public void setSwapsExecuted(int swapsExecuted) {
    this.swapsExecuted = swapsExecuted;
  }

  /**
   * Gets the planned number of executions.
   *
   * @return total swaps
   */
  public int getTotalSwaps() {
    return totalSwaps;
  }

  public void setTotalSwaps(int totalSwaps) {
    this.totalSwaps = totalSwaps;
  }

  /**
   * Gets the funding still held for this order.
   *
   * @return remaining balance
   */
  public long getRemainingBalance() {
    return remainingBalance;
  }

  public void setRemainingBalance(long remainingBalance) {
    this.remainingBalance = remainingBalance;
  }

  /**
   * Gets the fee collected when the order was created.
   *
   * @return fee paid
   */
  public long getFeePaid() {
    return feePaid;
  }

  public void setFeePaid(long feePaid) {
    this.feePaid = feePaid;
  }

  @Override
  public String toString() {
    return "Order{" +
        "id=" + id +
        ", owner='" + owner + '\'' +
        ", totalAmount=" + totalAmount +
        ", amountPerSwap=" + amountPerSwap +
        ", frequency=" + frequency +
        ", createdAt=" + createdAt +
        ", lastExecutionTime=" + lastExecutionTime +
        ", endTime=" + endTime +
        ", minPrice=" + minPrice +
        ", maxPrice=" + maxPrice +
        ", swapsExecuted=" + swapsExecuted +
        ", totalSwaps=" + totalSwaps +
        ", remainingBalance=" + remainingBalance +
        ", feePaid=" + feePaid +
        '}';
  }
}
