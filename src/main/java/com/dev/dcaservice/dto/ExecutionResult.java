package com.dev.dcaservice.dto;

import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of one successful execution.
 */
public class ExecutionResult {

  private UUID orderId;
  private String owner;
  private long amountIn;
  private long amountOut;
  private long price;
  private int swapsExecuted;
  private long remainingBalance;
  private Instant executedAt;
  private boolean completed;
  private long refunded;

  /**
   * Default constructor.
   */
  public ExecutionResult() {
    // Default constructor for framework use
  }

  /**
   * Constructs an ExecutionResult with all fields.
   *
   * @param orderId executed order
   * @param owner owning account
   * @param amountIn funding units debited
   * @param amountOut target units reported by the exchange
   * @param price price that passed the gate
   * @param swapsExecuted executions after this one
   * @param remainingBalance balance after the debit
   * @param executedAt execution time
   * @param completed whether this execution terminated the order
   * @param refunded unspent balance returned on completion
   */
  public ExecutionResult(UUID orderId, String owner, long amountIn, long amountOut, long price,
                         int swapsExecuted, long remainingBalance, Instant executedAt,
                         boolean completed, long refunded) {
    this.orderId = orderId;
    this.owner = owner;
    this.amountIn = amountIn;
    this.amountOut = amountOut;
    this.price = price;
    this.swapsExecuted = swapsExecuted;
    this.remainingBalance = remainingBalance;
    this.executedAt = executedAt;
    this.completed = completed;
    this.refunded = refunded;
  }

  public UUID getOrderId() {
    return orderId;
  }

  public void setOrderId(UUID orderId) {
    this.orderId = orderId;
  }

  public String getOwner() {
    return owner;
  }

  public void setOwner(String owner) {
    this.owner = owner;
  }

  public long getAmountIn() {
    return amountIn;
  }

  public void setAmountIn(long amountIn) {
    this.amountIn = amountIn;
  }

  public long getAmountOut() {
    return amountOut;
  }

  public void setAmountOut(long amountOut) {
    this.amountOut = amountOut;
  }

  public long getPrice() {
    return price;
  }

  public void setPrice(long price) {
    this.price = price;
  }

  public int getSwapsExecuted() {
    return swapsExecuted;
  }

  public void setSwapsExecuted(int swapsExecuted) {
    this.swapsExecuted = swapsExecuted;
  }

  public long getRemainingBalance() {
    return remainingBalance;
  }

  public void setRemainingBalance(long remainingBalance) {
    this.remainingBalance = remainingBalance;
  }

  public Instant getExecutedAt() {
    return executedAt;
  }

  public void setExecutedAt(Instant executedAt) {
    this.executedAt = executedAt;
  }

  public boolean isCompleted() {
    return completed;
  }

  public void setCompleted(boolean completed) {
    this.completed = completed;
  }

  public long getRefunded() {
    return refunded;
  }

  public void setRefunded(long refunded) {
    this.refunded = refunded;
  }
}
