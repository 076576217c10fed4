package com.dev.dcaservice.model;

import java.time.Instant;
import java.util.UUID;

/**
 * One completed partial execution of an order.
 * History rows outlive the order itself.
 */
public class ExecutionRecord {

  private UUID id;
  private UUID orderId;
  private String owner;
  private long amountIn;
  private long amountOut;
  private long price;
  private Instant executedAt;

  /**
   * Default constructor.
   */
  public ExecutionRecord() {
    // Default constructor for framework use
  }

  /**
   * Constructs an execution record with all fields.
   *
   * @param id unique record identifier
   * @param orderId order that was executed
   * @param owner owning account
   * @param amountIn funding amount debited
   * @param amountOut target amount reported by the exchange
   * @param price oracle price used for the gate
   * @param executedAt execution timestamp
   */
  public ExecutionRecord(UUID id, UUID orderId, String owner, long amountIn, long amountOut,
                         long price, Instant executedAt) {
    this.id = id;
    this.orderId = orderId;
    this.owner = owner;
    this.amountIn = amountIn;
    this.amountOut = amountOut;
    this.price = price;
    this.executedAt = executedAt;
  }

  public UUID getId() {
    return id;
  }

  public void setId(UUID id) {
    this.id = id;
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

  public Instant getExecutedAt() {
    return executedAt;
  }

  public void setExecutedAt(Instant executedAt) {
    this.executedAt = executedAt;
  }

  @Override
  public String toString() {
    return "ExecutionRecord{"
        + "id=" + id
        + ", orderId=" + orderId
        + ", owner='" + owner + '\''
        + ", amountIn=" + amountIn
        + ", amountOut=" + amountOut
        + ", price=" + price
        + ", executedAt=" + executedAt
        + '}';
  }
}
