package com.dev.dcaservice.model;

import com.dev.dcaservice.event.OrderEventType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Entity representing a persisted order lifecycle notification.
 * Kept after the order itself has been removed from the active set.
 */
@Entity
@Table(name = "order_events", indexes = {
  @Index(name = "idx_order_events_order_id", columnList = "order_id")
})
public class OrderEventRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.AUTO)
  private UUID id;

  @Column(name = "ts", nullable = false)
  private Instant ts;

  @Column(name = "order_id", nullable = false)
  private UUID orderId;

  @Column(name = "owner", nullable = false)
  private String owner;

  @Enumerated(EnumType.STRING)
  @Column(name = "event_type", nullable = false)
  private OrderEventType eventType;

  @Column(name = "amount_in")
  private Long amountIn;

  @Column(name = "amount_out")
  private Long amountOut;

  @Column(name = "swaps_executed")
  private Integer swapsExecuted;

  @Column(name = "remaining_balance")
  private Long remainingBalance;

  /**
   * Default constructor for JPA.
   */
  public OrderEventRecord() {
    this.ts = Instant.now();
  }

  /**
   * Constructor with the fields common to every event.
   *
   * @param orderId order the event refers to
   * @param owner owning account
   * @param eventType lifecycle transition
   * @param ts when the transition happened
   */
  public OrderEventRecord(UUID orderId, String owner, OrderEventType eventType, Instant ts) {
    this.orderId = orderId;
    this.owner = owner;
    this.eventType = eventType;
    this.ts = ts;
  }

  // Getters and Setters

  public UUID getId() {
    return id;
  }

  public void setId(UUID id) {
    this.id = id;
  }

  public Instant getTs() {
    return ts;
  }

  public void setTs(Instant ts) {
    this.ts = ts;
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

  public OrderEventType getEventType() {
    return eventType;
  }

  public void setEventType(OrderEventType eventType) {
    this.eventType = eventType;
  }

  public Long getAmountIn() {
    return amountIn;
  }

  public void setAmountIn(Long amountIn) {
    this.amountIn = amountIn;
  }

  public Long getAmountOut() {
    return amountOut;
  }

  public void setAmountOut(Long amountOut) {
    this.amountOut = amountOut;
  }

  public Integer getSwapsExecuted() {
    return swapsExecuted;
  }

  public void setSwapsExecuted(Integer swapsExecuted) {
    this.swapsExecuted = swapsExecuted;
  }

  public Long getRemainingBalance() {
    return remainingBalance;
  }

  public void setRemainingBalance(Long remainingBalance) {
    this.remainingBalance = remainingBalance;
  }

  @Override
  public String toString() {
    return "OrderEventRecord{"
        + "id=" + id
        + ", ts=" + ts
        + ", orderId=" + orderId
        + ", owner='" + owner + '\''
        + ", eventType=" + eventType
        + ", amountIn=" + amountIn
        + ", amountOut=" + amountOut
        + ", swapsExecuted=" + swapsExecuted
        + ", remainingBalance=" + remainingBalance
        + '}';
  }
}
