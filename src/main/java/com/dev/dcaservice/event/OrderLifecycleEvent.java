package com.dev.dcaservice.event;

import java.time.Instant;
import java.util.UUID;
import org.springframework.context.ApplicationEvent;

/**
 * Published whenever an order is created, executed, completed or cancelled.
 *
 * <p>Which payload fields are meaningful depends on the type:</p>
 * <ul>
 *   <li>CREATED: {@code remainingBalance} (the committed total)</li>
 *   <li>EXECUTED: {@code amountIn}, {@code amountOut}, {@code price}, {@code swapsExecuted}
 *   and {@code remainingBalance} after the debit</li>
 *   <li>COMPLETED: {@code swapsExecuted} and the refunded {@code remainingBalance}</li>
 *   <li>CANCELLED: the refunded {@code remainingBalance}</li>
 * </ul>
 *
 * <p>Events are published after the state change and synchronously, so listeners see
 * them in the order the engine applied the transitions.</p>
 */
public class OrderLifecycleEvent extends ApplicationEvent {

  private final OrderEventType eventType;
  private final UUID orderId;
  private final String owner;
  private final Instant occurredAt;
  private final long amountIn;
  private final long amountOut;
  private final long price;
  private final int swapsExecuted;
  private final long remainingBalance;

  private OrderLifecycleEvent(Object source, OrderEventType eventType, UUID orderId,
                              String owner, Instant occurredAt, long amountIn,
                              long amountOut, long price, int swapsExecuted,
                              long remainingBalance) {
    super(source);
    this.eventType = eventType;
    this.orderId = orderId;
    this.owner = owner;
    this.occurredAt = occurredAt;
    this.amountIn = amountIn;
    this.amountOut = amountOut;
    this.price = price;
    this.swapsExecuted = swapsExecuted;
    this.remainingBalance = remainingBalance;
  }

  public static OrderLifecycleEvent created(Object source, UUID orderId, String owner,
                                            Instant at, long totalAmount) {
    return new OrderLifecycleEvent(source, OrderEventType.CREATED, orderId, owner, at,
        0L, 0L, 0L, 0, totalAmount);
  }

  public static OrderLifecycleEvent executed(Object source, UUID orderId, String owner,
                                             Instant at, long amountIn, long amountOut,
                                             long price, int swapsExecuted,
                                             long remainingBalance) {
    return new OrderLifecycleEvent(source, OrderEventType.EXECUTED, orderId, owner, at,
        amountIn, amountOut, price, swapsExecuted, remainingBalance);
  }

  public static OrderLifecycleEvent completed(Object source, UUID orderId, String owner,
                                              Instant at, int swapsExecuted,
                                              long refunded) {
    return new OrderLifecycleEvent(source, OrderEventType.COMPLETED, orderId, owner, at,
        0L, 0L, 0L, swapsExecuted, refunded);
  }

  public static OrderLifecycleEvent cancelled(Object source, UUID orderId, String owner,
                                              Instant at, long refunded) {
    return new OrderLifecycleEvent(source, OrderEventType.CANCELLED, orderId, owner, at,
        0L, 0L, 0L, 0, refunded);
  }

  public OrderEventType getEventType() {
    return eventType;
  }

  public UUID getOrderId() {
    return orderId;
  }

  public String getOwner() {
    return owner;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }

  public long getAmountIn() {
    return amountIn;
  }

  public long getAmountOut() {
    return amountOut;
  }

  public long getPrice() {
    return price;
  }

  public int getSwapsExecuted() {
    return swapsExecuted;
  }

  public long getRemainingBalance() {
    return remainingBalance;
  }

  @Override
  public String toString() {
    return "OrderLifecycleEvent{type=" + eventType + ", orderId=" + orderId
        + ", owner='" + owner + "', swapsExecuted=" + swapsExecuted
        + ", remainingBalance=" + remainingBalance + '}';
  }
}
