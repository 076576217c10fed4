package com.dev.dcaservice.dto;

import com.dev.dcaservice.model.TerminationReason;
import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of removing an order from the active set.
 */
public class TerminationResult {

  private UUID orderId;
  private String owner;
  private TerminationReason reason;
  private int swapsExecuted;
  private long refunded;
  private Instant terminatedAt;

  /**
   * Default constructor.
   */
  public TerminationResult() {
    // Default constructor for framework use
  }

  /**
   * Constructs a TerminationResult with all fields.
   *
   * @param orderId removed order
   * @param owner owning account
   * @param reason completed or cancelled
   * @param swapsExecuted executions performed before removal
   * @param refunded unspent balance returned to the owner
   * @param terminatedAt removal time
   */
  public TerminationResult(UUID orderId, String owner, TerminationReason reason,
                           int swapsExecuted, long refunded, Instant terminatedAt) {
    this.orderId = orderId;
    this.owner = owner;
    this.reason = reason;
    this.swapsExecuted = swapsExecuted;
    this.refunded = refunded;
    this.terminatedAt = terminatedAt;
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

  public TerminationReason getReason() {
    return reason;
  }

  public void setReason(TerminationReason reason) {
    this.reason = reason;
  }

  public int getSwapsExecuted() {
    return swapsExecuted;
  }

  public void setSwapsExecuted(int swapsExecuted) {
    this.swapsExecuted = swapsExecuted;
  }

  public long getRefunded() {
    return refunded;
  }

  public void setRefunded(long refunded) {
    this.refunded = refunded;
  }

  public Instant getTerminatedAt() {
    return terminatedAt;
  }

  public void setTerminatedAt(Instant terminatedAt) {
    this.terminatedAt = terminatedAt;
  }
}
