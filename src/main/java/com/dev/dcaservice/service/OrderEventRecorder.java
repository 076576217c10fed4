package com.dev.dcaservice.service;

import com.dev.dcaservice.event.OrderEventType;
import com.dev.dcaservice.event.OrderLifecycleEvent;
import com.dev.dcaservice.model.ExecutionRecord;
import com.dev.dcaservice.model.OrderEventRecord;
import com.dev.dcaservice.repository.ExecutionRepository;
import com.dev.dcaservice.repository.OrderEventRepository;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Persists lifecycle notifications: every event goes to {@code order_events}, executions
 * also to {@code executions}.
 */
@Service
public class OrderEventRecorder {

  private static final Logger log = LoggerFactory.getLogger(OrderEventRecorder.class);

  private final OrderEventRepository orderEventRepository;
  private final ExecutionRepository executionRepository;

  public OrderEventRecorder(OrderEventRepository orderEventRepository,
                            ExecutionRepository executionRepository) {
    this.orderEventRepository = orderEventRepository;
    this.executionRepository = executionRepository;
  }

  /**
   * Records one lifecycle event.
   *
   * @param event the published event
   */
  @EventListener
  public void onLifecycleEvent(OrderLifecycleEvent event) {
    try {
      orderEventRepository.save(toRecord(event));
      if (event.getEventType() == OrderEventType.EXECUTED) {
        executionRepository.save(new ExecutionRecord(UUID.randomUUID(), event.getOrderId(),
            event.getOwner(), event.getAmountIn(), event.getAmountOut(), event.getPrice(),
            event.getOccurredAt()));
      }
    } catch (Exception e) {
      // Order state is already applied; history is best effort
      log.error("Failed to record {} event for order {}", event.getEventType(),
          event.getOrderId(), e);
    }
  }

  private static OrderEventRecord toRecord(OrderLifecycleEvent event) {
    OrderEventRecord record = new OrderEventRecord(event.getOrderId(), event.getOwner(),
        event.getEventType(), event.getOccurredAt());
    record.setRemainingBalance(event.getRemainingBalance());
    switch (event.getEventType()) {
      case EXECUTED:
        record.setAmountIn(event.getAmountIn());
        record.setAmountOut(event.getAmountOut());
        record.setSwapsExecuted(event.getSwapsExecuted());
        break;
      case COMPLETED:
        record.setSwapsExecuted(event.getSwapsExecuted());
        break;
      default:
        break;
    }
    return record;
  }
}
