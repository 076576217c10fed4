package com.dev.dcaservice.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.dev.dcaservice.event.OrderEventType;
import com.dev.dcaservice.event.OrderLifecycleEvent;
import com.dev.dcaservice.model.ExecutionRecord;
import com.dev.dcaservice.model.OrderEventRecord;
import com.dev.dcaservice.repository.ExecutionRepository;
import com.dev.dcaservice.repository.OrderEventRepository;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

/**
 * Unit tests for OrderEventRecorder.
 */
@ExtendWith(MockitoExtension.class)
class OrderEventRecorderTest {

  private static final Instant NOW = Instant.parse("2024-01-02T00:00:00Z");

  @Mock
  private OrderEventRepository orderEventRepository;

  @Mock
  private ExecutionRepository executionRepository;

  private OrderEventRecorder recorder;

  @BeforeEach
  void setUp() {
    recorder = new OrderEventRecorder(orderEventRepository, executionRepository);
  }

  @Test
  void testOnExecuted_SavesEventAndExecution_TypicalCase() {
    // Arrange
    UUID orderId = UUID.randomUUID();
    OrderLifecycleEvent event = OrderLifecycleEvent.executed(this, orderId, "alice", NOW,
        3, 3000, 1000, 1, 97);

    // Act
    recorder.onLifecycleEvent(event);

    // Assert
    ArgumentCaptor<OrderEventRecord> eventCaptor =
        ArgumentCaptor.forClass(OrderEventRecord.class);
    verify(orderEventRepository).save(eventCaptor.capture());
    OrderEventRecord record = eventCaptor.getValue();
    assertEquals(OrderEventType.EXECUTED, record.getEventType());
    assertEquals(3L, record.getAmountIn());
    assertEquals(3000L, record.getAmountOut());
    assertEquals(1, record.getSwapsExecuted());
    assertEquals(97L, record.getRemainingBalance());

    ArgumentCaptor<ExecutionRecord> execCaptor = ArgumentCaptor.forClass(ExecutionRecord.class);
    verify(executionRepository).save(execCaptor.capture());
    assertEquals(orderId, execCaptor.getValue().getOrderId());
    assertEquals(1000, execCaptor.getValue().getPrice());
    assertEquals(NOW, execCaptor.getValue().getExecutedAt());
  }

  @Test
  void testOnCancelled_SavesEventOnly() {
    OrderLifecycleEvent event = OrderLifecycleEvent.cancelled(this, UUID.randomUUID(),
        "alice", NOW, 100);

    recorder.onLifecycleEvent(event);

    ArgumentCaptor<OrderEventRecord> captor = ArgumentCaptor.forClass(OrderEventRecord.class);
    verify(orderEventRepository).save(captor.capture());
    assertEquals(OrderEventType.CANCELLED, captor.getValue().getEventType());
    assertNull(captor.getValue().getAmountIn());
    verify(executionRepository, never()).save(any());
  }

  @Test
  void testOnEvent_RepositoryFails_DoesNotPropagate() {
    when(orderEventRepository.save(any(OrderEventRecord.class)))
        .thenThrow(new DataAccessResourceFailureException("db down"));
    OrderLifecycleEvent event = OrderLifecycleEvent.created(this, UUID.randomUUID(),
        "alice", NOW, 100);

    recorder.onLifecycleEvent(event);

    verify(executionRepository, never()).save(any());
  }
}
