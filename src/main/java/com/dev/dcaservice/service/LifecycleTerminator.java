package com.dev.dcaservice.service;

import com.dev.dcaservice.dto.TerminationResult;
import com.dev.dcaservice.event.OrderLifecycleEvent;
import com.dev.dcaservice.exception.CustodyTransferFailedException;
import com.dev.dcaservice.exception.NotOrderOwnerException;
import com.dev.dcaservice.exception.OrderNotFoundException;
import com.dev.dcaservice.gateway.FundsCustody;
import com.dev.dcaservice.model.Order;
import com.dev.dcaservice.model.TerminationReason;
import com.dev.dcaservice.store.OrderStore;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Removes completed or cancelled orders and refunds their unspent balance.
 *
 * <p>This is the only component that deletes orders and the only one that refunds.
 * Removal and refund go together: if the refund fails the order is put back unchanged
 * and the failure is raised.</p>
 */
@Service
public class LifecycleTerminator {

  private static final Logger log = LoggerFactory.getLogger(LifecycleTerminator.class);

  private final OrderStore orderStore;
  private final FundsCustody fundsCustody;
  private final ApplicationEventPublisher eventPublisher;

  /**
   * Constructs the terminator.
   *
   * @param orderStore registry of active orders
   * @param fundsCustody custody used for refunds
   * @param eventPublisher publisher for lifecycle notifications
   */
  public LifecycleTerminator(OrderStore orderStore, FundsCustody fundsCustody,
                             ApplicationEventPublisher eventPublisher) {
    this.orderStore = orderStore;
    this.fundsCustody = fundsCustody;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Cancels an order on behalf of its owner. Allowed at any time.
   *
   * @param orderId order to cancel
   * @param caller requesting account, must be the owner
   * @param now cancellation time
   * @return what was removed and refunded
   * @throws OrderNotFoundException if the order is not active
   * @throws NotOrderOwnerException if the caller is not the owner
   * @throws CustodyTransferFailedException if the refund fails; the order stays active
   */
  public TerminationResult cancel(UUID orderId, String caller, Instant now) {
    Order order = orderStore.get(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
    if (!order.getOwner().equals(caller)) {
      throw new NotOrderOwnerException("Caller " + caller + " does not own order " + orderId);
    }
    TerminationResult result = terminate(orderId, TerminationReason.CANCELLED, now);
    announce(result);
    return result;
  }

  /**
   * Removes an order and refunds its remaining balance, without announcing it.
   * Callers follow up with {@link #announce(TerminationResult)} once their own
   * notifications are out.
   *
   * @param orderId order to remove
   * @param reason why it is removed
   * @param now removal time
   * @return what was removed and refunded
   * @throws OrderNotFoundException if the order is not active
   * @throws CustodyTransferFailedException if the refund fails; the order is re-inserted
   */
  public TerminationResult terminate(UUID orderId, TerminationReason reason, Instant now) {
    Order order = orderStore.removeById(orderId)
        .orElseThrow(() -> new OrderNotFoundException(orderId));
    long refund = order.getRemainingBalance();
    if (refund > 0) {
      try {
        fundsCustody.transferOut(order.getOwner(), refund);
      } catch (RuntimeException e) {
        orderStore.insert(order);
        log.error("Refund of {} to {} failed; order {} restored", refund, order.getOwner(),
            orderId, e);
        if (e instanceof CustodyTransferFailedException) {
          throw e;
        }
        throw new CustodyTransferFailedException("Refund failed for order " + orderId, e);
      }
    }
    log.info("Order {} {} after {} swaps; refunded {}", orderId,
        reason == TerminationReason.COMPLETED ? "completed" : "cancelled",
        order.getSwapsExecuted(), refund);
    return new TerminationResult(orderId, order.getOwner(), reason, order.getSwapsExecuted(),
        refund, now);
  }

  /**
   * Publishes the notification for a finished termination.
   *
   * @param result outcome returned by {@link #terminate}
   */
  public void announce(TerminationResult result) {
    if (result.getReason() == TerminationReason.COMPLETED) {
      eventPublisher.publishEvent(OrderLifecycleEvent.completed(this, result.getOrderId(),
          result.getOwner(), result.getTerminatedAt(), result.getSwapsExecuted(),
          result.getRefunded()));
    } else {
      eventPublisher.publishEvent(OrderLifecycleEvent.cancelled(this, result.getOrderId(),
          result.getOwner(), result.getTerminatedAt(), result.getRefunded()));
    }
  }
}
