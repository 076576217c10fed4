package com.dev.dcaservice.service;

import com.dev.dcaservice.dto.ExecutionResult;
import com.dev.dcaservice.dto.PreAuthorizationResult;
import com.dev.dcaservice.dto.TerminationResult;
import com.dev.dcaservice.event.OrderLifecycleEvent;
import com.dev.dcaservice.exception.CustodyTransferFailedException;
import com.dev.dcaservice.exception.ErrorCode;
import com.dev.dcaservice.exception.ExchangeRejectedException;
import com.dev.dcaservice.exception.ExecutionRejectedException;
import com.dev.dcaservice.exception.OrderNotFoundException;
import com.dev.dcaservice.exception.UnauthorizedException;
import com.dev.dcaservice.gateway.ExchangeExecutor;
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
 * Runs one partial execution of a due order.
 *
 * <p>Gates are checked in a fixed order and each fails with its own code:</p>
 * <ol>
 * <li>caller is the trusted agent ({@code UNAUTHORIZED})</li>
 * <li>order is active ({@code ORDER_NOT_FOUND})</li>
 * <li>interval has elapsed ({@code TOO_EARLY})</li>
 * <li>deadline has not passed ({@code PERIOD_ENDED})</li>
 * <li>balance covers one swap ({@code INSUFFICIENT_BALANCE})</li>
 * <li>price within bounds ({@code PRICE_BELOW_MINIMUM} / {@code PRICE_ABOVE_MAXIMUM})</li>
 * </ol>
 *
 * <p>This is the single place the order balance is debited. The pre-authorization check
 * evaluates the same gates plus the fee but never debits.</p>
 */
@Service
public class ExecutionEngine {

  private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

  private final OrderStore orderStore;
  private final ExchangeExecutor exchange;
  private final LifecycleTerminator terminator;
  private final EngineSettingsService settings;
  private final ApplicationEventPublisher eventPublisher;

  /**
   * Constructs the engine.
   *
   * @param orderStore registry of active orders
   * @param exchange exchange performing the conversion
   * @param terminator terminator for completed orders
   * @param settings engine settings (trusted agent, fee)
   * @param eventPublisher publisher for lifecycle notifications
   */
  public ExecutionEngine(OrderStore orderStore, ExchangeExecutor exchange,
                         LifecycleTerminator terminator, EngineSettingsService settings,
                         ApplicationEventPublisher eventPublisher) {
    this.orderStore = orderStore;
    this.exchange = exchange;
    this.terminator = terminator;
    this.settings = settings;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Executes one swap of an order.
   *
   * @param orderId order to execute
   * @param now execution time
   * @param currentPrice oracle price used for the gate
   * @param caller calling identity, must be the trusted agent
   * @return the booked execution, including completion details
   */
  public ExecutionResult execute(UUID orderId, Instant now, long currentPrice, String caller) {
    requireAgent(caller);
    Order order = orderStore.get(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));

    if (now.isBefore(order.nextEligibleTime())) {
      throw new ExecutionRejectedException(ErrorCode.TOO_EARLY, "Order " + orderId
          + " is not eligible before " + order.nextEligibleTime());
    }
    if (now.isAfter(order.getEndTime())) {
      throw new ExecutionRejectedException(ErrorCode.PERIOD_ENDED, "Order " + orderId
          + " ended at " + order.getEndTime());
    }
    if (order.getRemainingBalance() < order.getAmountPerSwap()) {
      throw new ExecutionRejectedException(ErrorCode.INSUFFICIENT_BALANCE, "Order " + orderId
          + " holds " + order.getRemainingBalance() + ", needs " + order.getAmountPerSwap());
    }
    checkPriceBounds(order, currentPrice);

    long amountIn = order.getAmountPerSwap();
    long amountOut = convert(orderId, amountIn);

    Order before = order.copy();
    order.setRemainingBalance(order.getRemainingBalance() - amountIn);
    order.setSwapsExecuted(order.getSwapsExecuted() + 1);
    order.setLastExecutionTime(now);

    boolean completed = order.getSwapsExecuted() >= order.getTotalSwaps()
        || !now.isBefore(order.getEndTime())
        || order.getRemainingBalance() < order.getAmountPerSwap();

    TerminationResult termination = null;
    if (completed) {
      try {
        termination = terminator.terminate(orderId, TerminationReason.COMPLETED, now);
      } catch (CustodyTransferFailedException e) {
        // the terminator has put the order back; roll its counters back as well
        orderStore.replace(before);
        log.error("Execution of order {} rolled back; exchange output {} is unbooked",
            orderId, amountOut);
        throw e;
      }
    }

    log.info("Executed order {}: swap {}/{} in={} out={} price={} remaining={}", orderId,
        order.getSwapsExecuted(), order.getTotalSwaps(), amountIn, amountOut, currentPrice,
        order.getRemainingBalance());
    eventPublisher.publishEvent(OrderLifecycleEvent.executed(this, orderId, order.getOwner(),
        now, amountIn, amountOut, currentPrice, order.getSwapsExecuted(),
        order.getRemainingBalance()));
    if (termination != null) {
      terminator.announce(termination);
    }

    return new ExecutionResult(orderId, order.getOwner(), amountIn, amountOut, currentPrice,
        order.getSwapsExecuted(), order.getRemainingBalance(), now, completed,
        termination != null ? termination.getRefunded() : 0L);
  }

  /**
   * Pre-trade check used when the agent routes an execution through the exchange.
   * Validates price bounds and that the balance covers one swap plus the execution fee.
   * Read-only: the debit happens in {@link #execute}.
   *
   * @param orderId order to check
   * @param currentPrice oracle price
   * @param caller calling identity, must be the trusted agent
   * @return the amount the next execution will debit
   */
  public PreAuthorizationResult preAuthorize(UUID orderId, long currentPrice, String caller) {
    requireAgent(caller);
    Order order = orderStore.get(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
    checkPriceBounds(order, currentPrice);
    long fee = settings.getExecutionFee();
    long required = order.getAmountPerSwap() + fee;
    if (order.getRemainingBalance() < required) {
      throw new ExecutionRejectedException(ErrorCode.INSUFFICIENT_BALANCE, "Order " + orderId
          + " holds " + order.getRemainingBalance() + ", pre-trade check needs " + required);
    }
    return new PreAuthorizationResult(orderId, order.getAmountPerSwap(), fee, currentPrice);
  }

  private void requireAgent(String caller) {
    if (!settings.isAgent(caller)) {
      log.warn("Rejected execution request from {}", caller);
      throw new UnauthorizedException("Caller " + caller + " is not the trusted agent");
    }
  }

  private static void checkPriceBounds(Order order, long price) {
    if (order.getMinPrice() != 0 && price < order.getMinPrice()) {
      throw new ExecutionRejectedException(ErrorCode.PRICE_BELOW_MINIMUM, "Price " + price
          + " is below minimum " + order.getMinPrice());
    }
    if (order.getMaxPrice() != 0 && price > order.getMaxPrice()) {
      throw new ExecutionRejectedException(ErrorCode.PRICE_ABOVE_MAXIMUM, "Price " + price
          + " is above maximum " + order.getMaxPrice());
    }
  }

  private long convert(UUID orderId, long amountIn) {
    try {
      return exchange.execute(amountIn);
    } catch (ExchangeRejectedException e) {
      log.warn("Exchange rejected {} for order {}: {}", amountIn, orderId, e.getMessage());
      throw e;
    } catch (RuntimeException e) {
      throw new ExchangeRejectedException("Exchange failed for order " + orderId, e);
    }
  }
}
