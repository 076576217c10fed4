package com.dev.dcaservice.service;

import com.dev.dcaservice.dto.CreateOrderRequest;
import com.dev.dcaservice.event.OrderLifecycleEvent;
import com.dev.dcaservice.exception.InsufficientFeeException;
import com.dev.dcaservice.exception.InvalidConfigurationException;
import com.dev.dcaservice.exception.InvalidScheduleException;
import com.dev.dcaservice.gateway.FundsCustody;
import com.dev.dcaservice.model.Frequency;
import com.dev.dcaservice.model.Order;
import com.dev.dcaservice.store.OrderStore;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Validates creation parameters, derives the schedule and registers new orders.
 *
 * <p>
 * Behavior:
 * </p>
 * <ol>
 * <li>Check the engine is initialized and the parameters are valid</li>
 * <li>Derive {@code totalSwaps} and {@code amountPerSwap}</li>
 * <li>Pull {@code totalAmount + feePayment} into custody in one transfer</li>
 * <li>Insert the order and announce it</li>
 * </ol>
 *
 * <p>Nothing is stored before the custody transfer succeeds.</p>
 */
@Service
public class OrderFactory {

  private static final Logger log = LoggerFactory.getLogger(OrderFactory.class);

  static final long SECONDS_PER_DAY = 86_400L;

  private final OrderStore orderStore;
  private final FundsCustody fundsCustody;
  private final EngineSettingsService settings;
  private final ApplicationEventPublisher eventPublisher;
  private final AtomicLong sequence = new AtomicLong();

  /**
   * Constructs the factory.
   *
   * @param orderStore registry receiving new orders
   * @param fundsCustody custody pulling the budget and fee
   * @param settings engine settings (initialization, fee)
   * @param eventPublisher publisher for lifecycle notifications
   */
  public OrderFactory(OrderStore orderStore, FundsCustody fundsCustody,
                      EngineSettingsService settings,
                      ApplicationEventPublisher eventPublisher) {
    this.orderStore = orderStore;
    this.fundsCustody = fundsCustody;
    this.settings = settings;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Creates and registers a new order.
   *
   * @param owner funding account
   * @param req schedule parameters
   * @param now creation time
   * @return the stored order
   */
  public Order createOrder(String owner, CreateOrderRequest req, Instant now) {
    settings.requireInitialized();
    if (owner == null || owner.isBlank()) {
      throw new InvalidConfigurationException("Order owner must be provided");
    }
    validate(req);

    long fee = settings.getExecutionFee();
    if (req.getFeePayment() < fee) {
      throw new InsufficientFeeException("Fee payment " + req.getFeePayment()
          + " is below the execution fee " + fee);
    }

    int totalSwaps = totalSwaps(req.getDurationDays(), req.getFrequency());
    long amountPerSwap = req.getTotalAmount() / totalSwaps;
    if (amountPerSwap == 0) {
      throw new InvalidScheduleException("Total amount " + req.getTotalAmount()
          + " cannot fund " + totalSwaps + " swaps");
    }
    long durationSeconds = req.getDurationDays() * SECONDS_PER_DAY;

    long charge;
    try {
      charge = Math.addExact(req.getTotalAmount(), req.getFeePayment());
    } catch (ArithmeticException e) {
      throw new InvalidScheduleException("Total amount plus fee overflows");
    }
    // throws CustodyTransferFailedException before anything is stored
    fundsCustody.transferIn(owner, charge);
    settings.recordFee(req.getFeePayment());

    Order order = new Order();
    order.setId(nextId(owner, now));
    order.setOwner(owner);
    order.setTotalAmount(req.getTotalAmount());
    order.setAmountPerSwap(amountPerSwap);
    order.setFrequency(req.getFrequency());
    order.setCreatedAt(now);
    order.setLastExecutionTime(now);
    order.setEndTime(now.plus(Duration.ofSeconds(durationSeconds)));
    order.setMinPrice(req.getMinPrice());
    order.setMaxPrice(req.getMaxPrice());
    order.setSwapsExecuted(0);
    order.setTotalSwaps(totalSwaps);
    order.setRemainingBalance(req.getTotalAmount());
    order.setFeePaid(req.getFeePayment());
    orderStore.insert(order);

    log.info("Created order {} for {}: {} x {} every {}, ends {}", order.getId(), owner,
        totalSwaps, amountPerSwap, order.getFrequency(), order.getEndTime());
    eventPublisher.publishEvent(OrderLifecycleEvent.created(this, order.getId(), owner, now,
        order.getTotalAmount()));
    return order.copy();
  }

  /**
   * Number of executions a schedule allows: {@code floor(durationDays * 86400 / frequency)}.
   *
   * @param durationDays positive duration in days
   * @param frequency cadence
   * @return planned execution count, at least one
   * @throws InvalidScheduleException if the duration is shorter than one interval
   */
  static int totalSwaps(long durationDays, Frequency frequency) {
    long durationSeconds;
    try {
      durationSeconds = Math.multiplyExact(durationDays, SECONDS_PER_DAY);
    } catch (ArithmeticException e) {
      throw new InvalidScheduleException("Duration is too long: " + durationDays + " days");
    }
    long swaps = durationSeconds / frequency.getSeconds();
    if (swaps == 0) {
      throw new InvalidScheduleException("Duration of " + durationDays
          + " days is shorter than one " + frequency + " interval");
    }
    if (swaps > Integer.MAX_VALUE) {
      throw new InvalidScheduleException("Schedule has too many swaps: " + swaps);
    }
    return (int) swaps;
  }

  private static void validate(CreateOrderRequest req) {
    if (req == null) {
      throw new InvalidScheduleException("Order parameters must be provided");
    }
    if (req.getTotalAmount() <= 0) {
      throw new InvalidScheduleException("Total amount must be positive");
    }
    if (req.getDurationDays() <= 0) {
      throw new InvalidScheduleException("Duration must be positive");
    }
    if (req.getFrequency() == null) {
      throw new InvalidScheduleException("Frequency must be one of HOURLY, DAILY, WEEKLY, "
          + "MONTHLY");
    }
    if (req.getMinPrice() < 0 || req.getMaxPrice() < 0) {
      throw new InvalidScheduleException("Price bounds must not be negative");
    }
    if (req.getMinPrice() != 0 && req.getMaxPrice() != 0
        && req.getMinPrice() > req.getMaxPrice()) {
      throw new InvalidScheduleException("Minimum price " + req.getMinPrice()
          + " exceeds maximum price " + req.getMaxPrice());
    }
    if (req.getFeePayment() < 0) {
      throw new InvalidScheduleException("Fee payment must not be negative");
    }
  }

  /**
   * Derives an id from owner, creation instant and a process-wide sequence, so two orders
   * created by one owner in the same instant still get distinct ids.
   */
  private UUID nextId(String owner, Instant now) {
    String seed = owner + '|' + now.getEpochSecond() + '|' + now.getNano() + '|'
        + sequence.incrementAndGet();
    return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8));
  }
}
