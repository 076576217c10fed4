package com.dev.dcaservice.service;

import com.dev.dcaservice.dto.CreateOrderRequest;
import com.dev.dcaservice.dto.ExecutionResult;
import com.dev.dcaservice.dto.PreAuthorizationResult;
import com.dev.dcaservice.dto.TerminationResult;
import com.dev.dcaservice.exception.OrderNotFoundException;
import com.dev.dcaservice.exception.UnauthorizedException;
import com.dev.dcaservice.gateway.PriceOracle;
import com.dev.dcaservice.model.ExecutionRecord;
import com.dev.dcaservice.model.Order;
import com.dev.dcaservice.model.OrderEventRecord;
import com.dev.dcaservice.repository.ExecutionRepository;
import com.dev.dcaservice.repository.OrderEventRepository;
import com.dev.dcaservice.store.OrderStore;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Order lifecycle service used by the REST layer.
 *
 * <p>
 * Responsibilities:
 * </p>
 * <ul>
 * <li>Create orders through the {@link OrderFactory}</li>
 * <li>Execute a given order, or the next due one, at the current clock time and oracle
 * price</li>
 * <li>Cancel orders on behalf of their owners</li>
 * <li>Query active orders, due orders and execution history</li>
 * </ul>
 *
 * <p>Every state-changing or state-reading call on the active set holds this service's
 * monitor, so actions run one at a time and never see a half-applied change.</p>
 */
@Service
public class DcaOrderService {

  private static final Logger log = LoggerFactory.getLogger(DcaOrderService.class);

  private final OrderStore orderStore;
  private final OrderFactory orderFactory;
  private final DueOrderScanner scanner;
  private final ExecutionEngine executionEngine;
  private final LifecycleTerminator terminator;
  private final EngineSettingsService settings;
  private final PriceOracle priceOracle;
  private final ExecutionRepository executionRepository;
  private final OrderEventRepository orderEventRepository;
  private final Clock clock;

  /**
   * Constructs the service.
   *
   * @param orderStore registry of active orders
   * @param orderFactory creator of new orders
   * @param scanner due-order scanner
   * @param executionEngine execution engine
   * @param terminator lifecycle terminator
   * @param settings engine settings
   * @param priceOracle source of the current price
   * @param executionRepository execution history
   * @param orderEventRepository lifecycle event history
   * @param clock time source
   */
  public DcaOrderService(OrderStore orderStore, OrderFactory orderFactory,
                         DueOrderScanner scanner, ExecutionEngine executionEngine,
                         LifecycleTerminator terminator, EngineSettingsService settings,
                         PriceOracle priceOracle, ExecutionRepository executionRepository,
                         OrderEventRepository orderEventRepository, Clock clock) {
    this.orderStore = orderStore;
    this.orderFactory = orderFactory;
    this.scanner = scanner;
    this.executionEngine = executionEngine;
    this.terminator = terminator;
    this.settings = settings;
    this.priceOracle = priceOracle;
    this.executionRepository = executionRepository;
    this.orderEventRepository = orderEventRepository;
    this.clock = clock;
  }

  /**
   * Creates a new order funded by {@code owner}.
   *
   * @param owner funding account
   * @param req schedule parameters
   * @return the stored order
   */
  public synchronized Order createOrder(String owner, CreateOrderRequest req) {
    return orderFactory.createOrder(owner, req, clock.instant());
  }

  /**
   * Returns a copy of an active order.
   *
   * @param orderId order identifier
   * @return order details
   * @throws OrderNotFoundException if the order is not active
   */
  public synchronized Order getOrder(UUID orderId) {
    return orderStore.get(orderId)
        .map(Order::copy)
        .orElseThrow(() -> new OrderNotFoundException(orderId));
  }

  public synchronized int countActive() {
    return orderStore.count();
  }

  public synchronized boolean isActive(UUID orderId) {
    return orderStore.containsId(orderId);
  }

  /**
   * Lists orders due at the current time, longest-waiting first.
   *
   * @return due orders
   */
  public synchronized List<Order> findDueOrders() {
    return scanner.findAllDue(clock.instant());
  }

  /**
   * Executes one swap of the given order at the current time and oracle price.
   *
   * @param orderId order to execute
   * @param caller calling identity, must be the trusted agent
   * @return the booked execution
   */
  public synchronized ExecutionResult executeOrder(UUID orderId, String caller) {
    long price = priceOracle.latestPrice().getValue();
    return executionEngine.execute(orderId, clock.instant(), price, caller);
  }

  /**
   * Scans for the longest-waiting due order and executes it.
   *
   * @param caller calling identity, must be the trusted agent
   * @return the booked execution, or empty when nothing is due
   */
  public synchronized Optional<ExecutionResult> executeNextDue(String caller) {
    if (!settings.isAgent(caller)) {
      throw new UnauthorizedException("Caller " + caller + " is not the trusted agent");
    }
    Instant now = clock.instant();
    Optional<UUID> due = scanner.findDue(now);
    if (due.isEmpty()) {
      log.debug("No order due at {}", now);
      return Optional.empty();
    }
    long price = priceOracle.latestPrice().getValue();
    return Optional.of(executionEngine.execute(due.get(), now, price, caller));
  }

  /**
   * Runs the pre-trade check for the given order at the current oracle price.
   *
   * @param orderId order to check
   * @param caller calling identity, must be the trusted agent
   * @return the amount the next execution will debit
   */
  public synchronized PreAuthorizationResult preAuthorize(UUID orderId, String caller) {
    long price = priceOracle.latestPrice().getValue();
    return executionEngine.preAuthorize(orderId, price, caller);
  }

  /**
   * Cancels an order and refunds its remaining balance to the owner.
   *
   * @param orderId order to cancel
   * @param caller requesting account, must be the owner
   * @return what was removed and refunded
   */
  public synchronized TerminationResult cancel(UUID orderId, String caller) {
    return terminator.cancel(orderId, caller, clock.instant());
  }

  /**
   * Returns the execution history of an order, including orders no longer active.
   *
   * @param orderId order identifier
   * @return executions, oldest first
   */
  public List<ExecutionRecord> getExecutions(UUID orderId) {
    return executionRepository.findByOrderId(orderId);
  }

  /**
   * Returns the recorded lifecycle events of an order.
   *
   * @param orderId order identifier
   * @return events, oldest first
   */
  public List<OrderEventRecord> getEvents(UUID orderId) {
    return orderEventRepository.findByOrderIdOrderByTsAsc(orderId);
  }
}
