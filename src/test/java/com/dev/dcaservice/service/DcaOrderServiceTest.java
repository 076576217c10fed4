package com.dev.dcaservice.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dev.dcaservice.MutableClock;
import com.dev.dcaservice.dto.CreateOrderRequest;
import com.dev.dcaservice.dto.ExecutionResult;
import com.dev.dcaservice.dto.TerminationResult;
import com.dev.dcaservice.exception.CustodyTransferFailedException;
import com.dev.dcaservice.exception.ErrorCode;
import com.dev.dcaservice.exception.ExecutionRejectedException;
import com.dev.dcaservice.exception.OrderNotFoundException;
import com.dev.dcaservice.exception.UnauthorizedException;
import com.dev.dcaservice.gateway.FundsCustody;
import com.dev.dcaservice.gateway.ManualPriceOracle;
import com.dev.dcaservice.gateway.OracleRateExchange;
import com.dev.dcaservice.model.Frequency;
import com.dev.dcaservice.model.Order;
import com.dev.dcaservice.store.OrderStore;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Scenario and property tests for DcaOrderService wired with real core components,
 * an in-memory custody ledger and a clock the test advances.
 */
@ExtendWith(MockitoExtension.class)
class DcaOrderServiceTest {

  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
  private static final String AGENT = "agent";

  @Mock
  private ApplicationEventPublisher eventPublisher;

  private MutableClock clock;
  private InMemoryCustody custody;
  private OrderStore store;
  private EngineSettingsService settings;
  private ManualPriceOracle oracle;
  private DcaOrderService service;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    custody = new InMemoryCustody();
    store = new OrderStore();
    settings = new EngineSettingsService(AGENT, 0);
    settings.initialize("oracle-1", "USDC", "WETH");
    oracle = new ManualPriceOracle(clock, 1000);
    OracleRateExchange exchange = new OracleRateExchange(oracle, 1000);
    LifecycleTerminator terminator = new LifecycleTerminator(store, custody, eventPublisher);
    ExecutionEngine engine = new ExecutionEngine(store, exchange, terminator, settings,
        eventPublisher);
    OrderFactory factory = new OrderFactory(store, custody, settings, eventPublisher);
    service = new DcaOrderService(store, factory, new DueOrderScanner(store), engine,
        terminator, settings, oracle, null, null, clock);
  }

  private static CreateOrderRequest request(long total, Frequency frequency, long days,
                                            long min, long max) {
    return new CreateOrderRequest(total, frequency, days, min, max, 0);
  }

  private static void assertAccounted(Order order) {
    assertEquals(order.getTotalAmount(),
        order.getRemainingBalance() + order.getAmountPerSwap() * order.getSwapsExecuted());
    assertTrue(order.getRemainingBalance() <= order.getTotalAmount());
    assertTrue(order.getSwapsExecuted() <= order.getTotalSwaps());
  }

  @Test
  void testScenario_PriceBoundedDailyOrder() {
    // Arrange
    custody.fund("alice", 100);
    Order order = service.createOrder("alice", request(100, Frequency.DAILY, 30, 900, 1100));
    assertEquals(30, order.getTotalSwaps());
    assertEquals(3, order.getAmountPerSwap());

    // Act: first swap at 1000
    clock.advance(Duration.ofDays(1));
    ExecutionResult result = service.executeOrder(order.getId(), AGENT);

    // Assert
    assertEquals(97, result.getRemainingBalance());
    assertEquals(1, result.getSwapsExecuted());

    // Next interval at 1200 is rejected and leaves the order unchanged
    clock.advance(Duration.ofDays(1));
    oracle.update(1200);
    ExecutionRejectedException ex = assertThrows(ExecutionRejectedException.class,
        () -> service.executeOrder(order.getId(), AGENT));
    assertEquals(ErrorCode.PRICE_ABOVE_MAXIMUM, ex.getErrorCode());
    Order after = service.getOrder(order.getId());
    assertEquals(97, after.getRemainingBalance());
    assertEquals(1, after.getSwapsExecuted());
    assertAccounted(after);
  }

  @Test
  void testScenario_RunToCompletion_NoRefund() {
    // Arrange: 10 over 5 days gives 2 per swap
    custody.fund("alice", 10);
    Order order = service.createOrder("alice", request(10, Frequency.DAILY, 5, 0, 0));
    assertEquals(2, order.getAmountPerSwap());

    // Act
    ExecutionResult last = null;
    for (int i = 0; i < 5; i++) {
      clock.advance(Duration.ofDays(1));
      last = service.executeOrder(order.getId(), AGENT);
    }

    // Assert
    assertTrue(last.isCompleted());
    assertEquals(0, last.getRemainingBalance());
    assertEquals(0, last.getRefunded());
    assertFalse(service.isActive(order.getId()));
    assertEquals(0, custody.balanceOf("alice"));
    assertThrows(OrderNotFoundException.class, () -> service.getOrder(order.getId()));
  }

  @Test
  void testScenario_CancelRightAfterCreate_RefundsAll() {
    // Arrange
    custody.fund("alice", 100);
    Order order = service.createOrder("alice", request(100, Frequency.DAILY, 30, 0, 0));
    assertEquals(0, custody.balanceOf("alice"));

    // Act
    TerminationResult result = service.cancel(order.getId(), "alice");

    // Assert
    assertEquals(100, result.getRefunded());
    assertEquals(100, custody.balanceOf("alice"));
    assertEquals(0, service.countActive());
    OrderNotFoundException ex = assertThrows(OrderNotFoundException.class,
        () -> service.cancel(order.getId(), "alice"));
    assertEquals(ErrorCode.ORDER_NOT_FOUND, ex.getErrorCode());
  }

  @Test
  void testCancel_AfterPartialExecution_RefundsRemaining() {
    custody.fund("alice", 100);
    Order order = service.createOrder("alice", request(100, Frequency.DAILY, 30, 0, 0));
    clock.advance(Duration.ofDays(1));
    service.executeOrder(order.getId(), AGENT);
    clock.advance(Duration.ofDays(1));
    service.executeOrder(order.getId(), AGENT);

    TerminationResult result = service.cancel(order.getId(), "alice");

    assertEquals(94, result.getRefunded());
    assertEquals(94, custody.balanceOf("alice"));
  }

  @Test
  void testCreate_UnfundedOwner_NothingStored() {
    assertThrows(CustodyTransferFailedException.class,
        () -> service.createOrder("bob", request(100, Frequency.DAILY, 30, 0, 0)));
    assertEquals(0, service.countActive());
  }

  @Test
  void testExecuteNextDue_PicksLongestWaiting() {
    // Arrange
    custody.fund("alice", 200);
    Order first = service.createOrder("alice", request(100, Frequency.DAILY, 30, 0, 0));
    clock.advance(Duration.ofHours(1));
    Order second = service.createOrder("alice", request(100, Frequency.DAILY, 30, 0, 0));

    // Act: both are due one day after the second was created
    clock.advance(Duration.ofDays(1));
    assertEquals(2, service.findDueOrders().size());
    ExecutionResult executed = service.executeNextDue(AGENT).orElseThrow();

    // Assert
    assertEquals(first.getId(), executed.getOrderId());
    assertEquals(second.getId(), service.executeNextDue(AGENT).orElseThrow().getOrderId());
    assertTrue(service.executeNextDue(AGENT).isEmpty());
  }

  @Test
  void testExecuteNextDue_NothingDue_Empty() {
    assertEquals(Optional.empty(), service.executeNextDue(AGENT));
  }

  @Test
  void testExecuteNextDue_NotAgent_Unauthorized() {
    assertThrows(UnauthorizedException.class, () -> service.executeNextDue("alice"));
  }

  @Test
  void testGetOrder_ReturnsCopy() {
    custody.fund("alice", 100);
    Order order = service.createOrder("alice", request(100, Frequency.DAILY, 30, 0, 0));

    service.getOrder(order.getId()).setRemainingBalance(0);

    assertEquals(100, service.getOrder(order.getId()).getRemainingBalance());
  }

  /**
   * Random schedules executed on every due tick: the balance identity holds throughout
   * and the execution count matches the schedule.
   */
  @Test
  void testProperty_AccountingHoldsAcrossRandomSchedules() {
    Random random = new Random(42);
    Frequency[] frequencies = {Frequency.HOURLY, Frequency.DAILY, Frequency.WEEKLY};
    for (int run = 0; run < 25; run++) {
      // Arrange
      Frequency frequency = frequencies[random.nextInt(frequencies.length)];
      long days = 7 + random.nextInt(30);
      long total = 1_000 + random.nextInt(100_000);
      String owner = "owner-" + run;
      custody.fund(owner, total);
      Order order = service.createOrder(owner, request(total, frequency, days, 0, 0));
      assertTrue(order.getAmountPerSwap() * order.getTotalSwaps() <= total);
      long expectedRuns = Math.min(order.getTotalSwaps(),
          Duration.between(order.getCreatedAt(), order.getEndTime()).getSeconds()
              / frequency.getSeconds());

      // Act
      int runs = 0;
      while (service.isActive(order.getId())) {
        clock.advance(frequency.toDuration());
        ExecutionResult result = service.executeOrder(order.getId(), AGENT);
        runs++;
        if (!result.isCompleted()) {
          assertAccounted(service.getOrder(order.getId()));
        } else {
          assertEquals(total - order.getAmountPerSwap() * runs, result.getRefunded());
        }
      }

      // Assert
      assertEquals(expectedRuns, runs);
      assertEquals(total - order.getAmountPerSwap() * runs, custody.balanceOf(owner));
    }
  }

  @Test
  void testProperty_NeverDueEarlyOrLate() {
    custody.fund("alice", 100);
    Order order = service.createOrder("alice", request(100, Frequency.DAILY, 3, 0, 0));

    clock.advance(Duration.ofDays(1).minusSeconds(1));
    assertTrue(service.findDueOrders().isEmpty());
    clock.advance(Duration.ofSeconds(1));
    assertEquals(1, service.findDueOrders().size());
    clock.set(order.getEndTime().plusSeconds(1));
    assertTrue(service.findDueOrders().isEmpty());
    ExecutionRejectedException ex = assertThrows(ExecutionRejectedException.class,
        () -> service.executeOrder(order.getId(), AGENT));
    assertEquals(ErrorCode.PERIOD_ENDED, ex.getErrorCode());
  }

  /** Custody double keeping balances in a map; the custody row is implicit. */
  private static final class InMemoryCustody implements FundsCustody {

    private final Map<String, Long> balances = new HashMap<>();

    void fund(String account, long amount) {
      balances.merge(account, amount, Long::sum);
    }

    long balanceOf(String account) {
      return balances.getOrDefault(account, 0L);
    }

    @Override
    public void transferIn(String from, long amount) {
      if (amount <= 0 || balanceOf(from) < amount) {
        throw new CustodyTransferFailedException("Insufficient balance in " + from);
      }
      balances.put(from, balanceOf(from) - amount);
    }

    @Override
    public void transferOut(String to, long amount) {
      fund(to, amount);
    }
  }
}
