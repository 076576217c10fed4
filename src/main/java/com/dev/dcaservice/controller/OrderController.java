package com.dev.dcaservice.controller;

import com.dev.dcaservice.dto.CreateOrderRequest;
import com.dev.dcaservice.dto.ExecutionResult;
import com.dev.dcaservice.dto.PreAuthorizationResult;
import com.dev.dcaservice.dto.TerminationResult;
import com.dev.dcaservice.model.ExecutionRecord;
import com.dev.dcaservice.model.Order;
import com.dev.dcaservice.model.OrderEventRecord;
import com.dev.dcaservice.service.DcaOrderService;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing DCA order APIs.
 * The calling account is taken from the {@code X-Account-Id} header.
 * Endpoints:
 * POST /orders - create a new order funded by the caller
 * GET /orders/{orderId} - fetch an active order
 * GET /orders/count - number of active orders
 * GET /orders/{orderId}/exists - whether an order is active
 * GET /orders/due - orders due now
 * GET /orders/{orderId}/executions - execution history
 * GET /orders/{orderId}/events - lifecycle history
 * POST /orders/{orderId}:execute - run one swap (agent only)
 * POST /orders/{orderId}:preauthorize - pre-trade check (agent only)
 * POST /orders/due:execute - run the next due order (agent only)
 * POST /orders/{orderId}:cancel - cancel and refund (owner only)
 */
@RestController
@RequestMapping("/orders")
public class OrderController {

  static final String CALLER_HEADER = "X-Account-Id";

  private final DcaOrderService orderService;

  /**
   * Constructs the controller with its service dependency.
   *
   * @param orderService business service for the order lifecycle
   */
  public OrderController(DcaOrderService orderService) {
    this.orderService = orderService;
  }

  /**
   * Creates a new order funded by the caller.
   *
   * @param caller owning account
   * @param req JSON payload describing the schedule
   * @return the created order
   */
  @PostMapping
  public ResponseEntity<Order> create(@RequestHeader(CALLER_HEADER) String caller,
                                      @RequestBody CreateOrderRequest req) {
    Order order = orderService.createOrder(caller, req);
    return new ResponseEntity<>(order, HttpStatus.CREATED);
  }

  /**
   * Retrieves an active order by ID.
   *
   * @param orderId the order identifier
   * @return the order details
   */
  @GetMapping("/{orderId}")
  public ResponseEntity<Order> getOrder(@PathVariable("orderId") UUID orderId) {
    return ResponseEntity.ok(orderService.getOrder(orderId));
  }

  @GetMapping("/count")
  public ResponseEntity<Map<String, Integer>> count() {
    return ResponseEntity.ok(Map.of("active", orderService.countActive()));
  }

  @GetMapping("/{orderId}/exists")
  public ResponseEntity<Map<String, Boolean>> exists(@PathVariable("orderId") UUID orderId) {
    return ResponseEntity.ok(Map.of("active", orderService.isActive(orderId)));
  }

  /**
   * Lists orders that are due now, longest-waiting first.
   *
   * @return due orders, possibly empty
   */
  @GetMapping("/due")
  public ResponseEntity<List<Order>> due() {
    return ResponseEntity.ok(orderService.findDueOrders());
  }

  /**
   * Lists all executions of an order, including completed and cancelled ones.
   *
   * @param orderId the order identifier
   * @return executions, possibly empty
   */
  @GetMapping("/{orderId}/executions")
  public ResponseEntity<List<ExecutionRecord>> executions(
      @PathVariable("orderId") UUID orderId) {
    return ResponseEntity.ok(orderService.getExecutions(orderId));
  }

  @GetMapping("/{orderId}/events")
  public ResponseEntity<List<OrderEventRecord>> events(@PathVariable("orderId") UUID orderId) {
    return ResponseEntity.ok(orderService.getEvents(orderId));
  }

  /**
   * Executes one swap of an order at the current oracle price.
   *
   * @param caller trusted agent
   * @param orderId the order identifier
   * @return the booked execution
   */
  @PostMapping("/{orderId}:execute")
  public ResponseEntity<ExecutionResult> execute(@RequestHeader(CALLER_HEADER) String caller,
                                                 @PathVariable("orderId") UUID orderId) {
    return ResponseEntity.ok(orderService.executeOrder(orderId, caller));
  }

  @PostMapping("/{orderId}:preauthorize")
  public ResponseEntity<PreAuthorizationResult> preAuthorize(
      @RequestHeader(CALLER_HEADER) String caller,
      @PathVariable("orderId") UUID orderId) {
    return ResponseEntity.ok(orderService.preAuthorize(orderId, caller));
  }

  /**
   * Executes the longest-waiting due order, if any.
   *
   * @param caller trusted agent
   * @return 200 with the execution, or 204 when nothing is due
   */
  @PostMapping("/due:execute")
  public ResponseEntity<ExecutionResult> executeNextDue(
      @RequestHeader(CALLER_HEADER) String caller) {
    Optional<ExecutionResult> result = orderService.executeNextDue(caller);
    return result.map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.noContent().build());
  }

  /**
   * Cancels an order and refunds its remaining balance.
   *
   * @param caller owning account
   * @param orderId the order identifier
   * @return what was removed and refunded
   */
  @PostMapping("/{orderId}:cancel")
  public ResponseEntity<TerminationResult> cancel(@RequestHeader(CALLER_HEADER) String caller,
                                                  @PathVariable("orderId") UUID orderId) {
    return ResponseEntity.ok(orderService.cancel(orderId, caller));
  }
}
