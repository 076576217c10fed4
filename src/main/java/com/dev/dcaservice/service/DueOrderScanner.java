package com.dev.dcaservice.service;

import com.dev.dcaservice.model.Order;
import com.dev.dcaservice.store.OrderStore;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Service;

/**
 * Finds active orders that are eligible for execution. Never mutates anything.
 *
 * <p>An order is due iff {@code now >= lastExecutionTime + frequency} and
 * {@code now <= endTime}. When several are due, the one that became eligible first wins;
 * equal eligibility times fall back to the id, so the choice is stable for a given
 * state.</p>
 */
@Service
public class DueOrderScanner {

  private static final Comparator<Order> BY_ELIGIBILITY =
      Comparator.comparing(Order::nextEligibleTime).thenComparing(Order::getId);

  private final OrderStore orderStore;

  public DueOrderScanner(OrderStore orderStore) {
    this.orderStore = orderStore;
  }

  /**
   * Returns the due order that has waited longest.
   *
   * @param now evaluation time
   * @return id of a due order, or empty if none is due
   */
  public Optional<UUID> findDue(Instant now) {
    return orderStore.snapshot().stream()
        .filter(order -> isDue(order, now))
        .min(BY_ELIGIBILITY)
        .map(Order::getId);
  }

  /**
   * Returns every due order, longest-waiting first. For inspection only.
   *
   * @param now evaluation time
   * @return due orders (copies)
   */
  public List<Order> findAllDue(Instant now) {
    return orderStore.snapshot().stream()
        .filter(order -> isDue(order, now))
        .sorted(BY_ELIGIBILITY)
        .toList();
  }

  /**
   * Due check.
   *
   * @param order order to test
   * @param now evaluation time
   * @return true if the interval has elapsed and the deadline has not passed
   */
  public static boolean isDue(Order order, Instant now) {
    return !now.isBefore(order.nextEligibleTime()) && !now.isAfter(order.getEndTime());
  }
}
