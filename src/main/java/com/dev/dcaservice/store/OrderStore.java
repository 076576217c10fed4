package com.dev.dcaservice.store;

import com.dev.dcaservice.model.Order;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * In-memory registry of active orders.
 *
 * <p>Holds a map of id → order and an index of active ids. The index keeps each id's
 * position so removal swaps the last id into the freed slot in O(1); the order of the
 * remaining ids is therefore not stable and is never exposed.</p>
 *
 * <p>Every entry in {@code orders} has exactly one entry in {@code index} and vice versa.
 * All methods hold the store's monitor so no caller can see the two structures
 * mid-update.</p>
 */
@Component
public class OrderStore {

  private final Map<UUID, Order> orders = new HashMap<>();
  private final List<UUID> index = new ArrayList<>();
  private final Map<UUID, Integer> positions = new HashMap<>();

  /**
   * Adds a new active order.
   *
   * @param order order with a non-null id and non-blank owner
   * @throws IllegalArgumentException if the order is malformed
   * @throws IllegalStateException if the id is already active
   */
  public synchronized void insert(Order order) {
    if (order == null || order.getId() == null) {
      throw new IllegalArgumentException("Order and order id must be provided");
    }
    if (order.getOwner() == null || order.getOwner().isBlank()) {
      throw new IllegalArgumentException("Order owner must be provided: " + order.getId());
    }
    if (orders.containsKey(order.getId())) {
      throw new IllegalStateException("Order already active: " + order.getId());
    }
    orders.put(order.getId(), order);
    positions.put(order.getId(), index.size());
    index.add(order.getId());
  }

  /**
   * Looks up an active order.
   *
   * @param orderId order identifier
   * @return the live order, or empty if it is not active
   */
  public synchronized Optional<Order> get(UUID orderId) {
    return Optional.ofNullable(orders.get(orderId));
  }

  /**
   * Puts back an order that is already active, replacing the stored instance.
   * Used to restore a snapshot after a rolled-back operation.
   *
   * @param order the replacement
   * @throws IllegalStateException if the id is not active
   */
  public synchronized void replace(Order order) {
    if (!orders.containsKey(order.getId())) {
      throw new IllegalStateException("Order not active: " + order.getId());
    }
    orders.put(order.getId(), order);
  }

  /**
   * Removes an order from both the map and the index.
   *
   * @param orderId order identifier
   * @return the removed order, or empty if it was not active
   */
  public synchronized Optional<Order> removeById(UUID orderId) {
    Order removed = orders.remove(orderId);
    if (removed == null) {
      return Optional.empty();
    }
    int slot = positions.remove(orderId);
    int last = index.size() - 1;
    if (slot != last) {
      UUID moved = index.get(last);
      index.set(slot, moved);
      positions.put(moved, slot);
    }
    index.remove(last);
    return Optional.of(removed);
  }

  public synchronized int count() {
    return orders.size();
  }

  public synchronized boolean containsId(UUID orderId) {
    return orders.containsKey(orderId);
  }

  /**
   * Copies every active order, for read-only scans.
   *
   * @return detached copies in index order
   */
  public synchronized List<Order> snapshot() {
    List<Order> copies = new ArrayList<>(index.size());
    for (UUID id : index) {
      copies.add(orders.get(id).copy());
    }
    return copies;
  }
}
