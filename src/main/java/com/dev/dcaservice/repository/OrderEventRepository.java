package com.dev.dcaservice.repository;

import com.dev.dcaservice.model.OrderEventRecord;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for persisted order lifecycle events.
 */
@Repository
public interface OrderEventRepository extends JpaRepository<OrderEventRecord, UUID> {

  /**
   * Find the events of one order, oldest first.
   *
   * @param orderId the order identifier
   * @return events recorded for that order
   */
  List<OrderEventRecord> findByOrderIdOrderByTsAsc(UUID orderId);
}
