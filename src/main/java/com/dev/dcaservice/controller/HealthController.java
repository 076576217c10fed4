package com.dev.dcaservice.controller;

import com.dev.dcaservice.gateway.PriceOracle;
import com.dev.dcaservice.model.PriceReading;
import com.dev.dcaservice.store.OrderStore;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import javax.sql.DataSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Controller for system health checks.
 * Reports the ledger database, the active order registry and the price oracle.
 */
@RestController
@RequestMapping("/health")
public class HealthController {

  private final DataSource dataSource;
  private final OrderStore orderStore;
  private final PriceOracle priceOracle;
  private final Clock clock;

  /**
   * Constructor with dependency injection.
   *
   * @param dataSource the database datasource
   * @param orderStore the active order registry
   * @param priceOracle the price source
   * @param clock time source
   */
  @Autowired
  public HealthController(DataSource dataSource,
                          OrderStore orderStore,
                          PriceOracle priceOracle,
                          Clock clock) {
    this.dataSource = dataSource;
    this.orderStore = orderStore;
    this.priceOracle = priceOracle;
    this.clock = clock;
  }

  /**
   * Health check endpoint.
   *
   * @return ResponseEntity with detailed health status
   */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, String> components = new HashMap<>();
    boolean allHealthy = true;

    // Check database connectivity
    try {
      dataSource.getConnection().close();
      components.put("database", "healthy");
    } catch (Exception e) {
      components.put("database", "unhealthy");
      allHealthy = false;
    }

    components.put("orderStore", "healthy");

    // A zero price means no reading has been published yet
    try {
      PriceReading reading = priceOracle.latestPrice();
      if (reading != null && reading.getValue() > 0) {
        components.put("priceOracle", "healthy");
      } else {
        components.put("priceOracle", "unhealthy");
        allHealthy = false;
      }
    } catch (Exception e) {
      components.put("priceOracle", "unhealthy");
      allHealthy = false;
    }

    Map<String, Object> health = new HashMap<>();
    health.put("status", allHealthy ? "ok" : "degraded");
    health.put("timestamp", clock.instant().toString());
    health.put("components", components);
    health.put("activeOrders", orderStore.count());
    health.put("version", "0.0.1-SNAPSHOT");

    return ResponseEntity.ok(health);
  }
}
