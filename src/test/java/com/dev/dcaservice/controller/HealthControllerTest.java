package com.dev.dcaservice.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.dev.dcaservice.gateway.PriceOracle;
import com.dev.dcaservice.model.PriceReading;
import com.dev.dcaservice.store.OrderStore;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Unit tests for HealthController.
 */
class HealthControllerTest {

  private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

  private HealthController healthController;
  private DataSource dataSource;
  private PriceOracle priceOracle;

  /**
   * Set up test fixtures before each test.
   */
  @BeforeEach
  void setUp() throws Exception {
    dataSource = mock(DataSource.class);
    priceOracle = mock(PriceOracle.class);
    Connection mockConnection = mock(Connection.class);
    when(dataSource.getConnection()).thenReturn(mockConnection);
    when(priceOracle.latestPrice()).thenReturn(new PriceReading(1000, NOW));

    healthController = new HealthController(dataSource, new OrderStore(), priceOracle,
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  @SuppressWarnings("unchecked")
  void testHealth_AllComponentsHealthy_TypicalCase() {
    ResponseEntity<Map<String, Object>> response = healthController.health();

    assertEquals(HttpStatus.OK, response.getStatusCode());
    Map<String, Object> body = response.getBody();
    assertNotNull(body);
    assertEquals("ok", body.get("status"));
    assertEquals(NOW.toString(), body.get("timestamp"));
    assertEquals(0, body.get("activeOrders"));
    Map<String, String> components = (Map<String, String>) body.get("components");
    assertEquals("healthy", components.get("database"));
    assertEquals("healthy", components.get("priceOracle"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void testHealth_DatabaseDown_Degraded() throws Exception {
    when(dataSource.getConnection()).thenThrow(new SQLException("down"));

    Map<String, Object> body = healthController.health().getBody();

    assertEquals("degraded", body.get("status"));
    assertEquals("unhealthy",
        ((Map<String, String>) body.get("components")).get("database"));
  }

  @Test
  void testHealth_NoPrice_Degraded() {
    when(priceOracle.latestPrice()).thenReturn(new PriceReading(0, NOW));

    Map<String, Object> body = healthController.health().getBody();

    assertEquals("degraded", body.get("status"));
  }
}
