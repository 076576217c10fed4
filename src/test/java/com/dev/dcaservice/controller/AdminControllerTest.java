package com.dev.dcaservice.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.dev.dcaservice.dto.AmountRequest;
import com.dev.dcaservice.dto.EngineSettingsView;
import com.dev.dcaservice.dto.InitializeRequest;
import com.dev.dcaservice.dto.SettingsUpdateRequest;
import com.dev.dcaservice.exception.AlreadyInitializedException;
import com.dev.dcaservice.gateway.ManualPriceOracle;
import com.dev.dcaservice.model.PriceReading;
import com.dev.dcaservice.service.EngineSettingsService;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;

/**
 * Unit tests for AdminController.
 */
@ExtendWith(MockitoExtension.class)
class AdminControllerTest {

  @Mock
  private ManualPriceOracle priceOracle;

  private EngineSettingsService settings;
  private AdminController adminController;

  @BeforeEach
  void setUp() {
    settings = new EngineSettingsService("agent", 0);
    adminController = new AdminController(settings, priceOracle);
  }

  @Test
  void testInitialize_ThenAgain_Conflict() {
    InitializeRequest request = new InitializeRequest("oracle-1", "USDC", "WETH");

    EngineSettingsView view = adminController.initialize(request).getBody();

    assertTrue(view.isInitialized());
    assertThrows(AlreadyInitializedException.class,
        () -> adminController.initialize(request));
  }

  @Test
  void testUpdateSettings_OnlyProvidedFieldsChange() {
    // Arrange
    SettingsUpdateRequest request = new SettingsUpdateRequest();
    request.setExecutionFee(7L);

    // Act
    EngineSettingsView view = adminController.updateSettings(request).getBody();

    // Assert
    assertEquals(7, view.getExecutionFee());
    assertEquals("agent", view.getAgentId());
  }

  @Test
  void testUpdateSettings_NewAgent() {
    SettingsUpdateRequest request = new SettingsUpdateRequest();
    request.setAgentId("keeper-2");

    adminController.updateSettings(request);

    assertTrue(settings.isAgent("keeper-2"));
  }

  @Test
  void testUpdatePrice_Delegates() {
    PriceReading reading = new PriceReading(1200, Instant.parse("2024-01-01T00:00:00Z"));
    when(priceOracle.update(1200)).thenReturn(reading);

    ResponseEntity<PriceReading> response = adminController.updatePrice(new AmountRequest(1200));

    assertEquals(1200, response.getBody().getValue());
  }

  @Test
  void testUpdatePrice_NonPositive_BadRequest() {
    assertThrows(ResponseStatusException.class,
        () -> adminController.updatePrice(new AmountRequest(0)));
    verify(priceOracle, never()).update(anyLong());
  }
}
