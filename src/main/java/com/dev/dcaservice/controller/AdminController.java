package com.dev.dcaservice.controller;

import com.dev.dcaservice.dto.AmountRequest;
import com.dev.dcaservice.dto.EngineSettingsView;
import com.dev.dcaservice.dto.InitializeRequest;
import com.dev.dcaservice.dto.SettingsUpdateRequest;
import com.dev.dcaservice.gateway.ManualPriceOracle;
import com.dev.dcaservice.model.PriceReading;
import com.dev.dcaservice.service.EngineSettingsService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Operator endpoints. Access requires the ADMIN role (see {@code SecurityConfig}).
 */
@RestController
@RequestMapping("/admin")
public class AdminController {

  private final EngineSettingsService settings;
  private final ManualPriceOracle priceOracle;

  public AdminController(EngineSettingsService settings, ManualPriceOracle priceOracle) {
    this.settings = settings;
    this.priceOracle = priceOracle;
  }

  @GetMapping("/settings")
  public ResponseEntity<EngineSettingsView> getSettings() {
    return ResponseEntity.ok(settings.view());
  }

  /**
   * Binds the price oracle and asset pair. Fails with 409 on a second call.
   *
   * @param request oracle and asset identifiers
   * @return the resulting settings
   */
  @PostMapping("/initialize")
  public ResponseEntity<EngineSettingsView> initialize(@RequestBody InitializeRequest request) {
    settings.initialize(request.getPriceOracleId(), request.getFundingAsset(),
        request.getTargetAsset());
    return ResponseEntity.ok(settings.view());
  }

  /**
   * Updates the trusted agent and/or the execution fee. Null fields are left unchanged.
   *
   * @param request new values
   * @return the resulting settings
   */
  @PutMapping("/settings")
  public ResponseEntity<EngineSettingsView> updateSettings(
      @RequestBody SettingsUpdateRequest request) {
    if (request.getAgentId() != null) {
      settings.setAgentId(request.getAgentId());
    }
    if (request.getExecutionFee() != null) {
      settings.setExecutionFee(request.getExecutionFee());
    }
    return ResponseEntity.ok(settings.view());
  }

  /**
   * Publishes a new oracle price.
   *
   * @param request the price
   * @return the stored reading
   */
  @PutMapping("/price")
  public ResponseEntity<PriceReading> updatePrice(@RequestBody AmountRequest request) {
    if (request.getAmount() <= 0) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Price must be positive");
    }
    return ResponseEntity.ok(priceOracle.update(request.getAmount()));
  }
}
