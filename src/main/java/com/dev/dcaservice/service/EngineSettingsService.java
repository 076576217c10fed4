package com.dev.dcaservice.service;

import com.dev.dcaservice.dto.EngineSettingsView;
import com.dev.dcaservice.exception.AlreadyInitializedException;
import com.dev.dcaservice.exception.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * <p><b>EngineSettingsService</b> — operator-controlled engine configuration.</p>
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Trusted agent identifier and caller checks</li>
 *   <li>Per-execution fee required at order creation</li>
 *   <li>One-time binding of the price oracle and asset pair</li>
 *   <li>Running total of collected fees</li>
 * </ul>
 */
@Service
public class EngineSettingsService {

  private static final Logger log = LoggerFactory.getLogger(EngineSettingsService.class);

  private String agentId;
  private long executionFee;
  private boolean initialized;
  private String priceOracleId;
  private String fundingAsset;
  private String targetAsset;
  private long accruedFees;

  /**
   * Creates the settings from configuration.
   *
   * @param agentId initial trusted agent ({@code dca.agent-id})
   * @param executionFee initial fee ({@code dca.execution-fee})
   */
  public EngineSettingsService(@Value("${dca.agent-id}") String agentId,
                               @Value("${dca.execution-fee:0}") long executionFee) {
    this.agentId = requireId(agentId, "Agent id");
    if (executionFee < 0) {
      throw new InvalidConfigurationException("Execution fee must not be negative");
    }
    this.executionFee = executionFee;
  }

  public synchronized String getAgentId() {
    return agentId;
  }

  /**
   * Tells whether the caller is the trusted automation agent.
   *
   * @param caller caller identity, may be null
   * @return true only for an exact match
   */
  public synchronized boolean isAgent(String caller) {
    return agentId.equals(caller);
  }

  /**
   * Replaces the trusted agent.
   *
   * @param newAgentId new agent identity, non-blank
   */
  public synchronized void setAgentId(String newAgentId) {
    String previous = agentId;
    agentId = requireId(newAgentId, "Agent id");
    log.info("Trusted agent changed from {} to {}", previous, agentId);
  }

  public synchronized long getExecutionFee() {
    return executionFee;
  }

  /**
   * Changes the fee required from new orders. Existing orders are unaffected.
   *
   * @param fee new fee, not negative
   */
  public synchronized void setExecutionFee(long fee) {
    if (fee < 0) {
      throw new InvalidConfigurationException("Execution fee must not be negative");
    }
    executionFee = fee;
    log.info("Execution fee set to {}", fee);
  }

  /**
   * Binds the price oracle and asset pair. Can run once only.
   *
   * @param oracleId price oracle identifier
   * @param funding funding asset identifier
   * @param target target asset identifier
   * @throws AlreadyInitializedException on any call after the first successful one
   * @throws InvalidConfigurationException for blank identifiers or a degenerate pair
   */
  public synchronized void initialize(String oracleId, String funding, String target) {
    if (initialized) {
      throw new AlreadyInitializedException("Engine already initialized with pair "
          + fundingAsset + "/" + targetAsset);
    }
    String oracle = requireId(oracleId, "Price oracle id");
    String in = requireId(funding, "Funding asset");
    String out = requireId(target, "Target asset");
    if (in.equals(out)) {
      throw new InvalidConfigurationException("Funding and target asset must differ: " + in);
    }
    priceOracleId = oracle;
    fundingAsset = in;
    targetAsset = out;
    initialized = true;
    log.info("Engine initialized: oracle={}, pair={}/{}", oracle, in, out);
  }

  public synchronized boolean isInitialized() {
    return initialized;
  }

  /**
   * Fails unless {@link #initialize} has run.
   *
   * @throws InvalidConfigurationException if the engine is not initialized
   */
  public synchronized void requireInitialized() {
    if (!initialized) {
      throw new InvalidConfigurationException("Engine has not been initialized");
    }
  }

  synchronized void recordFee(long fee) {
    accruedFees = Math.addExact(accruedFees, fee);
  }

  public synchronized long getAccruedFees() {
    return accruedFees;
  }

  /**
   * Snapshot of all settings.
   *
   * @return current settings
   */
  public synchronized EngineSettingsView view() {
    return new EngineSettingsView(agentId, executionFee, initialized, priceOracleId,
        fundingAsset, targetAsset, accruedFees);
  }

  private static String requireId(String value, String what) {
    if (value == null || value.isBlank()) {
      throw new InvalidConfigurationException(what + " must be provided");
    }
    return value.trim();
  }
}
