package com.dev.dcaservice.dto;

/**
 * Read-only view of the engine settings returned by the admin API.
 */
public class EngineSettingsView {

  private final String agentId;
  private final long executionFee;
  private final boolean initialized;
  private final String priceOracleId;
  private final String fundingAsset;
  private final String targetAsset;
  private final long accruedFees;

  /**
   * Creates a settings view.
   *
   * @param agentId trusted automation agent
   * @param executionFee fee required at order creation
   * @param initialized whether the one-time initialization has run
   * @param priceOracleId configured oracle, null before initialization
   * @param fundingAsset configured funding asset, null before initialization
   * @param targetAsset configured target asset, null before initialization
   * @param accruedFees fees collected so far
   */
  public EngineSettingsView(String agentId, long executionFee, boolean initialized,
                            String priceOracleId, String fundingAsset, String targetAsset,
                            long accruedFees) {
    this.agentId = agentId;
    this.executionFee = executionFee;
    this.initialized = initialized;
    this.priceOracleId = priceOracleId;
    this.fundingAsset = fundingAsset;
    this.targetAsset = targetAsset;
    this.accruedFees = accruedFees;
  }

  public String getAgentId() {
    return agentId;
  }

  public long getExecutionFee() {
    return executionFee;
  }

  public boolean isInitialized() {
    return initialized;
  }

  public String getPriceOracleId() {
    return priceOracleId;
  }

  public String getFundingAsset() {
    return fundingAsset;
  }

  public String getTargetAsset() {
    return targetAsset;
  }

  public long getAccruedFees() {
    return accruedFees;
  }
}
