package com.dev.dcaservice.dto;

/**
 * Request payload for the one-time engine initialization.
 */
public class InitializeRequest {

  private String priceOracleId;
  private String fundingAsset;
  private String targetAsset;

  public InitializeRequest() {
    // Default constructor for framework use
  }

  public InitializeRequest(String priceOracleId, String fundingAsset, String targetAsset) {
    this.priceOracleId = priceOracleId;
    this.fundingAsset = fundingAsset;
    this.targetAsset = targetAsset;
  }

  public String getPriceOracleId() {
    return priceOracleId;
  }

  public void setPriceOracleId(String priceOracleId) {
    this.priceOracleId = priceOracleId;
  }

  public String getFundingAsset() {
    return fundingAsset;
  }

  public void setFundingAsset(String fundingAsset) {
    this.fundingAsset = fundingAsset;
  }

  public String getTargetAsset() {
    return targetAsset;
  }

  public void setTargetAsset(String targetAsset) {
    this.targetAsset = targetAsset;
  }
}
