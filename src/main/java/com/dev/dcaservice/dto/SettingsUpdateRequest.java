package com.dev.dcaservice.dto;

/**
 * Request payload for updating engine settings. Null fields are left unchanged.
 */
public class SettingsUpdateRequest {

  private String agentId;
  private Long executionFee;

  public String getAgentId() {
    return agentId;
  }

  public void setAgentId(String agentId) {
    this.agentId = agentId;
  }

  public Long getExecutionFee() {
    return executionFee;
  }

  public void setExecutionFee(Long executionFee) {
    this.executionFee = executionFee;
  }
}
