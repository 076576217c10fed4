package com.dev.dcaservice.dto;

/**
 * External balance of an account.
 */
public class BalanceResponse {

  private String accountId;
  private long balance;

  public BalanceResponse() {
    // Default constructor for framework use
  }

  public BalanceResponse(String accountId, long balance) {
    this.accountId = accountId;
    this.balance = balance;
  }

  public String getAccountId() {
    return accountId;
  }

  public void setAccountId(String accountId) {
    this.accountId = accountId;
  }

  public long getBalance() {
    return balance;
  }

  public void setBalance(long balance) {
    this.balance = balance;
  }
}
