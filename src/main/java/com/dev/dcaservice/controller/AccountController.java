package com.dev.dcaservice.controller;

import com.dev.dcaservice.dto.AmountRequest;
import com.dev.dcaservice.dto.BalanceResponse;
import com.dev.dcaservice.gateway.LedgerFundsCustody;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST controller for the external balances that fund orders.
 */
@RestController
@RequestMapping("/accounts")
public class AccountController {

  private final LedgerFundsCustody custody;

  public AccountController(LedgerFundsCustody custody) {
    this.custody = custody;
  }

  /**
   * Credits an account's external balance.
   *
   * @param accountId account to fund
   * @param request amount to add
   * @return the new balance
   */
  @PostMapping("/{accountId}/deposit")
  public ResponseEntity<BalanceResponse> deposit(@PathVariable("accountId") String accountId,
                                                 @RequestBody AmountRequest request) {
    if (request.getAmount() <= 0) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
          "Deposit amount must be positive");
    }
    if (LedgerFundsCustody.CUSTODY_ACCOUNT.equals(accountId)) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Reserved account id");
    }
    long balance = custody.deposit(accountId, request.getAmount());
    return ResponseEntity.ok(new BalanceResponse(accountId, balance));
  }

  @GetMapping("/{accountId}/balance")
  public ResponseEntity<BalanceResponse> balance(@PathVariable("accountId") String accountId) {
    return ResponseEntity.ok(new BalanceResponse(accountId, custody.balanceOf(accountId)));
  }
}
