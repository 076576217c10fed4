package com.dev.dcaservice.gateway;

import com.dev.dcaservice.exception.CustodyTransferFailedException;
import com.dev.dcaservice.repository.BalanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * <p><b>LedgerFundsCustody</b> — custody backed by the {@code balances} table.</p>
 *
 * <p>Custody itself is the row {@link #CUSTODY_ACCOUNT}; a transfer debits one row and
 * credits the other inside one transaction. Fees collected at order creation stay in the
 * custody row.</p>
 */
@Service
public class LedgerFundsCustody implements FundsCustody {

  private static final Logger log = LoggerFactory.getLogger(LedgerFundsCustody.class);

  /** Ledger row holding every unit currently committed to orders. */
  public static final String CUSTODY_ACCOUNT = "__custody__";

  private final BalanceRepository balanceRepository;

  public LedgerFundsCustody(BalanceRepository balanceRepository) {
    this.balanceRepository = balanceRepository;
  }

  @Override
  @Transactional
  public void transferIn(String from, long amount) {
    move(from, CUSTODY_ACCOUNT, amount);
  }

  @Override
  @Transactional
  public void transferOut(String to, long amount) {
    move(CUSTODY_ACCOUNT, to, amount);
  }

  /**
   * Credits an account's external balance, e.g. when a user funds their wallet.
   *
   * @param accountId account to credit
   * @param amount units to add, positive
   * @return the new balance
   */
  @Transactional
  public long deposit(String accountId, long amount) {
    if (accountId == null || accountId.isBlank() || CUSTODY_ACCOUNT.equals(accountId)) {
      throw new IllegalArgumentException("A user account id must be provided");
    }
    if (amount <= 0) {
      throw new IllegalArgumentException("Deposit amount must be positive");
    }
    balanceRepository.credit(accountId, amount);
    long balance = balanceOf(accountId);
    log.info("Deposited {} to {}; balance now {}", amount, accountId, balance);
    return balance;
  }

  /**
   * Returns an account's external balance.
   *
   * @param accountId account identifier
   * @return the balance, zero if the account is unknown
   */
  public long balanceOf(String accountId) {
    return balanceRepository.findBalance(accountId).orElse(0L);
  }

  private void move(String from, String to, long amount) {
    if (amount <= 0) {
      throw new CustodyTransferFailedException("Transfer amount must be positive: " + amount);
    }
    try {
      if (!balanceRepository.debit(from, amount)) {
        log.warn("Transfer of {} from {} to {} refused: insufficient balance",
            amount, from, to);
        throw new CustodyTransferFailedException(
            "Insufficient balance in " + from + " for transfer of " + amount);
      }
      balanceRepository.credit(to, amount);
    } catch (DataAccessException e) {
      throw new CustodyTransferFailedException(
          "Ledger unavailable for transfer from " + from + " to " + to, e);
    }
    log.debug("Moved {} from {} to {}", amount, from, to);
  }
}
