package com.dev.dcaservice.gateway;

import com.dev.dcaservice.exception.CustodyTransferFailedException;

/**
 * Moves funding-asset units between an owner's external balance and system custody.
 * Each transfer either completes fully or throws and leaves both sides untouched.
 */
public interface FundsCustody {

  /**
   * Pulls funds from an account into custody.
   *
   * @param from paying account
   * @param amount units to move, positive
   * @throws CustodyTransferFailedException if the account cannot pay
   */
  void transferIn(String from, long amount);

  /**
   * Returns funds from custody to an account.
   *
   * @param to receiving account
   * @param amount units to move, positive
   * @throws CustodyTransferFailedException if custody cannot pay
   */
  void transferOut(String to, long amount);
}
