package com.dev.dcaservice.repository;

import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * JDBC-backed repository for account balances held in the {@code balances} table.
 * Amounts are integers in the smallest unit of the funding asset.
 */
@Repository
public class BalanceRepository {

  private final JdbcTemplate jdbcTemplate;

  /**
   * Creates a new repository instance using the provided {@link JdbcTemplate}.
   *
   * @param jdbcTemplate JDBC template used to execute SQL statements
   */
  public BalanceRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  /**
   * Looks up the balance of an account.
   *
   * @param accountId account identifier
   * @return the balance, or empty if the account has never been credited
   */
  public Optional<Long> findBalance(String accountId) {
    String sql = "SELECT amount FROM balances WHERE account_id = ?";
    List<Long> rows = jdbcTemplate.query(sql, (rs, rowNum) -> rs.getLong("amount"), accountId);
    return rows.stream().findFirst();
  }

  /**
   * Adds to an account balance, creating the row on first credit.
   *
   * @param accountId account identifier
   * @param amount amount to add
   */
  public void credit(String accountId, long amount) {
    String update = "UPDATE balances SET amount = amount + ? WHERE account_id = ?";
    int rows = jdbcTemplate.update(update, amount, accountId);
    if (rows == 0) {
      String insert = "INSERT INTO balances (account_id, amount) VALUES (?, ?)";
      jdbcTemplate.update(insert, accountId, amount);
    }
  }

  /**
   * Subtracts from an account balance if, and only if, enough is available.
   *
   * @param accountId account identifier
   * @param amount amount to subtract
   * @return true if the balance was debited, false if it was missing or too small
   */
  public boolean debit(String accountId, long amount) {
    String sql = "UPDATE balances SET amount = amount - ? WHERE account_id = ? AND amount >= ?";
    return jdbcTemplate.update(sql, amount, accountId, amount) == 1;
  }
}
