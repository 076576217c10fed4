package com.dev.dcaservice.repository;

import com.dev.dcaservice.model.ExecutionRecord;
import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * JDBC-backed repository for the execution history of orders.
 */
@Repository
public class ExecutionRepository {

  private final JdbcTemplate jdbcTemplate;

  private final RowMapper<ExecutionRecord> executionRowMapper = (rs, rowNum) ->
      new ExecutionRecord(
          rs.getObject("id", UUID.class),
          rs.getObject("order_id", UUID.class),
          rs.getString("owner"),
          rs.getLong("amount_in"),
          rs.getLong("amount_out"),
          rs.getLong("price"),
          rs.getTimestamp("executed_at").toInstant());

  /**
   * Creates a new repository instance using the provided {@link JdbcTemplate}.
   *
   * @param jdbcTemplate JDBC template used to execute SQL statements
   */
  public ExecutionRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  /**
   * Persists a new execution record.
   *
   * @param record the execution to save
   */
  public void save(ExecutionRecord record) {
    String sql = "INSERT INTO executions (id, order_id, owner, amount_in, amount_out, price, "
        + "executed_at) VALUES (?, ?, ?, ?, ?, ?, ?)";
    jdbcTemplate.update(sql, record.getId(), record.getOrderId(), record.getOwner(),
        record.getAmountIn(), record.getAmountOut(), record.getPrice(),
        Timestamp.from(record.getExecutedAt()));
  }

  /**
   * Retrieves all executions of an order, oldest first.
   *
   * @param orderId the order identifier
   * @return list of executions (may be empty)
   */
  public List<ExecutionRecord> findByOrderId(UUID orderId) {
    String sql = "SELECT * FROM executions WHERE order_id = ? ORDER BY executed_at ASC";
    return jdbcTemplate.query(sql, executionRowMapper, orderId);
  }
}
