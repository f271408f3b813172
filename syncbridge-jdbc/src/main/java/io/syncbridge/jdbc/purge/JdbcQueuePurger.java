package io.syncbridge.jdbc.purge;

import io.syncbridge.jdbc.JdbcTemplate;
import io.syncbridge.jdbc.store.AbstractJdbcSyncQueueStore;
import io.syncbridge.spi.QueuePurger;

import java.sql.Connection;
import java.time.Instant;

/**
 * {@link QueuePurger} with subquery-limited {@code DELETE}s that work on H2 and PostgreSQL.
 *
 * <p>Only terminal rows are deleted: {@code completed} and {@code skipped} rows by
 * {@link #purgeFinished}, exhausted {@code failed} rows by {@link #purgeExhausted}.
 * Dead-letter entries are kept.
 */
public final class JdbcQueuePurger implements QueuePurger {
  private final String tableName;

  public JdbcQueuePurger() {
    this(AbstractJdbcSyncQueueStore.DEFAULT_TABLE);
  }

  public JdbcQueuePurger(String tableName) {
    this.tableName = JdbcTemplate.checkTableName(tableName);
  }

  @Override
  public int purgeFinished(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName + " WHERE id IN ("
        + "SELECT id FROM " + tableName
        + " WHERE status IN ('completed','skipped') AND COALESCE(processed_at, created_at) < ?"
        + " ORDER BY created_at LIMIT ?)";
    return JdbcTemplate.update(conn, sql, before, limit);
  }

  @Override
  public int purgeExhausted(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName + " WHERE id IN ("
        + "SELECT id FROM " + tableName
        + " WHERE status='failed' AND retry_count >= max_retries AND COALESCE(processed_at, created_at) < ?"
        + " ORDER BY created_at LIMIT ?)";
    return JdbcTemplate.update(conn, sql, before, limit);
  }
}
