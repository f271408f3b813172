package io.syncbridge.jdbc.store;

import io.syncbridge.jdbc.JdbcTemplate;
import io.syncbridge.model.DeadLetterEntry;
import io.syncbridge.model.Operation;
import io.syncbridge.spi.DeadLetterStore;
import io.syncbridge.util.Json;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link DeadLetterStore} over the {@code sync_dead_letter} table.
 *
 * <p>{@code queue_item_id} is unique. An item that dies again after a replay reuses its
 * replayed entry, so each item has at most one entry and each death is recorded once.
 * Appends never raise a constraint violation, because they run in the same transaction as
 * the item's final status update.
 */
public final class JdbcDeadLetterStore implements DeadLetterStore {
  public static final String DEFAULT_TABLE = "sync_dead_letter";
  private static final int MAX_ERROR_LENGTH = 4000;

  private static final String COLUMNS = "id, queue_item_id, table_name, record_id, operation, payload, "
      + "last_error, error_details, retry_count, correlation_id, dead_at, replayed_at";

  private static final JdbcTemplate.RowMapper<DeadLetterEntry> ENTRY_ROW_MAPPER = rs -> new DeadLetterEntry(
      rs.getString("id"),
      rs.getString("queue_item_id"),
      rs.getString("table_name"),
      rs.getString("record_id"),
      Operation.fromCode(rs.getString("operation")),
      Json.readMap(rs.getString("payload")),
      rs.getString("last_error"),
      rs.getString("error_details"),
      rs.getInt("retry_count"),
      rs.getString("correlation_id"),
      JdbcTemplate.instant(rs, "dead_at"),
      JdbcTemplate.instant(rs, "replayed_at"));

  private final String tableName;

  public JdbcDeadLetterStore() {
    this(DEFAULT_TABLE);
  }

  public JdbcDeadLetterStore(String tableName) {
    this.tableName = JdbcTemplate.checkTableName(tableName);
  }

  @Override
  public boolean append(Connection conn, DeadLetterEntry entry) {
    Optional<Boolean> replayed = JdbcTemplate.queryOne(conn,
        "SELECT replayed_at FROM " + tableName + " WHERE queue_item_id=?",
        rs -> rs.getTimestamp(1) != null, entry.queueItemId());
    if (replayed.isPresent()) {
      if (!replayed.get()) {
        return false;
      }
      return JdbcTemplate.update(conn, "UPDATE " + tableName
              + " SET payload=?, last_error=?, error_details=?, retry_count=?, dead_at=?, replayed_at=NULL"
              + " WHERE queue_item_id=? AND replayed_at IS NOT NULL",
          Json.write(entry.payload()), truncate(entry.lastError()), entry.errorDetails(), entry.retryCount(),
          entry.deadAt(), entry.queueItemId()) == 1;
    }
    return JdbcTemplate.update(conn, "INSERT INTO " + tableName + " (" + COLUMNS + ")"
            + " VALUES (?,?,?,?,?,?,?,?,?,?,?,NULL)",
        entry.id(), entry.queueItemId(), entry.tableName(), entry.recordId(), entry.operation().code(),
        Json.write(entry.payload()), truncate(entry.lastError()), entry.errorDetails(), entry.retryCount(),
        entry.correlationId(), entry.deadAt()) == 1;
  }

  @Override
  public List<DeadLetterEntry> query(Connection conn, String tableFilter, int limit) {
    if (tableFilter == null) {
      return JdbcTemplate.query(conn, "SELECT " + COLUMNS + " FROM " + tableName
          + " WHERE replayed_at IS NULL ORDER BY dead_at DESC LIMIT ?", ENTRY_ROW_MAPPER, limit);
    }
    return JdbcTemplate.query(conn, "SELECT " + COLUMNS + " FROM " + tableName
        + " WHERE replayed_at IS NULL AND table_name=? ORDER BY dead_at DESC LIMIT ?",
        ENTRY_ROW_MAPPER, tableFilter, limit);
  }

  @Override
  public long count(Connection conn, String tableFilter) {
    if (tableFilter == null) {
      return JdbcTemplate.queryLong(conn, "SELECT COUNT(*) FROM " + tableName + " WHERE replayed_at IS NULL");
    }
    return JdbcTemplate.queryLong(conn,
        "SELECT COUNT(*) FROM " + tableName + " WHERE replayed_at IS NULL AND table_name=?", tableFilter);
  }

  @Override
  public Optional<DeadLetterEntry> findByQueueItem(Connection conn, String queueItemId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + tableName + " WHERE queue_item_id=?", ENTRY_ROW_MAPPER, queueItemId);
  }

  @Override
  public int markReplayed(Connection conn, String queueItemId, Instant replayedAt) {
    return JdbcTemplate.update(conn, "UPDATE " + tableName
        + " SET replayed_at=? WHERE queue_item_id=? AND replayed_at IS NULL", replayedAt, queueItemId);
  }

  private static String truncate(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
