package io.syncbridge.jdbc.store;

import io.syncbridge.jdbc.JdbcTemplate;
import io.syncbridge.jdbc.SyncStoreException;
import io.syncbridge.model.GroupPolicy;
import io.syncbridge.model.Operation;
import io.syncbridge.model.QueueStats;
import io.syncbridge.model.QueueStatus;
import io.syncbridge.model.StatusTableCount;
import io.syncbridge.model.SyncQueueItem;
import io.syncbridge.spi.SyncQueueStore;
import io.syncbridge.util.Json;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Base JDBC sync queue store with standard SQL that runs on H2 and PostgreSQL.
 *
 * <p>The "one pending row per record" rule is enforced by the unique {@code pending_guard}
 * column: it holds {@code table_name:record_id} while a row, standalone or grouped, is pending
 * and is cleared by every transition out of {@code pending}.
 *
 * <p>Subclasses override {@link #upsertPending} and {@link #tryInsert} where the database
 * has a native upsert. Register implementations via
 * {@code META-INF/services/io.syncbridge.jdbc.store.AbstractJdbcSyncQueueStore}.
 *
 * @see JdbcSyncStores
 */
public abstract class AbstractJdbcSyncQueueStore implements SyncQueueStore {
  public static final String DEFAULT_TABLE = "sync_queue";
  protected static final int MAX_ERROR_LENGTH = 4000;

  protected static final String COLUMNS = "id, table_name, record_id, operation, payload, status, "
      + "error_message, error_details, retry_count, max_retries, next_retry_at, idempotency_key, "
      + "correlation_id, seq, group_policy, created_at, processed_at, claimed_at, external_response";

  protected static final String DUE_PREDICATE = "(status='pending' OR (status='failed'"
      + " AND retry_count < max_retries AND (next_retry_at IS NULL OR next_retry_at <= ?)))";

  protected static final JdbcTemplate.RowMapper<SyncQueueItem> ITEM_ROW_MAPPER = rs -> {
    String policy = rs.getString("group_policy");
    return new SyncQueueItem(
        rs.getString("id"),
        rs.getString("table_name"),
        rs.getString("record_id"),
        Operation.fromCode(rs.getString("operation")),
        Json.readMap(rs.getString("payload")),
        QueueStatus.fromCode(rs.getString("status")),
        rs.getString("error_message"),
        rs.getString("error_details"),
        rs.getInt("retry_count"),
        rs.getInt("max_retries"),
        JdbcTemplate.instant(rs, "next_retry_at"),
        rs.getString("idempotency_key"),
        rs.getString("correlation_id"),
        JdbcTemplate.nullableInt(rs, "seq"),
        policy == null ? null : GroupPolicy.valueOf(policy),
        JdbcTemplate.instant(rs, "created_at"),
        JdbcTemplate.instant(rs, "processed_at"),
        JdbcTemplate.instant(rs, "claimed_at"),
        rs.getString("external_response"));
  };

  private final String tableName;

  protected AbstractJdbcSyncQueueStore() {
    this(DEFAULT_TABLE);
  }

  protected AbstractJdbcSyncQueueStore(String tableName) {
    this.tableName = JdbcTemplate.checkTableName(tableName);
  }

  /**
   * Unique identifier for this store (e.g., "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:postgresql:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  public String tableName() {
    return tableName;
  }

  /**
   * Default strategy: refresh the pending row if there is one, else insert. An insert that loses
   * a race on {@code pending_guard} falls back to refreshing the winner's row. A pending group
   * item keeps its idempotency key and {@code created_at}.
   */
  @Override
  public String upsertPending(Connection conn, SyncQueueItem item) {
    String guard = pendingGuard(item.tableName(), item.recordId());
    for (int attempt = 0; attempt < 2; attempt++) {
      Optional<String> existing = JdbcTemplate.queryOne(conn,
          "SELECT id FROM " + tableName() + " WHERE pending_guard=?", rs -> rs.getString(1), guard);
      if (existing.isPresent()) {
        int updated = JdbcTemplate.update(conn, "UPDATE " + tableName()
                + " SET operation=?, payload=?,"
                + " idempotency_key=CASE WHEN correlation_id IS NULL THEN ? ELSE idempotency_key END,"
                + " created_at=CASE WHEN correlation_id IS NULL THEN CAST(? AS TIMESTAMP) ELSE created_at END"
                + " WHERE id=? AND status='pending'",
            item.operation().code(), Json.write(item.payload()), item.idempotencyKey(), item.createdAt(),
            existing.get());
        if (updated == 1) {
          return existing.get();
        }
      }
      try {
        insert(conn, item, guard);
        return item.id();
      } catch (SyncStoreException e) {
        if (!e.isUniqueViolation()) {
          throw e;
        }
      }
    }
    throw new SyncStoreException("Could not upsert pending item for " + guard, null);
  }

  /**
   * Inserts the group item holding the record's {@code pending_guard}. When another row is
   * already pending for the record, the snapshot is folded into that row instead.
   */
  @Override
  public boolean insertIfAbsent(Connection conn, SyncQueueItem item) {
    String guard = pendingGuard(item.tableName(), item.recordId());
    for (int attempt = 0; attempt < 2; attempt++) {
      if (tryInsert(conn, item, guard)) {
        return true;
      }
      if (JdbcTemplate.queryLong(conn, "SELECT COUNT(*) FROM " + tableName() + " WHERE idempotency_key=?",
          item.idempotencyKey()) > 0) {
        return false;
      }
      // a pending insert stays an insert unless the record is now gone
      int refreshed = JdbcTemplate.update(conn, "UPDATE " + tableName()
              + " SET operation=CASE WHEN operation='insert' AND ?<>'delete' THEN operation ELSE ? END, payload=?"
              + " WHERE pending_guard=? AND status='pending'",
          item.operation().code(), item.operation().code(), Json.write(item.payload()), guard);
      if (refreshed == 1) {
        return false;
      }
    }
    throw new SyncStoreException("Could not insert group item " + item.idempotencyKey(), null);
  }

  /**
   * Inserts the row, returning {@code false} instead of failing on any unique conflict.
   */
  protected boolean tryInsert(Connection conn, SyncQueueItem item, String pendingGuard) {
    try {
      insert(conn, item, pendingGuard);
      return true;
    } catch (SyncStoreException e) {
      if (e.isUniqueViolation()) {
        return false;
      }
      throw e;
    }
  }

  protected void insert(Connection conn, SyncQueueItem item, String pendingGuard) {
    JdbcTemplate.update(conn, insertSql(), insertParams(item, pendingGuard));
  }

  protected String insertSql() {
    return "INSERT INTO " + tableName() + " (" + COLUMNS + ", pending_guard)"
        + " VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
  }

  protected Object[] insertParams(SyncQueueItem item, String pendingGuard) {
    return new Object[]{
        item.id(), item.tableName(), item.recordId(), item.operation().code(), Json.write(item.payload()),
        item.status().code(), truncate(item.errorMessage()), item.errorDetails(), item.retryCount(),
        item.maxRetries(), item.nextRetryAt(), item.idempotencyKey(), item.correlationId(), item.sequence(),
        item.groupPolicy() == null ? null : item.groupPolicy().name(), item.createdAt(), item.processedAt(),
        item.claimedAt(), item.externalResponse(), pendingGuard};
  }

  @Override
  public Optional<SyncQueueItem> findById(Connection conn, String id) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id=?", ITEM_ROW_MAPPER, id);
  }

  @Override
  public Optional<SyncQueueItem> findPending(Connection conn, String tableName, String recordId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE table_name=? AND record_id=? AND status='pending'"
            + " ORDER BY created_at LIMIT 1",
        ITEM_ROW_MAPPER, tableName, recordId);
  }

  @Override
  public List<SyncQueueItem> findDue(Connection conn, Instant now, int limit) {
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE " + DUE_PREDICATE
            + " ORDER BY created_at, seq LIMIT ?",
        ITEM_ROW_MAPPER, now, limit);
  }

  @Override
  public List<SyncQueueItem> findRetryable(Connection conn, Instant now, int limit) {
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE status='failed' AND retry_count < max_retries"
            + " AND (next_retry_at IS NULL OR next_retry_at <= ?)"
            + " ORDER BY COALESCE(next_retry_at, created_at), seq LIMIT ?",
        ITEM_ROW_MAPPER, now, limit);
  }

  @Override
  public long countDue(Connection conn, Instant now) {
    return JdbcTemplate.queryLong(conn,
        "SELECT COUNT(*) FROM " + tableName() + " WHERE " + DUE_PREDICATE, now);
  }

  @Override
  public List<SyncQueueItem> findGroup(Connection conn, String correlationId) {
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE correlation_id=? ORDER BY seq, created_at",
        ITEM_ROW_MAPPER, correlationId);
  }

  @Override
  public boolean tryClaim(Connection conn, String id, Instant now) {
    return JdbcTemplate.update(conn, "UPDATE " + tableName()
            + " SET status='processing', claimed_at=?, pending_guard=NULL WHERE id=? AND " + DUE_PREDICATE,
        now, id, now) == 1;
  }

  @Override
  public int markCompleted(Connection conn, String id, Instant processedAt, String externalResponse) {
    return JdbcTemplate.update(conn, "UPDATE " + tableName()
            + " SET status='completed', processed_at=?, external_response=?, error_message=NULL,"
            + " error_details=NULL, next_retry_at=NULL, claimed_at=NULL WHERE id=? AND status='processing'",
        processedAt, externalResponse, id);
  }

  @Override
  public int markFailed(Connection conn, String id, int retryCount, Instant nextRetryAt,
      String errorMessage, String errorDetails, Instant processedAt) {
    return JdbcTemplate.update(conn, "UPDATE " + tableName()
            + " SET status='failed', retry_count=?,"
            + " next_retry_at=CASE WHEN max_retries <= ? THEN NULL ELSE CAST(? AS TIMESTAMP) END,"
            + " error_message=?, error_details=?, processed_at=?, claimed_at=NULL"
            + " WHERE id=? AND status='processing'",
        retryCount, retryCount, nextRetryAt, truncate(errorMessage), errorDetails, processedAt, id);
  }

  @Override
  public int markSkipped(Connection conn, String id, String reason, Instant processedAt) {
    return JdbcTemplate.update(conn, "UPDATE " + tableName()
            + " SET status='skipped', error_message=?, processed_at=?, pending_guard=NULL, claimed_at=NULL"
            + " WHERE id=? AND status IN ('pending','processing','failed')",
        truncate(reason), processedAt, id);
  }

  @Override
  public int releaseStale(Connection conn, Instant claimedBefore, Instant now) {
    return JdbcTemplate.update(conn, "UPDATE " + tableName()
            + " SET status='failed', next_retry_at=?, claimed_at=NULL,"
            + " error_message=COALESCE(error_message, 'Processing claim expired')"
            + " WHERE status='processing' AND claimed_at < ?",
        now, claimedBefore);
  }

  @Override
  public boolean resetForReplay(Connection conn, String id) {
    return JdbcTemplate.update(conn, "UPDATE " + tableName() + " q"
            + " SET status='pending', retry_count=0, next_retry_at=NULL, error_message=NULL,"
            + " error_details=NULL, processed_at=NULL, claimed_at=NULL,"
            + " pending_guard=table_name || ':' || record_id"
            + " WHERE q.id=? AND q.status='failed' AND NOT EXISTS (SELECT 1 FROM " + tableName() + " p"
            + " WHERE p.table_name=q.table_name AND p.record_id=q.record_id AND p.status='pending'"
            + " AND p.id<>q.id)",
        id) == 1;
  }

  @Override
  public List<StatusTableCount> countByStatusAndTable(Connection conn) {
    return JdbcTemplate.query(conn,
        "SELECT status, table_name, COUNT(*) AS cnt FROM " + tableName()
            + " GROUP BY status, table_name ORDER BY table_name, status",
        rs -> new StatusTableCount(QueueStatus.fromCode(rs.getString("status")),
            rs.getString("table_name"), rs.getLong("cnt")));
  }

  @Override
  public QueueStats stats(Connection conn, Instant since) {
    String sql = "SELECT"
        + " SUM(CASE WHEN status='pending' THEN 1 ELSE 0 END) AS pending,"
        + " SUM(CASE WHEN status='processing' THEN 1 ELSE 0 END) AS processing,"
        + " SUM(CASE WHEN status='failed' AND retry_count < max_retries THEN 1 ELSE 0 END) AS retryable,"
        + " SUM(CASE WHEN status='failed' AND retry_count >= max_retries THEN 1 ELSE 0 END) AS exhausted,"
        + " SUM(CASE WHEN status='completed' AND processed_at >= ? THEN 1 ELSE 0 END) AS completed_recent,"
        + " SUM(CASE WHEN status='failed' AND processed_at >= ? THEN 1 ELSE 0 END) AS failed_recent"
        + " FROM " + tableName();
    return JdbcTemplate.queryOne(conn, sql, rs -> new QueueStats(
            rs.getLong("pending"),
            rs.getLong("processing"),
            rs.getLong("retryable"),
            rs.getLong("exhausted"),
            rs.getLong("completed_recent"),
            rs.getLong("failed_recent"),
            since),
        since, since)
        .orElse(new QueueStats(0, 0, 0, 0, 0, 0, since));
  }

  protected static String pendingGuard(String tableName, String recordId) {
    return tableName + ":" + recordId;
  }

  protected static String truncate(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
