package io.syncbridge.jdbc.store;

import io.syncbridge.jdbc.JdbcTemplate;
import io.syncbridge.jdbc.SyncStoreException;
import io.syncbridge.model.SyncQueueItem;

import java.sql.Connection;
import java.util.List;

/**
 * PostgreSQL sync queue store.
 *
 * <p>Writes use {@code INSERT ... ON CONFLICT} so a duplicate never raises an error inside
 * the caller's transaction (which would abort it).
 */
public final class PostgresSyncQueueStore extends AbstractJdbcSyncQueueStore {

  public PostgresSyncQueueStore() {
    super();
  }

  public PostgresSyncQueueStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  /**
   * Single round-trip coalescing upsert; the surviving row keeps its id.
   */
  @Override
  public String upsertPending(Connection conn, SyncQueueItem item) {
    String sql = insertSql()
        + " ON CONFLICT (pending_guard) DO UPDATE SET operation=EXCLUDED.operation, payload=EXCLUDED.payload,"
        + " idempotency_key=CASE WHEN " + tableName() + ".correlation_id IS NULL"
        + " THEN EXCLUDED.idempotency_key ELSE " + tableName() + ".idempotency_key END,"
        + " created_at=CASE WHEN " + tableName() + ".correlation_id IS NULL"
        + " THEN EXCLUDED.created_at ELSE " + tableName() + ".created_at END"
        + " RETURNING id";
    List<String> ids = JdbcTemplate.updateReturning(conn, sql, rs -> rs.getString(1),
        insertParams(item, pendingGuard(item.tableName(), item.recordId())));
    if (ids.isEmpty()) {
      throw new SyncStoreException("Upsert returned no row for " + item.tableName() + ":" + item.recordId(), null);
    }
    return ids.get(0);
  }

  @Override
  protected boolean tryInsert(Connection conn, SyncQueueItem item, String pendingGuard) {
    return JdbcTemplate.update(conn, insertSql() + " ON CONFLICT DO NOTHING", insertParams(item, pendingGuard)) == 1;
  }
}
