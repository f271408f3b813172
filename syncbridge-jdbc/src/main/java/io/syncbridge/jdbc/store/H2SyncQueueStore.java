package io.syncbridge.jdbc.store;

import java.util.List;

/**
 * H2 sync queue store. Primarily for tests and local development.
 *
 * <p>Uses the portable select-then-write upsert from {@link AbstractJdbcSyncQueueStore}.
 */
public final class H2SyncQueueStore extends AbstractJdbcSyncQueueStore {

  public H2SyncQueueStore() {
    super();
  }

  public H2SyncQueueStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
