package io.syncbridge.api;

import io.syncbridge.model.QueueStats;
import io.syncbridge.model.StatusTableCount;
import io.syncbridge.spi.ConnectionProvider;
import io.syncbridge.spi.SyncQueueStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Read-only views over the sync queue for dashboards and the status endpoint.
 */
public final class QueueMonitor {
  private static final Duration STATS_WINDOW = Duration.ofHours(1);

  private final ConnectionProvider connectionProvider;
  private final SyncQueueStore queueStore;
  private final Clock clock;

  public QueueMonitor(ConnectionProvider connectionProvider, SyncQueueStore queueStore) {
    this(connectionProvider, queueStore, Clock.systemUTC());
  }

  public QueueMonitor(ConnectionProvider connectionProvider, SyncQueueStore queueStore, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.queueStore = Objects.requireNonNull(queueStore, "queueStore");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Number of items per status and source table. */
  public List<StatusTableCount> countsByStatusAndTable() {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return queueStore.countByStatusAndTable(conn);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to count queue items", e);
    }
  }

  /** Queue health with completion and failure counts over the last hour. */
  public QueueStats stats() {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return queueStore.stats(conn, clock.instant().minus(STATS_WINDOW));
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to compute queue stats", e);
    }
  }
}
