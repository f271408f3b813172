package io.syncbridge.dead;

import io.syncbridge.model.DeadLetterEntry;
import io.syncbridge.spi.ConnectionProvider;
import io.syncbridge.spi.DeadLetterStore;
import io.syncbridge.spi.ProcessorTrigger;
import io.syncbridge.spi.SyncQueueStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator tooling for dead-lettered items: inspect, count and replay.
 *
 * <p>Replay resets the queue item to {@code pending} with a fresh retry budget and marks the
 * archive entry replayed, in one transaction. It is refused while another pending item exists
 * for the same record, since that item already carries a newer snapshot.
 */
public final class DeadLetterManager {
  private static final Logger logger = Logger.getLogger(DeadLetterManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final SyncQueueStore queueStore;
  private final DeadLetterStore deadLetterStore;
  private final ProcessorTrigger trigger;
  private final Clock clock;

  public DeadLetterManager(ConnectionProvider connectionProvider, SyncQueueStore queueStore,
      DeadLetterStore deadLetterStore) {
    this(connectionProvider, queueStore, deadLetterStore, ProcessorTrigger.NONE, Clock.systemUTC());
  }

  public DeadLetterManager(ConnectionProvider connectionProvider, SyncQueueStore queueStore,
      DeadLetterStore deadLetterStore, ProcessorTrigger trigger, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.queueStore = Objects.requireNonNull(queueStore, "queueStore");
    this.deadLetterStore = Objects.requireNonNull(deadLetterStore, "deadLetterStore");
    this.trigger = trigger != null ? trigger : ProcessorTrigger.NONE;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Entries not yet replayed, newest first.
   *
   * @param tableName optional filter; {@code null} for all tables
   */
  public List<DeadLetterEntry> query(String tableName, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return deadLetterStore.query(conn, tableName, limit);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to query dead-letter entries", e);
    }
  }

  public long count(String tableName) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return deadLetterStore.count(conn, tableName);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to count dead-letter entries", e);
    }
  }

  /**
   * Puts a dead-lettered item back into the queue.
   *
   * @return {@code true} if the item was reset to pending
   */
  public boolean replay(String queueItemId) {
    Objects.requireNonNull(queueItemId, "queueItemId");
    boolean replayed;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        replayed = queueStore.resetForReplay(conn, queueItemId)
            && deadLetterStore.markReplayed(conn, queueItemId, clock.instant()) > 0;
        if (replayed) {
          conn.commit();
        } else {
          conn.rollback();
        }
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to replay dead-letter entry " + queueItemId, e);
    }
    if (replayed) {
      logger.log(Level.INFO, "Replayed dead-lettered sync item {0}", queueItemId);
      fireTrigger();
    } else {
      logger.log(Level.WARNING, "Dead-lettered sync item {0} was not replayed", queueItemId);
    }
    return replayed;
  }

  /**
   * Replays up to {@code limit} entries of a table (or all tables).
   *
   * @return entries replayed
   */
  public int replayAll(String tableName, int limit) {
    int replayed = 0;
    for (DeadLetterEntry entry : query(tableName, limit)) {
      if (replay(entry.queueItemId())) {
        replayed++;
      }
    }
    return replayed;
  }

  private void fireTrigger() {
    try {
      trigger.fire(10);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Processor trigger after replay failed", e);
    }
  }
}
