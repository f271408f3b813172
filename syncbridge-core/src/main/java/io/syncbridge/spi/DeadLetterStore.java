package io.syncbridge.spi;

import io.syncbridge.model.DeadLetterEntry;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Archive of queue items that exhausted their retries.
 */
public interface DeadLetterStore {

  /**
   * Appends an entry unless one already exists for the same queue item.
   *
   * @return {@code true} if the entry was appended
   */
  boolean append(Connection conn, DeadLetterEntry entry);

  /**
   * Entries not yet replayed, newest first.
   *
   * @param tableName optional filter; {@code null} returns every table
   */
  List<DeadLetterEntry> query(Connection conn, String tableName, int limit);

  long count(Connection conn, String tableName);

  Optional<DeadLetterEntry> findByQueueItem(Connection conn, String queueItemId);

  int markReplayed(Connection conn, String queueItemId, Instant replayedAt);
}
