package io.syncbridge.spi;

import io.syncbridge.model.QueueStats;
import io.syncbridge.model.StatusTableCount;
import io.syncbridge.model.SyncQueueItem;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence operations for the sync queue.
 *
 * <p>Every status transition is a conditional update; the returned row count tells the
 * caller whether it won the transition. Methods throw an unchecked store exception on
 * database errors.
 */
public interface SyncQueueStore {

  /**
   * Coalesces a standalone item into the pending row for its {@code (tableName, recordId)},
   * replacing payload and operation (and, when that row is standalone, idempotency key and
   * {@code createdAt}); inserts the item when no such row exists.
   *
   * @return the id of the pending row holding the payload
   */
  String upsertPending(Connection conn, SyncQueueItem item);

  /**
   * Inserts a correlated item unless its idempotency key already exists. When another row is
   * pending for the same {@code (tableName, recordId)}, the item's payload and operation are
   * folded into that row and nothing is inserted, so a record never has two pending rows.
   *
   * @return {@code true} if inserted
   */
  boolean insertIfAbsent(Connection conn, SyncQueueItem item);

  Optional<SyncQueueItem> findById(Connection conn, String id);

  Optional<SyncQueueItem> findPending(Connection conn, String tableName, String recordId);

  /**
   * Items that are pending, or failed with retries left and {@code nextRetryAt <= now},
   * oldest {@code createdAt} first.
   */
  List<SyncQueueItem> findDue(Connection conn, Instant now, int limit);

  /**
   * Failed items with retries left whose {@code nextRetryAt} elapsed, earliest first.
   */
  List<SyncQueueItem> findRetryable(Connection conn, Instant now, int limit);

  /** Count matching {@link #findDue}. */
  long countDue(Connection conn, Instant now);

  /** All items of a correlation group in sequence order. */
  List<SyncQueueItem> findGroup(Connection conn, String correlationId);

  /**
   * Moves a due item to {@code processing}.
   *
   * @return {@code true} if this caller owns the claim
   */
  boolean tryClaim(Connection conn, String id, Instant now);

  int markCompleted(Connection conn, String id, Instant processedAt, String externalResponse);

  /**
   * Records a failed attempt. {@code nextRetryAt} is ignored once {@code retryCount}
   * reaches the item's {@code maxRetries}.
   */
  int markFailed(Connection conn, String id, int retryCount, Instant nextRetryAt,
      String errorMessage, String errorDetails, Instant processedAt);

  /** Moves a non-terminal item to {@code skipped}. */
  int markSkipped(Connection conn, String id, String reason, Instant processedAt);

  /**
   * Returns claims older than {@code claimedBefore} to {@code failed}, due immediately,
   * without consuming a retry.
   */
  int releaseStale(Connection conn, Instant claimedBefore, Instant now);

  /**
   * Resets a failed item to {@code pending} with a fresh retry budget, provided no other
   * pending row exists for the same record.
   *
   * @return {@code true} if the item was reset
   */
  boolean resetForReplay(Connection conn, String id);

  List<StatusTableCount> countByStatusAndTable(Connection conn);

  QueueStats stats(Connection conn, Instant since);
}
