package io.syncbridge.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted sync queue row.
 *
 * @param id               item identifier (ULID)
 * @param tableName        source table
 * @param recordId         source record identifier
 * @param operation        captured mutation
 * @param payload          filtered row snapshot
 * @param status           current lifecycle status
 * @param errorMessage     last failure message, cleared on success
 * @param errorDetails     verbatim response body of the last failure, if any
 * @param retryCount       failed attempts so far
 * @param maxRetries       failed attempts allowed before dead-lettering
 * @param nextRetryAt      earliest time a failed item is due again; {@code null} means now
 * @param idempotencyKey   unique enqueue key
 * @param correlationId    correlation group, {@code null} for standalone items
 * @param sequence         position within the correlation group, {@code null} for standalone items
 * @param groupPolicy      group delivery policy, {@code null} for standalone items
 * @param createdAt        enqueue time; refreshed when a pending item is coalesced
 * @param processedAt      time of the last terminal transition
 * @param claimedAt        start of the current processing claim
 * @param externalResponse response of the successful external call
 */
public record SyncQueueItem(
    String id,
    String tableName,
    String recordId,
    Operation operation,
    Map<String, Object> payload,
    QueueStatus status,
    String errorMessage,
    String errorDetails,
    int retryCount,
    int maxRetries,
    Instant nextRetryAt,
    String idempotencyKey,
    String correlationId,
    Integer sequence,
    GroupPolicy groupPolicy,
    Instant createdAt,
    Instant processedAt,
    Instant claimedAt,
    String externalResponse) {

  public static final int DEFAULT_MAX_RETRIES = 3;

  public SyncQueueItem {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(tableName, "tableName");
    Objects.requireNonNull(recordId, "recordId");
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(idempotencyKey, "idempotencyKey");
    Objects.requireNonNull(createdAt, "createdAt");
    payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }

  /**
   * Creates a fresh pending item.
   */
  public static SyncQueueItem pending(String id, String tableName, String recordId, Operation operation,
      Map<String, Object> payload, int maxRetries, String idempotencyKey, String correlationId,
      Integer sequence, GroupPolicy groupPolicy, Instant createdAt) {
    return new SyncQueueItem(id, tableName, recordId, operation, payload, QueueStatus.PENDING,
        null, null, 0, maxRetries, null, idempotencyKey, correlationId, sequence, groupPolicy,
        createdAt, null, null, null);
  }

  public boolean isCorrelated() {
    return correlationId != null;
  }

  /** Failed with no retries left; the item has been handed to the dead-letter store. */
  public boolean isExhausted() {
    return status == QueueStatus.FAILED && retryCount >= maxRetries;
  }

  /** Eligible for a processing claim at {@code now}. */
  public boolean isDue(Instant now) {
    if (status == QueueStatus.PENDING) {
      return true;
    }
    return status == QueueStatus.FAILED
        && retryCount < maxRetries
        && (nextRetryAt == null || !nextRetryAt.isAfter(now));
  }
}
