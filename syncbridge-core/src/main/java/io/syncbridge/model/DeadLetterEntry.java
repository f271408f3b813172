package io.syncbridge.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Archived copy of a queue item that exhausted its retries.
 */
public record DeadLetterEntry(
    String id,
    String queueItemId,
    String tableName,
    String recordId,
    Operation operation,
    Map<String, Object> payload,
    String lastError,
    String errorDetails,
    int retryCount,
    String correlationId,
    Instant deadAt,
    Instant replayedAt) {

  public DeadLetterEntry {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(queueItemId, "queueItemId");
    Objects.requireNonNull(deadAt, "deadAt");
    payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }

  public static DeadLetterEntry of(String id, SyncQueueItem item, String lastError, String errorDetails,
      int retryCount, Instant deadAt) {
    return new DeadLetterEntry(id, item.id(), item.tableName(), item.recordId(), item.operation(),
        item.payload(), lastError, errorDetails, retryCount, item.correlationId(), deadAt, null);
  }
}
