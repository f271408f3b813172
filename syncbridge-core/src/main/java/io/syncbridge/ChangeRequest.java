package io.syncbridge;

import io.syncbridge.model.Operation;

import java.util.Map;
import java.util.Objects;

/**
 * One member of a correlated change group.
 *
 * @param tableName source table
 * @param recordId  source record id
 * @param operation captured mutation
 * @param payload   unfiltered row snapshot
 * @param sequence  position within the group; delivery follows ascending sequence
 */
public record ChangeRequest(String tableName, String recordId, Operation operation,
    Map<String, Object> payload, int sequence) {

  public ChangeRequest {
    Objects.requireNonNull(tableName, "tableName");
    Objects.requireNonNull(recordId, "recordId");
    Objects.requireNonNull(operation, "operation");
  }
}
