package io.syncbridge.model;

/**
 * One row of the monitoring view: number of queue items per status and source table.
 */
public record StatusTableCount(QueueStatus status, String tableName, long count) {
}
