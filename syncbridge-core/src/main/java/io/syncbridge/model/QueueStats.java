package io.syncbridge.model;

import java.time.Instant;

/**
 * Point-in-time queue health summary.
 *
 * @param pending            items waiting for their first attempt
 * @param processing         items currently claimed
 * @param retryable          failed items with retries left
 * @param deadLettered       failed items with no retries left
 * @param completedLastHour  items completed since {@code since}
 * @param failedLastHour     failures recorded since {@code since}
 * @param since              window start
 */
public record QueueStats(
    long pending,
    long processing,
    long retryable,
    long deadLettered,
    long completedLastHour,
    long failedLastHour,
    Instant since) {
}
