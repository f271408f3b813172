package io.syncbridge.dispatch;

import java.util.List;

/**
 * Counts of one processor run.
 *
 * @param processed    items claimed by this run
 * @param succeeded    items completed
 * @param failed       failed attempts, including those that were dead-lettered
 * @param skipped      items moved to {@code skipped}
 * @param deadLettered items that exhausted their retries in this run
 * @param groups       partial-failure summaries of correlation groups
 */
public record ProcessingReport(
    int processed,
    int succeeded,
    int failed,
    int skipped,
    int deadLettered,
    List<GroupOutcome> groups) {

  public static final ProcessingReport EMPTY = new ProcessingReport(0, 0, 0, 0, 0, List.of());

  public ProcessingReport {
    groups = List.copyOf(groups);
  }
}
