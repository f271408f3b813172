package io.syncbridge.dispatch;

import io.syncbridge.model.GroupPolicy;

import java.util.List;

/**
 * Per-group result of one processing run. Only groups with a failure are reported.
 *
 * @param errors one {@code table/recordId: message} entry per failed item
 */
public record GroupOutcome(
    String correlationId,
    GroupPolicy policy,
    int completed,
    int failed,
    int skipped,
    List<String> errors) {

  public GroupOutcome {
    errors = List.copyOf(errors);
  }
}
