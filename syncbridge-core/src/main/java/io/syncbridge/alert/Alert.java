package io.syncbridge.alert;

import java.time.Instant;
import java.util.Objects;

/**
 * Operator alert.
 *
 * @param kind       what happened
 * @param subject    source table or workflow name
 * @param reference  record id or execution id
 * @param message    last error message
 * @param occurredAt alert time
 */
public record Alert(Kind kind, String subject, String reference, String message, Instant occurredAt) {

  public enum Kind {
    DEAD_LETTER,
    GROUP_PARTIAL_FAILURE,
    WORKFLOW_FAILED
  }

  public Alert {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(occurredAt, "occurredAt");
  }

  public static Alert deadLetter(String tableName, String recordId, String error) {
    return new Alert(Kind.DEAD_LETTER, tableName, recordId, error, Instant.now());
  }

  public static Alert workflowFailed(String workflowName, String executionId, String error) {
    return new Alert(Kind.WORKFLOW_FAILED, workflowName, executionId, error, Instant.now());
  }

  /** Single-line rendering used by log and chat channels. */
  public String summary() {
    return "[" + kind + "] " + subject + "/" + reference + ": " + message;
  }
}
