package io.syncbridge.workflow;

/**
 * Lifecycle status of a workflow execution.
 */
public enum ExecutionStatus {
  PENDING("pending"),
  RUNNING("running"),
  COMPLETED("completed"),
  FAILED("failed"),
  CANCELLED("cancelled");

  private final String code;

  ExecutionStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }

  public static ExecutionStatus fromCode(String code) {
    for (ExecutionStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown execution status: " + code);
  }
}
