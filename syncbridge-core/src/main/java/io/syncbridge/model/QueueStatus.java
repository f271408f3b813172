package io.syncbridge.model;

/**
 * Lifecycle status of a sync queue item.
 *
 * <pre>
 * pending --claim--> processing --ok--> completed
 *                       |
 *                       +--fail, retries left--> failed --due--> processing
 *                       +--fail, exhausted-----> failed (dead-lettered)
 * pending/processing --config missing or group aborted--> skipped
 * </pre>
 */
public enum QueueStatus {
  PENDING("pending"),
  PROCESSING("processing"),
  COMPLETED("completed"),
  FAILED("failed"),
  SKIPPED("skipped");

  private final String code;

  QueueStatus(String code) {
    this.code = code;
  }

  /** Value persisted in the {@code status} column. */
  public String code() {
    return code;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == SKIPPED;
  }

  public static QueueStatus fromCode(String code) {
    for (QueueStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown queue status: " + code);
  }
}
