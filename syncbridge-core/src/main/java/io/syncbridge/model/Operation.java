package io.syncbridge.model;

/**
 * Kind of mutation captured for a queue item.
 */
public enum Operation {
  INSERT("insert"),
  UPDATE("update"),
  DELETE("delete"),
  /** A multi-record change delivered to the target as one call. */
  ATOMIC_COMPOSITE("atomic_composite");

  private final String code;

  Operation(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static Operation fromCode(String code) {
    for (Operation operation : values()) {
      if (operation.code.equalsIgnoreCase(code)) {
        return operation;
      }
    }
    throw new IllegalArgumentException("Unknown operation: " + code);
  }
}
