package io.syncbridge.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What the engine does when a workflow step fails.
 */
public enum FailurePolicy {
  /** Record the failure in the context and move on to the next step. */
  CONTINUE("continue"),
  /** Fail the execution at this step. */
  ABORT("abort"),
  /** Re-run the step with backoff until the definition's retry limit, then fail. */
  RETRY("retry");

  private final String code;

  FailurePolicy(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }

  @JsonCreator
  public static FailurePolicy fromCode(String code) {
    for (FailurePolicy policy : values()) {
      if (policy.code.equalsIgnoreCase(code)) {
        return policy;
      }
    }
    throw new IllegalArgumentException("Unknown failure policy: " + code);
  }
}
