package io.syncbridge.workflow;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Named, versioned sequence of steps.
 *
 * <p>The registry assigns {@code version}; executions pin the version they were enqueued with.
 *
 * @param name                     unique workflow name
 * @param steps                    ordered, non-empty, unique step names
 * @param requiredFields           input keys that must be present at enqueue time
 * @param timeoutSeconds           wall-clock budget of one execution
 * @param visibilityTimeoutSeconds lease length of a running claim
 * @param maxRetries               attempts allowed for steps with {@link FailurePolicy#RETRY}
 * @param active                   inactive definitions cannot be enqueued
 * @param version                  incremented on every save
 */
public record WorkflowDefinition(
    String name,
    List<WorkflowStep> steps,
    List<String> requiredFields,
    int timeoutSeconds,
    int visibilityTimeoutSeconds,
    int maxRetries,
    boolean active,
    int version) {

  public static final int DEFAULT_TIMEOUT_SECONDS = 300;
  public static final int DEFAULT_VISIBILITY_TIMEOUT_SECONDS = 60;
  public static final int DEFAULT_MAX_RETRIES = 3;

  public WorkflowDefinition {
    Objects.requireNonNull(name, "name");
    if (steps == null || steps.isEmpty()) {
      throw new WorkflowValidationException("Workflow " + name + " must have at least one step");
    }
    steps = List.copyOf(steps);
    Set<String> names = new HashSet<>();
    for (WorkflowStep step : steps) {
      if (!names.add(step.name())) {
        throw new WorkflowValidationException("Duplicate step name in workflow " + name + ": " + step.name());
      }
    }
    requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
    if (timeoutSeconds <= 0) {
      throw new WorkflowValidationException("timeoutSeconds must be > 0");
    }
    if (visibilityTimeoutSeconds <= 0) {
      throw new WorkflowValidationException("visibilityTimeoutSeconds must be > 0");
    }
    if (maxRetries < 0) {
      throw new WorkflowValidationException("maxRetries must be >= 0");
    }
  }

  /**
   * Active definition with default timeouts and retry limit; version is assigned on save.
   */
  public static WorkflowDefinition of(String name, List<WorkflowStep> steps, List<String> requiredFields) {
    return new WorkflowDefinition(name, steps, requiredFields, DEFAULT_TIMEOUT_SECONDS,
        DEFAULT_VISIBILITY_TIMEOUT_SECONDS, DEFAULT_MAX_RETRIES, true, 0);
  }

  public WorkflowDefinition withVersion(int version) {
    return new WorkflowDefinition(name, steps, requiredFields, timeoutSeconds,
        visibilityTimeoutSeconds, maxRetries, active, version);
  }

  public WorkflowDefinition withActive(boolean active) {
    return new WorkflowDefinition(name, steps, requiredFields, timeoutSeconds,
        visibilityTimeoutSeconds, maxRetries, active, version);
  }

  public WorkflowDefinition withMaxRetries(int maxRetries) {
    return new WorkflowDefinition(name, steps, requiredFields, timeoutSeconds,
        visibilityTimeoutSeconds, maxRetries, active, version);
  }

  public WorkflowDefinition withTimeoutSeconds(int timeoutSeconds) {
    return new WorkflowDefinition(name, steps, requiredFields, timeoutSeconds,
        visibilityTimeoutSeconds, maxRetries, active, version);
  }

  public WorkflowDefinition withVisibilityTimeoutSeconds(int visibilityTimeoutSeconds) {
    return new WorkflowDefinition(name, steps, requiredFields, timeoutSeconds,
        visibilityTimeoutSeconds, maxRetries, active, version);
  }
}
