package io.syncbridge.workflow;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted state of one workflow run.
 *
 * @param currentStep index of the next step to run
 * @param context     step outputs keyed by step name
 * @param leaseUntil  end of the current claim, or the time a retried step becomes due
 */
public record WorkflowExecution(
    String id,
    String workflowName,
    int workflowVersion,
    ExecutionStatus status,
    int currentStep,
    int totalSteps,
    Map<String, Object> inputPayload,
    Map<String, Object> context,
    String errorMessage,
    String errorStep,
    int retryCount,
    String correlationId,
    String triggeredBy,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Instant updatedAt,
    Instant leaseUntil) {

  public WorkflowExecution {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(workflowName, "workflowName");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(correlationId, "correlationId");
    inputPayload = inputPayload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputPayload));
    context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  public static WorkflowExecution pending(String id, WorkflowDefinition definition, Map<String, Object> input,
      String correlationId, String triggeredBy, Instant now) {
    return new WorkflowExecution(id, definition.name(), definition.version(), ExecutionStatus.PENDING,
        0, definition.steps().size(), input, Map.of(), null, null, 0, correlationId, triggeredBy,
        now, null, null, now, null);
  }
}
