package io.syncbridge.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One step of a workflow definition.
 *
 * @param name            unique within the definition; the step output is stored under this key
 * @param targetFunction  key of the {@link io.syncbridge.spi.StepHandler} that runs the step
 * @param action          action passed to the handler
 * @param payloadTemplate request template; string values may contain {@code {{path}}} tokens
 * @param onFailure       failure policy, defaults to {@link FailurePolicy#ABORT}
 */
public record WorkflowStep(
    String name,
    String targetFunction,
    String action,
    Map<String, Object> payloadTemplate,
    FailurePolicy onFailure) {

  public WorkflowStep {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(targetFunction, "targetFunction");
    payloadTemplate = payloadTemplate == null
        ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payloadTemplate));
    onFailure = onFailure == null ? FailurePolicy.ABORT : onFailure;
  }
}
