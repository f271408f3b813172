package io.syncbridge.workflow;

import io.syncbridge.util.Json;

import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowDefinitionTest {
  private static final WorkflowStep CREATE = new WorkflowStep("create_booking", "bookings", "create",
      Map.of("listingId", "{{listing_id}}"), FailurePolicy.RETRY);

  @Test
  void defaultsApply() {
    WorkflowDefinition definition = WorkflowDefinition.of("proposal_accepted", List.of(CREATE), null);

    assertTrue(definition.active());
    assertEquals(WorkflowDefinition.DEFAULT_MAX_RETRIES, definition.maxRetries());
    assertEquals(WorkflowDefinition.DEFAULT_TIMEOUT_SECONDS, definition.timeoutSeconds());
    assertTrue(definition.requiredFields().isEmpty());
  }

  @Test
  void rejectsEmptyStepsAndDuplicateNames() {
    assertThrows(WorkflowValidationException.class,
        () -> WorkflowDefinition.of("empty", List.of(), List.of()));
    assertThrows(WorkflowValidationException.class,
        () -> WorkflowDefinition.of("dup", List.of(CREATE, CREATE), List.of()));
  }

  @Test
  void rejectsInvalidLimits() {
    WorkflowDefinition definition = WorkflowDefinition.of("proposal_accepted", List.of(CREATE), List.of());

    assertThrows(WorkflowValidationException.class, () -> definition.withTimeoutSeconds(0));
    assertThrows(WorkflowValidationException.class, () -> definition.withMaxRetries(-1));
  }

  @Test
  void stepDefaultsToAbort() {
    WorkflowStep step = new WorkflowStep("notify", "notifications", "send", null, null);

    assertEquals(FailurePolicy.ABORT, step.onFailure());
    assertTrue(step.payloadTemplate().isEmpty());
  }

  @Test
  void stepsSurviveJson() {
    String json = Json.write(List.of(CREATE));
    assertTrue(json.contains("\"onFailure\":\"retry\""));

    List<WorkflowStep> steps = Json.read(json, new TypeReference<List<WorkflowStep>>() {});
    assertEquals(List.of(CREATE), steps);
  }

  @Test
  void failurePolicyCodesAreCaseInsensitive() {
    assertEquals(FailurePolicy.CONTINUE, FailurePolicy.fromCode("CONTINUE"));
    assertThrows(IllegalArgumentException.class, () -> FailurePolicy.fromCode("ignore"));
  }

  @Test
  void registryRejectsDuplicateHandlers() {
    StepHandlerRegistry registry = new StepHandlerRegistry()
        .register("bookings", (action, payload) -> Map.of());

    assertThrows(IllegalStateException.class, () -> registry.register("bookings", (action, payload) -> Map.of()));
    assertTrue(registry.find("bookings").isPresent());
    assertTrue(registry.find("payments").isEmpty());
  }

  @Test
  void terminalStatuses() {
    assertFalse(ExecutionStatus.RUNNING.isTerminal());
    assertTrue(ExecutionStatus.CANCELLED.isTerminal());
    assertEquals(ExecutionStatus.FAILED, ExecutionStatus.fromCode("failed"));
  }
}
