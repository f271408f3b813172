package io.syncbridge.workflow;

/**
 * Thrown synchronously when a workflow definition or an enqueue request is invalid.
 */
public class WorkflowValidationException extends RuntimeException {

  public WorkflowValidationException(String message) {
    super(message);
  }
}
