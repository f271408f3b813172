package io.syncbridge.spi;

import io.syncbridge.workflow.WorkflowExecution;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence for workflow executions. Transitions are conditional updates that
 * return whether the caller won them.
 */
public interface WorkflowExecutionStore {

  /**
   * Inserts a pending execution unless one exists for the same correlation id.
   *
   * @return {@code true} if inserted
   */
  boolean insertIfAbsent(Connection conn, WorkflowExecution execution);

  Optional<WorkflowExecution> findById(Connection conn, String id);

  Optional<WorkflowExecution> findByCorrelationId(Connection conn, String correlationId);

  /**
   * Claims a {@code pending} execution, or a {@code running} one whose lease expired.
   *
   * @return {@code true} if the claim succeeded
   */
  boolean tryClaim(Connection conn, String id, Instant now, Instant leaseUntil);

  /** Ids of claimable executions, oldest first. */
  List<String> findClaimable(Connection conn, Instant now, int limit);

  /**
   * Persists progress of a running execution.
   *
   * @return rows updated; zero when the execution is no longer running
   */
  int updateProgress(Connection conn, String id, int currentStep, Map<String, Object> context,
      int retryCount, Instant leaseUntil, Instant now);

  int markCompleted(Connection conn, String id, int currentStep, Map<String, Object> context, Instant now);

  int markFailed(Connection conn, String id, String errorStep, String errorMessage,
      Map<String, Object> context, int retryCount, Instant now);

  /**
   * Moves a non-terminal execution to {@code cancelled}.
   *
   * @return rows updated; zero when the execution was already terminal
   */
  int cancel(Connection conn, String id, Instant now);
}
