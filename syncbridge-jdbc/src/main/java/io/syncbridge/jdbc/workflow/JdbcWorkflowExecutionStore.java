package io.syncbridge.jdbc.workflow;

import io.syncbridge.jdbc.JdbcTemplate;
import io.syncbridge.jdbc.SyncStoreException;
import io.syncbridge.spi.WorkflowExecutionStore;
import io.syncbridge.util.Json;
import io.syncbridge.workflow.ExecutionStatus;
import io.syncbridge.workflow.WorkflowExecution;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link WorkflowExecutionStore} over the {@code workflow_execution} table.
 *
 * <p>Every transition is guarded by the expected status, so a cancelled execution can never be
 * advanced or completed by a runner that claimed it earlier.
 */
public final class JdbcWorkflowExecutionStore implements WorkflowExecutionStore {
  public static final String DEFAULT_TABLE = "workflow_execution";
  private static final int MAX_ERROR_LENGTH = 4000;

  private static final String COLUMNS = "id, workflow_name, workflow_version, status, current_step, total_steps, "
      + "input_payload, context, error_message, error_step, retry_count, correlation_id, triggered_by, "
      + "created_at, started_at, completed_at, updated_at, lease_until";

  private static final JdbcTemplate.RowMapper<WorkflowExecution> EXECUTION_ROW_MAPPER = rs -> new WorkflowExecution(
      rs.getString("id"),
      rs.getString("workflow_name"),
      rs.getInt("workflow_version"),
      ExecutionStatus.fromCode(rs.getString("status")),
      rs.getInt("current_step"),
      rs.getInt("total_steps"),
      Json.readMap(rs.getString("input_payload")),
      Json.readMap(rs.getString("context")),
      rs.getString("error_message"),
      rs.getString("error_step"),
      rs.getInt("retry_count"),
      rs.getString("correlation_id"),
      rs.getString("triggered_by"),
      JdbcTemplate.instant(rs, "created_at"),
      JdbcTemplate.instant(rs, "started_at"),
      JdbcTemplate.instant(rs, "completed_at"),
      JdbcTemplate.instant(rs, "updated_at"),
      JdbcTemplate.instant(rs, "lease_until"));

  private final String tableName;

  public JdbcWorkflowExecutionStore() {
    this(DEFAULT_TABLE);
  }

  public JdbcWorkflowExecutionStore(String tableName) {
    this.tableName = JdbcTemplate.checkTableName(tableName);
  }

  /**
   * Inserts on an auto-commit connection; a concurrent insert for the same correlation id
   * surfaces as a unique violation and is reported as {@code false}.
   */
  @Override
  public boolean insertIfAbsent(Connection conn, WorkflowExecution execution) {
    try {
      return JdbcTemplate.update(conn, "INSERT INTO " + tableName + " (" + COLUMNS + ")"
              + " VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
          execution.id(), execution.workflowName(), execution.workflowVersion(), execution.status().code(),
          execution.currentStep(), execution.totalSteps(), Json.write(execution.inputPayload()),
          Json.write(execution.context()), truncate(execution.errorMessage()), execution.errorStep(),
          execution.retryCount(), execution.correlationId(), execution.triggeredBy(), execution.createdAt(),
          execution.startedAt(), execution.completedAt(), execution.updatedAt(), execution.leaseUntil()) == 1;
    } catch (SyncStoreException e) {
      if (e.isUniqueViolation()) {
        return false;
      }
      throw e;
    }
  }

  @Override
  public Optional<WorkflowExecution> findById(Connection conn, String id) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + tableName + " WHERE id=?", EXECUTION_ROW_MAPPER, id);
  }

  @Override
  public Optional<WorkflowExecution> findByCorrelationId(Connection conn, String correlationId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + tableName + " WHERE correlation_id=?", EXECUTION_ROW_MAPPER, correlationId);
  }

  @Override
  public boolean tryClaim(Connection conn, String id, Instant now, Instant leaseUntil) {
    return JdbcTemplate.update(conn, "UPDATE " + tableName
            + " SET status='running', started_at=COALESCE(started_at, CAST(? AS TIMESTAMP)), lease_until=?,"
            + " updated_at=? WHERE id=? AND (status='pending'"
            + " OR (status='running' AND (lease_until IS NULL OR lease_until <= ?)))",
        now, leaseUntil, now, id, now) == 1;
  }

  @Override
  public List<String> findClaimable(Connection conn, Instant now, int limit) {
    return JdbcTemplate.query(conn, "SELECT id FROM " + tableName
            + " WHERE status='pending' OR (status='running' AND (lease_until IS NULL OR lease_until <= ?))"
            + " ORDER BY created_at LIMIT ?",
        rs -> rs.getString("id"), now, limit);
  }

  @Override
  public int updateProgress(Connection conn, String id, int currentStep, Map<String, Object> context,
      int retryCount, Instant leaseUntil, Instant now) {
    return JdbcTemplate.update(conn, "UPDATE " + tableName
            + " SET current_step=?, context=?, retry_count=?, lease_until=?, updated_at=?"
            + " WHERE id=? AND status='running'",
        currentStep, Json.write(context), retryCount, leaseUntil, now, id);
  }

  @Override
  public int markCompleted(Connection conn, String id, int currentStep, Map<String, Object> context, Instant now) {
    return JdbcTemplate.update(conn, "UPDATE " + tableName
            + " SET status='completed', current_step=?, context=?, completed_at=?, updated_at=?, lease_until=NULL"
            + " WHERE id=? AND status='running'",
        currentStep, Json.write(context), now, now, id);
  }

  @Override
  public int markFailed(Connection conn, String id, String errorStep, String errorMessage,
      Map<String, Object> context, int retryCount, Instant now) {
    return JdbcTemplate.update(conn, "UPDATE " + tableName
            + " SET status='failed', error_step=?, error_message=?, context=?, retry_count=?, completed_at=?,"
            + " updated_at=?, lease_until=NULL WHERE id=? AND status='running'",
        errorStep, truncate(errorMessage), Json.write(context), retryCount, now, now, id);
  }

  @Override
  public int cancel(Connection conn, String id, Instant now) {
    return JdbcTemplate.update(conn, "UPDATE " + tableName
            + " SET status='cancelled', completed_at=?, updated_at=?, lease_until=NULL"
            + " WHERE id=? AND status IN ('pending','running')",
        now, now, id);
  }

  private static String truncate(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
