package io.syncbridge.jdbc.workflow;

import com.fasterxml.jackson.core.type.TypeReference;
import io.syncbridge.jdbc.JdbcTemplate;
import io.syncbridge.spi.WorkflowDefinitionStore;
import io.syncbridge.util.Json;
import io.syncbridge.workflow.WorkflowDefinition;
import io.syncbridge.workflow.WorkflowStep;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link WorkflowDefinitionStore} over the {@code workflow_definition} table, one row per
 * {@code (name, version)}. Steps are stored as a JSON array.
 */
public final class JdbcWorkflowDefinitionStore implements WorkflowDefinitionStore {
  public static final String DEFAULT_TABLE = "workflow_definition";

  private static final TypeReference<List<WorkflowStep>> STEPS_TYPE = new TypeReference<>() {};
  private static final TypeReference<List<String>> FIELDS_TYPE = new TypeReference<>() {};

  private static final String COLUMNS = "name, version, steps, required_fields, timeout_seconds, "
      + "visibility_timeout_seconds, max_retries, active";

  private static final JdbcTemplate.RowMapper<WorkflowDefinition> DEFINITION_ROW_MAPPER = rs -> {
    String required = rs.getString("required_fields");
    return new WorkflowDefinition(
        rs.getString("name"),
        Json.read(rs.getString("steps"), STEPS_TYPE),
        required == null || required.isBlank() ? List.of() : Json.read(required, FIELDS_TYPE),
        rs.getInt("timeout_seconds"),
        rs.getInt("visibility_timeout_seconds"),
        rs.getInt("max_retries"),
        rs.getBoolean("active"),
        rs.getInt("version"));
  };

  private final String tableName;

  public JdbcWorkflowDefinitionStore() {
    this(DEFAULT_TABLE);
  }

  public JdbcWorkflowDefinitionStore(String tableName) {
    this.tableName = JdbcTemplate.checkTableName(tableName);
  }

  @Override
  public Optional<WorkflowDefinition> findLatest(Connection conn, String name) {
    return JdbcTemplate.queryOne(conn, "SELECT " + COLUMNS + " FROM " + tableName
        + " WHERE name=? ORDER BY version DESC LIMIT 1", DEFINITION_ROW_MAPPER, name);
  }

  @Override
  public Optional<WorkflowDefinition> find(Connection conn, String name, int version) {
    return JdbcTemplate.queryOne(conn, "SELECT " + COLUMNS + " FROM " + tableName
        + " WHERE name=? AND version=?", DEFINITION_ROW_MAPPER, name, version);
  }

  @Override
  public List<WorkflowDefinition> findAllLatest(Connection conn) {
    return JdbcTemplate.query(conn, "SELECT " + COLUMNS + " FROM " + tableName + " d"
        + " WHERE d.version = (SELECT MAX(m.version) FROM " + tableName + " m WHERE m.name = d.name)"
        + " ORDER BY d.name", DEFINITION_ROW_MAPPER);
  }

  @Override
  public void insertVersion(Connection conn, WorkflowDefinition definition) {
    JdbcTemplate.update(conn, "INSERT INTO " + tableName + " (" + COLUMNS + ", created_at)"
            + " VALUES (?,?,?,?,?,?,?,?,?)",
        definition.name(), definition.version(), Json.write(definition.steps()),
        Json.write(definition.requiredFields()), definition.timeoutSeconds(),
        definition.visibilityTimeoutSeconds(), definition.maxRetries(), definition.active(), Instant.now());
  }
}
