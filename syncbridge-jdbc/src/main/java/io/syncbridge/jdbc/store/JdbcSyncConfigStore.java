package io.syncbridge.jdbc.store;

import com.fasterxml.jackson.core.type.TypeReference;
import io.syncbridge.jdbc.JdbcTemplate;
import io.syncbridge.model.SyncConfig;
import io.syncbridge.spi.SyncConfigStore;
import io.syncbridge.util.Json;

import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link SyncConfigStore} over the {@code sync_config} table. Field mappings and exclusions are
 * stored as JSON text.
 */
public final class JdbcSyncConfigStore implements SyncConfigStore {
  public static final String DEFAULT_TABLE = "sync_config";

  private static final TypeReference<Map<String, String>> MAPPING_TYPE = new TypeReference<>() {};
  private static final TypeReference<List<String>> EXCLUDED_TYPE = new TypeReference<>() {};

  private static final String COLUMNS = "source_table, target_endpoint, target_object_type, enabled, "
      + "sync_on_insert, sync_on_update, sync_on_delete, field_mapping, excluded_fields";

  private static final JdbcTemplate.RowMapper<SyncConfig> CONFIG_ROW_MAPPER = rs -> {
    String mapping = rs.getString("field_mapping");
    String excluded = rs.getString("excluded_fields");
    return new SyncConfig(
        rs.getString("source_table"),
        rs.getString("target_endpoint"),
        rs.getString("target_object_type"),
        rs.getBoolean("enabled"),
        rs.getBoolean("sync_on_insert"),
        rs.getBoolean("sync_on_update"),
        rs.getBoolean("sync_on_delete"),
        mapping == null || mapping.isBlank() ? Map.of() : Json.read(mapping, MAPPING_TYPE),
        excluded == null || excluded.isBlank() ? Set.of() : new LinkedHashSet<>(Json.read(excluded, EXCLUDED_TYPE)));
  };

  private final String tableName;

  public JdbcSyncConfigStore() {
    this(DEFAULT_TABLE);
  }

  public JdbcSyncConfigStore(String tableName) {
    this.tableName = JdbcTemplate.checkTableName(tableName);
  }

  @Override
  public Optional<SyncConfig> find(Connection conn, String sourceTable) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + tableName + " WHERE source_table=?", CONFIG_ROW_MAPPER, sourceTable);
  }

  @Override
  public List<SyncConfig> findAll(Connection conn) {
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName + " ORDER BY source_table", CONFIG_ROW_MAPPER);
  }

  @Override
  public void save(Connection conn, SyncConfig config) {
    String mapping = Json.write(config.fieldMapping());
    String excluded = Json.write(config.excludedFields().stream().sorted().toList());
    Instant now = Instant.now();
    int updated = JdbcTemplate.update(conn, "UPDATE " + tableName
            + " SET target_endpoint=?, target_object_type=?, enabled=?, sync_on_insert=?, sync_on_update=?,"
            + " sync_on_delete=?, field_mapping=?, excluded_fields=?, updated_at=? WHERE source_table=?",
        config.targetEndpoint(), config.targetObjectType(), config.enabled(), config.syncOnInsert(),
        config.syncOnUpdate(), config.syncOnDelete(), mapping, excluded, now, config.sourceTable());
    if (updated == 0) {
      JdbcTemplate.update(conn, "INSERT INTO " + tableName + " (" + COLUMNS + ", updated_at)"
              + " VALUES (?,?,?,?,?,?,?,?,?,?)",
          config.sourceTable(), config.targetEndpoint(), config.targetObjectType(), config.enabled(),
          config.syncOnInsert(), config.syncOnUpdate(), config.syncOnDelete(), mapping, excluded, now);
    }
  }

  @Override
  public boolean delete(Connection conn, String sourceTable) {
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName + " WHERE source_table=?", sourceTable) > 0;
  }
}
