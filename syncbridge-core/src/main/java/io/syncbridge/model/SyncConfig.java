package io.syncbridge.model;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-source-table mirroring policy.
 *
 * @param sourceTable      source table name, unique across configs
 * @param targetEndpoint   workflow name (or endpoint path) on the external platform
 * @param targetObjectType object type for data-API delivery; may be {@code null}
 * @param enabled          master switch; a disabled config captures nothing
 * @param syncOnInsert     capture inserts
 * @param syncOnUpdate     capture updates
 * @param syncOnDelete     capture deletes
 * @param fieldMapping     source key to target key renames
 * @param excludedFields   source keys never sent to the target
 */
public record SyncConfig(
    String sourceTable,
    String targetEndpoint,
    String targetObjectType,
    boolean enabled,
    boolean syncOnInsert,
    boolean syncOnUpdate,
    boolean syncOnDelete,
    Map<String, String> fieldMapping,
    Set<String> excludedFields) {

  public SyncConfig {
    Objects.requireNonNull(sourceTable, "sourceTable");
    Objects.requireNonNull(targetEndpoint, "targetEndpoint");
    fieldMapping = fieldMapping == null ? Map.of() : Map.copyOf(fieldMapping);
    excludedFields = excludedFields == null ? Set.of() : Set.copyOf(excludedFields);
  }

  /**
   * Enabled config with inserts and updates captured and deletes ignored.
   */
  public static SyncConfig of(String sourceTable, String targetEndpoint) {
    return new SyncConfig(sourceTable, targetEndpoint, null, true, true, true, false, Map.of(), Set.of());
  }

  /**
   * Returns whether the given operation is captured. Composite items are always captured
   * while the config is enabled.
   */
  public boolean captures(Operation operation) {
    if (!enabled) {
      return false;
    }
    return switch (operation) {
      case INSERT -> syncOnInsert;
      case UPDATE -> syncOnUpdate;
      case DELETE -> syncOnDelete;
      case ATOMIC_COMPOSITE -> true;
    };
  }

  public SyncConfig withEnabled(boolean enabled) {
    return new SyncConfig(sourceTable, targetEndpoint, targetObjectType, enabled,
        syncOnInsert, syncOnUpdate, syncOnDelete, fieldMapping, excludedFields);
  }

  public SyncConfig withSyncOnDelete(boolean syncOnDelete) {
    return new SyncConfig(sourceTable, targetEndpoint, targetObjectType, enabled,
        syncOnInsert, syncOnUpdate, syncOnDelete, fieldMapping, excludedFields);
  }

  public SyncConfig withFieldMapping(Map<String, String> fieldMapping) {
    return new SyncConfig(sourceTable, targetEndpoint, targetObjectType, enabled,
        syncOnInsert, syncOnUpdate, syncOnDelete, fieldMapping, excludedFields);
  }

  public SyncConfig withExcludedFields(Set<String> excludedFields) {
    return new SyncConfig(sourceTable, targetEndpoint, targetObjectType, enabled,
        syncOnInsert, syncOnUpdate, syncOnDelete, fieldMapping, excludedFields);
  }

  public SyncConfig withTargetObjectType(String targetObjectType) {
    return new SyncConfig(sourceTable, targetEndpoint, targetObjectType, enabled,
        syncOnInsert, syncOnUpdate, syncOnDelete, fieldMapping, excludedFields);
  }
}
