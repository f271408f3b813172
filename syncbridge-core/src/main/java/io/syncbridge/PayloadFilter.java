package io.syncbridge;

import io.syncbridge.model.SyncConfig;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Turns a row snapshot into the payload sent to the external platform.
 *
 * <p>The external platform rejects unknown fields, so every column owned by this system
 * is removed: {@link #INTERNAL_FIELDS} always, {@link #CREDENTIAL_FIELDS} always, the
 * config's excluded fields, and null values.
 */
public final class PayloadFilter {

  /** Bookkeeping columns maintained by the sync layer itself. */
  public static final Set<String> INTERNAL_FIELDS = Set.of(
      "bubble_id",
      "created_at",
      "updated_at",
      "sync_status",
      "bubble_sync_error",
      "pending",
      "_internal",
      "sync_at",
      "last_synced");

  /** Secrets that must never leave the primary datastore. */
  public static final Set<String> CREDENTIAL_FIELDS = Set.of(
      "password_hash",
      "refresh_token",
      "access_token",
      "service_role_key",
      "api_key");

  private PayloadFilter() {
  }

  /**
   * Returns a filtered copy of {@code row}, keeping key order.
   */
  public static Map<String, Object> filter(Map<String, Object> row, SyncConfig config) {
    Map<String, Object> filtered = new LinkedHashMap<>();
    if (row == null) {
      return filtered;
    }
    for (Map.Entry<String, Object> entry : row.entrySet()) {
      String key = entry.getKey();
      if (entry.getValue() == null
          || INTERNAL_FIELDS.contains(key)
          || CREDENTIAL_FIELDS.contains(key)
          || config.excludedFields().contains(key)) {
        continue;
      }
      filtered.put(key, entry.getValue());
    }
    return filtered;
  }

  /**
   * Applies the config's field renames. Unmapped keys pass through unchanged.
   */
  public static Map<String, Object> applyMapping(Map<String, Object> payload, SyncConfig config) {
    if (config.fieldMapping().isEmpty()) {
      return new LinkedHashMap<>(payload);
    }
    Map<String, Object> mapped = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : payload.entrySet()) {
      String target = config.fieldMapping().getOrDefault(entry.getKey(), entry.getKey());
      mapped.put(target, entry.getValue());
    }
    return mapped;
  }
}
