package io.syncbridge;

import io.syncbridge.model.SyncConfig;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PayloadFilterTest {

  @Test
  void dropsInternalCredentialExcludedAndNullFields() {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("id", "l1");
    row.put("title", "Loft");
    row.put("bubble_id", "1700000000x1");
    row.put("updated_at", "2026-03-02T09:00:00Z");
    row.put("sync_status", "pending");
    row.put("api_key", "secret");
    row.put("refresh_token", "r");
    row.put("host_notes", "private");
    row.put("description", null);

    SyncConfig config = SyncConfig.of("listings", "listing").withExcludedFields(Set.of("host_notes"));
    Map<String, Object> filtered = PayloadFilter.filter(row, config);

    assertEquals(List.of("id", "title"), new ArrayList<>(filtered.keySet()));
  }

  @Test
  void nullRowGivesEmptyPayload() {
    assertTrue(PayloadFilter.filter(null, SyncConfig.of("t", "t")).isEmpty());
  }

  @Test
  void mappingRenamesOnlyMappedKeys() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("title", "Loft");
    payload.put("price", 120);

    SyncConfig config = SyncConfig.of("listings", "listing").withFieldMapping(Map.of("title", "Name"));
    Map<String, Object> mapped = PayloadFilter.applyMapping(payload, config);

    assertEquals(List.of("Name", "price"), new ArrayList<>(mapped.keySet()));
    assertEquals("Loft", mapped.get("Name"));
    assertEquals(120, mapped.get("price"));
  }

  @Test
  void mappingReturnsACopy() {
    Map<String, Object> payload = new LinkedHashMap<>(Map.of("title", "Loft"));

    Map<String, Object> mapped = PayloadFilter.applyMapping(payload, SyncConfig.of("listings", "listing"));
    mapped.put("extra", 1);

    assertFalse(payload.containsKey("extra"));
  }
}
