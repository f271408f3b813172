package io.syncbridge.jdbc.store;

import io.syncbridge.jdbc.TestDatabase;
import io.syncbridge.model.GroupPolicy;
import io.syncbridge.model.Operation;
import io.syncbridge.model.QueueStats;
import io.syncbridge.model.QueueStatus;
import io.syncbridge.model.StatusTableCount;
import io.syncbridge.model.SyncQueueItem;
import io.syncbridge.util.Ids;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class H2SyncQueueStoreTest {
  private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

  private DataSource dataSource;
  private Connection conn;
  private H2SyncQueueStore store;

  @BeforeEach
  void setup() throws Exception {
    dataSource = TestDatabase.h2();
    conn = dataSource.getConnection();
    conn.setAutoCommit(true);
    store = new H2SyncQueueStore();
  }

  @AfterEach
  void tearDown() throws Exception {
    conn.close();
    TestDatabase.dropSchema(dataSource);
  }

  @Test
  void upsertPendingCoalescesIntoTheExistingRow() {
    String first = store.upsertPending(conn, item("users", "u1", Operation.INSERT, Map.of("name", "Ada"), NOW));
    String second = store.upsertPending(conn,
        item("users", "u1", Operation.UPDATE, Map.of("name", "Ada Lovelace"), NOW.plusSeconds(5)));

    assertEquals(first, second);
    SyncQueueItem pending = store.findPending(conn, "users", "u1").orElseThrow();
    assertEquals(first, pending.id());
    assertEquals(Operation.UPDATE, pending.operation());
    assertEquals("Ada Lovelace", pending.payload().get("name"));
    assertEquals(NOW.plusSeconds(5), pending.createdAt());
    assertEquals(1, store.findDue(conn, NOW.plusSeconds(10), 10).size());
  }

  @Test
  void upsertAfterClaimStartsANewPendingRow() {
    String first = store.upsertPending(conn, item("users", "u1", Operation.INSERT, Map.of("v", 1), NOW));
    assertTrue(store.tryClaim(conn, first, NOW));

    String second = store.upsertPending(conn, item("users", "u1", Operation.UPDATE, Map.of("v", 2), NOW));

    assertNotEquals(first, second);
    assertEquals(QueueStatus.PROCESSING, store.findById(conn, first).orElseThrow().status());
    assertEquals(2, store.findPending(conn, "users", "u1").orElseThrow().payload().get("v"));
  }

  @Test
  void differentRecordsDoNotCoalesce() {
    String a = store.upsertPending(conn, item("users", "u1", Operation.INSERT, Map.of(), NOW));
    String b = store.upsertPending(conn, item("users", "u2", Operation.INSERT, Map.of(), NOW));
    String c = store.upsertPending(conn, item("orders", "u1", Operation.INSERT, Map.of(), NOW));

    assertEquals(3, List.of(a, b, c).stream().distinct().count());
  }

  @Test
  void insertIfAbsentRejectsDuplicateIdempotencyKey() {
    SyncQueueItem first = grouped("corr-1", "users", "u1", 1, NOW);
    SyncQueueItem redelivered = SyncQueueItem.pending(Ids.newId(), "users", "u1", Operation.UPDATE, Map.of(),
        3, first.idempotencyKey(), "corr-1", 1, GroupPolicy.ALL_OR_NOTHING, NOW);

    assertTrue(store.insertIfAbsent(conn, first));
    assertFalse(store.insertIfAbsent(conn, redelivered));
    assertEquals(1, store.findGroup(conn, "corr-1").size());
  }

  @Test
  void groupItemIsFoldedIntoStandalonePending() {
    String standalone = store.upsertPending(conn, item("users", "u1", Operation.UPDATE, Map.of("v", 1), NOW));

    assertFalse(store.insertIfAbsent(conn, grouped("corr-1", "users", "u1", 1, NOW)));

    SyncQueueItem pending = store.findPending(conn, "users", "u1").orElseThrow();
    assertEquals(standalone, pending.id());
    assertEquals(Map.of("seq", 1), pending.payload());
    assertTrue(store.findGroup(conn, "corr-1").isEmpty());
    assertEquals(1, store.findDue(conn, NOW, 10).size());
  }

  @Test
  void recordHasOnePendingRowAcrossStandaloneAndGroups() throws Exception {
    store.upsertPending(conn, item("listings", "l1", Operation.UPDATE, Map.of("v", 1), NOW));
    store.insertIfAbsent(conn, grouped("c1", "listings", "l1", 1, NOW));
    store.insertIfAbsent(conn, grouped("c2", "listings", "l1", 1, NOW));

    assertEquals(1, pendingRows("listings", "l1"));
  }

  @Test
  void standaloneUpsertKeepsTheGroupItemsKeyAndOrder() {
    SyncQueueItem groupItem = grouped("corr-1", "users", "u1", 1, NOW);
    assertTrue(store.insertIfAbsent(conn, groupItem));

    String id = store.upsertPending(conn,
        item("users", "u1", Operation.UPDATE, Map.of("name", "Ada"), NOW.plusSeconds(30)));

    SyncQueueItem pending = store.findById(conn, id).orElseThrow();
    assertEquals(groupItem.id(), id);
    assertEquals("corr-1", pending.correlationId());
    assertEquals(groupItem.idempotencyKey(), pending.idempotencyKey());
    assertEquals(NOW, pending.createdAt());
    assertEquals("Ada", pending.payload().get("name"));
  }

  @Test
  void foldingKeepsAPendingInsertUnlessTheRecordIsDeleted() {
    String id = store.upsertPending(conn, item("users", "u1", Operation.INSERT, Map.of(), NOW));

    store.insertIfAbsent(conn, grouped("corr-1", "users", "u1", 1, NOW));
    assertEquals(Operation.INSERT, store.findById(conn, id).orElseThrow().operation());

    store.insertIfAbsent(conn, SyncQueueItem.pending(Ids.newId(), "users", "u1", Operation.DELETE, Map.of(), 3,
        "corr-2:users:u1:1", "corr-2", 1, GroupPolicy.ALL_OR_NOTHING, NOW));
    assertEquals(Operation.DELETE, store.findById(conn, id).orElseThrow().operation());
  }

  @Test
  void groupItemForClaimedRecordIsInserted() {
    String first = store.upsertPending(conn, item("users", "u1", Operation.INSERT, Map.of(), NOW));
    assertTrue(store.tryClaim(conn, first, NOW));

    assertTrue(store.insertIfAbsent(conn, grouped("corr-1", "users", "u1", 1, NOW)));
    assertEquals("corr-1", store.findPending(conn, "users", "u1").orElseThrow().correlationId());
  }

  @Test
  void findGroupOrdersBySequence() {
    store.insertIfAbsent(conn, grouped("corr-1", "orders", "o3", 3, NOW));
    store.insertIfAbsent(conn, grouped("corr-1", "orders", "o1", 1, NOW));
    store.insertIfAbsent(conn, grouped("corr-1", "orders", "o2", 2, NOW));

    List<SyncQueueItem> group = store.findGroup(conn, "corr-1");
    assertEquals(List.of(1, 2, 3), group.stream().map(SyncQueueItem::sequence).toList());
  }

  @Test
  void claimIsExclusive() {
    String id = store.upsertPending(conn, item("users", "u1", Operation.INSERT, Map.of(), NOW));

    assertTrue(store.tryClaim(conn, id, NOW));
    assertFalse(store.tryClaim(conn, id, NOW));
    SyncQueueItem claimed = store.findById(conn, id).orElseThrow();
    assertEquals(QueueStatus.PROCESSING, claimed.status());
    assertEquals(NOW, claimed.claimedAt());
  }

  @Test
  void failedItemBecomesDueAtNextRetry() {
    String id = store.upsertPending(conn, item("users", "u1", Operation.INSERT, Map.of(), NOW));
    store.tryClaim(conn, id, NOW);

    assertEquals(1, store.markFailed(conn, id, 1, NOW.plusSeconds(60), "HTTP 500", "{}", NOW));

    assertTrue(store.findDue(conn, NOW.plusSeconds(30), 10).isEmpty());
    assertTrue(store.findRetryable(conn, NOW.plusSeconds(30), 10).isEmpty());
    assertEquals(1, store.findDue(conn, NOW.plusSeconds(60), 10).size());
    assertEquals(1, store.findRetryable(conn, NOW.plusSeconds(61), 10).size());
    SyncQueueItem failed = store.findById(conn, id).orElseThrow();
    assertEquals(1, failed.retryCount());
    assertEquals("HTTP 500", failed.errorMessage());
    assertEquals("{}", failed.errorDetails());
  }

  @Test
  void exhaustedItemIsNeverDueAgain() {
    String id = store.upsertPending(conn, item("users", "u1", Operation.INSERT, Map.of(), NOW));
    store.tryClaim(conn, id, NOW);

    store.markFailed(conn, id, 3, NOW.plusSeconds(60), "HTTP 500", null, NOW);

    SyncQueueItem dead = store.findById(conn, id).orElseThrow();
    assertTrue(dead.isExhausted());
    assertNull(dead.nextRetryAt());
    assertTrue(store.findDue(conn, NOW.plus(Duration.ofDays(1)), 10).isEmpty());
    assertEquals(0, store.countDue(conn, NOW.plus(Duration.ofDays(1))));
  }

  @Test
  void completedClearsErrorState() {
    String id = store.upsertPending(conn, item("users", "u1", Operation.INSERT, Map.of(), NOW));
    store.tryClaim(conn, id, NOW);
    store.markFailed(conn, id, 1, NOW, "timeout", null, NOW);
    store.tryClaim(conn, id, NOW);

    assertEquals(1, store.markCompleted(conn, id, NOW.plusSeconds(1), "{\"ok\":true}"));
    assertEquals(0, store.markCompleted(conn, id, NOW.plusSeconds(2), "again"));

    SyncQueueItem done = store.findById(conn, id).orElseThrow();
    assertEquals(QueueStatus.COMPLETED, done.status());
    assertNull(done.errorMessage());
    assertEquals("{\"ok\":true}", done.externalResponse());
    assertEquals(1, done.retryCount());
  }

  @Test
  void markSkippedReleasesThePendingSlot() {
    String id = store.upsertPending(conn, item("users", "u1", Operation.INSERT, Map.of(), NOW));

    assertEquals(1, store.markSkipped(conn, id, "no config", NOW));
    assertEquals(0, store.markSkipped(conn, id, "no config", NOW));

    String next = store.upsertPending(conn, item("users", "u1", Operation.UPDATE, Map.of(), NOW));
    assertNotEquals(id, next);
  }

  @Test
  void releaseStaleReturnsOldClaimsWithoutConsumingARetry() {
    String stale = store.upsertPending(conn, item("users", "u1", Operation.INSERT, Map.of(), NOW));
    String fresh = store.upsertPending(conn, item("users", "u2", Operation.INSERT, Map.of(), NOW));
    store.tryClaim(conn, stale, NOW);
    store.tryClaim(conn, fresh, NOW.plusSeconds(290));

    Instant sweepAt = NOW.plusSeconds(301);
    assertEquals(1, store.releaseStale(conn, sweepAt.minusSeconds(300), sweepAt));

    SyncQueueItem released = store.findById(conn, stale).orElseThrow();
    assertEquals(QueueStatus.FAILED, released.status());
    assertEquals(0, released.retryCount());
    assertTrue(released.isDue(sweepAt));
    assertEquals(QueueStatus.PROCESSING, store.findById(conn, fresh).orElseThrow().status());
  }

  @Test
  void resetForReplayRestoresRetryBudget() {
    String id = store.upsertPending(conn, item("users", "u1", Operation.INSERT, Map.of(), NOW));
    store.tryClaim(conn, id, NOW);
    store.markFailed(conn, id, 3, null, "HTTP 500", null, NOW);

    assertTrue(store.resetForReplay(conn, id));

    SyncQueueItem replayed = store.findById(conn, id).orElseThrow();
    assertEquals(QueueStatus.PENDING, replayed.status());
    assertEquals(0, replayed.retryCount());
    assertNull(replayed.errorMessage());
    // the replayed row is the record's pending row again
    assertEquals(id, store.upsertPending(conn, item("users", "u1", Operation.UPDATE, Map.of(), NOW)));
  }

  @Test
  void resetForReplayRefusedWhileNewerPendingExists() {
    String id = store.upsertPending(conn, item("users", "u1", Operation.INSERT, Map.of(), NOW));
    store.tryClaim(conn, id, NOW);
    store.markFailed(conn, id, 3, null, "HTTP 500", null, NOW);
    store.upsertPending(conn, item("users", "u1", Operation.UPDATE, Map.of(), NOW.plusSeconds(1)));

    assertFalse(store.resetForReplay(conn, id));
    assertEquals(QueueStatus.FAILED, store.findById(conn, id).orElseThrow().status());
  }

  @Test
  void statsAndCountsReflectQueueState() {
    String done = store.upsertPending(conn, item("users", "u1", Operation.INSERT, Map.of(), NOW));
    store.tryClaim(conn, done, NOW);
    store.markCompleted(conn, done, NOW, "ok");
    String retry = store.upsertPending(conn, item("users", "u2", Operation.INSERT, Map.of(), NOW));
    store.tryClaim(conn, retry, NOW);
    store.markFailed(conn, retry, 1, NOW.plusSeconds(60), "HTTP 502", null, NOW);
    String dead = store.upsertPending(conn, item("orders", "o1", Operation.INSERT, Map.of(), NOW));
    store.tryClaim(conn, dead, NOW);
    store.markFailed(conn, dead, 3, null, "HTTP 400", null, NOW);
    store.upsertPending(conn, item("orders", "o2", Operation.INSERT, Map.of(), NOW));
    String running = store.upsertPending(conn, item("orders", "o3", Operation.INSERT, Map.of(), NOW));
    store.tryClaim(conn, running, NOW);

    QueueStats stats = store.stats(conn, NOW.minusSeconds(3600));
    assertEquals(1, stats.pending());
    assertEquals(1, stats.processing());
    assertEquals(1, stats.retryable());
    assertEquals(1, stats.deadLettered());
    assertEquals(1, stats.completedLastHour());
    assertEquals(2, stats.failedLastHour());

    List<StatusTableCount> counts = store.countByStatusAndTable(conn);
    assertTrue(counts.contains(new StatusTableCount(QueueStatus.FAILED, "orders", 1)));
    assertTrue(counts.contains(new StatusTableCount(QueueStatus.PENDING, "orders", 1)));
    assertTrue(counts.contains(new StatusTableCount(QueueStatus.COMPLETED, "users", 1)));
  }

  @Test
  void statsOfEmptyQueueAreZero() {
    QueueStats stats = store.stats(conn, NOW);
    assertEquals(0, stats.pending());
    assertEquals(0, stats.deadLettered());
  }

  @Test
  void rejectsUnsafeTableName() {
    assertThrows(IllegalArgumentException.class, () -> new H2SyncQueueStore("sync_queue; DROP TABLE x"));
  }

  private long pendingRows(String table, String recordId) throws Exception {
    return TestDatabase.count(dataSource,
        "SELECT COUNT(*) FROM sync_queue WHERE table_name=? AND record_id=? AND status='pending'", table, recordId);
  }

  static SyncQueueItem item(String table, String recordId, Operation operation, Map<String, Object> payload,
      Instant createdAt) {
    String id = Ids.newId();
    return SyncQueueItem.pending(id, table, recordId, operation, payload, 3,
        table + ":" + recordId + ":" + id, null, null, null, createdAt);
  }

  static SyncQueueItem grouped(String correlationId, String table, String recordId, int sequence, Instant createdAt) {
    return SyncQueueItem.pending(Ids.newId(), table, recordId, Operation.UPDATE, Map.of("seq", sequence), 3,
        correlationId + ":" + table + ":" + recordId + ":" + sequence, correlationId, sequence,
        GroupPolicy.ALL_OR_NOTHING, createdAt);
  }
}
