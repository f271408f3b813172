package io.syncbridge.jdbc;

import io.syncbridge.SyncConfigRegistry;
import io.syncbridge.dispatch.ProcessingReport;
import io.syncbridge.dispatch.QueueProcessor;
import io.syncbridge.jdbc.store.JdbcDeadLetterStore;
import io.syncbridge.jdbc.store.JdbcSyncConfigStore;
import io.syncbridge.jdbc.store.PostgresSyncQueueStore;
import io.syncbridge.model.GroupPolicy;
import io.syncbridge.model.Operation;
import io.syncbridge.model.QueueStatus;
import io.syncbridge.model.SyncConfig;
import io.syncbridge.model.SyncQueueItem;
import io.syncbridge.util.Ids;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.postgresql.ds.PGSimpleDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DockerAvailable
@Testcontainers
class PostgresSyncQueueStoreIntegrationTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("syncbridge_test");

  private static PGSimpleDataSource dataSource;
  private final PostgresSyncQueueStore store = new PostgresSyncQueueStore();

  @BeforeAll
  static void initSchema() throws Exception {
    dataSource = new PGSimpleDataSource();
    dataSource.setUrl(postgres.getJdbcUrl());
    dataSource.setUser(postgres.getUsername());
    dataSource.setPassword(postgres.getPassword());
    try (Connection conn = dataSource.getConnection()) {
      TestDatabase.createSchema(conn, "schema/postgresql.sql");
    }
  }

  @BeforeEach
  void truncate() throws Exception {
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      st.execute("TRUNCATE TABLE sync_queue, sync_dead_letter, sync_config");
    }
  }

  @Test
  void upsertCoalescesOnThePendingGuard() throws Exception {
    Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(true);
      String first = store.upsertPending(conn, item("listing", "l1", Operation.INSERT, Map.of("title", "Loft"), now));
      String second = store.upsertPending(conn,
          item("listing", "l1", Operation.UPDATE, Map.of("title", "Sunny loft"), now.plusSeconds(1)));

      assertEquals(first, second);
      SyncQueueItem pending = store.findPending(conn, "listing", "l1").orElseThrow();
      assertEquals(Operation.UPDATE, pending.operation());
      assertEquals("Sunny loft", pending.payload().get("title"));
      assertEquals(1, store.countDue(conn, now.plusSeconds(5)));
    }
  }

  @Test
  void insertIfAbsentIgnoresDuplicateKeyWithoutAbortingTheTransaction() throws Exception {
    Instant now = Instant.now();
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(false);
      SyncQueueItem first = grouped("proposal-1", 0, now);
      assertTrue(store.insertIfAbsent(conn, first));
      assertFalse(store.insertIfAbsent(conn, grouped("proposal-1", 0, now)));
      assertTrue(store.insertIfAbsent(conn, grouped("proposal-1", 1, now)));
      conn.commit();

      assertEquals(2, store.findGroup(conn, "proposal-1").size());
    }
  }

  @Test
  void groupItemForAPendingRecordIsFoldedIntoIt() throws Exception {
    Instant now = Instant.now();
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(false);
      String standalone = store.upsertPending(conn, item("bookings", "b0", Operation.UPDATE, Map.of("v", 1), now));
      assertFalse(store.insertIfAbsent(conn, grouped("proposal-2", 0, now)));
      conn.commit();

      SyncQueueItem pending = store.findPending(conn, "bookings", "b0").orElseThrow();
      assertEquals(standalone, pending.id());
      assertEquals(0, pending.payload().get("seq"));
      assertEquals(1, TestDatabase.count(dataSource,
          "SELECT COUNT(*) FROM sync_queue WHERE table_name='bookings' AND record_id='b0' AND status='pending'"));
    }
  }

  @Test
  void claimAndExhaustion() throws Exception {
    Instant now = Instant.now();
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(true);
      String id = store.upsertPending(conn, item("listing", "l2", Operation.INSERT, Map.of(), now));

      assertTrue(store.tryClaim(conn, id, now));
      assertFalse(store.tryClaim(conn, id, now));
      assertEquals(1, store.markFailed(conn, id, 3, null, "HTTP 500", null, now));

      SyncQueueItem dead = store.findById(conn, id).orElseThrow();
      assertEquals(QueueStatus.FAILED, dead.status());
      assertTrue(dead.isExhausted());
      assertEquals(0, store.countDue(conn, now.plus(Duration.ofDays(1))));
    }
  }

  @Test
  void processorDeliversAgainstPostgres() throws Exception {
    Instant now = Instant.now();
    DataSourceConnectionProvider connectionProvider = new DataSourceConnectionProvider(dataSource);
    SyncConfigRegistry configs = new SyncConfigRegistry(connectionProvider, new JdbcSyncConfigStore(),
        Duration.ZERO, Clock.systemUTC());
    configs.save(SyncConfig.of("listing", "listing"));
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(true);
      store.upsertPending(conn, item("listing", "l3", Operation.UPDATE, Map.of("title", "Cabin"), now));
    }

    RecordingPlatformClient client = new RecordingPlatformClient();
    try (QueueProcessor processor = QueueProcessor.builder()
        .connectionProvider(connectionProvider)
        .queueStore(store)
        .deadLetterStore(new JdbcDeadLetterStore())
        .configRegistry(configs)
        .client(client)
        .build()) {
      ProcessingReport report = processor.process(10);

      assertEquals(1, report.succeeded());
      assertEquals(1L, client.deliveriesOf("l3"));
    }
  }

  private static SyncQueueItem item(String table, String recordId, Operation operation, Map<String, Object> payload,
      Instant createdAt) {
    String id = Ids.newId();
    return SyncQueueItem.pending(id, table, recordId, operation, payload, 3,
        table + ":" + recordId + ":" + id, null, null, null, createdAt);
  }

  private static SyncQueueItem grouped(String correlationId, int sequence, Instant createdAt) {
    String recordId = "b" + sequence;
    return SyncQueueItem.pending(Ids.newId(), "bookings", recordId, Operation.INSERT, Map.of("seq", sequence), 3,
        correlationId + ":bookings:" + recordId + ":" + sequence, correlationId, sequence,
        GroupPolicy.ALL_OR_NOTHING, createdAt);
  }
}
