package io.syncbridge.jdbc;

import io.syncbridge.SyncConfigRegistry;
import io.syncbridge.alert.Alert;
import io.syncbridge.dispatch.FailureClassifier;
import io.syncbridge.dispatch.GroupOutcome;
import io.syncbridge.dispatch.ProcessingReport;
import io.syncbridge.dispatch.QueueProcessor;
import io.syncbridge.jdbc.store.H2SyncQueueStore;
import io.syncbridge.jdbc.store.JdbcDeadLetterStore;
import io.syncbridge.jdbc.store.JdbcSyncConfigStore;
import io.syncbridge.model.DeadLetterEntry;
import io.syncbridge.model.GroupPolicy;
import io.syncbridge.model.Operation;
import io.syncbridge.model.QueueStatus;
import io.syncbridge.model.SyncConfig;
import io.syncbridge.model.SyncQueueItem;
import io.syncbridge.spi.ExternalPlatformClient;
import io.syncbridge.util.Ids;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class QueueProcessorTest {
  private DataSource dataSource;
  private DataSourceConnectionProvider connectionProvider;
  private H2SyncQueueStore queueStore;
  private JdbcDeadLetterStore deadLetterStore;
  private SyncConfigRegistry configs;
  private RecordingPlatformClient client;
  private MutableClock clock;
  private final List<Alert> alerts = new CopyOnWriteArrayList<>();
  private QueueProcessor processor;

  @BeforeEach
  void setup() throws Exception {
    dataSource = TestDatabase.h2();
    connectionProvider = new DataSourceConnectionProvider(dataSource);
    queueStore = new H2SyncQueueStore();
    deadLetterStore = new JdbcDeadLetterStore();
    clock = new MutableClock();
    configs = new SyncConfigRegistry(connectionProvider, new JdbcSyncConfigStore(), Duration.ZERO, clock);
    configs.save(SyncConfig.of("listings", "listing").withFieldMapping(Map.of("title", "Name")));
    configs.save(SyncConfig.of("orders", "order"));
    client = new RecordingPlatformClient();
    processor = newProcessor(FailureClassifier.RETRY_ALL, client);
  }

  @AfterEach
  void tearDown() throws Exception {
    processor.close();
    TestDatabase.dropSchema(dataSource);
  }

  @Test
  void deliversMappedPayloadAndCompletes() throws Exception {
    String id = standalone("listings", "l1", Map.of("title", "Loft", "beds", 2));

    ProcessingReport report = processor.process(10);

    assertEquals(1, report.processed());
    assertEquals(1, report.succeeded());
    assertEquals(Map.of("Name", "Loft", "beds", 2), client.deliveries().get(0).payload());
    assertEquals("listing", client.deliveries().get(0).endpoint());
    SyncQueueItem item = find(id);
    assertEquals(QueueStatus.COMPLETED, item.status());
    assertEquals("{\"ok\":true}", item.externalResponse());
  }

  @Test
  void emptyQueueReportsNothing() {
    ProcessingReport report = processor.process(10);

    assertEquals(ProcessingReport.EMPTY, report);
    assertTrue(client.deliveries().isEmpty());
  }

  @Test
  void transientFailuresAreRetriedUntilDelivered() throws Exception {
    client.failTimes("l1", 2);
    String id = standalone("listings", "l1", Map.of("title", "Loft"));

    assertEquals(1, processor.process(10).failed());
    assertEquals(1, find(id).retryCount());
    assertEquals(1, processor.process(10).failed());
    assertEquals(1, processor.process(10).succeeded());

    SyncQueueItem item = find(id);
    assertEquals(QueueStatus.COMPLETED, item.status());
    assertEquals(2, item.retryCount());
    assertEquals(3, client.deliveriesOf("l1"));
    assertEquals(0, deadLetters(null));
    assertTrue(alerts.isEmpty());
  }

  @Test
  void retryWaitsForBackoff() throws Exception {
    processor.close();
    processor = QueueProcessor.builder()
        .connectionProvider(connectionProvider)
        .queueStore(queueStore)
        .deadLetterStore(deadLetterStore)
        .configRegistry(configs)
        .client(client)
        .retryPolicy(retryCount -> 60_000L * retryCount)
        .alertNotifier(alerts::add)
        .clock(clock)
        .build();
    client.failTimes("l1", 1);
    String id = standalone("listings", "l1", Map.of());

    processor.process(10);
    assertEquals(clock.instant().plusSeconds(60), find(id).nextRetryAt());
    assertEquals(0, processor.process(10).processed());

    clock.advance(Duration.ofSeconds(60));
    assertEquals(1, processor.process(10).succeeded());
  }

  @Test
  void exhaustedItemIsDeadLetteredExactlyOnce() throws Exception {
    client.alwaysFail("l1", 500);
    String id = standalone("listings", "l1", Map.of("title", "Loft"));

    processor.process(10);
    processor.process(10);
    ProcessingReport last = processor.process(10);
    ProcessingReport after = processor.process(10);

    assertEquals(1, last.deadLettered());
    assertEquals(0, after.processed());
    assertEquals(3, client.deliveriesOf("l1"));
    SyncQueueItem item = find(id);
    assertTrue(item.isExhausted());
    assertEquals("External platform returned HTTP 500", item.errorMessage());
    assertEquals("{\"error\":\"rejected\"}", item.errorDetails());

    assertEquals(1, deadLetters(null));
    try (Connection conn = dataSource.getConnection()) {
      DeadLetterEntry entry = deadLetterStore.findByQueueItem(conn, id).orElseThrow();
      assertEquals(3, entry.retryCount());
      assertEquals("Loft", entry.payload().get("title"));
    }
    assertEquals(1, alerts.size());
    assertEquals(Alert.Kind.DEAD_LETTER, alerts.get(0).kind());
  }

  @Test
  void itemWithOpenDeadLetterIsNotCountedOrAlertedAgain() throws Exception {
    processor.close();
    processor = newProcessor(FailureClassifier.CLIENT_ERRORS_FATAL, client);
    client.alwaysFail("l1", 400);
    String id = standalone("listings", "l1", Map.of("title", "Loft"));
    try (Connection conn = dataSource.getConnection()) {
      assertTrue(deadLetterStore.append(conn,
          DeadLetterEntry.of(Ids.newId(), find(id), "earlier failure", null, 3, clock.instant())));
    }

    ProcessingReport report = processor.process(10);

    assertEquals(0, report.deadLettered());
    assertTrue(find(id).isExhausted());
    assertEquals(1, deadLetters(null));
    assertTrue(alerts.isEmpty());
    try (Connection conn = dataSource.getConnection()) {
      assertEquals("earlier failure", deadLetterStore.findByQueueItem(conn, id).orElseThrow().lastError());
    }
  }

  @Test
  void clientErrorsAreRetriedByDefault() throws Exception {
    client.alwaysFail("l1", 422);
    String id = standalone("listings", "l1", Map.of());

    ProcessingReport report = processor.process(10);

    assertEquals(0, report.deadLettered());
    SyncQueueItem item = find(id);
    assertEquals(QueueStatus.FAILED, item.status());
    assertFalse(item.isExhausted());
  }

  @Test
  void clientErrorsFatalDeadLettersOnFirstRejection() throws Exception {
    processor.close();
    processor = newProcessor(FailureClassifier.CLIENT_ERRORS_FATAL, client);
    client.alwaysFail("l1", 400).failTimes("l2", 1);
    String rejected = standalone("listings", "l1", Map.of());
    String flaky = standalone("listings", "l2", Map.of());

    ProcessingReport report = processor.process(10);

    assertEquals(1, report.deadLettered());
    assertTrue(find(rejected).isExhausted());
    assertEquals(3, find(rejected).retryCount());
    assertEquals(QueueStatus.FAILED, find(flaky).status());
    assertFalse(find(flaky).isExhausted());
  }

  @Test
  void itemWithoutConfigIsSkipped() throws Exception {
    String id = standalone("payouts", "p1", Map.of());

    ProcessingReport report = processor.process(10);

    assertEquals(1, report.skipped());
    assertTrue(client.deliveries().isEmpty());
    SyncQueueItem item = find(id);
    assertEquals(QueueStatus.SKIPPED, item.status());
    assertTrue(item.errorMessage().contains("payouts"));
  }

  @Test
  void disabledConfigSkipsAlreadyQueuedItems() throws Exception {
    String id = standalone("listings", "l1", Map.of());
    configs.save(SyncConfig.of("listings", "listing").withEnabled(false));

    processor.process(10);

    assertEquals(QueueStatus.SKIPPED, find(id).status());
  }

  @Test
  void orderedGroupWaitsForFailedItemBeforeContinuing() throws Exception {
    group("proposal-1", GroupPolicy.ALL_OR_NOTHING, "o1", "o2", "o3");
    client.failTimes("o2", 1);

    ProcessingReport first = processor.process(10);

    assertEquals(List.of("o1", "o2"), client.deliveredRecordIds());
    assertEquals(1, first.succeeded());
    assertEquals(1, first.failed());
    assertEquals(QueueStatus.PENDING, groupStatus("proposal-1").get(2));

    processor.process(10);

    assertEquals(List.of("o1", "o2", "o2", "o3"), client.deliveredRecordIds());
    assertEquals(List.of(QueueStatus.COMPLETED, QueueStatus.COMPLETED, QueueStatus.COMPLETED),
        groupStatus("proposal-1"));
  }

  @Test
  void orderedGroupSkipsRemainderAfterDeadItem() throws Exception {
    processor.close();
    processor = newProcessor(FailureClassifier.CLIENT_ERRORS_FATAL, client);
    group("proposal-2", GroupPolicy.ALL_OR_NOTHING, "o1", "o2", "o3");
    client.alwaysFail("o2", 409);

    ProcessingReport report = processor.process(10);

    assertEquals(List.of("o1", "o2"), client.deliveredRecordIds());
    assertEquals(1, report.deadLettered());
    assertEquals(1, report.skipped());
    assertEquals(List.of(QueueStatus.COMPLETED, QueueStatus.FAILED, QueueStatus.SKIPPED),
        groupStatus("proposal-2"));
    GroupOutcome outcome = report.groups().get(0);
    assertEquals("proposal-2", outcome.correlationId());
    assertEquals(1, outcome.completed());
    assertEquals(1, outcome.failed());
    assertEquals(1, outcome.skipped());
  }

  @Test
  void bestEffortGroupDeliversEveryItem() throws Exception {
    processor.close();
    processor = newProcessor(FailureClassifier.CLIENT_ERRORS_FATAL, client);
    group("import-1", GroupPolicy.BEST_EFFORT, "o1", "o2", "o3");
    client.alwaysFail("o2", 400);

    ProcessingReport report = processor.process(10);

    assertEquals(List.of("o1", "o2", "o3"), client.deliveredRecordIds());
    assertEquals(2, report.succeeded());
    assertEquals(List.of(QueueStatus.COMPLETED, QueueStatus.FAILED, QueueStatus.COMPLETED),
        groupStatus("import-1"));
    assertEquals(GroupPolicy.BEST_EFFORT, report.groups().get(0).policy());
    assertEquals(List.of("orders/o2: DEAD"), report.groups().get(0).errors());
  }

  @Test
  void retryFailedLeavesPendingItemsAlone() throws Exception {
    client.failTimes("l1", 1);
    String failed = standalone("listings", "l1", Map.of());
    processor.process(10);
    String pending = standalone("listings", "l2", Map.of());

    ProcessingReport report = processor.retryFailed(10);

    assertEquals(1, report.processed());
    assertEquals(QueueStatus.COMPLETED, find(failed).status());
    assertEquals(QueueStatus.PENDING, find(pending).status());
  }

  @Test
  void slowCallTimesOutAsFailure() throws Exception {
    processor.close();
    ExternalPlatformClient slow = (item, config, payload) -> {
      try {
        Thread.sleep(5_000);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return "late";
    };
    processor = QueueProcessor.builder()
        .connectionProvider(connectionProvider)
        .queueStore(queueStore)
        .deadLetterStore(deadLetterStore)
        .configRegistry(configs)
        .client(slow)
        .retryPolicy(retryCount -> 0L)
        .callTimeout(Duration.ofMillis(100))
        .clock(clock)
        .build();
    String id = standalone("listings", "l1", Map.of());

    assertEquals(1, processor.process(10).failed());

    SyncQueueItem item = find(id);
    assertEquals(QueueStatus.FAILED, item.status());
    assertTrue(item.errorMessage().contains("timed out"));
  }

  @Test
  void rejectsInvalidBatchSizeAndUseAfterClose() {
    assertThrows(IllegalArgumentException.class, () -> processor.process(0));
    processor.close();
    assertThrows(IllegalStateException.class, () -> processor.process(10));
  }

  private QueueProcessor newProcessor(FailureClassifier classifier, ExternalPlatformClient platformClient) {
    return QueueProcessor.builder()
        .connectionProvider(connectionProvider)
        .queueStore(queueStore)
        .deadLetterStore(deadLetterStore)
        .configRegistry(configs)
        .client(platformClient)
        .retryPolicy(retryCount -> 0L)
        .failureClassifier(classifier)
        .alertNotifier(alerts::add)
        .workerCount(2)
        .clock(clock)
        .build();
  }

  private String standalone(String table, String recordId, Map<String, Object> payload) throws Exception {
    String id = Ids.newId();
    try (Connection conn = dataSource.getConnection()) {
      return queueStore.upsertPending(conn, SyncQueueItem.pending(id, table, recordId, Operation.UPDATE, payload,
          3, table + ":" + recordId + ":" + id, null, null, null, clock.instant()));
    }
  }

  private void group(String correlationId, GroupPolicy policy, String... recordIds) throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      for (int i = 0; i < recordIds.length; i++) {
        int sequence = i + 1;
        queueStore.insertIfAbsent(conn, SyncQueueItem.pending(Ids.newId(), "orders", recordIds[i], Operation.UPDATE,
            Map.of("seq", sequence), 3, correlationId + ":orders:" + recordIds[i] + ":" + sequence,
            correlationId, sequence, policy, clock.instant()));
      }
    }
  }

  private List<QueueStatus> groupStatus(String correlationId) throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      return queueStore.findGroup(conn, correlationId).stream().map(SyncQueueItem::status).toList();
    }
  }

  private SyncQueueItem find(String id) throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      return queueStore.findById(conn, id).orElseThrow();
    }
  }

  private long deadLetters(String table) throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      return deadLetterStore.count(conn, table);
    }
  }
}
