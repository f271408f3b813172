package io.syncbridge.jdbc.purge;

import io.syncbridge.jdbc.DataSourceConnectionProvider;
import io.syncbridge.jdbc.MutableClock;
import io.syncbridge.jdbc.TestDatabase;
import io.syncbridge.jdbc.store.H2SyncQueueStore;
import io.syncbridge.jdbc.store.JdbcDeadLetterStore;
import io.syncbridge.model.DeadLetterEntry;
import io.syncbridge.model.Operation;
import io.syncbridge.model.SyncQueueItem;
import io.syncbridge.purge.QueuePurgeScheduler;
import io.syncbridge.util.Ids;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcQueuePurgerTest {
  private DataSource dataSource;
  private Connection conn;
  private H2SyncQueueStore queueStore;
  private MutableClock clock;

  @BeforeEach
  void setup() throws Exception {
    dataSource = TestDatabase.h2();
    conn = dataSource.getConnection();
    queueStore = new H2SyncQueueStore();
    clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
  }

  @AfterEach
  void tearDown() throws Exception {
    conn.close();
    TestDatabase.dropSchema(dataSource);
  }

  @Test
  void purgesFinishedAndExhaustedItemsPastRetention() throws Exception {
    String oldCompleted = completed("c1");
    String oldSkipped = enqueue("s1");
    queueStore.markSkipped(conn, oldSkipped, "no config", clock.instant());
    String oldDead = failed("d1", 3);
    new JdbcDeadLetterStore().append(conn, DeadLetterEntry.of(Ids.newId(),
        queueStore.findById(conn, oldDead).orElseThrow(), "HTTP 500", null, 3, clock.instant()));
    String oldRetryable = failed("r1", 1);
    String oldPending = enqueue("p1");

    clock.advance(Duration.ofDays(8));
    String recentCompleted = completed("c2");

    QueuePurgeScheduler scheduler = QueuePurgeScheduler.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .purger(new JdbcQueuePurger())
        .finishedRetention(Duration.ofDays(7))
        .failedRetention(Duration.ofDays(30))
        .batchSize(1)
        .clock(clock)
        .build();

    QueuePurgeScheduler.PurgeResult first = scheduler.runOnce();
    assertEquals(2, first.finished());
    assertEquals(0, first.exhausted());
    assertTrue(queueStore.findById(conn, oldCompleted).isEmpty());
    assertTrue(queueStore.findById(conn, oldSkipped).isEmpty());
    assertTrue(queueStore.findById(conn, recentCompleted).isPresent());
    assertTrue(queueStore.findById(conn, oldDead).isPresent());

    clock.advance(Duration.ofDays(30));
    QueuePurgeScheduler.PurgeResult second = scheduler.runOnce();
    assertEquals(1, second.finished());
    assertEquals(1, second.exhausted());
    assertTrue(queueStore.findById(conn, oldDead).isEmpty());
    assertTrue(queueStore.findById(conn, oldRetryable).isPresent());
    assertTrue(queueStore.findById(conn, oldPending).isPresent());
    assertEquals(1, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM sync_dead_letter"));
    scheduler.close();
  }

  @Test
  void closedSchedulerPurgesNothing() throws Exception {
    completed("c1");
    clock.advance(Duration.ofDays(8));
    QueuePurgeScheduler scheduler = QueuePurgeScheduler.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .purger(new JdbcQueuePurger())
        .clock(clock)
        .build();
    scheduler.close();

    assertEquals(new QueuePurgeScheduler.PurgeResult(0, 0), scheduler.runOnce());
    assertThrows(IllegalStateException.class, scheduler::start);
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class, () -> QueuePurgeScheduler.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .purger(new JdbcQueuePurger())
        .batchSize(0)
        .build());
  }

  private String enqueue(String recordId) {
    String id = Ids.newId();
    return queueStore.upsertPending(conn, SyncQueueItem.pending(id, "listings", recordId, Operation.UPDATE,
        Map.of(), 3, "listings:" + recordId + ":" + id, null, null, null, clock.instant()));
  }

  private String completed(String recordId) {
    String id = enqueue(recordId);
    queueStore.tryClaim(conn, id, clock.instant());
    queueStore.markCompleted(conn, id, clock.instant(), "ok");
    return id;
  }

  private String failed(String recordId, int retryCount) {
    String id = enqueue(recordId);
    queueStore.tryClaim(conn, id, clock.instant());
    queueStore.markFailed(conn, id, retryCount, clock.instant().plus(Duration.ofDays(365)), "HTTP 500", null,
        clock.instant());
    return id;
  }
}
