package io.syncbridge.jdbc;

import io.syncbridge.jdbc.store.H2SyncQueueStore;
import io.syncbridge.model.Operation;
import io.syncbridge.model.QueueStatus;
import io.syncbridge.model.SyncQueueItem;
import io.syncbridge.sweep.SweepScheduler;
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
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SweepSchedulerTest {
  private DataSource dataSource;
  private DataSourceConnectionProvider connectionProvider;
  private H2SyncQueueStore queueStore;
  private MutableClock clock;
  private final List<Integer> triggered = new CopyOnWriteArrayList<>();

  @BeforeEach
  void setup() throws Exception {
    dataSource = TestDatabase.h2();
    connectionProvider = new DataSourceConnectionProvider(dataSource);
    queueStore = new H2SyncQueueStore();
    clock = new MutableClock();
  }

  @AfterEach
  void tearDown() throws Exception {
    TestDatabase.dropSchema(dataSource);
  }

  @Test
  void releasesStaleClaimAndTriggersProcessing() throws Exception {
    String id = enqueue("l1");
    try (Connection conn = dataSource.getConnection()) {
      assertTrue(queueStore.tryClaim(conn, id, clock.instant()));
    }
    clock.advance(Duration.ofMinutes(6));

    try (SweepScheduler sweep = newSweep(60_000)) {
      assertEquals(1, sweep.sweep());
    }

    assertEquals(List.of(25), triggered);
    try (Connection conn = dataSource.getConnection()) {
      SyncQueueItem item = queueStore.findById(conn, id).orElseThrow();
      assertEquals(QueueStatus.FAILED, item.status());
      assertEquals(0, item.retryCount());
      assertTrue(item.isDue(clock.instant()));
    }
  }

  @Test
  void recentClaimIsLeftAlone() throws Exception {
    String id = enqueue("l1");
    try (Connection conn = dataSource.getConnection()) {
      queueStore.tryClaim(conn, id, clock.instant());
    }
    clock.advance(Duration.ofMinutes(1));

    try (SweepScheduler sweep = newSweep(60_000)) {
      assertEquals(0, sweep.sweep());
    }

    assertTrue(triggered.isEmpty());
  }

  @Test
  void emptyQueueDoesNotTrigger() {
    try (SweepScheduler sweep = newSweep(60_000)) {
      assertEquals(0, sweep.sweep());
    }
    assertTrue(triggered.isEmpty());
  }

  @Test
  void failingTriggerIsContained() throws Exception {
    enqueue("l1");
    try (SweepScheduler sweep = SweepScheduler.builder()
        .connectionProvider(connectionProvider)
        .queueStore(queueStore)
        .trigger(batchSize -> { throw new IllegalStateException("down"); })
        .clock(clock)
        .build()) {
      assertEquals(1, sweep.sweep());
    }
  }

  @Test
  void scheduledLoopFiresTrigger() throws Exception {
    enqueue("l1");
    CountDownLatch fired = new CountDownLatch(1);

    try (SweepScheduler sweep = SweepScheduler.builder()
        .connectionProvider(connectionProvider)
        .queueStore(queueStore)
        .trigger(batchSize -> fired.countDown())
        .intervalMs(50)
        .clock(clock)
        .build()) {
      sweep.start();
      sweep.start();
      assertTrue(fired.await(5, TimeUnit.SECONDS));
    }
  }

  @Test
  void startAfterCloseFails() {
    SweepScheduler sweep = newSweep(60_000);
    sweep.close();
    assertThrows(IllegalStateException.class, sweep::start);
    assertEquals(0, sweep.sweep());
  }

  private SweepScheduler newSweep(long intervalMs) {
    return SweepScheduler.builder()
        .connectionProvider(connectionProvider)
        .queueStore(queueStore)
        .trigger(triggered::add)
        .batchSize(25)
        .intervalMs(intervalMs)
        .visibilityTimeout(Duration.ofMinutes(5))
        .clock(clock)
        .build();
  }

  private String enqueue(String recordId) throws Exception {
    String id = Ids.newId();
    try (Connection conn = dataSource.getConnection()) {
      return queueStore.upsertPending(conn, SyncQueueItem.pending(id, "listings", recordId, Operation.UPDATE,
          Map.of(), 3, "listings:" + recordId + ":" + id, null, null, null, clock.instant()));
    }
  }
}
