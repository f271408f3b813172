package io.syncbridge.dispatch;

import io.syncbridge.DeliveryException;
import io.syncbridge.PayloadFilter;
import io.syncbridge.SyncConfigRegistry;
import io.syncbridge.alert.Alert;
import io.syncbridge.alert.LoggingAlertNotifier;
import io.syncbridge.model.DeadLetterEntry;
import io.syncbridge.model.GroupPolicy;
import io.syncbridge.model.QueueStatus;
import io.syncbridge.model.SyncConfig;
import io.syncbridge.model.SyncQueueItem;
import io.syncbridge.spi.AlertNotifier;
import io.syncbridge.spi.ConnectionProvider;
import io.syncbridge.spi.DeadLetterStore;
import io.syncbridge.spi.ExternalPlatformClient;
import io.syncbridge.spi.MetricsExporter;
import io.syncbridge.spi.SyncQueueStore;
import io.syncbridge.util.DaemonThreadFactory;
import io.syncbridge.util.Ids;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Claims due queue items and delivers them to the external platform.
 *
 * <p>A run loads up to {@code batchSize} due items, splits them into work units (a standalone
 * item, or a whole correlation group in sequence order) and executes the units concurrently on
 * a bounded worker pool. Each item is claimed with a conditional {@code pending -> processing}
 * update before any call is made; losing the claim means another run owns the item, so
 * concurrent runs in any number of processes are safe.
 *
 * <p>Each external call runs under its own timeout; a timed-out call counts as a failure.
 * Failures are retried after {@link RetryPolicy#computeDelayMs} until the item's retry budget
 * is spent, then the item is archived in the {@link DeadLetterStore} in the same transaction
 * as its final status update, and an {@link Alert} is raised.
 *
 * <p>Create instances via {@link #builder()}. Thread-safe.
 */
public final class QueueProcessor implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(QueueProcessor.class.getName());

  private final ConnectionProvider connectionProvider;
  private final SyncQueueStore queueStore;
  private final DeadLetterStore deadLetterStore;
  private final SyncConfigRegistry configRegistry;
  private final ExternalPlatformClient client;
  private final RetryPolicy retryPolicy;
  private final FailureClassifier failureClassifier;
  private final AlertNotifier alertNotifier;
  private final MetricsExporter metrics;
  private final Duration callTimeout;
  private final Clock clock;
  private final ExecutorService workers;
  private final ExecutorService calls;
  private volatile boolean closed;

  private QueueProcessor(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.queueStore = Objects.requireNonNull(builder.queueStore, "queueStore");
    this.deadLetterStore = Objects.requireNonNull(builder.deadLetterStore, "deadLetterStore");
    this.configRegistry = Objects.requireNonNull(builder.configRegistry, "configRegistry");
    this.client = Objects.requireNonNull(builder.client, "client");
    if (builder.workerCount <= 0) {
      throw new IllegalArgumentException("workerCount must be > 0");
    }
    if (builder.callTimeout == null || builder.callTimeout.isNegative() || builder.callTimeout.isZero()) {
      throw new IllegalArgumentException("callTimeout must be positive");
    }
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(60_000, 3_600_000);
    this.failureClassifier = builder.failureClassifier != null
        ? builder.failureClassifier : FailureClassifier.RETRY_ALL;
    this.alertNotifier = builder.alertNotifier != null ? builder.alertNotifier : new LoggingAlertNotifier();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.callTimeout = builder.callTimeout;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.workers = Executors.newFixedThreadPool(builder.workerCount, new DaemonThreadFactory("syncbridge-worker-"));
    this.calls = Executors.newCachedThreadPool(new DaemonThreadFactory("syncbridge-call-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Processes up to {@code batchSize} due items: pending items and failed items whose retry
   * time has come, oldest first.
   *
   * @throws IllegalArgumentException if {@code batchSize <= 0}
   * @throws IllegalStateException    if the processor has been closed
   */
  public ProcessingReport process(int batchSize) {
    return run(batchSize, false);
  }

  /**
   * Processes up to {@code batchSize} failed items whose retry time has come. Pending items are
   * only touched when they belong to the correlation group of a retried item.
   */
  public ProcessingReport retryFailed(int batchSize) {
    return run(batchSize, true);
  }

  private ProcessingReport run(int batchSize, boolean retryOnly) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (closed) {
      throw new IllegalStateException("QueueProcessor has been closed");
    }
    List<SyncQueueItem> due = loadDue(batchSize, retryOnly);
    if (due.isEmpty()) {
      return ProcessingReport.EMPTY;
    }

    Tally tally = new Tally();
    List<Future<?>> pending = new ArrayList<>();
    for (WorkUnit unit : toUnits(due)) {
      pending.add(workers.submit(() -> runUnit(unit, tally)));
    }
    for (Future<?> future : pending) {
      try {
        future.get();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        logger.log(Level.WARNING, "Interrupted while waiting for queue workers");
        break;
      } catch (ExecutionException e) {
        logger.log(Level.SEVERE, "Queue work unit failed", e.getCause());
      }
    }
    ProcessingReport report = tally.toReport();
    logger.log(Level.INFO, "Processed {0} sync items: {1} succeeded, {2} failed, {3} skipped, {4} dead-lettered",
        new Object[]{report.processed(), report.succeeded(), report.failed(), report.skipped(),
            report.deadLettered()});
    return report;
  }

  private List<SyncQueueItem> loadDue(int batchSize, boolean retryOnly) {
    Instant now = clock.instant();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return retryOnly
          ? queueStore.findRetryable(conn, now, batchSize)
          : queueStore.findDue(conn, now, batchSize);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to load due sync items", e);
    }
  }

  private static List<WorkUnit> toUnits(List<SyncQueueItem> due) {
    Map<String, WorkUnit> units = new LinkedHashMap<>();
    for (SyncQueueItem item : due) {
      if (item.isCorrelated()) {
        units.putIfAbsent("group:" + item.correlationId(), new WorkUnit(item.correlationId(), item.groupPolicy(), null));
      } else {
        units.put("item:" + item.id(), new WorkUnit(null, null, item));
      }
    }
    return new ArrayList<>(units.values());
  }

  private void runUnit(WorkUnit unit, Tally tally) {
    if (unit.item() != null) {
      processItem(unit.item(), tally);
    } else if (unit.policy() == GroupPolicy.BEST_EFFORT) {
      runBestEffortGroup(unit.correlationId(), tally);
    } else {
      runOrderedGroup(unit.correlationId(), tally);
    }
  }

  /**
   * Item k+1 runs only after item k completed. A failed-but-retryable item stops the group until
   * its next run; a dead or skipped item skips the remainder.
   */
  private void runOrderedGroup(String correlationId, Tally tally) {
    List<SyncQueueItem> group = loadGroup(correlationId);
    GroupTally groupTally = new GroupTally();
    for (int i = 0; i < group.size(); i++) {
      SyncQueueItem item = group.get(i);
      Outcome outcome;
      if (item.status() == QueueStatus.COMPLETED) {
        continue;
      } else if (item.status() == QueueStatus.SKIPPED || item.isExhausted()) {
        outcome = Outcome.DEAD;
      } else {
        outcome = processItem(item, tally);
        groupTally.record(item, outcome);
      }
      if (outcome == Outcome.COMPLETED) {
        continue;
      }
      if (outcome == Outcome.DEAD || outcome == Outcome.SKIPPED) {
        String reason = "Correlation group " + correlationId + " aborted at sequence " + item.sequence();
        for (SyncQueueItem rest : group.subList(i + 1, group.size())) {
          if (skip(rest, reason)) {
            tally.skipped.incrementAndGet();
            groupTally.skipped++;
          }
        }
      }
      break;
    }
    groupTally.report(correlationId, GroupPolicy.ALL_OR_NOTHING, tally);
  }

  private void runBestEffortGroup(String correlationId, Tally tally) {
    Instant now = clock.instant();
    GroupTally groupTally = new GroupTally();
    for (SyncQueueItem item : loadGroup(correlationId)) {
      if (!item.isDue(now)) {
        continue;
      }
      groupTally.record(item, processItem(item, tally));
    }
    groupTally.report(correlationId, GroupPolicy.BEST_EFFORT, tally);
  }

  private Outcome processItem(SyncQueueItem candidate, Tally tally) {
    Instant now = clock.instant();
    Optional<SyncQueueItem> claimed = claim(candidate.id(), now);
    if (claimed.isEmpty()) {
      return Outcome.NOT_CLAIMED;
    }
    SyncQueueItem item = claimed.get();
    tally.processed.incrementAndGet();

    Optional<SyncConfig> config;
    try {
      config = configRegistry.find(item.tableName());
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to load sync config for item " + item.id(), e);
      return fail(item, "Failed to load sync config: " + e.getMessage(), null, true, tally);
    }
    if (config.isEmpty() || !config.get().enabled()) {
      if (skip(item, "No enabled sync config for table " + item.tableName())) {
        tally.skipped.incrementAndGet();
        metrics.incrementDispatchSkipped();
      }
      return Outcome.SKIPPED;
    }

    Map<String, Object> mapped = PayloadFilter.applyMapping(item.payload(), config.get());
    long started = System.nanoTime();
    try {
      String response = deliverWithTimeout(item, config.get(), mapped);
      metrics.recordCallDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
      complete(item, response);
      tally.succeeded.incrementAndGet();
      metrics.incrementDispatchSuccess();
      return Outcome.COMPLETED;
    } catch (DeliveryException e) {
      metrics.recordCallDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
      return fail(item, e.getMessage(), e.responseBody(), failureClassifier.isRetryable(e), tally);
    }
  }

  private Optional<SyncQueueItem> claim(String id, Instant now) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      if (!queueStore.tryClaim(conn, id, now)) {
        return Optional.empty();
      }
      return queueStore.findById(conn, id);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to claim sync item " + id, e);
      return Optional.empty();
    }
  }

  private String deliverWithTimeout(SyncQueueItem item, SyncConfig config, Map<String, Object> payload)
      throws DeliveryException {
    Future<String> call = calls.submit(() -> client.deliver(item, config, payload));
    try {
      return call.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      call.cancel(true);
      throw new DeliveryException("External call timed out after " + callTimeout.toMillis() + " ms", e);
    } catch (InterruptedException e) {
      call.cancel(true);
      Thread.currentThread().interrupt();
      throw new DeliveryException("Interrupted while waiting for external call", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof DeliveryException delivery) {
        throw delivery;
      }
      throw new DeliveryException(String.valueOf(cause), cause);
    }
  }

  private void complete(SyncQueueItem item, String response) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      queueStore.markCompleted(conn, item.id(), clock.instant(), response);
    } catch (SQLException | RuntimeException e) {
      // the claim expires and the item is delivered again
      logger.log(Level.SEVERE, "Failed to mark sync item " + item.id() + " completed", e);
    }
  }

  private Outcome fail(SyncQueueItem item, String error, String details, boolean retryable, Tally tally) {
    tally.failed.incrementAndGet();
    Instant now = clock.instant();
    int retryCount = item.retryCount() + 1;
    if (retryable && retryCount < item.maxRetries()) {
      Instant nextRetryAt = now.plusMillis(retryPolicy.computeDelayMs(retryCount));
      try (Connection conn = connectionProvider.getConnection()) {
        conn.setAutoCommit(true);
        queueStore.markFailed(conn, item.id(), retryCount, nextRetryAt, error, details, now);
      } catch (SQLException | RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to mark sync item " + item.id() + " failed", e);
      }
      metrics.incrementDispatchFailure();
      logger.log(Level.WARNING, "Sync of {0}/{1} failed (attempt {2} of {3}), next retry at {4}: {5}",
          new Object[]{item.tableName(), item.recordId(), retryCount, item.maxRetries(), nextRetryAt, error});
      return Outcome.FAILED;
    }

    int finalCount = Math.max(retryCount, item.maxRetries());
    boolean appended;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        queueStore.markFailed(conn, item.id(), finalCount, null, error, details, now);
        appended = deadLetterStore.append(conn, DeadLetterEntry.of(Ids.newId(), item, error, details, retryCount, now));
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to dead-letter sync item " + item.id(), e);
      return Outcome.FAILED;
    }
    if (!appended) {
      // an unreplayed entry for this item already exists and was alerted on
      logger.log(Level.FINE, "Sync item {0} already has an open dead-letter entry", item.id());
      return Outcome.DEAD;
    }
    tally.deadLettered.incrementAndGet();
    metrics.incrementDispatchDead();
    notifyAlert(Alert.deadLetter(item.tableName(), item.recordId(), error));
    return Outcome.DEAD;
  }

  private boolean skip(SyncQueueItem item, String reason) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      boolean skipped = queueStore.markSkipped(conn, item.id(), reason, clock.instant()) > 0;
      if (skipped) {
        logger.log(Level.WARNING, "Skipped sync item {0} ({1}/{2}): {3}",
            new Object[]{item.id(), item.tableName(), item.recordId(), reason});
      }
      return skipped;
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to mark sync item " + item.id() + " skipped", e);
      return false;
    }
  }

  private List<SyncQueueItem> loadGroup(String correlationId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return queueStore.findGroup(conn, correlationId);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to load correlation group " + correlationId, e);
    }
  }

  private void notifyAlert(Alert alert) {
    try {
      alertNotifier.notify(alert);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Alert notifier failed for " + alert.summary(), e);
    }
  }

  /**
   * Stops accepting runs and shuts down the worker and call pools.
   */
  @Override
  public void close() {
    closed = true;
    workers.shutdown();
    calls.shutdownNow();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private enum Outcome {
    NOT_CLAIMED,
    COMPLETED,
    FAILED,
    DEAD,
    SKIPPED
  }

  private record WorkUnit(String correlationId, GroupPolicy policy, SyncQueueItem item) {
  }

  private static final class Tally {
    final AtomicInteger processed = new AtomicInteger();
    final AtomicInteger succeeded = new AtomicInteger();
    final AtomicInteger failed = new AtomicInteger();
    final AtomicInteger skipped = new AtomicInteger();
    final AtomicInteger deadLettered = new AtomicInteger();
    final ConcurrentLinkedQueue<GroupOutcome> groups = new ConcurrentLinkedQueue<>();

    ProcessingReport toReport() {
      return new ProcessingReport(processed.get(), succeeded.get(), failed.get(), skipped.get(),
          deadLettered.get(), new ArrayList<>(groups));
    }
  }

  private static final class GroupTally {
    int completed;
    int failed;
    int skipped;
    final Set<String> errors = new LinkedHashSet<>();

    void record(SyncQueueItem item, Outcome outcome) {
      switch (outcome) {
        case COMPLETED -> completed++;
        case FAILED, DEAD -> {
          failed++;
          errors.add(item.tableName() + "/" + item.recordId() + ": " + outcome);
        }
        case SKIPPED -> skipped++;
        case NOT_CLAIMED -> {
        }
      }
    }

    void report(String correlationId, GroupPolicy policy, Tally tally) {
      if (failed > 0 || skipped > 0) {
        tally.groups.add(new GroupOutcome(correlationId, policy, completed, failed, skipped, new ArrayList<>(errors)));
      }
    }
  }

  /**
   * Builder for {@link QueueProcessor}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private SyncQueueStore queueStore;
    private DeadLetterStore deadLetterStore;
    private SyncConfigRegistry configRegistry;
    private ExternalPlatformClient client;
    private RetryPolicy retryPolicy;
    private FailureClassifier failureClassifier;
    private AlertNotifier alertNotifier;
    private MetricsExporter metrics;
    private int workerCount = 4;
    private Duration callTimeout = Duration.ofSeconds(30);
    private Clock clock;

    private Builder() {
    }

    /**
     * Sets the connection provider used for claims and status transitions.
     *
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder queueStore(SyncQueueStore queueStore) {
      this.queueStore = queueStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder deadLetterStore(DeadLetterStore deadLetterStore) {
      this.deadLetterStore = deadLetterStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder configRegistry(SyncConfigRegistry configRegistry) {
      this.configRegistry = configRegistry;
      return this;
    }

    /**
     * Sets the client that delivers items to the external platform.
     *
     * <p><b>Required.</b>
     */
    public Builder client(ExternalPlatformClient client) {
      this.client = client;
      return this;
    }

    /**
     * <p>Optional. Defaults to exponential backoff from 1 minute, capped at 1 hour.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link FailureClassifier#RETRY_ALL}.
     */
    public Builder failureClassifier(FailureClassifier failureClassifier) {
      this.failureClassifier = failureClassifier;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link LoggingAlertNotifier}.
     */
    public Builder alertNotifier(AlertNotifier alertNotifier) {
      this.alertNotifier = alertNotifier;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the number of work units processed in parallel.
     *
     * <p>Optional. Defaults to {@code 4}. Must be &gt; 0.
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets the timeout of a single external call.
     *
     * <p>Optional. Defaults to {@code 30s}. Must be positive.
     */
    public Builder callTimeout(Duration callTimeout) {
      this.callTimeout = callTimeout;
      return this;
    }

    /**
     * <p>Optional. Defaults to the UTC system clock.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * @throws NullPointerException     if a required component is missing
     * @throws IllegalArgumentException if {@code workerCount <= 0} or {@code callTimeout} is not positive
     */
    public QueueProcessor build() {
      return new QueueProcessor(this);
    }
  }
}
