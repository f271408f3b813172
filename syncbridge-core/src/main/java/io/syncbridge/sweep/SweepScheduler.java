package io.syncbridge.sweep;

import io.syncbridge.spi.ConnectionProvider;
import io.syncbridge.spi.MetricsExporter;
import io.syncbridge.spi.ProcessorTrigger;
import io.syncbridge.spi.SyncQueueStore;
import io.syncbridge.util.DaemonThreadFactory;
import io.syncbridge.workflow.WorkflowEngine;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic backstop for the immediate trigger.
 *
 * <p>Each cycle:
 * <ol>
 *   <li>returns {@code processing} claims older than the visibility timeout to {@code failed}, due now;
 *   <li>counts due items and, if any, fires the {@link ProcessorTrigger} with the batch-size hint
 *       (zero due items is a silent no-op);
 *   <li>runs claimable workflow executions, when a {@link WorkflowEngine} is configured.
 * </ol>
 *
 * <p>Safety comes from the conditional claims, so any number of processes may run a sweep
 * concurrently. Create instances via {@link #builder()}.
 */
public final class SweepScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SweepScheduler.class.getName());

  private final ConnectionProvider connectionProvider;
  private final SyncQueueStore queueStore;
  private final ProcessorTrigger trigger;
  private final WorkflowEngine workflowEngine;
  private final MetricsExporter metrics;
  private final int batchSize;
  private final int workflowBatchSize;
  private final long intervalMs;
  private final Duration visibilityTimeout;
  private final Clock clock;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> sweepTask;
  private volatile boolean closed;

  private SweepScheduler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.queueStore = Objects.requireNonNull(builder.queueStore, "queueStore");
    this.trigger = Objects.requireNonNull(builder.trigger, "trigger");
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.workflowBatchSize <= 0) {
      throw new IllegalArgumentException("workflowBatchSize must be > 0");
    }
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    if (builder.visibilityTimeout == null || builder.visibilityTimeout.isNegative()
        || builder.visibilityTimeout.isZero()) {
      throw new IllegalArgumentException("visibilityTimeout must be positive");
    }
    this.workflowEngine = builder.workflowEngine;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.batchSize = builder.batchSize;
    this.workflowBatchSize = builder.workflowBatchSize;
    this.intervalMs = builder.intervalMs;
    this.visibilityTimeout = builder.visibilityTimeout;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the sweep loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("SweepScheduler has been closed");
    }
    if (sweepTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("syncbridge-sweep-"));
    sweepTask = scheduler.scheduleWithFixedDelay(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Runs one sweep cycle. Called by the scheduler; may be invoked directly.
   *
   * @return due items found (0 when the count failed)
   */
  public long sweep() {
    if (closed) {
      return 0;
    }
    long due = 0;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      Instant now = clock.instant();
      int released = queueStore.releaseStale(conn, now.minus(visibilityTimeout), now);
      if (released > 0) {
        logger.log(Level.WARNING, "Released {0} sync items stuck in processing", released);
      }
      due = queueStore.countDue(conn, now);
      metrics.recordDueItems(due);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Sync queue sweep failed", e);
    }
    if (due > 0) {
      try {
        trigger.fire(batchSize);
      } catch (RuntimeException e) {
        metrics.incrementTriggerFailed();
        logger.log(Level.SEVERE, "Sweep could not trigger queue processing", e);
      }
    }
    if (workflowEngine != null) {
      try {
        workflowEngine.runDue(workflowBatchSize);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Workflow sweep failed", e);
      }
    }
    return due;
  }

  /** Cancels the sweep schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (sweepTask != null) {
      sweepTask.cancel(false);
      sweepTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link SweepScheduler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private SyncQueueStore queueStore;
    private ProcessorTrigger trigger;
    private WorkflowEngine workflowEngine;
    private MetricsExporter metrics;
    private int batchSize = 10;
    private int workflowBatchSize = 10;
    private long intervalMs = 60_000;
    private Duration visibilityTimeout = Duration.ofMinutes(5);
    private Clock clock;

    private Builder() {
    }

    /**
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
     * Sets the trigger fired when due items exist.
     *
     * <p><b>Required.</b>
     */
    public Builder trigger(ProcessorTrigger trigger) {
      this.trigger = trigger;
      return this;
    }

    /**
     * Sets the engine whose due executions are run each cycle.
     *
     * <p>Optional. Workflows are not swept when absent.
     */
    public Builder workflowEngine(WorkflowEngine workflowEngine) {
      this.workflowEngine = workflowEngine;
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
     * Sets the batch-size hint passed to the trigger.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &gt; 0.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the maximum number of workflow executions run per cycle.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &gt; 0.
     */
    public Builder workflowBatchSize(int workflowBatchSize) {
      this.workflowBatchSize = workflowBatchSize;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 60000} ms. Must be &gt; 0.
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Sets how long an item may stay {@code processing} before it is considered abandoned.
     *
     * <p>Optional. Defaults to {@code 5 minutes}. Should exceed the processor's call timeout.
     */
    public Builder visibilityTimeout(Duration visibilityTimeout) {
      this.visibilityTimeout = visibilityTimeout;
      return this;
    }

    /**
     * <p>Optional. Defaults to the UTC system clock.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public SweepScheduler build() {
      return new SweepScheduler(this);
    }
  }
}
