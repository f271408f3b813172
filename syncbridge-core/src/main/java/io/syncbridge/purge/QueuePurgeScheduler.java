package io.syncbridge.purge;

import io.syncbridge.spi.ConnectionProvider;
import io.syncbridge.spi.QueuePurger;
import io.syncbridge.util.DaemonThreadFactory;

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
import java.util.function.BiFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps the queue table bounded by deleting old terminal rows.
 *
 * <p>Each cycle deletes, in batches, {@code completed}/{@code skipped} items older than the
 * finished retention (default 7 days) and exhausted {@code failed} items older than the failed
 * retention (default 30 days). Dead-lettered items stay in the dead-letter store. Each batch
 * uses its own auto-committed connection to limit lock duration.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class QueuePurgeScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(QueuePurgeScheduler.class.getName());

  private final ConnectionProvider connectionProvider;
  private final QueuePurger purger;
  private final Duration finishedRetention;
  private final Duration failedRetention;
  private final int batchSize;
  private final long intervalSeconds;
  private final Clock clock;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> purgeTask;
  private volatile boolean closed;

  private QueuePurgeScheduler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.purger = Objects.requireNonNull(builder.purger, "purger");
    if (builder.finishedRetention.isNegative() || builder.failedRetention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    this.finishedRetention = builder.finishedRetention;
    this.failedRetention = builder.failedRetention;
    this.batchSize = builder.batchSize;
    this.intervalSeconds = builder.intervalSeconds;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled purge loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("QueuePurgeScheduler has been closed");
    }
    if (purgeTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("syncbridge-purge-"));
    purgeTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Executes one purge cycle. May be invoked directly for one-off purges.
   *
   * @return rows deleted
   */
  public PurgeResult runOnce() {
    if (closed) {
      return new PurgeResult(0, 0);
    }
    Instant now = clock.instant();
    long finished = 0;
    long exhausted = 0;
    try {
      finished = purgeAll(now.minus(finishedRetention), (conn, cutoff) -> purger.purgeFinished(conn, cutoff, batchSize));
      exhausted = purgeAll(now.minus(failedRetention), (conn, cutoff) -> purger.purgeExhausted(conn, cutoff, batchSize));
      if (finished + exhausted > 0) {
        logger.log(Level.INFO, "Purged {0} finished and {1} exhausted sync items", new Object[]{finished, exhausted});
      }
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Purge cycle failed", e);
    }
    return new PurgeResult(finished, exhausted);
  }

  private long purgeAll(Instant cutoff, BiFunction<Connection, Instant, Integer> batch) {
    long total = 0;
    int deleted;
    do {
      deleted = purgeBatch(cutoff, batch);
      total += deleted;
    } while (deleted >= batchSize);
    return total;
  }

  private int purgeBatch(Instant cutoff, BiFunction<Connection, Instant, Integer> batch) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return batch.apply(conn, cutoff);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to obtain connection for purge", e);
      return 0;
    }
  }

  /** Cancels the purge schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (purgeTask != null) {
      purgeTask.cancel(false);
      purgeTask = null;
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

  /**
   * Rows deleted by one cycle.
   */
  public record PurgeResult(long finished, long exhausted) {
  }

  /** Builder for {@link QueuePurgeScheduler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private QueuePurger purger;
    private Duration finishedRetention = Duration.ofDays(7);
    private Duration failedRetention = Duration.ofDays(30);
    private int batchSize = 500;
    private long intervalSeconds = 3600;
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
    public Builder purger(QueuePurger purger) {
      this.purger = purger;
      return this;
    }

    /**
     * Retention of {@code completed} and {@code skipped} items.
     *
     * <p>Optional. Defaults to {@code 7 days}. Must be &ge; 0.
     */
    public Builder finishedRetention(Duration finishedRetention) {
      this.finishedRetention = Objects.requireNonNull(finishedRetention, "finishedRetention");
      return this;
    }

    /**
     * Retention of exhausted {@code failed} items.
     *
     * <p>Optional. Defaults to {@code 30 days}. Must be &ge; 0.
     */
    public Builder failedRetention(Duration failedRetention) {
      this.failedRetention = Objects.requireNonNull(failedRetention, "failedRetention");
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 500}. Must be &gt; 0.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 3600} (1 hour). Must be &gt; 0.
     */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    /**
     * <p>Optional. Defaults to the UTC system clock.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public QueuePurgeScheduler build() {
      return new QueuePurgeScheduler(this);
    }
  }
}
