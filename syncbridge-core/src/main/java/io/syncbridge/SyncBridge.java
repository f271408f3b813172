package io.syncbridge;

import io.syncbridge.alert.LoggingAlertNotifier;
import io.syncbridge.api.ProcessQueueHandler;
import io.syncbridge.api.QueueMonitor;
import io.syncbridge.dead.DeadLetterManager;
import io.syncbridge.dispatch.FailureClassifier;
import io.syncbridge.dispatch.QueueProcessor;
import io.syncbridge.dispatch.RetryPolicy;
import io.syncbridge.purge.QueuePurgeScheduler;
import io.syncbridge.spi.AlertNotifier;
import io.syncbridge.spi.ConnectionProvider;
import io.syncbridge.spi.DeadLetterStore;
import io.syncbridge.spi.ExternalPlatformClient;
import io.syncbridge.spi.MetricsExporter;
import io.syncbridge.spi.ProcessorTrigger;
import io.syncbridge.spi.QueuePurger;
import io.syncbridge.spi.SyncConfigStore;
import io.syncbridge.spi.SyncQueueStore;
import io.syncbridge.spi.TxContext;
import io.syncbridge.spi.WorkflowDefinitionStore;
import io.syncbridge.spi.WorkflowExecutionStore;
import io.syncbridge.sweep.SweepScheduler;
import io.syncbridge.trigger.LocalProcessorTrigger;
import io.syncbridge.workflow.StepHandlerRegistry;
import io.syncbridge.workflow.WorkflowDefinitionRegistry;
import io.syncbridge.workflow.WorkflowEngine;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires change capture, the queue processor, the trigger, the backup
 * sweep, the purge scheduler, dead-letter tooling and (optionally) the workflow engine into a
 * single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (SyncBridge bridge = SyncBridge.builder()
 *     .connectionProvider(connectionProvider)
 *     .txContext(txContext)
 *     .configStore(configStore)
 *     .queueStore(queueStore)
 *     .deadLetterStore(deadLetterStore)
 *     .client(new HttpWorkflowApiClient(baseUrl, apiKey))
 *     .build()) {
 *   bridge.start();
 *   // inside a transaction:
 *   bridge.capture().enqueueSync("listing", id, Operation.UPDATE, row);
 * }
 * }</pre>
 *
 * <p>Nothing runs in the background until {@link #start()}; the processor can always be
 * driven directly via {@link #processor()} or {@link #handler()}.
 */
public final class SyncBridge implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SyncBridge.class.getName());

  private final SyncConfigRegistry configs;
  private final ChangeCapture capture;
  private final QueueProcessor processor;
  private final ProcessorTrigger trigger;
  private final SweepScheduler sweep;
  private final QueuePurgeScheduler purgeScheduler;
  private final DeadLetterManager deadLetters;
  private final QueueMonitor monitor;
  private final ProcessQueueHandler handler;
  private final WorkflowDefinitionRegistry workflowDefinitions;
  private final WorkflowEngine workflowEngine;
  private final MetricsExporter metrics;
  private final boolean sweepEnabled;

  private SyncBridge(Builder builder) {
    ConnectionProvider connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    Objects.requireNonNull(builder.txContext, "txContext");
    Objects.requireNonNull(builder.configStore, "configStore");
    Objects.requireNonNull(builder.queueStore, "queueStore");
    Objects.requireNonNull(builder.deadLetterStore, "deadLetterStore");
    Objects.requireNonNull(builder.client, "client");
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    AlertNotifier alertNotifier = builder.alertNotifier != null ? builder.alertNotifier : new LoggingAlertNotifier();

    this.configs = new SyncConfigRegistry(connectionProvider, builder.configStore, builder.configCacheTtl, clock);
    this.processor = QueueProcessor.builder()
        .connectionProvider(connectionProvider)
        .queueStore(builder.queueStore)
        .deadLetterStore(builder.deadLetterStore)
        .configRegistry(configs)
        .client(builder.client)
        .retryPolicy(builder.retryPolicy)
        .failureClassifier(builder.failureClassifier)
        .alertNotifier(alertNotifier)
        .metrics(metrics)
        .workerCount(builder.workerCount)
        .callTimeout(builder.callTimeout)
        .clock(clock)
        .build();
    this.trigger = builder.trigger != null ? builder.trigger : new LocalProcessorTrigger(processor);
    this.capture = ChangeCapture.builder()
        .txContext(builder.txContext)
        .configRegistry(configs)
        .queueStore(builder.queueStore)
        .trigger(trigger)
        .metrics(metrics)
        .maxRetries(builder.maxRetries)
        .triggerBatchSize(builder.batchSize)
        .clock(clock)
        .build();

    if (builder.definitionStore != null && builder.executionStore != null) {
      this.workflowDefinitions = new WorkflowDefinitionRegistry(connectionProvider, builder.definitionStore);
      this.workflowEngine = WorkflowEngine.builder()
          .connectionProvider(connectionProvider)
          .definitionStore(builder.definitionStore)
          .executionStore(builder.executionStore)
          .stepHandlers(builder.stepHandlers != null ? builder.stepHandlers : new StepHandlerRegistry())
          .retryPolicy(builder.workflowRetryPolicy)
          .alertNotifier(alertNotifier)
          .metrics(metrics)
          .stepTimeout(builder.callTimeout)
          .autoStart(builder.workflowAutoStart)
          .clock(clock)
          .build();
    } else {
      this.workflowDefinitions = null;
      this.workflowEngine = null;
    }

    this.sweepEnabled = builder.sweepEnabled;
    this.sweep = SweepScheduler.builder()
        .connectionProvider(connectionProvider)
        .queueStore(builder.queueStore)
        .trigger(trigger)
        .workflowEngine(workflowEngine)
        .metrics(metrics)
        .batchSize(builder.batchSize)
        .intervalMs(builder.sweepIntervalMs)
        .visibilityTimeout(builder.visibilityTimeout)
        .clock(clock)
        .build();
    this.purgeScheduler = builder.purger == null ? null : QueuePurgeScheduler.builder()
        .connectionProvider(connectionProvider)
        .purger(builder.purger)
        .finishedRetention(builder.finishedRetention)
        .failedRetention(builder.failedRetention)
        .batchSize(builder.purgeBatchSize)
        .intervalSeconds(builder.purgeIntervalSeconds)
        .clock(clock)
        .build();

    this.deadLetters = new DeadLetterManager(connectionProvider, builder.queueStore, builder.deadLetterStore,
        trigger, clock);
    this.monitor = new QueueMonitor(connectionProvider, builder.queueStore, clock);
    this.handler = new ProcessQueueHandler(processor, monitor, purgeScheduler);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the backup sweep (when enabled) and the purge scheduler (when a purger is configured).
   */
  public void start() {
    if (sweepEnabled) {
      sweep.start();
    }
    if (purgeScheduler != null) {
      purgeScheduler.start();
    }
    logger.log(Level.INFO, "SyncBridge started (sweep={0}, purge={1}, workflows={2})",
        new Object[]{sweepEnabled, purgeScheduler != null, workflowEngine != null});
  }

  public ChangeCapture capture() {
    return capture;
  }

  public SyncConfigRegistry configs() {
    return configs;
  }

  public QueueProcessor processor() {
    return processor;
  }

  public ProcessorTrigger trigger() {
    return trigger;
  }

  public SweepScheduler sweep() {
    return sweep;
  }

  /** Purge scheduler, or {@code null} when no purger was configured. */
  public QueuePurgeScheduler purgeScheduler() {
    return purgeScheduler;
  }

  public DeadLetterManager deadLetters() {
    return deadLetters;
  }

  public QueueMonitor monitor() {
    return monitor;
  }

  public ProcessQueueHandler handler() {
    return handler;
  }

  /** Workflow definition registry, or {@code null} when workflow stores were not configured. */
  public WorkflowDefinitionRegistry workflowDefinitions() {
    return workflowDefinitions;
  }

  /** Workflow engine, or {@code null} when workflow stores were not configured. */
  public WorkflowEngine workflowEngine() {
    return workflowEngine;
  }

  /**
   * Shuts down components in order: purge scheduler, sweep, trigger, workflow engine, processor.
   */
  @Override
  public void close() {
    List<AutoCloseable> components = new ArrayList<>();
    if (purgeScheduler != null) {
      components.add(purgeScheduler);
    }
    components.add(sweep);
    if (trigger instanceof AutoCloseable closeable) {
      components.add(closeable);
    }
    if (workflowEngine != null) {
      components.add(workflowEngine);
    }
    components.add(processor);
    if (metrics instanceof AutoCloseable closeable) {
      components.add(closeable);
    }

    RuntimeException first = null;
    for (AutoCloseable component : components) {
      try {
        component.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Single-use builder for {@link SyncBridge}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private TxContext txContext;
    private SyncConfigStore configStore;
    private SyncQueueStore queueStore;
    private DeadLetterStore deadLetterStore;
    private ExternalPlatformClient client;
    private QueuePurger purger;
    private WorkflowDefinitionStore definitionStore;
    private WorkflowExecutionStore executionStore;
    private StepHandlerRegistry stepHandlers;
    private ProcessorTrigger trigger;
    private RetryPolicy retryPolicy;
    private RetryPolicy workflowRetryPolicy;
    private FailureClassifier failureClassifier;
    private AlertNotifier alertNotifier;
    private MetricsExporter metrics;
    private int workerCount = 4;
    private Duration callTimeout = Duration.ofSeconds(30);
    private int maxRetries = 3;
    private int batchSize = 10;
    private Duration configCacheTtl = SyncConfigRegistry.DEFAULT_CACHE_TTL;
    private boolean sweepEnabled = true;
    private long sweepIntervalMs = 60_000;
    private Duration visibilityTimeout = Duration.ofMinutes(5);
    private Duration finishedRetention = Duration.ofDays(7);
    private Duration failedRetention = Duration.ofDays(30);
    private int purgeBatchSize = 500;
    private long purgeIntervalSeconds = 3600;
    private boolean workflowAutoStart = true;
    private Clock clock;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {
    }

    /**
     * Connection source for work outside the caller's transaction.
     *
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Transaction context used by change capture.
     *
     * <p><b>Required.</b>
     */
    public Builder txContext(TxContext txContext) {
      this.txContext = txContext;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder configStore(SyncConfigStore configStore) {
      this.configStore = configStore;
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
     * Client that delivers items to the external platform.
     *
     * <p><b>Required.</b>
     */
    public Builder client(ExternalPlatformClient client) {
      this.client = client;
      return this;
    }

    /**
     * Enables the purge scheduler.
     *
     * <p>Optional. Without a purger, terminal items are kept forever.
     */
    public Builder purger(QueuePurger purger) {
      this.purger = purger;
      return this;
    }

    /**
     * Enables the workflow engine. Both stores are needed.
     *
     * <p>Optional.
     */
    public Builder workflowStores(WorkflowDefinitionStore definitionStore, WorkflowExecutionStore executionStore) {
      this.definitionStore = definitionStore;
      this.executionStore = executionStore;
      return this;
    }

    /**
     * <p>Optional. Defaults to an empty registry.
     */
    public Builder stepHandlers(StepHandlerRegistry stepHandlers) {
      this.stepHandlers = stepHandlers;
      return this;
    }

    /**
     * Trigger fired after commit and by the sweep.
     *
     * <p>Optional. Defaults to a {@link LocalProcessorTrigger} over this bridge's processor.
     */
    public Builder trigger(ProcessorTrigger trigger) {
      this.trigger = trigger;
      return this;
    }

    /**
     * <p>Optional. Defaults to the processor's exponential backoff.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * <p>Optional. Defaults to the workflow engine's exponential backoff.
     */
    public Builder workflowRetryPolicy(RetryPolicy workflowRetryPolicy) {
      this.workflowRetryPolicy = workflowRetryPolicy;
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
     * <p>Optional. Defaults to {@code 4}.
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Timeout of one external call or workflow step.
     *
     * <p>Optional. Defaults to {@code 30s}.
     */
    public Builder callTimeout(Duration callTimeout) {
      this.callTimeout = callTimeout;
      return this;
    }

    /**
     * Failed attempts allowed per queue item before dead-lettering.
     *
     * <p>Optional. Defaults to {@code 3}.
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Batch size passed to the trigger by change capture and the sweep.
     *
     * <p>Optional. Defaults to {@code 10}.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link SyncConfigRegistry#DEFAULT_CACHE_TTL}.
     */
    public Builder configCacheTtl(Duration configCacheTtl) {
      this.configCacheTtl = configCacheTtl;
      return this;
    }

    /**
     * Whether {@link SyncBridge#start()} schedules the backup sweep.
     *
     * <p>Optional. Defaults to {@code true}.
     */
    public Builder sweepEnabled(boolean sweepEnabled) {
      this.sweepEnabled = sweepEnabled;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 60000}.
     */
    public Builder sweepIntervalMs(long sweepIntervalMs) {
      this.sweepIntervalMs = sweepIntervalMs;
      return this;
    }

    /**
     * Age after which a {@code processing} claim is considered abandoned.
     *
     * <p>Optional. Defaults to {@code 5m}.
     */
    public Builder visibilityTimeout(Duration visibilityTimeout) {
      this.visibilityTimeout = visibilityTimeout;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 7d}.
     */
    public Builder finishedRetention(Duration finishedRetention) {
      this.finishedRetention = finishedRetention;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 30d}.
     */
    public Builder failedRetention(Duration failedRetention) {
      this.failedRetention = failedRetention;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 500}.
     */
    public Builder purgeBatchSize(int purgeBatchSize) {
      this.purgeBatchSize = purgeBatchSize;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 3600}.
     */
    public Builder purgeIntervalSeconds(long purgeIntervalSeconds) {
      this.purgeIntervalSeconds = purgeIntervalSeconds;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code true}.
     */
    public Builder workflowAutoStart(boolean workflowAutoStart) {
      this.workflowAutoStart = workflowAutoStart;
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
     * @throws IllegalStateException if called twice on the same builder
     */
    public SyncBridge build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new SyncBridge(this);
    }
  }
}
