package io.syncbridge;

import io.syncbridge.model.GroupPolicy;
import io.syncbridge.model.Operation;
import io.syncbridge.model.SyncConfig;
import io.syncbridge.model.SyncQueueItem;
import io.syncbridge.spi.MetricsExporter;
import io.syncbridge.spi.ProcessorTrigger;
import io.syncbridge.spi.SyncQueueStore;
import io.syncbridge.spi.TxContext;
import io.syncbridge.util.Ids;

import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes sync queue items in the caller's transaction.
 *
 * <p>Every method requires an active transaction via {@link TxContext}. Queue rows are written
 * on the transaction's connection, so a failed enqueue rolls back the business mutation with
 * it. After the transaction commits, the {@link ProcessorTrigger} is fired; trigger failures
 * are logged and never reach the caller.
 *
 * @see SyncConfigRegistry
 * @see PayloadFilter
 */
public final class ChangeCapture {
  private static final Logger logger = Logger.getLogger(ChangeCapture.class.getName());

  private final TxContext txContext;
  private final SyncConfigRegistry configRegistry;
  private final SyncQueueStore queueStore;
  private final ProcessorTrigger trigger;
  private final MetricsExporter metrics;
  private final int maxRetries;
  private final int triggerBatchSize;
  private final Clock clock;

  private ChangeCapture(Builder builder) {
    this.txContext = Objects.requireNonNull(builder.txContext, "txContext");
    this.configRegistry = Objects.requireNonNull(builder.configRegistry, "configRegistry");
    this.queueStore = Objects.requireNonNull(builder.queueStore, "queueStore");
    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    if (builder.triggerBatchSize <= 0) {
      throw new IllegalArgumentException("triggerBatchSize must be > 0");
    }
    this.trigger = builder.trigger != null ? builder.trigger : ProcessorTrigger.NONE;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.maxRetries = builder.maxRetries;
    this.triggerBatchSize = builder.triggerBatchSize;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Captures a single-row mutation.
   *
   * <p>No-op when the table has no enabled config or the operation is not captured. A pending
   * item for the same {@code (table, recordId)} is coalesced: its payload, operation and
   * idempotency key are replaced with this snapshot.
   *
   * @param table     source table
   * @param recordId  source record id
   * @param operation captured mutation
   * @param payload   full row snapshot; internal and excluded fields are removed here
   * @return id of the pending item carrying the snapshot, or empty if nothing was captured
   * @throws IllegalStateException if no transaction is active
   */
  public Optional<String> enqueueSync(String table, String recordId, Operation operation,
      Map<String, Object> payload) {
    requireTransaction();
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(recordId, "recordId");
    Objects.requireNonNull(operation, "operation");

    Connection conn = txContext.currentConnection();
    Optional<SyncConfig> config = capturingConfig(conn, table, operation);
    if (config.isEmpty()) {
      return Optional.empty();
    }

    Instant now = clock.instant();
    String id = Ids.newId();
    SyncQueueItem item = SyncQueueItem.pending(id, table, recordId, operation,
        PayloadFilter.filter(payload, config.get()), maxRetries,
        table + ":" + recordId + ":" + id, null, null, null, now);
    String pendingId = queueStore.upsertPending(conn, item);
    metrics.incrementEnqueued();
    registerTrigger();
    return Optional.of(pendingId);
  }

  /**
   * Captures a multi-row change as one correlation group.
   *
   * <p>Items are written in ascending sequence with the idempotency key
   * {@code correlationId:table:recordId:sequence}; an item whose key already exists is skipped,
   * so redelivering the same group is harmless. Items of tables without a capturing config are
   * left out. An item whose record already has a pending row is folded into that row rather
   * than written, keeping one pending row per record.
   *
   * @return ids of newly written items in sequence order
   * @throws IllegalStateException    if no transaction is active
   * @throws IllegalArgumentException if two items share a sequence number
   */
  public List<String> enqueueComposite(String correlationId, GroupPolicy policy, List<ChangeRequest> changes) {
    requireTransaction();
    Objects.requireNonNull(correlationId, "correlationId");
    Objects.requireNonNull(policy, "policy");
    Objects.requireNonNull(changes, "changes");

    List<ChangeRequest> ordered = new ArrayList<>(changes);
    ordered.sort(Comparator.comparingInt(ChangeRequest::sequence));
    Set<Integer> sequences = new HashSet<>();
    for (ChangeRequest change : ordered) {
      if (!sequences.add(change.sequence())) {
        throw new IllegalArgumentException("Duplicate sequence " + change.sequence()
            + " in correlation group " + correlationId);
      }
    }

    Connection conn = txContext.currentConnection();
    Instant now = clock.instant();
    List<String> ids = new ArrayList<>();
    for (ChangeRequest change : ordered) {
      Optional<SyncConfig> config = capturingConfig(conn, change.tableName(), change.operation());
      if (config.isEmpty()) {
        continue;
      }
      String key = correlationId + ":" + change.tableName() + ":" + change.recordId() + ":" + change.sequence();
      SyncQueueItem item = SyncQueueItem.pending(Ids.newId(), change.tableName(), change.recordId(),
          change.operation(), PayloadFilter.filter(change.payload(), config.get()), maxRetries, key,
          correlationId, change.sequence(), policy, now);
      if (queueStore.insertIfAbsent(conn, item)) {
        ids.add(item.id());
        metrics.incrementEnqueued();
      } else {
        logger.log(Level.INFO, "Sync item {0} not written: duplicate key or record already pending", key);
      }
    }
    if (!ids.isEmpty()) {
      registerTrigger();
    }
    return ids;
  }

  /**
   * Captures a change spanning several records that the target applies as one call.
   *
   * <p>Written as a single {@link Operation#ATOMIC_COMPOSITE} item keyed by
   * {@code correlationId:table:recordId:0}; redelivery is skipped.
   *
   * @return the item id, or empty if the table is not captured or the item already exists
   */
  public Optional<String> enqueueAtomic(String correlationId, String table, String recordId,
      Map<String, Object> payload) {
    List<String> ids = enqueueComposite(correlationId, GroupPolicy.ALL_OR_NOTHING,
        List.of(new ChangeRequest(table, recordId, Operation.ATOMIC_COMPOSITE, payload, 0)));
    return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
  }

  private Optional<SyncConfig> capturingConfig(Connection conn, String table, Operation operation) {
    Optional<SyncConfig> config = configRegistry.find(conn, table);
    if (config.isEmpty()) {
      logger.log(Level.FINE, "No sync config for table {0}", table);
      return Optional.empty();
    }
    if (!config.get().captures(operation)) {
      logger.log(Level.FINE, "Sync of {0} on {1} is disabled", new Object[]{operation, table});
      return Optional.empty();
    }
    return config;
  }

  private void requireTransaction() {
    if (!txContext.isTransactionActive()) {
      throw new IllegalStateException("No active transaction");
    }
  }

  private void registerTrigger() {
    txContext.afterCommit(() -> {
      try {
        trigger.fire(triggerBatchSize);
      } catch (RuntimeException ex) {
        metrics.incrementTriggerFailed();
        logger.log(Level.WARNING, "Immediate processor trigger failed; the sweep will pick the item up", ex);
      }
    });
  }

  /**
   * Builder for {@link ChangeCapture}.
   */
  public static final class Builder {
    private TxContext txContext;
    private SyncConfigRegistry configRegistry;
    private SyncQueueStore queueStore;
    private ProcessorTrigger trigger;
    private MetricsExporter metrics;
    private int maxRetries = SyncQueueItem.DEFAULT_MAX_RETRIES;
    private int triggerBatchSize = 10;
    private Clock clock;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder txContext(TxContext txContext) {
      this.txContext = txContext;
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
     * <p><b>Required.</b>
     */
    public Builder queueStore(SyncQueueStore queueStore) {
      this.queueStore = queueStore;
      return this;
    }

    /**
     * Sets the trigger fired after commit.
     *
     * <p>Optional. Defaults to {@link ProcessorTrigger#NONE} (sweep-only delivery).
     */
    public Builder trigger(ProcessorTrigger trigger) {
      this.trigger = trigger;
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
     * Sets the retry budget written into new items.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 0.
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Sets the batch-size hint passed to the trigger.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &gt; 0.
     */
    public Builder triggerBatchSize(int triggerBatchSize) {
      this.triggerBatchSize = triggerBatchSize;
      return this;
    }

    /**
     * <p>Optional. Defaults to the UTC system clock.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public ChangeCapture build() {
      return new ChangeCapture(this);
    }
  }
}
