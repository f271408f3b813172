package io.syncbridge.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.syncbridge.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsExporter} backed by a Micrometer {@link MeterRegistry}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code syncbridge.enqueue}: queue rows written by change capture</li>
 *   <li>{@code syncbridge.dispatch.success}: items delivered</li>
 *   <li>{@code syncbridge.dispatch.failure}: failed attempts that will be retried</li>
 *   <li>{@code syncbridge.dispatch.dead}: items dead-lettered</li>
 *   <li>{@code syncbridge.dispatch.skipped}: items skipped (no config, group aborted)</li>
 *   <li>{@code syncbridge.trigger.failed}: processor triggers that could not be fired</li>
 *   <li>{@code syncbridge.workflow.completed} / {@code syncbridge.workflow.failed}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code syncbridge.queue.due}: due items seen by the last sweep</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code syncbridge.call.duration.ms}: external platform call time</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter enqueued;
    private final Counter dispatchSuccess;
    private final Counter dispatchFailure;
    private final Counter dispatchDead;
    private final Counter dispatchSkipped;
    private final Counter triggerFailed;
    private final Counter workflowCompleted;
    private final Counter workflowFailed;
    private final Gauge dueGauge;
    private final DistributionSummary callDuration;

    private final AtomicLong dueItems = new AtomicLong();
    private volatile boolean closed;

    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "syncbridge");
    }

    /**
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "listings.sync"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty() || namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must be non-empty and not end with '.': " + namePrefix);
        }

        this.registry = registry;
        this.enqueued = counter(namePrefix + ".enqueue", "Queue rows written by change capture");
        this.dispatchSuccess = counter(namePrefix + ".dispatch.success", "Items delivered to the external platform");
        this.dispatchFailure = counter(namePrefix + ".dispatch.failure", "Failed attempts scheduled for retry");
        this.dispatchDead = counter(namePrefix + ".dispatch.dead", "Items moved to the dead-letter archive");
        this.dispatchSkipped = counter(namePrefix + ".dispatch.skipped", "Items skipped without delivery");
        this.triggerFailed = counter(namePrefix + ".trigger.failed", "Processor triggers that failed to fire");
        this.workflowCompleted = counter(namePrefix + ".workflow.completed", "Workflow executions completed");
        this.workflowFailed = counter(namePrefix + ".workflow.failed", "Workflow executions failed");

        this.dueGauge = Gauge.builder(namePrefix + ".queue.due", dueItems, AtomicLong::get)
                .description("Due queue items seen by the last sweep")
                .register(registry);
        this.callDuration = DistributionSummary.builder(namePrefix + ".call.duration.ms")
                .description("External platform call time in milliseconds")
                .register(registry);
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name).description(description).register(registry);
    }

    @Override
    public void incrementEnqueued() {
        if (closed) return;
        enqueued.increment();
    }

    @Override
    public void incrementDispatchSuccess() {
        if (closed) return;
        dispatchSuccess.increment();
    }

    @Override
    public void incrementDispatchFailure() {
        if (closed) return;
        dispatchFailure.increment();
    }

    @Override
    public void incrementDispatchDead() {
        if (closed) return;
        dispatchDead.increment();
    }

    @Override
    public void incrementDispatchSkipped() {
        if (closed) return;
        dispatchSkipped.increment();
    }

    @Override
    public void incrementTriggerFailed() {
        if (closed) return;
        triggerFailed.increment();
    }

    @Override
    public void incrementWorkflowCompleted() {
        if (closed) return;
        workflowCompleted.increment();
    }

    @Override
    public void incrementWorkflowFailed() {
        if (closed) return;
        workflowFailed.increment();
    }

    @Override
    public void recordDueItems(long count) {
        if (closed) return;
        dueItems.set(count);
    }

    @Override
    public void recordCallDurationMs(long durationMs) {
        if (closed) return;
        callDuration.record(durationMs);
    }

    /**
     * Removes every meter this exporter registered. Later calls are ignored.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(enqueued, dispatchSuccess, dispatchFailure, dispatchDead, dispatchSkipped,
                triggerFailed, workflowCompleted, workflowFailed, dueGauge, callDuration)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
