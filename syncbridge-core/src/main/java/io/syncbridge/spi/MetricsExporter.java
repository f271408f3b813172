package io.syncbridge.spi;

/**
 * Observability hook for exporting sync counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything.
 */
public interface MetricsExporter {

    MetricsExporter NOOP = new Noop();

    /** A queue row was written by change capture. */
    void incrementEnqueued();

    void incrementDispatchSuccess();

    /** An attempt failed and the item will be retried. */
    void incrementDispatchFailure();

    /** An item exhausted its retries and was dead-lettered. */
    void incrementDispatchDead();

    void incrementDispatchSkipped();

    /** The immediate processor trigger could not be fired. */
    void incrementTriggerFailed();

    default void incrementWorkflowCompleted() {
    }

    default void incrementWorkflowFailed() {
    }

    /**
     * Records the number of due items seen by the last sweep.
     */
    void recordDueItems(long count);

    /**
     * Records the duration of one external call.
     */
    default void recordCallDurationMs(long durationMs) {
    }

    final class Noop implements MetricsExporter {
        @Override
        public void incrementEnqueued() {
        }

        @Override
        public void incrementDispatchSuccess() {
        }

        @Override
        public void incrementDispatchFailure() {
        }

        @Override
        public void incrementDispatchDead() {
        }

        @Override
        public void incrementDispatchSkipped() {
        }

        @Override
        public void incrementTriggerFailed() {
        }

        @Override
        public void recordDueItems(long count) {
        }
    }
}
