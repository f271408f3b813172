package io.syncbridge.spi;

import java.sql.Connection;
import java.time.Instant;

/**
 * Deletes old terminal queue rows in bounded batches.
 */
public interface QueuePurger {

    /**
     * Deletes up to {@code limit} {@code completed} or {@code skipped} items processed before {@code before}.
     *
     * @return rows deleted
     */
    int purgeFinished(Connection conn, Instant before, int limit);

    /**
     * Deletes up to {@code limit} exhausted {@code failed} items last processed before {@code before}.
     *
     * @return rows deleted
     */
    int purgeExhausted(Connection conn, Instant before, int limit);
}
