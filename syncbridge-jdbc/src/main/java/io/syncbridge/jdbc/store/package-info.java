/**
 * JDBC implementations of the queue, config and dead-letter SPIs.
 *
 * <p>{@link io.syncbridge.jdbc.store.AbstractJdbcSyncQueueStore} holds the shared SQL;
 * {@link io.syncbridge.jdbc.store.PostgresSyncQueueStore} replaces the writes with
 * {@code ON CONFLICT} upserts.
 *
 * @see io.syncbridge.jdbc.store.JdbcSyncStores
 */
package io.syncbridge.jdbc.store;
