/**
 * Change capture and the {@link io.syncbridge.SyncBridge} composite.
 *
 * <p>{@link io.syncbridge.ChangeCapture} writes queue items in the caller's transaction;
 * everything downstream of the queue table runs outside it.
 */
package io.syncbridge;
