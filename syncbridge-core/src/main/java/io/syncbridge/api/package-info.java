/**
 * Transport-neutral operator surface: the {@code process-queue} action router and the queue monitor.
 */
package io.syncbridge.api;
