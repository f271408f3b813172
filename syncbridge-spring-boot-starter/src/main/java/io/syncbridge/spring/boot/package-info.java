/**
 * Spring Boot auto-configuration for the sync bridge: properties under {@code syncbridge.*},
 * the {@link io.syncbridge.SyncBridge} composite, Micrometer metrics and the
 * {@code /process-queue} endpoint.
 */
package io.syncbridge.spring.boot;
