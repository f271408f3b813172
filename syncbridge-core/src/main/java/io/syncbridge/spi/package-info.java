/**
 * Service provider interfaces: transaction and connection access, stores, external
 * delivery, triggers, alerts, step handlers and metrics.
 */
package io.syncbridge.spi;
