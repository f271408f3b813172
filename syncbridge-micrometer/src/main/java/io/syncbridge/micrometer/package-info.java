/**
 * Micrometer bridge for the {@link io.syncbridge.spi.MetricsExporter} SPI.
 */
package io.syncbridge.micrometer;
