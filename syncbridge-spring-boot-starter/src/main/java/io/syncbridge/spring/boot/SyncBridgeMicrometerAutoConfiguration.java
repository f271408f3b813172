package io.syncbridge.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.syncbridge.micrometer.MicrometerMetricsExporter;
import io.syncbridge.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Registers a {@link MicrometerMetricsExporter} when a {@link MeterRegistry} is present and
 * {@code syncbridge.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link SyncBridgeAutoConfiguration} so the exporter is picked up by the
 * composite.
 */
@AutoConfiguration(before = SyncBridgeAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "syncbridge.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(SyncBridgeProperties.class)
public class SyncBridgeMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(MeterRegistry meterRegistry, SyncBridgeProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
