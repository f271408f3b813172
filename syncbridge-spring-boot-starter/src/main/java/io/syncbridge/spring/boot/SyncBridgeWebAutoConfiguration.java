package io.syncbridge.spring.boot;

import io.syncbridge.api.ProcessQueueHandler;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.web.bind.annotation.RestController;

/**
 * Exposes {@link ProcessQueueController} in servlet web applications when
 * {@code syncbridge.endpoint.enabled} is true (default).
 */
@AutoConfiguration(after = SyncBridgeAutoConfiguration.class)
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnClass(RestController.class)
@ConditionalOnBean(ProcessQueueHandler.class)
@ConditionalOnProperty(prefix = "syncbridge.endpoint", name = "enabled", matchIfMissing = true)
public class SyncBridgeWebAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public ProcessQueueController processQueueController(ProcessQueueHandler handler, SyncBridgeProperties props) {
    return new ProcessQueueController(handler, props.getEndpoint().getToken());
  }
}
