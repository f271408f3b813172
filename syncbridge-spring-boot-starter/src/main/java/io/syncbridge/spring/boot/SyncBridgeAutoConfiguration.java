package io.syncbridge.spring.boot;

import io.syncbridge.ChangeCapture;
import io.syncbridge.SyncBridge;
import io.syncbridge.alert.LoggingAlertNotifier;
import io.syncbridge.alert.WebhookAlertNotifier;
import io.syncbridge.api.ProcessQueueHandler;
import io.syncbridge.api.QueueMonitor;
import io.syncbridge.dead.DeadLetterManager;
import io.syncbridge.dispatch.ExponentialBackoffRetryPolicy;
import io.syncbridge.dispatch.FailureClassifier;
import io.syncbridge.jdbc.DataSourceConnectionProvider;
import io.syncbridge.jdbc.purge.JdbcQueuePurger;
import io.syncbridge.jdbc.store.AbstractJdbcSyncQueueStore;
import io.syncbridge.jdbc.store.JdbcDeadLetterStore;
import io.syncbridge.jdbc.store.JdbcSyncConfigStore;
import io.syncbridge.jdbc.store.JdbcSyncStores;
import io.syncbridge.jdbc.workflow.JdbcWorkflowDefinitionStore;
import io.syncbridge.jdbc.workflow.JdbcWorkflowExecutionStore;
import io.syncbridge.platform.HttpDataApiClient;
import io.syncbridge.platform.HttpWorkflowApiClient;
import io.syncbridge.spi.AlertNotifier;
import io.syncbridge.spi.ConnectionProvider;
import io.syncbridge.spi.DeadLetterStore;
import io.syncbridge.spi.ExternalPlatformClient;
import io.syncbridge.spi.MetricsExporter;
import io.syncbridge.spi.ProcessorTrigger;
import io.syncbridge.spi.SyncConfigStore;
import io.syncbridge.spi.TxContext;
import io.syncbridge.spring.SpringTxContext;
import io.syncbridge.trigger.HttpProcessorTrigger;
import io.syncbridge.workflow.StepHandlerRegistry;
import io.syncbridge.workflow.WorkflowDefinitionRegistry;
import io.syncbridge.workflow.WorkflowEngine;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * Auto-configuration for the sync bridge.
 *
 * <p>Builds a {@link SyncBridge} from the application {@link DataSource}: the queue store is
 * detected from the JDBC URL, change capture joins Spring transactions through
 * {@link SpringTxContext}, and the external platform client is created from
 * {@code syncbridge.platform.*} unless an {@link ExternalPlatformClient} bean is supplied.
 * Beans for the composite's parts ({@link ChangeCapture}, {@link ProcessQueueHandler},
 * {@link QueueMonitor}, {@link DeadLetterManager}, the workflow engine) are exposed for injection.
 *
 * @see SyncBridgeProperties
 * @see SyncBridgeMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(SyncBridge.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(SyncBridgeProperties.class)
public class SyncBridgeAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public AbstractJdbcSyncQueueStore syncQueueStore(DataSource dataSource) {
        return JdbcSyncStores.detect(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(SyncConfigStore.class)
    public JdbcSyncConfigStore syncConfigStore() {
        return new JdbcSyncConfigStore();
    }

    @Bean
    @ConditionalOnMissingBean(DeadLetterStore.class)
    public JdbcDeadLetterStore deadLetterStore() {
        return new JdbcDeadLetterStore();
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(TxContext.class)
    public SpringTxContext txContext(DataSource dataSource) {
        return new SpringTxContext(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "syncbridge.platform", name = "base-url")
    public ExternalPlatformClient externalPlatformClient(SyncBridgeProperties props) {
        SyncBridgeProperties.Platform platform = props.getPlatform();
        return switch (platform.getMode()) {
            case WORKFLOW -> new HttpWorkflowApiClient(platform.getBaseUrl(), platform.getApiKey());
            case DATA -> new HttpDataApiClient(platform.getBaseUrl(), platform.getApiKey());
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertNotifier alertNotifier(SyncBridgeProperties props) {
        String webhookUrl = props.getAlert().getWebhookUrl();
        if (webhookUrl != null && !webhookUrl.isBlank()) {
            return new WebhookAlertNotifier(webhookUrl);
        }
        return new LoggingAlertNotifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public StepHandlerRegistry stepHandlerRegistry() {
        return new StepHandlerRegistry();
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnBean(ExternalPlatformClient.class)
    public SyncBridge syncBridge(SyncBridgeProperties props,
                                 ConnectionProvider connectionProvider,
                                 TxContext txContext,
                                 SyncConfigStore configStore,
                                 AbstractJdbcSyncQueueStore queueStore,
                                 DeadLetterStore deadLetterStore,
                                 ExternalPlatformClient client,
                                 AlertNotifier alertNotifier,
                                 StepHandlerRegistry stepHandlers,
                                 ObjectProvider<MetricsExporter> metricsProvider) {
        SyncBridgeProperties.Processor processor = props.getProcessor();
        SyncBridge.Builder builder = SyncBridge.builder()
                .connectionProvider(connectionProvider)
                .txContext(txContext)
                .configStore(configStore)
                .queueStore(queueStore)
                .deadLetterStore(deadLetterStore)
                .client(client)
                .alertNotifier(alertNotifier)
                .retryPolicy(new ExponentialBackoffRetryPolicy(
                        props.getRetry().getBaseDelayMs(), props.getRetry().getMaxDelayMs()))
                .failureClassifier(processor.isClientErrorsFatal()
                        ? FailureClassifier.CLIENT_ERRORS_FATAL : FailureClassifier.RETRY_ALL)
                .workerCount(processor.getWorkerCount())
                .callTimeout(Duration.ofMillis(processor.getCallTimeoutMs()))
                .batchSize(processor.getBatchSize())
                .maxRetries(props.getMaxRetries())
                .configCacheTtl(props.getConfigCacheTtl())
                .sweepEnabled(props.getSweep().isEnabled())
                .sweepIntervalMs(props.getSweep().getIntervalMs())
                .visibilityTimeout(props.getSweep().getVisibilityTimeout());

        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }

        SyncBridgeProperties.Trigger trigger = props.getTrigger();
        switch (trigger.getMode()) {
            case HTTP -> {
                if (trigger.getUrl() == null || trigger.getUrl().isBlank()) {
                    throw new IllegalStateException("syncbridge.trigger.url is required for HTTP trigger mode");
                }
                builder.trigger(new HttpProcessorTrigger(trigger.getUrl(), trigger.getToken(), metrics));
            }
            case NONE -> builder.trigger(ProcessorTrigger.NONE);
            case LOCAL -> {
            }
        }

        if (props.getPurge().isEnabled()) {
            builder.purger(new JdbcQueuePurger())
                    .finishedRetention(props.getPurge().getCompletedRetention())
                    .failedRetention(props.getPurge().getFailedRetention())
                    .purgeBatchSize(props.getPurge().getBatchSize())
                    .purgeIntervalSeconds(props.getPurge().getIntervalSeconds());
        }

        if (props.getWorkflow().isEnabled()) {
            builder.workflowStores(new JdbcWorkflowDefinitionStore(), new JdbcWorkflowExecutionStore())
                    .stepHandlers(stepHandlers)
                    .workflowAutoStart(props.getWorkflow().isAutoStart());
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnBean(SyncBridge.class)
    @ConditionalOnMissingBean
    public ChangeCapture changeCapture(SyncBridge syncBridge) {
        return syncBridge.capture();
    }

    @Bean
    @ConditionalOnBean(SyncBridge.class)
    @ConditionalOnMissingBean
    public ProcessQueueHandler processQueueHandler(SyncBridge syncBridge) {
        return syncBridge.handler();
    }

    @Bean
    @ConditionalOnBean(SyncBridge.class)
    @ConditionalOnMissingBean
    public QueueMonitor queueMonitor(SyncBridge syncBridge) {
        return syncBridge.monitor();
    }

    @Bean
    @ConditionalOnBean(SyncBridge.class)
    @ConditionalOnMissingBean
    public DeadLetterManager deadLetterManager(SyncBridge syncBridge) {
        return syncBridge.deadLetters();
    }

    /** Closed together with the {@link SyncBridge}. */
    @Bean(destroyMethod = "")
    @ConditionalOnBean(SyncBridge.class)
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "syncbridge.workflow", name = "enabled", matchIfMissing = true)
    public WorkflowEngine workflowEngine(SyncBridge syncBridge) {
        return syncBridge.workflowEngine();
    }

    @Bean
    @ConditionalOnBean(SyncBridge.class)
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "syncbridge.workflow", name = "enabled", matchIfMissing = true)
    public WorkflowDefinitionRegistry workflowDefinitionRegistry(SyncBridge syncBridge) {
        return syncBridge.workflowDefinitions();
    }
}
