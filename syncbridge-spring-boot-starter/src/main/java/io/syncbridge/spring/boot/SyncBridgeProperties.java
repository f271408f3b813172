package io.syncbridge.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the sync bridge.
 *
 * @see SyncBridgeAutoConfiguration
 */
@ConfigurationProperties(prefix = "syncbridge")
public class SyncBridgeProperties {

    /**
     * Maximum delivery attempts for items captured by change capture.
     */
    private int maxRetries = 3;

    /**
     * How long sync configs are cached before being re-read.
     */
    private Duration configCacheTtl = Duration.ofSeconds(30);

    private final Processor processor = new Processor();
    private final Retry retry = new Retry();
    private final Sweep sweep = new Sweep();
    private final Purge purge = new Purge();
    private final Trigger trigger = new Trigger();
    private final Platform platform = new Platform();
    private final Alert alert = new Alert();
    private final Workflow workflow = new Workflow();
    private final Endpoint endpoint = new Endpoint();
    private final Metrics metrics = new Metrics();

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getConfigCacheTtl() {
        return configCacheTtl;
    }

    public void setConfigCacheTtl(Duration configCacheTtl) {
        this.configCacheTtl = configCacheTtl;
    }

    public Processor getProcessor() {
        return processor;
    }

    public Retry getRetry() {
        return retry;
    }

    public Sweep getSweep() {
        return sweep;
    }

    public Purge getPurge() {
        return purge;
    }

    public Trigger getTrigger() {
        return trigger;
    }

    public Platform getPlatform() {
        return platform;
    }

    public Alert getAlert() {
        return alert;
    }

    public Workflow getWorkflow() {
        return workflow;
    }

    public Endpoint getEndpoint() {
        return endpoint;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Processor {
        private int batchSize = 10;
        private int workerCount = 4;
        private long callTimeoutMs = 30_000;
        /**
         * Dead-letter HTTP 4xx answers on first failure instead of retrying them.
         */
        private boolean clientErrorsFatal = false;

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public long getCallTimeoutMs() {
            return callTimeoutMs;
        }

        public void setCallTimeoutMs(long callTimeoutMs) {
            this.callTimeoutMs = callTimeoutMs;
        }

        public boolean isClientErrorsFatal() {
            return clientErrorsFatal;
        }

        public void setClientErrorsFatal(boolean clientErrorsFatal) {
            this.clientErrorsFatal = clientErrorsFatal;
        }
    }

    public static class Retry {
        private long baseDelayMs = 60_000;
        private long maxDelayMs = 3_600_000;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Sweep {
        private boolean enabled = true;
        private long intervalMs = 60_000;
        private Duration visibilityTimeout = Duration.ofMinutes(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public Duration getVisibilityTimeout() {
            return visibilityTimeout;
        }

        public void setVisibilityTimeout(Duration visibilityTimeout) {
            this.visibilityTimeout = visibilityTimeout;
        }
    }

    public static class Purge {
        private boolean enabled = true;
        private Duration completedRetention = Duration.ofDays(7);
        private Duration failedRetention = Duration.ofDays(30);
        private int batchSize = 500;
        private long intervalSeconds = 3600;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getCompletedRetention() {
            return completedRetention;
        }

        public void setCompletedRetention(Duration completedRetention) {
            this.completedRetention = completedRetention;
        }

        public Duration getFailedRetention() {
            return failedRetention;
        }

        public void setFailedRetention(Duration failedRetention) {
            this.failedRetention = failedRetention;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }
    }

    public static class Trigger {
        private TriggerMode mode = TriggerMode.LOCAL;
        /**
         * Remote processor endpoint, required for {@code HTTP} mode.
         */
        private String url;
        private String token;

        public TriggerMode getMode() {
            return mode;
        }

        public void setMode(TriggerMode mode) {
            this.mode = mode;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }
    }

    public enum TriggerMode {
        LOCAL,
        HTTP,
        NONE
    }

    public static class Platform {
        private PlatformMode mode = PlatformMode.WORKFLOW;
        /**
         * External platform API root, e.g. {@code https://app.example.com/api/1.1}.
         */
        private String baseUrl;
        private String apiKey;

        public PlatformMode getMode() {
            return mode;
        }

        public void setMode(PlatformMode mode) {
            this.mode = mode;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }
    }

    public enum PlatformMode {
        WORKFLOW,
        DATA
    }

    public static class Alert {
        /**
         * Operator webhook; alerts are only logged when unset.
         */
        private String webhookUrl;

        public String getWebhookUrl() {
            return webhookUrl;
        }

        public void setWebhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
        }
    }

    public static class Workflow {
        private boolean enabled = true;
        private boolean autoStart = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }
    }

    public static class Endpoint {
        private boolean enabled = true;
        /**
         * Bearer token callers of {@code /process-queue} must present; open when unset.
         */
        private String token;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "syncbridge";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
