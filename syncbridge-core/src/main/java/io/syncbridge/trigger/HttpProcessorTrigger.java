package io.syncbridge.trigger;

import io.syncbridge.spi.MetricsExporter;
import io.syncbridge.spi.ProcessorTrigger;
import io.syncbridge.util.HttpUtil;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fires {@code POST /process-queue} at a remote processor endpoint without waiting for the answer.
 *
 * <p>Body: {@code {"action": "process_queue", "payload": {"batchSize": N}}}. Transport errors and
 * non-2xx answers arrive after {@link #fire} has returned; both count as trigger failures.
 */
public final class HttpProcessorTrigger implements ProcessorTrigger {
  private static final Logger logger = Logger.getLogger(HttpProcessorTrigger.class.getName());

  private final HttpClient httpClient;
  private final String endpointUrl;
  private final String bearerToken;
  private final Duration timeout;
  private final MetricsExporter metrics;

  public HttpProcessorTrigger(String endpointUrl, String bearerToken) {
    this(endpointUrl, bearerToken, MetricsExporter.NOOP);
  }

  public HttpProcessorTrigger(String endpointUrl, String bearerToken, MetricsExporter metrics) {
    this(HttpClient.newHttpClient(), endpointUrl, bearerToken, Duration.ofSeconds(10), metrics);
  }

  public HttpProcessorTrigger(HttpClient httpClient, String endpointUrl, String bearerToken, Duration timeout) {
    this(httpClient, endpointUrl, bearerToken, timeout, MetricsExporter.NOOP);
  }

  public HttpProcessorTrigger(HttpClient httpClient, String endpointUrl, String bearerToken, Duration timeout,
      MetricsExporter metrics) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.endpointUrl = Objects.requireNonNull(endpointUrl, "endpointUrl");
    this.bearerToken = bearerToken;
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  @Override
  public void fire(int batchSize) {
    Map<String, Object> body = Map.of(
        "action", "process_queue",
        "payload", Map.of("batchSize", batchSize));
    HttpUtil.sendJsonAsync(httpClient, "POST", endpointUrl, body, bearerToken, timeout)
        .whenComplete((response, error) -> {
          if (error != null) {
            metrics.incrementTriggerFailed();
            logger.log(Level.WARNING, "Processor trigger to " + endpointUrl + " failed", error);
          } else if (!HttpUtil.isSuccess(response.statusCode())) {
            metrics.incrementTriggerFailed();
            logger.log(Level.WARNING, "Processor trigger to {0} returned HTTP {1}",
                new Object[]{endpointUrl, response.statusCode()});
          }
        });
  }
}
