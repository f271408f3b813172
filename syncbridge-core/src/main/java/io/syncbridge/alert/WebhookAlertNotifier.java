package io.syncbridge.alert;

import io.syncbridge.spi.AlertNotifier;
import io.syncbridge.util.HttpUtil;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Posts alerts as JSON to an operator webhook (chat incoming-webhook compatible:
 * the {@code text} field holds the summary).
 *
 * <p>Delivery is asynchronous; failures are logged and dropped.
 */
public final class WebhookAlertNotifier implements AlertNotifier {
  private static final Logger logger = Logger.getLogger(WebhookAlertNotifier.class.getName());

  private final HttpClient httpClient;
  private final String webhookUrl;
  private final Duration timeout;

  public WebhookAlertNotifier(String webhookUrl) {
    this(HttpClient.newHttpClient(), webhookUrl, Duration.ofSeconds(10));
  }

  public WebhookAlertNotifier(HttpClient httpClient, String webhookUrl, Duration timeout) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.webhookUrl = Objects.requireNonNull(webhookUrl, "webhookUrl");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  @Override
  public void notify(Alert alert) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("text", alert.summary());
    body.put("kind", alert.kind().name());
    body.put("subject", alert.subject());
    body.put("reference", alert.reference());
    body.put("message", alert.message());
    body.put("occurredAt", alert.occurredAt().toString());
    try {
      HttpUtil.sendJsonAsync(httpClient, "POST", webhookUrl, body, null, timeout)
          .whenComplete((response, error) -> {
            if (error != null) {
              logger.log(Level.WARNING, "Alert webhook delivery failed: " + alert.summary(), error);
            } else if (!HttpUtil.isSuccess(response.statusCode())) {
              logger.log(Level.WARNING, "Alert webhook returned HTTP {0} for {1}",
                  new Object[]{response.statusCode(), alert.summary()});
            }
          });
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Alert webhook request could not be sent: " + alert.summary(), e);
    }
  }
}
