package io.syncbridge.platform;

import io.syncbridge.DeliveryException;
import io.syncbridge.spi.ExternalPlatformClient;
import io.syncbridge.util.HttpUtil;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * Shared HTTP plumbing for the external platform APIs: bearer authentication, JSON bodies,
 * and the mapping of non-2xx answers to {@link DeliveryException} with the verbatim body.
 */
public abstract class AbstractHttpPlatformClient implements ExternalPlatformClient {
  private final HttpClient httpClient;
  private final String baseUrl;
  private final String apiKey;
  private final Duration requestTimeout;

  protected AbstractHttpPlatformClient(HttpClient httpClient, String baseUrl, String apiKey, Duration requestTimeout) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    Objects.requireNonNull(baseUrl, "baseUrl");
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.apiKey = apiKey;
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
  }

  protected String baseUrl() {
    return baseUrl;
  }

  /**
   * Sends a request and returns the response body ({@code ""} for empty answers).
   *
   * @throws DeliveryException on a non-2xx status, an I/O failure or interruption
   */
  protected String send(String method, String path, Object body) throws DeliveryException {
    HttpResponse<String> response;
    try {
      response = HttpUtil.sendJson(httpClient, method, baseUrl + path, body, apiKey, requestTimeout);
    } catch (IOException e) {
      throw new DeliveryException(method + " " + path + " failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DeliveryException(method + " " + path + " interrupted", e);
    }
    if (!HttpUtil.isSuccess(response.statusCode())) {
      throw new DeliveryException(response.statusCode(), response.body());
    }
    return response.body() == null ? "" : response.body();
  }
}
