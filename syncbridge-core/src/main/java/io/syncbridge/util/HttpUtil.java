package io.syncbridge.util;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Builds and sends JSON requests with optional bearer authentication.
 */
public final class HttpUtil {

  private HttpUtil() {
  }

  public static HttpResponse<String> sendJson(HttpClient client, String method, String url, Object payload,
      String bearerToken, Duration timeout) throws IOException, InterruptedException {
    return client.send(request(method, url, payload, bearerToken, timeout), HttpResponse.BodyHandlers.ofString());
  }

  public static CompletableFuture<HttpResponse<String>> sendJsonAsync(HttpClient client, String method, String url,
      Object payload, String bearerToken, Duration timeout) {
    return client.sendAsync(request(method, url, payload, bearerToken, timeout), HttpResponse.BodyHandlers.ofString());
  }

  public static boolean isSuccess(int statusCode) {
    return statusCode >= 200 && statusCode < 300;
  }

  private static HttpRequest request(String method, String url, Object payload, String bearerToken,
      Duration timeout) {
    HttpRequest.Builder builder = HttpRequest.newBuilder().uri(URI.create(url));
    if (payload == null) {
      builder.method(method, HttpRequest.BodyPublishers.noBody());
    } else {
      builder.method(method, HttpRequest.BodyPublishers.ofString(Json.write(payload)));
      builder.header("Content-Type", "application/json");
    }
    if (bearerToken != null && !bearerToken.isBlank()) {
      builder.header("Authorization", "Bearer " + bearerToken);
    }
    if (timeout != null) {
      builder.timeout(timeout);
    }
    builder.header("Accept", "application/json");
    return builder.build();
  }
}
