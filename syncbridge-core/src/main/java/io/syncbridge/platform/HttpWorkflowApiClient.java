package io.syncbridge.platform;

import io.syncbridge.DeliveryException;
import io.syncbridge.model.SyncConfig;
import io.syncbridge.model.SyncQueueItem;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Delivers items through the platform's workflow API: {@code POST {baseUrl}/wf/{targetEndpoint}}
 * with body {@code {"_id": recordId, "operation": "INSERT|UPDATE|DELETE|ATOMIC_COMPOSITE", "data": {...}}}.
 */
public final class HttpWorkflowApiClient extends AbstractHttpPlatformClient {

  public HttpWorkflowApiClient(String baseUrl, String apiKey) {
    this(HttpClient.newHttpClient(), baseUrl, apiKey, Duration.ofSeconds(30));
  }

  public HttpWorkflowApiClient(HttpClient httpClient, String baseUrl, String apiKey, Duration requestTimeout) {
    super(httpClient, baseUrl, apiKey, requestTimeout);
  }

  @Override
  public String deliver(SyncQueueItem item, SyncConfig config, Map<String, Object> mappedPayload)
      throws DeliveryException {
    String workflow = config.targetEndpoint();
    if (workflow.isBlank() || workflow.contains(" ")) {
      throw new DeliveryException("Invalid workflow name '" + workflow + "' for table " + config.sourceTable(), null);
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("_id", item.recordId());
    body.put("operation", item.operation().name());
    body.put("data", mappedPayload);
    String response = send("POST", "/wf/" + workflow, body);
    // 204 No Content
    return response.isEmpty() ? "{\"success\":true,\"_id\":\"" + item.recordId() + "\"}" : response;
  }
}
