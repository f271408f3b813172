package io.syncbridge.platform;

import io.syncbridge.DeliveryException;
import io.syncbridge.model.SyncConfig;
import io.syncbridge.model.SyncQueueItem;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Delivers items through the platform's data API.
 *
 * <ul>
 *   <li>INSERT: {@code POST /obj/{type}}
 *   <li>UPDATE: {@code PATCH /obj/{type}/{_id}}, or {@code POST /obj/{type}} when the payload has no {@code _id}
 *   <li>DELETE: {@code DELETE /obj/{type}/{_id}}; fails without an {@code _id}
 *   <li>ATOMIC_COMPOSITE: {@code POST /wf/{targetEndpoint}} with the whole payload
 * </ul>
 *
 * <p>{@code type} is the config's target object type, falling back to its target endpoint.
 * The {@code _id} key identifies the external object and is never sent in the body.
 */
public final class HttpDataApiClient extends AbstractHttpPlatformClient {
  static final String EXTERNAL_ID = "_id";

  public HttpDataApiClient(String baseUrl, String apiKey) {
    this(HttpClient.newHttpClient(), baseUrl, apiKey, Duration.ofSeconds(30));
  }

  public HttpDataApiClient(HttpClient httpClient, String baseUrl, String apiKey, Duration requestTimeout) {
    super(httpClient, baseUrl, apiKey, requestTimeout);
  }

  @Override
  public String deliver(SyncQueueItem item, SyncConfig config, Map<String, Object> mappedPayload)
      throws DeliveryException {
    String type = config.targetObjectType() != null ? config.targetObjectType() : config.targetEndpoint();
    Object externalId = mappedPayload.get(EXTERNAL_ID);
    Map<String, Object> body = new LinkedHashMap<>(mappedPayload);
    body.remove(EXTERNAL_ID);

    return switch (item.operation()) {
      case INSERT -> send("POST", "/obj/" + type, body);
      case UPDATE -> externalId == null
          ? send("POST", "/obj/" + type, body)
          : send("PATCH", "/obj/" + type + "/" + externalId, body);
      case DELETE -> {
        if (externalId == null) {
          throw new DeliveryException("DELETE of " + item.tableName() + "/" + item.recordId()
              + " requires an " + EXTERNAL_ID + " in the payload", null);
        }
        yield send("DELETE", "/obj/" + type + "/" + externalId, null);
      }
      case ATOMIC_COMPOSITE -> send("POST", "/wf/" + config.targetEndpoint(), mappedPayload);
    };
  }
}
