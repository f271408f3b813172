package io.syncbridge.spi;

import io.syncbridge.DeliveryException;
import io.syncbridge.model.SyncConfig;
import io.syncbridge.model.SyncQueueItem;

import java.util.Map;

/**
 * Delivers one queue item to the external platform.
 *
 * @see io.syncbridge.platform.HttpWorkflowApiClient
 * @see io.syncbridge.platform.HttpDataApiClient
 */
public interface ExternalPlatformClient {

  /**
   * Sends the mapped payload of {@code item} to the target described by {@code config}.
   *
   * @param item          the claimed queue item
   * @param config        the item's sync config
   * @param mappedPayload payload after field renames
   * @return the response body, stored as the item's external response
   * @throws DeliveryException when the platform rejects the call or cannot be reached
   */
  String deliver(SyncQueueItem item, SyncConfig config, Map<String, Object> mappedPayload)
      throws DeliveryException;
}
