package io.syncbridge.dispatch;

import io.syncbridge.DeliveryException;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class FailureClassifierTest {
  private final DeliveryException badRequest = new DeliveryException(400, "{\"message\":\"unknown field\"}");
  private final DeliveryException serverError = new DeliveryException(503, "");
  private final DeliveryException network = new DeliveryException("POST /wf/listing failed", new IOException("reset"));

  @Test
  void retryAllRetriesEverything() {
    assertTrue(FailureClassifier.RETRY_ALL.isRetryable(badRequest));
    assertTrue(FailureClassifier.RETRY_ALL.isRetryable(serverError));
    assertTrue(FailureClassifier.RETRY_ALL.isRetryable(network));
  }

  @Test
  void clientErrorsFatalStopsOn4xx() {
    assertFalse(FailureClassifier.CLIENT_ERRORS_FATAL.isRetryable(badRequest));
    assertTrue(FailureClassifier.CLIENT_ERRORS_FATAL.isRetryable(serverError));
    assertTrue(FailureClassifier.CLIENT_ERRORS_FATAL.isRetryable(network));
  }

  @Test
  void deliveryExceptionKeepsStatusAndBody() {
    assertEquals("External platform returned HTTP 400", badRequest.getMessage());
    assertEquals(400, badRequest.statusCode());
    assertTrue(badRequest.hasStatus());
    assertEquals("{\"message\":\"unknown field\"}", badRequest.responseBody());
    assertFalse(network.hasStatus());
    assertFalse(network.isClientError());
  }
}
