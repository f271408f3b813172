package io.syncbridge.alert;

import io.syncbridge.platform.StubHttpServer;
import io.syncbridge.util.Json;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WebhookAlertNotifierTest {

  @Test
  void postsAlertAsJson() throws Exception {
    try (StubHttpServer server = new StubHttpServer()) {
      WebhookAlertNotifier notifier = new WebhookAlertNotifier(server.baseUrl() + "/hooks/ops");

      notifier.notify(Alert.deadLetter("listings", "l1", "External platform returned HTTP 500"));

      assertTrue(server.awaitRequest(5_000));
      Map<String, Object> body = Json.readMap(server.last().body());
      assertEquals("[DEAD_LETTER] listings/l1: External platform returned HTTP 500", body.get("text"));
      assertEquals("DEAD_LETTER", body.get("kind"));
      assertEquals("listings", body.get("subject"));
      assertEquals("l1", body.get("reference"));
    }
  }

  @Test
  void failingWebhookIsContained() throws Exception {
    try (StubHttpServer server = new StubHttpServer().respond(503, "down")) {
      WebhookAlertNotifier notifier = new WebhookAlertNotifier(server.baseUrl());

      assertDoesNotThrow(() -> notifier.notify(Alert.workflowFailed("proposal_accepted", "ex-1", "timeout")));
      assertTrue(server.awaitRequest(5_000));
    }
  }

  @Test
  void loggingNotifierAcceptsAnyAlert() {
    assertDoesNotThrow(() -> new LoggingAlertNotifier().notify(Alert.deadLetter("t", "r", null)));
  }
}
