package io.syncbridge.spring.boot;

import io.syncbridge.api.ProcessQueueHandler;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP front for {@link ProcessQueueHandler}.
 *
 * <ul>
 *   <li>{@code POST /process-queue} with {@code {"action": "...", "payload": {"batchSize": N}}}</li>
 *   <li>{@code GET /process-queue/status}: the {@code get_status} view</li>
 * </ul>
 *
 * <p>Answers use the {@code {"success": ..., "data"|"error": ...}} envelope. Invalid input is
 * a 400, a missing or wrong bearer token (when one is configured) a 401, anything else a 500.
 */
@RestController
@RequestMapping("/process-queue")
public class ProcessQueueController {
  private static final Logger logger = Logger.getLogger(ProcessQueueController.class.getName());

  private final ProcessQueueHandler handler;
  private final String token;

  public ProcessQueueController(ProcessQueueHandler handler, String token) {
    this.handler = Objects.requireNonNull(handler, "handler");
    this.token = token == null || token.isBlank() ? null : token;
  }

  @PostMapping
  public ResponseEntity<Map<String, Object>> process(
      @RequestHeader(value = "Authorization", required = false) String authorization,
      @RequestBody(required = false) Map<String, Object> request) {
    if (!authorized(authorization)) {
      return unauthorized();
    }
    Object action = request == null ? null : request.get("action");
    Map<String, Object> payload = request == null ? null : payloadOf(request.get("payload"));
    return ResponseEntity.ok(handler.handle(action == null ? null : action.toString(), payload));
  }

  @GetMapping("/status")
  public ResponseEntity<Map<String, Object>> status(
      @RequestHeader(value = "Authorization", required = false) String authorization) {
    if (!authorized(authorization)) {
      return unauthorized();
    }
    return ResponseEntity.ok(handler.handle(ProcessQueueHandler.GET_STATUS, Map.of()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
    return ResponseEntity.badRequest().body(ProcessQueueHandler.errorBody(e.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<Map<String, Object>> failure(RuntimeException e) {
    logger.log(Level.SEVERE, "process-queue request failed", e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ProcessQueueHandler.errorBody(e.getMessage()));
  }

  private boolean authorized(String authorization) {
    return token == null || ("Bearer " + token).equals(authorization);
  }

  private static ResponseEntity<Map<String, Object>> unauthorized() {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ProcessQueueHandler.errorBody("Unauthorized"));
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> payloadOf(Object payload) {
    if (payload == null) {
      return null;
    }
    if (payload instanceof Map<?, ?>) {
      return (Map<String, Object>) payload;
    }
    throw new IllegalArgumentException("payload must be a JSON object");
  }
}
