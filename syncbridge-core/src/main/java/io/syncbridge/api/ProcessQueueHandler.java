package io.syncbridge.api;

import io.syncbridge.dispatch.GroupOutcome;
import io.syncbridge.dispatch.ProcessingReport;
import io.syncbridge.dispatch.QueueProcessor;
import io.syncbridge.model.QueueStats;
import io.syncbridge.model.StatusTableCount;
import io.syncbridge.purge.QueuePurgeScheduler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes {@code {action, payload}} requests of the {@code process-queue} endpoint.
 *
 * <p>Actions:
 * <ul>
 *   <li>{@code process_queue} runs {@link QueueProcessor#process} with {@code payload.batchSize};</li>
 *   <li>{@code retry_failed} runs {@link QueueProcessor#retryFailed};</li>
 *   <li>{@code get_status} returns the monitoring view;</li>
 *   <li>{@code cleanup} runs one purge cycle.</li>
 * </ul>
 *
 * <p>Successful calls return {@code {success: true, data: {...}}}. Transports map
 * {@link IllegalArgumentException} to HTTP 400 and everything else to 500, both with
 * {@link #errorBody}.
 */
public final class ProcessQueueHandler {
  private static final Logger logger = Logger.getLogger(ProcessQueueHandler.class.getName());

  public static final String PROCESS_QUEUE = "process_queue";
  public static final String RETRY_FAILED = "retry_failed";
  public static final String GET_STATUS = "get_status";
  public static final String CLEANUP = "cleanup";
  public static final List<String> ACTIONS = List.of(PROCESS_QUEUE, RETRY_FAILED, GET_STATUS, CLEANUP);

  public static final int DEFAULT_BATCH_SIZE = 10;
  public static final int MAX_BATCH_SIZE = 500;

  private final QueueProcessor processor;
  private final QueueMonitor monitor;
  private final QueuePurgeScheduler purgeScheduler;

  /**
   * @param purgeScheduler used by {@code cleanup}; may be {@code null}, in which case the action fails
   */
  public ProcessQueueHandler(QueueProcessor processor, QueueMonitor monitor, QueuePurgeScheduler purgeScheduler) {
    this.processor = Objects.requireNonNull(processor, "processor");
    this.monitor = Objects.requireNonNull(monitor, "monitor");
    this.purgeScheduler = purgeScheduler;
  }

  /**
   * @throws IllegalArgumentException for an unknown action or an invalid batch size
   */
  public Map<String, Object> handle(String action, Map<String, Object> payload) {
    if (action == null || !ACTIONS.contains(action)) {
      throw new IllegalArgumentException("Invalid action. Allowed: " + String.join(", ", ACTIONS));
    }
    Map<String, Object> params = payload == null ? Map.of() : payload;
    logger.log(Level.FINE, "Handling {0} with {1}", new Object[]{action, params});

    Map<String, Object> data = switch (action) {
      case PROCESS_QUEUE -> reportBody(processor.process(batchSize(params)));
      case RETRY_FAILED -> reportBody(processor.retryFailed(batchSize(params)));
      case GET_STATUS -> statusBody(monitor.stats(), monitor.countsByStatusAndTable());
      case CLEANUP -> cleanupBody();
      default -> throw new IllegalArgumentException("Unhandled action: " + action);
    };
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", true);
    body.put("data", data);
    return body;
  }

  /** Failure body shared by every transport. */
  public static Map<String, Object> errorBody(String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", false);
    body.put("error", message != null ? message : "Unknown error occurred");
    return body;
  }

  static int batchSize(Map<String, Object> params) {
    Object value = params.get("batchSize");
    if (value == null) {
      return DEFAULT_BATCH_SIZE;
    }
    int batchSize;
    if (value instanceof Number number) {
      batchSize = number.intValue();
    } else {
      try {
        batchSize = Integer.parseInt(value.toString().trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("batchSize must be an integer: " + value, e);
      }
    }
    if (batchSize <= 0 || batchSize > MAX_BATCH_SIZE) {
      throw new IllegalArgumentException("batchSize must be between 1 and " + MAX_BATCH_SIZE + ": " + batchSize);
    }
    return batchSize;
  }

  private Map<String, Object> cleanupBody() {
    if (purgeScheduler == null) {
      throw new IllegalStateException("Queue purge is not configured");
    }
    QueuePurgeScheduler.PurgeResult result = purgeScheduler.runOnce();
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("deletedFinished", result.finished());
    data.put("deletedFailed", result.exhausted());
    return data;
  }

  static Map<String, Object> reportBody(ProcessingReport report) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("processed", report.processed());
    data.put("succeeded", report.succeeded());
    data.put("failed", report.failed());
    data.put("skipped", report.skipped());
    data.put("deadLettered", report.deadLettered());
    if (!report.groups().isEmpty()) {
      List<Map<String, Object>> groups = new ArrayList<>();
      for (GroupOutcome outcome : report.groups()) {
        Map<String, Object> group = new LinkedHashMap<>();
        group.put("correlationId", outcome.correlationId());
        group.put("policy", outcome.policy().name());
        group.put("completed", outcome.completed());
        group.put("failed", outcome.failed());
        group.put("skipped", outcome.skipped());
        group.put("errors", outcome.errors());
        groups.add(group);
      }
      data.put("groups", groups);
    }
    return data;
  }

  static Map<String, Object> statusBody(QueueStats stats, List<StatusTableCount> counts) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("pending", stats.pending());
    data.put("processing", stats.processing());
    data.put("retryable", stats.retryable());
    data.put("deadLettered", stats.deadLettered());
    data.put("completedLastHour", stats.completedLastHour());
    data.put("failedLastHour", stats.failedLastHour());
    List<Map<String, Object>> byTable = new ArrayList<>();
    for (StatusTableCount count : counts) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("status", count.status().code());
      row.put("tableName", count.tableName());
      row.put("count", count.count());
      byTable.add(row);
    }
    data.put("byStatusAndTable", byTable);
    return data;
  }
}
