package io.syncbridge.workflow;

import io.syncbridge.alert.Alert;
import io.syncbridge.alert.LoggingAlertNotifier;
import io.syncbridge.dispatch.ExponentialBackoffRetryPolicy;
import io.syncbridge.dispatch.RetryPolicy;
import io.syncbridge.spi.AlertNotifier;
import io.syncbridge.spi.ConnectionProvider;
import io.syncbridge.spi.MetricsExporter;
import io.syncbridge.spi.StepHandler;
import io.syncbridge.spi.WorkflowDefinitionStore;
import io.syncbridge.spi.WorkflowExecutionStore;
import io.syncbridge.util.DaemonThreadFactory;
import io.syncbridge.util.Ids;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes workflow definitions step by step.
 *
 * <p>{@link #enqueueWorkflow} validates the request synchronously and stores a {@code pending}
 * execution pinned to the definition's current version. {@link #runExecution} claims it with a
 * lease ({@code pending -> running}), then runs the remaining steps: render the step template
 * from the input and the accumulated context, invoke the {@link StepHandler} registered for the
 * step's target function under a timeout, and store the output in the context under the step
 * name. Progress is persisted after every step, so a crashed run resumes at the next step once
 * its lease expires. A lease never ends before the step timeout (plus {@link #LEASE_MARGIN}) has
 * elapsed, whatever the definition's visibility timeout says.
 *
 * <p>A failed step follows its {@link FailurePolicy}. {@code RETRY} keeps the execution
 * {@code running} and hides it until the backoff elapses; the sweep ({@link #runDue}) picks it up
 * again. Cancellation is observed before every step; side effects of finished steps stay.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class WorkflowEngine implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(WorkflowEngine.class.getName());

  /** Context key marking a step that failed under {@link FailurePolicy#CONTINUE}. */
  public static final String FAILED_MARKER = "_failed";
  /** Context key holding the error of a failed step. */
  public static final String ERROR_KEY = "_error";
  /** Slack added to the step timeout when it outlasts the visibility timeout. */
  public static final Duration LEASE_MARGIN = Duration.ofSeconds(5);

  private final ConnectionProvider connectionProvider;
  private final WorkflowDefinitionStore definitionStore;
  private final WorkflowExecutionStore executionStore;
  private final StepHandlerRegistry stepHandlers;
  private final RetryPolicy retryPolicy;
  private final AlertNotifier alertNotifier;
  private final MetricsExporter metrics;
  private final Duration stepTimeout;
  private final boolean autoStart;
  private final Clock clock;
  private final ExecutorService runner;
  private final ExecutorService calls;

  private WorkflowEngine(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.definitionStore = Objects.requireNonNull(builder.definitionStore, "definitionStore");
    this.executionStore = Objects.requireNonNull(builder.executionStore, "executionStore");
    this.stepHandlers = Objects.requireNonNull(builder.stepHandlers, "stepHandlers");
    if (builder.stepTimeout == null || builder.stepTimeout.isNegative() || builder.stepTimeout.isZero()) {
      throw new IllegalArgumentException("stepTimeout must be positive");
    }
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(5_000, 300_000);
    this.alertNotifier = builder.alertNotifier != null ? builder.alertNotifier : new LoggingAlertNotifier();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.stepTimeout = builder.stepTimeout;
    this.autoStart = builder.autoStart;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.runner = Executors.newSingleThreadExecutor(new DaemonThreadFactory("syncbridge-workflow-"));
    this.calls = Executors.newCachedThreadPool(new DaemonThreadFactory("syncbridge-step-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Enqueues a workflow with a generated correlation id.
   *
   * @see #enqueueWorkflow(String, Map, String, String)
   */
  public String enqueueWorkflow(String name, Map<String, Object> input) {
    return enqueueWorkflow(name, input, null, null);
  }

  public String enqueueWorkflow(String name, Map<String, Object> input, String correlationId) {
    return enqueueWorkflow(name, input, correlationId, null);
  }

  /**
   * Creates a pending execution of the latest active version of {@code name}.
   *
   * <p>A second call with the same {@code correlationId} returns the existing execution's id
   * without validating again.
   *
   * @param correlationId idempotency key; generated when {@code null}
   * @param triggeredBy   free-form origin recorded on the execution
   * @return the execution id
   * @throws WorkflowValidationException if the workflow is unknown or inactive, a required field is
   *                                     missing, or a template token cannot be resolved from the
   *                                     input or an earlier step
   */
  public String enqueueWorkflow(String name, Map<String, Object> input, String correlationId, String triggeredBy) {
    Objects.requireNonNull(name, "name");
    Map<String, Object> payload = input == null ? Map.of() : input;
    String key = correlationId != null ? correlationId : Ids.newId();

    String executionId;
    boolean created = false;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      Optional<WorkflowExecution> existing = executionStore.findByCorrelationId(conn, key);
      if (existing.isPresent()) {
        logger.log(Level.INFO, "Workflow {0} already enqueued for correlation id {1}", new Object[]{name, key});
        return existing.get().id();
      }
      WorkflowDefinition definition = definitionStore.findLatest(conn, name)
          .filter(WorkflowDefinition::active)
          .orElseThrow(() -> new WorkflowValidationException("Unknown or inactive workflow: " + name));
      validateInput(definition, payload);

      WorkflowExecution execution = WorkflowExecution.pending(Ids.newId(), definition, payload, key,
          triggeredBy, clock.instant());
      if (executionStore.insertIfAbsent(conn, execution)) {
        executionId = execution.id();
        created = true;
      } else {
        executionId = executionStore.findByCorrelationId(conn, key)
            .map(WorkflowExecution::id)
            .orElseThrow(() -> new IllegalStateException("Execution for " + key + " vanished"));
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to enqueue workflow " + name, e);
    }
    if (created) {
      logger.log(Level.INFO, "Enqueued workflow {0} as execution {1}", new Object[]{name, executionId});
      if (autoStart) {
        runner.execute(() -> runSafely(executionId));
      }
    }
    return executionId;
  }

  /**
   * Claims and runs an execution until it completes, fails, is cancelled, or waits for a step retry.
   * Returns immediately if another runner holds the claim.
   *
   * @return the execution as stored after the run
   * @throws IllegalArgumentException if the execution does not exist
   */
  public WorkflowExecution runExecution(String executionId) {
    Objects.requireNonNull(executionId, "executionId");
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      WorkflowExecution execution = executionStore.findById(conn, executionId)
          .orElseThrow(() -> new IllegalArgumentException("Unknown workflow execution: " + executionId));
      if (execution.status().isTerminal()) {
        return execution;
      }
      Optional<WorkflowDefinition> definition =
          definitionStore.find(conn, execution.workflowName(), execution.workflowVersion());
      Instant now = clock.instant();
      Instant lease = leaseFrom(now, definition.map(WorkflowDefinition::visibilityTimeoutSeconds)
          .orElse(WorkflowDefinition.DEFAULT_VISIBILITY_TIMEOUT_SECONDS));
      if (!executionStore.tryClaim(conn, executionId, now, lease)) {
        return execution;
      }
      if (definition.isEmpty()) {
        String error = "Workflow " + execution.workflowName() + " v" + execution.workflowVersion() + " not found";
        fail(conn, execution, null, error, execution.context(), execution.retryCount());
      } else {
        runSteps(conn, executionStore.findById(conn, executionId).orElse(execution), definition.get());
      }
      return executionStore.findById(conn, executionId).orElse(execution);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to run workflow execution " + executionId, e);
    }
  }

  /**
   * Runs up to {@code limit} claimable executions: pending ones, and running ones whose lease
   * expired or whose step retry became due.
   *
   * @return executions attempted
   */
  public int runDue(int limit) {
    List<String> ids;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      ids = executionStore.findClaimable(conn, clock.instant(), limit);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to find claimable workflow executions", e);
    }
    for (String id : ids) {
      runSafely(id);
    }
    return ids.size();
  }

  /**
   * Cancels an execution that has not reached a terminal state. Steps already run are not undone.
   *
   * @return {@code true} if the execution was cancelled by this call
   */
  public boolean cancel(String executionId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      boolean cancelled = executionStore.cancel(conn, executionId, clock.instant()) > 0;
      if (cancelled) {
        logger.log(Level.INFO, "Cancelled workflow execution {0}", executionId);
      }
      return cancelled;
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to cancel workflow execution " + executionId, e);
    }
  }

  public Optional<WorkflowExecution> find(String executionId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return executionStore.findById(conn, executionId);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to load workflow execution " + executionId, e);
    }
  }

  private void runSafely(String executionId) {
    try {
      runExecution(executionId);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Workflow execution " + executionId + " failed to run", e);
    }
  }

  private void runSteps(Connection conn, WorkflowExecution execution, WorkflowDefinition definition) {
    Map<String, Object> context = new LinkedHashMap<>(execution.context());
    int retryCount = execution.retryCount();
    Instant startedAt = execution.startedAt() != null ? execution.startedAt() : clock.instant();
    Instant deadline = startedAt.plusSeconds(definition.timeoutSeconds());
    List<WorkflowStep> steps = definition.steps();

    for (int index = execution.currentStep(); index < steps.size(); index++) {
      WorkflowStep step = steps.get(index);
      WorkflowExecution current = executionStore.findById(conn, execution.id()).orElse(null);
      if (current == null || current.status() != ExecutionStatus.RUNNING) {
        logger.log(Level.INFO, "Workflow execution {0} stopped before step {1}", new Object[]{execution.id(), step.name()});
        return;
      }
      Instant now = clock.instant();
      if (now.isAfter(deadline)) {
        fail(conn, execution, step.name(), "Workflow timed out after " + definition.timeoutSeconds() + "s",
            context, retryCount);
        return;
      }

      StepResult result = runStep(step, execution.inputPayload(), context);
      if (result.succeeded()) {
        context.put(step.name(), result.output());
        retryCount = 0;
        if (!advance(conn, execution, index + 1, context, definition)) {
          return;
        }
        continue;
      }

      FailurePolicy policy = result.retryable() ? step.onFailure() : nonRetryable(step.onFailure());
      switch (policy) {
        case CONTINUE -> {
          Map<String, Object> marker = new LinkedHashMap<>();
          marker.put(FAILED_MARKER, true);
          marker.put(ERROR_KEY, result.error());
          context.put(step.name(), marker);
          retryCount = 0;
          logger.log(Level.WARNING, "Workflow {0} step {1} failed, continuing: {2}",
              new Object[]{definition.name(), step.name(), result.error()});
          if (!advance(conn, execution, index + 1, context, definition)) {
            return;
          }
        }
        case ABORT -> {
          fail(conn, execution, step.name(), result.error(), context, retryCount);
          return;
        }
        case RETRY -> {
          retryCount++;
          if (retryCount > definition.maxRetries()) {
            fail(conn, execution, step.name(), result.error(), context, retryCount);
            return;
          }
          Instant retryAt = clock.instant().plusMillis(retryPolicy.computeDelayMs(retryCount));
          executionStore.updateProgress(conn, execution.id(), index, context, retryCount, retryAt, clock.instant());
          logger.log(Level.WARNING, "Workflow {0} step {1} failed (retry {2} of {3}) at {4}: {5}",
              new Object[]{definition.name(), step.name(), retryCount, definition.maxRetries(), retryAt, result.error()});
          return;
        }
      }
    }

    if (executionStore.markCompleted(conn, execution.id(), steps.size(), context, clock.instant()) > 0) {
      metrics.incrementWorkflowCompleted();
      logger.log(Level.INFO, "Workflow {0} execution {1} completed", new Object[]{definition.name(), execution.id()});
    }
  }

  private boolean advance(Connection conn, WorkflowExecution execution, int nextStep, Map<String, Object> context,
      WorkflowDefinition definition) {
    Instant now = clock.instant();
    Instant lease = leaseFrom(now, definition.visibilityTimeoutSeconds());
    return executionStore.updateProgress(conn, execution.id(), nextStep, context, 0, lease, now) > 0;
  }

  private Instant leaseFrom(Instant now, int visibilityTimeoutSeconds) {
    Duration visibility = Duration.ofSeconds(visibilityTimeoutSeconds);
    Duration floor = stepTimeout.plus(LEASE_MARGIN);
    return now.plus(visibility.compareTo(floor) >= 0 ? visibility : floor);
  }

  private StepResult runStep(WorkflowStep step, Map<String, Object> input, Map<String, Object> context) {
    Map<String, Object> payload;
    try {
      payload = TemplateRenderer.renderPayload(step.payloadTemplate(), input, context);
    } catch (TemplateResolutionException e) {
      return StepResult.permanentFailure(e.getMessage());
    }
    Optional<StepHandler> handler = stepHandlers.find(step.targetFunction());
    if (handler.isEmpty()) {
      return StepResult.permanentFailure("No step handler registered for " + step.targetFunction());
    }

    Future<Map<String, Object>> call = calls.submit(() -> handler.get().handle(step.action(), payload));
    try {
      Map<String, Object> output = call.get(stepTimeout.toMillis(), TimeUnit.MILLISECONDS);
      return StepResult.success(output == null ? Map.of() : output);
    } catch (TimeoutException e) {
      call.cancel(true);
      return StepResult.failure("Step " + step.name() + " timed out after " + stepTimeout.toMillis() + " ms");
    } catch (InterruptedException e) {
      call.cancel(true);
      Thread.currentThread().interrupt();
      return StepResult.failure("Interrupted while running step " + step.name());
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      return StepResult.failure(cause.getMessage() != null ? cause.getMessage() : cause.toString());
    }
  }

  private void fail(Connection conn, WorkflowExecution execution, String errorStep, String error,
      Map<String, Object> context, int retryCount) {
    if (executionStore.markFailed(conn, execution.id(), errorStep, error, context, retryCount, clock.instant()) == 0) {
      return;
    }
    metrics.incrementWorkflowFailed();
    logger.log(Level.SEVERE, "Workflow {0} execution {1} failed at step {2}: {3}",
        new Object[]{execution.workflowName(), execution.id(), errorStep, error});
    try {
      alertNotifier.notify(Alert.workflowFailed(execution.workflowName(), execution.id(),
          (errorStep != null ? errorStep + ": " : "") + error));
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Alert notifier failed for workflow execution " + execution.id(), e);
    }
  }

  /**
   * Template and handler lookup failures are never retried.
   */
  private static FailurePolicy nonRetryable(FailurePolicy policy) {
    return policy == FailurePolicy.RETRY ? FailurePolicy.ABORT : policy;
  }

  private static void validateInput(WorkflowDefinition definition, Map<String, Object> input) {
    List<String> missing = new ArrayList<>();
    for (String field : definition.requiredFields()) {
      if (input.get(field) == null) {
        missing.add(field);
      }
    }
    if (!missing.isEmpty()) {
      throw new WorkflowValidationException("Workflow " + definition.name() + " is missing required fields " + missing);
    }

    Set<String> earlierSteps = new HashSet<>();
    for (WorkflowStep step : definition.steps()) {
      for (String token : TemplateRenderer.tokens(step.payloadTemplate())) {
        String root = token.split("\\.", 2)[0];
        boolean fromInput = TemplateRenderer.resolve(token, List.of(input)).isPresent();
        if (!fromInput && !earlierSteps.contains(root)) {
          throw new WorkflowValidationException("Step " + step.name() + " of workflow " + definition.name()
              + " references unresolvable token {{" + token + "}}");
        }
      }
      earlierSteps.add(step.name());
    }
  }

  /**
   * Stops the background runner and interrupts running step calls.
   */
  @Override
  public void close() {
    runner.shutdown();
    calls.shutdownNow();
    try {
      if (!runner.awaitTermination(5, TimeUnit.SECONDS)) {
        runner.shutdownNow();
      }
    } catch (InterruptedException e) {
      runner.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private record StepResult(boolean succeeded, boolean retryable, Map<String, Object> output, String error) {

    static StepResult success(Map<String, Object> output) {
      return new StepResult(true, false, output, null);
    }

    static StepResult failure(String error) {
      return new StepResult(false, true, null, error);
    }

    static StepResult permanentFailure(String error) {
      return new StepResult(false, false, null, error);
    }
  }

  /**
   * Builder for {@link WorkflowEngine}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private WorkflowDefinitionStore definitionStore;
    private WorkflowExecutionStore executionStore;
    private StepHandlerRegistry stepHandlers;
    private RetryPolicy retryPolicy;
    private AlertNotifier alertNotifier;
    private MetricsExporter metrics;
    private Duration stepTimeout = Duration.ofSeconds(30);
    private boolean autoStart = true;
    private Clock clock;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder definitionStore(WorkflowDefinitionStore definitionStore) {
      this.definitionStore = definitionStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder executionStore(WorkflowExecutionStore executionStore) {
      this.executionStore = executionStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder stepHandlers(StepHandlerRegistry stepHandlers) {
      this.stepHandlers = stepHandlers;
      return this;
    }

    /**
     * Sets the backoff between attempts of a {@link FailurePolicy#RETRY} step.
     *
     * <p>Optional. Defaults to exponential backoff from 5 seconds, capped at 5 minutes.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link LoggingAlertNotifier}.
     */
    public Builder alertNotifier(AlertNotifier alertNotifier) {
      this.alertNotifier = alertNotifier;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the timeout of a single step handler call.
     *
     * <p>Optional. Defaults to {@code 30s}.
     */
    public Builder stepTimeout(Duration stepTimeout) {
      this.stepTimeout = stepTimeout;
      return this;
    }

    /**
     * Whether a newly enqueued execution starts running right away on a background thread.
     * When disabled, executions run only via {@link WorkflowEngine#runExecution} or the sweep.
     *
     * <p>Optional. Defaults to {@code true}.
     */
    public Builder autoStart(boolean autoStart) {
      this.autoStart = autoStart;
      return this;
    }

    /**
     * <p>Optional. Defaults to the UTC system clock.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public WorkflowEngine build() {
      return new WorkflowEngine(this);
    }
  }
}
