package io.syncbridge.jdbc.workflow;

import io.syncbridge.jdbc.TestDatabase;
import io.syncbridge.workflow.ExecutionStatus;
import io.syncbridge.workflow.FailurePolicy;
import io.syncbridge.workflow.WorkflowDefinition;
import io.syncbridge.workflow.WorkflowExecution;
import io.syncbridge.workflow.WorkflowStep;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcWorkflowStoresTest {
  private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

  private DataSource dataSource;
  private Connection conn;
  private JdbcWorkflowDefinitionStore definitions;
  private JdbcWorkflowExecutionStore executions;

  @BeforeEach
  void setup() throws Exception {
    dataSource = TestDatabase.h2();
    conn = dataSource.getConnection();
    definitions = new JdbcWorkflowDefinitionStore();
    executions = new JdbcWorkflowExecutionStore();
  }

  @AfterEach
  void tearDown() throws Exception {
    conn.close();
    TestDatabase.dropSchema(dataSource);
  }

  @Test
  void definitionRoundTripsStepsAndPolicies() {
    WorkflowDefinition definition = definition("user_signup", 1);
    definitions.insertVersion(conn, definition);

    WorkflowDefinition loaded = definitions.find(conn, "user_signup", 1).orElseThrow();
    assertEquals(definition, loaded);
    assertEquals(FailurePolicy.CONTINUE, loaded.steps().get(1).onFailure());
    assertEquals("{{user.email}}", loaded.steps().get(0).payloadTemplate().get("email"));
  }

  @Test
  void latestVersionWins() {
    definitions.insertVersion(conn, definition("user_signup", 1));
    definitions.insertVersion(conn, definition("user_signup", 2).withActive(false));
    definitions.insertVersion(conn, definition("listing_published", 1));

    assertEquals(2, definitions.findLatest(conn, "user_signup").orElseThrow().version());
    List<WorkflowDefinition> latest = definitions.findAllLatest(conn);
    assertEquals(List.of("listing_published", "user_signup"), latest.stream().map(WorkflowDefinition::name).toList());
    assertFalse(latest.get(1).active());
  }

  @Test
  void executionClaimHonoursLease() {
    WorkflowExecution execution = WorkflowExecution.pending("ex-1", definition("user_signup", 1),
        Map.of("user", Map.of("email", "a@b.c")), "signup-1", "test", NOW);
    assertTrue(executions.insertIfAbsent(conn, execution));
    assertFalse(executions.insertIfAbsent(conn, WorkflowExecution.pending("ex-2", definition("user_signup", 1),
        Map.of(), "signup-1", "test", NOW)));

    assertEquals(List.of("ex-1"), executions.findClaimable(conn, NOW, 10));
    assertTrue(executions.tryClaim(conn, "ex-1", NOW, NOW.plusSeconds(60)));
    assertFalse(executions.tryClaim(conn, "ex-1", NOW.plusSeconds(30), NOW.plusSeconds(90)));
    assertTrue(executions.findClaimable(conn, NOW.plusSeconds(30), 10).isEmpty());
    assertTrue(executions.tryClaim(conn, "ex-1", NOW.plusSeconds(60), NOW.plusSeconds(120)));

    WorkflowExecution claimed = executions.findById(conn, "ex-1").orElseThrow();
    assertEquals(ExecutionStatus.RUNNING, claimed.status());
    assertEquals(NOW, claimed.startedAt());
    assertEquals("a@b.c", ((Map<?, ?>) claimed.inputPayload().get("user")).get("email"));
  }

  @Test
  void terminalTransitionsAreGuarded() {
    executions.insertIfAbsent(conn, WorkflowExecution.pending("ex-1", definition("user_signup", 1), Map.of(),
        "signup-1", null, NOW));

    assertEquals(0, executions.markCompleted(conn, "ex-1", 2, Map.of(), NOW));
    executions.tryClaim(conn, "ex-1", NOW, NOW.plusSeconds(60));
    assertEquals(1, executions.markCompleted(conn, "ex-1", 2, Map.of("welcome", Map.of("ok", true)), NOW));
    assertEquals(0, executions.markFailed(conn, "ex-1", "welcome", "late failure", Map.of(), 0, NOW));
    assertEquals(0, executions.cancel(conn, "ex-1", NOW));

    WorkflowExecution done = executions.findByCorrelationId(conn, "signup-1").orElseThrow();
    assertEquals(ExecutionStatus.COMPLETED, done.status());
    assertNull(done.leaseUntil());
  }

  private static WorkflowDefinition definition(String name, int version) {
    return WorkflowDefinition.of(name, List.of(
            new WorkflowStep("create_user", "users", "create", Map.of("email", "{{user.email}}"), null),
            new WorkflowStep("welcome", "notifications", "send", Map.of("user", "{{create_user.id}}"),
                FailurePolicy.CONTINUE)),
        List.of("user"))
        .withVersion(version);
  }
}
