package io.syncbridge.spi;

import io.syncbridge.workflow.WorkflowDefinition;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Versioned workflow definitions. Every saved version is retained.
 */
public interface WorkflowDefinitionStore {

  /** Highest version of the named definition. */
  Optional<WorkflowDefinition> findLatest(Connection conn, String name);

  Optional<WorkflowDefinition> find(Connection conn, String name, int version);

  /** Latest version of every definition. */
  List<WorkflowDefinition> findAllLatest(Connection conn);

  /**
   * Stores a new version. Fails if {@code (name, version)} already exists.
   */
  void insertVersion(Connection conn, WorkflowDefinition definition);
}
