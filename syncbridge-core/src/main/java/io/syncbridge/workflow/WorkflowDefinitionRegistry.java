package io.syncbridge.workflow;

import io.syncbridge.spi.ConnectionProvider;
import io.syncbridge.spi.WorkflowDefinitionStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stores workflow definitions as immutable versions.
 *
 * <p>Every {@link #save} writes a new version one higher than the latest; executions keep
 * reading the version they were pinned to.
 */
public final class WorkflowDefinitionRegistry {
  private static final Logger logger = Logger.getLogger(WorkflowDefinitionRegistry.class.getName());

  private final ConnectionProvider connectionProvider;
  private final WorkflowDefinitionStore store;

  public WorkflowDefinitionRegistry(ConnectionProvider connectionProvider, WorkflowDefinitionStore store) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Saves a definition as its next version.
   *
   * @return the stored definition carrying its assigned version
   */
  public WorkflowDefinition save(WorkflowDefinition definition) {
    Objects.requireNonNull(definition, "definition");
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        int latest = store.findLatest(conn, definition.name()).map(WorkflowDefinition::version).orElse(0);
        WorkflowDefinition versioned = definition.withVersion(latest + 1);
        store.insertVersion(conn, versioned);
        conn.commit();
        logger.log(Level.INFO, "Saved workflow {0} version {1}", new Object[]{versioned.name(), versioned.version()});
        return versioned;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to save workflow " + definition.name(), e);
    }
  }

  /**
   * Saves a new, inactive version of the latest definition.
   *
   * @return {@code false} if no definition exists
   */
  public boolean deactivate(String name) {
    Optional<WorkflowDefinition> latest = findLatest(name);
    if (latest.isEmpty()) {
      return false;
    }
    save(latest.get().withActive(false));
    return true;
  }

  public Optional<WorkflowDefinition> findLatest(String name) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return store.findLatest(conn, name);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to load workflow " + name, e);
    }
  }

  public Optional<WorkflowDefinition> find(String name, int version) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return store.find(conn, name, version);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to load workflow " + name + " v" + version, e);
    }
  }

  public List<WorkflowDefinition> all() {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return store.findAllLatest(conn);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to list workflows", e);
    }
  }
}
