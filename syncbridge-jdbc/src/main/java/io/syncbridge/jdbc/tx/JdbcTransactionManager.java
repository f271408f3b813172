package io.syncbridge.jdbc.tx;

import io.syncbridge.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Minimal transaction manager for applications without a framework-managed transaction.
 * Obtains a connection, disables auto-commit and binds it to a {@link ThreadLocalTxContext}.
 *
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *   listingDao.update(conn(), listing);
 *   capture.enqueueSync("listing", listing.id(), Operation.UPDATE, listing.toRow());
 *   tx.commit();
 * }
 * }</pre>
 *
 * @see ThreadLocalTxContext
 */
public final class JdbcTransactionManager {
  private final ConnectionProvider connectionProvider;
  private final ThreadLocalTxContext txContext;

  public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
  }

  /**
   * Begins a transaction bound to the calling thread.
   *
   * @return a handle to use with try-with-resources
   * @throws SQLException if a connection cannot be obtained
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
      txContext.bind(connection);
    } catch (SQLException | RuntimeException e) {
      connection.close();
      throw e;
    }
    return new Transaction(connection, txContext);
  }

  /**
   * Transaction handle. Closing it without {@link #commit()} rolls back.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private final ThreadLocalTxContext txContext;
    private boolean completed;

    private Transaction(Connection connection, ThreadLocalTxContext txContext) {
      this.connection = connection;
      this.txContext = txContext;
    }

    public Connection connection() {
      return connection;
    }

    /**
     * Commits, then runs the post-commit callbacks. A callback failure is rethrown after the
     * connection has been released; the commit stands.
     */
    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      boolean committed = false;
      try {
        connection.commit();
        committed = true;
      } catch (SQLException e) {
        rollbackQuietly(e);
        throw e;
      } finally {
        finish(committed);
      }
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } finally {
        finish(false);
      }
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void finish(boolean committed) throws SQLException {
      RuntimeException callbackException = null;
      SQLException resetException = null;
      try {
        if (committed) {
          txContext.clearAfterCommit();
        } else {
          txContext.clearAfterRollback();
        }
      } catch (RuntimeException e) {
        callbackException = e;
      } finally {
        completed = true;
        try {
          connection.setAutoCommit(true);
        } catch (SQLException e) {
          if (callbackException != null) callbackException.addSuppressed(e);
          else resetException = e;
        } finally {
          connection.close();
        }
      }
      if (callbackException != null) {
        throw callbackException;
      }
      if (resetException != null) {
        throw resetException;
      }
    }

    private void rollbackQuietly(SQLException cause) {
      try {
        connection.rollback();
      } catch (SQLException e) {
        cause.addSuppressed(e);
      }
    }
  }
}
