package io.syncbridge.spi;

import java.sql.Connection;

/**
 * Abstracts the caller's transaction so change capture can write queue rows on the
 * same connection as the business mutation.
 *
 * <p>Implementations: {@code io.syncbridge.jdbc.tx.ThreadLocalTxContext} (manual JDBC),
 * {@code io.syncbridge.spring.SpringTxContext} (Spring-managed).
 */
public interface TxContext {

  /**
   * Returns {@code true} if a transaction is currently active on this thread.
   */
  boolean isTransactionActive();

  /**
   * Returns the JDBC connection bound to the current transaction.
   *
   * @throws IllegalStateException if no transaction is active
   */
  Connection currentConnection();

  /**
   * Registers a callback to run after the current transaction commits.
   *
   * @param callback action to execute post-commit
   * @throws IllegalStateException if no transaction is active
   */
  void afterCommit(Runnable callback);
}
