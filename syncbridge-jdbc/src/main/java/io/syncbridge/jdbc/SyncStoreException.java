package io.syncbridge.jdbc;

import java.sql.SQLException;

/**
 * Unchecked exception wrapping JDBC errors thrown by the SyncBridge JDBC stores.
 */
public final class SyncStoreException extends RuntimeException {
  public SyncStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Returns {@code true} if the underlying error is a unique or primary key violation
   * (SQLState class {@code 23505}).
   */
  public boolean isUniqueViolation() {
    return getCause() instanceof SQLException sql && "23505".equals(sql.getSQLState());
  }
}
