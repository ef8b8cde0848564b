package com.example.poolguard.core.jdbc;

import java.sql.SQLException;

/**
 * Driver error raised while executing work on a {@link PooledConnection}, annotated with the pool's
 * verdict on whether the underlying connection is dead.
 *
 * <p>When {@link #isConnectionInvalidated()} is true the pool has already discarded the physical
 * connection and marked every older connection stale, so running the same work again transparently
 * uses a freshly established connection.
 */
public class DatabaseAccessException extends SQLException {

  private static final long serialVersionUID = 1L;

  private final boolean connectionInvalidated;

  /**
   * Creates an exception wrapping a driver error.
   *
   * @param message description of the failed work
   * @param cause the driver error
   * @param connectionInvalidated whether the pool confirmed the connection dead
   */
  public DatabaseAccessException(
      final String message, final SQLException cause, final boolean connectionInvalidated) {
    super(message, cause.getSQLState(), cause.getErrorCode(), cause);
    this.connectionInvalidated = connectionInvalidated;
  }

  /**
   * Returns whether the underlying transport was confirmed dead.
   *
   * @return true if the connection was invalidated by the pool
   */
  public boolean isConnectionInvalidated() {
    return connectionInvalidated;
  }
}
