package com.example.poolguard.core.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Thin database client that runs operations on connections borrowed from a {@link
 * GuardedConnectionPool}. Every borrowed connection has passed the pool's listeners, so with a
 * {@code PoolGuard} installed it is known to be alive and owned by this process.
 *
 * @param pool the pool to borrow connections from
 */
public record DbClient(GuardedConnectionPool pool) {

  /**
   * Borrows a connection, runs the operation and returns the connection to the pool.
   *
   * @param operation the database operation to run with an open {@link Connection}
   * @param <T> the operation result type
   * @return the value returned by the operation
   * @throws SQLException if acquisition or the operation fails
   */
  public <T> T execute(final DbOperation<T> operation) throws SQLException {
    try (final var conn = pool.connect()) {
      return conn.execute(operation::execute);
    }
  }

  /**
   * Database operation executed against an open {@link Connection}.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface DbOperation<T> {
    /**
     * Executes the operation with the provided connection.
     *
     * @param conn an open JDBC connection
     * @return operation result
     * @throws SQLException on database errors
     */
    T execute(final Connection conn) throws SQLException;
  }
}
