package com.example.poolguard.core.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Logical connection handed out by a {@link GuardedConnectionPool}.
 *
 * <p>Work runs through {@link #execute(JdbcWork)} or {@link #scalar(String)} so the pool sees every
 * driver error: errors come back as {@link DatabaseAccessException}, and a dead connection is
 * replaced transparently on the next call. Closing the handle returns its record to the pool;
 * closing a {@link #branch() branch} leaves the parent untouched.
 */
public final class PooledConnection implements AutoCloseable {

  private final GuardedConnectionPool pool;
  private final ConnectionRecord record;
  private final boolean subConnection;

  private volatile boolean closeWithResult;
  private volatile boolean closed;

  PooledConnection(
      final GuardedConnectionPool pool,
      final ConnectionRecord record,
      final boolean subConnection) {
    this.pool = pool;
    this.record = record;
    this.subConnection = subConnection;
  }

  /**
   * Work executed against the physical connection.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface JdbcWork<T> {
    T execute(final Connection connection) throws SQLException;
  }

  /**
   * Runs work on the physical connection, re-establishing it first if a disconnect on this handle
   * dropped it.
   *
   * @param work the work to run
   * @param <T> result type
   * @return work result
   * @throws DatabaseAccessException if the driver reports an error
   * @throws SQLException if this handle is closed
   */
  public <T> T execute(final JdbcWork<T> work) throws SQLException {
    if (closed) throw new SQLException("Connection handle is closed");

    final T result;
    try {
      result = work.execute(record.ensureOpen());
    } catch (final SQLException e) {
      throw pool.handleDbError(e, record);
    }

    if (closeWithResult) close();
    return result;
  }

  /**
   * Runs a query and returns the first column of its first row.
   *
   * @param sql the query
   * @return the value, or null if the query returned no rows
   * @throws SQLException if the query fails or this handle is closed
   */
  public Object scalar(final String sql) throws SQLException {
    return execute(
        conn -> {
          try (final var stmt = conn.createStatement();
              final var rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getObject(1) : null;
          }
        });
  }

  /**
   * Opens a sub-connection sharing this connection's physical connection. Listeners see it with
   * {@code subConnection == true}.
   *
   * @return the branch
   * @throws SQLException if this handle is closed or a listener rejects the branch
   */
  public PooledConnection branch() throws SQLException {
    if (closed) throw new SQLException("Connection handle is closed");
    final var branch = new PooledConnection(pool, record, true);
    pool.fireAcquire(branch, true);
    return branch;
  }

  /**
   * Whether this handle closes itself once a unit of work has produced its result.
   *
   * @return the flag
   */
  public boolean isCloseWithResult() {
    return closeWithResult;
  }

  /**
   * Sets whether this handle closes itself once a unit of work has produced its result.
   *
   * @param closeWithResult the flag
   */
  public void setCloseWithResult(final boolean closeWithResult) {
    this.closeWithResult = closeWithResult;
  }

  /**
   * Whether this handle is a {@link #branch() branch} of another handle.
   *
   * @return true for branches
   */
  public boolean isSubConnection() {
    return subConnection;
  }

  /**
   * Whether this handle has been closed.
   *
   * @return the flag
   */
  public boolean isClosed() {
    return closed;
  }

  /**
   * Returns the pool record backing this handle.
   *
   * @return the record
   */
  public ConnectionRecord record() {
    return record;
  }

  @Override
  public void close() {
    if (closed) return;
    closed = true;
    if (!subConnection) pool.release(record);
  }
}
