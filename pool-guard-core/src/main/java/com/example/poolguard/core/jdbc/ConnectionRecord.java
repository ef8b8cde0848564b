package com.example.poolguard.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import java.lang.System.Logger;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pool bookkeeping for one physical connection slot.
 *
 * <p>The {@link #info()} map belongs to the physical connection currently held: it is emptied
 * whenever that connection is invalidated or replaced, so values written from {@link
 * PoolLifecycleListener#onConnect(ConnectionRecord)} describe exactly one physical connection.
 */
public final class ConnectionRecord {

  private static final Logger logger = System.getLogger(ConnectionRecord.class.getName());

  private final GuardedConnectionPool pool;
  private final int id;
  private final Map<String, Object> info = new ConcurrentHashMap<>();

  private volatile Connection connection;
  private volatile long epoch = -1L;

  ConnectionRecord(final GuardedConnectionPool pool, final int id) {
    this.pool = pool;
    this.id = id;
  }

  /**
   * Returns listener-owned metadata about the current physical connection.
   *
   * @return mutable info map
   */
  public Map<String, Object> info() {
    return info;
  }

  /**
   * Returns the live physical connection.
   *
   * @return the connection, or null if none is established
   */
  public Connection connection() {
    return connection;
  }

  /**
   * Drops the physical connection without closing it. Used when the handle must not be touched from
   * this process any more, e.g. a socket inherited from another process.
   */
  public void clearConnection() {
    connection = null;
  }

  /**
   * Returns the record's position in the pool, starting at 1.
   *
   * @return record id
   */
  public int id() {
    return id;
  }

  boolean isStale() {
    return connection == null || epoch < pool.epoch();
  }

  /** Checkout path: reopens a missing connection or one established before the pool's epoch. */
  Connection ensureConnected() throws SQLException {
    if (isStale()) reconnect();
    return connection;
  }

  /**
   * In-use path: reopens only a connection this record has lost itself. Epoch staleness waits for
   * the next checkout so a borrower's open transaction keeps its physical connection.
   */
  Connection ensureOpen() throws SQLException {
    if (connection == null) reconnect();
    return connection;
  }

  void reconnect() throws SQLException {
    invalidate("re-establishing connection");
    final var opened = pool.source().open();
    epoch = pool.epoch();
    connection = opened;
    logger.log(DEBUG, "Established connection for record {0}", id);
    pool.fireConnect(this);
  }

  void invalidate(final String reason) {
    final var current = connection;
    connection = null;
    info.clear();
    if (current == null) return;
    logger.log(DEBUG, "Invalidating connection for record {0}: {1}", id, reason);
    close(current);
  }

  private void close(final Connection physical) {
    try {
      physical.close();
    } catch (final SQLException e) {
      logger.log(WARNING, "Failed to close connection for record " + id, e);
    }
  }

  @Override
  public String toString() {
    return "ConnectionRecord[" + id + "]";
  }
}
