package com.example.poolguard.core.jdbc;

import java.sql.SQLException;

/**
 * Extension points a {@link GuardedConnectionPool} notifies during a connection's life. Register
 * with {@link GuardedConnectionPool#addListener(PoolLifecycleListener)}; every method defaults to a
 * no-op so a listener implements only the points it cares about.
 *
 * <p>Callbacks run synchronously on the thread that triggered them. An exception thrown from a
 * callback propagates to the caller of {@link GuardedConnectionPool#connect()} or {@link
 * PooledConnection#branch()}.
 */
public interface PoolLifecycleListener {

  /**
   * A physical connection was just established for {@code record}.
   *
   * @param record the record now holding a live connection
   */
  default void onConnect(final ConnectionRecord record) {}

  /**
   * A record is being checked out of the pool, including records that were used before.
   *
   * @param record the record being checked out
   * @param proxy the in-flight checkout's reference to the physical connection
   * @throws SQLException to reject the checkout; {@link DisconnectionException} makes the pool
   *     invalidate the record and try again
   */
  default void onCheckout(final ConnectionRecord record, final CheckoutProxy proxy)
      throws SQLException {}

  /**
   * A logical connection is about to be handed to a caller for direct use.
   *
   * @param connection the logical connection
   * @param subConnection true for a branch of an already acquired connection
   * @throws SQLException to fail the acquisition
   */
  default void onAcquire(final PooledConnection connection, final boolean subConnection)
      throws SQLException {}
}
