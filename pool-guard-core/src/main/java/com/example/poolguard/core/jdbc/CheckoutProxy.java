package com.example.poolguard.core.jdbc;

import java.sql.Connection;

/**
 * The in-flight checkout's reference to a physical connection. Checkout listeners may clear it so
 * that the caller never receives the handle.
 */
public final class CheckoutProxy {

  private Connection connection;

  CheckoutProxy(final Connection connection) {
    this.connection = connection;
  }

  /**
   * Returns the physical connection about to be handed out.
   *
   * @return the connection, or null once cleared
   */
  public Connection connection() {
    return connection;
  }

  /** Drops the reference without closing the connection. */
  public void clearConnection() {
    connection = null;
  }
}
