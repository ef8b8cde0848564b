package com.example.poolguard.core.jdbc;

import java.sql.SQLNonTransientConnectionException;

/**
 * Raised by a checkout listener to reject a connection that must not be handed to the caller. The
 * pool reacts by invalidating the record and checking it out again.
 */
public class DisconnectionException extends SQLNonTransientConnectionException {

  private static final long serialVersionUID = 1L;

  /** SQLState for "connection does not exist". */
  public static final String SQL_STATE = "08003";

  private final String ownerId;
  private final String currentId;

  /**
   * Creates an exception for a connection owned by another process.
   *
   * @param ownerId identifier recorded when the connection was established, may be null
   * @param currentId identifier of the process attempting the checkout
   */
  public DisconnectionException(final String ownerId, final String currentId) {
    super(
        "Connection record belongs to pid %s, attempting to check out in pid %s"
            .formatted(ownerId, currentId),
        SQL_STATE);
    this.ownerId = ownerId;
    this.currentId = currentId;
  }

  /**
   * Returns the identifier of the process that established the connection.
   *
   * @return owner id, or null if none was recorded
   */
  public String ownerId() {
    return ownerId;
  }

  /**
   * Returns the identifier of the process that attempted the checkout.
   *
   * @return current process id
   */
  public String currentId() {
    return currentId;
  }
}
