package com.example.poolguard.core;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.time.Duration;

/**
 * Raised when a connection stayed invalidated for the whole reconnect timeout. The last driver
 * error is attached as the cause.
 */
public class ReconnectTimeoutException extends SQLNonTransientConnectionException {

  private static final long serialVersionUID = 1L;

  /** SQLState for "unable to establish connection". */
  public static final String SQL_STATE = "08001";

  private final Duration timeout;
  private final Duration elapsed;

  /**
   * Creates the exception.
   *
   * @param timeout the configured reconnect timeout
   * @param elapsed time spent since the first probe
   * @param lastError the error raised by the last probe
   */
  public ReconnectTimeoutException(
      final Duration timeout, final Duration elapsed, final SQLException lastError) {
    super(
        "Failed to re-establish DB connection within %s secs (elapsed %s secs): %s"
            .formatted(
                GuardPolicy.toSeconds(timeout),
                GuardPolicy.toSeconds(elapsed),
                lastError.getMessage()),
        SQL_STATE,
        lastError);
    this.timeout = timeout;
    this.elapsed = elapsed;
  }

  /**
   * Returns the configured reconnect timeout.
   *
   * @return the timeout
   */
  public Duration timeout() {
    return timeout;
  }

  /**
   * Returns the time spent since the first probe when the guard gave up.
   *
   * @return elapsed time
   */
  public Duration elapsed() {
    return elapsed;
  }
}
