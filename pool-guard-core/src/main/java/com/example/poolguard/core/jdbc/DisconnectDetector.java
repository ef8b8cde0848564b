package com.example.poolguard.core.jdbc;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientConnectionException;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Decides whether a driver error means the physical connection is dead and must be discarded.
 *
 * <h3>Using the default detector</h3>
 *
 * <pre>{@code
 * var pool = GuardedConnectionPool.builder()
 *     .source(source)
 *     .disconnectDetector(DisconnectDetector.defaultDetector())
 *     .build();
 * }</pre>
 *
 * <h3>Adding vendor-specific codes</h3>
 *
 * <pre>{@code
 * var detector = DisconnectDetector.defaultDetector()
 *     .or(DisconnectDetector.custom(e -> e.getErrorCode() == 17002)); // Oracle IO error
 * }</pre>
 */
@FunctionalInterface
public interface DisconnectDetector {

  /**
   * Determines whether the exception means the connection is unusable.
   *
   * @param e the driver error
   * @return true if the connection should be invalidated
   */
  boolean isDisconnect(final SQLException e);

  /**
   * Returns the default detector.
   *
   * <p>Checks SQLState class 08, PostgreSQL shutdown states 57P01-57P03, the JDBC connection
   * exception types, and common transport error keywords, following the cause chain.
   *
   * @return default detector
   */
  static DisconnectDetector defaultDetector() {
    return Heuristics::isDisconnect;
  }

  /**
   * Creates a detector from a predicate.
   *
   * @param predicate the predicate to use for detection
   * @return custom detector
   */
  static DisconnectDetector custom(final Predicate<SQLException> predicate) {
    return predicate::test;
  }

  /**
   * Combines this detector with another using OR logic.
   *
   * @param other the other detector to combine with
   * @return combined detector
   */
  default DisconnectDetector or(final DisconnectDetector other) {
    return e -> this.isDisconnect(e) || other.isDisconnect(e);
  }

  /** Built-in heuristics behind {@link #defaultDetector()}. */
  final class Heuristics {

    private static final String[] DISCONNECT_KEYWORDS =
        new String[] {
          "connection refused",
          "connection reset",
          "connection has been closed",
          "connection is closed",
          "i/o error",
          "socket closed",
          "broken pipe",
          "terminating connection",
          "server closed the connection"
        };

    private Heuristics() {}

    static boolean isDisconnect(final SQLException e) {
      Throwable cur = e;
      while (cur != null) {
        if (cur instanceof SQLException sql && matches(sql)) return true;
        cur = cur.getCause();
      }
      return false;
    }

    private static boolean matches(final SQLException e) {
      if (e instanceof SQLRecoverableException
          || e instanceof SQLNonTransientConnectionException
          || e instanceof SQLTransientConnectionException) return true;

      final var state = e.getSQLState();
      if (state != null) {
        if (state.startsWith("08")) return true;
        if ("57P01".equals(state) || "57P02".equals(state) || "57P03".equals(state)) return true;
      }

      final var msg = e.getMessage();
      if (msg != null) {
        final var lower = msg.toLowerCase(Locale.ROOT);
        for (final var keyword : DISCONNECT_KEYWORDS) if (lower.contains(keyword)) return true;
      }

      return false;
    }
  }
}
