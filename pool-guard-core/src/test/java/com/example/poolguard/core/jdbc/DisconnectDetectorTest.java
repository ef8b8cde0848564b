package com.example.poolguard.core.jdbc;

import static org.junit.jupiter.api.Assertions.*;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLSyntaxErrorException;
import java.sql.SQLTransientConnectionException;
import org.junit.jupiter.api.*;

public class DisconnectDetectorTest {

  private final DisconnectDetector detector = DisconnectDetector.defaultDetector();

  @Nested
  @DisplayName("Default Heuristics")
  class DefaultHeuristics {

    @Test
    @DisplayName("Should detect SQLState class 08")
    void shouldDetectConnectionExceptionClass() {
      assertTrue(detector.isDisconnect(new SQLException("link failure", "08S01")));
      assertTrue(detector.isDisconnect(new SQLException("gone", "08006")));
    }

    @Test
    @DisplayName("Should detect PostgreSQL shutdown states")
    void shouldDetectAdminShutdown() {
      assertTrue(detector.isDisconnect(new SQLException("admin shutdown", "57P01")));
      assertTrue(detector.isDisconnect(new SQLException("crash shutdown", "57P02")));
      assertTrue(detector.isDisconnect(new SQLException("cannot connect now", "57P03")));
    }

    @Test
    @DisplayName("Should detect JDBC connection exception types")
    void shouldDetectConnectionTypes() {
      assertTrue(detector.isDisconnect(new SQLRecoverableException("retry")));
      assertTrue(detector.isDisconnect(new SQLNonTransientConnectionException("closed")));
      assertTrue(detector.isDisconnect(new SQLTransientConnectionException("busy")));
    }

    @Test
    @DisplayName("Should detect transport keywords regardless of case")
    void shouldDetectKeywords() {
      assertTrue(detector.isDisconnect(new SQLException("Broken pipe (Write failed)")));
      assertTrue(detector.isDisconnect(new SQLException("This connection has been closed.")));
      assertTrue(detector.isDisconnect(new SQLException("SERVER CLOSED THE CONNECTION")));
    }

    @Test
    @DisplayName("Should follow the cause chain")
    void shouldFollowCauses() {
      final var wrapped = new SQLException("statement failed", new SQLException("x", "08003"));

      assertTrue(detector.isDisconnect(wrapped));
    }

    @Test
    @DisplayName("Should ignore ordinary database errors")
    void shouldIgnoreOtherErrors() {
      assertFalse(detector.isDisconnect(new SQLSyntaxErrorException("bad sql", "42601")));
      assertFalse(detector.isDisconnect(new SQLException("duplicate key", "23505")));
      assertFalse(detector.isDisconnect(new SQLException((String) null)));
    }
  }

  @Nested
  @DisplayName("Composition")
  class Composition {

    @Test
    @DisplayName("Should combine detectors with OR")
    void shouldCombineWithOr() {
      final var combined = detector.or(DisconnectDetector.custom(e -> e.getErrorCode() == 17002));

      assertTrue(combined.isDisconnect(new SQLException("IO Error", "99999", 17002)));
      assertTrue(combined.isDisconnect(new SQLException("gone", "08006")));
      assertFalse(combined.isDisconnect(new SQLException("duplicate key", "23505")));
    }
  }
}
