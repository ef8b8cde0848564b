package com.example;

import java.sql.DriverManager;
import java.sql.SQLException;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;

/** Test-only utilities for integration tests. */
public final class TestSupport {
  private TestSupport() {}

  /** Simple Docker availability probe using Testcontainers. */
  public static boolean dockerAvailable() {
    try {
      DockerClientFactory.instance().client();
      return true;
    } catch (final Throwable t) {
      return false;
    }
  }

  /**
   * Terminates every backend of the container's database except the caller's own, the way an
   * administrator restart or a failover drops client sessions.
   *
   * @return the number of terminated backends
   */
  public static int terminateOtherBackends(final PostgreSQLContainer<?> postgres)
      throws SQLException {
    try (final var admin =
            DriverManager.getConnection(
                postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        final var stmt = admin.createStatement();
        final var rs =
            stmt.executeQuery(
                """
                SELECT count(pg_terminate_backend(pid)) FROM pg_stat_activity
                WHERE datname = '%s' AND pid <> pg_backend_pid()
                """
                    .formatted(postgres.getDatabaseName()))) {
      rs.next();
      return rs.getInt(1);
    }
  }
}
