package com.example.poolguard.core.jdbc;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import javax.sql.DataSource;

/**
 * Opens physical JDBC connections for a {@link GuardedConnectionPool}. Implementations should not
 * pool themselves; the guarded pool owns reuse.
 */
@FunctionalInterface
public interface PhysicalConnectionSource {

  /**
   * Opens a new physical connection.
   *
   * @return a new connection
   * @throws SQLException if the database cannot be reached
   */
  Connection open() throws SQLException;

  /**
   * Opens connections through a non-pooling {@link DataSource}.
   *
   * @param dataSource the data source
   * @return source delegating to {@link DataSource#getConnection()}
   */
  static PhysicalConnectionSource of(final DataSource dataSource) {
    return dataSource::getConnection;
  }

  /**
   * Opens connections through {@link DriverManager}.
   *
   * @param jdbcUrl JDBC URL
   * @param username user name
   * @param password password
   * @return source delegating to {@link DriverManager#getConnection(String, String, String)}
   */
  static PhysicalConnectionSource of(
      final String jdbcUrl, final String username, final String password) {
    return () -> DriverManager.getConnection(jdbcUrl, username, password);
  }
}
