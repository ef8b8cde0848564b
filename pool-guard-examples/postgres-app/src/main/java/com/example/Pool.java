package com.example;

import com.example.poolguard.core.jdbc.PhysicalConnectionSource;
import java.util.Optional;
import org.postgresql.ds.PGSimpleDataSource;

public class Pool {

  /** Non-pooling PostgreSQL connection source; the guarded pool on top of it owns reuse. */
  public static PhysicalConnectionSource postgres(
      final String jdbcUrl, final String username, final String password) {
    final var ds = new PGSimpleDataSource();
    ds.setUrl(jdbcUrl);
    ds.setUser(username);
    ds.setPassword(password);
    ds.setApplicationName("pool-guard-postgres-app");
    return PhysicalConnectionSource.of(ds);
  }

  /** Source configured from {@code DB_URL}, {@code DB_USER} and {@code DB_PASSWORD}. */
  public static PhysicalConnectionSource postgresFromEnvironment() {
    return postgres(
        env("DB_URL", "jdbc:postgresql://localhost:5432/postgres"),
        env("DB_USER", "postgres"),
        env("DB_PASSWORD", "postgres"));
  }

  private static String env(final String name, final String fallback) {
    return Optional.ofNullable(System.getenv(name)).filter(s -> !s.isBlank()).orElse(fallback);
  }
}
