package com.example;

import static java.lang.System.Logger.Level.INFO;

import com.example.poolguard.core.GuardPolicy;
import com.example.poolguard.core.PoolGuard;
import com.example.poolguard.core.jdbc.DbClient;
import com.example.poolguard.core.jdbc.GuardedConnectionPool;
import com.example.poolguard.core.jdbc.PhysicalConnectionSource;
import com.example.poolguard.core.reactive.ReactiveConnectionPool;
import java.sql.Connection;
import java.sql.SQLException;
import reactor.core.publisher.Mono;

/** Demo application showing how to query a database while surviving server restarts. */
public class App {
  private static final String NOW_QUERY = "SELECT NOW()";

  private final GuardedConnectionPool pool;
  private final DbClient client;
  private final ReactiveConnectionPool reactivePool;

  /**
   * Constructs the application with a single guarded pool that is reused for all later calls to
   * {@link #getString()} and {@link #currentTime()}.
   *
   * @param source opens physical connections to the database
   * @param policy reconnect policy for the installed {@link PoolGuard}
   */
  public App(final PhysicalConnectionSource source, final GuardPolicy policy) {
    this.pool = GuardedConnectionPool.builder().source(source).maxSize(10).build();
    PoolGuard.install(pool, policy);
    this.client = new DbClient(pool);
    this.reactivePool = new ReactiveConnectionPool(pool);
  }

  /**
   * Entry point. Builds an App from the {@code DB_*} environment variables and the guard settings
   * read by {@link GuardPolicy#fromEnvironment()}, then prints the DB time.
   *
   * @param args CLI args (unused)
   * @throws Exception on unexpected failures
   */
  public static void main(String[] args) throws Exception {
    final var logger = System.getLogger(App.class.getName());

    final var app = new App(Pool.postgresFromEnvironment(), GuardPolicy.fromEnvironment());
    try {
      logger.log(INFO, "DB Time = {0}", app.getString());
      logger.log(INFO, "DB Time (reactive) = {0}", app.currentTime().block());
    } finally {
      app.shutdown();
    }
  }

  /**
   * Queries the database for the current time. A dead pooled connection is replaced by the guard
   * before the query runs, so callers need no retry of their own.
   *
   * @return the time string returned by the database
   * @throws SQLException if the query fails or the database stays unreachable past the timeout
   */
  public String getString() throws SQLException {
    return client.execute(App::now);
  }

  /**
   * Same query as {@link #getString()} with acquisition moved off the calling thread.
   *
   * @return a Mono emitting the time string
   */
  public Mono<String> currentTime() {
    return reactivePool.withConnection(App::now);
  }

  /** Closes the pool and every idle physical connection. */
  public void shutdown() {
    pool.close();
  }

  private static String now(final Connection conn) throws SQLException {
    try (final var stmt = conn.createStatement();
        var rs = stmt.executeQuery(NOW_QUERY)) {
      rs.next();
      return rs.getString(1);
    }
  }
}
