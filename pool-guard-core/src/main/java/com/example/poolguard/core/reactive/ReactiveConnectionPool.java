package com.example.poolguard.core.reactive;

import com.example.poolguard.core.jdbc.GuardedConnectionPool;
import com.example.poolguard.core.jdbc.PooledConnection;
import com.example.poolguard.core.jdbc.PooledConnection.JdbcWork;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Non-blocking facade over a {@link GuardedConnectionPool}.
 *
 * <p>Acquisition may block for a long time while a guard waits out its reconnect backoff, so every
 * call is moved to a scheduler meant for blocking work ({@link Schedulers#boundedElastic()} by
 * default).
 *
 * <pre>{@code
 * var reactivePool = new ReactiveConnectionPool(pool);
 *
 * Mono<Object> now = reactivePool.withConnection(conn -> {
 *     try (var stmt = conn.createStatement(); var rs = stmt.executeQuery("SELECT NOW()")) {
 *         rs.next();
 *         return rs.getObject(1);
 *     }
 * });
 * }</pre>
 */
public final class ReactiveConnectionPool {

  private final GuardedConnectionPool pool;
  private final Scheduler scheduler;

  /**
   * Creates a facade that acquires on {@link Schedulers#boundedElastic()}.
   *
   * @param pool the pool to acquire from
   */
  public ReactiveConnectionPool(final GuardedConnectionPool pool) {
    this(pool, Schedulers.boundedElastic());
  }

  /**
   * Creates a facade that acquires on the given scheduler.
   *
   * @param pool the pool to acquire from
   * @param scheduler scheduler for blocking acquisition and work
   * @throws IllegalArgumentException if either argument is null
   */
  public ReactiveConnectionPool(final GuardedConnectionPool pool, final Scheduler scheduler) {
    if (pool == null) throw new IllegalArgumentException("pool cannot be null");
    if (scheduler == null) throw new IllegalArgumentException("scheduler cannot be null");
    this.pool = pool;
    this.scheduler = scheduler;
  }

  /**
   * Acquires a connection. The subscriber owns the emitted connection and must close it; a
   * connection discarded by a cancelled or filtering pipeline is closed and returned to the pool.
   * Prefer {@link #withConnection(JdbcWork)} when the work fits in one callback.
   *
   * @return a Mono emitting the acquired connection
   */
  public Mono<PooledConnection> acquire() {
    return Mono.fromCallable(pool::connect)
        .doOnDiscard(PooledConnection.class, PooledConnection::close)
        .subscribeOn(scheduler);
  }

  /**
   * Acquires a connection, runs the work on it and returns it to the pool once the work succeeds,
   * fails or is cancelled.
   *
   * @param work the JDBC work
   * @param <T> result type
   * @return a Mono emitting the work result, empty if the work returned null
   */
  public <T> Mono<T> withConnection(final JdbcWork<T> work) {
    return Mono.using(
            pool::connect,
            conn -> Mono.fromCallable(() -> conn.execute(work)),
            PooledConnection::close)
        .subscribeOn(scheduler);
  }
}
