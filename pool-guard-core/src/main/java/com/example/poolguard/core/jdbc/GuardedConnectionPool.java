package com.example.poolguard.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import java.lang.System.Logger;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-size JDBC connection pool that exposes its lifecycle to {@link PoolLifecycleListener}s.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var pool = GuardedConnectionPool.builder()
 *     .source(PhysicalConnectionSource.of(jdbcUrl, user, password))
 *     .maxSize(10)
 *     .build();
 * PoolGuard.install(pool, GuardPolicy.withTimeout(Duration.ofSeconds(30)));
 *
 * try (var conn = pool.connect()) {
 *     var now = conn.scalar("SELECT NOW()");
 * }
 * }</pre>
 *
 * <h2>Disconnect handling</h2>
 *
 * <p>When work on a {@link PooledConnection} fails with an error the {@link DisconnectDetector}
 * classifies as a disconnect, the pool closes that physical connection and bumps its invalidation
 * epoch: every record established before that moment is re-established the next time it is used.
 */
public final class GuardedConnectionPool implements AutoCloseable {

  private static final Logger logger = System.getLogger(GuardedConnectionPool.class.getName());

  /** Checkout attempts per {@link #connect()} when listeners keep raising disconnections. */
  static final int MAX_CHECKOUT_ATTEMPTS = 3;

  private final PhysicalConnectionSource source;
  private final DisconnectDetector disconnectDetector;
  private final int maxSize;
  private final Duration checkoutTimeout;

  private final List<PoolLifecycleListener> listeners = new CopyOnWriteArrayList<>();
  private final AtomicLong epoch = new AtomicLong();
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition available = lock.newCondition();
  private final Deque<ConnectionRecord> idle = new ArrayDeque<>();
  private final List<ConnectionRecord> all = new ArrayList<>();

  private boolean closed;

  private GuardedConnectionPool(final Builder builder) {
    this.source = builder.source;
    this.disconnectDetector = builder.disconnectDetector;
    this.maxSize = builder.maxSize;
    this.checkoutTimeout = builder.checkoutTimeout;
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link GuardedConnectionPool}. */
  public static class Builder {
    private PhysicalConnectionSource source;
    private DisconnectDetector disconnectDetector = DisconnectDetector.defaultDetector();
    private int maxSize = 10;
    private Duration checkoutTimeout = Duration.ofSeconds(30);

    private Builder() {}

    /**
     * Sets the source of physical connections (required).
     *
     * @param source the connection source
     * @return this builder
     */
    public Builder source(final PhysicalConnectionSource source) {
      this.source = source;
      return this;
    }

    /**
     * Sets the detector deciding which driver errors invalidate a connection.
     *
     * <p>Default: {@link DisconnectDetector#defaultDetector()}
     *
     * @param disconnectDetector the detector
     * @return this builder
     */
    public Builder disconnectDetector(final DisconnectDetector disconnectDetector) {
      this.disconnectDetector = disconnectDetector;
      return this;
    }

    /**
     * Sets the maximum number of physical connections.
     *
     * <p>Default: 10
     *
     * @param maxSize maximum pool size
     * @return this builder
     */
    public Builder maxSize(final int maxSize) {
      this.maxSize = maxSize;
      return this;
    }

    /**
     * Sets how long {@link #connect()} waits for a record when the pool is exhausted.
     *
     * <p>Default: 30 seconds
     *
     * @param checkoutTimeout maximum wait
     * @return this builder
     */
    public Builder checkoutTimeout(final Duration checkoutTimeout) {
      this.checkoutTimeout = checkoutTimeout;
      return this;
    }

    /**
     * Builds the pool. No connection is opened until the first {@link #connect()}.
     *
     * @return configured pool
     * @throws IllegalStateException if required fields are not set
     */
    public GuardedConnectionPool build() {
      if (source == null) throw new IllegalStateException("source is required");
      if (disconnectDetector == null)
        throw new IllegalStateException("disconnectDetector cannot be null");
      if (maxSize < 1) throw new IllegalArgumentException("maxSize must be >= 1");
      if (checkoutTimeout == null || checkoutTimeout.isNegative())
        throw new IllegalArgumentException("checkoutTimeout must be non-negative");
      return new GuardedConnectionPool(this);
    }
  }

  /**
   * Registers a listener for connect, checkout and acquire events.
   *
   * @param listener the listener
   */
  public void addListener(final PoolLifecycleListener listener) {
    if (listener == null) throw new IllegalArgumentException("listener cannot be null");
    listeners.add(listener);
  }

  /**
   * Borrows a connection, establishing or re-establishing it as needed.
   *
   * @return logical connection; close it to return the record
   * @throws SQLException if no connection can be established, checkout is rejected, or a listener
   *     fails the acquisition
   */
  public PooledConnection connect() throws SQLException {
    final var record = borrow();

    try {
      checkout(record);
    } catch (final SQLException | RuntimeException e) {
      release(record);
      throw e;
    }

    final var conn = new PooledConnection(this, record, false);
    try {
      fireAcquire(conn, false);
    } catch (final SQLException | RuntimeException e) {
      conn.close();
      throw e;
    }
    return conn;
  }

  /**
   * Marks every established connection stale. Each is closed and re-established the next time it is
   * checked out; connections currently borrowed keep their physical connection until returned.
   */
  public void invalidateAll() {
    final var current = epoch.incrementAndGet();
    logger.log(
        DEBUG, "Pool invalidated, connections established before epoch {0} are stale", current);
  }

  /**
   * Returns the number of records the pool has created.
   *
   * @return pool size
   */
  public int size() {
    lock.lock();
    try {
      return all.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of records waiting in the pool.
   *
   * @return idle count
   */
  public int idleCount() {
    lock.lock();
    try {
      return idle.size();
    } finally {
      lock.unlock();
    }
  }

  /** Closes every idle connection; records still checked out are closed when released. */
  @Override
  public void close() {
    final List<ConnectionRecord> toClose;
    lock.lock();
    try {
      if (closed) return;
      closed = true;
      toClose = new ArrayList<>(idle);
      idle.clear();
      available.signalAll();
    } finally {
      lock.unlock();
    }
    toClose.forEach(r -> r.invalidate("pool closed"));
    logger.log(DEBUG, "Pool closed");
  }

  PhysicalConnectionSource source() {
    return source;
  }

  long epoch() {
    return epoch.get();
  }

  void fireConnect(final ConnectionRecord record) {
    for (final var listener : listeners) listener.onConnect(record);
  }

  void fireAcquire(final PooledConnection conn, final boolean subConnection)
      throws SQLException {
    for (final var listener : listeners) listener.onAcquire(conn, subConnection);
  }

  DatabaseAccessException handleDbError(final SQLException e, final ConnectionRecord record) {
    if (e instanceof DatabaseAccessException dae) return dae;

    final var invalidated = disconnectDetector.isDisconnect(e);
    if (invalidated) {
      logger.log(DEBUG, "Disconnect detected on {0}: {1}", record, e.getMessage());
      record.invalidate(e.getMessage());
      invalidateAll();
    }
    return new DatabaseAccessException(e.getMessage(), e, invalidated);
  }

  void release(final ConnectionRecord record) {
    lock.lock();
    try {
      if (!closed) {
        idle.push(record);
        available.signal();
        return;
      }
    } finally {
      lock.unlock();
    }
    record.invalidate("pool closed");
  }

  private void checkout(final ConnectionRecord record) throws SQLException {
    DisconnectionException last = null;
    for (var attempt = 1; attempt <= MAX_CHECKOUT_ATTEMPTS; attempt++) {
      record.ensureConnected();
      final var proxy = new CheckoutProxy(record.connection());
      try {
        for (final var listener : listeners) listener.onCheckout(record, proxy);
        return;
      } catch (final DisconnectionException e) {
        logger.log(
            DEBUG, "Checkout of {0} rejected on attempt {1}: {2}", record, attempt, e.getMessage());
        record.invalidate(e.getMessage());
        last = e;
      }
    }
    throw last;
  }

  private ConnectionRecord borrow() throws SQLException {
    final var deadline = System.nanoTime() + checkoutTimeout.toNanos();
    lock.lock();
    try {
      while (true) {
        if (closed) throw new SQLException("Pool is closed");

        final var record = idle.poll();
        if (record != null) return record;

        if (all.size() < maxSize) {
          final var created = new ConnectionRecord(this, all.size() + 1);
          all.add(created);
          logger.log(DEBUG, "Created {0}, pool size {1}", created, all.size());
          return created;
        }

        final var remaining = deadline - System.nanoTime();
        if (remaining <= 0L) {
          logger.log(
              WARNING, "Pool exhausted, no connection available within {0}", checkoutTimeout);
          throw new SQLTransientConnectionException(
              "Timed out after " + checkoutTimeout.toMillis() + "ms waiting for a connection");
        }
        try {
          available.awaitNanos(remaining);
        } catch (final InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new SQLTransientConnectionException("Interrupted waiting for a connection", e);
        }
      }
    } finally {
      lock.unlock();
    }
  }
}
