package com.example.poolguard.core;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;

import com.example.poolguard.core.jdbc.CheckoutProxy;
import com.example.poolguard.core.jdbc.ConnectionRecord;
import com.example.poolguard.core.jdbc.DatabaseAccessException;
import com.example.poolguard.core.jdbc.DisconnectionException;
import com.example.poolguard.core.jdbc.GuardedConnectionPool;
import com.example.poolguard.core.jdbc.PoolLifecycleListener;
import com.example.poolguard.core.jdbc.PooledConnection;
import java.lang.System.Logger;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Lifecycle guard for a {@link GuardedConnectionPool}.
 *
 * <ul>
 *   <li><b>connect</b>: stamps each new physical connection with the identity of the process that
 *       opened it.
 *   <li><b>acquire</b>: pings the connection before handing it out. A connection the pool reports
 *       as invalidated is re-established with truncated exponential backoff and jitter until {@link
 *       GuardPolicy#reconnectTimeout()} has elapsed since the first ping; any other database error
 *       fails the acquisition immediately. Sub-connections are not pinged.
 *   <li><b>checkout</b>: rejects connections established by another process, clearing the handle
 *       so neither the pool nor the caller can use the inherited socket.
 * </ul>
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var pool = GuardedConnectionPool.builder().source(source).build();
 * PoolGuard.install(pool, GuardPolicy.withTimeout(Duration.ofSeconds(300)));
 * }</pre>
 *
 * <h2>Full Configuration</h2>
 *
 * <pre>{@code
 * PoolGuard.builder()
 *     .policy(GuardPolicy.fromEnvironment())
 *     .logger(System.getLogger("db.pool"))
 *     .processIdentity(() -> workerId)
 *     .build()
 *     .installOn(pool);
 * }</pre>
 *
 * <p>All callbacks run synchronously on the pool's calling thread. The only blocking step is the
 * sleep between pings, which lasts at most {@link GuardPolicy#maxBackoff()} per attempt.
 */
public final class PoolGuard implements PoolLifecycleListener {

  /** Key under which the owner process identifier is stored in {@link ConnectionRecord#info()}. */
  public static final String OWNER_KEY = "pid";

  static final String PING_QUERY = "SELECT 1";

  private final GuardPolicy policy;
  private final Logger logger;
  private final Clock clock;
  private final Sleeper sleeper;
  private final DoubleSupplier jitter;
  private final ProcessIdentity processIdentity;

  private PoolGuard(final Builder builder) {
    this.policy = builder.policy;
    this.logger = builder.logger;
    this.clock = builder.clock;
    this.sleeper = builder.sleeper;
    this.jitter = builder.jitter;
    this.processIdentity = builder.processIdentity;
  }

  /**
   * Creates a guard with default collaborators and registers it on the pool.
   *
   * @param pool the pool to guard
   * @param policy reconnect policy
   * @return the installed guard
   */
  public static PoolGuard install(final GuardedConnectionPool pool, final GuardPolicy policy) {
    return builder().policy(policy).build().installOn(pool);
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link PoolGuard}. */
  public static class Builder {
    private GuardPolicy policy;
    private Logger logger = System.getLogger(PoolGuard.class.getName());
    private Clock clock = Clock.systemUTC();
    private Sleeper sleeper = Sleeper.threadSleeper();
    private DoubleSupplier jitter = () -> ThreadLocalRandom.current().nextDouble();
    private ProcessIdentity processIdentity = ProcessIdentity.operatingSystemProcess();

    private Builder() {}

    /**
     * Sets the reconnect policy (required).
     *
     * @param policy the policy
     * @return this builder
     */
    public Builder policy(final GuardPolicy policy) {
      this.policy = policy;
      return this;
    }

    /**
     * Sets the logger used for reconnect warnings and fatal errors.
     *
     * <p>Default: {@code System.getLogger(PoolGuard.class.getName())}
     *
     * @param logger the logger
     * @return this builder
     */
    public Builder logger(final Logger logger) {
      this.logger = logger;
      return this;
    }

    /**
     * Sets the clock used to measure elapsed reconnect time.
     *
     * <p>Default: {@link Clock#systemUTC()}
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets how the guard waits between pings.
     *
     * <p>Default: {@link Sleeper#threadSleeper()}
     *
     * @param sleeper the sleeper
     * @return this builder
     */
    public Builder sleeper(final Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * Sets the source of jitter values, which must lie in [0, 1).
     *
     * <p>Default: {@link ThreadLocalRandom#nextDouble()}
     *
     * @param jitter the jitter source
     * @return this builder
     */
    public Builder jitter(final DoubleSupplier jitter) {
      this.jitter = jitter;
      return this;
    }

    /**
     * Sets how the current process is identified.
     *
     * <p>Default: {@link ProcessIdentity#operatingSystemProcess()}
     *
     * @param processIdentity the identity
     * @return this builder
     */
    public Builder processIdentity(final ProcessIdentity processIdentity) {
      this.processIdentity = processIdentity;
      return this;
    }

    /**
     * Builds the guard.
     *
     * @return configured guard
     * @throws IllegalStateException if required fields are not set
     */
    public PoolGuard build() {
      if (policy == null) throw new IllegalStateException("policy is required");
      if (logger == null) throw new IllegalStateException("logger cannot be null");
      if (clock == null) throw new IllegalStateException("clock cannot be null");
      if (sleeper == null) throw new IllegalStateException("sleeper cannot be null");
      if (jitter == null) throw new IllegalStateException("jitter cannot be null");
      if (processIdentity == null)
        throw new IllegalStateException("processIdentity cannot be null");
      return new PoolGuard(this);
    }
  }

  /**
   * Registers this guard on the pool.
   *
   * @param pool the pool to guard
   * @return this guard
   */
  public PoolGuard installOn(final GuardedConnectionPool pool) {
    pool.addListener(this);
    return this;
  }

  /**
   * Returns the reconnect policy this guard applies.
   *
   * @return the policy
   */
  public GuardPolicy policy() {
    return policy;
  }

  @Override
  public void onConnect(final ConnectionRecord record) {
    record.info().put(OWNER_KEY, processIdentity.currentId());
  }

  @Override
  public void onAcquire(final PooledConnection connection, final boolean subConnection)
      throws SQLException {
    // branches share the parent's already validated connection
    if (subConnection) return;

    final var backoff = new Backoff(policy, clock, jitter);
    final var savedCloseWithResult = connection.isCloseWithResult();

    while (true) {
      // a connection that closes with its result would tear itself down after the ping
      connection.setCloseWithResult(false);
      try {
        connection.scalar(PING_QUERY);
        return;
      } catch (final DatabaseAccessException e) {
        if (!e.isConnectionInvalidated()) {
          logger.log(ERROR, "Unknown database connection error. Not retrying", e);
          throw e;
        }

        final var elapsed = backoff.elapsed();
        if (elapsed.compareTo(policy.reconnectTimeout()) >= 0) {
          logger.log(
              ERROR,
              () ->
                  "Failed to re-establish DB connection within %s secs (elapsed %s secs)"
                      .formatted(
                          GuardPolicy.toSeconds(policy.reconnectTimeout()),
                          GuardPolicy.toSeconds(elapsed)),
              e);
          throw new ReconnectTimeoutException(policy.reconnectTimeout(), elapsed, e);
        }

        logger.log(WARNING, "DB connection invalidated. Reconnecting...");
        pause(backoff);
      } finally {
        connection.setCloseWithResult(savedCloseWithResult);
      }
    }
  }

  @Override
  public void onCheckout(final ConnectionRecord record, final CheckoutProxy proxy)
      throws SQLException {
    final var owner = record.info().get(OWNER_KEY);
    final var current = processIdentity.currentId();
    if (Objects.equals(owner, current)) return;

    record.clearConnection();
    proxy.clearConnection();

    final var ownerId = owner == null ? null : owner.toString();
    logger.log(
        ERROR,
        "Connection record {0} belongs to pid {1}, refusing checkout in pid {2}",
        record.id(),
        ownerId,
        current);
    throw new DisconnectionException(ownerId, current);
  }

  private void pause(final Backoff backoff) throws SQLException {
    final var delay = backoff.nextDelay();
    try {
      sleeper.sleep(delay);
    } catch (final InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new SQLTransientConnectionException(
          "Interrupted after " + backoff.attempts() + " reconnect attempt(s)", ie);
    }
  }
}
