package com.example.poolguard.core;

import static java.lang.System.Logger.Level.WARNING;

import java.time.Duration;
import java.util.Optional;

/**
 * Reconnect policy applied by {@link PoolGuard} when a liveness probe finds the connection
 * invalidated.
 *
 * <p>The guard keeps re-probing with a truncated exponential backoff until a probe succeeds or the
 * time elapsed since the <em>first</em> probe reaches {@code reconnectTimeout}.
 *
 * <pre>{@code
 * var policy = GuardPolicy.withTimeout(Duration.ofSeconds(30));
 *
 * var custom = new GuardPolicy(
 *     Duration.ofSeconds(30),
 *     Duration.ofMillis(500),  // first backoff interval
 *     Duration.ofSeconds(10)); // ceiling for a single sleep
 * }</pre>
 *
 * @param reconnectTimeout total time budget for re-establishing the connection, must be >= 0
 * @param initialBackoff first backoff interval before jitter is applied, must be > 0
 * @param maxBackoff ceiling for a single sleep between probes, must be >= initialBackoff
 */
public record GuardPolicy(Duration reconnectTimeout, Duration initialBackoff, Duration maxBackoff) {

  /** Default first backoff interval (0.2 seconds). */
  public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(200);

  /** Default ceiling for a single sleep (120 seconds). */
  public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(120);

  /** Reconnect timeout used by {@link #fromEnvironment()} when none is configured. */
  public static final Duration DEFAULT_RECONNECT_TIMEOUT = Duration.ofSeconds(300);

  private static final System.Logger LOGGER = System.getLogger(GuardPolicy.class.getName());

  /**
   * Validates the policy.
   *
   * @throws IllegalArgumentException if the timeout is negative, the initial backoff is not
   *     positive, or the ceiling is below the initial backoff
   */
  public GuardPolicy {
    if (reconnectTimeout == null || reconnectTimeout.isNegative())
      throw new IllegalArgumentException("reconnectTimeout must be >= 0");
    if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero())
      throw new IllegalArgumentException("initialBackoff must be > 0");
    if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0)
      throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
  }

  /**
   * Creates a policy with the given timeout and the default backoff bounds.
   *
   * @param reconnectTimeout total time budget for re-establishing the connection
   * @return policy with 0.2s initial backoff and a 120s ceiling
   */
  public static GuardPolicy withTimeout(final Duration reconnectTimeout) {
    return new GuardPolicy(reconnectTimeout, DEFAULT_INITIAL_BACKOFF, DEFAULT_MAX_BACKOFF);
  }

  /**
   * Creates a policy from fractional second values.
   *
   * @param reconnectTimeoutSeconds total time budget in seconds
   * @param initialBackoffSeconds first backoff interval in seconds
   * @param maxBackoffSeconds ceiling for a single sleep in seconds
   * @return policy
   */
  public static GuardPolicy ofSeconds(
      final double reconnectTimeoutSeconds,
      final double initialBackoffSeconds,
      final double maxBackoffSeconds) {
    return new GuardPolicy(
        seconds(reconnectTimeoutSeconds),
        seconds(initialBackoffSeconds),
        seconds(maxBackoffSeconds));
  }

  /**
   * Reads the policy from system properties, falling back to environment variables:
   *
   * <ul>
   *   <li>poolguard.reconnect.timeout.seconds / POOLGUARD_RECONNECT_TIMEOUT_SECONDS (default 300)
   *   <li>poolguard.initial.backoff.seconds / POOLGUARD_INITIAL_BACKOFF_SECONDS (default 0.2)
   *   <li>poolguard.max.backoff.seconds / POOLGUARD_MAX_BACKOFF_SECONDS (default 120)
   * </ul>
   *
   * @return policy built from the environment
   */
  public static GuardPolicy fromEnvironment() {
    return ofSeconds(
        readSeconds(
            "poolguard.reconnect.timeout.seconds",
            "POOLGUARD_RECONNECT_TIMEOUT_SECONDS",
            DEFAULT_RECONNECT_TIMEOUT),
        readSeconds(
            "poolguard.initial.backoff.seconds",
            "POOLGUARD_INITIAL_BACKOFF_SECONDS",
            DEFAULT_INITIAL_BACKOFF),
        readSeconds(
            "poolguard.max.backoff.seconds", "POOLGUARD_MAX_BACKOFF_SECONDS", DEFAULT_MAX_BACKOFF));
  }

  static Duration seconds(final double seconds) {
    if (Double.isNaN(seconds) || Double.isInfinite(seconds))
      throw new IllegalArgumentException("seconds must be finite: " + seconds);
    return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
  }

  static double toSeconds(final Duration duration) {
    return duration.toNanos() / 1_000_000_000d;
  }

  private static double readSeconds(
      final String property, final String envVar, final Duration fallback) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(envVar)))
        .filter(val -> !val.isBlank())
        .map(String::trim)
        .flatMap(
            val -> {
              try {
                return Optional.of(Double.parseDouble(val));
              } catch (final NumberFormatException e) {
                LOGGER.log(WARNING, "Ignoring unparseable value {0} for {1}", val, property);
                return Optional.empty();
              }
            })
        .orElse(toSeconds(fallback));
  }
}
