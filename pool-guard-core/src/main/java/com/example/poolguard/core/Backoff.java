package com.example.poolguard.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.DoubleSupplier;

/**
 * Backoff state for a single liveness check. Created when the check begins and discarded when it
 * resolves; never shared between connections.
 *
 * <p>Each call to {@link #nextDelay()} grows the interval by a random fraction of itself ({@code
 * backoff += backoff * U}, {@code U} in [0, 1)) and returns it capped at the policy ceiling.
 */
final class Backoff {

  private final GuardPolicy policy;
  private final Clock clock;
  private final DoubleSupplier jitter;
  private final Instant startedAt;

  private double backoffSeconds;
  private int attempts;

  Backoff(final GuardPolicy policy, final Clock clock, final DoubleSupplier jitter) {
    this.policy = policy;
    this.clock = clock;
    this.jitter = jitter;
    this.startedAt = clock.instant();
    this.backoffSeconds = GuardPolicy.toSeconds(policy.initialBackoff());
  }

  /** Wall-clock time since the check started, not since the latest attempt. */
  Duration elapsed() {
    return Duration.between(startedAt, clock.instant());
  }

  /**
   * Advances the backoff interval and returns how long to sleep before the next probe.
   *
   * @return {@code min(backoff, maxBackoff)}
   */
  Duration nextDelay() {
    final var u = jitter.getAsDouble();
    if (u < 0d || u >= 1d) throw new IllegalStateException("jitter must be in [0, 1): " + u);
    // the interval keeps growing past the ceiling, bounded to stay finite
    backoffSeconds = Math.min(backoffSeconds + backoffSeconds * u, Double.MAX_VALUE);
    attempts++;
    if (backoffSeconds >= GuardPolicy.toSeconds(policy.maxBackoff())) return policy.maxBackoff();
    return GuardPolicy.seconds(backoffSeconds);
  }

  int attempts() {
    return attempts;
  }
}
