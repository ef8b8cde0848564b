package com.example.poolguard.core;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/** Blocks the calling thread between liveness probes. */
@FunctionalInterface
public interface Sleeper {

  /**
   * Sleeps for the given duration.
   *
   * @param duration how long to block
   * @throws InterruptedException if the thread is interrupted while sleeping
   */
  void sleep(final Duration duration) throws InterruptedException;

  /**
   * Returns a sleeper backed by the calling thread.
   *
   * @return thread sleeper
   */
  static Sleeper threadSleeper() {
    return duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());
  }
}
