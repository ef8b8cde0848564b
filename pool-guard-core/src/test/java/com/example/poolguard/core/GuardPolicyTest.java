package com.example.poolguard.core;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.*;

public class GuardPolicyTest {

  @AfterEach
  void clearProperties() {
    System.clearProperty("poolguard.reconnect.timeout.seconds");
    System.clearProperty("poolguard.initial.backoff.seconds");
    System.clearProperty("poolguard.max.backoff.seconds");
  }

  @Nested
  @DisplayName("Validation")
  class Validation {

    @Test
    @DisplayName("Should reject a negative reconnect timeout")
    void shouldRejectNegativeTimeout() {
      assertThrows(
          IllegalArgumentException.class, () -> GuardPolicy.withTimeout(Duration.ofSeconds(-1)));
    }

    @Test
    @DisplayName("Should reject a zero initial backoff")
    void shouldRejectZeroInitialBackoff() {
      assertThrows(
          IllegalArgumentException.class,
          () -> new GuardPolicy(Duration.ofSeconds(1), Duration.ZERO, Duration.ofSeconds(1)));
    }

    @Test
    @DisplayName("Should reject a ceiling below the initial backoff")
    void shouldRejectCeilingBelowInitial() {
      assertThrows(IllegalArgumentException.class, () -> GuardPolicy.ofSeconds(10, 1, 0.5));
    }

    @Test
    @DisplayName("Should reject non-finite seconds")
    void shouldRejectNonFiniteSeconds() {
      assertThrows(
          IllegalArgumentException.class, () -> GuardPolicy.ofSeconds(Double.NaN, 0.2, 120));
    }

    @Test
    @DisplayName("Should accept a zero reconnect timeout")
    void shouldAcceptZeroTimeout() {
      assertDoesNotThrow(() -> GuardPolicy.withTimeout(Duration.ZERO));
    }
  }

  @Nested
  @DisplayName("Defaults")
  class Defaults {

    @Test
    @DisplayName("Should default to 0.2s initial backoff and a 120s ceiling")
    void shouldUseDefaultBackoffBounds() {
      final var policy = GuardPolicy.withTimeout(Duration.ofSeconds(30));

      assertEquals(Duration.ofSeconds(30), policy.reconnectTimeout());
      assertEquals(Duration.ofMillis(200), policy.initialBackoff());
      assertEquals(Duration.ofSeconds(120), policy.maxBackoff());
    }

    @Test
    @DisplayName("Should convert fractional seconds")
    void shouldConvertFractionalSeconds() {
      final var policy = GuardPolicy.ofSeconds(1.5, 0.25, 2);

      assertEquals(Duration.ofMillis(1500), policy.reconnectTimeout());
      assertEquals(Duration.ofMillis(250), policy.initialBackoff());
      assertEquals(Duration.ofSeconds(2), policy.maxBackoff());
    }
  }

  @Nested
  @DisplayName("Environment Configuration")
  class EnvironmentConfiguration {

    @Test
    @DisplayName("Should read values from system properties")
    void shouldReadSystemProperties() {
      System.setProperty("poolguard.reconnect.timeout.seconds", "45");
      System.setProperty("poolguard.initial.backoff.seconds", "0.5");
      System.setProperty("poolguard.max.backoff.seconds", " 30 ");

      final var policy = GuardPolicy.fromEnvironment();

      assertEquals(Duration.ofSeconds(45), policy.reconnectTimeout());
      assertEquals(Duration.ofMillis(500), policy.initialBackoff());
      assertEquals(Duration.ofSeconds(30), policy.maxBackoff());
    }

    @Test
    @DisplayName("Should fall back to defaults for unparseable values")
    void shouldFallBackOnGarbage() {
      Assumptions.assumeTrue(System.getenv("POOLGUARD_RECONNECT_TIMEOUT_SECONDS") == null);
      System.setProperty("poolguard.reconnect.timeout.seconds", "soon");

      final var policy = GuardPolicy.fromEnvironment();

      assertEquals(GuardPolicy.DEFAULT_RECONNECT_TIMEOUT, policy.reconnectTimeout());
    }

    @Test
    @DisplayName("Should use defaults when nothing is configured")
    void shouldUseDefaultsWhenUnset() {
      Assumptions.assumeTrue(System.getenv("POOLGUARD_RECONNECT_TIMEOUT_SECONDS") == null);
      Assumptions.assumeTrue(System.getenv("POOLGUARD_INITIAL_BACKOFF_SECONDS") == null);
      Assumptions.assumeTrue(System.getenv("POOLGUARD_MAX_BACKOFF_SECONDS") == null);

      final var policy = GuardPolicy.fromEnvironment();

      assertEquals(Duration.ofSeconds(300), policy.reconnectTimeout());
      assertEquals(GuardPolicy.DEFAULT_INITIAL_BACKOFF, policy.initialBackoff());
      assertEquals(GuardPolicy.DEFAULT_MAX_BACKOFF, policy.maxBackoff());
    }
  }
}
