package com.example;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.example.poolguard.core.GuardPolicy;
import java.time.Duration;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.condition.DisabledIfSystemProperty;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Integration test that exercises the App end-to-end and verifies it keeps answering after the
 * server drops every pooled session, while reusing a single guarded pool across calls.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@DisabledIfSystemProperty(named = "tests.integration.disable", matches = "true")
public class AppIntegrationTest {

  private static final DockerImageName POSTGRES_IMAGE = DockerImageName.parse("postgres:17");

  private PostgreSQLContainer<?> postgres;
  private App app;

  @BeforeAll
  void setup() {
    assumeTrue(TestSupport.dockerAvailable(), "Docker not available, skipping integration test");

    postgres =
        new PostgreSQLContainer<>(POSTGRES_IMAGE)
            .withDatabaseName("testdb")
            .withUsername("testuser")
            .withPassword("testpass");
    postgres.start();

    app =
        new App(
            Pool.postgres(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword()),
            GuardPolicy.ofSeconds(10, 0.05, 1));
  }

  @AfterAll
  void cleanup() {
    if (app != null) app.shutdown();
    if (postgres != null) postgres.stop();
  }

  /**
   * Integration test for App:
   *
   * <ul>
   *   <li>The first call should succeed.
   *   <li>Terminates the pooled backend from another session.
   *   <li>The next call succeeds on a fresh connection without any retry in App.
   * </ul>
   */
  @Test
  void survivesBackendTermination() throws Exception {
    final var first = app.getString();
    assertNotNull(first);
    assertFalse(first.isBlank());

    assertTrue(TestSupport.terminateOtherBackends(postgres) >= 1);
    // pg_terminate_backend only signals, give the backend a moment to exit
    Thread.sleep(200);

    final var second = app.getString();
    assertNotNull(second);
    assertFalse(second.isBlank());
  }

  @Test
  void reactiveQueryReturnsTime() {
    final var time = app.currentTime().block(Duration.ofSeconds(10));
    assertNotNull(time);
    assertFalse(time.isBlank());
  }
}
