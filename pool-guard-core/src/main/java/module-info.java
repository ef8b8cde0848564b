/**
 * Core module for guarding pooled JDBC connections.
 *
 * <p>Provides components for:
 *
 * <ul>
 *   <li>Pinging connections before they are handed out, reconnecting with backoff and jitter
 *   <li>Rejecting connections inherited from another process
 *   <li>A fixed-size JDBC pool exposing connect, checkout and acquire extension points
 *   <li>Non-blocking acquisition on Reactor schedulers
 * </ul>
 */
module com.example.poolguard.core {
  requires java.sql;
  requires org.reactivestreams;
  requires reactor.core;

  exports com.example.poolguard.core;
  exports com.example.poolguard.core.jdbc;
  exports com.example.poolguard.core.reactive;
}
