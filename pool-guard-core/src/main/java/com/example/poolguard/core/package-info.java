/**
 * Root package for the pool-guard library.
 *
 * <p>This package contains {@link com.example.poolguard.core.PoolGuard}, a lifecycle listener that
 * keeps a {@link com.example.poolguard.core.jdbc.GuardedConnectionPool} from handing out dead
 * connections or connections inherited from another process.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.poolguard.core.PoolGuard} – pings on acquire, reconnects with backoff,
 *       enforces process affinity on checkout.
 *   <li>{@link com.example.poolguard.core.GuardPolicy} – reconnect timeout and backoff bounds,
 *       optionally read from system properties or environment variables.
 *   <li>{@link com.example.poolguard.core.ReconnectTimeoutException} – raised when a connection
 *       stays invalidated for the whole reconnect timeout.
 *   <li>{@link com.example.poolguard.core.ProcessIdentity} and {@link
 *       com.example.poolguard.core.Sleeper} – seams for the process identifier and the backoff
 *       sleep.
 *   <li>{@link com.example.poolguard.core.jdbc} – the pool, its records, and its lifecycle
 *       extension points.
 *   <li>{@link com.example.poolguard.core.reactive} – Reactor facade for non-blocking acquisition.
 * </ul>
 *
 * <p>Thread-safety: the guard keeps no mutable state between callbacks. Backoff state lives on the
 * stack of the acquiring thread.
 */
package com.example.poolguard.core;
