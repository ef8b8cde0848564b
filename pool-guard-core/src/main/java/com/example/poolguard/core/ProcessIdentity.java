package com.example.poolguard.core;

/**
 * Supplies the identifier of the current execution context. The identifier must stay stable while a
 * connection is reused and differ once the work moves to another process (for example a forked or
 * spawned worker that inherited the pool).
 */
@FunctionalInterface
public interface ProcessIdentity {

  /**
   * Returns the identifier of the calling execution context.
   *
   * @return non-null identifier
   */
  String currentId();

  /**
   * Returns the identity of the running operating system process.
   *
   * @return identity backed by {@link ProcessHandle#pid()}
   */
  static ProcessIdentity operatingSystemProcess() {
    return () -> Long.toString(ProcessHandle.current().pid());
  }
}
