package com.example.failoverclient.core;

/**
 * Outcome of classifying a driver error.
 *
 * <p>{@link #READ_ONLY_FAILOVER} and {@link #CONNECTION_LOST} are transient and start the
 * reconnection protocol in {@link ResilientClient}; they differ only in how the new connection is
 * verified afterwards.
 */
public enum ErrorClass {

  /** Propagated to the caller immediately. No reconnect is attempted. */
  FATAL,

  /**
   * The node rejected a write because it is not currently the primary. Verified after reconnecting
   * by checking the server's read-only status variable.
   */
  READ_ONLY_FAILOVER,

  /** Network or availability failure. Verified after reconnecting with a ping. */
  CONNECTION_LOST;

  /**
   * Returns whether this class of error triggers the reconnection protocol.
   *
   * @return true for read-only failover and connection-lost errors
   */
  public boolean isTransient() {
    return this != FATAL;
  }
}
