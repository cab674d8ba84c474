package com.example.failoverclient.core;

import java.sql.SQLException;
import java.time.Duration;

/**
 * Callbacks for the reconnection protocol of {@link ResilientClient}, for metrics or custom
 * diagnostics. All methods default to no-ops; attempt numbers are 1-based.
 *
 * <p>Listeners run on the calling thread. An exception thrown by a listener is logged and ignored.
 */
public interface FailoverListener {

  /** Listener that does nothing. */
  FailoverListener NO_OP = new FailoverListener() {};

  /**
   * Invoked before sleeping ahead of a reconnect attempt.
   *
   * @param errorClass class of the error that triggered the protocol
   * @param attempt the upcoming attempt
   * @param delay computed backoff delay
   */
  default void beforeBackoff(ErrorClass errorClass, int attempt, Duration delay) {}

  /**
   * Invoked when a reconnect attempt failed to connect or failed verification.
   *
   * @param errorClass class of the error that triggered the protocol
   * @param attempt the failed attempt
   * @param cause why the attempt failed
   */
  default void attemptFailed(ErrorClass errorClass, int attempt, SQLException cause) {}

  /**
   * Invoked when the protocol reached a healthy connection.
   *
   * @param errorClass class of the error that triggered the protocol
   * @param attempts number of attempts used
   */
  default void recovered(ErrorClass errorClass, int attempts) {}

  /**
   * Invoked when the attempt budget ran out or the protocol was interrupted.
   *
   * @param errorClass class of the error that triggered the protocol
   * @param attempts number of attempts made
   * @param original the error that will be rethrown to the caller
   */
  default void exhausted(ErrorClass errorClass, int attempts, SQLException original) {}

  /**
   * Invoked when a read-only error closed the session instead of reconnecting.
   *
   * @param original the error that will be rethrown to the caller
   */
  default void disconnected(SQLException original) {}
}
