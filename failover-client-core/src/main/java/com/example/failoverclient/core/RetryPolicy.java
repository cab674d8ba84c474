package com.example.failoverclient.core;

import java.time.Duration;

/**
 * Reconnection retry policy with linear backoff.
 *
 * <p>The delay before reconnect attempt {@code n} (1-based) is {@code min(step * (n - 1), cap)}.
 * With the defaults (1.5 second step, 10 second cap) attempts 1 to 6 wait 0, 1.5, 3.0, 4.5, 6.0 and
 * 7.5 seconds, and every attempt from the eighth on waits 10 seconds.
 *
 * @param maxRetry maximum number of reconnect attempts, must be >= 0 (0 disables reconnection)
 * @param step delay added per attempt, must be non-negative
 * @param cap upper bound for a single delay, must be >= 0
 */
public record RetryPolicy(int maxRetry, Duration step, Duration cap) {

  /** Default maximum number of reconnect attempts. */
  public static final int DEFAULT_MAX_RETRY = 5;

  /** Default per-attempt backoff step. */
  public static final Duration DEFAULT_STEP = Duration.ofMillis(1_500L);

  /** Default backoff cap. */
  public static final Duration DEFAULT_CAP = Duration.ofSeconds(10L);

  public RetryPolicy {
    if (maxRetry < 0) throw new IllegalArgumentException("maxRetry must be >= 0");
    if (step == null || step.isNegative())
      throw new IllegalArgumentException("step must be non-negative");
    if (cap == null || cap.isNegative())
      throw new IllegalArgumentException("cap must be non-negative");
  }

  /**
   * Creates the default policy: 5 attempts, 1.5 second step, 10 second cap.
   *
   * @return default policy
   */
  public static RetryPolicy defaults() {
    return of(DEFAULT_MAX_RETRY);
  }

  /**
   * Creates a policy with the default backoff and the given attempt budget.
   *
   * @param maxRetry maximum number of reconnect attempts
   * @return retry policy
   */
  public static RetryPolicy of(final int maxRetry) {
    return new RetryPolicy(maxRetry, DEFAULT_STEP, DEFAULT_CAP);
  }

  /**
   * Calculates the delay before the given reconnect attempt.
   *
   * @param attempt reconnect attempt number (1-based)
   * @return delay to wait before the attempt
   * @throws IllegalArgumentException if {@code attempt < 1}
   */
  public Duration backoff(final int attempt) {
    if (attempt < 1) throw new IllegalArgumentException("attempt must be >= 1");

    final var delay = step.multipliedBy(attempt - 1L);
    return delay.compareTo(cap) > 0 ? cap : delay;
  }

  /**
   * Returns whether the given attempt is still within the budget.
   *
   * @param attempt reconnect attempt number (1-based)
   * @return true if {@code attempt <= maxRetry}
   */
  public boolean allows(final int attempt) {
    return attempt <= maxRetry;
  }
}
