package com.example.failoverclient.core;

import java.time.Duration;

/** Blocking delay used between reconnect attempts. Replaced in tests. */
@FunctionalInterface
interface Sleeper {

  Sleeper THREAD_SLEEP =
      delay -> {
        if (!delay.isZero()) Thread.sleep(delay.toMillis());
      };

  void sleep(final Duration delay) throws InterruptedException;
}
