package com.shelfscan.stream;

import java.time.Duration;

/** Waits between reconnection attempts. Replaced in tests to observe backoff without sleeping. */
@FunctionalInterface
public interface Sleeper {
  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
