package com.shelfscan.stream;

import java.time.Duration;

/** Exponential backoff: {@code base * 2^(failedAttempt-1)}, bounded by a total attempt count. */
public record BackoffPolicy(int maxAttempts, Duration base) {
  public static final BackoffPolicy DEFAULT = new BackoffPolicy(3, Duration.ofSeconds(2));

  public BackoffPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
    }
    if (base == null || base.isNegative()) {
      throw new IllegalArgumentException("base must be a non-negative duration");
    }
  }

  /** Delay to wait after the given (1-based) failed attempt before the next one. */
  public Duration delayAfter(int failedAttempt) {
    int shift = Math.max(0, Math.min(failedAttempt - 1, 20));
    return base.multipliedBy(1L << shift);
  }

  public BackoffPolicy withMaxAttempts(int attempts) {
    return new BackoffPolicy(attempts, base);
  }
}
