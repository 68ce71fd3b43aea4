package com.shelfscan.exception;

import java.time.Duration;

/** HTTP 429. Never retried locally; the caller escalates to the cooldown tracker. */
public class RateLimitedException extends ScanApiException {
  private final Duration retryAfter;

  public RateLimitedException(Duration retryAfter) {
    super(
        ShelfScanErrorCode.RATE_LIMITED,
        429,
        "Rate limited - retry after " + retryAfter.toSeconds() + "s");
    this.retryAfter = retryAfter;
  }

  public Duration retryAfter() {
    return retryAfter;
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}
