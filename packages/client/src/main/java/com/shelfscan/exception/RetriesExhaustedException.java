package com.shelfscan.exception;

/** The stream could not be kept open for the configured number of attempts. */
public class RetriesExhaustedException extends ScanApiException {
  private final int attempts;

  public RetriesExhaustedException(int attempts, Throwable lastFailure) {
    super(
        ShelfScanErrorCode.RETRIES_EXHAUSTED,
        0,
        "Stream connection lost after "
            + attempts
            + " attempts: "
            + ExceptionUtil.extractErrorMessage(lastFailure),
        lastFailure);
    this.attempts = attempts;
  }

  public int attempts() {
    return attempts;
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}
