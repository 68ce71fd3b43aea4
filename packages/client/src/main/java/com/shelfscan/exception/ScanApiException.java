package com.shelfscan.exception;

/**
 * Failure talking to the recognition service. Subclasses decide whether the failure may be retried
 * locally.
 */
public abstract class ScanApiException extends ShelfScanException {
  private final int statusCode;

  protected ScanApiException(ShelfScanErrorCode code, int statusCode, String message) {
    super(code, message);
    this.statusCode = statusCode;
  }

  protected ScanApiException(
      ShelfScanErrorCode code, int statusCode, String message, Throwable cause) {
    super(code, message, cause);
    this.statusCode = statusCode;
  }

  /** HTTP status that caused the failure, or 0 when no response was received. */
  public int statusCode() {
    return statusCode;
  }

  public abstract boolean isRetryable();
}
