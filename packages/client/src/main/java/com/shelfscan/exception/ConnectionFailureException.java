package com.shelfscan.exception;

/** Transport failure or 5xx response. Always retryable. */
public class ConnectionFailureException extends ScanApiException {
  public ConnectionFailureException(String message, Throwable cause) {
    super(ShelfScanErrorCode.CONNECTION_FAILURE, 0, message, cause);
  }

  public ConnectionFailureException(int statusCode, String message) {
    super(ShelfScanErrorCode.CONNECTION_FAILURE, statusCode, message);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
