package com.shelfscan.exception;

/** An operation was attempted in a state that does not allow it. */
public class StateException extends ShelfScanException {
  public StateException(String message) {
    super(ShelfScanErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(ShelfScanErrorCode.STATE_ERROR, message, cause);
  }
}
