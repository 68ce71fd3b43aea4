package com.shelfscan.exception;

/** A stream record whose payload does not match its event name. Logged and skipped. */
public class MalformedEventException extends ShelfScanException {
  public MalformedEventException(String eventName, String message) {
    super(ShelfScanErrorCode.MALFORMED_EVENT, "Malformed '" + eventName + "' event: " + message);
  }

  public MalformedEventException(String eventName, String message, Throwable cause) {
    super(
        ShelfScanErrorCode.MALFORMED_EVENT,
        "Malformed '" + eventName + "' event: " + message,
        cause);
  }
}
