package com.shelfscan.exception;

/** Failures reading or writing the durable offline queue. */
public class QueueException extends ShelfScanException {
  public QueueException(String message) {
    super(ShelfScanErrorCode.QUEUE_ERROR, message);
  }

  public QueueException(String message, Throwable cause) {
    super(ShelfScanErrorCode.QUEUE_ERROR, message, cause);
  }
}
