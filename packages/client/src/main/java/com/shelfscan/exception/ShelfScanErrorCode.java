package com.shelfscan.exception;

/** Stable error codes attached to every {@link ShelfScanException}. */
public enum ShelfScanErrorCode {
  UNKNOWN,
  CONFIG_ERROR,
  STATE_ERROR,
  QUEUE_ERROR,
  /** Could not establish or lost a connection; retried with backoff. */
  CONNECTION_FAILURE,
  /** HTTP 429 from the recognition service. */
  RATE_LIMITED,
  /** 4xx other than 429; never retried. */
  CLIENT_ERROR,
  /** A 2xx response whose body could not be understood. */
  INVALID_RESPONSE,
  /** Connection retries ran out before a terminal event. */
  RETRIES_EXHAUSTED,
  /** A stream record that could not be parsed. */
  MALFORMED_EVENT
}
