package com.shelfscan.model;

/** Lifecycle state of a scan job. */
public enum JobState {
  /** Created, waiting for a stream slot or for submission. */
  QUEUED,
  /** Submit accepted; job id and token assigned. */
  SUBMITTED,
  /** Stream open, events being consumed. */
  STREAMING,
  /** Terminal: results delivered. */
  COMPLETED,
  /** Terminal: permanent failure. */
  FAILED,
  /** Terminal: canceled by the server or by tearing down the client. */
  CANCELED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELED;
  }
}
