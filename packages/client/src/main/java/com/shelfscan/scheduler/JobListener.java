package com.shelfscan.scheduler;

import com.shelfscan.model.ScanJob;
import com.shelfscan.model.ScanOutcome;
import com.shelfscan.model.StreamEvent;
import java.time.Duration;

/**
 * Receives what happens to scheduled jobs. Callbacks run on the job's worker thread; for one job
 * they arrive in order, across jobs there is no ordering. A canceled job produces exactly one
 * {@link #onCanceled} and nothing after it.
 */
public interface JobListener {

  /** The server accepted the upload; {@link ScanJob#jobId()} is now set. */
  default void onSubmitted(ScanJob job) {}

  /** A non-terminal stream event. */
  default void onEvent(ScanJob job, StreamEvent event) {}

  /** The job finished. Delivered at most once per job by the scheduler. */
  void onTerminal(ScanJob job, ScanOutcome outcome);

  /**
   * Submit was answered with 429. The cooldown has already been recorded; the job was not
   * submitted and should be kept for later.
   */
  void onRateLimited(ScanJob job, Duration retryAfter);

  /** Submit failed for a transient reason (offline, 5xx). The job should be kept for later. */
  void onDeferred(ScanJob job, Throwable cause);

  /**
   * The job was canceled locally before reporting any other outcome. Called from {@code cancelAll}
   * for jobs that never ran, otherwise from the worker once it has stopped. {@link
   * ScanJob#isSubmitted()} tells whether the server saw the upload.
   */
  default void onCanceled(ScanJob job) {}
}
