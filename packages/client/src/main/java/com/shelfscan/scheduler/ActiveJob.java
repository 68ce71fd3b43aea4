package com.shelfscan.scheduler;

import com.shelfscan.model.ScanJob;
import com.shelfscan.stream.EventStream;
import java.util.concurrent.Future;

/** Scheduler bookkeeping for one running job. */
final class ActiveJob {
  final ScanJob job;
  final long startedNanos = System.nanoTime();
  volatile Future<?> future;
  volatile boolean cancelRequested;
  private boolean started;
  private EventStream stream;

  ActiveJob(ScanJob job) {
    this.job = job;
  }

  /** Attach the open stream. Closes it right away if the job was canceled meanwhile. */
  synchronized void attach(EventStream eventStream) {
    this.stream = eventStream;
    if (cancelRequested) {
      eventStream.close();
    }
  }

  /** Called by the worker before any work. Returns false if the job was canceled first. */
  synchronized boolean begin() {
    if (cancelRequested) {
      return false;
    }
    started = true;
    return true;
  }

  /**
   * Request cancellation.
   *
   * @return true if the worker had already begun; it then reports the cancellation itself
   */
  synchronized boolean cancel() {
    cancelRequested = true;
    if (stream != null) {
      stream.close();
    }
    if (future != null) {
      future.cancel(true);
    }
    return started;
  }

  long elapsedMillis() {
    return (System.nanoTime() - startedNanos) / 1_000_000;
  }
}
