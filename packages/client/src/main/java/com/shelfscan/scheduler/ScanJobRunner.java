package com.shelfscan.scheduler;

import com.shelfscan.cooldown.CooldownTracker;
import com.shelfscan.exception.ClientErrorException;
import com.shelfscan.exception.ExceptionUtil;
import com.shelfscan.exception.RateLimitedException;
import com.shelfscan.exception.ScanApiException;
import com.shelfscan.exception.ShelfScanErrorCode;
import com.shelfscan.exception.ShelfScanException;
import com.shelfscan.model.BookMetadata;
import com.shelfscan.model.JobState;
import com.shelfscan.model.ScanJob;
import com.shelfscan.model.ScanOutcome;
import com.shelfscan.model.StreamEvent;
import com.shelfscan.model.SubmitReceipt;
import com.shelfscan.stream.EventStream;
import com.shelfscan.stream.StreamClient;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.apache.commons.lang3.StringUtils;

/**
 * Drives one job from upload to its terminal outcome: submit, record the receipt, consume the event
 * stream, resolve the result list. Runs on a scheduler worker thread.
 */
final class ScanJobRunner implements Runnable {
  private static final org.slf4j.Logger log =
      com.shelfscan.logging.LoggingService.getLogger(ScanJobRunner.class);

  private final ActiveJob active;
  private final ScanJob job;
  private final StreamClient client;
  private final CooldownTracker cooldown;
  private final JobListener listener;
  private final Consumer<ActiveJob> onFinished;
  /** Set once the listener has been told the job's outcome. Worker thread only. */
  private boolean settled;

  ScanJobRunner(
      ActiveJob active,
      StreamClient client,
      CooldownTracker cooldown,
      JobListener listener,
      Consumer<ActiveJob> onFinished) {
    this.active = active;
    this.job = active.job;
    this.client = client;
    this.cooldown = cooldown;
    this.listener = listener;
    this.onFinished = onFinished;
  }

  @Override
  public void run() {
    if (!active.begin()) {
      // cancelAll already reported this job
      return;
    }
    try {
      if (!job.isSubmitted() && !submit()) {
        return;
      }
      if (active.cancelRequested) {
        return;
      }
      notify("onSubmitted", () -> listener.onSubmitted(job));
      stream();
    } catch (RuntimeException e) {
      log.error(
          "Unexpected failure in job {}: {}", job.localId(), ExceptionUtil.formatCompactStackTrace(e));
      terminal(
          ScanOutcome.failed(
              job, ExceptionUtil.extractErrorMessage(e), ShelfScanErrorCode.UNKNOWN.name(), true));
    } finally {
      if (active.cancelRequested) {
        job.state(JobState.CANCELED);
      }
      if (job.claimCleanup()) {
        client.cleanup(job.jobId(), job.authToken());
      }
      if (active.cancelRequested && !settled) {
        notify("onCanceled", () -> listener.onCanceled(job));
      }
      onFinished.accept(active);
    }
  }

  /** Returns true when the job now holds a receipt. */
  private boolean submit() {
    SubmitReceipt receipt;
    try {
      receipt = client.submit(job);
    } catch (RateLimitedException e) {
      cooldown.recordRateLimit(e.retryAfter());
      if (!active.cancelRequested) {
        job.state(JobState.QUEUED);
        settled = true;
        notify("onRateLimited", () -> listener.onRateLimited(job, e.retryAfter()));
      }
      return false;
    } catch (ClientErrorException e) {
      String code = e.problem() == null ? null : e.problem().code();
      terminal(
          ScanOutcome.failed(
              job, e.getMessage(), code != null ? code : e.getCode().name(), false));
      return false;
    } catch (ScanApiException e) {
      if (!active.cancelRequested) {
        job.state(JobState.QUEUED);
        log.info("Upload of {} deferred: {}", job.localId(), e.getMessage());
        settled = true;
        notify("onDeferred", () -> listener.onDeferred(job, e));
      }
      return false;
    }
    job.markSubmitted(receipt);
    return true;
  }

  private void stream() {
    job.state(JobState.STREAMING);
    List<BookMetadata> streamed = new ArrayList<>();
    try (EventStream events = client.consumeStream(job)) {
      active.attach(events);
      while (events.hasNext()) {
        StreamEvent event = events.next();
        if (active.cancelRequested) {
          return;
        }
        if (event instanceof StreamEvent.Completed completed) {
          terminal(ScanOutcome.completed(job, resolveBooks(completed, streamed)));
          return;
        }
        if (event instanceof StreamEvent.Failed failed) {
          terminal(
              ScanOutcome.failed(
                  job, serverErrorReason(failed), failed.code(), failed.retryable()));
          return;
        }
        if (event instanceof StreamEvent.Canceled) {
          terminal(ScanOutcome.canceled(job, "Job canceled by server"));
          return;
        }
        if (event instanceof StreamEvent.BookResult result) {
          streamed.add(result.metadata());
        }
        notify("onEvent", () -> listener.onEvent(job, event));
      }
      if (!active.cancelRequested) {
        terminal(
            ScanOutcome.failed(
                job,
                "Stream ended without a result",
                ShelfScanErrorCode.CONNECTION_FAILURE.name(),
                true));
      }
    } catch (ScanApiException e) {
      if (!active.cancelRequested) {
        // a rejected request will be rejected again; a lost connection may not be
        boolean userRetryable = !(e instanceof ClientErrorException);
        terminal(ScanOutcome.failed(job, e.getMessage(), e.getCode().name(), userRetryable));
      }
    } catch (ShelfScanException e) {
      if (!active.cancelRequested) {
        terminal(ScanOutcome.failed(job, e.getMessage(), e.getCode().name(), false));
      }
    }
  }

  private List<BookMetadata> resolveBooks(
      StreamEvent.Completed completed, List<BookMetadata> streamed) {
    if (completed.hasInlineBooks()) {
      return completed.inlineBooks();
    }
    if (completed.resultsUrl() != null) {
      try {
        return client.fetchResults(completed.resultsUrl(), job);
      } catch (ScanApiException e) {
        log.warn(
            "Results fetch for job {} failed, using {} streamed results: {}",
            job.jobId(),
            streamed.size(),
            e.getMessage());
      }
    }
    return streamed;
  }

  private static String serverErrorReason(StreamEvent.Failed failed) {
    String message = StringUtils.defaultIfBlank(failed.message(), "no details");
    if (StringUtils.isBlank(failed.code())) {
      return "Server error: " + message;
    }
    return "Server error [" + failed.code() + "]: " + message;
  }

    private void terminal(ScanOutcome outcome) {
    if (active.cancelRequested) {
      return;
    }
    job.state(outcome.state());
    settled = true;
    notify("onTerminal", () -> listener.onTerminal(job, outcome));
  }

  private void notify(String callback, Runnable call) {
    try {
      call.run();
    } catch (RuntimeException e) {
      log.warn(
          "Listener {} failed for job {}: {}",
          callback,
          job.localId(),
          ExceptionUtil.extractErrorMessage(e));
    }
  }
}
