package com.shelfscan.scheduler;

import com.shelfscan.cooldown.CooldownTracker;
import com.shelfscan.exception.ExceptionUtil;
import com.shelfscan.exception.StateException;
import com.shelfscan.model.JobState;
import com.shelfscan.model.ScanJob;
import com.shelfscan.stream.StreamClient;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs scan jobs with a ceiling on concurrently open streams. Jobs over the ceiling wait in a FIFO
 * queue and are promoted as soon as a running job reaches its terminal outcome.
 *
 * <p>All bookkeeping is guarded by one monitor. Network work happens on worker threads, never while
 * holding it.
 */
public final class StreamScheduler {
  private static final org.slf4j.Logger log =
      com.shelfscan.logging.LoggingService.getLogger(StreamScheduler.class);

  public static final int DEFAULT_MAX_CONCURRENT_STREAMS = 5;

  private final StreamClient client;
  private final CooldownTracker cooldown;
  private final JobListener listener;
  private final int maxConcurrentStreams;
  private final ExecutorService executor;

  private final Object lock = new Object();
  private final Map<String, ActiveJob> active = new LinkedHashMap<>();
  private final Deque<ScanJob> waiting = new ArrayDeque<>();
  private boolean shutdown;

  public StreamScheduler(
      StreamClient client,
      CooldownTracker cooldown,
      JobListener listener,
      int maxConcurrentStreams) {
    if (maxConcurrentStreams < 1) {
      throw new IllegalArgumentException(
          "maxConcurrentStreams must be at least 1, got " + maxConcurrentStreams);
    }
    this.client = Objects.requireNonNull(client, "client");
    this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.maxConcurrentStreams = maxConcurrentStreams;
    AtomicInteger threadCount = new AtomicInteger();
    this.executor =
        Executors.newCachedThreadPool(
            r -> {
              Thread t = new Thread(r, "scan-stream-" + threadCount.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  /** Run the job now if a slot is free, otherwise append it to the wait queue. */
  public void start(ScanJob job) {
    Objects.requireNonNull(job, "job");
    synchronized (lock) {
      if (shutdown) {
        throw new StateException("Scheduler is shut down");
      }
      if (active.containsKey(job.localId()) || waiting.contains(job)) {
        throw new StateException("Job " + job.localId() + " is already scheduled");
      }
      if (active.size() < maxConcurrentStreams) {
        launch(job);
        log.info(
            "Started {} (Active {}/{}, Queue {})",
            job.localId(),
            active.size(),
            maxConcurrentStreams,
            waiting.size());
      } else {
        job.state(JobState.QUEUED);
        waiting.addLast(job);
        log.info(
            "Queued {} (Active {}/{}, Queue {})",
            job.localId(),
            active.size(),
            maxConcurrentStreams,
            waiting.size());
      }
    }
  }

  /**
   * Cancel every active job and drop every waiting one. Active jobs that already have a server id
   * get a fire-and-forget cleanup call; jobs still uploading are cleaned up by their worker once
   * the upload returns. Returns without waiting for workers to stop.
   *
   * <p>Every canceled job is reported once through {@link JobListener#onCanceled}: waiting jobs
   * right here, running jobs by their worker when it stops.
   */
  public void cancelAll() {
    List<ActiveJob> canceled;
    List<ScanJob> dropped;
    synchronized (lock) {
      canceled = new ArrayList<>(active.values());
      dropped = new ArrayList<>(waiting);
      active.clear();
      waiting.clear();
      lock.notifyAll();
    }
    if (canceled.isEmpty() && dropped.isEmpty()) {
      return;
    }
    for (ActiveJob a : canceled) {
      a.job.state(JobState.CANCELED);
      boolean workerReports = a.cancel();
      if (a.job.claimCleanup()) {
        client.cleanup(a.job.jobId(), a.job.authToken());
      }
      if (!workerReports) {
        reportCanceled(a.job);
      }
    }
    for (ScanJob job : dropped) {
      job.state(JobState.CANCELED);
      reportCanceled(job);
    }
    log.info("Canceled {} active and {} waiting jobs", canceled.size(), dropped.size());
  }

  public int activeCount() {
    synchronized (lock) {
      return active.size();
    }
  }

  public int waitingCount() {
    synchronized (lock) {
      return waiting.size();
    }
  }

  public int maxConcurrentStreams() {
    return maxConcurrentStreams;
  }

  /**
   * Block until no job is active or waiting.
   *
   * @return false if the timeout elapsed first
   */
  public boolean awaitIdle(Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    synchronized (lock) {
      while (!active.isEmpty() || !waiting.isEmpty()) {
        long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
        if (remainingMillis <= 0) {
          return false;
        }
        lock.wait(remainingMillis);
      }
      return true;
    }
  }

  /** Cancel everything and stop the worker pool. Further {@link #start} calls fail. */
  public void shutdown() {
    synchronized (lock) {
      if (shutdown) {
        return;
      }
      shutdown = true;
    }
    cancelAll();
    executor.shutdownNow();
  }

  private void reportCanceled(ScanJob job) {
    try {
      listener.onCanceled(job);
    } catch (RuntimeException e) {
      log.warn(
          "Listener onCanceled failed for job {}: {}",
          job.localId(),
          ExceptionUtil.extractErrorMessage(e));
    }
  }

    private void launch(ScanJob job) {
    ActiveJob a = new ActiveJob(job);
    active.put(job.localId(), a);
    a.future = executor.submit(new ScanJobRunner(a, client, cooldown, listener, this::finished));
  }

  private void finished(ActiveJob a) {
    synchronized (lock) {
      if (active.get(a.job.localId()) != a) {
        // canceled; slot already released
        return;
      }
      active.remove(a.job.localId());
      log.info(
          "Completed {} in {}ms (Active {}/{}, Queue {})",
          a.job.localId(),
          a.elapsedMillis(),
          active.size(),
          maxConcurrentStreams,
          waiting.size());
      while (!shutdown && active.size() < maxConcurrentStreams && !waiting.isEmpty()) {
        ScanJob next = waiting.pollFirst();
        launch(next);
        log.info(
            "Dequeued {} (Active {}/{}, Queue {})",
            next.localId(),
            active.size(),
            maxConcurrentStreams,
            waiting.size());
      }
      lock.notifyAll();
    }
  }
}
