package com.shelfscan.orchestrator;

import com.shelfscan.cooldown.CooldownState;
import com.shelfscan.cooldown.CooldownTracker;
import com.shelfscan.exception.ExceptionUtil;
import com.shelfscan.exception.StateException;
import com.shelfscan.model.ScanJob;
import com.shelfscan.model.ScanOutcome;
import com.shelfscan.model.StreamEvent;
import com.shelfscan.queue.DurableQueue;
import com.shelfscan.queue.QueueHandle;
import com.shelfscan.queue.QueuedPayload;
import com.shelfscan.scheduler.JobListener;
import com.shelfscan.scheduler.StreamScheduler;
import com.shelfscan.stream.StreamClient;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for captured images. Decides whether a capture is uploaded now or parked in the
 * durable queue, reacts to rate limits and connectivity changes, and hands every terminal outcome
 * to the {@link CatalogSink} exactly once.
 *
 * <p>A background watcher ticks at a fixed interval; when it observes that a cooldown has ended it
 * drains the durable queue.
 */
public final class ScanOrchestrator implements JobListener, AutoCloseable {
  private static final org.slf4j.Logger log =
      com.shelfscan.logging.LoggingService.getLogger(ScanOrchestrator.class);

  private final CooldownTracker cooldown;
  private final DurableQueue queue;
  private final ConnectivityMonitor connectivity;
  private final CatalogSink catalog;
  private final ScanProgressListener progress;
  private final String deviceIdentifier;
  private final StreamScheduler scheduler;
  private final ScheduledExecutorService watcher;

  private final Set<QueueHandle> inFlight = ConcurrentHashMap.newKeySet();
  private final Map<String, ScanJob> failed = new ConcurrentHashMap<>();
  private final AtomicBoolean lastOnline;
  private volatile boolean coolingDown;

  private ScanOrchestrator(Builder b) {
    this.cooldown = b.cooldown;
    this.queue = b.queue;
    this.connectivity = b.connectivity;
    this.catalog = b.catalog;
    this.progress = b.progress;
    this.deviceIdentifier = b.deviceIdentifier;
    this.scheduler = new StreamScheduler(b.client, cooldown, this, b.maxConcurrentStreams);
    this.lastOnline = new AtomicBoolean(connectivity.isOnline());
    this.coolingDown = cooldown.isActive();
    connectivity.addListener(this::onConnectivityChanged);
    this.watcher =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "cooldown-watcher");
              t.setDaemon(true);
              return t;
            });
    long interval = b.watchInterval.toMillis();
    watcher.scheduleWithFixedDelay(this::watchCooldown, interval, interval, TimeUnit.MILLISECONDS);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Route one captured image. */
  public CaptureDisposition handleCapture(byte[] imageBytes) {
    Objects.requireNonNull(imageBytes, "imageBytes");
    if (!connectivity.isOnline()) {
      queue.enqueue(imageBytes, deviceIdentifier);
      log.info("Offline, capture stored for later ({} queued)", queue.size());
      return CaptureDisposition.QUEUED_OFFLINE;
    }
    if (!cooldown.admit()) {
      queue.enqueue(imageBytes, deviceIdentifier);
      int backlog = cooldown.incrementBacklog();
      log.info(
          "Cooling down for {}s, capture stored for later ({} deferred)",
          cooldown.secondsRemaining(),
          backlog);
      return CaptureDisposition.QUEUED_RATE_LIMITED;
    }
    scheduler.start(new ScanJob(imageBytes, deviceIdentifier));
    return CaptureDisposition.SCHEDULED;
  }

  /**
   * Schedule every durable queue entry that is not already running, in enqueue order. Does nothing
   * while offline and stops at the first entry refused by an active cooldown.
   *
   * @return number of entries scheduled
   */
  public synchronized int drainQueue() {
    if (!connectivity.isOnline()) {
      log.debug("Skipping queue drain while offline");
      return 0;
    }
    int scheduled = 0;
    for (QueuedPayload payload : queue.drainAll()) {
      if (!cooldown.admit()) {
        log.info("Queue drain paused by cooldown ({}s left)", cooldown.secondsRemaining());
        break;
      }
      if (!inFlight.add(payload.handle())) {
        continue;
      }
      scheduler.start(
          ScanJob.fromQueue(
              payload.handle(),
              payload.imageBytes(),
              payload.deviceIdentifier(),
              payload.enqueuedAt()));
      scheduled++;
    }
    if (scheduled > 0) {
      log.info("Drained {} queued scans", scheduled);
    }
    return scheduled;
  }

  /** Drain the durable queue on an offline to online transition. */
  public void onConnectivityChanged(boolean online) {
    boolean previous = lastOnline.getAndSet(online);
    if (online && !previous) {
      log.info("Back online, draining {} queued scans", queue.size());
      drainQueue();
    }
  }

  /**
   * Submit the image of a failed scan again as a new job.
   *
   * @throws StateException if no failed scan with that id is held
   */
  public CaptureDisposition retry(String localId) {
    ScanJob job = failed.remove(localId);
    if (job == null) {
      throw new StateException("No failed scan " + localId);
    }
    log.info("Retrying failed scan {}", localId);
    return handleCapture(job.imageBytes());
  }

  /** Forget a failed scan. Returns false if it was not held. */
  public boolean dismissFailure(String localId) {
    return failed.remove(localId) != null;
  }

  public Set<String> failedScans() {
    return Set.copyOf(failed.keySet());
  }

  public void cancelAll() {
    scheduler.cancelAll();
  }

  public long cooldownSecondsRemaining() {
    return cooldown.secondsRemaining();
  }

  public int queuedCount() {
    return queue.size();
  }

  public StreamScheduler scheduler() {
    return scheduler;
  }

  /** Wait until no scan is running or waiting for a slot. */
  public boolean awaitIdle(Duration timeout) throws InterruptedException {
    return scheduler.awaitIdle(timeout);
  }

  @Override
  public void close() {
    watcher.shutdownNow();
    scheduler.shutdown();
  }

  @Override
  public void onSubmitted(ScanJob job) {
    job.queueHandle().ifPresent(this::release);
  }

  @Override
  public void onEvent(ScanJob job, StreamEvent event) {
    String id = job.localId();
    if (event instanceof StreamEvent.Progress p) {
      progress.onProgress(id, p.message());
    } else if (event instanceof StreamEvent.SegmentedPreview preview) {
      progress.onSegmentedPreview(id, preview);
    } else if (event instanceof StreamEvent.BookProgress bookProgress) {
      progress.onBookProgress(id, bookProgress);
    } else if (event instanceof StreamEvent.BookResult result) {
      progress.onBookResult(id, result);
    } else if (event instanceof StreamEvent.EnrichmentDegraded degraded) {
      log.info("Enrichment degraded for job {}: {}", job.jobId(), degraded.reason());
      progress.onEnrichmentDegraded(id, degraded);
    }
  }

  @Override
  public void onTerminal(ScanJob job, ScanOutcome outcome) {
    if (!job.claimDelivery()) {
      log.debug("Ignoring repeated terminal outcome for {}", job.localId());
      return;
    }
    // a queued entry that ends here will never be uploaded by a later drain
    job.queueHandle().ifPresent(this::release);
    if (outcome.isSuccess()) {
      log.info("Scan {} completed with {} books", job.localId(), outcome.books().size());
    } else {
      failed.put(job.localId(), job);
      log.warn(
          "Scan {} ended {}: {}", job.localId(), outcome.state(), outcome.failureReason());
    }
    try {
      catalog.onTerminalResult(outcome);
    } catch (RuntimeException e) {
      log.error(
          "Catalog sink failed for {}: {}", job.localId(), ExceptionUtil.extractErrorMessage(e));
    }
  }

  @Override
  public void onRateLimited(ScanJob job, Duration retryAfter) {
    keepForLater(job);
    int backlog = cooldown.incrementBacklog();
    log.info(
        "Rate limited, cooling down for {}s ({} deferred)", retryAfter.toSeconds(), backlog);
    coolingDown = true;
    progress.onCooldown(cooldown.snapshot());
  }

  @Override
  public void onDeferred(ScanJob job, Throwable cause) {
    keepForLater(job);
  }

  @Override
  public void onCanceled(ScanJob job) {
    job.queueHandle()
        .ifPresent(
            handle -> {
              if (job.isSubmitted()) {
                // the server has seen this upload; the cleanup call discards it there
                queue.remove(handle);
              }
              inFlight.remove(handle);
            });
  }

    /** One watcher tick. */
  void watchCooldown() {
    try {
      boolean active = cooldown.isActive();
      if (active) {
        coolingDown = true;
        progress.onCooldown(cooldown.snapshot());
        return;
      }
      if (coolingDown) {
        coolingDown = false;
        log.info("Cooldown ended, draining {} queued scans", queue.size());
        progress.onCooldown(CooldownState.INACTIVE);
        drainQueue();
      }
    } catch (RuntimeException e) {
      log.warn("Cooldown watcher tick failed: {}", ExceptionUtil.extractErrorMessage(e));
    }
  }

  private void keepForLater(ScanJob job) {
    if (job.queueHandle().isPresent()) {
      // entry is still on disk; make it eligible for the next drain
      inFlight.remove(job.queueHandle().get());
    } else {
      queue.enqueue(job.imageBytes(), job.deviceIdentifier());
    }
  }

  private void release(QueueHandle handle) {
    queue.remove(handle);
    inFlight.remove(handle);
  }

  /** Collaborators of a {@link ScanOrchestrator}. */
  public static final class Builder {
    private StreamClient client;
    private CooldownTracker cooldown = new CooldownTracker();
    private DurableQueue queue;
    private ConnectivityMonitor connectivity = new ManualConnectivityMonitor();
    private CatalogSink catalog;
    private ScanProgressListener progress = ScanProgressListener.NONE;
    private String deviceIdentifier;
    private int maxConcurrentStreams = StreamScheduler.DEFAULT_MAX_CONCURRENT_STREAMS;
    private Duration watchInterval = Duration.ofSeconds(1);

    private Builder() {}

    public Builder client(StreamClient client) {
      this.client = client;
      return this;
    }

    public Builder cooldown(CooldownTracker cooldown) {
      this.cooldown = cooldown;
      return this;
    }

    public Builder queue(DurableQueue queue) {
      this.queue = queue;
      return this;
    }

    public Builder connectivity(ConnectivityMonitor connectivity) {
      this.connectivity = connectivity;
      return this;
    }

    public Builder catalog(CatalogSink catalog) {
      this.catalog = catalog;
      return this;
    }

    public Builder progress(ScanProgressListener progress) {
      this.progress = progress == null ? ScanProgressListener.NONE : progress;
      return this;
    }

    public Builder deviceIdentifier(String deviceIdentifier) {
      this.deviceIdentifier = deviceIdentifier;
      return this;
    }

    public Builder maxConcurrentStreams(int maxConcurrentStreams) {
      this.maxConcurrentStreams = maxConcurrentStreams;
      return this;
    }

    public Builder watchInterval(Duration watchInterval) {
      this.watchInterval = watchInterval;
      return this;
    }

    public ScanOrchestrator build() {
      Objects.requireNonNull(client, "client");
      Objects.requireNonNull(cooldown, "cooldown");
      Objects.requireNonNull(queue, "queue");
      Objects.requireNonNull(connectivity, "connectivity");
      Objects.requireNonNull(catalog, "catalog");
      Objects.requireNonNull(deviceIdentifier, "deviceIdentifier");
      if (watchInterval == null || watchInterval.isZero() || watchInterval.isNegative()) {
        throw new IllegalArgumentException("watchInterval must be positive");
      }
      return new ScanOrchestrator(this);
    }
  }
}
