package com.shelfscan.scheduler;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import com.shelfscan.cooldown.CooldownTracker;
import com.shelfscan.exception.ClientErrorException;
import com.shelfscan.exception.ConnectionFailureException;
import com.shelfscan.exception.RateLimitedException;
import com.shelfscan.exception.RetriesExhaustedException;
import com.shelfscan.model.BookMetadata;
import com.shelfscan.model.JobState;
import com.shelfscan.model.ProblemDetails;
import com.shelfscan.model.ScanJob;
import com.shelfscan.model.ScanOutcome;
import com.shelfscan.model.StreamEvent;
import com.shelfscan.model.SubmitReceipt;
import com.shelfscan.stream.EventStream;
import com.shelfscan.stream.ScriptedEventStream;
import com.shelfscan.stream.StreamClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StreamSchedulerTest {

  private StreamClient client;
  private CooldownTracker cooldown;
  private RecordingListener listener;
  private StreamScheduler scheduler;

  /** Collects callbacks from worker threads. */
  static class RecordingListener implements JobListener {
    final Map<String, ScanOutcome> terminal = new ConcurrentHashMap<>();
    final List<ScanJob> rateLimited = new CopyOnWriteArrayList<>();
    final List<ScanJob> deferred = new CopyOnWriteArrayList<>();
    final List<StreamEvent> events = new CopyOnWriteArrayList<>();
    final List<ScanJob> canceled = new CopyOnWriteArrayList<>();
    final AtomicInteger terminalCalls = new AtomicInteger();

    @Override
    public void onEvent(ScanJob job, StreamEvent event) {
      events.add(event);
    }

    @Override
    public void onTerminal(ScanJob job, ScanOutcome outcome) {
      terminalCalls.incrementAndGet();
      terminal.put(job.localId(), outcome);
    }

    @Override
    public void onRateLimited(ScanJob job, Duration retryAfter) {
      rateLimited.add(job);
    }

    @Override
    public void onDeferred(ScanJob job, Throwable cause) {
      deferred.add(job);
    }

    @Override
    public void onCanceled(ScanJob job) {
      canceled.add(job);
    }
  }

  @BeforeEach
  void setUp() {
    client = mock(StreamClient.class);
    cooldown = new CooldownTracker();
    listener = new RecordingListener();
    when(client.submit(any()))
        .thenAnswer(
            inv -> {
              ScanJob job = inv.getArgument(0);
              return job == null ? null : receipt(job);
            });
    when(client.cleanup(anyString(), any())).thenReturn(CompletableFuture.completedFuture(true));
  }

  @AfterEach
  void tearDown() {
    if (scheduler != null) {
      scheduler.shutdown();
    }
  }

  private static SubmitReceipt receipt(ScanJob job) {
    return new SubmitReceipt(
        "srv-" + job.localId(), "https://api/stream/" + job.localId(), "tok", null);
  }

  private static ScanJob job(String name) {
    return new ScanJob(
        name, name.getBytes(StandardCharsets.UTF_8), "device", null, null);
  }

  private static void awaitCondition(BooleanSupplier condition)
      throws InterruptedException {
    for (int i = 0; i < 200 && !condition.getAsBoolean(); i++) {
      Thread.sleep(10);
    }
    assertTrue(condition.getAsBoolean(), "condition not reached in time");
  }

  /** Counts open streams and remembers the highest count seen. */
  static final class OpenStreamCounter {
    final AtomicInteger open = new AtomicInteger();
    final AtomicInteger peak = new AtomicInteger();

    EventStream track(EventStream delegate) {
      peak.accumulateAndGet(open.incrementAndGet(), Math::max);
      return new EventStream() {
        private final AtomicBoolean closed = new AtomicBoolean();

        @Override
        public boolean hasNext() {
          return delegate.hasNext();
        }

        @Override
        public StreamEvent next() {
          return delegate.next();
        }

        @Override
        public int attempts() {
          return delegate.attempts();
        }

        @Override
        public void close() {
          if (closed.compareAndSet(false, true)) {
            open.decrementAndGet();
          }
          delegate.close();
        }
      };
    }
  }

  @Test
  @DisplayName("never more than the ceiling streaming at once, across every promotion")
  void enforcesCeiling() throws Exception {
    OpenStreamCounter counter = new OpenStreamCounter();
    AtomicInteger opened = new AtomicInteger();
    CountDownLatch firstWave = new CountDownLatch(1);
    when(client.consumeStream(any()))
        .thenAnswer(
            inv -> {
              CountDownLatch gate =
                  opened.incrementAndGet() <= 5 ? firstWave : new CountDownLatch(0);
              return counter.track(
                  ScriptedEventStream.gated(
                      gate,
                      new StreamEvent.Progress("reading"),
                      new StreamEvent.Completed(null, List.of(BookMetadata.of("T", "A")))));
            });
    scheduler = new StreamScheduler(client, cooldown, listener, 5);

    for (int i = 0; i < 20; i++) {
      scheduler.start(job("job-" + i));
    }
    assertEquals(5, scheduler.activeCount());
    assertEquals(15, scheduler.waitingCount());
    awaitCondition(() -> counter.open.get() == 5);

    firstWave.countDown();
    assertTrue(scheduler.awaitIdle(Duration.ofSeconds(5)));
    assertEquals(20, listener.terminal.size());
    assertTrue(listener.terminal.values().stream().allMatch(ScanOutcome::isSuccess));
    assertEquals(5, counter.peak.get());
    assertEquals(0, counter.open.get());
    verify(client, times(20)).cleanup(anyString(), any());
  }

  @Test
  void waitingJobsAreAdmittedInFifoOrder() throws Exception {
    List<String> submitted = new CopyOnWriteArrayList<>();
    when(client.submit(any()))
        .thenAnswer(
            inv -> {
              ScanJob job = inv.getArgument(0);
              submitted.add(job.localId());
              return receipt(job);
            });
    CountDownLatch gate = new CountDownLatch(1);
    when(client.consumeStream(any()))
        .thenAnswer(inv -> ScriptedEventStream.gated(gate, new StreamEvent.Completed(null, null)));
    scheduler = new StreamScheduler(client, cooldown, listener, 1);

    scheduler.start(job("a"));
    scheduler.start(job("b"));
    scheduler.start(job("c"));
    gate.countDown();

    assertTrue(scheduler.awaitIdle(Duration.ofSeconds(5)));
    assertEquals(List.of("a", "b", "c"), submitted);
  }

  @Test
  @DisplayName("cancelAll with 3 active and 4 waiting cleans up 3 jobs and clears both")
  void cancelAllCleansUpActiveJobs() throws Exception {
    CountDownLatch streaming = new CountDownLatch(3);
    CountDownLatch never = new CountDownLatch(1);
    when(client.consumeStream(any()))
        .thenAnswer(
            inv -> {
              streaming.countDown();
              return ScriptedEventStream.gated(never, new StreamEvent.Completed(null, null));
            });
    scheduler = new StreamScheduler(client, cooldown, listener, 3);
    List<ScanJob> jobs = new CopyOnWriteArrayList<>();
    for (int i = 0; i < 7; i++) {
      ScanJob job = job("job-" + i);
      jobs.add(job);
      scheduler.start(job);
    }
    assertTrue(streaming.await(5, TimeUnit.SECONDS));
    assertEquals(4, scheduler.waitingCount());

    scheduler.cancelAll();

    assertEquals(0, scheduler.activeCount());
    assertEquals(0, scheduler.waitingCount());
    verify(client, after(300).times(3)).cleanup(anyString(), eq("tok"));
    verify(client, times(3)).submit(any());
    assertTrue(listener.terminal.isEmpty());
    assertTrue(jobs.stream().allMatch(j -> j.state() == JobState.CANCELED));
    awaitCondition(() -> listener.canceled.size() == 7);
    assertEquals(Set.copyOf(jobs), Set.copyOf(listener.canceled));

    scheduler.cancelAll();
    verify(client, after(100).times(3)).cleanup(anyString(), any());
  }

  @Test
  void jobCanceledDuringSubmitIsCleanedUpWhenSubmitReturns() throws Exception {
    CountDownLatch inSubmit = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    when(client.submit(any()))
        .thenAnswer(
            inv -> {
              inSubmit.countDown();
              boolean done = false;
              while (!done) {
                try {
                  done = release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                  // the upload is already on the wire; keep waiting for the response
                }
              }
              return receipt(inv.getArgument(0));
            });
    scheduler = new StreamScheduler(client, cooldown, listener, 5);
    ScanJob job = job("slow");
    scheduler.start(job);
    assertTrue(inSubmit.await(5, TimeUnit.SECONDS));

    scheduler.cancelAll();
    verify(client, never()).cleanup(anyString(), any());

    assertTrue(listener.canceled.isEmpty());

    release.countDown();
    verify(client, timeout(2000)).cleanup("srv-slow", "tok");
    verify(client, never()).consumeStream(any());
    assertTrue(listener.terminal.isEmpty());
    awaitCondition(() -> listener.canceled.size() == 1);
    assertTrue(listener.canceled.get(0).isSubmitted());
  }

  @Test
  void jobCanceledWhileUploadFailsIsReportedUnsubmitted() throws Exception {
    CountDownLatch inSubmit = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    when(client.submit(any()))
        .thenAnswer(
            inv -> {
              inSubmit.countDown();
              boolean done = false;
              while (!done) {
                try {
                  done = release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                  // keep waiting for the response
                }
              }
              throw new ConnectionFailureException(503, "unavailable");
            });
    scheduler = new StreamScheduler(client, cooldown, listener, 5);
    scheduler.start(job("flaky"));
    assertTrue(inSubmit.await(5, TimeUnit.SECONDS));

    scheduler.cancelAll();
    release.countDown();

    awaitCondition(() -> listener.canceled.size() == 1);
    assertFalse(listener.canceled.get(0).isSubmitted());
    assertTrue(listener.deferred.isEmpty());
    verify(client, never()).cleanup(anyString(), any());
  }

  @Test
  void rateLimitedSubmitRecordsCooldownAndReturnsJob() throws Exception {
    when(client.submit(any())).thenThrow(new RateLimitedException(Duration.ofSeconds(45)));
    scheduler = new StreamScheduler(client, cooldown, listener, 5);

    ScanJob job = job("limited");
    scheduler.start(job);
    assertTrue(scheduler.awaitIdle(Duration.ofSeconds(5)));

    assertEquals(List.of(job), listener.rateLimited);
    assertTrue(cooldown.isActive());
    assertTrue(cooldown.secondsRemaining() > 40);
    assertTrue(listener.terminal.isEmpty());
    verify(client, never()).cleanup(anyString(), any());
  }

  @Test
  void transientSubmitFailureIsDeferred() throws Exception {
    when(client.submit(any())).thenThrow(new ConnectionFailureException(503, "unavailable"));
    scheduler = new StreamScheduler(client, cooldown, listener, 5);

    scheduler.start(job("offline"));
    assertTrue(scheduler.awaitIdle(Duration.ofSeconds(5)));

    assertEquals(1, listener.deferred.size());
    assertEquals(JobState.QUEUED, listener.deferred.get(0).state());
    assertTrue(listener.terminal.isEmpty());
  }

  @Test
  void rejectedSubmitFailsWithoutRetry() throws Exception {
    when(client.submit(any()))
        .thenThrow(
            new ClientErrorException(400, new ProblemDetails("Not an image", "BAD_IMAGE", false)));
    scheduler = new StreamScheduler(client, cooldown, listener, 5);

    scheduler.start(job("bad"));
    assertTrue(scheduler.awaitIdle(Duration.ofSeconds(5)));

    ScanOutcome outcome = listener.terminal.get("bad");
    assertEquals(JobState.FAILED, outcome.state());
    assertEquals("BAD_IMAGE", outcome.failureCode());
    assertFalse(outcome.retryable());
    assertNull(outcome.jobId());
  }

  @Test
  @DisplayName("events are forwarded in order and result events back an empty completion")
  void forwardsEventsAndFallsBackToStreamedResults() throws Exception {
    when(client.consumeStream(any()))
        .thenAnswer(
            inv ->
                ScriptedEventStream.of(
                    new StreamEvent.Progress("one"),
                    new StreamEvent.BookResult(BookMetadata.of("Dune", "Herbert")),
                    new StreamEvent.Progress("two"),
                    new StreamEvent.Completed(null, null)));
    scheduler = new StreamScheduler(client, cooldown, listener, 5);

    scheduler.start(job("j"));
    assertTrue(scheduler.awaitIdle(Duration.ofSeconds(5)));

    assertEquals(3, listener.events.size());
    assertEquals(new StreamEvent.Progress("two"), listener.events.get(2));
    ScanOutcome outcome = listener.terminal.get("j");
    assertTrue(outcome.isSuccess());
    assertEquals("Dune", outcome.books().get(0).title());
    verify(client, times(1)).cleanup("srv-j", "tok");
  }

  @Test
  void completionWithResultsUrlFetchesResults() throws Exception {
    when(client.consumeStream(any()))
        .thenAnswer(inv -> ScriptedEventStream.of(new StreamEvent.Completed("/results/j", null)));
    when(client.fetchResults(eq("/results/j"), any()))
        .thenReturn(List.of(BookMetadata.of("A", "x"), BookMetadata.of("B", "y")));
    scheduler = new StreamScheduler(client, cooldown, listener, 5);

    scheduler.start(job("j"));
    assertTrue(scheduler.awaitIdle(Duration.ofSeconds(5)));

    assertEquals(2, listener.terminal.get("j").books().size());
  }

  @Test
  void exhaustedStreamFailsJobOnceAndCleansUp() throws Exception {
    when(client.consumeStream(any()))
        .thenThrow(
            new RetriesExhaustedException(3, new ConnectionFailureException(502, "bad gateway")));
    scheduler = new StreamScheduler(client, cooldown, listener, 5);

    scheduler.start(job("lost"));
    assertTrue(scheduler.awaitIdle(Duration.ofSeconds(5)));

    ScanOutcome outcome = listener.terminal.get("lost");
    assertEquals(JobState.FAILED, outcome.state());
    assertTrue(outcome.retryable());
    assertTrue(outcome.failureReason().contains("after 3 attempts"));
    assertEquals(1, listener.terminalCalls.get());
    verify(client, times(1)).cleanup("srv-lost", "tok");
  }

  @Test
  void serverErrorEventFailsJob() throws Exception {
    when(client.consumeStream(any()))
        .thenAnswer(
            inv ->
                ScriptedEventStream.of(
                    new StreamEvent.Failed("Vision failed", "VISION", false),
                    new StreamEvent.Completed(null, null)));
    scheduler = new StreamScheduler(client, cooldown, listener, 5);

    scheduler.start(job("err"));
    assertTrue(scheduler.awaitIdle(Duration.ofSeconds(5)));

    ScanOutcome outcome = listener.terminal.get("err");
    assertEquals("VISION", outcome.failureCode());
    assertEquals("Server error [VISION]: Vision failed", outcome.failureReason());
    assertEquals(1, listener.terminalCalls.get());
  }

  @Test
  void failingListenerDoesNotAffectOtherJobs() throws Exception {
    when(client.consumeStream(any()))
        .thenAnswer(inv -> ScriptedEventStream.of(new StreamEvent.Completed(null, null)));
    RecordingListener throwing =
        new RecordingListener() {
          @Override
          public void onSubmitted(ScanJob job) {
            if (job.localId().equals("first")) {
              throw new IllegalStateException("boom");
            }
          }
        };
    scheduler = new StreamScheduler(client, cooldown, throwing, 2);

    scheduler.start(job("first"));
    scheduler.start(job("second"));
    awaitCondition(() -> throwing.terminal.size() == 2);
    assertTrue(throwing.terminal.get("first").isSuccess());
    assertTrue(throwing.terminal.get("second").isSuccess());
  }

  @Test
  void serverCancelIsTerminalNotLocalCancel() throws Exception {
    when(client.consumeStream(any()))
        .thenAnswer(inv -> ScriptedEventStream.of(new StreamEvent.Canceled()));
    scheduler = new StreamScheduler(client, cooldown, listener, 5);

    scheduler.start(job("gone"));
    assertTrue(scheduler.awaitIdle(Duration.ofSeconds(5)));

    ScanOutcome outcome = listener.terminal.get("gone");
    assertEquals(JobState.CANCELED, outcome.state());
    assertEquals("Job canceled by server", outcome.failureReason());
    assertTrue(listener.canceled.isEmpty());
  }

  @Test
  void rejectsInvalidCeiling() {
    assertThrows(
        IllegalArgumentException.class, () -> new StreamScheduler(client, cooldown, listener, 0));
  }
}
