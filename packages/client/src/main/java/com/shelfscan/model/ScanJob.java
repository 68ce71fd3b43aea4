package com.shelfscan.model;

import com.shelfscan.exception.StateException;
import com.shelfscan.queue.QueueHandle;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One captured image on its way through the recognition service.
 *
 * <p>{@code jobId} and {@code authToken} are assigned together, exactly once, from the submit
 * receipt. {@code state} is written only by the worker that drives the job (or by cancellation).
 */
public final class ScanJob {
  private final String localId;
  private final byte[] imageBytes;
  private final String deviceIdentifier;
  private final Instant createdAt;
  private final QueueHandle queueHandle;

  private final AtomicReference<SubmitReceipt> receipt = new AtomicReference<>();
  private final AtomicBoolean cleanupClaimed = new AtomicBoolean(false);
  private final AtomicBoolean deliveryClaimed = new AtomicBoolean(false);
  private volatile JobState state = JobState.QUEUED;

  public ScanJob(byte[] imageBytes, String deviceIdentifier) {
    this(UUID.randomUUID().toString(), imageBytes, deviceIdentifier, Instant.now(), null);
  }

  public ScanJob(
      String localId,
      byte[] imageBytes,
      String deviceIdentifier,
      Instant createdAt,
      QueueHandle queueHandle) {
    this.localId = Objects.requireNonNull(localId, "localId");
    this.imageBytes = Objects.requireNonNull(imageBytes, "imageBytes");
    this.deviceIdentifier = Objects.requireNonNull(deviceIdentifier, "deviceIdentifier");
    this.createdAt = createdAt == null ? Instant.now() : createdAt;
    this.queueHandle = queueHandle;
  }

  /** Rebuild a job from a durable queue entry; the handle lets the caller delete the entry. */
  public static ScanJob fromQueue(
      QueueHandle handle, byte[] imageBytes, String deviceIdentifier, Instant enqueuedAt) {
    return new ScanJob(
        UUID.randomUUID().toString(), imageBytes, deviceIdentifier, enqueuedAt, handle);
  }

  /**
   * Record the submit receipt. Must be called before any stream or cleanup call for this job.
   *
   * @throws StateException if the job was already submitted
   */
  public void markSubmitted(SubmitReceipt submitReceipt) {
    Objects.requireNonNull(submitReceipt, "submitReceipt");
    if (!receipt.compareAndSet(null, submitReceipt)) {
      throw new StateException("Job " + localId + " was already submitted as " + jobId());
    }
    state = JobState.SUBMITTED;
  }

  /**
   * Claim the single cleanup call allowed for this job. Returns true for the first caller only,
   * and only once the job has a server-side id.
   */
  public boolean claimCleanup() {
    return isSubmitted() && cleanupClaimed.compareAndSet(false, true);
  }

  /** Claim the single hand-off of this job's terminal outcome. True for the first caller only. */
  public boolean claimDelivery() {
    return deliveryClaimed.compareAndSet(false, true);
  }

    public boolean isSubmitted() {
    return receipt.get() != null;
  }

  public String localId() {
    return localId;
  }

  public byte[] imageBytes() {
    return imageBytes;
  }

  public String deviceIdentifier() {
    return deviceIdentifier;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Optional<QueueHandle> queueHandle() {
    return Optional.ofNullable(queueHandle);
  }

  /** Server-assigned id, or null before submit. */
  public String jobId() {
    SubmitReceipt r = receipt.get();
    return r == null ? null : r.jobId();
  }

  /** Per-job credential, or null before submit or when the server issued none. */
  public String authToken() {
    SubmitReceipt r = receipt.get();
    return r == null ? null : r.authToken();
  }

  public Optional<SubmitReceipt> receipt() {
    return Optional.ofNullable(receipt.get());
  }

  public JobState state() {
    return state;
  }

  public void state(JobState newState) {
    this.state = Objects.requireNonNull(newState, "state");
  }

  @Override
  public String toString() {
    return "ScanJob{localId=" + localId + ", jobId=" + jobId() + ", state=" + state + "}";
  }
}
