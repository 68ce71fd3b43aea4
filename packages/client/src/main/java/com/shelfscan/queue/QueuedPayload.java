package com.shelfscan.queue;

import java.time.Instant;
import java.util.Comparator;

/** A not-yet-submitted scan as held by the durable queue. */
public record QueuedPayload(
    QueueHandle handle,
    byte[] imageBytes,
    String deviceIdentifier,
    Instant enqueuedAt,
    long sequence) {

  /**
   * Enqueue order. Uses the per-queue sequence number only; {@code enqueuedAt} is wall-clock time
   * and may step backwards.
   */
  public static final Comparator<QueuedPayload> ENQUEUE_ORDER =
      Comparator.comparingLong(QueuedPayload::sequence);
}
