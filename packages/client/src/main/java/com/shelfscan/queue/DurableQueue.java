package com.shelfscan.queue;

import java.util.List;

/**
 * Holding area for scans that could not be submitted yet (offline or rate-limited). Entries stay
 * until {@link #remove(QueueHandle)} is called after a successful submit, which gives
 * at-least-once delivery across process restarts.
 */
public interface DurableQueue {

  /** Store a payload and return its handle. Never disturbs existing entries. */
  QueueHandle enqueue(byte[] imageBytes, String deviceIdentifier);

  /** All entries in enqueue order. Nothing is deleted. */
  List<QueuedPayload> drainAll();

  /** Delete one entry. Removing an unknown handle is a no-op. */
  void remove(QueueHandle handle);

  int size();
}
