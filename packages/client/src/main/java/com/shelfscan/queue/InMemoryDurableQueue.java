package com.shelfscan.queue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/** Non-persistent {@link DurableQueue} for tests and ephemeral sessions. */
public final class InMemoryDurableQueue implements DurableQueue {
  private final Map<QueueHandle, QueuedPayload> entries = new ConcurrentHashMap<>();
  private final AtomicLong sequence = new AtomicLong();

  @Override
  public QueueHandle enqueue(byte[] imageBytes, String deviceIdentifier) {
    QueueHandle handle = new QueueHandle(UUID.randomUUID().toString());
    entries.put(
        handle,
        new QueuedPayload(
            handle,
            imageBytes.clone(),
            deviceIdentifier,
            Instant.now(),
            sequence.incrementAndGet()));
    return handle;
  }

  @Override
  public List<QueuedPayload> drainAll() {
    List<QueuedPayload> result = new ArrayList<>(entries.values());
    result.sort(QueuedPayload.ENQUEUE_ORDER);
    return result;
  }

  @Override
  public void remove(QueueHandle handle) {
    if (handle != null) {
      entries.remove(handle);
    }
  }

  @Override
  public int size() {
    return entries.size();
  }
}
