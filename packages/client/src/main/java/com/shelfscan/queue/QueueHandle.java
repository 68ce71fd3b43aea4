package com.shelfscan.queue;

/** Opaque local reference to one durable queue entry. */
public record QueueHandle(String id) {
  public QueueHandle {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Queue handle id cannot be blank");
    }
  }
}
