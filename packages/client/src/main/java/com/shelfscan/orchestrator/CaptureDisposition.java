package com.shelfscan.orchestrator;

/** What happened to a captured image. */
public enum CaptureDisposition {
  /** Handed to the scheduler; it runs now or as soon as a slot frees up. */
  SCHEDULED,
  /** Stored in the durable queue because the device is offline. */
  QUEUED_OFFLINE,
  /** Stored in the durable queue because the service asked us to back off. */
  QUEUED_RATE_LIMITED
}
