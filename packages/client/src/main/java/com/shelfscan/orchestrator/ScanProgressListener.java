package com.shelfscan.orchestrator;

import com.shelfscan.cooldown.CooldownState;
import com.shelfscan.model.StreamEvent;

/**
 * Presentation-side observer of in-flight scans. Every method defaults to a no-op so callers only
 * override what they display.
 */
public interface ScanProgressListener {
  ScanProgressListener NONE = new ScanProgressListener() {};

  default void onProgress(String localId, String message) {}

  default void onSegmentedPreview(String localId, StreamEvent.SegmentedPreview preview) {}

  default void onBookProgress(String localId, StreamEvent.BookProgress progress) {}

  default void onBookResult(String localId, StreamEvent.BookResult result) {}

  default void onEnrichmentDegraded(String localId, StreamEvent.EnrichmentDegraded degraded) {}

  /** Called on every cooldown watcher tick while a cooldown is active, and once when it ends. */
  default void onCooldown(CooldownState state) {}
}
