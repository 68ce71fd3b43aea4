package com.shelfscan.orchestrator;

import com.shelfscan.model.ScanOutcome;

/** Receives the final outcome of every scan exactly once. */
@FunctionalInterface
public interface CatalogSink {
  void onTerminalResult(ScanOutcome outcome);
}
