package com.shelfscan.orchestrator;

import java.util.function.Consumer;

/** Source of the device's online/offline state. */
public interface ConnectivityMonitor {
  boolean isOnline();

  /** Register for changes. The listener receives the new state. */
  void addListener(Consumer<Boolean> listener);
}
