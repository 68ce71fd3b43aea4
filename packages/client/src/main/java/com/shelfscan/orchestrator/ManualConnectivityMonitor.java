package com.shelfscan.orchestrator;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/** {@link ConnectivityMonitor} whose state is set by the caller. Starts online. */
public final class ManualConnectivityMonitor implements ConnectivityMonitor {
  private static final org.slf4j.Logger log =
      com.shelfscan.logging.LoggingService.getLogger(ManualConnectivityMonitor.class);

  private final List<Consumer<Boolean>> listeners = new CopyOnWriteArrayList<>();
  private volatile boolean online;

  public ManualConnectivityMonitor() {
    this(true);
  }

  public ManualConnectivityMonitor(boolean online) {
    this.online = online;
  }

  @Override
  public boolean isOnline() {
    return online;
  }

  @Override
  public void addListener(Consumer<Boolean> listener) {
    listeners.add(listener);
  }

  /** Update the state; listeners are notified only on an actual change. */
  public void setOnline(boolean value) {
    boolean previous;
    synchronized (this) {
      previous = online;
      online = value;
    }
    if (previous == value) {
      return;
    }
    log.info("Connectivity changed: {}", value ? "online" : "offline");
    for (Consumer<Boolean> listener : listeners) {
      try {
        listener.accept(value);
      } catch (RuntimeException e) {
        log.warn("Connectivity listener failed: {}", e.toString());
      }
    }
  }
}
