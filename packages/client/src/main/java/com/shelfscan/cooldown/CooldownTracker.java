package com.shelfscan.cooldown;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Single source of truth for "are we currently rate-limited". Pure state guarded by this object's
 * monitor; performs no I/O.
 *
 * <p>The tracker clears itself on the first read after the expiry time has passed, resetting the
 * backlog count, so an inactive tracker never reports a backlog.
 */
public final class CooldownTracker {
  private static final org.slf4j.Logger log =
      com.shelfscan.logging.LoggingService.getLogger(CooldownTracker.class);

  private final Clock clock;

  private boolean active;
  private Instant expiresAt;
  private int backlogCount;

  public CooldownTracker() {
    this(Clock.systemUTC());
  }

  public CooldownTracker(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Start (or extend/shorten) a cooldown ending {@code retryAfter} from now. The backlog count is
   * left unchanged.
   */
  public synchronized void recordRateLimit(Duration retryAfter) {
    Objects.requireNonNull(retryAfter, "retryAfter");
    Duration effective = retryAfter.isNegative() ? Duration.ZERO : retryAfter;
    active = true;
    expiresAt = clock.instant().plus(effective);
    log.info("Rate limit recorded: retry after {}s (until {})", effective.toSeconds(), expiresAt);
    // a zero-length cooldown expires immediately
    expireIfDue();
  }

  /**
   * Whether a new submission may be attempted now. Clears the cooldown and resets the backlog as a
   * side effect once the expiry time has been reached.
   */
  public synchronized boolean admit() {
    expireIfDue();
    return !active;
  }

  /** Count one job deferred because of the cooldown. Ignored while inactive. */
  public synchronized int incrementBacklog() {
    expireIfDue();
    if (active) {
      backlogCount++;
    }
    return backlogCount;
  }

  /** Whole seconds left in the cooldown, rounded up; 0 when inactive or expired. */
  public synchronized long secondsRemaining() {
    Duration remaining = remaining();
    long seconds = remaining.getSeconds();
    return remaining.getNano() > 0 ? seconds + 1 : seconds;
  }

  /** Time left in the cooldown, floored at zero. */
  public synchronized Duration remaining() {
    if (!active) {
      return Duration.ZERO;
    }
    Duration left = Duration.between(clock.instant(), expiresAt);
    return left.isNegative() ? Duration.ZERO : left;
  }

  public synchronized boolean isActive() {
    expireIfDue();
    return active;
  }

  public synchronized int backlogCount() {
    expireIfDue();
    return backlogCount;
  }

  public synchronized CooldownState snapshot() {
    expireIfDue();
    return active ? new CooldownState(true, expiresAt, backlogCount) : CooldownState.INACTIVE;
  }

  private void expireIfDue() {
    if (active && !clock.instant().isBefore(expiresAt)) {
      log.info("Rate limit cleared ({} deferred scans)", backlogCount);
      active = false;
      expiresAt = null;
      backlogCount = 0;
    }
  }
}
