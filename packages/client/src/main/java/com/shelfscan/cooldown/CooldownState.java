package com.shelfscan.cooldown;

import java.time.Instant;

/**
 * Point-in-time copy of the rate-limit state.
 *
 * @param active whether submissions are currently blocked
 * @param expiresAt end of the cooldown, null when inactive
 * @param backlogCount jobs deferred while active, always 0 when inactive
 */
public record CooldownState(boolean active, Instant expiresAt, int backlogCount) {
  public static final CooldownState INACTIVE = new CooldownState(false, null, 0);
}
