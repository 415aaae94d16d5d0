package com.example.resilientdatasource.core.resilience;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable snapshot of a {@link CircuitBreaker}.
 *
 * @param open whether calls are currently rejected
 * @param lastFailureAt instant of the most recent fatal failure, null if none since last close
 * @param cooldown how long the circuit stays open after {@code lastFailureAt}
 * @param consecutiveFailures fatal failures recorded since the last success or reset
 * @param trippedBy kind that opened the circuit, null while closed
 */
public record CircuitState(
    boolean open,
    Instant lastFailureAt,
    Duration cooldown,
    int consecutiveFailures,
    ErrorKind trippedBy) {

  static CircuitState closed(final Duration cooldown) {
    return new CircuitState(false, null, cooldown, 0, null);
  }

  CircuitState withFailure(final Instant at, final ErrorKind kind, final int threshold) {
    final var failures = consecutiveFailures + 1;
    final var trips = open || failures >= threshold;
    return new CircuitState(trips, at, cooldown, failures, trips ? kind : null);
  }

  boolean cooledDown(final Instant now) {
    return open && Duration.between(lastFailureAt, now).compareTo(cooldown) > 0;
  }
}
