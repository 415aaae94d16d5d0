package com.example.resilientdatasource.core.resilience;

import java.util.concurrent.atomic.LongAdder;

/**
 * Monotonic connection counters. Only {@link #reset()} brings them back to zero.
 *
 * <p>{@code attempts}, {@code successes} and {@code failures} describe connection acquisitions
 * only, so {@code successes + failures} never exceeds {@code attempts}. Statements that fail on an
 * acquired connection are counted in {@code queryFailures}. {@code timeouts} and {@code resets}
 * cover both.
 */
public final class ConnectionStats {

  private final LongAdder attempts = new LongAdder();
  private final LongAdder successes = new LongAdder();
  private final LongAdder failures = new LongAdder();
  private final LongAdder queryFailures = new LongAdder();
  private final LongAdder timeouts = new LongAdder();
  private final LongAdder resets = new LongAdder();

  public void recordAttempt() {
    attempts.increment();
  }

  public void recordSuccess() {
    successes.increment();
  }

  /**
   * Counts a failed acquisition.
   *
   * @param kind classified failure
   */
  public void recordFailure(final ErrorKind kind) {
    failures.increment();
    recordKind(kind);
  }

  /**
   * Counts a statement or transaction that failed on an acquired connection.
   *
   * @param kind classified failure
   */
  public void recordQueryFailure(final ErrorKind kind) {
    queryFailures.increment();
    recordKind(kind);
  }

  private void recordKind(final ErrorKind kind) {
    if (kind == ErrorKind.TIMEOUT) timeouts.increment();
    else if (kind == ErrorKind.CONNECTION_RESET || kind == ErrorKind.CONNECTION_LOST)
      resets.increment();
  }

  public Snapshot snapshot() {
    return new Snapshot(
        attempts.sum(),
        successes.sum(),
        failures.sum(),
        queryFailures.sum(),
        timeouts.sum(),
        resets.sum());
  }

  public void reset() {
    attempts.reset();
    successes.reset();
    failures.reset();
    queryFailures.reset();
    timeouts.reset();
    resets.reset();
  }

  /**
   * Point-in-time copy of the counters.
   *
   * @param attempts connection acquisition attempts
   * @param successes successful acquisitions
   * @param failures failed acquisitions
   * @param queryFailures failed statements and transactions
   * @param timeouts acquisitions and statements that failed with a timeout
   * @param resets acquisitions and statements that failed on a reset or lost connection
   */
  public record Snapshot(
      long attempts,
      long successes,
      long failures,
      long queryFailures,
      long timeouts,
      long resets) {}
}
