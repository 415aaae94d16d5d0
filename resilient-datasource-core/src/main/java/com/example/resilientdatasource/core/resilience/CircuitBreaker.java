package com.example.resilientdatasource.core.resilience;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import java.lang.System.Logger;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Two-state (closed/open) circuit breaker guarding connection acquisition.
 *
 * <p>The circuit opens only for {@link ErrorCategory#FATAL fatal} kinds. Timeouts, resets and lost
 * connections are expected from the target link and never open it. An open circuit closes lazily on
 * the first {@link #isOpen()} call made after the cooldown has elapsed, or explicitly via {@link
 * #reset()}. No background timer is involved.
 *
 * <p>All transitions are compare-and-set updates of a single {@link CircuitState} reference.
 */
public final class CircuitBreaker {

  private static final Logger logger = System.getLogger(CircuitBreaker.class.getName());

  private final Clock clock;
  private final Duration cooldown;
  private final int failureThreshold;
  private final AtomicReference<CircuitState> state;

  public CircuitBreaker(final Duration cooldown) {
    this(cooldown, 1, Clock.systemUTC());
  }

  /**
   * Creates a closed breaker.
   *
   * @param cooldown how long to stay open after the last fatal failure
   * @param failureThreshold consecutive fatal failures needed to open, must be >= 1
   * @param clock time source
   */
  public CircuitBreaker(final Duration cooldown, final int failureThreshold, final Clock clock) {
    if (cooldown == null || cooldown.isNegative())
      throw new IllegalArgumentException("cooldown must be non-negative");
    if (failureThreshold < 1) throw new IllegalArgumentException("failureThreshold must be >= 1");
    if (clock == null) throw new IllegalArgumentException("clock cannot be null");
    this.cooldown = cooldown;
    this.failureThreshold = failureThreshold;
    this.clock = clock;
    this.state = new AtomicReference<>(CircuitState.closed(cooldown));
  }

  /**
   * Returns whether calls must currently be rejected, closing the circuit first if its cooldown
   * has elapsed.
   *
   * @return true while open
   */
  public boolean isOpen() {
    while (true) {
      final var current = state.get();
      if (!current.open()) return false;
      if (!current.cooledDown(clock.instant())) return true;
      if (state.compareAndSet(current, CircuitState.closed(cooldown))) {
        logger.log(INFO, "Circuit breaker cooldown elapsed, allowing connection attempts again");
        return false;
      }
    }
  }

  /**
   * Records a failed operation. Only fatal kinds count towards opening the circuit.
   *
   * @param kind classified failure
   */
  public void recordFailure(final ErrorKind kind) {
    if (kind == null || !kind.isFatal()) {
      logger.log(DEBUG, "Non-fatal error {0}, circuit breaker remains closed", kind);
      return;
    }
    final var now = clock.instant();
    final var previous = state.getAndUpdate(s -> s.withFailure(now, kind, failureThreshold));
    if (!previous.open() && previous.consecutiveFailures() + 1 >= failureThreshold)
      logger.log(WARNING, "Circuit breaker opened due to fatal error {0}", kind);
  }

  /** Records a successful operation, clearing the consecutive failure count. */
  public void recordSuccess() {
    state.updateAndGet(
        s -> s.open() || s.consecutiveFailures() == 0 ? s : CircuitState.closed(cooldown));
  }

  /** Closes the circuit unconditionally. */
  public void reset() {
    state.set(CircuitState.closed(cooldown));
    logger.log(INFO, "Circuit breaker manually reset");
  }

  /**
   * Returns the current state without triggering the lazy cooldown transition.
   *
   * @return state snapshot
   */
  public CircuitState state() {
    return state.get();
  }

  public Duration cooldown() {
    return cooldown;
  }
}
