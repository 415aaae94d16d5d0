package com.example.resilientdatasource.core.resilience;

import java.sql.SQLTransientConnectionException;

/**
 * Raised without touching the network while the {@link CircuitBreaker} is open, so callers can
 * tell "the breaker is protecting us" apart from a database failure.
 */
public class CircuitOpenException extends SQLTransientConnectionException {

  private final CircuitState state;

  public CircuitOpenException(final CircuitState state) {
    super(
        "Circuit breaker is open - database connections temporarily disabled (tripped by %s)"
            .formatted(state.trippedBy()),
        "08C01");
    this.state = state;
  }

  public CircuitState state() {
    return state;
  }
}
