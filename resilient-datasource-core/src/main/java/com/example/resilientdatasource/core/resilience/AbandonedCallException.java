package com.example.resilientdatasource.core.resilience;

import java.sql.SQLTimeoutException;

/**
 * Thrown by {@link TimeoutRace} when the caller stopped waiting while the call was still running.
 * Resources the call uses still belong to it; they are handed to the race's {@code afterAbandoned}
 * hook once the worker returns.
 */
public class AbandonedCallException extends SQLTimeoutException {

  public AbandonedCallException(final String reason, final String sqlState, final Throwable cause) {
    super(reason, sqlState, cause);
  }
}
