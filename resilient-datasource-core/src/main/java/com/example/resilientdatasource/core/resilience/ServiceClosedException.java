package com.example.resilientdatasource.core.resilience;

import java.sql.SQLNonTransientException;

/**
 * Raised when a closed service is asked for a connection. Classified as {@link
 * ErrorKind#SERVICE_CLOSED}, never as a lost link, so callers get an error instead of the
 * unavailable sentinel.
 */
public class ServiceClosedException extends SQLNonTransientException {

  public ServiceClosedException(final String name) {
    super(name + " is closed", "08003");
  }
}
