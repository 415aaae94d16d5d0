package com.example.resilientdatasource.core.pool;

import java.sql.SQLException;
import java.util.List;

/**
 * Raised when every {@link PoolStrategy} failed its liveness check. The last failure is the cause;
 * earlier ones are attached as suppressed exceptions, in strategy order.
 */
public class PoolInitializationException extends SQLException {

  private final List<SQLException> failures;

  public PoolInitializationException(final List<SQLException> failures) {
    super(
        "All pool strategies failed",
        failures.isEmpty() ? null : failures.get(failures.size() - 1).getSQLState(),
        failures.isEmpty() ? 0 : failures.get(failures.size() - 1).getErrorCode(),
        failures.isEmpty() ? null : failures.get(failures.size() - 1));
    this.failures = List.copyOf(failures);
    for (var i = 0; i < this.failures.size() - 1; i++) addSuppressed(this.failures.get(i));
  }

  public List<SQLException> failures() {
    return failures;
  }
}
