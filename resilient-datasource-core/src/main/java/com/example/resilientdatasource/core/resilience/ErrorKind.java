package com.example.resilientdatasource.core.resilience;

/**
 * Closed set of failure kinds produced by {@link ErrorClassifier}. Retry, circuit and degradation
 * decisions are made on these values only.
 */
public enum ErrorKind {
  AUTH_REJECTED(ErrorCategory.FATAL),
  UNKNOWN_DATABASE(ErrorCategory.FATAL),
  UNKNOWN_TABLE(ErrorCategory.FATAL),
  UNKNOWN_HOST(ErrorCategory.FATAL),
  CONNECTION_REFUSED(ErrorCategory.FATAL),
  TIMEOUT(ErrorCategory.TRANSIENT),
  CONNECTION_RESET(ErrorCategory.TRANSIENT),
  CONNECTION_LOST(ErrorCategory.TRANSIENT),
  /** Server-side ceiling reached ({@code max_connections} or {@code max_user_connections}). */
  CONNECTION_LIMIT(ErrorCategory.TRANSIENT),
  LOCK_WAIT_TIMEOUT(ErrorCategory.CONTENTION),
  DEADLOCK(ErrorCategory.CONTENTION),
  CIRCUIT_OPEN(ErrorCategory.CIRCUIT_OPEN),
  SERVICE_CLOSED(ErrorCategory.MISUSE),
  UNKNOWN(ErrorCategory.UNEXPECTED);

  private final ErrorCategory category;

  ErrorKind(final ErrorCategory category) {
    this.category = category;
  }

  public ErrorCategory category() {
    return category;
  }

  public boolean isFatal() {
    return category == ErrorCategory.FATAL;
  }

  /** Whether a connection acquisition failing with this kind is worth another attempt. */
  public boolean isRetryable() {
    return category == ErrorCategory.TRANSIENT || category == ErrorCategory.CONTENTION;
  }

  /** Whether a query failing with this kind is answered with the unavailable sentinel. */
  public boolean degradesGracefully() {
    return isRetryable();
  }

  /** Whether this kind points at the network path rather than the server's answer. */
  public boolean isNetwork() {
    return switch (this) {
      case TIMEOUT, CONNECTION_RESET, CONNECTION_LOST, CONNECTION_REFUSED, UNKNOWN_HOST -> true;
      default -> false;
    };
  }
}
