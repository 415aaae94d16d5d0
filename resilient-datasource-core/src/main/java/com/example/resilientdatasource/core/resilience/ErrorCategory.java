package com.example.resilientdatasource.core.resilience;

/** Coarse handling class of an {@link ErrorKind}. */
public enum ErrorCategory {
  /** Misconfiguration or rejected access. Not retried; may open the circuit. */
  FATAL,
  /** Network or timing noise. Retried, then degraded to an unavailable result. */
  TRANSIENT,
  /** Lock wait or deadlock. Degraded to an unavailable result. */
  CONTENTION,
  /** Rejected locally by an open circuit breaker. */
  CIRCUIT_OPEN,
  /** The service was used after it was closed. Not retried; surfaced to the caller. */
  MISUSE,
  /** Anything not recognized. Not retried; surfaced to the caller. */
  UNEXPECTED
}
