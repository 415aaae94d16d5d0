package com.example.resilientdatasource.core.probe;

import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of a {@link TransportProbe} attempt.
 *
 * @param ok whether the TCP handshake completed
 * @param failure failure kind when {@code ok} is false
 * @param elapsed time spent on the attempt
 * @param cause underlying socket error, null on success or plain timeout
 */
public record ProbeResult(
    boolean ok, Optional<ProbeFailure> failure, Duration elapsed, Throwable cause) {

  /** Reason a probe did not reach the server. */
  public enum ProbeFailure {
    TIMEOUT,
    REFUSED,
    UNKNOWN
  }

  public ProbeResult {
    if (failure == null) failure = Optional.empty();
    if (ok == failure.isPresent())
      throw new IllegalArgumentException("failure must be present exactly when ok is false");
    if (elapsed == null) elapsed = Duration.ZERO;
  }

  public static ProbeResult success(final Duration elapsed) {
    return new ProbeResult(true, Optional.empty(), elapsed, null);
  }

  public static ProbeResult failure(
      final ProbeFailure failure, final Duration elapsed, final Throwable cause) {
    return new ProbeResult(false, Optional.of(failure), elapsed, cause);
  }

  /**
   * Human readable description of the failure, suitable for logs.
   *
   * @return description, or {@code "ok"}
   */
  public String describe() {
    if (ok) return "ok";
    final var reason = failure.map(Enum::name).orElse("UNKNOWN");
    return cause == null || cause.getMessage() == null
        ? reason
        : reason + " (" + cause.getMessage() + ")";
  }
}
