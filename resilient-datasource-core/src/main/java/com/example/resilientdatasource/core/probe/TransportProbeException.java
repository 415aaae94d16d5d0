package com.example.resilientdatasource.core.probe;

import java.sql.SQLNonTransientConnectionException;

/** Thrown when the pre-flight socket check could not reach the database host. */
public class TransportProbeException extends SQLNonTransientConnectionException {

  private final ProbeResult result;

  public TransportProbeException(final String host, final int port, final ProbeResult result) {
    super(
        "TCP socket check to %s:%d failed: %s".formatted(host, port, result.describe()),
        "08001",
        result.cause());
    this.result = result;
  }

  public ProbeResult result() {
    return result;
  }
}
