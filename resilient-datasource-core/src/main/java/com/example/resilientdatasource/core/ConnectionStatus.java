package com.example.resilientdatasource.core;

import com.example.resilientdatasource.core.pool.PoolStats;
import com.example.resilientdatasource.core.resilience.CircuitState;
import com.example.resilientdatasource.core.resilience.ConnectionStats;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.UncheckedIOException;
import java.time.Instant;

/**
 * Diagnostics snapshot returned by {@link DatabaseService#getConnectionStatus()}. Informational
 * only; the shape may change between releases.
 *
 * @param connected whether a pool is currently open
 * @param activeStrategy name of the adopted pool strategy, null before initialization
 * @param poolCreatedAt when the active pool was created, null before initialization
 * @param circuit circuit breaker state
 * @param stats connection counters
 * @param pool native pool counts
 * @param debugTimeouts whether debug timeouts are on
 * @param timestamp when the snapshot was taken
 */
public record ConnectionStatus(
    boolean connected,
    String activeStrategy,
    Instant poolCreatedAt,
    CircuitState circuit,
    ConnectionStats.Snapshot stats,
    PoolStats pool,
    boolean debugTimeouts,
    Instant timestamp) {

  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);

  /**
   * Renders the snapshot as JSON, with ISO-8601 instants and durations.
   *
   * @return JSON document
   */
  public String toJson() {
    try {
      return MAPPER.writeValueAsString(this);
    } catch (final JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }
}
