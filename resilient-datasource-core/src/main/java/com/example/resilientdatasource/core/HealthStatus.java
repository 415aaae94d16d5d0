package com.example.resilientdatasource.core;

import java.time.Instant;

/**
 * Result of {@link DatabaseService#healthCheck()}.
 *
 * @param healthy whether the liveness query returned a row
 * @param responseTimeMs time spent on the check, never negative
 * @param error failure description, null when healthy
 * @param timestamp when the check finished
 */
public record HealthStatus(boolean healthy, long responseTimeMs, String error, Instant timestamp) {}
