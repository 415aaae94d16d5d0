/**
 * Root package for the resilient-datasource library.
 *
 * <p>The library keeps a MySQL connection pool usable over an unreliable network link. It probes
 * the transport before trusting it, degrades through smaller pool configurations when the regular
 * one cannot be established, retries transient failures with backoff and stops hammering the
 * server once it reports a configuration error.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.resilientdatasource.core.DatabaseService} – the single entry point;
 *       owns the pool, the circuit breaker and the counters.
 *   <li>{@link com.example.resilientdatasource.core.DatabaseSettings} – connection parameters,
 *       resolved from system properties and environment variables.
 *   <li>{@link com.example.resilientdatasource.core.probe.TransportProbe} – raw TCP reachability
 *       check.
 *   <li>{@link com.example.resilientdatasource.core.pool.ConnectionPool} – ordered pool
 *       strategies and connection hand-out.
 *   <li>{@link com.example.resilientdatasource.core.resilience.RetryExecutor} and {@link
 *       com.example.resilientdatasource.core.resilience.CircuitBreaker} – retry and fast-fail
 *       rules driven by {@link com.example.resilientdatasource.core.resilience.ErrorClassifier}.
 *   <li>{@link com.example.resilientdatasource.core.jdbc.QueryExecutor} – timed queries and
 *       transactions.
 *   <li>{@link com.example.resilientdatasource.core.diagnostics.ConnectionDiagnostics} – unpooled
 *       connection checks for troubleshooting.
 * </ul>
 */
package com.example.resilientdatasource.core;
