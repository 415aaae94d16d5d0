package com.example.resilientdatasource.core.pool;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.resilientdatasource.core.DatabaseSettings;
import com.example.resilientdatasource.core.resilience.TimeoutRace;
import java.lang.System.Logger;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Builds native pools from {@link PoolStrategy strategies} and hands out their connections.
 *
 * <p>{@link #initialize(List)} walks the strategies once, in order, and adopts the first pool whose
 * {@code SELECT 1} check completes within the liveness timeout. Every rejected candidate is closed
 * before the next one is tried.
 */
public final class ConnectionPool {

  private static final Logger logger = System.getLogger(ConnectionPool.class.getName());

  static final String LIVENESS_QUERY = "SELECT 1";

  private final DatabaseSettings settings;
  private final DataSourceFactory factory;
  private final ExecutorService executor;
  private final Clock clock;

  public ConnectionPool(
      final DatabaseSettings settings,
      final DataSourceFactory factory,
      final ExecutorService executor,
      final Clock clock) {
    if (settings == null) throw new IllegalArgumentException("settings cannot be null");
    if (factory == null) throw new IllegalArgumentException("factory cannot be null");
    if (executor == null) throw new IllegalArgumentException("executor cannot be null");
    if (clock == null) throw new IllegalArgumentException("clock cannot be null");
    this.settings = settings;
    this.factory = factory;
    this.executor = executor;
    this.clock = clock;
  }

  /**
   * Creates a native pool for {@code strategy}.
   *
   * @param strategy pool configuration
   * @return handle owning the new pool
   * @throws SQLException if the factory rejects the configuration or the server refuses the first
   *     connection; a driver error reported by the factory is rethrown as is
   */
  public PoolHandle createPool(final PoolStrategy strategy) throws SQLException {
    logger.log(
        INFO,
        "Creating {0} pool for {1}:{2}/{3} (limit {4}, connect timeout {5} ms, tls {6})",
        strategy.name(),
        settings.host(),
        String.valueOf(settings.port()),
        settings.database(),
        strategy.connectionLimit(),
        strategy.connectTimeout().toMillis(),
        strategy.tlsMode());
    try {
      return new PoolHandle(factory.create(settings, strategy), strategy, clock.instant());
    } catch (final RuntimeException e) {
      if (e.getCause() instanceof SQLException sql) throw sql;
      throw new SQLException("Failed to create " + strategy.name() + " pool: " + e.getMessage(), e);
    }
  }

  /**
   * Borrows a connection from {@code handle}.
   *
   * @param handle active pool
   * @return an open connection, to be given back through {@link #release(Connection)}
   * @throws SQLException if no connection can be obtained
   */
  public Connection acquire(final PoolHandle handle) throws SQLException {
    if (handle == null) throw new SQLException("Connection pool is not initialized", "08003");
    return handle.getConnection();
  }

  /**
   * Returns a connection to its pool. Never throws; failures are logged.
   *
   * @param connection connection to release, may be null
   */
  public void release(final Connection connection) {
    if (connection == null) return;
    try {
      connection.close();
    } catch (final SQLException e) {
      logger.log(WARNING, "Failed to release connection", e);
    }
  }

  /**
   * Drops a connection that must not be lent out again. The native pool evicts it when it can;
   * otherwise the link is aborted. Never throws; failures are logged.
   *
   * @param handle pool the connection came from, may be null
   * @param connection connection to drop, may be null
   */
  public void discard(final PoolHandle handle, final Connection connection) {
    if (connection == null) return;
    try {
      if (handle != null && handle.evict(connection)) {
        logger.log(DEBUG, "Evicted connection from {0} pool", handle.strategy().name());
        return;
      }
      connection.abort(executor);
    } catch (final SQLException | RuntimeException e) {
      logger.log(WARNING, "Failed to discard connection", e);
    }
  }

  /**
   * Tries each strategy in order and returns the first pool that passes the liveness check.
   *
   * @param strategies candidates, most capable first
   * @return the adopted pool
   * @throws PoolInitializationException if every strategy fails
   */
  public PoolHandle initialize(final List<PoolStrategy> strategies)
      throws PoolInitializationException {
    final var failures = new ArrayList<SQLException>();
    for (final var strategy : strategies) {
      PoolHandle candidate = null;
      try {
        candidate = createPool(strategy);
        checkLiveness(candidate);
        logger.log(INFO, "Database pool ready using {0} strategy", strategy.name());
        return candidate;
      } catch (final SQLException e) {
        logger.log(
            WARNING, "{0} pool failed liveness check: {1}", strategy.name(), e.getMessage());
        failures.add(e);
        if (candidate != null) candidate.close();
      }
    }
    logger.log(WARNING, "All {0} pool strategies failed", strategies.size());
    throw new PoolInitializationException(failures);
  }

  private void checkLiveness(final PoolHandle handle) throws SQLException {
    final var timeout = settings.livenessTimeout();
    TimeoutRace.race(
        () -> {
          try (final var conn = handle.getConnection();
              final var stmt = conn.createStatement()) {
            stmt.setQueryTimeout((int) Math.max(1L, timeout.toSeconds()));
            try (final var rs = stmt.executeQuery(LIVENESS_QUERY)) {
              if (!rs.next()) throw new SQLException("Liveness query returned no rows");
            }
            return Boolean.TRUE;
          }
        },
        timeout,
        executor,
        () -> logger.log(DEBUG, "{0} liveness check timed out", handle.strategy().name()));
  }
}
