package com.example.resilientdatasource.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.resilientdatasource.core.diagnostics.ConnectionDiagnostics;
import com.example.resilientdatasource.core.diagnostics.ConnectionLimitRecovery;
import com.example.resilientdatasource.core.diagnostics.ConnectionOpener;
import com.example.resilientdatasource.core.jdbc.ConnectionSource;
import com.example.resilientdatasource.core.jdbc.QueryExecutor;
import com.example.resilientdatasource.core.jdbc.QueryOutcome;
import com.example.resilientdatasource.core.jdbc.SqlStatement;
import com.example.resilientdatasource.core.jdbc.TransactionWork;
import com.example.resilientdatasource.core.pool.ConnectionPool;
import com.example.resilientdatasource.core.pool.DataSourceFactory;
import com.example.resilientdatasource.core.pool.HikariDataSourceFactory;
import com.example.resilientdatasource.core.pool.PoolHandle;
import com.example.resilientdatasource.core.pool.PoolInitializationException;
import com.example.resilientdatasource.core.pool.PoolStats;
import com.example.resilientdatasource.core.pool.PoolStrategy;
import com.example.resilientdatasource.core.probe.TransportProbe;
import com.example.resilientdatasource.core.probe.TransportProbeException;
import com.example.resilientdatasource.core.resilience.CircuitBreaker;
import com.example.resilientdatasource.core.resilience.CircuitOpenException;
import com.example.resilientdatasource.core.resilience.ConnectionStats;
import com.example.resilientdatasource.core.resilience.ErrorClassifier;
import com.example.resilientdatasource.core.resilience.ErrorKind;
import com.example.resilientdatasource.core.resilience.RetryExecutor;
import com.example.resilientdatasource.core.resilience.RetryExecutor.Policy;
import com.example.resilientdatasource.core.resilience.ServiceClosedException;
import java.lang.System.Logger;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point of the library: owns one connection pool, one circuit breaker and one set of
 * counters, and runs queries through them.
 *
 * <p>Build exactly one instance at startup and hand it to every caller.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var db = DatabaseService.builder()
 *     .settings(DatabaseSettings.fromEnvironment())
 *     .build();
 * db.registerShutdownHook();
 *
 * var rows = db.query("SELECT id, name FROM users WHERE id = ?", 42);
 * if (rows == null) {
 *     // temporarily unavailable: answer "retry later"
 * }
 * }</pre>
 *
 * <h2>Transactions</h2>
 *
 * <pre>{@code
 * db.transaction(List.of(
 *     SqlStatement.of("UPDATE accounts SET balance = balance - ? WHERE id = ?", 10, 1),
 *     SqlStatement.of("UPDATE accounts SET balance = balance + ? WHERE id = ?", 10, 2)));
 * }</pre>
 *
 * <h2>Acquisition path</h2>
 *
 * <ol>
 *   <li>an open circuit fails immediately with {@link CircuitOpenException};
 *   <li>the pool is initialized on first use, probing the TCP link first;
 *   <li>connections are borrowed under {@link RetryExecutor}; after any network-class failure the
 *       link is probed again before the next attempt.
 * </ol>
 */
public final class DatabaseService implements AutoCloseable {

  private static final Logger logger = System.getLogger(DatabaseService.class.getName());

  static final String HEALTH_QUERY = "SELECT 1";

  private final DatabaseSettings settings;
  private final Clock clock;
  private final TransportProbe transportProbe;
  private final ConnectionOpener connectionOpener;
  private final ConnectionLimitRecovery limitRecovery;
  private final ExecutorService workers;
  private final ConnectionPool connectionPool;
  private final CircuitBreaker circuitBreaker;
  private final ConnectionStats stats = new ConnectionStats();
  private final RetryExecutor retry;
  private final QueryExecutor queryExecutor;

  private final AtomicReference<PoolHandle> pool = new AtomicReference<>();
  private final AtomicBoolean probeRequired = new AtomicBoolean(true);
  private final AtomicBoolean debugTimeouts;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private Thread shutdownHook;

  private DatabaseService(final Builder builder) {
    this.settings = builder.settings;
    this.clock = builder.clock;
    this.transportProbe = builder.transportProbe;
    this.connectionOpener = builder.connectionOpener;
    this.debugTimeouts = new AtomicBoolean(settings.debugTimeouts());
    this.limitRecovery =
        builder.limitRecovery != null
            ? builder.limitRecovery
            : settings.connectionLimitRecovery()
                ? new ConnectionLimitRecovery(settings, connectionOpener)
                : null;

    final var threadCount = new AtomicInteger();
    this.workers =
        Executors.newCachedThreadPool(
            r -> {
              final var t = new Thread(r, "resilient-db-worker-" + threadCount.incrementAndGet());
              t.setDaemon(true);
              return t;
            });

    this.connectionPool = new ConnectionPool(settings, builder.dataSourceFactory, workers, clock);
    this.circuitBreaker =
        new CircuitBreaker(settings.circuitCooldown(), builder.failureThreshold, clock);
    this.retry = new RetryExecutor(circuitBreaker, stats, builder.retryPolicy);
    this.queryExecutor =
        new QueryExecutor(new PooledConnectionSource(), workers, this::queryTimeout, stats);
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for {@link DatabaseService}.
   *
   * <p>Only {@link #settings(DatabaseSettings)} is required; every other collaborator has a
   * production default.
   */
  public static class Builder {
    private DatabaseSettings settings;
    private DataSourceFactory dataSourceFactory = new HikariDataSourceFactory();
    private TransportProbe transportProbe = new TransportProbe();
    private ConnectionOpener connectionOpener = ConnectionOpener.DRIVER_MANAGER;
    private Clock clock = Clock.systemUTC();
    private Policy retryPolicy = Policy.defaultPolicy();
    private int failureThreshold = 1;
    private ConnectionLimitRecovery limitRecovery;

    private Builder() {}

    public Builder settings(final DatabaseSettings settings) {
      this.settings = settings;
      return this;
    }

    /**
     * Sets the factory that creates the native pool for each strategy.
     *
     * <p>Default: {@link HikariDataSourceFactory}
     *
     * @param dataSourceFactory pool factory
     * @return this builder
     */
    public Builder dataSourceFactory(final DataSourceFactory dataSourceFactory) {
      this.dataSourceFactory = dataSourceFactory;
      return this;
    }

    public Builder transportProbe(final TransportProbe transportProbe) {
      this.transportProbe = transportProbe;
      return this;
    }

    /**
     * Sets how unpooled connections are opened for diagnostics and connection-limit recovery.
     *
     * <p>Default: {@link java.sql.DriverManager}
     *
     * @param connectionOpener opener
     * @return this builder
     */
    public Builder connectionOpener(final ConnectionOpener connectionOpener) {
      this.connectionOpener = connectionOpener;
      return this;
    }

    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the retry policy for connection acquisition.
     *
     * <p>Default: 3 retries, doubling from 1 s up to 5 s
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(final Policy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets how many consecutive fatal failures open the circuit.
     *
     * <p>Default: 1
     *
     * @param failureThreshold threshold, must be >= 1
     * @return this builder
     */
    public Builder failureThreshold(final int failureThreshold) {
      this.failureThreshold = failureThreshold;
      return this;
    }

    /**
     * Overrides the connection-limit recovery. When not set, recovery is created only if {@link
     * DatabaseSettings#connectionLimitRecovery()} is enabled.
     *
     * @param limitRecovery recovery to run when pool initialization hits the connection limit
     * @return this builder
     */
    public Builder limitRecovery(final ConnectionLimitRecovery limitRecovery) {
      this.limitRecovery = limitRecovery;
      return this;
    }

    /**
     * Builds the service. No connection is opened until first use or {@link
     * DatabaseService#initializePool()}.
     *
     * @return configured service
     * @throws IllegalStateException if required fields are not set
     */
    public DatabaseService build() {
      if (settings == null) throw new IllegalStateException("settings is required");
      if (dataSourceFactory == null)
        throw new IllegalStateException("dataSourceFactory cannot be null");
      if (transportProbe == null) throw new IllegalStateException("transportProbe cannot be null");
      if (connectionOpener == null)
        throw new IllegalStateException("connectionOpener cannot be null");
      if (clock == null) throw new IllegalStateException("clock cannot be null");
      if (retryPolicy == null) throw new IllegalStateException("retryPolicy cannot be null");
      if (failureThreshold < 1) throw new IllegalArgumentException("failureThreshold must be >= 1");
      return new DatabaseService(this);
    }
  }

  /**
   * Returns the active pool, creating it on first call.
   *
   * <p>Strategies are tried in order (see {@link PoolStrategy#ordered}); the first one whose
   * liveness query succeeds is kept until {@link #closePool()}. When every strategy fails because
   * of the server's per-user connection limit and recovery is enabled, stale sessions are cleared
   * and initialization is attempted once more.
   *
   * @return the active pool
   * @throws ServiceClosedException if {@link #close()} was called
   * @throws CircuitOpenException if the circuit is open
   * @throws SQLException if no strategy could be established
   */
  public synchronized PoolHandle initializePool() throws SQLException {
    final var existing = pool.get();
    if (existing != null) return existing;
    if (closed.get()) throw new ServiceClosedException("DatabaseService");
    if (circuitBreaker.isOpen()) throw new CircuitOpenException(circuitBreaker.state());

    stats.recordAttempt();
    try {
      probeIfRequired();
      final var handle = createFirstLivePool();
      pool.set(handle);
      stats.recordSuccess();
      circuitBreaker.recordSuccess();
      return handle;
    } catch (final SQLException e) {
      final var kind = ErrorClassifier.classify(e);
      stats.recordFailure(kind);
      if (kind.isNetwork()) probeRequired.set(true);
      circuitBreaker.recordFailure(kind);
      logger.log(WARNING, "Pool initialization failed ({0}): {1}", kind, e.getMessage());
      throw e;
    }
  }

  private PoolHandle createFirstLivePool() throws SQLException {
    final var strategies = PoolStrategy.ordered(settings, debugTimeouts.get());
    try {
      return connectionPool.initialize(strategies);
    } catch (final PoolInitializationException e) {
      if (limitRecovery == null || ErrorClassifier.classify(e) != ErrorKind.CONNECTION_LIMIT)
        throw e;
      logger.log(INFO, "Connection limit reached during pool initialization, recovering");
      if (!limitRecovery.recover()) throw e;
      return connectionPool.initialize(strategies);
    }
  }

  private void probeIfRequired() throws SQLException {
    if (!probeRequired.get()) return;
    final var result =
        transportProbe.probe(settings.host(), settings.port(), settings.probeTimeout());
    if (!result.ok()) {
      logger.log(
          WARNING,
          "Transport probe to {0}:{1} failed: {2}",
          settings.host(),
          String.valueOf(settings.port()),
          result.describe());
      throw new TransportProbeException(settings.host(), settings.port(), result);
    }
    probeRequired.set(false);
    logger.log(DEBUG, "Transport probe succeeded in {0} ms", result.elapsed().toMillis());
  }

  /**
   * Runs a query.
   *
   * @param sql statement text with {@code ?} placeholders
   * @param params positional parameters
   * @return rows, or {@code null} when the database is temporarily unavailable and the caller
   *     should answer "retry later"
   * @throws CircuitOpenException if the circuit is open; no network call is made
   * @throws SQLException for configuration errors and unexpected failures
   */
  public List<Map<String, Object>> query(final String sql, final Object... params)
      throws SQLException {
    return queryExecutor.query(sql, params);
  }

  /**
   * Runs a statement and reports the outcome without throwing.
   *
   * @param sql statement text with {@code ?} placeholders
   * @param params positional parameters
   * @return classified outcome
   */
  public QueryOutcome execute(final String sql, final List<?> params) {
    return queryExecutor.execute(sql, params);
  }

  /**
   * Runs the statements in order in one transaction.
   *
   * @param statements statements to run
   * @return one result list per statement
   * @throws SQLException after rollback, when any statement fails
   */
  public List<List<Map<String, Object>>> transaction(final List<SqlStatement> statements)
      throws SQLException {
    return queryExecutor.transaction(statements);
  }

  /**
   * Runs {@code work} in one transaction.
   *
   * @param work unit of work
   * @param <T> result type
   * @return work result
   * @throws SQLException after rollback, when the work fails
   */
  public <T> T transaction(final TransactionWork<T> work) throws SQLException {
    return queryExecutor.transaction(work);
  }

  /**
   * Runs the liveness query and measures it. Never throws.
   *
   * @return health status
   */
  public HealthStatus healthCheck() {
    final var start = System.nanoTime();
    try {
      final var rows = query(HEALTH_QUERY);
      final var elapsed = millisSince(start);
      if (rows == null || rows.isEmpty())
        return new HealthStatus(
            false, elapsed, "Database temporarily unavailable", clock.instant());
      return new HealthStatus(true, elapsed, null, clock.instant());
    } catch (final SQLException | RuntimeException e) {
      return new HealthStatus(false, millisSince(start), e.getMessage(), clock.instant());
    }
  }

  /**
   * Returns whether a liveness query currently succeeds. Never throws.
   *
   * @return true when the database answered
   */
  public boolean isDatabaseAvailable() {
    return healthCheck().healthy();
  }

  /**
   * Returns a diagnostics snapshot. Does not touch the network.
   *
   * @return current status
   */
  public ConnectionStatus getConnectionStatus() {
    final var handle = pool.get();
    return new ConnectionStatus(
        handle != null && !handle.isClosed(),
        handle == null ? null : handle.strategy().name(),
        handle == null ? null : handle.createdAt(),
        circuitBreaker.state(),
        stats.snapshot(),
        getPoolStats(),
        debugTimeouts.get(),
        clock.instant());
  }

  /**
   * Returns the native pool counts, or {@link PoolStats#EMPTY} before initialization.
   *
   * @return pool counts
   */
  public PoolStats getPoolStats() {
    final var handle = pool.get();
    return handle == null ? PoolStats.EMPTY : handle.poolStats();
  }

  /** Closes the circuit unconditionally. */
  public void resetCircuitBreaker() {
    circuitBreaker.reset();
  }

  /** Zeroes the connection counters. */
  public void resetStats() {
    stats.reset();
  }

  /**
   * Switches debug timeouts on or off. Query timeouts follow immediately; connect timeouts only
   * apply to pools created afterwards.
   *
   * @param enabled whether timeouts are doubled
   */
  public void setDebugTimeouts(final boolean enabled) {
    if (debugTimeouts.getAndSet(enabled) != enabled)
      logger.log(INFO, "Debug timeouts {0}", enabled ? "enabled" : "disabled");
  }

  public boolean isDebugTimeouts() {
    return debugTimeouts.get();
  }

  /**
   * Returns the timeout currently applied to each query.
   *
   * @return query timeout, doubled while debug timeouts are on
   */
  public Duration queryTimeout() {
    final var base = settings.queryTimeout();
    return debugTimeouts.get() ? base.multipliedBy(2) : base;
  }

  /**
   * Creates unpooled connection diagnostics for the configured database.
   *
   * @return diagnostics helper
   */
  public ConnectionDiagnostics diagnostics() {
    return new ConnectionDiagnostics(settings, transportProbe, connectionOpener);
  }

  public DatabaseSettings settings() {
    return settings;
  }

  /**
   * Closes the active pool, if any. Safe to call repeatedly and before initialization; a later
   * query initializes a new pool.
   */
  public void closePool() {
    final PoolHandle handle;
    synchronized (this) {
      handle = pool.getAndSet(null);
    }
    if (handle == null) {
      logger.log(DEBUG, "No database pool to close");
      return;
    }
    handle.close();
    probeRequired.set(true);
    logger.log(INFO, "Database pool closed");
  }

  /**
   * Installs a JVM shutdown hook that closes the pool on SIGINT/SIGTERM. Later calls are no-ops.
   */
  public synchronized void registerShutdownHook() {
    if (shutdownHook != null) return;
    shutdownHook = new Thread(this::closePool, "resilient-db-shutdown");
    Runtime.getRuntime().addShutdownHook(shutdownHook);
  }

  /** Closes the pool and stops the worker threads. The service cannot be used afterwards. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;
    closePool();
    removeShutdownHook();
    workers.shutdown();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) workers.shutdownNow();
    } catch (final InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private synchronized void removeShutdownHook() {
    if (shutdownHook == null) return;
    try {
      Runtime.getRuntime().removeShutdownHook(shutdownHook);
    } catch (final IllegalStateException e) {
      logger.log(DEBUG, "JVM already shutting down, keeping shutdown hook");
    }
    shutdownHook = null;
  }

  private static long millisSince(final long startNanos) {
    return Math.max(0L, Duration.ofNanos(System.nanoTime() - startNanos).toMillis());
  }

  private final class PooledConnectionSource implements ConnectionSource {

    @Override
    public Connection acquire() throws SQLException {
      if (closed.get()) throw new ServiceClosedException("DatabaseService");
      if (circuitBreaker.isOpen()) throw new CircuitOpenException(circuitBreaker.state());
      initializePool();
      return retry.withRetry(
          () -> {
            try {
              probeIfRequired();
              final var handle = pool.get();
              return connectionPool.acquire(handle != null ? handle : initializePool());
            } catch (final SQLException e) {
              if (ErrorClassifier.classify(e).isNetwork()) probeRequired.set(true);
              throw e;
            }
          });
    }

    @Override
    public void release(final Connection connection) {
      connectionPool.release(connection);
    }

    @Override
    public void discard(final Connection connection) {
      connectionPool.discard(pool.get(), connection);
    }
  }
}
