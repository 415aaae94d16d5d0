package com.example.resilientdatasource.core.pool;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.zaxxer.hikari.HikariDataSource;
import java.lang.System.Logger;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.sql.DataSource;

/** A native pool together with the strategy it was built from. */
public final class PoolHandle implements AutoCloseable {

  private static final Logger logger = System.getLogger(PoolHandle.class.getName());

  private final DataSource dataSource;
  private final PoolStrategy strategy;
  private final Instant createdAt;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public PoolHandle(
      final DataSource dataSource, final PoolStrategy strategy, final Instant createdAt) {
    if (dataSource == null) throw new IllegalArgumentException("dataSource cannot be null");
    if (strategy == null) throw new IllegalArgumentException("strategy cannot be null");
    this.dataSource = dataSource;
    this.strategy = strategy;
    this.createdAt = createdAt == null ? Instant.now() : createdAt;
  }

  /**
   * Borrows a connection from the native pool.
   *
   * @return an open connection
   * @throws SQLException if the pool is closed or cannot provide a connection
   */
  public Connection getConnection() throws SQLException {
    if (closed.get())
      throw new SQLNonTransientConnectionException(
          "Pool " + strategy.name() + " is closed", "08003");
    return dataSource.getConnection();
  }

  /**
   * Returns the native pool counters, or {@link PoolStats#EMPTY} when the pool does not expose
   * them.
   *
   * @return current counts
   */
  public PoolStats poolStats() {
    if (closed.get()) return PoolStats.EMPTY;
    if (dataSource instanceof HikariDataSource hikari) {
      final var mxBean = hikari.getHikariPoolMXBean();
      if (mxBean == null) return PoolStats.EMPTY;
      return new PoolStats(
          mxBean.getTotalConnections(),
          mxBean.getActiveConnections(),
          mxBean.getIdleConnections(),
          mxBean.getThreadsAwaitingConnection());
    }
    return PoolStats.EMPTY;
  }

  /**
   * Removes a borrowed connection from the native pool and closes its physical link.
   *
   * @param connection connection obtained from {@link #getConnection()}
   * @return false when the native pool cannot evict, leaving the connection untouched
   */
  public boolean evict(final Connection connection) {
    if (closed.get() || !(dataSource instanceof HikariDataSource hikari)) return false;
    hikari.evictConnection(connection);
    return true;
  }

  public DataSource dataSource() {
    return dataSource;
  }

  public PoolStrategy strategy() {
    return strategy;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public boolean isClosed() {
    return closed.get();
  }

  /** Closes the native pool. Later calls are no-ops. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;
    if (dataSource instanceof AutoCloseable ac) {
      try {
        ac.close();
        logger.log(INFO, "Closed {0} pool", strategy.name());
      } catch (final Exception e) {
        logger.log(WARNING, "Failed to close " + strategy.name() + " pool", e);
      }
    }
  }
}
