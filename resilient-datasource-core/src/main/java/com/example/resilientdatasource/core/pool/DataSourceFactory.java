package com.example.resilientdatasource.core.pool;

import com.example.resilientdatasource.core.DatabaseSettings;
import javax.sql.DataSource;

/**
 * Creates the native pool for one {@link PoolStrategy}. Implementations may open a first connection
 * while creating the pool. When that fails they throw an unchecked exception whose cause is the
 * driver's {@link java.sql.SQLException}, so {@link ConnectionPool} can classify it. The liveness
 * check run by {@link ConnectionPool} still decides whether a created pool is usable.
 */
@FunctionalInterface
public interface DataSourceFactory {
  /**
   * Creates a new {@link DataSource} for the given settings and strategy.
   *
   * @param settings connection parameters
   * @param strategy pool limits and timeouts
   * @return a new {@link DataSource}, closed by the caller when it implements {@link
   *     AutoCloseable}
   */
  DataSource create(final DatabaseSettings settings, final PoolStrategy strategy);
}
