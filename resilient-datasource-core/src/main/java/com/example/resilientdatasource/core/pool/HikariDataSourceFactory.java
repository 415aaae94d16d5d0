package com.example.resilientdatasource.core.pool;

import com.example.resilientdatasource.core.DatabaseSettings;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.util.Locale;
import javax.sql.DataSource;

/**
 * Default {@link DataSourceFactory} backed by HikariCP and MySQL Connector/J.
 *
 * <p>Pools are created fail-fast: the constructor opens one connection and throws if the server
 * rejects it, instead of letting the error surface only after the borrow timeout.
 */
public final class HikariDataSourceFactory implements DataSourceFactory {

  static final String POOL_NAME_PREFIX = "resilient-";
  static final long INITIALIZATION_FAIL_TIMEOUT_MS = 1L;

  @Override
  public DataSource create(final DatabaseSettings settings, final PoolStrategy strategy) {
    return new HikariDataSource(config(settings, strategy));
  }

  static HikariConfig config(final DatabaseSettings settings, final PoolStrategy strategy) {
    final var config = new HikariConfig();
    config.setPoolName(POOL_NAME_PREFIX + strategy.name().toLowerCase(Locale.ROOT));
    config.setJdbcUrl(settings.jdbcUrl());
    config.setUsername(settings.user());
    config.setPassword(settings.password());
    config.setMaximumPoolSize(strategy.connectionLimit());
    config.setMinimumIdle(strategy.maxIdle());
    // Hikari rejects idle timeouts under 10 s and connection timeouts under 250 ms
    config.setIdleTimeout(Math.max(strategy.idleTimeout().toMillis(), 10_000L));
    config.setConnectionTimeout(Math.max(strategy.connectTimeout().toMillis(), 250L));
    config.setInitializationFailTimeout(INITIALIZATION_FAIL_TIMEOUT_MS);
    config.setDataSourceProperties(
        settings.driverProperties(strategy.tlsMode(), strategy.connectTimeout()));
    return config;
  }
}
