package com.example.resilientdatasource.core.pool;

import com.example.resilientdatasource.core.DatabaseSettings;
import com.example.resilientdatasource.core.TlsMode;
import java.time.Duration;
import java.util.List;

/**
 * One named pool configuration tried during {@link ConnectionPool#initialize(List)}.
 *
 * <p>The three built-in strategies degrade from a regular pool down to a single connection with
 * short timeouts. They are always attempted in the order returned by {@link #ordered}.
 *
 * @param name strategy name, shown in status snapshots
 * @param connectionLimit maximum number of pooled connections, must be >= 1
 * @param connectTimeout TCP plus handshake timeout for one connection
 * @param idleTimeout how long an idle connection may stay in the pool
 * @param maxIdle number of idle connections kept warm, must be between 0 and {@code
 *     connectionLimit}
 * @param tlsMode transport policy used by this strategy
 */
public record PoolStrategy(
    String name,
    int connectionLimit,
    Duration connectTimeout,
    Duration idleTimeout,
    int maxIdle,
    TlsMode tlsMode) {

  public static final PoolStrategy STANDARD =
      new PoolStrategy(
          "Standard", 5, Duration.ofSeconds(10), Duration.ofSeconds(60), 2, TlsMode.DISABLED);
  public static final PoolStrategy MINIMAL =
      new PoolStrategy(
          "Minimal", 2, Duration.ofSeconds(5), Duration.ofSeconds(30), 1, TlsMode.DISABLED);
  public static final PoolStrategy FALLBACK =
      new PoolStrategy(
          "Fallback", 1, Duration.ofSeconds(3), Duration.ofSeconds(10), 0, TlsMode.DISABLED);

  public PoolStrategy {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
    if (connectionLimit < 1) throw new IllegalArgumentException("connectionLimit must be >= 1");
    if (connectTimeout == null || connectTimeout.isZero() || connectTimeout.isNegative())
      throw new IllegalArgumentException("connectTimeout must be positive");
    if (idleTimeout == null || idleTimeout.isNegative())
      throw new IllegalArgumentException("idleTimeout must be non-negative");
    if (maxIdle < 0 || maxIdle > connectionLimit)
      throw new IllegalArgumentException("maxIdle must be between 0 and connectionLimit");
    if (tlsMode == null) tlsMode = TlsMode.DISABLED;
  }

  /**
   * Returns the built-in strategies, most capable first, adjusted to the given settings.
   *
   * <ul>
   *   <li>the pool size limit replaces the Standard ceiling and caps the smaller ones;
   *   <li>the configured TLS mode applies to every strategy;
   *   <li>debug timeouts double the Standard connect timeout.
   * </ul>
   *
   * @param settings connection settings
   * @param debugTimeouts whether debug timeouts are currently on
   * @return Standard, Minimal, Fallback in that order
   */
  public static List<PoolStrategy> ordered(
      final DatabaseSettings settings, final boolean debugTimeouts) {
    final var limit = settings.poolSizeLimit();
    var standard = STANDARD.withTlsMode(settings.tlsMode());
    if (limit.isPresent()) standard = standard.withConnectionLimit(limit.getAsInt());
    if (debugTimeouts)
      standard = standard.withConnectTimeout(STANDARD.connectTimeout().multipliedBy(2));

    var minimal = MINIMAL.withTlsMode(settings.tlsMode());
    var fallback = FALLBACK.withTlsMode(settings.tlsMode());
    if (limit.isPresent()) {
      minimal = minimal.cappedAt(limit.getAsInt());
      fallback = fallback.cappedAt(limit.getAsInt());
    }
    return List.of(standard, minimal, fallback);
  }

  public PoolStrategy withConnectionLimit(final int connectionLimit) {
    return new PoolStrategy(
        name,
        connectionLimit,
        connectTimeout,
        idleTimeout,
        Math.min(maxIdle, connectionLimit),
        tlsMode);
  }

  public PoolStrategy withConnectTimeout(final Duration connectTimeout) {
    return new PoolStrategy(name, connectionLimit, connectTimeout, idleTimeout, maxIdle, tlsMode);
  }

  public PoolStrategy withTlsMode(final TlsMode tlsMode) {
    return new PoolStrategy(name, connectionLimit, connectTimeout, idleTimeout, maxIdle, tlsMode);
  }

  private PoolStrategy cappedAt(final int ceiling) {
    return connectionLimit <= ceiling ? this : withConnectionLimit(ceiling);
  }
}
