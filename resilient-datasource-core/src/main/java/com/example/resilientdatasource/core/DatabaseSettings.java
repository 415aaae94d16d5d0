package com.example.resilientdatasource.core;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Properties;
import java.util.function.Function;

/**
 * Connection parameters and timeouts for a {@link DatabaseService}.
 *
 * <p>Values can be supplied through the {@link Builder} or resolved from system properties and
 * environment variables via {@link #fromEnvironment()}:
 *
 * <ul>
 *   <li>db.host / DB_HOST / DATABASE_HOST (default {@code localhost})
 *   <li>db.port / DB_PORT / DATABASE_PORT (default {@code 3306})
 *   <li>db.user / DB_USER / DATABASE_USER (default {@code root})
 *   <li>db.password / DB_PASSWORD / DATABASE_PASSWORD (default empty)
 *   <li>db.name / DB_NAME / DATABASE_NAME (default {@code app})
 *   <li>db.pool.limit / DB_POOL_LIMIT / DATABASE_POOL_LIMIT (optional connection ceiling)
 *   <li>db.debug.timeout / DEBUG_DB_TIMEOUT (default {@code false})
 *   <li>db.tls.mode / DB_TLS_MODE (default {@code DISABLED})
 *   <li>db.limit.recovery / DB_LIMIT_RECOVERY (default {@code false})
 * </ul>
 *
 * <p>Malformed numeric values fall back to their defaults.
 *
 * @param host database host name or address
 * @param port database port
 * @param user database user
 * @param password database password
 * @param database database (schema) name
 * @param poolSizeLimit optional override of the connection-count ceiling
 * @param debugTimeouts whether connect and query timeouts start out doubled
 * @param tlsMode transport encryption policy
 * @param connectionLimitRecovery whether to clear stale sessions when the server reports its
 *     per-user connection limit during pool initialization
 * @param queryTimeout upper bound for a single query
 * @param livenessTimeout upper bound for the {@code SELECT 1} check run against a new pool
 * @param probeTimeout upper bound for the raw socket check
 * @param circuitCooldown how long the circuit breaker stays open after a fatal failure
 */
public record DatabaseSettings(
    String host,
    int port,
    String user,
    String password,
    String database,
    OptionalInt poolSizeLimit,
    boolean debugTimeouts,
    TlsMode tlsMode,
    boolean connectionLimitRecovery,
    Duration queryTimeout,
    Duration livenessTimeout,
    Duration probeTimeout,
    Duration circuitCooldown) {

  public static final int DEFAULT_PORT = 3306;
  public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_LIVENESS_TIMEOUT = Duration.ofSeconds(5);
  public static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(3);
  public static final Duration DEFAULT_CIRCUIT_COOLDOWN = Duration.ofSeconds(30);
  static final Duration SOCKET_TIMEOUT_MARGIN = Duration.ofSeconds(5);

  public DatabaseSettings {
    if (host == null || host.isBlank()) throw new IllegalArgumentException("host is required");
    if (port < 1 || port > 65_535) throw new IllegalArgumentException("port out of range: " + port);
    if (user == null) throw new IllegalArgumentException("user is required");
    if (database == null || database.isBlank())
      throw new IllegalArgumentException("database is required");
    if (password == null) password = "";
    if (poolSizeLimit == null) poolSizeLimit = OptionalInt.empty();
    if (poolSizeLimit.isPresent() && poolSizeLimit.getAsInt() < 1)
      throw new IllegalArgumentException("poolSizeLimit must be >= 1");
    if (tlsMode == null) tlsMode = TlsMode.DISABLED;
    requirePositive(queryTimeout, "queryTimeout");
    requirePositive(livenessTimeout, "livenessTimeout");
    requirePositive(probeTimeout, "probeTimeout");
    if (circuitCooldown == null || circuitCooldown.isNegative())
      throw new IllegalArgumentException("circuitCooldown must be non-negative");
  }

  private static void requirePositive(final Duration value, final String name) {
    if (value == null || value.isZero() || value.isNegative())
      throw new IllegalArgumentException(name + " must be positive");
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
   * Resolves settings from system properties, falling back to environment variables.
   *
   * @return resolved settings
   */
  public static DatabaseSettings fromEnvironment() {
    return fromLookup(name -> Optional.ofNullable(System.getenv(name)));
  }

  static DatabaseSettings fromLookup(final Function<String, Optional<String>> env) {
    final var builder = builder();
    lookup(env, "db.host", "DB_HOST", "DATABASE_HOST").ifPresent(builder::host);
    lookup(env, "db.port", "DB_PORT", "DATABASE_PORT")
        .flatMap(DatabaseSettings::parseInt)
        .ifPresent(builder::port);
    lookup(env, "db.user", "DB_USER", "DATABASE_USER").ifPresent(builder::user);
    lookup(env, "db.password", "DB_PASSWORD", "DATABASE_PASSWORD").ifPresent(builder::password);
    lookup(env, "db.name", "DB_NAME", "DATABASE_NAME").ifPresent(builder::database);
    lookup(env, "db.pool.limit", "DB_POOL_LIMIT", "DATABASE_POOL_LIMIT")
        .flatMap(DatabaseSettings::parseInt)
        .filter(limit -> limit > 0)
        .ifPresent(builder::poolSizeLimit);
    lookup(env, "db.debug.timeout", "DEBUG_DB_TIMEOUT")
        .map(Boolean::parseBoolean)
        .ifPresent(builder::debugTimeouts);
    lookup(env, "db.tls.mode", "DB_TLS_MODE").flatMap(TlsMode::parse).ifPresent(builder::tlsMode);
    lookup(env, "db.limit.recovery", "DB_LIMIT_RECOVERY")
        .map(Boolean::parseBoolean)
        .ifPresent(builder::connectionLimitRecovery);
    return builder.build();
  }

  private static Optional<String> lookup(
      final Function<String, Optional<String>> env,
      final String property,
      final String... variables) {
    var value = Optional.ofNullable(System.getProperty(property));
    for (final var variable : variables) value = value.or(() -> env.apply(variable));
    return value.filter(v -> !v.isBlank()).map(String::trim);
  }

  private static Optional<Integer> parseInt(final String value) {
    try {
      return Optional.of(Integer.parseInt(value));
    } catch (final NumberFormatException e) {
      return Optional.empty();
    }
  }

  /**
   * Returns the driver socket read timeout. It covers the doubled debug query timeout plus the
   * driver-side statement timeout, so it only fires on a link that stopped answering.
   *
   * @return socket read timeout
   */
  public Duration socketTimeout() {
    return queryTimeout.multipliedBy(2).plus(SOCKET_TIMEOUT_MARGIN);
  }

  /**
   * Returns the JDBC URL for the configured MySQL server.
   *
   * @return jdbc url without driver properties
   */
  public String jdbcUrl() {
    return "jdbc:mysql://%s:%d/%s".formatted(host, port, database);
  }

  /**
   * Builds the driver properties for a connection attempt.
   *
   * @param tls transport policy to apply
   * @param connectTimeout handshake timeout
   * @return driver properties, including credentials
   */
  public Properties connectionProperties(final TlsMode tls, final Duration connectTimeout) {
    final var props = new Properties();
    props.setProperty("user", user);
    props.setProperty("password", password);
    props.putAll(driverProperties(tls, connectTimeout));
    return props;
  }

  /**
   * Builds the driver properties that do not carry credentials.
   *
   * @param tls transport policy to apply
   * @param connectTimeout handshake timeout
   * @return driver properties
   */
  public Properties driverProperties(final TlsMode tls, final Duration connectTimeout) {
    final var props = new Properties();
    props.setProperty("sslMode", tls.sslMode());
    props.setProperty("connectTimeout", Long.toString(connectTimeout.toMillis()));
    props.setProperty("socketTimeout", Long.toString(socketTimeout().toMillis()));
    props.setProperty("tcpKeepAlive", "true");
    props.setProperty("characterEncoding", "UTF-8");
    props.setProperty("connectionTimeZone", "UTC");
    props.setProperty("allowMultiQueries", "false");
    // caching_sha2_password needs the server key to authenticate over a plaintext link
    if (tls == TlsMode.DISABLED) props.setProperty("allowPublicKeyRetrieval", "true");
    return props;
  }

  @Override
  public String toString() {
    return ("DatabaseSettings[host=%s, port=%d, user=%s, database=%s, poolSizeLimit=%s,"
            + " debugTimeouts=%s, tlsMode=%s]")
        .formatted(host, port, user, database, poolSizeLimit, debugTimeouts, tlsMode);
  }

  /** Builder for {@link DatabaseSettings}. */
  public static class Builder {
    private String host = "localhost";
    private int port = DEFAULT_PORT;
    private String user = "root";
    private String password = "";
    private String database = "app";
    private OptionalInt poolSizeLimit = OptionalInt.empty();
    private boolean debugTimeouts;
    private TlsMode tlsMode = TlsMode.DISABLED;
    private boolean connectionLimitRecovery;
    private Duration queryTimeout = DEFAULT_QUERY_TIMEOUT;
    private Duration livenessTimeout = DEFAULT_LIVENESS_TIMEOUT;
    private Duration probeTimeout = DEFAULT_PROBE_TIMEOUT;
    private Duration circuitCooldown = DEFAULT_CIRCUIT_COOLDOWN;

    private Builder() {}

    public Builder host(final String host) {
      this.host = host;
      return this;
    }

    public Builder port(final int port) {
      this.port = port;
      return this;
    }

    public Builder user(final String user) {
      this.user = user;
      return this;
    }

    public Builder password(final String password) {
      this.password = password;
      return this;
    }

    public Builder database(final String database) {
      this.database = database;
      return this;
    }

    /**
     * Overrides the connection-count ceiling of the default strategy. Smaller strategies are capped
     * at this value.
     *
     * @param poolSizeLimit maximum connections, must be >= 1
     * @return this builder
     */
    public Builder poolSizeLimit(final int poolSizeLimit) {
      this.poolSizeLimit = OptionalInt.of(poolSizeLimit);
      return this;
    }

    public Builder debugTimeouts(final boolean debugTimeouts) {
      this.debugTimeouts = debugTimeouts;
      return this;
    }

    public Builder tlsMode(final TlsMode tlsMode) {
      this.tlsMode = tlsMode;
      return this;
    }

    public Builder connectionLimitRecovery(final boolean connectionLimitRecovery) {
      this.connectionLimitRecovery = connectionLimitRecovery;
      return this;
    }

    public Builder queryTimeout(final Duration queryTimeout) {
      this.queryTimeout = queryTimeout;
      return this;
    }

    public Builder livenessTimeout(final Duration livenessTimeout) {
      this.livenessTimeout = livenessTimeout;
      return this;
    }

    public Builder probeTimeout(final Duration probeTimeout) {
      this.probeTimeout = probeTimeout;
      return this;
    }

    public Builder circuitCooldown(final Duration circuitCooldown) {
      this.circuitCooldown = circuitCooldown;
      return this;
    }

    /**
     * Builds the settings.
     *
     * @return validated settings
     * @throws IllegalArgumentException if a value is out of range
     */
    public DatabaseSettings build() {
      return new DatabaseSettings(
          host,
          port,
          user,
          password,
          database,
          poolSizeLimit,
          debugTimeouts,
          tlsMode,
          connectionLimitRecovery,
          queryTimeout,
          livenessTimeout,
          probeTimeout,
          circuitCooldown);
    }
  }
}
