package com.example.resilientdatasource.core.diagnostics;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.resilientdatasource.core.DatabaseSettings;
import com.example.resilientdatasource.core.TlsMode;
import com.example.resilientdatasource.core.probe.TransportProbe;
import com.example.resilientdatasource.core.probe.TransportProbeException;
import com.example.resilientdatasource.core.resilience.ErrorClassifier;
import com.example.resilientdatasource.core.resilience.ErrorKind;
import java.lang.System.Logger;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One-off connection checks that bypass the pool, used to find out why a database cannot be
 * reached. None of the methods throw; every failure ends up in the returned report.
 */
public final class ConnectionDiagnostics {

  private static final Logger logger = System.getLogger(ConnectionDiagnostics.class.getName());

  static final Duration HANDSHAKE_TIMEOUT = Duration.ofSeconds(10);

  private final DatabaseSettings settings;
  private final TransportProbe probe;
  private final ConnectionOpener opener;

  public ConnectionDiagnostics(
      final DatabaseSettings settings, final TransportProbe probe, final ConnectionOpener opener) {
    if (settings == null) throw new IllegalArgumentException("settings cannot be null");
    if (probe == null) throw new IllegalArgumentException("probe cannot be null");
    if (opener == null) throw new IllegalArgumentException("opener cannot be null");
    this.settings = settings;
    this.probe = probe;
    this.opener = opener;
  }

  /**
   * Timings of a single connection attempt, phase by phase. Phases that were not reached report
   * {@code -1}.
   *
   * @param success whether the whole sequence completed
   * @param dnsMillis host name resolution
   * @param tcpMillis raw TCP connect
   * @param handshakeMillis driver handshake and authentication
   * @param queryMillis version query
   * @param totalMillis whole sequence
   * @param resolvedAddress address the host resolved to, null if resolution failed
   * @param serverVersion reported server version, null on failure
   * @param errorKind classified failure, null on success
   * @param errorCode vendor error code, 0 when unknown
   * @param sqlState SQLState of the failure, null when unknown
   * @param errorMessage failure message, null on success
   */
  public record BasicConnectionReport(
      boolean success,
      long dnsMillis,
      long tcpMillis,
      long handshakeMillis,
      long queryMillis,
      long totalMillis,
      String resolvedAddress,
      String serverVersion,
      ErrorKind errorKind,
      int errorCode,
      String sqlState,
      String errorMessage) {}

  /**
   * Outcome of connecting with one TLS mode.
   *
   * @param mode mode tried
   * @param success whether connect plus {@code SELECT 1} worked
   * @param elapsedMillis time spent
   * @param errorMessage failure message, null on success
   */
  public record TlsVariantResult(
      TlsMode mode, boolean success, long elapsedMillis, String errorMessage) {}

  /**
   * Results of {@link #testTlsVariants()}.
   *
   * @param variants one result per mode, in the order tried
   * @param recommended most secure mode that worked, empty when none did
   * @param summary one-line human readable summary
   */
  public record TlsReport(
      List<TlsVariantResult> variants, Optional<TlsMode> recommended, String summary) {}

  /**
   * Resolves the host, opens a TCP socket, connects through the driver and runs {@code SELECT
   * VERSION()}, timing each phase.
   *
   * @return the report
   */
  public BasicConnectionReport testBasicConnection() {
    final var start = System.nanoTime();
    long dns = -1;
    long tcp = -1;
    long handshake = -1;
    long query = -1;
    String address = null;
    try {
      var phase = System.nanoTime();
      address = InetAddress.getByName(settings.host()).getHostAddress();
      dns = millisSince(phase);

      phase = System.nanoTime();
      final var probed = probe.probe(settings.host(), settings.port(), settings.probeTimeout());
      tcp = millisSince(phase);
      if (!probed.ok())
        throw new TransportProbeException(settings.host(), settings.port(), probed);

      phase = System.nanoTime();
      try (final var conn =
          opener.open(
              settings.jdbcUrl(),
              settings.connectionProperties(settings.tlsMode(), HANDSHAKE_TIMEOUT))) {
        handshake = millisSince(phase);

        phase = System.nanoTime();
        try (final var stmt = conn.createStatement();
            final var rs = stmt.executeQuery("SELECT VERSION()")) {
          final var version = rs.next() ? rs.getString(1) : null;
          query = millisSince(phase);
          final var total = millisSince(start);
          logger.log(INFO, "Basic connection test passed in {0} ms", total);
          return new BasicConnectionReport(
              true, dns, tcp, handshake, query, total, address, version, null, 0, null, null);
        }
      }
    } catch (final UnknownHostException | SQLException e) {
      final var kind = ErrorClassifier.classify(e);
      final var sql = e instanceof SQLException s ? s : null;
      logger.log(WARNING, "Basic connection test failed ({0}): {1}", kind, e.getMessage());
      return new BasicConnectionReport(
          false,
          dns,
          tcp,
          handshake,
          query,
          millisSince(start),
          address,
          null,
          kind,
          sql == null ? 0 : sql.getErrorCode(),
          sql == null ? null : sql.getSQLState(),
          e.getMessage());
    }
  }

  /**
   * Connects once with every {@link TlsMode} and recommends the most secure one that works.
   *
   * @return the report
   */
  public TlsReport testTlsVariants() {
    final var results = new ArrayList<TlsVariantResult>();
    for (final var mode : TlsMode.values()) results.add(tryMode(mode));

    TlsMode recommended = null;
    for (final var result : results) if (result.success()) recommended = result.mode();

    final var working = results.stream().filter(TlsVariantResult::success).count();
    final var summary =
        working == 0
            ? "No TLS variant could connect"
            : "Found %d working TLS variant(s), recommended %s".formatted(working, recommended);
    logger.log(INFO, summary);
    return new TlsReport(List.copyOf(results), Optional.ofNullable(recommended), summary);
  }

  private TlsVariantResult tryMode(final TlsMode mode) {
    final var start = System.nanoTime();
    try (final var conn =
            opener.open(settings.jdbcUrl(), settings.connectionProperties(mode, HANDSHAKE_TIMEOUT));
        final var stmt = conn.createStatement();
        final var rs = stmt.executeQuery("SELECT 1")) {
      rs.next();
      return new TlsVariantResult(mode, true, millisSince(start), null);
    } catch (final SQLException e) {
      logger.log(INFO, "TLS mode {0} failed: {1}", mode, e.getMessage());
      return new TlsVariantResult(mode, false, millisSince(start), e.getMessage());
    }
  }

  private static long millisSince(final long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
  }
}
