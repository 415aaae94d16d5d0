package com.example.resilientdatasource.core.diagnostics;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.resilientdatasource.core.DatabaseSettings;
import com.example.resilientdatasource.core.resilience.ErrorClassifier;
import com.example.resilientdatasource.core.resilience.ErrorKind;
import com.example.resilientdatasource.core.resilience.RetryExecutor.Policy;
import java.lang.System.Logger;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Frees server-side sessions after MySQL rejected us for exceeding the per-user connection limit.
 *
 * <p>Sessions left behind by a previous process instance keep counting against {@code
 * max_user_connections} until the server times them out. Recovery kills every other session of
 * the configured user, then polls with a slowly growing delay until a new connection is accepted.
 */
public final class ConnectionLimitRecovery {

  private static final Logger logger = System.getLogger(ConnectionLimitRecovery.class.getName());

  static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(60);
  static final String SESSIONS_QUERY =
      """
      SELECT ID FROM information_schema.PROCESSLIST WHERE USER = ? AND ID <> ?
      """;

  private final DatabaseSettings settings;
  private final ConnectionOpener opener;
  private final Policy waitPolicy;

  public ConnectionLimitRecovery(final DatabaseSettings settings, final ConnectionOpener opener) {
    this(settings, opener, defaultWaitPolicy());
  }

  public ConnectionLimitRecovery(
      final DatabaseSettings settings, final ConnectionOpener opener, final Policy waitPolicy) {
    if (settings == null) throw new IllegalArgumentException("settings cannot be null");
    if (opener == null) throw new IllegalArgumentException("opener cannot be null");
    if (waitPolicy == null) throw new IllegalArgumentException("waitPolicy cannot be null");
    this.settings = settings;
    this.opener = opener;
    this.waitPolicy = waitPolicy;
  }

  /**
   * Ten attempts, starting at 3 s and growing by 20% per attempt up to 15 s.
   *
   * @return default wait policy
   */
  public static Policy defaultWaitPolicy() {
    return new Policy(10, 3_000L, 15_000L, 1.2, false);
  }

  /**
   * Kills stale sessions, then waits until a connection is accepted again.
   *
   * @return true when a connection could be opened afterwards
   */
  public boolean recover() {
    logger.log(INFO, "Attempting connection limit recovery for user {0}", settings.user());
    final var killed = killExistingConnections();
    logger.log(INFO, "Killed {0} stale session(s)", killed);
    return waitForAvailability();
  }

  /**
   * Kills every session of the configured user except the one used to issue the kills.
   *
   * @return number of sessions killed, 0 when the cleanup connection itself failed
   */
  public int killExistingConnections() {
    try (final var conn = open()) {
      final var ownId = connectionId(conn);
      var killed = 0;
      for (final var id : otherSessions(conn, ownId)) {
        try (final var stmt = conn.createStatement()) {
          stmt.execute("KILL CONNECTION " + id);
          killed++;
        } catch (final SQLException e) {
          // the session may have ended on its own in the meantime
          logger.log(DEBUG, "Could not kill connection {0}: {1}", id, e.getMessage());
        }
      }
      return killed;
    } catch (final SQLException e) {
      logger.log(WARNING, "Connection cleanup failed: {0}", e.getMessage());
      return 0;
    }
  }

  /**
   * Polls until a connection is accepted, sleeping between attempts while the server still
   * reports its connection limit. Any other failure ends the wait.
   *
   * @return true when a connection answered {@code SELECT 1}
   */
  public boolean waitForAvailability() {
    for (var attempt = 1; attempt <= waitPolicy.maxAttempts(); attempt++) {
      try (final var conn = open();
          final var stmt = conn.createStatement()) {
        stmt.execute("SELECT 1");
        logger.log(INFO, "Database connection available after {0} attempt(s)", attempt);
        return true;
      } catch (final SQLException e) {
        if (ErrorClassifier.classify(e) != ErrorKind.CONNECTION_LIMIT) {
          logger.log(WARNING, "Connection check failed: {0}", e.getMessage());
          return false;
        }
        if (attempt == waitPolicy.maxAttempts()) break;
        final var delay = waitPolicy.delayBefore(attempt + 1);
        logger.log(
            INFO,
            "Connection limit reached (attempt {0}/{1}), waiting {2} ms",
            attempt,
            waitPolicy.maxAttempts(),
            delay);
        try {
          Thread.sleep(delay);
        } catch (final InterruptedException ie) {
          Thread.currentThread().interrupt();
          return false;
        }
      }
    }
    logger.log(
        WARNING, "Connection limit still reached after {0} attempts", waitPolicy.maxAttempts());
    return false;
  }

  private Connection open() throws SQLException {
    return opener.open(
        settings.jdbcUrl(), settings.connectionProperties(settings.tlsMode(), CONNECT_TIMEOUT));
  }

  private static long connectionId(final Connection conn) throws SQLException {
    try (final var stmt = conn.createStatement();
        final var rs = stmt.executeQuery("SELECT CONNECTION_ID()")) {
      if (!rs.next()) throw new SQLException("CONNECTION_ID() returned no rows");
      return rs.getLong(1);
    }
  }

  private List<Long> otherSessions(final Connection conn, final long ownId) throws SQLException {
    final var ids = new ArrayList<Long>();
    try (final var stmt = conn.prepareStatement(SESSIONS_QUERY)) {
      stmt.setString(1, settings.user());
      stmt.setLong(2, ownId);
      try (final var rs = stmt.executeQuery()) {
        while (rs.next()) ids.add(rs.getLong(1));
      }
    }
    return ids;
  }
}
