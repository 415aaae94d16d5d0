package com.example.resilientdatasource.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.resilientdatasource.core.resilience.AbandonedCallException;
import com.example.resilientdatasource.core.resilience.ConnectionStats;
import com.example.resilientdatasource.core.resilience.ErrorClassifier;
import com.example.resilientdatasource.core.resilience.ErrorKind;
import com.example.resilientdatasource.core.resilience.TimeoutRace;
import java.lang.System.Logger;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs SQL against a {@link ConnectionSource} with a hard per-statement timeout.
 *
 * <p>Each statement executes on a worker thread while the caller waits at most the current query
 * timeout. When the timer wins the caller gets a timeout outcome at once. The statement is
 * cancelled from another worker, and the connection is discarded, never recycled, once the
 * statement's worker has returned. Otherwise the caller releases the connection exactly once.
 *
 * <h2>Outcome mapping</h2>
 *
 * <ul>
 *   <li>rows or an update count: {@link QueryOutcome.Rows}
 *   <li>timeouts, lost or reset links, lock waits and deadlocks: {@link QueryOutcome.Unavailable}
 *   <li>everything else, including an open circuit: {@link QueryOutcome.Failed}
 * </ul>
 */
public final class QueryExecutor {

  private static final Logger logger = System.getLogger(QueryExecutor.class.getName());

  public static final String AFFECTED_ROWS = "affectedRows";

  private final ConnectionSource source;
  private final ExecutorService executor;
  private final Supplier<Duration> queryTimeout;
  private final ConnectionStats stats;

  public QueryExecutor(
      final ConnectionSource source,
      final ExecutorService executor,
      final Supplier<Duration> queryTimeout,
      final ConnectionStats stats) {
    if (source == null) throw new IllegalArgumentException("source cannot be null");
    if (executor == null) throw new IllegalArgumentException("executor cannot be null");
    if (queryTimeout == null) throw new IllegalArgumentException("queryTimeout cannot be null");
    if (stats == null) throw new IllegalArgumentException("stats cannot be null");
    this.source = source;
    this.executor = executor;
    this.queryTimeout = queryTimeout;
    this.stats = stats;
  }

  /**
   * Runs a statement and reports the outcome without throwing.
   *
   * @param sql statement text with {@code ?} placeholders
   * @param params positional parameters
   * @return classified outcome
   */
  public QueryOutcome execute(final String sql, final List<?> params) {
    final Connection conn;
    try {
      conn = source.acquire();
    } catch (final SQLException e) {
      // acquisition failures are already counted by the connection source
      return outcome(ErrorClassifier.classify(e), e);
    } catch (final RuntimeException e) {
      return new QueryOutcome.Failed(ErrorKind.UNKNOWN, e);
    }

    final var timeout = queryTimeout.get();
    final var statement = new AtomicReference<PreparedStatement>();
    var abandoned = false;
    try {
      final var rows =
          TimeoutRace.race(
              () -> run(conn, sql, params, timeout, statement),
              timeout,
              executor,
              () -> cancel(statement.get()),
              () -> source.discard(conn));
      return new QueryOutcome.Rows(rows);
    } catch (final SQLException e) {
      abandoned = e instanceof AbandonedCallException;
      final var kind = ErrorClassifier.classify(e);
      stats.recordQueryFailure(kind);
      return outcome(kind, e);
    } catch (final RuntimeException e) {
      stats.recordQueryFailure(ErrorKind.UNKNOWN);
      return new QueryOutcome.Failed(ErrorKind.UNKNOWN, e);
    } finally {
      // an abandoned statement may still be running; its worker discards the connection
      if (!abandoned) source.release(conn);
    }
  }

  /**
   * Runs a statement and returns its rows.
   *
   * @param sql statement text with {@code ?} placeholders
   * @param params positional parameters
   * @return rows, or {@code null} when the database is temporarily unavailable
   * @throws SQLException for fatal and unexpected failures, including {@link
   *     com.example.resilientdatasource.core.resilience.CircuitOpenException}
   */
  public List<Map<String, Object>> query(final String sql, final Object... params)
      throws SQLException {
    final var outcome = execute(sql, params == null ? List.of() : Arrays.asList(params));
    if (outcome instanceof QueryOutcome.Rows rows) return rows.rows();
    if (outcome instanceof QueryOutcome.Unavailable unavailable) {
      logger.log(
          WARNING,
          "Database temporarily unavailable ({0}): {1}",
          unavailable.kind(),
          unavailable.error().getMessage());
      return null;
    }
    ((QueryOutcome.Failed) outcome).rethrow();
    throw new IllegalStateException("unreachable");
  }

  /**
   * Runs {@code work} in a single transaction on one connection.
   *
   * <p>Commits when the work returns, rolls back when it throws. Auto-commit is restored and the
   * connection released in every case.
   *
   * @param work statements to run
   * @param <T> result type
   * @return work result
   * @throws SQLException the failure that caused the rollback
   */
  public <T> T transaction(final TransactionWork<T> work) throws SQLException {
    final var conn = source.acquire();
    try {
      final var autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        final var result = work.execute(conn);
        conn.commit();
        return result;
      } catch (final SQLException | RuntimeException e) {
        rollback(conn, e);
        stats.recordQueryFailure(ErrorClassifier.classify(e));
        throw e;
      } finally {
        restoreAutoCommit(conn, autoCommit);
      }
    } finally {
      source.release(conn);
    }
  }

  /**
   * Runs the statements in order in a single transaction.
   *
   * @param statements statements to run
   * @return one result list per statement, in order
   * @throws SQLException the failure that caused the rollback
   */
  public List<List<Map<String, Object>>> transaction(final List<SqlStatement> statements)
      throws SQLException {
    final var timeout = queryTimeout.get();
    return transaction(
        conn -> {
          final var results = new ArrayList<List<Map<String, Object>>>(statements.size());
          for (final var statement : statements) {
            try (final var stmt = conn.prepareStatement(statement.sql())) {
              stmt.setQueryTimeout(driverTimeoutSeconds(timeout));
              bind(stmt, statement.params());
              results.add(results(stmt));
            }
          }
          return results;
        });
  }

  private List<Map<String, Object>> run(
      final Connection conn,
      final String sql,
      final List<?> params,
      final Duration timeout,
      final AtomicReference<PreparedStatement> holder)
      throws SQLException {
    try (final var stmt = conn.prepareStatement(sql)) {
      holder.set(stmt);
      stmt.setQueryTimeout(driverTimeoutSeconds(timeout));
      bind(stmt, params);
      return results(stmt);
    }
  }

  private static List<Map<String, Object>> results(final PreparedStatement stmt)
      throws SQLException {
    if (stmt.execute()) {
      try (final var rs = stmt.getResultSet()) {
        return rows(rs);
      }
    }
    final var row = new LinkedHashMap<String, Object>();
    row.put(AFFECTED_ROWS, stmt.getUpdateCount());
    return List.of(row);
  }

  static List<Map<String, Object>> rows(final ResultSet rs) throws SQLException {
    final var meta = rs.getMetaData();
    final var columns = meta.getColumnCount();
    final var rows = new ArrayList<Map<String, Object>>();
    while (rs.next()) {
      final var row = new LinkedHashMap<String, Object>();
      for (var i = 1; i <= columns; i++) row.put(meta.getColumnLabel(i), rs.getObject(i));
      rows.add(row);
    }
    return rows;
  }

  private static void bind(final PreparedStatement stmt, final List<?> params)
      throws SQLException {
    for (var i = 0; i < params.size(); i++) stmt.setObject(i + 1, params.get(i));
  }

  // the driver-side bound sits just past the caller's race so the race normally decides
  private static int driverTimeoutSeconds(final Duration timeout) {
    return (int) Math.min(Integer.MAX_VALUE, timeout.toSeconds() + 1);
  }

  private static QueryOutcome outcome(final ErrorKind kind, final SQLException error) {
    if (kind.degradesGracefully()) return new QueryOutcome.Unavailable(kind, error);
    return new QueryOutcome.Failed(kind, error);
  }

  private static void cancel(final PreparedStatement stmt) {
    if (stmt == null) return;
    try {
      stmt.cancel();
    } catch (final SQLException e) {
      logger.log(DEBUG, "Statement cancel failed: {0}", e.getMessage());
    }
  }

  private static void rollback(final Connection conn, final Exception cause) {
    try {
      conn.rollback();
    } catch (final SQLException e) {
      cause.addSuppressed(e);
      logger.log(WARNING, "Rollback failed: {0}", e.getMessage());
    }
  }

  private static void restoreAutoCommit(final Connection conn, final boolean autoCommit) {
    try {
      conn.setAutoCommit(autoCommit);
    } catch (final SQLException e) {
      logger.log(WARNING, "Failed to restore auto-commit: {0}", e.getMessage());
    }
  }
}
