package com.example.resilientdatasource.core.jdbc;

import com.example.resilientdatasource.core.resilience.ErrorKind;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/** Result of {@link QueryExecutor#execute(String, List)}. */
public sealed interface QueryOutcome
    permits QueryOutcome.Rows, QueryOutcome.Unavailable, QueryOutcome.Failed {

  /**
   * Rows returned by the statement; for updates a single {@code affectedRows} row.
   *
   * @param rows rows keyed by column label, in column order
   */
  record Rows(List<Map<String, Object>> rows) implements QueryOutcome {
    public Rows {
      rows = List.copyOf(rows);
    }
  }

  /**
   * The database is temporarily unreachable or contended; the caller should answer "retry later".
   *
   * @param kind timeout, network or contention kind
   * @param error underlying failure
   */
  record Unavailable(ErrorKind kind, SQLException error) implements QueryOutcome {}

  /**
   * A fatal or unexpected failure the caller must surface.
   *
   * @param kind classified failure, {@link ErrorKind#CIRCUIT_OPEN} when rejected by the breaker
   * @param error underlying failure
   */
  record Failed(ErrorKind kind, Exception error) implements QueryOutcome {

    /**
     * Rethrows the underlying failure.
     *
     * @throws SQLException the failure, wrapped if it was not a SQLException
     */
    public void rethrow() throws SQLException {
      if (error instanceof SQLException sql) throw sql;
      if (error instanceof RuntimeException runtime) throw runtime;
      throw new SQLException(error.getMessage(), error);
    }
  }
}
