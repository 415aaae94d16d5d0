package com.example.resilientdatasource.core.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Unit of work executed inside {@link QueryExecutor#transaction(TransactionWork)}. The connection
 * is already in manual-commit mode; the work must neither commit nor close it.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface TransactionWork<T> {
  /**
   * Runs statements on the transaction's connection.
   *
   * @param conn connection with auto-commit disabled
   * @return work result
   * @throws SQLException to roll the transaction back
   */
  T execute(final Connection conn) throws SQLException;
}
