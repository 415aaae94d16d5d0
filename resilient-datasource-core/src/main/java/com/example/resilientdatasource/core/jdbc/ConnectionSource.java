package com.example.resilientdatasource.core.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/** Where {@link QueryExecutor} borrows its connections from and gives them back to. */
public interface ConnectionSource {

  /**
   * Borrows a connection, applying whatever retry and circuit rules the source enforces.
   *
   * @return an open connection
   * @throws SQLException if no connection can be obtained
   */
  Connection acquire() throws SQLException;

  /**
   * Gives a connection back. Must not throw.
   *
   * @param connection connection obtained from {@link #acquire()}, may be null
   */
  void release(Connection connection);

  /**
   * Gives back a connection whose state is unknown, typically after a statement on it was
   * abandoned. The physical link is closed instead of being recycled. Must not throw.
   *
   * @param connection connection obtained from {@link #acquire()}, may be null
   */
  void discard(Connection connection);
}
