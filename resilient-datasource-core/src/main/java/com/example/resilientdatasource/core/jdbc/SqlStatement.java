package com.example.resilientdatasource.core.jdbc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A parameterized statement run as one step of {@link QueryExecutor#transaction(List)}.
 *
 * @param sql statement text with {@code ?} placeholders
 * @param params positional parameters, may contain nulls
 */
public record SqlStatement(String sql, List<Object> params) {

  public SqlStatement {
    if (sql == null || sql.isBlank()) throw new IllegalArgumentException("sql is required");
    params =
        params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }

  public static SqlStatement of(final String sql, final Object... params) {
    return new SqlStatement(sql, params == null ? List.of() : Arrays.asList(params));
  }
}
