package com.example.resilientdatasource.core.resilience;

import com.example.resilientdatasource.core.probe.ProbeResult.ProbeFailure;
import com.example.resilientdatasource.core.probe.TransportProbeException;
import java.io.EOFException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransactionRollbackException;
import java.sql.SQLTransientConnectionException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Maps any throwable raised by the driver, the pool or the socket layer to an {@link ErrorKind}.
 *
 * <p>The cause chain (and each {@link SQLException#getNextException() next exception}) is scanned
 * twice: first for decisive evidence (socket exceptions, MySQL vendor codes, local fast-fail
 * exceptions), then for generic hints (SQLState classes, JDBC exception subtypes, message
 * keywords). This lets a {@code Connection refused} buried under a generic communications failure
 * win over the outer {@code 08S01} state.
 */
public final class ErrorClassifier {

  private ErrorClassifier() {}

  // MySQL server and client error codes
  private static final int ER_DBACCESS_DENIED = 1044;
  private static final int ER_ACCESS_DENIED = 1045;
  private static final int ER_ACCESS_DENIED_NO_PASSWORD = 1698;
  private static final int ER_BAD_DB = 1049;
  private static final int ER_NO_SUCH_TABLE = 1146;
  private static final int ER_CON_COUNT = 1040;
  private static final int ER_USER_LIMIT_REACHED = 1226;
  private static final int ER_LOCK_WAIT_TIMEOUT = 1205;
  private static final int ER_LOCK_DEADLOCK = 1213;
  private static final int ER_QUERY_INTERRUPTED = 1317;
  private static final int ER_QUERY_TIMEOUT = 3024;
  private static final int CR_SERVER_GONE = 2006;
  private static final int CR_SERVER_LOST = 2013;

  private static final Map<String, ErrorKind> KEYWORDS = keywords();

  private static Map<String, ErrorKind> keywords() {
    // insertion order matters: more specific phrases first
    final var map = new LinkedHashMap<String, ErrorKind>();
    map.put("access denied", ErrorKind.AUTH_REJECTED);
    map.put("authentication failed", ErrorKind.AUTH_REJECTED);
    map.put("unknown database", ErrorKind.UNKNOWN_DATABASE);
    map.put("lock wait timeout", ErrorKind.LOCK_WAIT_TIMEOUT);
    map.put("deadlock", ErrorKind.DEADLOCK);
    map.put("max_user_connections", ErrorKind.CONNECTION_LIMIT);
    map.put("too many connections", ErrorKind.CONNECTION_LIMIT);
    map.put("connection refused", ErrorKind.CONNECTION_REFUSED);
    map.put("connection reset", ErrorKind.CONNECTION_RESET);
    map.put("broken pipe", ErrorKind.CONNECTION_RESET);
    map.put("communications link failure", ErrorKind.CONNECTION_LOST);
    map.put("connection lost", ErrorKind.CONNECTION_LOST);
    map.put("socket closed", ErrorKind.CONNECTION_LOST);
    map.put("timed out", ErrorKind.TIMEOUT);
    map.put("timeout", ErrorKind.TIMEOUT);
    return Collections.unmodifiableMap(map);
  }

  /**
   * Classifies a failure.
   *
   * @param error the failure, may be null
   * @return the kind, {@link ErrorKind#UNKNOWN} when nothing matches
   */
  public static ErrorKind classify(final Throwable error) {
    if (error == null) return ErrorKind.UNKNOWN;
    final var chain = chain(error);
    for (final var t : chain) {
      final var kind = decisive(t);
      if (kind != null) return kind;
    }
    for (final var t : chain) {
      final var kind = generic(t);
      if (kind != null) return kind;
    }
    return ErrorKind.UNKNOWN;
  }

  /**
   * Flattens the cause chain and SQLException next-chains, outermost first, without cycles.
   *
   * @param error root throwable
   * @return ordered list of distinct throwables
   */
  static List<Throwable> chain(final Throwable error) {
    final var seen = Collections.newSetFromMap(new IdentityHashMap<Throwable, Boolean>());
    final var result = new ArrayList<Throwable>();
    final var pending = new ArrayList<Throwable>();
    pending.add(error);
    while (!pending.isEmpty()) {
      final var cur = pending.remove(0);
      if (cur == null || !seen.add(cur)) continue;
      result.add(cur);
      if (cur.getCause() != null) pending.add(cur.getCause());
      if (cur instanceof SQLException sql && sql.getNextException() != null)
        pending.add(sql.getNextException());
    }
    return result;
  }

  private static ErrorKind decisive(final Throwable t) {
    if (t instanceof CircuitOpenException) return ErrorKind.CIRCUIT_OPEN;
    if (t instanceof ServiceClosedException) return ErrorKind.SERVICE_CLOSED;
    if (t instanceof TransportProbeException probe) {
      final var failure = probe.result().failure().orElse(ProbeFailure.UNKNOWN);
      if (failure == ProbeFailure.TIMEOUT) return ErrorKind.TIMEOUT;
      if (failure == ProbeFailure.REFUSED) return ErrorKind.CONNECTION_REFUSED;
      // UNKNOWN: let the underlying socket cause decide
      return null;
    }
    if (t instanceof UnknownHostException) return ErrorKind.UNKNOWN_HOST;
    if (t instanceof SocketTimeoutException) return ErrorKind.TIMEOUT;
    if (t instanceof ConnectException) {
      final var msg = lower(t.getMessage());
      if (msg.contains("refused")) return ErrorKind.CONNECTION_REFUSED;
      if (msg.contains("timed out")) return ErrorKind.TIMEOUT;
      return ErrorKind.CONNECTION_LOST;
    }
    if (t instanceof SocketException) {
      final var msg = lower(t.getMessage());
      if (msg.contains("reset") || msg.contains("broken pipe")) return ErrorKind.CONNECTION_RESET;
      return ErrorKind.CONNECTION_LOST;
    }
    if (t instanceof EOFException) return ErrorKind.CONNECTION_LOST;
    if (t instanceof TimeoutException) return ErrorKind.TIMEOUT;
    if (t instanceof SQLException sql) return vendorCode(sql.getErrorCode());
    return null;
  }

  private static ErrorKind vendorCode(final int code) {
    return switch (code) {
      case ER_ACCESS_DENIED, ER_DBACCESS_DENIED, ER_ACCESS_DENIED_NO_PASSWORD ->
          ErrorKind.AUTH_REJECTED;
      case ER_BAD_DB -> ErrorKind.UNKNOWN_DATABASE;
      case ER_NO_SUCH_TABLE -> ErrorKind.UNKNOWN_TABLE;
      case ER_CON_COUNT, ER_USER_LIMIT_REACHED -> ErrorKind.CONNECTION_LIMIT;
      case ER_LOCK_WAIT_TIMEOUT -> ErrorKind.LOCK_WAIT_TIMEOUT;
      case ER_LOCK_DEADLOCK -> ErrorKind.DEADLOCK;
      case ER_QUERY_INTERRUPTED, ER_QUERY_TIMEOUT -> ErrorKind.TIMEOUT;
      case CR_SERVER_GONE, CR_SERVER_LOST -> ErrorKind.CONNECTION_LOST;
      default -> null;
    };
  }

  private static ErrorKind generic(final Throwable t) {
    if (t instanceof SQLTimeoutException) return ErrorKind.TIMEOUT;
    if (t instanceof SQLTransactionRollbackException) return ErrorKind.DEADLOCK;
    if (t instanceof SQLException sql) {
      final var state = sql.getSQLState();
      if (state != null) {
        if (state.startsWith("28")) return ErrorKind.AUTH_REJECTED;
        if ("40001".equals(state)) return ErrorKind.DEADLOCK;
        if ("42S02".equals(state)) return ErrorKind.UNKNOWN_TABLE;
        if (state.startsWith("HYT")) return ErrorKind.TIMEOUT;
      }
      final var keyword = keyword(t.getMessage());
      if (keyword != null) return keyword;
      if (state != null && state.startsWith("08")) return ErrorKind.CONNECTION_LOST;
      if (t instanceof SQLTransientConnectionException) return ErrorKind.TIMEOUT;
      if (t instanceof SQLRecoverableException || t instanceof SQLNonTransientConnectionException)
        return ErrorKind.CONNECTION_LOST;
      return null;
    }
    return keyword(t.getMessage());
  }

  private static ErrorKind keyword(final String message) {
    final var msg = lower(message);
    if (msg.isEmpty()) return null;
    for (final var entry : KEYWORDS.entrySet())
      if (msg.contains(entry.getKey())) return entry.getValue();
    return null;
  }

  private static String lower(final String message) {
    return message == null ? "" : message.toLowerCase(Locale.ROOT);
  }
}
