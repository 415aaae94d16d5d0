package com.example.resilientdatasource.core.diagnostics;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import com.example.resilientdatasource.core.TestSupport;
import com.example.resilientdatasource.core.resilience.RetryExecutor.Policy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class ConnectionLimitRecoveryTest {

  private static final Policy NO_WAIT = new Policy(3, 0L, 0L, 1.2, false);

  private ConnectionOpener opener;
  private ConnectionLimitRecovery recovery;

  @BeforeEach
  void setUp() {
    opener = mock(ConnectionOpener.class);
    recovery = new ConnectionLimitRecovery(TestSupport.localSettings(), opener, NO_WAIT);
  }

  private static SQLException limitReached() {
    return new SQLException("User 'app' has exceeded the 'max_user_connections'", "42000", 1226);
  }

  private static Connection adminConnection(final Statement killStatement, final long... sessions)
      throws SQLException {
    final var conn = mock(Connection.class);
    final var idStatement = mock(Statement.class);
    final var idRs = mock(ResultSet.class);
    when(conn.createStatement()).thenReturn(idStatement, killStatement);
    when(idStatement.executeQuery("SELECT CONNECTION_ID()")).thenReturn(idRs);
    when(idRs.next()).thenReturn(true);
    when(idRs.getLong(1)).thenReturn(7L);

    final var sessionsStatement = mock(PreparedStatement.class);
    final var sessionsRs = mock(ResultSet.class);
    when(conn.prepareStatement(ConnectionLimitRecovery.SESSIONS_QUERY))
        .thenReturn(sessionsStatement);
    when(sessionsStatement.executeQuery()).thenReturn(sessionsRs);
    var next = when(sessionsRs.next());
    for (var i = 0; i < sessions.length; i++) next = next.thenReturn(true);
    next.thenReturn(false);
    if (sessions.length > 0) {
      var ids = when(sessionsRs.getLong(1));
      for (final var id : sessions) ids = ids.thenReturn(id);
    }
    return conn;
  }

  private static Connection liveConnection() throws SQLException {
    final var conn = mock(Connection.class);
    when(conn.createStatement()).thenReturn(mock(Statement.class));
    return conn;
  }

  @Nested
  @DisplayName("Killing Sessions")
  class KillingSessions {

    @Test
    @DisplayName("Should kill every other session of the user")
    void shouldKillOtherSessions() throws Exception {
      final var kill = mock(Statement.class);
      final var admin = adminConnection(kill, 11L, 12L);
      when(opener.open(anyString(), any())).thenReturn(admin);

      assertEquals(2, recovery.killExistingConnections());

      verify(kill).execute("KILL CONNECTION 11");
      verify(kill).execute("KILL CONNECTION 12");
      final var sessions = admin.prepareStatement(ConnectionLimitRecovery.SESSIONS_QUERY);
      verify(sessions).setString(1, "app");
      verify(sessions).setLong(2, 7L);
      verify(admin).close();
    }

    @Test
    @DisplayName("Should skip sessions that can no longer be killed")
    void shouldSkipVanishedSessions() throws Exception {
      final var kill = mock(Statement.class);
      when(kill.execute("KILL CONNECTION 11"))
          .thenThrow(new SQLException("Unknown thread id: 11", "HY000", 1094));
      final var admin = adminConnection(kill, 11L, 12L);
      when(opener.open(anyString(), any())).thenReturn(admin);

      assertEquals(1, recovery.killExistingConnections());
      verify(kill).execute("KILL CONNECTION 12");
    }

    @Test
    @DisplayName("Should report zero when the cleanup connection cannot be opened")
    void shouldReportZeroWhenCleanupFails() throws Exception {
      when(opener.open(anyString(), any())).thenThrow(limitReached());

      assertEquals(0, recovery.killExistingConnections());
    }

    @Test
    @DisplayName("Should use a generous connect timeout")
    void shouldUseLongConnectTimeout() throws Exception {
      final var admin = adminConnection(mock(Statement.class));
      when(opener.open(anyString(), any())).thenReturn(admin);

      recovery.killExistingConnections();

      verify(opener)
          .open(
              eq("jdbc:mysql://127.0.0.1:3306/appdb"),
              argThat(p -> p != null && "60000".equals(p.getProperty("connectTimeout"))));
    }
  }

  @Nested
  @DisplayName("Waiting")
  class Waiting {

    @Test
    @DisplayName("Should keep polling while the limit is reported")
    void shouldPollUntilAvailable() throws Exception {
      final var live = liveConnection();
      when(opener.open(anyString(), any())).thenThrow(limitReached()).thenReturn(live);

      assertTrue(recovery.waitForAvailability());

      verify(opener, times(2)).open(anyString(), any());
      verify(live).close();
    }

    @Test
    @DisplayName("Should give up on any other error")
    void shouldStopOnOtherErrors() throws Exception {
      when(opener.open(anyString(), any()))
          .thenThrow(new SQLException("Access denied for user 'app'", "28000", 1045));

      assertFalse(recovery.waitForAvailability());
      verify(opener, times(1)).open(anyString(), any());
    }

    @Test
    @DisplayName("Should give up once the policy is exhausted")
    void shouldGiveUpWhenExhausted() throws Exception {
      when(opener.open(anyString(), any())).thenThrow(limitReached());

      assertFalse(recovery.waitForAvailability());
      verify(opener, times(3)).open(anyString(), any());
    }

    @Test
    @DisplayName("Should give up when interrupted and keep the interrupt flag")
    void shouldStopWhenInterrupted() throws Exception {
      recovery =
          new ConnectionLimitRecovery(
              TestSupport.localSettings(), opener, new Policy(3, 50L, 50L, 1.0, false));
      when(opener.open(anyString(), any())).thenThrow(limitReached());

      Thread.currentThread().interrupt();
      try {
        assertFalse(recovery.waitForAvailability());
        assertTrue(Thread.currentThread().isInterrupted());
      } finally {
        Thread.interrupted();
      }
      verify(opener, times(1)).open(anyString(), any());
    }
  }

  @Test
  @DisplayName("Should kill stale sessions, then wait for availability")
  void shouldRecover() throws Exception {
    final var kill = mock(Statement.class);
    final var admin = adminConnection(kill, 21L);
    final var live = liveConnection();
    when(opener.open(anyString(), any())).thenReturn(admin, live);

    assertTrue(recovery.recover());

    verify(kill).execute("KILL CONNECTION 21");
    verify(live).close();
  }

  @Test
  @DisplayName("Should default to ten slowly growing waits")
  void shouldExposeDefaultWaitPolicy() {
    final var policy = ConnectionLimitRecovery.defaultWaitPolicy();

    assertEquals(10, policy.maxAttempts());
    assertEquals(3_000L, policy.delayBefore(2));
    assertEquals(3_600L, policy.delayBefore(3));
    assertEquals(15_000L, policy.maxDelayMillis());
    assertTrue(policy.delayBefore(10) <= 15_000L);
  }
}
