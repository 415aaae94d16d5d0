package com.example.resilientdatasource.core;

import static com.example.resilientdatasource.core.TestSupport.dockerAvailable;
import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.example.resilientdatasource.core.jdbc.SqlStatement;
import com.example.resilientdatasource.core.resilience.CircuitOpenException;
import com.example.resilientdatasource.core.resilience.ErrorKind;
import com.example.resilientdatasource.core.resilience.RetryExecutor.Policy;
import java.net.ServerSocket;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.condition.DisabledIfSystemProperty;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.utility.DockerImageName;

@DisabledIfSystemProperty(named = "tests.integration.disable", matches = "true")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class DatabaseServiceIT {

  private MySQLContainer<?> mysql;
  private DatabaseService service;

  @BeforeAll
  void startContainer() throws SQLException {
    assumeTrue(dockerAvailable(), "Docker not available, skipping test");

    mysql = new MySQLContainer<>(DockerImageName.parse("mysql:8.0"));
    mysql.start();

    service = DatabaseService.builder().settings(settings(mysql.getPassword()).build()).build();
    service.execute(
        "CREATE TABLE IF NOT EXISTS accounts (id INT PRIMARY KEY, balance INT NOT NULL)",
        List.of());
  }

  @AfterAll
  void cleanup() {
    if (service != null) service.close();
    if (mysql != null) mysql.stop();
  }

  @BeforeEach
  void resetAccounts() throws SQLException {
    service.query("DELETE FROM accounts");
    service.query("INSERT INTO accounts (id, balance) VALUES (1, 100), (2, 0)");
  }

  private DatabaseSettings.Builder settings(final String password) {
    return DatabaseSettings.builder()
        .host(mysql.getHost())
        .port(mysql.getMappedPort(MySQLContainer.MYSQL_PORT))
        .user(mysql.getUsername())
        .password(password)
        .database(mysql.getDatabaseName())
        .queryTimeout(Duration.ofSeconds(5));
  }

  private int balance(final int id) throws SQLException {
    final var rows = service.query("SELECT balance FROM accounts WHERE id = ?", id);
    return ((Number) rows.get(0).get("balance")).intValue();
  }

  @Test
  void healthCheckShouldReportHealthy() {
    final var health = service.healthCheck();

    assertTrue(health.healthy(), () -> String.valueOf(health.error()));
    assertTrue(health.responseTimeMs() >= 0);
  }

  @Test
  void queryShouldReturnRowsKeyedByColumnLabel() throws SQLException {
    final var rows = service.query("SELECT 1 AS one, 'x' AS letter");

    assertEquals(1, rows.size());
    assertEquals(1, ((Number) rows.get(0).get("one")).intValue());
    assertEquals("x", rows.get(0).get("letter"));
  }

  @Test
  void updateShouldReportAffectedRows() throws SQLException {
    final var rows = service.query("UPDATE accounts SET balance = balance + ? WHERE id > ?", 1, 0);

    assertEquals(2, ((Number) rows.get(0).get("affectedRows")).intValue());
  }

  @Test
  void transactionShouldCommitAllStatements() throws SQLException {
    service.transaction(
        List.of(
            SqlStatement.of("UPDATE accounts SET balance = balance - ? WHERE id = ?", 40, 1),
            SqlStatement.of("UPDATE accounts SET balance = balance + ? WHERE id = ?", 40, 2)));

    assertEquals(60, balance(1));
    assertEquals(40, balance(2));
  }

  @Test
  void transactionShouldRollBackWhenAStatementFails() throws SQLException {
    final var thrown =
        assertThrows(
            SQLException.class,
            () ->
                service.transaction(
                    List.of(
                        SqlStatement.of("UPDATE accounts SET balance = 0 WHERE id = ?", 1),
                        SqlStatement.of("UPDATE missing_table SET x = 1"))));

    assertEquals(1146, thrown.getErrorCode());
    assertEquals(100, balance(1));
  }

  @Test
  void unknownTableShouldBeRethrownWithoutOpeningTheCircuit() {
    final var thrown =
        assertThrows(SQLException.class, () -> service.query("SELECT * FROM missing_table"));

    assertEquals(1146, thrown.getErrorCode());
    assertFalse(service.getConnectionStatus().circuit().open());
  }

  @Test
  void statusShouldDescribeTheStandardPool() throws SQLException {
    service.query("SELECT 1");

    final var status = service.getConnectionStatus();

    assertTrue(status.connected());
    assertEquals("Standard", status.activeStrategy());
    assertTrue(status.pool().total() >= 1);
    assertTrue(status.toJson().contains("\"activeStrategy\":\"Standard\""));
  }

  @Test
  void diagnosticsShouldReachTheServer() {
    final var report = service.diagnostics().testBasicConnection();

    assertTrue(report.success(), report.errorMessage());
    assertTrue(report.serverVersion().startsWith("8."), report.serverVersion());

    final var tls = service.diagnostics().testTlsVariants();
    assertTrue(tls.recommended().isPresent(), tls.summary());
  }

  @Test
  void wrongPasswordShouldOpenTheCircuit() throws SQLException {
    try (final var rejected =
        DatabaseService.builder()
            .settings(settings("wrong-password").build())
            .retryPolicy(Policy.retries(1, 0L, 0L))
            .build()) {

      final var thrown = assertThrows(SQLException.class, rejected::initializePool);

      assertEquals(1045, thrown.getErrorCode());
      final var circuit = rejected.getConnectionStatus().circuit();
      assertTrue(circuit.open());
      assertEquals(ErrorKind.AUTH_REJECTED, circuit.trippedBy());
      assertThrows(CircuitOpenException.class, () -> rejected.query("SELECT 1"));
      assertFalse(rejected.healthCheck().healthy());
    }
  }

  @Test
  void closedPortShouldFailFastWithoutCreatingAPool() throws Exception {
    final int port;
    try (final var socket = new ServerSocket(0)) {
      port = socket.getLocalPort();
    }
    try (final var unreachable =
        DatabaseService.builder()
            .settings(
                settings(mysql.getPassword())
                    .host("127.0.0.1")
                    .port(port)
                    .probeTimeout(Duration.ofSeconds(1))
                    .build())
            .build()) {

      assertThrows(SQLException.class, unreachable::initializePool);

      final var status = unreachable.getConnectionStatus();
      assertFalse(status.connected());
      assertEquals(ErrorKind.CONNECTION_REFUSED, status.circuit().trippedBy());
    }
  }

  @Test
  void closePoolShouldAllowLazyReinitialization() throws SQLException {
    service.closePool();
    service.closePool();

    assertFalse(service.getConnectionStatus().connected());
    assertEquals(1, ((Number) service.query("SELECT 1").get(0).get("1")).intValue());
    assertTrue(service.getConnectionStatus().connected());
  }
}
