package com.example.resilientdatasource.core.pool;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.example.resilientdatasource.core.DatabaseSettings;
import com.example.resilientdatasource.core.resilience.ErrorClassifier;
import com.example.resilientdatasource.core.resilience.ErrorKind;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import javax.sql.DataSource;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class ConnectionPoolTest {

  private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

  private final DatabaseSettings settings =
      DatabaseSettings.builder()
          .host("db")
          .database("appdb")
          .livenessTimeout(Duration.ofMillis(200))
          .build();

  private ExecutorService executor;
  private List<String> created;

  @BeforeAll
  void startExecutor() {
    executor = Executors.newCachedThreadPool();
  }

  @AfterAll
  void stopExecutor() {
    executor.shutdownNow();
  }

  @BeforeEach
  void setUp() {
    created = new ArrayList<>();
  }

  private static DataSource closeableDataSource() {
    return mock(DataSource.class, withSettings().extraInterfaces(AutoCloseable.class));
  }

  private static DataSource healthyDataSource() throws SQLException {
    final var dataSource = closeableDataSource();
    final var conn = mock(Connection.class);
    final var stmt = mock(Statement.class);
    final var rs = mock(ResultSet.class);
    when(dataSource.getConnection()).thenReturn(conn);
    when(conn.createStatement()).thenReturn(stmt);
    when(stmt.executeQuery(ConnectionPool.LIVENESS_QUERY)).thenReturn(rs);
    when(rs.next()).thenReturn(true);
    return dataSource;
  }

  private static DataSource failingDataSource(final SQLException failure) throws SQLException {
    final var dataSource = closeableDataSource();
    when(dataSource.getConnection()).thenThrow(failure);
    return dataSource;
  }

  private ConnectionPool pool(final DataSourceFactory factory) {
    return new ConnectionPool(settings, factory, executor, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private DataSourceFactory recording(
      final DataSource standard, final DataSource minimal, final DataSource fallback) {
    return (s, strategy) -> {
      created.add(strategy.name());
      return switch (strategy.name()) {
        case "Standard" -> standard;
        case "Minimal" -> minimal;
        default -> fallback;
      };
    };
  }

  @Nested
  @DisplayName("Initialization")
  class Initialization {

    @Test
    @DisplayName("Should adopt Standard when its liveness check passes")
    void shouldAdoptStandard() throws Exception {
      final var standard = healthyDataSource();

      final var handle =
          pool(recording(standard, healthyDataSource(), healthyDataSource()))
              .initialize(PoolStrategy.ordered(settings, false));

      assertEquals("Standard", handle.strategy().name());
      assertEquals(NOW, handle.createdAt());
      assertSame(standard, handle.dataSource());
      assertEquals(List.of("Standard"), created);
    }

    @Test
    @DisplayName("Should fall back to Minimal and never try Fallback")
    void shouldFallBackToMinimal() throws Exception {
      final var standard = failingDataSource(new SQLTimeoutException("connect timed out"));
      final var minimal = healthyDataSource();
      final var fallback = healthyDataSource();

      final var handle =
          pool(recording(standard, minimal, fallback))
              .initialize(PoolStrategy.ordered(settings, false));

      assertEquals("Minimal", handle.strategy().name());
      assertEquals(2, handle.strategy().connectionLimit());
      assertEquals(List.of("Standard", "Minimal"), created);
      verify((AutoCloseable) standard).close();
      verify((AutoCloseable) minimal, never()).close();
      verifyNoInteractions(fallback);
    }

    @Test
    @DisplayName("Should treat a hanging liveness check as a failure")
    void shouldTimeOutHangingLiveness() throws Exception {
      final var standard = closeableDataSource();
      when(standard.getConnection())
          .thenAnswer(
              invocation -> {
                Thread.sleep(5_000L);
                return mock(Connection.class);
              });

      final var handle =
          pool(recording(standard, healthyDataSource(), healthyDataSource()))
              .initialize(PoolStrategy.ordered(settings, false));

      assertEquals("Minimal", handle.strategy().name());
      verify((AutoCloseable) standard).close();
    }

    @Test
    @DisplayName("Should report every failure when all strategies fail")
    void shouldFailWhenAllStrategiesFail() throws Exception {
      final var denied = new SQLException("Access denied for user 'app'", "28000", 1045);
      final var standard = failingDataSource(new SQLTimeoutException("timed out"));
      final var minimal = failingDataSource(new SQLTimeoutException("timed out"));
      final var fallback = failingDataSource(denied);

      final var thrown =
          assertThrows(
              PoolInitializationException.class,
              () ->
                  pool(recording(standard, minimal, fallback))
                      .initialize(PoolStrategy.ordered(settings, false)));

      assertEquals(3, thrown.failures().size());
      assertSame(denied, thrown.getCause());
      assertEquals(2, thrown.getSuppressed().length);
      assertEquals(ErrorKind.AUTH_REJECTED, ErrorClassifier.classify(thrown));
      assertEquals(List.of("Standard", "Minimal", "Fallback"), created);
      verify((AutoCloseable) fallback).close();
    }

    @Test
    @DisplayName("Should wrap factory errors and continue with the next strategy")
    void shouldWrapFactoryErrors() throws Exception {
      final var minimal = healthyDataSource();
      final DataSourceFactory factory =
          (s, strategy) -> {
            created.add(strategy.name());
            if (strategy.name().equals("Standard"))
              throw new IllegalArgumentException("bad pool config");
            return minimal;
          };

      final var handle = pool(factory).initialize(PoolStrategy.ordered(settings, false));

      assertEquals("Minimal", handle.strategy().name());
    }

    @Test
    @DisplayName("Should surface the driver error a fail-fast factory reports")
    void shouldUnwrapDriverErrors() {
      final var denied = new SQLException("Access denied for user 'app'", "28000", 1045);
      final DataSourceFactory factory =
          (s, strategy) -> {
            throw new IllegalStateException("Failed to initialize pool", denied);
          };

      final var thrown =
          assertThrows(
              PoolInitializationException.class,
              () -> pool(factory).initialize(List.of(PoolStrategy.FALLBACK)));

      assertSame(denied, thrown.getCause());
      assertEquals(1045, thrown.getErrorCode());
      assertEquals("28000", thrown.getSQLState());
    }
  }

  @Nested
  @DisplayName("Acquire and Release")
  class AcquireAndRelease {

    @Test
    @DisplayName("Should borrow from the handle and close on release")
    void shouldAcquireAndRelease() throws Exception {
      final var dataSource = healthyDataSource();
      final var pool = pool(recording(dataSource, dataSource, dataSource));
      final var handle = pool.createPool(PoolStrategy.STANDARD);

      final var conn = pool.acquire(handle);
      pool.release(conn);

      verify(conn).close();
    }

    @Test
    @DisplayName("Should refuse to acquire without a pool")
    void shouldRefuseWithoutPool() {
      final var pool = pool(recording(null, null, null));
      assertThrows(SQLException.class, () -> pool.acquire(null));
    }

    @Test
    @DisplayName("Should never throw from release")
    void shouldNotThrowFromRelease() throws Exception {
      final var pool = pool(recording(null, null, null));
      final var conn = mock(Connection.class);
      doThrow(new SQLException("already closed")).when(conn).close();

      assertDoesNotThrow(() -> pool.release(conn));
      assertDoesNotThrow(() -> pool.release(null));
    }

    @Test
    @DisplayName("Should evict a discarded connection from a Hikari pool instead of recycling it")
    void shouldEvictDiscardedConnection() throws Exception {
      final var hikari = mock(HikariDataSource.class);
      final var conn = mock(Connection.class);
      final var pool = pool(recording(null, null, null));
      final var handle = new PoolHandle(hikari, PoolStrategy.STANDARD, NOW);

      pool.discard(handle, conn);

      verify(hikari).evictConnection(conn);
      verify(conn, never()).close();
      verify(conn, never()).abort(any());
    }

    @Test
    @DisplayName("Should abort a discarded connection when the pool cannot evict")
    void shouldAbortWhenEvictionUnsupported() throws Exception {
      final var conn = mock(Connection.class);
      final var pool = pool(recording(null, null, null));
      final var handle = new PoolHandle(closeableDataSource(), PoolStrategy.STANDARD, NOW);

      pool.discard(handle, conn);
      pool.discard(null, conn);

      verify(conn, times(2)).abort(executor);
      verify(conn, never()).close();
    }

    @Test
    @DisplayName("Should never throw from discard")
    void shouldNotThrowFromDiscard() throws Exception {
      final var pool = pool(recording(null, null, null));
      final var conn = mock(Connection.class);
      doThrow(new SQLException("already closed")).when(conn).abort(any());

      assertDoesNotThrow(() -> pool.discard(null, conn));
      assertDoesNotThrow(() -> pool.discard(null, null));
    }
  }
}
