package com.example;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.resilientdatasource.core.DatabaseService;
import com.example.resilientdatasource.core.DatabaseSettings;
import com.example.resilientdatasource.core.HealthStatus;
import java.io.IOException;
import java.lang.System.Logger;
import java.sql.SQLException;
import java.util.Optional;
import java.util.logging.LogManager;

/** Demo application showing how to query MySQL through an unreliable network link. */
public class App {
  private static final Logger logger = System.getLogger(App.class.getName());

  private final DatabaseService db;

  /**
   * Constructs the application with a single DatabaseService that is reused for all later calls to
   * {@link #currentTime()}.
   *
   * @param settings connection settings
   */
  public App(final DatabaseSettings settings) {
    this.db = DatabaseService.builder().settings(settings).build();
  }

  /**
   * Entry point. Reads the connection settings from system properties and environment variables,
   * checks the database and prints its clock and the connection status.
   *
   * @param args CLI args (unused)
   */
  public static void main(String[] args) {
    configureLogging();
    final var app = new App(DatabaseSettings.fromEnvironment());
    app.db.registerShutdownHook();
    try {
      final var health = app.health();
      logger.log(
          INFO, "Database healthy = {0} ({1} ms)", health.healthy(), health.responseTimeMs());

      app.currentTime()
          .ifPresentOrElse(
              time -> logger.log(INFO, "DB Time = {0}", time),
              () -> logger.log(WARNING, "Database temporarily unavailable, try again later"));
    } catch (final SQLException e) {
      logger.log(WARNING, "Query failed: {0}", e.getMessage());
    } finally {
      System.out.println(app.db.getConnectionStatus().toJson());
      app.shutdown();
    }
  }

  private static void configureLogging() {
    if (System.getProperty("java.util.logging.config.file") != null) return;
    try (final var in = App.class.getResourceAsStream("/logging.properties")) {
      if (in != null) LogManager.getLogManager().readConfiguration(in);
    } catch (final IOException e) {
      logger.log(WARNING, "Could not load logging.properties: {0}", e.getMessage());
    }
  }

  /**
   * Queries the database for the current time.
   *
   * @return the time string, empty when the database is temporarily unavailable
   * @throws SQLException if the query fails for a non-transient reason or the circuit is open
   */
  public Optional<String> currentTime() throws SQLException {
    final var rows = db.query("SELECT NOW() AS now");
    if (rows == null || rows.isEmpty()) return Optional.empty();
    return Optional.ofNullable(rows.get(0).get("now")).map(String::valueOf);
  }

  public HealthStatus health() {
    return db.healthCheck();
  }

  public DatabaseService database() {
    return db;
  }

  /** Closes the pool and the worker threads. */
  public void shutdown() {
    db.close();
  }
}
