package com.example;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.failoverclient.core.DriverAdapter;
import com.example.failoverclient.core.ErrorClass;
import com.example.failoverclient.core.FailoverListener;
import com.example.failoverclient.core.ResilientClient;
import com.example.failoverclient.core.jdbc.JdbcDriverAdapter;
import java.lang.System.Logger;
import java.sql.SQLException;
import java.util.Map;

/** Demo application that keeps writing to a MySQL-compatible cluster across failovers. */
public class App {

  private static final Logger logger = System.getLogger(App.class.getName());

  private final ResilientClient client;

  /**
   * Connects with the given option map, e.g. {@code url}, {@code user}, {@code password} and any
   * of the failover settings ({@code maxRetry}, {@code disconnectOnReadOnly}, ...).
   *
   * @param options flat option map
   * @param adapter driver adapter
   * @throws SQLException if the initial connect fails
   */
  public App(final Map<String, String> options, final DriverAdapter adapter) throws SQLException {
    this.client =
        ResilientClient.builder()
            .adapter(adapter)
            .options(options)
            .listener(new LoggingListener())
            .build();
  }

  /**
   * Entry point. Reads the endpoint from {@code APP_DB_URL}, {@code APP_DB_USER} and {@code
   * APP_DB_PASSWORD} and writes one heartbeat per second until interrupted.
   *
   * @param args CLI args (unused)
   * @throws Exception on unexpected failures
   */
  public static void main(String[] args) throws Exception {
    final var options =
        Map.of(
            "url", env("APP_DB_URL", "jdbc:mysql://localhost:3306/app"),
            "user", env("APP_DB_USER", "app"),
            "password", env("APP_DB_PASSWORD", "app"));

    final var app = new App(options, new JdbcDriverAdapter());
    try {
      app.createSchema();
      while (!Thread.currentThread().isInterrupted()) {
        try {
          app.heartbeat("main");
          logger.log(INFO, "DB Time = {0}", app.getString());
        } catch (final SQLException e) {
          logger.log(WARNING, "Heartbeat failed: {0}", e.getMessage());
        }
        Thread.sleep(1_000L);
      }
    } finally {
      app.shutdown();
    }
  }

  /**
   * Creates the heartbeat table if needed.
   *
   * @throws SQLException if the statement fails
   */
  public void createSchema() throws SQLException {
    client.execute(
        "CREATE TABLE IF NOT EXISTS heartbeat ("
            + "id BIGINT AUTO_INCREMENT PRIMARY KEY, "
            + "source VARCHAR(64) NOT NULL, "
            + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)");
  }

  /**
   * Inserts one heartbeat row. After a failover the insert fails once, the client reconnects,
   * and the next call goes to the new writer.
   *
   * @param source heartbeat source name
   * @return affected rows
   * @throws SQLException if the insert fails
   */
  public long heartbeat(final String source) throws SQLException {
    return client.execute("INSERT INTO heartbeat(source) VALUES (?)", source).updateCount();
  }

  /**
   * Counts the heartbeat rows.
   *
   * @return row count
   * @throws SQLException if the query fails
   */
  public long count() throws SQLException {
    return client
        .execute("SELECT COUNT(*) AS total FROM heartbeat")
        .value(0, "total")
        .map(value -> ((Number) value).longValue())
        .orElse(0L);
  }

  /**
   * Queries the database for the current time.
   *
   * @return the time string returned by the database
   * @throws SQLException if the query fails
   */
  public String getString() throws SQLException {
    return client
        .execute("SELECT NOW() AS now")
        .value(0, "now")
        .map(String::valueOf)
        .orElseThrow(() -> new SQLException("NOW() returned no row"));
  }

  ResilientClient client() {
    return client;
  }

  /** Closes the underlying session. */
  public void shutdown() {
    client.close();
  }

  private static String env(final String name, final String fallback) {
    final var value = System.getenv(name);
    return value == null || value.isBlank() ? fallback : value;
  }

  static final class LoggingListener implements FailoverListener {

    @Override
    public void recovered(final ErrorClass errorClass, final int attempts) {
      logger.log(INFO, "Recovered from {0} after {1} attempt(s)", errorClass, attempts);
    }

    @Override
    public void exhausted(
        final ErrorClass errorClass, final int attempts, final SQLException original) {
      logger.log(WARNING, "Could not recover from {0}: {1}", errorClass, original.getMessage());
    }
  }
}
