package com.example.failoverclient.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.failoverclient.core.ConnectionOptions;
import com.example.failoverclient.core.DatabaseSession;
import com.example.failoverclient.core.DriverAdapter;
import java.lang.System.Logger;
import java.sql.SQLException;

/**
 * {@link DriverAdapter} over plain JDBC. Each {@link #connect(ConnectionOptions)} opens one new
 * physical connection and wraps it in a {@link JdbcSession}.
 */
public final class JdbcDriverAdapter implements DriverAdapter {

  private static final Logger logger = System.getLogger(JdbcDriverAdapter.class.getName());

  /** Default timeout for {@link JdbcSession#ping()}. */
  public static final int DEFAULT_PING_TIMEOUT_SECONDS = 5;

  private final ConnectionSource source;
  private final int pingTimeoutSeconds;

  /** Creates an adapter that connects through {@link java.sql.DriverManager}. */
  public JdbcDriverAdapter() {
    this(ConnectionSource.driverManager());
  }

  /**
   * Creates an adapter over the given connection source.
   *
   * @param source opens physical connections
   */
  public JdbcDriverAdapter(final ConnectionSource source) {
    this(source, DEFAULT_PING_TIMEOUT_SECONDS);
  }

  /**
   * Creates an adapter over the given connection source.
   *
   * @param source opens physical connections
   * @param pingTimeoutSeconds timeout passed to {@link java.sql.Connection#isValid(int)}, >= 0
   */
  public JdbcDriverAdapter(final ConnectionSource source, final int pingTimeoutSeconds) {
    if (source == null) throw new IllegalArgumentException("source cannot be null");
    if (pingTimeoutSeconds < 0)
      throw new IllegalArgumentException("pingTimeoutSeconds must be >= 0");
    this.source = source;
    this.pingTimeoutSeconds = pingTimeoutSeconds;
  }

  @Override
  public DatabaseSession connect(final ConnectionOptions options) throws SQLException {
    logger.log(DEBUG, "Opening JDBC connection to {0}", options.url());
    final var connection = source.open(options);
    if (connection == null) throw new SQLException("Connection source returned no connection");
    return new JdbcSession(connection, pingTimeoutSeconds);
  }

  @Override
  public String name() {
    return "JDBC";
  }
}
