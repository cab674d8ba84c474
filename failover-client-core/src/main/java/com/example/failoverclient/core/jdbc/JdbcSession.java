package com.example.failoverclient.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.failoverclient.core.DatabaseSession;
import com.example.failoverclient.core.QueryResult;
import com.example.failoverclient.core.SessionConfig;
import java.lang.System.Logger;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link DatabaseSession} over one JDBC {@link Connection}.
 *
 * <p>The session keeps its own copy of the {@link SessionConfig}. Reading it never touches the
 * connection, so the config of a broken session can still be carried over to its replacement.
 * Statement-level settings are applied to every statement this session creates.
 */
public final class JdbcSession implements DatabaseSession {

  private static final Logger logger = System.getLogger(JdbcSession.class.getName());

  private final Connection connection;
  private final int pingTimeoutSeconds;
  private SessionConfig config = SessionConfig.empty();

  JdbcSession(final Connection connection, final int pingTimeoutSeconds) {
    this.connection = connection;
    this.pingTimeoutSeconds = pingTimeoutSeconds;
  }

  @Override
  public QueryResult execute(final String sql, final Object... args) throws SQLException {
    if (args == null || args.length == 0) {
      try (final var statement = connection.createStatement()) {
        configure(statement);
        return read(statement, statement.execute(sql));
      }
    }

    try (final var statement = connection.prepareStatement(sql)) {
      configure(statement);
      for (var i = 0; i < args.length; i++) statement.setObject(i + 1, args[i]);
      return read(statement, statement.execute());
    }
  }

  @Override
  public void ping() throws SQLException {
    if (!connection.isValid(pingTimeoutSeconds))
      throw new SQLNonTransientConnectionException("Connection is not valid", "08003");
  }

  @Override
  public boolean isClosed() {
    try {
      return connection.isClosed();
    } catch (final SQLException e) {
      logger.log(DEBUG, "isClosed check failed, treating connection as closed", e);
      return true;
    }
  }

  @Override
  public void close() throws SQLException {
    connection.close();
  }

  @Override
  public SessionConfig sessionConfig() {
    return config;
  }

  /**
   * Merges {@code update} into the session config, then pushes its connection-level fields to the
   * connection. The merged config is kept even if pushing fails.
   */
  @Override
  public void applySessionConfig(final SessionConfig update) throws SQLException {
    if (update == null) return;
    config = config.merge(update);

    if (update.autoCommit() != null) connection.setAutoCommit(update.autoCommit());
    if (update.transactionIsolation() != null)
      connection.setTransactionIsolation(update.transactionIsolation());
    if (update.catalog() != null) connection.setCatalog(update.catalog());
    if (update.schema() != null) connection.setSchema(update.schema());
  }

  @Override
  public void setAutoCommit(final boolean autoCommit) throws SQLException {
    applySessionConfig(SessionConfig.empty().withAutoCommit(autoCommit));
  }

  @Override
  public boolean getAutoCommit() throws SQLException {
    return connection.getAutoCommit();
  }

  @Override
  public void commit() throws SQLException {
    connection.commit();
  }

  @Override
  public void rollback() throws SQLException {
    connection.rollback();
  }

  @Override
  public String serverVersion() throws SQLException {
    return connection.getMetaData().getDatabaseProductVersion();
  }

  @Override
  public <T> T unwrap(final Class<T> iface) throws SQLException {
    if (iface.isInstance(this)) return iface.cast(this);
    if (iface.isInstance(connection)) return iface.cast(connection);
    return connection.unwrap(iface);
  }

  @Override
  public boolean isWrapperFor(final Class<?> iface) throws SQLException {
    return iface.isInstance(this) || iface.isInstance(connection) || connection.isWrapperFor(iface);
  }

  private void configure(final Statement statement) throws SQLException {
    if (config.queryTimeoutSeconds() != null)
      statement.setQueryTimeout(config.queryTimeoutSeconds());
    if (config.fetchSize() != null) statement.setFetchSize(config.fetchSize());
    if (config.maxRows() != null) statement.setMaxRows(config.maxRows());
  }

  private static QueryResult read(final Statement statement, final boolean hasResultSet)
      throws SQLException {
    if (!hasResultSet) return QueryResult.ofUpdateCount(statement.getUpdateCount());

    try (final var rs = statement.getResultSet()) {
      return materialize(rs);
    }
  }

  static QueryResult materialize(final ResultSet rs) throws SQLException {
    final var meta = rs.getMetaData();
    final var count = meta.getColumnCount();
    final var columns = new ArrayList<String>(count);
    for (var i = 1; i <= count; i++) columns.add(meta.getColumnLabel(i));

    final var rows = new ArrayList<Map<String, Object>>();
    while (rs.next()) {
      final var row = new LinkedHashMap<String, Object>(count);
      for (var i = 1; i <= count; i++) row.put(columns.get(i - 1), rs.getObject(i));
      rows.add(row);
    }
    return QueryResult.ofRows(columns, rows);
  }
}
