package com.example.failoverclient.core;

import java.sql.SQLException;

/**
 * One live database connection as seen by {@link ResilientClient}.
 *
 * <p>Sessions are created by a {@link DriverAdapter}. {@link ResilientClient} implements this
 * interface too, so it can be used wherever a raw session is expected: it intercepts {@link
 * #execute(String, Object...)} and forwards every other operation to the session it currently
 * holds.
 */
public interface DatabaseSession extends AutoCloseable {

  /**
   * Executes a statement.
   *
   * @param sql the statement; {@code ?} placeholders are bound from {@code args}
   * @param args positional parameters
   * @return rows for queries, the update count otherwise
   * @throws SQLException on any server-side or network failure
   */
  QueryResult execute(String sql, Object... args) throws SQLException;

  /**
   * Lightweight liveness probe.
   *
   * @throws SQLException if the connection is not usable
   */
  void ping() throws SQLException;

  /**
   * Returns whether the session is closed. A session that cannot tell is reported closed.
   *
   * @return true if closed or broken
   */
  boolean isClosed();

  /**
   * Closes the session.
   *
   * @throws SQLException if closing fails
   */
  @Override
  void close() throws SQLException;

  /**
   * Returns the settings that must survive a reconnect.
   *
   * @return current session config
   * @throws SQLException if the session cannot be read
   */
  SessionConfig sessionConfig() throws SQLException;

  /**
   * Applies settings on top of the current ones. Fields that are not set are left unchanged.
   *
   * @param config settings to apply
   * @throws SQLException if a setting cannot be applied
   */
  void applySessionConfig(SessionConfig config) throws SQLException;

  void setAutoCommit(boolean autoCommit) throws SQLException;

  boolean getAutoCommit() throws SQLException;

  void commit() throws SQLException;

  void rollback() throws SQLException;

  /**
   * Returns the server product version.
   *
   * @return version string reported by the server
   * @throws SQLException if the connection cannot be queried
   */
  String serverVersion() throws SQLException;

  /**
   * Returns an object implementing the given interface, such as the underlying {@link
   * java.sql.Connection}.
   *
   * @param iface the interface to unwrap to
   * @param <T> the interface type
   * @return the unwrapped object
   * @throws SQLException if nothing in the chain implements {@code iface}
   */
  <T> T unwrap(Class<T> iface) throws SQLException;

  /**
   * Returns whether {@link #unwrap(Class)} would succeed.
   *
   * @param iface the interface to check
   * @return true if unwrapping is possible
   * @throws SQLException if the check fails
   */
  boolean isWrapperFor(Class<?> iface) throws SQLException;
}
