package com.example.failoverclient.core;

import java.sql.SQLException;

/**
 * Opens {@link DatabaseSession}s. Implementations wrap a concrete driver, for example {@link
 * com.example.failoverclient.core.jdbc.JdbcDriverAdapter}.
 */
@FunctionalInterface
public interface DriverAdapter {

  /**
   * Opens a new session.
   *
   * @param options connection options
   * @return a new live session
   * @throws SQLException if the endpoint is unreachable or authentication fails
   */
  DatabaseSession connect(final ConnectionOptions options) throws SQLException;

  /**
   * Describes the driver behind this adapter.
   *
   * @return driver name
   */
  default String name() {
    return getClass().getSimpleName();
  }
}
