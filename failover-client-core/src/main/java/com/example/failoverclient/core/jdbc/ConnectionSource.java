package com.example.failoverclient.core.jdbc;

import com.example.failoverclient.core.ConnectionOptions;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import javax.sql.DataSource;

/**
 * Opens physical JDBC connections for {@link JdbcDriverAdapter}. Implementations must return a
 * new connection on every call.
 */
@FunctionalInterface
public interface ConnectionSource {

  /**
   * Opens a new connection.
   *
   * @param options url and driver properties
   * @return an open connection
   * @throws SQLException if the connection cannot be opened
   */
  Connection open(final ConnectionOptions options) throws SQLException;

  /**
   * Returns the source backed by {@link DriverManager#getConnection(String,
   * java.util.Properties)}.
   *
   * @return driver manager source
   */
  static ConnectionSource driverManager() {
    return options -> DriverManager.getConnection(options.url(), options.toProperties());
  }

  /**
   * Returns a source that ignores the options and opens connections from a non-pooling {@link
   * DataSource}, such as a driver's own {@code MysqlDataSource}.
   *
   * @param dataSource unpooled data source
   * @return data source backed source
   */
  static ConnectionSource of(final DataSource dataSource) {
    return options -> dataSource.getConnection();
  }
}
