package com.example.failoverclient.core.jdbc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import com.example.failoverclient.core.SessionConfig;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.Statement;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class JdbcSessionTest {

  private Connection connection;
  private JdbcSession session;

  @BeforeEach
  void setUp() {
    connection = mock(Connection.class);
    session = new JdbcSession(connection, 3);
  }

  @Nested
  @DisplayName("Execute")
  class Execute {

    @Test
    @DisplayName("Should materialize rows of a plain statement")
    void shouldMaterializeRows() throws SQLException {
      final var statement = mock(Statement.class);
      final var rs = mock(ResultSet.class);
      final var meta = mock(ResultSetMetaData.class);
      when(rs.getMetaData()).thenReturn(meta);
      when(meta.getColumnCount()).thenReturn(1);
      when(meta.getColumnLabel(1)).thenReturn("name");
      when(rs.next()).thenReturn(true, true, false);
      when(rs.getObject(1)).thenReturn("a", "b");
      when(connection.createStatement()).thenReturn(statement);
      when(statement.execute("SELECT name FROM t")).thenReturn(true);
      when(statement.getResultSet()).thenReturn(rs);

      final var result = session.execute("SELECT name FROM t");

      assertEquals(List.of("name"), result.columns());
      assertEquals(2, result.rows().size());
      assertEquals(Optional.of("b"), result.value(1, "NAME"));
      verify(statement).close();
      verify(rs).close();
    }

    @Test
    @DisplayName("Should bind parameters and return update count")
    void shouldBindParameters() throws SQLException {
      final var statement = mock(PreparedStatement.class);
      when(connection.prepareStatement("UPDATE t SET a = ? WHERE id = ?")).thenReturn(statement);
      when(statement.execute()).thenReturn(false);
      when(statement.getUpdateCount()).thenReturn(2);

      final var result = session.execute("UPDATE t SET a = ? WHERE id = ?", "x", 7);

      assertEquals(2, result.updateCount());
      assertFalse(result.hasRows());
      verify(statement).setObject(1, "x");
      verify(statement).setObject(2, 7);
      verify(statement).close();
    }

    @Test
    @DisplayName("Should apply statement limits from session config")
    void shouldApplyStatementLimits() throws SQLException {
      final var statement = mock(Statement.class);
      when(connection.createStatement()).thenReturn(statement);
      when(statement.execute(anyString())).thenReturn(false);
      session.applySessionConfig(
          SessionConfig.empty().withQueryTimeoutSeconds(30).withFetchSize(100).withMaxRows(10));

      session.execute("DELETE FROM t");

      verify(statement).setQueryTimeout(30);
      verify(statement).setFetchSize(100);
      verify(statement).setMaxRows(10);
    }

    @Test
    @DisplayName("Should propagate driver errors")
    void shouldPropagateErrors() throws SQLException {
      final var statement = mock(Statement.class);
      final var error = new SQLException("Lost connection");
      when(connection.createStatement()).thenReturn(statement);
      when(statement.execute(anyString())).thenThrow(error);

      assertSame(error, assertThrows(SQLException.class, () -> session.execute("SELECT 1")));
      verify(statement).close();
    }
  }

  @Nested
  @DisplayName("Session State")
  class SessionState {

    @Test
    @DisplayName("Should push config to the connection and remember it")
    void shouldApplySessionConfig() throws SQLException {
      session.applySessionConfig(
          SessionConfig.empty()
              .withAutoCommit(false)
              .withTransactionIsolation(Connection.TRANSACTION_SERIALIZABLE)
              .withCatalog("app"));
      session.setAutoCommit(true);

      verify(connection).setAutoCommit(false);
      verify(connection).setAutoCommit(true);
      verify(connection).setTransactionIsolation(Connection.TRANSACTION_SERIALIZABLE);
      verify(connection).setCatalog("app");
      verify(connection, never()).setSchema(anyString());

      final var config = session.sessionConfig();
      assertEquals(true, config.autoCommit());
      assertEquals("app", config.catalog());
    }

    @Test
    @DisplayName("Should fail ping when connection is not valid")
    void shouldFailPing() throws SQLException {
      when(connection.isValid(3)).thenReturn(false);

      final var error = assertThrows(SQLNonTransientConnectionException.class, session::ping);
      assertEquals("08003", error.getSQLState());
    }

    @Test
    @DisplayName("Should pass ping when connection is valid")
    void shouldPassPing() throws SQLException {
      when(connection.isValid(anyInt())).thenReturn(true);

      assertDoesNotThrow(session::ping);
    }

    @Test
    @DisplayName("Should treat failing isClosed check as closed")
    void shouldTreatFailingIsClosedAsClosed() throws SQLException {
      when(connection.isClosed()).thenThrow(new SQLException("broken"));

      assertTrue(session.isClosed());
    }

    @Test
    @DisplayName("Should report server version and unwrap the connection")
    void shouldReportVersionAndUnwrap() throws SQLException {
      final var meta = mock(DatabaseMetaData.class);
      when(connection.getMetaData()).thenReturn(meta);
      when(meta.getDatabaseProductVersion()).thenReturn("8.0.mysql_aurora.3.05.2");

      assertEquals("8.0.mysql_aurora.3.05.2", session.serverVersion());
      assertSame(connection, session.unwrap(Connection.class));
      assertSame(session, session.unwrap(JdbcSession.class));
      assertTrue(session.isWrapperFor(Connection.class));
    }

    @Test
    @DisplayName("Should forward transaction control")
    void shouldForwardTransactionControl() throws SQLException {
      session.commit();
      session.rollback();
      session.close();

      verify(connection).commit();
      verify(connection).rollback();
      verify(connection).close();
    }
  }
}
