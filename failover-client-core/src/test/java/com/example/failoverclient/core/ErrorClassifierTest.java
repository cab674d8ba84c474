package com.example.failoverclient.core;

import static org.junit.jupiter.api.Assertions.*;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class ErrorClassifierTest {

  private final ErrorClassifier classifier = ErrorClassifier.defaultClassifier();

  @Nested
  @DisplayName("Message Classification")
  class MessageClassification {

    @Test
    @DisplayName("Should classify MySQL read-only option error")
    void shouldClassifyReadOnlyOption() {
      assertEquals(
          ErrorClass.READ_ONLY_FAILOVER,
          classifier.classify(
              "The MySQL server is running with the --read-only option so it cannot execute this"
                  + " statement"));
    }

    @Test
    @DisplayName("Should classify read only transaction error")
    void shouldClassifyReadOnlyTransaction() {
      assertEquals(
          ErrorClass.READ_ONLY_FAILOVER,
          classifier.classify("cannot execute INSERT in a READ ONLY transaction"));
    }

    @Test
    @DisplayName("Should classify connection-lost messages")
    void shouldClassifyConnectionLost() {
      assertEquals(
          ErrorClass.CONNECTION_LOST,
          classifier.classify("Lost connection to MySQL server during query"));
      assertEquals(
          ErrorClass.CONNECTION_LOST,
          classifier.classify("Can't connect to MySQL server on 'db' (111)"));
      assertEquals(
          ErrorClass.CONNECTION_LOST, classifier.classify("MySQL client is not connected"));
      assertEquals(ErrorClass.CONNECTION_LOST, classifier.classify("Server shutdown in progress"));
      assertEquals(
          ErrorClass.CONNECTION_LOST,
          classifier.classify("Communications link failure\n\nThe last packet sent ..."));
    }

    @Test
    @DisplayName("Should prefer read-only when both marker kinds match")
    void shouldPreferReadOnly() {
      assertEquals(
          ErrorClass.READ_ONLY_FAILOVER,
          classifier.classify("Lost connection: server switched to --read-only"));
    }

    @Test
    @DisplayName("Should classify unmatched, null and blank messages as fatal")
    void shouldClassifyOthersAsFatal() {
      assertEquals(ErrorClass.FATAL, classifier.classify("Duplicate entry '1' for key 'PRIMARY'"));
      assertEquals(ErrorClass.FATAL, classifier.classify("You have an error in your SQL syntax"));
      assertEquals(ErrorClass.FATAL, classifier.classify((String) null));
      assertEquals(ErrorClass.FATAL, classifier.classify("   "));
    }
  }

  @Nested
  @DisplayName("Exception Classification")
  class ExceptionClassification {

    @Test
    @DisplayName("Should classify by message in cause chain")
    void shouldClassifyCauseChain() {
      final var e =
          new SQLException("statement failed", new RuntimeException("Connection reset by peer"));

      assertEquals(ErrorClass.CONNECTION_LOST, classifier.classify(e));
    }

    @Test
    @DisplayName("Should let read-only anywhere in the chain win")
    void shouldPreferReadOnlyInChain() {
      final var e = new SQLException("Communications link failure");
      e.setNextException(new SQLException("database is read-only"));

      assertEquals(ErrorClass.READ_ONLY_FAILOVER, classifier.classify(e));
    }

    @Test
    @DisplayName("Should fall back to SQLState when messages are fatal")
    void shouldFallBackToSqlState() {
      assertEquals(
          ErrorClass.READ_ONLY_FAILOVER, classifier.classify(new SQLException("nope", "25006")));
      assertEquals(
          ErrorClass.CONNECTION_LOST,
          classifier.classify(new SQLTransientConnectionException("nope", "08S01")));
      assertEquals(ErrorClass.FATAL, classifier.classify(new SQLException("nope", "23000")));
    }

    @Test
    @DisplayName("Should classify null exception as fatal")
    void shouldClassifyNullAsFatal() {
      assertEquals(ErrorClass.FATAL, classifier.classify((SQLException) null));
    }
  }

  @Nested
  @DisplayName("Builder")
  class BuilderTests {

    @Test
    @DisplayName("Should replace read-only markers")
    void shouldReplaceReadOnlyMarkers() {
      final var custom = ErrorClassifier.builder().readOnlyMarkers("standby mode").build();

      assertEquals(
          ErrorClass.READ_ONLY_FAILOVER,
          custom.classify("cannot execute in STANDBY MODE right now"));
      assertEquals(ErrorClass.FATAL, custom.classify("server is read-only"));
    }

    @Test
    @DisplayName("Should add connection-lost marker and keep defaults")
    void shouldAddConnectionLostMarker() {
      final var custom =
          ErrorClassifier.builder().addConnectionLostMarker("Server Has Gone Away").build();

      assertEquals(ErrorClass.CONNECTION_LOST, custom.classify("MySQL server has gone away"));
      assertEquals(ErrorClass.CONNECTION_LOST, custom.classify("broken pipe"));
      assertTrue(custom.connectionLostMarkers().contains("server has gone away"));
    }

    @Test
    @DisplayName("Should reject blank markers")
    void shouldRejectBlankMarkers() {
      assertThrows(
          IllegalArgumentException.class,
          () -> ErrorClassifier.builder().addReadOnlyMarker(" ").build());
      assertThrows(
          IllegalArgumentException.class,
          () -> ErrorClassifier.builder().connectionLostMarkers("ok", "").build());
    }
  }
}
