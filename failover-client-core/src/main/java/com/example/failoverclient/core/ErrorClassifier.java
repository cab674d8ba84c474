package com.example.failoverclient.core;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Classifies driver errors by their message text.
 *
 * <p>Drivers surface failover conditions only as text, so classification is a case-insensitive
 * substring match against two ordered marker lists. Read-only markers are checked first: a message
 * that matches both a read-only marker and a connection-lost marker is {@link
 * ErrorClass#READ_ONLY_FAILOVER}. Anything unmatched, including a null message, is {@link
 * ErrorClass#FATAL}.
 *
 * <pre>{@code
 * final var classifier = ErrorClassifier.builder()
 *     .readOnlyMarkers("--read-only")
 *     .addConnectionLostMarker("server has gone away")
 *     .build();
 * }</pre>
 */
public final class ErrorClassifier {

  static final List<String> DEFAULT_READ_ONLY_MARKERS =
      List.of("read-only", "read only");

  static final List<String> DEFAULT_CONNECTION_LOST_MARKERS =
      List.of(
          "not connected",
          "lost connection",
          "can't connect",
          "shutdown in progress",
          "communications link failure",
          "connection is closed",
          "no operations allowed after connection closed",
          "connection reset",
          "broken pipe");

  private static final String READ_ONLY_SQL_STATE = "25006";
  private static final String CONNECTION_SQL_STATE_CLASS = "08";

  private static final ErrorClassifier DEFAULT = builder().build();

  private final List<String> readOnlyMarkers;
  private final List<String> connectionLostMarkers;

  private ErrorClassifier(final Builder builder) {
    this.readOnlyMarkers = lowerCase(builder.readOnlyMarkers);
    this.connectionLostMarkers = lowerCase(builder.connectionLostMarkers);
  }

  /**
   * Returns the classifier with the built-in marker lists.
   *
   * @return default classifier
   */
  public static ErrorClassifier defaultClassifier() {
    return DEFAULT;
  }

  /**
   * Creates a builder preloaded with the default marker lists.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Classifies an error message.
   *
   * @param message the driver error message, may be null
   * @return the error class, never null
   */
  public ErrorClass classify(final String message) {
    if (message == null || message.isBlank()) return ErrorClass.FATAL;

    final var lower = message.toLowerCase(Locale.ROOT);
    if (containsAny(lower, readOnlyMarkers)) return ErrorClass.READ_ONLY_FAILOVER;
    if (containsAny(lower, connectionLostMarkers)) return ErrorClass.CONNECTION_LOST;
    return ErrorClass.FATAL;
  }

  /**
   * Classifies a driver exception.
   *
   * <p>Every message in the cause and {@link SQLException#getNextException() next-exception}
   * chain is classified, with the same read-only-first tie-break as {@link #classify(String)}.
   * When all messages are fatal, SQLState {@code 25006} maps to read-only failover and SQLState
   * class {@code 08} to connection lost.
   *
   * @param e the exception to classify, may be null
   * @return the error class, never null
   */
  public ErrorClass classify(final SQLException e) {
    if (e == null) return ErrorClass.FATAL;

    final var byMessage = classifyChain(e);
    if (byMessage.isTransient()) return byMessage;

    final var state = e.getSQLState();
    if (READ_ONLY_SQL_STATE.equals(state)) return ErrorClass.READ_ONLY_FAILOVER;
    if (state != null && state.startsWith(CONNECTION_SQL_STATE_CLASS))
      return ErrorClass.CONNECTION_LOST;
    return ErrorClass.FATAL;
  }

  List<String> readOnlyMarkers() {
    return readOnlyMarkers;
  }

  List<String> connectionLostMarkers() {
    return connectionLostMarkers;
  }

  private ErrorClass classifyChain(final Throwable root) {
    var connectionLost = false;
    Throwable cur = root;
    while (cur != null) {
      final var messages = new ArrayList<String>();
      messages.add(cur.getMessage());
      if (cur instanceof SQLException sql) {
        for (var next = sql.getNextException(); next != null; next = next.getNextException())
          messages.add(next.getMessage());
      }
      for (final var message : messages) {
        final var errorClass = classify(message);
        if (errorClass == ErrorClass.READ_ONLY_FAILOVER) return errorClass;
        if (errorClass == ErrorClass.CONNECTION_LOST) connectionLost = true;
      }
      cur = cur.getCause() == cur ? null : cur.getCause();
    }
    return connectionLost ? ErrorClass.CONNECTION_LOST : ErrorClass.FATAL;
  }

  private static boolean containsAny(final String lower, final List<String> markers) {
    for (final var marker : markers) if (lower.contains(marker)) return true;
    return false;
  }

  private static List<String> lowerCase(final List<String> markers) {
    final var result = new ArrayList<String>(markers.size());
    for (final var marker : markers) result.add(marker.toLowerCase(Locale.ROOT));
    return Collections.unmodifiableList(result);
  }

  /** Builder for {@link ErrorClassifier}. Starts from the default marker lists. */
  public static final class Builder {
    private final List<String> readOnlyMarkers = new ArrayList<>(DEFAULT_READ_ONLY_MARKERS);
    private final List<String> connectionLostMarkers =
        new ArrayList<>(DEFAULT_CONNECTION_LOST_MARKERS);

    private Builder() {}

    /**
     * Replaces the read-only markers.
     *
     * @param markers substrings identifying a read-only failover error
     * @return this builder
     */
    public Builder readOnlyMarkers(final String... markers) {
      readOnlyMarkers.clear();
      readOnlyMarkers.addAll(List.of(markers));
      return this;
    }

    /**
     * Adds one read-only marker.
     *
     * @param marker substring identifying a read-only failover error
     * @return this builder
     */
    public Builder addReadOnlyMarker(final String marker) {
      readOnlyMarkers.add(marker);
      return this;
    }

    /**
     * Replaces the connection-lost markers.
     *
     * @param markers substrings identifying a lost connection
     * @return this builder
     */
    public Builder connectionLostMarkers(final String... markers) {
      connectionLostMarkers.clear();
      connectionLostMarkers.addAll(List.of(markers));
      return this;
    }

    /**
     * Adds one connection-lost marker.
     *
     * @param marker substring identifying a lost connection
     * @return this builder
     */
    public Builder addConnectionLostMarker(final String marker) {
      connectionLostMarkers.add(marker);
      return this;
    }

    /**
     * Builds the classifier.
     *
     * @return configured classifier
     * @throws IllegalArgumentException if a marker is null or blank
     */
    public ErrorClassifier build() {
      for (final var marker : readOnlyMarkers)
        if (marker == null || marker.isBlank())
          throw new IllegalArgumentException("read-only markers must not be blank");
      for (final var marker : connectionLostMarkers)
        if (marker == null || marker.isBlank())
          throw new IllegalArgumentException("connection-lost markers must not be blank");
      return new ErrorClassifier(this);
    }
  }
}
