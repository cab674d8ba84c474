package com.example.failoverclient.core;

import java.sql.SQLException;

/**
 * Raised during reconnect verification when the new connection still reports a read-only server.
 * Never reaches callers of {@link ResilientClient}.
 */
final class StillReadOnlyException extends SQLException {

  private static final long serialVersionUID = 1L;

  StillReadOnlyException(final String variable, final String reportedValue) {
    super("Server still read-only: %s=%s".formatted(variable, reportedValue));
  }
}
