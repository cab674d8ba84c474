package com.example.failoverclient.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.failoverclient.core.secrets.SecretHelper;
import java.lang.System.Logger;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Database session that survives failover of its endpoint.
 *
 * <p>The client owns exactly one {@link DatabaseSession} at a time. {@link #execute(String,
 * Object...)} classifies every failure with an {@link ErrorClassifier}:
 *
 * <ul>
 *   <li>{@link ErrorClass#FATAL} errors are rethrown immediately.
 *   <li>{@link ErrorClass#READ_ONLY_FAILOVER} and {@link ErrorClass#CONNECTION_LOST} errors start
 *       the reconnection protocol: back off, replace the session (carrying its {@link
 *       SessionConfig} over), then verify the new session with the read-only status query or a
 *       ping. This repeats until verification passes or the {@link RetryPolicy} budget is spent.
 * </ul>
 *
 * <p>In both transient cases the original error is rethrown once the protocol ends. The failed
 * statement is never re-executed; only the connection is repaired so that the next call can
 * succeed. A session found closed at the start of {@code execute} is replaced before the
 * statement runs.
 *
 * <p>All other {@link DatabaseSession} operations are forwarded to the current session.
 *
 * <p>Instances are not thread-safe. Backoff sleeps block the calling thread; use one client per
 * worker.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * try (var client = ResilientClient.builder()
 *     .adapter(new JdbcDriverAdapter())
 *     .connectionOptions(ConnectionOptions.of("jdbc:mysql://cluster:3306/app", "app", "secret"))
 *     .build()) {
 *   client.execute("INSERT INTO events(name) VALUES (?)", "started");
 * }
 * }</pre>
 *
 * <h2>Disconnect Instead of Reconnecting on Read-Only Errors</h2>
 *
 * <pre>{@code
 * var client = ResilientClient.builder()
 *     .adapter(new JdbcDriverAdapter())
 *     .secretId("prod/aurora/app")
 *     .disconnectOnReadOnly(true)
 *     .sleepBeforeDisconnect(Duration.ofSeconds(2))
 *     .build();
 * }</pre>
 *
 * <h2>From an Option Map</h2>
 *
 * <pre>{@code
 * var client = ResilientClient.builder()
 *     .adapter(new JdbcDriverAdapter())
 *     .options(Map.of(
 *         "url", "jdbc:mysql://cluster:3306/app",
 *         "user", "app",
 *         "password", "secret",
 *         "maxRetry", "3",
 *         "readOnlyVariable", "read_only"))
 *     .build();
 * }</pre>
 */
public final class ResilientClient implements DatabaseSession {

  private static final Logger logger = System.getLogger(ResilientClient.class.getName());

  private static final String STATUS_VALUE_COLUMN = "Value";
  private static final String WRITABLE = "OFF";

  private final DriverAdapter adapter;
  private final ConnectionOptions options;
  private final FailoverSettings settings;
  private final RetryPolicy retryPolicy;
  private final ErrorClassifier classifier;
  private final String statusQuery;
  private final FailoverListener listener;
  private final Sleeper sleeper;

  private DatabaseSession session;

  private ResilientClient(
      final Builder builder,
      final ConnectionOptions options,
      final FailoverSettings settings,
      final RetryPolicy retryPolicy)
      throws SQLException {
    this.adapter = builder.adapter;
    this.options = options;
    this.settings = settings;
    this.retryPolicy = retryPolicy;
    this.classifier = builder.classifier;
    this.statusQuery =
        Optional.ofNullable(builder.statusQuery).orElseGet(settings::statusQuery);
    this.listener = builder.listener;
    this.sleeper = builder.sleeper;

    session = adapter.connect(options);
  }

  /**
   * Creates a new builder instance. Defaults are read from system properties and environment
   * variables (see {@link FailoverSettings}).
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Executes a statement on the current session, repairing the connection on failover errors.
   *
   * @param sql the statement
   * @param args positional parameters
   * @return the result of the statement
   * @throws SQLException the original driver error (after reconnection for transient errors), or
   *     the connect error when a closed session could not be replaced before the statement
   */
  @Override
  public QueryResult execute(final String sql, final Object... args) throws SQLException {
    if (session.isClosed()) {
      logger.log(DEBUG, "Session is closed, reconnecting before executing statement");
      reconnect(captureSessionConfig(session));
    }

    try {
      return session.execute(sql, args);
    } catch (final SQLException e) {
      final var errorClass = classifier.classify(e);
      switch (errorClass) {
        case READ_ONLY_FAILOVER -> {
          if (settings.disconnectOnReadOnly()) disconnect(e);
          else recover(errorClass, e);
        }
        case CONNECTION_LOST -> recover(errorClass, e);
        case FATAL -> {}
      }
      throw e;
    }
  }

  @Override
  public void ping() throws SQLException {
    session.ping();
  }

  @Override
  public boolean isClosed() {
    return session.isClosed();
  }

  /** Closes the current session. Failures are logged, never thrown. */
  @Override
  public void close() {
    closeQuietly(session);
  }

  @Override
  public SessionConfig sessionConfig() throws SQLException {
    return session.sessionConfig();
  }

  @Override
  public void applySessionConfig(final SessionConfig config) throws SQLException {
    session.applySessionConfig(config);
  }

  @Override
  public void setAutoCommit(final boolean autoCommit) throws SQLException {
    session.setAutoCommit(autoCommit);
  }

  @Override
  public boolean getAutoCommit() throws SQLException {
    return session.getAutoCommit();
  }

  @Override
  public void commit() throws SQLException {
    session.commit();
  }

  @Override
  public void rollback() throws SQLException {
    session.rollback();
  }

  @Override
  public String serverVersion() throws SQLException {
    return session.serverVersion();
  }

  @Override
  public <T> T unwrap(final Class<T> iface) throws SQLException {
    if (iface.isInstance(this)) return iface.cast(this);
    return session.unwrap(iface);
  }

  @Override
  public boolean isWrapperFor(final Class<?> iface) throws SQLException {
    return iface.isInstance(this) || session.isWrapperFor(iface);
  }

  /**
   * Returns the adapter used to open sessions, for driver-level operations.
   *
   * @return the driver adapter
   */
  public DriverAdapter adapter() {
    return adapter;
  }

  public FailoverSettings settings() {
    return settings;
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  public String statusQuery() {
    return statusQuery;
  }

  DatabaseSession session() {
    return session;
  }

  /**
   * Runs the reconnection protocol for a transient error.
   *
   * @return true if a verified session is in place, false if the budget ran out or the thread was
   *     interrupted
   */
  private boolean recover(final ErrorClass trigger, final SQLException original) {
    final var config = captureSessionConfig(session);
    var attempt = 0;
    while (true) {
      attempt++;
      if (!retryPolicy.allows(attempt)) {
        final var made = attempt - 1;
        logger.log(
            WARNING,
            "{0}: giving up after {1} reconnect attempt(s), max {2}",
            describe(trigger),
            made,
            retryPolicy.maxRetry());
        notifyListener(l -> l.exhausted(trigger, made, original));
        return false;
      }

      final var current = attempt;
      final var delay = retryPolicy.backoff(attempt);
      logger.log(
          WARNING,
          "{0}: reconnect attempt {1}/{2} after {3} seconds",
          describe(trigger),
          attempt,
          retryPolicy.maxRetry(),
          seconds(delay));
      notifyListener(l -> l.beforeBackoff(trigger, current, delay));

      try {
        sleeper.sleep(delay);
      } catch (final InterruptedException ie) {
        Thread.currentThread().interrupt();
        logger.log(
            WARNING,
            "{0}: interrupted before reconnect attempt {1} ({2} seconds backoff)",
            describe(trigger),
            attempt,
            seconds(delay));
        notifyListener(l -> l.exhausted(trigger, current - 1, original));
        return false;
      }

      try {
        reconnect(config);
        verify(trigger);
        logger.log(
            WARNING,
            "{0}: reconnected on attempt {1} after {2} seconds backoff",
            describe(trigger),
            attempt,
            seconds(delay));
        notifyListener(l -> l.recovered(trigger, current));
        return true;
      } catch (final StillReadOnlyException e) {
        logger.log(
            WARNING,
            "{0}: reconnect attempt {1} ({2} seconds backoff) reached a read-only server: {3}",
            describe(trigger),
            attempt,
            seconds(delay),
            e.getMessage());
        notifyListener(l -> l.attemptFailed(trigger, current, e));
      } catch (final SQLException e) {
        logger.log(
            WARNING,
            "{0}: reconnect attempt {1} ({2} seconds backoff) failed: {3}",
            describe(trigger),
            attempt,
            seconds(delay),
            e.getMessage());
        notifyListener(l -> l.attemptFailed(trigger, current, e));
      }
    }
  }

  /**
   * Replaces the current session and applies {@code config} to the new one. Callers read the
   * config once per protocol run, before the first close.
   */
  private void reconnect(final SessionConfig config) throws SQLException {
    closeQuietly(session);

    final var incoming = adapter.connect(options);
    session = incoming;
    if (!config.isEmpty()) incoming.applySessionConfig(config);
  }

  private void verify(final ErrorClass trigger) throws SQLException {
    if (trigger == ErrorClass.CONNECTION_LOST) {
      session.ping();
      return;
    }

    final var value = statusValue(session.execute(statusQuery));
    if (value == null || !WRITABLE.equalsIgnoreCase(value.trim()))
      throw new StillReadOnlyException(settings.readOnlyVariable(), value);
  }

  private void disconnect(final SQLException original) {
    final var delay = settings.sleepBeforeDisconnect();
    logger.log(
        WARNING,
        "{0}: closing connection after {1} seconds instead of reconnecting (attempt 0)",
        describe(ErrorClass.READ_ONLY_FAILOVER),
        seconds(delay));
    try {
      sleeper.sleep(delay);
    } catch (final InterruptedException ie) {
      Thread.currentThread().interrupt();
      logger.log(DEBUG, "Interrupted while waiting to close read-only connection");
    }
    closeQuietly(session);
    notifyListener(l -> l.disconnected(original));
  }

  /**
   * Extracts the status variable value from a {@code SHOW VARIABLES}-style result: the {@code
   * Value} column of the first row, or the row's last column when there is no such column.
   */
  static String statusValue(final QueryResult result) {
    if (result.first().isEmpty()) return null;
    final var byName = result.value(0, STATUS_VALUE_COLUMN);
    if (byName.isPresent()) return String.valueOf(byName.get());
    if (result.columns().isEmpty()) return null;
    return result
        .value(0, result.columns().get(result.columns().size() - 1))
        .map(String::valueOf)
        .orElse(null);
  }

  private static SessionConfig captureSessionConfig(final DatabaseSession outgoing) {
    try {
      return Optional.ofNullable(outgoing.sessionConfig()).orElse(SessionConfig.empty());
    } catch (final SQLException | RuntimeException e) {
      logger.log(DEBUG, "Could not read session config from outgoing session, using empty", e);
      return SessionConfig.empty();
    }
  }

  private static void closeQuietly(final DatabaseSession s) {
    try {
      s.close();
    } catch (final Exception e) {
      logger.log(DEBUG, "Failed to close session", e);
    }
  }

  private void notifyListener(final Consumer<FailoverListener> event) {
    try {
      event.accept(listener);
    } catch (final RuntimeException e) {
      logger.log(WARNING, "Failover listener failed", e);
    }
  }

  private static String describe(final ErrorClass errorClass) {
    return errorClass == ErrorClass.READ_ONLY_FAILOVER
        ? "Database is read-only"
        : "Connection lost";
  }

  private static double seconds(final Duration delay) {
    return delay.toMillis() / 1000.0;
  }

  /**
   * Builder for {@link ResilientClient}.
   *
   * <h3>Example: Minimal Configuration</h3>
   *
   * <pre>{@code
   * var client = ResilientClient.builder()
   *     .adapter(new JdbcDriverAdapter())
   *     .connectionOptions(ConnectionOptions.of(url, user, password))
   *     .build();
   * }</pre>
   *
   * <h3>Example: PostgreSQL Read-Only Check</h3>
   *
   * <pre>{@code
   * var client = ResilientClient.builder()
   *     .adapter(new JdbcDriverAdapter())
   *     .connectionOptions(ConnectionOptions.of(url, user, password))
   *     .statusQuery("SHOW transaction_read_only")
   *     .maxRetry(8)
   *     .build();
   * }</pre>
   */
  public static class Builder {
    private DriverAdapter adapter;
    private ConnectionOptions connectionOptions;
    private String secretId;
    private int maxRetry;
    private RetryPolicy retryPolicy;
    private boolean disconnectOnReadOnly;
    private Duration sleepBeforeDisconnect;
    private String readOnlyVariable;
    private String statusQuery;
    private ErrorClassifier classifier = ErrorClassifier.defaultClassifier();
    private FailoverListener listener = FailoverListener.NO_OP;
    private Sleeper sleeper = Sleeper.THREAD_SLEEP;

    private Builder() {
      apply(FailoverSettings.defaults());
    }

    /**
     * Sets the driver adapter (required).
     *
     * @param adapter adapter used for the initial connect and every reconnect
     * @return this builder
     */
    public Builder adapter(final DriverAdapter adapter) {
      this.adapter = adapter;
      return this;
    }

    /**
     * Sets the connection options. Exactly one of this and {@link #secretId(String)} is required.
     *
     * @param connectionOptions raw driver options
     * @return this builder
     */
    public Builder connectionOptions(final ConnectionOptions connectionOptions) {
      this.connectionOptions = connectionOptions;
      return this;
    }

    /**
     * Reads connection options from an RDS-format secret in AWS Secrets Manager when {@link
     * #build()} runs.
     *
     * @param secretId the secret identifier
     * @return this builder
     */
    public Builder secretId(final String secretId) {
      this.secretId = secretId;
      return this;
    }

    /**
     * Applies a flat option map: recognized resilience keys (see {@link FailoverSettings}) set the
     * corresponding builder values, values set earlier for absent keys are kept; when a {@code url}
     * key is present, it and the remaining keys become the connection options.
     *
     * @param options option map
     * @return this builder
     * @throws IllegalArgumentException if a recognized value is malformed
     */
    public Builder options(final Map<String, String> options) {
      final var resolved = FailoverSettings.resolve(options);
      if (FailoverSettings.isSet(options, FailoverSettings.MAX_RETRY))
        maxRetry(resolved.maxRetry());
      if (FailoverSettings.isSet(options, FailoverSettings.DISCONNECT_ON_READ_ONLY))
        disconnectOnReadOnly = resolved.disconnectOnReadOnly();
      if (FailoverSettings.isSet(options, FailoverSettings.SLEEP_BEFORE_DISCONNECT))
        sleepBeforeDisconnect = resolved.sleepBeforeDisconnect();
      if (FailoverSettings.isSet(options, FailoverSettings.READ_ONLY_VARIABLE))
        readOnlyVariable = resolved.readOnlyVariable();
      Optional.ofNullable(options.get(FailoverSettings.URL))
          .filter(url -> !url.isBlank())
          .map(url -> new ConnectionOptions(url, FailoverSettings.driverProperties(options)))
          .ifPresent(this::connectionOptions);
      return this;
    }

    /**
     * Sets the maximum number of reconnect attempts.
     *
     * <p>Default: 5
     *
     * @param maxRetry attempts, 0 disables reconnection
     * @return this builder
     */
    public Builder maxRetry(final int maxRetry) {
      this.maxRetry = maxRetry;
      this.retryPolicy = null;
      return this;
    }

    /**
     * Sets the full retry policy, replacing {@link #maxRetry(int)}.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(final RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Closes the session on read-only errors instead of running the reconnection protocol. The
     * client first waits {@link #sleepBeforeDisconnect(Duration)}, then closes the session and
     * rethrows the error. The next {@code execute} reconnects.
     *
     * <p>Default: false
     *
     * @param disconnectOnReadOnly whether to disconnect
     * @return this builder
     */
    public Builder disconnectOnReadOnly(final boolean disconnectOnReadOnly) {
      this.disconnectOnReadOnly = disconnectOnReadOnly;
      return this;
    }

    /**
     * Sets the delay before closing the session in disconnect-on-read-only mode. The session stays
     * open during the delay.
     *
     * <p>Default: zero
     *
     * @param sleepBeforeDisconnect delay
     * @return this builder
     */
    public Builder sleepBeforeDisconnect(final Duration sleepBeforeDisconnect) {
      this.sleepBeforeDisconnect = sleepBeforeDisconnect;
      return this;
    }

    /**
     * Sets the server variable checked after reconnecting on a read-only error.
     *
     * <p>Default: {@code innodb_read_only}. Aurora MySQL readers report it; self-managed MySQL
     * replicas usually need {@code read_only}.
     *
     * @param readOnlyVariable variable name, letters, digits and underscores only
     * @return this builder
     */
    public Builder readOnlyVariable(final String readOnlyVariable) {
      this.readOnlyVariable = readOnlyVariable;
      return this;
    }

    /**
     * Replaces the read-only status query. Its first row must carry the status in a {@code Value}
     * column or in its last column; {@code OFF} (any case) means writable.
     *
     * @param statusQuery the status query
     * @return this builder
     */
    public Builder statusQuery(final String statusQuery) {
      this.statusQuery = statusQuery;
      return this;
    }

    /**
     * Sets the error classifier.
     *
     * <p>Default: {@link ErrorClassifier#defaultClassifier()}
     *
     * @param classifier the classifier
     * @return this builder
     */
    public Builder classifier(final ErrorClassifier classifier) {
      this.classifier = classifier;
      return this;
    }

    /**
     * Sets the listener notified of reconnection events.
     *
     * @param listener the listener
     * @return this builder
     */
    public Builder listener(final FailoverListener listener) {
      this.listener = listener;
      return this;
    }

    Builder sleeper(final Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * Validates the configuration and opens the initial session. No retry happens here.
     *
     * @return connected client
     * @throws IllegalStateException if a required value is missing
     * @throws IllegalArgumentException if a value is out of range
     * @throws SQLException if the initial connect fails
     */
    public ResilientClient build() throws SQLException {
      if (adapter == null) throw new IllegalStateException("adapter is required");
      if (connectionOptions == null && (secretId == null || secretId.isBlank()))
        throw new IllegalStateException("connectionOptions or secretId is required");
      if (connectionOptions != null && secretId != null)
        throw new IllegalStateException("connectionOptions and secretId are mutually exclusive");
      if (classifier == null) throw new IllegalStateException("classifier cannot be null");
      if (listener == null) throw new IllegalStateException("listener cannot be null");
      if (statusQuery != null && statusQuery.isBlank())
        throw new IllegalArgumentException("statusQuery must not be blank");

      final var policy =
          Optional.ofNullable(retryPolicy).orElseGet(() -> RetryPolicy.of(maxRetry));
      final var settings =
          new FailoverSettings(
              policy.maxRetry(), disconnectOnReadOnly, sleepBeforeDisconnect, readOnlyVariable);
      final var options =
          Optional.ofNullable(connectionOptions)
              .orElseGet(() -> ConnectionOptions.fromSecret(SecretHelper.getDbSecret(secretId)));
      return new ResilientClient(this, options, settings, policy);
    }

    private void apply(final FailoverSettings settings) {
      this.maxRetry = settings.maxRetry();
      this.retryPolicy = null;
      this.disconnectOnReadOnly = settings.disconnectOnReadOnly();
      this.sleepBeforeDisconnect = settings.sleepBeforeDisconnect();
      this.readOnlyVariable = settings.readOnlyVariable();
    }
  }
}
